/*
 * Copyright 2015-2022 Transmogrify LLC, 2022-2025 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.tessera;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * One cell of a {@link TransportEvents#ROW} payload.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class ColumnValue {
	@NonNull
	private final ColumnMetadata metadata;
	@Nullable
	private final Object value;

	public ColumnValue(@NonNull ColumnMetadata metadata,
										 @Nullable Object value) {
		requireNonNull(metadata);

		this.metadata = metadata;
		this.value = value;
	}

	@NonNull
	public ColumnMetadata getMetadata() {
		return this.metadata;
	}

	@NonNull
	public Optional<Object> getValue() {
		return Optional.ofNullable(this.value);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{column=%s, value=%s}", getClass().getSimpleName(), getMetadata().getName(), this.value);
	}
}
