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
 * A named, typed value bound to a {@link Query}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class Parameter {
	@NonNull
	private final String name;
	@NonNull
	private final ParameterDirection direction;
	@NonNull
	private final SqlType type;
	@Nullable
	private final Object value;
	@NonNull
	private final ParameterOptions options;

	Parameter(@NonNull String name,
						@NonNull ParameterDirection direction,
						@NonNull SqlType type,
						@Nullable Object value,
						@NonNull ParameterOptions options) {
		requireNonNull(name);
		requireNonNull(direction);
		requireNonNull(type);
		requireNonNull(options);

		this.name = name;
		this.direction = direction;
		this.type = type;
		this.value = value;
		this.options = options;
	}

	/**
	 * @return the parameter name, without any leading {@code @}
	 */
	@NonNull
	public String getName() {
		return this.name;
	}

	@NonNull
	public ParameterDirection getDirection() {
		return this.direction;
	}

	@NonNull
	public SqlType getType() {
		return this.type;
	}

	@NonNull
	public Optional<Object> getValue() {
		return Optional.ofNullable(this.value);
	}

	@NonNull
	public ParameterOptions getOptions() {
		return this.options;
	}

	@NonNull
	public Boolean isOutput() {
		return getDirection() == ParameterDirection.OUT;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{name=%s, direction=%s, type=%s, value=%s}", getClass().getSimpleName(),
				getName(), getDirection().name(), getType().getTypeName(), this.value);
	}
}
