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
 * Payload of the statement, in-procedure and procedure completion events.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class DoneToken {
	@Nullable
	private final Long rowCount;
	@NonNull
	private final Boolean more;
	@Nullable
	private final Object returnValue;

	public DoneToken(@Nullable Long rowCount,
									 @NonNull Boolean more) {
		this(rowCount, more, null);
	}

	public DoneToken(@Nullable Long rowCount,
									 @NonNull Boolean more,
									 @Nullable Object returnValue) {
		requireNonNull(more);

		this.rowCount = rowCount;
		this.more = more;
		this.returnValue = returnValue;
	}

	/**
	 * @return the number of rows the statement affected, or empty if the server did not report one
	 */
	@NonNull
	public Optional<Long> getRowCount() {
		return Optional.ofNullable(this.rowCount);
	}

	/**
	 * @return whether more results follow in the same request
	 */
	@NonNull
	public Boolean getMore() {
		return this.more;
	}

	/**
	 * @return the procedure return value, only ever present on {@link TransportEvents#DONE_PROC}
	 */
	@NonNull
	public Optional<Object> getReturnValue() {
		return Optional.ofNullable(this.returnValue);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{rowCount=%s, more=%s, returnValue=%s}", getClass().getSimpleName(),
				this.rowCount, getMore(), this.returnValue);
	}
}
