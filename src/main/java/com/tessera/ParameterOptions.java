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

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;

/**
 * Length, precision and scale hints for a {@link Parameter} or bulk load column, passed through to the transport.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class ParameterOptions {
	@NonNull
	private static final ParameterOptions NONE;

	static {
		NONE = new Builder().build();
	}

	@Nullable
	private final Integer length;
	@Nullable
	private final Integer precision;
	@Nullable
	private final Integer scale;
	@Nullable
	private final Boolean nullable;

	@NonNull
	public static ParameterOptions none() {
		return NONE;
	}

	@NonNull
	public static Builder builder() {
		return new Builder();
	}

	private ParameterOptions(@NonNull Builder builder) {
		this.length = builder.length;
		this.precision = builder.precision;
		this.scale = builder.scale;
		this.nullable = builder.nullable;
	}

	@NonNull
	public Optional<Integer> getLength() {
		return Optional.ofNullable(this.length);
	}

	@NonNull
	public Optional<Integer> getPrecision() {
		return Optional.ofNullable(this.precision);
	}

	@NonNull
	public Optional<Integer> getScale() {
		return Optional.ofNullable(this.scale);
	}

	/**
	 * Only meaningful for bulk load columns.
	 *
	 * @return whether the column accepts {@code null}, or empty to use the transport default
	 */
	@NonNull
	public Optional<Boolean> getNullable() {
		return Optional.ofNullable(this.nullable);
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ParameterOptions))
			return false;

		ParameterOptions parameterOptions = (ParameterOptions) object;

		return Objects.equals(this.length, parameterOptions.length)
				&& Objects.equals(this.precision, parameterOptions.precision)
				&& Objects.equals(this.scale, parameterOptions.scale)
				&& Objects.equals(this.nullable, parameterOptions.nullable);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.length, this.precision, this.scale, this.nullable);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{length=%s, precision=%s, scale=%s, nullable=%s}", getClass().getSimpleName(),
				this.length, this.precision, this.scale, this.nullable);
	}

	/**
	 * Builder used to construct instances of {@link ParameterOptions}.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@Nullable
		private Integer length;
		@Nullable
		private Integer precision;
		@Nullable
		private Integer scale;
		@Nullable
		private Boolean nullable;

		private Builder() {
			// Use ParameterOptions.builder()
		}

		@NonNull
		public Builder length(@Nullable Integer length) {
			if (length != null && length < 0)
				throw new IllegalArgumentException("Length cannot be negative");

			this.length = length;
			return this;
		}

		@NonNull
		public Builder precision(@Nullable Integer precision) {
			if (precision != null && precision < 0)
				throw new IllegalArgumentException("Precision cannot be negative");

			this.precision = precision;
			return this;
		}

		@NonNull
		public Builder scale(@Nullable Integer scale) {
			if (scale != null && scale < 0)
				throw new IllegalArgumentException("Scale cannot be negative");

			this.scale = scale;
			return this;
		}

		@NonNull
		public Builder nullable(@Nullable Boolean nullable) {
			this.nullable = nullable;
			return this;
		}

		@NonNull
		public ParameterOptions build() {
			return new ParameterOptions(this);
		}
	}
}
