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
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Describes one column of a {@link Result}, as reported by the transport.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class ColumnMetadata {
	@NonNull
	private final String name;
	@Nullable
	private final SqlType type;
	@Nullable
	private final Integer length;
	@Nullable
	private final Integer precision;
	@Nullable
	private final Integer scale;
	@Nullable
	private final Boolean nullable;

	public ColumnMetadata(@NonNull String name,
												@Nullable SqlType type) {
		this(name, type, null, null, null, null);
	}

	public ColumnMetadata(@NonNull String name,
												@Nullable SqlType type,
												@Nullable Integer length,
												@Nullable Integer precision,
												@Nullable Integer scale,
												@Nullable Boolean nullable) {
		requireNonNull(name);

		this.name = name;
		this.type = type;
		this.length = length;
		this.precision = precision;
		this.scale = scale;
		this.nullable = nullable;
	}

	/**
	 * @return the column name, which is empty for unnamed expressions
	 */
	@NonNull
	public String getName() {
		return this.name;
	}

	/**
	 * @return the column type, or empty if the transport reported a type with no {@link SqlType} counterpart
	 */
	@NonNull
	public Optional<SqlType> getType() {
		return Optional.ofNullable(this.type);
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

	@NonNull
	public Optional<Boolean> getNullable() {
		return Optional.ofNullable(this.nullable);
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ColumnMetadata))
			return false;

		ColumnMetadata columnMetadata = (ColumnMetadata) object;

		return Objects.equals(this.name, columnMetadata.name)
				&& Objects.equals(this.type, columnMetadata.type)
				&& Objects.equals(this.length, columnMetadata.length)
				&& Objects.equals(this.precision, columnMetadata.precision)
				&& Objects.equals(this.scale, columnMetadata.scale)
				&& Objects.equals(this.nullable, columnMetadata.nullable);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.name, this.type, this.length, this.precision, this.scale, this.nullable);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{name=%s, type=%s}", getClass().getSimpleName(), getName(),
				getType().map(SqlType::getTypeName).orElse("unknown"));
	}
}
