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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Calendar;
import java.util.Date;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * TDS column and parameter types.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
public enum SqlType {
	TINYINT("TinyInt", Types.TINYINT),
	BIT("Bit", Types.BIT),
	SMALLINT("SmallInt", Types.SMALLINT),
	INT("Int", Types.INTEGER),
	SMALLDATETIME("SmallDateTime", Types.TIMESTAMP),
	REAL("Real", Types.REAL),
	MONEY("Money", Types.DECIMAL),
	DATETIME("DateTime", Types.TIMESTAMP),
	FLOAT("Float", Types.DOUBLE),
	DECIMAL("Decimal", Types.DECIMAL),
	NUMERIC("Numeric", Types.NUMERIC),
	SMALLMONEY("SmallMoney", Types.DECIMAL),
	BIGINT("BigInt", Types.BIGINT),
	IMAGE("Image", Types.LONGVARBINARY),
	TEXT("Text", Types.LONGVARCHAR),
	UNIQUEIDENTIFIER("UniqueIdentifier", Types.CHAR),
	NTEXT("NText", Types.LONGNVARCHAR),
	VARBINARY("VarBinary", Types.VARBINARY),
	VARCHAR("VarChar", Types.VARCHAR),
	BINARY("Binary", Types.BINARY),
	CHAR("Char", Types.CHAR),
	NVARCHAR("NVarChar", Types.NVARCHAR),
	NCHAR("NChar", Types.NCHAR),
	XML("Xml", Types.SQLXML),
	TIME("Time", Types.TIME),
	DATE("Date", Types.DATE),
	DATETIME2("DateTime2", Types.TIMESTAMP),
	DATETIMEOFFSET("DateTimeOffset", Types.TIMESTAMP_WITH_TIMEZONE),
	UDT("UDT", Types.JAVA_OBJECT),
	TVP("TVP", Types.STRUCT),
	VARIANT("Variant", Types.OTHER);

	@NonNull
	private static final Pattern GUID_PATTERN;

	static {
		GUID_PATTERN = Pattern.compile("^[{(]?[0-9A-F]{8}-?(?:[0-9A-F]{4}-?){3}[0-9A-F]{12}[)}]?$", Pattern.CASE_INSENSITIVE);
	}

	@NonNull
	private final String typeName;
	private final int jdbcType;

	SqlType(@NonNull String typeName,
					int jdbcType) {
		this.typeName = typeName;
		this.jdbcType = jdbcType;
	}

	/**
	 * Gets the type name as the database spells it, e.g. {@code NVarChar}.
	 *
	 * @return the type name
	 */
	@NonNull
	public String getTypeName() {
		return this.typeName;
	}

	/**
	 * Gets the closest {@link Types} constant, for transports which bridge to JDBC.
	 *
	 * @return the JDBC type
	 */
	public int getJdbcType() {
		return this.jdbcType;
	}

	/**
	 * Looks up a type by name, ignoring case, e.g. {@code "nvarchar"} or {@code "NVarChar"}.
	 *
	 * @param name the type name
	 * @return the matching type
	 * @throws IllegalArgumentException if no type has the given name
	 */
	@NonNull
	public static SqlType fromName(@Nullable String name) {
		if (name == null || name.trim().length() == 0)
			throw new IllegalArgumentException("A type name is required");

		for (SqlType sqlType : values())
			if (sqlType.name().equalsIgnoreCase(name.trim()) || sqlType.getTypeName().equalsIgnoreCase(name.trim()))
				return sqlType;

		throw new IllegalArgumentException(format("'%s' is not a supported type", name));
	}

	/**
	 * Finds the type a JDBC column of the given {@link Types} constant most naturally maps to.
	 *
	 * @param jdbcType the JDBC type
	 * @return the matching type, or {@link Optional#empty()} if there is no natural mapping
	 */
	@NonNull
	public static Optional<SqlType> fromJdbcType(int jdbcType) {
		switch (jdbcType) {
			case Types.BOOLEAN:
				return Optional.of(BIT);
			case Types.DOUBLE:
			case Types.FLOAT:
				return Optional.of(FLOAT);
			case Types.TIMESTAMP:
				return Optional.of(DATETIME2);
			case Types.LONGVARCHAR:
			case Types.CLOB:
				return Optional.of(TEXT);
			case Types.LONGNVARCHAR:
			case Types.NCLOB:
				return Optional.of(NTEXT);
			case Types.LONGVARBINARY:
			case Types.BLOB:
				return Optional.of(VARBINARY);
			case Types.CHAR:
				return Optional.of(CHAR);
			case Types.DECIMAL:
				return Optional.of(DECIMAL);
			default:
				for (SqlType sqlType : values())
					if (sqlType.getJdbcType() == jdbcType)
						return Optional.of(sqlType);

				return Optional.empty();
		}
	}

	/**
	 * Infers the type of a parameter from its runtime value. First match wins:
	 * <ul>
	 *   <li>{@code null} → {@link #VARCHAR}</li>
	 *   <li>string containing a non-ASCII character → {@link #NVARCHAR}</li>
	 *   <li>GUID-shaped string, or {@link UUID} → {@link #UNIQUEIDENTIFIER}</li>
	 *   <li>any other string → {@link #VARCHAR}</li>
	 *   <li>{@link Boolean} → {@link #BIT}</li>
	 *   <li>non-integral number → {@link #FLOAT}</li>
	 *   <li>integer in [0, 255] → {@link #TINYINT}</li>
	 *   <li>integer in [-32767, 32767] → {@link #SMALLINT}</li>
	 *   <li>integer in [-2147483647, 2147483647] → {@link #INT}</li>
	 *   <li>any larger integer → {@link #BIGINT}</li>
	 *   <li>{@code byte[]} or {@link ByteBuffer} → {@link #VARBINARY}</li>
	 *   <li>date/time value → {@link #DATETIMEOFFSET}</li>
	 * </ul>
	 *
	 * @param value the parameter value
	 * @return the inferred type
	 * @throws IllegalArgumentException if no type can be inferred from the value
	 */
	@NonNull
	public static SqlType infer(@Nullable Object value) {
		if (value == null)
			return VARCHAR;

		if (value instanceof CharSequence || value instanceof Character) {
			String string = value.toString();

			if (containsNonAscii(string))
				return NVARCHAR;

			if (GUID_PATTERN.matcher(string).matches())
				return UNIQUEIDENTIFIER;

			return VARCHAR;
		}

		if (value instanceof UUID)
			return UNIQUEIDENTIFIER;

		if (value instanceof Boolean)
			return BIT;

		if (value instanceof Number number)
			return inferNumber(number);

		if (value instanceof byte[] || value instanceof ByteBuffer)
			return VARBINARY;

		if (value instanceof Date
				|| value instanceof Calendar
				|| value instanceof Instant
				|| value instanceof OffsetDateTime
				|| value instanceof ZonedDateTime
				|| value instanceof LocalDateTime
				|| value instanceof LocalDate)
			return DATETIMEOFFSET;

		throw new IllegalArgumentException(format("Unable to determine a type for value of %s", value.getClass().getName()));
	}

	@NonNull
	private static SqlType inferNumber(@NonNull Number number) {
		requireNonNull(number);

		if (number instanceof Double || number instanceof Float) {
			double doubleValue = number.doubleValue();

			if (!Double.isFinite(doubleValue) || doubleValue % 1 != 0)
				return FLOAT;

			if (Math.abs(doubleValue) >= 0x1p63)
				return BIGINT;

			return inferInteger((long) doubleValue);
		}

		if (number instanceof BigDecimal bigDecimal) {
			if (bigDecimal.signum() != 0 && bigDecimal.stripTrailingZeros().scale() > 0)
				return FLOAT;

			return inferInteger(bigDecimal.toBigInteger());
		}

		if (number instanceof BigInteger bigInteger)
			return inferInteger(bigInteger);

		return inferInteger(number.longValue());
	}

	@NonNull
	private static SqlType inferInteger(@NonNull BigInteger bigInteger) {
		requireNonNull(bigInteger);

		if (bigInteger.bitLength() > 63)
			return BIGINT;

		return inferInteger(bigInteger.longValue());
	}

	@NonNull
	private static SqlType inferInteger(long value) {
		if (value >= 0 && value <= 255)
			return TINYINT;

		if (value >= -32767 && value <= 32767)
			return SMALLINT;

		if (value >= -2147483647L && value <= 2147483647L)
			return INT;

		return BIGINT;
	}

	@NonNull
	private static Boolean containsNonAscii(@NonNull String string) {
		for (int i = 0; i < string.length(); ++i)
			if (string.charAt(i) > 0x7F)
				return true;

		return false;
	}
}
