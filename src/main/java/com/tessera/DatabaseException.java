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
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;

/**
 * Thrown when the database reports an error while executing a request, such as a syntax error, a constraint
 * violation or a connection reset.
 * <p>
 * If the {@code cause} of this exception is a {@link SQLException}, the {@link #getErrorCode()} and
 * {@link #getSqlState()} accessors are shorthand for retrieving the corresponding {@link SQLException} values.
 * Transports which decode server error tokens themselves can supply every detail via
 * {@link #DatabaseException(String, Throwable, Details)}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public class DatabaseException extends RuntimeException {
	@Nullable
	private final Integer errorCode;
	@Nullable
	private final String sqlState;
	@Nullable
	private final Integer state;
	@Nullable
	private final Integer severity;
	@Nullable
	private final Integer line;
	@Nullable
	private final String procedure;
	@Nullable
	private final String serverName;

	/**
	 * Creates a {@code DatabaseException} with the given {@code message}.
	 *
	 * @param message a message describing this exception
	 */
	public DatabaseException(@Nullable String message) {
		this(message, null);
	}

	/**
	 * Creates a {@code DatabaseException} which wraps the given {@code cause}.
	 *
	 * @param cause the cause of this exception
	 */
	public DatabaseException(@Nullable Throwable cause) {
		this(cause == null ? null : cause.getMessage(), cause);
	}

	/**
	 * Creates a {@code DatabaseException} which wraps the given {@code cause}.
	 *
	 * @param message a message describing this exception
	 * @param cause   the cause of this exception
	 */
	public DatabaseException(@Nullable String message,
													 @Nullable Throwable cause) {
		this(message, cause, null);
	}

	/**
	 * Creates a {@code DatabaseException} carrying server error details.
	 *
	 * @param message a message describing this exception
	 * @param cause   the cause of this exception
	 * @param details server error details, or {@code null} to derive what is available from {@code cause}
	 */
	public DatabaseException(@Nullable String message,
													 @Nullable Throwable cause,
													 @Nullable Details details) {
		super(message, cause);

		Details resolvedDetails = details;

		if (resolvedDetails == null && cause != null) {
			if (cause instanceof DatabaseException databaseException) {
				resolvedDetails = new Details()
						.errorCode(databaseException.errorCode)
						.sqlState(databaseException.sqlState)
						.state(databaseException.state)
						.severity(databaseException.severity)
						.line(databaseException.line)
						.procedure(databaseException.procedure)
						.serverName(databaseException.serverName);
			} else if (cause instanceof SQLException sqlException) {
				resolvedDetails = new Details()
						.errorCode(sqlException.getErrorCode())
						.sqlState(sqlException.getSQLState());
			}
		}

		if (resolvedDetails == null)
			resolvedDetails = new Details();

		this.errorCode = resolvedDetails.errorCode;
		this.sqlState = resolvedDetails.sqlState;
		this.state = resolvedDetails.state;
		this.severity = resolvedDetails.severity;
		this.line = resolvedDetails.line;
		this.procedure = resolvedDetails.procedure;
		this.serverName = resolvedDetails.serverName;
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(8);

		if (getMessage() != null && getMessage().trim().length() > 0)
			components.add(format("message=%s", getMessage()));

		if (getErrorCode().isPresent())
			components.add(format("errorCode=%s", getErrorCode().get()));
		if (getSqlState().isPresent())
			components.add(format("sqlState=%s", getSqlState().get()));
		if (getState().isPresent())
			components.add(format("state=%s", getState().get()));
		if (getSeverity().isPresent())
			components.add(format("severity=%s", getSeverity().get()));
		if (getLine().isPresent())
			components.add(format("line=%s", getLine().get()));
		if (getProcedure().isPresent())
			components.add(format("procedure=%s", getProcedure().get()));
		if (getServerName().isPresent())
			components.add(format("serverName=%s", getServerName().get()));

		return format("%s: %s", getClass().getName(), components.stream().collect(Collectors.joining(", ")));
	}

	/**
	 * The server error number, or {@link SQLException#getErrorCode()} if this exception was caused by a
	 * {@link SQLException}.
	 *
	 * @return the error code, or empty if not available
	 */
	@NonNull
	public Optional<Integer> getErrorCode() {
		return Optional.ofNullable(this.errorCode);
	}

	/**
	 * Shorthand for {@link SQLException#getSQLState()} if this exception was caused by a {@link SQLException}.
	 *
	 * @return the SQL state, or empty if not available
	 */
	@NonNull
	public Optional<String> getSqlState() {
		return Optional.ofNullable(this.sqlState);
	}

	/**
	 * @return the server's error state number, or empty if not available
	 */
	@NonNull
	public Optional<Integer> getState() {
		return Optional.ofNullable(this.state);
	}

	/**
	 * @return the error severity class, or empty if not available
	 */
	@NonNull
	public Optional<Integer> getSeverity() {
		return Optional.ofNullable(this.severity);
	}

	/**
	 * @return the offending line of the batch or procedure, or empty if not available
	 */
	@NonNull
	public Optional<Integer> getLine() {
		return Optional.ofNullable(this.line);
	}

	/**
	 * @return the procedure which raised the error, or empty if not available
	 */
	@NonNull
	public Optional<String> getProcedure() {
		return Optional.ofNullable(this.procedure);
	}

	@NonNull
	public Optional<String> getServerName() {
		return Optional.ofNullable(this.serverName);
	}

	/**
	 * Server error details a transport may attach to a {@link DatabaseException}.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Details {
		@Nullable
		private Integer errorCode;
		@Nullable
		private String sqlState;
		@Nullable
		private Integer state;
		@Nullable
		private Integer severity;
		@Nullable
		private Integer line;
		@Nullable
		private String procedure;
		@Nullable
		private String serverName;

		@NonNull
		public Details errorCode(@Nullable Integer errorCode) {
			this.errorCode = errorCode;
			return this;
		}

		@NonNull
		public Details sqlState(@Nullable String sqlState) {
			this.sqlState = sqlState;
			return this;
		}

		@NonNull
		public Details state(@Nullable Integer state) {
			this.state = state;
			return this;
		}

		@NonNull
		public Details severity(@Nullable Integer severity) {
			this.severity = severity;
			return this;
		}

		@NonNull
		public Details line(@Nullable Integer line) {
			this.line = line;
			return this;
		}

		@NonNull
		public Details procedure(@Nullable String procedure) {
			this.procedure = procedure;
			return this;
		}

		@NonNull
		public Details serverName(@Nullable String serverName) {
			this.serverName = serverName;
			return this;
		}
	}
}
