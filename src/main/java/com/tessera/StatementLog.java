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
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Diagnostics for one execution: a query, a transaction step or a bulk load.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class StatementLog {
	@NonNull
	private final String statement;
	@Nullable
	private final QueryMode mode;
	@NonNull
	private final List<Parameter> parameters;
	@Nullable
	private final String connectionId;
	@NonNull
	private final Duration totalDuration;
	@Nullable
	private final Duration connectionAcquisitionDuration;
	@Nullable
	private final Duration executionDuration;
	@Nullable
	private final Integer resultCount;
	@Nullable
	private final Long rowCount;
	@Nullable
	private final Throwable exception;

	private StatementLog(@NonNull Builder builder) {
		requireNonNull(builder);

		this.statement = requireNonNull(builder.statement);
		this.mode = builder.mode;
		this.parameters = Collections.unmodifiableList(new ArrayList<>(builder.parameters));
		this.connectionId = builder.connectionId;
		this.connectionAcquisitionDuration = builder.connectionAcquisitionDuration;
		this.executionDuration = builder.executionDuration;
		this.resultCount = builder.resultCount;
		this.rowCount = builder.rowCount;
		this.exception = builder.exception;

		Duration totalDuration = Duration.ZERO;

		if (this.connectionAcquisitionDuration != null)
			totalDuration = totalDuration.plus(this.connectionAcquisitionDuration);

		if (this.executionDuration != null)
			totalDuration = totalDuration.plus(this.executionDuration);

		this.totalDuration = totalDuration;
	}

	/**
	 * Creates a {@link StatementLog} builder for the given statement text.
	 *
	 * @param statement the statement, or a description of the operation for bulk loads
	 * @return a {@link StatementLog} builder
	 */
	@NonNull
	public static Builder withStatement(@NonNull String statement) {
		requireNonNull(statement);
		return new Builder(statement);
	}

	/**
	 * Creates a {@link StatementLog} builder seeded with the statement, mode and parameters of the given query.
	 *
	 * @param query the query
	 * @return a {@link StatementLog} builder
	 */
	@NonNull
	public static Builder withQuery(@NonNull Query query) {
		requireNonNull(query);

		return new Builder(query.getStatement().orElse(""))
				.mode(query.getMode())
				.parameters(new ArrayList<>(query.getParameters().values()));
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(8);

		components.add(format("statement=%s", getStatement()));

		if (getMode().isPresent())
			components.add(format("mode=%s", getMode().get().name()));

		if (getConnectionId().isPresent())
			components.add(format("connectionId=%s", getConnectionId().get()));

		components.add(format("totalDuration=%s", getTotalDuration()));

		if (getConnectionAcquisitionDuration().isPresent())
			components.add(format("connectionAcquisitionDuration=%s", getConnectionAcquisitionDuration().get()));

		if (getExecutionDuration().isPresent())
			components.add(format("executionDuration=%s", getExecutionDuration().get()));

		if (getResultCount().isPresent())
			components.add(format("resultCount=%s", getResultCount().get()));

		if (getRowCount().isPresent())
			components.add(format("rowCount=%s", getRowCount().get()));

		if (getException().isPresent())
			components.add(format("exception=%s", getException().get()));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(Collectors.joining(", ")));
	}

	@NonNull
	public String getStatement() {
		return this.statement;
	}

	/**
	 * @return how the statement was dispatched, or empty for bulk loads and transaction control
	 */
	@NonNull
	public Optional<QueryMode> getMode() {
		return Optional.ofNullable(this.mode);
	}

	@NonNull
	public List<Parameter> getParameters() {
		return this.parameters;
	}

	/**
	 * The {@link Connection#getId()} of the connection the statement ran on.
	 *
	 * @return the connection id, if a connection was acquired
	 */
	@NonNull
	public Optional<String> getConnectionId() {
		return Optional.ofNullable(this.connectionId);
	}

	/**
	 * How long did it take to acquire a {@link Connection} from the pool?
	 *
	 * @return how long it took to acquire a {@link Connection}, if available
	 */
	@NonNull
	public Optional<Duration> getConnectionAcquisitionDuration() {
		return Optional.ofNullable(this.connectionAcquisitionDuration);
	}

	/**
	 * How long did it take from dispatching the request to its completion?
	 *
	 * @return how long it took to execute, if available
	 */
	@NonNull
	public Optional<Duration> getExecutionDuration() {
		return Optional.ofNullable(this.executionDuration);
	}

	/**
	 * How long did the operation take in total?
	 * <p>
	 * This is the sum of {@link #getConnectionAcquisitionDuration()} and {@link #getExecutionDuration()}.
	 *
	 * @return how long the operation took in total
	 */
	@NonNull
	public Duration getTotalDuration() {
		return this.totalDuration;
	}

	/**
	 * @return how many {@link Result}s the execution produced, if it succeeded
	 */
	@NonNull
	public Optional<Integer> getResultCount() {
		return Optional.ofNullable(this.resultCount);
	}

	/**
	 * @return how many rows a bulk load inserted, if it succeeded
	 */
	@NonNull
	public Optional<Long> getRowCount() {
		return Optional.ofNullable(this.rowCount);
	}

	@NonNull
	public Optional<Throwable> getException() {
		return Optional.ofNullable(this.exception);
	}

	/**
	 * Builder used to construct instances of {@link StatementLog}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final String statement;
		@Nullable
		private QueryMode mode;
		@NonNull
		private List<Parameter> parameters;
		@Nullable
		private String connectionId;
		@Nullable
		private Duration connectionAcquisitionDuration;
		@Nullable
		private Duration executionDuration;
		@Nullable
		private Integer resultCount;
		@Nullable
		private Long rowCount;
		@Nullable
		private Throwable exception;

		private Builder(@NonNull String statement) {
			this.statement = requireNonNull(statement);
			this.parameters = List.of();
		}

		@NonNull
		public Builder mode(@Nullable QueryMode mode) {
			this.mode = mode;
			return this;
		}

		@NonNull
		public Builder parameters(@Nullable List<Parameter> parameters) {
			this.parameters = parameters == null ? List.of() : parameters;
			return this;
		}

		@NonNull
		public Builder connectionId(@Nullable String connectionId) {
			this.connectionId = connectionId;
			return this;
		}

		@NonNull
		public Builder connectionAcquisitionDuration(@Nullable Duration connectionAcquisitionDuration) {
			this.connectionAcquisitionDuration = connectionAcquisitionDuration;
			return this;
		}

		@NonNull
		public Builder executionDuration(@Nullable Duration executionDuration) {
			this.executionDuration = executionDuration;
			return this;
		}

		@NonNull
		public Builder resultCount(@Nullable Integer resultCount) {
			this.resultCount = resultCount;
			return this;
		}

		@NonNull
		public Builder rowCount(@Nullable Long rowCount) {
			this.rowCount = rowCount;
			return this;
		}

		@NonNull
		public Builder exception(@Nullable Throwable exception) {
			this.exception = exception;
			return this;
		}

		@NonNull
		public StatementLog build() {
			return new StatementLog(this);
		}
	}
}
