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
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static java.util.Objects.requireNonNull;

/**
 * A {@link Query} bound to a {@link Tessera} instance's pool, executable directly.
 * <p>
 * Execution snapshots the query, so it may be modified and executed again while an earlier execution is in flight.
 * <p>
 * Example:
 * <pre>{@code  Results results = tessera.query()
 *   .sql("SELECT * FROM employee WHERE department_id = @departmentId")
 *   .in("departmentId", 42)
 *   .execute();}</pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public class ExecutableQuery extends Query {
	@NonNull
	private final QueryExecutor queryExecutor;

	ExecutableQuery(@NonNull QueryExecutor queryExecutor) {
		requireNonNull(queryExecutor);
		this.queryExecutor = queryExecutor;
	}

	/**
	 * Executes this query on a pooled connection.
	 *
	 * @return a future which completes with the results or fails with a {@link DatabaseException}
	 * @throws IllegalStateException if no statement was set
	 */
	@NonNull
	public CompletableFuture<Results> executeAsync() {
		return getQueryExecutor().executeAsync(this);
	}

	/**
	 * Executes this query on a pooled connection and waits for its results.
	 *
	 * @return the results
	 * @throws DatabaseException     if the database reported an error or the request timed out
	 * @throws IllegalStateException if no statement was set
	 */
	@NonNull
	public Results execute() {
		return QueryExecutor.await(executeAsync());
	}

	@Override
	@NonNull
	public ExecutableQuery sql(@Nullable String statement) {
		super.sql(statement);
		return this;
	}

	@Override
	@NonNull
	public ExecutableQuery sql(@Nullable String statement,
														 @Nullable Map<String, ?> parameters) {
		super.sql(statement, parameters);
		return this;
	}

	@Override
	@NonNull
	public ExecutableQuery batch() {
		super.batch();
		return this;
	}

	@Override
	@NonNull
	public ExecutableQuery exec() {
		super.exec();
		return this;
	}

	@Override
	@NonNull
	public ExecutableQuery timeout(@Nullable Duration timeout) {
		super.timeout(timeout);
		return this;
	}

	@Override
	@NonNull
	public ExecutableQuery in(@Nullable String name,
														@Nullable Object value) {
		super.in(name, value);
		return this;
	}

	@Override
	@NonNull
	public ExecutableQuery in(@Nullable String name,
														@Nullable SqlType type,
														@Nullable Object value) {
		super.in(name, type, value);
		return this;
	}

	@Override
	@NonNull
	public ExecutableQuery in(@Nullable String name,
														@Nullable SqlType type,
														@Nullable Object value,
														@Nullable ParameterOptions options) {
		super.in(name, type, value, options);
		return this;
	}

	@Override
	@NonNull
	public ExecutableQuery in(@NonNull Map<String, ?> parameters) {
		super.in(parameters);
		return this;
	}

	@Override
	@NonNull
	public ExecutableQuery out(@Nullable String name,
														 @Nullable SqlType type) {
		super.out(name, type);
		return this;
	}

	@Override
	@NonNull
	public ExecutableQuery out(@Nullable String name,
														 @Nullable SqlType type,
														 @Nullable Object value) {
		super.out(name, type, value);
		return this;
	}

	@Override
	@NonNull
	public ExecutableQuery out(@Nullable String name,
														 @Nullable SqlType type,
														 @Nullable Object value,
														 @Nullable ParameterOptions options) {
		super.out(name, type, value, options);
		return this;
	}

	@NonNull
	QueryExecutor getQueryExecutor() {
		return this.queryExecutor;
	}
}
