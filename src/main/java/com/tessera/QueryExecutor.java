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
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.WARNING;

/**
 * Runs {@link Query}s on pooled connections.
 * <p>
 * A standalone execution acquires a connection, makes sure it is live, moves it to {@link ConnectionState#EXECUTING}
 * for the duration of the request and hands it back to the pool exactly once however the request ends. Every
 * execution is reported to the {@link StatementLogger}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
class QueryExecutor {
	@NonNull
	private final ConnectionPool connectionPool;
	@NonNull
	private final StatementLogger statementLogger;
	@NonNull
	private final Logger logger;

	QueryExecutor(@NonNull ConnectionPool connectionPool,
								@NonNull StatementLogger statementLogger) {
		requireNonNull(connectionPool);
		requireNonNull(statementLogger);

		this.connectionPool = connectionPool;
		this.statementLogger = statementLogger;
		this.logger = Logger.getLogger(QueryExecutor.class.getName());
	}

	/**
	 * Executes a snapshot of the given query on a pooled connection.
	 *
	 * @param query the query to execute
	 * @return a future which completes with the query's results or fails with a {@link DatabaseException}
	 * @throws IllegalStateException if the query has no statement
	 */
	@NonNull
	CompletableFuture<Results> executeAsync(@NonNull Query query) {
		requireNonNull(query);

		Query snapshot = snapshot(query);
		long acquisitionStartTime = System.nanoTime();
		Connection connection;

		try {
			connection = getConnectionPool().acquire();
		} catch (RuntimeException e) {
			StatementLog statementLog = StatementLog.withQuery(snapshot)
					.connectionAcquisitionDuration(Duration.ofNanos(System.nanoTime() - acquisitionStartTime))
					.exception(e)
					.build();

			logStatement(statementLog, e);
			return CompletableFuture.failedFuture(e);
		}

		Duration connectionAcquisitionDuration = Duration.ofNanos(System.nanoTime() - acquisitionStartTime);
		long executionStartTime = System.nanoTime();
		CompletableFuture<Results> execution;

		try {
			execution = connection.connect().thenCompose(liveConnection -> {
				liveConnection.beginExecution();
				return new ResultAggregator(liveConnection, snapshot).execute();
			});
		} catch (RuntimeException e) {
			execution = CompletableFuture.failedFuture(e);
		}

		return execution.handle((results, error) -> {
			Throwable failure = error == null ? null : unwrap(error);

			connection.endExecution();
			getConnectionPool().release(connection);

			StatementLog statementLog = StatementLog.withQuery(snapshot)
					.connectionId(connection.getId())
					.connectionAcquisitionDuration(connectionAcquisitionDuration)
					.executionDuration(Duration.ofNanos(System.nanoTime() - executionStartTime))
					.resultCount(results == null ? null : results.size())
					.exception(failure)
					.build();

			logStatement(statementLog, failure);

			if (failure != null)
				throw new CompletionException(failure);

			return results;
		});
	}

	/**
	 * Executes a snapshot of the given query on a connection the caller already holds, such as one inside a
	 * transaction. The connection's state is left untouched and it is not released.
	 *
	 * @param connection the connection to execute on
	 * @param query      the query to execute
	 * @return a future which completes with the query's results or fails with a {@link DatabaseException}
	 */
	@NonNull
	CompletableFuture<Results> executeOn(@NonNull Connection connection,
																			 @NonNull Query query) {
		requireNonNull(connection);
		requireNonNull(query);

		Query snapshot = snapshot(query);
		long executionStartTime = System.nanoTime();

		return new ResultAggregator(connection, snapshot).execute().handle((results, error) -> {
			Throwable failure = error == null ? null : unwrap(error);

			StatementLog statementLog = StatementLog.withQuery(snapshot)
					.connectionId(connection.getId())
					.executionDuration(Duration.ofNanos(System.nanoTime() - executionStartTime))
					.resultCount(results == null ? null : results.size())
					.exception(failure)
					.build();

			logStatement(statementLog, failure);

			if (failure != null)
				throw new CompletionException(failure);

			return results;
		});
	}

	/**
	 * Hands a log entry to the statement logger. A failing statement logger never replaces the execution's outcome.
	 *
	 * @param statementLog the entry to log
	 * @param failure      the execution's failure, if any, to which a logger failure is attached
	 */
	void logStatement(@NonNull StatementLog statementLog,
										@Nullable Throwable failure) {
		requireNonNull(statementLog);

		try {
			getStatementLogger().log(statementLog);
		} catch (RuntimeException e) {
			if (failure != null)
				failure.addSuppressed(e);
			else
				getLogger().log(WARNING, format("Statement logger failed for %s", statementLog.getStatement()), e);
		}
	}

	@NonNull
	private static Query snapshot(@NonNull Query query) {
		Query snapshot = new Query().copyFrom(query);

		if (snapshot.getStatement().isEmpty())
			throw new IllegalStateException("A statement is required before executing a query");

		return snapshot;
	}

	/**
	 * Strips the wrappers {@link CompletableFuture} puts around a failure.
	 *
	 * @param throwable the failure as observed on a future
	 * @return the underlying failure
	 */
	@NonNull
	static Throwable unwrap(@NonNull Throwable throwable) {
		requireNonNull(throwable);

		Throwable current = throwable;

		while ((current instanceof CompletionException || current instanceof ExecutionException) && current.getCause() != null)
			current = current.getCause();

		return current;
	}

	/**
	 * Waits for a future on behalf of a blocking API, rethrowing its failure directly.
	 *
	 * @param future the future to wait for
	 * @param <T>    the result type
	 * @return the future's value
	 */
	static <T> T await(@NonNull CompletableFuture<T> future) {
		requireNonNull(future);

		try {
			return future.join();
		} catch (CompletionException e) {
			Throwable cause = unwrap(e);

			if (cause instanceof RuntimeException)
				throw (RuntimeException) cause;
			if (cause instanceof Error)
				throw (Error) cause;

			throw new DatabaseException(cause);
		}
	}

	@NonNull
	ConnectionPool getConnectionPool() {
		return this.connectionPool;
	}

	@NonNull
	StatementLogger getStatementLogger() {
		return this.statementLogger;
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}
}
