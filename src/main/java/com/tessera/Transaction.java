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
import java.security.SecureRandom;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.FINE;
import static java.util.logging.Level.WARNING;

/**
 * A queue of statements and savepoints which run as one unit of work.
 * <p>
 * Nothing touches the database until {@link #commit()}. Committing acquires a connection, opens the transaction
 * boundary, runs the queued statements in order (setting a savepoint on the server at each savepoint entry) and
 * commits. If a statement fails, the boundary stays open and the connection stays held, so {@link #rollback()} or
 * {@link #rollback(String)} can follow.
 * <p>
 * Example:
 * <pre>{@code  Transaction transaction = tessera.transaction();
 * transaction.query("INSERT INTO account (id) VALUES (@id)", Map.of("id", 1));
 * String savepoint = transaction.savePoint();
 * transaction.query("UPDATE account SET balance = 0");
 * Results results = transaction.commit();}</pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public class Transaction {
	@NonNull
	private static final SecureRandom NAME_GENERATOR;

	static {
		NAME_GENERATOR = new SecureRandom();
	}

	@NonNull
	private final QueryExecutor queryExecutor;
	@NonNull
	private final TransactionIsolation isolation;
	@NonNull
	private final String name;
	@NonNull
	private final List<Entry> entries;
	@NonNull
	private final Set<String> savepointNames;
	@NonNull
	private final Logger logger;
	@Nullable
	private Connection connection;

	Transaction(@NonNull QueryExecutor queryExecutor,
							@NonNull TransactionIsolation isolation) {
		requireNonNull(queryExecutor);
		requireNonNull(isolation);

		this.queryExecutor = queryExecutor;
		this.isolation = isolation;
		this.name = generateName("tx_");
		this.entries = new ArrayList<>();
		this.savepointNames = new HashSet<>();
		this.logger = Logger.getLogger(Transaction.class.getName());
	}

	@NonNull
	public Transaction query(@NonNull String statement) {
		return query(new Query().sql(statement));
	}

	@NonNull
	public Transaction query(@NonNull String statement,
													 @Nullable Map<String, ?> parameters) {
		return query(new Query().sql(statement, parameters));
	}

	/**
	 * Queues a snapshot of the given query.
	 *
	 * @param query the query to queue
	 * @return this transaction, for chaining
	 * @throws IllegalArgumentException if the query has no statement
	 */
	@NonNull
	public Transaction query(@NonNull Query query) {
		requireNonNull(query);

		if (query.getStatement().isEmpty())
			throw new IllegalArgumentException("Queued queries must have a statement");

		this.entries.add(new StatementEntry(new Query().copyFrom(query)));
		return this;
	}

	/**
	 * Queues a savepoint with a generated name.
	 *
	 * @return the generated name
	 * @throws IllegalStateException if no statement was queued or the previous entry is already a savepoint
	 */
	@NonNull
	public String savePoint() {
		return savePoint(null);
	}

	/**
	 * Queues a savepoint.
	 *
	 * @param name the savepoint name, or {@code null} to generate one unique within this transaction
	 * @return the name used
	 * @throws IllegalStateException if no statement was queued or the previous entry is already a savepoint
	 */
	@NonNull
	public String savePoint(@Nullable String name) {
		if (this.entries.size() == 0)
			throw new IllegalStateException("A savepoint must follow a statement");

		if (this.entries.get(this.entries.size() - 1) instanceof SavepointEntry)
			throw new IllegalStateException("A savepoint cannot immediately follow another savepoint");

		String savepointName = name;

		if (savepointName == null || savepointName.trim().length() == 0) {
			do {
				savepointName = generateName("sp_");
			} while (this.savepointNames.contains(savepointName));
		}

		this.savepointNames.add(savepointName);
		this.entries.add(new SavepointEntry(savepointName));

		return savepointName;
	}

	/**
	 * Runs the queued entries and commits, waiting for the outcome.
	 *
	 * @return the results of every queued statement, flattened in execution order
	 * @throws DatabaseException if a statement or the commit failed; the transaction stays open for rollback
	 */
	@NonNull
	public Results commit() {
		return QueryExecutor.await(commitAsync());
	}

	/**
	 * Runs the queued entries and commits.
	 * <p>
	 * The queue is consumed when execution starts.
	 *
	 * @return a future which completes with the results of every queued statement, flattened in execution order
	 */
	@NonNull
	public CompletableFuture<Results> commitAsync() {
		List<Entry> pendingEntries = new ArrayList<>(this.entries);
		List<Results> collectedResults = new ArrayList<>(pendingEntries.size());

		this.entries.clear();

		CompletableFuture<Void> chain = openBoundary();

		for (Entry entry : pendingEntries) {
			if (entry instanceof StatementEntry statementEntry) {
				chain = chain.thenCompose(ignored ->
						getQueryExecutor().executeOn(requireConnection(), statementEntry.getQuery())
								.thenAccept(collectedResults::add));
			} else if (entry instanceof SavepointEntry savepointEntry) {
				chain = chain.thenCompose(ignored ->
						control(format("SAVE TRANSACTION %s", savepointEntry.getName()),
								(callback) -> requireConnection().requireTransportConnection().saveTransaction(callback, savepointEntry.getName())));
			}
		}

		return chain
				.thenCompose(ignored -> control(format("COMMIT TRANSACTION %s", getName()),
						(callback) -> requireConnection().requireTransportConnection().commitTransaction(callback)))
				.thenApply(ignored -> {
					closeBoundary(false);
					Results results = Result.flatten(collectedResults.toArray());
					return results == null ? new Results(List.of()) : results;
				});
	}

	/**
	 * Rolls back and closes the transaction, waiting for the outcome.
	 */
	public void rollback() {
		QueryExecutor.await(rollbackAsync());
	}

	/**
	 * Rolls back to the given savepoint, keeping the transaction open, and waits for the outcome.
	 *
	 * @param savepointName the savepoint to roll back to
	 */
	public void rollback(@NonNull String savepointName) {
		QueryExecutor.await(rollbackAsync(savepointName));
	}

	/**
	 * Rolls back and closes the transaction, releasing its connection. Queued entries are discarded.
	 * Rolling back a transaction which was never opened only discards the queue.
	 *
	 * @return a future which completes once the transaction is rolled back
	 */
	@NonNull
	public CompletableFuture<Void> rollbackAsync() {
		this.entries.clear();

		if (this.connection == null)
			return CompletableFuture.completedFuture(null);

		return control(format("ROLLBACK TRANSACTION %s", getName()),
				(callback) -> requireConnection().requireTransportConnection().rollbackTransaction(callback, null))
				.whenComplete((ignored, error) -> closeBoundary(error != null));
	}

	/**
	 * Rolls back to the given savepoint. The transaction stays open for further statements.
	 *
	 * @param savepointName the savepoint to roll back to
	 * @return a future which completes once the rollback is done
	 * @throws IllegalStateException if the transaction is not open
	 */
	@NonNull
	public CompletableFuture<Void> rollbackAsync(@NonNull String savepointName) {
		requireNonNull(savepointName);

		if (this.connection == null)
			throw new IllegalStateException(format("Cannot roll back to savepoint '%s': transaction %s is not open",
					savepointName, getName()));

		return control(format("ROLLBACK TRANSACTION %s", savepointName),
				(callback) -> requireConnection().requireTransportConnection().rollbackTransaction(callback, savepointName));
	}

	/**
	 * Empties the queue without touching the database.
	 */
	public void clear() {
		this.entries.clear();
	}

	@NonNull
	private CompletableFuture<Void> openBoundary() {
		if (this.connection != null)
			return CompletableFuture.completedFuture(null);

		Connection acquiredConnection;

		try {
			acquiredConnection = getQueryExecutor().getConnectionPool().acquire();
		} catch (RuntimeException e) {
			return CompletableFuture.failedFuture(e);
		}

		CompletableFuture<Void> boundary;

		try {
			boundary = acquiredConnection.connect().thenCompose(liveConnection -> {
				liveConnection.beginTransaction();
				this.connection = liveConnection;

				return control(format("BEGIN TRANSACTION %s", getName()),
						(callback) -> liveConnection.requireTransportConnection().beginTransaction(callback, getName(), getIsolation()));
			});
		} catch (RuntimeException e) {
			boundary = CompletableFuture.failedFuture(e);
		}

		return boundary.whenComplete((ignored, error) -> {
			if (error == null)
				return;

			// Nothing to roll back if the boundary never opened
			this.connection = null;
			acquiredConnection.endTransaction();
			getQueryExecutor().getConnectionPool().release(acquiredConnection);
		});
	}

	private void closeBoundary(@NonNull Boolean discardConnection) {
		Connection heldConnection = this.connection;

		if (heldConnection == null)
			return;

		this.connection = null;
		heldConnection.endTransaction();

		if (discardConnection) {
			getLogger().log(WARNING, format("Discarding connection %s after failed rollback of transaction %s",
					heldConnection.getId(), getName()));
			getQueryExecutor().getConnectionPool().destroy(heldConnection);
		} else {
			getQueryExecutor().getConnectionPool().release(heldConnection);
		}
	}

	@NonNull
	private CompletableFuture<Void> control(@NonNull String description,
																					@NonNull Consumer<Consumer<@Nullable Throwable>> operation) {
		requireNonNull(description);
		requireNonNull(operation);

		CompletableFuture<Void> future = new CompletableFuture<>();
		long startTime = System.nanoTime();

		try {
			operation.accept((error) -> {
				if (error == null)
					future.complete(null);
				else
					future.completeExceptionally(error instanceof DatabaseException
							? error
							: new DatabaseException(format("Unable to %s", description.toLowerCase()), error));
			});
		} catch (RuntimeException e) {
			future.completeExceptionally(e);
		}

		return future.whenComplete((ignored, error) -> {
			Throwable failure = error == null ? null : QueryExecutor.unwrap(error);
			Connection heldConnection = this.connection;

			getLogger().log(FINE, format("%s %s", description, failure == null ? "succeeded" : "failed"));

			getQueryExecutor().logStatement(StatementLog.withStatement(description)
					.connectionId(heldConnection == null ? null : heldConnection.getId())
					.executionDuration(Duration.ofNanos(System.nanoTime() - startTime))
					.exception(failure)
					.build(), failure);
		});
	}

	@NonNull
	private Connection requireConnection() {
		if (this.connection == null)
			throw new IllegalStateException(format("Transaction %s is not open", getName()));

		return this.connection;
	}

	@NonNull
	private static String generateName(@NonNull String prefix) {
		byte[] bytes = new byte[8];
		NAME_GENERATOR.nextBytes(bytes);
		return prefix + HexFormat.of().formatHex(bytes);
	}

	/**
	 * Is the transaction boundary open on the database, holding a connection?
	 *
	 * @return {@code true} if open, {@code false} otherwise
	 */
	@NonNull
	public Boolean isOpen() {
		return this.connection != null;
	}

	/**
	 * @return the entries queued since the last {@link #commit()}, {@link #rollback()} or {@link #clear()}
	 */
	@NonNull
	public List<Entry> getEntries() {
		return Collections.unmodifiableList(new ArrayList<>(this.entries));
	}

	@NonNull
	public String getName() {
		return this.name;
	}

	@NonNull
	public TransactionIsolation getIsolation() {
		return this.isolation;
	}

	@NonNull
	public Optional<Connection> getConnection() {
		return Optional.ofNullable(this.connection);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{name=%s, isolation=%s, entries=%s, open=%s}", getClass().getSimpleName(), getName(),
				getIsolation().name(), this.entries, isOpen());
	}

	@NonNull
	QueryExecutor getQueryExecutor() {
		return this.queryExecutor;
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}

	/**
	 * An entry in a {@link Transaction}'s queue.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 * @since 1.0.0
	 */
	@ThreadSafe
	public abstract static sealed class Entry permits StatementEntry, SavepointEntry {
		private Entry() {
			// Only the nested subclasses
		}
	}

	/**
	 * A queued statement.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 * @since 1.0.0
	 */
	@ThreadSafe
	public static final class StatementEntry extends Entry {
		@NonNull
		private final Query query;

		StatementEntry(@NonNull Query query) {
			this.query = requireNonNull(query);
		}

		@NonNull
		public Query getQuery() {
			return this.query;
		}

		@Override
		@NonNull
		public String toString() {
			return format("%s{query=%s}", getClass().getSimpleName(), getQuery());
		}
	}

	/**
	 * A queued savepoint marker.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 * @since 1.0.0
	 */
	@ThreadSafe
	public static final class SavepointEntry extends Entry {
		@NonNull
		private final String name;

		SavepointEntry(@NonNull String name) {
			this.name = requireNonNull(name);
		}

		@NonNull
		public String getName() {
			return this.name;
		}

		@Override
		@NonNull
		public String toString() {
			return format("%s{name=%s}", getClass().getSimpleName(), getName());
		}
	}
}
