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
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.FINE;
import static java.util.logging.Level.WARNING;

/**
 * Main entry point: a pool of managed connections and the operations which run on it.
 * <p>
 * Example:
 * <pre>{@code  Tessera tessera = Tessera.withTransport(transport)
 *   .configuration(TesseraConfiguration.builder().server("db.example.com").database("hr").build())
 *   .build();
 *
 * Results results = tessera.query("SELECT * FROM employee WHERE id = @id", Map.of("id", 123)).execute();
 *
 * tessera.destroy();}</pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class Tessera implements AutoCloseable {
	@NonNull
	private final TesseraConfiguration configuration;
	@NonNull
	private final Transport transport;
	@NonNull
	private final ConnectionPool connectionPool;
	@NonNull
	private final QueryExecutor queryExecutor;
	@NonNull
	private final StatementLogger statementLogger;
	@NonNull
	private final AtomicBoolean destroyed;
	@NonNull
	private final Logger logger;

	private Tessera(@NonNull Builder builder) {
		requireNonNull(builder);

		this.configuration = builder.configuration == null ? TesseraConfiguration.withDefaults() : builder.configuration;
		this.transport = requireNonNull(builder.transport);
		this.statementLogger = builder.statementLogger == null ? (statementLog) -> {} : builder.statementLogger;
		this.logger = builder.logger == null ? Logger.getLogger(Tessera.class.getName()) : builder.logger;
		this.connectionPool = new ConnectionPool(this.configuration, this.transport,
				builder.connectionValidator == null ? ConnectionValidator.permissive() : builder.connectionValidator, this.logger);
		this.queryExecutor = new QueryExecutor(this.connectionPool, this.statementLogger);
		this.destroyed = new AtomicBoolean(false);
	}

	/**
	 * Provides a {@link Tessera} builder for the given {@link Transport}.
	 *
	 * @param transport the transport used to open physical connections
	 * @return a {@link Tessera} builder
	 */
	@NonNull
	public static Builder withTransport(@NonNull Transport transport) {
		requireNonNull(transport);
		return new Builder(transport);
	}

	/**
	 * Creates an empty query bound to this instance.
	 *
	 * @return a new query
	 */
	@NonNull
	public ExecutableQuery query() {
		ensureNotDestroyed();
		return new ExecutableQuery(getQueryExecutor());
	}

	@NonNull
	public ExecutableQuery query(@NonNull String statement) {
		return query().sql(statement);
	}

	/**
	 * Creates a query bound to this instance with the given statement and input parameters.
	 *
	 * @param statement  the statement
	 * @param parameters input parameter values keyed by name
	 * @return a new query
	 */
	@NonNull
	public ExecutableQuery query(@NonNull String statement,
															 @Nullable Map<String, ?> parameters) {
		return query().sql(statement, parameters);
	}

	@NonNull
	public Transaction transaction() {
		return transaction(TransactionIsolation.DEFAULT);
	}

	/**
	 * Creates a transaction with the given isolation level. No connection is acquired until it commits.
	 *
	 * @param transactionIsolation the isolation level
	 * @return a new transaction
	 */
	@NonNull
	public Transaction transaction(@NonNull TransactionIsolation transactionIsolation) {
		requireNonNull(transactionIsolation);
		ensureNotDestroyed();

		return new Transaction(getQueryExecutor(), transactionIsolation);
	}

	@NonNull
	public BulkLoader bulk(@NonNull String table) {
		return bulk(table, BulkLoadOptions.defaults());
	}

	/**
	 * Creates a bulk loader for the given table. No connection is acquired until the first column or row is added.
	 *
	 * @param table   the target table
	 * @param options bulk load behavior
	 * @return a new bulk loader
	 */
	@NonNull
	public BulkLoader bulk(@NonNull String table,
												 @NonNull BulkLoadOptions options) {
		requireNonNull(table);
		requireNonNull(options);
		ensureNotDestroyed();

		return new BulkLoader(getQueryExecutor(), table, options);
	}

	/**
	 * Checks that a live connection can be acquired.
	 * <p>
	 * Never throws; failures are logged.
	 *
	 * @return {@code true} if a connection was acquired and handed back, {@code false} otherwise
	 */
	@NonNull
	public Boolean ping() {
		if (isDestroyed())
			return false;

		Connection connection;

		try {
			connection = getConnectionPool().acquire();
		} catch (RuntimeException e) {
			getLogger().log(WARNING, format("Unable to reach server %s", getConfiguration().getServer()), e);
			return false;
		}

		Boolean live = connection.isLive();
		getConnectionPool().release(connection);

		return live;
	}

	/**
	 * Closes the pool and disconnects idle connections. Subsequent operations fail with {@link IllegalStateException}.
	 * Safe to call more than once.
	 */
	public void destroy() {
		if (!this.destroyed.compareAndSet(false, true))
			return;

		getLogger().log(FINE, format("Destroying connection pool for server %s", getConfiguration().getServer()));
		getConnectionPool().close();
	}

	@Override
	public void close() {
		destroy();
	}

	@NonNull
	public Boolean isDestroyed() {
		return this.destroyed.get();
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{configuration=%s, pool=%s}", getClass().getSimpleName(), getConfiguration(), getConnectionPool());
	}

	private void ensureNotDestroyed() {
		if (isDestroyed())
			throw new IllegalStateException("This instance has been destroyed");
	}

	@NonNull
	public TesseraConfiguration getConfiguration() {
		return this.configuration;
	}

	@NonNull
	public Transport getTransport() {
		return this.transport;
	}

	@NonNull
	public ConnectionPool getConnectionPool() {
		return this.connectionPool;
	}

	@NonNull
	public StatementLogger getStatementLogger() {
		return this.statementLogger;
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
	 * Builder used to construct instances of {@link Tessera}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final Transport transport;
		@Nullable
		private TesseraConfiguration configuration;
		@Nullable
		private StatementLogger statementLogger;
		@Nullable
		private ConnectionValidator connectionValidator;
		@Nullable
		private Logger logger;

		private Builder(@NonNull Transport transport) {
			// Use Tessera.withTransport()
			this.transport = requireNonNull(transport);
		}

		@NonNull
		public Builder configuration(@Nullable TesseraConfiguration configuration) {
			this.configuration = configuration;
			return this;
		}

		@NonNull
		public Builder statementLogger(@Nullable StatementLogger statementLogger) {
			this.statementLogger = statementLogger;
			return this;
		}

		@NonNull
		public Builder connectionValidator(@Nullable ConnectionValidator connectionValidator) {
			this.connectionValidator = connectionValidator;
			return this;
		}

		/**
		 * Sets the logger connections report lifecycle and protocol errors to.
		 *
		 * @param logger the logger, or {@code null} for one named after {@link Tessera}
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder logger(@Nullable Logger logger) {
			this.logger = logger;
			return this;
		}

		@NonNull
		public Tessera build() {
			return new Tessera(this);
		}
	}
}
