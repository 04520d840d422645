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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Accumulates columns and rows for a bulk insert into one table.
 * <p>
 * A connection is acquired on the first {@link #column(String, SqlType)} or {@link #add(Object)} call and held until
 * the load settles, or until {@link #close()} if it is never executed. Columns must be declared before rows are added.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public class BulkLoader implements AutoCloseable {
	@NonNull
	private final QueryExecutor queryExecutor;
	@NonNull
	private final String table;
	@NonNull
	private final BulkLoadOptions options;
	@NonNull
	private final List<String> columnNames;
	@NonNull
	private final CompletableFuture<Long> rowCountFuture;
	@NonNull
	private final AtomicBoolean released;
	@Nullable
	private Connection connection;
	@Nullable
	private TransportBulkLoad transportBulkLoad;
	@Nullable
	private Duration connectionAcquisitionDuration;
	private long rowsAdded;
	private boolean executed;

	BulkLoader(@NonNull QueryExecutor queryExecutor,
						 @NonNull String table,
						 @NonNull BulkLoadOptions options) {
		requireNonNull(queryExecutor);
		requireNonNull(table);
		requireNonNull(options);

		if (table.trim().length() == 0)
			throw new IllegalArgumentException("A table name is required");

		this.queryExecutor = queryExecutor;
		this.table = table;
		this.options = options;
		this.columnNames = new ArrayList<>();
		this.rowCountFuture = new CompletableFuture<>();
		this.released = new AtomicBoolean(false);
	}

	@NonNull
	public BulkLoader column(@NonNull String name,
													 @NonNull SqlType type) {
		return column(name, type, null);
	}

	/**
	 * Declares a column.
	 *
	 * @param name    the column name
	 * @param type    the column type
	 * @param options length/precision/scale/nullability, or {@code null} for none
	 * @return this loader, for chaining
	 * @throws IllegalArgumentException if the name is blank or already declared
	 * @throws IllegalStateException    if rows were already added or the load was executed
	 */
	@NonNull
	public BulkLoader column(@NonNull String name,
													 @NonNull SqlType type,
													 @Nullable ParameterOptions options) {
		requireNonNull(name);
		requireNonNull(type);

		if (name.trim().length() == 0)
			throw new IllegalArgumentException("A column name is required");

		if (this.columnNames.contains(name))
			throw new IllegalArgumentException(format("Column '%s' was already declared", name));

		ensureModifiable();

		if (this.rowsAdded > 0)
			throw new IllegalStateException("Columns must be declared before rows are added");

		requireTransportBulkLoad().addColumn(name, type, options == null ? ParameterOptions.none() : options);
		this.columnNames.add(name);

		return this;
	}

	/**
	 * Adds a row.
	 * <p>
	 * A row is either a {@link Map} keyed by column name, or a {@link List} or array of values in column declaration
	 * order whose size matches the number of declared columns. {@code null} rows are skipped.
	 *
	 * @param row the row to add
	 * @return this loader, for chaining
	 * @throws IllegalArgumentException if the row has an unsupported shape or the wrong number of values
	 */
	@NonNull
	public BulkLoader add(@Nullable Object row) {
		if (row == null)
			return this;

		ensureModifiable();

		if (row instanceof Map<?, ?> map) {
			Map<String, Object> record = new LinkedHashMap<>();

			for (Map.Entry<?, ?> entry : map.entrySet()) {
				if (!(entry.getKey() instanceof String key))
					throw new IllegalArgumentException(format("Row keys must be column names, found %s", entry.getKey()));

				record.put(key, entry.getValue());
			}

			requireTransportBulkLoad().addRow(record);
		} else if (row instanceof List<?> list) {
			requireTransportBulkLoad().addRow(positionalRow(list));
		} else if (row instanceof Object[] array) {
			requireTransportBulkLoad().addRow(positionalRow(Arrays.asList(array)));
		} else {
			throw new IllegalArgumentException(format("Unsupported row type %s; rows must be maps, lists or arrays",
					row.getClass().getName()));
		}

		++this.rowsAdded;
		return this;
	}

	/**
	 * Adds each of the given rows. {@code null} rows are skipped.
	 *
	 * @param rows the rows to add
	 * @return this loader, for chaining
	 */
	@NonNull
	public BulkLoader addAll(@NonNull Iterable<?> rows) {
		requireNonNull(rows);

		for (Object row : rows)
			add(row);

		return this;
	}

	/**
	 * Runs the bulk insert and waits for it.
	 *
	 * @return the number of inserted rows
	 */
	@NonNull
	public Long execute() {
		return QueryExecutor.await(executeAsync());
	}

	/**
	 * Runs the bulk insert. The held connection is released once the insert settles.
	 *
	 * @return a future which completes with the number of inserted rows
	 * @throws IllegalStateException if the load was already executed or closed
	 */
	@NonNull
	public CompletableFuture<Long> executeAsync() {
		ensureModifiable();

		TransportBulkLoad bulkLoad = requireTransportBulkLoad();
		Connection heldConnection = requireNonNull(this.connection);
		long executionStartTime = System.nanoTime();

		this.executed = true;

		getOptions().getTimeout().ifPresent(bulkLoad::setTimeout);

		try {
			heldConnection.requireTransportConnection().execBulkLoad(bulkLoad);
		} catch (RuntimeException e) {
			settle(e, null);
		}

		return this.rowCountFuture.whenComplete((rowCount, error) -> {
			Throwable failure = error == null ? null : QueryExecutor.unwrap(error);

			releaseConnection();

			getQueryExecutor().logStatement(StatementLog.withStatement(format("BULK INSERT %s (%s)", getTable(),
							String.join(", ", this.columnNames)))
					.connectionId(heldConnection.getId())
					.connectionAcquisitionDuration(this.connectionAcquisitionDuration)
					.executionDuration(Duration.ofNanos(System.nanoTime() - executionStartTime))
					.rowCount(rowCount)
					.exception(failure)
					.build(), failure);
		});
	}

	/**
	 * Releases a connection acquired by a load which was never executed. Safe to call more than once.
	 */
	@Override
	public void close() {
		if (this.executed)
			return;

		this.executed = true;
		releaseConnection();
	}

	@NonNull
	public String getTable() {
		return this.table;
	}

	@NonNull
	public BulkLoadOptions getOptions() {
		return this.options;
	}

	@NonNull
	public List<String> getColumnNames() {
		return List.copyOf(this.columnNames);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{table=%s, columns=%s, rowsAdded=%d}", getClass().getSimpleName(), getTable(), this.columnNames,
				this.rowsAdded);
	}

	@NonNull
	private List<Object> positionalRow(@NonNull List<?> values) {
		if (values.size() != this.columnNames.size())
			throw new IllegalArgumentException(format("Row has %d value[s] but %d column[s] were declared", values.size(),
					this.columnNames.size()));

		return new ArrayList<>(values);
	}

	private void ensureModifiable() {
		if (this.executed)
			throw new IllegalStateException(format("Bulk load into %s was already executed or closed", getTable()));
	}

	@NonNull
	private TransportBulkLoad requireTransportBulkLoad() {
		if (this.transportBulkLoad != null)
			return this.transportBulkLoad;

		long acquisitionStartTime = System.nanoTime();
		Connection acquiredConnection = getQueryExecutor().getConnectionPool().acquire();

		try {
			QueryExecutor.await(acquiredConnection.connect());
			acquiredConnection.beginExecution();
			this.transportBulkLoad = acquiredConnection.requireTransportConnection()
					.newBulkLoad(getTable(), getOptions(), this::settle);
		} catch (RuntimeException e) {
			acquiredConnection.endExecution();
			getQueryExecutor().getConnectionPool().release(acquiredConnection);
			throw e;
		}

		this.connection = acquiredConnection;

		this.connectionAcquisitionDuration = Duration.ofNanos(System.nanoTime() - acquisitionStartTime);

		return this.transportBulkLoad;
	}

	private void settle(@Nullable Throwable error,
											@Nullable Long rowCount) {
		if (error == null)
			this.rowCountFuture.complete(rowCount == null ? 0L : rowCount);
		else
			this.rowCountFuture.completeExceptionally(error instanceof DatabaseException
					? error
					: new DatabaseException(format("Bulk load into %s failed", getTable()), error));
	}

	private void releaseConnection() {
		Connection heldConnection = this.connection;

		if (heldConnection == null || !this.released.compareAndSet(false, true))
			return;

		heldConnection.endExecution();
		getQueryExecutor().getConnectionPool().release(heldConnection);
	}

	@NonNull
	private QueryExecutor getQueryExecutor() {
		return this.queryExecutor;
	}
}
