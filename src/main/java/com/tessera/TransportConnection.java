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

import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * One physical connection, as exposed by a {@link Transport}.
 * <p>
 * All operations are asynchronous. Outcomes are reported through events ({@link TransportEvents#CONNECT},
 * {@link TransportEvents#ERROR}, {@link TransportEvents#END}, {@link TransportEvents#DEBUG},
 * {@link TransportEvents#INFO}) or through the callback handed to each operation. A callback receives {@code null}
 * on success and the failure otherwise.
 * <p>
 * A connection runs one request at a time.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
public interface TransportConnection extends EventSource {
	/**
	 * Starts the handshake. Emits {@link TransportEvents#CONNECT} on success or {@link TransportEvents#ERROR} on
	 * failure.
	 */
	void connect();

	/**
	 * Closes the connection. Emits {@link TransportEvents#END} once closed.
	 */
	void close();

	@NonNull
	Boolean isClosed();

	@NonNull
	Boolean isLoggedIn();

	/**
	 * Creates a request for the given statement. Nothing is sent until the request is passed to one of the
	 * execution entry points.
	 *
	 * @param sql      statement text, or a procedure name for {@link #callProcedure(TransportRequest)}
	 * @param callback invoked once with {@code null} or the failure, before {@link TransportEvents#REQUEST_COMPLETED}
	 * @return the request
	 */
	@NonNull
	TransportRequest newRequest(@NonNull String sql,
															@NonNull Consumer<@Nullable Throwable> callback);

	/**
	 * Runs a parameterized statement.
	 */
	void execSql(@NonNull TransportRequest request);

	/**
	 * Runs a raw batch of statements. Parameters are not supported.
	 */
	void execSqlBatch(@NonNull TransportRequest request);

	/**
	 * Calls the stored procedure named by the request's statement text.
	 */
	void callProcedure(@NonNull TransportRequest request);

	void beginTransaction(@NonNull Consumer<@Nullable Throwable> callback,
												@NonNull String name,
												@NonNull TransactionIsolation isolation);

	/**
	 * Sets a savepoint inside the open transaction.
	 */
	void saveTransaction(@NonNull Consumer<@Nullable Throwable> callback,
											 @NonNull String name);

	void commitTransaction(@NonNull Consumer<@Nullable Throwable> callback);

	/**
	 * Rolls back the whole open transaction, or only to the named savepoint.
	 *
	 * @param callback invoked once with {@code null} or the failure
	 * @param name     the savepoint to roll back to, or {@code null} to roll back and end the transaction
	 */
	void rollbackTransaction(@NonNull Consumer<@Nullable Throwable> callback,
													 @Nullable String name);

	/**
	 * Creates a bulk load into the given table.
	 *
	 * @param table    the target table
	 * @param options  bulk load behavior
	 * @param callback invoked once with either the failure or the number of inserted rows
	 * @return the bulk load
	 */
	@NonNull
	TransportBulkLoad newBulkLoad(@NonNull String table,
																@NonNull BulkLoadOptions options,
																@NonNull BiConsumer<@Nullable Throwable, @Nullable Long> callback);

	void execBulkLoad(@NonNull TransportBulkLoad bulkLoad);
}
