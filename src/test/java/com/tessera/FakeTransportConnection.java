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
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Connection handed out by {@link FakeTransport}. Records every operation it is asked to perform.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public class FakeTransportConnection implements TransportConnection {
	@NonNull
	private final FakeTransport transport;
	@NonNull
	private final EventEmitter eventEmitter;
	@NonNull
	private final List<String> operations;
	@NonNull
	private final List<FakeTransportRequest> requests;
	@NonNull
	private final List<BulkLoad> bulkLoads;
	private volatile boolean closed;
	private volatile boolean loggedIn;

	FakeTransportConnection(@NonNull FakeTransport transport) {
		this.transport = requireNonNull(transport);
		this.eventEmitter = new EventEmitter();
		this.operations = new CopyOnWriteArrayList<>();
		this.requests = new CopyOnWriteArrayList<>();
		this.bulkLoads = new CopyOnWriteArrayList<>();
	}

	@Override
	public void connect() {
		this.operations.add("connect");

		if (this.transport.isDeferConnect())
			return;

		Throwable connectFailure = this.transport.getConnectFailure();

		if (connectFailure == null)
			completeConnect();
		else
			failConnect(connectFailure);
	}

	public void completeConnect() {
		this.loggedIn = true;
		this.eventEmitter.emit(TransportEvents.CONNECT, null);
	}

	public void failConnect(@NonNull Throwable failure) {
		this.eventEmitter.emit(TransportEvents.ERROR, failure);
	}

	/**
	 * Simulates the server dropping the connection.
	 */
	public void drop() {
		this.loggedIn = false;
		this.closed = true;
	}

	public <T> void emit(@NonNull Event<T> event,
											 @Nullable T payload) {
		this.eventEmitter.emit(event, payload);
	}

	@Override
	public void close() {
		this.operations.add("close");
		this.closed = true;
		this.loggedIn = false;
		this.eventEmitter.emit(TransportEvents.END, null);
	}

	@Override
	@NonNull
	public Boolean isClosed() {
		return this.closed;
	}

	@Override
	@NonNull
	public Boolean isLoggedIn() {
		return this.loggedIn;
	}

	@Override
	@NonNull
	public TransportRequest newRequest(@NonNull String sql,
																		 @NonNull Consumer<@Nullable Throwable> callback) {
		FakeTransportRequest request = new FakeTransportRequest(sql, callback);
		this.requests.add(request);
		return request;
	}

	@Override
	public void execSql(@NonNull TransportRequest request) {
		dispatch("execSql", request);
	}

	@Override
	public void execSqlBatch(@NonNull TransportRequest request) {
		dispatch("execSqlBatch", request);
	}

	@Override
	public void callProcedure(@NonNull TransportRequest request) {
		dispatch("callProcedure", request);
	}

	@Override
	public void beginTransaction(@NonNull Consumer<@Nullable Throwable> callback,
															 @NonNull String name,
															 @NonNull TransactionIsolation isolation) {
		control("begin", format("begin:%s", isolation.name()), callback);
	}

	@Override
	public void saveTransaction(@NonNull Consumer<@Nullable Throwable> callback,
															@NonNull String name) {
		control("save", format("save:%s", name), callback);
	}

	@Override
	public void commitTransaction(@NonNull Consumer<@Nullable Throwable> callback) {
		control("commit", "commit", callback);
	}

	@Override
	public void rollbackTransaction(@NonNull Consumer<@Nullable Throwable> callback,
																	@Nullable String name) {
		control("rollback", name == null ? "rollback" : format("rollback:%s", name), callback);
	}

	@Override
	@NonNull
	public TransportBulkLoad newBulkLoad(@NonNull String table,
																			 @NonNull BulkLoadOptions options,
																			 @NonNull BiConsumer<@Nullable Throwable, @Nullable Long> callback) {
		BulkLoad bulkLoad = new BulkLoad(table, callback);
		this.bulkLoads.add(bulkLoad);
		return bulkLoad;
	}

	@Override
	public void execBulkLoad(@NonNull TransportBulkLoad bulkLoad) {
		this.operations.add(format("bulk:%s", bulkLoad.getTable()));
		BulkLoad fakeBulkLoad = (BulkLoad) bulkLoad;
		fakeBulkLoad.callback.accept(null, (long) fakeBulkLoad.rows.size());
	}

	@NonNull
	public List<String> getOperations() {
		return this.operations;
	}

	@NonNull
	public List<FakeTransportRequest> getRequests() {
		return this.requests;
	}

	@NonNull
	public List<BulkLoad> getBulkLoads() {
		return this.bulkLoads;
	}

	@Override
	@NonNull
	public <T> Subscription addListener(@NonNull Event<T> event,
																			@NonNull Consumer<? super T> listener) {
		return this.eventEmitter.addListener(event, listener);
	}

	@Override
	@NonNull
	public Boolean removeListener(@NonNull Event<?> event,
																@NonNull Consumer<?> listener) {
		return this.eventEmitter.removeListener(event, listener);
	}

	@Override
	@NonNull
	public List<Consumer<?>> listeners(@NonNull Event<?> event) {
		return this.eventEmitter.listeners(event);
	}

	@Override
	@NonNull
	public Set<Event<?>> eventNames() {
		return this.eventEmitter.eventNames();
	}

	private void dispatch(@NonNull String operation,
												@NonNull TransportRequest request) {
		this.operations.add(format("%s:%s", operation, request.getSql()));
		this.transport.respond((FakeTransportRequest) request);
	}

	private void control(@NonNull String operation,
											 @NonNull String description,
											 @NonNull Consumer<@Nullable Throwable> callback) {
		this.operations.add(description);
		callback.accept(this.transport.controlFailure(operation));
	}

	/**
	 * Bulk load which records its columns and rows.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	public static class BulkLoad implements TransportBulkLoad {
		@NonNull
		private final String table;
		@NonNull
		private final BiConsumer<@Nullable Throwable, @Nullable Long> callback;
		@NonNull
		private final List<String> columns;
		@NonNull
		private final List<Object> rows;
		@Nullable
		private Duration timeout;

		BulkLoad(@NonNull String table,
						 @NonNull BiConsumer<@Nullable Throwable, @Nullable Long> callback) {
			this.table = table;
			this.callback = callback;
			this.columns = new ArrayList<>();
			this.rows = new ArrayList<>();
		}

		@Override
		@NonNull
		public String getTable() {
			return this.table;
		}

		@Override
		public void addColumn(@NonNull String name,
													@NonNull SqlType type,
													@NonNull ParameterOptions options) {
			this.columns.add(name);
		}

		@Override
		public void addRow(@NonNull Map<String, Object> row) {
			this.rows.add(row);
		}

		@Override
		public void addRow(@NonNull List<Object> row) {
			this.rows.add(row);
		}

		@Override
		public void setTimeout(@NonNull Duration timeout) {
			this.timeout = timeout;
		}

		@NonNull
		public List<String> getColumns() {
			return this.columns;
		}

		@NonNull
		public List<Object> getRows() {
			return this.rows;
		}

		@Nullable
		public Duration getTimeout() {
			return this.timeout;
		}
	}
}
