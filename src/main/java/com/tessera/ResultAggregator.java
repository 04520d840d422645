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
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.SEVERE;

/**
 * Runs one {@link Query} as one transport request and assembles the request's event stream into {@link Results}.
 * <p>
 * Results are kept in an ordered list and events always apply to the last one. Statement boundaries open a new
 * {@link Result}; procedure-internal boundaries only do so when the current one holds data. A trailing empty
 * {@link Result} is dropped unless the query is a procedure call.
 * <p>
 * Listeners are attached through a per-execution {@link EventTracker} and detached before the outcome settles, so the
 * pooled connection carries nothing over to its next borrower. Transport events for one request arrive sequentially.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
final class ResultAggregator {
	@NonNull
	private final Connection connection;
	@NonNull
	private final Query query;
	@NonNull
	private final DisplayMode displayMode;
	@NonNull
	private final EventTracker tracker;
	@NonNull
	private final List<Result> results;
	@NonNull
	private final CompletableFuture<Results> resultsFuture;
	@NonNull
	private final AtomicBoolean failureLogged;
	@Nullable
	private TransportRequest request;

	ResultAggregator(@NonNull Connection connection,
									 @NonNull Query query) {
		requireNonNull(connection);
		requireNonNull(query);

		this.connection = connection;
		this.query = query;
		this.displayMode = connection.getConfiguration().getDisplayMode();
		this.tracker = new EventTracker();
		this.results = new ArrayList<>();
		this.results.add(new Result(this.displayMode));
		this.resultsFuture = new CompletableFuture<>();
		this.failureLogged = new AtomicBoolean(false);
	}

	/**
	 * Builds the request, attaches listeners and dispatches it.
	 *
	 * @return a future which completes with the assembled results or fails with a {@link DatabaseException}
	 */
	@NonNull
	CompletableFuture<Results> execute() {
		String statement = getQuery().getStatement().orElseThrow(() ->
				new IllegalStateException("A statement is required before executing a query"));

		try {
			TransportConnection transportConnection = getConnection().requireTransportConnection();
			TransportRequest request = transportConnection.newRequest(statement, this::onRequestCallback);
			this.request = request;

			Duration timeout = getQuery().getTimeout().orElse(getConnection().getConfiguration().getRequestTimeout());
			request.setTimeout(timeout);

			for (Parameter parameter : getQuery().getParameters().values()) {
				if (parameter.isOutput())
					request.addOutputParameter(parameter.getName(), parameter.getType(), parameter.getValue().orElse(null), parameter.getOptions());
				else
					request.addParameter(parameter.getName(), parameter.getType(), parameter.getValue().orElse(null), parameter.getOptions());
			}

			getTracker().registerOn(request, TransportEvents.ERROR, this::onError);
			getTracker().registerOn(request, TransportEvents.COLUMN_METADATA, this::onColumnMetadata);
			getTracker().registerOn(request, TransportEvents.ROW, this::onRow);
			getTracker().registerOn(request, TransportEvents.DONE, this::onDone);
			getTracker().registerOn(request, TransportEvents.DONE_IN_PROC, this::onDoneInProc);
			getTracker().registerOn(request, TransportEvents.DONE_PROC, this::onDoneProc);
			getTracker().registerOn(request, TransportEvents.REQUEST_COMPLETED, this::onRequestCompleted);

			if (getQuery().getMode() == QueryMode.EXEC)
				transportConnection.callProcedure(request);
			else if (getQuery().getMode() == QueryMode.BATCH && getQuery().getParameters().size() == 0)
				transportConnection.execSqlBatch(request);
			else
				transportConnection.execSql(request);
		} catch (RuntimeException e) {
			onError(e);
		}

		return getResultsFuture();
	}

	private void onRequestCallback(@Nullable Throwable error) {
		if (error != null)
			onError(error);
	}

	private void onError(@Nullable Throwable error) {
		DatabaseException failure = error instanceof DatabaseException
				? (DatabaseException) error
				: new DatabaseException(error == null ? "Request failed" : error.getMessage(), error);

		if (getFailureLogged().compareAndSet(false, true))
			getConnection().getLogger().log(SEVERE, format("[%s] Request failed: %s", getConnection().getId(),
					failure.getMessage()), failure);

		detach();
		getResultsFuture().completeExceptionally(failure);
	}

	private void onColumnMetadata(@NonNull List<ColumnMetadata> columns) {
		currentResult().addColumns(columns);
	}

	private void onRow(@NonNull List<ColumnValue> columnValues) {
		currentResult().addRow(columnValues);
	}

	private void onDone(@NonNull DoneToken doneToken) {
		if (doneToken.getMore())
			startResult();
	}

	private void onDoneInProc(@NonNull DoneToken doneToken) {
		// Procedure-internal boundaries often carry no data at all
		if (currentResult().hasData())
			startResult();
	}

	private void onDoneProc(@NonNull DoneToken doneToken) {
		currentResult().setReturnValue(doneToken.getReturnValue().orElse(null));

		if (doneToken.getMore())
			startResult();
		else if (getQuery().getMode() != QueryMode.EXEC && currentResult().isEmpty())
			this.results.remove(this.results.size() - 1);
	}

	private void onRequestCompleted(@Nullable Void ignored) {
		detach();
		getResultsFuture().complete(new Results(this.results));
	}

	private void detach() {
		TransportRequest request = this.request;

		if (request != null)
			getTracker().removeFrom(request, null, true);

		getTracker().dispose();
	}

	@NonNull
	private Result currentResult() {
		if (this.results.size() == 0)
			startResult();

		return this.results.get(this.results.size() - 1);
	}

	private void startResult() {
		this.results.add(new Result(getDisplayMode()));
	}

	@NonNull
	private Connection getConnection() {
		return this.connection;
	}

	@NonNull
	private Query getQuery() {
		return this.query;
	}

	@NonNull
	private DisplayMode getDisplayMode() {
		return this.displayMode;
	}

	@NonNull
	private EventTracker getTracker() {
		return this.tracker;
	}

	@NonNull
	private CompletableFuture<Results> getResultsFuture() {
		return this.resultsFuture;
	}

	@NonNull
	private AtomicBoolean getFailureLogged() {
		return this.failureLogged;
	}
}
