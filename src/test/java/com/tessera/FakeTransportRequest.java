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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * Request created by {@link FakeTransportConnection}. Scripts drive it through its fluent emit helpers.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public class FakeTransportRequest implements TransportRequest {
	@NonNull
	private final String sql;
	@NonNull
	private final Consumer<@Nullable Throwable> callback;
	@NonNull
	private final EventEmitter eventEmitter;
	@NonNull
	private final Map<String, Parameter> parameters;
	@NonNull
	private List<ColumnMetadata> columns;
	@Nullable
	private Duration timeout;

	FakeTransportRequest(@NonNull String sql,
											 @NonNull Consumer<@Nullable Throwable> callback) {
		this.sql = requireNonNull(sql);
		this.callback = requireNonNull(callback);
		this.eventEmitter = new EventEmitter();
		this.parameters = new LinkedHashMap<>();
		this.columns = List.of();
	}

	@NonNull
	public FakeTransportRequest columns(@NonNull String... names) {
		List<ColumnMetadata> columns = new ArrayList<>(names.length);

		for (String name : names)
			columns.add(new ColumnMetadata(name, SqlType.VARCHAR));

		this.columns = columns;
		this.eventEmitter.emit(TransportEvents.COLUMN_METADATA, columns);
		return this;
	}

	@NonNull
	public FakeTransportRequest row(@Nullable Object... values) {
		List<ColumnValue> row = new ArrayList<>(values.length);

		for (int i = 0; i < values.length; ++i)
			row.add(new ColumnValue(this.columns.get(i), values[i]));

		this.eventEmitter.emit(TransportEvents.ROW, row);
		return this;
	}

	@NonNull
	public FakeTransportRequest done(@Nullable Long rowCount,
																	 boolean more) {
		this.eventEmitter.emit(TransportEvents.DONE, new DoneToken(rowCount, more));
		return this;
	}

	@NonNull
	public FakeTransportRequest doneInProc(@Nullable Long rowCount,
																				 boolean more) {
		this.eventEmitter.emit(TransportEvents.DONE_IN_PROC, new DoneToken(rowCount, more));
		return this;
	}

	@NonNull
	public FakeTransportRequest doneProc(@Nullable Long rowCount,
																			 boolean more,
																			 @Nullable Object returnValue) {
		this.eventEmitter.emit(TransportEvents.DONE_PROC, new DoneToken(rowCount, more, returnValue));
		return this;
	}

	/**
	 * Reports a protocol error the way a server does: an error event, then the failed callback, then completion.
	 */
	public void fail(@NonNull Throwable error) {
		this.eventEmitter.emit(TransportEvents.ERROR, error);
		this.callback.accept(error);
		this.eventEmitter.emit(TransportEvents.REQUEST_COMPLETED, null);
	}

	public void complete() {
		this.callback.accept(null);
		this.eventEmitter.emit(TransportEvents.REQUEST_COMPLETED, null);
	}

	@Override
	@NonNull
	public String getSql() {
		return this.sql;
	}

	@Override
	public void addParameter(@NonNull String name,
													 @NonNull SqlType type,
													 @Nullable Object value,
													 @NonNull ParameterOptions options) {
		this.parameters.put(name, new Parameter(name, ParameterDirection.IN, type, value, options));
	}

	@Override
	public void addOutputParameter(@NonNull String name,
																 @NonNull SqlType type,
																 @Nullable Object value,
																 @NonNull ParameterOptions options) {
		this.parameters.put(name, new Parameter(name, ParameterDirection.OUT, type, value, options));
	}

	@Override
	public void setTimeout(@NonNull Duration timeout) {
		this.timeout = timeout;
	}

	@NonNull
	public Map<String, Parameter> getParameters() {
		return this.parameters;
	}

	@Nullable
	public Duration getTimeout() {
		return this.timeout;
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
}
