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

package com.tessera.jdbc;

import com.tessera.Event;
import com.tessera.EventEmitter;
import com.tessera.ParameterOptions;
import com.tessera.SqlType;
import com.tessera.Subscription;
import com.tessera.TransportRequest;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A request created by {@link JdbcTransportConnection}, carrying its statement, parameters and timeout.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
class JdbcTransportRequest implements TransportRequest {
	@NonNull
	private final String sql;
	@NonNull
	private final Consumer<@Nullable Throwable> callback;
	@NonNull
	private final EventEmitter eventEmitter;
	@NonNull
	private final Map<String, JdbcParameter> parameters;
	@Nullable
	private Duration timeout;

	JdbcTransportRequest(@NonNull String sql,
											 @NonNull Consumer<@Nullable Throwable> callback) {
		requireNonNull(sql);
		requireNonNull(callback);

		this.sql = sql;
		this.callback = callback;
		this.eventEmitter = new EventEmitter();
		this.parameters = new LinkedHashMap<>();
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
		requireNonNull(name);
		requireNonNull(type);
		requireNonNull(options);

		this.parameters.put(name, new JdbcParameter(name, type, value, false));
	}

	@Override
	public void addOutputParameter(@NonNull String name,
																 @NonNull SqlType type,
																 @Nullable Object value,
																 @NonNull ParameterOptions options) {
		requireNonNull(name);
		requireNonNull(type);
		requireNonNull(options);

		this.parameters.put(name, new JdbcParameter(name, type, value, true));
	}

	@Override
	public void setTimeout(@NonNull Duration timeout) {
		requireNonNull(timeout);
		this.timeout = timeout;
	}

	@NonNull
	Optional<Duration> getTimeout() {
		return Optional.ofNullable(this.timeout);
	}

	@NonNull
	Map<String, JdbcParameter> getParameters() {
		return Collections.unmodifiableMap(this.parameters);
	}

	@NonNull
	Consumer<@Nullable Throwable> getCallback() {
		return this.callback;
	}

	<T> void emit(@NonNull Event<T> event,
								@Nullable T payload) {
		this.eventEmitter.emit(event, payload);
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

	@Override
	@NonNull
	public String toString() {
		return format("%s{sql=%s, parameters=%s}", getClass().getSimpleName(), getSql(), this.parameters.keySet());
	}

	/**
	 * One bound parameter.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 * @since 1.0.0
	 */
	@ThreadSafe
	static final class JdbcParameter {
		@NonNull
		private final String name;
		@NonNull
		private final SqlType type;
		@Nullable
		private final Object value;
		private final boolean output;

		JdbcParameter(@NonNull String name,
									@NonNull SqlType type,
									@Nullable Object value,
									boolean output) {
			this.name = name;
			this.type = type;
			this.value = value;
			this.output = output;
		}

		@NonNull
		String getName() {
			return this.name;
		}

		@NonNull
		SqlType getType() {
			return this.type;
		}

		@Nullable
		Object getValue() {
			return this.value;
		}

		boolean isOutput() {
			return this.output;
		}
	}
}
