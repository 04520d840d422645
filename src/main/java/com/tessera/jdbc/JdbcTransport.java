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

import com.tessera.TesseraConfiguration;
import com.tessera.Transport;
import com.tessera.TransportConnection;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import javax.sql.DataSource;
import java.util.concurrent.Executor;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * {@link Transport} which opens connections from a JDBC {@link DataSource}.
 * <p>
 * By default all work runs on the calling thread, so futures returned by the session layer are already settled when
 * they are handed back. Supply an {@link Executor} to run JDBC work elsewhere.
 * <p>
 * Differences from a native protocol transport:
 * <ul>
 *   <li>{@code @name} markers are rewritten to positional JDBC parameters</li>
 *   <li>raw batches are split into statements and run one at a time</li>
 *   <li>procedures run through the JDBC {@code {call ...}} escape; output parameter values are not reported</li>
 *   <li>bulk loads run as a JDBC batch insert, so {@code keepNulls}, {@code fireTriggers}, {@code checkConstraints} and
 *   {@code tableLock} follow the driver's normal insert behavior</li>
 * </ul>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public class JdbcTransport implements Transport {
	@NonNull
	private final DataSource dataSource;
	@NonNull
	private final Executor executor;

	public JdbcTransport(@NonNull DataSource dataSource) {
		this(dataSource, Runnable::run);
	}

	public JdbcTransport(@NonNull DataSource dataSource,
											 @NonNull Executor executor) {
		requireNonNull(dataSource);
		requireNonNull(executor);

		this.dataSource = dataSource;
		this.executor = executor;
	}

	@Override
	@NonNull
	public TransportConnection createConnection(@NonNull TesseraConfiguration configuration) {
		requireNonNull(configuration);
		return new JdbcTransportConnection(getDataSource(), configuration, getExecutor());
	}

	@NonNull
	public DataSource getDataSource() {
		return this.dataSource;
	}

	@NonNull
	public Executor getExecutor() {
		return this.executor;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{dataSource=%s}", getClass().getSimpleName(), getDataSource());
	}
}
