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

import org.apache.commons.pool2.impl.GenericObjectPool;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.WARNING;

/**
 * Pool of live {@link Connection}s backed by Apache Commons Pool's {@link GenericObjectPool}.
 * <p>
 * The pool owns slot allocation, idle eviction and sizing. This class only adapts it: acquired connections are
 * connected, released connections go back for reuse and connections which are no longer usable are destroyed.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public class ConnectionPool implements AutoCloseable {
	@NonNull
	private final GenericObjectPool<Connection> objectPool;
	@NonNull
	private final Logger logger;

	public ConnectionPool(@NonNull TesseraConfiguration configuration,
												@NonNull Transport transport) {
		this(configuration, transport, ConnectionValidator.permissive(), Logger.getLogger(ConnectionPool.class.getName()));
	}

	public ConnectionPool(@NonNull TesseraConfiguration configuration,
												@NonNull Transport transport,
												@NonNull ConnectionValidator connectionValidator,
												@NonNull Logger logger) {
		requireNonNull(configuration);
		requireNonNull(transport);
		requireNonNull(connectionValidator);
		requireNonNull(logger);

		this.logger = logger;
		this.objectPool = new GenericObjectPool<>(
				new PooledConnectionFactory(configuration, transport, connectionValidator, logger),
				createObjectPoolConfig(configuration.getPoolConfiguration()));
	}

	@NonNull
	private static GenericObjectPoolConfig<Connection> createObjectPoolConfig(@NonNull PoolConfiguration poolConfiguration) {
		requireNonNull(poolConfiguration);

		GenericObjectPoolConfig<Connection> objectPoolConfig = new GenericObjectPoolConfig<>();
		objectPoolConfig.setMaxTotal(poolConfiguration.getMaxSize());
		objectPoolConfig.setMaxIdle(poolConfiguration.getMaxSize());
		objectPoolConfig.setMinIdle(poolConfiguration.getMinSize());
		objectPoolConfig.setMaxWait(poolConfiguration.getAcquireTimeout());
		objectPoolConfig.setBlockWhenExhausted(true);
		objectPoolConfig.setTestOnBorrow(poolConfiguration.getTestOnBorrow());
		objectPoolConfig.setMinEvictableIdleDuration(poolConfiguration.getIdleTimeout());
		objectPoolConfig.setJmxEnabled(false);

		Duration evictionInterval = poolConfiguration.getEvictionInterval().orElse(null);

		if (evictionInterval != null)
			objectPoolConfig.setTimeBetweenEvictionRuns(evictionInterval);

		return objectPoolConfig;
	}

	/**
	 * Borrows a live connection, creating and connecting one if none is idle.
	 * <p>
	 * Blocks for up to {@link PoolConfiguration#getAcquireTimeout()} when the pool is exhausted.
	 *
	 * @return a live connection, which must later be passed to {@link #release(Connection)} or {@link #destroy(Connection)}
	 * @throws DatabaseException if no connection could be acquired
	 */
	@NonNull
	public Connection acquire() {
		try {
			return getObjectPool().borrowObject();
		} catch (DatabaseException e) {
			throw e;
		} catch (Exception e) {
			throw new DatabaseException("Unable to acquire database connection", e);
		}
	}

	/**
	 * Returns a connection for reuse. Connections which are no longer live are destroyed instead.
	 *
	 * @param connection the connection to return
	 */
	public void release(@NonNull Connection connection) {
		requireNonNull(connection);

		if (!connection.isLive() || connection.getState() != ConnectionState.IDLE) {
			destroy(connection);
			return;
		}

		try {
			getObjectPool().returnObject(connection);
		} catch (RuntimeException e) {
			getLogger().log(WARNING, format("[%s] Unable to return connection to the pool", connection.getId()), e);
		}
	}

	/**
	 * Removes a connection from the pool and disconnects it.
	 *
	 * @param connection the connection to destroy
	 */
	public void destroy(@NonNull Connection connection) {
		requireNonNull(connection);

		try {
			getObjectPool().invalidateObject(connection);
		} catch (Exception e) {
			getLogger().log(WARNING, format("[%s] Unable to destroy pooled connection", connection.getId()), e);
		}
	}

	@NonNull
	public Integer getActiveCount() {
		return getObjectPool().getNumActive();
	}

	@NonNull
	public Integer getIdleCount() {
		return getObjectPool().getNumIdle();
	}

	@NonNull
	public Boolean isClosed() {
		return getObjectPool().isClosed();
	}

	/**
	 * Closes the pool, disconnecting idle connections. Connections still borrowed are destroyed as they are released.
	 */
	@Override
	public void close() {
		getObjectPool().close();
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{active=%d, idle=%d, closed=%s}", getClass().getSimpleName(), getActiveCount(), getIdleCount(), isClosed());
	}

	@NonNull
	protected GenericObjectPool<Connection> getObjectPool() {
		return this.objectPool;
	}

	@NonNull
	protected Logger getLogger() {
		return this.logger;
	}
}
