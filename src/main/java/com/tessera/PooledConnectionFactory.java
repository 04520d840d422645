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

import org.apache.commons.pool2.BasePooledObjectFactory;
import org.apache.commons.pool2.PooledObject;
import org.apache.commons.pool2.impl.DefaultPooledObject;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.util.concurrent.CompletionException;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.FINE;
import static java.util.logging.Level.WARNING;

/**
 * Creates, destroys and validates pooled {@link Connection}s.
 * <p>
 * Every connection is bound to the shared configuration, transport and logger and is connected before the pool hands
 * it out.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
class PooledConnectionFactory extends BasePooledObjectFactory<Connection> {
	@NonNull
	private final TesseraConfiguration configuration;
	@NonNull
	private final Transport transport;
	@NonNull
	private final ConnectionValidator connectionValidator;
	@NonNull
	private final Logger logger;

	PooledConnectionFactory(@NonNull TesseraConfiguration configuration,
													@NonNull Transport transport,
													@NonNull ConnectionValidator connectionValidator,
													@NonNull Logger logger) {
		requireNonNull(configuration);
		requireNonNull(transport);
		requireNonNull(connectionValidator);
		requireNonNull(logger);

		this.configuration = configuration;
		this.transport = transport;
		this.connectionValidator = connectionValidator;
		this.logger = logger;
	}

	@Override
	public Connection create() throws Exception {
		Connection connection = new Connection(getConfiguration(), getTransport(), getLogger());

		try {
			connection.connect().join();
		} catch (CompletionException e) {
			if (e.getCause() instanceof Exception)
				throw (Exception) e.getCause();

			throw e;
		}

		getLogger().log(FINE, format("[%s] Created pooled connection", connection.getId()));

		return connection;
	}

	@Override
	public PooledObject<Connection> wrap(Connection connection) {
		return new DefaultPooledObject<>(connection);
	}

	@Override
	public void destroyObject(PooledObject<Connection> pooledObject) throws Exception {
		Connection connection = pooledObject.getObject();

		try {
			connection.disconnect().join();
		} catch (CompletionException | IllegalStateException e) {
			// The pool is discarding this connection either way
			getLogger().log(WARNING, format("[%s] Unable to cleanly disconnect pooled connection", connection.getId()), e);
		}
	}

	@Override
	public boolean validateObject(PooledObject<Connection> pooledObject) {
		Connection connection = pooledObject.getObject();

		try {
			return getConnectionValidator().validate(connection);
		} catch (RuntimeException e) {
			getLogger().log(WARNING, format("[%s] Connection validation failed", connection.getId()), e);
			return false;
		}
	}

	@NonNull
	TesseraConfiguration getConfiguration() {
		return this.configuration;
	}

	@NonNull
	Transport getTransport() {
		return this.transport;
	}

	@NonNull
	ConnectionValidator getConnectionValidator() {
		return this.connectionValidator;
	}

	@NonNull
	Logger getLogger() {
		return this.logger;
	}
}
