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

import javax.annotation.concurrent.NotThreadSafe;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Thrown when an operation is attempted on a {@link Connection} whose current state does not allow it, which means
 * the caller did not serialize its own use of the connection.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public class ConnectionStateException extends IllegalStateException {
	@NonNull
	private final ConnectionState state;

	public ConnectionStateException(@NonNull String operation,
																	@NonNull ConnectionState state) {
		super(format("Cannot %s while the connection is in state %s", requireNonNull(operation), requireNonNull(state).name()));
		this.state = state;
	}

	/**
	 * @return the state the connection was in when the operation was attempted
	 */
	@NonNull
	public ConnectionState getState() {
		return this.state;
	}
}
