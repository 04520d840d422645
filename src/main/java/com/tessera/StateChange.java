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
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Payload of {@link ConnectionEvents#STATE_CHANGED}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class StateChange {
	@NonNull
	private final Connection connection;
	@NonNull
	private final ConnectionState previousState;
	@NonNull
	private final ConnectionState currentState;
	@Nullable
	private final Throwable error;

	StateChange(@NonNull Connection connection,
							@NonNull ConnectionState previousState,
							@NonNull ConnectionState currentState,
							@Nullable Throwable error) {
		requireNonNull(connection);
		requireNonNull(previousState);
		requireNonNull(currentState);

		this.connection = connection;
		this.previousState = previousState;
		this.currentState = currentState;
		this.error = error;
	}

	@NonNull
	public Connection getConnection() {
		return this.connection;
	}

	@NonNull
	public ConnectionState getPreviousState() {
		return this.previousState;
	}

	@NonNull
	public ConnectionState getCurrentState() {
		return this.currentState;
	}

	/**
	 * @return the failure which caused this change, e.g. a failed handshake returning the connection to IDLE
	 */
	@NonNull
	public Optional<Throwable> getError() {
		return Optional.ofNullable(this.error);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{connection=%s, %s -> %s, error=%s}", getClass().getSimpleName(), getConnection().getId(),
				getPreviousState().name(), getCurrentState().name(), this.error);
	}
}
