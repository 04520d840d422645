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

/**
 * Lifecycle events emitted by a {@link Connection}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
public final class ConnectionEvents {
	@NonNull
	public static final Event<Connection> CONNECTING;
	/**
	 * Emitted once per {@link Connection#connect()} caller, including callers which joined an attempt already in flight
	 * and callers of an already-live connection.
	 */
	@NonNull
	public static final Event<Connection> CONNECTED;
	@NonNull
	public static final Event<Connection> DISCONNECTING;
	@NonNull
	public static final Event<Connection> DISCONNECTED;
	@NonNull
	public static final Event<StateChange> STATE_CHANGED;

	static {
		CONNECTING = Event.named("connecting");
		CONNECTED = Event.named("connected");
		DISCONNECTING = Event.named("disconnecting");
		DISCONNECTED = Event.named("disconnected");
		STATE_CHANGED = Event.named("stateChanged");
	}

	private ConnectionEvents() {
		// Non-instantiable
	}
}
