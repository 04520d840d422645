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

import java.util.List;

/**
 * Events a {@link Transport} emits on its connections and requests.
 * <p>
 * Request events are emitted on a {@link TransportRequest}, connection events on a {@link TransportConnection}.
 * {@link #ERROR} is shared by both.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
public final class TransportEvents {
	/**
	 * A protocol error, such as a syntax error, constraint violation or timeout.
	 */
	@NonNull
	public static final Event<Throwable> ERROR;

	/**
	 * Column descriptions for the rows which follow.
	 */
	@NonNull
	public static final Event<List<ColumnMetadata>> COLUMN_METADATA;
	@NonNull
	public static final Event<List<ColumnValue>> ROW;
	/**
	 * A statement outside of a procedure completed.
	 */
	@NonNull
	public static final Event<DoneToken> DONE;
	/**
	 * A statement inside a procedure completed.
	 */
	@NonNull
	public static final Event<DoneToken> DONE_IN_PROC;
	/**
	 * A procedure completed, carrying its return value.
	 */
	@NonNull
	public static final Event<DoneToken> DONE_PROC;
	/**
	 * The request finished, successfully or not. Always the last event of a request.
	 */
	@NonNull
	public static final Event<Void> REQUEST_COMPLETED;

	/**
	 * The connection handshake and login completed.
	 */
	@NonNull
	public static final Event<Void> CONNECT;
	/**
	 * The connection was closed, by either side.
	 */
	@NonNull
	public static final Event<Void> END;
	@NonNull
	public static final Event<String> DEBUG;
	/**
	 * Informational messages from the server, such as {@code PRINT} output.
	 */
	@NonNull
	public static final Event<String> INFO;

	static {
		ERROR = Event.named("error");
		COLUMN_METADATA = Event.named("columnMetadata");
		ROW = Event.named("row");
		DONE = Event.named("done");
		DONE_IN_PROC = Event.named("doneInProc");
		DONE_PROC = Event.named("doneProc");
		REQUEST_COMPLETED = Event.named("requestCompleted");
		CONNECT = Event.named("connect");
		END = Event.named("end");
		DEBUG = Event.named("debug");
		INFO = Event.named("infoMessage");
	}

	private TransportEvents() {
		// Non-instantiable
	}
}
