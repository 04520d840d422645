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
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * In-memory {@link Transport} whose connections answer requests from a script.
 * <p>
 * By default connections connect immediately and every request completes with no results.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public class FakeTransport implements Transport {
	@NonNull
	private final AtomicInteger createCount;
	@NonNull
	private final List<FakeTransportConnection> connections;
	@NonNull
	private final Map<String, Throwable> controlFailures;
	@NonNull
	private volatile Consumer<FakeTransportRequest> responder;
	private volatile boolean deferConnect;
	@Nullable
	private volatile Throwable connectFailure;

	public FakeTransport() {
		this.createCount = new AtomicInteger();
		this.connections = new CopyOnWriteArrayList<>();
		this.controlFailures = new ConcurrentHashMap<>();
		this.responder = (request) -> request.done(0L, false).complete();
	}

	@Override
	@NonNull
	public TransportConnection createConnection(@NonNull TesseraConfiguration configuration) {
		requireNonNull(configuration);

		this.createCount.incrementAndGet();
		FakeTransportConnection connection = new FakeTransportConnection(this);
		this.connections.add(connection);

		return connection;
	}

	/**
	 * Scripts how every subsequent request is answered.
	 */
	@NonNull
	public FakeTransport respondWith(@NonNull Consumer<FakeTransportRequest> responder) {
		this.responder = requireNonNull(responder);
		return this;
	}

	/**
	 * When deferred, {@link TransportConnection#connect()} only records the attempt; the test settles it.
	 */
	@NonNull
	public FakeTransport deferConnect(boolean deferConnect) {
		this.deferConnect = deferConnect;
		return this;
	}

	@NonNull
	public FakeTransport failConnectWith(@Nullable Throwable connectFailure) {
		this.connectFailure = connectFailure;
		return this;
	}

	/**
	 * Makes a transaction control operation ({@code begin}, {@code save}, {@code commit} or {@code rollback}) fail.
	 */
	@NonNull
	public FakeTransport failControl(@NonNull String operation,
																	 @NonNull Throwable failure) {
		this.controlFailures.put(operation, failure);
		return this;
	}

	public int getCreateCount() {
		return this.createCount.get();
	}

	@NonNull
	public List<FakeTransportConnection> getConnections() {
		return this.connections;
	}

	@NonNull
	public FakeTransportConnection lastConnection() {
		return this.connections.get(this.connections.size() - 1);
	}

	void respond(@NonNull FakeTransportRequest request) {
		this.responder.accept(request);
	}

	boolean isDeferConnect() {
		return this.deferConnect;
	}

	@Nullable
	Throwable getConnectFailure() {
		return this.connectFailure;
	}

	@Nullable
	Throwable controlFailure(@NonNull String operation) {
		return this.controlFailures.get(operation);
	}
}
