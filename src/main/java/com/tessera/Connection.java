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

import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;
import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.FINE;
import static java.util.logging.Level.SEVERE;
import static java.util.logging.Level.WARNING;

/**
 * One physical database connection and its lifecycle.
 * <p>
 * A {@code Connection} owns its {@link TransportConnection} and moves through the {@link ConnectionState} graph.
 * Concurrent {@link #connect()} (or {@link #disconnect()}) calls coalesce: exactly one underlying attempt is in flight
 * and every caller observes its outcome. Executions must be serialized by the caller; the pool hands a connection to
 * one borrower at a time.
 * <p>
 * Lifecycle notifications are published as {@link ConnectionEvents}. Listener failures are logged, never propagated.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public class Connection implements EventSource {
	@NonNull
	private static final SecureRandom ID_GENERATOR;

	static {
		ID_GENERATOR = new SecureRandom();
	}

	@NonNull
	private final String id;
	@NonNull
	private final TesseraConfiguration configuration;
	@NonNull
	private final Transport transport;
	@NonNull
	private final Logger logger;
	@NonNull
	private final EventEmitter eventEmitter;
	@NonNull
	private final EventTracker relayTracker;
	@NonNull
	private final ReentrantLock lock;
	@NonNull
	@GuardedBy("lock")
	private ConnectionState state;
	@Nullable
	@GuardedBy("lock")
	private TransportConnection transportConnection;
	@NonNull
	@GuardedBy("lock")
	private CompletableFuture<StateChange> nextTransition;

	public Connection(@NonNull TesseraConfiguration configuration,
										@NonNull Transport transport) {
		this(configuration, transport, Logger.getLogger(Connection.class.getName()));
	}

	public Connection(@NonNull TesseraConfiguration configuration,
										@NonNull Transport transport,
										@NonNull Logger logger) {
		requireNonNull(configuration);
		requireNonNull(transport);
		requireNonNull(logger);

		this.id = generateId();
		this.configuration = configuration;
		this.transport = transport;
		this.logger = logger;
		this.eventEmitter = new EventEmitter();
		this.relayTracker = new EventTracker();
		this.lock = new ReentrantLock();
		this.state = ConnectionState.IDLE;
		this.nextTransition = new CompletableFuture<>();
	}

	/**
	 * Ensures this connection is live.
	 * <p>
	 * If it already is, {@link ConnectionEvents#CONNECTED} is emitted and the returned future is already complete.
	 * If another caller's attempt is in flight, this caller adopts that attempt's outcome.
	 *
	 * @return a future which completes with this connection once connected
	 * @throws ConnectionStateException if the connection is executing, transacting or disconnecting
	 */
	@NonNull
	public CompletableFuture<Connection> connect() {
		Transition connectingTransition;
		TransportConnection staleTransportConnection;

		getLock().lock();

		try {
			if (this.state == ConnectionState.CONNECTING)
				return this.nextTransition.thenApply(stateChange -> {
					emitSafely(ConnectionEvents.CONNECTED, this);
					return this;
				});

			if (this.state != ConnectionState.IDLE)
				throw new ConnectionStateException("connect", this.state);

			if (isLiveUnderLock()) {
				connectingTransition = null;
				staleTransportConnection = null;
			} else {
				connectingTransition = applyTransition(ConnectionState.CONNECTING, null);
				staleTransportConnection = this.transportConnection;
				this.transportConnection = null;
			}
		} finally {
			getLock().unlock();
		}

		if (connectingTransition == null) {
			emitSafely(ConnectionEvents.CONNECTED, this);
			return CompletableFuture.completedFuture(this);
		}

		publish(connectingTransition);
		emitSafely(ConnectionEvents.CONNECTING, this);

		if (staleTransportConnection != null)
			discardTransportConnection(staleTransportConnection);

		return performConnect();
	}

	/**
	 * Closes the underlying transport connection and waits for its acknowledgment.
	 *
	 * @return a future which completes with this connection once disconnected
	 * @throws ConnectionStateException if the connection is executing, transacting or connecting
	 */
	@NonNull
	public CompletableFuture<Connection> disconnect() {
		Transition disconnectingTransition;
		TransportConnection currentTransportConnection;

		getLock().lock();

		try {
			if (this.state == ConnectionState.DISCONNECTING)
				return this.nextTransition.thenApply(stateChange -> {
					emitSafely(ConnectionEvents.DISCONNECTED, this);
					return this;
				});

			if (this.state != ConnectionState.IDLE)
				throw new ConnectionStateException("disconnect", this.state);

			currentTransportConnection = this.transportConnection;

			if (currentTransportConnection == null || currentTransportConnection.isClosed()) {
				disconnectingTransition = null;
				this.transportConnection = null;
			} else {
				disconnectingTransition = applyTransition(ConnectionState.DISCONNECTING, null);
			}
		} finally {
			getLock().unlock();
		}

		if (disconnectingTransition == null) {
			if (currentTransportConnection != null)
				detachRelayListeners(currentTransportConnection);

			emitSafely(ConnectionEvents.DISCONNECTED, this);
			return CompletableFuture.completedFuture(this);
		}

		publish(disconnectingTransition);
		emitSafely(ConnectionEvents.DISCONNECTING, this);

		return performDisconnect(currentTransportConnection);
	}

	/**
	 * Waits for the next state change of this connection.
	 *
	 * @return a future which completes with the next change, or fails with the error the change carried
	 */
	@NonNull
	public CompletableFuture<StateChange> awaitNextTransition() {
		getLock().lock();

		try {
			return this.nextTransition.copy();
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Moves this connection to {@code target} if the state graph allows it, emitting
	 * {@link ConnectionEvents#STATE_CHANGED} and settling {@link #awaitNextTransition()} waiters.
	 *
	 * @param target the state to move to
	 * @param error  the failure which caused the change, if any
	 * @return {@code true} if the transition happened, {@code false} if it was not legal from the current state
	 */
	@NonNull
	protected Boolean transitionTo(@NonNull ConnectionState target,
																 @Nullable Throwable error) {
		requireNonNull(target);

		Transition transition;

		getLock().lock();

		try {
			transition = applyTransition(target, error);
		} finally {
			getLock().unlock();
		}

		if (transition == null)
			return false;

		publish(transition);
		return true;
	}

	/**
	 * Is there an open, logged-in transport connection?
	 *
	 * @return {@code true} if this connection is live, {@code false} otherwise
	 */
	@NonNull
	public Boolean isLive() {
		getLock().lock();

		try {
			return isLiveUnderLock();
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	public String getId() {
		return this.id;
	}

	@NonNull
	public ConnectionState getState() {
		getLock().lock();

		try {
			return this.state;
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	public TesseraConfiguration getConfiguration() {
		return this.configuration;
	}

	@NonNull
	public Logger getLogger() {
		return this.logger;
	}

	@Override
	@NonNull
	public <T> Subscription addListener(@NonNull Event<T> event,
																			@NonNull Consumer<? super T> listener) {
		return getEventEmitter().addListener(event, listener);
	}

	@Override
	@NonNull
	public Boolean removeListener(@NonNull Event<?> event,
																@NonNull Consumer<?> listener) {
		return getEventEmitter().removeListener(event, listener);
	}

	@Override
	@NonNull
	public List<Consumer<?>> listeners(@NonNull Event<?> event) {
		return getEventEmitter().listeners(event);
	}

	@Override
	@NonNull
	public Set<Event<?>> eventNames() {
		return getEventEmitter().eventNames();
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{id=%s, state=%s}", getClass().getSimpleName(), getId(), getState().name());
	}

	void beginExecution() {
		begin(ConnectionState.EXECUTING, "execute");
	}

	void endExecution() {
		end(ConnectionState.EXECUTING);
	}

	void beginTransaction() {
		begin(ConnectionState.TRANSACTING, "begin a transaction");
	}

	void endTransaction() {
		end(ConnectionState.TRANSACTING);
	}

	/**
	 * @return the live transport connection
	 * @throws IllegalStateException if this connection is not connected
	 */
	@NonNull
	TransportConnection requireTransportConnection() {
		getLock().lock();

		try {
			if (this.transportConnection == null)
				throw new IllegalStateException(format("Connection %s is not connected", getId()));

			return this.transportConnection;
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	private CompletableFuture<Connection> performConnect() {
		CompletableFuture<Connection> connectFuture = new CompletableFuture<>();
		TransportConnection newTransportConnection;

		try {
			newTransportConnection = getTransport().createConnection(getConfiguration());
		} catch (RuntimeException e) {
			failConnect(connectFuture, null, e);
			return connectFuture;
		}

		EventTracker handshakeTracker = new EventTracker();
		AtomicBoolean settled = new AtomicBoolean(false);

		Consumer<Void> connectListener = (ignored) -> {
			if (!settled.compareAndSet(false, true))
				return;

			handshakeTracker.dispose();

			getLock().lock();

			try {
				this.transportConnection = newTransportConnection;
			} finally {
				getLock().unlock();
			}

			attachRelayListeners(newTransportConnection);
			getLogger().log(FINE, format("[%s] Connected to server %s", getId(), getConfiguration().getServer()));

			transitionTo(ConnectionState.IDLE, null);
			emitSafely(ConnectionEvents.CONNECTED, this);
			connectFuture.complete(this);
		};

		Consumer<Throwable> errorListener = (error) -> {
			if (!settled.compareAndSet(false, true))
				return;

			handshakeTracker.dispose();
			failConnect(connectFuture, newTransportConnection, error);
		};

		handshakeTracker.registerOn(newTransportConnection, TransportEvents.CONNECT, connectListener);
		handshakeTracker.registerOn(newTransportConnection, TransportEvents.ERROR, errorListener);

		try {
			newTransportConnection.connect();
		} catch (RuntimeException e) {
			errorListener.accept(e);
		}

		return connectFuture;
	}

	private void failConnect(@NonNull CompletableFuture<Connection> connectFuture,
													 @Nullable TransportConnection failedTransportConnection,
													 @Nullable Throwable error) {
		Throwable failure = error instanceof DatabaseException
				? error
				: new DatabaseException(format("Unable to connect to server %s", getConfiguration().getServer()), error);

		getLogger().log(SEVERE, format("[%s] Unable to connect to server %s", getId(), getConfiguration().getServer()), failure);

		if (failedTransportConnection != null)
			discardTransportConnection(failedTransportConnection);

		transitionTo(ConnectionState.IDLE, failure);
		connectFuture.completeExceptionally(failure);
	}

	@NonNull
	private CompletableFuture<Connection> performDisconnect(@NonNull TransportConnection closingTransportConnection) {
		requireNonNull(closingTransportConnection);

		CompletableFuture<Connection> disconnectFuture = new CompletableFuture<>();
		EventTracker closeTracker = new EventTracker();
		AtomicBoolean settled = new AtomicBoolean(false);

		Consumer<Void> endListener = (ignored) -> {
			if (!settled.compareAndSet(false, true))
				return;

			closeTracker.dispose();
			detachRelayListeners(closingTransportConnection);

			getLock().lock();

			try {
				if (this.transportConnection == closingTransportConnection)
					this.transportConnection = null;
			} finally {
				getLock().unlock();
			}

			transitionTo(ConnectionState.IDLE, null);
			emitSafely(ConnectionEvents.DISCONNECTED, this);
			disconnectFuture.complete(this);
		};

		closeTracker.registerOn(closingTransportConnection, TransportEvents.END, endListener);

		try {
			closingTransportConnection.close();
		} catch (RuntimeException e) {
			if (settled.compareAndSet(false, true)) {
				closeTracker.dispose();
				detachRelayListeners(closingTransportConnection);

				getLock().lock();

				try {
					if (this.transportConnection == closingTransportConnection)
						this.transportConnection = null;
				} finally {
					getLock().unlock();
				}

				DatabaseException failure = new DatabaseException(format("Unable to close connection %s", getId()), e);
				transitionTo(ConnectionState.IDLE, failure);
				disconnectFuture.completeExceptionally(failure);
			}
		}

		return disconnectFuture;
	}

	private void attachRelayListeners(@NonNull TransportConnection relayedTransportConnection) {
		requireNonNull(relayedTransportConnection);

		getRelayTracker().registerOn(relayedTransportConnection, TransportEvents.ERROR, (error) ->
				getLogger().log(SEVERE, format("[%s] Connection error", getId()), error));

		getRelayTracker().registerOn(relayedTransportConnection, TransportEvents.END, (ignored) ->
				getLogger().log(FINE, format("[%s] Disconnected from server %s", getId(), getConfiguration().getServer())));

		if (getConfiguration().getDebug()) {
			getRelayTracker().registerOn(relayedTransportConnection, TransportEvents.DEBUG, (message) ->
					getLogger().log(FINE, format("[%s] %s", getId(), message)));
			getRelayTracker().registerOn(relayedTransportConnection, TransportEvents.INFO, (message) ->
					getLogger().log(FINE, format("[%s] %s", getId(), message)));
		}
	}

	private void detachRelayListeners(@NonNull TransportConnection relayedTransportConnection) {
		requireNonNull(relayedTransportConnection);
		getRelayTracker().removeFrom(relayedTransportConnection, null, true);
	}

	private void discardTransportConnection(@NonNull TransportConnection staleTransportConnection) {
		requireNonNull(staleTransportConnection);

		detachRelayListeners(staleTransportConnection);

		try {
			if (!staleTransportConnection.isClosed())
				staleTransportConnection.close();
		} catch (RuntimeException e) {
			getLogger().log(WARNING, format("[%s] Unable to close stale transport connection", getId()), e);
		}
	}

	private void begin(@NonNull ConnectionState target,
										 @NonNull String operation) {
		Transition transition;

		getLock().lock();

		try {
			if (this.state != ConnectionState.IDLE)
				throw new ConnectionStateException(operation, this.state);

			transition = applyTransition(target, null);
		} finally {
			getLock().unlock();
		}

		if (transition != null)
			publish(transition);
	}

	private void end(@NonNull ConnectionState expectedState) {
		Transition transition = null;

		getLock().lock();

		try {
			if (this.state == expectedState)
				transition = applyTransition(ConnectionState.IDLE, null);
		} finally {
			getLock().unlock();
		}

		if (transition != null)
			publish(transition);
	}

	// Caller must hold the lock
	@Nullable
	private Transition applyTransition(@NonNull ConnectionState target,
																		 @Nullable Throwable error) {
		if (!this.state.canTransitionTo(target))
			return null;

		StateChange stateChange = new StateChange(this, this.state, target, error);
		CompletableFuture<StateChange> completedTransition = this.nextTransition;

		this.state = target;
		this.nextTransition = new CompletableFuture<>();

		return new Transition(stateChange, completedTransition);
	}

	private void publish(@NonNull Transition transition) {
		requireNonNull(transition);

		StateChange stateChange = transition.getStateChange();

		getLogger().log(FINE, format("[%s] %s -> %s", getId(), stateChange.getPreviousState().name(),
				stateChange.getCurrentState().name()));

		emitSafely(ConnectionEvents.STATE_CHANGED, stateChange);

		if (stateChange.getError().isPresent())
			transition.getFuture().completeExceptionally(stateChange.getError().get());
		else
			transition.getFuture().complete(stateChange);
	}

	// Caller must hold the lock
	@NonNull
	private Boolean isLiveUnderLock() {
		return this.transportConnection != null
				&& !this.transportConnection.isClosed()
				&& this.transportConnection.isLoggedIn();
	}

	private <T> void emitSafely(@NonNull Event<T> event,
															@Nullable T payload) {
		try {
			getEventEmitter().emit(event, payload);
		} catch (RuntimeException e) {
			getLogger().log(WARNING, format("[%s] Listener for '%s' failed", getId(), event.getName()), e);
		}
	}

	@NonNull
	private static String generateId() {
		byte[] bytes = new byte[16];
		ID_GENERATOR.nextBytes(bytes);
		return HexFormat.of().formatHex(bytes);
	}

	@NonNull
	private Transport getTransport() {
		return this.transport;
	}

	@NonNull
	private EventEmitter getEventEmitter() {
		return this.eventEmitter;
	}

	@NonNull
	EventTracker getRelayTracker() {
		return this.relayTracker;
	}

	@NonNull
	private ReentrantLock getLock() {
		return this.lock;
	}

	@ThreadSafe
	private static final class Transition {
		@NonNull
		private final StateChange stateChange;
		@NonNull
		private final CompletableFuture<StateChange> future;

		private Transition(@NonNull StateChange stateChange,
											 @NonNull CompletableFuture<StateChange> future) {
			this.stateChange = stateChange;
			this.future = future;
		}

		@NonNull
		public StateChange getStateChange() {
			return this.stateChange;
		}

		@NonNull
		public CompletableFuture<StateChange> getFuture() {
			return this.future;
		}
	}
}
