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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
public class ConnectionTests {
	@Test
	public void testConcurrentConnectsShareOneAttempt() {
		FakeTransport transport = new FakeTransport().deferConnect(true);
		Connection connection = new Connection(TesseraConfiguration.withDefaults(), transport);
		AtomicInteger connectedCount = new AtomicInteger();

		connection.addListener(ConnectionEvents.CONNECTED, (ignored) -> connectedCount.incrementAndGet());

		List<CompletableFuture<Connection>> futures = new ArrayList<>();

		for (int i = 0; i < 5; ++i)
			futures.add(connection.connect());

		Assertions.assertEquals(1, transport.getCreateCount());
		Assertions.assertEquals(ConnectionState.CONNECTING, connection.getState());
		Assertions.assertFalse(connection.isLive());

		transport.lastConnection().completeConnect();

		for (CompletableFuture<Connection> future : futures)
			Assertions.assertSame(connection, future.join());

		Assertions.assertEquals(5, connectedCount.get(), "Every caller observes its own connected event");
		Assertions.assertEquals(ConnectionState.IDLE, connection.getState());
		Assertions.assertTrue(connection.isLive());
	}

	@Test
	public void testConnectWhenLive() {
		FakeTransport transport = new FakeTransport();
		Connection connection = new Connection(TesseraConfiguration.withDefaults(), transport);
		AtomicInteger connectedCount = new AtomicInteger();

		connection.connect().join();
		connection.addListener(ConnectionEvents.CONNECTED, (ignored) -> connectedCount.incrementAndGet());

		CompletableFuture<Connection> future = connection.connect();

		Assertions.assertTrue(future.isDone());
		Assertions.assertEquals(1, connectedCount.get());
		Assertions.assertEquals(1, transport.getCreateCount());
	}

	@Test
	public void testFailedConnectFailsEveryCaller() {
		FakeTransport transport = new FakeTransport().deferConnect(true);
		Connection connection = new Connection(TesseraConfiguration.withDefaults(), transport);

		CompletableFuture<Connection> first = connection.connect();
		CompletableFuture<Connection> second = connection.connect();
		CompletableFuture<StateChange> transition = connection.awaitNextTransition();

		transport.lastConnection().failConnect(new RuntimeException("Connection refused"));

		CompletionException firstException = Assertions.assertThrows(CompletionException.class, first::join);
		CompletionException secondException = Assertions.assertThrows(CompletionException.class, second::join);
		CompletionException transitionException = Assertions.assertThrows(CompletionException.class, transition::join);

		Assertions.assertTrue(firstException.getCause() instanceof DatabaseException);
		Assertions.assertSame(firstException.getCause(), secondException.getCause());
		Assertions.assertSame(firstException.getCause(), transitionException.getCause());
		Assertions.assertEquals("Connection refused", firstException.getCause().getCause().getMessage());

		Assertions.assertEquals(ConnectionState.IDLE, connection.getState());
		Assertions.assertFalse(connection.isLive());
		Assertions.assertTrue(transport.lastConnection().getOperations().contains("close"),
				"The failed transport connection is discarded");

		// A later attempt starts over
		transport.deferConnect(false);
		Assertions.assertSame(connection, connection.connect().join());
		Assertions.assertEquals(2, transport.getCreateCount());
	}

	@Test
	public void testStateGuards() {
		Connection connection = new Connection(TesseraConfiguration.withDefaults(), new FakeTransport());

		connection.connect().join();
		connection.beginExecution();

		ConnectionStateException exception = Assertions.assertThrows(ConnectionStateException.class, connection::connect);

		Assertions.assertEquals(ConnectionState.EXECUTING, exception.getState());
		Assertions.assertThrows(ConnectionStateException.class, connection::disconnect);
		Assertions.assertThrows(ConnectionStateException.class, connection::beginTransaction);

		connection.endExecution();

		Assertions.assertEquals(ConnectionState.IDLE, connection.getState());
		Assertions.assertFalse(connection.transitionTo(ConnectionState.IDLE, null), "Self transitions are not legal");
	}

	@Test
	public void testDisconnect() {
		FakeTransport transport = new FakeTransport();
		Connection connection = new Connection(TesseraConfiguration.withDefaults(), transport);
		List<String> events = new CopyOnWriteArrayList<>();

		connection.addListener(ConnectionEvents.DISCONNECTING, (ignored) -> events.add("disconnecting"));
		connection.addListener(ConnectionEvents.DISCONNECTED, (ignored) -> events.add("disconnected"));
		connection.addListener(ConnectionEvents.STATE_CHANGED, (stateChange) ->
				events.add(stateChange.getPreviousState() + "->" + stateChange.getCurrentState()));

		connection.connect().join();
		events.clear();

		Assertions.assertSame(connection, connection.disconnect().join());
		Assertions.assertEquals(List.of("IDLE->DISCONNECTING", "disconnecting", "DISCONNECTING->IDLE", "disconnected"), events);
		Assertions.assertFalse(connection.isLive());
		Assertions.assertEquals(List.of("connect", "close"), transport.lastConnection().getOperations());

		events.clear();
		connection.disconnect().join();

		Assertions.assertEquals(List.of("disconnected"), events, "Disconnecting a closed connection settles immediately");
	}

	@Test
	public void testDroppedConnectionReconnects() {
		FakeTransport transport = new FakeTransport();
		Connection connection = new Connection(TesseraConfiguration.withDefaults(), transport);

		connection.connect().join();
		transport.lastConnection().drop();

		Assertions.assertFalse(connection.isLive());

		connection.connect().join();

		Assertions.assertTrue(connection.isLive());
		Assertions.assertEquals(2, transport.getCreateCount());
	}

	@Test
	public void testRelayListenersDoNotAccumulateAcrossReconnects() {
		FakeTransport transport = new FakeTransport();
		Connection connection = new Connection(TesseraConfiguration.withDefaults(), transport);

		connection.connect().join();

		FakeTransportConnection firstTransportConnection = transport.lastConnection();
		int registrationCount = connection.getRelayTracker().getRegistrations().size();

		Assertions.assertTrue(registrationCount > 0);

		for (int i = 0; i < 10; ++i) {
			connection.disconnect().join();
			connection.connect().join();
		}

		Assertions.assertEquals(registrationCount, connection.getRelayTracker().getRegistrations().size());
		Assertions.assertTrue(firstTransportConnection.eventNames().isEmpty(), "Closed transport keeps no listeners");

		for (int i = 0; i < 10; ++i) {
			FakeTransportConnection droppedTransportConnection = transport.lastConnection();
			droppedTransportConnection.drop();
			connection.connect().join();

			Assertions.assertTrue(droppedTransportConnection.eventNames().isEmpty(), "Dropped transport keeps no listeners");
		}

		Assertions.assertEquals(registrationCount, connection.getRelayTracker().getRegistrations().size());
		Assertions.assertEquals(21, transport.getCreateCount());
	}

	@Test
	public void testListenerFailuresAreContained() {
		Connection connection = new Connection(TesseraConfiguration.withDefaults(), new FakeTransport());

		connection.addListener(ConnectionEvents.CONNECTED, (ignored) -> {
			throw new IllegalStateException("Listener failure");
		});

		Assertions.assertSame(connection, connection.connect().join());
		Assertions.assertTrue(connection.isLive());
	}

	@Test
	public void testDebugRelay() {
		List<String> messages = new CopyOnWriteArrayList<>();
		Logger logger = Logger.getLogger(ConnectionTests.class.getName() + ".debug");
		logger.setUseParentHandlers(false);
		logger.setLevel(Level.ALL);
		logger.addHandler(new Handler() {
			@Override
			public void publish(LogRecord record) {
				messages.add(record.getMessage());
			}

			@Override
			public void flush() {
				// Nothing to do
			}

			@Override
			public void close() {
				// Nothing to do
			}
		});

		FakeTransport transport = new FakeTransport();
		TesseraConfiguration configuration = TesseraConfiguration.builder().debug(true).build();
		Connection connection = new Connection(configuration, transport, logger);

		connection.connect().join();
		transport.lastConnection().emit(TransportEvents.DEBUG, "packet sent");

		Assertions.assertTrue(messages.stream().anyMatch(message -> message.endsWith("packet sent")));
	}
}
