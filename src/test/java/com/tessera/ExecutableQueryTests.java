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

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
public class ExecutableQueryTests {
	@Test
	public void testSingleStatement() {
		FakeTransport transport = new FakeTransport().respondWith((request) ->
				request.columns("name").row("Fred").row("Wilma").done(2L, false).complete());

		try (Tessera tessera = Tessera.withTransport(transport).build()) {
			Results results = tessera.query("SELECT name FROM person").execute();

			Assertions.assertTrue(results.isSingle());
			Assertions.assertEquals(List.of(List.of("Fred"), List.of("Wilma")), results.getSingle().getRows());
			Assertions.assertEquals(List.of("connect", "execSql:SELECT name FROM person"),
					transport.lastConnection().getOperations());
		}
	}

	@Test
	public void testBatchProducesOrderedResults() {
		FakeTransport transport = new FakeTransport().respondWith((request) -> request
				.columns("a").row(1).done(1L, true)
				.columns("b").row(2).done(1L, false)
				.complete());

		try (Tessera tessera = Tessera.withTransport(transport).build()) {
			Results results = tessera.query("SELECT 1 AS a; SELECT 2 AS b").execute();

			Assertions.assertEquals(2, results.size());
			Assertions.assertEquals("a", results.get(0).getColumns().get(0).getName());
			Assertions.assertEquals(List.of(List.of(2)), results.get(1).getRows());
			Assertions.assertEquals("execSqlBatch:SELECT 1 AS a; SELECT 2 AS b", transport.lastConnection().getOperations().get(1));
		}
	}

	@Test
	public void testTrailingEmptyResultDroppedOutsideProcedures() {
		FakeTransport transport = new FakeTransport().respondWith((request) -> request
				.columns("a").row(1).doneInProc(1L, true)
				.doneProc(null, false, 0)
				.complete());

		try (Tessera tessera = Tessera.withTransport(transport).build()) {
			Results queryResults = tessera.query("SELECT 1 AS a").execute();

			Assertions.assertTrue(queryResults.isSingle());

			Results procedureResults = tessera.query("EXEC list_cars").execute();

			Assertions.assertEquals(2, procedureResults.size());
			Assertions.assertTrue(procedureResults.get(1).isEmpty());
			Assertions.assertEquals(0, procedureResults.get(1).getReturnValue().get());
			Assertions.assertEquals("callProcedure:list_cars", transport.lastConnection().getOperations().get(2));
		}
	}

	@Test
	public void testEmptyProcedureBoundariesAreSkipped() {
		FakeTransport transport = new FakeTransport().respondWith((request) -> request
				.doneInProc(0L, true)
				.columns("make").row("Honda").doneInProc(1L, true)
				.doneProc(null, false, 0)
				.complete());

		try (Tessera tessera = Tessera.withTransport(transport).build()) {
			Results results = tessera.query("EXEC list_cars").execute();

			Assertions.assertEquals(2, results.size());
			Assertions.assertEquals(List.of(List.of("Honda")), results.get(0).getRows());
		}
	}

	@Test
	public void testNamedDisplayMode() {
		FakeTransport transport = new FakeTransport().respondWith((request) ->
				request.columns("id", "name").row(1, "Fred").done(1L, false).complete());
		TesseraConfiguration configuration = TesseraConfiguration.builder().displayMode(DisplayMode.NAMED).build();

		try (Tessera tessera = Tessera.withTransport(transport).configuration(configuration).build()) {
			Result result = tessera.query("SELECT id, name FROM person").execute().getSingle();

			Assertions.assertEquals(List.of(Map.of("id", 1, "name", "Fred")), result.getRecords());
		}
	}

	@Test
	public void testParametersAndTimeoutReachTheRequest() {
		FakeTransport transport = new FakeTransport();

		try (Tessera tessera = Tessera.withTransport(transport).build()) {
			tessera.query("SELECT @valid = active FROM person WHERE id = @id")
					.in("id", 5)
					.out("valid", SqlType.BIT)
					.timeout(Duration.ofSeconds(3))
					.execute();

			FakeTransportRequest request = transport.lastConnection().getRequests().get(0);

			Assertions.assertEquals(List.of("id", "valid"), List.copyOf(request.getParameters().keySet()));
			Assertions.assertEquals(SqlType.TINYINT, request.getParameters().get("id").getType());
			Assertions.assertTrue(request.getParameters().get("valid").isOutput());
			Assertions.assertEquals(Duration.ofSeconds(3), request.getTimeout());

			tessera.query("SELECT 1").execute();

			Assertions.assertEquals(tessera.getConfiguration().getRequestTimeout(),
					transport.lastConnection().getRequests().get(1).getTimeout());
		}
	}

	@Test
	public void testQueryIsSnapshottedAtExecution() {
		FakeTransport transport = new FakeTransport();

		try (Tessera tessera = Tessera.withTransport(transport).build()) {
			ExecutableQuery query = tessera.query("SELECT * FROM person WHERE id = @id").in("id", 1);
			CompletableFuture<Results> future = query.executeAsync();

			query.clear();
			future.join();

			Assertions.assertEquals(1, transport.lastConnection().getRequests().get(0).getParameters().size());
		}
	}

	@Test
	public void testRequestErrorReleasesConnection() {
		FakeTransport transport = new FakeTransport()
				.respondWith((request) -> request.fail(new RuntimeException("Invalid object name 'missing'")));

		try (Tessera tessera = Tessera.withTransport(transport).build()) {
			DatabaseException exception = Assertions.assertThrows(DatabaseException.class, () ->
					tessera.query("SELECT * FROM missing").execute());

			Assertions.assertEquals("Invalid object name 'missing'", exception.getMessage());

			FakeTransportRequest request = transport.lastConnection().getRequests().get(0);

			Assertions.assertTrue(request.eventNames().isEmpty(), "No listeners are left on the request");
			Assertions.assertEquals(0, tessera.getConnectionPool().getActiveCount());
			Assertions.assertEquals(1, tessera.getConnectionPool().getIdleCount());

			transport.respondWith((nextRequest) -> nextRequest.done(0L, false).complete());
			tessera.query("SELECT 1").execute();

			Assertions.assertEquals(1, transport.getCreateCount(), "The connection is reused after a request error");
		}
	}

	@Test
	public void testRequestTimeout() {
		RequestTimeoutException timeout = new RequestTimeoutException("Request timed out after PT0.5S");
		FakeTransport transport = new FakeTransport().respondWith((request) -> request.fail(timeout));

		try (Tessera tessera = Tessera.withTransport(transport).build()) {
			RequestTimeoutException exception = Assertions.assertThrows(RequestTimeoutException.class, () ->
					tessera.query("WAITFOR DELAY '00:00:05'").timeout(Duration.ofMillis(500)).execute());

			Assertions.assertSame(timeout, exception);

			FakeTransportRequest request = transport.lastConnection().getRequests().get(0);

			Assertions.assertEquals(Duration.ofMillis(500), request.getTimeout());
			Assertions.assertTrue(request.eventNames().isEmpty(), "No listeners are left on the timed out request");
			Assertions.assertEquals(0, tessera.getConnectionPool().getActiveCount());
		}
	}

	@Test
	public void testAsyncFailure() {
		FakeTransport transport = new FakeTransport()
				.respondWith((request) -> request.fail(new DatabaseException("Deadlock victim")));

		try (Tessera tessera = Tessera.withTransport(transport).build()) {
			CompletableFuture<Results> future = tessera.query("UPDATE person SET name = 'Fred'").executeAsync();
			CompletionException exception = Assertions.assertThrows(CompletionException.class, future::join);

			Assertions.assertTrue(exception.getCause() instanceof DatabaseException);
			Assertions.assertEquals("Deadlock victim", exception.getCause().getMessage());
		}
	}

	@Test
	public void testConnectFailure() {
		FakeTransport transport = new FakeTransport().failConnectWith(new RuntimeException("Login failed"));
		List<StatementLog> statementLogs = new CopyOnWriteArrayList<>();

		try (Tessera tessera = Tessera.withTransport(transport).statementLogger(statementLogs::add).build()) {
			Assertions.assertThrows(DatabaseException.class, () -> tessera.query("SELECT 1").execute());
			Assertions.assertEquals(0, tessera.getConnectionPool().getActiveCount());
			Assertions.assertEquals(1, statementLogs.size());
			Assertions.assertTrue(statementLogs.get(0).getException().isPresent());
			Assertions.assertFalse(statementLogs.get(0).getConnectionId().isPresent());
			Assertions.assertFalse(tessera.ping());
		}
	}

	@Test
	public void testStatementLog() {
		FakeTransport transport = new FakeTransport();
		List<StatementLog> statementLogs = new CopyOnWriteArrayList<>();

		try (Tessera tessera = Tessera.withTransport(transport).statementLogger(statementLogs::add).build()) {
			tessera.query("SELECT * FROM person WHERE id = @id").in("id", 1).execute();

			StatementLog statementLog = statementLogs.get(0);

			Assertions.assertEquals("SELECT * FROM person WHERE id = @id", statementLog.getStatement());
			Assertions.assertEquals(QueryMode.QUERY, statementLog.getMode().get());
			Assertions.assertEquals(1, statementLog.getParameters().size());
			Assertions.assertEquals(1, statementLog.getResultCount().get());
			Assertions.assertTrue(statementLog.getConnectionId().isPresent());
			Assertions.assertTrue(statementLog.getConnectionAcquisitionDuration().isPresent());
			Assertions.assertFalse(statementLog.getException().isPresent());
		}
	}

	@Test
	public void testStatementLoggerFailureIsContained() {
		IllegalStateException loggerFailure = new IllegalStateException("Logger failure");
		FakeTransport transport = new FakeTransport();

		try (Tessera tessera = Tessera.withTransport(transport).statementLogger((statementLog) -> {
			throw loggerFailure;
		}).build()) {
			Assertions.assertTrue(tessera.query("SELECT 1").execute().isSingle());

			transport.respondWith((request) -> request.fail(new DatabaseException("Syntax error")));

			DatabaseException exception = Assertions.assertThrows(DatabaseException.class, () ->
					tessera.query("SELEC 1").execute());

			Assertions.assertEquals("Syntax error", exception.getMessage());
			Assertions.assertTrue(Arrays.asList(exception.getSuppressed()).contains(loggerFailure));
		}
	}

	@Test
	public void testMissingStatement() {
		try (Tessera tessera = Tessera.withTransport(new FakeTransport()).build()) {
			Assertions.assertThrows(IllegalStateException.class, () -> tessera.query().execute());
		}
	}

	@Test
	public void testDestroy() {
		try (Tessera tessera = Tessera.withTransport(new FakeTransport()).build()) {
			Assertions.assertTrue(tessera.ping());

			tessera.destroy();
			tessera.destroy();

			Assertions.assertTrue(tessera.isDestroyed());
			Assertions.assertFalse(tessera.ping());
			Assertions.assertThrows(IllegalStateException.class, () -> tessera.query("SELECT 1"));
			Assertions.assertThrows(IllegalStateException.class, tessera::transaction);
		}
	}
}
