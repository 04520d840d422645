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
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
public class BulkLoaderTests {
	@Test
	public void testConnectionIsAcquiredLazily() {
		FakeTransport transport = new FakeTransport();

		try (Tessera tessera = Tessera.withTransport(transport).build()) {
			BulkLoader bulkLoader = tessera.bulk("person");

			Assertions.assertEquals(0, transport.getCreateCount());

			bulkLoader.column("id", SqlType.INT);

			Assertions.assertEquals(1, transport.getCreateCount());
			Assertions.assertEquals(1, tessera.getConnectionPool().getActiveCount());

			bulkLoader.close();
			bulkLoader.close();

			Assertions.assertEquals(0, tessera.getConnectionPool().getActiveCount());
			Assertions.assertThrows(IllegalStateException.class, bulkLoader::execute, "A closed load cannot be executed");
		}
	}

	@Test
	public void testRowShapes() {
		FakeTransport transport = new FakeTransport();
		List<StatementLog> statementLogs = new CopyOnWriteArrayList<>();

		try (Tessera tessera = Tessera.withTransport(transport).statementLogger(statementLogs::add).build()) {
			Long rowCount = tessera.bulk("person")
					.column("id", SqlType.INT)
					.column("name", SqlType.NVARCHAR, ParameterOptions.builder().length(50).build())
					.add(Map.of("id", 1, "name", "Fred"))
					.add(List.of(2, "Wilma"))
					.add(new Object[]{3, "Barney"})
					.add(null)
					.addAll(Arrays.asList(null, List.of(4, "Betty")))
					.execute();

			Assertions.assertEquals(4L, rowCount);

			FakeTransportConnection.BulkLoad bulkLoad = transport.lastConnection().getBulkLoads().get(0);

			Assertions.assertEquals("person", bulkLoad.getTable());
			Assertions.assertEquals(List.of("id", "name"), bulkLoad.getColumns());
			Assertions.assertEquals(List.of(2, "Wilma"), bulkLoad.getRows().get(1));
			Assertions.assertEquals(List.of(3, "Barney"), bulkLoad.getRows().get(2));
			Assertions.assertTrue(transport.lastConnection().getOperations().contains("bulk:person"));

			Assertions.assertEquals(0, tessera.getConnectionPool().getActiveCount());
			Assertions.assertEquals(1, tessera.getConnectionPool().getIdleCount());

			StatementLog statementLog = statementLogs.get(0);

			Assertions.assertEquals("BULK INSERT person (id, name)", statementLog.getStatement());
			Assertions.assertEquals(4L, statementLog.getRowCount().get());
			Assertions.assertFalse(statementLog.getMode().isPresent());
		}
	}

	@Test
	public void testInvalidRows() {
		try (Tessera tessera = Tessera.withTransport(new FakeTransport()).build();
				 BulkLoader bulkLoader = tessera.bulk("person")) {
			bulkLoader.column("id", SqlType.INT).column("name", SqlType.VARCHAR);

			Assertions.assertThrows(IllegalArgumentException.class, () -> bulkLoader.add("1,Fred"));
			Assertions.assertThrows(IllegalArgumentException.class, () -> bulkLoader.add(List.of(1)));
			Assertions.assertThrows(IllegalArgumentException.class, () -> bulkLoader.add(new Object[]{1, "Fred", true}));
			Assertions.assertThrows(IllegalArgumentException.class, () -> bulkLoader.add(Map.of(1, "Fred")));
		}
	}

	@Test
	public void testColumnRules() {
		try (Tessera tessera = Tessera.withTransport(new FakeTransport()).build()) {
			Assertions.assertThrows(IllegalArgumentException.class, () -> tessera.bulk(" "));

			try (BulkLoader bulkLoader = tessera.bulk("person")) {
				bulkLoader.column("id", SqlType.INT);

				Assertions.assertThrows(IllegalArgumentException.class, () -> bulkLoader.column("id", SqlType.BIGINT));
				Assertions.assertThrows(IllegalArgumentException.class, () -> bulkLoader.column("", SqlType.BIGINT));

				bulkLoader.add(List.of(1));

				Assertions.assertThrows(IllegalStateException.class, () -> bulkLoader.column("name", SqlType.VARCHAR));
				Assertions.assertEquals(List.of("id"), bulkLoader.getColumnNames());
			}

			Assertions.assertEquals(0, tessera.getConnectionPool().getActiveCount());
		}
	}

	@Test
	public void testOptionsAndSingleExecution() {
		FakeTransport transport = new FakeTransport();
		BulkLoadOptions options = BulkLoadOptions.builder().timeout(Duration.ofSeconds(5)).tableLock(true).build();

		try (Tessera tessera = Tessera.withTransport(transport).build()) {
			BulkLoader bulkLoader = tessera.bulk("person", options).column("id", SqlType.INT).add(List.of(1));

			Assertions.assertEquals(1L, bulkLoader.executeAsync().join());
			Assertions.assertEquals(Duration.ofSeconds(5), transport.lastConnection().getBulkLoads().get(0).getTimeout());
			Assertions.assertThrows(IllegalStateException.class, bulkLoader::execute);
			Assertions.assertThrows(IllegalStateException.class, () -> bulkLoader.add(List.of(2)));
		}
	}
}
