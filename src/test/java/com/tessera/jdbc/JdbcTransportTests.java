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

package com.tessera.jdbc;

import com.tessera.DatabaseException;
import com.tessera.RequestTimeoutException;
import com.tessera.Result;
import com.tessera.Results;
import com.tessera.SqlType;
import com.tessera.Tessera;
import com.tessera.Transaction;
import org.hsqldb.jdbc.JDBCDataSource;
import org.jspecify.annotations.NonNull;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
public class JdbcTransportTests {
	@Test
	public void testQueryWithParameters() {
		try (Tessera tessera = createTessera("query_with_parameters")) {
			createPersonTable(tessera);

			tessera.query("INSERT INTO person (id, name) VALUES (@id, @name)")
					.in("id", 1)
					.in("name", "Fred")
					.execute();

			tessera.query("INSERT INTO person (id, name) VALUES (@id, @name)", Map.of("id", 2, "name", "Wilma")).execute();

			Result result = tessera.query("SELECT name FROM person WHERE id = @id").in("@id", 2).execute().getSingle();

			Assertions.assertEquals(List.of(List.of("Wilma")), result.getRows());
			Assertions.assertEquals("NAME", result.getColumns().get(0).getName());
			Assertions.assertEquals(SqlType.VARCHAR, result.getColumns().get(0).getType().get());
		}
	}

	@Test
	public void testNullParameter() {
		try (Tessera tessera = createTessera("null_parameter")) {
			tessera.query("CREATE TABLE note (id INT PRIMARY KEY, body VARCHAR(255))").execute();
			tessera.query("INSERT INTO note (id, body) VALUES (@id, @body)")
					.in("id", 1)
					.in("body", SqlType.VARCHAR, null)
					.execute();

			Result result = tessera.query("SELECT body FROM note WHERE id = 1").execute().getSingle();

			Assertions.assertEquals(1, result.getRowCount());
			Assertions.assertNull(result.getRows().get(0).get(0));
		}
	}

	@Test
	public void testBatch() {
		try (Tessera tessera = createTessera("batch")) {
			Results results = tessera.query("""
					CREATE TABLE car (id INT PRIMARY KEY, make VARCHAR(50));
					INSERT INTO car (id, make) VALUES (1, 'Honda');
					INSERT INTO car (id, make) VALUES (2, 'Toyota; Corolla');
					SELECT make FROM car ORDER BY id
					""").execute();

			Assertions.assertTrue(results.size() > 1);

			Result last = results.get(results.size() - 1);

			Assertions.assertEquals(List.of(List.of("Honda"), List.of("Toyota; Corolla")), last.getRows());
		}
	}

	@Test
	public void testTransactionCommitAndRollback() {
		try (Tessera tessera = createTessera("transaction_commit_and_rollback")) {
			createPersonTable(tessera);

			Transaction committed = tessera.transaction();
			committed.query("INSERT INTO person (id, name) VALUES (1, 'Fred')");
			committed.query("INSERT INTO person (id, name) VALUES (2, 'Wilma')");

			Assertions.assertEquals(2, committed.commit().size());
			Assertions.assertEquals(2L, countRows(tessera, "person"));

			Transaction failed = tessera.transaction();
			failed.query("INSERT INTO person (id, name) VALUES (3, 'Barney')");
			failed.query("INSERT INTO missing (id) VALUES (1)");

			Assertions.assertThrows(DatabaseException.class, failed::commit);
			Assertions.assertTrue(failed.isOpen());

			failed.rollback();

			Assertions.assertFalse(failed.isOpen());
			Assertions.assertEquals(2L, countRows(tessera, "person"));
		}
	}

	@Test
	public void testSavepoint() {
		try (Tessera tessera = createTessera("savepoint")) {
			createPersonTable(tessera);

			Transaction transaction = tessera.transaction();
			transaction.query("INSERT INTO person (id, name) VALUES (1, 'Fred')");
			transaction.savePoint("after_fred");
			transaction.query("INSERT INTO person (id, name) VALUES (2, 'Wilma')");
			transaction.query("INSERT INTO person (id, name) VALUES (1, 'Duplicate')");

			Assertions.assertThrows(DatabaseException.class, transaction::commit);

			Assertions.assertThrows(DatabaseException.class, () -> transaction.rollback("never_saved"));
			Assertions.assertTrue(transaction.isOpen());

			transaction.rollback("after_fred");
			transaction.commit();

			Result result = tessera.query("SELECT name FROM person ORDER BY id").execute().getSingle();

			Assertions.assertEquals(List.of(List.of("Fred")), result.getRows());
		}
	}

	@Test
	public void testBulkLoad() {
		try (Tessera tessera = createTessera("bulk_load")) {
			createPersonTable(tessera);

			Long rowCount = tessera.bulk("person")
					.column("id", SqlType.INT)
					.column("name", SqlType.VARCHAR)
					.add(Map.of("name", "Fred", "id", 1))
					.add(List.of(2, "Wilma"))
					.add(new Object[]{3, "Barney"})
					.execute();

			Assertions.assertEquals(3L, rowCount);
			Assertions.assertEquals(3L, countRows(tessera, "person"));
			Assertions.assertEquals(0, tessera.getConnectionPool().getActiveCount());
		}
	}

	@Test
	public void testProcedure() {
		try (Tessera tessera = createTessera("procedure")) {
			tessera.query("CREATE TABLE car (id INT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, make VARCHAR(50))").execute();
			tessera.query("CREATE PROCEDURE add_car(IN p_make VARCHAR(50)) MODIFIES SQL DATA "
					+ "INSERT INTO car (make) VALUES (p_make)").execute();

			Results results = tessera.query("EXEC add_car").in("make", "Honda").execute();

			Assertions.assertFalse(results.isEmpty(), "Procedure calls keep their final result");

			tessera.query("EXECUTE add_car @make").in("make", "Toyota").execute();

			Result result = tessera.query("SELECT make FROM car ORDER BY id").execute().getSingle();

			Assertions.assertEquals(List.of(List.of("Honda"), List.of("Toyota")), result.getRows());
		}
	}

	@Test
	public void testErrors() {
		try (Tessera tessera = createTessera("errors")) {
			DatabaseException missingTable = Assertions.assertThrows(DatabaseException.class, () ->
					tessera.query("SELECT * FROM missing").execute());

			Assertions.assertTrue(missingTable.getSqlState().isPresent());

			DatabaseException missingParameter = Assertions.assertThrows(DatabaseException.class, () ->
					tessera.query("SELECT * FROM INFORMATION_SCHEMA.TABLES WHERE TABLE_NAME = @name").execute());

			Assertions.assertEquals("Must declare the scalar variable \"@name\"", missingParameter.getMessage());

			// The connection survives request errors
			Assertions.assertEquals(1L, ((Number) tessera.query("VALUES (1)").execute().getSingle().getRows().get(0).get(0)).longValue());
			Assertions.assertEquals(0, tessera.getConnectionPool().getActiveCount());
		}
	}

	@Test
	public void testTimeoutMapping() {
		SQLTimeoutException timeout = new SQLTimeoutException("Statement cancelled due to timeout");

		DatabaseException exception = JdbcTransportConnection.toDatabaseException(timeout, Duration.ofSeconds(5));

		Assertions.assertEquals(RequestTimeoutException.class, exception.getClass());
		Assertions.assertEquals("Request timed out after PT5S", exception.getMessage());
		Assertions.assertSame(timeout, exception.getCause());

		Assertions.assertEquals("Request timed out",
				JdbcTransportConnection.toDatabaseException(timeout, null).getMessage());
		Assertions.assertEquals(DatabaseException.class,
				JdbcTransportConnection.toDatabaseException(new SQLException("Syntax error"), null).getClass());
	}

	@Test
	public void testQueryTimeoutSeconds() {
		Assertions.assertEquals(1, JdbcTransportConnection.toQueryTimeoutSeconds(Duration.ofMillis(1)));
		Assertions.assertEquals(2, JdbcTransportConnection.toQueryTimeoutSeconds(Duration.ofMillis(1500)));
		Assertions.assertEquals(15, JdbcTransportConnection.toQueryTimeoutSeconds(Duration.ofSeconds(15)));
		Assertions.assertEquals(Integer.MAX_VALUE, JdbcTransportConnection.toQueryTimeoutSeconds(Duration.ofDays(365L * 1000)));
		Assertions.assertEquals(Integer.MAX_VALUE, JdbcTransportConnection.toQueryTimeoutSeconds(Duration.ofSeconds(Long.MAX_VALUE, 999_999_999)));
	}

	@Test
	public void testPing() {
		Tessera tessera = createTessera("ping");

		Assertions.assertTrue(tessera.ping());

		tessera.destroy();

		Assertions.assertFalse(tessera.ping());
	}

	protected long countRows(@NonNull Tessera tessera,
													 @NonNull String table) {
		requireNonNull(tessera);
		requireNonNull(table);

		Object count = tessera.query(format("SELECT COUNT(*) FROM %s", table)).execute().getSingle().getRows().get(0).get(0);
		return ((Number) count).longValue();
	}

	protected void createPersonTable(@NonNull Tessera tessera) {
		requireNonNull(tessera);

		tessera.query("""
				CREATE TABLE person (
				  id INT PRIMARY KEY,
				  name VARCHAR(255) NOT NULL
				)
				""").execute();
	}

	@NonNull
	protected Tessera createTessera(@NonNull String databaseName) {
		requireNonNull(databaseName);
		return Tessera.withTransport(new JdbcTransport(createInMemoryDataSource(databaseName))).build();
	}

	@NonNull
	protected DataSource createInMemoryDataSource(@NonNull String databaseName) {
		requireNonNull(databaseName);

		JDBCDataSource dataSource = new JDBCDataSource();
		dataSource.setUrl(format("jdbc:hsqldb:mem:%s", databaseName));
		dataSource.setUser("sa");
		dataSource.setPassword("");

		return dataSource;
	}
}
