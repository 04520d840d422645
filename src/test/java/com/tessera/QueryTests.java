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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
public class QueryTests {
	@Test
	public void testClassification() {
		Assertions.assertEquals(QueryMode.EXEC, Query.classify("EXEC sp_x"));
		Assertions.assertEquals(QueryMode.EXEC, Query.classify("  ;execute dbo.sp_x;;"));
		Assertions.assertEquals(QueryMode.BATCH, Query.classify("SELECT 1; SELECT 2"));
		Assertions.assertEquals(QueryMode.BATCH, Query.classify("SELECT 1\nGO\nSELECT 2"));
		Assertions.assertEquals(QueryMode.BATCH, Query.classify("EXEC sp_x; SELECT 2"));
		Assertions.assertEquals(QueryMode.QUERY, Query.classify("UPDATE t SET x=1"));
		Assertions.assertEquals(QueryMode.QUERY, Query.classify("SELECT 1;"));
		Assertions.assertEquals(QueryMode.QUERY, Query.classify("SELECT 1;  ;\n"));
		Assertions.assertEquals(QueryMode.QUERY, Query.classify("SELECT executive FROM t"));
	}

	@Test
	public void testSeparatorsInsideQuotesAndComments() {
		Assertions.assertEquals(QueryMode.QUERY, Query.classify("SELECT 'a; b' AS x"));
		Assertions.assertEquals(QueryMode.QUERY, Query.classify("SELECT 'it''s; fine' AS x"));
		Assertions.assertEquals(QueryMode.QUERY, Query.classify("SELECT [odd;name] FROM t"));
		Assertions.assertEquals(QueryMode.QUERY, Query.classify("SELECT 1 -- ; SELECT 2"));
		Assertions.assertEquals(QueryMode.QUERY, Query.classify("SELECT 1 /* ; SELECT 2 */"));
		Assertions.assertEquals(QueryMode.QUERY, Query.classify("SELECT 'GO'\n"));
		Assertions.assertEquals(QueryMode.QUERY, Query.classify("SELECT 1\nGO\n"));
	}

	@Test
	public void testExecStatementIsStripped() {
		Query query = new Query().sql("EXEC dbo.get_employees;");

		Assertions.assertEquals(QueryMode.EXEC, query.getMode());
		Assertions.assertEquals("dbo.get_employees", query.getStatement().orElse(null));

		Query batch = new Query().sql("SELECT 1; SELECT 2");

		Assertions.assertEquals(QueryMode.BATCH, batch.getMode());
		Assertions.assertEquals("SELECT 1; SELECT 2", batch.getStatement().orElse(null));
	}

	@Test
	public void testBlankStatementsAreRejected() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> new Query().sql(null));
		Assertions.assertThrows(IllegalArgumentException.class, () -> new Query().sql("   "));
	}

	@Test
	public void testParameterNames() {
		Query query = new Query()
				.sql("SELECT * FROM employee WHERE id = @id AND name = @name")
				.in("@id", 42)
				.in("name", "Fred");

		Assertions.assertEquals(List.of("id", "name"), List.copyOf(query.getParameters().keySet()));
		Assertions.assertEquals(SqlType.TINYINT, query.getParameter("id").get().getType());
		Assertions.assertEquals(ParameterDirection.IN, query.getParameter("name").get().getDirection());

		Assertions.assertThrows(IllegalArgumentException.class, () -> query.in("id", 43), "Duplicate names are rejected");
		Assertions.assertThrows(IllegalArgumentException.class, () -> query.in("@id", 43), "Duplicates ignore the leading @");
		Assertions.assertThrows(IllegalArgumentException.class, () -> query.in(null, 1));
		Assertions.assertThrows(IllegalArgumentException.class, () -> query.in(" ", 1));
		Assertions.assertThrows(IllegalArgumentException.class, () -> query.in("@", 1));

		// Names are case-sensitive
		query.in("ID", 44);
		Assertions.assertEquals(3, query.getParameters().size());
	}

	@Test
	public void testOutputParameters() {
		Query query = new Query().sql("EXEC get_count").out("count", SqlType.INT);
		Parameter parameter = query.getParameter("count").get();

		Assertions.assertTrue(parameter.isOutput());
		Assertions.assertEquals(SqlType.INT, parameter.getType());
		Assertions.assertTrue(parameter.getValue().isEmpty());
		Assertions.assertThrows(IllegalArgumentException.class, () -> query.out("other", null), "Output types are required");
	}

	@Test
	public void testExplicitTypesAndOptions() {
		ParameterOptions options = ParameterOptions.builder().precision(10).scale(2).build();
		Query query = new Query().sql("SELECT @amount").in("amount", SqlType.DECIMAL, 12.5, options);
		Parameter parameter = query.getParameter("amount").get();

		Assertions.assertEquals(SqlType.DECIMAL, parameter.getType());
		Assertions.assertEquals(10, parameter.getOptions().getPrecision().get());
		Assertions.assertEquals(2, parameter.getOptions().getScale().get());
		Assertions.assertThrows(IllegalArgumentException.class, () -> ParameterOptions.builder().length(-1).build());
	}

	@Test
	public void testRemoveAndClear() {
		Query query = new Query().sql("SELECT @a, @b").in("a", 1).in("b", 2).timeout(Duration.ofSeconds(5));

		Assertions.assertTrue(query.remove("@a"));
		Assertions.assertFalse(query.remove("a"));
		Assertions.assertEquals(List.of("b"), List.copyOf(query.getParameters().keySet()));

		query.clear();

		Assertions.assertTrue(query.getStatement().isEmpty());
		Assertions.assertEquals(QueryMode.QUERY, query.getMode());
		Assertions.assertTrue(query.getParameters().isEmpty());
		Assertions.assertTrue(query.getTimeout().isEmpty());
	}

	@Test
	public void testParametersTurnBatchesIntoQueries() {
		Query query = new Query().sql("SELECT 1; SELECT @x");
		Assertions.assertEquals(QueryMode.BATCH, query.getMode());

		query.in("x", 1);
		Assertions.assertEquals(QueryMode.QUERY, query.getMode());

		Query parameterized = new Query().in("x", 1).sql("SELECT 1; SELECT @x");
		Assertions.assertEquals(QueryMode.QUERY, parameterized.getMode());

		Assertions.assertThrows(IllegalStateException.class, parameterized::batch);
		Assertions.assertEquals(QueryMode.BATCH, new Query().sql("SELECT 1").batch().getMode());
		Assertions.assertEquals(QueryMode.EXEC, new Query().sql("get_employees").exec().getMode());
	}

	@Test
	public void testSqlWithParameterMap() {
		Map<String, Object> parameters = new LinkedHashMap<>();
		parameters.put("first", "a");
		parameters.put("@second", null);

		Query query = new Query().sql("SELECT @first, @second", parameters);

		Assertions.assertEquals(List.of("first", "second"), List.copyOf(query.getParameters().keySet()));
		Assertions.assertEquals(SqlType.VARCHAR, query.getParameter("second").get().getType());
	}

	@Test
	public void testTimeouts() {
		Query query = new Query().sql("SELECT 1");

		Assertions.assertThrows(IllegalArgumentException.class, () -> query.timeout(Duration.ofSeconds(-1)));
		Assertions.assertEquals(Duration.ofMillis(250), query.timeout(Duration.ofMillis(250)).getTimeout().get());
		Assertions.assertTrue(query.timeout(null).getTimeout().isEmpty());
	}
}
