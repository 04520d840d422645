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

import java.nio.ByteBuffer;
import java.time.Duration;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
public class DefaultStatementLoggerTests {
	@Test
	public void testFormatStatementLog() {
		Query query = new Query()
				.sql("SELECT * FROM person WHERE name = @name AND avatar = @avatar")
				.in("name", "x".repeat(150))
				.in("avatar", SqlType.VARBINARY, ByteBuffer.wrap(new byte[]{1, 2, 3}))
				.out("total", SqlType.INT);

		StatementLog statementLog = StatementLog.withQuery(query)
				.connectionId("abc123")
				.connectionAcquisitionDuration(Duration.ofMillis(2))
				.executionDuration(Duration.ofMillis(5))
				.exception(new DatabaseException("Wrapper", new IllegalStateException("Root cause")))
				.build();

		String formatted = new DefaultStatementLogger().formatStatementLog(statementLog);
		String[] lines = formatted.split("\n");

		Assertions.assertEquals("[QUERY] SELECT * FROM person WHERE name = @name AND avatar = @avatar", lines[0]);
		Assertions.assertTrue(lines[1].startsWith("Parameters: @name='" + "x".repeat(100) + "...'"));
		Assertions.assertTrue(lines[1].contains("@avatar=[byte buffer of length 3]"));
		Assertions.assertTrue(lines[1].endsWith("@total OUT=null"));
		Assertions.assertEquals("On connection abc123", lines[2]);
		Assertions.assertEquals("PT0.002S acquiring connection, PT0.005S executing", lines[3]);
		Assertions.assertEquals("Failed due to java.lang.IllegalStateException: Root cause", lines[4]);
		Assertions.assertEquals(Duration.ofMillis(7), statementLog.getTotalDuration());
	}

	@Test
	public void testFormatControlStatement() {
		StatementLog statementLog = StatementLog.withStatement("COMMIT TRANSACTION tx_1").build();

		Assertions.assertEquals("COMMIT TRANSACTION tx_1", new DefaultStatementLogger().formatStatementLog(statementLog));
	}
}
