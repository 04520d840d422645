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

import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * Lightweight lexical passes over statement text which JDBC needs but the database's native protocol does not:
 * splitting batches into individual statements and turning {@code @name} markers into positional {@code ?}s.
 * <p>
 * Quoted strings, quoted and bracketed identifiers, and comments are copied through untouched.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
final class SqlScanner {
	@NonNull
	private static final Pattern BATCH_SEPARATOR_PATTERN;

	static {
		BATCH_SEPARATOR_PATTERN = Pattern.compile("^[ \\t]*GO(?:[ \\t]+(\\d+))?[ \\t]*;?[ \\t]*\\r?$", Pattern.CASE_INSENSITIVE);
	}

	private SqlScanner() {
		// Non-instantiable
	}

	/**
	 * Splits a batch into its statements. {@code GO} lines separate batches; {@code GO n} runs the preceding batch
	 * {@code n} times.
	 *
	 * @param batch the batch text
	 * @return the non-blank statements, in order, without terminators
	 */
	@NonNull
	static List<String> split(@NonNull String batch) {
		requireNonNull(batch);

		List<String> statements = new ArrayList<>();
		List<String> currentBatch = new ArrayList<>();
		StringBuilder currentStatement = new StringBuilder();
		boolean lineStart = true;
		int i = 0;

		while (i < batch.length()) {
			if (lineStart) {
				int lineEnd = batch.indexOf('\n', i);
				String line = lineEnd == -1 ? batch.substring(i) : batch.substring(i, lineEnd);
				Matcher matcher = BATCH_SEPARATOR_PATTERN.matcher(line);

				if (matcher.matches()) {
					addStatement(currentBatch, currentStatement);

					int repeat = matcher.group(1) == null ? 1 : Integer.parseInt(matcher.group(1));

					for (int j = 0; j < repeat; ++j)
						statements.addAll(currentBatch);

					currentBatch.clear();
					i = lineEnd == -1 ? batch.length() : lineEnd + 1;
					continue;
				}
			}

			int end = segmentEnd(batch, i);

			if (end == i + 1) {
				char c = batch.charAt(i);

				if (c == ';')
					addStatement(currentBatch, currentStatement);
				else
					currentStatement.append(c);

				lineStart = c == '\n';
			} else {
				currentStatement.append(batch, i, end);
				lineStart = false;
			}

			i = end;
		}

		addStatement(currentBatch, currentStatement);
		statements.addAll(currentBatch);

		return Collections.unmodifiableList(statements);
	}

	/**
	 * Replaces each {@code @name} marker with {@code ?}. System variables ({@code @@name}) are left alone.
	 *
	 * @param sql the statement text
	 * @return the rewritten statement and the marker names in order of appearance
	 */
	@NonNull
	static PositionalStatement positional(@NonNull String sql) {
		requireNonNull(sql);

		StringBuilder rewritten = new StringBuilder(sql.length());
		List<String> parameterNames = new ArrayList<>();
		int i = 0;

		while (i < sql.length()) {
			int end = segmentEnd(sql, i);

			if (end == i + 1 && sql.charAt(i) == '@') {
				if (i + 1 < sql.length() && sql.charAt(i + 1) == '@') {
					end = identifierEnd(sql, i + 2);
				} else {
					int nameEnd = identifierEnd(sql, i + 1);

					if (nameEnd > i + 1) {
						parameterNames.add(sql.substring(i + 1, nameEnd));
						rewritten.append('?');
						i = nameEnd;
						continue;
					}
				}
			}

			rewritten.append(sql, i, end);
			i = end;
		}

		return new PositionalStatement(rewritten.toString(), parameterNames);
	}

	/**
	 * Finds where the lexical segment starting at {@code start} ends: a whole quoted string, quoted identifier or
	 * comment, or otherwise the single character at {@code start}. Line comments end before their newline.
	 */
	private static int segmentEnd(@NonNull String text,
																int start) {
		char c = text.charAt(start);
		char next = start + 1 < text.length() ? text.charAt(start + 1) : 0;

		if (c == '\'' || c == '"' || c == '[') {
			char close = c == '[' ? ']' : c;
			int i = start + 1;

			while (i < text.length()) {
				if (text.charAt(i) == close) {
					// Doubled closing character is an escape
					if (i + 1 < text.length() && text.charAt(i + 1) == close) {
						i += 2;
						continue;
					}

					return i + 1;
				}

				++i;
			}

			return text.length();
		}

		if (c == '-' && next == '-') {
			int lineEnd = text.indexOf('\n', start);
			return lineEnd == -1 ? text.length() : lineEnd;
		}

		if (c == '/' && next == '*') {
			int commentEnd = text.indexOf("*/", start + 2);
			return commentEnd == -1 ? text.length() : commentEnd + 2;
		}

		return start + 1;
	}

	private static int identifierEnd(@NonNull String text,
																	 int start) {
		int end = start;

		while (end < text.length()) {
			char c = text.charAt(end);

			if (!(Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '#'))
				break;

			++end;
		}

		return end;
	}

	private static void addStatement(@NonNull List<String> statements,
																	 @NonNull StringBuilder statement) {
		String trimmed = statement.toString().trim();

		if (hasCode(trimmed))
			statements.add(trimmed);

		statement.setLength(0);
	}

	// Comment-only text is not a statement
	private static boolean hasCode(@NonNull String text) {
		int i = 0;

		while (i < text.length()) {
			int end = segmentEnd(text, i);
			char c = text.charAt(i);

			if (end == i + 1 ? !Character.isWhitespace(c) : !(c == '-' || c == '/'))
				return true;

			i = end;
		}

		return false;
	}

	/**
	 * Statement text with positional markers, plus the names the markers stand for.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 * @since 1.0.0
	 */
	@ThreadSafe
	static final class PositionalStatement {
		@NonNull
		private final String sql;
		@NonNull
		private final List<String> parameterNames;

		PositionalStatement(@NonNull String sql,
												@NonNull List<String> parameterNames) {
			requireNonNull(sql);
			requireNonNull(parameterNames);

			this.sql = sql;
			this.parameterNames = List.copyOf(parameterNames);
		}

		@NonNull
		String getSql() {
			return this.sql;
		}

		@NonNull
		List<String> getParameterNames() {
			return this.parameterNames;
		}
	}
}
