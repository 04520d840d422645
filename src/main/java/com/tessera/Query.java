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

import javax.annotation.concurrent.NotThreadSafe;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Statement text plus an ordered set of named parameters.
 * <p>
 * Example usage:
 * <pre>{@code
 * Query query = new Query()
 *   .sql("SELECT @valid = IsCustomer FROM contacts WHERE name LIKE @firstName AND account = @number")
 *   .in("firstName", "John")
 *   .in("number", SqlType.INT, 23494893)
 *   .out("valid", SqlType.BIT);
 * }</pre>
 * <p>
 * Setting the statement classifies it as {@link QueryMode#EXEC} (a single {@code EXEC}/{@code EXECUTE} call, whose
 * leading keyword is dropped), {@link QueryMode#BATCH} (more than one statement) or {@link QueryMode#QUERY}.
 * Adding a parameter to a {@link QueryMode#BATCH} query turns it back into a {@link QueryMode#QUERY}, since raw
 * batches cannot carry parameters.
 * <p>
 * Instances are intended for use by a single thread.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public class Query {
	@NonNull
	private static final Pattern EXEC_PATTERN;
	@NonNull
	private static final Pattern BATCH_SEPARATOR_PATTERN;

	static {
		EXEC_PATTERN = Pattern.compile("^[\\s;]*EXEC(?:UTE)?\\s+(.+)$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
		BATCH_SEPARATOR_PATTERN = Pattern.compile("^[ \\t]*GO(?:[ \\t]+\\d+)?[ \\t]*;?[ \\t]*\\r?$", Pattern.CASE_INSENSITIVE);
	}

	@Nullable
	private String statement;
	@NonNull
	private QueryMode mode;
	@NonNull
	private final Map<String, Parameter> parameters;
	@Nullable
	private Duration timeout;

	public Query() {
		this.mode = QueryMode.QUERY;
		this.parameters = new LinkedHashMap<>();
	}

	/**
	 * Sets the statement text and classifies it.
	 *
	 * @param statement the statement to execute
	 * @return this query, for chaining
	 * @throws IllegalArgumentException if the statement is {@code null} or blank
	 */
	@NonNull
	public Query sql(@Nullable String statement) {
		if (statement == null || statement.trim().length() == 0)
			throw new IllegalArgumentException("A statement is required");

		Classification classification = classifyStatement(statement);

		this.mode = classification.getMode();
		this.statement = classification.getStatement();

		// Raw batches cannot carry parameters
		if (this.mode == QueryMode.BATCH && this.parameters.size() > 0)
			this.mode = QueryMode.QUERY;

		return this;
	}

	/**
	 * Sets the statement text, classifies it and binds each map entry as an input parameter.
	 *
	 * @param statement  the statement to execute
	 * @param parameters input parameter values keyed by name
	 * @return this query, for chaining
	 */
	@NonNull
	public Query sql(@Nullable String statement,
									 @Nullable Map<String, ?> parameters) {
		sql(statement);

		if (parameters != null)
			in(parameters);

		return this;
	}

	/**
	 * Forces {@link QueryMode#BATCH}.
	 *
	 * @return this query, for chaining
	 * @throws IllegalStateException if the query already has parameters
	 */
	@NonNull
	public Query batch() {
		if (this.parameters.size() > 0)
			throw new IllegalStateException(format("A query with parameters cannot run as a batch: %d parameter[s] declared",
					this.parameters.size()));

		this.mode = QueryMode.BATCH;
		return this;
	}

	/**
	 * Forces {@link QueryMode#EXEC}, treating the statement as a procedure name.
	 *
	 * @return this query, for chaining
	 */
	@NonNull
	public Query exec() {
		this.mode = QueryMode.EXEC;
		return this;
	}

	/**
	 * Sets the request timeout for this query.
	 *
	 * @param timeout the timeout, or {@code null} to use the configured default
	 * @return this query, for chaining
	 * @throws IllegalArgumentException if the timeout is negative
	 */
	@NonNull
	public Query timeout(@Nullable Duration timeout) {
		if (timeout != null && timeout.isNegative())
			throw new IllegalArgumentException("Timeout cannot be negative");

		this.timeout = timeout;
		return this;
	}

	/**
	 * Adds an input parameter whose type is inferred from its value via {@link SqlType#infer(Object)}.
	 *
	 * @param name  the parameter name, with or without a leading {@code @}
	 * @param value the value
	 * @return this query, for chaining
	 */
	@NonNull
	public Query in(@Nullable String name,
									@Nullable Object value) {
		return in(name, null, value, null);
	}

	@NonNull
	public Query in(@Nullable String name,
									@Nullable SqlType type,
									@Nullable Object value) {
		return in(name, type, value, null);
	}

	/**
	 * Adds an input parameter.
	 *
	 * @param name    the parameter name, with or without a leading {@code @}
	 * @param type    the type, or {@code null} to infer it from {@code value}
	 * @param value   the value
	 * @param options length/precision/scale hints, or {@code null} for none
	 * @return this query, for chaining
	 * @throws IllegalArgumentException if the name is missing or already used, or no type can be inferred
	 */
	@NonNull
	public Query in(@Nullable String name,
									@Nullable SqlType type,
									@Nullable Object value,
									@Nullable ParameterOptions options) {
		String normalizedName = normalizeParameterName(name);
		SqlType resolvedType = type == null ? SqlType.infer(value) : type;

		return addParameter(new Parameter(normalizedName, ParameterDirection.IN, resolvedType, value,
				options == null ? ParameterOptions.none() : options));
	}

	/**
	 * Adds an input parameter for each map entry, in the map's iteration order.
	 *
	 * @param parameters values keyed by parameter name
	 * @return this query, for chaining
	 */
	@NonNull
	public Query in(@NonNull Map<String, ?> parameters) {
		requireNonNull(parameters);

		for (Map.Entry<String, ?> entry : parameters.entrySet())
			in(entry.getKey(), entry.getValue());

		return this;
	}

	@NonNull
	public Query out(@Nullable String name,
									 @Nullable SqlType type) {
		return out(name, type, null, null);
	}

	@NonNull
	public Query out(@Nullable String name,
									 @Nullable SqlType type,
									 @Nullable Object value) {
		return out(name, type, value, null);
	}

	/**
	 * Adds an output parameter.
	 *
	 * @param name    the parameter name, with or without a leading {@code @}
	 * @param type    the type, which is required
	 * @param value   an initial value, usually {@code null}
	 * @param options length/precision/scale hints, or {@code null} for none
	 * @return this query, for chaining
	 * @throws IllegalArgumentException if the name is missing or already used, or the type is missing
	 */
	@NonNull
	public Query out(@Nullable String name,
									 @Nullable SqlType type,
									 @Nullable Object value,
									 @Nullable ParameterOptions options) {
		String normalizedName = normalizeParameterName(name);

		if (type == null)
			throw new IllegalArgumentException(format("A type is required for output parameter '%s'", normalizedName));

		return addParameter(new Parameter(normalizedName, ParameterDirection.OUT, type, value,
				options == null ? ParameterOptions.none() : options));
	}

	/**
	 * Removes a parameter.
	 *
	 * @param name the parameter name, with or without a leading {@code @}
	 * @return {@code true} if a parameter with that name existed, {@code false} otherwise
	 */
	@NonNull
	public Boolean remove(@Nullable String name) {
		return this.parameters.remove(normalizeParameterName(name)) != null;
	}

	/**
	 * Resets the statement, mode, parameters and timeout.
	 */
	public void clear() {
		this.statement = null;
		this.mode = QueryMode.QUERY;
		this.parameters.clear();
		this.timeout = null;
	}

	@NonNull
	public Optional<String> getStatement() {
		return Optional.ofNullable(this.statement);
	}

	@NonNull
	public QueryMode getMode() {
		return this.mode;
	}

	/**
	 * @return the parameters in insertion order, keyed by name
	 */
	@NonNull
	public Map<String, Parameter> getParameters() {
		return Collections.unmodifiableMap(new LinkedHashMap<>(this.parameters));
	}

	@NonNull
	public Optional<Parameter> getParameter(@NonNull String name) {
		requireNonNull(name);
		return Optional.ofNullable(this.parameters.get(normalizeParameterName(name)));
	}

	@NonNull
	public Optional<Duration> getTimeout() {
		return Optional.ofNullable(this.timeout);
	}

	/**
	 * Determines the mode a statement would be classified as.
	 *
	 * @param statement the statement
	 * @return the mode
	 */
	@NonNull
	public static QueryMode classify(@NonNull String statement) {
		requireNonNull(statement);
		return classifyStatement(statement).getMode();
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{mode=%s, statement=%s, parameters=%s}", getClass().getSimpleName(), getMode().name(),
				this.statement, this.parameters.values());
	}

	@NonNull
	protected Query copyFrom(@NonNull Query query) {
		requireNonNull(query);

		this.statement = query.statement;
		this.mode = query.mode;
		this.parameters.clear();
		this.parameters.putAll(query.parameters);
		this.timeout = query.timeout;

		return this;
	}

	@NonNull
	private Query addParameter(@NonNull Parameter parameter) {
		requireNonNull(parameter);

		if (this.parameters.containsKey(parameter.getName()))
			throw new IllegalArgumentException(format("Parameter '%s' was already specified", parameter.getName()));

		this.parameters.put(parameter.getName(), parameter);

		if (this.mode == QueryMode.BATCH)
			this.mode = QueryMode.QUERY;

		return this;
	}

	@NonNull
	private static String normalizeParameterName(@Nullable String name) {
		if (name == null || name.trim().length() == 0)
			throw new IllegalArgumentException("A parameter name is required");

		String normalizedName = name.charAt(0) == '@' ? name.substring(1) : name;

		if (normalizedName.trim().length() == 0)
			throw new IllegalArgumentException(format("'%s' is not a valid parameter name", name));

		return normalizedName;
	}

	@NonNull
	private static Classification classifyStatement(@NonNull String statement) {
		requireNonNull(statement);

		Matcher execMatcher = EXEC_PATTERN.matcher(statement);

		if (execMatcher.matches()) {
			String callTarget = stripTrailingTerminators(execMatcher.group(1));

			if (!containsMultipleStatements(callTarget))
				return new Classification(QueryMode.EXEC, callTarget);

			return new Classification(QueryMode.BATCH, statement);
		}

		if (containsMultipleStatements(statement))
			return new Classification(QueryMode.BATCH, statement);

		return new Classification(QueryMode.QUERY, statement);
	}

	@NonNull
	private static String stripTrailingTerminators(@NonNull String text) {
		int end = text.length();

		while (end > 0 && (Character.isWhitespace(text.charAt(end - 1)) || text.charAt(end - 1) == ';'))
			--end;

		return text.substring(0, end);
	}

	// A ';' or a GO line, outside of quotes, brackets and comments, followed by more statement text
	@NonNull
	private static Boolean containsMultipleStatements(@NonNull String text) {
		char quote = 0;
		boolean lineComment = false;
		boolean blockComment = false;
		boolean lineStart = true;

		for (int i = 0; i < text.length(); ++i) {
			char c = text.charAt(i);
			char next = i + 1 < text.length() ? text.charAt(i + 1) : 0;

			if (lineComment) {
				if (c == '\n') {
					lineComment = false;
					lineStart = true;
				}

				continue;
			}

			if (blockComment) {
				if (c == '*' && next == '/') {
					blockComment = false;
					++i;
				}

				continue;
			}

			if (quote != 0) {
				if (c == quote) {
					// Doubled quote is an escaped quote
					if (next == quote)
						++i;
					else
						quote = 0;
				}

				continue;
			}

			if (lineStart) {
				int lineEnd = text.indexOf('\n', i);
				String line = lineEnd == -1 ? text.substring(i) : text.substring(i, lineEnd);

				if (BATCH_SEPARATOR_PATTERN.matcher(line).matches())
					return lineEnd != -1 && hasStatementText(text, lineEnd + 1);

				lineStart = false;
			}

			if (c == '\'' || c == '"')
				quote = c;
			else if (c == '[')
				quote = ']';
			else if (c == '-' && next == '-')
				lineComment = true;
			else if (c == '/' && next == '*')
				blockComment = true;
			else if (c == ';' && hasStatementText(text, i + 1))
				return true;
			else if (c == '\n')
				lineStart = true;
		}

		return false;
	}

	@NonNull
	private static Boolean hasStatementText(@NonNull String text,
																					int start) {
		for (int i = start; i < text.length(); ++i) {
			char c = text.charAt(i);

			if (!Character.isWhitespace(c) && c != ';')
				return true;
		}

		return false;
	}

	@NotThreadSafe
	private static final class Classification {
		@NonNull
		private final QueryMode mode;
		@NonNull
		private final String statement;

		private Classification(@NonNull QueryMode mode,
													 @NonNull String statement) {
			this.mode = mode;
			this.statement = statement;
		}

		@NonNull
		public QueryMode getMode() {
			return this.mode;
		}

		@NonNull
		public String getStatement() {
			return this.statement;
		}
	}
}
