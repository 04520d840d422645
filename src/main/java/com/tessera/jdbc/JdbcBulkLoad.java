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

import com.tessera.BulkLoadOptions;
import com.tessera.ParameterOptions;
import com.tessera.SqlType;
import com.tessera.TransportBulkLoad;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * Buffers a bulk load's columns and rows until {@link JdbcTransportConnection#execBulkLoad(TransportBulkLoad)} sends
 * them as one JDBC batch insert.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
class JdbcBulkLoad implements TransportBulkLoad {
	@NonNull
	private final String table;
	@NonNull
	private final BulkLoadOptions options;
	@NonNull
	private final BiConsumer<@Nullable Throwable, @Nullable Long> callback;
	@NonNull
	private final Map<String, SqlType> columns;
	@NonNull
	private final List<List<Object>> rows;
	@Nullable
	private Duration timeout;

	JdbcBulkLoad(@NonNull String table,
							 @NonNull BulkLoadOptions options,
							 @NonNull BiConsumer<@Nullable Throwable, @Nullable Long> callback) {
		requireNonNull(table);
		requireNonNull(options);
		requireNonNull(callback);

		this.table = table;
		this.options = options;
		this.callback = callback;
		this.columns = new LinkedHashMap<>();
		this.rows = new ArrayList<>();
		this.timeout = options.getTimeout().orElse(null);
	}

	@Override
	@NonNull
	public String getTable() {
		return this.table;
	}

	@Override
	public void addColumn(@NonNull String name,
												@NonNull SqlType type,
												@NonNull ParameterOptions options) {
		requireNonNull(name);
		requireNonNull(type);
		requireNonNull(options);

		this.columns.put(name, type);
	}

	@Override
	public void addRow(@NonNull Map<String, Object> row) {
		requireNonNull(row);

		for (String key : row.keySet())
			if (!this.columns.containsKey(key))
				throw new IllegalArgumentException(format("Column '%s' was not declared for bulk load into %s", key, getTable()));

		List<Object> values = new ArrayList<>(this.columns.size());

		for (String column : this.columns.keySet())
			values.add(row.get(column));

		this.rows.add(values);
	}

	@Override
	public void addRow(@NonNull List<Object> row) {
		requireNonNull(row);

		if (row.size() != this.columns.size())
			throw new IllegalArgumentException(format("Row has %d value[s] but %d column[s] were declared", row.size(),
					this.columns.size()));

		this.rows.add(new ArrayList<>(row));
	}

	@Override
	public void setTimeout(@NonNull Duration timeout) {
		requireNonNull(timeout);
		this.timeout = timeout;
	}

	@NonNull
	String toInsertStatement() {
		return format("INSERT INTO %s (%s) VALUES (%s)", getTable(), String.join(", ", this.columns.keySet()),
				this.columns.keySet().stream().map(column -> "?").collect(joining(", ")));
	}

	@NonNull
	List<SqlType> getColumnTypes() {
		return List.copyOf(this.columns.values());
	}

	@NonNull
	List<List<Object>> getRows() {
		return Collections.unmodifiableList(this.rows);
	}

	@NonNull
	BulkLoadOptions getOptions() {
		return this.options;
	}

	@NonNull
	Optional<Duration> getTimeout() {
		return Optional.ofNullable(this.timeout);
	}

	@NonNull
	BiConsumer<@Nullable Throwable, @Nullable Long> getCallback() {
		return this.callback;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{table=%s, columns=%s, rows=%d}", getClass().getSimpleName(), getTable(), this.columns.keySet(),
				this.rows.size());
	}
}
