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
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The columns, rows and procedure return value produced by one statement.
 * <p>
 * Rows take one shape for the lifetime of a {@code Result}, chosen by its {@link DisplayMode}: positional value lists
 * ({@link #getRows()}) or records keyed by column name ({@link #getRecords()}).
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public final class Result {
	@NonNull
	private final DisplayMode displayMode;
	@NonNull
	private final List<ColumnMetadata> columns;
	@NonNull
	private final List<List<Object>> rows;
	@NonNull
	private final List<Map<String, Object>> records;
	@Nullable
	private Object returnValue;

	public Result(@NonNull DisplayMode displayMode) {
		requireNonNull(displayMode);

		this.displayMode = displayMode;
		this.columns = new ArrayList<>();
		this.rows = new ArrayList<>();
		this.records = new ArrayList<>();
	}

	/**
	 * Walks arbitrarily nested arrays and {@link Iterable}s (including {@link Results}) and gathers every
	 * {@link Result} found, in encounter order. {@code null}s and other values are skipped.
	 *
	 * @param values the values to flatten
	 * @return {@code null} if no {@link Result} was found, otherwise the results found
	 */
	@Nullable
	public static Results flatten(@Nullable Object... values) {
		List<Result> results = new ArrayList<>();

		if (values != null)
			for (Object value : values)
				collect(value, results);

		if (results.size() == 0)
			return null;

		return new Results(results);
	}

	private static void collect(@Nullable Object value,
															@NonNull List<Result> results) {
		if (value == null)
			return;

		if (value instanceof Result result) {
			results.add(result);
		} else if (value instanceof Object[] array) {
			for (Object element : array)
				collect(element, results);
		} else if (value instanceof Iterable<?> iterable) {
			for (Object element : iterable)
				collect(element, results);
		}
	}

	@NonNull
	public DisplayMode getDisplayMode() {
		return this.displayMode;
	}

	@NonNull
	public List<ColumnMetadata> getColumns() {
		return Collections.unmodifiableList(this.columns);
	}

	/**
	 * Gets rows as positional value lists, in column order.
	 *
	 * @return the rows
	 * @throws IllegalStateException if this result holds {@link DisplayMode#NAMED} records
	 */
	@NonNull
	public List<List<Object>> getRows() {
		if (getDisplayMode() != DisplayMode.POSITIONAL)
			throw new IllegalStateException(format("Rows are not available in %s display mode, use getRecords() instead",
					getDisplayMode().name()));

		return Collections.unmodifiableList(this.rows);
	}

	/**
	 * Gets rows as records keyed by column name.
	 *
	 * @return the records
	 * @throws IllegalStateException if this result holds {@link DisplayMode#POSITIONAL} rows
	 */
	@NonNull
	public List<Map<String, Object>> getRecords() {
		if (getDisplayMode() != DisplayMode.NAMED)
			throw new IllegalStateException(format("Records are not available in %s display mode, use getRows() instead",
					getDisplayMode().name()));

		return Collections.unmodifiableList(this.records);
	}

	@NonNull
	public Integer getRowCount() {
		return getDisplayMode() == DisplayMode.NAMED ? this.records.size() : this.rows.size();
	}

	@NonNull
	public Optional<Object> getReturnValue() {
		return Optional.ofNullable(this.returnValue);
	}

	/**
	 * @return {@code true} if this result has no columns and no rows
	 */
	@NonNull
	public Boolean isEmpty() {
		return this.columns.size() == 0 && getRowCount() == 0;
	}

	@NonNull
	Boolean hasData() {
		return this.returnValue != null || !isEmpty();
	}

	void addColumns(@NonNull List<ColumnMetadata> columns) {
		requireNonNull(columns);

		if (getDisplayMode() == DisplayMode.POSITIONAL) {
			this.columns.clear();
			this.columns.addAll(columns);
			return;
		}

		for (ColumnMetadata column : columns) {
			boolean merged = false;

			for (int i = 0; i < this.columns.size(); ++i) {
				if (this.columns.get(i).getName().equals(column.getName())) {
					this.columns.set(i, column);
					merged = true;
					break;
				}
			}

			if (!merged)
				this.columns.add(column);
		}
	}

	void addRow(@NonNull List<ColumnValue> columnValues) {
		requireNonNull(columnValues);

		if (getDisplayMode() == DisplayMode.POSITIONAL) {
			List<Object> row = new ArrayList<>(columnValues.size());

			for (ColumnValue columnValue : columnValues)
				row.add(columnValue.getValue().orElse(null));

			this.rows.add(Collections.unmodifiableList(row));
		} else {
			Map<String, Object> record = new LinkedHashMap<>(columnValues.size());

			for (ColumnValue columnValue : columnValues)
				record.put(columnValue.getMetadata().getName(), columnValue.getValue().orElse(null));

			this.records.add(Collections.unmodifiableMap(record));
		}
	}

	void setReturnValue(@Nullable Object returnValue) {
		this.returnValue = returnValue;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{displayMode=%s, columns=%s, rowCount=%s, returnValue=%s}", getClass().getSimpleName(),
				getDisplayMode().name(), this.columns.size(), getRowCount(), this.returnValue);
	}
}
