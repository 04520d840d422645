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

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Column and row accumulation for a bulk insert on a {@link TransportConnection}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
public interface TransportBulkLoad {
	@NonNull
	String getTable();

	void addColumn(@NonNull String name,
								 @NonNull SqlType type,
								 @NonNull ParameterOptions options);

	/**
	 * Adds a row keyed by column name.
	 */
	void addRow(@NonNull Map<String, Object> row);

	/**
	 * Adds a row whose values are in column declaration order.
	 */
	void addRow(@NonNull List<Object> row);

	void setTimeout(@NonNull Duration timeout);
}
