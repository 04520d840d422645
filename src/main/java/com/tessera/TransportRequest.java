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

import java.time.Duration;

/**
 * A single request on a {@link TransportConnection}.
 * <p>
 * Emits {@link TransportEvents#ERROR}, {@link TransportEvents#COLUMN_METADATA}, {@link TransportEvents#ROW},
 * {@link TransportEvents#DONE}, {@link TransportEvents#DONE_IN_PROC}, {@link TransportEvents#DONE_PROC} and finally
 * {@link TransportEvents#REQUEST_COMPLETED}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
public interface TransportRequest extends EventSource {
	@NonNull
	String getSql();

	void addParameter(@NonNull String name,
										@NonNull SqlType type,
										@Nullable Object value,
										@NonNull ParameterOptions options);

	void addOutputParameter(@NonNull String name,
													@NonNull SqlType type,
													@Nullable Object value,
													@NonNull ParameterOptions options);

	/**
	 * Sets how long the request may run before it fails with a timeout.
	 *
	 * @param timeout the timeout, where {@link Duration#ZERO} means no timeout
	 */
	void setTimeout(@NonNull Duration timeout);
}
