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

import javax.annotation.concurrent.ThreadSafe;

/**
 * Decides whether an idle pooled {@link Connection} may be handed to a borrower.
 * <p>
 * Invoked by the pool on borrow when {@link PoolConfiguration#getTestOnBorrow()} is enabled. Connections which fail
 * validation are destroyed and replaced.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
@FunctionalInterface
public interface ConnectionValidator {
	/**
	 * Accepts every connection.
	 *
	 * @return a validator which always succeeds
	 */
	@NonNull
	static ConnectionValidator permissive() {
		return (connection) -> true;
	}

	/**
	 * Validates the given connection.
	 *
	 * @param connection the connection to validate
	 * @return {@code true} if the connection may be used, {@code false} if it should be destroyed
	 */
	@NonNull
	Boolean validate(@NonNull Connection connection);
}
