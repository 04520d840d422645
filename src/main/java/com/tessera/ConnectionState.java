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

import static java.util.Objects.requireNonNull;

/**
 * Lifecycle states of a {@link Connection}.
 * <p>
 * Every legal transition passes through {@link #IDLE}: IDLE↔CONNECTING, IDLE↔DISCONNECTING, IDLE↔EXECUTING and
 * IDLE↔TRANSACTING.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
public enum ConnectionState {
	IDLE,
	CONNECTING,
	DISCONNECTING,
	TRANSACTING,
	EXECUTING;

	/**
	 * Is moving from this state to {@code target} a legal transition?
	 *
	 * @param target the state to move to
	 * @return {@code true} if the transition is legal, {@code false} otherwise
	 */
	@NonNull
	public Boolean canTransitionTo(@NonNull ConnectionState target) {
		requireNonNull(target);

		if (this == target)
			return false;

		return this == IDLE || target == IDLE;
	}
}
