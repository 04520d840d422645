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

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A typed event key, identifying both an event name and the type of payload its listeners receive.
 * <p>
 * Events compare by identity: two keys with the same name are distinct events.
 * Declare them once as constants, as {@link TransportEvents} and {@link ConnectionEvents} do.
 *
 * @param <T> the payload type delivered to listeners
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class Event<T> {
	@NonNull
	private final String name;

	private Event(@NonNull String name) {
		requireNonNull(name);
		this.name = name;
	}

	/**
	 * Creates a new event key with the given name.
	 *
	 * @param name the event name, used for diagnostics
	 * @param <T>  the payload type
	 * @return a new event key
	 */
	@NonNull
	public static <T> Event<T> named(@NonNull String name) {
		requireNonNull(name);

		if (name.trim().length() == 0)
			throw new IllegalArgumentException("The event name is required");

		return new Event<>(name);
	}

	@NonNull
	public String getName() {
		return this.name;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{name=%s}", getClass().getSimpleName(), getName());
	}
}
