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
import java.util.function.Consumer;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * An (event, listener) pair known to an {@link EventTracker}, independent of any source it was attached to.
 * <p>
 * Two registrations are equal when they name the same event and the very same listener instance.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class EventRegistration {
	@NonNull
	private final Event<?> event;
	@NonNull
	private final Consumer<?> listener;

	EventRegistration(@NonNull Event<?> event,
										@NonNull Consumer<?> listener) {
		requireNonNull(event);
		requireNonNull(listener);

		this.event = event;
		this.listener = listener;
	}

	@NonNull
	public Event<?> getEvent() {
		return this.event;
	}

	@NonNull
	public Consumer<?> getListener() {
		return this.listener;
	}

	@NonNull
	Boolean matches(@NonNull Event<?> event,
									@NonNull Consumer<?> listener) {
		return this.event == event && this.listener == listener;
	}

	@Override
	public int hashCode() {
		return 31 * System.identityHashCode(getEvent()) + System.identityHashCode(getListener());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof EventRegistration))
			return false;

		EventRegistration registration = (EventRegistration) object;
		return matches(registration.getEvent(), registration.getListener());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{event=%s, listener=%s}", getClass().getSimpleName(), getEvent().getName(), getListener());
	}
}
