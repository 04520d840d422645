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

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Keeps track of the listeners one piece of code attaches to long-lived {@link EventSource}s, so they can later be
 * removed without disturbing listeners attached by anyone else.
 * <p>
 * Pooled connections and their requests outlive any single execution; each execution attaches its listeners through
 * its own tracker and removes exactly those when it settles.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class EventTracker {
	@NonNull
	private final List<EventRegistration> registrations;
	@NonNull
	private final List<Subscription> subscriptions;
	@NonNull
	private final ReentrantLock lock;

	public EventTracker() {
		this.registrations = new ArrayList<>();
		this.subscriptions = new ArrayList<>();
		this.lock = new ReentrantLock();
	}

	/**
	 * Registers one or more listeners for an event. Pairs already registered are skipped.
	 *
	 * @param event     the event
	 * @param listeners the listeners
	 * @param <T>       the payload type
	 * @throws IllegalArgumentException if the event is missing, no listeners are given, or any listener is {@code null}
	 */
	@SafeVarargs
	public final <T> void register(@Nullable Event<T> event,
																 @Nullable Consumer<? super T>... listeners) {
		validate(event, listeners);

		getLock().lock();

		try {
			for (Consumer<? super T> listener : listeners) {
				EventRegistration registration = new EventRegistration(event, listener);

				if (!this.registrations.contains(registration))
					this.registrations.add(registration);
			}
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Registers one or more listeners in this tracker and attaches them to the given source.
	 *
	 * @param source    the source to attach the listeners to
	 * @param event     the event
	 * @param listeners the listeners
	 * @param <T>       the payload type
	 */
	@SafeVarargs
	public final <T> void registerOn(@NonNull EventSource source,
																	 @Nullable Event<T> event,
																	 @Nullable Consumer<? super T>... listeners) {
		requireNonNull(source);
		registerOn(List.of(source), event, listeners);
	}

	/**
	 * Registers one or more listeners in this tracker and attaches them to each of the given sources.
	 *
	 * @param sources   the sources to attach the listeners to
	 * @param event     the event
	 * @param listeners the listeners
	 * @param <T>       the payload type
	 */
	@SafeVarargs
	public final <T> void registerOn(@NonNull Collection<? extends EventSource> sources,
																	 @Nullable Event<T> event,
																	 @Nullable Consumer<? super T>... listeners) {
		requireNonNull(sources);

		register(event, listeners);

		getLock().lock();

		try {
			for (Consumer<? super T> listener : listeners)
				for (EventSource source : sources)
					this.subscriptions.add(source.addListener(event, listener));
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Removes every tracked listener from the given source, across all of its events.
	 *
	 * @param source the source
	 */
	public void removeFrom(@NonNull EventSource source) {
		removeFrom(source, null, false);
	}

	/**
	 * Removes tracked listeners from the given source.
	 * <p>
	 * Only listeners which are both attached to {@code source} and registered in this tracker are removed. When
	 * {@code unregister} is {@code true}, registrations which were found on the source are also dropped from this
	 * tracker; registrations not found on the source are kept.
	 *
	 * @param source     the source
	 * @param event      limits removal to this event, or {@code null} for every event on the source
	 * @param unregister whether to also drop the removed registrations from this tracker
	 */
	public void removeFrom(@NonNull EventSource source,
												 @Nullable Event<?> event,
												 @NonNull Boolean unregister) {
		requireNonNull(source);
		requireNonNull(unregister);

		getLock().lock();

		try {
			if (this.registrations.isEmpty())
				return;

			Collection<Event<?>> events = event == null ? source.eventNames() : List.of(event);

			for (Event<?> currentEvent : events) {
				List<Consumer<?>> attachedListeners = source.listeners(currentEvent);

				for (int i = this.registrations.size() - 1; i >= 0; --i) {
					EventRegistration registration = this.registrations.get(i);

					if (registration.getEvent() != currentEvent)
						continue;

					boolean found = false;

					for (Consumer<?> attachedListener : attachedListeners) {
						if (attachedListener == registration.getListener()) {
							source.removeListener(currentEvent, attachedListener);
							found = true;
						}
					}

					if (found && unregister)
						this.registrations.remove(i);
				}
			}

			this.subscriptions.removeIf(Subscription::isDisposed);
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Clears every registration.
	 */
	public void unregister() {
		unregister(null);
	}

	/**
	 * Drops registrations matching the given event and/or listeners. Attached listeners are not detached.
	 * <p>
	 * With neither an event nor listeners, everything is cleared. With only an event, all of its registrations are
	 * dropped. With only listeners, those listeners are dropped under every event.
	 *
	 * @param event     the event to match, or {@code null} to match any event
	 * @param listeners the listeners to match, or none to match any listener
	 */
	public void unregister(@Nullable Event<?> event,
												 @Nullable Consumer<?>... listeners) {
		boolean anyListeners = listeners != null && listeners.length > 0;

		getLock().lock();

		try {
			if (event == null && !anyListeners) {
				this.registrations.clear();
				return;
			}

			for (int i = this.registrations.size() - 1; i >= 0; --i) {
				EventRegistration registration = this.registrations.get(i);

				if (event != null && registration.getEvent() != event)
					continue;

				if (!anyListeners) {
					this.registrations.remove(i);
					continue;
				}

				for (Consumer<?> listener : listeners) {
					if (registration.getListener() == listener) {
						this.registrations.remove(i);
						break;
					}
				}
			}
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Detaches every listener this tracker attached via {@code registerOn} and clears all registrations.
	 */
	public void dispose() {
		getLock().lock();

		try {
			for (Subscription subscription : this.subscriptions)
				subscription.dispose();

			this.subscriptions.clear();
			this.registrations.clear();
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Gets a snapshot of the registrations in this tracker, in registration order.
	 *
	 * @return the registrations
	 */
	@NonNull
	public List<EventRegistration> getRegistrations() {
		getLock().lock();

		try {
			return Collections.unmodifiableList(new ArrayList<>(this.registrations));
		} finally {
			getLock().unlock();
		}
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{registrations=%s}", getClass().getSimpleName(), getRegistrations().size());
	}

	private static void validate(@Nullable Event<?> event,
															 @Nullable Consumer<?>[] listeners) {
		if (event == null)
			throw new IllegalArgumentException("The event is required");

		if (listeners == null || listeners.length == 0)
			throw new IllegalArgumentException("At least one listener is required");

		for (Consumer<?> listener : listeners)
			if (listener == null)
				throw new IllegalArgumentException(format("Cannot register a null listener for %s", event.getName()));
	}

	@NonNull
	private ReentrantLock getLock() {
		return this.lock;
	}
}
