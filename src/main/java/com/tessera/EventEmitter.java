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
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Default {@link EventSource} implementation which can also {@link #emit(Event, Object)} payloads.
 * <p>
 * Listeners are invoked synchronously, on the emitting thread, in attachment order.
 * A listener attached or detached during an emit does not affect that emit.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public class EventEmitter implements EventSource {
	@NonNull
	private final Map<Event<?>, CopyOnWriteArrayList<Attachment>> attachmentsByEvent;

	public EventEmitter() {
		this.attachmentsByEvent = new ConcurrentHashMap<>();
	}

	@Override
	@NonNull
	public <T> Subscription addListener(@NonNull Event<T> event,
																			@NonNull Consumer<? super T> listener) {
		requireNonNull(event);
		requireNonNull(listener);

		Attachment attachment = new Attachment(event, listener);
		getAttachmentsByEvent().computeIfAbsent(event, ignored -> new CopyOnWriteArrayList<>()).add(attachment);
		return attachment;
	}

	@Override
	@NonNull
	public Boolean removeListener(@NonNull Event<?> event,
																@NonNull Consumer<?> listener) {
		requireNonNull(event);
		requireNonNull(listener);

		List<Attachment> attachments = getAttachmentsByEvent().get(event);

		if (attachments == null)
			return false;

		for (int i = attachments.size() - 1; i >= 0; --i) {
			Attachment attachment = attachments.get(i);

			if (attachment.getListener() == listener)
				return detach(attachment);
		}

		return false;
	}

	@Override
	@NonNull
	public List<Consumer<?>> listeners(@NonNull Event<?> event) {
		requireNonNull(event);

		List<Attachment> attachments = getAttachmentsByEvent().get(event);

		if (attachments == null)
			return List.of();

		List<Consumer<?>> listeners = new ArrayList<>(attachments.size());

		for (Attachment attachment : attachments)
			listeners.add(attachment.getListener());

		return Collections.unmodifiableList(listeners);
	}

	@Override
	@NonNull
	public Set<Event<?>> eventNames() {
		Set<Event<?>> eventNames = new LinkedHashSet<>();

		for (Map.Entry<Event<?>, CopyOnWriteArrayList<Attachment>> entry : getAttachmentsByEvent().entrySet())
			if (entry.getValue().size() > 0)
				eventNames.add(entry.getKey());

		return Collections.unmodifiableSet(eventNames);
	}

	/**
	 * Invokes every listener currently attached for {@code event} with the given payload.
	 * <p>
	 * An exception thrown by a listener propagates to the caller and skips the remaining listeners.
	 *
	 * @param event   the event to emit
	 * @param payload the payload, which may be {@code null} for events that carry none
	 * @param <T>     the payload type
	 * @return {@code true} if at least one listener was invoked, {@code false} otherwise
	 */
	@NonNull
	@SuppressWarnings("unchecked")
	public <T> Boolean emit(@NonNull Event<T> event,
													@Nullable T payload) {
		requireNonNull(event);

		List<Attachment> attachments = getAttachmentsByEvent().get(event);

		if (attachments == null || attachments.size() == 0)
			return false;

		for (Attachment attachment : attachments)
			((Consumer<T>) attachment.getListener()).accept(payload);

		return true;
	}

	/**
	 * Detaches every listener for every event.
	 */
	public void removeAllListeners() {
		getAttachmentsByEvent().clear();
	}

	@NonNull
	protected Boolean detach(@NonNull Attachment attachment) {
		requireNonNull(attachment);

		attachment.markDisposed();

		List<Attachment> attachments = getAttachmentsByEvent().get(attachment.getEvent());
		return attachments != null && attachments.remove(attachment);
	}

	@NonNull
	protected Map<Event<?>, CopyOnWriteArrayList<Attachment>> getAttachmentsByEvent() {
		return this.attachmentsByEvent;
	}

	/**
	 * One attachment of a listener to an event. Compared by identity so duplicates stay distinct.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@ThreadSafe
	protected final class Attachment implements Subscription {
		@NonNull
		private final Event<?> event;
		@NonNull
		private final Consumer<?> listener;
		@NonNull
		private final AtomicBoolean disposed;

		private Attachment(@NonNull Event<?> event,
											 @NonNull Consumer<?> listener) {
			this.event = event;
			this.listener = listener;
			this.disposed = new AtomicBoolean(false);
		}

		@Override
		public void dispose() {
			if (!isDisposed())
				detach(this);
		}

		@Override
		@NonNull
		public Boolean isDisposed() {
			return this.disposed.get();
		}

		void markDisposed() {
			this.disposed.set(true);
		}

		@NonNull
		Event<?> getEvent() {
			return this.event;
		}

		@NonNull
		Consumer<?> getListener() {
			return this.listener;
		}

		@Override
		@NonNull
		public String toString() {
			return format("%s{event=%s, disposed=%s}", getClass().getSimpleName(), getEvent().getName(), isDisposed());
		}
	}
}
