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
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Something listeners can be attached to: transport connections and requests, and {@link Connection} itself.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public interface EventSource {
	/**
	 * Attaches a listener for the given event.
	 * <p>
	 * The same listener may be attached more than once, in which case it is invoked once per attachment.
	 *
	 * @param event    the event to listen for
	 * @param listener the listener to invoke with each payload
	 * @param <T>      the payload type
	 * @return a handle which detaches exactly this attachment
	 */
	@NonNull
	<T> Subscription addListener(@NonNull Event<T> event,
															 @NonNull Consumer<? super T> listener);

	/**
	 * Detaches the most recent attachment of {@code listener} for the given event, matched by reference.
	 *
	 * @param event    the event the listener was attached to
	 * @param listener the listener to detach
	 * @return {@code true} if an attachment was removed, {@code false} otherwise
	 */
	@NonNull
	Boolean removeListener(@NonNull Event<?> event,
												 @NonNull Consumer<?> listener);

	/**
	 * Gets a snapshot of the listeners currently attached for the given event, in attachment order.
	 *
	 * @param event the event to inspect
	 * @return the attached listeners
	 */
	@NonNull
	List<Consumer<?>> listeners(@NonNull Event<?> event);

	/**
	 * Gets the events which currently have at least one listener attached.
	 *
	 * @return the events with listeners
	 */
	@NonNull
	Set<Event<?>> eventNames();
}
