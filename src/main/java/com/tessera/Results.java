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
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The ordered {@link Result}s of one execution.
 * <p>
 * A single statement produces exactly one {@link Result}, available via {@link #getSingle()}.
 * A multi-statement batch, procedure call or transaction produces one {@link Result} per statement, in execution order.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class Results implements Iterable<Result> {
	@NonNull
	private final List<Result> results;

	Results(@NonNull List<Result> results) {
		requireNonNull(results);
		this.results = Collections.unmodifiableList(new ArrayList<>(results));
	}

	/**
	 * @return {@code true} if exactly one {@link Result} was produced
	 */
	@NonNull
	public Boolean isSingle() {
		return this.results.size() == 1;
	}

	/**
	 * Gets the only {@link Result}.
	 *
	 * @return the single result
	 * @throws IllegalStateException if there is not exactly one result
	 */
	@NonNull
	public Result getSingle() {
		if (!isSingle())
			throw new IllegalStateException(format("Expected exactly one result but there were %d", this.results.size()));

		return this.results.get(0);
	}

	@NonNull
	public Result get(int index) {
		return this.results.get(index);
	}

	@NonNull
	public List<Result> asList() {
		return this.results;
	}

	public int size() {
		return this.results.size();
	}

	@NonNull
	public Boolean isEmpty() {
		return this.results.isEmpty();
	}

	@Override
	@NonNull
	public Iterator<Result> iterator() {
		return this.results.iterator();
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{results=%s}", getClass().getSimpleName(), this.results);
	}
}
