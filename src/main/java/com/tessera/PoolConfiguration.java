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

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.Optional;

import static java.lang.String.format;

/**
 * Sizing and timeouts for the {@link ConnectionPool}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class PoolConfiguration {
	@NonNull
	private final Integer minSize;
	@NonNull
	private final Integer maxSize;
	@NonNull
	private final Duration acquireTimeout;
	@NonNull
	private final Duration idleTimeout;
	@Nullable
	private final Duration evictionInterval;
	@NonNull
	private final Boolean testOnBorrow;

	@NonNull
	public static Builder builder() {
		return new Builder();
	}

	@NonNull
	public static PoolConfiguration withDefaults() {
		return builder().build();
	}

	private PoolConfiguration(@NonNull Builder builder) {
		this.minSize = builder.minSize == null ? 0 : builder.minSize;
		this.maxSize = builder.maxSize == null ? 10 : builder.maxSize;
		this.acquireTimeout = builder.acquireTimeout == null ? Duration.ofSeconds(30) : builder.acquireTimeout;
		this.idleTimeout = builder.idleTimeout == null ? Duration.ofSeconds(30) : builder.idleTimeout;
		this.evictionInterval = builder.evictionInterval;
		this.testOnBorrow = builder.testOnBorrow == null ? true : builder.testOnBorrow;

		if (this.minSize < 0)
			throw new IllegalArgumentException("Minimum pool size cannot be negative");

		if (this.maxSize < 1)
			throw new IllegalArgumentException("Maximum pool size must be at least 1");

		if (this.minSize > this.maxSize)
			throw new IllegalArgumentException(format("Minimum pool size %d exceeds maximum pool size %d", this.minSize, this.maxSize));
	}

	@NonNull
	public Integer getMinSize() {
		return this.minSize;
	}

	@NonNull
	public Integer getMaxSize() {
		return this.maxSize;
	}

	/**
	 * @return how long {@link ConnectionPool#acquire()} waits for a free connection before failing
	 */
	@NonNull
	public Duration getAcquireTimeout() {
		return this.acquireTimeout;
	}

	/**
	 * @return how long a connection may sit idle before it becomes eligible for eviction
	 */
	@NonNull
	public Duration getIdleTimeout() {
		return this.idleTimeout;
	}

	/**
	 * @return how often the evictor runs, or empty if idle connections are never evicted
	 */
	@NonNull
	public Optional<Duration> getEvictionInterval() {
		return Optional.ofNullable(this.evictionInterval);
	}

	/**
	 * @return whether connections are validated each time they are acquired
	 */
	@NonNull
	public Boolean getTestOnBorrow() {
		return this.testOnBorrow;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{minSize=%s, maxSize=%s, acquireTimeout=%s, idleTimeout=%s, evictionInterval=%s, testOnBorrow=%s}",
				getClass().getSimpleName(), getMinSize(), getMaxSize(), getAcquireTimeout(), getIdleTimeout(),
				this.evictionInterval, getTestOnBorrow());
	}

	/**
	 * Builder used to construct instances of {@link PoolConfiguration}.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@Nullable
		private Integer minSize;
		@Nullable
		private Integer maxSize;
		@Nullable
		private Duration acquireTimeout;
		@Nullable
		private Duration idleTimeout;
		@Nullable
		private Duration evictionInterval;
		@Nullable
		private Boolean testOnBorrow;

		private Builder() {
			// Use PoolConfiguration.builder()
		}

		@NonNull
		public Builder minSize(@Nullable Integer minSize) {
			this.minSize = minSize;
			return this;
		}

		@NonNull
		public Builder maxSize(@Nullable Integer maxSize) {
			this.maxSize = maxSize;
			return this;
		}

		@NonNull
		public Builder acquireTimeout(@Nullable Duration acquireTimeout) {
			this.acquireTimeout = acquireTimeout;
			return this;
		}

		@NonNull
		public Builder idleTimeout(@Nullable Duration idleTimeout) {
			this.idleTimeout = idleTimeout;
			return this;
		}

		@NonNull
		public Builder evictionInterval(@Nullable Duration evictionInterval) {
			this.evictionInterval = evictionInterval;
			return this;
		}

		@NonNull
		public Builder testOnBorrow(@Nullable Boolean testOnBorrow) {
			this.testOnBorrow = testOnBorrow;
			return this;
		}

		@NonNull
		public PoolConfiguration build() {
			return new PoolConfiguration(this);
		}
	}
}
