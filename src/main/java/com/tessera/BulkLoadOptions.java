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
 * Server-side behavior of a {@link BulkLoader}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class BulkLoadOptions {
	@NonNull
	private static final BulkLoadOptions DEFAULTS;

	static {
		DEFAULTS = new Builder().build();
	}

	@NonNull
	private final Boolean checkConstraints;
	@NonNull
	private final Boolean fireTriggers;
	@NonNull
	private final Boolean keepNulls;
	@NonNull
	private final Boolean tableLock;
	@Nullable
	private final Duration timeout;

	@NonNull
	public static BulkLoadOptions defaults() {
		return DEFAULTS;
	}

	@NonNull
	public static Builder builder() {
		return new Builder();
	}

	private BulkLoadOptions(@NonNull Builder builder) {
		this.checkConstraints = builder.checkConstraints;
		this.fireTriggers = builder.fireTriggers;
		this.keepNulls = builder.keepNulls;
		this.tableLock = builder.tableLock;
		this.timeout = builder.timeout;
	}

	/**
	 * @return whether constraints on the target table are checked during the insert
	 */
	@NonNull
	public Boolean getCheckConstraints() {
		return this.checkConstraints;
	}

	/**
	 * @return whether insert triggers on the target table fire
	 */
	@NonNull
	public Boolean getFireTriggers() {
		return this.fireTriggers;
	}

	/**
	 * @return whether {@code null}s are kept rather than replaced by column defaults
	 */
	@NonNull
	public Boolean getKeepNulls() {
		return this.keepNulls;
	}

	/**
	 * @return whether a table-level lock is held for the duration of the load
	 */
	@NonNull
	public Boolean getTableLock() {
		return this.tableLock;
	}

	/**
	 * @return the load timeout, or empty to use the configured request timeout
	 */
	@NonNull
	public Optional<Duration> getTimeout() {
		return Optional.ofNullable(this.timeout);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{checkConstraints=%s, fireTriggers=%s, keepNulls=%s, tableLock=%s, timeout=%s}",
				getClass().getSimpleName(), getCheckConstraints(), getFireTriggers(), getKeepNulls(), getTableLock(),
				this.timeout);
	}

	/**
	 * Builder used to construct instances of {@link BulkLoadOptions}.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private Boolean checkConstraints;
		@NonNull
		private Boolean fireTriggers;
		@NonNull
		private Boolean keepNulls;
		@NonNull
		private Boolean tableLock;
		@Nullable
		private Duration timeout;

		private Builder() {
			this.checkConstraints = false;
			this.fireTriggers = false;
			this.keepNulls = false;
			this.tableLock = false;
		}

		@NonNull
		public Builder checkConstraints(@Nullable Boolean checkConstraints) {
			this.checkConstraints = checkConstraints == null ? false : checkConstraints;
			return this;
		}

		@NonNull
		public Builder fireTriggers(@Nullable Boolean fireTriggers) {
			this.fireTriggers = fireTriggers == null ? false : fireTriggers;
			return this;
		}

		@NonNull
		public Builder keepNulls(@Nullable Boolean keepNulls) {
			this.keepNulls = keepNulls == null ? false : keepNulls;
			return this;
		}

		@NonNull
		public Builder tableLock(@Nullable Boolean tableLock) {
			this.tableLock = tableLock == null ? false : tableLock;
			return this;
		}

		@NonNull
		public Builder timeout(@Nullable Duration timeout) {
			if (timeout != null && timeout.isNegative())
				throw new IllegalArgumentException("Timeout cannot be negative");

			this.timeout = timeout;
			return this;
		}

		@NonNull
		public BulkLoadOptions build() {
			return new BulkLoadOptions(this);
		}
	}
}
