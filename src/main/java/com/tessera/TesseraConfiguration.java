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
 * Server, authentication and behavior settings shared by every {@link Connection} of a {@link Tessera} instance.
 * <p>
 * Transports read what they need from here; the session layer itself only uses the timeouts, the
 * {@link DisplayMode}, the debug flag and the pool settings.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class TesseraConfiguration {
	@NonNull
	private final String server;
	@NonNull
	private final Integer port;
	@Nullable
	private final String instanceName;
	@Nullable
	private final String database;
	@Nullable
	private final String appName;
	@NonNull
	private final Boolean encrypt;
	@Nullable
	private final String user;
	@Nullable
	private final String password;
	@Nullable
	private final String domain;
	@NonNull
	private final Duration connectTimeout;
	@NonNull
	private final Duration requestTimeout;
	@NonNull
	private final DisplayMode displayMode;
	@NonNull
	private final Boolean debug;
	@NonNull
	private final PoolConfiguration poolConfiguration;

	@NonNull
	public static Builder builder() {
		return new Builder();
	}

	@NonNull
	public static TesseraConfiguration withDefaults() {
		return builder().build();
	}

	private TesseraConfiguration(@NonNull Builder builder) {
		this.server = builder.server == null ? "localhost" : builder.server;
		this.port = builder.port == null ? 1433 : builder.port;
		this.instanceName = builder.instanceName;
		this.database = builder.database;
		this.appName = builder.appName;
		this.encrypt = builder.encrypt == null ? false : builder.encrypt;
		this.user = builder.user;
		this.password = builder.password;
		this.domain = builder.domain;
		this.connectTimeout = builder.connectTimeout == null ? Duration.ofSeconds(15) : builder.connectTimeout;
		this.requestTimeout = builder.requestTimeout == null ? Duration.ofSeconds(15) : builder.requestTimeout;
		this.displayMode = builder.displayMode == null ? DisplayMode.POSITIONAL : builder.displayMode;
		this.debug = builder.debug == null ? false : builder.debug;
		this.poolConfiguration = builder.poolConfiguration == null ? PoolConfiguration.withDefaults() : builder.poolConfiguration;

		if (this.port < 1 || this.port > 65535)
			throw new IllegalArgumentException(format("Port %d is out of range", this.port));

		if (this.connectTimeout.isNegative() || this.requestTimeout.isNegative())
			throw new IllegalArgumentException("Timeouts cannot be negative");
	}

	@NonNull
	public String getServer() {
		return this.server;
	}

	@NonNull
	public Integer getPort() {
		return this.port;
	}

	/**
	 * @return the named server instance, which takes precedence over {@link #getPort()} when present
	 */
	@NonNull
	public Optional<String> getInstanceName() {
		return Optional.ofNullable(this.instanceName);
	}

	@NonNull
	public Optional<String> getDatabase() {
		return Optional.ofNullable(this.database);
	}

	@NonNull
	public Optional<String> getAppName() {
		return Optional.ofNullable(this.appName);
	}

	@NonNull
	public Boolean getEncrypt() {
		return this.encrypt;
	}

	@NonNull
	public Optional<String> getUser() {
		return Optional.ofNullable(this.user);
	}

	@NonNull
	public Optional<String> getPassword() {
		return Optional.ofNullable(this.password);
	}

	/**
	 * @return the Windows domain, present only for NTLM authentication
	 */
	@NonNull
	public Optional<String> getDomain() {
		return Optional.ofNullable(this.domain);
	}

	@NonNull
	public Duration getConnectTimeout() {
		return this.connectTimeout;
	}

	/**
	 * @return the timeout applied to requests which do not set their own, where {@link Duration#ZERO} means none
	 */
	@NonNull
	public Duration getRequestTimeout() {
		return this.requestTimeout;
	}

	@NonNull
	public DisplayMode getDisplayMode() {
		return this.displayMode;
	}

	/**
	 * @return whether transport debug and info messages are relayed to the connection logger
	 */
	@NonNull
	public Boolean getDebug() {
		return this.debug;
	}

	@NonNull
	public PoolConfiguration getPoolConfiguration() {
		return this.poolConfiguration;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{server=%s, port=%s, instanceName=%s, database=%s, user=%s, password=%s, displayMode=%s}",
				getClass().getSimpleName(), getServer(), getPort(), this.instanceName, this.database, this.user,
				this.password == null ? null : "[redacted]", getDisplayMode().name());
	}

	/**
	 * Builder used to construct instances of {@link TesseraConfiguration}.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@Nullable
		private String server;
		@Nullable
		private Integer port;
		@Nullable
		private String instanceName;
		@Nullable
		private String database;
		@Nullable
		private String appName;
		@Nullable
		private Boolean encrypt;
		@Nullable
		private String user;
		@Nullable
		private String password;
		@Nullable
		private String domain;
		@Nullable
		private Duration connectTimeout;
		@Nullable
		private Duration requestTimeout;
		@Nullable
		private DisplayMode displayMode;
		@Nullable
		private Boolean debug;
		@Nullable
		private PoolConfiguration poolConfiguration;

		private Builder() {
			// Use TesseraConfiguration.builder()
		}

		@NonNull
		public Builder server(@Nullable String server) {
			this.server = server;
			return this;
		}

		@NonNull
		public Builder port(@Nullable Integer port) {
			this.port = port;
			return this;
		}

		@NonNull
		public Builder instanceName(@Nullable String instanceName) {
			this.instanceName = instanceName;
			return this;
		}

		@NonNull
		public Builder database(@Nullable String database) {
			this.database = database;
			return this;
		}

		@NonNull
		public Builder appName(@Nullable String appName) {
			this.appName = appName;
			return this;
		}

		@NonNull
		public Builder encrypt(@Nullable Boolean encrypt) {
			this.encrypt = encrypt;
			return this;
		}

		@NonNull
		public Builder user(@Nullable String user) {
			this.user = user;
			return this;
		}

		@NonNull
		public Builder password(@Nullable String password) {
			this.password = password;
			return this;
		}

		@NonNull
		public Builder domain(@Nullable String domain) {
			this.domain = domain;
			return this;
		}

		@NonNull
		public Builder connectTimeout(@Nullable Duration connectTimeout) {
			this.connectTimeout = connectTimeout;
			return this;
		}

		@NonNull
		public Builder requestTimeout(@Nullable Duration requestTimeout) {
			this.requestTimeout = requestTimeout;
			return this;
		}

		@NonNull
		public Builder displayMode(@Nullable DisplayMode displayMode) {
			this.displayMode = displayMode;
			return this;
		}

		@NonNull
		public Builder debug(@Nullable Boolean debug) {
			this.debug = debug;
			return this;
		}

		@NonNull
		public Builder poolConfiguration(@Nullable PoolConfiguration poolConfiguration) {
			this.poolConfiguration = poolConfiguration;
			return this;
		}

		@NonNull
		public TesseraConfiguration build() {
			return new TesseraConfiguration(this);
		}
	}
}
