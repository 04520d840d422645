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

package com.tessera.jdbc;

import com.tessera.BulkLoadOptions;
import com.tessera.ColumnMetadata;
import com.tessera.ColumnValue;
import com.tessera.DatabaseException;
import com.tessera.DoneToken;
import com.tessera.Event;
import com.tessera.EventEmitter;
import com.tessera.RequestTimeoutException;
import com.tessera.SqlType;
import com.tessera.Subscription;
import com.tessera.TesseraConfiguration;
import com.tessera.TransactionIsolation;
import com.tessera.TransportBulkLoad;
import com.tessera.TransportConnection;
import com.tessera.TransportEvents;
import com.tessera.TransportRequest;
import com.tessera.jdbc.JdbcTransportRequest.JdbcParameter;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;
import javax.sql.DataSource;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.sql.CallableStatement;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.Savepoint;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Calendar;
import java.util.Collections;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.FINE;
import static java.util.logging.Level.WARNING;

/**
 * A {@link TransportConnection} over one JDBC {@link Connection}.
 * <p>
 * Every operation runs on the transport's {@link Executor} and reports through events and callbacks, the same way a
 * wire protocol client would. Statement results are walked with {@link Statement#getMoreResults()} and reported as
 * {@link TransportEvents#COLUMN_METADATA}, {@link TransportEvents#ROW} and {@link TransportEvents#DONE} events.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
class JdbcTransportConnection implements TransportConnection {
	@NonNull
	private static final Pattern PROCEDURE_NAME_PATTERN;
	@NonNull
	private static final Pattern PROCEDURE_WITH_ARGUMENTS_PATTERN;

	static {
		PROCEDURE_NAME_PATTERN = Pattern.compile("^[\\w$#.\\[\\]\"]+$");
		PROCEDURE_WITH_ARGUMENTS_PATTERN = Pattern.compile("^([\\w$#.\\[\\]\"]+)\\s+(.+)$", Pattern.DOTALL);
	}

	@NonNull
	private final DataSource dataSource;
	@NonNull
	private final TesseraConfiguration configuration;
	@NonNull
	private final Executor executor;
	@NonNull
	private final EventEmitter eventEmitter;
	@NonNull
	private final AtomicBoolean closed;
	@NonNull
	private final ReentrantLock lock;
	@NonNull
	@GuardedBy("lock")
	private final Map<String, Savepoint> savepointsByName;
	@NonNull
	private final Logger logger;
	@Nullable
	private volatile Connection jdbcConnection;
	@Nullable
	@GuardedBy("lock")
	private Integer isolationBeforeTransaction;

	JdbcTransportConnection(@NonNull DataSource dataSource,
													@NonNull TesseraConfiguration configuration,
													@NonNull Executor executor) {
		requireNonNull(dataSource);
		requireNonNull(configuration);
		requireNonNull(executor);

		this.dataSource = dataSource;
		this.configuration = configuration;
		this.executor = executor;
		this.eventEmitter = new EventEmitter();
		this.closed = new AtomicBoolean(false);
		this.lock = new ReentrantLock();
		this.savepointsByName = new HashMap<>();
		this.logger = Logger.getLogger(JdbcTransportConnection.class.getName());
	}

	@Override
	public void connect() {
		getExecutor().execute(() -> {
			try {
				this.jdbcConnection = getDataSource().getConnection();
				debug(format("Opened JDBC connection to %s", getConfiguration().getServer()));
				getEventEmitter().emit(TransportEvents.CONNECT, null);
			} catch (SQLException | RuntimeException e) {
				getEventEmitter().emit(TransportEvents.ERROR,
						new DatabaseException(format("Unable to open JDBC connection to %s", getConfiguration().getServer()), e));
			}
		});
	}

	@Override
	public void close() {
		if (!this.closed.compareAndSet(false, true))
			return;

		getExecutor().execute(() -> {
			Connection connection = this.jdbcConnection;

			if (connection != null) {
				try {
					connection.close();
				} catch (SQLException e) {
					// The server side is gone either way
					getLogger().log(WARNING, "Unable to close JDBC connection", e);
				}
			}

			getEventEmitter().emit(TransportEvents.END, null);
		});
	}

	@Override
	@NonNull
	public Boolean isClosed() {
		return this.closed.get();
	}

	@Override
	@NonNull
	public Boolean isLoggedIn() {
		Connection connection = this.jdbcConnection;

		if (connection == null || isClosed())
			return false;

		try {
			return !connection.isClosed();
		} catch (SQLException e) {
			return false;
		}
	}

	@Override
	@NonNull
	public TransportRequest newRequest(@NonNull String sql,
																		 @NonNull Consumer<@Nullable Throwable> callback) {
		return new JdbcTransportRequest(sql, callback);
	}

	@Override
	public void execSql(@NonNull TransportRequest request) {
		JdbcTransportRequest jdbcRequest = requireJdbcRequest(request);

		getExecutor().execute(() -> runRequest(jdbcRequest, () -> {
			SqlScanner.PositionalStatement positionalStatement = SqlScanner.positional(jdbcRequest.getSql());

			try (PreparedStatement preparedStatement = requireJdbcConnection().prepareStatement(positionalStatement.getSql())) {
				applyTimeout(preparedStatement, jdbcRequest.getTimeout().orElse(null));
				bindParameters(preparedStatement, positionalStatement.getParameterNames(), jdbcRequest, false);
				emitResults(jdbcRequest, preparedStatement, preparedStatement.execute(), TransportEvents.DONE, false);
			}
		}));
	}

	@Override
	public void execSqlBatch(@NonNull TransportRequest request) {
		JdbcTransportRequest jdbcRequest = requireJdbcRequest(request);

		getExecutor().execute(() -> runRequest(jdbcRequest, () -> {
			List<String> statements = SqlScanner.split(jdbcRequest.getSql());

			try (Statement statement = requireJdbcConnection().createStatement()) {
				applyTimeout(statement, jdbcRequest.getTimeout().orElse(null));

				for (int i = 0; i < statements.size(); ++i)
					emitResults(jdbcRequest, statement, statement.execute(statements.get(i)), TransportEvents.DONE,
							i < statements.size() - 1);
			}
		}));
	}

	@Override
	public void callProcedure(@NonNull TransportRequest request) {
		JdbcTransportRequest jdbcRequest = requireJdbcRequest(request);

		getExecutor().execute(() -> runRequest(jdbcRequest, () -> {
			String target = jdbcRequest.getSql().trim();
			String callSql;
			List<String> parameterNames;

			if (PROCEDURE_NAME_PATTERN.matcher(target).matches()) {
				parameterNames = new ArrayList<>(jdbcRequest.getParameters().keySet());
				callSql = format("{call %s(%s)}", target, String.join(", ", Collections.nCopies(parameterNames.size(), "?")));
			} else {
				Matcher matcher = PROCEDURE_WITH_ARGUMENTS_PATTERN.matcher(target);
				SqlScanner.PositionalStatement positionalStatement = matcher.matches()
						? SqlScanner.positional(format("%s(%s)", matcher.group(1), matcher.group(2)))
						: SqlScanner.positional(target);

				parameterNames = positionalStatement.getParameterNames();
				callSql = format("{call %s}", positionalStatement.getSql());
			}

			try (CallableStatement callableStatement = requireJdbcConnection().prepareCall(callSql)) {
				applyTimeout(callableStatement, jdbcRequest.getTimeout().orElse(null));
				bindParameters(callableStatement, parameterNames, jdbcRequest, true);
				emitResults(jdbcRequest, callableStatement, callableStatement.execute(), TransportEvents.DONE_IN_PROC, true);
				jdbcRequest.emit(TransportEvents.DONE_PROC, new DoneToken(null, false, null));
			}
		}));
	}

	@Override
	public void beginTransaction(@NonNull Consumer<@Nullable Throwable> callback,
															 @NonNull String name,
															 @NonNull TransactionIsolation isolation) {
		requireNonNull(callback);
		requireNonNull(name);
		requireNonNull(isolation);

		getExecutor().execute(() -> runControl(callback, () -> {
			Connection connection = requireJdbcConnection();

			getLock().lock();

			try {
				this.savepointsByName.clear();
				this.isolationBeforeTransaction = null;

				if (isolation.getJdbcLevel().isPresent()) {
					this.isolationBeforeTransaction = connection.getTransactionIsolation();
					connection.setTransactionIsolation(isolation.getJdbcLevel().get());
				}

				connection.setAutoCommit(false);
			} finally {
				getLock().unlock();
			}

			debug(format("Began transaction %s", name));
		}));
	}

	@Override
	public void saveTransaction(@NonNull Consumer<@Nullable Throwable> callback,
															@NonNull String name) {
		requireNonNull(callback);
		requireNonNull(name);

		getExecutor().execute(() -> runControl(callback, () -> {
			Savepoint savepoint = requireJdbcConnection().setSavepoint(name);

			getLock().lock();

			try {
				this.savepointsByName.put(name, savepoint);
			} finally {
				getLock().unlock();
			}
		}));
	}

	@Override
	public void commitTransaction(@NonNull Consumer<@Nullable Throwable> callback) {
		requireNonNull(callback);

		getExecutor().execute(() -> runControl(callback, () -> {
			Connection connection = requireJdbcConnection();
			connection.commit();
			endTransaction(connection);
		}));
	}

	@Override
	public void rollbackTransaction(@NonNull Consumer<@Nullable Throwable> callback,
																	@Nullable String name) {
		requireNonNull(callback);

		getExecutor().execute(() -> runControl(callback, () -> {
			Connection connection = requireJdbcConnection();

			if (name == null) {
				connection.rollback();
				endTransaction(connection);
				return;
			}

			Savepoint savepoint;

			getLock().lock();

			try {
				savepoint = this.savepointsByName.get(name);
			} finally {
				getLock().unlock();
			}

			if (savepoint == null)
				throw new DatabaseException(format("No savepoint named '%s' exists in the current transaction", name));

			connection.rollback(savepoint);
		}));
	}

	@Override
	@NonNull
	public TransportBulkLoad newBulkLoad(@NonNull String table,
																			 @NonNull BulkLoadOptions options,
																			 @NonNull BiConsumer<@Nullable Throwable, @Nullable Long> callback) {
		return new JdbcBulkLoad(table, options, callback);
	}

	@Override
	public void execBulkLoad(@NonNull TransportBulkLoad bulkLoad) {
		requireNonNull(bulkLoad);

		if (!(bulkLoad instanceof JdbcBulkLoad jdbcBulkLoad))
			throw new IllegalArgumentException(format("Bulk load %s was not created by this transport", bulkLoad));

		getExecutor().execute(() -> {
			long rowCount = 0;

			if (jdbcBulkLoad.getRows().size() == 0) {
				jdbcBulkLoad.getCallback().accept(null, 0L);
				return;
			}

			List<SqlType> columnTypes = jdbcBulkLoad.getColumnTypes();

			try (PreparedStatement preparedStatement = requireJdbcConnection().prepareStatement(jdbcBulkLoad.toInsertStatement())) {
				applyTimeout(preparedStatement, jdbcBulkLoad.getTimeout().orElse(null));

				for (List<Object> row : jdbcBulkLoad.getRows()) {
					for (int i = 0; i < row.size(); ++i)
						bindValue(preparedStatement, i + 1, columnTypes.get(i), row.get(i));

					preparedStatement.addBatch();
				}

				for (int updateCount : preparedStatement.executeBatch())
					rowCount += updateCount == Statement.SUCCESS_NO_INFO ? 1 : Math.max(updateCount, 0);
			} catch (SQLException | RuntimeException e) {
				jdbcBulkLoad.getCallback().accept(toDatabaseException(e, jdbcBulkLoad.getTimeout().orElse(null)), null);
				return;
			}

			jdbcBulkLoad.getCallback().accept(null, rowCount);
		});
	}

	@Override
	@NonNull
	public <T> Subscription addListener(@NonNull Event<T> event,
																			@NonNull Consumer<? super T> listener) {
		return getEventEmitter().addListener(event, listener);
	}

	@Override
	@NonNull
	public Boolean removeListener(@NonNull Event<?> event,
																@NonNull Consumer<?> listener) {
		return getEventEmitter().removeListener(event, listener);
	}

	@Override
	@NonNull
	public List<Consumer<?>> listeners(@NonNull Event<?> event) {
		return getEventEmitter().listeners(event);
	}

	@Override
	@NonNull
	public Set<Event<?>> eventNames() {
		return getEventEmitter().eventNames();
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{server=%s, closed=%s}", getClass().getSimpleName(), getConfiguration().getServer(), isClosed());
	}

	/**
	 * A unit of JDBC work which may fail with {@link SQLException}.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@FunctionalInterface
	private interface JdbcWork {
		void perform() throws SQLException;
	}

	private void runRequest(@NonNull JdbcTransportRequest request,
													@NonNull JdbcWork work) {
		Throwable failure = null;

		try {
			work.perform();
		} catch (SQLException | RuntimeException e) {
			failure = toDatabaseException(e, request.getTimeout().orElse(null));
			request.emit(TransportEvents.ERROR, failure);
		}

		request.getCallback().accept(failure);
		request.emit(TransportEvents.REQUEST_COMPLETED, null);
	}

	private void runControl(@NonNull Consumer<@Nullable Throwable> callback,
													@NonNull JdbcWork work) {
		try {
			work.perform();
		} catch (SQLException | RuntimeException e) {
			callback.accept(toDatabaseException(e, null));
			return;
		}

		callback.accept(null);
	}

	/**
	 * Walks every result of an executed statement, emitting its columns and rows followed by {@code doneEvent}.
	 *
	 * @param moreAfterStatement whether something else follows the last result of this statement
	 */
	private void emitResults(@NonNull JdbcTransportRequest request,
													 @NonNull Statement statement,
													 boolean resultSetAvailable,
													 @NonNull Event<DoneToken> doneEvent,
													 boolean moreAfterStatement) throws SQLException {
		boolean resultSet = resultSetAvailable;

		while (true) {
			long rowCount;

			if (resultSet) {
				rowCount = emitResultSet(request, statement.getResultSet());
			} else {
				int updateCount = statement.getUpdateCount();

				if (updateCount == -1)
					break;

				rowCount = updateCount;
			}

			resultSet = statement.getMoreResults();
			boolean more = resultSet || statement.getUpdateCount() != -1;

			request.emit(doneEvent, new DoneToken(rowCount, more || moreAfterStatement));
		}
	}

	private long emitResultSet(@NonNull JdbcTransportRequest request,
														 @NonNull ResultSet resultSet) throws SQLException {
		long rowCount = 0;

		try (resultSet) {
			ResultSetMetaData resultSetMetaData = resultSet.getMetaData();
			List<ColumnMetadata> columns = new ArrayList<>(resultSetMetaData.getColumnCount());

			for (int i = 1; i <= resultSetMetaData.getColumnCount(); ++i) {
				int nullable = resultSetMetaData.isNullable(i);

				columns.add(new ColumnMetadata(resultSetMetaData.getColumnLabel(i),
						SqlType.fromJdbcType(resultSetMetaData.getColumnType(i)).orElse(null),
						resultSetMetaData.getColumnDisplaySize(i),
						resultSetMetaData.getPrecision(i),
						resultSetMetaData.getScale(i),
						nullable == ResultSetMetaData.columnNullableUnknown ? null : nullable == ResultSetMetaData.columnNullable));
			}

			request.emit(TransportEvents.COLUMN_METADATA, columns);

			while (resultSet.next()) {
				List<ColumnValue> row = new ArrayList<>(columns.size());

				for (int i = 0; i < columns.size(); ++i)
					row.add(new ColumnValue(columns.get(i), resultSet.getObject(i + 1)));

				request.emit(TransportEvents.ROW, row);
				++rowCount;
			}
		}

		return rowCount;
	}

	private void bindParameters(@NonNull PreparedStatement preparedStatement,
															@NonNull List<String> parameterNames,
															@NonNull JdbcTransportRequest request,
															boolean allowOutput) throws SQLException {
		for (int i = 0; i < parameterNames.size(); ++i) {
			String parameterName = parameterNames.get(i);
			JdbcParameter parameter = request.getParameters().get(parameterName);

			if (parameter == null)
				throw new DatabaseException(format("Must declare the scalar variable \"@%s\"", parameterName));

			if (parameter.isOutput() && allowOutput) {
				((CallableStatement) preparedStatement).registerOutParameter(i + 1, parameter.getType().getJdbcType());

				if (parameter.getValue() != null)
					bindValue(preparedStatement, i + 1, parameter.getType(), parameter.getValue());
			} else {
				bindValue(preparedStatement, i + 1, parameter.getType(), parameter.getValue());
			}
		}
	}

	private static void bindValue(@NonNull PreparedStatement preparedStatement,
																int index,
																@NonNull SqlType type,
																@Nullable Object value) throws SQLException {
		if (value == null)
			preparedStatement.setNull(index, type.getJdbcType());
		else
			preparedStatement.setObject(index, toJdbcValue(value));
	}

	@NonNull
	private static Object toJdbcValue(@NonNull Object value) {
		if (value instanceof ByteBuffer byteBuffer) {
			byte[] bytes = new byte[byteBuffer.remaining()];
			byteBuffer.duplicate().get(bytes);
			return bytes;
		}

		if (value instanceof UUID || value instanceof Character)
			return value.toString();

		if (value instanceof BigInteger bigInteger)
			return new BigDecimal(bigInteger);

		if (value instanceof Instant instant)
			return Timestamp.from(instant);

		if (value instanceof ZonedDateTime zonedDateTime)
			return zonedDateTime.toOffsetDateTime();

		if (value instanceof Calendar calendar)
			return new Timestamp(calendar.getTimeInMillis());

		if (value instanceof Date date && !(value instanceof java.sql.Date || value instanceof java.sql.Time || value instanceof Timestamp))
			return new Timestamp(date.getTime());

		return value;
	}

	private static void applyTimeout(@NonNull Statement statement,
																	 @Nullable Duration timeout) throws SQLException {
		if (timeout == null || timeout.isZero() || timeout.isNegative())
			return;

		statement.setQueryTimeout(toQueryTimeoutSeconds(timeout));
	}

	/**
	 * JDBC timeouts have one-second granularity, so partial seconds round up and oversized values are capped.
	 */
	static int toQueryTimeoutSeconds(@NonNull Duration timeout) {
		requireNonNull(timeout);

		long seconds = timeout.getSeconds();

		if (timeout.getNano() > 0 && seconds < Integer.MAX_VALUE)
			++seconds;

		return (int) Math.min(Integer.MAX_VALUE, Math.max(1L, seconds));
	}

	@NonNull
	static DatabaseException toDatabaseException(@NonNull Throwable throwable,
																											 @Nullable Duration timeout) {
		if (throwable instanceof DatabaseException databaseException)
			return databaseException;

		if (throwable instanceof SQLTimeoutException)
			return new RequestTimeoutException(timeout == null
					? "Request timed out"
					: format("Request timed out after %s", timeout), throwable);

		return new DatabaseException(throwable.getMessage(), throwable);
	}

	private void endTransaction(@NonNull Connection connection) throws SQLException {
		getLock().lock();

		try {
			connection.setAutoCommit(true);

			if (this.isolationBeforeTransaction != null)
				connection.setTransactionIsolation(this.isolationBeforeTransaction);

			this.isolationBeforeTransaction = null;
			this.savepointsByName.clear();
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	private Connection requireJdbcConnection() {
		Connection connection = this.jdbcConnection;

		if (connection == null || isClosed())
			throw new DatabaseException("JDBC connection is not open");

		return connection;
	}

	@NonNull
	private static JdbcTransportRequest requireJdbcRequest(@NonNull TransportRequest request) {
		requireNonNull(request);

		if (!(request instanceof JdbcTransportRequest jdbcRequest))
			throw new IllegalArgumentException(format("Request %s was not created by this transport", request));

		return jdbcRequest;
	}

	private void debug(@NonNull String message) {
		getLogger().log(FINE, message);

		if (getConfiguration().getDebug())
			getEventEmitter().emit(TransportEvents.DEBUG, message);
	}

	@NonNull
	private DataSource getDataSource() {
		return this.dataSource;
	}

	@NonNull
	private TesseraConfiguration getConfiguration() {
		return this.configuration;
	}

	@NonNull
	private Executor getExecutor() {
		return this.executor;
	}

	@NonNull
	private EventEmitter getEventEmitter() {
		return this.eventEmitter;
	}

	@NonNull
	private ReentrantLock getLock() {
		return this.lock;
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}
}
