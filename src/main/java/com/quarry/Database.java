/*
 * Copyright 2015-2022 Transmogrify LLC, 2022-2026 Revetware LLC.
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

package com.quarry;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ParameterMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

import static java.lang.System.nanoTime;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.WARNING;

/**
 * Main class for performing database access operations.
 * <p>
 * Hands out {@link QueryBuilder}s via {@link #table(String)} and runs their compiled statements, either on a fresh
 * connection borrowed from the {@link DataSource} or on the connection of the current thread's {@link Transaction}.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class Database implements ExecutionHandle {
	@NonNull
	private static final ThreadLocal<Deque<Transaction>> TRANSACTION_STACK_HOLDER;

	static {
		TRANSACTION_STACK_HOLDER = ThreadLocal.withInitial(() -> new ArrayDeque<>());
	}

	@NonNull
	private final DataSource dataSource;
	@NonNull
	private final DatabaseType databaseType;
	@NonNull
	private final Grammar grammar;
	@NonNull
	private final ZoneId timeZone;
	@NonNull
	private final PreparedStatementBinder preparedStatementBinder;
	@NonNull
	private final ResultSetMapper resultSetMapper;
	@NonNull
	private final StatementLogger statementLogger;
	@NonNull
	private final Logger logger;

	@NonNull
	private volatile DatabaseOperationSupportStatus executeLargeUpdateSupported;

	protected Database(@NonNull Builder builder) {
		requireNonNull(builder);

		this.dataSource = requireNonNull(builder.dataSource);

		if (builder.databaseType != null)
			this.databaseType = builder.databaseType;
		else if (builder.grammar != null)
			this.databaseType = builder.grammar.getDatabaseType();
		else
			this.databaseType = DatabaseType.fromDataSource(builder.dataSource);

		// Grammars hold no per-statement state, so one instance serves every builder
		this.grammar = builder.grammar == null ? Grammar.forDatabaseType(this.databaseType) : builder.grammar;
		this.timeZone = builder.timeZone == null ? ZoneId.systemDefault() : builder.timeZone;
		this.preparedStatementBinder = builder.preparedStatementBinder == null ? PreparedStatementBinder.withDefaultConfiguration() : builder.preparedStatementBinder;
		this.resultSetMapper = builder.resultSetMapper == null ? ResultSetMapper.withDefaultConfiguration() : builder.resultSetMapper;
		this.statementLogger = builder.statementLogger == null ? (statementLog) -> {} : builder.statementLogger;
		this.logger = Logger.getLogger(getClass().getName());
		this.executeLargeUpdateSupported = DatabaseOperationSupportStatus.UNKNOWN;
	}

	/**
	 * Provides a {@link Database} builder for the given {@link DataSource}.
	 *
	 * @param dataSource data source used to create the {@link Database} builder
	 * @return a {@link Database} builder
	 */
	@NonNull
	public static Builder withDataSource(@NonNull DataSource dataSource) {
		requireNonNull(dataSource);
		return new Builder(dataSource);
	}

	/**
	 * Creates a query builder for {@code table}.
	 * <p>
	 * If the calling thread is inside {@link #transaction(TransactionalOperation)}, the builder runs its statements in
	 * that transaction. Otherwise each statement borrows its own connection.
	 *
	 * @param table the table to query
	 * @return a new query builder
	 */
	@NonNull
	public QueryBuilder table(@NonNull String table) {
		requireNonNull(table);

		Transaction transaction = currentTransaction().orElse(null);
		return new QueryBuilder(transaction == null ? this : transaction, getGrammar(), table);
	}

	/**
	 * Gets a reference to the innermost transaction this {@code Database} has open on the calling thread, if any.
	 * <p>
	 * Transactions opened by other {@code Database} instances are ignored.
	 *
	 * @return the current transaction
	 */
	@NonNull
	public Optional<Transaction> currentTransaction() {
		for (Transaction transaction : TRANSACTION_STACK_HOLDER.get())
			if (transaction.getDatabase() == this)
				return Optional.of(transaction);

		return Optional.empty();
	}

	/**
	 * Performs an operation transactionally.
	 * <p>
	 * The transaction will be automatically rolled back if an exception bubbles out of {@code transactionalOperation}.
	 *
	 * @param transactionalOperation the operation to perform transactionally
	 */
	public void transaction(@NonNull TransactionalOperation transactionalOperation) {
		requireNonNull(transactionalOperation);

		transaction((transaction) -> {
			transactionalOperation.perform(transaction);
			return Optional.empty();
		});
	}

	/**
	 * Performs an operation transactionally and optionally returns a value.
	 * <p>
	 * The transaction is committed when {@code transactionalOperation} completes normally, unless it was marked
	 * {@link Transaction#setRollbackOnly(Boolean) rollback-only}. Anything thrown rolls the transaction back and is
	 * rethrown; checked exceptions are wrapped in a {@link RuntimeException}.
	 * <p>
	 * Each call opens an independent transaction, even when one is already active on this thread.
	 *
	 * @param transactionalOperation the operation to perform transactionally
	 * @param <T>                    the type to be returned
	 * @return the result of the transactional operation
	 */
	@NonNull
	public <T> Optional<T> transaction(@NonNull ReturningTransactionalOperation<T> transactionalOperation) {
		requireNonNull(transactionalOperation);

		Transaction transaction = new Transaction(this);
		TRANSACTION_STACK_HOLDER.get().push(transaction);
		Throwable thrown = null;

		try {
			Optional<T> returnValue = transactionalOperation.perform(transaction);

			// Safeguard in case user code accidentally returns null instead of Optional.empty()
			if (returnValue == null)
				returnValue = Optional.empty();

			if (transaction.isRollbackOnly())
				transaction.rollback();
			else
				transaction.commit();

			return returnValue;
		} catch (RuntimeException | Error e) {
			thrown = e;
			rollbackAfterFailure(transaction, e);
			restoreInterruptIfNeeded(e);
			throw e;
		} catch (Throwable t) {
			RuntimeException wrapped = new RuntimeException(t);
			thrown = wrapped;
			rollbackAfterFailure(transaction, wrapped);
			restoreInterruptIfNeeded(t);
			throw wrapped;
		} finally {
			Deque<Transaction> transactionStack = TRANSACTION_STACK_HOLDER.get();

			transactionStack.pop();

			// Ensure txn stack is fully cleaned up
			if (transactionStack.isEmpty())
				TRANSACTION_STACK_HOLDER.remove();

			Throwable cleanupFailure = null;

			try {
				if (transaction.getInitialAutoCommit().isPresent() && transaction.getInitialAutoCommit().get())
					// Autocommit was true initially, so restoring to true now that transaction has completed
					transaction.setAutoCommit(true);
			} catch (Throwable cleanupException) {
				cleanupFailure = cleanupException;
			} finally {
				if (transaction.hasConnection()) {
					try {
						closeConnection(transaction.getConnection());
					} catch (Throwable cleanupException) {
						if (cleanupFailure == null)
							cleanupFailure = cleanupException;
						else
							cleanupFailure.addSuppressed(cleanupException);
					}
				}
			}

			if (cleanupFailure != null) {
				if (thrown != null) {
					thrown.addSuppressed(cleanupFailure);
				} else if (cleanupFailure instanceof RuntimeException) {
					throw (RuntimeException) cleanupFailure;
				} else if (cleanupFailure instanceof Error) {
					throw (Error) cleanupFailure;
				} else {
					throw new RuntimeException(cleanupFailure);
				}
			}
		}
	}

	protected void rollbackAfterFailure(@NonNull Transaction transaction,
																			@NonNull Throwable failure) {
		requireNonNull(transaction);
		requireNonNull(failure);

		try {
			transaction.rollback();
		} catch (Exception rollbackException) {
			logger.log(WARNING, "Unable to roll back transaction", rollbackException);
			failure.addSuppressed(rollbackException);
		}
	}

	@Override
	@NonNull
	public List<Map<String, @Nullable Object>> query(@NonNull CompiledQuery compiledQuery,
																									 @NonNull QueryContext queryContext) {
		requireNonNull(compiledQuery);
		requireNonNull(queryContext);

		return performQuery(null, compiledQuery, queryContext);
	}

	@Override
	@NonNull
	public ExecutionResult execute(@NonNull CompiledQuery compiledQuery,
																 @NonNull QueryContext queryContext,
																 boolean returnGeneratedKeys) {
		requireNonNull(compiledQuery);
		requireNonNull(queryContext);

		return performExecute(null, compiledQuery, queryContext, returnGeneratedKeys);
	}

	@NonNull
	List<Map<String, @Nullable Object>> performQuery(@Nullable Transaction transaction,
																									 @NonNull CompiledQuery compiledQuery,
																									 @NonNull QueryContext queryContext) {
		requireNonNull(compiledQuery);
		requireNonNull(queryContext);

		List<Map<String, Object>> rows = new ArrayList<>();

		performDatabaseOperation(transaction, compiledQuery, queryContext, false, (statementContext, preparedStatement) -> {
			long startTime = nanoTime();

			try (ResultSet resultSet = preparedStatement.executeQuery()) {
				Duration executionDuration = Duration.ofNanos(nanoTime() - startTime);
				startTime = nanoTime();

				while (resultSet.next())
					rows.add(getResultSetMapper().map(statementContext, resultSet));

				Duration resultSetMappingDuration = Duration.ofNanos(nanoTime() - startTime);
				return new DatabaseOperationResult(executionDuration, resultSetMappingDuration);
			}
		});

		return rows;
	}

	@NonNull
	ExecutionResult performExecute(@Nullable Transaction transaction,
																 @NonNull CompiledQuery compiledQuery,
																 @NonNull QueryContext queryContext,
																 boolean returnGeneratedKeys) {
		requireNonNull(compiledQuery);
		requireNonNull(queryContext);

		ResultHolder<ExecutionResult> resultHolder = new ResultHolder<>();

		performDatabaseOperation(transaction, compiledQuery, queryContext, returnGeneratedKeys, (statementContext, preparedStatement) -> {
			long startTime = nanoTime();
			long rowsAffected = executeUpdate(preparedStatement);
			Duration executionDuration = Duration.ofNanos(nanoTime() - startTime);
			Duration resultSetMappingDuration = null;
			Long lastInsertId = null;

			if (returnGeneratedKeys) {
				startTime = nanoTime();
				lastInsertId = extractGeneratedKey(preparedStatement).orElse(null);
				resultSetMappingDuration = Duration.ofNanos(nanoTime() - startTime);
			}

			resultHolder.value = ExecutionResult.of(rowsAffected, lastInsertId);
			return new DatabaseOperationResult(executionDuration, resultSetMappingDuration);
		});

		return requireNonNull(resultHolder.value);
	}

	protected long executeUpdate(@NonNull PreparedStatement preparedStatement) throws SQLException {
		requireNonNull(preparedStatement);

		DatabaseOperationSupportStatus executeLargeUpdateSupported = getExecuteLargeUpdateSupported();

		// Use the appropriate "large" value if we know it.
		// If we don't know it, detect it and store it.
		if (executeLargeUpdateSupported == DatabaseOperationSupportStatus.YES)
			return preparedStatement.executeLargeUpdate();

		if (executeLargeUpdateSupported == DatabaseOperationSupportStatus.NO)
			return preparedStatement.executeUpdate();

		try {
			long rowsAffected = preparedStatement.executeLargeUpdate();
			setExecuteLargeUpdateSupported(DatabaseOperationSupportStatus.YES);
			return rowsAffected;
		} catch (SQLFeatureNotSupportedException | UnsupportedOperationException | AbstractMethodError e) {
			setExecuteLargeUpdateSupported(DatabaseOperationSupportStatus.NO);
			return preparedStatement.executeUpdate();
		}
	}

	@NonNull
	protected Optional<Long> extractGeneratedKey(@NonNull PreparedStatement preparedStatement) throws SQLException {
		requireNonNull(preparedStatement);

		try (ResultSet generatedKeys = preparedStatement.getGeneratedKeys()) {
			if (generatedKeys == null || !generatedKeys.next())
				return Optional.empty();

			Object generatedKey = generatedKeys.getObject(1);

			if (generatedKey instanceof Number number)
				return Optional.of(number.longValue());

			if (generatedKey == null)
				return Optional.empty();

			try {
				return Optional.of(Long.valueOf(generatedKey.toString().trim()));
			} catch (NumberFormatException e) {
				throw new DatabaseException("Generated key is not numeric: " + generatedKey, e);
			}
		}
	}

	protected void performDatabaseOperation(@Nullable Transaction transaction,
																					@NonNull CompiledQuery compiledQuery,
																					@NonNull QueryContext queryContext,
																					boolean returnGeneratedKeys,
																					@NonNull DatabaseOperation databaseOperation) {
		requireNonNull(compiledQuery);
		requireNonNull(queryContext);
		requireNonNull(databaseOperation);

		CompiledQuery jdbcQuery;

		try {
			jdbcQuery = SqlPlaceholders.toJdbc(compiledQuery);
		} catch (IllegalArgumentException e) {
			throw new DatabaseException(e.getMessage(), e);
		}

		StatementContext statementContext = StatementContext.with(compiledQuery, this)
				.jdbcQuery(jdbcQuery)
				.queryContext(queryContext)
				.build();

		long startTime = nanoTime();
		Duration connectionAcquisitionDuration = null;
		Duration preparationDuration = null;
		Duration executionDuration = null;
		Duration resultSetMappingDuration = null;
		Exception exception = null;
		Throwable thrown = null;
		Connection connection = null;
		ReentrantLock connectionLock = transaction == null ? null : transaction.getConnectionLock();

		if (connectionLock != null)
			connectionLock.lock();

		try {
			boolean alreadyHasConnection = transaction != null && transaction.hasConnection();
			connection = transaction != null ? transaction.getConnection() : acquireConnection();
			connectionAcquisitionDuration = alreadyHasConnection ? null : Duration.ofNanos(nanoTime() - startTime);
			startTime = nanoTime();

			try (PreparedStatement preparedStatement = returnGeneratedKeys
					? connection.prepareStatement(statementContext.getSql(), Statement.RETURN_GENERATED_KEYS)
					: connection.prepareStatement(statementContext.getSql())) {
				applyQueryContext(statementContext, preparedStatement);
				performPreparedStatementBinding(statementContext, preparedStatement);
				preparationDuration = Duration.ofNanos(nanoTime() - startTime);

				DatabaseOperationResult databaseOperationResult = databaseOperation.perform(statementContext, preparedStatement);
				executionDuration = databaseOperationResult.getExecutionDuration().orElse(null);
				resultSetMappingDuration = databaseOperationResult.getResultSetMappingDuration().orElse(null);
			}
		} catch (DatabaseException e) {
			exception = e;
			thrown = e;
			throw e;
		} catch (Error e) {
			exception = new DatabaseException(e);
			thrown = e;
			throw e;
		} catch (Exception e) {
			DatabaseException wrapped = new DatabaseException(e);
			exception = wrapped;
			thrown = wrapped;
			throw wrapped;
		} finally {
			Throwable cleanupFailure = null;

			try {
				// If this was a single-shot operation (not in a transaction), close the connection
				if (connection != null && transaction == null) {
					try {
						closeConnection(connection);
					} catch (Throwable cleanupException) {
						cleanupFailure = cleanupException;
					}
				}
			} finally {
				if (connectionLock != null)
					connectionLock.unlock();

				StatementLog statementLog =
						StatementLog.withStatementContext(statementContext)
								.connectionAcquisitionDuration(connectionAcquisitionDuration)
								.preparationDuration(preparationDuration)
								.executionDuration(executionDuration)
								.resultSetMappingDuration(resultSetMappingDuration)
								.exception(exception)
								.build();

				try {
					getStatementLogger().log(statementLog);
				} catch (Throwable cleanupException) {
					if (cleanupFailure == null)
						cleanupFailure = cleanupException;
					else
						cleanupFailure.addSuppressed(cleanupException);
				}
			}

			if (cleanupFailure != null) {
				if (thrown != null) {
					thrown.addSuppressed(cleanupFailure);
				} else if (cleanupFailure instanceof RuntimeException) {
					throw (RuntimeException) cleanupFailure;
				} else if (cleanupFailure instanceof Error) {
					throw (Error) cleanupFailure;
				} else {
					throw new RuntimeException(cleanupFailure);
				}
			}
		}
	}

	protected void applyQueryContext(@NonNull StatementContext statementContext,
																	 @NonNull PreparedStatement preparedStatement) throws SQLException {
		requireNonNull(statementContext);
		requireNonNull(preparedStatement);

		Integer timeoutInSeconds = statementContext.getQueryContext().getTimeoutInSeconds().orElse(null);

		if (timeoutInSeconds != null)
			preparedStatement.setQueryTimeout(timeoutInSeconds);
	}

	protected void performPreparedStatementBinding(@NonNull StatementContext statementContext,
																								 @NonNull PreparedStatement preparedStatement) throws SQLException {
		requireNonNull(statementContext);
		requireNonNull(preparedStatement);

		List<Object> parameters = statementContext.getParameters();

		for (int i = 0; i < parameters.size(); ++i) {
			Object parameter = unwrapOptionalValue(parameters.get(i));

			if (parameter != null) {
				getPreparedStatementBinder().bindParameter(statementContext, preparedStatement, i + 1, parameter);
			} else {
				try {
					ParameterMetaData parameterMetaData = preparedStatement.getParameterMetaData();

					if (parameterMetaData != null) {
						preparedStatement.setNull(i + 1, parameterMetaData.getParameterType(i + 1));
					} else {
						preparedStatement.setNull(i + 1, Types.NULL);
					}
				} catch (SQLFeatureNotSupportedException | AbstractMethodError e) {
					preparedStatement.setNull(i + 1, Types.NULL);
				}
			}
		}
	}

	@NonNull
	protected Connection acquireConnection() {
		try {
			return getDataSource().getConnection();
		} catch (SQLException e) {
			throw new DatabaseException("Unable to acquire database connection", e);
		}
	}

	protected void closeConnection(@NonNull Connection connection) {
		requireNonNull(connection);

		try {
			connection.close();
		} catch (SQLException e) {
			throw new DatabaseException("Unable to close database connection", e);
		}
	}

	private static void restoreInterruptIfNeeded(@NonNull Throwable throwable) {
		requireNonNull(throwable);

		Throwable current = throwable;

		while (current != null) {
			if (current instanceof InterruptedException) {
				Thread.currentThread().interrupt();
				return;
			}

			current = current.getCause();
		}
	}

	@Nullable
	private static Object unwrapOptionalValue(@Nullable Object value) {
		if (value == null)
			return null;

		if (value instanceof Optional<?> optional)
			return optional.orElse(null);
		if (value instanceof OptionalInt optionalInt)
			return optionalInt.isPresent() ? optionalInt.getAsInt() : null;
		if (value instanceof OptionalLong optionalLong)
			return optionalLong.isPresent() ? optionalLong.getAsLong() : null;
		if (value instanceof OptionalDouble optionalDouble)
			return optionalDouble.isPresent() ? optionalDouble.getAsDouble() : null;

		return value;
	}

	@NonNull
	public DatabaseType getDatabaseType() {
		return this.databaseType;
	}

	/**
	 * The grammar every builder created by this database compiles with.
	 *
	 * @return the grammar
	 */
	@NonNull
	public Grammar getGrammar() {
		return this.grammar;
	}

	@NonNull
	public ZoneId getTimeZone() {
		return this.timeZone;
	}

	@NonNull
	protected DataSource getDataSource() {
		return this.dataSource;
	}

	@NonNull
	protected PreparedStatementBinder getPreparedStatementBinder() {
		return this.preparedStatementBinder;
	}

	@NonNull
	protected ResultSetMapper getResultSetMapper() {
		return this.resultSetMapper;
	}

	@NonNull
	protected StatementLogger getStatementLogger() {
		return this.statementLogger;
	}

	@NonNull
	protected DatabaseOperationSupportStatus getExecuteLargeUpdateSupported() {
		return this.executeLargeUpdateSupported;
	}

	protected void setExecuteLargeUpdateSupported(@NonNull DatabaseOperationSupportStatus executeLargeUpdateSupported) {
		requireNonNull(executeLargeUpdateSupported);
		this.executeLargeUpdateSupported = executeLargeUpdateSupported;
	}

	@FunctionalInterface
	protected interface DatabaseOperation {
		@NonNull
		DatabaseOperationResult perform(@NonNull StatementContext statementContext,
																		@NonNull PreparedStatement preparedStatement) throws Exception;
	}

	/**
	 * Builder used to construct instances of {@link Database}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final DataSource dataSource;
		@Nullable
		private DatabaseType databaseType;
		@Nullable
		private Grammar grammar;
		@Nullable
		private ZoneId timeZone;
		@Nullable
		private PreparedStatementBinder preparedStatementBinder;
		@Nullable
		private ResultSetMapper resultSetMapper;
		@Nullable
		private StatementLogger statementLogger;

		private Builder(@NonNull DataSource dataSource) {
			this.dataSource = requireNonNull(dataSource);
			this.databaseType = null;
		}

		/**
		 * Overrides automatic database type detection.
		 *
		 * @param databaseType the database type to use (null to enable auto-detection)
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder databaseType(@Nullable DatabaseType databaseType) {
			this.databaseType = databaseType;
			return this;
		}

		/**
		 * Overrides the grammar derived from the database type.
		 *
		 * @param grammar the grammar to compile queries with (null to derive it from the database type)
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder grammar(@Nullable Grammar grammar) {
			this.grammar = grammar;
			return this;
		}

		@NonNull
		public Builder timeZone(@Nullable ZoneId timeZone) {
			this.timeZone = timeZone;
			return this;
		}

		@NonNull
		public Builder preparedStatementBinder(@Nullable PreparedStatementBinder preparedStatementBinder) {
			this.preparedStatementBinder = preparedStatementBinder;
			return this;
		}

		@NonNull
		public Builder resultSetMapper(@Nullable ResultSetMapper resultSetMapper) {
			this.resultSetMapper = resultSetMapper;
			return this;
		}

		@NonNull
		public Builder statementLogger(@Nullable StatementLogger statementLogger) {
			this.statementLogger = statementLogger;
			return this;
		}

		@NonNull
		public Database build() {
			return new Database(this);
		}
	}

	@ThreadSafe
	static class DatabaseOperationResult {
		@Nullable
		private final Duration executionDuration;
		@Nullable
		private final Duration resultSetMappingDuration;

		public DatabaseOperationResult(@Nullable Duration executionDuration,
																	 @Nullable Duration resultSetMappingDuration) {
			this.executionDuration = executionDuration;
			this.resultSetMappingDuration = resultSetMappingDuration;
		}

		@NonNull
		public Optional<Duration> getExecutionDuration() {
			return Optional.ofNullable(this.executionDuration);
		}

		@NonNull
		public Optional<Duration> getResultSetMappingDuration() {
			return Optional.ofNullable(this.resultSetMappingDuration);
		}
	}

	@NotThreadSafe
	static class ResultHolder<T> {
		T value;
	}

	enum DatabaseOperationSupportStatus {
		UNKNOWN,
		YES,
		NO
	}
}
