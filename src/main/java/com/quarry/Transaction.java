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

import javax.annotation.concurrent.ThreadSafe;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Represents a database transaction.
 * <p>
 * Commit and rollback are controlled by {@link Database#transaction(TransactionalOperation)}. Statements run through a
 * transaction share one connection, acquired on first use and guarded by a lock so that builders used from several
 * threads never interleave on it.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class Transaction implements ExecutionHandle {
	@NonNull
	private static final AtomicLong ID_GENERATOR;

	static {
		ID_GENERATOR = new AtomicLong(0);
	}

	@NonNull
	private final Long id;
	@NonNull
	private final Database database;
	@NonNull
	private final ReentrantLock connectionLock;
	@NonNull
	private final AtomicBoolean rollbackOnly;
	@NonNull
	private final Logger logger;

	@Nullable
	private Connection connection;
	@Nullable
	private volatile Boolean initialAutoCommit;

	Transaction(@NonNull Database database) {
		requireNonNull(database);

		this.id = ID_GENERATOR.incrementAndGet();
		this.database = database;
		this.connectionLock = new ReentrantLock();
		this.rollbackOnly = new AtomicBoolean(false);
		this.logger = Logger.getLogger(Transaction.class.getName());
		this.connection = null;
		this.initialAutoCommit = null;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{id=%s, hasConnection=%s, isRollbackOnly=%s}",
				getClass().getSimpleName(), id(), hasConnection(), isRollbackOnly());
	}

	/**
	 * Creates a query builder for {@code table} whose statements run in this transaction.
	 *
	 * @param table the table to query
	 * @return a new query builder
	 */
	@NonNull
	public QueryBuilder table(@NonNull String table) {
		requireNonNull(table);
		return new QueryBuilder(this, getDatabase().getGrammar(), table);
	}

	@Override
	@NonNull
	public List<Map<String, @Nullable Object>> query(@NonNull CompiledQuery compiledQuery,
																									 @NonNull QueryContext queryContext) {
		requireNonNull(compiledQuery);
		requireNonNull(queryContext);

		return getDatabase().performQuery(this, compiledQuery, queryContext);
	}

	@Override
	@NonNull
	public ExecutionResult execute(@NonNull CompiledQuery compiledQuery,
																 @NonNull QueryContext queryContext,
																 boolean returnGeneratedKeys) {
		requireNonNull(compiledQuery);
		requireNonNull(queryContext);

		return getDatabase().performExecute(this, compiledQuery, queryContext, returnGeneratedKeys);
	}

	/**
	 * Should this transaction be rolled back upon completion?
	 * <p>
	 * Default value is {@code false}.
	 *
	 * @return {@code true} if this transaction should be rolled back, {@code false} otherwise
	 */
	@NonNull
	public Boolean isRollbackOnly() {
		return this.rollbackOnly.get();
	}

	/**
	 * Sets whether this transaction should be rolled back upon completion.
	 *
	 * @param rollbackOnly whether to set this transaction to be rollback-only
	 */
	public void setRollbackOnly(@NonNull Boolean rollbackOnly) {
		requireNonNull(rollbackOnly);
		this.rollbackOnly.set(rollbackOnly);
	}

	@NonNull
	Long id() {
		return this.id;
	}

	@NonNull
	Boolean hasConnection() {
		getConnectionLock().lock();

		try {
			return this.connection != null;
		} finally {
			getConnectionLock().unlock();
		}
	}

	void commit() {
		getConnectionLock().lock();

		try {
			if (!hasConnection()) {
				logger.finer("Transaction has no connection, so nothing to commit");
				return;
			}

			logger.finer("Committing transaction...");

			try {
				getConnection().commit();
				logger.finer("Transaction committed.");
			} catch (SQLException e) {
				throw new DatabaseException("Unable to commit transaction", e);
			}
		} finally {
			getConnectionLock().unlock();
		}
	}

	void rollback() {
		getConnectionLock().lock();

		try {
			if (!hasConnection()) {
				logger.finer("Transaction has no connection, so nothing to roll back");
				return;
			}

			logger.finer("Rolling back transaction...");

			try {
				getConnection().rollback();
				logger.finer("Transaction rolled back.");
			} catch (SQLException e) {
				throw new DatabaseException("Unable to roll back transaction", e);
			}
		} finally {
			getConnectionLock().unlock();
		}
	}

	/**
	 * The connection associated with this transaction.
	 * <p>
	 * If no connection is associated yet, we ask the {@link Database} for one and turn autocommit off.
	 *
	 * @return The connection associated with this transaction.
	 * @throws DatabaseException if unable to acquire a connection.
	 */
	@NonNull
	Connection getConnection() {
		getConnectionLock().lock();

		try {
			if (this.connection != null)
				return this.connection;

			this.connection = getDatabase().acquireConnection();

			// Keep track of the initial setting for autocommit since it might need to get changed from "true" to "false" for
			// the duration of the transaction and then back to "true" post-transaction.
			try {
				this.initialAutoCommit = this.connection.getAutoCommit();
			} catch (SQLException e) {
				throw new DatabaseException("Unable to determine database connection autocommit setting", e);
			}

			if (this.initialAutoCommit)
				setAutoCommit(false);

			return this.connection;
		} finally {
			getConnectionLock().unlock();
		}
	}

	void setAutoCommit(@NonNull Boolean autoCommit) {
		requireNonNull(autoCommit);

		getConnectionLock().lock();

		try {
			try {
				getConnection().setAutoCommit(autoCommit);
			} catch (SQLException e) {
				throw new DatabaseException(format("Unable to set database connection autocommit value to '%s'", autoCommit), e);
			}
		} finally {
			getConnectionLock().unlock();
		}
	}

	@NonNull
	Optional<Boolean> getInitialAutoCommit() {
		return Optional.ofNullable(this.initialAutoCommit);
	}

	@NonNull
	Database getDatabase() {
		return this.database;
	}

	@NonNull
	ReentrantLock getConnectionLock() {
		return this.connectionLock;
	}
}
