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
import java.io.Serializable;
import java.sql.SQLException;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import static java.lang.String.format;

/**
 * The unchecked exception Quarry throws for every database failure.
 * <p>
 * When a {@link SQLException} appears anywhere in the cause chain, {@link #getErrorCode()} and {@link #getSqlState()}
 * report its values. Failures raised by the PostgreSQL driver also carry the server's error fields (offending table,
 * column, constraint and so on).
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class DatabaseException extends RuntimeException {
	@Nullable
	private final Integer errorCode;
	@Nullable
	private final String sqlState;
	@Nullable
	private final ServerDetails serverDetails;

	public DatabaseException(@Nullable String message) {
		this(message, null);
	}

	public DatabaseException(@Nullable Throwable cause) {
		this(cause == null ? null : cause.getMessage(), cause);
	}

	public DatabaseException(@Nullable String message,
													 @Nullable Throwable cause) {
		super(message, cause);

		SQLException sqlException = findSqlException(cause);
		ServerDetails serverDetails = sqlException == null ? null : ServerDetails.fromPostgres(sqlException);

		this.errorCode = sqlException == null ? null : sqlException.getErrorCode();
		this.serverDetails = serverDetails;

		if (serverDetails != null && serverDetails.sqlState() != null)
			this.sqlState = serverDetails.sqlState();
		else
			this.sqlState = sqlException == null ? null : sqlException.getSQLState();
	}

	@Nullable
	private static SQLException findSqlException(@Nullable Throwable cause) {
		Set<Throwable> visited = Collections.newSetFromMap(new IdentityHashMap<>());

		for (Throwable current = cause; current != null && visited.add(current); current = current.getCause())
			if (current instanceof SQLException sqlException)
				return sqlException;

		return null;
	}

	@Override
	public String toString() {
		Map<String, Optional<?>> fields = new LinkedHashMap<>();
		fields.put("message", Optional.ofNullable(getMessage()).filter(message -> !message.isBlank()));
		fields.put("errorCode", getErrorCode());
		fields.put("sqlState", getSqlState());
		fields.put("table", getTable());
		fields.put("column", getColumn());
		fields.put("constraint", getConstraint());
		fields.put("detail", getDetail());
		fields.put("hint", getHint());
		fields.put("dbmsMessage", getDbmsMessage());

		return format("%s: %s", getClass().getName(), fields.entrySet().stream()
				.filter(entry -> entry.getValue().isPresent())
				.map(entry -> format("%s=%s", entry.getKey(), entry.getValue().get()))
				.collect(Collectors.joining(", ")));
	}

	/**
	 * The vendor error code of the underlying {@link SQLException}.
	 *
	 * @return the error code, or empty if no {@link SQLException} caused this exception
	 */
	@NonNull
	public Optional<Integer> getErrorCode() {
		return Optional.ofNullable(this.errorCode);
	}

	/**
	 * The five-character SQLSTATE of the underlying failure, e.g. {@code 23502} for a {@code NOT NULL} violation.
	 *
	 * @return the SQLSTATE, or empty if not available
	 */
	@NonNull
	public Optional<String> getSqlState() {
		return Optional.ofNullable(this.sqlState);
	}

	@NonNull
	public Optional<String> getTable() {
		return serverDetail(ServerDetails::table);
	}

	@NonNull
	public Optional<String> getColumn() {
		return serverDetail(ServerDetails::column);
	}

	@NonNull
	public Optional<String> getConstraint() {
		return serverDetail(ServerDetails::constraint);
	}

	@NonNull
	public Optional<String> getDetail() {
		return serverDetail(ServerDetails::detail);
	}

	@NonNull
	public Optional<String> getHint() {
		return serverDetail(ServerDetails::hint);
	}

	/**
	 * The primary message as reported by the database server, without driver decoration.
	 *
	 * @return the server message, or empty if not available
	 */
	@NonNull
	public Optional<String> getDbmsMessage() {
		return serverDetail(ServerDetails::message);
	}

	@NonNull
	private Optional<String> serverDetail(@NonNull Function<ServerDetails, String> accessor) {
		return Optional.ofNullable(this.serverDetails).map(accessor);
	}

	/**
	 * Error fields a PostgreSQL server attaches to a failure.
	 */
	private record ServerDetails(@Nullable String sqlState,
															 @Nullable String table,
															 @Nullable String column,
															 @Nullable String constraint,
															 @Nullable String detail,
															 @Nullable String hint,
															 @Nullable String message) implements Serializable {
		@Nullable
		static ServerDetails fromPostgres(@NonNull SQLException sqlException) {
			// Checked by name so the driver stays optional at runtime
			if (!"org.postgresql.util.PSQLException".equals(sqlException.getClass().getName()))
				return null;

			org.postgresql.util.ServerErrorMessage serverErrorMessage =
					((org.postgresql.util.PSQLException) sqlException).getServerErrorMessage();

			if (serverErrorMessage == null)
				return null;

			return new ServerDetails(serverErrorMessage.getSQLState(), serverErrorMessage.getTable(),
					serverErrorMessage.getColumn(), serverErrorMessage.getConstraint(), serverErrorMessage.getDetail(),
					serverErrorMessage.getHint(), serverErrorMessage.getMessage());
		}
	}
}
