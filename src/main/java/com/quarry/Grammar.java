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
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Dialect-specific strategy for turning {@link QueryBuilder} state into SQL text plus bindings.
 * <p>
 * Implementations must be stateless: any bookkeeping needed while compiling a statement (for example, the running
 * placeholder index) lives only for the duration of one {@code compile*} call. A single instance may therefore be
 * shared by every builder created against a {@link Database}, across threads.
 *
 * @since 1.0.0
 */
@ThreadSafe
public interface Grammar {
	/**
	 * The type of database this grammar targets.
	 *
	 * @return the database type
	 */
	@NonNull
	DatabaseType getDatabaseType();

	/**
	 * Quotes a table name, e.g. {@code users} becomes {@code "users"} and {@code public.users} becomes
	 * {@code "public"."users"}. Names containing whitespace (aliases, subqueries) are left as-is.
	 *
	 * @param table the table name
	 * @return the quoted table name
	 */
	@NonNull
	String wrapTable(@NonNull String table);

	/**
	 * Quotes a column reference. {@code *}, aliased expressions ({@code " AS "}), function calls and already-quoted
	 * identifiers are left as-is; dotted references have each non-{@code *} segment quoted.
	 *
	 * @param column the column reference
	 * @return the quoted column reference
	 */
	@NonNull
	String wrapColumn(@NonNull String column);

	/**
	 * The placeholder for the binding at the given zero-based position in the statement.
	 *
	 * @param index zero-based binding position
	 * @return the placeholder text
	 */
	@NonNull
	String parameter(int index);

	/**
	 * The {@link java.time.format.DateTimeFormatter} pattern this dialect uses for timestamp literals.
	 *
	 * @return the date format pattern
	 */
	@NonNull
	String getDateFormat();

	@NonNull
	CompiledQuery compileSelect(@NonNull QueryBuilder queryBuilder);

	@NonNull
	CompiledQuery compileInsert(@NonNull QueryBuilder queryBuilder,
															@NonNull Map<String, ?> values);

	@NonNull
	CompiledQuery compileUpdate(@NonNull QueryBuilder queryBuilder,
															@NonNull Map<String, ?> values);

	@NonNull
	CompiledQuery compileDelete(@NonNull QueryBuilder queryBuilder);

	/**
	 * Wraps the builder's compiled {@code SELECT} in {@code SELECT EXISTS (...) AS "exists"}.
	 *
	 * @param queryBuilder the builder to compile
	 * @return the compiled query
	 */
	@NonNull
	CompiledQuery compileExists(@NonNull QueryBuilder queryBuilder);

	@NonNull
	CompiledQuery compileTruncate(@NonNull String table);

	/**
	 * Provides the grammar for the given database type.
	 *
	 * @param databaseType the type of database
	 * @return a grammar for {@code databaseType}
	 */
	@NonNull
	static Grammar forDatabaseType(@NonNull DatabaseType databaseType) {
		requireNonNull(databaseType);

		switch (databaseType) {
			case POSTGRESQL:
				return new PostgresGrammar();
			case SQLITE:
				return new SqliteGrammar();
			default:
				return new BaseGrammar();
		}
	}

	/**
	 * Provides the grammar for a driver name such as {@code postgres} or {@code sqlite3}.
	 * Unrecognized or missing names get the base grammar.
	 *
	 * @param driverName the driver name
	 * @return a grammar for {@code driverName}
	 */
	@NonNull
	static Grammar forDriverName(@Nullable String driverName) {
		return forDatabaseType(DatabaseType.fromDriverName(driverName));
	}
}
