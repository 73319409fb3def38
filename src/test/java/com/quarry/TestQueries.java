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

import org.hsqldb.jdbc.JDBCDataSource;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.sql.DataSource;
import java.util.List;
import java.util.Map;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * @since 1.0.0
 */
final class TestQueries {
	private TestQueries() {}

	/**
	 * Runs DDL or fixture SQL with no bindings.
	 */
	static long execute(@NonNull ExecutionHandle executionHandle,
											@NonNull String sql) {
		requireNonNull(executionHandle);
		requireNonNull(sql);

		return executionHandle.execute(CompiledQuery.of(sql), QueryContext.background()).getRowsAffected();
	}

	static void createUsersTable(@NonNull ExecutionHandle executionHandle) {
		requireNonNull(executionHandle);

		execute(executionHandle, """
				CREATE TABLE "users" (
				  "id" INTEGER GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
				  "name" VARCHAR(255) NOT NULL,
				  "status" VARCHAR(32),
				  "age" INTEGER,
				  "score" DECIMAL(10, 2),
				  "logins" INTEGER DEFAULT 0 NOT NULL
				)
				""");
	}

	/**
	 * A handle for compile-only tests. Fails if a statement is ever run on it.
	 */
	@NonNull
	static ExecutionHandle unusedExecutionHandle() {
		return new ExecutionHandle() {
			@Override
			@NonNull
			public List<Map<String, @Nullable Object>> query(@NonNull CompiledQuery compiledQuery,
																											 @NonNull QueryContext queryContext) {
				throw new AssertionError(format("Unexpected query: %s", compiledQuery));
			}

			@Override
			@NonNull
			public ExecutionResult execute(@NonNull CompiledQuery compiledQuery,
																		 @NonNull QueryContext queryContext,
																		 boolean returnGeneratedKeys) {
				throw new AssertionError(format("Unexpected statement: %s", compiledQuery));
			}
		};
	}

	@NonNull
	static DataSource createInMemoryDataSource(@NonNull String databaseName) {
		requireNonNull(databaseName);

		JDBCDataSource dataSource = new JDBCDataSource();
		dataSource.setUrl(format("jdbc:hsqldb:mem:%s", databaseName));
		dataSource.setUser("sa");
		dataSource.setPassword("");

		return dataSource;
	}
}
