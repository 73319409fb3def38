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
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.NotThreadSafe;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * @since 1.0.0
 */
public class QueryBuilderTests {
	@Test
	public void testCloneIsIndependent() {
		QueryBuilder original = new QueryBuilder(TestQueries.unusedExecutionHandle(), new PostgresGrammar(), "users")
				.where("status", "active")
				.limit(10);

		CompiledQuery before = original.toSql();

		QueryBuilder clone = original.clone()
				.where("age", ">", 30)
				.orderBy("name")
				.select("id")
				.offset(5);

		Assertions.assertEquals(before, original.toSql(), "Mutating the clone changed the original");
		Assertions.assertEquals("SELECT \"id\" FROM \"users\" WHERE \"status\" = $1 AND \"age\" > $2 ORDER BY \"name\" ASC LIMIT 10 OFFSET 5",
				clone.toSql().getSql());
		Assertions.assertSame(original.getExecutionHandle(), clone.getExecutionHandle());
		Assertions.assertSame(original.getGrammar(), clone.getGrammar());
	}

	@Test
	public void testForPage() {
		QueryBuilder queryBuilder = new QueryBuilder(TestQueries.unusedExecutionHandle(), new BaseGrammar(), "users");

		Assertions.assertEquals("SELECT * FROM \"users\" LIMIT 15 OFFSET 30", queryBuilder.forPage(3, 15).toSql().getSql());
		Assertions.assertEquals("SELECT * FROM \"users\" LIMIT 15 OFFSET 0", queryBuilder.forPage(0, 15).toSql().getSql());
		Assertions.assertEquals("SELECT * FROM \"users\" LIMIT 15 OFFSET 0", queryBuilder.forPage(-4, 15).toSql().getSql());
	}

	@Test
	public void testLimitZeroIsDistinctFromNoLimit() {
		QueryBuilder queryBuilder = new QueryBuilder(TestQueries.unusedExecutionHandle(), new BaseGrammar(), "users");

		Assertions.assertEquals(Optional.empty(), queryBuilder.getLimit());
		Assertions.assertEquals("SELECT * FROM \"users\" LIMIT 0 OFFSET 0", queryBuilder.take(0).skip(0).toSql().getSql());
	}

	@Test
	public void testAggregatesIgnoreOrderingAndRestoreBuilderState() {
		RecordingExecutionHandle executionHandle = new RecordingExecutionHandle();
		executionHandle.rows.add(row("aggregate", 42L));

		QueryBuilder queryBuilder = new QueryBuilder(executionHandle, new PostgresGrammar(), "users")
				.selectRaw("age * ? AS doubled", 2)
				.where("status", "active")
				.orderByRaw("age * ? DESC", 3)
				.orderBy("name")
				.limit(50)
				.offset(100);

		CompiledQuery before = queryBuilder.toSql();

		Assertions.assertEquals(42L, queryBuilder.count());
		Assertions.assertEquals(before, queryBuilder.toSql(), "Aggregate did not restore builder state");
		Assertions.assertEquals(CompiledQuery.of("SELECT COUNT(*) AS \"aggregate\" FROM \"users\" WHERE \"status\" = $1 LIMIT 1", List.of("active")),
				executionHandle.queries.get(0));
	}

	@Test
	public void testAggregateValues() {
		RecordingExecutionHandle executionHandle = new RecordingExecutionHandle();
		QueryBuilder queryBuilder = new QueryBuilder(executionHandle, new BaseGrammar(), "orders");

		executionHandle.rows.add(row("aggregate", null));
		Assertions.assertEquals(0D, queryBuilder.sum("total"), "Sum over no rows should be zero");
		Assertions.assertEquals("SELECT SUM(\"total\") AS \"aggregate\" FROM \"orders\" LIMIT 1", executionHandle.queries.get(0).getSql());

		executionHandle.rows.set(0, row("aggregate", 12.5D));
		Assertions.assertEquals(12.5D, queryBuilder.avg("total"));

		executionHandle.rows.set(0, row("aggregate", 99));
		Assertions.assertEquals(Optional.of(99), queryBuilder.max("total"));

		executionHandle.rows.set(0, row("aggregate", null));
		Assertions.assertEquals(Optional.empty(), queryBuilder.min("total"));

		executionHandle.rows.set(0, row("aggregate", "not a number"));
		Assertions.assertThrows(DatabaseException.class, () -> queryBuilder.sum("total"));
	}

	@Test
	public void testExistsDerivesFromCount() {
		RecordingExecutionHandle executionHandle = new RecordingExecutionHandle();
		executionHandle.rows.add(row("aggregate", 0L));

		QueryBuilder queryBuilder = new QueryBuilder(executionHandle, new BaseGrammar(), "users");

		Assertions.assertFalse(queryBuilder.exists());
		Assertions.assertTrue(queryBuilder.doesntExist());
		Assertions.assertTrue(executionHandle.queries.get(0).getSql().startsWith("SELECT COUNT(*) AS \"aggregate\""));
	}

	@Test
	public void testValueAndPluckNarrowProjection() {
		RecordingExecutionHandle executionHandle = new RecordingExecutionHandle();
		executionHandle.rows.add(row("name", "Ana"));
		executionHandle.rows.add(row("name", "Bo"));

		Assertions.assertEquals(List.of("Ana", "Bo"),
				new QueryBuilder(executionHandle, new BaseGrammar(), "users").pluck("name"));
		Assertions.assertEquals("SELECT \"name\" FROM \"users\"", executionHandle.queries.get(0).getSql());

		Assertions.assertEquals(Optional.of("Ana"),
				new QueryBuilder(executionHandle, new BaseGrammar(), "users").value("name"));
		Assertions.assertEquals("SELECT \"name\" FROM \"users\" LIMIT 1", executionHandle.queries.get(1).getSql());
	}

	@Test
	public void testFindFiltersOnId() {
		RecordingExecutionHandle executionHandle = new RecordingExecutionHandle();

		Assertions.assertEquals(Optional.empty(), new QueryBuilder(executionHandle, new PostgresGrammar(), "users").find(7));
		Assertions.assertEquals(CompiledQuery.of("SELECT * FROM \"users\" WHERE \"id\" = $1 LIMIT 1", List.of(7)),
				executionHandle.queries.get(0));
	}

	@Test
	public void testInsertGetIdOnPostgresReturningId() {
		RecordingExecutionHandle executionHandle = new RecordingExecutionHandle();
		executionHandle.rows.add(row("id", 42));

		long id = new QueryBuilder(executionHandle, new PostgresGrammar(), "users").insertGetId(Map.of("name", "Ana"));

		Assertions.assertEquals(42L, id);
		Assertions.assertEquals(CompiledQuery.of("INSERT INTO \"users\" (\"name\") VALUES ($1) RETURNING id", List.of("Ana")),
				executionHandle.queries.get(0));
		Assertions.assertTrue(executionHandle.statements.isEmpty());
	}

	@Test
	public void testInsertGetIdElsewhereUsesGeneratedKeys() {
		RecordingExecutionHandle executionHandle = new RecordingExecutionHandle();
		executionHandle.executionResult = ExecutionResult.of(1, 17L);

		long id = new QueryBuilder(executionHandle, new SqliteGrammar(), "users").insertGetId(Map.of("name", "Ana"));

		Assertions.assertEquals(17L, id);
		Assertions.assertEquals("INSERT INTO \"users\" (\"name\") VALUES (?)", executionHandle.statements.get(0).getSql());
		Assertions.assertFalse(executionHandle.statements.get(0).getSql().contains("RETURNING"));
		Assertions.assertEquals(List.of(Boolean.TRUE), executionHandle.returnGeneratedKeys);
		Assertions.assertTrue(executionHandle.queries.isEmpty());
	}

	@Test
	public void testInsertBatchRunsOneStatementPerRecord() {
		RecordingExecutionHandle executionHandle = new RecordingExecutionHandle();
		QueryBuilder queryBuilder = new QueryBuilder(executionHandle, new BaseGrammar(), "users");

		long inserted = queryBuilder.insertBatch(List.of(Map.of("name", "Ana"), Map.of("name", "Bo"), Map.of("name", "Cy")));

		Assertions.assertEquals(3L, inserted);
		Assertions.assertEquals(3, executionHandle.statements.size());
		Assertions.assertEquals(List.of("Bo"), executionHandle.statements.get(1).getBindings());
		Assertions.assertEquals(0L, queryBuilder.insertBatch(List.of()));
	}

	@Test
	public void testIncrementAndDecrementAreLiteral() {
		RecordingExecutionHandle executionHandle = new RecordingExecutionHandle();

		new QueryBuilder(executionHandle, new PostgresGrammar(), "users").where("id", 3).increment("logins");
		new QueryBuilder(executionHandle, new PostgresGrammar(), "users").where("id", 3).decrement("credits", 5, Map.of("status", "spent"));

		Assertions.assertEquals(CompiledQuery.of("UPDATE \"users\" SET \"logins\" = \"logins\" + 1 WHERE \"id\" = $1", List.of(3)),
				executionHandle.statements.get(0));
		Assertions.assertEquals(CompiledQuery.of("UPDATE \"users\" SET \"credits\" = \"credits\" - 5, \"status\" = $1 WHERE \"id\" = $2",
				List.of("spent", 3)), executionHandle.statements.get(1));
	}

	@Test
	public void testTruncate() {
		RecordingExecutionHandle executionHandle = new RecordingExecutionHandle();

		new QueryBuilder(executionHandle, new SqliteGrammar(), "sessions").truncate();

		Assertions.assertEquals(CompiledQuery.of("TRUNCATE TABLE \"sessions\""), executionHandle.statements.get(0));
	}

	@Test
	public void testStickyErrorShortCircuitsExecution() {
		RecordingExecutionHandle executionHandle = new RecordingExecutionHandle();
		QueryBuilder queryBuilder = new QueryBuilder(executionHandle, new BaseGrammar(), "users");
		IllegalStateException failure = new IllegalStateException("invalid filter");

		queryBuilder.setError(failure);

		Assertions.assertSame(failure, Assertions.assertThrows(IllegalStateException.class, queryBuilder::get));
		Assertions.assertSame(failure, Assertions.assertThrows(IllegalStateException.class, queryBuilder::delete));
		Assertions.assertSame(failure, Assertions.assertThrows(IllegalStateException.class, queryBuilder::count));
		Assertions.assertSame(failure, Assertions.assertThrows(IllegalStateException.class, () -> queryBuilder.clone().first()));
		Assertions.assertTrue(executionHandle.queries.isEmpty());
		Assertions.assertTrue(executionHandle.statements.isEmpty());

		// Compiling is still allowed
		Assertions.assertEquals("SELECT * FROM \"users\"", queryBuilder.toSql().getSql());

		SQLException checkedFailure = new SQLException("checked");
		queryBuilder.setError(checkedFailure);

		DatabaseException wrapped = Assertions.assertThrows(DatabaseException.class, () -> queryBuilder.update(Map.of("name", "x")));
		Assertions.assertSame(checkedFailure, wrapped.getCause());

		queryBuilder.setError(null);
		queryBuilder.get();
		Assertions.assertEquals(1, executionHandle.queries.size());
	}

	@Test
	public void testContextIsPassedToHandle() {
		RecordingExecutionHandle executionHandle = new RecordingExecutionHandle();
		QueryContext queryContext = QueryContext.withTimeout(Duration.ofMillis(1500));

		new QueryBuilder(executionHandle, new BaseGrammar(), "users").get();
		new QueryBuilder(executionHandle, new BaseGrammar(), "users").withContext(queryContext).delete();

		Assertions.assertEquals(List.of(QueryContext.background(), queryContext), executionHandle.queryContexts);
		Assertions.assertEquals(Optional.of(2), queryContext.getTimeoutInSeconds(), "Sub-second remainder should round up");
		Assertions.assertThrows(IllegalArgumentException.class, () -> QueryContext.withTimeout(Duration.ZERO));
	}

	@NonNull
	protected static Map<String, @Nullable Object> row(@NonNull String column,
																										 @Nullable Object value) {
		requireNonNull(column);

		Map<String, Object> row = new LinkedHashMap<>();
		row.put(column, value);
		return row;
	}

	/**
	 * Records every statement it is asked to run and answers queries with canned rows.
	 */
	@NotThreadSafe
	protected static class RecordingExecutionHandle implements ExecutionHandle {
		@NonNull
		final List<CompiledQuery> queries = new ArrayList<>();
		@NonNull
		final List<CompiledQuery> statements = new ArrayList<>();
		@NonNull
		final List<Boolean> returnGeneratedKeys = new ArrayList<>();
		@NonNull
		final List<QueryContext> queryContexts = new ArrayList<>();
		@NonNull
		final List<Map<String, @Nullable Object>> rows = new ArrayList<>();
		@NonNull
		ExecutionResult executionResult = ExecutionResult.of(1, null);

		@Override
		@NonNull
		public List<Map<String, @Nullable Object>> query(@NonNull CompiledQuery compiledQuery,
																										 @NonNull QueryContext queryContext) {
			this.queries.add(compiledQuery);
			this.queryContexts.add(queryContext);
			return new ArrayList<>(this.rows);
		}

		@Override
		@NonNull
		public ExecutionResult execute(@NonNull CompiledQuery compiledQuery,
																	 @NonNull QueryContext queryContext,
																	 boolean returnGeneratedKeys) {
			this.statements.add(compiledQuery);
			this.returnGeneratedKeys.add(returnGeneratedKeys);
			this.queryContexts.add(queryContext);
			return this.executionResult;
		}
	}
}
