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
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * @since 1.0.0
 */
public class GrammarTests {
	@Test
	public void testPostgresSelectScenario() {
		CompiledQuery compiledQuery = builder(new PostgresGrammar(), "users")
				.where("age", ">", 25)
				.where("status", "=", "active")
				.orderByDesc("age")
				.limit(5)
				.toSql();

		Assertions.assertEquals("SELECT * FROM \"users\" WHERE \"age\" > $1 AND \"status\" = $2 ORDER BY \"age\" DESC LIMIT 5",
				compiledQuery.getSql());
		Assertions.assertEquals(List.of(25, "active"), compiledQuery.getBindings());
	}

	@Test
	public void testSameStateAcrossDialects() {
		CompiledQuery postgres = builder(new PostgresGrammar(), "users")
				.where("status", "=", "active").orderBy("name", "asc").limit(10).toSql();
		CompiledQuery sqlite = builder(new SqliteGrammar(), "users")
				.where("status", "=", "active").orderBy("name", "asc").limit(10).toSql();
		CompiledQuery base = builder(new BaseGrammar(), "users")
				.where("status", "=", "active").orderBy("name", "asc").limit(10).toSql();

		Assertions.assertEquals("SELECT * FROM \"users\" WHERE \"status\" = $1 ORDER BY \"name\" ASC LIMIT 10", postgres.getSql());
		Assertions.assertEquals("SELECT * FROM \"users\" WHERE \"status\" = ? ORDER BY \"name\" ASC LIMIT 10", sqlite.getSql());
		Assertions.assertEquals(sqlite, base, "SQLite and base grammars should compile identically");
		Assertions.assertEquals(List.of("active"), postgres.getBindings());
		Assertions.assertEquals(postgres.getBindings(), sqlite.getBindings());
	}

	@Test
	public void testClauseOrder() {
		CompiledQuery compiledQuery = fullyLoaded(builder(new PostgresGrammar(), "users")).toSql();

		Assertions.assertEquals("SELECT DISTINCT \"users\".\"id\", COUNT(orders.id) AS order_count FROM \"users\" "
				+ "INNER JOIN \"orders\" ON \"users\".\"id\" = \"orders\".\"user_id\" "
				+ "LEFT JOIN \"profiles\" ON \"profiles\".\"user_id\" = \"users\".\"id\" "
				+ "RIGHT JOIN \"teams\" ON \"teams\".\"id\" = \"users\".\"team_id\" "
				+ "CROSS JOIN \"regions\" "
				+ "WHERE \"users\".\"age\" >= $1 OR \"users\".\"status\" = $2 AND \"users\".\"role\" IN ($3, $4) "
				+ "GROUP BY \"users\".\"id\" "
				+ "HAVING \"order_count\" > $5 OR \"order_count\" < $6 "
				+ "ORDER BY \"users\".\"id\" ASC, \"users\".\"name\" DESC "
				+ "LIMIT 10 OFFSET 20", compiledQuery.getSql());
		Assertions.assertEquals(List.of(18, "vip", "admin", "staff", 2, 100), compiledQuery.getBindings());
	}

	@Test
	public void testPlaceholderBindingParity() {
		CompiledQuery base = fullyLoaded(builder(new BaseGrammar(), "users")).toSql();
		CompiledQuery postgres = fullyLoaded(builder(new PostgresGrammar(), "users")).toSql();

		Assertions.assertEquals(base.getBindings().size(), countOccurrences(base.getSql(), "?"));
		Assertions.assertEquals(postgres.getBindings().size(), maximumNumberedPlaceholder(postgres.getSql()));
	}

	@Test
	public void testDialectsDifferOnlyInPlaceholders() {
		CompiledQuery base = fullyLoaded(builder(new BaseGrammar(), "users")).toSql();
		CompiledQuery postgres = fullyLoaded(builder(new PostgresGrammar(), "users")).toSql();

		Assertions.assertEquals(base.getSql(), postgres.getSql().replaceAll("\\$\\d+", "?"));
		Assertions.assertEquals(base.getBindings(), postgres.getBindings());
	}

	@Test
	public void testPredicateShapes() {
		CompiledQuery compiledQuery = builder(new BaseGrammar(), "users")
				.whereNull("deleted_at")
				.whereNotNull("email")
				.whereBetween("age", 18, 65)
				.whereNotIn("id", List.of(1, 2, 3))
				.orWhere("name", null)
				.toSql();

		Assertions.assertEquals("SELECT * FROM \"users\" WHERE \"deleted_at\" IS NULL AND \"email\" IS NOT NULL "
				+ "AND \"age\" BETWEEN ? AND ? AND \"id\" NOT IN (?, ?, ?) OR \"name\" = ?", compiledQuery.getSql());

		List<Object> expectedBindings = new ArrayList<>(List.of(18, 65, 1, 2, 3));
		expectedBindings.add(null);
		Assertions.assertEquals(expectedBindings, compiledQuery.getBindings());
	}

	@Test
	public void testEmptyInListCompiles() {
		CompiledQuery compiledQuery = builder(new BaseGrammar(), "users").whereIn("id", List.of()).toSql();

		Assertions.assertEquals("SELECT * FROM \"users\" WHERE \"id\" IN ()", compiledQuery.getSql());
		Assertions.assertTrue(compiledQuery.getBindings().isEmpty());
	}

	@Test
	public void testIdentifierWrapping() {
		Grammar grammar = new BaseGrammar();

		Assertions.assertEquals("*", grammar.wrapColumn("*"));
		Assertions.assertEquals("\"name\"", grammar.wrapColumn("name"));
		Assertions.assertEquals("\"users\".\"name\"", grammar.wrapColumn("users.name"));
		Assertions.assertEquals("\"users\".*", grammar.wrapColumn("users.*"));
		Assertions.assertEquals("name AS n", grammar.wrapColumn("name AS n"));
		Assertions.assertEquals("name as n", grammar.wrapColumn("name as n"));
		Assertions.assertEquals("COUNT(*)", grammar.wrapColumn("COUNT(*)"));
		Assertions.assertEquals("\"already\"", grammar.wrapColumn("\"already\""));
		Assertions.assertEquals("\"users\"", grammar.wrapTable("users"));
		Assertions.assertEquals("\"public\".\"users\"", grammar.wrapTable("public.users"));
		Assertions.assertEquals("users u", grammar.wrapTable("users u"));

		Grammar postgres = new PostgresGrammar();
		Grammar sqlite = new SqliteGrammar();

		for (String identifier : List.of("*", "name", "users.name", "users.*", "COUNT(*)", "name AS n")) {
			Assertions.assertEquals(grammar.wrapColumn(identifier), postgres.wrapColumn(identifier));
			Assertions.assertEquals(grammar.wrapColumn(identifier), sqlite.wrapColumn(identifier));
		}
	}

	@Test
	public void testPlaceholderSynthesis() {
		Assertions.assertEquals("?", new BaseGrammar().parameter(0));
		Assertions.assertEquals("?", new SqliteGrammar().parameter(7));
		Assertions.assertEquals("$1", new PostgresGrammar().parameter(0));
		Assertions.assertEquals("$8", new PostgresGrammar().parameter(7));
		Assertions.assertEquals("yyyy-MM-dd HH:mm:ss", new PostgresGrammar().getDateFormat());
	}

	@Test
	public void testInsertAndUpdateAreDeterministic() {
		Map<String, Object> forward = new LinkedHashMap<>();
		forward.put("name", "Ana");
		forward.put("status", "active");
		forward.put("age", 30);

		Map<String, Object> backward = new LinkedHashMap<>();
		backward.put("age", 30);
		backward.put("status", "active");
		backward.put("name", "Ana");

		Grammar grammar = new SqliteGrammar();
		QueryBuilder queryBuilder = builder(grammar, "users");

		CompiledQuery insert = grammar.compileInsert(queryBuilder, forward);

		Assertions.assertEquals("INSERT INTO \"users\" (\"age\", \"name\", \"status\") VALUES (?, ?, ?)", insert.getSql());
		Assertions.assertEquals(List.of(30, "Ana", "active"), insert.getBindings());
		Assertions.assertEquals(insert, grammar.compileInsert(queryBuilder, backward));

		CompiledQuery update = grammar.compileUpdate(queryBuilder, forward);

		Assertions.assertEquals("UPDATE \"users\" SET \"age\" = ?, \"name\" = ?, \"status\" = ?", update.getSql());
		Assertions.assertEquals(update, grammar.compileUpdate(queryBuilder, backward));
	}

	@Test
	public void testUpdateContinuesPlaceholderNumberingIntoWhere() {
		Grammar grammar = new PostgresGrammar();
		QueryBuilder queryBuilder = builder(grammar, "users").where("id", "=", 7).whereIn("status", List.of("a", "b"));

		CompiledQuery update = grammar.compileUpdate(queryBuilder, Map.of("name", "Ana", "age", 31));

		Assertions.assertEquals("UPDATE \"users\" SET \"age\" = $1, \"name\" = $2 WHERE \"id\" = $3 AND \"status\" IN ($4, $5)",
				update.getSql());
		Assertions.assertEquals(List.of(31, "Ana", 7, "a", "b"), update.getBindings());
	}

	@Test
	public void testRawExpressionIsNeverBound() {
		Grammar grammar = new PostgresGrammar();
		QueryBuilder queryBuilder = builder(grammar, "users")
				.where("updated_at", "<", RawExpression.of("CURRENT_TIMESTAMP"))
				.where("status", "=", "idle");

		CompiledQuery update = grammar.compileUpdate(queryBuilder,
				Map.of("logins", RawExpression.of("\"logins\" + 1"), "status", "active"));

		Assertions.assertEquals("UPDATE \"users\" SET \"logins\" = \"logins\" + 1, \"status\" = $1 "
				+ "WHERE \"updated_at\" < CURRENT_TIMESTAMP AND \"status\" = $2", update.getSql());
		Assertions.assertEquals(List.of("active", "idle"), update.getBindings());
	}

	@Test
	public void testRawFragmentsUseDialectPlaceholders() {
		CompiledQuery compiledQuery = builder(new PostgresGrammar(), "products")
				.selectRaw("price * ? AS total", 2)
				.where("status", "active")
				.whereRaw("lower(\"name\") = ? AND \"note\" <> '?'", "ana")
				.groupBy("status")
				.havingRaw("COUNT(*) > ?", 1)
				.orderByRaw("CASE WHEN \"tier\" = ? THEN 0 ELSE 1 END", "gold")
				.toSql();

		Assertions.assertEquals("SELECT price * $1 AS total FROM \"products\" WHERE \"status\" = $2 "
				+ "AND lower(\"name\") = $3 AND \"note\" <> '?' GROUP BY \"status\" HAVING COUNT(*) > $4 "
				+ "ORDER BY CASE WHEN \"tier\" = $5 THEN 0 ELSE 1 END", compiledQuery.getSql());
		Assertions.assertEquals(List.of(2, "active", "ana", 1, "gold"), compiledQuery.getBindings());
	}

	@Test
	public void testDoubledQuestionMarkIsLiteralInRawFragments() {
		CompiledQuery compiledQuery = builder(new PostgresGrammar(), "products")
				.whereRaw("\"tags\" ?? 'vip'")
				.where("status", "active")
				.whereRaw("\"attributes\" ?? ?", "color")
				.toSql();

		Assertions.assertEquals("SELECT * FROM \"products\" WHERE \"tags\" ?? 'vip' AND \"status\" = $1 "
				+ "AND \"attributes\" ?? $2", compiledQuery.getSql());
		Assertions.assertEquals(List.of("active", "color"), compiledQuery.getBindings());

		CompiledQuery jdbcQuery = SqlPlaceholders.toJdbc(compiledQuery);

		Assertions.assertEquals("SELECT * FROM \"products\" WHERE \"tags\" ?? 'vip' AND \"status\" = ? "
				+ "AND \"attributes\" ?? ?", jdbcQuery.getSql());
		Assertions.assertEquals(List.of("active", "color"), jdbcQuery.getBindings());
	}

	@Test
	public void testSelectRawKeepsExplicitColumns() {
		CompiledQuery compiledQuery = builder(new BaseGrammar(), "users")
				.select("id")
				.selectRaw("UPPER(\"name\") AS shout")
				.toSql();

		Assertions.assertEquals("SELECT \"id\", UPPER(\"name\") AS shout FROM \"users\"", compiledQuery.getSql());
	}

	@Test
	public void testDeleteExistsAndTruncate() {
		Grammar grammar = new PostgresGrammar();
		QueryBuilder queryBuilder = builder(grammar, "users").where("age", ">", 90);

		Assertions.assertEquals(CompiledQuery.of("DELETE FROM \"users\" WHERE \"age\" > $1", List.of(90)),
				grammar.compileDelete(queryBuilder));
		Assertions.assertEquals(CompiledQuery.of("SELECT EXISTS (SELECT * FROM \"users\" WHERE \"age\" > $1) AS \"exists\"", List.of(90)),
				grammar.compileExists(queryBuilder));
		Assertions.assertEquals(CompiledQuery.of("TRUNCATE TABLE \"users\""), grammar.compileTruncate("users"));
		Assertions.assertEquals("DELETE FROM \"users\"", grammar.compileDelete(builder(grammar, "users")).getSql());
	}

	@Test
	public void testGrammarForDriverName() {
		Assertions.assertEquals(PostgresGrammar.class, Grammar.forDriverName("postgres").getClass());
		Assertions.assertEquals(PostgresGrammar.class, Grammar.forDriverName("pgsql").getClass());
		Assertions.assertEquals(SqliteGrammar.class, Grammar.forDriverName("sqlite3").getClass());
		Assertions.assertEquals(BaseGrammar.class, Grammar.forDriverName("mysql").getClass());
		Assertions.assertEquals(BaseGrammar.class, Grammar.forDriverName(null).getClass());
		Assertions.assertEquals(DatabaseType.SQLITE, Grammar.forDatabaseType(DatabaseType.SQLITE).getDatabaseType());
	}

	@Test
	public void testSharedGrammarCompilesConcurrently() throws Exception {
		Grammar grammar = new PostgresGrammar();
		ExecutorService executorService = Executors.newFixedThreadPool(8);

		try {
			List<Future<Boolean>> futures = new ArrayList<>();

			for (int i = 0; i < 400; ++i) {
				int age = i;
				futures.add(executorService.submit(() -> {
					CompiledQuery compiledQuery = builder(grammar, "users")
							.where("age", ">", age)
							.whereIn("status", List.of("a", "b"))
							.having("age", "<", 1000)
							.toSql();

					return compiledQuery.getSql().equals("SELECT * FROM \"users\" WHERE \"age\" > $1 AND \"status\" IN ($2, $3) HAVING \"age\" < $4")
							&& compiledQuery.getBindings().equals(List.of(age, "a", "b", 1000));
				}));
			}

			for (Future<Boolean> future : futures)
				Assertions.assertTrue(future.get(), "Concurrent compilation produced mismatched placeholders");
		} finally {
			executorService.shutdownNow();
		}
	}

	@NonNull
	protected QueryBuilder builder(@NonNull Grammar grammar,
																 @NonNull String table) {
		requireNonNull(grammar);
		requireNonNull(table);

		return new QueryBuilder(TestQueries.unusedExecutionHandle(), grammar, table);
	}

	@NonNull
	protected QueryBuilder fullyLoaded(@NonNull QueryBuilder queryBuilder) {
		requireNonNull(queryBuilder);

		return queryBuilder
				.select("users.id", "COUNT(orders.id) AS order_count")
				.distinct()
				.join("orders", "users.id", "=", "orders.user_id")
				.leftJoin("profiles", "profiles.user_id", "=", "users.id")
				.rightJoin("teams", "teams.id", "=", "users.team_id")
				.crossJoin("regions")
				.where("users.age", ">=", 18)
				.orWhere("users.status", "vip")
				.whereIn("users.role", List.of("admin", "staff"))
				.groupBy("users.id")
				.having("order_count", ">", 2)
				.orHaving("order_count", "<", 100)
				.orderBy("users.id", "sideways")
				.orderByDesc("users.name")
				.limit(10)
				.offset(20);
	}

	protected int countOccurrences(@NonNull String string,
																 @NonNull String substring) {
		int count = 0;

		for (int i = string.indexOf(substring); i != -1; i = string.indexOf(substring, i + substring.length()))
			++count;

		return count;
	}

	protected int maximumNumberedPlaceholder(@NonNull String sql) {
		Matcher matcher = Pattern.compile("\\$(\\d+)").matcher(sql);
		int maximum = 0;

		while (matcher.find())
			maximum = Math.max(maximum, Integer.parseInt(matcher.group(1)));

		return maximum;
	}
}
