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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Fluent, mutable builder for a single statement against one table.
 * <p>
 * Configuration methods append to the builder's clause lists and return the same instance. Terminal methods
 * ({@link #get()}, {@link #count()}, {@link #insert(Map)}, {@link #update(Map)} and friends) compile the current state
 * with the builder's {@link Grammar} and run it on its {@link ExecutionHandle}.
 * <p>
 * Arguments are not validated beyond null checks: a malformed column or operator shows up as a driver error when the
 * statement runs.
 * <pre>{@code List<Map<String, Object>> rows = database.table("users")
 *   .where("age", ">", 25)
 *   .orderByDesc("age")
 *   .limit(5)
 *   .get();}</pre>
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class QueryBuilder {
	@NonNull
	private static final String DEFAULT_COLUMN = "*";
	@NonNull
	private static final String PRIMARY_KEY_COLUMN = "id";

	@NonNull
	private final ExecutionHandle executionHandle;
	@NonNull
	private final Grammar grammar;
	@NonNull
	private String table;
	@NonNull
	private List<String> columns;
	private boolean defaultColumns;
	@NonNull
	private List<@Nullable Object> selectBindings;
	private boolean distinct;
	@NonNull
	private final List<JoinClause> joins;
	@NonNull
	private final List<WhereClause> wheres;
	@NonNull
	private final List<String> groups;
	@NonNull
	private final List<HavingClause> havings;
	@NonNull
	private final List<OrderClause> orders;
	@Nullable
	private Integer limit;
	@Nullable
	private Integer offset;
	@Nullable
	private QueryContext queryContext;
	@Nullable
	private Throwable error;

	/**
	 * Creates a builder that compiles with {@code grammar} and runs statements on {@code executionHandle}.
	 * <p>
	 * Most code gets a builder from {@link Database#table(String)} or {@link Transaction#table(String)} instead.
	 *
	 * @param executionHandle where compiled statements run
	 * @param grammar         the dialect to compile with
	 * @param table           the table to query
	 */
	public QueryBuilder(@NonNull ExecutionHandle executionHandle,
											@NonNull Grammar grammar,
											@NonNull String table) {
		requireNonNull(executionHandle);
		requireNonNull(grammar);
		requireNonNull(table);

		this.executionHandle = executionHandle;
		this.grammar = grammar;
		this.table = table;
		this.columns = new ArrayList<>(List.of(DEFAULT_COLUMN));
		this.defaultColumns = true;
		this.selectBindings = new ArrayList<>();
		this.joins = new ArrayList<>();
		this.wheres = new ArrayList<>();
		this.groups = new ArrayList<>();
		this.havings = new ArrayList<>();
		this.orders = new ArrayList<>();
	}

	/**
	 * Attaches a context (statement timeout) to every statement this builder runs.
	 *
	 * @param queryContext the context to use
	 * @return this builder, for chaining
	 */
	@NonNull
	public QueryBuilder withContext(@NonNull QueryContext queryContext) {
		requireNonNull(queryContext);
		this.queryContext = queryContext;
		return this;
	}

	/**
	 * Replaces the projection. Calling with no columns leaves the projection unchanged.
	 *
	 * @param columns the columns to select
	 * @return this builder, for chaining
	 */
	@NonNull
	public QueryBuilder select(@NonNull String... columns) {
		requireNonNull(columns);

		if (columns.length > 0) {
			this.columns = new ArrayList<>(Arrays.asList(columns));
			this.defaultColumns = false;
		}

		return this;
	}

	/**
	 * Adds a raw expression to the projection, e.g. {@code selectRaw("price * ? AS total", 1.2)}.
	 * <p>
	 * The expression is not quoted. Each {@code ?} is a binding marker. If nothing was selected explicitly, the
	 * expression replaces the implicit {@code *}.
	 *
	 * @param expression the SQL expression
	 * @param bindings   values for the expression's markers
	 * @return this builder, for chaining
	 */
	@NonNull
	public QueryBuilder selectRaw(@NonNull String expression,
																@Nullable Object... bindings) {
		requireNonNull(expression);

		if (this.defaultColumns) {
			this.columns = new ArrayList<>();
			this.defaultColumns = false;
		}

		this.columns.add(expression);
		this.selectBindings.addAll(bindingsAsList(bindings));
		return this;
	}

	/**
	 * Emits {@code SELECT DISTINCT}.
	 *
	 * @return this builder, for chaining
	 */
	@NonNull
	public QueryBuilder distinct() {
		this.distinct = true;
		return this;
	}

	/**
	 * Changes the table this builder targets.
	 *
	 * @param table the table name
	 * @return this builder, for chaining
	 */
	@NonNull
	public QueryBuilder from(@NonNull String table) {
		requireNonNull(table);
		this.table = table;
		return this;
	}

	/**
	 * Adds {@code INNER JOIN table ON first operator second}.
	 *
	 * @param table    the table to join
	 * @param first    the left-hand column
	 * @param operator the comparison operator
	 * @param second   the right-hand column
	 * @return this builder, for chaining
	 */
	@NonNull
	public QueryBuilder join(@NonNull String table,
													 @NonNull String first,
													 @NonNull String operator,
													 @NonNull String second) {
		return addJoin(JoinClause.JoinType.INNER, table, first, operator, second);
	}

	/**
	 * Adds a {@code LEFT JOIN}. See {@link #join(String, String, String, String)}.
	 *
	 * @param table    the table to join
	 * @param first    the left-hand column
	 * @param operator the comparison operator
	 * @param second   the right-hand column
	 * @return this builder, for chaining
	 */
	@NonNull
	public QueryBuilder leftJoin(@NonNull String table,
															 @NonNull String first,
															 @NonNull String operator,
															 @NonNull String second) {
		return addJoin(JoinClause.JoinType.LEFT, table, first, operator, second);
	}

	/**
	 * Adds a {@code RIGHT JOIN}. See {@link #join(String, String, String, String)}.
	 *
	 * @param table    the table to join
	 * @param first    the left-hand column
	 * @param operator the comparison operator
	 * @param second   the right-hand column
	 * @return this builder, for chaining
	 */
	@NonNull
	public QueryBuilder rightJoin(@NonNull String table,
																@NonNull String first,
																@NonNull String operator,
																@NonNull String second) {
		return addJoin(JoinClause.JoinType.RIGHT, table, first, operator, second);
	}

	/**
	 * Adds {@code CROSS JOIN table}, which takes no {@code ON} condition.
	 *
	 * @param table the table to join
	 * @return this builder, for chaining
	 */
	@NonNull
	public QueryBuilder crossJoin(@NonNull String table) {
		requireNonNull(table);
		this.joins.add(JoinClause.cross(table));
		return this;
	}

	/**
	 * Adds {@code column operator value}, joined to earlier predicates with {@code AND}.
	 * <p>
	 * A {@link RawExpression} value is written into the SQL as-is instead of being bound.
	 *
	 * @param column   the column to compare
	 * @param operator the comparison operator, e.g. {@code =} or {@code >=}
	 * @param value    the value to compare against
	 * @return this builder, for chaining
	 */
	@NonNull
	public QueryBuilder where(@NonNull String column,
														@NonNull String operator,
														@Nullable Object value) {
		this.wheres.add(new WhereClause.Basic(column, operator, value, Connective.AND));
		return this;
	}

	/**
	 * Shorthand for {@code where(column, "=", value)}.
	 *
	 * @param column the column to compare
	 * @param value  the value it must equal
	 * @return this builder, for chaining
	 */
	@NonNull
	public QueryBuilder where(@NonNull String column,
														@Nullable Object value) {
		return where(column, "=", value);
	}

	/**
	 * Like {@link #where(String, String, Object)}, but joined to earlier predicates with {@code OR}.
	 *
	 * @param column   the column to compare
	 * @param operator the comparison operator
	 * @param value    the value to compare against
	 * @return this builder, for chaining
	 */
	@NonNull
	public QueryBuilder orWhere(@NonNull String column,
															@NonNull String operator,
															@Nullable Object value) {
		this.wheres.add(new WhereClause.Basic(column, operator, value, Connective.OR));
		return this;
	}

	/**
	 * Shorthand for {@code orWhere(column, "=", value)}.
	 *
	 * @param column the column to compare
	 * @param value  the value it must equal
	 * @return this builder, for chaining
	 */
	@NonNull
	public QueryBuilder orWhere(@NonNull String column,
															@Nullable Object value) {
		return orWhere(column, "=", value);
	}

	/**
	 * Adds {@code column IN (...)}. An empty list compiles to {@code IN ()}, which most databases reject.
	 *
	 * @param column the column to test
	 * @param values the allowed values
	 * @return this builder, for chaining
	 */
	@NonNull
	public QueryBuilder whereIn(@NonNull String column,
															@NonNull List<?> values) {
		requireNonNull(values);
		this.wheres.add(new WhereClause.In(column, new ArrayList<>(values), Connective.AND));
		return this;
	}

	/**
	 * Adds {@code column NOT IN (...)}.
	 *
	 * @param column the column to test
	 * @param values the excluded values
	 * @return this builder, for chaining
	 */
	@NonNull
	public QueryBuilder whereNotIn(@NonNull String column,
																 @NonNull List<?> values) {
		requireNonNull(values);
		this.wheres.add(new WhereClause.NotIn(column, new ArrayList<>(values), Connective.AND));
		return this;
	}

	/**
	 * Adds {@code column IS NULL}.
	 *
	 * @param column the column to test
	 * @return this builder, for chaining
	 */
	@NonNull
	public QueryBuilder whereNull(@NonNull String column) {
		this.wheres.add(new WhereClause.Null(column, Connective.AND));
		return this;
	}

	/**
	 * Adds {@code column IS NOT NULL}.
	 *
	 * @param column the column to test
	 * @return this builder, for chaining
	 */
	@NonNull
	public QueryBuilder whereNotNull(@NonNull String column) {
		this.wheres.add(new WhereClause.NotNull(column, Connective.AND));
		return this;
	}

	/**
	 * Adds {@code column BETWEEN low AND high}, binding {@code low} first.
	 *
	 * @param column the column to test
	 * @param low    the inclusive lower bound
	 * @param high   the inclusive upper bound
	 * @return this builder, for chaining
	 */
	@NonNull
	public QueryBuilder whereBetween(@NonNull String column,
																	 @Nullable Object low,
																	 @Nullable Object high) {
		this.wheres.add(new WhereClause.Between(column, low, high, Connective.AND));
		return this;
	}

	/**
	 * Adds a raw predicate, e.g. {@code whereRaw("lower(\"email\") = ?", email)}. Each {@code ?} outside quoted text
	 * becomes the dialect's placeholder. Write {@code ??} for a literal {@code ?} operator, as in
	 * {@code whereRaw("\"tags\" ?? 'vip'")}; it reaches the driver unchanged.
	 *
	 * @param sql      the predicate SQL
	 * @param bindings values for the predicate's markers
	 * @return this builder, for chaining
	 */
	@NonNull
	public QueryBuilder whereRaw(@NonNull String sql,
															 @Nullable Object... bindings) {
		this.wheres.add(new WhereClause.Raw(sql, bindingsAsList(bindings), Connective.AND));
		return this;
	}

	/**
	 * Like {@link #whereRaw(String, Object...)}, but joined to earlier predicates with {@code OR}.
	 *
	 * @param sql      the predicate SQL
	 * @param bindings values for the predicate's markers
	 * @return this builder, for chaining
	 */
	@NonNull
	public QueryBuilder orWhereRaw(@NonNull String sql,
																 @Nullable Object... bindings) {
		this.wheres.add(new WhereClause.Raw(sql, bindingsAsList(bindings), Connective.OR));
		return this;
	}

	/**
	 * Appends columns to the {@code GROUP BY} list.
	 *
	 * @param columns the columns to group by
	 * @return this builder, for chaining
	 */
	@NonNull
	public QueryBuilder groupBy(@NonNull String... columns) {
		requireNonNull(columns);
		this.groups.addAll(Arrays.asList(columns));
		return this;
	}

	/**
	 * Adds a {@code HAVING} condition, joined to earlier ones with {@code AND}.
	 *
	 * @param column   the column or aggregate expression
	 * @param operator the comparison operator
	 * @param value    the value to compare against
	 * @return this builder, for chaining
	 */
	@NonNull
	public QueryBuilder having(@NonNull String column,
														 @NonNull String operator,
														 @Nullable Object value) {
		this.havings.add(new HavingClause.Basic(column, operator, value, Connective.AND));
		return this;
	}

	/**
	 * Adds a {@code HAVING} condition, joined to earlier ones with {@code OR}.
	 *
	 * @param column   the column or aggregate expression
	 * @param operator the comparison operator
	 * @param value    the value to compare against
	 * @return this builder, for chaining
	 */
	@NonNull
	public QueryBuilder orHaving(@NonNull String column,
															 @NonNull String operator,
															 @Nullable Object value) {
		this.havings.add(new HavingClause.Basic(column, operator, value, Connective.OR));
		return this;
	}

	/**
	 * Adds a raw {@code HAVING} condition, e.g. {@code havingRaw("SUM(\"total\") > ?", 100)}.
	 *
	 * @param sql      the condition SQL
	 * @param bindings values for the condition's markers
	 * @return this builder, for chaining
	 */
	@NonNull
	public QueryBuilder havingRaw(@NonNull String sql,
																@Nullable Object... bindings) {
		this.havings.add(new HavingClause.Raw(sql, bindingsAsList(bindings), Connective.AND));
		return this;
	}

	/**
	 * Orders by {@code column}. Directions other than {@code asc} or {@code desc} (in any case) fall back to
	 * {@code ASC}.
	 *
	 * @param column    the column to order by
	 * @param direction {@code asc} or {@code desc}
	 * @return this builder, for chaining
	 */
	@NonNull
	public QueryBuilder orderBy(@NonNull String column,
															@NonNull String direction) {
		this.orders.add(OrderClause.column(column, direction));
		return this;
	}

	/**
	 * Orders by {@code column} ascending.
	 *
	 * @param column the column to order by
	 * @return this builder, for chaining
	 */
	@NonNull
	public QueryBuilder orderBy(@NonNull String column) {
		return orderBy(column, "ASC");
	}

	/**
	 * Orders by {@code column} descending.
	 *
	 * @param column the column to order by
	 * @return this builder, for chaining
	 */
	@NonNull
	public QueryBuilder orderByDesc(@NonNull String column) {
		return orderBy(column, "DESC");
	}

	/**
	 * Adds a raw {@code ORDER BY} entry. It is not quoted, and its bindings follow any {@code HAVING} bindings.
	 *
	 * @param sql      the ordering SQL
	 * @param bindings values for the entry's markers
	 * @return this builder, for chaining
	 */
	@NonNull
	public QueryBuilder orderByRaw(@NonNull String sql,
																 @Nullable Object... bindings) {
		this.orders.add(OrderClause.raw(sql, bindingsAsList(bindings)));
		return this;
	}

	/**
	 * Caps the number of rows returned. {@code 0} is emitted as {@code LIMIT 0}.
	 *
	 * @param limit the maximum number of rows
	 * @return this builder, for chaining
	 */
	@NonNull
	public QueryBuilder limit(int limit) {
		this.limit = limit;
		return this;
	}

	/**
	 * Skips the first {@code offset} rows.
	 *
	 * @param offset the number of rows to skip
	 * @return this builder, for chaining
	 */
	@NonNull
	public QueryBuilder offset(int offset) {
		this.offset = offset;
		return this;
	}

	/**
	 * Alias for {@link #limit(int)}.
	 *
	 * @param count the maximum number of rows
	 * @return this builder, for chaining
	 */
	@NonNull
	public QueryBuilder take(int count) {
		return limit(count);
	}

	/**
	 * Alias for {@link #offset(int)}.
	 *
	 * @param count the number of rows to skip
	 * @return this builder, for chaining
	 */
	@NonNull
	public QueryBuilder skip(int count) {
		return offset(count);
	}

	/**
	 * Selects page {@code page} (1-based) of {@code perPage} rows. Pages below 1 are treated as page 1.
	 *
	 * @param page    the page number
	 * @param perPage rows per page
	 * @return this builder, for chaining
	 */
	@NonNull
	public QueryBuilder forPage(int page,
															int perPage) {
		if (page < 1)
			page = 1;

		return offset((page - 1) * perPage).limit(perPage);
	}

	/**
	 * Runs the {@code SELECT} and returns every row.
	 *
	 * @return rows keyed by column label, in column order
	 */
	@NonNull
	public List<Map<String, @Nullable Object>> get() {
		return query(toSql());
	}

	/**
	 * Limits the query to one row and returns it. The limit stays on the builder.
	 *
	 * @return the first row, or empty if there is none
	 */
	@NonNull
	public Optional<Map<String, @Nullable Object>> first() {
		limit(1);
		List<Map<String, Object>> rows = get();
		return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
	}

	/**
	 * Shorthand for {@code where("id", "=", id).first()}.
	 *
	 * @param id the primary key value
	 * @return the row, or empty if there is none
	 */
	@NonNull
	public Optional<Map<String, @Nullable Object>> find(@Nullable Object id) {
		return where(PRIMARY_KEY_COLUMN, "=", id).first();
	}

	/**
	 * Narrows the projection to {@code column} and returns its value from the first row.
	 *
	 * @param column the column to read
	 * @return the value, or empty if there is no row or the value is SQL {@code NULL}
	 */
	@NonNull
	public Optional<Object> value(@NonNull String column) {
		requireNonNull(column);

		select(column);
		return first().map(row -> firstValue(row));
	}

	/**
	 * Narrows the projection to {@code column} and returns its value from every row.
	 *
	 * @param column the column to read
	 * @return the values in row order, {@code null} for SQL {@code NULL}
	 */
	@NonNull
	public List<@Nullable Object> pluck(@NonNull String column) {
		requireNonNull(column);

		select(column);

		List<Map<String, Object>> rows = get();
		List<Object> values = new ArrayList<>(rows.size());

		for (Map<String, Object> row : rows)
			values.add(firstValue(row));

		return values;
	}

	/**
	 * Whether any row matches, derived from {@link #count()}.
	 *
	 * @return {@code true} if at least one row matches
	 */
	public boolean exists() {
		return count() > 0;
	}

	/**
	 * @return {@code true} if no row matches
	 */
	public boolean doesntExist() {
		return !exists();
	}

	/**
	 * Counts the rows matching this builder's filters. Ordering, limit and offset do not apply, so a paginated builder
	 * reports the total across all pages.
	 *
	 * @return the number of matching rows
	 * @throws DatabaseException if the database returned a non-numeric count
	 */
	public long count() {
		Object count = aggregate("COUNT", DEFAULT_COLUMN);

		if (count == null)
			return 0;

		if (count instanceof Number number)
			return number.longValue();

		throw new DatabaseException(format("Unexpected type for count: %s", count.getClass().getName()));
	}

	/**
	 * The largest value of {@code column} over the matching rows.
	 *
	 * @param column the column to inspect
	 * @return the maximum, or empty if there were no non-null values
	 */
	@NonNull
	public Optional<Object> max(@NonNull String column) {
		requireNonNull(column);
		return Optional.ofNullable(aggregate("MAX", column));
	}

	/**
	 * The smallest value of {@code column} over the matching rows.
	 *
	 * @param column the column to inspect
	 * @return the minimum, or empty if there were no non-null values
	 */
	@NonNull
	public Optional<Object> min(@NonNull String column) {
		requireNonNull(column);
		return Optional.ofNullable(aggregate("MIN", column));
	}

	/**
	 * Sums {@code column} over the matching rows.
	 *
	 * @param column the column to sum
	 * @return the sum, or {@code 0} if there were no non-null values
	 * @throws DatabaseException if the database returned a non-numeric sum
	 */
	public double sum(@NonNull String column) {
		requireNonNull(column);
		return aggregateAsDouble("SUM", column);
	}

	/**
	 * Averages {@code column} over the matching rows.
	 *
	 * @param column the column to average
	 * @return the average, or {@code 0} if there were no non-null values
	 * @throws DatabaseException if the database returned a non-numeric average
	 */
	public double avg(@NonNull String column) {
		requireNonNull(column);
		return aggregateAsDouble("AVG", column);
	}

	/**
	 * Inserts one row.
	 *
	 * @param values column-to-value map; columns are written in sorted order
	 * @return the number of rows inserted
	 */
	public long insert(@NonNull Map<String, ?> values) {
		requireNonNull(values);
		return execute(getGrammar().compileInsert(this, values), false).getRowsAffected();
	}

	/**
	 * Inserts one row and returns its generated {@code id}.
	 * <p>
	 * On PostgreSQL the statement gets a {@code RETURNING id} suffix and the key is read from the returned row. Other
	 * databases report the key through JDBC generated keys.
	 *
	 * @param values column-to-value map
	 * @return the generated key
	 * @throws DatabaseException if no key was produced
	 */
	public long insertGetId(@NonNull Map<String, ?> values) {
		requireNonNull(values);

		CompiledQuery compiledQuery = getGrammar().compileInsert(this, values);

		if (getGrammar().getDatabaseType() == DatabaseType.POSTGRESQL) {
			Map<String, Object> row = queryRow(compiledQuery.withSql(compiledQuery.getSql() + " RETURNING id"))
					.orElseThrow(() -> new DatabaseException("Insert did not return a row"));

			Object id = firstValue(row);

			if (id instanceof Number number)
				return number.longValue();

			throw new DatabaseException(format("Unexpected generated key: %s", id));
		}

		return execute(compiledQuery, true).getLastInsertId();
	}

	/**
	 * Inserts each record with its own {@code INSERT} statement, in order.
	 * <p>
	 * There is no implicit transaction: if a record fails, the exception propagates and earlier records stay
	 * inserted. Wrap the call in {@link Database#transaction(TransactionalOperation)} for all-or-nothing behavior.
	 *
	 * @param records the rows to insert
	 * @return the total number of rows inserted
	 */
	public long insertBatch(@NonNull List<? extends Map<String, ?>> records) {
		requireNonNull(records);

		long totalRowsAffected = 0;

		for (Map<String, ?> record : records)
			totalRowsAffected += clone().insert(record);

		return totalRowsAffected;
	}

	/**
	 * Updates the rows matching this builder's predicates.
	 *
	 * @param values column-to-value map; a {@link RawExpression} value is written as-is
	 * @return the number of rows updated
	 */
	public long update(@NonNull Map<String, ?> values) {
		requireNonNull(values);
		return execute(getGrammar().compileUpdate(this, values), false).getRowsAffected();
	}

	/**
	 * Adds one to {@code column} on the matching rows.
	 *
	 * @param column the column to increment
	 * @return the number of rows updated
	 */
	public long increment(@NonNull String column) {
		return increment(column, 1);
	}

	public long increment(@NonNull String column,
												int amount) {
		return increment(column, amount, Map.of());
	}

	/**
	 * Adds {@code amount} to {@code column} and sets {@code extraValues} in the same statement.
	 *
	 * @param column      the column to increment
	 * @param amount      how much to add
	 * @param extraValues other columns to update
	 * @return the number of rows updated
	 */
	public long increment(@NonNull String column,
												int amount,
												@NonNull Map<String, ?> extraValues) {
		return adjust(column, "+", amount, extraValues);
	}

	public long decrement(@NonNull String column) {
		return decrement(column, 1);
	}

	public long decrement(@NonNull String column,
												int amount) {
		return decrement(column, amount, Map.of());
	}

	/**
	 * Subtracts {@code amount} from {@code column} and sets {@code extraValues} in the same statement.
	 *
	 * @param column      the column to decrement
	 * @param amount      how much to subtract
	 * @param extraValues other columns to update
	 * @return the number of rows updated
	 */
	public long decrement(@NonNull String column,
												int amount,
												@NonNull Map<String, ?> extraValues) {
		return adjust(column, "-", amount, extraValues);
	}

	/**
	 * Deletes the rows matching this builder's predicates. With no predicates, every row is deleted.
	 *
	 * @return the number of rows deleted
	 */
	public long delete() {
		return execute(getGrammar().compileDelete(this), false).getRowsAffected();
	}

	/**
	 * Empties the table with {@code TRUNCATE TABLE}. Predicates are ignored.
	 */
	public void truncate() {
		execute(getGrammar().compileTruncate(getTable()), false);
	}

	/**
	 * Compiles the current state into a {@code SELECT} without running it.
	 *
	 * @return the SQL, in the grammar's placeholder syntax, and its bindings
	 */
	@NonNull
	public CompiledQuery toSql() {
		return getGrammar().compileSelect(this);
	}

	/**
	 * Copies this builder. The copy shares the execution handle and grammar but has its own clause lists, so changes
	 * to either builder do not affect the other.
	 *
	 * @return an independent copy
	 */
	@Override
	@NonNull
	public QueryBuilder clone() {
		QueryBuilder clone = new QueryBuilder(getExecutionHandle(), getGrammar(), getTable());
		clone.columns = new ArrayList<>(this.columns);
		clone.defaultColumns = this.defaultColumns;
		clone.selectBindings = new ArrayList<>(this.selectBindings);
		clone.distinct = this.distinct;
		clone.joins.addAll(this.joins);
		clone.wheres.addAll(this.wheres);
		clone.groups.addAll(this.groups);
		clone.havings.addAll(this.havings);
		clone.orders.addAll(this.orders);
		clone.limit = this.limit;
		clone.offset = this.offset;
		clone.queryContext = this.queryContext;
		clone.error = this.error;
		return clone;
	}

	/**
	 * Latches an error onto this builder. While set, every statement the builder would run fails with it instead,
	 * without touching the database. Passing {@code null} clears it.
	 *
	 * @param error the error to fail with
	 */
	public void setError(@Nullable Throwable error) {
		this.error = error;
	}

	@NonNull
	public Optional<Throwable> getError() {
		return Optional.ofNullable(this.error);
	}

	@NonNull
	protected List<Map<String, @Nullable Object>> query(@NonNull CompiledQuery compiledQuery) {
		requireNonNull(compiledQuery);

		throwErrorIfPresent();
		return getExecutionHandle().query(compiledQuery, getEffectiveQueryContext());
	}

	@NonNull
	protected Optional<Map<String, @Nullable Object>> queryRow(@NonNull CompiledQuery compiledQuery) {
		requireNonNull(compiledQuery);

		throwErrorIfPresent();
		return getExecutionHandle().queryRow(compiledQuery, getEffectiveQueryContext());
	}

	@NonNull
	protected ExecutionResult execute(@NonNull CompiledQuery compiledQuery,
																		boolean returnGeneratedKeys) {
		requireNonNull(compiledQuery);

		throwErrorIfPresent();
		return getExecutionHandle().execute(compiledQuery, getEffectiveQueryContext(), returnGeneratedKeys);
	}

	protected void throwErrorIfPresent() {
		Throwable error = this.error;

		if (error == null)
			return;

		if (error instanceof RuntimeException runtimeException)
			throw runtimeException;

		if (error instanceof Error e)
			throw e;

		throw new DatabaseException(error);
	}

	@NonNull
	private QueryBuilder addJoin(JoinClause.@NonNull JoinType joinType,
															 @NonNull String table,
															 @NonNull String first,
															 @NonNull String operator,
															 @NonNull String second) {
		requireNonNull(joinType);
		requireNonNull(table);
		requireNonNull(first);
		requireNonNull(operator);
		requireNonNull(second);

		this.joins.add(new JoinClause(joinType, table, first, operator, second));
		return this;
	}

	/**
	 * Temporarily swaps the projection for {@code FUNCTION(column) AS "aggregate"} and runs {@link #first()}.
	 * Ordering and offset are dropped for the aggregate statement, so the result covers every row the filters match.
	 * Projection, ordering, limit and offset are restored afterwards, even on failure.
	 */
	@Nullable
	private Object aggregate(@NonNull String function,
													 @NonNull String column) {
		requireNonNull(function);
		requireNonNull(column);

		List<String> originalColumns = this.columns;
		boolean originalDefaultColumns = this.defaultColumns;
		List<Object> originalSelectBindings = this.selectBindings;
		List<OrderClause> originalOrders = new ArrayList<>(this.orders);
		Integer originalLimit = this.limit;
		Integer originalOffset = this.offset;

		this.columns = new ArrayList<>(List.of(format("%s(%s) AS \"aggregate\"", function, getGrammar().wrapColumn(column))));
		this.defaultColumns = false;
		this.selectBindings = new ArrayList<>();
		this.orders.clear();
		this.offset = null;

		try {
			Map<String, Object> row = first().orElse(null);
			return row == null ? null : firstValue(row);
		} finally {
			this.columns = originalColumns;
			this.defaultColumns = originalDefaultColumns;
			this.selectBindings = originalSelectBindings;
			this.orders.clear();
			this.orders.addAll(originalOrders);
			this.limit = originalLimit;
			this.offset = originalOffset;
		}
	}

	private double aggregateAsDouble(@NonNull String function,
																	 @NonNull String column) {
		Object value = aggregate(function, column);

		if (value == null)
			return 0;

		if (value instanceof Number number)
			return number.doubleValue();

		throw new DatabaseException(format("Unexpected type for %s: %s", function.toLowerCase(Locale.ENGLISH), value.getClass().getName()));
	}

	private long adjust(@NonNull String column,
											@NonNull String operator,
											int amount,
											@NonNull Map<String, ?> extraValues) {
		requireNonNull(column);
		requireNonNull(operator);
		requireNonNull(extraValues);

		Map<String, Object> values = new HashMap<>(extraValues);
		values.put(column, RawExpression.of(format("%s %s %d", getGrammar().wrapColumn(column), operator, amount)));

		return update(values);
	}

	@Nullable
	private static Object firstValue(@NonNull Map<String, @Nullable Object> row) {
		requireNonNull(row);
		return row.isEmpty() ? null : row.values().iterator().next();
	}

	@NonNull
	private static List<@Nullable Object> bindingsAsList(@Nullable Object[] bindings) {
		// A lone null vararg arrives as a null array
		if (bindings == null)
			return Collections.singletonList(null);

		return Arrays.asList(bindings);
	}

	@NonNull
	private QueryContext getEffectiveQueryContext() {
		return this.queryContext == null ? QueryContext.background() : this.queryContext;
	}

	@NonNull
	public String getTable() {
		return this.table;
	}

	@NonNull
	public List<String> getColumns() {
		return Collections.unmodifiableList(this.columns);
	}

	/**
	 * Bindings for {@link #selectRaw(String, Object...)} expressions, in the order they were added.
	 *
	 * @return the projection's bindings
	 */
	@NonNull
	public List<@Nullable Object> getSelectBindings() {
		return Collections.unmodifiableList(this.selectBindings);
	}

	public boolean isDistinct() {
		return this.distinct;
	}

	@NonNull
	public List<JoinClause> getJoins() {
		return Collections.unmodifiableList(this.joins);
	}

	@NonNull
	public List<WhereClause> getWheres() {
		return Collections.unmodifiableList(this.wheres);
	}

	@NonNull
	public List<String> getGroups() {
		return Collections.unmodifiableList(this.groups);
	}

	@NonNull
	public List<HavingClause> getHavings() {
		return Collections.unmodifiableList(this.havings);
	}

	@NonNull
	public List<OrderClause> getOrders() {
		return Collections.unmodifiableList(this.orders);
	}

	@NonNull
	public Optional<Integer> getLimit() {
		return Optional.ofNullable(this.limit);
	}

	@NonNull
	public Optional<Integer> getOffset() {
		return Optional.ofNullable(this.offset);
	}

	@NonNull
	public Optional<QueryContext> getQueryContext() {
		return Optional.ofNullable(this.queryContext);
	}

	@NonNull
	public Grammar getGrammar() {
		return this.grammar;
	}

	@NonNull
	public ExecutionHandle getExecutionHandle() {
		return this.executionHandle;
	}
}
