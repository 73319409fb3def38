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
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * Grammar for databases without special handling: double-quoted identifiers and {@code ?} placeholders.
 * <p>
 * Dialects customize behavior by overriding {@link #parameter(int)}, {@link #wrapTable(String)} and friends.
 *
 * @since 1.0.0
 */
@ThreadSafe
public class BaseGrammar implements Grammar {
	@NonNull
	private static final String DATE_FORMAT = "yyyy-MM-dd HH:mm:ss";

	@Override
	@NonNull
	public DatabaseType getDatabaseType() {
		return DatabaseType.GENERIC;
	}

	@Override
	@NonNull
	public String wrapTable(@NonNull String table) {
		requireNonNull(table);

		if (containsWhitespace(table) || isQuoted(table))
			return table;

		return wrapSegments(table);
	}

	@Override
	@NonNull
	public String wrapColumn(@NonNull String column) {
		requireNonNull(column);

		if (column.equals("*"))
			return column;

		if (column.contains(" AS ") || column.contains(" as ") || column.contains("("))
			return column;

		if (containsWhitespace(column) || isQuoted(column))
			return column;

		return wrapSegments(column);
	}

	@Override
	@NonNull
	public String parameter(int index) {
		return "?";
	}

	@Override
	@NonNull
	public String getDateFormat() {
		return DATE_FORMAT;
	}

	@Override
	@NonNull
	public CompiledQuery compileSelect(@NonNull QueryBuilder queryBuilder) {
		requireNonNull(queryBuilder);

		CompilationContext context = new CompilationContext(this);
		List<String> parts = new ArrayList<>(9);

		// Raw select expressions come first in the text, so their bindings do too
		String columns = queryBuilder.getColumns().stream()
				.map(column -> context.placeholders(wrapColumn(column)))
				.collect(joining(", "));

		context.bindAll(queryBuilder.getSelectBindings());
		parts.add((queryBuilder.isDistinct() ? "SELECT DISTINCT " : "SELECT ") + columns);

		parts.add("FROM " + wrapTable(queryBuilder.getTable()));

		for (JoinClause join : queryBuilder.getJoins())
			parts.add(compileJoin(join));

		String wheres = compileWheres(queryBuilder.getWheres(), context);

		if (wheres.length() > 0)
			parts.add("WHERE " + wheres);

		if (queryBuilder.getGroups().size() > 0)
			parts.add("GROUP BY " + queryBuilder.getGroups().stream().map(this::wrapColumn).collect(joining(", ")));

		String havings = compileHavings(queryBuilder.getHavings(), context);

		if (havings.length() > 0)
			parts.add("HAVING " + havings);

		if (queryBuilder.getOrders().size() > 0)
			parts.add("ORDER BY " + compileOrders(queryBuilder.getOrders(), context));

		Integer limit = queryBuilder.getLimit().orElse(null);

		if (limit != null)
			parts.add(format("LIMIT %d", limit));

		Integer offset = queryBuilder.getOffset().orElse(null);

		if (offset != null)
			parts.add(format("OFFSET %d", offset));

		return context.toCompiledQuery(String.join(" ", parts));
	}

	@Override
	@NonNull
	public CompiledQuery compileInsert(@NonNull QueryBuilder queryBuilder,
																		 @NonNull Map<String, ?> values) {
		requireNonNull(queryBuilder);
		requireNonNull(values);

		CompilationContext context = new CompilationContext(this);
		List<String> columns = new ArrayList<>(values.size());
		List<String> placeholders = new ArrayList<>(values.size());

		for (Map.Entry<String, ?> entry : sortedByKey(values).entrySet()) {
			columns.add(wrapColumn(entry.getKey()));
			placeholders.add(compileValue(entry.getValue(), context));
		}

		return context.toCompiledQuery(format("INSERT INTO %s (%s) VALUES (%s)", wrapTable(queryBuilder.getTable()),
				String.join(", ", columns), String.join(", ", placeholders)));
	}

	@Override
	@NonNull
	public CompiledQuery compileUpdate(@NonNull QueryBuilder queryBuilder,
																		 @NonNull Map<String, ?> values) {
		requireNonNull(queryBuilder);
		requireNonNull(values);

		CompilationContext context = new CompilationContext(this);
		List<String> assignments = new ArrayList<>(values.size());

		for (Map.Entry<String, ?> entry : sortedByKey(values).entrySet())
			assignments.add(format("%s = %s", wrapColumn(entry.getKey()), compileValue(entry.getValue(), context)));

		StringBuilder sql = new StringBuilder(format("UPDATE %s SET %s", wrapTable(queryBuilder.getTable()),
				String.join(", ", assignments)));

		// Same counter, so WHERE placeholders continue after the SET list
		String wheres = compileWheres(queryBuilder.getWheres(), context);

		if (wheres.length() > 0)
			sql.append(" WHERE ").append(wheres);

		return context.toCompiledQuery(sql.toString());
	}

	@Override
	@NonNull
	public CompiledQuery compileDelete(@NonNull QueryBuilder queryBuilder) {
		requireNonNull(queryBuilder);

		CompilationContext context = new CompilationContext(this);
		StringBuilder sql = new StringBuilder("DELETE FROM ").append(wrapTable(queryBuilder.getTable()));
		String wheres = compileWheres(queryBuilder.getWheres(), context);

		if (wheres.length() > 0)
			sql.append(" WHERE ").append(wheres);

		return context.toCompiledQuery(sql.toString());
	}

	@Override
	@NonNull
	public CompiledQuery compileExists(@NonNull QueryBuilder queryBuilder) {
		requireNonNull(queryBuilder);

		CompiledQuery select = compileSelect(queryBuilder);
		return select.withSql(format("SELECT EXISTS (%s) AS \"exists\"", select.getSql()));
	}

	@Override
	@NonNull
	public CompiledQuery compileTruncate(@NonNull String table) {
		requireNonNull(table);
		return CompiledQuery.of("TRUNCATE TABLE " + wrapTable(table));
	}

	@NonNull
	protected String compileJoin(@NonNull JoinClause join) {
		requireNonNull(join);

		if (join.type() == JoinClause.JoinType.CROSS)
			return "CROSS JOIN " + wrapTable(join.table());

		return format("%s JOIN %s ON %s %s %s", join.type().name(), wrapTable(join.table()),
				wrapColumn(requireNonNull(join.first())), requireNonNull(join.operator()), wrapColumn(requireNonNull(join.second())));
	}

	/**
	 * Compiles predicates in the order they were added. The first predicate has no leading connective; each later one
	 * is preceded by its own.
	 */
	@NonNull
	protected String compileWheres(@NonNull List<WhereClause> wheres,
																 @NonNull CompilationContext context) {
		requireNonNull(wheres);
		requireNonNull(context);

		StringBuilder sql = new StringBuilder();

		for (int i = 0; i < wheres.size(); ++i) {
			WhereClause where = wheres.get(i);

			if (i > 0)
				sql.append(' ').append(where.connective().name()).append(' ');

			sql.append(compileWhere(where, context));
		}

		return sql.toString();
	}

	@NonNull
	protected String compileWhere(@NonNull WhereClause where,
																@NonNull CompilationContext context) {
		requireNonNull(where);
		requireNonNull(context);

		if (where instanceof WhereClause.Basic basic)
			return format("%s %s %s", wrapColumn(basic.column()), basic.operator(), compileValue(basic.value(), context));

		if (where instanceof WhereClause.In in)
			return format("%s IN (%s)", wrapColumn(in.column()), compileValues(in.values(), context));

		if (where instanceof WhereClause.NotIn notIn)
			return format("%s NOT IN (%s)", wrapColumn(notIn.column()), compileValues(notIn.values(), context));

		if (where instanceof WhereClause.Null isNull)
			return format("%s IS NULL", wrapColumn(isNull.column()));

		if (where instanceof WhereClause.NotNull isNotNull)
			return format("%s IS NOT NULL", wrapColumn(isNotNull.column()));

		if (where instanceof WhereClause.Between between) {
			String low = context.bind(between.low());
			String high = context.bind(between.high());
			return format("%s BETWEEN %s AND %s", wrapColumn(between.column()), low, high);
		}

		if (where instanceof WhereClause.Raw raw) {
			String sql = context.placeholders(raw.sql());
			context.bindAll(raw.bindings());
			return sql;
		}

		throw new IllegalArgumentException(format("Unsupported %s type: %s", WhereClause.class.getSimpleName(),
				where.getClass().getName()));
	}

	@NonNull
	protected String compileHavings(@NonNull List<HavingClause> havings,
																	@NonNull CompilationContext context) {
		requireNonNull(havings);
		requireNonNull(context);

		StringBuilder sql = new StringBuilder();

		for (int i = 0; i < havings.size(); ++i) {
			HavingClause having = havings.get(i);

			if (i > 0)
				sql.append(' ').append(having.connective().name()).append(' ');

			if (having instanceof HavingClause.Basic basic) {
				sql.append(format("%s %s %s", wrapColumn(basic.column()), basic.operator(), compileValue(basic.value(), context)));
			} else if (having instanceof HavingClause.Raw raw) {
				sql.append(context.placeholders(raw.sql()));
				context.bindAll(raw.bindings());
			} else {
				throw new IllegalArgumentException(format("Unsupported %s type: %s", HavingClause.class.getSimpleName(),
						having.getClass().getName()));
			}
		}

		return sql.toString();
	}

	@NonNull
	protected String compileOrders(@NonNull List<OrderClause> orders,
																 @NonNull CompilationContext context) {
		requireNonNull(orders);
		requireNonNull(context);

		List<String> parts = new ArrayList<>(orders.size());

		for (OrderClause order : orders) {
			if (order.isRaw()) {
				parts.add(context.placeholders(requireNonNull(order.rawSql())));
				context.bindAll(order.rawBindings());
			} else {
				parts.add(format("%s %s", wrapColumn(requireNonNull(order.column())), order.direction()));
			}
		}

		return String.join(", ", parts);
	}

	/**
	 * A {@link RawExpression} is written as-is; anything else becomes a placeholder plus a binding.
	 */
	@NonNull
	protected String compileValue(@Nullable Object value,
																@NonNull CompilationContext context) {
		requireNonNull(context);

		if (value instanceof RawExpression rawExpression)
			return rawExpression.sql();

		return context.bind(value);
	}

	@NonNull
	protected String compileValues(@NonNull List<?> values,
																 @NonNull CompilationContext context) {
		requireNonNull(values);
		requireNonNull(context);

		List<String> placeholders = new ArrayList<>(values.size());

		for (Object value : values)
			placeholders.add(context.bind(value));

		return String.join(", ", placeholders);
	}

	@NonNull
	protected String quote(@NonNull String identifier) {
		requireNonNull(identifier);
		return "\"" + identifier.replace("\"", "\"\"") + "\"";
	}

	@NonNull
	private String wrapSegments(@NonNull String identifier) {
		requireNonNull(identifier);

		if (identifier.indexOf('.') == -1)
			return quote(identifier);

		String[] segments = identifier.split("\\.", -1);
		List<String> wrappedSegments = new ArrayList<>(segments.length);

		for (String segment : segments)
			wrappedSegments.add(segment.equals("*") ? segment : quote(segment));

		return String.join(".", wrappedSegments);
	}

	private static boolean containsWhitespace(@NonNull String string) {
		for (int i = 0; i < string.length(); ++i)
			if (Character.isWhitespace(string.charAt(i)))
				return true;

		return false;
	}

	private static boolean isQuoted(@NonNull String string) {
		return string.indexOf('"') != -1 || string.indexOf('`') != -1;
	}

	@NonNull
	private static Map<String, ?> sortedByKey(@NonNull Map<String, ?> values) {
		return new TreeMap<>(values);
	}

	/**
	 * Per-statement compilation state: the running placeholder index and the bindings collected so far.
	 * <p>
	 * A fresh instance is created for every {@code compile*} call and never escapes it.
	 */
	@NotThreadSafe
	protected static final class CompilationContext {
		@NonNull
		private final Grammar grammar;
		@NonNull
		private final List<@Nullable Object> bindings;
		private int parameterIndex;

		CompilationContext(@NonNull Grammar grammar) {
			requireNonNull(grammar);
			this.grammar = grammar;
			this.bindings = new ArrayList<>();
		}

		/**
		 * Records {@code value} as the next binding and returns its placeholder.
		 */
		@NonNull
		String bind(@Nullable Object value) {
			this.bindings.add(value);
			return nextPlaceholder();
		}

		/**
		 * Rewrites each {@code ?} marker in caller-supplied SQL to the next placeholder. Bindings are recorded separately
		 * via {@link #bindAll(List)}.
		 */
		@NonNull
		String placeholders(@NonNull String sql) {
			requireNonNull(sql);

			if (sql.indexOf('?') == -1)
				return sql;

			return SqlPlaceholders.replaceQuestionMarks(sql, this::nextPlaceholder);
		}

		void bindAll(@NonNull List<?> values) {
			requireNonNull(values);
			this.bindings.addAll(values);
		}

		@NonNull
		CompiledQuery toCompiledQuery(@NonNull String sql) {
			requireNonNull(sql);
			return CompiledQuery.of(sql, this.bindings);
		}

		@NonNull
		private String nextPlaceholder() {
			return this.grammar.parameter(this.parameterIndex++);
		}
	}
}
