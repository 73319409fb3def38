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
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Data that represents a SQL statement about to be run: the query as compiled by a {@link Grammar} and the form
 * actually handed to JDBC.
 * <p>
 * The two differ only for dialects with numbered placeholders, whose {@code $N} markers are rewritten to {@code ?}.
 *
 * @since 1.0.0
 */
@ThreadSafe
public class StatementContext {
	@NonNull
	private final CompiledQuery compiledQuery;
	@NonNull
	private final CompiledQuery jdbcQuery;
	@NonNull
	private final QueryContext queryContext;
	@NonNull
	private final DatabaseType databaseType;
	@NonNull
	private final ZoneId timeZone;

	protected StatementContext(@NonNull Builder builder) {
		requireNonNull(builder);

		this.compiledQuery = builder.compiledQuery;
		this.jdbcQuery = builder.jdbcQuery == null ? builder.compiledQuery : builder.jdbcQuery;
		this.queryContext = builder.queryContext == null ? QueryContext.background() : builder.queryContext;
		this.databaseType = builder.databaseType;
		this.timeZone = builder.timeZone;
	}

	@Override
	public int hashCode() {
		return Objects.hash(getCompiledQuery(), getJdbcQuery(), getQueryContext(), getDatabaseType(), getTimeZone());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof StatementContext statementContext))
			return false;

		return Objects.equals(statementContext.getCompiledQuery(), getCompiledQuery())
				&& Objects.equals(statementContext.getJdbcQuery(), getJdbcQuery())
				&& Objects.equals(statementContext.getQueryContext(), getQueryContext())
				&& Objects.equals(statementContext.getDatabaseType(), getDatabaseType())
				&& Objects.equals(statementContext.getTimeZone(), getTimeZone());
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(5);

		components.add(format("sql=%s", getCompiledQuery().getSql()));

		if (getCompiledQuery().getBindings().size() > 0)
			components.add(format("bindings=%s", getCompiledQuery().getBindings()));

		if (getQueryContext().getTimeout().isPresent())
			components.add(format("timeout=%s", getQueryContext().getTimeout().get()));

		components.add(format("databaseType=%s", getDatabaseType().name()));
		components.add(format("timeZone=%s", getTimeZone().getId()));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(Collectors.joining(", ")));
	}

	/**
	 * The query as produced by a {@link Grammar}, e.g. with {@code $N} placeholders for PostgreSQL.
	 */
	@NonNull
	public CompiledQuery getCompiledQuery() {
		return this.compiledQuery;
	}

	/**
	 * The query as prepared via JDBC, with {@code ?} placeholders.
	 */
	@NonNull
	public CompiledQuery getJdbcQuery() {
		return this.jdbcQuery;
	}

	@NonNull
	public String getSql() {
		return getJdbcQuery().getSql();
	}

	@NonNull
	public List<@Nullable Object> getParameters() {
		return getJdbcQuery().getBindings();
	}

	@NonNull
	public QueryContext getQueryContext() {
		return this.queryContext;
	}

	@NonNull
	public DatabaseType getDatabaseType() {
		return this.databaseType;
	}

	@NonNull
	public ZoneId getTimeZone() {
		return this.timeZone;
	}

	@NonNull
	public static Builder with(@NonNull CompiledQuery compiledQuery,
														 @NonNull Database database) {
		requireNonNull(compiledQuery);
		requireNonNull(database);

		return new Builder(compiledQuery, database);
	}

	/**
	 * Builder used to construct instances of {@link StatementContext}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final CompiledQuery compiledQuery;
		@NonNull
		private final DatabaseType databaseType;
		@NonNull
		private final ZoneId timeZone;
		@Nullable
		private CompiledQuery jdbcQuery;
		@Nullable
		private QueryContext queryContext;

		private Builder(@NonNull CompiledQuery compiledQuery,
										@NonNull Database database) {
			requireNonNull(compiledQuery);
			requireNonNull(database);

			this.compiledQuery = compiledQuery;
			this.databaseType = database.getDatabaseType();
			this.timeZone = database.getTimeZone();
		}

		@NonNull
		public Builder jdbcQuery(@Nullable CompiledQuery jdbcQuery) {
			this.jdbcQuery = jdbcQuery;
			return this;
		}

		@NonNull
		public Builder queryContext(@Nullable QueryContext queryContext) {
			this.queryContext = queryContext;
			return this;
		}

		@NonNull
		public StatementContext build() {
			return new StatementContext(this);
		}
	}
}
