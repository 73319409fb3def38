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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * SQL text plus the bindings for its placeholders, in placeholder order.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class CompiledQuery {
	@NonNull
	private final String sql;
	@NonNull
	private final List<@Nullable Object> bindings;

	private CompiledQuery(@NonNull String sql,
												@NonNull List<@Nullable Object> bindings) {
		requireNonNull(sql);
		requireNonNull(bindings);

		this.sql = sql;
		// List.copyOf() rejects nulls, and null is a perfectly good binding
		this.bindings = Collections.unmodifiableList(new ArrayList<>(bindings));
	}

	@NonNull
	public static CompiledQuery of(@NonNull String sql,
																 @NonNull List<@Nullable Object> bindings) {
		requireNonNull(sql);
		requireNonNull(bindings);

		return new CompiledQuery(sql, bindings);
	}

	@NonNull
	public static CompiledQuery of(@NonNull String sql) {
		requireNonNull(sql);
		return new CompiledQuery(sql, List.of());
	}

	/**
	 * Same bindings, different SQL text.
	 *
	 * @param sql the replacement SQL
	 * @return a new compiled query
	 */
	@NonNull
	public CompiledQuery withSql(@NonNull String sql) {
		requireNonNull(sql);
		return new CompiledQuery(sql, getBindings());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getSql(), getBindings());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof CompiledQuery))
			return false;

		CompiledQuery compiledQuery = (CompiledQuery) object;

		return Objects.equals(compiledQuery.getSql(), getSql())
				&& Objects.equals(compiledQuery.getBindings(), getBindings());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{sql=%s, bindings=%s}", getClass().getSimpleName(), getSql(), getBindings());
	}

	@NonNull
	public String getSql() {
		return this.sql;
	}

	@NonNull
	public List<@Nullable Object> getBindings() {
		return this.bindings;
	}
}
