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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import static java.util.Objects.requireNonNull;

/**
 * A single {@code ORDER BY} entry: either a column with a direction, or raw SQL.
 *
 * @since 1.0.0
 */
public record OrderClause(@Nullable String column,
													@Nullable String direction,
													@Nullable String rawSql,
													@NonNull List<@Nullable Object> rawBindings) {
	public OrderClause {
		requireNonNull(rawBindings);
		rawBindings = Collections.unmodifiableList(new ArrayList<>(rawBindings));
	}

	/**
	 * Orders by {@code column}. Any direction other than {@code asc}/{@code desc} (case-insensitive) becomes {@code ASC}.
	 *
	 * @param column    the column to order by
	 * @param direction the requested direction
	 * @return an order clause
	 */
	@NonNull
	public static OrderClause column(@NonNull String column,
																	 @NonNull String direction) {
		requireNonNull(column);
		requireNonNull(direction);

		String normalizedDirection = direction.toUpperCase(Locale.ENGLISH);

		if (!normalizedDirection.equals("ASC") && !normalizedDirection.equals("DESC"))
			normalizedDirection = "ASC";

		return new OrderClause(column, normalizedDirection, null, List.of());
	}

	@NonNull
	public static OrderClause raw(@NonNull String rawSql,
																@NonNull List<@Nullable Object> rawBindings) {
		requireNonNull(rawSql);
		requireNonNull(rawBindings);

		return new OrderClause(null, null, rawSql, rawBindings);
	}

	public boolean isRaw() {
		return this.rawSql != null;
	}
}
