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

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * The statement-running capability a {@link QueryBuilder} needs.
 * <p>
 * {@link Database} implements it by borrowing a pooled connection per call; {@link Transaction} implements it on
 * the transaction's connection. Implementations throw {@link DatabaseException} for any driver failure.
 *
 * @since 1.0.0
 */
public interface ExecutionHandle {
	/**
	 * Runs a row-returning statement.
	 *
	 * @param compiledQuery SQL and bindings, placeholders in the handle's dialect
	 * @param queryContext  timeout and related settings
	 * @return every row, each keyed by column label in column order
	 */
	@NonNull
	List<Map<String, @Nullable Object>> query(@NonNull CompiledQuery compiledQuery,
																						@NonNull QueryContext queryContext);

	/**
	 * Runs a row-returning statement and keeps only its first row.
	 *
	 * @param compiledQuery SQL and bindings
	 * @param queryContext  timeout and related settings
	 * @return the first row, or empty if there were none
	 */
	@NonNull
	default Optional<Map<String, @Nullable Object>> queryRow(@NonNull CompiledQuery compiledQuery,
																													 @NonNull QueryContext queryContext) {
		requireNonNull(compiledQuery);
		requireNonNull(queryContext);

		List<Map<String, Object>> rows = query(compiledQuery, queryContext);
		return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
	}

	/**
	 * Runs a data-modifying statement.
	 *
	 * @param compiledQuery       SQL and bindings
	 * @param queryContext        timeout and related settings
	 * @param returnGeneratedKeys whether the driver should report generated keys
	 * @return rows affected, plus the generated key if requested
	 */
	@NonNull
	ExecutionResult execute(@NonNull CompiledQuery compiledQuery,
													@NonNull QueryContext queryContext,
													boolean returnGeneratedKeys);

	@NonNull
	default ExecutionResult execute(@NonNull CompiledQuery compiledQuery,
																	@NonNull QueryContext queryContext) {
		return execute(compiledQuery, queryContext, false);
	}
}
