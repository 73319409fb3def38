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

import static java.util.Objects.requireNonNull;

/**
 * A single {@code JOIN} in a query.
 * <p>
 * {@link JoinType#CROSS} joins have no {@code ON} condition, so their column and operator components are {@code null}.
 *
 * @since 1.0.0
 */
public record JoinClause(@NonNull JoinType type,
												 @NonNull String table,
												 @Nullable String first,
												 @Nullable String operator,
												 @Nullable String second) {
	public JoinClause {
		requireNonNull(type);
		requireNonNull(table);
	}

	@NonNull
	public static JoinClause cross(@NonNull String table) {
		requireNonNull(table);
		return new JoinClause(JoinType.CROSS, table, null, null, null);
	}

	public enum JoinType {
		INNER,
		LEFT,
		RIGHT,
		CROSS
	}
}
