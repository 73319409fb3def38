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

import static java.util.Objects.requireNonNull;

/**
 * A post-aggregation filter in a query's {@code HAVING} chain.
 *
 * @since 1.0.0
 */
public interface HavingClause {
	@NonNull
	Connective connective();

	record Basic(@NonNull String column,
							 @NonNull String operator,
							 @Nullable Object value,
							 @NonNull Connective connective) implements HavingClause {
		public Basic {
			requireNonNull(column);
			requireNonNull(operator);
			requireNonNull(connective);
		}
	}

	record Raw(@NonNull String sql,
						 @NonNull List<@Nullable Object> bindings,
						 @NonNull Connective connective) implements HavingClause {
		public Raw {
			requireNonNull(sql);
			requireNonNull(bindings);
			requireNonNull(connective);

			bindings = Collections.unmodifiableList(new ArrayList<>(bindings));
		}
	}
}
