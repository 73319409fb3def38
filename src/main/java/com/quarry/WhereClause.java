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
 * A single predicate in a query's {@code WHERE} chain.
 * <p>
 * Predicates are immutable. Their order in {@link QueryBuilder#getWheres()} defines both the order in which they
 * are written into SQL and the order in which their bindings are produced.
 *
 * @since 1.0.0
 */
public interface WhereClause {
	@NonNull
	Connective connective();

	/**
	 * {@code column operator value}, e.g. {@code "age" > ?}. Consumes one binding unless {@code value} is a
	 * {@link RawExpression}.
	 */
	record Basic(@NonNull String column,
							 @NonNull String operator,
							 @Nullable Object value,
							 @NonNull Connective connective) implements WhereClause {
		public Basic {
			requireNonNull(column);
			requireNonNull(operator);
			requireNonNull(connective);
		}
	}

	/**
	 * {@code column IN (...)}. Consumes one binding per value; an empty list compiles to {@code IN ()}.
	 */
	record In(@NonNull String column,
						@NonNull List<@Nullable Object> values,
						@NonNull Connective connective) implements WhereClause {
		public In {
			requireNonNull(column);
			requireNonNull(values);
			requireNonNull(connective);

			values = Collections.unmodifiableList(new ArrayList<>(values));
		}
	}

	/**
	 * {@code column NOT IN (...)}.
	 */
	record NotIn(@NonNull String column,
							 @NonNull List<@Nullable Object> values,
							 @NonNull Connective connective) implements WhereClause {
		public NotIn {
			requireNonNull(column);
			requireNonNull(values);
			requireNonNull(connective);

			values = Collections.unmodifiableList(new ArrayList<>(values));
		}
	}

	record Null(@NonNull String column,
							@NonNull Connective connective) implements WhereClause {
		public Null {
			requireNonNull(column);
			requireNonNull(connective);
		}
	}

	record NotNull(@NonNull String column,
								 @NonNull Connective connective) implements WhereClause {
		public NotNull {
			requireNonNull(column);
			requireNonNull(connective);
		}
	}

	/**
	 * {@code column BETWEEN low AND high}. Consumes two bindings, low first.
	 */
	record Between(@NonNull String column,
								 @Nullable Object low,
								 @Nullable Object high,
								 @NonNull Connective connective) implements WhereClause {
		public Between {
			requireNonNull(column);
			requireNonNull(connective);
		}
	}

	/**
	 * Caller-supplied SQL. Each {@code ?} outside of quoted text is a binding marker.
	 */
	record Raw(@NonNull String sql,
						 @NonNull List<@Nullable Object> bindings,
						 @NonNull Connective connective) implements WhereClause {
		public Raw {
			requireNonNull(sql);
			requireNonNull(bindings);
			requireNonNull(connective);

			bindings = Collections.unmodifiableList(new ArrayList<>(bindings));
		}
	}
}
