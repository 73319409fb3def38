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

import javax.annotation.concurrent.ThreadSafe;

import static java.util.Objects.requireNonNull;

/**
 * A literal SQL fragment that grammars emit as-is instead of binding it as a parameter.
 * <p>
 * Wherever a value is accepted (an {@code UPDATE} value map, a {@code WHERE} comparison value), passing a
 * {@code RawExpression} means "write this text into the statement". For example, {@link QueryBuilder#increment(String)}
 * compiles to {@code "votes" = "votes" + 1} rather than {@code "votes" = ?}.
 * <p>
 * Never construct a {@code RawExpression} from untrusted input.
 *
 * @since 1.0.0
 */
@ThreadSafe
public record RawExpression(@NonNull String sql) {
	public RawExpression {
		requireNonNull(sql);
	}

	/**
	 * Wraps the given SQL text.
	 *
	 * @param sql the literal SQL text
	 * @return a raw expression
	 */
	@NonNull
	public static RawExpression of(@NonNull String sql) {
		requireNonNull(sql);
		return new RawExpression(sql);
	}

	@Override
	@NonNull
	public String toString() {
		return this.sql;
	}
}
