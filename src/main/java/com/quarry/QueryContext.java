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
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Per-statement execution settings carried from a {@link QueryBuilder} to its {@link ExecutionHandle}.
 * <p>
 * A timeout is applied via {@link java.sql.Statement#setQueryTimeout(int)}, so it is rounded up to whole seconds.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class QueryContext {
	@NonNull
	private static final QueryContext BACKGROUND;

	static {
		BACKGROUND = new QueryContext(null);
	}

	@Nullable
	private final Duration timeout;

	private QueryContext(@Nullable Duration timeout) {
		this.timeout = timeout;
	}

	/**
	 * A context with no timeout. Used when a builder was never given a context.
	 *
	 * @return the background context
	 */
	@NonNull
	public static QueryContext background() {
		return BACKGROUND;
	}

	/**
	 * A context whose statements are cancelled by the driver once {@code timeout} elapses.
	 *
	 * @param timeout how long a statement may run, must be positive
	 * @return a context with the given timeout
	 */
	@NonNull
	public static QueryContext withTimeout(@NonNull Duration timeout) {
		requireNonNull(timeout);

		if (timeout.isZero() || timeout.isNegative())
			throw new IllegalArgumentException(format("Timeout must be positive, but was %s", timeout));

		return new QueryContext(timeout);
	}

	@NonNull
	public Optional<Duration> getTimeout() {
		return Optional.ofNullable(this.timeout);
	}

	/**
	 * The timeout in the whole seconds JDBC expects, rounding up so a sub-second timeout is never disabled.
	 *
	 * @return the timeout in seconds, if one was set
	 */
	@NonNull
	public Optional<Integer> getTimeoutInSeconds() {
		if (this.timeout == null)
			return Optional.empty();

		long seconds = this.timeout.getSeconds() + (this.timeout.getNano() > 0 ? 1 : 0);
		return Optional.of((int) Math.min(seconds, Integer.MAX_VALUE));
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(this.timeout);
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof QueryContext queryContext))
			return false;

		return Objects.equals(queryContext.getTimeout(), getTimeout());
	}

	@Override
	@NonNull
	public String toString() {
		return this.timeout == null ? format("%s{background}", getClass().getSimpleName())
				: format("%s{timeout=%s}", getClass().getSimpleName(), this.timeout);
	}
}
