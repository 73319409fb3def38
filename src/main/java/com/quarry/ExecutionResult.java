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
import java.util.Objects;

import static java.lang.String.format;

/**
 * Outcome of a data-modifying statement.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class ExecutionResult {
	private final long rowsAffected;
	@Nullable
	private final Long lastInsertId;

	private ExecutionResult(long rowsAffected,
													@Nullable Long lastInsertId) {
		this.rowsAffected = rowsAffected;
		this.lastInsertId = lastInsertId;
	}

	/**
	 * @param rowsAffected how many rows the statement changed
	 * @param lastInsertId the key generated by the statement, or {@code null} if none was requested or produced
	 * @return an execution result
	 */
	@NonNull
	public static ExecutionResult of(long rowsAffected,
																	 @Nullable Long lastInsertId) {
		return new ExecutionResult(rowsAffected, lastInsertId);
	}

	public long getRowsAffected() {
		return this.rowsAffected;
	}

	/**
	 * The key generated by the statement.
	 *
	 * @return the generated key
	 * @throws DatabaseException if keys were not requested, or the driver did not report one
	 */
	public long getLastInsertId() {
		if (this.lastInsertId == null)
			throw new DatabaseException("No generated key is available for this statement");

		return this.lastInsertId;
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.rowsAffected, this.lastInsertId);
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ExecutionResult executionResult))
			return false;

		return executionResult.rowsAffected == this.rowsAffected
				&& Objects.equals(executionResult.lastInsertId, this.lastInsertId);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{rowsAffected=%d, lastInsertId=%s}", getClass().getSimpleName(), this.rowsAffected, this.lastInsertId);
	}
}
