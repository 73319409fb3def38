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

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Map;

/**
 * Contract for mapping the current {@link ResultSet} row to a column-keyed map.
 * <p>
 * A production-ready concrete implementation is available via {@link #withDefaultConfiguration()}.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ResultSetMapper {
	/**
	 * Maps the current row of {@code resultSet}.
	 * <p>
	 * Implementations must not advance the result set.
	 *
	 * @param statementContext current SQL context
	 * @param resultSet        provides raw row data to pull from
	 * @return the row's values keyed by column label, in column order
	 * @throws SQLException if an error occurs during mapping
	 */
	@NonNull
	Map<String, @Nullable Object> map(@NonNull StatementContext statementContext,
																		@NonNull ResultSet resultSet) throws SQLException;

	/**
	 * Acquires a concrete implementation of this interface with out-of-the-box defaults.
	 * <p>
	 * The returned instance is thread-safe.
	 *
	 * @return a concrete implementation of this interface with out-of-the-box defaults
	 */
	@NonNull
	static ResultSetMapper withDefaultConfiguration() {
		return new DefaultResultSetMapper();
	}
}
