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
import java.nio.charset.StandardCharsets;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Basic implementation of {@link ResultSetMapper}.
 * <p>
 * Binary values ({@code byte[]}) are decoded as UTF-8 strings and {@link Clob}s are read fully into strings, so every
 * returned row is detached from the {@link ResultSet}.
 *
 * @since 1.0.0
 */
@ThreadSafe
class DefaultResultSetMapper implements ResultSetMapper {
	@Override
	@NonNull
	public Map<String, @Nullable Object> map(@NonNull StatementContext statementContext,
																					 @NonNull ResultSet resultSet) throws SQLException {
		requireNonNull(statementContext);
		requireNonNull(resultSet);

		ResultSetMetaData resultSetMetaData = resultSet.getMetaData();
		int columnCount = resultSetMetaData.getColumnCount();
		Map<String, Object> row = new LinkedHashMap<>(Math.max(16, columnCount * 2));

		for (int i = 1; i <= columnCount; ++i)
			row.put(columnLabel(resultSetMetaData, i), normalizeValue(resultSet.getObject(i)));

		return row;
	}

	@NonNull
	protected String columnLabel(@NonNull ResultSetMetaData resultSetMetaData,
															 int columnIndex) throws SQLException {
		requireNonNull(resultSetMetaData);

		String columnLabel = resultSetMetaData.getColumnLabel(columnIndex);

		if (columnLabel == null || columnLabel.length() == 0)
			columnLabel = resultSetMetaData.getColumnName(columnIndex);

		return columnLabel;
	}

	@Nullable
	protected Object normalizeValue(@Nullable Object value) throws SQLException {
		if (value instanceof byte[] bytes)
			return new String(bytes, StandardCharsets.UTF_8);

		if (value instanceof Clob clob) {
			try {
				long length = clob.length();
				return length == 0 ? "" : clob.getSubString(1, (int) length);
			} finally {
				clob.free();
			}
		}

		return value;
	}
}
