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

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.util.Locale;

import static java.util.Objects.requireNonNull;

/**
 * Identifies different types of databases, which determines the {@link Grammar} used to compile queries.
 *
 * @since 1.0.0
 */
public enum DatabaseType {
	/**
	 * A database which requires no special handling.
	 */
	GENERIC,
	/**
	 * A PostgreSQL database.
	 */
	POSTGRESQL,
	/**
	 * A SQLite database.
	 */
	SQLITE;

	/**
	 * Determines the type of database to which the given {@code dataSource} connects.
	 * <p>
	 * Note: this will establish a {@link Connection} to the database.
	 *
	 * @param dataSource the database connection factory
	 * @return the type of database
	 * @throws DatabaseException if an exception occurs while attempting to read database metadata
	 */
	@NonNull
	public static DatabaseType fromDataSource(@NonNull DataSource dataSource) {
		requireNonNull(dataSource);

		try (Connection connection = dataSource.getConnection()) {
			DatabaseMetaData databaseMetaData = connection.getMetaData();
			String databaseProductName = databaseMetaData.getDatabaseProductName();
			String url = databaseMetaData.getURL();
			String driverName = databaseMetaData.getDriverName();

			// All of our checks are against databases with English names
			String databaseProductNameLowercase = databaseProductName == null ? "" : databaseProductName.toLowerCase(Locale.ENGLISH);
			String urlLowercase = url == null ? "" : url.toLowerCase(Locale.ENGLISH);
			String driverNameLowercase = driverName == null ? "" : driverName.toLowerCase(Locale.ENGLISH);

			// Strict match for PostgreSQL
			if (databaseProductNameLowercase.contains("postgresql") || databaseProductNameLowercase.equals("postgres"))  // some proxies shorten it
				return DatabaseType.POSTGRESQL;

			if (databaseProductNameLowercase.startsWith("sqlite"))
				return DatabaseType.SQLITE;

			// Fallbacks if product name is absent/weird but the driver or URL is clear
			if (urlLowercase.startsWith("jdbc:postgresql:") || driverNameLowercase.contains("postgresql"))
				return DatabaseType.POSTGRESQL;

			if (urlLowercase.startsWith("jdbc:sqlite:") || driverNameLowercase.contains("sqlite"))
				return DatabaseType.SQLITE;

			return DatabaseType.GENERIC;
		} catch (SQLException e) {
			throw new DatabaseException("Unable to connect to database to determine its type", e);
		}
	}

	/**
	 * Maps a short driver name to a database type: {@code pgsql}, {@code postgres} and {@code postgresql} are
	 * {@link #POSTGRESQL}; {@code sqlite} and {@code sqlite3} are {@link #SQLITE}; anything else, including
	 * {@code null}, is {@link #GENERIC}.
	 *
	 * @param driverName the driver name, matched case-insensitively
	 * @return the type of database
	 */
	@NonNull
	public static DatabaseType fromDriverName(@Nullable String driverName) {
		if (driverName == null)
			return DatabaseType.GENERIC;

		switch (driverName.trim().toLowerCase(Locale.ENGLISH)) {
			case "pgsql":
			case "postgres":
			case "postgresql":
				return DatabaseType.POSTGRESQL;
			case "sqlite":
			case "sqlite3":
				return DatabaseType.SQLITE;
			default:
				return DatabaseType.GENERIC;
		}
	}
}
