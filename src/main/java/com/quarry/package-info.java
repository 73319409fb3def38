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

/**
 * Quarry is a fluent SQL query builder for JDBC, with dialect-aware compilation for PostgreSQL, SQLite and
 * generic databases.
 *
 * <pre>
 * // Minimal setup, database type and grammar detected from the data source
 * DataSource dataSource = ...
 * Database database = Database.withDataSource(dataSource).build();
 *
 * // Queries
 * List&lt;Map&lt;String, Object&gt;&gt; adults = database.table("users").where("age", "&gt;=", 18).orderBy("name").get();
 * Optional&lt;Map&lt;String, Object&gt;&gt; user = database.table("users").find(123);
 * long active = database.table("users").where("status", "active").count();
 *
 * // Statements
 * long id = database.table("users").insertGetId(Map.of("name", "Ana", "status", "active"));
 * database.table("users").where("id", id).increment("logins");
 *
 * // Transactions
 * database.transaction(transaction -&gt; {
 *   transaction.table("account").where("id", 1).decrement("balance", 100);
 *   transaction.table("account").where("id", 2).increment("balance", 100);
 * });
 *
 * // Inspect without running
 * CompiledQuery compiledQuery = database.table("users").where("age", "&gt;", 25).limit(5).toSql();</pre>
 *
 * @since 1.0.0
 */
package com.quarry;
