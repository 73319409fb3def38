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

/**
 * PostgreSQL grammar: numbered {@code $1, $2, ...} placeholders.
 * <p>
 * Numbering is 1-based and runs across the whole statement, including raw fragments and the {@code WHERE} of an
 * {@code UPDATE}.
 *
 * @since 1.0.0
 */
@ThreadSafe
public class PostgresGrammar extends BaseGrammar {
	@Override
	@NonNull
	public DatabaseType getDatabaseType() {
		return DatabaseType.POSTGRESQL;
	}

	@Override
	@NonNull
	public String parameter(int index) {
		return "$" + (index + 1);
	}
}
