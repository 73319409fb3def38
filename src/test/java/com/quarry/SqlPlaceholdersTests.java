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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * @since 1.0.0
 */
public class SqlPlaceholdersTests {
	@Test
	public void testQuestionMarksOutsideQuotedTextAreReplaced() {
		AtomicInteger counter = new AtomicInteger();

		String sql = SqlPlaceholders.replaceQuestionMarks(
				"SELECT '?', \"a?b\", `c?` FROM t WHERE x = ? -- trailing ?\nAND y = ? /* ? */ AND z = $$?$$",
				() -> "$" + counter.incrementAndGet());

		Assertions.assertEquals("SELECT '?', \"a?b\", `c?` FROM t WHERE x = $1 -- trailing ?\nAND y = $2 /* ? */ AND z = $$?$$", sql);
		Assertions.assertEquals(2, counter.get());
	}

	@Test
	public void testEscapedQuotesStayInsideLiterals() {
		String sql = SqlPlaceholders.replaceQuestionMarks("WHERE a = 'it''s ?' AND b = E'\\' ?' AND c = ?", () -> ":p");

		Assertions.assertEquals("WHERE a = 'it''s ?' AND b = E'\\' ?' AND c = :p", sql);
	}

	@Test
	public void testNumberedMarkersBecomeJdbcMarkers() {
		CompiledQuery jdbcQuery = SqlPlaceholders.toJdbc(
				CompiledQuery.of("SELECT * FROM \"users\" WHERE \"age\" > $1 AND \"status\" = $2", List.of(25, "active")));

		Assertions.assertEquals("SELECT * FROM \"users\" WHERE \"age\" > ? AND \"status\" = ?", jdbcQuery.getSql());
		Assertions.assertEquals(List.of(25, "active"), jdbcQuery.getBindings());
	}

	@Test
	public void testNumberedMarkersMayRepeatAndReorder() {
		CompiledQuery jdbcQuery = SqlPlaceholders.toJdbc(
				CompiledQuery.of("SELECT $2, $1, $2 WHERE note = '$1'", List.of("a", "b")));

		Assertions.assertEquals("SELECT ?, ?, ? WHERE note = '$1'", jdbcQuery.getSql());
		Assertions.assertEquals(List.of("b", "a", "b"), jdbcQuery.getBindings());
	}

	@Test
	public void testSqlWithoutNumberedMarkersIsUnchanged() {
		CompiledQuery compiledQuery = CompiledQuery.of("SELECT * FROM t WHERE a = ? AND b = '$5'", List.of(1));

		Assertions.assertSame(compiledQuery, SqlPlaceholders.toJdbc(compiledQuery));
	}

	@Test
	public void testDollarQuotedBodiesAreSkipped() {
		CompiledQuery jdbcQuery = SqlPlaceholders.toJdbc(
				CompiledQuery.of("SELECT $body$ $1 ? $body$, $1", List.of(9)));

		Assertions.assertEquals("SELECT $body$ $1 ? $body$, ?", jdbcQuery.getSql());
		Assertions.assertEquals(List.of(9), jdbcQuery.getBindings());
	}

	@Test
	public void testMissingBindingIsRejected() {
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> SqlPlaceholders.toJdbc(CompiledQuery.of("SELECT $1, $2", List.of(1))));
	}

	@Test
	public void testMixedMarkersAreRejected() {
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> SqlPlaceholders.toJdbc(CompiledQuery.of("SELECT $1, ?", List.of(1, 2))));
	}

	@Test
	public void testDoubledQuestionMarkIsNotAMarker() {
		AtomicInteger counter = new AtomicInteger();

		String sql = SqlPlaceholders.replaceQuestionMarks("WHERE tags ?? 'a' AND id = ? AND attrs ??| ?",
				() -> "$" + counter.incrementAndGet());

		Assertions.assertEquals("WHERE tags ?? 'a' AND id = $1 AND attrs ??| $2", sql);
		Assertions.assertEquals(2, counter.get());
	}
}
