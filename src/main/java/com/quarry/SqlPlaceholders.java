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
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Finds parameter markers in SQL text while skipping string literals, quoted identifiers, comments and
 * Postgres dollar-quoted bodies.
 * <p>
 * Two markers are recognized: the positional {@code ?} and the numbered {@code $N}. A doubled {@code ??} is not a
 * marker; it passes through unchanged, which the PostgreSQL JDBC driver reads as a literal {@code ?} operator.
 *
 * @since 1.0.0
 */
@ThreadSafe
final class SqlPlaceholders {
	private SqlPlaceholders() {}

	/**
	 * Replaces every {@code ?} marker with the next value from {@code replacementSupplier}, left to right.
	 *
	 * @param sql                 the SQL to scan
	 * @param replacementSupplier supplies the text for each marker, invoked once per marker
	 * @return the rewritten SQL
	 */
	@NonNull
	static String replaceQuestionMarks(@NonNull String sql,
																		 @NonNull Supplier<String> replacementSupplier) {
		requireNonNull(sql);
		requireNonNull(replacementSupplier);

		return scan(sql, (output, number, marker) -> {
			if (number == null)
				output.append(replacementSupplier.get());
			else
				output.append(marker);
		});
	}

	/**
	 * Rewrites numbered {@code $N} markers into JDBC {@code ?} markers, reordering bindings to match.
	 * <p>
	 * {@code $N} refers to the N-th binding (1-based), so a marker may appear more than once. SQL without numbered
	 * markers is returned unchanged.
	 *
	 * @param compiledQuery SQL and bindings as produced by a grammar
	 * @return SQL and bindings suitable for {@link java.sql.Connection#prepareStatement(String)}
	 * @throws IllegalArgumentException if a marker has no corresponding binding, or {@code ?} and {@code $N} are mixed
	 */
	@NonNull
	static CompiledQuery toJdbc(@NonNull CompiledQuery compiledQuery) {
		requireNonNull(compiledQuery);

		String sql = compiledQuery.getSql();

		if (sql.indexOf('$') == -1)
			return compiledQuery;

		List<Object> bindings = compiledQuery.getBindings();
		List<Object> jdbcBindings = new ArrayList<>(bindings.size());
		int[] questionMarkCount = new int[1];

		String jdbcSql = scan(sql, (output, number, marker) -> {
			if (number == null) {
				++questionMarkCount[0];
				output.append(marker);
				return;
			}

			if (number < 1 || number > bindings.size())
				throw new IllegalArgumentException(format("Placeholder %s has no binding (%d binding[s] supplied) in SQL: %s",
						marker, bindings.size(), sql));

			output.append('?');
			jdbcBindings.add(bindings.get(number - 1));
		});

		// Nothing numbered after all, e.g. the only '$' was inside a literal
		if (jdbcBindings.isEmpty())
			return compiledQuery;

		if (questionMarkCount[0] > 0)
			throw new IllegalArgumentException(format("SQL mixes '?' and '$N' placeholders: %s", sql));

		return CompiledQuery.of(jdbcSql, jdbcBindings);
	}

	@FunctionalInterface
	private interface MarkerVisitor {
		/**
		 * @param output the rewritten SQL so far; the visitor appends whatever should stand in for the marker
		 * @param number the {@code N} of a {@code $N} marker, or {@code null} for {@code ?}
		 * @param marker the marker text as it appeared in the input
		 */
		void visit(@NonNull StringBuilder output,
							 @Nullable Integer number,
							 @NonNull String marker);
	}

	@NonNull
	private static String scan(@NonNull String sql,
														 @NonNull MarkerVisitor markerVisitor) {
		requireNonNull(sql);
		requireNonNull(markerVisitor);

		StringBuilder output = new StringBuilder(sql.length() + 16);

		boolean inSingleQuote = false;
		boolean inSingleQuoteEscapesBackslash = false;
		boolean inDoubleQuote = false;
		boolean inBacktickQuote = false;
		boolean inLineComment = false;
		boolean inBlockComment = false;
		String dollarQuoteDelimiter = null;

		for (int i = 0; i < sql.length(); ) {
			if (dollarQuoteDelimiter != null) {
				if (sql.startsWith(dollarQuoteDelimiter, i)) {
					output.append(dollarQuoteDelimiter);
					i += dollarQuoteDelimiter.length();
					dollarQuoteDelimiter = null;
				} else {
					output.append(sql.charAt(i));
					++i;
				}

				continue;
			}

			char c = sql.charAt(i);

			if (inLineComment) {
				output.append(c);
				++i;

				if (c == '\n' || c == '\r')
					inLineComment = false;

				continue;
			}

			if (inBlockComment) {
				output.append(c);

				if (c == '*' && i + 1 < sql.length() && sql.charAt(i + 1) == '/') {
					output.append('/');
					i += 2;
					inBlockComment = false;
				} else {
					++i;
				}

				continue;
			}

			if (inSingleQuote) {
				output.append(c);

				if (inSingleQuoteEscapesBackslash && c == '\\' && i + 1 < sql.length()) {
					output.append(sql.charAt(i + 1));
					i += 2;
					continue;
				}

				if (c == '\'') {
					// Escaped quote: ''
					if (i + 1 < sql.length() && sql.charAt(i + 1) == '\'') {
						output.append('\'');
						i += 2;
						continue;
					}

					inSingleQuote = false;
					inSingleQuoteEscapesBackslash = false;
				}

				++i;
				continue;
			}

			if (inDoubleQuote) {
				output.append(c);

				if (c == '"') {
					// Escaped quote: ""
					if (i + 1 < sql.length() && sql.charAt(i + 1) == '"') {
						output.append('"');
						i += 2;
						continue;
					}

					inDoubleQuote = false;
				}

				++i;
				continue;
			}

			if (inBacktickQuote) {
				output.append(c);

				if (c == '`')
					inBacktickQuote = false;

				++i;
				continue;
			}

			// Not inside string/comment
			if (c == '-' && i + 1 < sql.length() && sql.charAt(i + 1) == '-') {
				output.append("--");
				i += 2;
				inLineComment = true;
				continue;
			}

			if (c == '/' && i + 1 < sql.length() && sql.charAt(i + 1) == '*') {
				output.append("/*");
				i += 2;
				inBlockComment = true;
				continue;
			}

			if ((c == 'E' || c == 'e') && i + 1 < sql.length() && sql.charAt(i + 1) == '\''
					&& (i == 0 || !Character.isJavaIdentifierPart(sql.charAt(i - 1)))) {
				inSingleQuote = true;
				inSingleQuoteEscapesBackslash = true;
				output.append(c).append('\'');
				i += 2;
				continue;
			}

			if (c == '\'') {
				inSingleQuote = true;
				inSingleQuoteEscapesBackslash = false;
				output.append(c);
				++i;
				continue;
			}

			if (c == '"') {
				inDoubleQuote = true;
				output.append(c);
				++i;
				continue;
			}

			if (c == '`') {
				inBacktickQuote = true;
				output.append(c);
				++i;
				continue;
			}

			if (c == '$') {
				int digitsEndIndex = i + 1;

				while (digitsEndIndex < sql.length() && Character.isDigit(sql.charAt(digitsEndIndex)))
					++digitsEndIndex;

				if (digitsEndIndex > i + 1) {
					String marker = sql.substring(i, digitsEndIndex);
					markerVisitor.visit(output, Integer.valueOf(marker.substring(1)), marker);
					i = digitsEndIndex;
					continue;
				}

				String delimiter = parseDollarQuoteDelimiter(sql, i);

				if (delimiter != null) {
					output.append(delimiter);
					i += delimiter.length();
					dollarQuoteDelimiter = delimiter;
					continue;
				}
			}

			// Escaped literal, e.g. the jsonb key-exists operator
			if (c == '?' && i + 1 < sql.length() && sql.charAt(i + 1) == '?') {
				output.append("??");
				i += 2;
				continue;
			}

			if (c == '?') {
				markerVisitor.visit(output, null, "?");
				++i;
				continue;
			}

			output.append(c);
			++i;
		}

		return output.toString();
	}

	/**
	 * Postgres dollar-quote tags are {@code $$} or {@code $tag$}, where the tag cannot start with a digit.
	 */
	@Nullable
	private static String parseDollarQuoteDelimiter(@NonNull String sql,
																									int startIndex) {
		requireNonNull(sql);

		if (startIndex < 0 || startIndex >= sql.length() || sql.charAt(startIndex) != '$')
			return null;

		int i = startIndex + 1;

		if (i < sql.length() && sql.charAt(i) == '$')
			return "$$";

		if (i >= sql.length() || !(Character.isLetter(sql.charAt(i)) || sql.charAt(i) == '_'))
			return null;

		while (i < sql.length()) {
			char c = sql.charAt(i);

			if (c == '$')
				return sql.substring(startIndex, i + 1);

			if (!(Character.isLetterOrDigit(c) || c == '_'))
				return null;

			++i;
		}

		return null;
	}
}
