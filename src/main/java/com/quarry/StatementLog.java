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

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A collection of SQL statement execution diagnostics.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class StatementLog {
	@NonNull
	private final StatementContext statementContext;
	@NonNull
	private final Duration totalDuration;
	@Nullable
	private final Duration connectionAcquisitionDuration;
	@Nullable
	private final Duration preparationDuration;
	@Nullable
	private final Duration executionDuration;
	@Nullable
	private final Duration resultSetMappingDuration;
	@Nullable
	private final Exception exception;

	private StatementLog(@NonNull Builder builder) {
		requireNonNull(builder);

		this.statementContext = requireNonNull(builder.statementContext);
		this.connectionAcquisitionDuration = builder.connectionAcquisitionDuration;
		this.preparationDuration = builder.preparationDuration;
		this.executionDuration = builder.executionDuration;
		this.resultSetMappingDuration = builder.resultSetMappingDuration;
		this.exception = builder.exception;

		Duration totalDuration = Duration.ZERO;

		if (this.connectionAcquisitionDuration != null)
			totalDuration = totalDuration.plus(this.connectionAcquisitionDuration);

		if (this.preparationDuration != null)
			totalDuration = totalDuration.plus(this.preparationDuration);

		if (this.executionDuration != null)
			totalDuration = totalDuration.plus(this.executionDuration);

		if (this.resultSetMappingDuration != null)
			totalDuration = totalDuration.plus(this.resultSetMappingDuration);

		this.totalDuration = totalDuration;
	}

	/**
	 * Creates a {@link StatementLog} builder for the given {@code statementContext}.
	 *
	 * @param statementContext current SQL context
	 * @return a {@link StatementLog} builder
	 */
	@NonNull
	public static Builder withStatementContext(@NonNull StatementContext statementContext) {
		requireNonNull(statementContext);
		return new Builder(statementContext);
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(7);

		components.add(format("statementContext=%s", getStatementContext()));
		components.add(format("totalDuration=%s", getTotalDuration()));

		getConnectionAcquisitionDuration().ifPresent(duration -> components.add(format("connectionAcquisitionDuration=%s", duration)));
		getPreparationDuration().ifPresent(duration -> components.add(format("preparationDuration=%s", duration)));
		getExecutionDuration().ifPresent(duration -> components.add(format("executionDuration=%s", duration)));
		getResultSetMappingDuration().ifPresent(duration -> components.add(format("resultSetMappingDuration=%s", duration)));
		getException().ifPresent(exception -> components.add(format("exception=%s", exception)));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(Collectors.joining(", ")));
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof StatementLog statementLog))
			return false;

		return Objects.equals(getStatementContext(), statementLog.getStatementContext())
				&& Objects.equals(getConnectionAcquisitionDuration(), statementLog.getConnectionAcquisitionDuration())
				&& Objects.equals(getPreparationDuration(), statementLog.getPreparationDuration())
				&& Objects.equals(getExecutionDuration(), statementLog.getExecutionDuration())
				&& Objects.equals(getResultSetMappingDuration(), statementLog.getResultSetMappingDuration())
				&& Objects.equals(getException(), statementLog.getException());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getStatementContext(), getConnectionAcquisitionDuration(), getPreparationDuration(),
				getExecutionDuration(), getResultSetMappingDuration(), getException());
	}

	/**
	 * How long did it take to acquire a {@link java.sql.Connection} from the {@link javax.sql.DataSource}?
	 * <p>
	 * Empty when the statement ran on a transaction's already-open connection.
	 *
	 * @return how long it took to acquire a {@link java.sql.Connection}, if available
	 */
	@NonNull
	public Optional<Duration> getConnectionAcquisitionDuration() {
		return Optional.ofNullable(this.connectionAcquisitionDuration);
	}

	/**
	 * How long did it take to prepare the statement and bind its parameters?
	 *
	 * @return how long it took to prepare the {@link java.sql.PreparedStatement}, if available
	 */
	@NonNull
	public Optional<Duration> getPreparationDuration() {
		return Optional.ofNullable(this.preparationDuration);
	}

	@NonNull
	public Optional<Duration> getExecutionDuration() {
		return Optional.ofNullable(this.executionDuration);
	}

	@NonNull
	public Optional<Duration> getResultSetMappingDuration() {
		return Optional.ofNullable(this.resultSetMappingDuration);
	}

	/**
	 * How long did it take to perform the database operation in total?
	 * <p>
	 * This is the sum of {@link #getConnectionAcquisitionDuration()} + {@link #getPreparationDuration()} +
	 * {@link #getExecutionDuration()} + {@link #getResultSetMappingDuration()}.
	 *
	 * @return how long the database operation took in total
	 */
	@NonNull
	public Duration getTotalDuration() {
		return this.totalDuration;
	}

	@NonNull
	public StatementContext getStatementContext() {
		return this.statementContext;
	}

	/**
	 * The exception that occurred during SQL statement execution.
	 *
	 * @return the exception that occurred during SQL statement execution, if available
	 */
	@NonNull
	public Optional<Exception> getException() {
		return Optional.ofNullable(this.exception);
	}

	/**
	 * Builder used to construct instances of {@link StatementLog}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final StatementContext statementContext;
		@Nullable
		private Duration connectionAcquisitionDuration;
		@Nullable
		private Duration preparationDuration;
		@Nullable
		private Duration executionDuration;
		@Nullable
		private Duration resultSetMappingDuration;
		@Nullable
		private Exception exception;

		private Builder(@NonNull StatementContext statementContext) {
			requireNonNull(statementContext);
			this.statementContext = statementContext;
		}

		@NonNull
		public Builder connectionAcquisitionDuration(@Nullable Duration connectionAcquisitionDuration) {
			this.connectionAcquisitionDuration = connectionAcquisitionDuration;
			return this;
		}

		@NonNull
		public Builder preparationDuration(@Nullable Duration preparationDuration) {
			this.preparationDuration = preparationDuration;
			return this;
		}

		@NonNull
		public Builder executionDuration(@Nullable Duration executionDuration) {
			this.executionDuration = executionDuration;
			return this;
		}

		@NonNull
		public Builder resultSetMappingDuration(@Nullable Duration resultSetMappingDuration) {
			this.resultSetMappingDuration = resultSetMappingDuration;
			return this;
		}

		@NonNull
		public Builder exception(@Nullable Exception exception) {
			this.exception = exception;
			return this;
		}

		@NonNull
		public StatementLog build() {
			return new StatementLog(this);
		}
	}
}
