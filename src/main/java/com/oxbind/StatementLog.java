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

package com.oxbind;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A collection of SQL statement execution diagnostics.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class StatementLog {
	@NonNull
	private final String sql;
	@NonNull
	private final List<Object> parameters;
	@NonNull
	private final Duration totalDuration;
	@Nullable
	private final Duration preparationDuration;
	@Nullable
	private final Duration executionDuration;
	@Nullable
	private final Long rowCount;
	@Nullable
	private final Exception exception;

	/**
	 * Creates a {@code StatementLog} for the given {@code builder}.
	 *
	 * @param builder the builder used to construct this {@code StatementLog}
	 */
	private StatementLog(@NonNull Builder builder) {
		requireNonNull(builder);

		this.sql = requireNonNull(builder.sql);
		this.parameters = builder.parameters == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(builder.parameters));
		this.preparationDuration = builder.preparationDuration;
		this.executionDuration = builder.executionDuration;
		this.rowCount = builder.rowCount;
		this.exception = builder.exception;

		Duration totalDuration = Duration.ZERO;

		if (this.preparationDuration != null)
			totalDuration = totalDuration.plus(this.preparationDuration);

		if (this.executionDuration != null)
			totalDuration = totalDuration.plus(this.executionDuration);

		this.totalDuration = totalDuration;
	}

	/**
	 * Creates a {@link StatementLog} builder for the given {@code sql}.
	 *
	 * @param sql the SQL that was executed
	 * @return a {@link StatementLog} builder
	 */
	@NonNull
	public static Builder withSql(@NonNull String sql) {
		requireNonNull(sql);
		return new Builder(sql);
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(7);

		components.add(format("sql=%s", getSql().replaceAll("\n+", " ").trim()));

		if (getParameters().size() > 0)
			components.add(format("parameters=%s", getParameters()));

		components.add(format("totalDuration=%s", getTotalDuration()));

		Duration preparationDuration = getPreparationDuration().orElse(null);

		if (preparationDuration != null)
			components.add(format("preparationDuration=%s", preparationDuration));

		Duration executionDuration = getExecutionDuration().orElse(null);

		if (executionDuration != null)
			components.add(format("executionDuration=%s", executionDuration));

		Long rowCount = getRowCount().orElse(null);

		if (rowCount != null)
			components.add(format("rowCount=%s", rowCount));

		Exception exception = getException().orElse(null);

		if (exception != null)
			components.add(format("exception=%s", exception));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(Collectors.joining(", ")));
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof StatementLog))
			return false;

		StatementLog statementLog = (StatementLog) object;

		return Objects.equals(getSql(), statementLog.getSql())
				&& Objects.equals(getParameters(), statementLog.getParameters())
				&& Objects.equals(getPreparationDuration(), statementLog.getPreparationDuration())
				&& Objects.equals(getExecutionDuration(), statementLog.getExecutionDuration())
				&& Objects.equals(getRowCount(), statementLog.getRowCount())
				&& Objects.equals(getException(), statementLog.getException());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getSql(), getParameters(), getPreparationDuration(), getExecutionDuration(), getRowCount(),
				getException());
	}

	/**
	 * The SQL statement that was executed.
	 *
	 * @return the SQL statement that was executed
	 */
	@NonNull
	public String getSql() {
		return this.sql;
	}

	/**
	 * The parameter values bound when the statement was executed.
	 *
	 * @return the bound parameter values
	 */
	@NonNull
	public List<Object> getParameters() {
		return this.parameters;
	}

	/**
	 * How long did it take to bind data to the {@link java.sql.PreparedStatement}?
	 * <p>
	 * Empty if the bound parameters were still current and no binding was needed.
	 *
	 * @return how long it took to bind data to the {@link java.sql.PreparedStatement}, if available
	 */
	@NonNull
	public Optional<Duration> getPreparationDuration() {
		return Optional.ofNullable(this.preparationDuration);
	}

	/**
	 * How long did it take to execute the SQL statement?
	 *
	 * @return how long it took to execute the SQL statement, if available
	 */
	@NonNull
	public Optional<Duration> getExecutionDuration() {
		return Optional.ofNullable(this.executionDuration);
	}

	/**
	 * How long did it take to perform the database operation in total?
	 *
	 * @return how long the database operation took in total
	 */
	@NonNull
	public Duration getTotalDuration() {
		return this.totalDuration;
	}

	/**
	 * How many rows the statement affected, for statements that report it.
	 *
	 * @return the affected row count, if available
	 */
	@NonNull
	public Optional<Long> getRowCount() {
		return Optional.ofNullable(this.rowCount);
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
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final String sql;
		@Nullable
		private List<Object> parameters;
		@Nullable
		private Duration preparationDuration;
		@Nullable
		private Duration executionDuration;
		@Nullable
		private Long rowCount;
		@Nullable
		private Exception exception;

		private Builder(@NonNull String sql) {
			requireNonNull(sql);
			this.sql = sql;
		}

		@NonNull
		public Builder parameters(@Nullable List<Object> parameters) {
			this.parameters = parameters;
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
		public Builder rowCount(@Nullable Long rowCount) {
			this.rowCount = rowCount;
			return this;
		}

		@NonNull
		public Builder exception(@Nullable Exception exception) {
			this.exception = exception;
			return this;
		}

		/**
		 * Constructs a {@code StatementLog} instance.
		 *
		 * @return a {@code StatementLog} instance
		 */
		@NonNull
		public StatementLog build() {
			return new StatementLog(this);
		}
	}
}
