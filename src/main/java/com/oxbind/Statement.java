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
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Duration;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.lang.System.nanoTime;
import static java.util.Objects.requireNonNull;

/**
 * A prepared statement owned by a single persistence context.
 * <p>
 * The JDBC statement is prepared once, at construction. Parameters come from a {@link Binding} and are only
 * re-applied to the JDBC statement when the binding's version differs from the version last applied.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public abstract class Statement implements AutoCloseable {
	@NonNull
	private final DatabaseConnection connection;
	@NonNull
	private final String sql;
	@NonNull
	private final Binding parameterBinding;
	@NonNull
	private final PreparedStatement preparedStatement;
	@NonNull
	private final Logger logger;

	private long appliedParameterVersion;
	private boolean closed;

	protected Statement(@NonNull DatabaseConnection connection,
											@NonNull String sql,
											@NonNull Binding parameterBinding) {
		requireNonNull(connection);
		requireNonNull(sql);
		requireNonNull(parameterBinding);

		this.connection = connection;
		this.sql = sql;
		this.parameterBinding = parameterBinding;
		this.logger = Logger.getLogger(getClass().getName());
		this.appliedParameterVersion = -1;
		this.closed = false;

		try {
			this.preparedStatement = connection.getJdbcConnection().prepareStatement(sql);
		} catch (SQLException e) {
			throw new DatabaseException(format("Unable to prepare statement: %s", sql), e);
		}
	}

	/**
	 * Applies the parameter binding to the JDBC statement if it changed since it was last applied.
	 *
	 * @return how long binding took, or {@code null} if the applied parameters were still current
	 * @throws SQLException if the driver rejects a parameter
	 */
	@Nullable
	protected Duration bindParameters() throws SQLException {
		ensureOpen();

		Binding binding = getParameterBinding();

		if (binding.getVersion() == this.appliedParameterVersion)
			return null;

		long startTime = nanoTime();
		PreparedStatementBinder preparedStatementBinder = getConnection().getPreparedStatementBinder();

		for (int i = 0; i < binding.size(); ++i)
			preparedStatementBinder.bindParameter(getPreparedStatement(), i + 1, binding.get(i));

		this.appliedParameterVersion = binding.getVersion();
		return Duration.ofNanos(nanoTime() - startTime);
	}

	/**
	 * Runs the JDBC update for this statement, logging the outcome.
	 *
	 * @return the number of affected rows
	 * @throws SQLException if execution fails
	 */
	protected long executeUpdate() throws SQLException {
		Duration preparationDuration = null;
		Duration executionDuration = null;
		Long rowCount = null;
		Exception exception = null;

		try {
			preparationDuration = bindParameters();

			long startTime = nanoTime();
			rowCount = (long) getPreparedStatement().executeUpdate();
			executionDuration = Duration.ofNanos(nanoTime() - startTime);

			return rowCount;
		} catch (SQLException | RuntimeException e) {
			exception = e;
			throw e;
		} finally {
			log(preparationDuration, executionDuration, rowCount, exception);
		}
	}

	protected void log(@Nullable Duration preparationDuration,
										 @Nullable Duration executionDuration,
										 @Nullable Long rowCount,
										 @Nullable Exception exception) {
		StatementLog statementLog = StatementLog.withSql(getSql())
				.parameters(getParameterBinding().getValues())
				.preparationDuration(preparationDuration)
				.executionDuration(executionDuration)
				.rowCount(rowCount)
				.exception(exception)
				.build();

		try {
			getConnection().getStatementLogger().log(statementLog);
		} catch (RuntimeException e) {
			if (exception == null)
				throw e;

			exception.addSuppressed(e);
		}
	}

	protected void ensureOpen() {
		if (this.closed)
			throw new IllegalStateException(format("Statement has been closed: %s", getSql()));
	}

	@Override
	public void close() {
		if (this.closed)
			return;

		this.closed = true;

		try {
			getPreparedStatement().close();
		} catch (SQLException e) {
			throw new DatabaseException(format("Unable to close statement: %s", getSql()), e);
		}
	}

	@NonNull
	public Boolean isClosed() {
		return this.closed;
	}

	@Override
	@NonNull
	public String toString() {
		// Strip out newlines for more compact SQL representation
		return format("%s{sql=%s}", getClass().getSimpleName(), getSql().replaceAll("\n+", " ").trim());
	}

	@NonNull
	public String getSql() {
		return this.sql;
	}

	@NonNull
	public Binding getParameterBinding() {
		return this.parameterBinding;
	}

	@NonNull
	protected DatabaseConnection getConnection() {
		return this.connection;
	}

	@NonNull
	protected PreparedStatement getPreparedStatement() {
		return this.preparedStatement;
	}

	@NonNull
	protected Logger getLogger() {
		return this.logger;
	}
}
