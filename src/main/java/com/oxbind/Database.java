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
import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.logging.Logger;

import static java.util.Objects.requireNonNull;

/**
 * Entry point: a {@link DataSource} plus the configuration shared by every {@link DatabaseConnection} opened from it.
 * <pre>
 * Database database = Database.withDataSource(dataSource).build();
 *
 * try (DatabaseConnection connection = database.connect()) {
 *   ObjectPersister&lt;Author, Long&gt; authors = connection.persister(AuthorMapping.INSTANCE);
 *   authors.persist(author);
 *   Optional&lt;Author&gt; found = authors.find(author.getId());
 * }
 * </pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class Database {
	@NonNull
	private final DataSource dataSource;
	@NonNull
	private final PreparedStatementBinder preparedStatementBinder;
	@NonNull
	private final StatementLogger statementLogger;
	@NonNull
	private final Logger logger;

	protected Database(@NonNull Builder builder) {
		requireNonNull(builder);

		this.dataSource = requireNonNull(builder.dataSource);
		this.preparedStatementBinder = builder.preparedStatementBinder == null ? PreparedStatementBinder.withDefaultConfiguration() : builder.preparedStatementBinder;
		this.statementLogger = builder.statementLogger == null ? (statementLog) -> {} : builder.statementLogger;
		this.logger = Logger.getLogger(getClass().getName());
	}

	/**
	 * Provides a {@link Database} builder for the given {@link DataSource}.
	 *
	 * @param dataSource data source used to create the {@link Database} builder
	 * @return a {@link Database} builder
	 */
	@NonNull
	public static Builder withDataSource(@NonNull DataSource dataSource) {
		requireNonNull(dataSource);
		return new Builder(dataSource);
	}

	/**
	 * Acquires a JDBC connection from the data source and wraps it.
	 * <p>
	 * The caller owns the returned connection and must close it.
	 *
	 * @return a new connection
	 */
	@NonNull
	public DatabaseConnection connect() {
		Connection jdbcConnection;

		try {
			jdbcConnection = getDataSource().getConnection();
		} catch (SQLException e) {
			throw new DatabaseException("Unable to acquire database connection", e);
		}

		getLogger().finer("Acquired database connection");

		return new DatabaseConnection(jdbcConnection, getPreparedStatementBinder(), getStatementLogger());
	}

	@NonNull
	public DataSource getDataSource() {
		return this.dataSource;
	}

	@NonNull
	public PreparedStatementBinder getPreparedStatementBinder() {
		return this.preparedStatementBinder;
	}

	@NonNull
	public StatementLogger getStatementLogger() {
		return this.statementLogger;
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}

	/**
	 * Builder used to construct instances of {@link Database}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final DataSource dataSource;
		@Nullable
		private PreparedStatementBinder preparedStatementBinder;
		@Nullable
		private StatementLogger statementLogger;

		private Builder(@NonNull DataSource dataSource) {
			this.dataSource = requireNonNull(dataSource);
		}

		@NonNull
		public Builder preparedStatementBinder(@Nullable PreparedStatementBinder preparedStatementBinder) {
			this.preparedStatementBinder = preparedStatementBinder;
			return this;
		}

		@NonNull
		public Builder statementLogger(@Nullable StatementLogger statementLogger) {
			this.statementLogger = statementLogger;
			return this;
		}

		@NonNull
		public Database build() {
			return new Database(this);
		}
	}
}
