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

import javax.annotation.concurrent.NotThreadSafe;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.WARNING;

/**
 * One JDBC connection together with the persistence contexts created on it.
 * <p>
 * Each mapping gets exactly one {@link ObjectStatements} (and one {@link ObjectPersister}) per connection, created on
 * first access. Types with a managed version column get the optimistic variants; which overload of
 * {@link #objectStatements(ObjectMapping)} or {@link #persister(ObjectMapping)} applies is decided by the mapping's
 * static type, and the plain overloads hand optimistic mappings to the optimistic ones.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public class DatabaseConnection implements AutoCloseable {
	@NonNull
	private final Connection jdbcConnection;
	@NonNull
	private final PreparedStatementBinder preparedStatementBinder;
	@NonNull
	private final StatementLogger statementLogger;
	@NonNull
	private final Map<ObjectMapping<?, ?>, ObjectStatements<?, ?>> objectStatementsByMapping;
	@NonNull
	private final Map<ObjectMapping<?, ?>, ObjectPersister<?, ?>> persistersByMapping;
	@NonNull
	private final Logger logger;

	private boolean closed;

	DatabaseConnection(@NonNull Connection jdbcConnection,
										 @NonNull PreparedStatementBinder preparedStatementBinder,
										 @NonNull StatementLogger statementLogger) {
		requireNonNull(jdbcConnection);
		requireNonNull(preparedStatementBinder);
		requireNonNull(statementLogger);

		this.jdbcConnection = jdbcConnection;
		this.preparedStatementBinder = preparedStatementBinder;
		this.statementLogger = statementLogger;
		this.objectStatementsByMapping = new LinkedHashMap<>();
		this.persistersByMapping = new LinkedHashMap<>();
		this.logger = Logger.getLogger(getClass().getName());
		this.closed = false;
	}

	/**
	 * Gets the persistence context for {@code objectMapping}, creating it on first access.
	 *
	 * @param objectMapping the mapping
	 * @param <T>           the mapped object type
	 * @param <I>           the object id type
	 * @return this connection's context for the mapping
	 */
	@NonNull
	@SuppressWarnings("unchecked")
	public <T, I> ObjectStatements<T, I> objectStatements(@NonNull ObjectMapping<T, I> objectMapping) {
		requireNonNull(objectMapping);

		if (objectMapping instanceof OptimisticObjectMapping)
			return objectStatements((OptimisticObjectMapping<T, I>) objectMapping);

		ensureOpen();

		ObjectStatements<T, I> objectStatements = (ObjectStatements<T, I>) getObjectStatementsByMapping().get(objectMapping);

		if (objectStatements == null) {
			getLogger().finer(format("Creating statements for %s", objectMapping.getObjectType().getSimpleName()));
			objectStatements = new ObjectStatements<>(this, objectMapping);
			getObjectStatementsByMapping().put(objectMapping, objectStatements);
		}

		return objectStatements;
	}

	/**
	 * Gets the persistence context for the versioned type {@code objectMapping}, creating it on first access.
	 *
	 * @param objectMapping the mapping
	 * @param <T>           the mapped object type
	 * @param <I>           the object id type
	 * @return this connection's context for the mapping
	 */
	@NonNull
	@SuppressWarnings("unchecked")
	public <T, I> OptimisticObjectStatements<T, I> objectStatements(@NonNull OptimisticObjectMapping<T, I> objectMapping) {
		requireNonNull(objectMapping);
		ensureOpen();

		OptimisticObjectStatements<T, I> objectStatements = (OptimisticObjectStatements<T, I>) getObjectStatementsByMapping().get(objectMapping);

		if (objectStatements == null) {
			getLogger().finer(format("Creating optimistic statements for %s", objectMapping.getObjectType().getSimpleName()));
			objectStatements = new OptimisticObjectStatements<>(this, objectMapping);
			getObjectStatementsByMapping().put(objectMapping, objectStatements);
		}

		return objectStatements;
	}

	/**
	 * Gets the persister for {@code objectMapping}, creating it on first access.
	 *
	 * @param objectMapping the mapping
	 * @param <T>           the mapped object type
	 * @param <I>           the object id type
	 * @return this connection's persister for the mapping
	 */
	@NonNull
	@SuppressWarnings("unchecked")
	public <T, I> ObjectPersister<T, I> persister(@NonNull ObjectMapping<T, I> objectMapping) {
		requireNonNull(objectMapping);

		if (objectMapping instanceof OptimisticObjectMapping)
			return persister((OptimisticObjectMapping<T, I>) objectMapping);

		ObjectPersister<T, I> persister = (ObjectPersister<T, I>) getPersistersByMapping().get(objectMapping);

		if (persister == null) {
			persister = new ObjectPersister<>(objectStatements(objectMapping));
			getPersistersByMapping().put(objectMapping, persister);
		}

		return persister;
	}

	/**
	 * Gets the persister for the versioned type {@code objectMapping}, creating it on first access.
	 *
	 * @param objectMapping the mapping
	 * @param <T>           the mapped object type
	 * @param <I>           the object id type
	 * @return this connection's persister for the mapping
	 */
	@NonNull
	@SuppressWarnings("unchecked")
	public <T, I> OptimisticObjectPersister<T, I> persister(@NonNull OptimisticObjectMapping<T, I> objectMapping) {
		requireNonNull(objectMapping);

		OptimisticObjectPersister<T, I> persister = (OptimisticObjectPersister<T, I>) getPersistersByMapping().get(objectMapping);

		if (persister == null) {
			persister = new OptimisticObjectPersister<>(objectStatements(objectMapping));
			getPersistersByMapping().put(objectMapping, persister);
		}

		return persister;
	}

	/**
	 * Closes every persistence context created on this connection, then the JDBC connection itself.
	 * <p>
	 * The first failure is rethrown after everything has been attempted; later ones are attached to it as suppressed
	 * exceptions. Closing again is a no-op.
	 */
	@Override
	public void close() {
		if (this.closed)
			return;

		this.closed = true;

		RuntimeException failure = null;
		List<ObjectStatements<?, ?>> objectStatements = new ArrayList<>(getObjectStatementsByMapping().values());

		getObjectStatementsByMapping().clear();
		getPersistersByMapping().clear();

		for (ObjectStatements<?, ?> statements : objectStatements) {
			try {
				statements.close();
			} catch (RuntimeException e) {
				getLogger().log(WARNING, format("Unable to close %s", statements), e);

				if (failure == null)
					failure = e;
				else
					failure.addSuppressed(e);
			}
		}

		try {
			getJdbcConnection().close();
		} catch (SQLException e) {
			DatabaseException databaseException = new DatabaseException("Unable to close connection", e);
			getLogger().log(WARNING, "Unable to close connection", e);

			if (failure == null)
				failure = databaseException;
			else
				failure.addSuppressed(databaseException);
		}

		if (failure != null)
			throw failure;
	}

	@NonNull
	public Boolean isClosed() {
		return this.closed;
	}

	@NonNull
	public Connection getJdbcConnection() {
		return this.jdbcConnection;
	}

	@NonNull
	public PreparedStatementBinder getPreparedStatementBinder() {
		return this.preparedStatementBinder;
	}

	@NonNull
	public StatementLogger getStatementLogger() {
		return this.statementLogger;
	}

	protected void ensureOpen() {
		if (this.closed)
			throw new IllegalStateException("Connection has been closed");
	}

	@NonNull
	protected Map<ObjectMapping<?, ?>, ObjectStatements<?, ?>> getObjectStatementsByMapping() {
		return this.objectStatementsByMapping;
	}

	@NonNull
	protected Map<ObjectMapping<?, ?>, ObjectPersister<?, ?>> getPersistersByMapping() {
		return this.persistersByMapping;
	}

	@NonNull
	protected Logger getLogger() {
		return this.logger;
	}
}
