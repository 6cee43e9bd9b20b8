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
import java.util.Optional;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Persists, finds, updates and erases instances of one mapped type through that type's {@link ObjectStatements}.
 * <p>
 * Instances are obtained from {@link DatabaseConnection#persister(ObjectMapping)}; there is one per mapping per
 * connection.
 * <p>
 * Loading is lock-aware. A top-level {@link #find(Object)} locks the type's context, reads the row, then keeps running
 * {@link ObjectStatements#loadDelayed()} until every same-type reference discovered along the way has been loaded.
 * A {@code find} issued while the context is already locked (typically from
 * {@link ObjectMapping#initObject(Object, Image, DatabaseConnection)} resolving a reference to the same type) returns
 * an empty instance immediately and queues its load.
 *
 * @param <T> the mapped object type
 * @param <I> the object id type
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public class ObjectPersister<T, I> {
	@NonNull
	private final ObjectStatements<T, I> statements;
	@NonNull
	private final Logger logger;

	public ObjectPersister(@NonNull ObjectStatements<T, I> statements) {
		requireNonNull(statements);

		this.statements = statements;
		this.logger = Logger.getLogger(getClass().getName());
	}

	/**
	 * Inserts {@code object} and its container elements.
	 *
	 * @param object the object to insert
	 * @throws ObjectAlreadyPersistentException if a row with the same id already exists
	 */
	public void persist(@NonNull T object) {
		requireNonNull(object);

		ObjectStatements<T, I> statements = getStatements();
		ObjectMapping<T, I> objectMapping = getObjectMapping();

		objectMapping.initImage(statements.getImage(), object);
		statements.refreshInsertImageBinding();

		if (!statements.persistStatement().execute())
			throw new ObjectAlreadyPersistentException(objectMapping.getObjectType(), objectMapping.getId(object));

		afterPersist(object);

		if (hasContainers()) {
			selectId(objectMapping.getId(object));
			statements.containerStatementCache().insertElements(object);
		}
	}

	/**
	 * Finds the object with the given id.
	 *
	 * @param id the object id
	 * @return the object, or an empty {@link Optional} if no such row exists
	 */
	@NonNull
	public Optional<T> find(@NonNull I id) {
		return find(id, CachePosition.NONE);
	}

	/**
	 * Finds the object with the given id on behalf of the association slot {@code position}.
	 * <p>
	 * If this type's context is already locked by an enclosing load, a new instance is returned right away and its load
	 * is queued; the queued load fails with {@link ObjectNotPersistentException} if the row does not exist.
	 *
	 * @param id       the object id
	 * @param position the pending slot the result will occupy
	 * @return the object, or an empty {@link Optional} if no such row exists
	 */
	@NonNull
	public Optional<T> find(@NonNull I id,
													@NonNull CachePosition position) {
		requireNonNull(id);
		requireNonNull(position);

		ObjectStatements<T, I> statements = getStatements();

		try (ObjectStatements.AutoLock lock = new ObjectStatements.AutoLock(statements)) {
			if (lock.isLocked()) {
				if (!statements.findRow(id))
					return Optional.empty();

				T object = getObjectMapping().newInstance();
				loadFoundRow(object);
				position.loaded();
				lock.unlock();

				return Optional.of(object);
			}
		}

		T object = getObjectMapping().newInstance();
		getLogger().finer(format("Deferring load of %s with id %s", getObjectTypeName(), id));
		statements.delayLoad(id, object, position, null);

		return Optional.of(object);
	}

	/**
	 * Loads the object with the given id into an existing instance.
	 * <p>
	 * As with {@link #find(Object, CachePosition)}, the load is queued if this type's context is already locked.
	 *
	 * @param id     the object id
	 * @param object the instance to load into
	 * @throws ObjectNotPersistentException if no such row exists
	 */
	public void load(@NonNull I id,
									 @NonNull T object) {
		requireNonNull(id);
		requireNonNull(object);

		ObjectStatements<T, I> statements = getStatements();

		try (ObjectStatements.AutoLock lock = new ObjectStatements.AutoLock(statements)) {
			if (lock.isLocked()) {
				if (!statements.findRow(id))
					throw new ObjectNotPersistentException(getObjectMapping().getObjectType(), id);

				loadFoundRow(object);
				lock.unlock();
				return;
			}
		}

		getLogger().finer(format("Deferring load of %s with id %s", getObjectTypeName(), id));
		statements.delayLoad(id, object, CachePosition.NONE, null);
	}

	/**
	 * A loader that, when run from {@link ObjectStatements#loadDelayed()}, releases the lock and performs a complete
	 * top-level {@link #load(Object, Object)}, so the object's own references are resolved before the next queued load.
	 *
	 * @return an eager loader for this type
	 */
	@NonNull
	public DelayedLoader<T, I> eagerLoader() {
		return (connection, id, object) -> {
			try (ObjectStatements.AutoUnlock unlock = new ObjectStatements.AutoUnlock(getStatements())) {
				load(id, object);
			}
		};
	}

	/**
	 * Updates the row of {@code object} and replaces its container elements.
	 *
	 * @param object the object to update
	 * @return {@code true} if the row was updated
	 * @throws ObjectNotPersistentException if no row with the object's id exists
	 */
	@NonNull
	public Boolean update(@NonNull T object) {
		requireNonNull(object);

		ObjectStatements<T, I> statements = getStatements();
		ObjectMapping<T, I> objectMapping = getObjectMapping();
		I id = objectMapping.getId(object);

		objectMapping.initImage(statements.getImage(), object);
		objectMapping.initIdImage(statements.getIdImage(), id);
		initExpectedVersion(object);
		statements.refreshUpdateImageBinding();

		if (statements.updateStatement().execute() == 0)
			return noRowsUpdated(id);

		afterUpdate(object);

		if (hasContainers()) {
			ContainerStatementCache<T> containerStatementCache = statements.containerStatementCache();
			statements.refreshIdImageBinding();
			containerStatementCache.deleteElements();
			containerStatementCache.insertElements(object);
		}

		return true;
	}

	/**
	 * Erases the object with the given id and its container elements, regardless of version.
	 *
	 * @param id the object id
	 * @throws ObjectNotPersistentException if no such row exists
	 */
	public void eraseById(@NonNull I id) {
		requireNonNull(id);

		ObjectStatements<T, I> statements = getStatements();

		selectId(id);

		if (hasContainers())
			statements.containerStatementCache().deleteElements();

		if (statements.eraseStatement().execute() == 0)
			throw new ObjectNotPersistentException(getObjectMapping().getObjectType(), id);
	}

	/**
	 * Erases {@code object}.
	 *
	 * @param object the object to erase
	 * @return {@code true} if the row was erased
	 * @throws ObjectNotPersistentException if no row with the object's id exists
	 */
	@NonNull
	public Boolean erase(@NonNull T object) {
		requireNonNull(object);

		eraseById(getObjectMapping().getId(object));
		return true;
	}

	protected void loadFoundRow(@NonNull T object) {
		requireNonNull(object);

		ObjectStatements<T, I> statements = getStatements();

		statements.initObjectFromFoundRow(object);
		statements.loadContainers(object);

		while (statements.hasDelayedLoads())
			statements.loadDelayed();
	}

	protected void selectId(@NonNull I id) {
		requireNonNull(id);

		getObjectMapping().initIdImage(getStatements().getIdImage(), id);
		getStatements().refreshIdImageBinding();
	}

	@NonNull
	protected Boolean hasContainers() {
		return !getObjectMapping().getContainerMappings().isEmpty();
	}

	protected void afterPersist(@NonNull T object) {
		// Nothing to do for unversioned types
	}

	protected void initExpectedVersion(@NonNull T object) {
		// Nothing to do for unversioned types
	}

	protected void afterUpdate(@NonNull T object) {
		// Nothing to do for unversioned types
	}

	@NonNull
	protected Boolean noRowsUpdated(@NonNull I id) {
		throw new ObjectNotPersistentException(getObjectMapping().getObjectType(), id);
	}

	@NonNull
	public ObjectStatements<T, I> getStatements() {
		return this.statements;
	}

	@NonNull
	public ObjectMapping<T, I> getObjectMapping() {
		return getStatements().getObjectMapping();
	}

	@NonNull
	protected Logger getLogger() {
		return this.logger;
	}

	@NonNull
	protected String getObjectTypeName() {
		return getObjectMapping().getObjectType().getSimpleName();
	}
}
