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
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The persistence context for one mapped type on one {@link DatabaseConnection}.
 * <p>
 * Owns the type's main image and id image, one binding per statement kind, and at most one instance of each
 * statement, created on first use and kept until {@link #close()}.
 * <p>
 * The update binding spans both images: the updatable columns of the main image, then the id columns of the id image,
 * then (optimistic types) the expected version stored after the id in the id image. The id binding is a view over
 * that suffix, so the update binding is valid only when both of its source image versions are current.
 * <p>
 * The context is locked while one of its statements is producing rows. Objects of this type referenced from those
 * rows cannot be fetched with the same statement until it is done, so their loads are queued with
 * {@link #delayLoad(Object, Object, CachePosition, DelayedLoader)} and run by {@link #loadDelayed()}.
 *
 * @param <T> the mapped object type
 * @param <I> the object id type
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public class ObjectStatements<T, I> extends StatementsBase {
	@NonNull
	private final ObjectMapping<T, I> objectMapping;
	@NonNull
	private final ColumnCounts columnCounts;
	@NonNull
	private final LazyStatementCache<ContainerStatementCache<T>> containerStatementCache;
	@NonNull
	private final Logger logger;

	@NonNull
	private final Image image;

	private long selectImageVersion;
	@NonNull
	private final Binding selectImageBinding;

	private long insertImageVersion;
	@NonNull
	private final Binding insertImageBinding;

	private long updateImageVersion;
	private long updateIdImageVersion;
	@NonNull
	private final Bind[] updateImageBinds;
	@NonNull
	private final Binding updateImageBinding;

	@NonNull
	private final Image idImage;
	private long idImageVersion;
	@NonNull
	private final Binding idImageBinding;

	@Nullable
	private InsertStatement persist;
	@Nullable
	private SelectStatement find;
	@Nullable
	private UpdateStatement update;
	@Nullable
	private DeleteStatement erase;

	private boolean locked;
	private boolean closed;
	@NonNull
	private List<DelayedLoad<T, I>> delayed;

	public ObjectStatements(@NonNull DatabaseConnection connection,
													@NonNull ObjectMapping<T, I> objectMapping) {
		super(connection);

		requireNonNull(objectMapping);

		this.objectMapping = objectMapping;
		this.columnCounts = ColumnCounts.forMapping(objectMapping);
		this.logger = Logger.getLogger(getClass().getName());
		this.containerStatementCache = new LazyStatementCache<>((cacheConnection, idBinding) ->
				new ContainerStatementCache<>(cacheConnection, objectMapping.getContainerMappings(), idBinding));

		if (this.columnCounts.getManagedOptimisticColumnCount() > 0 && !(objectMapping instanceof OptimisticObjectMapping))
			throw new IllegalArgumentException(format("%s declares a managed version column but is not an %s",
					objectMapping.getObjectType().getSimpleName(), OptimisticObjectMapping.class.getSimpleName()));

		List<Column> columns = objectMapping.getColumns();

		if (columns.size() != this.columnCounts.getSelectColumnCount())
			throw new IllegalArgumentException(format("%s declares %d columns but its layout has %d",
					objectMapping.getObjectType().getSimpleName(), this.columnCounts.getSelectColumnCount(), columns.size()));

		int idColumnCount = this.columnCounts.getIdColumnCount();
		int managedColumnCount = this.columnCounts.getManagedOptimisticColumnCount();
		int updateColumnCount = this.columnCounts.getUpdateColumnCount();

		this.image = new Image(columns.size());
		this.idImage = new Image(idColumnCount + managedColumnCount);

		this.selectImageBinding = new Binding(this.columnCounts.getSelectColumnCount());
		this.insertImageBinding = new Binding(this.columnCounts.getInsertColumnCount());
		this.updateImageBinds = Binding.newBinds(updateColumnCount + idColumnCount + managedColumnCount);
		this.updateImageBinding = new Binding(this.updateImageBinds, 0, this.updateImageBinds.length);
		this.idImageBinding = new Binding(this.updateImageBinds, updateColumnCount, idColumnCount);

		int insertIndex = 0;
		int updateIndex = 0;
		int idIndex = 0;
		int managedIndex = 0;

		for (int column = 0; column < columns.size(); ++column) {
			Column mappedColumn = columns.get(column);
			ColumnRole role = mappedColumn.getRole();
			int sqlType = mappedColumn.getSqlType();

			this.selectImageBinding.get(column).assign(this.image, column, sqlType);

			if (role != ColumnRole.INVERSE && role != ColumnRole.VERSION)
				this.insertImageBinding.get(insertIndex++).assign(this.image, column, sqlType);

			if (role == ColumnRole.DATA)
				this.updateImageBinds[updateIndex++].assign(this.image, column, sqlType);
			else if (role == ColumnRole.ID)
				this.updateImageBinds[updateColumnCount + idIndex].assign(this.idImage, idIndex++, sqlType);
			else if (role == ColumnRole.VERSION)
				this.updateImageBinds[updateColumnCount + idColumnCount + managedIndex].assign(this.idImage, idColumnCount + managedIndex++, sqlType);
		}

		if (insertIndex != this.columnCounts.getInsertColumnCount() || updateIndex != updateColumnCount
				|| idIndex != idColumnCount || managedIndex != managedColumnCount)
			throw new IllegalArgumentException(format("Column roles of %s do not match its column counts %s",
					objectMapping.getObjectType().getSimpleName(), this.columnCounts));

		this.locked = false;
		this.delayed = new ArrayList<>();
	}

	// Locking

	/**
	 * Locks this context.
	 *
	 * @throws IllegalStateException if this context is already locked
	 */
	public void lock() {
		ensureOpen();

		if (this.locked)
			throw new IllegalStateException(format("Statements for %s are already locked", getObjectTypeName()));

		this.locked = true;
	}

	/**
	 * Unlocks this context.
	 *
	 * @throws IllegalStateException if this context is not locked
	 */
	public void unlock() {
		if (!this.locked)
			throw new IllegalStateException(format("Statements for %s are not locked", getObjectTypeName()));

		this.locked = false;
	}

	@NonNull
	public Boolean isLocked() {
		return this.locked;
	}

	// Delayed loading

	/**
	 * Queues a deferred load of the object with the given id into {@code object}.
	 *
	 * @param id       the id of the object to load
	 * @param object   the instance to load into
	 * @param position the pending slot the object occupies
	 * @param loader   how to load it, or {@code null} to use this context's find statement
	 */
	public void delayLoad(@NonNull I id,
												@NonNull T object,
												@NonNull CachePosition position,
												@Nullable DelayedLoader<T, I> loader) {
		ensureOpen();
		this.delayed.add(new DelayedLoad<>(id, object, position, loader));
	}

	/**
	 * Runs every load queued before this call, in the order queued.
	 * <p>
	 * Loads queued while this runs stay queued for a later call. If a load fails, the exception propagates and every
	 * load not yet completed, including any queued during this call, is discarded.
	 *
	 * @throws IllegalStateException if this context is not locked
	 */
	public void loadDelayed() {
		if (!this.locked)
			throw new IllegalStateException(format("Statements for %s must be locked to run delayed loads", getObjectTypeName()));

		if (!this.delayed.isEmpty())
			loadDelayedInternal();
	}

	/**
	 * Discards every queued load without running it.
	 */
	public void clearDelayed() {
		if (!this.delayed.isEmpty())
			clearDelayedInternal();
	}

	@NonNull
	public Boolean hasDelayedLoads() {
		return !this.delayed.isEmpty();
	}

	@NonNull
	public List<DelayedLoad<T, I>> getDelayedLoads() {
		return List.copyOf(this.delayed);
	}

	protected void loadDelayedInternal() {
		List<DelayedLoad<T, I>> working = this.delayed;
		this.delayed = new ArrayList<>();

		int completed = 0;

		getLogger().finer(format("Running %d delayed load[s] for %s", working.size(), getObjectTypeName()));

		try {
			for (DelayedLoad<T, I> delayedLoad : working) {
				loadDelayedObject(delayedLoad);
				++completed;
				delayedLoad.getPosition().loaded();
			}
		} finally {
			if (completed < working.size()) {
				getLogger().fine(format("Delayed load for %s failed, discarding %d unfinished load[s] and %d queued since",
						getObjectTypeName(), working.size() - completed, this.delayed.size()));

				for (int i = completed; i < working.size(); ++i)
					working.get(i).getPosition().abandon();

				clearDelayed();
			}

			working.clear();
		}
	}

	protected void loadDelayedObject(@NonNull DelayedLoad<T, I> delayedLoad) {
		requireNonNull(delayedLoad);

		DelayedLoader<T, I> loader = delayedLoad.getLoader().orElse(null);

		if (loader != null) {
			loader.load(getConnection(), delayedLoad.getId(), delayedLoad.getObject());
			return;
		}

		if (!findRow(delayedLoad.getId()))
			throw new ObjectNotPersistentException(getObjectMapping().getObjectType(), delayedLoad.getId());

		initObjectFromFoundRow(delayedLoad.getObject());
		loadContainers(delayedLoad.getObject());
	}

	protected void clearDelayedInternal() {
		List<DelayedLoad<T, I>> discarded = this.delayed;
		this.delayed = new ArrayList<>();

		for (DelayedLoad<T, I> delayedLoad : discarded)
			delayedLoad.getPosition().abandon();
	}

	// Row access shared by find and the default delayed-load path

	/**
	 * Executes the find statement for {@code id} and fetches its row into the main image.
	 * <p>
	 * On success the find statement's result stays active; release it with {@link #initObjectFromFoundRow(Object)}.
	 *
	 * @param id the object id
	 * @return {@code true} if the row exists
	 */
	@NonNull
	public Boolean findRow(@NonNull I id) {
		requireNonNull(id);

		getObjectMapping().initIdImage(getIdImage(), id);
		refreshIdImageBinding();

		SelectStatement find = findStatement();
		find.execute();

		boolean found = false;

		try {
			found = find.fetch() == SelectStatement.FetchResult.SUCCESS;

			if (found)
				setSelectImageVersion(getImage().getVersion());

			return found;
		} finally {
			if (!found)
				find.freeResult();
		}
	}

	/**
	 * Copies the row fetched by {@link #findRow(Object)} into {@code object} and releases the find result.
	 *
	 * @param object the destination object
	 */
	public void initObjectFromFoundRow(@NonNull T object) {
		requireNonNull(object);

		try {
			getObjectMapping().initObject(object, getImage(), getConnection());
		} finally {
			findStatement().freeResult();
		}
	}

	/**
	 * Loads the containers of {@code object}, whose id must be current in the id binding.
	 *
	 * @param object the owning object
	 */
	public void loadContainers(@NonNull T object) {
		requireNonNull(object);

		if (!getObjectMapping().getContainerMappings().isEmpty())
			containerStatementCache().loadElements(object);
	}

	// Binding refresh

	public void refreshInsertImageBinding() {
		Binding binding = getInsertImageBinding();

		if (getImage().getVersion() != getInsertImageVersion() || binding.getVersion() == 0) {
			binding.derive();
			setInsertImageVersion(getImage().getVersion());
			binding.incrementVersion();
		}
	}

	public void refreshUpdateImageBinding() {
		Binding binding = getUpdateImageBinding();

		if (getImage().getVersion() != getUpdateImageVersion()
				|| getIdImage().getVersion() != getUpdateIdImageVersion()
				|| binding.getVersion() == 0) {
			binding.derive();
			setUpdateImageVersion(getImage().getVersion());
			setUpdateIdImageVersion(getIdImage().getVersion());
			binding.incrementVersion();
		}
	}

	public void refreshIdImageBinding() {
		Binding binding = getIdImageBinding();

		if (getIdImage().getVersion() != getIdImageVersion() || binding.getVersion() == 0) {
			binding.derive();
			setIdImageVersion(getIdImage().getVersion());
			binding.incrementVersion();
		}
	}

	// Statements

	@NonNull
	public InsertStatement persistStatement() {
		ensureOpen();

		if (this.persist == null) {
			getLogger().finer(format("Preparing persist statement for %s", getObjectTypeName()));
			this.persist = new InsertStatement(getConnection(), getObjectMapping().getPersistSql(), getInsertImageBinding());
		}

		return this.persist;
	}

	@NonNull
	public SelectStatement findStatement() {
		ensureOpen();

		if (this.find == null) {
			getLogger().finer(format("Preparing find statement for %s", getObjectTypeName()));
			this.find = new SelectStatement(getConnection(), getObjectMapping().getFindSql(), getIdImageBinding(), getSelectImageBinding());
		}

		return this.find;
	}

	@NonNull
	public UpdateStatement updateStatement() {
		ensureOpen();

		if (this.update == null) {
			getLogger().finer(format("Preparing update statement for %s", getObjectTypeName()));
			this.update = new UpdateStatement(getConnection(), getObjectMapping().getUpdateSql(), getUpdateImageBinding());
		}

		return this.update;
	}

	@NonNull
	public DeleteStatement eraseStatement() {
		ensureOpen();

		if (this.erase == null) {
			getLogger().finer(format("Preparing erase statement for %s", getObjectTypeName()));
			this.erase = new DeleteStatement(getConnection(), getObjectMapping().getEraseSql(), getIdImageBinding());
		}

		return this.erase;
	}

	@NonNull
	public ContainerStatementCache<T> containerStatementCache() {
		ensureOpen();
		return this.containerStatementCache.get(getConnection(), getIdImageBinding());
	}

	@NonNull
	public Boolean isContainerStatementCacheAllocated() {
		return this.containerStatementCache.isAllocated();
	}

	/**
	 * Closes every statement created so far and releases the container statement cache. The context may not be used
	 * afterwards; closing again is a no-op.
	 */
	@Override
	public void close() {
		if (this.closed)
			return;

		this.closed = true;

		Statement persist = this.persist;
		Statement find = this.find;
		Statement update = this.update;
		Statement erase = this.erase;

		this.persist = null;
		this.find = null;
		this.update = null;
		this.erase = null;

		clearDelayed();

		try {
			closeAll(persist, find, update, erase);
		} finally {
			this.containerStatementCache.reset();
		}
	}

	@NonNull
	public Boolean isClosed() {
		return this.closed;
	}

	/**
	 * @throws IllegalStateException if this context has been closed
	 */
	protected void ensureOpen() {
		if (this.closed)
			throw new IllegalStateException(format("Statements for %s have been closed", getObjectTypeName()));
	}

	// Images, bindings and versions

	@NonNull
	public Image getImage() {
		return this.image;
	}

	@NonNull
	public Image getIdImage() {
		return this.idImage;
	}

	public long getSelectImageVersion() {
		return this.selectImageVersion;
	}

	public void setSelectImageVersion(long selectImageVersion) {
		this.selectImageVersion = selectImageVersion;
	}

	@NonNull
	public Binding getSelectImageBinding() {
		return this.selectImageBinding;
	}

	public long getInsertImageVersion() {
		return this.insertImageVersion;
	}

	public void setInsertImageVersion(long insertImageVersion) {
		this.insertImageVersion = insertImageVersion;
	}

	@NonNull
	public Binding getInsertImageBinding() {
		return this.insertImageBinding;
	}

	public long getUpdateImageVersion() {
		return this.updateImageVersion;
	}

	public void setUpdateImageVersion(long updateImageVersion) {
		this.updateImageVersion = updateImageVersion;
	}

	public long getUpdateIdImageVersion() {
		return this.updateIdImageVersion;
	}

	public void setUpdateIdImageVersion(long updateIdImageVersion) {
		this.updateIdImageVersion = updateIdImageVersion;
	}

	@NonNull
	public Binding getUpdateImageBinding() {
		return this.updateImageBinding;
	}

	public long getIdImageVersion() {
		return this.idImageVersion;
	}

	public void setIdImageVersion(long idImageVersion) {
		this.idImageVersion = idImageVersion;
	}

	@NonNull
	public Binding getIdImageBinding() {
		return this.idImageBinding;
	}

	@NonNull
	protected Bind[] getUpdateImageBinds() {
		return this.updateImageBinds;
	}

	// Column counts

	public int getSelectColumnCount() {
		return this.columnCounts.getSelectColumnCount();
	}

	public int getInsertColumnCount() {
		return this.columnCounts.getInsertColumnCount();
	}

	public int getUpdateColumnCount() {
		return this.columnCounts.getUpdateColumnCount();
	}

	public int getIdColumnCount() {
		return this.columnCounts.getIdColumnCount();
	}

	public int getManagedOptimisticColumnCount() {
		return this.columnCounts.getManagedOptimisticColumnCount();
	}

	@NonNull
	public ObjectMapping<T, I> getObjectMapping() {
		return this.objectMapping;
	}

	@NonNull
	protected Logger getLogger() {
		return this.logger;
	}

	@NonNull
	private String getObjectTypeName() {
		return getObjectMapping().getObjectType().getSimpleName();
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{objectType=%s, locked=%s, delayedLoads=%d}", getClass().getSimpleName(), getObjectTypeName(),
				isLocked(), this.delayed.size());
	}

	/**
	 * Locks a context for the duration of one operation unless an enclosing operation already holds the lock.
	 * <p>
	 * Normal control flow runs {@link ObjectStatements#loadDelayed()} and then {@link #unlock()} explicitly. If
	 * {@link #close()} finds the lock still held, the operation ended abnormally: the context is unlocked and its
	 * delayed loads are discarded, not run.
	 * <pre>{@code
	 * try (ObjectStatements.AutoLock lock = new ObjectStatements.AutoLock(statements)) {
	 *   if (lock.isLocked()) {
	 *     // ... execute, fetch, init ...
	 *     statements.loadDelayed();
	 *     lock.unlock();
	 *   }
	 * }
	 * }</pre>
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static final class AutoLock implements AutoCloseable {
		@NonNull
		private final ObjectStatements<?, ?> statements;
		private boolean locked;

		public AutoLock(@NonNull ObjectStatements<?, ?> statements) {
			requireNonNull(statements);

			this.statements = statements;

			if (statements.isLocked()) {
				this.locked = false;
			} else {
				statements.lock();
				this.locked = true;
			}
		}

		/**
		 * Does this guard hold the lock?
		 *
		 * @return {@code true} if this guard locked the context and has not yet released it
		 */
		@NonNull
		public Boolean isLocked() {
			return this.locked;
		}

		/**
		 * Unlocks the context and discards any loads still queued, if this guard holds the lock.
		 */
		public void unlock() {
			if (!this.locked)
				return;

			this.statements.unlock();
			this.statements.clearDelayed();
			this.locked = false;
		}

		@Override
		public void close() {
			unlock();
		}
	}

	/**
	 * Releases a context's lock for the duration of a nested operation that needs to take it itself, then takes it
	 * back.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static final class AutoUnlock implements AutoCloseable {
		@NonNull
		private final ObjectStatements<?, ?> statements;

		public AutoUnlock(@NonNull ObjectStatements<?, ?> statements) {
			requireNonNull(statements);

			this.statements = statements;
			statements.unlock();
		}

		@Override
		public void close() {
			this.statements.lock();
		}
	}
}
