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

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Persister for types with a managed version column.
 * <p>
 * {@link #update(Object)} and {@link #erase(Object)} only touch the row if its version still matches the object's.
 * A mismatch, including a row erased concurrently, is reported by returning {@code false}.
 * {@link #eraseById(Object)} erases unconditionally.
 *
 * @param <T> the mapped object type
 * @param <I> the object id type
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public class OptimisticObjectPersister<T, I> extends ObjectPersister<T, I> {
	public OptimisticObjectPersister(@NonNull OptimisticObjectStatements<T, I> statements) {
		super(statements);
	}

	/**
	 * Erases {@code object} if its row still carries the object's version.
	 *
	 * @param object the object to erase
	 * @return {@code true} if the row was erased, {@code false} if it was changed or erased since {@code object} was read
	 */
	@Override
	@NonNull
	public Boolean erase(@NonNull T object) {
		requireNonNull(object);

		OptimisticObjectStatements<T, I> statements = getStatements();
		I id = getObjectMapping().getId(object);

		getObjectMapping().initIdImage(statements.getIdImage(), id);
		initExpectedVersion(object);
		statements.refreshOptimisticIdImageBinding();

		if (statements.optimisticEraseStatement().execute() == 0) {
			getLogger().fine(format("Optimistic erase of %s with id %s lost to a concurrent change", getObjectTypeName(), id));
			return false;
		}

		if (hasContainers()) {
			statements.refreshIdImageBinding();
			statements.containerStatementCache().deleteElements();
		}

		return true;
	}

	@Override
	protected void afterPersist(@NonNull T object) {
		getObjectMapping().setVersion(object, getObjectMapping().getInitialVersion());
	}

	@Override
	protected void initExpectedVersion(@NonNull T object) {
		Object version = getObjectMapping().getVersion(object);

		if (version == null)
			throw new IllegalArgumentException(format("%s with id %s has no version; it was never persisted or loaded",
					getObjectTypeName(), getObjectMapping().getId(object)));

		getStatements().getIdImage().set(getStatements().getIdColumnCount(), version);
	}

	@Override
	protected void afterUpdate(@NonNull T object) {
		getObjectMapping().setVersion(object, getObjectMapping().nextVersion(getObjectMapping().getVersion(object)));
	}

	@Override
	@NonNull
	protected Boolean noRowsUpdated(@NonNull I id) {
		getLogger().fine(format("Optimistic update of %s with id %s lost to a concurrent change", getObjectTypeName(), id));
		return false;
	}

	@Override
	@NonNull
	public OptimisticObjectStatements<T, I> getStatements() {
		return (OptimisticObjectStatements<T, I>) super.getStatements();
	}

	@Override
	@NonNull
	public OptimisticObjectMapping<T, I> getObjectMapping() {
		return getStatements().getOptimisticObjectMapping();
	}
}
