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

import static java.lang.String.format;

/**
 * Persistence context for a type with a managed version column.
 * <p>
 * Adds a binding over the whole id image (id columns followed by the expected version) and the version-checked erase
 * statement that uses it. The update binding already carries the expected version as its last parameter.
 *
 * @param <T> the mapped object type
 * @param <I> the object id type
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public class OptimisticObjectStatements<T, I> extends ObjectStatements<T, I> {
	@NonNull
	private final Binding optimisticIdImageBinding;
	private long optimisticIdImageVersion;

	@Nullable
	private DeleteStatement optimisticErase;

	public OptimisticObjectStatements(@NonNull DatabaseConnection connection,
																		@NonNull OptimisticObjectMapping<T, I> objectMapping) {
		super(connection, objectMapping);

		if (getManagedOptimisticColumnCount() != 1)
			throw new IllegalArgumentException(format("%s must declare exactly one %s column but declares %d",
					objectMapping.getObjectType().getSimpleName(), ColumnRole.VERSION.name(), getManagedOptimisticColumnCount()));

		this.optimisticIdImageBinding = new Binding(getUpdateImageBinds(), getUpdateColumnCount(),
				getIdColumnCount() + getManagedOptimisticColumnCount());
	}

	public void refreshOptimisticIdImageBinding() {
		Binding binding = getOptimisticIdImageBinding();

		if (getIdImage().getVersion() != getOptimisticIdImageVersion() || binding.getVersion() == 0) {
			binding.derive();
			setOptimisticIdImageVersion(getIdImage().getVersion());
			binding.incrementVersion();
		}
	}

	@NonNull
	public DeleteStatement optimisticEraseStatement() {
		ensureOpen();

		if (this.optimisticErase == null) {
			getLogger().finer(format("Preparing optimistic erase statement for %s", getObjectMapping().getObjectType().getSimpleName()));
			this.optimisticErase = new DeleteStatement(getConnection(), getOptimisticObjectMapping().getOptimisticEraseSql(),
					getOptimisticIdImageBinding());
		}

		return this.optimisticErase;
	}

	@Override
	public void close() {
		Statement optimisticErase = this.optimisticErase;
		this.optimisticErase = null;

		try {
			closeAll(optimisticErase);
		} finally {
			super.close();
		}
	}

	public long getOptimisticIdImageVersion() {
		return this.optimisticIdImageVersion;
	}

	public void setOptimisticIdImageVersion(long optimisticIdImageVersion) {
		this.optimisticIdImageVersion = optimisticIdImageVersion;
	}

	@NonNull
	public Binding getOptimisticIdImageBinding() {
		return this.optimisticIdImageBinding;
	}

	@NonNull
	public OptimisticObjectMapping<T, I> getOptimisticObjectMapping() {
		return (OptimisticObjectMapping<T, I>) getObjectMapping();
	}
}
