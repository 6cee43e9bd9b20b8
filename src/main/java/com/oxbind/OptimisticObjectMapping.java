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

/**
 * Mapping for a type with a managed optimistic-concurrency version column.
 * <p>
 * Mapping a type through this interface is what selects {@link OptimisticObjectStatements} for it; plain
 * {@link ObjectMapping}s never carry optimistic state.
 *
 * @param <T> the mapped object type
 * @param <I> the object id type
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
public interface OptimisticObjectMapping<T, I> extends ObjectMapping<T, I> {
	/**
	 * SQL deleting by id and expected version, with parameters in id image order.
	 *
	 * @return the version-checked delete SQL
	 */
	@NonNull
	String getOptimisticEraseSql();

	@Nullable
	Object getVersion(@NonNull T object);

	void setVersion(@NonNull T object,
									@Nullable Object version);

	/**
	 * The version a row has right after it is persisted.
	 *
	 * @return the initial version
	 */
	@NonNull
	default Object getInitialVersion() {
		return 1L;
	}

	/**
	 * The version a row has after a successful update, given the version it had before.
	 *
	 * @param version the version before the update
	 * @return the version after the update
	 */
	@NonNull
	default Object nextVersion(@NonNull Object version) {
		return ((Number) version).longValue() + 1L;
	}
}
