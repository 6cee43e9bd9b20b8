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

import java.util.List;

/**
 * Mapping for a one-to-many container stored in its own table, keyed by the owner's id.
 * <p>
 * Parameter and column order:
 * <ul>
 *   <li>insert: the owner id columns, then the element index, then the element value</li>
 *   <li>select: the owner id columns as parameters; selects the element index and value, ordered by index</li>
 *   <li>delete: the owner id columns</li>
 * </ul>
 *
 * @param <T> the owner type
 * @param <E> the element type
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
public interface ContainerMapping<T, E> {
	@NonNull
	String getName();

	@NonNull
	String getInsertSql();

	@NonNull
	String getSelectSql();

	@NonNull
	String getDeleteSql();

	int getElementSqlType();

	@NonNull
	List<E> getElements(@NonNull T owner);

	void setElements(@NonNull T owner,
									 @NonNull List<E> elements);

	/**
	 * Converts a fetched element value to the element type.
	 *
	 * @param value the fetched value
	 * @return the element
	 */
	@Nullable
	@SuppressWarnings("unchecked")
	default E toElement(@Nullable Object value) {
		return (E) value;
	}
}
