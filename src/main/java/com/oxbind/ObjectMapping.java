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

import java.util.List;

/**
 * Per-type mapping metadata: the image layout, the static SQL for each statement kind, and the conversions between
 * an object and its images.
 * <p>
 * Implementations are typically generated. The column counts are constants for the lifetime of the type; they default
 * to counts over {@link #getColumns()}.
 * <p>
 * The main image has one column per entry in {@link #getColumns()}, in order. The id image holds the {@link ColumnRole#ID}
 * columns in order, followed by the {@link ColumnRole#VERSION} column for optimistic types. SQL parameters are expected
 * in binding order:
 * <ul>
 *   <li>persist: every column except {@link ColumnRole#INVERSE} and {@link ColumnRole#VERSION}</li>
 *   <li>find: the id columns; it must select every column, in order</li>
 *   <li>update: the {@link ColumnRole#DATA} columns, then the id columns, then (optimistic types) the expected version</li>
 *   <li>erase: the id columns</li>
 * </ul>
 *
 * @param <T> the mapped object type
 * @param <I> the object id type
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
public interface ObjectMapping<T, I> {
	@NonNull
	Class<T> getObjectType();

	@NonNull
	List<Column> getColumns();

	default int getColumnCount() {
		return getColumns().size();
	}

	default int getInverseColumnCount() {
		return countColumns(ColumnRole.INVERSE);
	}

	default int getManagedOptimisticColumnCount() {
		return countColumns(ColumnRole.VERSION);
	}

	default int getIdColumnCount() {
		return countColumns(ColumnRole.ID);
	}

	default int getReadonlyColumnCount() {
		return countColumns(ColumnRole.READONLY);
	}

	@NonNull
	String getPersistSql();

	@NonNull
	String getFindSql();

	@NonNull
	String getUpdateSql();

	@NonNull
	String getEraseSql();

	@NonNull
	T newInstance();

	@NonNull
	I getId(@NonNull T object);

	/**
	 * Copies the object's persistent state into the main image.
	 *
	 * @param image  the main image
	 * @param object the source object
	 */
	void initImage(@NonNull Image image,
								 @NonNull T object);

	/**
	 * Copies a fetched row from the main image into the object.
	 * <p>
	 * References to other persistent objects are resolved through {@code connection}, typically with
	 * {@link ObjectPersister#find(Object)}. A reference to this same type found while a row of this type is being
	 * consumed comes back as an instance whose load has been delayed until the current statement is done.
	 *
	 * @param object     the destination object
	 * @param image      the main image holding the fetched row
	 * @param connection the connection the row was fetched on
	 */
	void initObject(@NonNull T object,
									@NonNull Image image,
									@NonNull DatabaseConnection connection);

	/**
	 * Copies an id into the leading columns of the id image.
	 *
	 * @param idImage the id image
	 * @param id      the object id
	 */
	void initIdImage(@NonNull Image idImage,
									 @NonNull I id);

	@NonNull
	default List<ContainerMapping<T, ?>> getContainerMappings() {
		return List.of();
	}

	private int countColumns(@NonNull ColumnRole columnRole) {
		int count = 0;

		for (Column column : getColumns())
			if (column.getRole() == columnRole)
				++count;

		return count;
	}
}
