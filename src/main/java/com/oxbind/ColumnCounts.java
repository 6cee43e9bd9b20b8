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

import javax.annotation.concurrent.ThreadSafe;

import static java.lang.String.format;

/**
 * Per-type binding sizes, derived once from a mapping's column counts:
 * <pre>
 * select = total
 * insert = total - inverse - managed_optimistic
 * update = insert - id - readonly
 * </pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class ColumnCounts {
	private final int selectColumnCount;
	private final int insertColumnCount;
	private final int updateColumnCount;
	private final int idColumnCount;
	private final int managedOptimisticColumnCount;

	private ColumnCounts(int totalColumnCount,
											 int inverseColumnCount,
											 int managedOptimisticColumnCount,
											 int idColumnCount,
											 int readonlyColumnCount) {
		requireNonNegative("total", totalColumnCount);
		requireNonNegative("inverse", inverseColumnCount);
		requireNonNegative("managed optimistic", managedOptimisticColumnCount);
		requireNonNegative("id", idColumnCount);
		requireNonNegative("readonly", readonlyColumnCount);

		this.selectColumnCount = totalColumnCount;
		this.insertColumnCount = totalColumnCount - inverseColumnCount - managedOptimisticColumnCount;
		this.updateColumnCount = this.insertColumnCount - idColumnCount - readonlyColumnCount;
		this.idColumnCount = idColumnCount;
		this.managedOptimisticColumnCount = managedOptimisticColumnCount;

		requireNonNegative("insert", this.insertColumnCount);
		requireNonNegative("update", this.updateColumnCount);
	}

	@NonNull
	public static ColumnCounts of(int totalColumnCount,
																int inverseColumnCount,
																int managedOptimisticColumnCount,
																int idColumnCount,
																int readonlyColumnCount) {
		return new ColumnCounts(totalColumnCount, inverseColumnCount, managedOptimisticColumnCount, idColumnCount, readonlyColumnCount);
	}

	@NonNull
	public static ColumnCounts forMapping(@NonNull ObjectMapping<?, ?> objectMapping) {
		return of(objectMapping.getColumnCount(), objectMapping.getInverseColumnCount(),
				objectMapping.getManagedOptimisticColumnCount(), objectMapping.getIdColumnCount(),
				objectMapping.getReadonlyColumnCount());
	}

	private static void requireNonNegative(@NonNull String name,
																				 int count) {
		if (count < 0)
			throw new IllegalArgumentException(format("The %s column count must be >= 0 but was %d", name, count));
	}

	public int getSelectColumnCount() {
		return this.selectColumnCount;
	}

	public int getInsertColumnCount() {
		return this.insertColumnCount;
	}

	public int getUpdateColumnCount() {
		return this.updateColumnCount;
	}

	public int getIdColumnCount() {
		return this.idColumnCount;
	}

	public int getManagedOptimisticColumnCount() {
		return this.managedOptimisticColumnCount;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{select=%d, insert=%d, update=%d, id=%d, managedOptimistic=%d}", getClass().getSimpleName(),
				getSelectColumnCount(), getInsertColumnCount(), getUpdateColumnCount(), getIdColumnCount(),
				getManagedOptimisticColumnCount());
	}
}
