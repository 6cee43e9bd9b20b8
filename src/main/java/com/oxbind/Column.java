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
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A column of a mapped type's image layout.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class Column {
	@NonNull
	private final String name;
	@NonNull
	private final ColumnRole role;
	private final int sqlType;

	private Column(@NonNull String name,
								 @NonNull ColumnRole role,
								 int sqlType) {
		requireNonNull(name);
		requireNonNull(role);

		this.name = name;
		this.role = role;
		this.sqlType = sqlType;
	}

	/**
	 * Factory method for providing {@link Column} instances.
	 *
	 * @param name    the column name, for diagnostics
	 * @param role    how the column participates in statements
	 * @param sqlType the {@link java.sql.Types} constant for the column
	 * @return a column instance
	 */
	@NonNull
	public static Column of(@NonNull String name,
													@NonNull ColumnRole role,
													int sqlType) {
		requireNonNull(name);
		requireNonNull(role);

		return new Column(name, role, sqlType);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getName(), getRole(), getSqlType());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Column))
			return false;

		Column column = (Column) object;

		return Objects.equals(column.getName(), getName())
				&& Objects.equals(column.getRole(), getRole())
				&& column.getSqlType() == getSqlType();
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{name=%s, role=%s, sqlType=%d}", getClass().getSimpleName(), getName(), getRole().name(), getSqlType());
	}

	@NonNull
	public String getName() {
		return this.name;
	}

	@NonNull
	public ColumnRole getRole() {
		return this.role;
	}

	public int getSqlType() {
		return this.sqlType;
	}
}
