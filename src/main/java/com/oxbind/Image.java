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
import java.util.Arrays;

import static java.lang.String.format;

/**
 * Fixed-layout, reusable buffer holding one row's column values for a mapped type.
 * <p>
 * Every mutation bumps {@link #getVersion()}, which is how bindings over this image detect that they are stale.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public final class Image {
	@NonNull
	private final Object[] values;

	private long version;

	public Image(int columnCount) {
		if (columnCount < 0)
			throw new IllegalArgumentException(format("Column count must be >= 0 but was %d", columnCount));

		this.values = new Object[columnCount];
		this.version = 0;
	}

	@Nullable
	public Object get(int column) {
		return this.values[checkColumn(column)];
	}

	public void set(int column,
									@Nullable Object value) {
		this.values[checkColumn(column)] = value;
		this.version++;
	}

	public void clear() {
		Arrays.fill(this.values, null);
		this.version++;
	}

	public int getColumnCount() {
		return this.values.length;
	}

	public long getVersion() {
		return this.version;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{version=%d, values=%s}", getClass().getSimpleName(), getVersion(), Arrays.toString(this.values));
	}

	private int checkColumn(int column) {
		if (column < 0 || column >= this.values.length)
			throw new IndexOutOfBoundsException(format("Column %d is out of range for an image of %d columns", column, this.values.length));

		return column;
	}
}
