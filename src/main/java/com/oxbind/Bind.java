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
import static java.util.Objects.requireNonNull;

/**
 * A single parameter or result slot within a {@link Binding}.
 * <p>
 * A slot's address is an {@link Image} column plus its JDBC type; the address is assigned once via
 * {@link #assign(Image, int, int)}. The slot's {@link #getValue() value} is a copy of the addressed column taken by
 * {@link #derive()}, so a slot whose image changed since the last derivation holds a stale value until re-derived.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public final class Bind {
	@Nullable
	private Image image;
	private int column;
	private int sqlType;
	@Nullable
	private Object value;

	public Bind() {
		this.column = -1;
	}

	public void assign(@NonNull Image image,
										 int column,
										 int sqlType) {
		requireNonNull(image);

		if (column < 0 || column >= image.getColumnCount())
			throw new IndexOutOfBoundsException(format("Column %d is out of range for an image of %d columns", column, image.getColumnCount()));

		this.image = image;
		this.column = column;
		this.sqlType = sqlType;
		this.value = null;
	}

	/**
	 * Re-reads this slot's value from the image column it addresses.
	 */
	public void derive() {
		this.value = getImage().get(this.column);
	}

	/**
	 * Writes a fetched result value into the image column this slot addresses.
	 *
	 * @param value the fetched value
	 */
	public void store(@Nullable Object value) {
		this.value = value;
		getImage().set(this.column, value);
	}

	@NonNull
	public Boolean isAssigned() {
		return this.image != null;
	}

	@NonNull
	public Image getImage() {
		if (this.image == null)
			throw new IllegalStateException("Bind has not been assigned to an image");

		return this.image;
	}

	public int getColumn() {
		return this.column;
	}

	public int getSqlType() {
		return this.sqlType;
	}

	@Nullable
	public Object getValue() {
		return this.value;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{column=%d, sqlType=%d, value=%s}", getClass().getSimpleName(), this.column, this.sqlType, this.value);
	}
}
