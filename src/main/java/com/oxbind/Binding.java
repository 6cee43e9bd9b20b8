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
import java.util.ArrayList;
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * An ordered, fixed-length run of {@link Bind} slots paired with a version number.
 * <p>
 * A binding may be a view over part of a larger slot array; the id binding of a persistence context shares its slots
 * with the suffix of the update binding. The version is bumped by whoever re-derives the slots so that statements
 * know when their JDBC parameters must be re-applied.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public final class Binding {
	@NonNull
	private final Bind[] binds;
	private final int offset;
	private final int count;

	private long version;

	public Binding(int count) {
		this(newBinds(count), 0, count);
	}

	public Binding(@NonNull Bind[] binds,
								 int offset,
								 int count) {
		requireNonNull(binds);

		if (offset < 0 || count < 0 || offset + count > binds.length)
			throw new IllegalArgumentException(format("Invalid view [offset=%d, count=%d] over %d binds", offset, count, binds.length));

		this.binds = binds;
		this.offset = offset;
		this.count = count;
		this.version = 0;
	}

	@NonNull
	static Bind[] newBinds(int count) {
		Bind[] binds = new Bind[count];

		for (int i = 0; i < count; ++i)
			binds[i] = new Bind();

		return binds;
	}

	@NonNull
	public Bind get(int index) {
		if (index < 0 || index >= this.count)
			throw new IndexOutOfBoundsException(format("Bind %d is out of range for a binding of %d binds", index, this.count));

		return this.binds[this.offset + index];
	}

	public int size() {
		return this.count;
	}

	/**
	 * Re-derives every slot's value from its image, reusing the existing slots.
	 */
	public void derive() {
		for (int i = 0; i < this.count; ++i)
			this.binds[this.offset + i].derive();
	}

	public long getVersion() {
		return this.version;
	}

	public void incrementVersion() {
		this.version++;
	}

	@NonNull
	public List<Object> getValues() {
		List<Object> values = new ArrayList<>(this.count);

		for (int i = 0; i < this.count; ++i)
			values.add(this.binds[this.offset + i].getValue());

		return values;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{version=%d, values=%s}", getClass().getSimpleName(), getVersion(), getValues());
	}
}
