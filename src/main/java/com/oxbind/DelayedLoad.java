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
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A deferred fetch of an object, queued on its type's {@link ObjectStatements}.
 *
 * @param <T> the object type
 * @param <I> the object id type
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public final class DelayedLoad<T, I> {
	@NonNull
	private final I id;
	@NonNull
	private final T object;
	@NonNull
	private final CachePosition position;
	@Nullable
	private final DelayedLoader<T, I> loader;

	DelayedLoad(@NonNull I id,
							@NonNull T object,
							@NonNull CachePosition position,
							@Nullable DelayedLoader<T, I> loader) {
		requireNonNull(id);
		requireNonNull(object);
		requireNonNull(position);

		this.id = id;
		this.object = object;
		this.position = position;
		this.loader = loader;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{id=%s, objectType=%s, customLoader=%s}", getClass().getSimpleName(), getId(),
				getObject().getClass().getSimpleName(), getLoader().isPresent());
	}

	@NonNull
	public I getId() {
		return this.id;
	}

	@NonNull
	public T getObject() {
		return this.object;
	}

	@NonNull
	public CachePosition getPosition() {
		return this.position;
	}

	/**
	 * The loader to use, or empty to load with the owning statements' find statement.
	 *
	 * @return the custom loader, if any
	 */
	@NonNull
	public Optional<DelayedLoader<T, I>> getLoader() {
		return Optional.ofNullable(this.loader);
	}
}
