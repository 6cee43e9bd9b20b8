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

import static java.util.Objects.requireNonNull;

/**
 * Owns at most one nested statement cache, allocated on first access and released exactly once by {@link #reset()}.
 *
 * @param <C> the nested cache type
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public final class LazyStatementCache<C extends AutoCloseable> {
	@NonNull
	private final Factory<C> factory;
	@Nullable
	private C cache;

	public LazyStatementCache(@NonNull Factory<C> factory) {
		requireNonNull(factory);
		this.factory = factory;
	}

	/**
	 * Creates the nested cache for a persistence context.
	 *
	 * @param <C> the nested cache type
	 */
	@FunctionalInterface
	public interface Factory<C> {
		@NonNull
		C create(@NonNull DatabaseConnection connection,
						 @NonNull Binding idBinding);
	}

	@NonNull
	public C get(@NonNull DatabaseConnection connection,
							 @NonNull Binding idBinding) {
		requireNonNull(connection);
		requireNonNull(idBinding);

		if (this.cache == null)
			this.cache = requireNonNull(getFactory().create(connection, idBinding));

		return this.cache;
	}

	@NonNull
	public Boolean isAllocated() {
		return this.cache != null;
	}

	/**
	 * Releases the nested cache if one is allocated. The holder forgets the cache before closing it, so a failing
	 * close is never retried.
	 */
	public void reset() {
		C cache = this.cache;

		if (cache == null)
			return;

		this.cache = null;

		try {
			cache.close();
		} catch (RuntimeException e) {
			throw e;
		} catch (Exception e) {
			throw new DatabaseException("Unable to release nested statement cache", e);
		}
	}

	@NonNull
	private Factory<C> getFactory() {
		return this.factory;
	}
}
