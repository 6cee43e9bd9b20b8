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
 * Base for the statement groups owned by a {@link DatabaseConnection}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public abstract class StatementsBase implements AutoCloseable {
	@NonNull
	private final DatabaseConnection connection;

	protected StatementsBase(@NonNull DatabaseConnection connection) {
		requireNonNull(connection);
		this.connection = connection;
	}

	/**
	 * Closes every statement this group created.
	 */
	@Override
	public abstract void close();

	/**
	 * Closes each non-null statement, closing the rest even if one fails. The first failure is rethrown with any later
	 * ones suppressed.
	 *
	 * @param statements the statements to close
	 */
	protected static void closeAll(@Nullable Statement... statements) {
		if (statements == null)
			return;

		RuntimeException failure = null;

		for (Statement statement : statements) {
			if (statement == null)
				continue;

			try {
				statement.close();
			} catch (RuntimeException e) {
				if (failure == null)
					failure = e;
				else
					failure.addSuppressed(e);
			}
		}

		if (failure != null)
			throw failure;
	}

	@NonNull
	public DatabaseConnection getConnection() {
		return this.connection;
	}
}
