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

import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Contract for binding a {@link Bind} slot's value to a {@link PreparedStatement} parameter.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@FunctionalInterface
public interface PreparedStatementBinder {
	/**
	 * Binds a single slot to the given parameter index.
	 *
	 * @param preparedStatement the prepared statement to bind to
	 * @param parameterIndex    1-based parameter index
	 * @param bind              the slot whose current value should be bound; its value may be {@code null}
	 * @throws SQLException if an error occurs during binding
	 */
	void bindParameter(@NonNull PreparedStatement preparedStatement,
										 @NonNull Integer parameterIndex,
										 @NonNull Bind bind) throws SQLException;

	/**
	 * Acquires a binder with reasonable defaults.
	 *
	 * @return a {@code PreparedStatementBinder} with default settings
	 */
	@NonNull
	static PreparedStatementBinder withDefaultConfiguration() {
		return new DefaultPreparedStatementBinder();
	}
}
