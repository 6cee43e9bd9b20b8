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
import java.sql.SQLException;

import static java.lang.String.format;

/**
 * A prepared {@code INSERT}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public class InsertStatement extends Statement {
	public InsertStatement(@NonNull DatabaseConnection connection,
												 @NonNull String sql,
												 @NonNull Binding parameterBinding) {
		super(connection, sql, parameterBinding);
	}

	/**
	 * Inserts one row from the current parameter binding.
	 *
	 * @return {@code true} if the row was inserted, {@code false} if it violates an integrity constraint (for example, a
	 * duplicate primary key)
	 * @throws DatabaseException if the insert fails for any other reason
	 */
	@NonNull
	public Boolean execute() {
		try {
			executeUpdate();
			return true;
		} catch (SQLException e) {
			if (DatabaseException.isIntegrityConstraintViolation(e)) {
				getLogger().finer(format("Insert rejected by integrity constraint (SQLState %s)", e.getSQLState()));
				return false;
			}

			throw new DatabaseException(format("Unable to execute insert: %s", getSql()), e);
		}
	}
}
