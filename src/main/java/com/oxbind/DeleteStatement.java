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
 * A prepared {@code DELETE}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public class DeleteStatement extends Statement {
	public DeleteStatement(@NonNull DatabaseConnection connection,
												 @NonNull String sql,
												 @NonNull Binding parameterBinding) {
		super(connection, sql, parameterBinding);
	}

	/**
	 * @return the number of rows deleted; zero for a version-checked delete whose expected version no longer matches
	 */
	public long execute() {
		try {
			return executeUpdate();
		} catch (SQLException e) {
			throw new DatabaseException(format("Unable to execute delete: %s", getSql()), e);
		}
	}
}
