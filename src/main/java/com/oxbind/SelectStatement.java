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
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;

import static java.lang.String.format;
import static java.lang.System.nanoTime;
import static java.util.Objects.requireNonNull;

/**
 * A prepared {@code SELECT} whose rows are stored into a result {@link Binding}.
 * <p>
 * Only one result may be active per statement: {@link #execute()} while a previous result is still open is a caller
 * bug and fails immediately rather than silently discarding the open cursor.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public class SelectStatement extends Statement {
	@NonNull
	private final Binding resultBinding;
	@Nullable
	private ResultSet resultSet;

	public SelectStatement(@NonNull DatabaseConnection connection,
												 @NonNull String sql,
												 @NonNull Binding parameterBinding,
												 @NonNull Binding resultBinding) {
		super(connection, sql, parameterBinding);
		this.resultBinding = requireNonNull(resultBinding);
	}

	/**
	 * Outcome of a {@link #fetch()}.
	 */
	public enum FetchResult {
		SUCCESS,
		NO_DATA
	}

	/**
	 * Executes the query, leaving its result active until {@link #freeResult()}.
	 *
	 * @throws IllegalStateException if this statement already has an active result
	 */
	public void execute() {
		if (this.resultSet != null)
			throw new IllegalStateException(format("Statement already has an active result: %s", getSql()));

		Duration preparationDuration = null;
		Duration executionDuration = null;
		Exception exception = null;

		try {
			preparationDuration = bindParameters();

			long startTime = nanoTime();
			this.resultSet = getPreparedStatement().executeQuery();
			executionDuration = Duration.ofNanos(nanoTime() - startTime);
		} catch (SQLException e) {
			exception = e;
			throw new DatabaseException(format("Unable to execute query: %s", getSql()), e);
		} catch (RuntimeException e) {
			exception = e;
			throw e;
		} finally {
			log(preparationDuration, executionDuration, null, exception);
		}
	}

	/**
	 * Advances to the next row and stores its columns into the result binding's image.
	 *
	 * @return {@link FetchResult#SUCCESS} if a row was stored, {@link FetchResult#NO_DATA} if the result is exhausted
	 * @throws IllegalStateException if there is no active result
	 */
	@NonNull
	public FetchResult fetch() {
		ResultSet resultSet = this.resultSet;

		if (resultSet == null)
			throw new IllegalStateException(format("Statement has no active result: %s", getSql()));

		try {
			if (!resultSet.next())
				return FetchResult.NO_DATA;

			Binding resultBinding = getResultBinding();

			for (int i = 0; i < resultBinding.size(); ++i) {
				Object value = resultSet.getObject(i + 1);
				resultBinding.get(i).store(resultSet.wasNull() ? null : value);
			}

			return FetchResult.SUCCESS;
		} catch (SQLException e) {
			throw new DatabaseException(format("Unable to fetch row: %s", getSql()), e);
		}
	}

	/**
	 * Closes the active result, if any. Safe to call repeatedly.
	 */
	public void freeResult() {
		ResultSet resultSet = this.resultSet;

		if (resultSet == null)
			return;

		this.resultSet = null;

		try {
			resultSet.close();
		} catch (SQLException e) {
			throw new DatabaseException(format("Unable to close result: %s", getSql()), e);
		}
	}

	@NonNull
	public Boolean isActive() {
		return this.resultSet != null;
	}

	@Override
	public void close() {
		try {
			freeResult();
		} finally {
			super.close();
		}
	}

	@NonNull
	public Binding getResultBinding() {
		return this.resultBinding;
	}
}
