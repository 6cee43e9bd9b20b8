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
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;

/**
 * Thrown when a statement, connection or mapping operation fails.
 * <p>
 * If a {@link SQLException} appears anywhere in the cause chain, {@link #getErrorCode()} and {@link #getSqlState()}
 * expose its values.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public class DatabaseException extends RuntimeException {
	/**
	 * SQLState class for integrity constraint violations.
	 */
	@NonNull
	private static final String INTEGRITY_CONSTRAINT_VIOLATION_CLASS = "23";

	@Nullable
	private final Integer errorCode;
	@Nullable
	private final String sqlState;

	public DatabaseException(@Nullable String message) {
		this(message, null);
	}

	public DatabaseException(@Nullable Throwable cause) {
		this(cause == null ? null : cause.getMessage(), cause);
	}

	public DatabaseException(@Nullable String message,
													 @Nullable Throwable cause) {
		super(message, cause);

		SQLException sqlException = findSqlException(cause).orElse(null);

		this.errorCode = sqlException == null ? null : sqlException.getErrorCode();
		this.sqlState = sqlException == null ? null : sqlException.getSQLState();
	}

	/**
	 * Does {@code sqlException} report an integrity constraint violation, such as a duplicate key or a {@code NULL} in a
	 * {@code NOT NULL} column?
	 *
	 * @param sqlException the exception to inspect
	 * @return {@code true} if its SQLState is in class {@code 23}
	 */
	@NonNull
	public static Boolean isIntegrityConstraintViolation(@NonNull SQLException sqlException) {
		String sqlState = sqlException.getSQLState();
		return sqlState != null && sqlState.startsWith(INTEGRITY_CONSTRAINT_VIOLATION_CLASS);
	}

	/**
	 * Was this exception caused by an integrity constraint violation?
	 *
	 * @return {@code true} if the underlying SQLState is in class {@code 23}
	 */
	@NonNull
	public Boolean isIntegrityConstraintViolation() {
		return this.sqlState != null && this.sqlState.startsWith(INTEGRITY_CONSTRAINT_VIOLATION_CLASS);
	}

	@NonNull
	private static Optional<SQLException> findSqlException(@Nullable Throwable cause) {
		// Bounded walk in case of a self-referencing cause chain
		for (int depth = 0; cause != null && depth < 16; ++depth, cause = cause.getCause())
			if (cause instanceof SQLException sqlException)
				return Optional.of(sqlException);

		return Optional.empty();
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(3);

		if (getMessage() != null && getMessage().trim().length() > 0)
			components.add(format("message=%s", getMessage()));

		if (getErrorCode().isPresent())
			components.add(format("errorCode=%s", getErrorCode().get()));
		if (getSqlState().isPresent())
			components.add(format("sqlState=%s", getSqlState().get()));

		return format("%s: %s", getClass().getName(), components.stream().collect(Collectors.joining(", ")));
	}

	/**
	 * Shorthand for {@link SQLException#getErrorCode()} of the first {@link SQLException} in the cause chain.
	 *
	 * @return the error code, or empty if not available
	 */
	@NonNull
	public Optional<Integer> getErrorCode() {
		return Optional.ofNullable(this.errorCode);
	}

	/**
	 * Shorthand for {@link SQLException#getSQLState()} of the first {@link SQLException} in the cause chain.
	 *
	 * @return the SQLState, or empty if not available
	 */
	@NonNull
	public Optional<String> getSqlState() {
		return Optional.ofNullable(this.sqlState);
	}
}
