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

import javax.annotation.concurrent.ThreadSafe;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * Basic implementation of {@link PreparedStatementBinder}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
class DefaultPreparedStatementBinder implements PreparedStatementBinder {
	@Override
	public void bindParameter(@NonNull PreparedStatement preparedStatement,
														@NonNull Integer parameterIndex,
														@NonNull Bind bind) throws SQLException {
		requireNonNull(preparedStatement);
		requireNonNull(parameterIndex);
		requireNonNull(bind);

		Object value = bind.getValue();
		int sqlType = bind.getSqlType();

		if (value == null) {
			preparedStatement.setNull(parameterIndex, sqlType == Types.OTHER ? Types.NULL : sqlType);
			return;
		}

		if (value instanceof Enum<?> enumValue) {
			preparedStatement.setString(parameterIndex, enumValue.name());
			return;
		}

		if (value instanceof UUID uuid) {
			preparedStatement.setString(parameterIndex, uuid.toString());
			return;
		}

		if (value instanceof Instant instant) {
			preparedStatement.setTimestamp(parameterIndex, Timestamp.from(instant));
			return;
		}

		if (value instanceof OffsetDateTime offsetDateTime) {
			preparedStatement.setTimestamp(parameterIndex, Timestamp.from(offsetDateTime.toInstant()));
			return;
		}

		if (value instanceof LocalDateTime localDateTime) {
			preparedStatement.setTimestamp(parameterIndex, Timestamp.valueOf(localDateTime));
			return;
		}

		if (value instanceof LocalDate localDate) {
			preparedStatement.setDate(parameterIndex, java.sql.Date.valueOf(localDate));
			return;
		}

		if (value instanceof LocalTime localTime) {
			// Some drivers used to offset LocalTime; safest is a tz-free string.
			preparedStatement.setString(parameterIndex, localTime.toString());
			return;
		}

		if (sqlType == Types.OTHER)
			preparedStatement.setObject(parameterIndex, value);
		else
			preparedStatement.setObject(parameterIndex, value, sqlType);
	}
}
