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

import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * {@link StatementLogger} that writes one line per execution through {@code java.util.logging}.
 * <p>
 * Successful executions are logged at {@code loggerLevel}, failed ones at {@code failureLevel}. Example output:
 * <pre>
 * UPDATE employee SET name = ?, manager_id = ? WHERE id = ? ['Ada', null, 2] (bound in 0.041ms, executed in 0.212ms, 1 row)
 * SELECT id, name, manager_id FROM employee WHERE id = ? [parameters current] (executed in 0.108ms)
 * </pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public class DefaultStatementLogger implements StatementLogger {
	@NonNull
	public static final String DEFAULT_LOGGER_NAME = "com.oxbind.SQL";
	@NonNull
	public static final Level DEFAULT_LOGGER_LEVEL = Level.FINE;
	@NonNull
	public static final Level DEFAULT_FAILURE_LEVEL = Level.FINE;

	private static final int MAXIMUM_PARAMETER_LOGGING_LENGTH = 100;

	@NonNull
	private final Logger logger;
	@NonNull
	private final Level loggerLevel;
	@NonNull
	private final Level failureLevel;

	public DefaultStatementLogger() {
		this(DEFAULT_LOGGER_NAME, DEFAULT_LOGGER_LEVEL, DEFAULT_FAILURE_LEVEL);
	}

	public DefaultStatementLogger(@NonNull String loggerName,
																@NonNull Level loggerLevel,
																@NonNull Level failureLevel) {
		requireNonNull(loggerName);
		requireNonNull(loggerLevel);
		requireNonNull(failureLevel);

		this.logger = Logger.getLogger(loggerName);
		this.loggerLevel = loggerLevel;
		this.failureLevel = failureLevel;
	}

	@Override
	public void log(@NonNull StatementLog statementLog) {
		requireNonNull(statementLog);

		Level level = statementLog.getException().isPresent() ? getFailureLevel() : getLoggerLevel();

		if (getLogger().isLoggable(level))
			getLogger().log(level, formatStatementLog(statementLog));
	}

	@NonNull
	protected String formatStatementLog(@NonNull StatementLog statementLog) {
		requireNonNull(statementLog);

		StringBuilder line = new StringBuilder(statementLog.getSql().replaceAll("\\s+", " ").trim());

		// No preparation time means the statement ran with the parameters it already had
		if (statementLog.getPreparationDuration().isEmpty())
			line.append(" [parameters current]");
		else if (statementLog.getParameters().size() > 0)
			line.append(statementLog.getParameters().stream().map(this::formatParameter).collect(joining(", ", " [", "]")));

		List<String> details = new ArrayList<>(3);

		statementLog.getPreparationDuration().ifPresent(duration -> details.add(format("bound in %s", formatDuration(duration))));
		statementLog.getExecutionDuration().ifPresent(duration -> details.add(format("executed in %s", formatDuration(duration))));
		statementLog.getRowCount().ifPresent(rowCount -> details.add(format("%d %s", rowCount, rowCount == 1 ? "row" : "rows")));

		if (details.size() > 0)
			line.append(details.stream().collect(joining(", ", " (", ")")));

		Throwable exception = statementLog.getException().orElse(null);

		if (exception != null) {
			if (exception instanceof DatabaseException && exception.getCause() != null)
				exception = exception.getCause();

			line.append(format(" failed: %s", exception));
		}

		return line.toString();
	}

	@NonNull
	protected String formatParameter(@Nullable Object parameter) {
		if (parameter == null)
			return "null";

		if (parameter instanceof Number || parameter instanceof Boolean)
			return parameter.toString();

		if (parameter instanceof byte[] bytes)
			return format("[%d bytes]", bytes.length);

		return format("'%s'", ellipsize(parameter.toString(), MAXIMUM_PARAMETER_LOGGING_LENGTH));
	}

	@NonNull
	protected String formatDuration(@NonNull Duration duration) {
		requireNonNull(duration);
		return format(Locale.ROOT, "%.3fms", duration.toNanos() / 1_000_000.0);
	}

	@NonNull
	protected String ellipsize(@NonNull String string,
														 int maximumLength) {
		requireNonNull(string);

		string = string.trim();

		if (string.length() <= maximumLength)
			return string;

		return format("%s...", string.substring(0, maximumLength));
	}

	@NonNull
	protected Logger getLogger() {
		return this.logger;
	}

	@NonNull
	protected Level getLoggerLevel() {
		return this.loggerLevel;
	}

	@NonNull
	protected Level getFailureLevel() {
		return this.failureLevel;
	}
}
