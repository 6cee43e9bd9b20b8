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

/**
 * Receives a {@link StatementLog} after every statement execution on a {@link DatabaseConnection}, successful or not.
 * <p>
 * Configured with {@link Database.Builder#statementLogger(StatementLogger)}. {@link DefaultStatementLogger} writes to
 * {@code java.util.logging}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
@FunctionalInterface
public interface StatementLogger {
	/**
	 * Called once per execution.
	 * <p>
	 * If this throws while the execution itself failed, the logger's exception is attached to the execution's as a
	 * suppressed exception; otherwise it propagates to the caller.
	 *
	 * @param statementLog what was executed, with what parameters, how long it took and how it ended
	 */
	void log(@NonNull StatementLog statementLog);
}
