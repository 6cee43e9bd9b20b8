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

/**
 * Oxbind is the per-connection persistence core of an object-relational runtime over JDBC.
 * <p>
 * For each mapped type a {@link com.oxbind.DatabaseConnection} holds one {@link com.oxbind.ObjectStatements}: the
 * type's row buffers ({@link com.oxbind.Image}), parameter bindings ({@link com.oxbind.Binding}) and the prepared
 * statements that insert, find, update and erase its rows. {@link com.oxbind.ObjectPersister} drives those statements.
 *
 * <pre>
 * Database database = Database.withDataSource(dataSource).build();
 *
 * try (DatabaseConnection connection = database.connect()) {
 *   ObjectPersister&lt;Employee, Long&gt; employees = connection.persister(EmployeeMapping.INSTANCE);
 *
 *   employees.persist(employee);
 *   Optional&lt;Employee&gt; found = employees.find(employee.getId());
 *   employees.update(found.get());
 *   employees.erase(employee.getId());
 * }
 * </pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
package com.oxbind;
