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

import com.oxbind.MappingFixtures.Author;
import com.oxbind.MappingFixtures.AuthorMapping;
import com.oxbind.MappingFixtures.Document;
import com.oxbind.MappingFixtures.DocumentMapping;
import com.oxbind.MappingFixtures.Employee;
import com.oxbind.MappingFixtures.EmployeeMapping;
import org.jspecify.annotations.NonNull;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.sql.Types;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
public class ObjectStatementsTests {
	@Test
	public void testStatementsCreatedOnceAndReused() {
		try (DatabaseConnection connection = MappingFixtures.createDatabase("statements_once").connect()) {
			ObjectStatements<Employee, Long> statements = connection.objectStatements(EmployeeMapping.INSTANCE);

			Assertions.assertSame(statements, connection.objectStatements(EmployeeMapping.INSTANCE));
			Assertions.assertSame(statements.persistStatement(), statements.persistStatement());
			Assertions.assertSame(statements.findStatement(), statements.findStatement());
			Assertions.assertSame(statements.updateStatement(), statements.updateStatement());
			Assertions.assertSame(statements.eraseStatement(), statements.eraseStatement());
		}
	}

	@Test
	public void testCloseReleasesStatements() {
		try (DatabaseConnection connection = MappingFixtures.createDatabase("statements_close").connect()) {
			ObjectStatements<Employee, Long> statements = connection.objectStatements(EmployeeMapping.INSTANCE);
			SelectStatement find = statements.findStatement();
			InsertStatement persist = statements.persistStatement();

			statements.close();
			statements.close();

			Assertions.assertTrue(find.isClosed());
			Assertions.assertTrue(persist.isClosed());
		}
	}

	@Test
	public void testClosedStatementsRejectUse() {
		try (DatabaseConnection connection = MappingFixtures.createDatabase("statements_closed").connect()) {
			ObjectStatements<Employee, Long> statements = connection.objectStatements(EmployeeMapping.INSTANCE);
			ContainerStatements<Employee, ?> nicknames = statements.containerStatementCache().getContainerStatements().get(0);

			statements.persistStatement();
			nicknames.insertStatement();

			statements.close();

			Assertions.assertTrue(statements.isClosed());
			Assertions.assertTrue(nicknames.isClosed());
			Assertions.assertThrows(IllegalStateException.class, statements::persistStatement);
			Assertions.assertThrows(IllegalStateException.class, statements::findStatement);
			Assertions.assertThrows(IllegalStateException.class, statements::updateStatement);
			Assertions.assertThrows(IllegalStateException.class, statements::eraseStatement);
			Assertions.assertThrows(IllegalStateException.class, statements::containerStatementCache);
			Assertions.assertThrows(IllegalStateException.class, statements::lock);
			Assertions.assertThrows(IllegalStateException.class,
					() -> statements.delayLoad(1L, new Employee(), CachePosition.NONE, null));
			Assertions.assertThrows(IllegalStateException.class, nicknames::insertStatement);
			Assertions.assertThrows(IllegalStateException.class, nicknames::selectStatement);
			Assertions.assertThrows(IllegalStateException.class, nicknames::deleteStatement);
			Assertions.assertFalse(statements.hasDelayedLoads());
		}
	}

	@Test
	public void testClosedOptimisticStatementsRejectUse() {
		try (DatabaseConnection connection = MappingFixtures.createDatabase("statements_closed_optimistic").connect()) {
			OptimisticObjectStatements<Document, Long> statements = connection.objectStatements(DocumentMapping.INSTANCE);
			DeleteStatement optimisticErase = statements.optimisticEraseStatement();

			statements.close();

			Assertions.assertTrue(optimisticErase.isClosed());
			Assertions.assertThrows(IllegalStateException.class, statements::optimisticEraseStatement);
			Assertions.assertThrows(IllegalStateException.class, statements::updateStatement);
		}
	}

	@Test
	public void testOptimisticMappingSelectsOptimisticStatements() {
		try (DatabaseConnection connection = MappingFixtures.createDatabase("statements_optimistic").connect()) {
			ObjectMapping<Document, Long> plainView = DocumentMapping.INSTANCE;

			OptimisticObjectStatements<Document, Long> optimistic = connection.objectStatements(DocumentMapping.INSTANCE);
			ObjectStatements<Document, Long> viaPlainOverload = connection.objectStatements(plainView);

			Assertions.assertSame(optimistic, viaPlainOverload);
			Assertions.assertEquals(1, optimistic.getManagedOptimisticColumnCount());
			Assertions.assertEquals(2, optimistic.getIdImage().getColumnCount());
			Assertions.assertEquals(2, optimistic.getOptimisticIdImageBinding().size());
			Assertions.assertEquals(1, optimistic.getIdImageBinding().size());
			Assertions.assertEquals(3, optimistic.getUpdateImageBinding().size());
		}
	}

	@Test
	public void testVersionColumnRequiresOptimisticMapping() {
		ObjectMapping<Document, Long> unversioned = new ForwardingMapping<>(DocumentMapping.INSTANCE);

		try (DatabaseConnection connection = MappingFixtures.createDatabase("statements_unversioned").connect()) {
			Assertions.assertThrows(IllegalArgumentException.class, () -> new ObjectStatements<>(connection, unversioned));
		}
	}

	@Test
	public void testBindingLayout() {
		try (DatabaseConnection connection = MappingFixtures.createDatabase("statements_layout").connect()) {
			ObjectStatements<Author, Long> statements = connection.objectStatements(AuthorMapping.INSTANCE);

			Assertions.assertEquals(5, statements.getSelectImageBinding().size());
			Assertions.assertEquals(4, statements.getInsertImageBinding().size());
			Assertions.assertEquals(3, statements.getUpdateImageBinding().size());
			Assertions.assertEquals(1, statements.getIdImageBinding().size());

			// The id binding is the tail of the update binding
			Assertions.assertSame(statements.getUpdateImageBinding().get(2), statements.getIdImageBinding().get(0));
			Assertions.assertSame(statements.getIdImage(), statements.getIdImageBinding().get(0).getImage());
			Assertions.assertEquals(1, statements.getUpdateImageBinding().get(0).getColumn());
			Assertions.assertEquals(2, statements.getUpdateImageBinding().get(1).getColumn());
			Assertions.assertEquals(Types.DATE, statements.getInsertImageBinding().get(3).getSqlType());
		}
	}

	@Test
	public void testStaleBindingRefreshedOnlyWhenImageChanges() {
		try (DatabaseConnection connection = MappingFixtures.createDatabase("statements_refresh").connect()) {
			ObjectStatements<Author, Long> statements = connection.objectStatements(AuthorMapping.INSTANCE);
			Binding insertBinding = statements.getInsertImageBinding();

			AuthorMapping.INSTANCE.initImage(statements.getImage(), new Author(1L, "Le Guin", "ursula@example.com", null));
			statements.refreshInsertImageBinding();

			Assertions.assertEquals(1, insertBinding.getVersion());
			Assertions.assertEquals(statements.getImage().getVersion(), statements.getInsertImageVersion());
			Assertions.assertEquals(List.of(1L, "Le Guin", "ursula@example.com"), insertBinding.getValues().subList(0, 3));

			statements.refreshInsertImageBinding();
			Assertions.assertEquals(1, insertBinding.getVersion(), "Unchanged image must not bump the binding version");

			statements.getImage().set(1, "Butler");
			statements.refreshInsertImageBinding();

			Assertions.assertEquals(2, insertBinding.getVersion());
			Assertions.assertEquals("Butler", insertBinding.get(1).getValue());
		}
	}

	@Test
	public void testUpdateBindingTracksBothImages() {
		try (DatabaseConnection connection = MappingFixtures.createDatabase("statements_update_refresh").connect()) {
			ObjectStatements<Author, Long> statements = connection.objectStatements(AuthorMapping.INSTANCE);
			Binding updateBinding = statements.getUpdateImageBinding();

			AuthorMapping.INSTANCE.initImage(statements.getImage(), new Author(1L, "Le Guin", null, null));
			AuthorMapping.INSTANCE.initIdImage(statements.getIdImage(), 1L);
			statements.refreshUpdateImageBinding();

			Assertions.assertEquals(1, updateBinding.getVersion());

			AuthorMapping.INSTANCE.initIdImage(statements.getIdImage(), 2L);
			statements.refreshUpdateImageBinding();

			Assertions.assertEquals(2, updateBinding.getVersion(), "Id image change alone must refresh the update binding");
			Assertions.assertEquals(List.of("Le Guin", 2L), Arrays.asList(updateBinding.get(0).getValue(), updateBinding.get(2).getValue()));
			Assertions.assertEquals(statements.getIdImage().getVersion(), statements.getUpdateIdImageVersion());
		}
	}

	@Test
	public void testParametersReappliedOnlyWhenBindingVersionChanges() {
		AtomicInteger boundParameters = new AtomicInteger();
		PreparedStatementBinder defaultBinder = PreparedStatementBinder.withDefaultConfiguration();

		Database database = Database.withDataSource(MappingFixtures.createSchemaDataSource("statements_rebind"))
				.preparedStatementBinder((preparedStatement, parameterIndex, bind) -> {
					boundParameters.incrementAndGet();
					defaultBinder.bindParameter(preparedStatement, parameterIndex, bind);
				})
				.build();

		try (DatabaseConnection connection = database.connect()) {
			MappingFixtures.execute(connection, "INSERT INTO author (id, name, email, created_on) VALUES (1, 'Le Guin', NULL, NULL)");

			ObjectStatements<Author, Long> statements = connection.objectStatements(AuthorMapping.INSTANCE);

			Assertions.assertTrue(statements.findRow(1L));
			statements.initObjectFromFoundRow(new Author());
			Assertions.assertEquals(1, boundParameters.get());

			Assertions.assertTrue(statements.findRow(1L));
			statements.initObjectFromFoundRow(new Author());
			Assertions.assertEquals(2, boundParameters.get(), "Re-setting the id image bumps its version");

			// Execute directly with the current binding: nothing to rebind
			SelectStatement find = statements.findStatement();
			find.execute();
			find.freeResult();
			Assertions.assertEquals(2, boundParameters.get());
		}
	}

	@Test
	public void testFindRowPopulatesImage() {
		try (DatabaseConnection connection = MappingFixtures.createDatabase("statements_find_row").connect()) {
			MappingFixtures.execute(connection, "INSERT INTO author (id, name, email, created_on) VALUES (1, 'Le Guin', 'ursula@example.com', DATE '1969-03-01')");
			MappingFixtures.execute(connection, "INSERT INTO book (id, author_id) VALUES (10, 1)");
			MappingFixtures.execute(connection, "INSERT INTO book (id, author_id) VALUES (11, 1)");

			ObjectStatements<Author, Long> statements = connection.objectStatements(AuthorMapping.INSTANCE);

			Assertions.assertTrue(statements.findRow(1L));
			Assertions.assertTrue(statements.findStatement().isActive());
			Assertions.assertEquals(statements.getImage().getVersion(), statements.getSelectImageVersion());

			Author author = new Author();
			statements.initObjectFromFoundRow(author);

			Assertions.assertFalse(statements.findStatement().isActive());
			Assertions.assertEquals("Le Guin", author.getName());
			Assertions.assertEquals(LocalDate.of(1969, 3, 1), author.getCreatedOn());
			Assertions.assertEquals(2L, author.getBookCount());

			Assertions.assertFalse(statements.findRow(2L));
			Assertions.assertFalse(statements.findStatement().isActive());
		}
	}

	@Test
	public void testExecuteWithActiveResultFails() {
		try (DatabaseConnection connection = MappingFixtures.createDatabase("statements_active").connect()) {
			MappingFixtures.execute(connection, "INSERT INTO author (id, name, email, created_on) VALUES (1, 'Le Guin', NULL, NULL)");

			ObjectStatements<Author, Long> statements = connection.objectStatements(AuthorMapping.INSTANCE);

			Assertions.assertTrue(statements.findRow(1L));
			Assertions.assertThrows(IllegalStateException.class, () -> statements.findStatement().execute());

			statements.findStatement().freeResult();
			statements.findStatement().freeResult();
		}
	}

	@Test
	public void testStatementLoggerReceivesExecutions() {
		List<StatementLog> statementLogs = new ArrayList<>();

		Database database = Database.withDataSource(MappingFixtures.createSchemaDataSource("statements_logging"))
				.statementLogger(statementLogs::add)
				.build();

		try (DatabaseConnection connection = database.connect()) {
			ObjectPersister<Author, Long> authors = connection.persister(AuthorMapping.INSTANCE);
			authors.persist(new Author(1L, "Le Guin", null, null));

			Assertions.assertEquals(1, statementLogs.size());
			Assertions.assertEquals(AuthorMapping.INSTANCE.getPersistSql(), statementLogs.get(0).getSql());
			Assertions.assertEquals(1L, statementLogs.get(0).getRowCount().orElse(null));
			Assertions.assertEquals(List.of(1L, "Le Guin"), statementLogs.get(0).getParameters().subList(0, 2));
		}
	}

	@Test
	public void testStatementLoggerFailureSuppressedWhenOperationFails() {
		RuntimeException loggerFailure = new RuntimeException("logger failed");

		Database database = Database.withDataSource(MappingFixtures.createSchemaDataSource("statements_logger_failure"))
				.statementLogger(statementLog -> {
					throw loggerFailure;
				})
				.build();

		try (DatabaseConnection connection = database.connect()) {
			MappingFixtures.execute(connection, "DROP TABLE author");

			ObjectStatements<Author, Long> statements = connection.objectStatements(AuthorMapping.INSTANCE);

			// Preparing against a missing table fails before anything is logged
			Assertions.assertThrows(DatabaseException.class, statements::findStatement);

			MappingFixtures.execute(connection, "INSERT INTO employee (id, name, manager_id) VALUES (1, 'Ada', NULL)");

			ObjectStatements<Employee, Long> employees = connection.objectStatements(EmployeeMapping.INSTANCE);
			UpdateStatement update = employees.updateStatement();

			// name is NOT NULL
			EmployeeMapping.INSTANCE.initImage(employees.getImage(), new Employee(1L, "Ada", null));
			employees.getImage().set(1, null);
			EmployeeMapping.INSTANCE.initIdImage(employees.getIdImage(), 1L);
			employees.refreshUpdateImageBinding();

			DatabaseException exception = Assertions.assertThrows(DatabaseException.class, update::execute);

			Assertions.assertTrue(exception.isIntegrityConstraintViolation());

			Assertions.assertTrue(Arrays.stream(exception.getCause().getSuppressed()).anyMatch(suppressed -> suppressed == loggerFailure),
					"Expected statement logger failure to be suppressed");
		}
	}

	/**
	 * Exposes an optimistic mapping through the plain interface only.
	 */
	private static class ForwardingMapping<T, I> implements ObjectMapping<T, I> {
		@NonNull
		private final ObjectMapping<T, I> delegate;

		ForwardingMapping(@NonNull ObjectMapping<T, I> delegate) {
			this.delegate = delegate;
		}

		@Override
		@NonNull
		public Class<T> getObjectType() {
			return this.delegate.getObjectType();
		}

		@Override
		@NonNull
		public List<Column> getColumns() {
			return this.delegate.getColumns();
		}

		@Override
		@NonNull
		public String getPersistSql() {
			return this.delegate.getPersistSql();
		}

		@Override
		@NonNull
		public String getFindSql() {
			return this.delegate.getFindSql();
		}

		@Override
		@NonNull
		public String getUpdateSql() {
			return this.delegate.getUpdateSql();
		}

		@Override
		@NonNull
		public String getEraseSql() {
			return this.delegate.getEraseSql();
		}

		@Override
		@NonNull
		public T newInstance() {
			return this.delegate.newInstance();
		}

		@Override
		@NonNull
		public I getId(@NonNull T object) {
			return this.delegate.getId(object);
		}

		@Override
		public void initImage(@NonNull Image image,
													@NonNull T object) {
			this.delegate.initImage(image, object);
		}

		@Override
		public void initObject(@NonNull T object,
													 @NonNull Image image,
													 @NonNull DatabaseConnection connection) {
			this.delegate.initObject(object, image, connection);
		}

		@Override
		public void initIdImage(@NonNull Image idImage,
														@NonNull I id) {
			this.delegate.initIdImage(idImage, id);
		}
	}
}
