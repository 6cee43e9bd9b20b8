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
import com.oxbind.MappingFixtures.Employee;
import com.oxbind.MappingFixtures.EmployeeMapping;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
public class ObjectPersisterTests {
	@Test
	public void testPersistFindUpdateErase() {
		try (DatabaseConnection connection = MappingFixtures.createDatabase("persister_crud").connect()) {
			ObjectPersister<Author, Long> authors = connection.persister(AuthorMapping.INSTANCE);

			authors.persist(new Author(1L, "Le Guin", "ursula@example.com", LocalDate.of(1969, 3, 1)));
			MappingFixtures.execute(connection, "INSERT INTO book (id, author_id) VALUES (10, 1)");

			Author author = authors.find(1L).orElse(null);

			Assertions.assertNotNull(author);
			Assertions.assertEquals("Le Guin", author.getName());
			Assertions.assertEquals("ursula@example.com", author.getEmail());
			Assertions.assertEquals(LocalDate.of(1969, 3, 1), author.getCreatedOn());
			Assertions.assertEquals(1L, author.getBookCount());

			author.setName("Ursula K. Le Guin");
			author.setEmail(null);
			author.setCreatedOn(LocalDate.of(2000, 1, 1));

			Assertions.assertTrue(authors.update(author));

			Author updated = authors.find(1L).orElseThrow();

			Assertions.assertEquals("Ursula K. Le Guin", updated.getName());
			Assertions.assertNull(updated.getEmail());
			Assertions.assertEquals(LocalDate.of(1969, 3, 1), updated.getCreatedOn(), "Read-only column must not be updated");

			authors.eraseById(1L);

			Assertions.assertTrue(authors.find(1L).isEmpty());
			Assertions.assertFalse(authors.getStatements().isLocked());
		}
	}

	@Test
	public void testPersistDuplicateFails() {
		try (DatabaseConnection connection = MappingFixtures.createDatabase("persister_duplicate").connect()) {
			ObjectPersister<Author, Long> authors = connection.persister(AuthorMapping.INSTANCE);

			authors.persist(new Author(1L, "Le Guin", null, null));

			Assertions.assertThrows(ObjectAlreadyPersistentException.class, () -> authors.persist(new Author(1L, "Butler", null, null)));

			// Context remains usable
			authors.persist(new Author(2L, "Butler", null, null));
			Assertions.assertEquals("Butler", authors.find(2L).orElseThrow().getName());
		}
	}

	@Test
	public void testMissingObjects() {
		try (DatabaseConnection connection = MappingFixtures.createDatabase("persister_missing").connect()) {
			ObjectPersister<Author, Long> authors = connection.persister(AuthorMapping.INSTANCE);

			Assertions.assertTrue(authors.find(42L).isEmpty());
			Assertions.assertThrows(ObjectNotPersistentException.class, () -> authors.update(new Author(42L, "Nobody", null, null)));
			Assertions.assertThrows(ObjectNotPersistentException.class, () -> authors.eraseById(42L));
			Assertions.assertThrows(ObjectNotPersistentException.class, () -> authors.load(42L, new Author()));
			Assertions.assertFalse(authors.getStatements().isLocked());
		}
	}

	@Test
	public void testSameTypeReferencesLoadedThroughDelayedLoads() {
		try (DatabaseConnection connection = MappingFixtures.createDatabase("persister_references").connect()) {
			ObjectPersister<Employee, Long> employees = connection.persister(EmployeeMapping.INSTANCE);

			Employee grace = new Employee(1L, "Grace", null);
			Employee ada = new Employee(2L, "Ada", grace);
			Employee bob = new Employee(3L, "Bob", ada);

			employees.persist(grace);
			employees.persist(ada);
			employees.persist(bob);

			Employee found = employees.find(3L).orElseThrow();

			Assertions.assertEquals("Bob", found.getName());
			Assertions.assertNotNull(found.getManager());
			Assertions.assertEquals("Ada", found.getManager().getName());
			Assertions.assertNotNull(found.getManager().getManager());
			Assertions.assertEquals("Grace", found.getManager().getManager().getName());
			Assertions.assertNull(found.getManager().getManager().getManager());

			Assertions.assertFalse(employees.getStatements().isLocked());
			Assertions.assertFalse(employees.getStatements().hasDelayedLoads());
		}
	}

	@Test
	public void testFindWhileLockedDefersLoad() {
		try (DatabaseConnection connection = MappingFixtures.createDatabase("persister_deferred").connect()) {
			ObjectPersister<Employee, Long> employees = connection.persister(EmployeeMapping.INSTANCE);
			ObjectStatements<Employee, Long> statements = employees.getStatements();

			employees.persist(new Employee(1L, "Grace", null));

			statements.lock();

			Employee deferred = employees.find(1L).orElseThrow();

			Assertions.assertNull(deferred.getName(), "Load should be queued, not performed");
			Assertions.assertTrue(statements.hasDelayedLoads());

			statements.loadDelayed();
			statements.unlock();

			Assertions.assertEquals("Grace", deferred.getName());
		}
	}

	@Test
	public void testEagerLoaderResolvesReferencesBeforeReturning() {
		try (DatabaseConnection connection = MappingFixtures.createDatabase("persister_eager").connect()) {
			ObjectPersister<Employee, Long> employees = connection.persister(EmployeeMapping.INSTANCE);
			ObjectStatements<Employee, Long> statements = employees.getStatements();

			employees.persist(new Employee(1L, "Grace", null));
			employees.persist(new Employee(2L, "Ada", new Employee(1L, "Grace", null)));

			Employee ada = new Employee();

			statements.lock();
			statements.delayLoad(2L, ada, CachePosition.NONE, employees.eagerLoader());
			statements.loadDelayed();

			Assertions.assertTrue(statements.isLocked(), "Eager loader must hand the lock back");
			Assertions.assertFalse(statements.hasDelayedLoads(), "Eager loader drains its own references");

			statements.unlock();

			Assertions.assertEquals("Ada", ada.getName());
			Assertions.assertEquals("Grace", requireNonNull(ada.getManager()).getName());
		}
	}

	@Test
	public void testLoadIntoExistingInstance() {
		try (DatabaseConnection connection = MappingFixtures.createDatabase("persister_load").connect()) {
			ObjectPersister<Author, Long> authors = connection.persister(AuthorMapping.INSTANCE);

			authors.persist(new Author(1L, "Le Guin", null, null));

			Author author = new Author();
			authors.load(1L, author);

			Assertions.assertEquals(1L, author.getId());
			Assertions.assertEquals("Le Guin", author.getName());
			Assertions.assertEquals(0L, author.getBookCount());
		}
	}

	@Test
	public void testContainers() {
		try (DatabaseConnection connection = MappingFixtures.createDatabase("persister_containers").connect()) {
			ObjectPersister<Employee, Long> employees = connection.persister(EmployeeMapping.INSTANCE);

			Employee ada = new Employee(1L, "Ada", null);
			ada.setNicknames(new ArrayList<>(List.of("Countess", "Enchantress of Number")));
			employees.persist(ada);

			Employee other = new Employee(2L, "Grace", null);
			other.setNicknames(new ArrayList<>(List.of("Amazing Grace")));
			employees.persist(other);

			Assertions.assertEquals(List.of("Countess", "Enchantress of Number"), employees.find(1L).orElseThrow().getNicknames());
			Assertions.assertEquals(List.of("Amazing Grace"), employees.find(2L).orElseThrow().getNicknames());

			ada.setNicknames(new ArrayList<>(List.of("Lady Lovelace")));
			employees.update(ada);

			Assertions.assertEquals(List.of("Lady Lovelace"), employees.find(1L).orElseThrow().getNicknames());

			employees.eraseById(1L);

			Assertions.assertEquals(0L, MappingFixtures.count(connection, "SELECT COUNT(*) FROM employee_nickname WHERE employee_id = 1"));
			Assertions.assertEquals(1L, MappingFixtures.count(connection, "SELECT COUNT(*) FROM employee_nickname WHERE employee_id = 2"));
		}
	}

	@Test
	public void testReferencedObjectsLoadTheirContainers() {
		try (DatabaseConnection connection = MappingFixtures.createDatabase("persister_reference_containers").connect()) {
			ObjectPersister<Employee, Long> employees = connection.persister(EmployeeMapping.INSTANCE);

			Employee grace = new Employee(1L, "Grace", null);
			grace.setNicknames(new ArrayList<>(List.of("Amazing Grace")));
			employees.persist(grace);
			employees.persist(new Employee(2L, "Ada", grace));

			Employee ada = employees.find(2L).orElseThrow();

			Assertions.assertTrue(ada.getNicknames().isEmpty());
			Assertions.assertEquals(List.of("Amazing Grace"), requireNonNull(ada.getManager()).getNicknames());
		}
	}

	@Test
	public void testConnectionCloseReleasesEverything() {
		DatabaseConnection connection = MappingFixtures.createDatabase("persister_close").connect();
		ObjectPersister<Employee, Long> employees = connection.persister(EmployeeMapping.INSTANCE);

		employees.persist(new Employee(1L, "Ada", null));
		employees.find(1L);

		SelectStatement find = employees.getStatements().findStatement();
		ContainerStatementCache<Employee> containerStatementCache = employees.getStatements().containerStatementCache();

		connection.close();
		connection.close();

		Assertions.assertTrue(connection.isClosed());
		Assertions.assertTrue(find.isClosed());
		Assertions.assertTrue(containerStatementCache.isClosed());
		Assertions.assertThrows(IllegalStateException.class, () -> connection.objectStatements(AuthorMapping.INSTANCE));
	}
}
