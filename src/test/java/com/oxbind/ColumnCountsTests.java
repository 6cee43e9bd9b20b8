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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
public class ColumnCountsTests {
	@Test
	public void testDerivedCounts() {
		ColumnCounts columnCounts = ColumnCounts.of(5, 1, 0, 1, 1);

		Assertions.assertEquals(5, columnCounts.getSelectColumnCount());
		Assertions.assertEquals(4, columnCounts.getInsertColumnCount());
		Assertions.assertEquals(2, columnCounts.getUpdateColumnCount());
		Assertions.assertEquals(1, columnCounts.getIdColumnCount());
		Assertions.assertEquals(0, columnCounts.getManagedOptimisticColumnCount());
	}

	@Test
	public void testManagedColumnsExcludedFromInsert() {
		ColumnCounts columnCounts = ColumnCounts.of(3, 0, 1, 1, 0);

		Assertions.assertEquals(3, columnCounts.getSelectColumnCount());
		Assertions.assertEquals(2, columnCounts.getInsertColumnCount());
		Assertions.assertEquals(1, columnCounts.getUpdateColumnCount());
	}

	@Test
	public void testCountsFromMappings() {
		ColumnCounts authorCounts = ColumnCounts.forMapping(MappingFixtures.AuthorMapping.INSTANCE);

		Assertions.assertEquals(5, authorCounts.getSelectColumnCount());
		Assertions.assertEquals(4, authorCounts.getInsertColumnCount());
		Assertions.assertEquals(2, authorCounts.getUpdateColumnCount());

		ColumnCounts documentCounts = ColumnCounts.forMapping(MappingFixtures.DocumentMapping.INSTANCE);

		Assertions.assertEquals(1, documentCounts.getManagedOptimisticColumnCount());
		Assertions.assertEquals(2, documentCounts.getInsertColumnCount());
	}

	@Test
	public void testNegativeCountsRejected() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> ColumnCounts.of(2, 3, 0, 0, 0));
		Assertions.assertThrows(IllegalArgumentException.class, () -> ColumnCounts.of(2, 0, 0, 2, 1));
		Assertions.assertThrows(IllegalArgumentException.class, () -> ColumnCounts.of(-1, 0, 0, 0, 0));
	}
}
