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

/**
 * How a mapped column participates in the statements of its type.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
public enum ColumnRole {
	/**
	 * Part of the object id. Selected and inserted, never updated; bound through the id image.
	 */
	ID,
	/**
	 * Ordinary data. Selected, inserted and updated.
	 */
	DATA,
	/**
	 * Selected and inserted, never updated.
	 */
	READONLY,
	/**
	 * The inverse side of a relationship, owned by another table. Only selected.
	 */
	INVERSE,
	/**
	 * A managed optimistic-concurrency version. Selected only; its expected value lives in the id image.
	 */
	VERSION
}
