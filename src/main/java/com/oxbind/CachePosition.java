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
 * The pending slot a delayed load fills, for example an entry reserved in an object cache.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
public interface CachePosition {
	/**
	 * A position that tracks nothing.
	 */
	CachePosition NONE = new CachePosition() {};

	/**
	 * Called once the object at this position has been fully loaded.
	 */
	default void loaded() {
		// No-op by default
	}

	/**
	 * Called when the load for this position is discarded without completing.
	 */
	default void abandon() {
		// No-op by default
	}
}
