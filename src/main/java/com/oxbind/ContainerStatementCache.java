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

import javax.annotation.concurrent.NotThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * The container statements of one mapped type, created together the first time any container is touched.
 *
 * @param <T> the owner type
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public class ContainerStatementCache<T> implements AutoCloseable {
	@NonNull
	private final List<ContainerStatements<T, ?>> containerStatements;

	private boolean closed;

	public ContainerStatementCache(@NonNull DatabaseConnection connection,
																 @NonNull List<ContainerMapping<T, ?>> containerMappings,
																 @NonNull Binding idBinding) {
		requireNonNull(connection);
		requireNonNull(containerMappings);
		requireNonNull(idBinding);

		List<ContainerStatements<T, ?>> containerStatements = new ArrayList<>(containerMappings.size());

		for (ContainerMapping<T, ?> containerMapping : containerMappings)
			containerStatements.add(new ContainerStatements<>(connection, containerMapping, idBinding));

		this.containerStatements = Collections.unmodifiableList(containerStatements);
		this.closed = false;
	}

	public void insertElements(@NonNull T owner) {
		requireNonNull(owner);

		for (ContainerStatements<T, ?> containerStatements : getContainerStatements())
			containerStatements.insertElements(owner);
	}

	public void loadElements(@NonNull T owner) {
		requireNonNull(owner);

		for (ContainerStatements<T, ?> containerStatements : getContainerStatements())
			containerStatements.loadElements(owner);
	}

	public void deleteElements() {
		for (ContainerStatements<T, ?> containerStatements : getContainerStatements())
			containerStatements.deleteElements();
	}

	@Override
	public void close() {
		if (this.closed)
			return;

		this.closed = true;

		RuntimeException failure = null;

		for (ContainerStatements<T, ?> containerStatements : getContainerStatements()) {
			try {
				containerStatements.close();
			} catch (RuntimeException e) {
				if (failure == null)
					failure = e;
				else
					failure.addSuppressed(e);
			}
		}

		if (failure != null)
			throw failure;
	}

	@NonNull
	public Boolean isClosed() {
		return this.closed;
	}

	@NonNull
	public List<ContainerStatements<T, ?>> getContainerStatements() {
		return this.containerStatements;
	}
}
