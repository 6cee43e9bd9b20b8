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

import javax.annotation.concurrent.NotThreadSafe;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Statements and buffers for one container of a mapped type, keyed by the owner's id binding.
 * <p>
 * The owner's id binding is shared, not copied: callers refresh it before using these statements.
 *
 * @param <T> the owner type
 * @param <E> the element type
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public class ContainerStatements<T, E> extends StatementsBase {
	private static final int INDEX_COLUMN = 0;
	private static final int VALUE_COLUMN = 1;

	@NonNull
	private final ContainerMapping<T, E> containerMapping;
	@NonNull
	private final Binding idBinding;
	@NonNull
	private final Image dataImage;
	@NonNull
	private final Binding insertBinding;
	@NonNull
	private final Binding selectBinding;

	@Nullable
	private InsertStatement insert;
	@Nullable
	private SelectStatement select;
	@Nullable
	private DeleteStatement delete;

	private boolean closed;

	public ContainerStatements(@NonNull DatabaseConnection connection,
														 @NonNull ContainerMapping<T, E> containerMapping,
														 @NonNull Binding idBinding) {
		super(connection);

		requireNonNull(containerMapping);
		requireNonNull(idBinding);

		this.containerMapping = containerMapping;
		this.idBinding = idBinding;
		this.dataImage = new Image(2);

		Bind[] insertBinds = new Bind[idBinding.size() + 2];

		for (int i = 0; i < idBinding.size(); ++i)
			insertBinds[i] = idBinding.get(i);

		insertBinds[idBinding.size()] = new Bind();
		insertBinds[idBinding.size()].assign(this.dataImage, INDEX_COLUMN, Types.INTEGER);
		insertBinds[idBinding.size() + 1] = new Bind();
		insertBinds[idBinding.size() + 1].assign(this.dataImage, VALUE_COLUMN, containerMapping.getElementSqlType());

		this.insertBinding = new Binding(insertBinds, 0, insertBinds.length);

		this.selectBinding = new Binding(2);
		this.selectBinding.get(0).assign(this.dataImage, INDEX_COLUMN, Types.INTEGER);
		this.selectBinding.get(1).assign(this.dataImage, VALUE_COLUMN, containerMapping.getElementSqlType());
	}

	/**
	 * Inserts every element of the owner's container, in order.
	 *
	 * @param owner the owning object, whose id is in the shared id binding
	 */
	public void insertElements(@NonNull T owner) {
		requireNonNull(owner);

		List<E> elements = getContainerMapping().getElements(owner);

		for (int i = 0; i < elements.size(); ++i) {
			getDataImage().set(INDEX_COLUMN, i);
			getDataImage().set(VALUE_COLUMN, elements.get(i));

			getInsertBinding().derive();
			getInsertBinding().incrementVersion();

			if (!insertStatement().execute())
				throw new DatabaseException(format("Unable to insert element %d of container '%s'", i, getContainerMapping().getName()));
		}
	}

	/**
	 * Replaces the owner's container with the stored elements.
	 *
	 * @param owner the owning object, whose id is in the shared id binding
	 */
	public void loadElements(@NonNull T owner) {
		requireNonNull(owner);

		SelectStatement select = selectStatement();
		List<E> elements = new ArrayList<>();

		select.execute();

		try {
			while (select.fetch() == SelectStatement.FetchResult.SUCCESS)
				elements.add(getContainerMapping().toElement(getDataImage().get(VALUE_COLUMN)));
		} finally {
			select.freeResult();
		}

		getContainerMapping().setElements(owner, elements);
	}

	/**
	 * Deletes every stored element of the owner in the shared id binding.
	 *
	 * @return the number of elements deleted
	 */
	public long deleteElements() {
		return deleteStatement().execute();
	}

	@NonNull
	public InsertStatement insertStatement() {
		ensureOpen();

		if (this.insert == null)
			this.insert = new InsertStatement(getConnection(), getContainerMapping().getInsertSql(), getInsertBinding());

		return this.insert;
	}

	@NonNull
	public SelectStatement selectStatement() {
		ensureOpen();

		if (this.select == null)
			this.select = new SelectStatement(getConnection(), getContainerMapping().getSelectSql(), getIdBinding(), getSelectBinding());

		return this.select;
	}

	@NonNull
	public DeleteStatement deleteStatement() {
		ensureOpen();

		if (this.delete == null)
			this.delete = new DeleteStatement(getConnection(), getContainerMapping().getDeleteSql(), getIdBinding());

		return this.delete;
	}

	@Override
	public void close() {
		if (this.closed)
			return;

		this.closed = true;

		Statement insert = this.insert;
		Statement select = this.select;
		Statement delete = this.delete;

		this.insert = null;
		this.select = null;
		this.delete = null;

		closeAll(insert, select, delete);
	}

	@NonNull
	public Boolean isClosed() {
		return this.closed;
	}

	protected void ensureOpen() {
		if (this.closed)
			throw new IllegalStateException(format("Statements for container '%s' have been closed", getContainerMapping().getName()));
	}

	@NonNull
	public ContainerMapping<T, E> getContainerMapping() {
		return this.containerMapping;
	}

	@NonNull
	protected Binding getIdBinding() {
		return this.idBinding;
	}

	@NonNull
	protected Image getDataImage() {
		return this.dataImage;
	}

	@NonNull
	protected Binding getInsertBinding() {
		return this.insertBinding;
	}

	@NonNull
	protected Binding getSelectBinding() {
		return this.selectBinding;
	}
}
