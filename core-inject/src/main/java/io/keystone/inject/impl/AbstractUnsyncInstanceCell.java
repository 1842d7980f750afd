/*
 * Copyright (C) 2020 ActiveJ LLC.
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

package io.keystone.inject.impl;

import io.keystone.inject.Key;
import io.keystone.inject.binding.DIException;
import org.jetbrains.annotations.Nullable;

import static io.keystone.inject.impl.AbstractInstanceCell.CREATING;

/**
 * Instance cell for modules that are used from a single thread, with no locking at all.
 */
public abstract class AbstractUnsyncInstanceCell<T> implements InstanceCell<T> {
	protected final Key<T> key;

	private @Nullable Object instance;

	protected AbstractUnsyncInstanceCell(Key<T> key, @Nullable T preset) {
		this.key = key;
		this.instance = preset;
	}

	@Override
	public final Key<T> getKey() {
		return key;
	}

	@SuppressWarnings("unchecked")
	@Override
	public final T getInstance() {
		Object instance = this.instance;
		if (instance == CREATING) {
			throw DIException.reentrantConstruction(key);
		}
		if (instance != null) return (T) instance;
		this.instance = CREATING;
		T created;
		try {
			created = doCreateInstance();
		} catch (RuntimeException | Error e) {
			this.instance = null;
			throw e;
		}
		if (created == null) {
			this.instance = null;
			throw DIException.cannotConstruct(key, null);
		}
		this.instance = created;
		return created;
	}

	@SuppressWarnings("unchecked")
	@Override
	public final @Nullable T peekInstance() {
		Object instance = this.instance;
		return instance != CREATING ? (T) instance : null;
	}

	protected abstract T doCreateInstance();

	@Override
	public String toString() {
		return "UnsyncInstanceCell<" + key.getDisplayString() + ">";
	}
}
