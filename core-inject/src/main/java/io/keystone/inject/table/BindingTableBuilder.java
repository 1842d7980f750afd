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

package io.keystone.inject.table;

import io.keystone.inject.Key;
import org.jetbrains.annotations.NotNull;

import java.util.Collection;
import java.util.List;

/**
 * This interface is used to restrict the DSL.
 * Basically, it disallows any methods from {@link BindingTableBuilder0} not listed below
 * to be called without previously calling {@link #bind bind(...)}.
 */
@SuppressWarnings("UnusedReturnValue")
public interface BindingTableBuilder {
	/**
	 * Adds all bindings from given tables to this one.
	 * <p>
	 * This works just as if you'd declare all of those bindings directly,
	 * so a key bound by two of them is a duplicate.
	 */
	BindingTableBuilder install(Collection<BindingTable> tables);

	/**
	 * @see #install(Collection)
	 */
	default BindingTableBuilder install(BindingTable... tables) {
		return install(List.of(tables));
	}

	/**
	 * Begins a chain of binding builder DSL calls
	 *
	 * @see #bind(Key)
	 */
	default <T> BindingTableBuilder0<T> bind(Class<T> cls) {
		return bind(Key.of(cls));
	}

	/**
	 * Begins a chain of binding builder DSL calls
	 *
	 * @see #bind(Key)
	 */
	default <T> BindingTableBuilder0<T> bind(Class<T> cls, Object qualifier) {
		return bind(Key.of(cls, qualifier));
	}

	/**
	 * This method begins a chain of binding builder DSL calls for the interface key.
	 * The chain must be finished with one of {@code toComponent}, {@code toProvider} or {@code toAsyncProvider}.
	 */
	<T> BindingTableBuilder0<T> bind(@NotNull Key<T> key);

	/**
	 * Validates the collected bindings and returns them as a table.
	 *
	 * @throws io.keystone.inject.binding.DIException if the bindings are not a valid table
	 */
	BindingTable build();
}
