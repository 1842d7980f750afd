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
import io.keystone.inject.binding.Binding;
import io.keystone.inject.binding.BindingType;
import io.keystone.inject.binding.ComponentBinding;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A closed and validated set of bindings, exactly one per key.
 * <p>
 * Tables are made with the {@link #builder() DSL}, which runs all the structural checks
 * once, so any existing table is known to be complete, acyclic and free of
 * components that depend on providers.
 * The same table can be used to build any number of {@link io.keystone.inject.Module modules}.
 */
public final class BindingTable {
	private final Map<Key<?>, Binding<?>> bindings;
	private final Map<Class<?>, ComponentBinding<?>> componentsByImplementation;

	BindingTable(Map<Key<?>, Binding<?>> bindings) {
		this.bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
		Map<Class<?>, ComponentBinding<?>> components = new LinkedHashMap<>();
		for (Binding<?> binding : bindings.values()) {
			if (binding instanceof ComponentBinding<?> componentBinding && !componentBinding.isInstance()) {
				components.put(binding.getImplementation(), componentBinding);
			}
		}
		this.componentsByImplementation = Collections.unmodifiableMap(components);
	}

	public static BindingTableBuilder builder() {
		return new BindingTableBuilderImpl<>();
	}

	public Map<Key<?>, Binding<?>> getBindings() {
		return bindings;
	}

	@SuppressWarnings("unchecked")
	public <T> @Nullable Binding<T> get(Key<T> key) {
		return (Binding<T>) bindings.get(key);
	}

	public boolean contains(Key<?> key) {
		return bindings.containsKey(key);
	}

	public @Nullable BindingType getType(Key<?> key) {
		Binding<?> binding = bindings.get(key);
		return binding != null ? binding.getType() : null;
	}

	/**
	 * Returns the component binding whose implementation is the given class,
	 * there is at most one since a component implements exactly one interface.
	 */
	public @Nullable ComponentBinding<?> getComponentByImplementation(Class<?> implementation) {
		return componentsByImplementation.get(implementation);
	}

	public int size() {
		return bindings.size();
	}

	@Override
	public String toString() {
		return "BindingTable{" + bindings.size() + " bindings}";
	}
}
