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

package io.keystone.inject.binding;

import io.keystone.inject.Key;
import io.keystone.inject.Parameter;
import io.keystone.inject.util.LocationInfo;
import org.jetbrains.annotations.Nullable;

import java.util.List;

import static java.util.stream.Collectors.joining;

/**
 * A binding ties an interface {@link Key key} to the one implementation chosen for it.
 * <p>
 * Bindings are plain descriptions: an implementation class, a factory, and the keys of its
 * dependencies in declaration order. They are validated together as a
 * {@link io.keystone.inject.table.BindingTable binding table} and only then used by a {@link io.keystone.inject.Module module}.
 */
public abstract class Binding<T> {
	private final Key<T> key;
	private final Class<?> implementation;
	private final List<Key<?>> dependencies;
	private final List<Parameter<?>> parameters;
	private final @Nullable LocationInfo location;

	protected Binding(Key<T> key, Class<?> implementation,
			List<Key<?>> dependencies, List<Parameter<?>> parameters,
			@Nullable LocationInfo location) {
		this.key = key;
		this.implementation = implementation;
		this.dependencies = List.copyOf(dependencies);
		this.parameters = List.copyOf(parameters);
		this.location = location;
	}

	public abstract BindingType getType();

	public Key<T> getKey() {
		return key;
	}

	public Class<?> getImplementation() {
		return implementation;
	}

	public List<Key<?>> getDependencies() {
		return dependencies;
	}

	public List<Parameter<?>> getParameters() {
		return parameters;
	}

	public @Nullable Parameter<?> getParameter(String name) {
		for (Parameter<?> parameter : parameters) {
			if (parameter.getName().equals(name)) {
				return parameter;
			}
		}
		return null;
	}

	public @Nullable LocationInfo getLocation() {
		return location;
	}

	public String getDisplayString() {
		return dependencies.stream()
				.map(Key::getDisplayString)
				.collect(joining(", ", getType().name().toLowerCase().replace('_', ' ') + " " + implementation.getSimpleName() + "(", ")"));
	}

	@Override
	public String toString() {
		return getDisplayString();
	}
}
