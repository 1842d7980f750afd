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

public final class ComponentBinding<T> extends Binding<T> {
	private final ComponentFactory<? extends T> factory;
	private final boolean instance;

	public ComponentBinding(Key<T> key, Class<?> implementation, ComponentFactory<? extends T> factory,
			List<Key<?>> dependencies, List<Parameter<?>> parameters,
			@Nullable LocationInfo location) {
		this(key, implementation, factory, dependencies, parameters, location, false);
	}

	private ComponentBinding(Key<T> key, Class<?> implementation, ComponentFactory<? extends T> factory,
			List<Key<?>> dependencies, List<Parameter<?>> parameters,
			@Nullable LocationInfo location, boolean instance) {
		super(key, implementation, dependencies, parameters, location);
		this.factory = factory;
		this.instance = instance;
	}

	/**
	 * A component that is the given instance in every module.
	 * Instance bindings are not indexed by their implementation class,
	 * so any number of them may share one class under distinct keys.
	 */
	public static <T> ComponentBinding<T> ofInstance(Key<T> key, T instance, List<Key<?>> dependencies, @Nullable LocationInfo location) {
		return new ComponentBinding<>(key, instance.getClass(), $ -> instance, dependencies, List.of(), location, true);
	}

	public boolean isInstance() {
		return instance;
	}

	@Override
	public BindingType getType() {
		return BindingType.COMPONENT;
	}

	public ComponentFactory<? extends T> getFactory() {
		return factory;
	}
}
