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

public final class ProviderBinding<T> extends Binding<T> {
	private final ProviderFactory<? extends T> factory;

	public ProviderBinding(Key<T> key, Class<?> implementation, ProviderFactory<? extends T> factory,
			List<Key<?>> dependencies, List<Parameter<?>> parameters,
			@Nullable LocationInfo location) {
		super(key, implementation, dependencies, parameters, location);
		this.factory = factory;
	}

	@Override
	public BindingType getType() {
		return BindingType.PROVIDER;
	}

	public ProviderFactory<? extends T> getFactory() {
		return factory;
	}
}
