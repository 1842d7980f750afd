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

import io.keystone.inject.binding.AsyncProviderFactory;
import io.keystone.inject.binding.ComponentFactory;
import io.keystone.inject.binding.ProviderFactory;
import org.jetbrains.annotations.NotNull;

public interface BindingTableBuilder0<T> {
	/**
	 * Binds the key to a component, created once per module with the given factory.
	 */
	BindingTableBuilder1<T> toComponent(@NotNull Class<? extends T> implementation, @NotNull ComponentFactory<? extends T> factory);

	/**
	 * Binds the key to a component that is the given instance in every module.
	 */
	BindingTableBuilder1<T> toInstance(@NotNull T instance);

	/**
	 * Binds the key to a provider, whose factory is called on every request.
	 */
	BindingTableBuilder1<T> toProvider(@NotNull Class<? extends T> implementation, @NotNull ProviderFactory<? extends T> factory);

	/**
	 * Binds the key to an async provider, whose factory is called on every request.
	 */
	BindingTableBuilder1<T> toAsyncProvider(@NotNull Class<? extends T> implementation, @NotNull AsyncProviderFactory<T> factory);
}
