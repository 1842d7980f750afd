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

package io.keystone.inject;

import io.keystone.inject.binding.*;
import io.keystone.inject.impl.AbstractInstanceCell;
import io.keystone.inject.impl.AbstractUnsyncInstanceCell;
import io.keystone.inject.impl.InstanceCell;
import io.keystone.inject.table.BindingTable;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.Map.Entry;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import static io.keystone.inject.binding.BindingType.*;

/**
 * Module is the composition root: a built and frozen dependency graph.
 * <p>
 * It is made from a {@link BindingTable} by a {@link ModuleBuilder}, and from then on its bindings
 * can never change. For each component it owns one {@link InstanceCell cell}, which is filled
 * on the first {@link #resolve resolve} of that component (or was preset by an override),
 * and for each provider it owns the factory that is called on every {@link #provide provide}.
 * <p>
 * Resolving and providing need only read access, so a thread-safe module
 * may be shared by any number of threads.
 */
@SuppressWarnings({"unused", "WeakerAccess"})
public final class Module implements ResourceLocator {
	private static final Logger logger = LoggerFactory.getLogger(Module.class);

	private final BindingTable table;
	private final boolean threadsafe;

	private final Map<Key<?>, InstanceCell<?>> cells;
	private final Map<Key<?>, Map<String, Object>> parameters;
	private final Map<Key<?>, ProviderFactory<?>> providers;
	private final Map<Key<?>, AsyncProviderFactory<?>> asyncProviders;
	private final Map<Key<?>, ResourceLocator> locators;

	Module(BindingTable table, boolean threadsafe,
			Map<Key<?>, Object> componentOverrides,
			Map<Key<?>, Map<String, Object>> parameters,
			Map<Key<?>, ProviderFactory<?>> providerOverrides,
			Map<Key<?>, AsyncProviderFactory<?>> asyncProviderOverrides) {
		this.table = table;
		this.threadsafe = threadsafe;
		this.parameters = parameters;

		Object lock = new Object();
		Map<Key<?>, InstanceCell<?>> cells = new HashMap<>();
		Map<Key<?>, ProviderFactory<?>> providers = new HashMap<>();
		Map<Key<?>, AsyncProviderFactory<?>> asyncProviders = new HashMap<>();
		Map<Key<?>, ResourceLocator> locators = new HashMap<>();

		for (Entry<Key<?>, Binding<?>> entry : table.getBindings().entrySet()) {
			Key<?> key = entry.getKey();
			Binding<?> binding = entry.getValue();
			if (binding instanceof ComponentBinding<?> componentBinding) {
				cells.put(key, createCell(componentBinding, componentOverrides.get(key), lock));
			} else if (binding instanceof ProviderBinding<?> providerBinding) {
				ProviderFactory<?> override = providerOverrides.get(key);
				providers.put(key, override != null ? override : providerBinding.getFactory());
				locators.put(key, createLocator(binding));
			} else if (binding instanceof AsyncProviderBinding<?> asyncProviderBinding) {
				AsyncProviderFactory<?> override = asyncProviderOverrides.get(key);
				asyncProviders.put(key, override != null ? override : asyncProviderBinding.getFactory());
				locators.put(key, createLocator(binding));
			}
		}

		this.cells = cells;
		this.providers = providers;
		this.asyncProviders = asyncProviders;
		this.locators = locators;
	}

	/**
	 * Begins staging of a module that is made of the given binding table.
	 */
	public static ModuleBuilder builder(BindingTable table) {
		return new ModuleBuilder(table);
	}

	/**
	 * A shortcut for a thread-safe module with no overrides.
	 */
	public static Module of(BindingTable table) {
		return builder(table).build();
	}

	@SuppressWarnings("unchecked")
	private <T> InstanceCell<T> createCell(ComponentBinding<T> binding, @Nullable Object preset, Object lock) {
		T presetInstance = (T) preset;
		return threadsafe ?
				new AbstractInstanceCell<>(binding.getKey(), lock, presetInstance) {
					@Override
					protected T doCreateInstance() {
						return construct(binding);
					}
				} :
				new AbstractUnsyncInstanceCell<>(binding.getKey(), presetInstance) {
					@Override
					protected T doCreateInstance() {
						return construct(binding);
					}
				};
	}

	private ResourceLocator createLocator(Binding<?> binding) {
		return new ResourceLocator() {
			@Override
			public <T> T resolve(Key<T> key) {
				return Module.this.resolve(checkDeclared(binding, key));
			}

			@Override
			public <T> T provide(Key<T> key) throws Exception {
				return Module.this.provide(checkDeclared(binding, key));
			}

			@Override
			public <T> CompletionStage<T> asyncProvide(Key<T> key) {
				return Module.this.asyncProvide(checkDeclared(binding, key));
			}

			@Override
			public String toString() {
				return "ResourceLocator{" + binding.getKey().getDisplayString() + '}';
			}
		};
	}

	private static <T> Key<T> checkDeclared(Binding<?> binding, Key<T> key) {
		if (!binding.getDependencies().contains(key)) {
			throw DIException.undeclaredDependency(binding, key);
		}
		return key;
	}

	private <T> T construct(ComponentBinding<T> binding) {
		if (logger.isTraceEnabled()) {
			logger.trace("Constructing {} for {}", binding.getImplementation().getName(), binding.getKey().getDisplayString());
		}
		Map<String, Object> overlay = parameters.getOrDefault(binding.getKey(), Map.of());
		return binding.getFactory().create(new ComponentContext() {
			@Override
			public <D> D resolve(Key<D> key) {
				return Module.this.resolve(checkDeclared(binding, key));
			}

			@Override
			public <P> P getParameter(Parameter<P> parameter) {
				Parameter<?> declared = binding.getParameter(parameter.getName());
				if (!parameter.equals(declared)) {
					throw DIException.undeclaredParameter(binding, parameter.getName());
				}
				Object value = overlay.get(parameter.getName());
				return parameter.getType().cast(value != null ? value : declared.getDefaultValue());
			}
		});
	}

	/**
	 * Returns the one instance of the component bound to given key, constructing it at the first call.
	 * <p>
	 * Every dependency of a component was checked when its binding table was built,
	 * so this method fails only when the key is not bound to a component at all.
	 */
	@SuppressWarnings("unchecked")
	@Override
	public <T> T resolve(Key<T> key) {
		InstanceCell<T> cell = (InstanceCell<T>) cells.get(key);
		if (cell == null) {
			throw missing(key, COMPONENT);
		}
		return cell.getInstance();
	}

	/**
	 * @see #resolve(Key)
	 */
	@Override
	public <T> T resolve(Class<T> type) {
		return resolve(Key.of(type));
	}

	/**
	 * Calls the provider bound to given key (or its override) and returns what it made.
	 * The factory is given a locator that serves the declared dependencies of the provider only.
	 * Each call makes a new instance, which belongs to the caller.
	 *
	 * @throws Exception whatever the provider factory has thrown, unchanged
	 */
	@SuppressWarnings("unchecked")
	@Override
	public <T> T provide(Key<T> key) throws Exception {
		ProviderFactory<T> factory = (ProviderFactory<T>) providers.get(key);
		if (factory == null) {
			throw missing(key, PROVIDER);
		}
		logger.trace("Providing {}", key);
		T instance = factory.provide(locators.get(key));
		if (instance == null) {
			throw DIException.cannotConstruct(key, table.get(key));
		}
		return instance;
	}

	/**
	 * @see #provide(Key)
	 */
	@Override
	public <T> T provide(Class<T> type) throws Exception {
		return provide(Key.of(type));
	}

	/**
	 * Calls the async provider bound to given key (or its override).
	 * <p>
	 * This method never blocks, the returned stage completes when the provider completes.
	 * If the provider fails, even by throwing before returning a stage,
	 * the returned stage fails with the exception of the provider.
	 */
	@SuppressWarnings("unchecked")
	@Override
	public <T> CompletionStage<T> asyncProvide(Key<T> key) {
		AsyncProviderFactory<T> factory = (AsyncProviderFactory<T>) asyncProviders.get(key);
		if (factory == null) {
			throw missing(key, ASYNC_PROVIDER);
		}
		logger.trace("Providing {} asynchronously", key);
		CompletionStage<T> stage;
		try {
			stage = factory.provide(locators.get(key));
		} catch (RuntimeException e) {
			return CompletableFuture.failedFuture(e);
		}
		if (stage == null) {
			return CompletableFuture.failedFuture(DIException.cannotConstruct(key, table.get(key)));
		}
		return stage;
	}

	/**
	 * @see #asyncProvide(Key)
	 */
	@Override
	public <T> CompletionStage<T> asyncProvide(Class<T> type) {
		return asyncProvide(Key.of(type));
	}

	private DIException missing(Key<?> key, BindingType requested) {
		Binding<?> binding = table.get(key);
		return binding != null ?
				DIException.wrongBindingType(key, requested, binding) :
				DIException.notBound(key, requested);
	}

	/**
	 * This method returns an instance only if it already was created by a {@link #resolve} call before
	 * (or was given as an override), it does not trigger instance creation.
	 */
	@SuppressWarnings("unchecked")
	public <T> @Nullable T peekInstance(Key<T> key) {
		InstanceCell<T> cell = (InstanceCell<T>) cells.get(key);
		return cell != null ? cell.peekInstance() : null;
	}

	/**
	 * @see #peekInstance(Key)
	 */
	public <T> @Nullable T peekInstance(Class<T> type) {
		return peekInstance(Key.of(type));
	}

	/**
	 * This method checks if an instance for this key was created by a {@link #resolve} call before.
	 */
	public boolean hasInstance(Key<?> key) {
		return peekInstance(key) != null;
	}

	/**
	 * @see #hasInstance(Key)
	 */
	public boolean hasInstance(Class<?> type) {
		return hasInstance(Key.of(type));
	}

	/**
	 * This method returns a copy of all already created component instances.
	 */
	public Map<Key<?>, Object> peekInstances() {
		Map<Key<?>, Object> result = new HashMap<>();
		for (InstanceCell<?> cell : cells.values()) {
			Object instance = cell.peekInstance();
			if (instance != null) {
				result.put(cell.getKey(), instance);
			}
		}
		return result;
	}

	public boolean hasBinding(Key<?> key) {
		return table.contains(key);
	}

	public boolean hasBinding(Class<?> type) {
		return hasBinding(Key.of(type));
	}

	public <T> @Nullable Binding<T> getBinding(Key<T> key) {
		return table.get(key);
	}

	public BindingTable getBindingTable() {
		return table;
	}

	public boolean isThreadsafe() {
		return threadsafe;
	}

	@Override
	public String toString() {
		return "Module{bindings=" + table.size() + ", threadsafe=" + threadsafe + '}';
	}
}
