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
import io.keystone.inject.table.BindingTable;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.Map.Entry;

import static io.keystone.inject.util.Utils.checkArgument;
import static io.keystone.inject.util.Utils.checkState;
import static java.util.stream.Collectors.joining;

/**
 * A mutable staging area for a {@link Module}.
 * <p>
 * It collects overrides for the bindings of a fixed {@link BindingTable}:
 * parameter overlays and preset instances for components, and replacement factories for providers.
 * Overrides can only replace what the table binds, they never add or remove bindings,
 * and repeated calls for the same binding replace the previous value.
 * <p>
 * A builder is single-use, once {@link #build()} is called it cannot be changed or built again.
 */
@SuppressWarnings("UnusedReturnValue")
public final class ModuleBuilder {
	private static final Logger logger = LoggerFactory.getLogger(ModuleBuilder.class);

	private final BindingTable table;

	private final Map<Key<?>, Object> componentOverrides = new HashMap<>();
	private final Map<Key<?>, Parameters> componentParameters = new HashMap<>();
	private final Map<Key<?>, ProviderFactory<?>> providerOverrides = new HashMap<>();
	private final Map<Key<?>, AsyncProviderFactory<?>> asyncProviderOverrides = new HashMap<>();

	private boolean threadsafe = true;
	private boolean consumed;

	ModuleBuilder(BindingTable table) {
		this.table = table;
	}

	/**
	 * Sets the parameter overlay of the component implemented by given class.
	 * <p>
	 * The overlay is consulted only when the component is constructed,
	 * so it has no effect if the component instance is also {@link #withComponentOverride overridden}.
	 */
	public ModuleBuilder withComponentParameters(@NotNull Class<?> implementation, @NotNull Parameters parameters) {
		ensureNotConsumed();
		ComponentBinding<?> binding = table.getComponentByImplementation(implementation);
		if (binding == null) {
			throw new DIException("No component is implemented by " + implementation.getName());
		}
		componentParameters.put(binding.getKey(), parameters);
		return this;
	}

	/**
	 * Presets the instance of the component bound to given key,
	 * so that its factory is never called by the module.
	 */
	public <T> ModuleBuilder withComponentOverride(@NotNull Key<T> key, @NotNull T instance) {
		ensureNotConsumed();
		ensureBound(key, BindingType.COMPONENT);
		//noinspection ConstantConditions
		checkArgument(instance != null, "Component override cannot be null");
		checkArgument(key.getRawType().isInstance(instance),
				"Override " + instance + " is not an instance of " + key.getDisplayString());
		componentOverrides.put(key, instance);
		return this;
	}

	/**
	 * @see #withComponentOverride(Key, Object)
	 */
	public <T> ModuleBuilder withComponentOverride(@NotNull Class<T> type, @NotNull T instance) {
		return withComponentOverride(Key.of(type), instance);
	}

	/**
	 * Replaces the factory of the provider bound to given key.
	 */
	public <T> ModuleBuilder withProviderOverride(@NotNull Key<T> key, @NotNull ProviderFactory<? extends T> factory) {
		ensureNotConsumed();
		ensureBound(key, BindingType.PROVIDER);
		providerOverrides.put(key, factory);
		return this;
	}

	/**
	 * @see #withProviderOverride(Key, ProviderFactory)
	 */
	public <T> ModuleBuilder withProviderOverride(@NotNull Class<T> type, @NotNull ProviderFactory<? extends T> factory) {
		return withProviderOverride(Key.of(type), factory);
	}

	/**
	 * Replaces the factory of the async provider bound to given key.
	 */
	public <T> ModuleBuilder withAsyncProviderOverride(@NotNull Key<T> key, @NotNull AsyncProviderFactory<T> factory) {
		ensureNotConsumed();
		ensureBound(key, BindingType.ASYNC_PROVIDER);
		asyncProviderOverrides.put(key, factory);
		return this;
	}

	/**
	 * @see #withAsyncProviderOverride(Key, AsyncProviderFactory)
	 */
	public <T> ModuleBuilder withAsyncProviderOverride(@NotNull Class<T> type, @NotNull AsyncProviderFactory<T> factory) {
		return withAsyncProviderOverride(Key.of(type), factory);
	}

	/**
	 * Chooses between a module that may be shared by threads (the default)
	 * and a module that must be confined to one thread but does no locking.
	 */
	public ModuleBuilder withThreadsafe(boolean threadsafe) {
		ensureNotConsumed();
		this.threadsafe = threadsafe;
		return this;
	}

	/**
	 * Consumes this builder and returns the module.
	 * <p>
	 * Parameter overlays are checked here: every name must be a declared parameter of the component,
	 * every value must be of the parameter type (or configuration text the parameter can convert),
	 * and every required parameter must have a value unless the component instance is overridden.
	 *
	 * @throws DIException if the overlays are not valid, no module is built then
	 */
	public Module build() {
		ensureNotConsumed();
		consumed = true;

		Map<Key<?>, Map<String, Object>> parameters = new HashMap<>();
		List<String> errors = new ArrayList<>();
		for (Binding<?> binding : table.getBindings().values()) {
			if (binding.getType() != BindingType.COMPONENT) continue;
			Key<?> key = binding.getKey();
			Parameters overlay = componentParameters.getOrDefault(key, Parameters.create());
			Map<String, Object> values = resolveParameters(binding, overlay, componentOverrides.containsKey(key), errors);
			if (!values.isEmpty()) {
				parameters.put(key, values);
			}
		}

		if (!errors.isEmpty()) {
			throw new DIException(errors.stream()
					.collect(joining("\n", "Invalid component parameters:\n", "\n")));
		}

		Module module = new Module(table, threadsafe,
				Map.copyOf(componentOverrides),
				Map.copyOf(parameters),
				Map.copyOf(providerOverrides),
				Map.copyOf(asyncProviderOverrides));

		logger.debug("Built {} with {} component overrides, {} parameter overlays and {} provider overrides",
				module, componentOverrides.size(), componentParameters.size(), providerOverrides.size() + asyncProviderOverrides.size());
		return module;
	}

	private static Map<String, Object> resolveParameters(Binding<?> binding, Parameters overlay, boolean overridden, List<String> errors) {
		Map<String, Object> values = new HashMap<>();
		String component = binding.getKey().getDisplayString();

		for (Entry<String, Object> entry : overlay.asMap().entrySet()) {
			String name = entry.getKey();
			Object value = entry.getValue();
			Parameter<?> parameter = binding.getParameter(name);
			if (parameter == null) {
				errors.add("\t" + component + " has no parameter '" + name + "'");
				continue;
			}
			if (parameter.accepts(value)) {
				values.put(name, value);
			} else if (value instanceof String text && parameter.hasConverter()) {
				try {
					values.put(name, parameter.convert(text));
				} catch (RuntimeException e) {
					errors.add("\t" + component + " parameter '" + name + "' cannot be converted from '" + text + "': " + e.getMessage());
				}
			} else {
				errors.add("\t" + component + " parameter '" + name + "' expects " + parameter.getType().getName() +
						", got " + value.getClass().getName());
			}
		}

		if (!overridden) {
			for (Parameter<?> parameter : binding.getParameters()) {
				if (!parameter.hasDefault() && !overlay.has(parameter.getName())) {
					errors.add("\t" + component + " parameter '" + parameter.getName() + "' has no default and no value was given");
				}
			}
		}
		return values;
	}

	private void ensureNotConsumed() {
		checkState(!consumed, "Module builder was already consumed by build()");
	}

	private void ensureBound(Key<?> key, BindingType type) {
		Binding<?> binding = table.get(key);
		if (binding == null) {
			throw DIException.notBound(key, type);
		}
		if (binding.getType() != type) {
			throw DIException.wrongBindingType(key, type, binding);
		}
	}

	@Override
	public String toString() {
		return "ModuleBuilder{" + table + '}';
	}
}
