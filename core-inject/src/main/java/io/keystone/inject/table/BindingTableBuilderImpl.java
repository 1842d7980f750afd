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
import io.keystone.inject.Parameter;
import io.keystone.inject.binding.*;
import io.keystone.inject.impl.Preprocessor;
import io.keystone.inject.util.LocationInfo;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

import static io.keystone.inject.util.Utils.checkState;
import static io.keystone.inject.util.Utils.getLocation;
import static java.util.stream.Collectors.joining;

@SuppressWarnings("UnusedReturnValue")
final class BindingTableBuilderImpl<T> implements BindingTableBuilder0<T>, BindingTableBuilder1<T> {
	private static final Logger logger = LoggerFactory.getLogger(BindingTableBuilderImpl.class);

	private static final Set<String> DSL_CLASSES = Set.of(
			BindingTable.class.getName(),
			BindingTableBuilder.class.getName(),
			BindingTableBuilder0.class.getName(),
			BindingTableBuilder1.class.getName(),
			BindingTableBuilderImpl.class.getName());

	private final List<Binding<?>> bindings = new ArrayList<>();
	private final List<BindingTable> installed = new ArrayList<>();

	private @Nullable BindingDesc current = null;
	private boolean built;

	BindingTableBuilderImpl() {
	}

	private void completePreviousStep() {
		checkState(!built, "Binding table was already built");
		if (current != null) {
			checkState(current.kind != null,
					"Binding for " + current.key.getDisplayString() + " was not finished with toComponent, toProvider or toAsyncProvider");
			bindings.add(current.toBinding(this));
			current = null;
		}
	}

	@Override
	@SuppressWarnings("unchecked")
	public <U> BindingTableBuilder0<U> bind(@NotNull Key<U> key) {
		completePreviousStep();
		current = new BindingDesc(key, callerFrame());
		return (BindingTableBuilder0<U>) this;
	}

	private BindingDesc ensureCurrent() {
		BindingDesc desc = current;
		checkState(desc != null, "Cannot configure binding before bind(...) call");
		return desc;
	}

	private BindingDesc ensureMapped() {
		BindingDesc desc = ensureCurrent();
		checkState(desc.kind != null, "Binding for " + desc.key.getDisplayString() + " is not mapped to an implementation yet");
		return desc;
	}

	private BindingTableBuilder1<T> mapTo(BindingType kind, Class<?> implementation, Object factory) {
		BindingDesc desc = ensureCurrent();
		checkState(desc.kind == null, "Already mapped to an implementation");
		desc.kind = kind;
		desc.implementation = implementation;
		desc.factory = factory;
		return this;
	}

	@Override
	public BindingTableBuilder1<T> toComponent(@NotNull Class<? extends T> implementation, @NotNull ComponentFactory<? extends T> factory) {
		return mapTo(BindingType.COMPONENT, implementation, factory);
	}

	@Override
	public BindingTableBuilder1<T> toInstance(@NotNull T instance) {
		BindingTableBuilder1<T> result = mapTo(BindingType.COMPONENT, instance.getClass(), instance);
		ensureCurrent().instance = true;
		return result;
	}

	@Override
	public BindingTableBuilder1<T> toProvider(@NotNull Class<? extends T> implementation, @NotNull ProviderFactory<? extends T> factory) {
		return mapTo(BindingType.PROVIDER, implementation, factory);
	}

	@Override
	public BindingTableBuilder1<T> toAsyncProvider(@NotNull Class<? extends T> implementation, @NotNull AsyncProviderFactory<T> factory) {
		return mapTo(BindingType.ASYNC_PROVIDER, implementation, factory);
	}

	@Override
	public BindingTableBuilder1<T> withDependencies(List<Key<?>> dependencies) {
		ensureMapped().dependencies.addAll(dependencies);
		return this;
	}

	@Override
	public BindingTableBuilder1<T> withParameters(List<Parameter<?>> parameters) {
		BindingDesc desc = ensureMapped();
		checkState(!desc.instance, "Instance binding for " + desc.key.getDisplayString() + " cannot have parameters");
		desc.parameters.addAll(parameters);
		return this;
	}

	@Override
	public BindingTableBuilder install(Collection<BindingTable> tables) {
		completePreviousStep();
		installed.addAll(tables);
		return this;
	}

	@Override
	public BindingTable build() {
		completePreviousStep(); // finish the last binding
		built = true;

		List<Binding<?>> all = new ArrayList<>();
		installed.forEach(table -> all.addAll(table.getBindings().values()));
		all.addAll(bindings);

		Map<Key<?>, Binding<?>> byKey = new LinkedHashMap<>();
		Map<Key<?>, List<Binding<?>>> duplicateKeys = new LinkedHashMap<>();
		Map<Class<?>, List<Binding<?>>> componentsByImplementation = new LinkedHashMap<>();
		for (Binding<?> binding : all) {
			Binding<?> previous = byKey.putIfAbsent(binding.getKey(), binding);
			if (previous != null) {
				duplicateKeys.computeIfAbsent(binding.getKey(), $ -> new ArrayList<>(List.of(previous))).add(binding);
			}
			if (binding instanceof ComponentBinding<?> component && !component.isInstance()) {
				componentsByImplementation.computeIfAbsent(binding.getImplementation(), $ -> new ArrayList<>()).add(binding);
			}
		}
		componentsByImplementation.values().removeIf(list -> list.size() == 1);

		if (!duplicateKeys.isEmpty() || !componentsByImplementation.isEmpty()) {
			StringBuilder sb = new StringBuilder("Duplicate bindings detected:\n");
			duplicateKeys.forEach((key, list) -> sb.append(list.stream()
					.map(binding -> binding.getDisplayString() + " " + getLocation(binding))
					.collect(joining("\n\t\t- ", "\tkey " + key.getDisplayString() + " is bound more than once:\n\t\t- ", "\n"))));
			componentsByImplementation.forEach((implementation, list) -> sb.append(list.stream()
					.map(binding -> binding.getKey().getDisplayString() + " " + getLocation(binding))
					.collect(joining("\n\t\t- ", "\tcomponent " + implementation.getName() + " implements more than one interface:\n\t\t- ", "\n"))));
			throw new DIException(sb.toString());
		}

		Preprocessor.check(byKey);

		logger.debug("Validated binding table of {} bindings", byKey.size());
		return new BindingTable(byKey);
	}

	private static @Nullable StackTraceElement callerFrame() {
		return StackWalker.getInstance().walk(frames -> frames
				.filter(frame -> !DSL_CLASSES.contains(frame.getClassName()))
				.findFirst()
				.map(StackWalker.StackFrame::toStackTraceElement)
				.orElse(null));
	}

	@Override
	public String toString() {
		return "BindingTableBuilder";
	}

	private static final class BindingDesc {
		private final Key<?> key;
		private final @Nullable StackTraceElement frame;
		private final List<Key<?>> dependencies = new ArrayList<>();
		private final List<Parameter<?>> parameters = new ArrayList<>();
		private @Nullable BindingType kind;
		private boolean instance;
		private Class<?> implementation;
		private Object factory; // the instance itself for instance bindings

		BindingDesc(Key<?> key, @Nullable StackTraceElement frame) {
			this.key = key;
			this.frame = frame;
		}

		@SuppressWarnings({"unchecked", "rawtypes"})
		Binding<?> toBinding(Object declarer) {
			LocationInfo location = LocationInfo.from(declarer, frame);
			assert kind != null;
			return switch (kind) {
				case COMPONENT -> instance ?
						ComponentBinding.ofInstance((Key) key, factory, dependencies, location) :
						new ComponentBinding(key, implementation, (ComponentFactory) factory, dependencies, parameters, location);
				case PROVIDER -> new ProviderBinding(key, implementation, (ProviderFactory) factory, dependencies, parameters, location);
				case ASYNC_PROVIDER -> new AsyncProviderBinding(key, implementation, (AsyncProviderFactory) factory, dependencies, parameters, location);
			};
		}
	}
}
