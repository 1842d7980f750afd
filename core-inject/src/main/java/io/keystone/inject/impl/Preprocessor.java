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
import io.keystone.inject.Parameter;
import io.keystone.inject.binding.Binding;
import io.keystone.inject.binding.BindingType;
import io.keystone.inject.binding.DIException;
import io.keystone.inject.util.Utils;

import java.util.*;

import static io.keystone.inject.binding.BindingType.*;
import static io.keystone.inject.util.Utils.getLocation;
import static java.util.stream.Collectors.joining;

/**
 * This class contains the structural checks of a binding table.
 * <p>
 * They run once, when the table is built, so that a module never has to check anything while resolving.
 */
public final class Preprocessor {
	private Preprocessor() {}

	/**
	 * Checks that the bindings form a valid table, that is:
	 * <ul>
	 *     <li>every dependency has a binding</li>
	 *     <li>components depend on components only, and providers do not depend on async providers</li>
	 *     <li>parameters are declared on components only, and at most once per name</li>
	 *     <li>there are no dependency cycles</li>
	 * </ul>
	 * Problems are reported per category, the first failing category throws a {@link DIException} that lists all of its problems.
	 */
	public static void check(Map<Key<?>, Binding<?>> bindings) {
		checkUnsatisfied(bindings);
		checkDependencyKinds(bindings);
		checkParameters(bindings);
		checkCycles(bindings);
	}

	private static void checkUnsatisfied(Map<Key<?>, Binding<?>> bindings) {
		Map<Key<?>, List<Binding<?>>> unsatisfied = new LinkedHashMap<>();
		for (Binding<?> binding : bindings.values()) {
			for (Key<?> dependency : binding.getDependencies()) {
				if (!bindings.containsKey(dependency)) {
					unsatisfied.computeIfAbsent(dependency, $ -> new ArrayList<>()).add(binding);
				}
			}
		}

		if (!unsatisfied.isEmpty()) {
			throw new DIException(unsatisfied.entrySet().stream()
					.map(entry -> entry.getValue().stream()
							.map(binding -> binding.getKey().getDisplayString() + " " + getLocation(binding))
							.collect(joining("\n\t\t- ", "\tkey " + entry.getKey().getDisplayString() + " required to make:\n\t\t- ", "")))
					.collect(joining("\n", "Unsatisfied dependencies detected:\n", "\n")));
		}
	}

	private static void checkDependencyKinds(Map<Key<?>, Binding<?>> bindings) {
		List<String> violations = new ArrayList<>();
		for (Binding<?> binding : bindings.values()) {
			for (Key<?> dependency : binding.getDependencies()) {
				BindingType dependencyType = bindings.get(dependency).getType();
				if (!mayDependOn(binding.getType(), dependencyType)) {
					violations.add("\t" + binding.getDisplayString() + " cannot depend on " +
							dependency.getDisplayString() + " which is " + describe(dependencyType) +
							"\n\t\t " + getLocation(binding));
				}
			}
		}

		if (!violations.isEmpty()) {
			throw new DIException(violations.stream()
					.collect(joining("\n", "Invalid dependencies detected, components may only depend on components " +
							"and providers may not depend on async providers:\n", "\n")));
		}
	}

	private static boolean mayDependOn(BindingType type, BindingType dependencyType) {
		return switch (type) {
			case COMPONENT -> dependencyType == COMPONENT;
			case PROVIDER -> dependencyType != ASYNC_PROVIDER;
			case ASYNC_PROVIDER -> true;
		};
	}

	private static void checkParameters(Map<Key<?>, Binding<?>> bindings) {
		List<String> violations = new ArrayList<>();
		for (Binding<?> binding : bindings.values()) {
			if (binding.getType() != COMPONENT && !binding.getParameters().isEmpty()) {
				violations.add("\t" + binding.getDisplayString() + " declares parameters, but only components may have them" +
						"\n\t\t " + getLocation(binding));
			}
			Set<String> names = new HashSet<>();
			for (Parameter<?> parameter : binding.getParameters()) {
				if (!names.add(parameter.getName())) {
					violations.add("\t" + binding.getDisplayString() + " declares parameter '" + parameter.getName() + "' more than once" +
							"\n\t\t " + getLocation(binding));
				}
			}
		}

		if (!violations.isEmpty()) {
			throw new DIException(violations.stream()
					.collect(joining("\n", "Invalid parameters detected:\n", "\n")));
		}
	}

	private static void checkCycles(Map<Key<?>, Binding<?>> bindings) {
		List<Key<?>[]> cycles = collectCycles(bindings);

		if (!cycles.isEmpty()) {
			throw new DIException(cycles.stream()
					.map(Utils::drawCycle)
					.collect(joining("\n\n", "Cyclic dependencies detected:\n\n", "\n")));
		}
	}

	/**
	 * This method performs a simple recursive DFS on given bindings and returns all found cycles.
	 * <p>
	 * Unsatisfied dependencies are ignored.
	 */
	public static List<Key<?>[]> collectCycles(Map<Key<?>, Binding<?>> bindings) {
		Set<Key<?>> visited = new HashSet<>();
		LinkedHashSet<Key<?>> visiting = new LinkedHashSet<>();
		List<Key<?>[]> cycles = new ArrayList<>();
		// the graph is not necessarily connected, so we go through any possibly disconnected part
		for (Key<?> key : bindings.keySet()) {
			if (!visited.contains(key)) {
				collectCycles(bindings, visited, visiting, cycles, key);
			}
		}
		return cycles;
	}

	private static void collectCycles(Map<Key<?>, Binding<?>> bindings, Set<Key<?>> visited, LinkedHashSet<Key<?>> visiting, List<Key<?>[]> cycles, Key<?> key) {
		Binding<?> binding = bindings.get(key);
		if (binding == null) {
			visited.add(key);
			return;
		}
		// visited are done (black), visiting are on the current path (grey)
		if (visiting.add(key)) {
			for (Key<?> dependency : binding.getDependencies()) {
				if (!visited.contains(dependency)) {
					collectCycles(bindings, visited, visiting, cycles, dependency);
				}
			}
			visiting.remove(key);
			visited.add(key);
			return;
		}

		// the path looks like a -> b -> c -> d here with c requested again, so the cycle is c -> d (-> c)
		List<Key<?>> path = new ArrayList<>(visiting);
		cycles.add(path.subList(path.indexOf(key), path.size()).toArray(new Key<?>[0]));
	}

	private static String describe(BindingType type) {
		return switch (type) {
			case COMPONENT -> "a component";
			case PROVIDER -> "a provider";
			case ASYNC_PROVIDER -> "an async provider";
		};
	}
}
