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

package io.keystone.inject.util;

import io.keystone.inject.Key;
import io.keystone.inject.binding.Binding;
import io.keystone.inject.table.BindingTable;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.annotation.Annotation;
import java.lang.reflect.Type;
import java.util.*;
import java.util.Map.Entry;
import java.util.regex.Pattern;

import static io.keystone.inject.binding.BindingType.ASYNC_PROVIDER;
import static io.keystone.inject.binding.BindingType.PROVIDER;
import static java.util.stream.Collectors.joining;

public final class Utils {
	private static final Pattern PACKAGE_PREFIX = Pattern.compile("\\b[a-z_][a-zA-Z0-9_]*\\.");

	private Utils() {}

	public static void checkArgument(boolean condition, String message) {
		if (!condition) {
			throw new IllegalArgumentException(message);
		}
	}

	public static void checkState(boolean condition, String message) {
		if (!condition) {
			throw new IllegalStateException(message);
		}
	}

	public static String getLocation(@Nullable Binding<?> binding) {
		LocationInfo location = binding != null ? binding.getLocation() : null;
		return "at " + (location != null ? location.toString() : "<unknown binding location>");
	}

	/**
	 * Strips package prefixes from a type name, so that
	 * {@code java.util.List<java.lang.String>} becomes {@code List<String>}
	 * and nested classes are joined with a dot.
	 */
	public static String getShortName(Type type) {
		String name = type instanceof Class<?> cls ? cls.getName() : type.getTypeName();
		return PACKAGE_PREFIX.matcher(name).replaceAll("").replace('$', '.');
	}

	public static String getDisplayString(@NotNull Object object) {
		if (object instanceof Annotation annotation) {
			String typeName = annotation.annotationType().getName();
			String str = annotation.toString();
			return str.startsWith("@" + typeName) ?
					"@" + getShortName(annotation.annotationType()) + str.substring(typeName.length() + 1) :
					str;
		}
		if (object instanceof Class<?> cls) {
			return getShortName(cls);
		}
		return object.toString();
	}

	public static int getKeyDisplayCenter(Key<?> key) {
		Object qualifier = key.getQualifier();
		int nameOffset = qualifier != null ? getDisplayString(qualifier).length() + 1 : 0;
		return nameOffset + (key.getDisplayString().length() - nameOffset) / 2;
	}

	public static String drawCycle(Key<?>[] cycle) {
		int offset = getKeyDisplayCenter(cycle[0]);
		String cycleString = Arrays.stream(cycle).map(Key::getDisplayString).collect(joining(" -> ", "\t", ""));
		String indent = " ".repeat(offset);
		String line = "-".repeat(cycleString.length() - offset);
		return cycleString + " -,\n\t" + indent + "^" + line + "'";
	}

	/**
	 * A shortcut for printing the result of {@link #makeGraphVizGraph} into the standard output.
	 */
	public static void printGraphVizGraph(BindingTable table) {
		System.out.println(makeGraphVizGraph(table));
	}

	/**
	 * Makes a GraphViz graph representation of the binding table.
	 * Components are drawn as plain nodes, providers as dotted ones and async providers as dashed ones.
	 */
	@SuppressWarnings("StringConcatenationInsideStringBufferAppend")
	public static String makeGraphVizGraph(BindingTable table) {
		StringBuilder sb = new StringBuilder();
		sb.append("digraph {\n\trankdir=BT;\n");

		Set<Key<?>> leafs = new LinkedHashSet<>();
		for (Entry<Key<?>, Binding<?>> entry : table.getBindings().entrySet()) {
			Key<?> key = entry.getKey();
			Binding<?> binding = entry.getValue();
			if (binding.getDependencies().isEmpty()) {
				leafs.add(key);
			}
			sb.append('\t')
					.append(quote(key))
					.append(" [label=" + '"' + escape(key.getDisplayString()) + '"')
					.append(binding.getType() == PROVIDER ? " style=dotted" :
							binding.getType() == ASYNC_PROVIDER ? " style=dashed" :
									"")
					.append("];\n");
		}

		if (!leafs.isEmpty()) {
			sb.append(leafs.stream()
					.map(Utils::quote)
					.collect(joining(" ", "\n\t{ rank=same; ", " }\n\n")));
		}

		for (Entry<Key<?>, Binding<?>> entry : table.getBindings().entrySet()) {
			for (Key<?> dependency : entry.getValue().getDependencies()) {
				sb.append('\t' + quote(entry.getKey()) + " -> " + quote(dependency) + " [];\n");
			}
		}
		sb.append("}\n");
		return sb.toString();
	}

	private static String quote(Key<?> key) {
		return '"' + escape(key.toString()) + '"';
	}

	private static String escape(String string) {
		return string.replace("\"", "\\\"");
	}
}
