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

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

import static io.keystone.inject.util.Utils.checkArgument;

/**
 * An immutable overlay of explicit parameter values for one component, keyed by parameter name.
 * <p>
 * Values may be already typed, or may be configuration text that is converted
 * by the declared {@link Parameter} when the module is built.
 */
public final class Parameters {
	private static final Parameters EMPTY = new Parameters(Map.of());

	private final Map<String, Object> values;

	private Parameters(Map<String, Object> values) {
		this.values = values;
	}

	public static Parameters create() {
		return EMPTY;
	}

	public static Parameters of(@NotNull Map<String, ?> values) {
		Map<String, Object> copy = new LinkedHashMap<>();
		values.forEach((name, value) -> {
			checkArgument(name != null && !name.isEmpty(), "Parameter name cannot be empty");
			checkArgument(value != null, "Value of parameter '" + name + "' cannot be null");
			copy.put(name, value);
		});
		return new Parameters(Collections.unmodifiableMap(copy));
	}

	/**
	 * Collects the properties under the given prefix, so that with prefix {@code writer}
	 * a property {@code writer.year=2020} becomes the parameter {@code year} with text value {@code "2020"}.
	 * An empty prefix takes every property.
	 */
	public static Parameters ofProperties(@NotNull Properties properties, @NotNull String prefix) {
		String fullPrefix = prefix.isEmpty() ? "" : prefix + ".";
		Map<String, Object> values = new TreeMap<>();
		for (String propertyName : properties.stringPropertyNames()) {
			if (!propertyName.startsWith(fullPrefix)) continue;
			String name = propertyName.substring(fullPrefix.length());
			if (name.isEmpty()) continue;
			values.put(name, properties.getProperty(propertyName));
		}
		return of(values);
	}

	public Parameters with(@NotNull String name, @NotNull Object value) {
		Map<String, Object> copy = new LinkedHashMap<>(values);
		copy.put(name, value);
		return of(copy);
	}

	public <T> Parameters with(@NotNull Parameter<T> parameter, @NotNull T value) {
		return with(parameter.getName(), value);
	}

	public boolean has(String name) {
		return values.containsKey(name);
	}

	public @Nullable Object get(String name) {
		return values.get(name);
	}

	public Set<String> getNames() {
		return values.keySet();
	}

	public Map<String, Object> asMap() {
		return values;
	}

	public boolean isEmpty() {
		return values.isEmpty();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return values.equals(((Parameters) o).values);
	}

	@Override
	public int hashCode() {
		return values.hashCode();
	}

	@Override
	public String toString() {
		return "Parameters" + values;
	}
}
