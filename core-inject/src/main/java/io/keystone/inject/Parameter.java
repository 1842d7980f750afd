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

import java.util.Map;
import java.util.function.Function;

import static io.keystone.inject.util.Utils.checkArgument;
import static io.keystone.inject.util.Utils.checkState;

/**
 * A named and typed property of a component that is not a dependency.
 * <p>
 * When a component is constructed, the value of a parameter is taken from the {@link Parameters}
 * overlay given to the {@link ModuleBuilder}, or else from the declared default.
 * A {@link #required(String, Class) required} parameter has no default, so every module
 * that may construct its component must supply a value for it.
 * <p>
 * Parameters whose overlay value comes from configuration text are converted
 * with the parameter converter, see {@link Parameters#ofProperties}.
 */
public final class Parameter<T> {
	private static final Map<Class<?>, Class<?>> WRAPPERS = Map.of(
			boolean.class, Boolean.class,
			byte.class, Byte.class,
			short.class, Short.class,
			char.class, Character.class,
			int.class, Integer.class,
			long.class, Long.class,
			float.class, Float.class,
			double.class, Double.class);

	private final String name;
	private final Class<T> type;
	private final @Nullable T defaultValue;
	private final @Nullable Function<String, ? extends T> converter;

	private Parameter(String name, Class<T> type, @Nullable T defaultValue, @Nullable Function<String, ? extends T> converter) {
		this.name = name;
		this.type = type;
		this.defaultValue = defaultValue;
		this.converter = converter;
	}

	public static <T> Parameter<T> of(@NotNull String name, @NotNull Class<T> type, @NotNull T defaultValue) {
		checkArgument(!name.isEmpty(), "Parameter name cannot be empty");
		//noinspection ConstantConditions
		checkArgument(defaultValue != null, "Default value of parameter '" + name + "' cannot be null, use Parameter.required(...) instead");
		Class<T> boxed = boxed(type);
		checkArgument(boxed.isInstance(defaultValue), "Default value " + defaultValue + " is not an instance of " + type.getName());
		return new Parameter<>(name, boxed, defaultValue, defaultConverter(boxed));
	}

	public static <T> Parameter<T> required(@NotNull String name, @NotNull Class<T> type) {
		checkArgument(!name.isEmpty(), "Parameter name cannot be empty");
		Class<T> boxed = boxed(type);
		return new Parameter<>(name, boxed, null, defaultConverter(boxed));
	}

	/**
	 * Returns a copy of this parameter that converts configuration text with the given converter.
	 */
	public Parameter<T> withConverter(@NotNull Function<String, ? extends T> converter) {
		return new Parameter<>(name, type, defaultValue, converter);
	}

	public String getName() {
		return name;
	}

	public Class<T> getType() {
		return type;
	}

	public boolean hasDefault() {
		return defaultValue != null;
	}

	public T getDefaultValue() {
		checkState(defaultValue != null, "Parameter '" + name + "' has no default value");
		return defaultValue;
	}

	public boolean hasConverter() {
		return converter != null;
	}

	public boolean accepts(Object value) {
		return type.isInstance(value);
	}

	public T convert(String text) {
		checkState(converter != null, "Parameter '" + name + "' has no converter for configuration text");
		T converted = converter.apply(text);
		checkArgument(converted != null, "Converter of parameter '" + name + "' returned null for '" + text + "'");
		return converted;
	}

	@SuppressWarnings("unchecked")
	private static <T> Class<T> boxed(Class<T> type) {
		Class<?> wrapper = WRAPPERS.get(type);
		return wrapper != null ? (Class<T>) wrapper : type;
	}

	@SuppressWarnings({"unchecked", "rawtypes"})
	private static <T> @Nullable Function<String, ? extends T> defaultConverter(Class<T> type) {
		if (type == String.class) return text -> (T) text;
		if (type == Integer.class) return text -> (T) Integer.valueOf(text.trim());
		if (type == Long.class) return text -> (T) Long.valueOf(text.trim());
		if (type == Double.class) return text -> (T) Double.valueOf(text.trim());
		if (type == Boolean.class) return text -> (T) parseBoolean(text.trim());
		if (type.isEnum()) return text -> (T) Enum.valueOf((Class) type, text.trim());
		return null;
	}

	private static Boolean parseBoolean(String text) {
		if (text.equalsIgnoreCase("true")) return Boolean.TRUE;
		if (text.equalsIgnoreCase("false")) return Boolean.FALSE;
		throw new IllegalArgumentException("Not a boolean: '" + text + "'");
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Parameter<?> other = (Parameter<?>) o;
		return name.equals(other.name) && type == other.type;
	}

	@Override
	public int hashCode() {
		return 31 * name.hashCode() + type.hashCode();
	}

	@Override
	public String toString() {
		return name + ": " + type.getSimpleName() + (defaultValue != null ? " = " + defaultValue : "");
	}
}
