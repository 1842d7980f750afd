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

import io.keystone.inject.util.Utils;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.Objects;

/**
 * The key defines an identity of a binding. A {@link io.keystone.inject.table.BindingTable binding table}
 * holds at most one binding per key, and the {@link Module} is queried by keys.
 * <p>
 * A key consists of a type and an optional qualifier, so that the same interface
 * can be bound more than once under distinct qualifiers.
 * <p>
 * Parameterized keys are made with the type-token idiom: {@code new Key<List<String>>() {}}.
 */
public class Key<T> {
	private final @NotNull Type type;
	private final @Nullable Object qualifier;

	/**
	 * Creates a key from the type parameter of an anonymous subclass.
	 */
	protected Key() {
		this(null);
	}

	/**
	 * Creates a qualified key from the type parameter of an anonymous subclass.
	 */
	protected Key(@Nullable Object qualifier) {
		this.type = extractTypeParameter(getClass());
		this.qualifier = qualifier;
	}

	private Key(@NotNull Type type, @Nullable Object qualifier) {
		this.type = type;
		this.qualifier = qualifier;
	}

	public static <T> Key<T> of(@NotNull Class<T> type) {
		return new Key<>(type, null);
	}

	public static <T> Key<T> of(@NotNull Class<T> type, @Nullable Object qualifier) {
		return new Key<>(type, qualifier);
	}

	public static <T> Key<T> ofType(@NotNull Type type) {
		return new Key<>(type, null);
	}

	public static <T> Key<T> ofType(@NotNull Type type, @Nullable Object qualifier) {
		return new Key<>(type, qualifier);
	}

	private static Type extractTypeParameter(Class<?> subclass) {
		Type superclass = subclass.getGenericSuperclass();
		if (!(superclass instanceof ParameterizedType parameterized) || parameterized.getRawType() != Key.class) {
			throw new IllegalArgumentException("Key type tokens must directly extend Key with a concrete type argument");
		}
		Type typeArgument = parameterized.getActualTypeArguments()[0];
		if (!(typeArgument instanceof Class) && !(typeArgument instanceof ParameterizedType)) {
			throw new IllegalArgumentException("Unsupported key type " + typeArgument.getTypeName());
		}
		return typeArgument;
	}

	public @NotNull Type getType() {
		return type;
	}

	@SuppressWarnings("unchecked")
	public @NotNull Class<T> getRawType() {
		if (type instanceof Class<?> cls) {
			return (Class<T>) cls;
		}
		if (type instanceof ParameterizedType parameterized) {
			return (Class<T>) parameterized.getRawType();
		}
		throw new IllegalStateException("Cannot get raw type of " + type.getTypeName());
	}

	public @Nullable Object getQualifier() {
		return qualifier;
	}

	/**
	 * Returns a new key with the same type and the given qualifier.
	 */
	public Key<T> qualified(@Nullable Object qualifier) {
		return new Key<>(type, qualifier);
	}

	/**
	 * Returns a short human-readable form of this key, used in error messages and graphs.
	 */
	public String getDisplayString() {
		return (qualifier != null ? Utils.getDisplayString(qualifier) + " " : "") + Utils.getShortName(type);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof Key<?> other)) return false;
		return type.equals(other.type) && Objects.equals(qualifier, other.qualifier);
	}

	@Override
	public int hashCode() {
		return 31 * type.hashCode() + (qualifier != null ? qualifier.hashCode() : 0);
	}

	@Override
	public String toString() {
		return "Key<" + type.getTypeName() + ">" + (qualifier != null ? "(" + qualifier + ")" : "");
	}
}
