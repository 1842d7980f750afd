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
import io.keystone.inject.Module;
import org.jetbrains.annotations.Nullable;

import static io.keystone.inject.util.Utils.getLocation;

/**
 * A runtime exception that is thrown when static conditions of a binding table fail
 * (missing or cyclic dependencies, components depending on providers etc.),
 * when a module cannot be built from the staged overrides,
 * or in runtime when a {@link Module} is asked for something it was never bound to do.
 * <p>
 * It is never used for failures of provider factories, those reach the caller unchanged.
 */
public final class DIException extends RuntimeException {
	public static DIException cannotConstruct(Key<?> key, @Nullable Binding<?> binding) {
		return new DIException(
			(binding != null ?
				"Binding refused to" :
				"No binding to") +
			" construct an instance for key " + key.getDisplayString() +
			(binding != null && binding.getLocation() != null ?
				("\n\t " + getLocation(binding)) :
				""));
	}

	public static DIException wrongBindingType(Key<?> key, BindingType requested, Binding<?> binding) {
		return new DIException("Key " + key.getDisplayString() + " is bound as " + describe(binding.getType()) +
				", not as " + describe(requested) + "\n\t " + getLocation(binding));
	}

	public static DIException notBound(Key<?> key, BindingType requested) {
		return new DIException("Key " + key.getDisplayString() + " is not bound as " + describe(requested));
	}

	public static DIException undeclaredDependency(Binding<?> binding, Key<?> dependency) {
		return new DIException(binding.getDisplayString() + " for key " + binding.getKey().getDisplayString() +
				" requested " + dependency.getDisplayString() + " which is not among its declared dependencies" +
				"\n\t " + getLocation(binding));
	}

	public static DIException undeclaredParameter(Binding<?> binding, String name) {
		return new DIException("Component " + binding.getKey().getDisplayString() +
				" has no parameter '" + name + "'" +
				"\n\t " + getLocation(binding));
	}

	public static DIException reentrantConstruction(Key<?> key) {
		return new DIException("Component " + key.getDisplayString() +
				" was requested again while it was being constructed, this is a dependency cycle");
	}

	public DIException(String message) {
		super(message);
	}

	private static String describe(BindingType type) {
		return switch (type) {
			case COMPONENT -> "a component";
			case PROVIDER -> "a provider";
			case ASYNC_PROVIDER -> "an async provider";
		};
	}
}
