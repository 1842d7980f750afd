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

import java.util.Arrays;
import java.util.List;

public interface BindingTableBuilder1<T> extends BindingTableBuilder {
	/**
	 * Declares the dependencies of the current binding, in the order they are resolved.
	 * May be called more than once, the keys are appended.
	 */
	BindingTableBuilder1<T> withDependencies(List<Key<?>> dependencies);

	default BindingTableBuilder1<T> withDependencies(Key<?>... dependencies) {
		return withDependencies(List.of(dependencies));
	}

	default BindingTableBuilder1<T> withDependencies(Class<?>... dependencies) {
		return withDependencies(Arrays.stream(dependencies).<Key<?>>map(Key::of).toList());
	}

	/**
	 * Declares the parameters of the current binding, only components may have parameters.
	 */
	BindingTableBuilder1<T> withParameters(List<Parameter<?>> parameters);

	default BindingTableBuilder1<T> withParameters(Parameter<?>... parameters) {
		return withParameters(List.of(parameters));
	}
}
