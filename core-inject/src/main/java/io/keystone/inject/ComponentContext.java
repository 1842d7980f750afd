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

import io.keystone.inject.binding.ComponentFactory;

/**
 * What a {@link ComponentFactory component factory} sees while its component is being constructed.
 * <p>
 * Only the declared dependencies of the component can be resolved,
 * and only its declared parameters can be read.
 */
public interface ComponentContext {
	<T> T resolve(Key<T> key);

	default <T> T resolve(Class<T> type) {
		return resolve(Key.of(type));
	}

	/**
	 * Returns the value of the parameter from the overlay, or its default value.
	 */
	<T> T getParameter(Parameter<T> parameter);
}
