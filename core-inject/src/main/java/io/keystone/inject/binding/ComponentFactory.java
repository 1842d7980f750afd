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

import io.keystone.inject.ComponentContext;

/**
 * Constructs a component from its declared dependencies and parameters.
 * <p>
 * Component construction is infallible by contract: every dependency is itself a component,
 * and every parameter is either defaulted or supplied, so no checked exception is allowed here.
 */
@FunctionalInterface
public interface ComponentFactory<T> {
	T create(ComponentContext context);
}
