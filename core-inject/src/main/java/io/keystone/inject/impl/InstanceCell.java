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
import org.jetbrains.annotations.Nullable;

/**
 * A slot for the single instance of a component.
 * <p>
 * It starts empty and, once an instance is created (or preset), holds it for the lifetime of the module.
 */
public interface InstanceCell<T> {
	Key<T> getKey();

	/**
	 * Returns the stored instance, creating it on the first call.
	 */
	T getInstance();

	/**
	 * Returns the stored instance without triggering its creation.
	 */
	@Nullable T peekInstance();
}
