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

/**
 * The kind of a binding, which decides its lifetime and what it may depend on.
 */
public enum BindingType {
	/**
	 * Constructed at most once per module, lazily, and shared.
	 * May depend on other components only.
	 */
	COMPONENT,

	/**
	 * Constructed anew on every request.
	 * May depend on components and on other providers.
	 */
	PROVIDER,

	/**
	 * Like a {@link #PROVIDER provider}, but its construction may suspend.
	 * May depend on components, providers and other async providers.
	 */
	ASYNC_PROVIDER
}
