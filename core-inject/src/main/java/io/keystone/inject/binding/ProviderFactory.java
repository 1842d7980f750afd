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

import io.keystone.inject.Module;
import io.keystone.inject.ResourceLocator;

/**
 * Produces a fresh instance on every call from the declared dependencies of its provider.
 * Asking the locator for any other key is a {@link DIException}.
 * <p>
 * Anything thrown here reaches the caller of {@link Module#provide} as is.
 */
@FunctionalInterface
public interface ProviderFactory<T> {
	T provide(ResourceLocator locator) throws Exception;
}
