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

import java.util.concurrent.CompletionStage;

/**
 * The read-only surface of a built {@link Module}.
 * <p>
 * Provider factories see the module through this interface too, restricted to the declared dependencies of the provider.
 * <p>
 * Integrations, such as request handlers of a web framework, should receive
 * an already built module through this interface and only resolve or provide from it.
 */
public interface ResourceLocator {
	<T> T resolve(Key<T> key);

	default <T> T resolve(Class<T> type) {
		return resolve(Key.of(type));
	}

	<T> T provide(Key<T> key) throws Exception;

	default <T> T provide(Class<T> type) throws Exception {
		return provide(Key.of(type));
	}

	<T> CompletionStage<T> asyncProvide(Key<T> key);

	default <T> CompletionStage<T> asyncProvide(Class<T> type) {
		return asyncProvide(Key.of(type));
	}
}
