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

package io.keystone.inject.util;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * LocationInfo is attached to a {@link io.keystone.inject.binding.Binding binding} by the table DSL
 * so that error messages can show where a binding was declared.
 */
public final class LocationInfo {
	private final Object declarer;
	private final @Nullable StackTraceElement frame;

	private LocationInfo(Object declarer, @Nullable StackTraceElement frame) {
		this.declarer = declarer;
		this.frame = frame;
	}

	public static LocationInfo from(@NotNull Object declarer, @Nullable StackTraceElement frame) {
		return new LocationInfo(declarer, frame);
	}

	@Override
	public String toString() {
		if (frame == null) {
			return "object " + declarer;
		}
		return "object " + declarer + ", declared at " + frame.getClassName() + "." + frame.getMethodName() +
				"(" + frame.getFileName() + ":" + frame.getLineNumber() + ")";
	}
}
