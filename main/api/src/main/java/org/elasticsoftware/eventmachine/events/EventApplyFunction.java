/*
 * Copyright 2022 - 2025 The Original Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 *     you may not use this file except in compliance with the License.
 *     You may obtain a copy of the License at
 *
 *           http://www.apache.org/licenses/LICENSE-2.0
 *
 *     Unless required by applicable law or agreed to in writing, software
 *     distributed under the License is distributed on an "AS IS" BASIS,
 *     WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *     See the License for the specific language governing permissions and
 *     limitations under the License.
 *
 */

package org.elasticsoftware.eventmachine.events;

import jakarta.annotation.Nullable;
import jakarta.validation.constraints.NotNull;

/**
 * Produces the next aggregate state from the current state and a recorded event. Implementations must be
 * pure: replaying the same history must always yield the same state.
 *
 * @param <S> the aggregate state type
 * @param <E> the event type, an {@link org.elasticsoftware.eventmachine.messaging.EventMessage} unless a
 *            converter is registered for the event
 */
@FunctionalInterface
public interface EventApplyFunction<S, E> {
    @NotNull S apply(@NotNull E event, @Nullable S state);
}
