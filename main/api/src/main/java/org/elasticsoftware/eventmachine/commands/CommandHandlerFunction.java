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

package org.elasticsoftware.eventmachine.commands;

import jakarta.annotation.Nullable;
import jakarta.validation.constraints.NotNull;

import java.util.stream.Stream;

/**
 * Decides which events a command causes. The returned stream is consumed lazily and in order, every item
 * is recorded on the aggregate before the next one is requested.
 * <p>
 * Items can be {@link org.elasticsoftware.eventmachine.events.EmittedEvent}s, {@code [name, payload]} or
 * {@code [name, payload, metadata]} tuples (as {@link java.util.List} or array), or {@code null} /
 * {@link java.util.Optional#empty()} to record nothing.
 *
 * @param <S> the aggregate state type
 * @param <C> the command type, a {@link org.elasticsoftware.eventmachine.messaging.CommandMessage} unless a
 *            command converter is configured
 */
@FunctionalInterface
public interface CommandHandlerFunction<S, C> {
    /**
     * @param command the command
     * @param state   the current state, {@code null} for commands that create the aggregate
     * @param context the value of the configured context provider, {@code null} when none is configured
     */
    @NotNull Stream<?> apply(@NotNull C command, @Nullable S state, @Nullable Object context);
}
