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

import java.util.Map;
import java.util.Optional;

/**
 * An event as produced by a {@link org.elasticsoftware.eventmachine.commands.CommandHandlerFunction},
 * before it is normalized into an {@link org.elasticsoftware.eventmachine.messaging.EventMessage}.
 * <p>
 * {@code metadata} is kept as a plain object on purpose: command handlers built from loosely typed
 * configuration can hand in anything, and the normalizer reports non-map metadata.
 */
public record EmittedEvent(String eventName, EventPayload payload, @Nullable Object metadata) {
    public static EmittedEvent of(String eventName, Map<String, Object> payload) {
        return new EmittedEvent(eventName, new RawPayload(payload), null);
    }

    public static EmittedEvent of(String eventName, Map<String, Object> payload, Map<String, Object> metadata) {
        return new EmittedEvent(eventName, new RawPayload(payload), metadata);
    }

    public static EmittedEvent of(String eventName, EventConvertible event) {
        return new EmittedEvent(eventName, new AdaptedPayload(event), null);
    }

    /**
     * Signals that no event should be recorded for this step of the command handler.
     */
    public static Optional<EmittedEvent> nothing() {
        return Optional.empty();
    }
}
