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

package org.elasticsoftware.eventmachine.messaging;

import jakarta.validation.constraints.NotNull;

import java.util.Map;

/**
 * Creates {@link CommandMessage}s and {@link EventMessage}s. The same factory is used for both, the
 * message name decides which kind of message is created.
 */
public interface MessageFactory {
    String UUID_FIELD = "uuid";
    String CREATED_AT_FIELD = "created_at";
    String PAYLOAD_FIELD = "payload";
    String METADATA_FIELD = "metadata";

    @NotNull Message createMessage(@NotNull String messageName,
                                   @NotNull Map<String, Object> payload,
                                   Map<String, Object> metadata);

    /**
     * Creates a message from its field representation. Recognized fields are {@value #UUID_FIELD},
     * {@value #CREATED_AT_FIELD}, {@value #PAYLOAD_FIELD} and {@value #METADATA_FIELD}. A missing uuid or
     * creation time is generated.
     */
    @NotNull Message createMessageFromFields(@NotNull String messageName, @NotNull Map<String, Object> fields);

    default EventMessage createEvent(String eventName, Map<String, Object> payload, Map<String, Object> metadata) {
        return (EventMessage) createMessage(eventName, payload, metadata);
    }

    default CommandMessage createCommand(String commandName, Map<String, Object> payload) {
        return (CommandMessage) createMessage(commandName, payload, null);
    }
}
