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

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public sealed interface Message permits CommandMessage, EventMessage {
    @NotNull String name();

    @NotNull UUID uuid();

    @NotNull Instant createdAt();

    @NotNull Map<String, Object> payload();

    @NotNull Map<String, Object> metadata();

    MessageType messageType();

    default Object get(String payloadKey) {
        return payload().get(payloadKey);
    }

    default Object getMeta(String metadataKey) {
        return metadata().get(metadataKey);
    }
}
