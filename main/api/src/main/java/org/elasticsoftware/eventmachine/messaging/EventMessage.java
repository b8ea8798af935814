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

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

public record EventMessage(
        String name,
        UUID uuid,
        Instant createdAt,
        Map<String, Object> payload,
        Map<String, Object> metadata
) implements Message {
    public EventMessage {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(uuid, "uuid");
        Objects.requireNonNull(createdAt, "createdAt");
        payload = MessageMaps.immutableCopy(payload);
        metadata = MessageMaps.immutableCopy(metadata);
    }

    @Override
    public MessageType messageType() {
        return MessageType.EVENT;
    }

    public EventMessage withAddedMetadata(String key, Object value) {
        Map<String, Object> newMetadata = new LinkedHashMap<>(metadata);
        newMetadata.put(key, value);
        return new EventMessage(name, uuid, createdAt, payload, newMetadata);
    }

    public EventMessage withAddedMetadata(Map<String, Object> additionalMetadata) {
        Map<String, Object> newMetadata = new LinkedHashMap<>(metadata);
        newMetadata.putAll(additionalMetadata);
        return new EventMessage(name, uuid, createdAt, payload, newMetadata);
    }

    /**
     * @return the aggregate version this event was recorded with, or 0 when the event was not (yet) recorded
     */
    public long aggregateVersion() {
        Object version = metadata.get(MetadataKeys.AGGREGATE_VERSION);
        return version instanceof Number number ? number.longValue() : 0L;
    }
}
