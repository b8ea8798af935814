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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.elasticsoftware.eventmachine.errors.ConfigurationException;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * {@link MessageFactory} backed by a registry of known command and event names.
 */
public class DefaultMessageFactory implements MessageFactory {
    private final Map<String, MessageType> messageTypes;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private DefaultMessageFactory(Map<String, MessageType> messageTypes, ObjectMapper objectMapper, Clock clock) {
        this.messageTypes = Collections.unmodifiableMap(messageTypes);
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Message createMessage(String messageName, Map<String, Object> payload, Map<String, Object> metadata) {
        return create(messageName, UUID.randomUUID(), clock.instant(), payload, metadata);
    }

    @Override
    public Message createMessageFromFields(String messageName, Map<String, Object> fields) {
        return create(messageName,
                toUuid(messageName, fields.get(UUID_FIELD)),
                toInstant(messageName, fields.get(CREATED_AT_FIELD)),
                toMap(messageName, PAYLOAD_FIELD, fields.get(PAYLOAD_FIELD)),
                toMap(messageName, METADATA_FIELD, fields.get(METADATA_FIELD)));
    }

    @Override
    public EventMessage createEvent(String eventName, Map<String, Object> payload, Map<String, Object> metadata) {
        requireType(eventName, MessageType.EVENT);
        return (EventMessage) createMessage(eventName, payload, metadata);
    }

    @Override
    public CommandMessage createCommand(String commandName, Map<String, Object> payload) {
        requireType(commandName, MessageType.COMMAND);
        return (CommandMessage) createMessage(commandName, payload, null);
    }

    public boolean isKnownMessage(String messageName) {
        return messageTypes.containsKey(messageName);
    }

    private Message create(String messageName,
                           UUID uuid,
                           Instant createdAt,
                           Map<String, Object> payload,
                           Map<String, Object> metadata) {
        MessageType messageType = messageTypes.get(messageName);
        if (messageType == null) {
            throw new ConfigurationException("Unknown message " + messageName + ". Did you forget to register it?");
        }
        return switch (messageType) {
            case COMMAND -> new CommandMessage(messageName, uuid, createdAt, payload, metadata);
            case EVENT -> new EventMessage(messageName, uuid, createdAt, payload, metadata);
        };
    }

    private void requireType(String messageName, MessageType expectedType) {
        MessageType messageType = messageTypes.get(messageName);
        if (messageType != null && messageType != expectedType) {
            throw new ConfigurationException("Message %s is registered as %s, not as %s"
                    .formatted(messageName, messageType, expectedType));
        }
    }

    private UUID toUuid(String messageName, Object value) {
        if (value == null) {
            return UUID.randomUUID();
        } else if (value instanceof UUID uuid) {
            return uuid;
        }
        try {
            return UUID.fromString(value.toString());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid uuid " + value + " for message " + messageName, e);
        }
    }

    private Instant toInstant(String messageName, Object value) {
        if (value == null) {
            return clock.instant();
        } else if (value instanceof Instant instant) {
            return instant;
        }
        try {
            return objectMapper.convertValue(value, Instant.class);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid " + CREATED_AT_FIELD + " " + value + " for message " + messageName, e);
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> toMap(String messageName, String field, Object value) {
        if (value == null) {
            return Collections.emptyMap();
        } else if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        throw new IllegalArgumentException("Field %s of message %s must be a map but was %s"
                .formatted(field, messageName, value.getClass().getName()));
    }

    public static class Builder {
        private final Map<String, MessageType> messageTypes = new HashMap<>();
        private ObjectMapper objectMapper;
        private Clock clock = Clock.systemUTC();

        public Builder registerCommand(String commandName) {
            return register(commandName, MessageType.COMMAND);
        }

        public Builder registerEvent(String eventName) {
            return register(eventName, MessageType.EVENT);
        }

        private Builder register(String messageName, MessageType messageType) {
            MessageType existing = messageTypes.putIfAbsent(messageName, messageType);
            if (existing != null && existing != messageType) {
                throw new ConfigurationException("Message %s cannot be registered as %s, it is already registered as %s"
                        .formatted(messageName, messageType, existing));
            }
            return this;
        }

        public Builder setObjectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder setClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public DefaultMessageFactory build() {
            ObjectMapper mapper = objectMapper != null ? objectMapper : new ObjectMapper().registerModule(new JavaTimeModule());
            return new DefaultMessageFactory(new HashMap<>(messageTypes), mapper, clock);
        }
    }
}
