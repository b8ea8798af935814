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
import org.elasticsoftware.eventmachine.errors.EventShapeException;
import org.elasticsoftware.eventmachine.errors.MetadataTypeException;
import org.elasticsoftware.eventmachine.events.AdaptedPayload;
import org.elasticsoftware.eventmachine.events.EmittedEvent;
import org.elasticsoftware.eventmachine.events.EventConvertible;
import org.elasticsoftware.eventmachine.events.EventPayload;
import org.elasticsoftware.eventmachine.events.RawPayload;
import org.elasticsoftware.eventmachine.messaging.CommandMessage;
import org.elasticsoftware.eventmachine.messaging.EventMessage;
import org.elasticsoftware.eventmachine.messaging.MessageFactory;
import org.elasticsoftware.eventmachine.messaging.MetadataKeys;

import java.lang.reflect.Array;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns the items produced by a command handler into {@link EventMessage}s carrying causation metadata.
 * Has no side effects.
 */
public final class EventNormalizer {
    private final MessageFactory messageFactory;

    public EventNormalizer(MessageFactory messageFactory) {
        this.messageFactory = Objects.requireNonNull(messageFactory, "messageFactory");
    }

    public Optional<EventMessage> normalize(@Nullable Object rawItem, String aggregateType, CommandMessage command) {
        return normalize(rawItem, aggregateType, command.name(), command.uuid());
    }

    /**
     * @return the normalized event, or empty when the item signals that nothing should be recorded
     * @throws EventShapeException    if the item is not an event representation
     * @throws MetadataTypeException  if the item carries metadata that is not a map
     */
    public Optional<EventMessage> normalize(@Nullable Object rawItem,
                                            String aggregateType,
                                            String commandName,
                                            UUID causationId) {
        Object item = rawItem instanceof Optional<?> optional ? optional.orElse(null) : rawItem;
        if (isEmpty(item)) {
            return Optional.empty();
        }
        final EmittedEvent emittedEvent = toEmittedEvent(item, aggregateType, commandName);

        final Map<String, Object> payload;
        Map<String, Object> metadata;
        if (emittedEvent.payload() instanceof RawPayload rawPayload) {
            payload = rawPayload.payload();
            metadata = Collections.emptyMap();
        } else {
            EventConvertible event = ((AdaptedPayload) emittedEvent.payload()).event();
            Map<String, Object> fields = event.toMessageFields();
            if (fields == null || !(fields.get(MessageFactory.PAYLOAD_FIELD) instanceof Map<?, ?> adaptedPayload)) {
                throw new EventShapeException(("Event %s returned by aggregate of type %s while handling command %s " +
                        "should return a map with a payload entry from toMessageFields")
                        .formatted(event.getClass().getName(), aggregateType, commandName),
                        aggregateType,
                        commandName);
            }
            payload = checkKeys(adaptedPayload, aggregateType, commandName);
            metadata = toMetadata(fields.get(MessageFactory.METADATA_FIELD), aggregateType, commandName);
        }
        // explicit metadata replaces the metadata of an adapted event
        if (emittedEvent.metadata() != null) {
            metadata = toMetadata(emittedEvent.metadata(), aggregateType, commandName);
        }

        Map<String, Object> eventMetadata = new LinkedHashMap<>(metadata);
        // causation fields always win over handler supplied values
        eventMetadata.put(MetadataKeys.CAUSATION_ID, causationId.toString());
        eventMetadata.put(MetadataKeys.CAUSATION_NAME, commandName);

        return Optional.of(messageFactory.createEvent(emittedEvent.eventName(), payload, eventMetadata));
    }

    private EmittedEvent toEmittedEvent(Object item, String aggregateType, String commandName) {
        if (item instanceof EmittedEvent emittedEvent) {
            if (emittedEvent.eventName() == null || emittedEvent.eventName().isBlank() || emittedEvent.payload() == null) {
                throw invalidFormat(aggregateType, commandName);
            }
            return emittedEvent;
        }
        List<?> tuple;
        if (item instanceof List<?> list) {
            tuple = list;
        } else if (item instanceof Object[] array) {
            tuple = Arrays.asList(array);
        } else {
            throw invalidFormat(aggregateType, commandName);
        }
        if (tuple.size() < 2 || tuple.size() > 3
                || !(tuple.get(0) instanceof String eventName)
                || eventName.isBlank()) {
            throw invalidFormat(aggregateType, commandName);
        }
        final EventPayload payload;
        if (tuple.get(1) instanceof Map<?, ?> map) {
            payload = new RawPayload(checkKeys(map, aggregateType, commandName));
        } else if (tuple.get(1) instanceof EventConvertible convertible) {
            payload = new AdaptedPayload(convertible);
        } else if (tuple.get(1) instanceof EventPayload eventPayload) {
            payload = eventPayload;
        } else {
            throw invalidFormat(aggregateType, commandName);
        }
        return new EmittedEvent(eventName, payload, tuple.size() == 3 ? tuple.get(2) : null);
    }

    private Map<String, Object> toMetadata(@Nullable Object metadata, String aggregateType, String commandName) {
        if (metadata == null) {
            return Collections.emptyMap();
        }
        if (!(metadata instanceof Map<?, ?> map)) {
            throw new MetadataTypeException(aggregateType, commandName, metadata.getClass());
        }
        return checkKeys(map, aggregateType, commandName);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> checkKeys(Map<?, ?> map, String aggregateType, String commandName) {
        for (Object key : map.keySet()) {
            if (!(key instanceof String)) {
                throw new EventShapeException(("Event returned by aggregate of type %s while handling command %s " +
                        "contains a non string key %s").formatted(aggregateType, commandName, key),
                        aggregateType,
                        commandName);
            }
        }
        return (Map<String, Object>) map;
    }

    // falsy values mean "no event": null, false, zero, "" and "0", and empty collections, maps or arrays
    private static boolean isEmpty(@Nullable Object item) {
        if (item == null) {
            return true;
        } else if (item instanceof Boolean bool) {
            return !bool;
        } else if (item instanceof Number number) {
            return number.doubleValue() == 0d;
        } else if (item instanceof CharSequence chars) {
            return chars.isEmpty() || "0".contentEquals(chars);
        } else if (item instanceof Collection<?> collection) {
            return collection.isEmpty();
        } else if (item instanceof Map<?, ?> map) {
            return map.isEmpty();
        } else if (item.getClass().isArray()) {
            return Array.getLength(item) == 0;
        }
        return false;
    }

    private static EventShapeException invalidFormat(String aggregateType, String commandName) {
        return new EventShapeException(("Event returned by aggregate of type %s while handling command %s does not " +
                "have the format [String eventName, Map payload | EventConvertible event, Map metadata?]")
                .formatted(aggregateType, commandName),
                aggregateType,
                commandName);
    }
}
