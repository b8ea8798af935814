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

package org.elasticsoftware.eventmachine.aggregate;

import jakarta.annotation.Nullable;
import org.elasticsoftware.eventmachine.errors.ConfigurationException;
import org.elasticsoftware.eventmachine.events.EventApplyFunction;
import org.elasticsoftware.eventmachine.messaging.EventMessage;
import org.elasticsoftware.eventmachine.messaging.MessageConverter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Resolved description of an aggregate type: how it is identified, which stream it lives in and how its
 * state is derived from its events.
 */
public final class AggregateDescription {
    public static final String DEFAULT_STREAM_NAME = "event_stream";

    private final String aggregateType;
    private final String identifierField;
    private final String streamName;
    private final Map<String, EventApplyFunction<Object, Object>> eventApplyMap;
    private final Map<String, MessageConverter<?>> eventConverters;

    private AggregateDescription(String aggregateType,
                                 String identifierField,
                                 String streamName,
                                 Map<String, EventApplyFunction<Object, Object>> eventApplyMap,
                                 Map<String, MessageConverter<?>> eventConverters) {
        this.aggregateType = aggregateType;
        this.identifierField = identifierField;
        this.streamName = streamName;
        this.eventApplyMap = Collections.unmodifiableMap(eventApplyMap);
        this.eventConverters = Collections.unmodifiableMap(eventConverters);
    }

    public static Builder builder(String aggregateType) {
        return new Builder().setAggregateType(aggregateType);
    }

    public String getAggregateType() {
        return aggregateType;
    }

    public String getIdentifierField() {
        return identifierField;
    }

    public String getStreamName() {
        return streamName;
    }

    public Set<String> getEventNames() {
        return eventApplyMap.keySet();
    }

    public Map<String, EventApplyFunction<Object, Object>> getEventApplyMap() {
        return eventApplyMap;
    }

    public EventApplyFunction<Object, Object> getApplyFunction(String eventName) {
        EventApplyFunction<Object, Object> applyFunction = eventApplyMap.get(eventName);
        if (applyFunction == null) {
            throw new ConfigurationException("No apply function registered for event %s of aggregate %s"
                    .formatted(eventName, aggregateType));
        }
        return applyFunction;
    }

    @Nullable
    public MessageConverter<?> getEventConverter(String eventName) {
        return eventConverters.get(eventName);
    }

    /**
     * @return the event in the representation the apply function expects
     */
    public Object materialize(EventMessage event) {
        MessageConverter<?> converter = eventConverters.get(event.name());
        return converter != null ? converter.convert(event) : event;
    }

    @Override
    public String toString() {
        return "AggregateDescription{" + aggregateType + "@" + streamName + "}";
    }

    public static class Builder {
        private final Map<String, EventApplyFunction<Object, Object>> eventApplyMap = new LinkedHashMap<>();
        private final Map<String, MessageConverter<?>> eventConverters = new LinkedHashMap<>();
        private String aggregateType;
        private String identifierField;
        private String streamName = DEFAULT_STREAM_NAME;

        public Builder setAggregateType(String aggregateType) {
            this.aggregateType = aggregateType;
            return this;
        }

        public Builder setIdentifierField(String identifierField) {
            this.identifierField = identifierField;
            return this;
        }

        public Builder setStreamName(String streamName) {
            this.streamName = streamName;
            return this;
        }

        @SuppressWarnings("unchecked")
        public <S> Builder addApplyFunction(String eventName, EventApplyFunction<S, EventMessage> applyFunction) {
            this.eventApplyMap.put(eventName, (EventApplyFunction<Object, Object>) (EventApplyFunction<?, ?>) applyFunction);
            return this;
        }

        /**
         * Registers an apply function that receives the event converted by {@code converter} instead of the
         * generic {@link EventMessage}.
         */
        @SuppressWarnings("unchecked")
        public <S, E> Builder addApplyFunction(String eventName,
                                               MessageConverter<E> converter,
                                               EventApplyFunction<S, E> applyFunction) {
            this.eventConverters.put(eventName, converter);
            this.eventApplyMap.put(eventName, (EventApplyFunction<Object, Object>) (EventApplyFunction<?, ?>) applyFunction);
            return this;
        }

        public AggregateDescription build() {
            if (aggregateType == null || aggregateType.isBlank()) {
                throw new ConfigurationException("Missing aggregateType in aggregate description");
            }
            if (identifierField == null || identifierField.isBlank()) {
                throw new ConfigurationException("Missing identifierField in description of aggregate " + aggregateType);
            }
            if (streamName == null || streamName.isBlank()) {
                throw new ConfigurationException("Missing streamName in description of aggregate " + aggregateType);
            }
            return new AggregateDescription(aggregateType,
                    identifierField,
                    streamName,
                    new LinkedHashMap<>(eventApplyMap),
                    new LinkedHashMap<>(eventConverters));
        }
    }
}
