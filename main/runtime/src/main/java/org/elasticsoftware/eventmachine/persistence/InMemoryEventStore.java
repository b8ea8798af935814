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

package org.elasticsoftware.eventmachine.persistence;

import org.elasticsoftware.eventmachine.errors.ConcurrencyConflictException;
import org.elasticsoftware.eventmachine.messaging.EventMessage;
import org.elasticsoftware.eventmachine.messaging.MetadataKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiConsumer;
import java.util.stream.Stream;

/**
 * {@link EventStore} keeping all streams in memory. Appends are serialized, subscribers are notified in
 * log order while the append still holds the store lock, so a subscriber must not append itself.
 */
public class InMemoryEventStore implements EventStore {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryEventStore.class);
    private final Map<String, List<EventMessage>> streams = new HashMap<>();
    private final Map<AggregateKey, Long> aggregateVersions = new HashMap<>();
    private final List<BiConsumer<String, EventMessage>> subscribers = new CopyOnWriteArrayList<>();
    private final ReentrantLock lock = new ReentrantLock();

    @Override
    public void appendTo(String streamName,
                         String aggregateType,
                         String aggregateId,
                         long expectedVersion,
                         List<EventMessage> events) {
        if (events.isEmpty()) {
            return;
        }
        final AggregateKey key = new AggregateKey(streamName, aggregateType, aggregateId);
        lock.lock();
        try {
            long currentVersion = aggregateVersions.getOrDefault(key, 0L);
            if (currentVersion != expectedVersion) {
                logger.debug("Rejecting {} events for {} {}, expected version {} but stream is at {}",
                        events.size(), aggregateType, aggregateId, expectedVersion, currentVersion);
                throw new ConcurrencyConflictException(streamName, aggregateId, expectedVersion, currentVersion);
            }
            for (int i = 0; i < events.size(); i++) {
                EventMessage event = events.get(i);
                if (event.aggregateVersion() != expectedVersion + i + 1
                        || !aggregateId.equals(event.getMeta(MetadataKeys.AGGREGATE_ID))
                        || !aggregateType.equals(event.getMeta(MetadataKeys.AGGREGATE_TYPE))) {
                    throw new IllegalArgumentException("Event %s does not belong to %s %s at version %d"
                            .formatted(event.name(), aggregateType, aggregateId, expectedVersion + i + 1));
                }
            }
            streams.computeIfAbsent(streamName, name -> new ArrayList<>()).addAll(events);
            aggregateVersions.put(key, expectedVersion + events.size());
            // still under the lock, subscribers must see the events in log order
            for (EventMessage event : events) {
                for (BiConsumer<String, EventMessage> subscriber : subscribers) {
                    subscriber.accept(streamName, event);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Stream<EventMessage> load(String streamName, String aggregateType, String aggregateId, long fromVersion) {
        lock.lock();
        try {
            return streams.getOrDefault(streamName, List.of()).stream()
                    .filter(event -> aggregateType.equals(event.getMeta(MetadataKeys.AGGREGATE_TYPE)))
                    .filter(event -> aggregateId.equals(event.getMeta(MetadataKeys.AGGREGATE_ID)))
                    .filter(event -> event.aggregateVersion() >= fromVersion)
                    .toList()
                    .stream();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return all events of the stream in append order
     */
    public List<EventMessage> readAll(String streamName) {
        lock.lock();
        try {
            return List.copyOf(streams.getOrDefault(streamName, List.of()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Registers a subscriber that receives every appended event together with the name of its stream.
     * Subscribers run on the appending thread while the store is locked. Exceptions thrown by a subscriber
     * propagate to the appending caller, the events stay stored.
     */
    public void subscribe(BiConsumer<String, EventMessage> subscriber) {
        subscribers.add(subscriber);
    }

    private record AggregateKey(String streamName, String aggregateType, String aggregateId) {
    }
}
