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
import org.elasticsoftware.eventmachine.messaging.EventMessage;
import org.elasticsoftware.eventmachine.messaging.MetadataKeys;
import org.elasticsoftware.eventmachine.persistence.Snapshot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory state machine of a single aggregate. The state is only ever produced by folding events through
 * the apply functions of the {@link AggregateDescription}. Not thread safe, an instance is owned by one
 * command at a time.
 */
public final class AggregateRoot {
    private final AggregateDescription description;
    private final String aggregateId;
    private final List<EventMessage> recordedEvents = new ArrayList<>();
    private Object state;
    private long version;
    private long persistedVersion;

    private AggregateRoot(AggregateDescription description, String aggregateId, Object state, long version) {
        this.description = description;
        this.aggregateId = aggregateId;
        this.state = state;
        this.version = version;
        this.persistedVersion = version;
    }

    public static AggregateRoot create(AggregateDescription description, String aggregateId) {
        return new AggregateRoot(description, aggregateId, null, 0L);
    }

    public static AggregateRoot fromSnapshot(AggregateDescription description, Snapshot snapshot) {
        return new AggregateRoot(description, snapshot.aggregateId(), snapshot.state(), snapshot.version());
    }

    /**
     * Replays the given history on top of a fresh aggregate.
     *
     * @return the reconstituted aggregate or {@code null} when the history is empty
     */
    @Nullable
    public static AggregateRoot reconstituteFromHistory(AggregateDescription description,
                                                        String aggregateId,
                                                        Iterator<EventMessage> history) {
        if (!history.hasNext()) {
            return null;
        }
        AggregateRoot aggregateRoot = create(description, aggregateId);
        aggregateRoot.replay(history);
        return aggregateRoot;
    }

    /**
     * Applies already persisted events, in version order.
     */
    public void replay(Iterator<EventMessage> history) {
        if (!recordedEvents.isEmpty()) {
            throw new IllegalStateException("Cannot replay history on aggregate " + aggregateId + " with unsaved events");
        }
        while (history.hasNext()) {
            EventMessage event = history.next();
            long eventVersion = event.aggregateVersion();
            if (eventVersion != version + 1) {
                throw new IllegalStateException("Unexpected version %d of event %s while replaying aggregate %s at version %d"
                        .formatted(eventVersion, event.name(), aggregateId, version));
            }
            state = apply(event);
            version = eventVersion;
        }
        persistedVersion = version;
    }

    /**
     * Records a new event: stamps the aggregate metadata on it, applies it to the state and keeps it until
     * the aggregate is saved.
     *
     * @return the event as it was recorded
     */
    public EventMessage recordThat(EventMessage event) {
        long nextVersion = version + 1;
        Map<String, Object> aggregateMetadata = new LinkedHashMap<>();
        aggregateMetadata.put(MetadataKeys.AGGREGATE_VERSION, nextVersion);
        aggregateMetadata.put(MetadataKeys.AGGREGATE_ID, aggregateId);
        aggregateMetadata.put(MetadataKeys.AGGREGATE_TYPE, description.getAggregateType());
        EventMessage recordedEvent = event.withAddedMetadata(aggregateMetadata);
        // apply first, a failing apply function must not leave a half recorded event behind
        state = apply(recordedEvent);
        version = nextVersion;
        recordedEvents.add(recordedEvent);
        return recordedEvent;
    }

    private Object apply(EventMessage event) {
        return description.getApplyFunction(event.name()).apply(description.materialize(event), state);
    }

    /**
     * @return all events recorded since the last call, clearing the pending list
     */
    public List<EventMessage> popRecordedEvents() {
        List<EventMessage> events = List.copyOf(recordedEvents);
        recordedEvents.clear();
        return events;
    }

    public List<EventMessage> getRecordedEvents() {
        return Collections.unmodifiableList(recordedEvents);
    }

    void markPersisted() {
        persistedVersion = version;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public String getAggregateType() {
        return description.getAggregateType();
    }

    public AggregateDescription getDescription() {
        return description;
    }

    @Nullable
    public Object currentState() {
        return state;
    }

    public long getVersion() {
        return version;
    }

    /**
     * @return the version of the aggregate in the event store, which is the expected version of the next append
     */
    public long getPersistedVersion() {
        return persistedVersion;
    }

    @Override
    public String toString() {
        return "AggregateRoot{" + description.getAggregateType() + ":" + aggregateId + "@" + version + "}";
    }
}
