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
import org.elasticsoftware.eventmachine.errors.ConcurrencyConflictException;
import org.elasticsoftware.eventmachine.messaging.EventMessage;
import org.elasticsoftware.eventmachine.persistence.EventStore;
import org.elasticsoftware.eventmachine.persistence.Snapshot;
import org.elasticsoftware.eventmachine.persistence.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.stream.Stream;

/**
 * Loads aggregates of one type from their event history and persists newly recorded events with an
 * expected version check.
 */
public class AggregateRepository {
    private static final Logger logger = LoggerFactory.getLogger(AggregateRepository.class);
    private final EventStore eventStore;
    private final AggregateDescription description;
    private final SnapshotStore snapshotStore;
    private final SnapshotPolicy snapshotPolicy;
    private final Executor snapshotExecutor;
    private final Clock clock;

    public AggregateRepository(EventStore eventStore, AggregateDescription description) {
        this(eventStore, description, null, SnapshotPolicy.never(), Runnable::run, Clock.systemUTC());
    }

    public AggregateRepository(EventStore eventStore,
                               AggregateDescription description,
                               @Nullable SnapshotStore snapshotStore,
                               SnapshotPolicy snapshotPolicy,
                               Executor snapshotExecutor,
                               Clock clock) {
        this.eventStore = Objects.requireNonNull(eventStore, "eventStore");
        this.description = Objects.requireNonNull(description, "description");
        this.snapshotStore = snapshotStore;
        this.snapshotPolicy = Objects.requireNonNull(snapshotPolicy, "snapshotPolicy");
        this.snapshotExecutor = Objects.requireNonNull(snapshotExecutor, "snapshotExecutor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public AggregateDescription getDescription() {
        return description;
    }

    public AggregateRoot newAggregate(String aggregateId) {
        return AggregateRoot.create(description, aggregateId);
    }

    /**
     * @return the aggregate with all its events applied, or empty when no events exist for the id
     */
    public Optional<AggregateRoot> load(String aggregateId) {
        Snapshot snapshot = findSnapshot(aggregateId);
        if (snapshot != null) {
            List<EventMessage> newerEvents;
            try (Stream<EventMessage> events = loadEvents(aggregateId, snapshot.version() + 1)) {
                newerEvents = events.toList();
            }
            if (newerEvents.isEmpty() || newerEvents.get(0).aggregateVersion() == snapshot.version() + 1) {
                AggregateRoot aggregateRoot = AggregateRoot.fromSnapshot(description, snapshot);
                aggregateRoot.replay(newerEvents.iterator());
                logger.trace("Loaded {} from snapshot at version {} and {} newer events",
                        aggregateRoot, snapshot.version(), newerEvents.size());
                return Optional.of(aggregateRoot);
            }
            logger.warn("Snapshot of {} {} at version {} does not line up with the event stream, replaying full history",
                    description.getAggregateType(), aggregateId, snapshot.version());
        }
        try (Stream<EventMessage> history = loadEvents(aggregateId, 1L)) {
            return Optional.ofNullable(AggregateRoot.reconstituteFromHistory(description, aggregateId, history.iterator()));
        }
    }

    /**
     * Appends the pending events of the aggregate. The pending events are discarded whatever the outcome, a
     * {@link ConcurrencyConflictException} leaves the event store unchanged and is passed on to the caller.
     *
     * @return the events that were persisted
     */
    public List<EventMessage> save(AggregateRoot aggregateRoot) {
        final long previousVersion = aggregateRoot.getPersistedVersion();
        final List<EventMessage> events = aggregateRoot.popRecordedEvents();
        eventStore.appendTo(description.getStreamName(),
                description.getAggregateType(),
                aggregateRoot.getAggregateId(),
                previousVersion,
                events);
        if (events.isEmpty()) {
            return events;
        }
        aggregateRoot.markPersisted();
        logger.trace("Saved {} events of {}, version {} -> {}",
                events.size(), aggregateRoot, previousVersion, aggregateRoot.getVersion());
        if (snapshotStore != null && snapshotPolicy.shouldSnapshot(aggregateRoot, previousVersion)) {
            scheduleSnapshot(aggregateRoot);
        }
        return events;
    }

    private void scheduleSnapshot(AggregateRoot aggregateRoot) {
        final Snapshot snapshot = new Snapshot(
                aggregateRoot.getAggregateType(),
                aggregateRoot.getAggregateId(),
                aggregateRoot.currentState(),
                aggregateRoot.getVersion(),
                clock.instant());
        snapshotExecutor.execute(() -> {
            try {
                snapshotStore.save(snapshot);
                logger.debug("Stored snapshot of {} {} at version {}",
                        snapshot.aggregateType(), snapshot.aggregateId(), snapshot.version());
            } catch (RuntimeException e) {
                // the events are persisted, a missing snapshot only makes the next load slower
                logger.error("Error storing snapshot of {} {} at version {}",
                        snapshot.aggregateType(), snapshot.aggregateId(), snapshot.version(), e);
            }
        });
    }

    @Nullable
    private Snapshot findSnapshot(String aggregateId) {
        if (snapshotStore == null) {
            return null;
        }
        try {
            return snapshotStore.get(description.getAggregateType(), aggregateId)
                    .filter(snapshot -> snapshot.version() > 0)
                    .orElse(null);
        } catch (RuntimeException e) {
            logger.warn("Unable to read snapshot of {} {}, replaying full history",
                    description.getAggregateType(), aggregateId, e);
            return null;
        }
    }

    private Stream<EventMessage> loadEvents(String aggregateId, long fromVersion) {
        return eventStore.load(description.getStreamName(), description.getAggregateType(), aggregateId, fromVersion);
    }
}
