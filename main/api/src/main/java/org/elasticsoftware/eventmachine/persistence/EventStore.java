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

import jakarta.validation.constraints.NotNull;
import org.elasticsoftware.eventmachine.errors.ConcurrencyConflictException;
import org.elasticsoftware.eventmachine.messaging.EventMessage;

import java.util.List;
import java.util.stream.Stream;

/**
 * Append-only event log. Streams are shared by many aggregates, every event carries its aggregate type,
 * id and version in its metadata.
 */
public interface EventStore {
    /**
     * Appends all events or none of them.
     *
     * @param expectedVersion the version of the aggregate before the new events
     * @throws ConcurrencyConflictException if the aggregate's version in the stream differs from {@code expectedVersion}
     */
    void appendTo(@NotNull String streamName,
                  @NotNull String aggregateType,
                  @NotNull String aggregateId,
                  long expectedVersion,
                  @NotNull List<EventMessage> events) throws ConcurrencyConflictException;

    /**
     * @return the events of a single aggregate with a version of at least {@code fromVersion}, in version order
     */
    @NotNull Stream<EventMessage> load(@NotNull String streamName,
                                       @NotNull String aggregateType,
                                       @NotNull String aggregateId,
                                       long fromVersion);
}
