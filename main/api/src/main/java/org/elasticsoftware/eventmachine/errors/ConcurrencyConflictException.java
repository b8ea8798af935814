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

package org.elasticsoftware.eventmachine.errors;

public class ConcurrencyConflictException extends EventMachineException {
    private final String streamName;
    private final String aggregateId;
    private final long expectedVersion;
    private final long actualVersion;

    public ConcurrencyConflictException(String streamName, String aggregateId, long expectedVersion, long actualVersion) {
        super("Concurrency conflict on stream %s for aggregate %s: expected version %d but was %d"
                .formatted(streamName, aggregateId, expectedVersion, actualVersion));
        this.streamName = streamName;
        this.aggregateId = aggregateId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String getStreamName() {
        return streamName;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
