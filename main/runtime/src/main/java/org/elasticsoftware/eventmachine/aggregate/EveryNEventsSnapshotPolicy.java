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

/**
 * Takes a snapshot whenever a save crosses a multiple of {@code eventCount}.
 */
public record EveryNEventsSnapshotPolicy(int eventCount) implements SnapshotPolicy {
    public EveryNEventsSnapshotPolicy {
        if (eventCount < 1) {
            throw new IllegalArgumentException("eventCount must be positive but was " + eventCount);
        }
    }

    @Override
    public boolean shouldSnapshot(AggregateRoot aggregateRoot, long previousVersion) {
        return aggregateRoot.getVersion() / eventCount > previousVersion / eventCount;
    }
}
