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

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemorySnapshotStore implements SnapshotStore {
    private final Map<String, Snapshot> snapshots = new ConcurrentHashMap<>();

    @Override
    public Optional<Snapshot> get(String aggregateType, String aggregateId) {
        return Optional.ofNullable(snapshots.get(key(aggregateType, aggregateId)));
    }

    @Override
    public void save(Snapshot snapshot) {
        // never replace a snapshot with an older one, snapshots may be written out of order
        snapshots.merge(key(snapshot.aggregateType(), snapshot.aggregateId()),
                snapshot,
                (current, candidate) -> candidate.version() > current.version() ? candidate : current);
    }

    public void clear() {
        snapshots.clear();
    }

    private static String key(String aggregateType, String aggregateId) {
        return aggregateType + ":" + aggregateId;
    }
}
