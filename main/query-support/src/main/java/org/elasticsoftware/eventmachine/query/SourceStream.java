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

package org.elasticsoftware.eventmachine.query;

import jakarta.annotation.Nullable;

import java.util.Objects;

/**
 * A stream a projection reads from. Without a service name the stream belongs to the local service.
 */
public record SourceStream(@Nullable String serviceName, String streamName) {
    public SourceStream {
        Objects.requireNonNull(streamName, "streamName");
    }

    public static SourceStream local(String streamName) {
        return new SourceStream(null, streamName);
    }

    public static SourceStream foreign(String serviceName, String streamName) {
        return new SourceStream(Objects.requireNonNull(serviceName, "serviceName"), streamName);
    }

    public boolean isLocalService(String localServiceName) {
        return serviceName == null || serviceName.equals(localServiceName);
    }
}
