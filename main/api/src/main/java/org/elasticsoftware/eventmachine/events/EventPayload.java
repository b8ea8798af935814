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

package org.elasticsoftware.eventmachine.events;

import java.util.Map;

/**
 * The payload of an event emitted by a command handler: either a plain map or an object that knows how to
 * convert itself into message fields.
 */
public sealed interface EventPayload permits RawPayload, AdaptedPayload {
    static EventPayload of(Object payload) {
        if (payload instanceof EventPayload eventPayload) {
            return eventPayload;
        } else if (payload instanceof Map<?, ?> map) {
            return new RawPayload(castMap(map));
        } else if (payload instanceof EventConvertible convertible) {
            return new AdaptedPayload(convertible);
        }
        throw new IllegalArgumentException("Unsupported event payload type " +
                (payload == null ? "null" : payload.getClass().getName()));
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> castMap(Map<?, ?> map) {
        return (Map<String, Object>) map;
    }
}
