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

import jakarta.validation.constraints.NotNull;

import java.util.Map;

/**
 * Implemented by custom event classes that are emitted by command handlers instead of a payload map.
 * <p>
 * The returned map must contain a {@code payload} entry holding a map and may contain a {@code metadata}
 * entry holding a map.
 */
public interface EventConvertible {
    @NotNull Map<String, Object> toMessageFields();
}
