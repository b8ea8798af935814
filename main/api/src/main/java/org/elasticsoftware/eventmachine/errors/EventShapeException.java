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

public class EventShapeException extends EventMachineException {
    private final String aggregateType;
    private final String commandName;

    public EventShapeException(String message, String aggregateType, String commandName) {
        super(message);
        this.aggregateType = aggregateType;
        this.commandName = commandName;
    }

    public String getAggregateType() {
        return aggregateType;
    }

    public String getCommandName() {
        return commandName;
    }
}
