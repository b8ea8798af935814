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

public class MetadataTypeException extends EventMachineException {
    private final String aggregateType;
    private final String commandName;
    private final Class<?> detectedType;

    public MetadataTypeException(String aggregateType, String commandName, Class<?> detectedType) {
        super(("Event returned by aggregate of type %s while handling command %s contains additional metadata " +
                "but metadata type is not a map. Detected type is: %s")
                .formatted(aggregateType, commandName, detectedType.getName()));
        this.aggregateType = aggregateType;
        this.commandName = commandName;
        this.detectedType = detectedType;
    }

    public String getAggregateType() {
        return aggregateType;
    }

    public String getCommandName() {
        return commandName;
    }

    public Class<?> getDetectedType() {
        return detectedType;
    }
}
