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

public class MissingIdentifierException extends EventMachineException {
    private final String identifierField;
    private final String commandName;

    public MissingIdentifierException(String identifierField, String commandName) {
        super("Missing aggregate identifier %s in payload of command %s".formatted(identifierField, commandName));
        this.identifierField = identifierField;
        this.commandName = commandName;
    }

    public String getIdentifierField() {
        return identifierField;
    }

    public String getCommandName() {
        return commandName;
    }
}
