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

import jakarta.annotation.Nullable;
import org.elasticsoftware.eventmachine.commands.CommandHandlerFunction;
import org.elasticsoftware.eventmachine.errors.ConfigurationException;
import org.elasticsoftware.eventmachine.messaging.CommandMessage;
import org.elasticsoftware.eventmachine.messaging.MessageConverter;

/**
 * Resolved routing of a single command to the aggregate that handles it.
 */
public final class CommandProcessorDescription {
    private final String commandName;
    private final AggregateDescription aggregateDescription;
    private final boolean createAggregate;
    private final CommandHandlerFunction<Object, Object> commandHandler;
    private final Class<?> commandClass;
    private final MessageConverter<?> commandConverter;

    private CommandProcessorDescription(String commandName,
                                        AggregateDescription aggregateDescription,
                                        boolean createAggregate,
                                        CommandHandlerFunction<Object, Object> commandHandler,
                                        Class<?> commandClass,
                                        MessageConverter<?> commandConverter) {
        this.commandName = commandName;
        this.aggregateDescription = aggregateDescription;
        this.createAggregate = createAggregate;
        this.commandHandler = commandHandler;
        this.commandClass = commandClass;
        this.commandConverter = commandConverter;
    }

    public static Builder builder(String commandName) {
        return new Builder().setCommandName(commandName);
    }

    public String getCommandName() {
        return commandName;
    }

    public AggregateDescription getAggregateDescription() {
        return aggregateDescription;
    }

    public String getAggregateType() {
        return aggregateDescription.getAggregateType();
    }

    public boolean isCreateAggregate() {
        return createAggregate;
    }

    public CommandHandlerFunction<Object, Object> getCommandHandler() {
        return commandHandler;
    }

    @Nullable
    public Class<?> getCommandClass() {
        return commandClass;
    }

    /**
     * @return the command in the representation the command handler expects
     */
    public Object materialize(CommandMessage command) {
        return commandConverter != null ? commandConverter.convert(command) : command;
    }

    @Override
    public String toString() {
        return "CommandProcessorDescription{" + commandName + "->" + aggregateDescription.getAggregateType() + "}";
    }

    public static class Builder {
        private String commandName;
        private AggregateDescription aggregateDescription;
        private boolean createAggregate;
        private CommandHandlerFunction<Object, Object> commandHandler;
        private Class<?> commandClass;
        private MessageConverter<?> commandConverter;

        public Builder setCommandName(String commandName) {
            this.commandName = commandName;
            return this;
        }

        public Builder setAggregateDescription(AggregateDescription aggregateDescription) {
            this.aggregateDescription = aggregateDescription;
            return this;
        }

        public Builder setCreateAggregate(boolean createAggregate) {
            this.createAggregate = createAggregate;
            return this;
        }

        @SuppressWarnings("unchecked")
        public <S> Builder setCommandHandler(CommandHandlerFunction<S, CommandMessage> commandHandler) {
            this.commandHandler = (CommandHandlerFunction<Object, Object>) (CommandHandlerFunction<?, ?>) commandHandler;
            return this;
        }

        /**
         * Declares a custom command class. The handler receives the command as produced by {@code converter}.
         */
        @SuppressWarnings("unchecked")
        public <S, C> Builder setCommandHandler(Class<C> commandClass,
                                                MessageConverter<C> converter,
                                                CommandHandlerFunction<S, C> commandHandler) {
            this.commandClass = commandClass;
            this.commandConverter = converter;
            this.commandHandler = (CommandHandlerFunction<Object, Object>) (CommandHandlerFunction<?, ?>) commandHandler;
            return this;
        }

        public Builder setCommandClass(Class<?> commandClass) {
            this.commandClass = commandClass;
            return this;
        }

        public Builder setCommandConverter(MessageConverter<?> commandConverter) {
            this.commandConverter = commandConverter;
            return this;
        }

        public CommandProcessorDescription build() {
            if (commandName == null || commandName.isBlank()) {
                throw new ConfigurationException("Missing commandName in command processor description");
            }
            if (aggregateDescription == null) {
                throw new ConfigurationException("Missing aggregate description for command " + commandName);
            }
            if (commandHandler == null) {
                throw new ConfigurationException("Missing command handler for command " + commandName);
            }
            if (commandClass != null && commandConverter == null) {
                throw new ConfigurationException("Custom command class %s of command %s has no registered converter"
                        .formatted(commandClass.getName(), commandName));
            }
            return new CommandProcessorDescription(commandName,
                    aggregateDescription,
                    createAggregate,
                    commandHandler,
                    commandClass,
                    commandConverter);
        }
    }
}
