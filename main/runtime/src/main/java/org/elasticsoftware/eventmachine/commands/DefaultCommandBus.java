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

package org.elasticsoftware.eventmachine.commands;

import jakarta.annotation.Nullable;
import org.elasticsoftware.eventmachine.aggregate.AggregateDescription;
import org.elasticsoftware.eventmachine.aggregate.AggregateRepository;
import org.elasticsoftware.eventmachine.aggregate.CommandProcessorDescription;
import org.elasticsoftware.eventmachine.aggregate.SnapshotPolicy;
import org.elasticsoftware.eventmachine.errors.ConfigurationException;
import org.elasticsoftware.eventmachine.messaging.CommandMessage;
import org.elasticsoftware.eventmachine.messaging.EventMessage;
import org.elasticsoftware.eventmachine.messaging.MessageFactory;
import org.elasticsoftware.eventmachine.persistence.EventStore;
import org.elasticsoftware.eventmachine.persistence.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Routes commands to the {@link CommandProcessor} registered for their name.
 */
public class DefaultCommandBus implements CommandBus {
    private static final Logger logger = LoggerFactory.getLogger(DefaultCommandBus.class);
    private final Map<String, CommandProcessor> commandProcessors;

    public DefaultCommandBus(Collection<CommandProcessor> commandProcessors) {
        Map<String, CommandProcessor> processors = new LinkedHashMap<>();
        for (CommandProcessor commandProcessor : commandProcessors) {
            if (processors.putIfAbsent(commandProcessor.getCommandName(), commandProcessor) != null) {
                throw new ConfigurationException("Duplicate command processor for command " + commandProcessor.getCommandName());
            }
        }
        this.commandProcessors = Collections.unmodifiableMap(processors);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public void send(CommandMessage command) {
        process(command);
    }

    /**
     * @return the events persisted for the command
     */
    public List<EventMessage> process(CommandMessage command) {
        CommandProcessor commandProcessor = commandProcessors.get(command.name());
        if (commandProcessor == null) {
            throw new ConfigurationException("No command processor registered for command " + command.name());
        }
        return commandProcessor.process(command);
    }

    public Collection<String> getCommandNames() {
        return commandProcessors.keySet();
    }

    /**
     * Creates one {@link AggregateRepository} per aggregate type up front and shares it between the command
     * processors of that aggregate.
     */
    public static class Builder {
        private final List<CommandProcessorDescription> descriptions = new ArrayList<>();
        private MessageFactory messageFactory;
        private EventStore eventStore;
        private SnapshotStore snapshotStore;
        private SnapshotPolicy snapshotPolicy = SnapshotPolicy.never();
        private Executor snapshotExecutor = Runnable::run;
        private ContextProvider contextProvider;
        private Clock clock = Clock.systemUTC();

        public Builder addCommandProcessorDescription(CommandProcessorDescription description) {
            this.descriptions.add(description);
            return this;
        }

        public Builder addCommandProcessorDescriptions(Collection<CommandProcessorDescription> descriptions) {
            this.descriptions.addAll(descriptions);
            return this;
        }

        public Builder setMessageFactory(MessageFactory messageFactory) {
            this.messageFactory = messageFactory;
            return this;
        }

        public Builder setEventStore(EventStore eventStore) {
            this.eventStore = eventStore;
            return this;
        }

        public Builder setSnapshotStore(@Nullable SnapshotStore snapshotStore) {
            this.snapshotStore = snapshotStore;
            return this;
        }

        public Builder setSnapshotPolicy(SnapshotPolicy snapshotPolicy) {
            this.snapshotPolicy = snapshotPolicy;
            return this;
        }

        public Builder setSnapshotExecutor(Executor snapshotExecutor) {
            this.snapshotExecutor = snapshotExecutor;
            return this;
        }

        public Builder setContextProvider(@Nullable ContextProvider contextProvider) {
            this.contextProvider = contextProvider;
            return this;
        }

        public Builder setClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public DefaultCommandBus build() {
            if (messageFactory == null) {
                throw new ConfigurationException("Missing MessageFactory for command bus");
            }
            if (eventStore == null) {
                throw new ConfigurationException("Missing EventStore for command bus");
            }
            Map<String, AggregateRepository> repositories = new HashMap<>();
            EventNormalizer eventNormalizer = new EventNormalizer(messageFactory);
            List<CommandProcessor> processors = new ArrayList<>();
            for (CommandProcessorDescription description : descriptions) {
                AggregateDescription aggregateDescription = description.getAggregateDescription();
                AggregateRepository repository = repositories.computeIfAbsent(aggregateDescription.getAggregateType(),
                        aggregateType -> new AggregateRepository(eventStore,
                                aggregateDescription,
                                snapshotStore,
                                snapshotPolicy,
                                snapshotExecutor,
                                clock));
                if (repository.getDescription() != aggregateDescription) {
                    throw new ConfigurationException("Aggregate %s is described more than once"
                            .formatted(aggregateDescription.getAggregateType()));
                }
                processors.add(new CommandProcessor(description, repository, eventNormalizer, contextProvider));
            }
            logger.info("Registered {} command processors for {} aggregate types", processors.size(), repositories.size());
            return new DefaultCommandBus(processors);
        }
    }
}
