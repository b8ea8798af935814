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
import org.elasticsoftware.eventmachine.aggregate.AggregateRepository;
import org.elasticsoftware.eventmachine.aggregate.AggregateRoot;
import org.elasticsoftware.eventmachine.aggregate.CommandProcessorDescription;
import org.elasticsoftware.eventmachine.errors.AggregateNotFoundException;
import org.elasticsoftware.eventmachine.errors.ConfigurationException;
import org.elasticsoftware.eventmachine.errors.MissingIdentifierException;
import org.elasticsoftware.eventmachine.errors.ProtocolViolationException;
import org.elasticsoftware.eventmachine.errors.RoutingMismatchException;
import org.elasticsoftware.eventmachine.messaging.CommandMessage;
import org.elasticsoftware.eventmachine.messaging.EventMessage;
import org.elasticsoftware.eventmachine.messaging.MessageFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Handles one command type end to end: loads or creates the aggregate, runs the command handler, records
 * the normalized events and saves the aggregate.
 * <p>
 * Exactly one of three things happens per command: the produced events are persisted, nothing is recorded
 * (and the save is a no-op), or an exception is thrown and nothing is persisted.
 */
public final class CommandProcessor {
    private static final Logger logger = LoggerFactory.getLogger(CommandProcessor.class);
    private final CommandProcessorDescription description;
    private final AggregateRepository aggregateRepository;
    private final EventNormalizer eventNormalizer;
    private final ContextProvider contextProvider;

    public CommandProcessor(CommandProcessorDescription description,
                            AggregateRepository aggregateRepository,
                            EventNormalizer eventNormalizer,
                            @Nullable ContextProvider contextProvider) {
        if (!description.getAggregateType().equals(aggregateRepository.getDescription().getAggregateType())) {
            throw new ConfigurationException("Command %s targets aggregate %s but the repository manages %s"
                    .formatted(description.getCommandName(),
                            description.getAggregateType(),
                            aggregateRepository.getDescription().getAggregateType()));
        }
        this.description = description;
        this.aggregateRepository = aggregateRepository;
        this.eventNormalizer = eventNormalizer;
        this.contextProvider = contextProvider;
    }

    public static CommandProcessor fromDescription(CommandProcessorDescription description,
                                                   MessageFactory messageFactory,
                                                   AggregateRepository aggregateRepository,
                                                   @Nullable ContextProvider contextProvider) {
        return new CommandProcessor(description, aggregateRepository, new EventNormalizer(messageFactory), contextProvider);
    }

    public String getCommandName() {
        return description.getCommandName();
    }

    public CommandProcessorDescription getDescription() {
        return description;
    }

    /**
     * @return the events that were persisted, possibly none
     */
    public List<EventMessage> process(CommandMessage command) {
        if (!command.name().equals(description.getCommandName())) {
            throw new RoutingMismatchException(description.getCommandName(), command.name());
        }
        final String aggregateId = extractAggregateId(command);
        final Object materializedCommand = description.materialize(command);

        final AggregateRoot aggregateRoot;
        if (description.isCreateAggregate()) {
            aggregateRoot = aggregateRepository.newAggregate(aggregateId);
        } else {
            aggregateRoot = aggregateRepository.load(aggregateId)
                    .orElseThrow(() -> new AggregateNotFoundException(description.getAggregateType(), aggregateId));
        }
        final Object context = contextProvider != null ? contextProvider.provide(materializedCommand) : null;

        Stream<?> events = description.getCommandHandler().apply(materializedCommand, aggregateRoot.currentState(), context);
        if (events == null) {
            throw new ProtocolViolationException(("Expected the command handler of %s for aggregate %s to return a " +
                    "Stream of events. Did you return null instead of Stream.empty()?")
                    .formatted(description.getCommandName(), description.getAggregateType()));
        }
        try (events) {
            // pull one item at a time so each event is applied before the handler produces the next one
            Iterator<?> itr = events.iterator();
            while (itr.hasNext()) {
                eventNormalizer.normalize(itr.next(), description.getAggregateType(), command)
                        .ifPresent(aggregateRoot::recordThat);
            }
        }
        List<EventMessage> persistedEvents = aggregateRepository.save(aggregateRoot);
        logger.debug("Processed command {} with id {} on {} {}, recorded {} events",
                command.name(),
                command.uuid(),
                description.getAggregateType(),
                aggregateId,
                persistedEvents.size());
        return persistedEvents;
    }

    private String extractAggregateId(CommandMessage command) {
        Object aggregateId = command.payload().get(description.getAggregateDescription().getIdentifierField());
        if (aggregateId == null) {
            throw new MissingIdentifierException(description.getAggregateDescription().getIdentifierField(), command.name());
        }
        return aggregateId.toString();
    }

    @Override
    public String toString() {
        return "CommandProcessor{" + description.getCommandName() + "->" + description.getAggregateType() + "}";
    }
}
