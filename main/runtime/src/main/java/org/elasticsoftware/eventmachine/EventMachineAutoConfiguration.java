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

package org.elasticsoftware.eventmachine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.elasticsoftware.eventmachine.aggregate.CommandProcessorDescription;
import org.elasticsoftware.eventmachine.aggregate.SnapshotPolicy;
import org.elasticsoftware.eventmachine.commands.CommandBus;
import org.elasticsoftware.eventmachine.commands.ContextProvider;
import org.elasticsoftware.eventmachine.commands.DefaultCommandBus;
import org.elasticsoftware.eventmachine.messaging.DefaultMessageFactory;
import org.elasticsoftware.eventmachine.messaging.MessageFactory;
import org.elasticsoftware.eventmachine.persistence.EventStore;
import org.elasticsoftware.eventmachine.persistence.InMemoryEventStore;
import org.elasticsoftware.eventmachine.persistence.InMemorySnapshotStore;
import org.elasticsoftware.eventmachine.persistence.SnapshotStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@PropertySource("classpath:eventmachine.properties")
public class EventMachineAutoConfiguration {

    @ConditionalOnMissingBean(ObjectMapper.class)
    @Bean(name = "eventMachineObjectMapper")
    public ObjectMapper objectMapper() {
        return new ObjectMapper().registerModule(new JavaTimeModule());
    }

    @ConditionalOnMissingBean(MessageFactory.class)
    @Bean(name = "eventMachineMessageFactory")
    public MessageFactory messageFactory(ObjectProvider<CommandProcessorDescription> descriptions,
                                         ObjectMapper objectMapper) {
        DefaultMessageFactory.Builder builder = DefaultMessageFactory.builder().setObjectMapper(objectMapper);
        descriptions.orderedStream().forEach(description -> {
            builder.registerCommand(description.getCommandName());
            description.getAggregateDescription().getEventNames().forEach(builder::registerEvent);
        });
        return builder.build();
    }

    @ConditionalOnMissingBean(EventStore.class)
    @Bean(name = "eventMachineEventStore")
    public EventStore eventStore() {
        return new InMemoryEventStore();
    }

    @ConditionalOnMissingBean(SnapshotStore.class)
    @Bean(name = "eventMachineSnapshotStore")
    public SnapshotStore snapshotStore() {
        return new InMemorySnapshotStore();
    }

    @ConditionalOnMissingBean(SnapshotPolicy.class)
    @Bean(name = "eventMachineSnapshotPolicy")
    public SnapshotPolicy snapshotPolicy(@Value("${eventmachine.snapshot.every-n-events:0}") int everyNEvents) {
        return everyNEvents > 0 ? SnapshotPolicy.everyNEvents(everyNEvents) : SnapshotPolicy.never();
    }

    @Bean(name = "eventMachineSnapshotExecutor", destroyMethod = "shutdown")
    public ExecutorService snapshotExecutor() {
        return Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "eventmachine-snapshots");
            thread.setDaemon(true);
            return thread;
        });
    }

    @ConditionalOnMissingBean(CommandBus.class)
    @Bean(name = "eventMachineCommandBus")
    public DefaultCommandBus commandBus(ObjectProvider<CommandProcessorDescription> descriptions,
                                        MessageFactory messageFactory,
                                        EventStore eventStore,
                                        SnapshotStore snapshotStore,
                                        SnapshotPolicy snapshotPolicy,
                                        @Qualifier("eventMachineSnapshotExecutor") ExecutorService snapshotExecutor,
                                        ObjectProvider<ContextProvider> contextProvider) {
        List<CommandProcessorDescription> commandProcessorDescriptions = descriptions.orderedStream().toList();
        return DefaultCommandBus.builder()
                .addCommandProcessorDescriptions(commandProcessorDescriptions)
                .setMessageFactory(messageFactory)
                .setEventStore(eventStore)
                .setSnapshotStore(snapshotStore)
                .setSnapshotPolicy(snapshotPolicy)
                .setSnapshotExecutor(snapshotExecutor)
                .setContextProvider(contextProvider.getIfAvailable())
                .build();
    }
}
