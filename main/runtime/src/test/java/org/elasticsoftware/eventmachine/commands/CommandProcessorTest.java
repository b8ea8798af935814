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

import org.elasticsoftware.eventmachine.UserAggregate;
import org.elasticsoftware.eventmachine.UserAggregate.UserState;
import org.elasticsoftware.eventmachine.aggregate.AggregateDescription;
import org.elasticsoftware.eventmachine.aggregate.AggregateRepository;
import org.elasticsoftware.eventmachine.aggregate.AggregateRoot;
import org.elasticsoftware.eventmachine.aggregate.CommandProcessorDescription;
import org.elasticsoftware.eventmachine.errors.AggregateNotFoundException;
import org.elasticsoftware.eventmachine.errors.ConcurrencyConflictException;
import org.elasticsoftware.eventmachine.errors.ConfigurationException;
import org.elasticsoftware.eventmachine.errors.MissingIdentifierException;
import org.elasticsoftware.eventmachine.errors.ProtocolViolationException;
import org.elasticsoftware.eventmachine.errors.RoutingMismatchException;
import org.elasticsoftware.eventmachine.events.EmittedEvent;
import org.elasticsoftware.eventmachine.messaging.CommandMessage;
import org.elasticsoftware.eventmachine.messaging.DefaultMessageFactory;
import org.elasticsoftware.eventmachine.messaging.EventMessage;
import org.elasticsoftware.eventmachine.messaging.MetadataKeys;
import org.elasticsoftware.eventmachine.persistence.EventStore;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

import static org.elasticsoftware.eventmachine.UserAggregate.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class CommandProcessorTest {
    private final AggregateDescription description = UserAggregate.description();
    private final DefaultMessageFactory messageFactory = UserAggregate.messageFactory();
    private final EventStore eventStore = mock(EventStore.class);
    private final AggregateRepository repository = new AggregateRepository(eventStore, description);

    @Test
    void testRegisterUserOnEmptyAggregate() {
        CommandProcessor processor = processor(registerUser(description), null);
        CommandMessage command = messageFactory.createCommand(REGISTER_USER, user("U1", "Alex"));

        List<EventMessage> events = processor.process(command);

        List<EventMessage> appended = captureAppend(0L);
        assertEquals(events, appended);
        assertEquals(1, events.size());
        EventMessage event = events.get(0);
        assertEquals(USER_WAS_REGISTERED, event.name());
        assertEquals(1L, event.aggregateVersion());
        assertEquals(REGISTER_USER, event.getMeta(MetadataKeys.CAUSATION_NAME));
        assertEquals(command.uuid().toString(), event.getMeta(MetadataKeys.CAUSATION_ID));
        assertEquals(Set.of(
                MetadataKeys.CAUSATION_ID,
                MetadataKeys.CAUSATION_NAME,
                MetadataKeys.AGGREGATE_VERSION,
                MetadataKeys.AGGREGATE_ID,
                MetadataKeys.AGGREGATE_TYPE), event.metadata().keySet());
        assertEquals("U1", event.getMeta(MetadataKeys.AGGREGATE_ID));
        assertEquals(AGGREGATE_TYPE, event.getMeta(MetadataKeys.AGGREGATE_TYPE));
    }

    @Test
    void testChangeUsernameOnExistingAggregate() {
        when(eventStore.load("event_stream", AGGREGATE_TYPE, "U1", 1L)).thenReturn(history("Alex").stream());
        CommandProcessor processor = processor(changeUsername(description), null);

        List<EventMessage> events = processor.process(messageFactory.createCommand(CHANGE_USERNAME, user("U1", "Max")));

        assertEquals(1, events.size());
        assertEquals(USERNAME_WAS_CHANGED, events.get(0).name());
        assertEquals(2L, events.get(0).aggregateVersion());
        assertEquals(events, captureAppend(1L));
    }

    @Test
    void testNonCreateCommandOnUnknownAggregate() {
        when(eventStore.load(anyString(), anyString(), anyString(), anyLong())).thenReturn(Stream.empty());
        CommandProcessor processor = processor(changeUsername(description), null);

        AggregateNotFoundException exception = assertThrows(AggregateNotFoundException.class,
                () -> processor.process(messageFactory.createCommand(CHANGE_USERNAME, user("U1", "Max"))));

        assertEquals("U1", exception.getAggregateId());
        verify(eventStore, never()).appendTo(anyString(), anyString(), anyString(), anyLong(), anyList());
    }

    @Test
    void testHandlerWithoutEventsStillSaves() {
        when(eventStore.load("event_stream", AGGREGATE_TYPE, "U1", 1L)).thenReturn(history("Alex").stream());
        CommandProcessor processor = processor(changeUsername(description), null);

        List<EventMessage> events = processor.process(messageFactory.createCommand(CHANGE_USERNAME, user("U1", "Alex")));

        assertTrue(events.isEmpty());
        verify(eventStore, times(1)).appendTo("event_stream", AGGREGATE_TYPE, "U1", 1L, List.of());
    }

    @Test
    void testMultipleEventsGetContiguousVersions() {
        CommandProcessor processor = processor(CommandProcessorDescription.builder(REGISTER_USER)
                .setAggregateDescription(description)
                .setCreateAggregate(true)
                .setCommandHandler((CommandMessage command, UserState state, Object context) -> Stream.of(
                        EmittedEvent.of(USER_WAS_REGISTERED, user("U1", "Alex")),
                        null,
                        List.of(USERNAME_WAS_CHANGED, user("U1", "Max")),
                        EmittedEvent.nothing(),
                        new Object[]{USERNAME_WAS_CHANGED, user("U1", "Sam")}))
                .build(), null);

        List<EventMessage> events = processor.process(messageFactory.createCommand(REGISTER_USER, user("U1", "Alex")));

        assertEquals(List.of(1L, 2L, 3L), events.stream().map(EventMessage::aggregateVersion).toList());
        assertEquals(List.of("Alex", "Max", "Sam"), events.stream().map(event -> event.get("name")).toList());
    }

    @Test
    void testEachEventIsAppliedBeforeTheNextIsProduced() {
        List<String> trace = new ArrayList<>();
        AggregateDescription tracingDescription = AggregateDescription.builder(AGGREGATE_TYPE)
                .setIdentifierField(ID_FIELD)
                .addApplyFunction(USER_WAS_REGISTERED, (EventMessage event, UserState state) -> {
                    trace.add("apply " + event.get("name"));
                    return new UserState("U1", (String) event.get("name"));
                })
                .build();
        CommandProcessorDescription registerTwice = CommandProcessorDescription.builder(REGISTER_USER)
                .setAggregateDescription(tracingDescription)
                .setCreateAggregate(true)
                .setCommandHandler((CommandMessage command, UserState state, Object context) -> Stream.of("A", "B")
                        .map(name -> {
                            trace.add("emit " + name);
                            return EmittedEvent.of(USER_WAS_REGISTERED, user("U1", name));
                        }))
                .build();
        CommandProcessor processor = new CommandProcessor(registerTwice,
                new AggregateRepository(eventStore, tracingDescription),
                new EventNormalizer(messageFactory),
                null);

        processor.process(messageFactory.createCommand(REGISTER_USER, user("U1", "A")));

        assertEquals(List.of("emit A", "apply A", "emit B", "apply B"), trace);
    }

    @Test
    void testRoutingMismatch() {
        CommandProcessor processor = processor(registerUser(description), null);

        RoutingMismatchException exception = assertThrows(RoutingMismatchException.class,
                () -> processor.process(messageFactory.createCommand(CHANGE_USERNAME, user("U1", "Max"))));

        assertTrue(exception.getMessage().startsWith("Wrong routing detected"));
        verifyNoInteractions(eventStore);
    }

    @Test
    void testMissingIdentifier() {
        CommandProcessor processor = processor(registerUser(description), null);

        MissingIdentifierException exception = assertThrows(MissingIdentifierException.class,
                () -> processor.process(messageFactory.createCommand(REGISTER_USER, Map.of("name", "Alex"))));

        assertEquals("Missing aggregate identifier user_id in payload of command RegisterUser", exception.getMessage());
        verifyNoInteractions(eventStore);
    }

    @Test
    void testIdentifierIsConvertedToString() {
        CommandProcessor processor = processor(registerUser(description), null);

        List<EventMessage> events = processor.process(
                messageFactory.createCommand(REGISTER_USER, Map.of(ID_FIELD, 42, "name", "Alex")));

        assertEquals("42", events.get(0).getMeta(MetadataKeys.AGGREGATE_ID));
    }

    @Test
    void testNullStreamIsAProtocolViolation() {
        CommandProcessor processor = processor(CommandProcessorDescription.builder(REGISTER_USER)
                .setAggregateDescription(description)
                .setCreateAggregate(true)
                .setCommandHandler((CommandMessage command, UserState state, Object context) -> null)
                .build(), null);

        assertThrows(ProtocolViolationException.class,
                () -> processor.process(messageFactory.createCommand(REGISTER_USER, user("U1", "Alex"))));
        verifyNoInteractions(eventStore);
    }

    @Test
    void testHandlerFailureMidStreamPersistsNothing() {
        CommandProcessor processor = processor(CommandProcessorDescription.builder(REGISTER_USER)
                .setAggregateDescription(description)
                .setCreateAggregate(true)
                .setCommandHandler((CommandMessage command, UserState state, Object context) -> Stream.of(1, 2)
                        .map(i -> {
                            if (i == 2) {
                                throw new IllegalStateException("boom");
                            }
                            return EmittedEvent.of(USER_WAS_REGISTERED, command.payload());
                        }))
                .build(), null);

        assertThrows(IllegalStateException.class,
                () -> processor.process(messageFactory.createCommand(REGISTER_USER, user("U1", "Alex"))));
        verifyNoInteractions(eventStore);
    }

    @Test
    void testContextProviderIsCalledOncePerCommand() {
        ContextProvider contextProvider = mock(ContextProvider.class);
        when(contextProvider.provide(any())).thenReturn("the-context");
        List<Object> receivedContexts = new ArrayList<>();
        CommandProcessor processor = processor(CommandProcessorDescription.builder(REGISTER_USER)
                .setAggregateDescription(description)
                .setCreateAggregate(true)
                .setCommandHandler((CommandMessage command, UserState state, Object context) -> {
                    receivedContexts.add(context);
                    return Stream.of(
                            EmittedEvent.of(USER_WAS_REGISTERED, command.payload()),
                            EmittedEvent.of(USERNAME_WAS_CHANGED, user("U1", "Max")));
                })
                .build(), contextProvider);
        CommandMessage command = messageFactory.createCommand(REGISTER_USER, user("U1", "Alex"));

        processor.process(command);

        verify(contextProvider, times(1)).provide(command);
        assertEquals(List.of("the-context"), receivedContexts);
    }

    @Test
    void testContextIsNullWithoutProvider() {
        List<Object> receivedContexts = new ArrayList<>();
        CommandProcessor processor = processor(CommandProcessorDescription.builder(REGISTER_USER)
                .setAggregateDescription(description)
                .setCreateAggregate(true)
                .setCommandHandler((CommandMessage command, UserState state, Object context) -> {
                    receivedContexts.add(context);
                    return Stream.empty();
                })
                .build(), null);

        processor.process(messageFactory.createCommand(REGISTER_USER, user("U1", "Alex")));

        assertEquals(1, receivedContexts.size());
        assertNull(receivedContexts.get(0));
    }

    @Test
    void testCommandConverter() {
        record RegisterUserCommand(String userId, String name) {
        }
        CommandProcessor processor = processor(CommandProcessorDescription.builder(REGISTER_USER)
                .setAggregateDescription(description)
                .setCreateAggregate(true)
                .setCommandHandler(RegisterUserCommand.class,
                        message -> new RegisterUserCommand((String) message.get(ID_FIELD), (String) message.get("name")),
                        (RegisterUserCommand command, UserState state, Object context) ->
                                Stream.of(EmittedEvent.of(USER_WAS_REGISTERED, user(command.userId(), command.name().toUpperCase()))))
                .build(), null);

        List<EventMessage> events = processor.process(messageFactory.createCommand(REGISTER_USER, user("U1", "Alex")));

        assertEquals("ALEX", events.get(0).get("name"));
    }

    @Test
    void testConcurrencyConflictPropagates() {
        doThrow(new ConcurrencyConflictException("event_stream", "U1", 0L, 1L))
                .when(eventStore).appendTo(anyString(), anyString(), anyString(), anyLong(), anyList());
        CommandProcessor processor = processor(registerUser(description), null);

        ConcurrencyConflictException exception = assertThrows(ConcurrencyConflictException.class,
                () -> processor.process(messageFactory.createCommand(REGISTER_USER, user("U1", "Alex"))));

        assertEquals(1L, exception.getActualVersion());
    }

    @Test
    void testProcessorRejectsRepositoryOfOtherAggregate() {
        AggregateDescription accountDescription = AggregateDescription.builder("Account")
                .setIdentifierField("account_id")
                .build();

        assertThrows(ConfigurationException.class, () -> new CommandProcessor(registerUser(description),
                new AggregateRepository(eventStore, accountDescription),
                new EventNormalizer(messageFactory),
                null));
    }

    private CommandProcessor processor(CommandProcessorDescription processorDescription, ContextProvider contextProvider) {
        return CommandProcessor.fromDescription(processorDescription, messageFactory, repository, contextProvider);
    }

    private List<EventMessage> history(String name) {
        AggregateRoot aggregateRoot = AggregateRoot.create(description, "U1");
        aggregateRoot.recordThat(messageFactory.createEvent(USER_WAS_REGISTERED, user("U1", name), Map.of()));
        return aggregateRoot.popRecordedEvents();
    }

    @SuppressWarnings("unchecked")
    private List<EventMessage> captureAppend(long expectedVersion) {
        ArgumentCaptor<List<EventMessage>> captor = ArgumentCaptor.forClass(List.class);
        verify(eventStore).appendTo(eq("event_stream"), eq(AGGREGATE_TYPE), eq("U1"), eq(expectedVersion), captor.capture());
        return captor.getValue();
    }
}
