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

package org.elasticsoftware.eventmachine.query;

import org.elasticsoftware.eventmachine.errors.ConfigurationException;
import org.elasticsoftware.eventmachine.messaging.EventMessage;
import org.elasticsoftware.eventmachine.messaging.MetadataKeys;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ProjectionDispatcherTest {
    private static final String SERVICE = "users";
    private static final String VERSION = "42";
    private static final String STREAM = "event_stream";

    private final Projector userList = mock(Projector.class);
    private final Projector userStats = mock(Projector.class);
    private final Projector billing = mock(Projector.class);

    @Test
    void testInitRegistersOnlyLocalProjections() {
        ProjectionDispatcher dispatcher = new ProjectionDispatcher(List.of(
                projection("user_list", SourceStream.local(STREAM), userList),
                projection("user_stats", new SourceStream(SERVICE, STREAM), userStats),
                projection("invoices", SourceStream.foreign("billing", STREAM), billing)), SERVICE, VERSION);

        assertFalse(dispatcher.isInitialized());
        dispatcher.init();

        assertTrue(dispatcher.isInitialized());
        assertEquals(List.of("user_list", "user_stats"),
                dispatcher.getReadModels().stream().map(ReadModel::getName).toList());
        assertTrue(dispatcher.getReadModel("invoices").isEmpty());
        verify(userList).prepareForRun(VERSION, "user_list");
        verify(userStats).prepareForRun(VERSION, "user_stats");
        verifyNoInteractions(billing);
    }

    @Test
    void testHandleFansOutInRegistrationOrder() {
        ProjectionDispatcher dispatcher = new ProjectionDispatcher(List.of(
                projection("user_list", SourceStream.local(STREAM), userList),
                projection("user_stats", SourceStream.local(STREAM), userStats)), SERVICE, VERSION);
        EventMessage event = event("UserWasRegistered", "User");

        dispatcher.handle(STREAM, event);

        InOrder inOrder = inOrder(userList, userStats);
        inOrder.verify(userList).handle(VERSION, "user_list", event);
        inOrder.verify(userStats).handle(VERSION, "user_stats", event);
    }

    @Test
    void testHandleOnlyReachesInterestedReadModels() {
        ProjectionDispatcher dispatcher = new ProjectionDispatcher(List.of(
                ProjectionDescription.builder("registrations")
                        .setSourceStream(SourceStream.local(STREAM))
                        .setEventsFilter(Set.of("UserWasRegistered"))
                        .setProjector(userList)
                        .build(),
                ProjectionDescription.builder("accounts")
                        .setSourceStream(SourceStream.local(STREAM))
                        .setAggregateTypeFilter("Account")
                        .setProjector(userStats)
                        .build(),
                projection("audit", SourceStream.local("audit_stream"), billing)), SERVICE, VERSION);
        EventMessage registered = event("UserWasRegistered", "User");
        EventMessage changed = event("UsernameWasChanged", "User");
        EventMessage opened = event("AccountWasOpened", "Account");

        dispatcher.handle(STREAM, registered);
        dispatcher.handle(STREAM, changed);
        dispatcher.handle(STREAM, opened);

        verify(userList).handle(VERSION, "registrations", registered);
        verify(userList, never()).handle(VERSION, "registrations", changed);
        verify(userStats).handle(VERSION, "accounts", opened);
        verify(userStats, times(1)).handle(any(), any(), any());
        verify(billing, never()).handle(any(), any(), any());
    }

    @Test
    void testHandleInitializesLazily() {
        ProjectionDispatcher dispatcher = new ProjectionDispatcher(
                List.of(projection("user_list", SourceStream.local(STREAM), userList)), SERVICE, VERSION);

        dispatcher.handle(STREAM, event("UserWasRegistered", "User"));
        dispatcher.handle(STREAM, event("UsernameWasChanged", "User"));

        assertTrue(dispatcher.isInitialized());
        verify(userList, times(1)).prepareForRun(VERSION, "user_list");
        verify(userList, times(2)).handle(eq(VERSION), eq("user_list"), any());
    }

    @Test
    void testDeleteReachesEveryReadModelOnce() {
        ProjectionDispatcher dispatcher = new ProjectionDispatcher(List.of(
                ProjectionDescription.builder("registrations")
                        .setSourceStream(SourceStream.local(STREAM))
                        .setEventsFilter(Set.of("UserWasRegistered"))
                        .setProjector(userList)
                        .build(),
                projection("audit", SourceStream.local("audit_stream"), userStats)), SERVICE, VERSION);
        dispatcher.init();

        dispatcher.delete();

        verify(userList, times(1)).deleteReadModel(VERSION, "registrations");
        verify(userStats, times(1)).deleteReadModel(VERSION, "audit");
    }

    @Test
    void testDeleteBeforeInit() {
        ProjectionDispatcher dispatcher = new ProjectionDispatcher(
                List.of(projection("user_list", SourceStream.local(STREAM), userList)), SERVICE, VERSION);

        dispatcher.delete();

        verify(userList).deleteReadModel(VERSION, "user_list");
        verify(userList, never()).prepareForRun(any(), any());
        assertFalse(dispatcher.isInitialized());
    }

    @Test
    void testResetDropsDataAndReinitializesOnNextEvent() {
        ProjectionDispatcher dispatcher = new ProjectionDispatcher(
                List.of(projection("user_list", SourceStream.local(STREAM), userList)), SERVICE, VERSION);
        dispatcher.init();

        dispatcher.reset();

        assertFalse(dispatcher.isInitialized());
        verify(userList).deleteReadModel(VERSION, "user_list");

        dispatcher.handle(STREAM, event("UserWasRegistered", "User"));

        assertTrue(dispatcher.isInitialized());
        InOrder inOrder = inOrder(userList);
        inOrder.verify(userList).prepareForRun(VERSION, "user_list");
        inOrder.verify(userList).deleteReadModel(VERSION, "user_list");
        inOrder.verify(userList).prepareForRun(VERSION, "user_list");
        inOrder.verify(userList).handle(eq(VERSION), eq("user_list"), any());
    }

    @Test
    void testReadModelFailureHaltsFanOut() {
        ProjectionDispatcher dispatcher = new ProjectionDispatcher(List.of(
                projection("user_list", SourceStream.local(STREAM), userList),
                projection("user_stats", SourceStream.local(STREAM), userStats)), SERVICE, VERSION);
        EventMessage event = event("UserWasRegistered", "User");
        doThrow(new IllegalStateException("projection bug")).when(userList).handle(VERSION, "user_list", event);

        assertThrows(IllegalStateException.class, () -> dispatcher.handle(STREAM, event));
        verify(userStats, never()).handle(any(), any(), any());
    }

    @Test
    void testDuplicateProjectionNames() {
        ProjectionDispatcher dispatcher = new ProjectionDispatcher(List.of(
                projection("user_list", SourceStream.local(STREAM), userList),
                projection("user_list", SourceStream.local(STREAM), userStats)), SERVICE, VERSION);

        assertThrows(ConfigurationException.class, dispatcher::init);
        assertFalse(dispatcher.isInitialized());
    }

    @Test
    void testCustomReadModelFactory() {
        ReadModel readModel = mock(ReadModel.class);
        when(readModel.isInterestedIn(eq(STREAM), any())).thenReturn(true);
        ProjectionDispatcher dispatcher = new ProjectionDispatcher(
                List.of(projection("user_list", SourceStream.local(STREAM), userList)),
                SERVICE,
                VERSION,
                (description, appVersion) -> readModel);
        EventMessage event = event("UserWasRegistered", "User");

        dispatcher.handle(STREAM, event);
        dispatcher.handle("other_stream", event);

        verify(readModel).prepareForRun();
        verify(readModel, times(1)).handle(event);
        verifyNoInteractions(userList);
    }

    private static ProjectionDescription projection(String name, SourceStream sourceStream, Projector projector) {
        return ProjectionDescription.builder(name)
                .setSourceStream(sourceStream)
                .setProjector(projector)
                .build();
    }

    private static EventMessage event(String eventName, String aggregateType) {
        return new EventMessage(eventName,
                UUID.randomUUID(),
                Instant.now(),
                Map.of("name", "Alex"),
                Map.of(MetadataKeys.AGGREGATE_TYPE, aggregateType, MetadataKeys.AGGREGATE_VERSION, 1L));
    }
}
