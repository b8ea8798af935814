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

import org.elasticsoftware.eventmachine.messaging.EventMessage;
import org.elasticsoftware.eventmachine.messaging.MetadataKeys;

/**
 * {@link ReadModel} that filters events according to a {@link ProjectionDescription} and delegates the work to
 * its {@link Projector}.
 */
public class DefaultReadModel implements ReadModel {
    private final ProjectionDescription description;
    private final String appVersion;

    public DefaultReadModel(ProjectionDescription description, String appVersion) {
        this.description = description;
        this.appVersion = appVersion;
    }

    @Override
    public String getName() {
        return description.getName();
    }

    @Override
    public boolean isInterestedIn(String streamName, EventMessage event) {
        if (!description.getSourceStream().streamName().equals(streamName)) {
            return false;
        }
        String aggregateType = description.getAggregateTypeFilter();
        if (aggregateType != null && !aggregateType.equals(event.getMeta(MetadataKeys.AGGREGATE_TYPE))) {
            return false;
        }
        return description.getEventsFilter() == null || description.getEventsFilter().contains(event.name());
    }

    @Override
    public void handle(EventMessage event) {
        description.getProjector().handle(appVersion, description.getName(), event);
    }

    @Override
    public void prepareForRun() {
        description.getProjector().prepareForRun(appVersion, description.getName());
    }

    @Override
    public void delete() {
        description.getProjector().deleteReadModel(appVersion, description.getName());
    }

    @Override
    public String toString() {
        return "DefaultReadModel[" + description.getName() + "@" + appVersion + "]";
    }
}
