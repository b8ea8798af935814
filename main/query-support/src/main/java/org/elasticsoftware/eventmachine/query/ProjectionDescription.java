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

import jakarta.annotation.Nullable;
import org.elasticsoftware.eventmachine.errors.ConfigurationException;

import java.util.Set;

public final class ProjectionDescription {
    private final String name;
    private final SourceStream sourceStream;
    private final String aggregateTypeFilter;
    private final Set<String> eventsFilter;
    private final Projector projector;

    private ProjectionDescription(String name,
                                  SourceStream sourceStream,
                                  @Nullable String aggregateTypeFilter,
                                  @Nullable Set<String> eventsFilter,
                                  Projector projector) {
        this.name = name;
        this.sourceStream = sourceStream;
        this.aggregateTypeFilter = aggregateTypeFilter;
        this.eventsFilter = eventsFilter;
        this.projector = projector;
    }

    public static Builder builder(String name) {
        return new Builder().setName(name);
    }

    public String getName() {
        return name;
    }

    public SourceStream getSourceStream() {
        return sourceStream;
    }

    @Nullable
    public String getAggregateTypeFilter() {
        return aggregateTypeFilter;
    }

    /**
     * @return the names of the events the projection wants, or null for all events
     */
    @Nullable
    public Set<String> getEventsFilter() {
        return eventsFilter;
    }

    public Projector getProjector() {
        return projector;
    }

    @Override
    public String toString() {
        return "ProjectionDescription[" + name + " <- " + sourceStream + "]";
    }

    public static class Builder {
        private String name;
        private SourceStream sourceStream;
        private String aggregateTypeFilter;
        private Set<String> eventsFilter;
        private Projector projector;

        public Builder setName(String name) {
            this.name = name;
            return this;
        }

        public Builder setSourceStream(SourceStream sourceStream) {
            this.sourceStream = sourceStream;
            return this;
        }

        public Builder setAggregateTypeFilter(@Nullable String aggregateTypeFilter) {
            this.aggregateTypeFilter = aggregateTypeFilter;
            return this;
        }

        public Builder setEventsFilter(@Nullable Set<String> eventsFilter) {
            this.eventsFilter = eventsFilter != null ? Set.copyOf(eventsFilter) : null;
            return this;
        }

        public Builder setProjector(Projector projector) {
            this.projector = projector;
            return this;
        }

        public ProjectionDescription build() {
            if (name == null || name.isBlank()) {
                throw new ConfigurationException("Projection name is required");
            }
            if (sourceStream == null) {
                throw new ConfigurationException("Projection " + name + " has no source stream");
            }
            if (projector == null) {
                throw new ConfigurationException("Projection " + name + " has no projector");
            }
            return new ProjectionDescription(name, sourceStream, aggregateTypeFilter, eventsFilter, projector);
        }
    }
}
