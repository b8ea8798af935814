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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * Fans out the events of the local event log to the registered read models, in registration order.
 * Lifecycle calls ({@link #init()}, {@link #reset()}, {@link #delete()}) must not run concurrently with
 * {@link #handle(String, EventMessage)}.
 */
public class ProjectionDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(ProjectionDispatcher.class);
    private final List<ProjectionDescription> projections;
    private final String serviceName;
    private final String appVersion;
    private final BiFunction<ProjectionDescription, String, ReadModel> readModelFactory;
    private volatile Map<String, ReadModel> readModels;

    public ProjectionDispatcher(Collection<ProjectionDescription> projections, String serviceName, String appVersion) {
        this(projections, serviceName, appVersion, DefaultReadModel::new);
    }

    public ProjectionDispatcher(Collection<ProjectionDescription> projections,
                                String serviceName,
                                String appVersion,
                                BiFunction<ProjectionDescription, String, ReadModel> readModelFactory) {
        this.projections = List.copyOf(projections);
        this.serviceName = serviceName;
        this.appVersion = appVersion;
        this.readModelFactory = readModelFactory;
    }

    public void init() {
        Map<String, ReadModel> models = buildReadModels();
        for (ReadModel readModel : models.values()) {
            readModel.prepareForRun();
        }
        this.readModels = models;
        logger.info("Initialized {} read models for service {} version {}: {}",
                models.size(), serviceName, appVersion, models.keySet());
    }

    public void handle(String streamName, EventMessage event) {
        Map<String, ReadModel> models = readModels;
        if (models == null) {
            init();
            models = readModels;
        }
        for (ReadModel readModel : models.values()) {
            if (readModel.isInterestedIn(streamName, event)) {
                readModel.handle(event);
            }
        }
    }

    /**
     * Deletes all projected data; the read models are prepared again when the next event arrives.
     */
    public void reset() {
        delete();
        this.readModels = null;
        logger.info("Reset read models of service {} version {}", serviceName, appVersion);
    }

    public void delete() {
        Map<String, ReadModel> models = readModels != null ? readModels : buildReadModels();
        for (ReadModel readModel : models.values()) {
            logger.debug("Deleting read model {}", readModel.getName());
            readModel.delete();
        }
    }

    public boolean isInitialized() {
        return readModels != null;
    }

    public Optional<ReadModel> getReadModel(String projectionName) {
        Map<String, ReadModel> models = readModels;
        return models != null ? Optional.ofNullable(models.get(projectionName)) : Optional.empty();
    }

    public Collection<ReadModel> getReadModels() {
        Map<String, ReadModel> models = readModels;
        return models != null ? models.values() : Collections.emptyList();
    }

    private Map<String, ReadModel> buildReadModels() {
        Map<String, ReadModel> models = new LinkedHashMap<>();
        for (ProjectionDescription projection : projections) {
            if (!projection.getSourceStream().isLocalService(serviceName)) {
                logger.debug("Skipping projection {}, it reads from service {}",
                        projection.getName(), projection.getSourceStream().serviceName());
                continue;
            }
            if (models.putIfAbsent(projection.getName(), readModelFactory.apply(projection, appVersion)) != null) {
                throw new ConfigurationException("Duplicate projection " + projection.getName());
            }
        }
        return Collections.unmodifiableMap(models);
    }
}
