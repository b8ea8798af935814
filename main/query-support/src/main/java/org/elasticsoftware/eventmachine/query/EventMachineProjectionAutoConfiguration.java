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

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;

@Configuration
@PropertySource("classpath:eventmachine-query.properties")
public class EventMachineProjectionAutoConfiguration {

    @ConditionalOnMissingBean(ProjectionDispatcher.class)
    @Bean(name = "eventMachineProjectionDispatcher")
    public ProjectionDispatcher projectionDispatcher(ObjectProvider<ProjectionDescription> projections,
                                                     @Value("${eventmachine.service-name}") String serviceName,
                                                     @Value("${eventmachine.app-version}") String appVersion) {
        return new ProjectionDispatcher(projections.orderedStream().toList(), serviceName, appVersion);
    }
}
