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

package org.elasticsoftware.eventmachine.messaging;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.elasticsoftware.eventmachine.errors.ConfigurationException;

/**
 * Converts the payload of a message into a custom class using Jackson's data binding.
 */
public class JacksonMessageConverter<T> implements MessageConverter<T> {
    private final ObjectMapper objectMapper;
    private final Class<T> targetClass;

    public JacksonMessageConverter(ObjectMapper objectMapper, Class<T> targetClass) {
        this.objectMapper = objectMapper;
        this.targetClass = targetClass;
    }

    public static <T> JacksonMessageConverter<T> forClass(ObjectMapper objectMapper, Class<T> targetClass) {
        return new JacksonMessageConverter<>(objectMapper, targetClass);
    }

    @Override
    public T convert(Message message) {
        try {
            return objectMapper.convertValue(message.payload(), targetClass);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Payload of %s %s cannot be converted into %s"
                    .formatted(message.messageType(), message.name(), targetClass.getName()), e);
        }
    }

    public Class<T> getTargetClass() {
        return targetClass;
    }
}
