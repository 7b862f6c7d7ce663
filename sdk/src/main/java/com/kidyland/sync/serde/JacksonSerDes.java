// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync.serde;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.type.TypeFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.kidyland.sync.TypeToken;
import com.kidyland.sync.exception.DecodeException;
import java.lang.reflect.Type;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Jackson-based implementation of {@link SerDes}.
 *
 * <p>The default mapper matches the conventions of the timer API:
 *
 * <ul>
 *   <li>snake_case property names ({@code timer_id}, {@code alert_minutes})
 *   <li>Java 8 time types supported
 *   <li>Unknown properties ignored during deserialization
 *   <li>Type cache for generic payload types such as {@code List<TimerSnapshot>}
 * </ul>
 */
public class JacksonSerDes implements SerDes {
    private final ObjectMapper mapper;
    private final TypeFactory typeFactory;
    private final Map<Type, JavaType> typeCache;

    public JacksonSerDes() {
        this(new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    }

    /**
     * Creates a SerDes around a caller-configured mapper.
     *
     * @param mapper the mapper to use
     */
    public JacksonSerDes(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "ObjectMapper cannot be null");
        this.typeFactory = mapper.getTypeFactory();
        this.typeCache = new ConcurrentHashMap<>();
    }

    @Override
    public <T> T deserialize(String data, TypeToken<T> typeToken) {
        if (data == null) return null;

        try {
            JavaType javaType = typeCache.computeIfAbsent(typeToken.getType(), typeFactory::constructType);
            return mapper.readValue(data, javaType);
        } catch (Exception e) {
            throw new DecodeException(
                    "Deserialization failed for type: " + typeToken.getType().getTypeName(), e);
        }
    }
}
