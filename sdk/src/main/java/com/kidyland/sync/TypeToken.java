// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.Objects;

/**
 * Captures the payload type an engine decodes, including generic types such as {@code List<TimerSnapshot>} that
 * would otherwise be lost to erasure.
 *
 * <pre>{@code
 * TypeToken<List<TimerSnapshot>> token = new TypeToken<List<TimerSnapshot>>() {};
 * }</pre>
 *
 * @param <T> the type being captured
 */
public abstract class TypeToken<T> {
    private final Type type;

    /**
     * Constructs a new TypeToken. This constructor must be called from an anonymous subclass to capture the type
     * parameter.
     *
     * @throws IllegalStateException if created without a type parameter
     */
    protected TypeToken() {
        Type superClass = getClass().getGenericSuperclass();
        if (superClass instanceof ParameterizedType) {
            this.type = ((ParameterizedType) superClass).getActualTypeArguments()[0];
        } else {
            throw new IllegalStateException("TypeToken must be created as an anonymous subclass with a type parameter. "
                    + "Example: new TypeToken<List<String>>() {}");
        }
    }

    private TypeToken(Class<T> rawType) {
        this.type = Objects.requireNonNull(rawType, "type cannot be null");
    }

    /**
     * Creates a token for a non-generic type.
     *
     * @param type the class to capture
     * @return a token for {@code type}
     * @param <T> the captured type
     */
    public static <T> TypeToken<T> of(Class<T> type) {
        return new TypeToken<T>(type) {};
    }

    /** @return the type represented by this token */
    public Type getType() {
        return type;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof TypeToken)) return false;
        TypeToken<?> other = (TypeToken<?>) obj;
        return type.equals(other.type);
    }

    @Override
    public int hashCode() {
        return type.hashCode();
    }

    @Override
    public String toString() {
        return "TypeToken<" + type.getTypeName() + ">";
    }
}
