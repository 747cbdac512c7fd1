package com.sceneit.engine.api;

import java.util.Objects;
import java.util.UUID;

/**
 * Opaque unique handle for an entity of kind {@code T}.
 *
 * The type parameter is a compile-time tag only: an {@code Id<Scene>} cannot be
 * passed where an {@code Id<Author>} is expected, although both wrap a plain
 * UUID. Equality, hashing and ordering use the UUID alone.
 *
 * An identifier may outlive the entity it names. Holding an {@code Id} says
 * nothing about whether the entity still exists anywhere.
 *
 * @param <T> The entity kind this identifier names.
 */
public final class Id<T> implements Comparable<Id<T>> {
    private final UUID value;

    private Id(UUID value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    /** Creates a fresh random (version 4) identifier. */
    public static <T> Id<T> random() {
        return new Id<>(UUID.randomUUID());
    }

    /** Wraps an existing UUID. */
    public static <T> Id<T> of(UUID value) {
        return new Id<>(value);
    }

    public UUID uuid() {
        return value;
    }

    @Override
    public int compareTo(Id<T> other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Id<?> other))
            return false;
        return value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
