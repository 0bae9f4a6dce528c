package com.pizzeria.catalog.service;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * One attribute of a partial update: either absent (leave the attribute as
 * it is) or present with a non-null value to store.
 *
 * Clearing an attribute is not expressible; {@link #of(Object)} rejects null.
 *
 * @param <T> attribute type
 */
public final class FieldUpdate<T> {

    private final T value;

    private FieldUpdate(T value) {
        this.value = value;
    }

    public static <T> FieldUpdate<T> absent() {
        return new FieldUpdate<>(null);
    }

    /**
     * @throws NullPointerException if value is null
     */
    public static <T> FieldUpdate<T> of(T value) {
        return new FieldUpdate<>(Objects.requireNonNull(value, "update value"));
    }

    /**
     * Absent when the value is null, e.g. an optional request parameter that
     * was not sent.
     */
    public static <T> FieldUpdate<T> ofNullable(T value) {
        return value == null ? absent() : of(value);
    }

    public boolean isPresent() {
        return value != null;
    }

    public T get() {
        if (value == null) {
            throw new NoSuchElementException("No update value present");
        }
        return value;
    }

    public void ifPresent(Consumer<? super T> action) {
        if (value != null) {
            action.accept(value);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FieldUpdate)) {
            return false;
        }
        return Objects.equals(value, ((FieldUpdate<?>) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return value == null ? "FieldUpdate.absent" : "FieldUpdate[" + value + "]";
    }
}
