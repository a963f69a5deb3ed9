// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jarray.array;

import java.util.Collection;
import jarray.status.Result;
import jarray.status.Status;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.jetbrains.annotations.NotNull;

/**
 * A container that stores element references as they are. Copying an element into or out of it copies the
 * reference, so the same object may be shared by several containers. Best suited to immutable element types.
 */
public final class ValueArray<T> extends JArray<T> {
    private ValueArray(final @NotNull Capabilities<T> capabilities) {
        super(capabilities);
    }

    /**
     * Creates an empty container with no backing store and no capabilities.
     */
    public static <T> @NotNull ValueArray<T> create() {
        return new ValueArray<>(Capabilities.none());
    }

    /**
     * Creates an empty container with no backing store.
     */
    public static <T> @NotNull ValueArray<T> create(final @NotNull Capabilities<T> capabilities) {
        return new ValueArray<>(capabilities);
    }

    /**
     * Creates a container holding the elements of {@code source}, in a backing store of its own.
     */
    public static <T> @NotNull Result<ValueArray<T>> copyOf(
        final T @Nullable [] source,
        final @NotNull Capabilities<T> capabilities
    ) {
        final var array = new ValueArray<>(capabilities);
        return wrap(array, array.initFrom(source, false));
    }

    /**
     * Creates a container holding the elements of {@code source}, in iteration order.
     */
    public static <T> @NotNull Result<ValueArray<T>> copyOf(
        final @Nullable Collection<? extends T> source,
        final @NotNull Capabilities<T> capabilities
    ) {
        final var array = new ValueArray<>(capabilities);
        return wrap(array, array.initFrom((source == null) ? null : source.toArray(), false));
    }

    /**
     * Creates a container using {@code buffer} itself as its backing store, holding its first {@code length}
     * elements. Slots past {@code length} are cleared.
     * <p>
     * The container owns the buffer from now on: the caller must not touch it again. Its component type must accept
     * every element later stored in the container.
     */
    public static <T> @NotNull Result<ValueArray<T>> adopt(
        final T @Nullable [] buffer,
        final int length,
        final @NotNull Capabilities<T> capabilities
    ) {
        final var array = new ValueArray<>(capabilities);
        return wrap(array, array.adoptStore(buffer, length));
    }

    /**
     * Creates an empty container with a backing store of {@code capacity} slots, which is also its minimum
     * reservation.
     */
    public static <T> @NotNull Result<ValueArray<T>> withCapacity(
        final int capacity,
        final @NotNull Capabilities<T> capabilities
    ) {
        final var array = new ValueArray<>(capabilities);
        return wrap(array, array.reserve(capacity));
    }

    @Override
    public @NotNull ElementKind kind() {
        return ElementKind.VALUE;
    }

    @Override
    @NotNull T copyElement(final @NotNull T element) {
        return element;
    }

    @Override
    void release(final @NotNull T element) {
        // References aren't owned, nothing to give up.
    }

    @Override
    @NotNull JArray<T> emptyLike() {
        return new ValueArray<>(capabilities());
    }

    private static <T> @NotNull Result<ValueArray<T>> wrap(final @NotNull ValueArray<T> array, final Status status) {
        return status.isOk() ? Result.ok(array) : Result.failed(status);
    }
}
