// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jarray.array;

import java.util.Collection;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;
import jarray.status.ArrayError;
import jarray.status.Result;
import jarray.status.Status;
import jarray.status.StatusChannel;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.jetbrains.annotations.NotNull;

/**
 * A container that exclusively owns its elements.
 * <p>
 * Every element entering the container, and every element handed out as a copy, goes through the copier, so two
 * containers never share a mutable element. When the container gives an element up, on removal, overwrite, clear,
 * free, or when sorting replaces the elements, it passes it to the disposer, if there is one.
 * <p>
 * The one exception to exclusive ownership is {@link #copyOf(Object[], UnaryOperator, Capabilities)}, which takes
 * the references as they are. Use {@link #deepCopyOf(Object[], UnaryOperator, Capabilities)} to copy the elements
 * too.
 */
public final class OwnedArray<T> extends JArray<T> {
    private OwnedArray(
        final @NotNull Capabilities<T> capabilities,
        final @NotNull UnaryOperator<T> copier,
        final @Nullable Consumer<? super T> disposer
    ) {
        super(capabilities);
        this.copier = Objects.requireNonNull(copier, "copier");
        this.disposer = disposer;
    }

    /**
     * Creates an empty container with no backing store and no capabilities.
     */
    public static <T> @NotNull OwnedArray<T> create(final @NotNull UnaryOperator<T> copier) {
        return new OwnedArray<>(Capabilities.none(), copier, null);
    }

    /**
     * Creates an empty container with no backing store.
     */
    public static <T> @NotNull OwnedArray<T> create(
        final @NotNull UnaryOperator<T> copier,
        final @NotNull Capabilities<T> capabilities
    ) {
        return new OwnedArray<>(capabilities, copier, null);
    }

    /**
     * Creates a container holding the <em>same</em> element objects as {@code source}, without copying them. The
     * caller must not use those objects afterwards.
     */
    public static <T> @NotNull Result<OwnedArray<T>> copyOf(
        final T @Nullable [] source,
        final @NotNull UnaryOperator<T> copier,
        final @NotNull Capabilities<T> capabilities
    ) {
        final var array = new OwnedArray<>(capabilities, copier, null);
        return wrap(array, array.initFrom(source, false));
    }

    /**
     * Creates a container holding copies of the elements of {@code source}, made by the copier.
     */
    public static <T> @NotNull Result<OwnedArray<T>> deepCopyOf(
        final T @Nullable [] source,
        final @NotNull UnaryOperator<T> copier,
        final @NotNull Capabilities<T> capabilities
    ) {
        final var array = new OwnedArray<>(capabilities, copier, null);
        return wrap(array, array.initFrom(source, true));
    }

    /**
     * Creates a container holding copies of the elements of {@code source}, in iteration order.
     */
    public static <T> @NotNull Result<OwnedArray<T>> deepCopyOf(
        final @Nullable Collection<? extends T> source,
        final @NotNull UnaryOperator<T> copier,
        final @NotNull Capabilities<T> capabilities
    ) {
        final var array = new OwnedArray<>(capabilities, copier, null);
        return wrap(array, array.initFrom((source == null) ? null : source.toArray(), true));
    }

    /**
     * Creates a container using {@code buffer} itself as its backing store, taking ownership of its first
     * {@code length} elements. Slots past {@code length} are cleared.
     */
    public static <T> @NotNull Result<OwnedArray<T>> adopt(
        final T @Nullable [] buffer,
        final int length,
        final @NotNull UnaryOperator<T> copier,
        final @NotNull Capabilities<T> capabilities
    ) {
        final var array = new OwnedArray<>(capabilities, copier, null);
        return wrap(array, array.adoptStore(buffer, length));
    }

    /**
     * Creates an empty container with a backing store of {@code capacity} slots, which is also its minimum
     * reservation.
     */
    public static <T> @NotNull Result<OwnedArray<T>> withCapacity(
        final int capacity,
        final @NotNull UnaryOperator<T> copier,
        final @NotNull Capabilities<T> capabilities
    ) {
        final var array = new OwnedArray<>(capabilities, copier, null);
        return wrap(array, array.reserve(capacity));
    }

    /**
     * Installs the hook called with every element the container gives up, or removes it if {@code null}.
     */
    public @NotNull Status setDisposer(final @Nullable Consumer<? super T> newDisposer) {
        if (isFreed()) {
            return StatusChannel.failure(this, ArrayError.UNINITIALIZED, "Operation on a freed JARRAY");
        }
        disposer = newDisposer;
        return StatusChannel.success();
    }

    @Override
    public @NotNull ElementKind kind() {
        return ElementKind.OWNED;
    }

    @Override
    @NotNull T copyElement(final @NotNull T element) {
        return Objects.requireNonNull(copier.apply(element), "Element copier returned null");
    }

    @Override
    void release(final @NotNull T element) {
        final var hook = disposer;
        if (hook != null) {
            hook.accept(element);
        }
    }

    @Override
    @NotNull JArray<T> emptyLike() {
        return new OwnedArray<>(capabilities(), copier, disposer);
    }

    private static <T> @NotNull Result<OwnedArray<T>> wrap(final @NotNull OwnedArray<T> array, final Status status) {
        return status.isOk() ? Result.ok(array) : Result.failed(status);
    }

    private final @NotNull UnaryOperator<T> copier;
    private @Nullable Consumer<? super T> disposer;
}
