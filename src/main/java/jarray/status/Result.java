// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jarray.status;

import java.util.NoSuchElementException;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.jetbrains.annotations.NotNull;

/**
 * The outcome of an array operation that produces a value.
 * <p>
 * A failed result normally carries no value. Index searches are the exception: a failed index search carries the
 * container's length, so callers that compare the index against the length keep working.
 *
 * @param status The status of the operation.
 * @param value  The produced value, or {@code null}.
 */
public record Result<V>(@NotNull Status status, @Nullable V value) {
    @CheckReturnValue
    public static <V> @NotNull Result<V> ok(final @NotNull V value) {
        return new Result<>(Status.OK, value);
    }

    @CheckReturnValue
    public static <V> @NotNull Result<V> failed(final @NotNull Status status) {
        assert !status.isOk() : "A failed result needs a failed status";
        return new Result<>(status, null);
    }

    public boolean isOk() {
        return status.isOk();
    }

    /**
     * Returns the error kind, or {@code null} if the operation succeeded.
     */
    public @Nullable ArrayError error() {
        return status.error();
    }

    /**
     * Returns the produced value.
     *
     * @throws NoSuchElementException If there is no value.
     */
    public @NotNull V get() {
        final var result = value;
        if (result == null) {
            throw new NoSuchElementException("No value present: " + status);
        }
        return result;
    }

    /**
     * Returns the produced value, or {@code fallback} if there is none.
     */
    public V orElse(final V fallback) {
        final var result = value;
        return (result == null) ? fallback : result;
    }
}
