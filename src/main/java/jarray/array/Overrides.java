// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jarray.array;

import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.jetbrains.annotations.NotNull;

/**
 * Replacements for the default rendering of a container and of the errors it reports. Immutable.
 */
public final class Overrides<T> {
    private Overrides(final @Nullable ArrayPrinter<T> arrayPrinter, final @Nullable ErrorRenderer errorRenderer) {
        this.arrayPrinter = arrayPrinter;
        this.errorRenderer = errorRenderer;
    }

    @CheckReturnValue
    @SuppressWarnings("unchecked")
    public static <T> @NotNull Overrides<T> none() {
        return (Overrides<T>) NONE;
    }

    @CheckReturnValue
    public @NotNull Overrides<T> withArrayPrinter(final @Nullable ArrayPrinter<T> newArrayPrinter) {
        return new Overrides<>(newArrayPrinter, errorRenderer);
    }

    @CheckReturnValue
    public @NotNull Overrides<T> withErrorRenderer(final @Nullable ErrorRenderer newErrorRenderer) {
        return new Overrides<>(arrayPrinter, newErrorRenderer);
    }

    public @Nullable ArrayPrinter<T> arrayPrinter() {
        return arrayPrinter;
    }

    public @Nullable ErrorRenderer errorRenderer() {
        return errorRenderer;
    }

    private final @Nullable ArrayPrinter<T> arrayPrinter;
    private final @Nullable ErrorRenderer errorRenderer;

    private static final Overrides<?> NONE = new Overrides<>(null, null);
}
