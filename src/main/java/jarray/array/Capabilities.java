// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jarray.array;

import java.util.Comparator;
import java.util.function.BiPredicate;
import java.util.function.Function;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.jetbrains.annotations.NotNull;

/**
 * The optional element callbacks of a container. Each one unlocks a family of operations: printing unlocks
 * {@link JArray#print()}, stringifying unlocks {@link JArray#join(String)}, comparison unlocks
 * {@link JArray#sort(SortMethod)}, equality unlocks {@link JArray#contains(Object)} and friends.
 * <p>
 * Tables are immutable. The {@code with} methods return an updated copy.
 */
public final class Capabilities<T> {
    private Capabilities(
        final @Nullable ElementPrinter<? super T> printer,
        final @Nullable Function<? super T, String> stringifier,
        final @Nullable Comparator<? super T> comparator,
        final @Nullable BiPredicate<? super T, ? super T> equality
    ) {
        this.printer = printer;
        this.stringifier = stringifier;
        this.comparator = comparator;
        this.equality = equality;
    }

    /**
     * Returns a table with no callbacks at all.
     */
    @CheckReturnValue
    @SuppressWarnings("unchecked")
    public static <T> @NotNull Capabilities<T> none() {
        return (Capabilities<T>) NONE; // Fine, since the table holds no callbacks.
    }

    @CheckReturnValue
    public @NotNull Capabilities<T> withPrinter(final @Nullable ElementPrinter<? super T> newPrinter) {
        return new Capabilities<>(newPrinter, stringifier, comparator, equality);
    }

    @CheckReturnValue
    public @NotNull Capabilities<T> withStringifier(final @Nullable Function<? super T, String> newStringifier) {
        return new Capabilities<>(printer, newStringifier, comparator, equality);
    }

    @CheckReturnValue
    public @NotNull Capabilities<T> withComparator(final @Nullable Comparator<? super T> newComparator) {
        return new Capabilities<>(printer, stringifier, newComparator, equality);
    }

    @CheckReturnValue
    public @NotNull Capabilities<T> withEquality(final @Nullable BiPredicate<? super T, ? super T> newEquality) {
        return new Capabilities<>(printer, stringifier, comparator, newEquality);
    }

    public @Nullable ElementPrinter<? super T> printer() {
        return printer;
    }

    public @Nullable Function<? super T, String> stringifier() {
        return stringifier;
    }

    public @Nullable Comparator<? super T> comparator() {
        return comparator;
    }

    public @Nullable BiPredicate<? super T, ? super T> equality() {
        return equality;
    }

    private final @Nullable ElementPrinter<? super T> printer;
    private final @Nullable Function<? super T, String> stringifier;
    private final @Nullable Comparator<? super T> comparator;
    private final @Nullable BiPredicate<? super T, ? super T> equality;

    private static final Capabilities<?> NONE = new Capabilities<>(null, null, null, null);
}
