// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jarray.array;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.jetbrains.annotations.NotNull;

/**
 * A folding step used by {@link JArray#reduce} and {@link JArray#reduceRight}.
 * <p>
 * The returned accumulator is copied into the container's accumulator slot and then released, so for owned
 * containers the reducer must return a fresh object each step. Returning {@code null} aborts the fold.
 */
@FunctionalInterface
public interface Reducer<T, C> {
    @Nullable T reduce(@NotNull T accumulator, @NotNull T element, @Nullable C context);
}
