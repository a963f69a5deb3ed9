// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jarray.array;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.jetbrains.annotations.NotNull;

/**
 * A predicate over elements that also receives a caller-supplied context object.
 */
@FunctionalInterface
public interface ElementPredicate<T, C> {
    boolean test(@NotNull T element, @Nullable C context);
}
