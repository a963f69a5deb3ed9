// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jarray.array;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.jetbrains.annotations.NotNull;

/**
 * An action applied to each element by {@link JArray#forEach(ElementAction, Object)}.
 * <p>
 * The element is the container's own, so for owned containers the action may update it in place.
 */
@FunctionalInterface
public interface ElementAction<T, C> {
    void accept(@NotNull T element, @Nullable C context);
}
