// Copyright © 2021  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jarray.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * The body executed by {@link ConditionContext#withRestart(String, RestartCallback)}.
 */
@FunctionalInterface
public interface RestartCallback<T> {
    T call(@NotNull Restart restart);
}
