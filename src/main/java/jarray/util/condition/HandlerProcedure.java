// Copyright © 2021  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jarray.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * A functional interface representing {@link Handler} procedures.
 */
@FunctionalInterface
public interface HandlerProcedure {
    /**
     * Processes the given condition.
     * <p>
     * A handler declines a condition by returning normally. It handles it by transferring control elsewhere, for
     * example to a restart point with {@link Restart#unwindTo()}.
     */
    void handle(@NotNull SignaledCondition condition);
}
