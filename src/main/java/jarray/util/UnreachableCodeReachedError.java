// Copyright © 2021  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jarray.util;

import org.jetbrains.annotations.NotNull;

/**
 * Signals that control flow reached a point that should be unreachable, such as a broken container invariant.
 * <p>
 * This is a programming error, never an expected failure mode, hence an {@link AssertionError}.
 */
public final class UnreachableCodeReachedError extends AssertionError {
    public UnreachableCodeReachedError() {
        super("Execution reached a point expected to be unreachable");
    }

    public UnreachableCodeReachedError(final @NotNull String message) {
        super(message);
    }
}
