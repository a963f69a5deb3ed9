// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jarray.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * Throwable type used by the restart mechanism to transfer control flow to a given restart point.
 * <p>
 * Never catch or throw objects of this type manually. Array operations let it pass through untouched, so an unwind
 * started by a handler leaves the array in whatever consistent state the operation was in when it signaled.
 * <p>
 * It's neither an {@link Exception} nor an {@link Error}: it represents control flow, not a failure.
 */
@SuppressWarnings("ExtendsThrowable")
public final class Unwind extends Throwable {
    Unwind(final @NotNull Restart target) {
        super("Unwinding to a restart point", null, false, false);
        this.target = target;
    }

    @NotNull Restart target() {
        return target;
    }

    // Unwinds are not serializable, they just inherit Serializable from Throwable.
    private final transient @NotNull Restart target;
}
