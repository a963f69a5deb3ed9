// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jarray.util;

import org.jetbrains.annotations.NotNull;

/**
 * Facilities for bypassing the checked exception mechanism.
 */
public final class SneakyThrow {
    private SneakyThrow() {
    }

    /**
     * Throws the given throwable as an <em>unchecked exception</em>, no matter its static or dynamic type.
     * <p>
     * Reserved for throwables that no caller should have to declare: {@link InterruptedException} raised while
     * waiting for the diagnostic stream lock, and {@link jarray.util.condition.Unwind} raised by a restart.
     * <p>
     * Since this method never returns normally, it's declared to return {@link UnreachableCodeReachedError} that can
     * be "thrown" at call sites to help the compiler's control flow analysis.
     */
    public static @NotNull UnreachableCodeReachedError doThrow(final @NotNull Throwable throwable) {
        throw doThrowImpl(throwable);
    }

    /**
     * Does nothing, pretending to throw exceptions of the type given by the type parameter, so that a sneakily
     * thrown checked exception can be caught at the call site.
     */
    @SuppressWarnings({"RedundantThrows", "EmptyMethod"})
    public static <E extends Throwable> void pretendThrows() throws E {
    }

    // E is erased to Throwable, so the cast doesn't exist in bytecode, but callers that don't name E get it inferred
    // as RuntimeException.
    @SuppressWarnings("unchecked")
    private static <E extends Throwable> @NotNull UnreachableCodeReachedError doThrowImpl(
        final @NotNull Throwable throwable
    ) throws E {
        throw (E) throwable;
    }
}
