// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jarray.util.condition;

/**
 * Indicates that an exception thrown by user code was suppressed, typically by a custom error renderer.
 * <p>
 * Signaled by {@link ConditionContext#withSuppressedExceptions(ConditionContext.ThrowingCallback)}, which disallows
 * unwinding to a restart in response.
 */
public final class SuppressedExceptionCondition extends Condition {
    /**
     * Initializes a new condition indicating that the given exception was suppressed.
     */
    public SuppressedExceptionCondition(final Exception exception) {
        super("Suppressed exception: " + exception);
        this.exception = exception;
    }

    /**
     * Returns the suppressed exception.
     */
    public Exception exception() {
        return exception;
    }

    private final Exception exception;
}
