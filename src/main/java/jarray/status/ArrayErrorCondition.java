// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jarray.status;

import jarray.util.condition.Condition;
import org.jetbrains.annotations.NotNull;

/**
 * Signaled whenever an array operation reports a failure.
 * <p>
 * The condition is non-fatal: if no handler transfers control, the operation returns its failed status as usual.
 */
public final class ArrayErrorCondition extends Condition {
    public ArrayErrorCondition(final @NotNull Status status) {
        super(status.message());
        assert !status.isOk() : "ArrayErrorCondition signaled for a successful status";
        this.status = status;
    }

    public @NotNull Status status() {
        return status;
    }

    @SuppressWarnings("nullness:dereference.of.nullable") // Failed statuses always carry an error kind.
    @Override
    public @NotNull String detailedMessage() {
        final var builder = new StringBuilder();
        builder.append(status.error().description()).append(": ").append(message());
        for (final var trace : status.traces()) {
            builder.append("\n - ").append(trace);
        }
        return builder.toString();
    }

    private final @NotNull Status status;
}
