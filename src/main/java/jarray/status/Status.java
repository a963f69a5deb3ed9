// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jarray.status;

import java.lang.ref.WeakReference;
import java.util.List;
import jarray.array.JArray;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.jetbrains.annotations.NotNull;

/**
 * The outcome of one array operation.
 *
 * @param error           The error kind, or {@code null} on success.
 * @param message         The user-readable message, at most {@value #MAX_MESSAGE_LENGTH} characters long.
 * @param sourceReference The container the operation ran on, used only to find its custom error renderer. Held
 *                        weakly: the channel doesn't keep a container alive.
 * @param traces          The operation traces active when the error was reported, most recent first.
 */
public record Status(
    @Nullable ArrayError error,
    @NotNull String message,
    @Nullable WeakReference<JArray<?>> sourceReference,
    @NotNull List<String> traces
) {
    public Status {
        message = truncate(message);
        traces = List.copyOf(traces);
    }

    /**
     * Creates a failed status of the given kind.
     */
    public static @NotNull Status failed(
        final @Nullable JArray<?> source,
        final @NotNull ArrayError error,
        final @NotNull String message,
        final @NotNull List<String> traces
    ) {
        return new Status(error, message, (source == null) ? null : new WeakReference<JArray<?>>(source), traces);
    }

    /**
     * Returns the container the operation ran on, or {@code null} if there was none or it has been collected.
     */
    public @Nullable JArray<?> source() {
        final var reference = sourceReference;
        return (reference == null) ? null : reference.get();
    }

    public boolean isOk() {
        return error == null;
    }

    /**
     * Returns whether this status failed with the given kind.
     */
    public boolean is(final @NotNull ArrayError kind) {
        return error == kind;
    }

    @Override
    public @NotNull String toString() {
        return (error == null) ? "Status[OK]" : "Status[" + error + ": " + message + "]";
    }

    private static @NotNull String truncate(final @NotNull String message) {
        return (message.length() <= MAX_MESSAGE_LENGTH) ? message : message.substring(0, MAX_MESSAGE_LENGTH);
    }

    /**
     * The maximum length of a status message. Longer messages are cut, never rejected.
     */
    public static final int MAX_MESSAGE_LENGTH = 99;

    /**
     * The shared successful status.
     */
    public static final Status OK = new Status(null, "No error", null, List.of());
}
