// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jarray.status;

import java.io.PrintStream;
import java.util.Locale;
import jarray.array.JArray;
import jarray.util.Streams;
import jarray.util.Trace;
import jarray.util.condition.ConditionContext;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.jetbrains.annotations.NotNull;

/**
 * The per-thread record of the most recent array operation's outcome.
 * <p>
 * Every array operation stores its outcome here before returning, overwriting the previous one. Threads never see
 * each other's outcomes.
 */
public final class StatusChannel {
    private StatusChannel() {
    }

    /**
     * Records success and returns the shared successful status.
     */
    public static @NotNull Status success() {
        last.set(Status.OK);
        return Status.OK;
    }

    /**
     * Records a failure with a message built from {@code format} and {@code args}, then signals it as an
     * {@link ArrayErrorCondition}.
     * <p>
     * The status is recorded before the condition is signaled, so a handler that unwinds still leaves it behind.
     */
    public static @NotNull Status failure(
        final @Nullable JArray<?> source,
        final @NotNull ArrayError kind,
        final @NotNull String format,
        final @Nullable Object... args
    ) {
        final var message = (args.length == 0) ? format : String.format(Locale.ROOT, format, args);
        final var status = Status.failed(source, kind, message, Trace.snapshot());
        last.set(status);
        ConditionContext.signal(new ArrayErrorCondition(status));
        return status;
    }

    /**
     * Returns the status of the calling thread's most recent array operation.
     */
    public static @NotNull Status last() {
        return last.get();
    }

    /**
     * Resets the calling thread's status to success.
     */
    public static void clear() {
        last.set(Status.OK);
    }

    /**
     * Renders the current status to standard error, tagged with the given source location.
     *
     * @see #print(PrintStream, String, int)
     */
    public static void print(final @NotNull String file, final int line) {
        try (final var streams = Streams.acquire()) {
            print(streams.err(), file, line);
        }
    }

    /**
     * Renders the current status to the given stream, tagged with the given source location.
     * <p>
     * A successful status prints nothing. If the originating container has a custom error renderer, it is used
     * instead of the default format, and any exception it throws is suppressed.
     */
    public static void print(final @NotNull PrintStream stream, final @NotNull String file, final int line) {
        final var status = last();
        final var error = status.error();
        if (error == null) {
            return;
        }
        final var source = status.source();
        final var renderer = (source == null) ? null : source.overrides().errorRenderer();
        if (renderer != null) {
            ConditionContext.withSuppressedExceptions(() -> renderer.render(status, stream));
            return;
        }
        stream.printf("%s:%d [Error: %s] : %s%n", file, line, error.description(), status.message());
        for (final var trace : status.traces()) {
            stream.printf(" - %s%n", trace);
        }
    }

    @SuppressWarnings("nullness:type.argument") // Not actually nullable, CF doesn't understand withInitial.
    private static final ThreadLocal<Status> last = ThreadLocal.withInitial(() -> Status.OK);
}
