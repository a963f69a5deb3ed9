// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jarray.util.condition;

import java.util.Iterator;
import java.util.NoSuchElementException;
import jarray.util.SneakyThrow;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A condition context keeps track of currently registered handlers and restart points.
 * <p>
 * Each thread has its own local condition context. Instances are not accessible directly, static methods operating
 * on the current thread's context are provided instead.
 *
 * @see Handler
 * @see Restart
 */
public final class ConditionContext {
    private ConditionContext() {
    }

    /**
     * Signals the given condition.
     * <p>
     * Registered handlers are invoked from the newest to the oldest. If any handler performs a non-local control flow
     * transfer, later handlers are not invoked. If all handlers decline, this method returns normally.
     * <p>
     * Since handlers are allowed to unwind to a restart point, this method may throw {@link Unwind}.
     */
    public static void signal(final @NotNull Condition condition) {
        localContext().signal(new SignaledCondition(condition, true));
    }

    /**
     * Signals the given exception as a non-fatal condition of type {@link SuppressedExceptionCondition}.
     * <p>
     * Handlers are <strong>not allowed</strong> to unwind to a restart point in response.
     */
    public static void signalSuppressedException(final @NotNull Exception exception) {
        try {
            SneakyThrow.<Unwind>pretendThrows();
            localContext().signal(new SignaledCondition(new SuppressedExceptionCondition(exception), false));
        } catch (final Unwind u) {
            throw new AssertionError("A handler attempted to unwind a suppressed exception condition", u);
        }
    }

    /**
     * Calls the given callback, suppressing the exceptions it throws.
     * <p>
     * If the callback throws an exception, it is caught and signaled with
     * {@link #signalSuppressedException(Exception)}.
     */
    public static void withSuppressedExceptions(final @NotNull ThrowingCallback callback) {
        try {
            callback.run();
        } catch (final Exception e) {
            signalSuppressedException(e);
        }
    }

    /**
     * Executes the given function with a restart point around it.
     *
     * @param restartName The user-readable name of this restart point.
     * @param callback    The function to execute. The restart object is passed as an argument.
     * @return The value returned by {@code callback}, or {@code null} if control was transferred to this restart.
     */
    public static <T> @Nullable T withRestart(
        final @NotNull String restartName,
        final @NotNull RestartCallback<? extends T> callback
    ) {
        final var restart = new Restart(restartName);
        try {
            return callback.call(restart);
        } catch (final Throwable t) {
            if (t instanceof final Unwind unwind && unwind.target() == restart) {
                return null;
            }
            throw SneakyThrow.doThrow(t);
        } finally {
            restart.unlink();
        }
    }

    /**
     * Returns an iterable containing all active restart points, ordered from the newest one to the oldest.
     */
    public static @NotNull Iterable<@NotNull Restart> restarts() {
        return localContext().new RestartIterable();
    }

    static @NotNull ConditionContext localContext() {
        return localContext.get();
    }

    private void signal(final @NotNull SignaledCondition condition) {
        for (var handler = findFirstHandler(); handler != null; handler = handler.next) {
            final var currentSave = currentHandler;
            currentHandler = handler;
            try {
                handler.handle(condition);
            } finally {
                currentHandler = currentSave;
            }
        }
    }

    private @Nullable Handler findFirstHandler() {
        // While a handler runs, only handlers older than it are considered, to avoid recursion.
        return (currentHandler == null) ? firstHandler : currentHandler.next;
    }

    @Nullable Handler firstHandler = null;
    @Nullable Restart firstRestart = null;
    private @Nullable Handler currentHandler = null;

    private static final ThreadLocal<@NotNull ConditionContext> localContext =
        ThreadLocal.withInitial(ConditionContext::new);

    /**
     * A generic callback declared to throw checked exceptions.
     */
    @FunctionalInterface
    public interface ThrowingCallback {
        void run() throws Exception;
    }

    private final class RestartIterable implements Iterable<@NotNull Restart> {
        @Override
        public @NotNull Iterator<@NotNull Restart> iterator() {
            return new RestartIterator(firstRestart);
        }
    }

    private static final class RestartIterator implements Iterator<@NotNull Restart> {
        private RestartIterator(final @Nullable Restart firstRestart) {
            current = firstRestart;
        }

        @Override
        public boolean hasNext() {
            return current != null;
        }

        @Override
        public @NotNull Restart next() {
            final var result = current;
            if (result == null) {
                throw new NoSuchElementException("No more restarts left");
            }
            current = result.next;
            return result;
        }

        private @Nullable Restart current;
    }
}
