// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jarray.util;

import java.io.PrintStream;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Exclusive access to the process's standard output and error streams, intended to be used within
 * try-with-resources.
 * <p>
 * Array printing and error rendering write several lines per call; holding the lock keeps those lines together when
 * more than one thread prints at the same time.
 */
public final class Streams implements AutoCloseable {
    // The corresponding unlock is in close(), so this is fine.
    @SuppressWarnings("LockAcquiredButNotSafelyReleased")
    private Streams() {
        try {
            lock.lockInterruptibly();
        } catch (final InterruptedException e) {
            throw SneakyThrow.doThrow(e);
        }
    }

    /**
     * Acquires the stream lock, waiting for it if another thread holds it.
     */
    public static Streams acquire() {
        return new Streams();
    }

    @Override
    public void close() {
        lock.unlock();
    }

    @SuppressWarnings({"MethodMayBeStatic", "SameReturnValue", "UseOfSystemOutOrSystemErr"})
    public PrintStream out() {
        return System.out;
    }

    @SuppressWarnings({"MethodMayBeStatic", "SameReturnValue", "UseOfSystemOutOrSystemErr"})
    public PrintStream err() {
        return System.err;
    }

    private static final ReentrantLock lock = new ReentrantLock();
}
