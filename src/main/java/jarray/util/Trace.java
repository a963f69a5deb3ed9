// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jarray.util;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import jarray.util.condition.MessageSupplier;
import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A trace message, intended to be used within try-with-resources.
 * <p>
 * Traces are <em>user-readable</em> messages describing what the program was doing, like "removing all occurrences
 * of 3 values"; they're <em>not</em> a machine stack trace. When an array operation reports an error, the traces
 * active at that moment are copied into the status record, and the default error renderer prints them.
 * <p>
 * Trace objects must <em>never</em> be used outside the thread that created them.
 */
public final class Trace implements AutoCloseable {
    /**
     * Initializes a new trace with the given <em>lazily evaluated</em> message and registers it as the first active
     * trace of the calling thread.
     * <p>
     * The message supplier is called at most once, and only if somebody asks for the message.
     */
    public Trace(final MessageSupplier supplier) {
        this((Object) supplier);
    }

    /**
     * Initializes a new trace with the given message and registers it as the first active trace of the calling
     * thread.
     */
    public Trace(final String message) {
        this((Object) message);
    }

    private Trace(final Object object) {
        final var context = localContext();
        next = context.firstTrace;
        messageOrSupplier = object;
        ownerContext = context;
        context.firstTrace = this;
    }

    /**
     * Returns an iterable over the calling thread's active trace messages, most recently established first.
     */
    public static Iterable<String> activeTraces() {
        return IterableImpl.instance;
    }

    /**
     * Returns an immutable copy of the calling thread's active trace messages, most recently established first.
     * <p>
     * Forces evaluation of lazily evaluated messages, so the copy stays meaningful after the traces are closed.
     */
    public static List<String> snapshot() {
        final var first = localContext().firstTrace;
        if (first == null) {
            return List.of();
        }
        final var messages = new ArrayList<String>();
        for (final var message : activeTraces()) {
            messages.add(message);
        }
        return List.copyOf(messages);
    }

    /**
     * Dummy method that does nothing, to silence compiler warnings about unreferenced auto-closeable resources.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    /**
     * Unregisters the trace from the current thread's trace chain.
     * <p>
     * Never call this manually: use try-with-resources instead.
     */
    @Override
    public void close() {
        checkUnlinkInvariants();
        ownerContext.firstTrace = next;
    }

    @SuppressWarnings("MethodOnlyUsedFromInnerClass")
    private String message() {
        return (messageOrSupplier instanceof final String string) ? string : runSupplier();
    }

    private String runSupplier() {
        assert messageOrSupplier instanceof MessageSupplier : "runSupplier called with no supplier present";
        final var supplier = (MessageSupplier) messageOrSupplier;
        final var string = supplier.get();
        messageOrSupplier = string;
        return string;
    }

    private void checkUnlinkInvariants() {
        assert ownerContext == localContext() : "Trace closed by a different thread";
        assert ownerContext.firstTrace == this : "Trace chain corrupt";
    }

    private static Context localContext() {
        return context.get();
    }

    @SuppressWarnings("nullness:type.argument") // Not actually nullable, CF doesn't understand withInitial.
    private static final ThreadLocal<Context> context = ThreadLocal.withInitial(Context::new);

    private final @Nullable Trace next;
    // Either the message itself or the MessageSupplier producing it.
    private Object messageOrSupplier;
    private final Context ownerContext;

    private static final class Context {
        private @Nullable Trace firstTrace = null;
    }

    private static final class IterableImpl implements Iterable<String> {
        @Override
        public @NonNull Iterator<String> iterator() {
            return new IteratorImpl(localContext().firstTrace);
        }

        private static final IterableImpl instance = new IterableImpl();
    }

    private static final class IteratorImpl implements Iterator<String> {
        private IteratorImpl(final @Nullable Trace firstTrace) {
            current = firstTrace;
        }

        @Override
        public boolean hasNext() {
            return current != null;
        }

        @Override
        public String next() {
            final var result = current;
            if (result == null) {
                throw new NoSuchElementException("No more traces left");
            }
            current = result.next;
            return result.message();
        }

        private @Nullable Trace current;
    }
}
