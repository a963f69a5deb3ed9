// Copyright © 2021  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jarray.util.condition;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A condition handler, intended to be used within try-with-resources.
 * <p>
 * Whenever a condition is signaled, the procedures of all installed handlers are executed in order from the last
 * installed to the first. Handlers are strictly per-thread: a handler installed on one thread never sees conditions
 * signaled by array operations running on another.
 */
public final class Handler implements AutoCloseable {
    /**
     * Installs a new handler with the given procedure in the current thread's {@link ConditionContext}.
     */
    public Handler(final @NotNull HandlerProcedure procedure) {
        final var context = ConditionContext.localContext();
        next = context.firstHandler;
        this.procedure = procedure;
        ownerContext = context;
        context.firstHandler = this;
    }

    /**
     * Dummy method that does nothing, to silence compiler warnings about unreferenced auto-closeable resources.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    @Override
    public void close() {
        assert ownerContext == ConditionContext.localContext() : "Handler closed by a different thread";
        assert ownerContext.firstHandler == this : "Handler chain corrupt";
        ownerContext.firstHandler = next;
    }

    void handle(final @NotNull SignaledCondition condition) {
        procedure.handle(condition);
    }

    final @Nullable Handler next;
    private final @NotNull HandlerProcedure procedure;
    private final @NotNull ConditionContext ownerContext;
}
