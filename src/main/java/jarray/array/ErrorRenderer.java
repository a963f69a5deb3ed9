// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jarray.array;

import java.io.PrintStream;
import jarray.status.Status;
import org.jetbrains.annotations.NotNull;

/**
 * Replaces the default rendering of a failed status by {@link jarray.status.StatusChannel#print(String, int)}.
 * <p>
 * Exceptions thrown by a renderer are suppressed and signaled as
 * {@link jarray.util.condition.SuppressedExceptionCondition}s.
 */
@FunctionalInterface
public interface ErrorRenderer {
    void render(@NotNull Status status, @NotNull PrintStream stream) throws Exception;
}
