// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jarray.array;

import java.io.PrintStream;
import org.jetbrains.annotations.NotNull;

/**
 * Replaces the default rendering of a whole container by {@link JArray#print()}.
 */
@FunctionalInterface
public interface ArrayPrinter<T> {
    void print(@NotNull JArray<T> array, @NotNull PrintStream stream);
}
