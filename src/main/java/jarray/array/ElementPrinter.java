// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jarray.array;

import java.io.PrintStream;
import org.jetbrains.annotations.NotNull;

/**
 * Prints a single element, without a trailing newline.
 */
@FunctionalInterface
public interface ElementPrinter<T> {
    void print(@NotNull T element, @NotNull PrintStream stream);
}
