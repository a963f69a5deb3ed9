// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jarray.status;

import org.jetbrains.annotations.NotNull;

/**
 * The kinds of failure an array operation can report.
 */
public enum ArrayError {
    INDEX_OUT_OF_BOUND("Index out of bound"),
    UNINITIALIZED("JARRAY uninitialized"),
    DATA_NULL("Data is null"),
    PRINT_CALLBACK_MISSING("Print callback not set"),
    STRINGIFY_CALLBACK_MISSING("Element to string callback not set"),
    COMPARE_CALLBACK_MISSING("Compare callback not set"),
    EQUALITY_CALLBACK_MISSING("is_equal callback not set"),
    EMPTY("Empty jarray"),
    ELEMENT_NOT_FOUND("Element not found"),
    INVALID_ARGUMENT("Invalid argument"),
    /**
     * Reserved for operations a container kind does not support. No operation of the built-in kinds reports it.
     */
    UNIMPLEMENTED_FUNCTION("Function not implemented");

    ArrayError(final @NotNull String description) {
        this.description = description;
    }

    /**
     * Returns the fixed, user-readable description printed by the default error renderer.
     */
    public @NotNull String description() {
        return description;
    }

    private final @NotNull String description;
}
