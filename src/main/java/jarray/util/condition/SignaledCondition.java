// Copyright © 2021  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jarray.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * Bundles the condition being signaled with auxiliary information.
 *
 * @param condition     The condition being signaled.
 * @param unwindAllowed {@code false} iff handlers must not unwind to a restart in response to this condition.
 */
public record SignaledCondition(@NotNull Condition condition, boolean unwindAllowed) {
}
