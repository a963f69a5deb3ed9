// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Common Lisp-inspired condition and restart system.
 * <p>
 * Array operations never throw for expected failures; they report them through returned status values and signal
 * them here as non-fatal conditions, so that code further up the stack can watch for them with a {@link Handler}
 * and, if it wants to, abandon the work by unwinding to a {@link Restart}.
 */
@NonNullByDefault
package jarray.util.condition;

import jarray.util.annotation.NonNullByDefault;
