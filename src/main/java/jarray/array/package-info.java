// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The array engine: a resizable sequence container with pluggable element capabilities.
 * <p>
 * Operations never throw for expected failures. Each returns a {@link jarray.status.Status} or a
 * {@link jarray.status.Result}, records it in the calling thread's {@link jarray.status.StatusChannel}, and signals
 * failures as {@link jarray.status.ArrayErrorCondition}s.
 */
@NonNullByDefault
package jarray.array;

import jarray.util.annotation.NonNullByDefault;
