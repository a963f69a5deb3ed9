// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Outcome reporting for array operations: error kinds, status records, payload-carrying results and the
 * per-thread channel holding the outcome of the most recent operation.
 */
@NonNullByDefault
package jarray.status;

import jarray.util.annotation.NonNullByDefault;
