// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Ready-made containers for common element types.
 */
@NonNullByDefault
package jarray.preset;

import jarray.util.annotation.NonNullByDefault;
