// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jarray.array;

/**
 * The sorting strategies accepted by {@link JArray#sort(SortMethod)}.
 * <p>
 * All strategies produce the same total order for the same comparator. Whether equal elements keep their relative
 * order depends on the strategy.
 */
public enum SortMethod {
    /**
     * The platform's sort.
     */
    LIBRARY,
    BUBBLE_SORT,
    INSERTION_SORT,
    SELECTION_SORT
}
