// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jarray.array;

import java.util.Arrays;
import java.util.Comparator;

final class Sorting {
    private Sorting() {
    }

    /**
     * Sorts the first {@code length} slots of {@code work} in place with the given strategy.
     */
    static <T> void sort(
        final T[] work,
        final int length,
        final SortMethod method,
        final Comparator<? super T> comparator
    ) {
        assert length <= work.length;
        switch (method) {
            case LIBRARY -> Arrays.sort(work, 0, length, comparator);
            case BUBBLE_SORT -> bubbleSort(work, length, comparator);
            case INSERTION_SORT -> insertionSort(work, length, comparator);
            case SELECTION_SORT -> selectionSort(work, length, comparator);
        }
    }

    private static <T> void bubbleSort(final T[] work, final int length, final Comparator<? super T> comparator) {
        for (int end = length - 1; end > 0; end -= 1) {
            var swapped = false;
            for (int i = 0; i < end; i += 1) {
                if (comparator.compare(work[i], work[i + 1]) > 0) {
                    swap(work, i, i + 1);
                    swapped = true;
                }
            }
            if (!swapped) {
                return;
            }
        }
    }

    private static <T> void insertionSort(final T[] work, final int length, final Comparator<? super T> comparator) {
        for (int i = 1; i < length; i += 1) {
            final var key = work[i];
            var j = i - 1;
            while (j >= 0 && comparator.compare(work[j], key) > 0) {
                work[j + 1] = work[j];
                j -= 1;
            }
            work[j + 1] = key;
        }
    }

    private static <T> void selectionSort(final T[] work, final int length, final Comparator<? super T> comparator) {
        for (int i = 0; i < length - 1; i += 1) {
            var minIndex = i;
            for (int j = i + 1; j < length; j += 1) {
                if (comparator.compare(work[j], work[minIndex]) < 0) {
                    minIndex = j;
                }
            }
            if (minIndex != i) {
                swap(work, i, minIndex);
            }
        }
    }

    private static void swap(final Object[] array, final int i, final int j) {
        final var temp = array[i];
        array[i] = array[j];
        array[j] = temp;
    }
}
