// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jarray.test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.LongStream;
import jarray.array.Capabilities;
import jarray.array.OwnedArray;
import jarray.array.SortMethod;
import jarray.array.ValueArray;
import jarray.preset.Presets;
import jarray.status.ArrayError;
import static jarray.test.TestArrays.contents;
import static jarray.test.TestArrays.integers;
import static jarray.test.TestArrays.seededTestDisplayName;
import static jarray.test.TestArrays.texts;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

final class SortTest {
    static LongStream provideSeeds() {
        return RandomUtils.seeds();
    }

    @ParameterizedTest(name = "{displayName} method = {0}")
    @EnumSource(SortMethod.class)
    void sortsSmallInputWithDuplicates(final SortMethod method) {
        final var array = integers(5, 3, 3, 1, 4);
        assertThat(array.sort(method).isOk()).isTrue();
        assertThat(contents(array)).containsExactly(1, 3, 3, 4, 5);
    }

    @ParameterizedTest(name = seededTestDisplayName)
    @MethodSource("provideSeeds")
    void allMethodsAgreeOnRandomInput(final long seed) {
        final var generator = RandomUtils.createGenerator(seed);
        final var values = RandomUtils.randomInts(generator, 1 + generator.nextInt(1_000), 500);
        final var expected = Arrays.stream(values).sorted().boxed().collect(Collectors.toList());
        for (final var method : SortMethod.values()) {
            final var array = integers(values);
            final var capacity = array.capacity();
            assertThat(array.sort(method).isOk()).as("sorting with %s", method).isTrue();
            assertThat(contents(array)).as("sorting with %s", method).isEqualTo(expected);
            assertThat(array.capacity()).isEqualTo(capacity);
        }
    }

    @ParameterizedTest(name = "{displayName} method = {0}")
    @EnumSource(SortMethod.class)
    void sortingEmptyArrayReportsEmpty(final SortMethod method) {
        final var array = Presets.integers();
        assertThat(array.sort(method).error()).isEqualTo(ArrayError.EMPTY);
        assertThat(array.capacity()).isZero();
    }

    @Test
    void sortingWithoutComparatorLeavesArrayUntouched() {
        final var array = ValueArray.<Integer>create();
        assertThat(array.addm(3, 1, 2).isOk()).isTrue();
        assertThat(array.sort(SortMethod.LIBRARY).error()).isEqualTo(ArrayError.COMPARE_CALLBACK_MISSING);
        assertThat(contents(array)).containsExactly(3, 1, 2);
    }

    @ParameterizedTest(name = "{displayName} method = {0}")
    @EnumSource(SortMethod.class)
    void overrideComparatorWins(final SortMethod method) {
        final var array = integers(2, 5, 1, 4, 3);
        assertThat(array.sort(method, Comparator.reverseOrder()).isOk()).isTrue();
        assertThat(contents(array)).containsExactly(5, 4, 3, 2, 1);
    }

    @Test
    void overrideComparatorWorksWithoutCapability() {
        final var array = ValueArray.<String>create();
        assertThat(array.addm("pear", "fig", "apple").isOk()).isTrue();
        assertThat(array.sort(SortMethod.INSERTION_SORT, Comparator.comparingInt(String::length)).isOk()).isTrue();
        assertThat(contents(array)).containsExactly("fig", "pear", "apple");
    }

    @Test
    void insertionSortIsStable() {
        final var array = ValueArray.create(Capabilities.<int[]>none().withComparator(Comparator.comparingInt(
            pair -> pair[0])));
        for (int i = 0; i < 20; i += 1) {
            assertThat(array.add(new int[] {i % 3, i}).isOk()).isTrue();
        }
        assertThat(array.sort(SortMethod.INSERTION_SORT).isOk()).isTrue();
        final var sorted = contents(array);
        assertThat(sorted).isSortedAccordingTo(Comparator.<int[]>comparingInt(pair -> pair[0])
            .thenComparingInt(pair -> pair[1]));
    }

    @Test
    void ownedSortReleasesReplacedElements() {
        final var released = new ArrayList<StringBuilder>();
        final OwnedArray<StringBuilder> array = Presets.textBuffers();
        assertThat(array.setDisposer(released::add).isOk()).isTrue();
        assertThat(array.addm(new StringBuilder("c"), new StringBuilder("a"), new StringBuilder("b")).isOk())
            .isTrue();
        final List<StringBuilder> before = new ArrayList<>();
        for (int i = 0; i < array.length(); i += 1) {
            before.add(array.at(i).get());
        }
        assertThat(array.sort(SortMethod.SELECTION_SORT).isOk()).isTrue();
        assertThat(texts(array)).containsExactly("a", "b", "c");
        assertThat(released).hasSize(3);
        for (final var old : before) {
            assertThat(released).anySatisfy(element -> assertThat(element).isSameAs(old));
        }
    }
}
