// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jarray.test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import jarray.array.Capabilities;
import jarray.array.ElementKind;
import jarray.array.JArray;
import jarray.array.Overrides;
import jarray.array.ValueArray;
import jarray.preset.Presets;
import jarray.status.ArrayError;
import static jarray.test.TestArrays.contents;
import static jarray.test.TestArrays.integers;
import static jarray.test.TestArrays.textBuffers;
import static jarray.test.TestArrays.texts;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;

final class TransformTest {
    @Test
    void filterKeepsOrderAndSizesExactly() {
        final var array = integers(1, 2, 3, 4, 5, 6);
        final var calls = new int[1];
        final var filtered = array.filter(element -> {
            calls[0] += 1;
            return element % 2 == 0;
        });
        assertThat(filtered.isOk()).isTrue();
        assertThat(contents(filtered.get())).containsExactly(2, 4, 6);
        assertThat(filtered.get().capacity()).isEqualTo(3);
        assertThat(calls[0]).isEqualTo(6);
        assertThat(contents(array)).containsExactly(1, 2, 3, 4, 5, 6);
    }

    @Test
    void filterKeepsTablesAndMultiplier() {
        final var array = integers(10, 20, 30);
        assertThat(array.setGrowthMultiplier(3.0).isOk()).isTrue();
        final var filtered = array.filter((element, threshold) -> element > threshold, 10).get();
        assertThat(filtered.kind()).isEqualTo(ElementKind.VALUE);
        assertThat(filtered.growthMultiplier()).isEqualTo(3.0);
        assertThat(filtered.join("+").get()).isEqualTo("20+30");
    }

    @Test
    void filteringEmptyArrayYieldsEmptyArray() {
        final var filtered = Presets.integers().filter(element -> true);
        assertThat(filtered.isOk()).isTrue();
        assertThat(filtered.get().length()).isZero();
        assertThat(filtered.get().capacity()).isZero();
    }

    @Test
    void filterCopiesOwnedElements() {
        final var array = textBuffers("keep", "drop", "keep too");
        final var filtered = array.filter(element -> element.indexOf("keep") >= 0).get();
        assertThat(filtered.kind()).isEqualTo(ElementKind.OWNED);
        assertThat(texts(filtered)).containsExactly("keep", "keep too");
        assertThat(filtered.at(0).get()).isNotSameAs(array.at(0).get());
    }

    @Test
    void joinUsesStringifier() {
        final var array = integers(1, 2, 3);
        assertThat(array.join("-").get()).isEqualTo("1-2-3");
        assertThat(array.join(null).get()).isEqualTo("123");
        assertThat(Presets.integers().join(",").error()).isEqualTo(ArrayError.EMPTY);
    }

    @Test
    void joinFailures() {
        final var bare = ValueArray.<Integer>create();
        assertThat(bare.add(1).isOk()).isTrue();
        assertThat(bare.join(",").error()).isEqualTo(ArrayError.STRINGIFY_CALLBACK_MISSING);
        assertThat(bare.setCapabilities(Capabilities.<Integer>none().withStringifier(element -> null)).isOk())
            .isTrue();
        assertThat(bare.join(",").error()).isEqualTo(ArrayError.DATA_NULL);
    }

    @Test
    void reduceFoldsLeftToRight() {
        final var array = integers(1, 2, 3, 4);
        assertThat(array.reduce(Integer::sum, 0).get()).isEqualTo(10);
        assertThat(array.reduce(Integer::sum).get()).isEqualTo(10);
        assertThat(array.reduce((accumulator, element) -> accumulator * 10 + element).get()).isEqualTo(1234);
    }

    @Test
    void reduceRightFoldsRightToLeft() {
        final var array = integers(1, 2, 3, 4);
        assertThat(array.reduceRight((accumulator, element) -> accumulator * 10 + element).get()).isEqualTo(4321);
        assertThat(array.reduceRight((accumulator, element) -> accumulator * 10 + element, 9).get())
            .isEqualTo(94321);
    }

    @Test
    void reducerReceivesContext() {
        final var array = integers(1, 2, 3);
        final var result = array.reduce((accumulator, element, weight) -> accumulator + element * weight, 0, 2);
        assertThat(result.get()).isEqualTo(12);
    }

    @Test
    void reduceFailures() {
        assertThat(Presets.integers().reduce(Integer::sum).error()).isEqualTo(ArrayError.EMPTY);
        final var array = integers(1, 2);
        assertThat(array.reduce((accumulator, element) -> null).error()).isEqualTo(ArrayError.INVALID_ARGUMENT);
        assertThat(array.reduce(null).error()).isEqualTo(ArrayError.INVALID_ARGUMENT);
    }

    @Test
    void ownedReduceCopiesAndReleasesAccumulators() {
        final var released = new ArrayList<String>();
        final var array = textBuffers("a", "b", "c");
        assertThat(array.setDisposer(element -> released.add(element.toString())).isOk()).isTrue();
        final var result = array.reduceRight((accumulator, element) -> new StringBuilder(accumulator).append(element));
        assertThat(result.get()).hasToString("cba");
        assertThat(texts(array)).containsExactly("a", "b", "c");
        // Seed copy, then per step: the old accumulator and the returned value after copying it.
        assertThat(released).containsExactly("c", "cb", "cb", "cba");
    }

    @Test
    void fillOverwritesAndGrows() {
        final var array = integers(1, 2, 3);
        assertThat(array.fill(7, 1, 4).isOk()).isTrue();
        assertThat(contents(array)).containsExactly(1, 7, 7, 7, 7);
        assertThat(array.fill(0, 0, 0).isOk()).isTrue();
        assertThat(contents(array)).containsExactly(0, 7, 7, 7, 7);
    }

    @Test
    void fillRejectsBadRanges() {
        final var array = integers(1, 2, 3);
        assertThat(array.fill(7, 2, 1).error()).isEqualTo(ArrayError.INVALID_ARGUMENT);
        assertThat(array.fill(7, 3, 5).error()).isEqualTo(ArrayError.INVALID_ARGUMENT);
        assertThat(array.fill(null, 0, 1).error()).isEqualTo(ArrayError.INVALID_ARGUMENT);
        assertThat(contents(array)).containsExactly(1, 2, 3);
    }

    @Test
    void fillGivesEverySlotItsOwnCopy() {
        final var array = textBuffers("x");
        assertThat(array.fill(new StringBuilder("y"), 0, 2).isOk()).isTrue();
        assertThat(texts(array)).containsExactly("y", "y", "y");
        assertThat(array.at(0).get()).isNotSameAs(array.at(1).get());
    }

    @Test
    void concatCopiesBothInOrder() {
        final var first = integers(1, 2);
        final var second = integers(3);
        final var result = JArray.concat(first, second);
        assertThat(contents(result.get())).containsExactly(1, 2, 3);
        assertThat(result.get().capacity()).isEqualTo(3);
        assertThat(contents(first)).containsExactly(1, 2);
    }

    @Test
    void concatRequiresMatchingKinds() {
        final JArray<StringBuilder> values = ValueArray.create();
        assertThat(values.add(new StringBuilder("v")).isOk()).isTrue();
        final JArray<StringBuilder> owned = textBuffers("o");
        assertThat(JArray.concat(values, owned).error()).isEqualTo(ArrayError.INVALID_ARGUMENT);
        assertThat(JArray.concat(null, owned).error()).isEqualTo(ArrayError.INVALID_ARGUMENT);
        assertThat(JArray.concat(owned, null).error()).isEqualTo(ArrayError.INVALID_ARGUMENT);
    }

    @Test
    void concatOfOwnedArraysDeepCopies() {
        final var first = textBuffers("a");
        final var second = textBuffers("b");
        final var result = JArray.concat(first, second).get();
        assertThat(texts(result)).containsExactly("a", "b");
        assertThat(result.at(1).get()).isNotSameAs(second.at(0).get());
    }

    @Test
    void reverseInPlace() {
        final var array = integers(1, 2, 3, 4);
        assertThat(array.reverse().isOk()).isTrue();
        assertThat(contents(array)).containsExactly(4, 3, 2, 1);
    }

    @Test
    void subarrayIsInclusiveAndClamped() {
        final var array = integers(1, 2, 3, 4, 5);
        assertThat(contents(array.subarray(1, 3).get())).containsExactly(2, 3, 4);
        assertThat(contents(array.subarray(1, 10).get())).containsExactly(2, 3, 4, 5);
        assertThat(array.subarray(3, 1).error()).isEqualTo(ArrayError.INVALID_ARGUMENT);
        assertThat(array.subarray(5, 6).error()).isEqualTo(ArrayError.INVALID_ARGUMENT);
        assertThat(Presets.integers().subarray(0, 1).error()).isEqualTo(ArrayError.EMPTY);
    }

    @Test
    void copyDataIsIndependent() {
        final var array = textBuffers("a", "b");
        final var copies = array.copyData().get();
        copies.get(0).append("!");
        assertThat(texts(array)).containsExactly("a", "b");
        assertThat(Presets.integers().copyData().get()).isEmpty();
    }

    @Test
    void forEachVisitsInOrder() {
        final var array = integers(3, 1, 2);
        final var seen = new ArrayList<Integer>();
        assertThat(array.forEach(seen::add).isOk()).isTrue();
        assertThat(seen).containsExactly(3, 1, 2);
        final var scaled = new ArrayList<Integer>();
        assertThat(array.forEach((element, factor) -> scaled.add(element * factor), 10).isOk()).isTrue();
        assertThat(scaled).containsExactly(30, 10, 20);
        assertThat(Presets.integers().forEach(seen::add).error()).isEqualTo(ArrayError.EMPTY);
    }

    @Test
    void printUsesHeaderAndElementPrinter() {
        final var array = integers(1, 2, 3);
        final var output = new ByteArrayOutputStream();
        try (final var stream = new PrintStream(output, true, StandardCharsets.UTF_8)) {
            assertThat(array.print(stream).isOk()).isTrue();
        }
        final var newline = System.lineSeparator();
        assertThat(output.toString(StandardCharsets.UTF_8))
            .isEqualTo("JARRAY [size: 3, min_alloc: 0] =>" + newline + "1 2 3 " + newline);
    }

    @Test
    void printDelegatesToArrayPrinter() {
        final var array = integers(1, 2);
        assertThat(array.setOverrides(Overrides.<Integer>none()
            .withArrayPrinter((self, stream) -> stream.print("custom " + self.length()))).isOk()).isTrue();
        final var output = new ByteArrayOutputStream();
        try (final var stream = new PrintStream(output, true, StandardCharsets.UTF_8)) {
            assertThat(array.print(stream).isOk()).isTrue();
        }
        assertThat(output.toString(StandardCharsets.UTF_8)).isEqualTo("custom 2");
    }

    @Test
    void printNeedsElementPrinterEvenWithArrayPrinter() {
        final var array = ValueArray.<Integer>create();
        assertThat(array.add(1).isOk()).isTrue();
        assertThat(array.setOverrides(Overrides.<Integer>none().withArrayPrinter((self, stream) -> { }))
            .isOk()).isTrue();
        final var output = new ByteArrayOutputStream();
        try (final var stream = new PrintStream(output, true, StandardCharsets.UTF_8)) {
            assertThat(array.print(stream).error()).isEqualTo(ArrayError.PRINT_CALLBACK_MISSING);
        }
        assertThat(output.size()).isZero();
    }
}
