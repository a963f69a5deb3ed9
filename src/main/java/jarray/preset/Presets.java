// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jarray.preset;

import java.util.Locale;
import jarray.array.Capabilities;
import jarray.array.OwnedArray;
import jarray.array.ValueArray;
import org.jetbrains.annotations.NotNull;

/**
 * Factories of empty containers whose capability tables are filled in for a common element type.
 * <p>
 * Every preset prints an element followed by a space, stringifies it without padding, compares it by its natural
 * numeric or lexicographic order, and tests equality by value. Floating point elements are printed and stringified
 * with two decimals.
 */
public final class Presets {
    private Presets() {
    }

    public static @NotNull ValueArray<Integer> integers() {
        return ValueArray.create(INTEGERS);
    }

    /**
     * Integers interpreted as unsigned 32-bit values for printing, stringifying and ordering.
     */
    public static @NotNull ValueArray<Integer> unsignedIntegers() {
        return ValueArray.create(UNSIGNED_INTEGERS);
    }

    public static @NotNull ValueArray<Long> longs() {
        return ValueArray.create(LONGS);
    }

    public static @NotNull ValueArray<Short> shorts() {
        return ValueArray.create(SHORTS);
    }

    /**
     * Shorts interpreted as unsigned 16-bit values for printing, stringifying and ordering.
     */
    public static @NotNull ValueArray<Short> unsignedShorts() {
        return ValueArray.create(UNSIGNED_SHORTS);
    }

    public static @NotNull ValueArray<Double> doubles() {
        return ValueArray.create(DOUBLES);
    }

    public static @NotNull ValueArray<Float> floats() {
        return ValueArray.create(FLOATS);
    }

    public static @NotNull ValueArray<Character> characters() {
        return ValueArray.create(CHARACTERS);
    }

    /**
     * Strings are immutable, so they're stored by reference.
     */
    public static @NotNull ValueArray<String> strings() {
        return ValueArray.create(STRINGS);
    }

    /**
     * Mutable text buffers, deep-copied whenever they enter or leave the container.
     */
    public static @NotNull OwnedArray<StringBuilder> textBuffers() {
        return OwnedArray.create(StringBuilder::new, TEXT_BUFFERS);
    }

    private static String twoDecimals(final double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    private static final Capabilities<Integer> INTEGERS = Capabilities.<Integer>none()
        .withPrinter((element, stream) -> stream.print(element + " "))
        .withStringifier(String::valueOf)
        .withComparator(Integer::compare)
        .withEquality((a, b) -> a.intValue() == b.intValue());

    private static final Capabilities<Integer> UNSIGNED_INTEGERS = Capabilities.<Integer>none()
        .withPrinter((element, stream) -> stream.print(Integer.toUnsignedString(element) + " "))
        .withStringifier(Integer::toUnsignedString)
        .withComparator(Integer::compareUnsigned)
        .withEquality((a, b) -> a.intValue() == b.intValue());

    private static final Capabilities<Long> LONGS = Capabilities.<Long>none()
        .withPrinter((element, stream) -> stream.print(element + " "))
        .withStringifier(String::valueOf)
        .withComparator(Long::compare)
        .withEquality((a, b) -> a.longValue() == b.longValue());

    private static final Capabilities<Short> SHORTS = Capabilities.<Short>none()
        .withPrinter((element, stream) -> stream.print(element + " "))
        .withStringifier(String::valueOf)
        .withComparator(Short::compare)
        .withEquality((a, b) -> a.shortValue() == b.shortValue());

    private static final Capabilities<Short> UNSIGNED_SHORTS = Capabilities.<Short>none()
        .withPrinter((element, stream) -> stream.print(Short.toUnsignedInt(element) + " "))
        .withStringifier(element -> String.valueOf(Short.toUnsignedInt(element)))
        .withComparator(Short::compareUnsigned)
        .withEquality((a, b) -> a.shortValue() == b.shortValue());

    private static final Capabilities<Double> DOUBLES = Capabilities.<Double>none()
        .withPrinter((element, stream) -> stream.print(twoDecimals(element) + " "))
        .withStringifier(Presets::twoDecimals)
        .withComparator(Double::compare)
        .withEquality((a, b) -> a.doubleValue() == b.doubleValue());

    private static final Capabilities<Float> FLOATS = Capabilities.<Float>none()
        .withPrinter((element, stream) -> stream.print(twoDecimals(element) + " "))
        .withStringifier(element -> twoDecimals(element))
        .withComparator(Float::compare)
        .withEquality((a, b) -> a.floatValue() == b.floatValue());

    private static final Capabilities<Character> CHARACTERS = Capabilities.<Character>none()
        .withPrinter((element, stream) -> stream.print(element + " "))
        .withStringifier(String::valueOf)
        .withComparator(Character::compare)
        .withEquality((a, b) -> a.charValue() == b.charValue());

    private static final Capabilities<String> STRINGS = Capabilities.<String>none()
        .withPrinter((element, stream) -> stream.print(element + " "))
        .withStringifier(element -> element)
        .withComparator(String::compareTo)
        .withEquality(String::equals);

    private static final Capabilities<StringBuilder> TEXT_BUFFERS = Capabilities.<StringBuilder>none()
        .withPrinter((element, stream) -> stream.print(element + " "))
        .withStringifier(StringBuilder::toString)
        .withComparator(StringBuilder::compareTo)
        .withEquality((a, b) -> a.compareTo(b) == 0);
}
