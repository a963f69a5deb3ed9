// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jarray.array;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.function.BiPredicate;
import java.util.function.BinaryOperator;
import java.util.function.Consumer;
import java.util.function.Predicate;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jarray.status.ArrayError;
import jarray.status.Result;
import jarray.status.Status;
import jarray.status.StatusChannel;
import jarray.util.Streams;
import jarray.util.Trace;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.jetbrains.annotations.NotNull;

/**
 * A resizable sequence container with pluggable element capabilities.
 * <p>
 * Elements are never {@code null}. How elements are copied when they enter the container, and whether they are
 * released when they leave it, depends on the {@link ElementKind}: {@link ValueArray} stores references as they are,
 * {@link OwnedArray} deep-copies every element that crosses a container boundary.
 * <p>
 * No operation throws for an expected failure. Instead, every operation returns a {@link Status} or a
 * {@link Result}, records the same status in the calling thread's {@link StatusChannel}, and signals failures as
 * {@link jarray.status.ArrayErrorCondition}s. A failed operation leaves the container as it was before the call.
 * Exceptions thrown by user callbacks propagate unchanged.
 * <p>
 * The backing store grows geometrically by the {@linkplain #setGrowthMultiplier(double) growth multiplier} and
 * shrinks on removal, but never below the {@linkplain #reserve(int) minimum reservation}. The store is absent if
 * and only if the capacity is zero.
 * <p>
 * Elements returned by {@link #at(int)}, {@link #findFirst} and {@link #findLast} are <em>borrowed</em>: for owned
 * containers they remain the container's property and must not be kept across a later mutation.
 * <p>
 * Containers are not thread-safe.
 */
public abstract sealed class JArray<T> permits ValueArray, OwnedArray {
    JArray(final @NotNull Capabilities<T> capabilities) {
        this.capabilities = capabilities;
    }

    /**
     * Returns the copy of the given element that this container stores.
     */
    abstract @NotNull T copyElement(@NotNull T element);

    /**
     * Gives up an element this container stored.
     */
    abstract void release(@NotNull T element);

    /**
     * Returns a new empty container of the same kind, with the same capabilities and element hooks.
     */
    abstract @NotNull JArray<T> emptyLike();

    /**
     * Returns how this container holds its elements.
     */
    public abstract @NotNull ElementKind kind();

    // Accessors. These are queries and leave the status channel alone.

    /**
     * Returns the number of elements.
     * <p>
     * Complexity: constant time.
     */
    public int length() {
        return length;
    }

    /**
     * Returns the number of slots in the backing store, zero if it's absent.
     * <p>
     * Complexity: constant time.
     */
    public int capacity() {
        final var store = data;
        return (store == null) ? 0 : store.length;
    }

    public int minimumReservation() {
        return minimumReservation;
    }

    public double growthMultiplier() {
        return growthMultiplier;
    }

    public @NotNull Capabilities<T> capabilities() {
        return capabilities;
    }

    public @NotNull Overrides<T> overrides() {
        return overrides;
    }

    /**
     * Returns whether {@link #free()} was called on this container.
     */
    public boolean isFreed() {
        return freed;
    }

    /**
     * Replaces the capability table.
     */
    public @NotNull Status setCapabilities(final @NotNull Capabilities<T> newCapabilities) {
        if (freed) {
            return uninitialized();
        }
        capabilities = newCapabilities;
        return StatusChannel.success();
    }

    /**
     * Replaces the override table.
     */
    public @NotNull Status setOverrides(final @NotNull Overrides<T> newOverrides) {
        if (freed) {
            return uninitialized();
        }
        overrides = newOverrides;
        return StatusChannel.success();
    }

    // Buffer and growth.

    /**
     * Sets the minimum reservation to {@code newCapacity}, growing the backing store to exactly that many slots if
     * it's currently smaller.
     * <p>
     * Failures: {@code INVALID_ARGUMENT} for a negative capacity, {@code DATA_NULL} if the store can't be allocated.
     */
    public @NotNull Status reserve(final int newCapacity) {
        if (freed) {
            return uninitialized();
        }
        if (newCapacity < 0) {
            return fail(ArrayError.INVALID_ARGUMENT, "Cannot reserve a negative capacity (%d)", newCapacity);
        }
        if (newCapacity > capacity() && !reallocate(newCapacity)) {
            return fail(ArrayError.DATA_NULL, "Memory allocation failed when reallocating for reserve");
        }
        minimumReservation = newCapacity;
        return StatusChannel.success();
    }

    /**
     * Sets the factor by which the backing store grows when it runs out of slots, and by which it must be
     * underused before it shrinks. The default is {@value #DEFAULT_GROWTH_MULTIPLIER}.
     * <p>
     * Failures: {@code INVALID_ARGUMENT} if the multiplier is not a finite number of at least 1.
     */
    public @NotNull Status setGrowthMultiplier(final double multiplier) {
        if (freed) {
            return uninitialized();
        }
        if (!(multiplier >= 1.0) || Double.isInfinite(multiplier)) {
            return fail(ArrayError.INVALID_ARGUMENT, "Growth multiplier must be finite and at least 1, got %s",
                multiplier);
        }
        growthMultiplier = multiplier;
        return StatusChannel.success();
    }

    /**
     * Appends a copy of the given element.
     * <p>
     * Complexity: amortized constant time.
     */
    public @NotNull Status add(final @Nullable T element) {
        if (freed) {
            return uninitialized();
        }
        if (element == null) {
            return fail(ArrayError.INVALID_ARGUMENT, "Cannot insert NULL in a jarray");
        }
        final var growthFailure = ensureCapacity(length + 1L);
        if (growthFailure != null) {
            return growthFailure;
        }
        store()[length] = copyElement(element);
        length += 1;
        return StatusChannel.success();
    }

    /**
     * Inserts a copy of the given element at {@code index}, moving later elements one slot to the right. An index
     * equal to the length appends.
     * <p>
     * Complexity: linear time.
     */
    public @NotNull Status addAt(final int index, final @Nullable T element) {
        if (freed) {
            return uninitialized();
        }
        if (element == null) {
            return fail(ArrayError.INVALID_ARGUMENT, "Cannot insert NULL element");
        }
        if (index < 0 || index > length) {
            return fail(ArrayError.INDEX_OUT_OF_BOUND, "Index %d out of bound for insert", index);
        }
        final var growthFailure = ensureCapacity(length + 1L);
        if (growthFailure != null) {
            return growthFailure;
        }
        final var copy = copyElement(element);
        final var store = store();
        System.arraycopy(store, index, store, index + 1, length - index);
        store[index] = copy;
        length += 1;
        return StatusChannel.success();
    }

    /**
     * Removes the last element.
     */
    public @NotNull Status remove() {
        if (freed) {
            return uninitialized();
        }
        if (length == 0) {
            return fail(ArrayError.EMPTY, "Cannot remove from empty array");
        }
        removeSlot(length - 1);
        return StatusChannel.success();
    }

    /**
     * Removes the element at {@code index}, moving later elements one slot to the left, and shrinks the backing
     * store if it became underused.
     * <p>
     * Complexity: linear time.
     */
    public @NotNull Status removeAt(final int index) {
        if (freed) {
            return uninitialized();
        }
        if (index < 0 || index >= length) {
            return fail(ArrayError.INDEX_OUT_OF_BOUND, "Index %d out of bound for remove", index);
        }
        removeSlot(index);
        return StatusChannel.success();
    }

    /**
     * Appends copies of all given elements, in iteration order, growing the backing store at most once.
     * <p>
     * Failures: {@code INVALID_ARGUMENT} if the collection is {@code null}, empty, or contains {@code null}; nothing
     * is appended in that case.
     */
    public @NotNull Status addAll(final @Nullable Collection<? extends T> elements) {
        if (freed) {
            return uninitialized();
        }
        if (elements == null || elements.isEmpty()) {
            return fail(ArrayError.INVALID_ARGUMENT, "Data is null or count is zero");
        }
        return appendAll(elements.toArray());
    }

    /**
     * Appends copies of all given elements, in order.
     *
     * @see #addAll(Collection)
     */
    public @NotNull Status addAll(final T @Nullable [] elements) {
        if (freed) {
            return uninitialized();
        }
        if (elements == null || elements.length == 0) {
            return fail(ArrayError.INVALID_ARGUMENT, "Data is null or count is zero");
        }
        return appendAll(elements.clone());
    }

    /**
     * Appends copies of the given elements, in argument order. Unlike {@link #addAll(Collection)}, appending
     * nothing is a successful no-op.
     */
    @SafeVarargs
    public final @NotNull Status addm(final T @Nullable ... elements) {
        if (freed) {
            return uninitialized();
        }
        if (elements == null) {
            return fail(ArrayError.INVALID_ARGUMENT, "Data is null");
        }
        if (elements.length == 0) {
            return StatusChannel.success();
        }
        return appendAll(elements.clone());
    }

    /**
     * Returns the element at {@code index}. The element is borrowed.
     * <p>
     * Complexity: constant time.
     */
    public @NotNull Result<T> at(final int index) {
        if (freed) {
            return Result.failed(uninitialized());
        }
        if (index < 0 || index >= length) {
            return Result.failed(fail(ArrayError.INDEX_OUT_OF_BOUND, "Index %d is out of bound", index));
        }
        return succeed(elementAt(index));
    }

    /**
     * Replaces the element at {@code index} with a copy of the given one, releasing the old element.
     */
    public @NotNull Status set(final int index, final @Nullable T element) {
        if (freed) {
            return uninitialized();
        }
        if (element == null) {
            return fail(ArrayError.INVALID_ARGUMENT, "Cannot insert NULL in a jarray");
        }
        if (length == 0) {
            return fail(ArrayError.EMPTY, "Cannot set element in an empty array");
        }
        if (index < 0 || index >= length) {
            return fail(ArrayError.INDEX_OUT_OF_BOUND, "Index %d is out of bound", index);
        }
        final var copy = copyElement(element);
        final var old = elementAt(index);
        store()[index] = copy;
        release(old);
        return StatusChannel.success();
    }

    // Search.

    /**
     * Returns the first element satisfying the predicate. The element is borrowed.
     * <p>
     * Failures: {@code EMPTY} on an empty container, {@code ELEMENT_NOT_FOUND} if no element matches.
     * <p>
     * Complexity: linear time.
     */
    public <C> @NotNull Result<T> findFirst(
        final @Nullable ElementPredicate<? super T, ? super C> predicate,
        final @Nullable C context
    ) {
        final var index = findIndex(predicate, context, true);
        return index.isOk() ? succeed(elementAt(index.get())) : Result.failed(index.status());
    }

    public @NotNull Result<T> findFirst(final @Nullable Predicate<? super T> predicate) {
        return findFirst(JArray.<T>adapt(predicate), null);
    }

    /**
     * Returns the last element satisfying the predicate. The element is borrowed.
     *
     * @see #findFirst(ElementPredicate, Object)
     */
    public <C> @NotNull Result<T> findLast(
        final @Nullable ElementPredicate<? super T, ? super C> predicate,
        final @Nullable C context
    ) {
        final var index = findIndex(predicate, context, false);
        return index.isOk() ? succeed(elementAt(index.get())) : Result.failed(index.status());
    }

    public @NotNull Result<T> findLast(final @Nullable Predicate<? super T> predicate) {
        return findLast(JArray.<T>adapt(predicate), null);
    }

    /**
     * Returns the index of the first element satisfying the predicate.
     * <p>
     * On failure, the result still carries the container's length.
     */
    public <C> @NotNull Result<Integer> findFirstIndex(
        final @Nullable ElementPredicate<? super T, ? super C> predicate,
        final @Nullable C context
    ) {
        return findIndex(predicate, context, true);
    }

    public @NotNull Result<Integer> findFirstIndex(final @Nullable Predicate<? super T> predicate) {
        return findFirstIndex(JArray.<T>adapt(predicate), null);
    }

    /**
     * Returns the index of the last element satisfying the predicate.
     * <p>
     * On failure, the result still carries the container's length.
     */
    public <C> @NotNull Result<Integer> findLastIndex(
        final @Nullable ElementPredicate<? super T, ? super C> predicate,
        final @Nullable C context
    ) {
        return findIndex(predicate, context, false);
    }

    public @NotNull Result<Integer> findLastIndex(final @Nullable Predicate<? super T> predicate) {
        return findLastIndex(JArray.<T>adapt(predicate), null);
    }

    /**
     * Returns the indices of all elements equal to the given one, in ascending order, according to the equality
     * capability.
     * <p>
     * Failures: {@code EMPTY}, then {@code EQUALITY_CALLBACK_MISSING}, then {@code ELEMENT_NOT_FOUND} if nothing
     * matches.
     * <p>
     * Complexity: linear time.
     */
    public @NotNull Result<int[]> indexesOf(final @Nullable T element) {
        if (freed) {
            return Result.failed(uninitialized());
        }
        if (element == null) {
            return Result.failed(fail(ArrayError.INVALID_ARGUMENT, "Array cannot contain a NULL element"));
        }
        if (length == 0) {
            return Result.failed(fail(ArrayError.EMPTY, "Cannot search in empty array"));
        }
        final var equality = capabilities.equality();
        if (equality == null) {
            return Result.failed(fail(ArrayError.EQUALITY_CALLBACK_MISSING, "is_equal callback not set"));
        }
        final var indices = matchingIndices(element, equality);
        if (indices.length == 0) {
            return Result.failed(fail(ArrayError.ELEMENT_NOT_FOUND, "No matching elements found"));
        }
        return succeed(indices);
    }

    /**
     * Returns whether any element is equal to the given one, according to the equality capability.
     * <p>
     * Complexity: linear time, stopping at the first match.
     */
    public @NotNull Result<Boolean> contains(final @Nullable T element) {
        if (freed) {
            return Result.failed(uninitialized());
        }
        if (element == null) {
            return Result.failed(fail(ArrayError.INVALID_ARGUMENT, "Array cannot contain a NULL element"));
        }
        if (length == 0) {
            return Result.failed(fail(ArrayError.EMPTY, "Cannot check containment in an empty array"));
        }
        final var equality = capabilities.equality();
        if (equality == null) {
            return Result.failed(fail(ArrayError.EQUALITY_CALLBACK_MISSING, "is_equal callback not set"));
        }
        for (int i = 0; i < length; i += 1) {
            if (equality.test(elementAt(i), element)) {
                return succeed(true);
            }
        }
        return succeed(false);
    }

    /**
     * Returns whether any element satisfies the predicate.
     * <p>
     * Complexity: linear time, stopping at the first match.
     */
    public <C> @NotNull Result<Boolean> any(
        final @Nullable ElementPredicate<? super T, ? super C> predicate,
        final @Nullable C context
    ) {
        if (freed) {
            return Result.failed(uninitialized());
        }
        if (predicate == null) {
            return Result.failed(fail(ArrayError.INVALID_ARGUMENT, "Predicate function is null"));
        }
        if (length == 0) {
            return Result.failed(fail(ArrayError.EMPTY, "Cannot check any on an empty array"));
        }
        for (int i = 0; i < length; i += 1) {
            if (predicate.test(elementAt(i), context)) {
                return succeed(true);
            }
        }
        return succeed(false);
    }

    public @NotNull Result<Boolean> any(final @Nullable Predicate<? super T> predicate) {
        return any(JArray.<T>adapt(predicate), null);
    }

    // Transforms.

    /**
     * Sorts the elements using the comparison capability.
     *
     * @see #sort(SortMethod, Comparator)
     */
    public @NotNull Status sort(final @Nullable SortMethod method) {
        return sort(method, null);
    }

    /**
     * Sorts the elements with the given strategy, using {@code comparator} if given, the comparison capability
     * otherwise.
     * <p>
     * The sort runs on a copy of the elements, which replaces the current ones only once sorting finished. Whether
     * equal elements keep their relative order depends on the strategy.
     * <p>
     * Failures: {@code EMPTY}, then {@code COMPARE_CALLBACK_MISSING}. The container is untouched in either case.
     * <p>
     * Complexity: {@code O(n log n)} comparisons for {@link SortMethod#LIBRARY}, {@code O(n²)} for the others.
     */
    public @NotNull Status sort(final @Nullable SortMethod method, final @Nullable Comparator<? super T> comparator) {
        if (freed) {
            return uninitialized();
        }
        if (method == null) {
            return fail(ArrayError.INVALID_ARGUMENT, "Sort method cannot be NULL");
        }
        if (length == 0) {
            return fail(ArrayError.EMPTY, "Cannot sort an empty array");
        }
        final @Nullable Comparator<? super T> effectiveComparator =
            (comparator != null) ? comparator : capabilities.comparator();
        if (effectiveComparator == null) {
            return fail(ArrayError.COMPARE_CALLBACK_MISSING,
                "Either compare callback or custom compare function must be set");
        }
        final var work = allocate(capacity());
        if (work == null) {
            return fail(ArrayError.DATA_NULL, "Memory allocation failed in array_sort");
        }
        for (int i = 0; i < length; i += 1) {
            work[i] = copyElement(elementAt(i));
        }
        Sorting.sort(JArray.<T>asElements(work), length, method, effectiveComparator);
        final var old = store();
        data = work;
        releaseAll(old, length);
        return StatusChannel.success();
    }

    /**
     * Returns a new container with copies of the elements satisfying the predicate, in their original order. The
     * new container has the same kind, tables and growth multiplier, and exactly as many slots as elements.
     * <p>
     * Filtering an empty container yields an empty container. The predicate is called once per element.
     */
    @CheckReturnValue
    public <C> @NotNull Result<JArray<T>> filter(
        final @Nullable ElementPredicate<? super T, ? super C> predicate,
        final @Nullable C context
    ) {
        if (freed) {
            return Result.failed(uninitialized());
        }
        if (predicate == null) {
            return Result.failed(fail(ArrayError.INVALID_ARGUMENT, "Predicate cannot be NULL"));
        }
        final var accepted = new boolean[length];
        var count = 0;
        for (int i = 0; i < length; i += 1) {
            if (predicate.test(elementAt(i), context)) {
                accepted[i] = true;
                count += 1;
            }
        }
        final var result = derive();
        if (count > 0) {
            if (!result.reallocate(count)) {
                return Result.failed(fail(ArrayError.DATA_NULL, "Memory allocation failed for filtered array"));
            }
            for (int i = 0; i < accepted.length; i += 1) {
                if (accepted[i]) {
                    result.appendCopyUnchecked(copyElement(elementAt(i)));
                }
            }
        }
        return succeed(result);
    }

    @CheckReturnValue
    public @NotNull Result<JArray<T>> filter(final @Nullable Predicate<? super T> predicate) {
        return filter(JArray.<T>adapt(predicate), null);
    }

    /**
     * Folds the elements from first to last.
     * <p>
     * If {@code initial} is {@code null}, the first element seeds the accumulator and folding starts at the second.
     * Each accumulator the reducer returns is copied and then released, so owned containers need a reducer that
     * returns a fresh object every step. The caller owns the returned value.
     * <p>
     * Failures: {@code EMPTY} on an empty container, {@code INVALID_ARGUMENT} if the reducer returns {@code null}.
     */
    public <C> @NotNull Result<T> reduce(
        final @Nullable Reducer<T, ? super C> reducer,
        final @Nullable T initial,
        final @Nullable C context
    ) {
        return fold(reducer, initial, context, true);
    }

    public @NotNull Result<T> reduce(final @Nullable BinaryOperator<T> reducer, final @Nullable T initial) {
        return reduce(JArray.<T>adapt(reducer), initial, null);
    }

    public @NotNull Result<T> reduce(final @Nullable BinaryOperator<T> reducer) {
        return reduce(JArray.<T>adapt(reducer), null, null);
    }

    /**
     * Folds the elements from last to first.
     *
     * @see #reduce(Reducer, Object, Object)
     */
    public <C> @NotNull Result<T> reduceRight(
        final @Nullable Reducer<T, ? super C> reducer,
        final @Nullable T initial,
        final @Nullable C context
    ) {
        return fold(reducer, initial, context, false);
    }

    public @NotNull Result<T> reduceRight(final @Nullable BinaryOperator<T> reducer, final @Nullable T initial) {
        return reduceRight(JArray.<T>adapt(reducer), initial, null);
    }

    public @NotNull Result<T> reduceRight(final @Nullable BinaryOperator<T> reducer) {
        return reduceRight(JArray.<T>adapt(reducer), null, null);
    }

    /**
     * Sets every slot from {@code start} to {@code end}, both inclusive, to a fresh copy of the given element. If
     * {@code end} is past the last element, the container grows to {@code end + 1} elements.
     * <p>
     * Failures: {@code INVALID_ARGUMENT} if {@code start > end} or {@code start} is not a valid index.
     */
    public @NotNull Status fill(final @Nullable T element, final int start, final int end) {
        if (freed) {
            return uninitialized();
        }
        if (element == null) {
            return fail(ArrayError.INVALID_ARGUMENT, "Cannot insert NULL in a jarray");
        }
        if (start < 0 || start > end) {
            return fail(ArrayError.INVALID_ARGUMENT, "start (%d) cannot be higher than end (%d)", start, end);
        }
        if (start >= length) {
            return fail(ArrayError.INVALID_ARGUMENT,
                "start (%d) must be strictly lower than the length of the jarray (%d)", start, length);
        }
        final var growthFailure = ensureCapacity(end + 1L);
        if (growthFailure != null) {
            return growthFailure;
        }
        final var store = store();
        for (int i = start; i <= end; i += 1) {
            final var copy = copyElement(element);
            if (i < length) {
                final var old = elementAt(i);
                store[i] = copy;
                release(old);
            } else {
                store[i] = copy;
                length = i + 1;
            }
        }
        return StatusChannel.success();
    }

    /**
     * Joins the string forms of all elements, given by the stringify capability, with the given separator. A
     * {@code null} separator is the empty string.
     * <p>
     * Failures: {@code EMPTY}, then {@code STRINGIFY_CALLBACK_MISSING}, then {@code DATA_NULL} if the stringify
     * callback returns {@code null}.
     */
    public @NotNull Result<String> join(final @Nullable String separator) {
        if (freed) {
            return Result.failed(uninitialized());
        }
        if (length == 0) {
            return Result.failed(fail(ArrayError.EMPTY, "Cannot join elements of an empty array"));
        }
        final var stringifier = capabilities.stringifier();
        if (stringifier == null) {
            return Result.failed(fail(ArrayError.STRINGIFY_CALLBACK_MISSING, "element_to_string callback not set"));
        }
        final var effectiveSeparator = (separator == null) ? "" : separator;
        final var builder = new StringBuilder();
        for (int i = 0; i < length; i += 1) {
            final @Nullable String string = stringifier.apply(elementAt(i));
            if (string == null) {
                return Result.failed(fail(ArrayError.DATA_NULL, "element_to_string callback returned null"));
            }
            if (i > 0) {
                builder.append(effectiveSeparator);
            }
            builder.append(string);
        }
        return succeed(builder.toString());
    }

    /**
     * Returns a new container with copies of the elements of {@code first} followed by copies of the elements of
     * {@code second}, each copied the way its own container copies elements. The result takes the tables and
     * growth multiplier of {@code first}.
     * <p>
     * Failures: {@code INVALID_ARGUMENT} if either container is {@code null} or their element kinds differ.
     */
    @CheckReturnValue
    public static <T> @NotNull Result<JArray<T>> concat(
        final @Nullable JArray<T> first,
        final @Nullable JArray<T> second
    ) {
        if (first == null) {
            return Result.failed(StatusChannel.failure(null, ArrayError.INVALID_ARGUMENT,
                "Cannot concatenate a NULL JARRAY (first)"));
        }
        if (second == null) {
            return Result.failed(StatusChannel.failure(first, ArrayError.INVALID_ARGUMENT,
                "Cannot concatenate a NULL JARRAY (second)"));
        }
        if (first.freed) {
            return Result.failed(first.uninitialized());
        }
        if (second.freed) {
            return Result.failed(second.uninitialized());
        }
        if (first.kind() != second.kind()) {
            return Result.failed(first.fail(ArrayError.INVALID_ARGUMENT,
                "Element kinds do not match for concatenation (%s, %s)", first.kind(), second.kind()));
        }
        final var total = (long) first.length + second.length;
        final var result = first.derive();
        if (total > 0) {
            if (total > MAX_ARRAY_SIZE || !result.reallocate((int) total)) {
                return Result.failed(first.fail(ArrayError.DATA_NULL, "Memory allocation failed for new array"));
            }
            for (int i = 0; i < first.length; i += 1) {
                result.appendCopyUnchecked(first.copyElement(first.elementAt(i)));
            }
            for (int i = 0; i < second.length; i += 1) {
                result.appendCopyUnchecked(second.copyElement(second.elementAt(i)));
            }
        }
        return first.succeed(result);
    }

    /**
     * Reverses the order of the elements in place.
     */
    public @NotNull Status reverse() {
        if (freed) {
            return uninitialized();
        }
        if (length == 0) {
            return fail(ArrayError.EMPTY, "Cannot reverse an empty array");
        }
        final var store = store();
        for (int low = 0, high = length - 1; low < high; low += 1, high -= 1) {
            final var temp = store[low];
            store[low] = store[high];
            store[high] = temp;
        }
        return StatusChannel.success();
    }

    /**
     * Returns a new container with copies of the elements from {@code low} to {@code high}, both inclusive. A
     * {@code high} past the last element is clamped to it.
     * <p>
     * Failures: {@code EMPTY}, then {@code INVALID_ARGUMENT} if {@code low > high} or {@code low} is not a valid
     * index.
     */
    @CheckReturnValue
    public @NotNull Result<JArray<T>> subarray(final int low, final int high) {
        if (freed) {
            return Result.failed(uninitialized());
        }
        if (length == 0) {
            return Result.failed(fail(ArrayError.EMPTY, "Cannot determine a sub array with an empty array"));
        }
        if (low < 0 || low > high) {
            return Result.failed(fail(ArrayError.INVALID_ARGUMENT,
                "start (%d) cannot be higher than end (%d)", low, high));
        }
        if (low >= length) {
            return Result.failed(fail(ArrayError.INVALID_ARGUMENT,
                "start (%d) cannot be higher or equal than the length of array (%d)", low, length));
        }
        final var last = Math.min(high, length - 1);
        final var result = derive();
        if (!result.reallocate(last - low + 1)) {
            return Result.failed(fail(ArrayError.DATA_NULL, "Memory allocation failed for subarray data"));
        }
        for (int i = low; i <= last; i += 1) {
            result.appendCopyUnchecked(copyElement(elementAt(i)));
        }
        return succeed(result);
    }

    /**
     * Returns a new list with copies of all elements, in order. The caller owns the copies.
     */
    public @NotNull Result<List<T>> copyData() {
        if (freed) {
            return Result.failed(uninitialized());
        }
        final var copies = new ArrayList<T>(length);
        for (int i = 0; i < length; i += 1) {
            copies.add(copyElement(elementAt(i)));
        }
        return succeed(copies);
    }

    /**
     * Calls the action on every element, in order. The elements passed are the container's own.
     */
    public <C> @NotNull Status forEach(
        final @Nullable ElementAction<? super T, ? super C> action,
        final @Nullable C context
    ) {
        if (freed) {
            return uninitialized();
        }
        if (action == null) {
            return fail(ArrayError.INVALID_ARGUMENT, "Callback function is null");
        }
        if (length == 0) {
            return fail(ArrayError.EMPTY, "Cannot iterate over an empty array");
        }
        for (int i = 0; i < length; i += 1) {
            action.accept(elementAt(i), context);
        }
        return StatusChannel.success();
    }

    public @NotNull Status forEach(final @Nullable Consumer<? super T> action) {
        final @Nullable ElementAction<T, Object> adapted =
            (action == null) ? null : (element, context) -> action.accept(element);
        return forEach(adapted, null);
    }

    /**
     * Prints the container to standard output.
     *
     * @see #print(PrintStream)
     */
    public @NotNull Status print() {
        try (final var streams = Streams.acquire()) {
            return print(streams.out());
        }
    }

    /**
     * Prints the container to the given stream: a header line with the length and the minimum reservation, then
     * every element through the print capability, then a newline. If the override table has an array printer, it
     * prints the container instead.
     * <p>
     * Failures: {@code PRINT_CALLBACK_MISSING}, even if an array printer is installed.
     */
    public @NotNull Status print(final @NotNull PrintStream stream) {
        if (freed) {
            return uninitialized();
        }
        final var printer = capabilities.printer();
        if (printer == null) {
            return fail(ArrayError.PRINT_CALLBACK_MISSING, "The print single element callback not set");
        }
        final var arrayPrinter = overrides.arrayPrinter();
        if (arrayPrinter != null) {
            arrayPrinter.print(this, stream);
            return StatusChannel.success();
        }
        stream.printf("JARRAY [size: %d, min_alloc: %d] =>%n", length, minimumReservation);
        for (int i = 0; i < length; i += 1) {
            printer.print(elementAt(i), stream);
        }
        stream.println();
        return StatusChannel.success();
    }

    // Structural edits.

    /**
     * Removes up to {@code removeCount} elements starting at {@code index}, then inserts copies of the given
     * elements at {@code index}, in order. Removal stops quietly at the end of the container.
     * <p>
     * Failures: {@code INVALID_ARGUMENT} if {@code index} is past the end, {@code removeCount} is negative, or any
     * element is {@code null}; the container is untouched in that case.
     */
    public @NotNull Status splice(
        final int index,
        final int removeCount,
        final @Nullable Collection<? extends T> elements
    ) {
        if (freed) {
            return uninitialized();
        }
        if (elements == null) {
            return fail(ArrayError.INVALID_ARGUMENT, "Cannot splice in a NULL element list");
        }
        return spliceImpl(index, removeCount, elements.toArray());
    }

    /**
     * Removes up to {@code removeCount} elements starting at {@code index}, then inserts copies of the given
     * elements there.
     *
     * @see #splice(int, int, Collection)
     */
    @SafeVarargs
    public final @NotNull Status splice(final int index, final int removeCount, final T @Nullable ... elements) {
        if (freed) {
            return uninitialized();
        }
        if (elements == null) {
            return fail(ArrayError.INVALID_ARGUMENT, "Cannot splice in a NULL element list");
        }
        return spliceImpl(index, removeCount, elements.clone());
    }

    /**
     * Removes every element equal to any of the given values, according to the equality capability.
     * <p>
     * Values matching nothing are skipped. Running out of elements ends the operation successfully.
     * <p>
     * Failures: {@code INVALID_ARGUMENT} for a {@code null} or empty collection or a {@code null} value,
     * {@code EQUALITY_CALLBACK_MISSING} if there's anything to compare against but no equality.
     */
    public @NotNull Status removeAll(final @Nullable Collection<? extends T> values) {
        if (freed) {
            return uninitialized();
        }
        if (values == null || values.isEmpty()) {
            return fail(ArrayError.INVALID_ARGUMENT, "Data is null or count is zero");
        }
        final var candidates = values.toArray();
        if (containsNull(candidates)) {
            return fail(ArrayError.INVALID_ARGUMENT, "Array cannot contain a NULL element");
        }
        try (final var trace = new Trace(() -> "removing all occurrences of " + candidates.length + " values")) {
            trace.use();
            for (final var candidate : candidates) {
                if (length == 0) {
                    break;
                }
                final var equality = capabilities.equality();
                if (equality == null) {
                    return fail(ArrayError.EQUALITY_CALLBACK_MISSING, "is_equal callback not set");
                }
                @SuppressWarnings("unchecked") // Came from a Collection<? extends T>.
                final var indices = matchingIndices((T) candidate, equality);
                // Highest first, so earlier removals don't shift the later indices.
                for (int i = indices.length - 1; i >= 0; i -= 1) {
                    removeSlot(indices[i]);
                }
            }
        }
        return StatusChannel.success();
    }

    /**
     * Removes the first element.
     */
    public @NotNull Status shift() {
        if (freed) {
            return uninitialized();
        }
        if (length == 0) {
            return fail(ArrayError.EMPTY, "Cannot shift an empty array");
        }
        removeSlot(0);
        return StatusChannel.success();
    }

    /**
     * Inserts a copy of the given element before the first one.
     */
    public @NotNull Status shiftRight(final @Nullable T element) {
        return addAt(0, element);
    }

    // Lifecycle.

    /**
     * Returns a new container of the same kind with copies of all elements, the same minimum reservation, growth
     * multiplier and tables. The copy's capacity is the larger of the length and the minimum reservation.
     * <p>
     * Failures: {@code EMPTY} on an empty container.
     */
    @CheckReturnValue
    @SuppressWarnings({"MethodDoesntCallSuperMethod", "CloneDoesntDeclareCloneNotSupportedException"})
    @Override
    public @NotNull Result<JArray<T>> clone() {
        if (freed) {
            return Result.failed(uninitialized());
        }
        if (length == 0) {
            return Result.failed(fail(ArrayError.EMPTY, "Cannot clone an empty array"));
        }
        final var result = derive();
        if (!result.reallocate(Math.max(length, minimumReservation))) {
            return Result.failed(fail(ArrayError.DATA_NULL, "Memory allocation failed for clone data"));
        }
        result.minimumReservation = minimumReservation;
        for (int i = 0; i < length; i += 1) {
            result.appendCopyUnchecked(copyElement(elementAt(i)));
        }
        return succeed(result);
    }

    /**
     * Removes all elements. The backing store is released, unless there's a minimum reservation, in which case a
     * fresh store of exactly that many slots replaces it.
     * <p>
     * Failures: {@code DATA_NULL} if there is no backing store to clear.
     */
    public @NotNull Status clear() {
        if (freed) {
            return uninitialized();
        }
        final var old = data;
        if (old == null) {
            return fail(ArrayError.DATA_NULL, "Data field of array is null");
        }
        if (minimumReservation > 0) {
            final var fresh = allocate(minimumReservation);
            if (fresh == null) {
                return fail(ArrayError.DATA_NULL, "Memory allocation failed when clearing");
            }
            data = fresh;
        } else {
            data = null;
        }
        final var oldLength = length;
        length = 0;
        releaseAll(old, oldLength);
        return StatusChannel.success();
    }

    /**
     * Releases all elements and the backing store, and clears the tables. Every later operation except this one
     * reports {@code UNINITIALIZED}. Freeing twice is harmless.
     */
    public @NotNull Status free() {
        if (freed) {
            return StatusChannel.success();
        }
        final var old = data;
        final var oldLength = length;
        data = null;
        length = 0;
        minimumReservation = 0;
        growthMultiplier = 0;
        capabilities = Capabilities.none();
        overrides = Overrides.none();
        freed = true;
        if (old != null) {
            releaseAll(old, oldLength);
        }
        return StatusChannel.success();
    }

    @Override
    public @NotNull String toString() {
        return getClass().getSimpleName() + "[length=" + length + ", capacity=" + capacity()
            + (freed ? ", freed]" : "]");
    }

    // Initialization helpers for the factories of the subclasses.

    /**
     * Fills this new container with the given elements, copied shallowly or through {@link #copyElement}.
     */
    final @NotNull Status initFrom(final Object @Nullable [] source, final boolean deep) {
        assert length == 0 && data == null;
        if (source == null) {
            return fail(ArrayError.INVALID_ARGUMENT, "Provided data cannot be NULL");
        }
        if (containsNull(source)) {
            return fail(ArrayError.INVALID_ARGUMENT, "Array cannot contain a NULL element");
        }
        if (source.length > 0) {
            if (!reallocate(source.length)) {
                return fail(ArrayError.DATA_NULL, "Memory allocation failed in init_with_data_copy");
            }
            for (final var element : source) {
                @SuppressWarnings("unchecked") // The factories only pass arrays of T.
                final var typed = (T) element;
                appendCopyUnchecked(deep ? copyElement(typed) : typed);
            }
        }
        return StatusChannel.success();
    }

    /**
     * Makes the given array this new container's backing store, without copying.
     */
    @SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Adopting the caller's buffer is the contract")
    final @NotNull Status adoptStore(final Object @Nullable [] buffer, final int count) {
        assert length == 0 && data == null;
        if (buffer == null) {
            return fail(ArrayError.INVALID_ARGUMENT, "Provided data cannot be NULL");
        }
        if (count < 0 || count > buffer.length) {
            return fail(ArrayError.INVALID_ARGUMENT, "Length %d doesn't fit a buffer of %d slots", count,
                buffer.length);
        }
        for (int i = 0; i < count; i += 1) {
            if (buffer[i] == null) {
                return fail(ArrayError.INVALID_ARGUMENT, "Array cannot contain a NULL element");
            }
        }
        for (int i = count; i < buffer.length; i += 1) {
            buffer[i] = null;
        }
        data = (buffer.length == 0) ? null : buffer;
        length = count;
        return StatusChannel.success();
    }

    // Internals.

    private @NotNull Status spliceImpl(final int index, final int removeCount, final Object[] items) {
        if (index < 0 || index > length) {
            return fail(ArrayError.INVALID_ARGUMENT, "Splice index %d is past the length of the jarray (%d)",
                index, length);
        }
        if (removeCount < 0) {
            return fail(ArrayError.INVALID_ARGUMENT, "Remove count cannot be negative (%d)", removeCount);
        }
        if (containsNull(items)) {
            return fail(ArrayError.INVALID_ARGUMENT, "Cannot insert NULL element");
        }
        try (final var trace = new Trace(() -> "splicing " + items.length + " elements in at index " + index)) {
            trace.use();
            final var removable = Math.min(removeCount, length - index);
            if (removable == 0 && items.length == 0) {
                return StatusChannel.success();
            }
            final var newLength = (long) length - removable + items.length;
            final var growthFailure = ensureCapacity(newLength);
            if (growthFailure != null) {
                return growthFailure;
            }
            final var copies = new Object[items.length];
            for (int i = 0; i < items.length; i += 1) {
                @SuppressWarnings("unchecked") // Came from a Collection<? extends T> or a T[].
                final var typed = (T) items[i];
                copies[i] = copyElement(typed);
            }
            final var store = store();
            final var removed = new Object[removable];
            System.arraycopy(store, index, removed, 0, removable);
            System.arraycopy(store, index + removable, store, index + items.length, length - index - removable);
            System.arraycopy(copies, 0, store, index, copies.length);
            for (int i = (int) newLength; i < length; i += 1) {
                store[i] = null;
            }
            length = (int) newLength;
            if (removable > items.length) {
                shrinkAfterRemoval();
            }
            releaseAll(removed, removable);
        }
        return StatusChannel.success();
    }

    private @NotNull Status appendAll(final Object[] items) {
        if (containsNull(items)) {
            return fail(ArrayError.INVALID_ARGUMENT, "Cannot insert NULL in a jarray");
        }
        final var growthFailure = ensureCapacity((long) length + items.length);
        if (growthFailure != null) {
            return growthFailure;
        }
        for (final var item : items) {
            @SuppressWarnings("unchecked") // Came from a Collection<? extends T> or a T[].
            final var typed = (T) item;
            appendCopyUnchecked(copyElement(typed));
        }
        return StatusChannel.success();
    }

    private <C> @NotNull Result<Integer> findIndex(
        final @Nullable ElementPredicate<? super T, ? super C> predicate,
        final @Nullable C context,
        final boolean forward
    ) {
        if (freed) {
            return new Result<>(uninitialized(), length);
        }
        if (predicate == null) {
            return new Result<>(fail(ArrayError.INVALID_ARGUMENT, "Cannot find element with a NULL predicate"),
                length);
        }
        if (length == 0) {
            return new Result<>(fail(ArrayError.EMPTY, "Cannot find element in an empty array"), length);
        }
        if (forward) {
            for (int i = 0; i < length; i += 1) {
                if (predicate.test(elementAt(i), context)) {
                    return succeed(i);
                }
            }
        } else {
            for (int i = length - 1; i >= 0; i -= 1) {
                if (predicate.test(elementAt(i), context)) {
                    return succeed(i);
                }
            }
        }
        return new Result<>(fail(ArrayError.ELEMENT_NOT_FOUND,
            "Found no element corresponding with predicate conditions"), length);
    }

    private <C> @NotNull Result<T> fold(
        final @Nullable Reducer<T, ? super C> reducer,
        final @Nullable T initial,
        final @Nullable C context,
        final boolean forward
    ) {
        if (freed) {
            return Result.failed(uninitialized());
        }
        if (reducer == null) {
            return Result.failed(fail(ArrayError.INVALID_ARGUMENT, "Reducer function is null"));
        }
        if (length == 0) {
            return Result.failed(fail(ArrayError.EMPTY, "Cannot reduce an empty array"));
        }
        final var step = forward ? 1 : -1;
        var index = forward ? 0 : length - 1;
        T accumulator;
        if (initial != null) {
            accumulator = copyElement(initial);
        } else {
            accumulator = copyElement(elementAt(index));
            index += step;
        }
        for (; index >= 0 && index < length; index += step) {
            final var element = elementAt(index);
            final var next = reducer.reduce(accumulator, element, context);
            if (next == null) {
                release(accumulator);
                return Result.failed(fail(ArrayError.INVALID_ARGUMENT, "Reducer function returned null"));
            }
            final var copy = copyElement(next);
            if (next != accumulator) {
                release(accumulator);
            }
            if (next != element) {
                release(next);
            }
            accumulator = copy;
        }
        return succeed(accumulator);
    }

    private int @NotNull [] matchingIndices(
        final @NotNull T element,
        final @NotNull BiPredicate<? super T, ? super T> equality
    ) {
        final var indices = new int[length];
        var count = 0;
        for (int i = 0; i < length; i += 1) {
            if (equality.test(elementAt(i), element)) {
                indices[count] = i;
                count += 1;
            }
        }
        return Arrays.copyOf(indices, count);
    }

    private void removeSlot(final int index) {
        assert index >= 0 && index < length;
        final var store = store();
        final var removed = elementAt(index);
        System.arraycopy(store, index + 1, store, index, length - index - 1);
        length -= 1;
        store[length] = null;
        shrinkAfterRemoval();
        release(removed);
    }

    /**
     * Shrinks the backing store once the length dropped to {@code capacity / growthMultiplier} or below, keeping at
     * least the minimum reservation. An empty container without a minimum reservation loses its store entirely.
     */
    private void shrinkAfterRemoval() {
        if (length == 0 && minimumReservation == 0) {
            data = null;
            return;
        }
        final var capacity = capacity();
        final var threshold = capacity / growthMultiplier;
        if (length <= threshold) {
            final var target = Math.max(Math.max((int) threshold, length), minimumReservation);
            // A failed shrink just keeps the larger store.
            if (target < capacity) {
                reallocate(target);
            }
        }
    }

    /**
     * Grows the backing store to hold at least {@code required} slots.
     *
     * @return {@code null} on success, the reported failure otherwise.
     */
    private @Nullable Status ensureCapacity(final long required) {
        final var capacity = capacity();
        if (required <= capacity) {
            return null;
        }
        if (required > MAX_ARRAY_SIZE) {
            return fail(ArrayError.DATA_NULL, "Cannot grow to %d slots", required);
        }
        var newCapacity = (long) capacity;
        while (newCapacity < required) {
            newCapacity = Math.max((long) (newCapacity * growthMultiplier), newCapacity + 1);
        }
        if (!reallocate((int) Math.min(newCapacity, MAX_ARRAY_SIZE))) {
            return fail(ArrayError.DATA_NULL, "Memory allocation failed in add");
        }
        return null;
    }

    private boolean reallocate(final int newCapacity) {
        assert newCapacity >= length && newCapacity > 0;
        final var fresh = allocate(newCapacity);
        if (fresh == null) {
            return false;
        }
        final var old = data;
        if (old != null) {
            System.arraycopy(old, 0, fresh, 0, length);
        }
        data = fresh;
        return true;
    }

    // Callers report a null result as DATA_NULL.
    @SuppressWarnings("ErrorNotRethrown")
    private static @Nullable Object @Nullable [] allocate(final int size) {
        try {
            return new Object[size];
        } catch (final OutOfMemoryError e) {
            return null;
        }
    }

    /**
     * Stores an already copied element in the next slot. The store must have room for it.
     */
    private void appendCopyUnchecked(final @NotNull T copy) {
        store()[length] = copy;
        length += 1;
    }

    private void releaseAll(final @Nullable Object @NotNull [] elements, final int count) {
        for (int i = 0; i < count; i += 1) {
            @SuppressWarnings("unchecked")
            final var element = (T) elements[i];
            if (element != null) {
                release(element);
            }
        }
    }

    private @NotNull JArray<T> derive() {
        final var result = emptyLike();
        result.overrides = overrides;
        result.growthMultiplier = growthMultiplier;
        return result;
    }

    @SuppressWarnings("nullness:return") // Only called when there are elements, so the store is present.
    private @Nullable Object @NotNull [] store() {
        assert data != null : "Backing store absent";
        return data;
    }

    @SuppressWarnings({"unchecked", "nullness:return"}) // Occupied slots always hold a T.
    private @NotNull T elementAt(final int index) {
        assert index >= 0 && index < length;
        return (T) store()[index];
    }

    @SuppressWarnings("unchecked")
    private static <T> T @NotNull [] asElements(final @Nullable Object @NotNull [] work) {
        return (T[]) work; // Erased, so this is always fine.
    }

    private <V> @NotNull Result<V> succeed(final @NotNull V value) {
        StatusChannel.success();
        return Result.ok(value);
    }

    private @NotNull Status uninitialized() {
        return fail(ArrayError.UNINITIALIZED, "Operation on a freed JARRAY");
    }

    private @NotNull Status fail(final @NotNull ArrayError kind, final @NotNull String format, final Object... args) {
        return StatusChannel.failure(this, kind, format, args);
    }

    private static boolean containsNull(final @Nullable Object @NotNull [] items) {
        for (final var item : items) {
            if (item == null) {
                return true;
            }
        }
        return false;
    }

    private static <T> @Nullable ElementPredicate<T, Object> adapt(final @Nullable Predicate<? super T> predicate) {
        return (predicate == null) ? null : (element, context) -> predicate.test(element);
    }

    private static <T> @Nullable Reducer<T, Object> adapt(final @Nullable BinaryOperator<T> operator) {
        return (operator == null) ? null : (accumulator, element, context) -> operator.apply(accumulator, element);
    }

    /**
     * The growth multiplier of new containers.
     */
    public static final double DEFAULT_GROWTH_MULTIPLIER = 2.0;

    // Some VMs reserve header words in arrays, so stay a bit below Integer.MAX_VALUE.
    private static final int MAX_ARRAY_SIZE = Integer.MAX_VALUE - 8;

    private @Nullable Object @Nullable [] data = null;
    private int length = 0;
    private int minimumReservation = 0;
    private double growthMultiplier = DEFAULT_GROWTH_MULTIPLIER;
    private @NotNull Capabilities<T> capabilities;
    private @NotNull Overrides<T> overrides = Overrides.none();
    private boolean freed = false;
}
