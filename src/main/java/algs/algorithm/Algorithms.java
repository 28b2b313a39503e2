// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package algs.algorithm;

import java.util.Comparator;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;
import java.util.function.Consumer;
import java.util.function.Predicate;
import algs.iterator.BidirectionalIterator;
import algs.iterator.ForwardIterator;
import algs.iterator.InputIterator;
import algs.iterator.OutputIterator;
import algs.iterator.RandomAccessIterator;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import org.jetbrains.annotations.NotNull;

/**
 * Generic algorithms over half-open ranges {@code [begin, end)} of position markers.
 * <p>
 * All methods are stateless and never retain references to their arguments. Markers passed in are never modified,
 * since markers are immutable; the returned marker, where there is one, is a new position in the same range.
 * <p>
 * Element equality is determined according to {@link Objects#equals(Object, Object)}, so {@code null} elements are
 * permitted everywhere equality is used. Ordering is determined by the natural ordering or an explicit comparator.
 * <p>
 * Preconditions are <em>not</em> validated: a range whose end isn't reachable from its beginning, a destination too
 * small to hold the output, or an unsorted input to {@link #binarySearch} result in unspecified behavior, which may
 * include infinite loops or exceptions thrown by the underlying container. Predicates and functions must not mutate
 * the sequence being traversed. Exceptions thrown by caller-supplied functions are passed through to the caller,
 * leaving the range in an unspecified, but valid state.
 * <p>
 * Unless noted otherwise, all algorithms run in linear time, and evaluate predicates exactly once per position, in
 * order.
 */
public final class Algorithms {
    private Algorithms() {
    }

    /**
     * Returns {@code true} iff the range {@code [begin1, end1)} is elementwise equal to the range of the same length
     * starting at {@code begin2}.
     * <p>
     * The second range must be at least as long as the first one; its length is never checked.
     */
    @CheckReturnValue
    public static <T, U, I1 extends InputIterator<T, I1>, I2 extends InputIterator<U, I2>> boolean equal(
        final @NotNull I1 begin1,
        final @NotNull I1 end1,
        final @NotNull I2 begin2
    ) {
        return equal(begin1, end1, begin2, Objects::equals);
    }

    /**
     * Like {@link #equal(InputIterator, InputIterator, InputIterator)}, but with elements considered equal iff the
     * given predicate holds for them.
     */
    @CheckReturnValue
    public static <T, U, I1 extends InputIterator<T, I1>, I2 extends InputIterator<U, I2>> boolean equal(
        final @NotNull I1 begin1,
        final @NotNull I1 end1,
        final @NotNull I2 begin2,
        final @NotNull BiPredicate<? super T, ? super U> equivalence
    ) {
        var first = begin1;
        var second = begin2;
        while (!first.equals(end1)) {
            if (!equivalence.test(first.get(), second.get())) {
                return false;
            }
            first = first.next();
            second = second.next();
        }
        return true;
    }

    /**
     * Returns the first position in {@code [begin, end)} holding an element equal to {@code value}, or {@code end} if
     * there's no such element.
     */
    @CheckReturnValue
    public static <T, I extends InputIterator<T, I>> @NotNull I find(
        final @NotNull I begin,
        final @NotNull I end,
        final T value
    ) {
        var current = begin;
        while (!current.equals(end) && !Objects.equals(current.get(), value)) {
            current = current.next();
        }
        return current;
    }

    /**
     * Returns the same position as {@link #find(InputIterator, InputIterator, Object)}, computed by tail recursion
     * over the range.
     * <p>
     * Recursion depth is bounded regardless of range length: after a fixed number of nested calls, the recursion
     * unwinds to the marker it reached and resumes from there.
     */
    @CheckReturnValue
    public static <T, I extends InputIterator<T, I>> @NotNull I rfind(
        final @NotNull I begin,
        final @NotNull I end,
        final T value
    ) {
        var current = begin;
        while (true) {
            final var reached = rfindDescend(current, end, value, maxRecursionDepth);
            if (reached.finished()) {
                return reached.position();
            }
            current = reached.position();
        }
    }

    /**
     * Returns the first position in {@code [begin, end)} whose element satisfies the given predicate, or {@code end}
     * if there's no such element.
     */
    @CheckReturnValue
    public static <T, I extends InputIterator<T, I>> @NotNull I findIf(
        final @NotNull I begin,
        final @NotNull I end,
        final @NotNull Predicate<? super T> predicate
    ) {
        var current = begin;
        while (!current.equals(end) && !predicate.test(current.get())) {
            current = current.next();
        }
        return current;
    }

    /**
     * Returns the position of the first occurrence of the subsequence {@code [needleBegin, needleEnd)} in {@code
     * [begin, end)}, or {@code end} if it doesn't occur.
     * <p>
     * An empty needle occurs at {@code begin}.
     * <p>
     * Complexity: O(n·m) comparisons in the worst case, where n and m are the lengths of the haystack and the needle.
     */
    @CheckReturnValue
    public static <I extends ForwardIterator<?, I>, J extends ForwardIterator<?, J>> @NotNull I search(
        final @NotNull I begin,
        final @NotNull I end,
        final @NotNull J needleBegin,
        final @NotNull J needleEnd
    ) {
        if (needleBegin.equals(needleEnd)) {
            return begin;
        }
        for (var start = begin; !start.equals(end); start = start.next()) {
            var haystack = start;
            var needle = needleBegin;
            while (Objects.equals(haystack.get(), needle.get())) {
                haystack = haystack.next();
                needle = needle.next();
                // Needle exhaustion is checked first: a match ending exactly at the end of the haystack is a match.
                if (needle.equals(needleEnd)) {
                    return start;
                }
                if (haystack.equals(end)) {
                    return end;
                }
            }
        }
        return end;
    }

    /**
     * Returns {@code true} iff the range {@code [begin, end)}, sorted in non-decreasing natural order, contains an
     * element equal to {@code value} according to the natural ordering.
     * <p>
     * Complexity: logarithmic time.
     */
    @CheckReturnValue
    public static <T extends Comparable<? super T>, I extends RandomAccessIterator<T, I>> boolean binarySearch(
        final @NotNull I begin,
        final @NotNull I end,
        final @NotNull T value
    ) {
        return binarySearch(begin, end, value, Comparator.naturalOrder());
    }

    /**
     * Returns {@code true} iff the range {@code [begin, end)}, sorted in non-decreasing order according to the given
     * comparator, contains an element equivalent to {@code value}.
     * <p>
     * Complexity: logarithmic time.
     */
    @CheckReturnValue
    public static <T, I extends RandomAccessIterator<T, I>> boolean binarySearch(
        final @NotNull I begin,
        final @NotNull I end,
        final T value,
        final @NotNull Comparator<? super T> comparator
    ) {
        var low = begin;
        var high = end;
        while (low.compareTo(high) < 0) {
            // Never compute (low + high) / 2: marker arithmetic may overflow for large ranges.
            final var middle = low.plus(low.distanceTo(high) / 2);
            final var element = middle.get();
            if (comparator.compare(value, element) < 0) {
                high = middle;
            } else if (comparator.compare(element, value) < 0) {
                low = middle.next();
            } else {
                return true;
            }
        }
        return false;
    }

    /**
     * Writes the elements of {@code [begin, end)} to successive positions starting at {@code destination}, returning
     * the position one past the last written element.
     */
    public static <T, I extends InputIterator<? extends T, I>, O extends OutputIterator<? super T, O>>
    @NotNull O copy(
        final @NotNull I begin,
        final @NotNull I end,
        final @NotNull O destination
    ) {
        var output = destination;
        for (var current = begin; !current.equals(end); current = current.next()) {
            output.set(current.get());
            output = output.next();
        }
        return output;
    }

    /**
     * Copies the elements of {@code [begin, end)} not equal to {@code value} to successive positions starting at
     * {@code destination}, preserving their relative order. Returns the position one past the last written element.
     */
    public static <T, I extends InputIterator<? extends T, I>, O extends OutputIterator<? super T, O>>
    @NotNull O removeCopy(
        final @NotNull I begin,
        final @NotNull I end,
        final @NotNull O destination,
        final T value
    ) {
        return removeCopyIf(begin, end, destination, element -> Objects.equals(element, value));
    }

    /**
     * Copies the elements of {@code [begin, end)} not satisfying the given predicate to successive positions starting
     * at {@code destination}, preserving their relative order. Returns the position one past the last written element.
     */
    public static <T, I extends InputIterator<? extends T, I>, O extends OutputIterator<? super T, O>>
    @NotNull O removeCopyIf(
        final @NotNull I begin,
        final @NotNull I end,
        final @NotNull O destination,
        final @NotNull Predicate<? super T> predicate
    ) {
        var output = destination;
        for (var current = begin; !current.equals(end); current = current.next()) {
            final T element = current.get();
            if (!predicate.test(element)) {
                output.set(element);
                output = output.next();
            }
        }
        return output;
    }

    /**
     * Moves the elements of {@code [begin, end)} not equal to {@code value} to the front of the range, preserving their
     * relative order, and returns the new logical end of the range.
     * <p>
     * Elements between the returned position and {@code end} are left in an unspecified, but valid state. Nothing is
     * ever removed from the underlying container.
     */
    @CheckReturnValue
    public static <T, I extends ForwardIterator<T, I>> @NotNull I remove(
        final @NotNull I begin,
        final @NotNull I end,
        final T value
    ) {
        return removeIf(begin, end, element -> Objects.equals(element, value));
    }

    /**
     * Moves the elements of {@code [begin, end)} not satisfying the given predicate to the front of the range,
     * preserving their relative order, and returns the new logical end of the range.
     * <p>
     * Elements between the returned position and {@code end} are left in an unspecified, but valid state.
     */
    @CheckReturnValue
    public static <T, I extends ForwardIterator<T, I>> @NotNull I removeIf(
        final @NotNull I begin,
        final @NotNull I end,
        final @NotNull Predicate<? super T> predicate
    ) {
        var result = begin;
        for (var current = begin; !current.equals(end); current = current.next()) {
            final var element = current.get();
            if (!predicate.test(element)) {
                // Until the first removal, every kept element is already where it belongs.
                if (!result.equals(current)) {
                    result.set(element);
                }
                result = result.next();
            }
        }
        return result;
    }

    /**
     * Replaces every element of {@code [begin, end)} equal to {@code oldValue} with {@code newValue}.
     */
    public static <T, I extends ForwardIterator<T, I>> void replace(
        final @NotNull I begin,
        final @NotNull I end,
        final T oldValue,
        final T newValue
    ) {
        for (var current = begin; !current.equals(end); current = current.next()) {
            if (Objects.equals(current.get(), oldValue)) {
                current.set(newValue);
            }
        }
    }

    /**
     * Reverses the order of elements of {@code [begin, end)} in place.
     */
    public static <T, I extends BidirectionalIterator<T, I>> void reverse(
        final @NotNull I begin,
        final @NotNull I end
    ) {
        var front = begin;
        var back = end;
        while (!front.equals(back)) {
            back = back.previous();
            if (!front.equals(back)) {
                swap(front, back);
                front = front.next();
            }
        }
    }

    /**
     * Reorders the elements of {@code [begin, end)} so that all elements satisfying the given predicate precede all
     * elements that don't, and returns the position of the first element of the second group, or {@code end} if
     * there are none.
     * <p>
     * The relative order of elements within each group is <em>not</em> preserved.
     */
    public static <T, I extends BidirectionalIterator<T, I>> @NotNull I partition(
        final @NotNull I begin,
        final @NotNull I end,
        final @NotNull Predicate<? super T> predicate
    ) {
        var front = begin;
        var back = end;
        while (!front.equals(back)) {
            while (predicate.test(front.get())) {
                front = front.next();
                if (front.equals(back)) {
                    return front;
                }
            }
            do {
                back = back.previous();
                if (front.equals(back)) {
                    return front;
                }
            } while (!predicate.test(back.get()));
            swap(front, back);
            front = front.next();
        }
        return front;
    }

    /**
     * Folds the elements of {@code [begin, end)} into {@code initial} from left to right, using the given function as
     * the in-place addition: each step replaces the accumulator with {@code addition.apply(accumulator, element)}.
     * <p>
     * Returns {@code initial} for an empty range.
     */
    public static <T, A, I extends InputIterator<T, I>> A accumulate(
        final @NotNull I begin,
        final @NotNull I end,
        final A initial,
        final @NotNull BiFunction<A, ? super T, A> addition
    ) {
        Objects.requireNonNull(addition); // Check eagerly in case the range is empty.
        var accumulator = initial;
        for (var current = begin; !current.equals(end); current = current.next()) {
            accumulator = addition.apply(accumulator, current.get());
        }
        return accumulator;
    }

    /**
     * Performs the given action on each element of {@code [begin, end)}, in order, and returns the action itself, so
     * that any state it gathered can be inspected.
     */
    public static <T, I extends InputIterator<T, I>, F extends Consumer<? super T>> @NotNull F forEach(
        final @NotNull I begin,
        final @NotNull I end,
        final @NotNull F action
    ) {
        Objects.requireNonNull(action); // Check eagerly in case the range is empty.
        for (var current = begin; !current.equals(end); current = current.next()) {
            action.accept(current.get());
        }
        return action;
    }

    /**
     * Exchanges the elements at the two given positions.
     * <p>
     * Swapping a position with itself leaves it unchanged.
     */
    public static <T, I extends ForwardIterator<T, I>, J extends ForwardIterator<T, J>> void swap(
        final @NotNull I first,
        final @NotNull J second
    ) {
        final var temporary = first.get();
        first.set(second.get());
        second.set(temporary);
    }

    /**
     * Returns {@code first} if it's strictly greater than {@code second}, {@code second} otherwise. In particular,
     * returns {@code second} when both are equal.
     */
    public static <T extends Comparable<? super T>> T max(final T first, final T second) {
        return (first.compareTo(second) > 0) ? first : second;
    }

    /**
     * Like {@link #max(Comparable, Comparable)}, but using the given comparator.
     */
    public static <T> T max(final T first, final T second, final @NotNull Comparator<? super T> comparator) {
        return (comparator.compare(first, second) > 0) ? first : second;
    }

    /**
     * Returns {@code first} if it's strictly less than {@code second}, {@code second} otherwise. In particular,
     * returns {@code second} when both are equal.
     */
    public static <T extends Comparable<? super T>> T min(final T first, final T second) {
        return (first.compareTo(second) < 0) ? first : second;
    }

    /**
     * Like {@link #min(Comparable, Comparable)}, but using the given comparator.
     */
    public static <T> T min(final T first, final T second, final @NotNull Comparator<? super T> comparator) {
        return (comparator.compare(first, second) < 0) ? first : second;
    }

    private static <T, I extends InputIterator<T, I>> @NotNull RecursionResult<I> rfindDescend(
        final @NotNull I current,
        final @NotNull I end,
        final T value,
        final int remainingDepth
    ) {
        if (current.equals(end) || Objects.equals(current.get(), value)) {
            return new RecursionResult<>(current, true);
        }
        if (remainingDepth == 0) {
            return new RecursionResult<>(current.next(), false);
        }
        return rfindDescend(current.next(), end, value, remainingDepth - 1);
    }

    // Deep enough to actually exercise recursion, shallow enough for any sane thread stack size.
    private static final int maxRecursionDepth = 1024;

    private record RecursionResult<I>(@NotNull I position, boolean finished) {
    }
}
