// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package algs.iterator;

import java.util.Collection;
import java.util.List;
import org.jetbrains.annotations.NotNull;

/**
 * Factory methods for markers into standard containers, and generic marker arithmetic.
 */
public final class Iterators {
    private Iterators() {
    }

    /**
     * Returns a marker to the first element of the given array.
     * <p>
     * Complexity: constant time.
     */
    public static <T> @NotNull ArrayIterator<T> begin(final T @NotNull [] array) {
        return new ArrayIterator<>(array, 0);
    }

    /**
     * Returns a marker one past the last element of the given array.
     * <p>
     * Complexity: constant time.
     */
    public static <T> @NotNull ArrayIterator<T> end(final T @NotNull [] array) {
        return new ArrayIterator<>(array, array.length);
    }

    /**
     * Returns a marker to the first element of the given list.
     * <p>
     * Complexity: constant time.
     */
    public static <T> @NotNull ListIndexIterator<T> begin(final @NotNull List<T> list) {
        return new ListIndexIterator<>(list, 0);
    }

    /**
     * Returns a marker one past the last element of the given list, as of the time of the call.
     * <p>
     * Complexity: constant time, as long as the list's {@code size} is.
     */
    public static <T> @NotNull ListIndexIterator<T> end(final @NotNull List<T> list) {
        return new ListIndexIterator<>(list, list.size());
    }

    /**
     * Returns an output marker appending everything written through it to the given collection.
     */
    public static <T> @NotNull BackInsertIterator<T> backInserter(final @NotNull Collection<? super T> collection) {
        return new BackInsertIterator<>(collection);
    }

    /**
     * Returns the number of times {@code begin} has to be advanced to reach {@code end}.
     * <p>
     * Complexity: linear time. The behavior is undefined if {@code end} is not reachable from {@code begin}.
     */
    public static <I extends InputIterator<?, I>> long distance(final @NotNull I begin, final @NotNull I end) {
        long distance = 0;
        for (var current = begin; !current.equals(end); current = current.next()) {
            distance += 1;
        }
        return distance;
    }

    /**
     * Returns the signed distance from {@code begin} to {@code end}, negative if {@code end} precedes {@code begin}.
     * <p>
     * Complexity: constant time.
     */
    public static <I extends RandomAccessIterator<?, I>> long distance(final @NotNull I begin, final @NotNull I end) {
        return begin.distanceTo(end);
    }

    /**
     * Returns the marker {@code count} positions after {@code begin}.
     * <p>
     * Complexity: linear time.
     */
    public static <I extends InputIterator<?, I>> @NotNull I advance(final @NotNull I begin, final long count) {
        assert count >= 0;
        var current = begin;
        for (long i = 0; i < count; i += 1) {
            current = current.next();
        }
        return current;
    }

    /**
     * Returns the marker {@code count} positions after {@code begin}. A negative {@code count} moves backwards.
     * <p>
     * Complexity: constant time.
     */
    public static <I extends RandomAccessIterator<?, I>> @NotNull I advance(final @NotNull I begin, final long count) {
        return begin.plus(count);
    }
}
