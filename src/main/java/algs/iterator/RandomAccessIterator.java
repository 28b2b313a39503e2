// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package algs.iterator;

import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import org.jetbrains.annotations.NotNull;

/**
 * A read-write position marker supporting constant time arithmetic.
 * <p>
 * The natural ordering of markers is the order of their positions. Ordering markers into different sequences is
 * undefined.
 *
 * @param <T> the type of elements of the underlying sequence
 * @param <I> the concrete marker type
 */
public interface RandomAccessIterator<T, I extends RandomAccessIterator<T, I>>
    extends BidirectionalIterator<T, I>, Comparable<I> {
    /**
     * Returns a marker {@code offset} positions away from this one. Negative offsets move backwards.
     */
    @CheckReturnValue
    @NotNull I plus(long offset);

    /**
     * Returns the signed number of positions between this marker and the given one, that is, the {@code n} for which
     * {@code this.plus(n).equals(other)}.
     */
    long distanceTo(@NotNull I other);
}
