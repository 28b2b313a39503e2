// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package algs.iterator;

import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import org.jetbrains.annotations.NotNull;

/**
 * A read-write position marker that can move in both directions.
 *
 * @param <T> the type of elements of the underlying sequence
 * @param <I> the concrete marker type
 */
public interface BidirectionalIterator<T, I extends BidirectionalIterator<T, I>> extends ForwardIterator<T, I> {
    /**
     * Returns a marker to the position immediately preceding this one.
     * <p>
     * The behavior is undefined if this marker is the beginning of its sequence.
     */
    @CheckReturnValue
    @NotNull I previous();
}
