// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package algs.iterator;

import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import org.jetbrains.annotations.NotNull;

/**
 * A read-only position marker that can only move forward.
 * <p>
 * Markers are immutable values: moving a marker produces a new marker, the original keeps pointing where it did.
 * Two markers are at the same position iff they're {@linkplain Object#equals(Object) equal}, so implementations
 * <em>must</em> override {@code equals} and {@code hashCode}. Comparing markers into different sequences is allowed,
 * they're just never equal.
 *
 * @param <T> the type of elements of the underlying sequence
 * @param <I> the concrete marker type
 */
public interface InputIterator<T, I extends InputIterator<T, I>> {
    /**
     * Returns the element at this position.
     * <p>
     * The behavior is undefined if this marker is the end of its range.
     */
    T get();

    /**
     * Returns a marker to the position immediately following this one.
     */
    @CheckReturnValue
    @NotNull I next();
}
