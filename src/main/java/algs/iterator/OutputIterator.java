// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package algs.iterator;

import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import org.jetbrains.annotations.NotNull;

/**
 * A write-only position marker that can only move forward.
 * <p>
 * Writing through a marker mutates the underlying sequence, never the marker itself.
 *
 * @param <T> the type of elements accepted by the underlying sequence
 * @param <O> the concrete marker type
 */
public interface OutputIterator<T, O extends OutputIterator<T, O>> {
    /**
     * Stores the given element at this position.
     */
    void set(T value);

    /**
     * Returns a marker to the position immediately following this one.
     */
    @CheckReturnValue
    @NotNull O next();
}
