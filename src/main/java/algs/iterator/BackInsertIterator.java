// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package algs.iterator;

import java.util.Collection;
import org.jetbrains.annotations.NotNull;

/**
 * An output marker that appends every written element to a collection.
 * <p>
 * All positions of a back-inserter are the same position: {@link #next()} returns the marker itself. This allows
 * copying algorithms to write into a destination of unknown final size.
 *
 * @param <T> the type of written elements
 */
public final class BackInsertIterator<T> implements OutputIterator<T, BackInsertIterator<T>> {
    BackInsertIterator(final @NotNull Collection<? super T> collection) {
        this.collection = collection;
    }

    /**
     * Appends the given element to the underlying collection.
     *
     * @throws UnsupportedOperationException if the collection doesn't support {@link Collection#add(Object)}
     */
    @Override
    public void set(final T value) {
        collection.add(value);
    }

    @Override
    public @NotNull BackInsertIterator<T> next() {
        return this;
    }

    private final @NotNull Collection<? super T> collection;
}
