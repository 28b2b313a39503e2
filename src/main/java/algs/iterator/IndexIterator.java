// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package algs.iterator;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.jetbrains.annotations.NotNull;

/**
 * Common base of markers into sequences addressed by an {@code int} index.
 * <p>
 * Two markers are equal iff they refer to the very same container object (by identity, not by equality of contents)
 * and to the same index.
 *
 * @param <T> the type of elements of the underlying sequence
 * @param <I> the concrete marker type
 */
public abstract sealed class IndexIterator<T, I extends IndexIterator<T, I>> implements RandomAccessIterator<T, I>
    permits ArrayIterator, ListIndexIterator {
    IndexIterator(final int index) {
        assert index >= 0;
        this.index = index;
    }

    /**
     * Returns the index in the underlying container this marker points to.
     */
    public final int index() {
        return index;
    }

    @Override
    public final @NotNull I next() {
        return at(index + 1);
    }

    @Override
    public final @NotNull I previous() {
        return at(index - 1);
    }

    /**
     * {@inheritDoc}
     *
     * @throws ArithmeticException if the resulting index doesn't fit in an {@code int}
     */
    @Override
    public final @NotNull I plus(final long offset) {
        return (offset == 0) ? self() : at(Math.toIntExact(index + offset));
    }

    @Override
    public final long distanceTo(final @NotNull I other) {
        assert sameContainer(other);
        return (long) other.index - index;
    }

    @Override
    public final int compareTo(final @NotNull I other) {
        assert sameContainer(other);
        return Integer.compare(index, other.index);
    }

    @Override
    public final boolean equals(final @Nullable Object object) {
        return object instanceof IndexIterator<?, ?> other && index == other.index && sameContainer(other);
    }

    @Override
    public final int hashCode() {
        return 31 * System.identityHashCode(container()) + index;
    }

    @Override
    public final @NotNull String toString() {
        return getClass().getSimpleName() + "[" + index + "]";
    }

    abstract @NotNull Object container();

    abstract @NotNull I at(int newIndex);

    private boolean sameContainer(final @NotNull IndexIterator<?, ?> other) {
        return container() == other.container();
    }

    @SuppressWarnings("unchecked")
    private @NotNull I self() {
        return (I) this;
    }

    final int index;
}
