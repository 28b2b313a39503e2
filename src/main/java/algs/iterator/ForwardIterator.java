// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package algs.iterator;

/**
 * A forward-only position marker that supports both reading and writing at the same position.
 *
 * @param <T> the type of elements of the underlying sequence
 * @param <I> the concrete marker type
 */
public interface ForwardIterator<T, I extends ForwardIterator<T, I>> extends InputIterator<T, I>, OutputIterator<T, I> {
}
