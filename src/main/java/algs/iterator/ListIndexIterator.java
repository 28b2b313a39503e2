// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package algs.iterator;

import java.util.List;
import org.jetbrains.annotations.NotNull;

/**
 * A random access marker into a {@link List}, addressing elements by index.
 * <p>
 * Each dereference is a call to {@link List#get(int)} or {@link List#set(int, Object)}, so the stated complexity of
 * algorithms holds only for lists implementing {@link java.util.RandomAccess}. Writing through a marker requires the
 * list to support {@code set}; structural modification of the list while markers into it are in use leaves them
 * pointing at whatever the indices now denote.
 *
 * @param <T> the type of list elements
 */
public final class ListIndexIterator<T> extends IndexIterator<T, ListIndexIterator<T>> {
    ListIndexIterator(final @NotNull List<T> list, final int index) {
        super(index);
        assert index <= list.size();
        this.list = list;
    }

    @Override
    public T get() {
        return list.get(index);
    }

    @Override
    public void set(final T value) {
        list.set(index, value);
    }

    @Override
    @NotNull Object container() {
        return list;
    }

    @Override
    @NotNull ListIndexIterator<T> at(final int newIndex) {
        return new ListIndexIterator<>(list, newIndex);
    }

    private final @NotNull List<T> list;
}
