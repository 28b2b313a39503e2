// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package algs.iterator;

import org.jetbrains.annotations.NotNull;

/**
 * A random access marker into a Java array.
 * <p>
 * Only arrays of reference types are supported. Writing an element not assignable to the array's runtime component
 * type throws {@link ArrayStoreException}, just like a plain array store would.
 *
 * @param <T> the type of array elements
 */
public final class ArrayIterator<T> extends IndexIterator<T, ArrayIterator<T>> {
    ArrayIterator(final T @NotNull [] array, final int index) {
        super(index);
        assert index <= array.length;
        this.array = array;
    }

    @Override
    public T get() {
        return array[index];
    }

    @Override
    public void set(final T value) {
        array[index] = value;
    }

    @Override
    @NotNull Object container() {
        return array;
    }

    @Override
    @NotNull ArrayIterator<T> at(final int newIndex) {
        return new ArrayIterator<>(array, newIndex);
    }

    private final T @NotNull [] array;
}
