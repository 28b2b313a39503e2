// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package algs.test;

import java.util.ArrayList;
import java.util.List;

/**
 * The shared test vectors. Every test class holds its own instance in a field, so fixtures are rebuilt from scratch
 * for each test method.
 */
final class Fixtures {
    Fixtures() {
        for (int i = 0; i < 21; i += 1) {
            if (i < 10) {
                ascending.add(i);
                ascendingCopy.add(i);
                descending.add(10 - i);
            }
            if (isOdd(i)) {
                odd.add(i);
            } else {
                even.add(i);
            }
            zeros.add(0);
        }
    }

    static boolean isEven(final int x) {
        return x % 2 == 0;
    }

    static boolean isOdd(final int x) {
        return x % 2 != 0;
    }

    static List<Integer> ints(final int from, final int to) {
        final var list = new ArrayList<Integer>();
        for (int i = from; i < to; i += 1) {
            list.add(i);
        }
        return list;
    }

    // 0, 1, …, 9
    final List<Integer> ascending = new ArrayList<>();
    final List<Integer> ascendingCopy = new ArrayList<>();
    // 10, 9, …, 1
    final List<Integer> descending = new ArrayList<>();
    // 1, 3, …, 19
    final List<Integer> odd = new ArrayList<>();
    // 0, 2, …, 20
    final List<Integer> even = new ArrayList<>();
    // Twenty-one zeros.
    final List<Integer> zeros = new ArrayList<>();
}
