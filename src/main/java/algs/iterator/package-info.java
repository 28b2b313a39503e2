// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Position markers: immutable cursors into linear sequences, classified by capability tier.
 * <p>
 * The tiers form the hierarchy {@link algs.iterator.InputIterator} / {@link algs.iterator.OutputIterator} &lt;
 * {@link algs.iterator.ForwardIterator} &lt; {@link algs.iterator.BidirectionalIterator} &lt;
 * {@link algs.iterator.RandomAccessIterator}. Each tier is F-bounded on the concrete marker type, so an algorithm that
 * demands a given tier simply doesn't compile when handed a weaker marker.
 * <p>
 * This package also provides adapters presenting Java arrays and lists as ranges of markers, see {@link
 * algs.iterator.Iterators}.
 */
package algs.iterator;
