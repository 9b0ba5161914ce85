// This file is part of the LamChecker (lamc).
//
// The LamChecker is free software; you can redistribute
// it and/or modify it under the terms of the GNU General Public
// License as published by the Free Software Foundation; either
// version 3 of the License, or (at your option) any later version.
//
// The LamChecker is distributed in the hope that it
// will be useful, but WITHOUT ANY WARRANTY; without even the
// implied warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR
// PURPOSE. See the GNU General Public License for more details.
//
// You should have received a copy of the GNU General Public
// License along with the LamChecker. If not, see
// <http://www.gnu.org/licenses/>
//
// Copyright 2018, David James Pearce.
package lamchecker.util;

import java.util.Arrays;

/**
 * Various helper functions for working with arrays, in particular the sort
 * arrays used to represent typing contexts.
 *
 * @author David J. Pearce
 *
 */
public class ArrayUtils {

	/**
	 * Append two arrays together, producing a fresh array.
	 *
	 * @param lhs
	 * @param rhs
	 * @return
	 */
	public static <T> T[] append(T[] lhs, T[] rhs) {
		T[] rs = Arrays.copyOf(lhs, lhs.length + rhs.length);
		System.arraycopy(rhs, 0, rs, lhs.length, rhs.length);
		return rs;
	}

	/**
	 * Prepend an item onto the front of an array, producing a fresh array.
	 *
	 * @param item
	 * @param items
	 * @return
	 */
	public static <T> T[] prepend(T item, T[] items) {
		T[] rs = Arrays.copyOf(items, items.length + 1);
		System.arraycopy(items, 0, rs, 1, items.length);
		rs[0] = item;
		return rs;
	}

	/**
	 * Drop the first <code>n</code> items from an array.
	 *
	 * @param items
	 * @param n
	 * @return
	 */
	public static <T> T[] drop(T[] items, int n) {
		return Arrays.copyOfRange(items, n, items.length);
	}

	/**
	 * Return a reversed copy of a given array.
	 *
	 * @param items
	 * @return
	 */
	public static <T> T[] reverse(T[] items) {
		T[] rs = Arrays.copyOf(items, items.length);
		for (int i = 0, j = items.length - 1; i < j; ++i, --j) {
			T tmp = rs[i];
			rs[i] = rs[j];
			rs[j] = tmp;
		}
		return rs;
	}

	/**
	 * Convert a string into a string of a given width by padding with spaces on
	 * the left.
	 *
	 * @param width
	 * @param str
	 * @return
	 */
	public static String leftPad(int width, String str) {
		StringBuilder r = new StringBuilder();
		for (int i = str.length(); i < width; ++i) {
			r.append(' ');
		}
		return r.append(str).toString();
	}
}
