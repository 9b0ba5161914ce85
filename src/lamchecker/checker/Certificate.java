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
package lamchecker.checker;

import lamchecker.core.Syntax.Sort;

/**
 * A self-contained record of a derivation, suitable for independent
 * re-verification. Line <code>i</code> justifies entry <code>i</code>, and
 * the goals identify the entries the derivation was produced to establish.
 *
 * @author David J. Pearce
 *
 */
public class Certificate {
	private final Sort[] atomSorts;
	private final Sort[] importSorts;
	private final Assertion[] assertions;
	private final Line[] lines;
	private final REntry[] entries;
	private final Sort[] etomSorts;
	private final int[] goals;
	private final Reindexing reindexing;

	public Certificate(Sort[] atomSorts, Sort[] importSorts, Assertion[] assertions, Line[] lines, REntry[] entries,
			Sort[] etomSorts, int[] goals, Reindexing reindexing) {
		if (lines.length != entries.length) {
			throw new IllegalArgumentException("every entry requires exactly one line");
		}
		this.atomSorts = atomSorts;
		this.importSorts = importSorts;
		this.assertions = assertions;
		this.lines = lines;
		this.entries = entries;
		this.etomSorts = etomSorts;
		this.goals = goals;
		this.reindexing = reindexing;
	}

	public Sort[] atomSorts() {
		return atomSorts.clone();
	}

	public Sort[] importSorts() {
		return importSorts.clone();
	}

	public Assertion[] assertions() {
		return assertions.clone();
	}

	public Line[] lines() {
		return lines.clone();
	}

	public REntry[] entries() {
		return entries.clone();
	}

	public Sort[] etomSorts() {
		return etomSorts.clone();
	}

	public int[] goals() {
		return goals.clone();
	}

	/**
	 * Get the goal entries themselves.
	 *
	 * @return
	 */
	public REntry[] goalEntries() {
		REntry[] es = new REntry[goals.length];
		for (int i = 0; i != goals.length; ++i) {
			es[i] = entries[goals[i]];
		}
		return es;
	}

	public int size() {
		return entries.length;
	}

	/**
	 * The maps from the indices of the table this certificate was minimised
	 * from to its own, or <code>null</code> if it was taken directly from a
	 * table.
	 *
	 * @return
	 */
	public Reindexing reindexing() {
		return reindexing;
	}

	/**
	 * Old to new index maps produced by minimisation. An index which was not
	 * carried over maps to <code>-1</code>.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Reindexing {
		private final int[] positions;
		private final int[] sortAtoms;
		private final int[] atoms;
		private final int[] etoms;

		public Reindexing(int[] positions, int[] sortAtoms, int[] atoms, int[] etoms) {
			this.positions = positions;
			this.sortAtoms = sortAtoms;
			this.atoms = atoms;
			this.etoms = etoms;
		}

		public int position(int old) {
			return lookup(positions, old);
		}

		public int sortAtom(int old) {
			return lookup(sortAtoms, old);
		}

		public int atom(int old) {
			return lookup(atoms, old);
		}

		public int etom(int old) {
			return lookup(etoms, old);
		}

		private static int lookup(int[] map, int old) {
			return old >= 0 && old < map.length ? map[old] : -1;
		}
	}
}
