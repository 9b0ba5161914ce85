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
package lamchecker.core;

import java.util.Arrays;

import lamchecker.core.Syntax.Sort;

/**
 * Fixes the sorts of the term atoms, existential atoms and import-form logical
 * primitives against which a term is checked. Each lookup returns
 * <code>null</code> when the given index is not defined.
 *
 * @author David J. Pearce
 *
 */
public interface Signature {

	public Sort atomSort(int index);

	public Sort etomSort(int index);

	public Sort importSort(int index);

	/**
	 * A fixed signature backed by arrays.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Impl implements Signature {
		private final Sort[] atoms;
		private final Sort[] etoms;
		private final Sort[] imports;

		public Impl(Sort[] atoms, Sort[] etoms, Sort[] imports) {
			this.atoms = atoms;
			this.etoms = etoms;
			this.imports = imports;
		}

		public Impl(Sort... atoms) {
			this(atoms, new Sort[0], new Sort[0]);
		}

		@Override
		public Sort atomSort(int index) {
			return lookup(atoms, index);
		}

		@Override
		public Sort etomSort(int index) {
			return lookup(etoms, index);
		}

		@Override
		public Sort importSort(int index) {
			return lookup(imports, index);
		}

		private static Sort lookup(Sort[] sorts, int index) {
			return index >= 0 && index < sorts.length ? sorts[index] : null;
		}

		@Override
		public String toString() {
			return Arrays.toString(atoms) + Arrays.toString(etoms) + Arrays.toString(imports);
		}
	}
}
