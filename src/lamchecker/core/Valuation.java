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

import java.util.HashMap;

import lamchecker.core.Syntax.Sort;

/**
 * An assignment of concrete values to the term atoms and existential atoms of
 * a signature, together with the interpretation bundle of every sort which is
 * compared or quantified over. A valuation is owned by whoever reified the
 * terms; the checker never constructs one.
 *
 * @author David J. Pearce
 *
 */
public class Valuation {
	private static final Semantics.SortInterp BOOLEANS = new Semantics.Finite(Boolean.FALSE, Boolean.TRUE);

	private final Object[] atoms;
	private final Object[] etoms;
	private final HashMap<Sort, Semantics.SortInterp> interps = new HashMap<>();

	public Valuation(Object[] atoms, Object[] etoms) {
		this.atoms = atoms;
		this.etoms = etoms;
	}

	public Valuation(Object... atoms) {
		this(atoms, new Object[0]);
	}

	/**
	 * Get the value assigned to a given term atom.
	 *
	 * @param index
	 * @return
	 */
	public Object atom(int index) {
		if (index < 0 || index >= atoms.length) {
			throw new IllegalArgumentException("no value for atom " + index);
		}
		return atoms[index];
	}

	/**
	 * Get the value assigned to a given existential atom.
	 *
	 * @param index
	 * @return
	 */
	public Object etom(int index) {
		if (index < 0 || index >= etoms.length) {
			throw new IllegalArgumentException("no value for etom " + index);
		}
		return etoms[index];
	}

	public int atomCount() {
		return atoms.length;
	}

	public int etomCount() {
		return etoms.length;
	}

	/**
	 * Register the interpretation bundle for a given sort. Each sort is
	 * registered at most once, and the bundles for <code>prop</code> and
	 * <code>bool</code> are built in.
	 *
	 * @param s
	 * @param interp
	 * @return
	 */
	public Valuation register(Sort s, Semantics.SortInterp interp) {
		if (s.equals(Sort.Prop) || s.equals(Sort.Bool) || interps.containsKey(s)) {
			throw new IllegalArgumentException("sort already interpreted: " + s);
		}
		interps.put(s, interp);
		return this;
	}

	/**
	 * Get the interpretation bundle for a given sort.
	 *
	 * @param s
	 * @return
	 */
	public Semantics.SortInterp interp(Sort s) {
		if (s.equals(Sort.Prop) || s.equals(Sort.Bool)) {
			return BOOLEANS;
		}
		Semantics.SortInterp r = interps.get(s);
		if (r == null) {
			throw new IllegalArgumentException("no interpretation for sort " + s);
		}
		return r;
	}
}
