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
import lamchecker.core.Syntax.Term;
import lamchecker.util.CheckError;

/**
 * The state of a single reification session: one checker table, fed with
 * atoms, external facts and checking steps in the order they are supplied.
 * A session is not thread-safe and is never shared. The first failing step
 * raises a {@link CheckError}, and the session is then expected to be
 * abandoned.
 *
 * @author David J. Pearce
 *
 */
public class Session {
	public final static String UNKNOWN_ENTRY = "entry not derived";

	private final CheckerTable table;

	public Session(Sort... atomSorts) {
		this.table = new CheckerTable(atomSorts);
	}

	/**
	 * Declare a further term atom.
	 *
	 * @param s
	 * @return The index of the new atom
	 */
	public int addAtom(Sort s) {
		return table.addAtom(s);
	}

	/**
	 * Get the import index for a given sort, allocating one if this sort has
	 * not been seen before.
	 *
	 * @param s
	 * @return
	 */
	public int importSort(Sort s) {
		return table.addImport(s);
	}

	/**
	 * Accept an external fact.
	 *
	 * @param proof
	 * @param t
	 * @return The position of the validity entry recording it
	 */
	public int assertTerm(Object proof, Term t) {
		return table.assertExternal(proof, t);
	}

	/**
	 * Apply a checking step.
	 *
	 * @param step
	 * @return The position of the derived entry
	 */
	public int apply(ChkStep step) {
		return table.apply(step);
	}

	public REntry get(int position) {
		return table.get(position);
	}

	/**
	 * Get the position of a given entry.
	 *
	 * @param e
	 * @return
	 * @throws CheckError if the entry has not been derived
	 */
	public int position(REntry e) {
		int i = table.indexOf(e);
		if (i < 0) {
			throw new CheckError(CheckError.Kind.UNDEFINED_REFERENCE, UNKNOWN_ENTRY, e);
		}
		return i;
	}

	public CheckerTable table() {
		return table;
	}

	/**
	 * Package the whole table as a certificate for the given goal entries.
	 *
	 * @param goals
	 * @return
	 */
	public Certificate certificate(REntry... goals) {
		return table.certificate(positions(goals));
	}

	/**
	 * Package only the part of the table needed for the given goal entries.
	 *
	 * @param goals
	 * @return
	 */
	public Certificate minimize(REntry... goals) {
		return new Minimizer(table).minimize(positions(goals));
	}

	private int[] positions(REntry[] goals) {
		int[] ps = new int[goals.length];
		for (int i = 0; i != goals.length; ++i) {
			ps[i] = position(goals[i]);
		}
		return ps;
	}
}
