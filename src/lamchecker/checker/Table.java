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

import lamchecker.core.Signature;
import lamchecker.core.Syntax.Term;

/**
 * A read-only view of a checker table, as seen by the step evaluator. Besides
 * the entries themselves this exposes the atom, etom and import sorts (through
 * {@link Signature}) and the definitions of etoms introduced by definition
 * steps.
 *
 * @author David J. Pearce
 *
 */
public interface Table extends Signature {
	/**
	 * Get the entry at a given position, or <code>null</code> if no such
	 * position exists.
	 *
	 * @param position
	 * @return
	 */
	public REntry get(int position);

	public int size();

	/**
	 * Get the position of a given entry, or <code>-1</code> if it is not
	 * present.
	 *
	 * @param e
	 * @return
	 */
	public int indexOf(REntry e);

	/**
	 * The number of etoms allocated so far. The next allocated etom receives
	 * this index.
	 *
	 * @return
	 */
	public int etomCount();

	/**
	 * Get the defining term of a given etom, or <code>null</code> if it was
	 * introduced by skolemization (or does not exist).
	 *
	 * @param etom
	 * @return
	 */
	public Term definition(int etom);
}
