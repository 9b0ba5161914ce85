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

import lamchecker.core.Syntax.Term;

/**
 * An external fact supplied by the reifier: an opaque proof value together
 * with the closed proposition it establishes. The proof value is carried
 * through to the certificate untouched.
 *
 * @author David J. Pearce
 *
 */
public class Assertion {
	private final Object proof;
	private final Term term;

	public Assertion(Object proof, Term term) {
		this.proof = proof;
		this.term = term;
	}

	public Object proof() {
		return proof;
	}

	public Term term() {
		return term;
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof Assertion) {
			Assertion a = (Assertion) o;
			return term.equals(a.term) && (proof == null ? a.proof == null : proof.equals(a.proof));
		}
		return false;
	}

	@Override
	public int hashCode() {
		return term.hashCode();
	}

	@Override
	public String toString() {
		return "assert " + term;
	}
}
