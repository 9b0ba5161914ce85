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
package lamchecker.testing;

import java.util.ArrayList;
import java.util.List;

import lamchecker.core.Constant;
import lamchecker.core.Syntax.Sort;
import lamchecker.core.Syntax.Term;

/**
 * Exhaustively enumerates every term up to a given size which can be built
 * from a fixed set of leaves, binder sorts and application annotations. Terms
 * are generated by increasing size, and no term is generated twice.
 *
 * @author David J. Pearce
 *
 */
public class TermSpace {
	private final Term[] leaves;
	private final Sort[] sorts;
	/**
	 * The terms of each exact size, indexed by size.
	 */
	private final ArrayList<List<Term>> bySize = new ArrayList<>();

	/**
	 * @param leaves The terms of size one.
	 * @param sorts  The sorts used for both binders and argument annotations.
	 */
	public TermSpace(Term[] leaves, Sort[] sorts) {
		this.leaves = leaves;
		this.sorts = sorts;
		bySize.add(new ArrayList<>());
	}

	/**
	 * The default space over atoms <code>a0 : nat</code> and
	 * <code>a1 : nat → nat</code>, two bound variables, successor and the
	 * first imported equality.
	 *
	 * @return
	 */
	public static TermSpace standard() {
		Sort natToNat = new Sort.Func(Sort.Nat, Sort.Nat);
		Term[] leaves = { new Term.Atom(0), new Term.Atom(1), new Term.BVar(0), new Term.BVar(1),
				new Term.Const(Constant.NatOp.SUCC), new Term.Const(Constant.Logical.eqI(0)) };
		return new TermSpace(leaves, new Sort[] { Sort.Nat, natToNat });
	}

	/**
	 * Get all terms of exactly a given size.
	 *
	 * @param size
	 * @return
	 */
	public List<Term> ofSize(int size) {
		while (bySize.size() <= size) {
			bySize.add(generate(bySize.size()));
		}
		return bySize.get(size);
	}

	/**
	 * Get all terms up to and including a given size.
	 *
	 * @param max
	 * @return
	 */
	public List<Term> upto(int max) {
		ArrayList<Term> terms = new ArrayList<>();
		for (int i = 1; i <= max; ++i) {
			terms.addAll(ofSize(i));
		}
		return terms;
	}

	private List<Term> generate(int size) {
		ArrayList<Term> terms = new ArrayList<>();
		if (size == 1) {
			for (Term l : leaves) {
				terms.add(l);
			}
			return terms;
		}
		for (Sort s : sorts) {
			for (Term body : ofSize(size - 1)) {
				terms.add(new Term.Lam(s, body));
			}
		}
		// Split the remaining size between function and argument
		for (int i = 1; i < size - 1; ++i) {
			List<Term> fns = ofSize(i);
			List<Term> args = ofSize(size - 1 - i);
			for (Sort s : sorts) {
				for (Term fn : fns) {
					for (Term arg : args) {
						terms.add(new Term.App(s, fn, arg));
					}
				}
			}
		}
		return terms;
	}

	@Override
	public String toString() {
		return "T{" + leaves.length + "," + sorts.length + "}";
	}
}
