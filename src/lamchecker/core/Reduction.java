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

import java.util.BitSet;
import java.util.List;

import lamchecker.core.Syntax.Sort;
import lamchecker.core.Syntax.Term;
import lamchecker.util.CheckError;
import lamchecker.util.Pair;

/**
 * Operations over the de Bruijn representation of terms: lifting and lowering
 * of loose bound variables, instantiation, beta reduction and the resolution
 * of import-form logical primitives.
 *
 * @author David J. Pearce
 *
 */
public class Reduction {
	public final static String UNRESOLVED_IMPORT = "import index has no sort";

	// ================================================================================
	// Lifting & Lowering
	// ================================================================================

	/**
	 * Increment every loose bound variable of a term by <code>n</code>.
	 *
	 * @param t
	 * @param n
	 * @return
	 */
	public static Term bvarLifts(Term t, int n) {
		return bvarLiftsIdx(t, 0, n);
	}

	/**
	 * Increment every bound variable at or above <code>idx</code> by
	 * <code>n</code>.
	 *
	 * @param t
	 * @param idx
	 * @param n
	 * @return
	 */
	public static Term bvarLiftsIdx(Term t, int idx, int n) {
		if (n == 0 || t.maxLooseBVarSucc() <= idx) {
			return t;
		}
		switch (t.getOpcode()) {
		case Syntax.TERM_bvar: {
			Term.BVar b = (Term.BVar) t;
			return new Term.BVar(b.index() + n);
		}
		case Syntax.TERM_lam: {
			Term.Lam l = (Term.Lam) t;
			return new Term.Lam(l.binder(), bvarLiftsIdx(l.body(), idx + 1, n));
		}
		case Syntax.TERM_app: {
			Term.App a = (Term.App) t;
			return new Term.App(a.argSort(), bvarLiftsIdx(a.fn(), idx, n), bvarLiftsIdx(a.arg(), idx, n));
		}
		default:
			return t;
		}
	}

	/**
	 * Check whether bound variable <code>idx</code> occurs loose in a term.
	 *
	 * @param t
	 * @param idx
	 * @return
	 */
	public static boolean hasLooseBVar(Term t, int idx) {
		if (t.maxLooseBVarSucc() <= idx) {
			return false;
		}
		switch (t.getOpcode()) {
		case Syntax.TERM_bvar:
			return ((Term.BVar) t).index() == idx;
		case Syntax.TERM_lam:
			return hasLooseBVar(((Term.Lam) t).body(), idx + 1);
		case Syntax.TERM_app: {
			Term.App a = (Term.App) t;
			return hasLooseBVar(a.fn(), idx) || hasLooseBVar(a.arg(), idx);
		}
		default:
			return false;
		}
	}

	/**
	 * Decrement every bound variable above <code>idx</code> by one. The caller
	 * is responsible for ensuring that <code>#idx</code> does not occur loose.
	 *
	 * @param t
	 * @param idx
	 * @return
	 */
	public static Term bvarLowers(Term t, int idx) {
		if (t.maxLooseBVarSucc() <= idx) {
			return t;
		}
		switch (t.getOpcode()) {
		case Syntax.TERM_bvar: {
			Term.BVar b = (Term.BVar) t;
			return b.index() > idx ? new Term.BVar(b.index() - 1) : t;
		}
		case Syntax.TERM_lam: {
			Term.Lam l = (Term.Lam) t;
			return new Term.Lam(l.binder(), bvarLowers(l.body(), idx + 1));
		}
		case Syntax.TERM_app: {
			Term.App a = (Term.App) t;
			return new Term.App(a.argSort(), bvarLowers(a.fn(), idx), bvarLowers(a.arg(), idx));
		}
		default:
			return t;
		}
	}

	// ================================================================================
	// Instantiation
	// ================================================================================

	/**
	 * Substitute a given argument for bound variable <code>#0</code> in a given
	 * body, lowering all other loose bound variables by one.
	 *
	 * @param body
	 * @param arg
	 * @return
	 */
	public static Term instantiate1(Term body, Term arg) {
		return instantiateAt(body, 0, new Term[] { arg });
	}

	/**
	 * Simultaneously substitute <code>args[i]</code> for bound variable
	 * <code>#i</code> in a given body, lowering all other loose bound variables
	 * by <code>args.length</code>.
	 *
	 * @param body
	 * @param args
	 * @return
	 */
	public static Term instantiateN(Term body, Term[] args) {
		return instantiateAt(body, 0, args);
	}

	private static Term instantiateAt(Term t, int lvl, Term[] args) {
		if (t.maxLooseBVarSucc() <= lvl) {
			return t;
		}
		switch (t.getOpcode()) {
		case Syntax.TERM_bvar: {
			int i = ((Term.BVar) t).index();
			if (i < lvl) {
				return t;
			} else if (i < lvl + args.length) {
				return bvarLifts(args[i - lvl], lvl);
			} else {
				return new Term.BVar(i - args.length);
			}
		}
		case Syntax.TERM_lam: {
			Term.Lam l = (Term.Lam) t;
			return new Term.Lam(l.binder(), instantiateAt(l.body(), lvl + 1, args));
		}
		case Syntax.TERM_app: {
			Term.App a = (Term.App) t;
			return new Term.App(a.argSort(), instantiateAt(a.fn(), lvl, args), instantiateAt(a.arg(), lvl, args));
		}
		default:
			return t;
		}
	}

	// ================================================================================
	// Beta Reduction
	// ================================================================================

	/**
	 * Check whether the head of a term is a beta redex, i.e. an abstraction
	 * applied to at least one argument.
	 *
	 * @param t
	 * @return
	 */
	public static boolean hasHeadRedex(Term t) {
		return t instanceof Term.App && Syntax.getAppFn(t) instanceof Term.Lam;
	}

	/**
	 * Contract head redexes until the head of the term is no longer an
	 * abstraction applied to an argument.
	 *
	 * @param t
	 * @return
	 */
	public static Term headBeta(Term t) {
		while (hasHeadRedex(t)) {
			Term.Lam fn = (Term.Lam) Syntax.getAppFn(t);
			List<Pair<Sort, Term>> args = Syntax.getAppArgs(t);
			Term body = instantiate1(fn.body(), args.get(0).second());
			t = Syntax.mkAppN(body, args.subList(1, args.size()));
		}
		return t;
	}

	/**
	 * Check whether a term contains a beta redex anywhere.
	 *
	 * @param t
	 * @return
	 */
	public static boolean hasRedex(Term t) {
		switch (t.getOpcode()) {
		case Syntax.TERM_lam:
			return hasRedex(((Term.Lam) t).body());
		case Syntax.TERM_app: {
			Term.App a = (Term.App) t;
			return a.fn() instanceof Term.Lam || hasRedex(a.fn()) || hasRedex(a.arg());
		}
		default:
			return false;
		}
	}

	/**
	 * Reduce a term in normal order, performing at most <code>bound</code>
	 * contractions.
	 *
	 * @param t
	 * @param bound
	 * @return
	 */
	public static Term betaBounded(Term t, int bound) {
		for (int i = 0; i < bound; ++i) {
			Term r = betaStep(t);
			if (r == null) {
				break;
			}
			t = r;
		}
		return t;
	}

	/**
	 * Contract the leftmost-outermost redex of a term, or return
	 * <code>null</code> if it is in normal form.
	 *
	 * @param t
	 * @return
	 */
	private static Term betaStep(Term t) {
		switch (t.getOpcode()) {
		case Syntax.TERM_lam: {
			Term.Lam l = (Term.Lam) t;
			Term body = betaStep(l.body());
			return body == null ? null : new Term.Lam(l.binder(), body);
		}
		case Syntax.TERM_app: {
			Term.App a = (Term.App) t;
			if (a.fn() instanceof Term.Lam) {
				return instantiate1(((Term.Lam) a.fn()).body(), a.arg());
			}
			Term fn = betaStep(a.fn());
			if (fn != null) {
				return new Term.App(a.argSort(), fn, a.arg());
			}
			Term arg = betaStep(a.arg());
			return arg == null ? null : new Term.App(a.argSort(), a.fn(), arg);
		}
		default:
			return null;
		}
	}

	// ================================================================================
	// Import Resolution
	// ================================================================================

	/**
	 * Check whether a term contains any import-form logical primitive.
	 *
	 * @param t
	 * @return
	 */
	public static boolean hasImport(Term t) {
		switch (t.getOpcode()) {
		case Syntax.TERM_const: {
			Constant c = ((Term.Const) t).constant();
			return c instanceof Constant.Logical && ((Constant.Logical) c).isImport();
		}
		case Syntax.TERM_lam:
			return hasImport(((Term.Lam) t).body());
		case Syntax.TERM_app: {
			Term.App a = (Term.App) t;
			return hasImport(a.fn()) || hasImport(a.arg());
		}
		default:
			return false;
		}
	}

	/**
	 * Replace every import-form logical primitive by its resolved form, using
	 * the import table of a given signature. Resolved terms are unchanged, and
	 * bound variables and etoms are never touched.
	 *
	 * @param t
	 * @param signature
	 * @return
	 */
	public static Term resolveImport(Term t, Signature signature) {
		switch (t.getOpcode()) {
		case Syntax.TERM_const: {
			Constant c = ((Term.Const) t).constant();
			if (c instanceof Constant.Logical && ((Constant.Logical) c).isImport()) {
				Constant.Logical l = (Constant.Logical) c;
				Sort s = signature.importSort(l.importIndex());
				if (s == null) {
					throw new CheckError(CheckError.Kind.UNRESOLVED_IMPORT, UNRESOLVED_IMPORT, t);
				}
				return new Term.Const(l.resolve(s));
			}
			return t;
		}
		case Syntax.TERM_lam: {
			Term.Lam l = (Term.Lam) t;
			Term body = resolveImport(l.body(), signature);
			return body == l.body() ? t : new Term.Lam(l.binder(), body);
		}
		case Syntax.TERM_app: {
			Term.App a = (Term.App) t;
			Term fn = resolveImport(a.fn(), signature);
			Term arg = resolveImport(a.arg(), signature);
			return fn == a.fn() && arg == a.arg() ? t : new Term.App(a.argSort(), fn, arg);
		}
		default:
			return t;
		}
	}

	// ================================================================================
	// Renaming
	// ================================================================================

	/**
	 * A renaming of the sort atoms, term atoms and etoms of a term.
	 *
	 * @author David J. Pearce
	 *
	 */
	public interface Renaming {
		public int sortAtom(int index);

		public int atom(int index);

		public int etom(int index);
	}

	/**
	 * Rename every sort atom occurring in a sort.
	 *
	 * @param s
	 * @param r
	 * @return
	 */
	public static Sort remap(Sort s, Renaming r) {
		switch (s.getOpcode()) {
		case Syntax.SORT_atom:
			return new Sort.Atom(r.sortAtom(((Sort.Atom) s).index()));
		case Syntax.SORT_func: {
			Sort.Func f = (Sort.Func) s;
			return new Sort.Func(remap(f.domain(), r), remap(f.codomain(), r));
		}
		default:
			return s;
		}
	}

	/**
	 * Rename every sort atom, term atom and etom occurring in a term. Bound
	 * variables are untouched, and import-form primitives are left as they are
	 * since the import table is not renamed.
	 *
	 * @param t
	 * @param r
	 * @return
	 */
	public static Term remap(Term t, Renaming r) {
		switch (t.getOpcode()) {
		case Syntax.TERM_atom:
			return new Term.Atom(r.atom(((Term.Atom) t).index()));
		case Syntax.TERM_etom:
			return new Term.Etom(r.etom(((Term.Etom) t).index()));
		case Syntax.TERM_const: {
			Constant c = ((Term.Const) t).constant();
			if (c instanceof Constant.Logical && !((Constant.Logical) c).isImport()) {
				Constant.Logical l = (Constant.Logical) c;
				return new Term.Const(l.resolve(remap(l.instance(), r)));
			}
			return t;
		}
		case Syntax.TERM_lam: {
			Term.Lam l = (Term.Lam) t;
			return new Term.Lam(remap(l.binder(), r), remap(l.body(), r));
		}
		case Syntax.TERM_app: {
			Term.App a = (Term.App) t;
			return new Term.App(remap(a.argSort(), r), remap(a.fn(), r), remap(a.arg(), r));
		}
		default:
			return t;
		}
	}

	/**
	 * Collect the indices of every etom occurring in a term.
	 *
	 * @param t
	 * @param etoms
	 */
	public static void etoms(Term t, BitSet etoms) {
		if (t.maxEVarSucc() == 0) {
			return;
		}
		switch (t.getOpcode()) {
		case Syntax.TERM_etom:
			etoms.set(((Term.Etom) t).index());
			break;
		case Syntax.TERM_lam:
			etoms(((Term.Lam) t).body(), etoms);
			break;
		case Syntax.TERM_app: {
			Term.App a = (Term.App) t;
			etoms(a.fn(), etoms);
			etoms(a.arg(), etoms);
			break;
		}
		default:
			break;
		}
	}
}
