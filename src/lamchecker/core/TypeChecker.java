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

import lamchecker.core.Syntax.Sort;
import lamchecker.core.Syntax.Term;
import lamchecker.util.AbstractTransformer;
import lamchecker.util.ArrayUtils;
import lamchecker.util.CheckError;

/**
 * Responsible for sort checking a term against a typing context and a
 * signature. The algorithm is syntax directed, hence a term has at most one
 * sort in a given context. The context is an array of sorts where
 * <code>ctx[i]</code> is the sort of bound variable <code>#i</code>.
 *
 * @author David J. Pearce
 *
 */
public class TypeChecker extends AbstractTransformer<Sort[], Sort> {
	// Error messages
	public final static String UNKNOWN_ATOM = "unknown atom";
	public final static String UNKNOWN_ETOM = "unknown etom";
	public final static String UNKNOWN_IMPORT = "unknown import index";
	public final static String LOOSE_BVAR = "loose bound variable";
	public final static String EXPECTED_FUNCTION = "expected function sort";
	public final static String ARGUMENT_MISMATCH = "argument sort does not match function domain";
	public final static String ANNOTATION_MISMATCH = "application annotation does not match argument sort";
	public final static String INCOMPATIBLE_SORT = "incompatible sort";

	private final Signature signature;

	public TypeChecker(Signature signature) {
		this.signature = signature;
	}

	/**
	 * Determine the sort of a given term in a given context.
	 *
	 * @param ctx
	 * @param t
	 * @return
	 * @throws CheckError if the term is ill-typed
	 */
	public Sort check(Sort[] ctx, Term t) {
		return apply(ctx, t);
	}

	/**
	 * Check that a given term has a given sort in a given context.
	 *
	 * @param ctx
	 * @param t
	 * @param expected
	 * @return
	 */
	public Sort check(Sort[] ctx, Term t, Sort expected) {
		Sort s = apply(ctx, t);
		check(s.equals(expected), INCOMPATIBLE_SORT, t);
		return s;
	}

	/**
	 * T-Atom
	 */
	@Override
	public Sort apply(Sort[] ctx, Term.Atom t) {
		Sort s = signature.atomSort(t.index());
		check(s != null, UNKNOWN_ATOM, t);
		return s;
	}

	/**
	 * T-Etom
	 */
	@Override
	public Sort apply(Sort[] ctx, Term.Etom t) {
		Sort s = signature.etomSort(t.index());
		check(s != null, UNKNOWN_ETOM, t);
		return s;
	}

	/**
	 * T-Const
	 */
	@Override
	public Sort apply(Sort[] ctx, Term.Const t) {
		Constant c = t.constant();
		if (c instanceof Constant.Logical && ((Constant.Logical) c).isImport()) {
			Constant.Logical l = (Constant.Logical) c;
			Sort s = signature.importSort(l.importIndex());
			check(s != null, UNKNOWN_IMPORT, t);
			return Constant.Logical.sortAt(l.kind(), s);
		}
		return c.sort();
	}

	/**
	 * T-BVar
	 */
	@Override
	public Sort apply(Sort[] ctx, Term.BVar t) {
		check(t.index() < ctx.length, LOOSE_BVAR, t);
		return ctx[t.index()];
	}

	/**
	 * T-Lam
	 */
	@Override
	public Sort apply(Sort[] ctx, Term.Lam t) {
		Sort body = apply(ArrayUtils.prepend(t.binder(), ctx), t.body());
		return new Sort.Func(t.binder(), body);
	}

	/**
	 * T-App. The domain of the function, the sort of the argument and the
	 * annotation on the node must all agree.
	 */
	@Override
	public Sort apply(Sort[] ctx, Term.App t) {
		Sort fn = apply(ctx, t.fn());
		Sort arg = apply(ctx, t.arg());
		check(fn instanceof Sort.Func, EXPECTED_FUNCTION, t);
		Sort.Func f = (Sort.Func) fn;
		check(f.domain().equals(arg), ARGUMENT_MISMATCH, t);
		check(t.argSort().equals(arg), ANNOTATION_MISMATCH, t);
		return f.codomain();
	}

	private static void check(boolean ok, String msg, Object element) {
		if (!ok) {
			throw new CheckError(CheckError.Kind.ILL_TYPED, msg, element);
		}
	}
}
