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

import java.util.Arrays;

import lamchecker.core.Reduction;
import lamchecker.core.Syntax;
import lamchecker.core.Syntax.Sort;
import lamchecker.core.Syntax.Term;
import lamchecker.core.TypeChecker;
import lamchecker.util.ArrayUtils;
import lamchecker.util.CheckError;

/**
 * Evaluates checking steps against a table. Evaluation is a pure function of
 * the table and the step: it never mutates the table, and evaluating the same
 * step against the same table twice yields the same result (including the
 * same failure).
 *
 * @author David J. Pearce
 *
 */
public class StepEvaluator {
	/**
	 * Enable or disable debugging output.
	 */
	private static final boolean DEBUG = false;
	// Error messages
	public final static String UNKNOWN_POSITION = "position does not exist";
	public final static String UNKNOWN_ATOM = "unknown atom";
	public final static String UNKNOWN_ETOM = "unknown etom";
	public final static String UNEXPECTED_ETOM = "definition does not name the next etom";
	public final static String CONFLICTING_DEFINITION = "etom already has a different definition";
	public final static String EXPECTED_WF = "expected well-formedness entry";
	public final static String EXPECTED_VALID = "expected validity entry";
	public final static String EXPECTED_NONEMPTY = "expected non-emptiness entry";
	public final static String CONTEXT_MISMATCH = "premise contexts differ";
	public final static String CONTEXT_TOO_SHORT = "context has too few binders";
	public final static String EXPECTED_FORALL = "expected binder-closed universal quantifier";
	public final static String EXPECTED_EXISTS = "expected existential quantifier";
	public final static String EXPECTED_IMPLICATION = "expected implication";
	public final static String HYPOTHESIS_MISMATCH = "hypothesis does not match antecedent";
	public final static String EXPECTED_EQUALITY = "expected equality";
	public final static String EXPECTED_FUNCTION_EQUALITY = "expected equality at a function sort";
	public final static String EQUALITY_MISMATCH = "equalities do not chain";
	public final static String SORT_MISMATCH = "sort does not match";
	public final static String NO_HEAD_REDEX = "no head redex";
	public final static String NO_REDEX = "no redex";
	public final static String BVAR_OCCURS = "bound variable 0 occurs in term";
	public final static String TOO_FEW_BINDERS = "fewer binders than witnesses";
	public final static String TOO_FEW_ARGUMENTS = "fewer arguments than equations";
	public final static String MISSING_PREMISES = "missing premises";
	public final static String ASSERTION_HAS_ETOM = "assertion mentions an etom";
	public final static String SKOLEM_ENTRY_EXISTS = "skolemized entry already derived";

	private static final Sort[] EMPTY_CONTEXT = new Sort[0];

	/**
	 * Evaluate a given step against a given table.
	 *
	 * @param table
	 * @param step
	 * @return
	 */
	public EvalResult evaluate(Table table, ChkStep step) {
		EvalResult r;
		try {
			r = apply(table, step);
		} catch (CheckError e) {
			r = new EvalResult.Fail(e);
		}
		if (DEBUG) {
			System.err.println(ArrayUtils.leftPad(6, Integer.toString(table.size())) + " | " + step + " ==> " + r);
		}
		return r;
	}

	/**
	 * Evaluate an external assertion. The term must be a closed proposition
	 * which mentions no etom.
	 *
	 * @param table
	 * @param t
	 * @return
	 */
	public EvalResult assertion(Table table, Term t) {
		try {
			new TypeChecker(table).check(EMPTY_CONTEXT, t, Sort.Prop);
			check(t.maxEVarSucc() == 0, ASSERTION_HAS_ETOM, t);
			return new EvalResult.AddEntry(REntry.valid(EMPTY_CONTEXT, t));
		} catch (CheckError e) {
			return new EvalResult.Fail(e);
		}
	}

	private EvalResult apply(Table table, ChkStep step) {
		switch (step.getOpcode()) {
		case ChkStep.WF_OF_CHECK:
			return wfOfCheck(table, (ChkStep.Check) step);
		case ChkStep.WF_OF_APPEND:
		case ChkStep.WF_OF_PREPEND:
		case ChkStep.VALID_OF_APPEND:
		case ChkStep.VALID_OF_PREPEND:
			return ofExtend(table, (ChkStep.Extend) step);
		case ChkStep.VALID_OF_INTRO1F:
			return validOfIntro1F(table, (ChkStep.Ref) step);
		case ChkStep.VALID_OF_INTRO1H:
			return validOfIntro1H(table, (ChkStep.Ref) step);
		case ChkStep.VALID_OF_INTRO_N:
			return validOfIntroN(table, (ChkStep.Bounded) step);
		case ChkStep.VALID_OF_REVERT1:
			return validOfRevert1(table, (ChkStep.Ref) step);
		case ChkStep.VALID_OF_REVERT_N:
			return validOfRevertN(table, (ChkStep.Bounded) step);
		case ChkStep.WF_OF_HEAD_BETA:
		case ChkStep.VALID_OF_HEAD_BETA:
			return ofHeadBeta(table, (ChkStep.Ref) step);
		case ChkStep.WF_OF_BETA_BOUNDED:
		case ChkStep.VALID_OF_BETA_BOUNDED:
			return ofBetaBounded(table, (ChkStep.Bounded) step);
		case ChkStep.VALID_OF_EXTENSIONALIZE:
			return validOfExtensionalize(table, (ChkStep.Ref) step);
		case ChkStep.VALID_OF_IMP:
		case ChkStep.VALID_OF_IMPS:
			return validOfImps(table, (ChkStep.Ref) step);
		case ChkStep.VALID_OF_INSTANTIATE:
		case ChkStep.VALID_OF_INSTANTIATE_REV:
			return validOfInstantiate(table, (ChkStep.Instantiate) step);
		case ChkStep.VALID_OF_INSTANTIATE_CTX:
			return validOfInstantiateCtx(table, (ChkStep.Instantiate) step);
		case ChkStep.VALID_OF_CONGR_ARG:
		case ChkStep.VALID_OF_CONGR_ARGS:
			return validOfCongrArgs(table, (ChkStep.Ref) step);
		case ChkStep.VALID_OF_CONGR_FUN:
		case ChkStep.VALID_OF_CONGR_FUN_N:
			return validOfCongrFunN(table, (ChkStep.Ref) step);
		case ChkStep.VALID_OF_CONGR:
		case ChkStep.VALID_OF_CONGRS:
			return validOfCongrs(table, (ChkStep.Ref) step);
		case ChkStep.VALID_OF_EQ_SYMM:
			return validOfEqSymm(table, (ChkStep.Ref) step);
		case ChkStep.VALID_OF_EQ_TRANS:
			return validOfEqTrans(table, (ChkStep.Ref) step);
		case ChkStep.VALID_OF_EQ_MP:
			return validOfEqMP(table, (ChkStep.Ref) step);
		case ChkStep.VALID_OF_BVAR_LOWER:
			return validOfBVarLower(table, (ChkStep.Ref) step);
		case ChkStep.NONEMPTY_OF_ATOM:
		case ChkStep.NONEMPTY_OF_ETOM:
			return nonemptyOfIndex(table, (ChkStep.Index) step);
		case ChkStep.SKOLEMIZE:
			return skolemize(table, (ChkStep.Ref) step);
		case ChkStep.DEFINE:
			return define(table, (ChkStep.Define) step);
		}
		throw new IllegalArgumentException("Invalid step encountered: " + step);
	}

	// ================================================================================
	// Well-formedness & Weakening
	// ================================================================================

	private EvalResult wfOfCheck(Table table, ChkStep.Check step) {
		Sort[] ctx = step.ctx();
		Sort s = new TypeChecker(table).check(ctx, step.term());
		return add(REntry.wf(ctx, s, step.term()));
	}

	/**
	 * Append extends the context at its outermost end, hence no bound variable
	 * moves. Prepend extends it at the innermost end, hence every loose bound
	 * variable is lifted.
	 */
	private EvalResult ofExtend(Table table, ChkStep.Extend step) {
		Sort[] sorts = step.sorts();
		int pos = step.position();
		switch (step.getOpcode()) {
		case ChkStep.WF_OF_APPEND: {
			REntry.WF w = wf(table, step, pos);
			return add(REntry.wf(ArrayUtils.append(w.ctx(), sorts), w.sort(), w.term()));
		}
		case ChkStep.WF_OF_PREPEND: {
			REntry.WF w = wf(table, step, pos);
			Term t = Reduction.bvarLifts(w.term(), sorts.length);
			return add(REntry.wf(ArrayUtils.append(sorts, w.ctx()), w.sort(), t));
		}
		case ChkStep.VALID_OF_APPEND: {
			REntry.Valid v = valid(table, step, pos);
			return add(REntry.valid(ArrayUtils.append(v.ctx(), sorts), v.term()));
		}
		default: {
			REntry.Valid v = valid(table, step, pos);
			Term t = Reduction.bvarLifts(v.term(), sorts.length);
			return add(REntry.valid(ArrayUtils.append(sorts, v.ctx()), t));
		}
		}
	}

	// ================================================================================
	// Introduction & Reversion
	// ================================================================================

	private EvalResult validOfIntro1F(Table table, ChkStep.Ref step) {
		REntry.Valid v = valid(table, step, step.position(0));
		Syntax.Quantifier q = Syntax.asForall(v.term());
		check(q != null && q.body() != null, EXPECTED_FORALL, step, step.position(0));
		return add(REntry.valid(ArrayUtils.prepend(q.sort(), v.ctx()), q.body()));
	}

	private EvalResult validOfIntro1H(Table table, ChkStep.Ref step) {
		REntry.Valid v = valid(table, step, step.position(0));
		Syntax.Quantifier q = Syntax.asForall(v.term());
		check(q != null, EXPECTED_FORALL, step, step.position(0));
		Term p = Reduction.bvarLifts(q.predicate(), 1);
		Term t = new Term.App(q.sort(), p, new Term.BVar(0));
		return add(REntry.valid(ArrayUtils.prepend(q.sort(), v.ctx()), t));
	}

	private EvalResult validOfIntroN(Table table, ChkStep.Bounded step) {
		REntry.Valid v = valid(table, step, step.position());
		Sort[] ctx = v.ctx();
		Term t = v.term();
		for (int i = 0; i != step.count(); ++i) {
			Syntax.Quantifier q = Syntax.asForall(t);
			check(q != null && q.body() != null, EXPECTED_FORALL, step, step.position());
			ctx = ArrayUtils.prepend(q.sort(), ctx);
			t = q.body();
		}
		return add(REntry.valid(ctx, t));
	}

	private EvalResult validOfRevert1(Table table, ChkStep.Ref step) {
		REntry.Valid v = valid(table, step, step.position(0));
		Sort[] ctx = v.ctx();
		check(ctx.length >= 1, CONTEXT_TOO_SHORT, step, step.position(0));
		return add(REntry.valid(ArrayUtils.drop(ctx, 1), Syntax.mkForallEF(ctx[0], v.term())));
	}

	private EvalResult validOfRevertN(Table table, ChkStep.Bounded step) {
		REntry.Valid v = valid(table, step, step.position());
		Sort[] ctx = v.ctx();
		int n = step.count();
		check(ctx.length >= n, CONTEXT_TOO_SHORT, step, step.position());
		// The outermost of the reverted binders is ctx[n-1]
		Sort[] binders = ArrayUtils.reverse(Arrays.copyOf(ctx, n));
		return add(REntry.valid(ArrayUtils.drop(ctx, n), Syntax.mkForallEFN(binders, v.term())));
	}

	// ================================================================================
	// Beta Reduction
	// ================================================================================

	private EvalResult ofHeadBeta(Table table, ChkStep.Ref step) {
		int pos = step.position(0);
		if (step.getOpcode() == ChkStep.WF_OF_HEAD_BETA) {
			REntry.WF w = wf(table, step, pos);
			check(Reduction.hasHeadRedex(w.term()), NO_HEAD_REDEX, step, pos);
			return add(REntry.wf(w.ctx(), w.sort(), Reduction.headBeta(w.term())));
		} else {
			REntry.Valid v = valid(table, step, pos);
			check(Reduction.hasHeadRedex(v.term()), NO_HEAD_REDEX, step, pos);
			return add(REntry.valid(v.ctx(), Reduction.headBeta(v.term())));
		}
	}

	private EvalResult ofBetaBounded(Table table, ChkStep.Bounded step) {
		int pos = step.position();
		if (step.getOpcode() == ChkStep.WF_OF_BETA_BOUNDED) {
			REntry.WF w = wf(table, step, pos);
			check(Reduction.hasRedex(w.term()), NO_REDEX, step, pos);
			return add(REntry.wf(w.ctx(), w.sort(), Reduction.betaBounded(w.term(), step.count())));
		} else {
			REntry.Valid v = valid(table, step, pos);
			check(Reduction.hasRedex(v.term()), NO_REDEX, step, pos);
			return add(REntry.valid(v.ctx(), Reduction.betaBounded(v.term(), step.count())));
		}
	}

	// ================================================================================
	// Extensionality & Implication
	// ================================================================================

	private EvalResult validOfExtensionalize(Table table, ChkStep.Ref step) {
		int pos = step.position(0);
		REntry.Valid v = valid(table, step, pos);
		Syntax.Binary eq = Syntax.asEq(v.term());
		check(eq != null, EXPECTED_EQUALITY, step, pos);
		check(eq.sort() instanceof Sort.Func, EXPECTED_FUNCTION_EQUALITY, step, pos);
		Sort[] argTys = Sort.getArgTys(eq.sort());
		Sort res = Sort.getResTy(eq.sort());
		int n = argTys.length;
		Term lhs = Reduction.headBeta(Syntax.bvarApps(Reduction.bvarLifts(eq.lhs(), n), argTys, 0));
		Term rhs = Reduction.headBeta(Syntax.bvarApps(Reduction.bvarLifts(eq.rhs(), n), argTys, 0));
		return add(REntry.valid(v.ctx(), Syntax.mkForallEFN(argTys, Syntax.mkEq(res, lhs, rhs))));
	}

	/**
	 * Discharge the antecedents of an implication one at a time, using the
	 * hypotheses in the order given.
	 */
	private EvalResult validOfImps(Table table, ChkStep.Ref step) {
		check(step.size() >= 2, CheckError.Kind.ARITY_MISMATCH, MISSING_PREMISES, step);
		int pos = step.position(0);
		REntry.Valid imp = valid(table, step, pos);
		Sort[] ctx = imp.ctx();
		Term t = imp.term();
		for (int i = 1; i < step.size(); ++i) {
			int hpos = step.position(i);
			REntry.Valid hyp = valid(table, step, hpos);
			checkContext(ctx, hyp.ctx(), step, pos, hpos);
			Term[] parts = Syntax.asImp(t);
			check(parts != null, EXPECTED_IMPLICATION, step, pos);
			check(parts[0].equals(hyp.term()), HYPOTHESIS_MISMATCH, step, pos, hpos);
			t = parts[1];
		}
		return add(REntry.valid(ctx, t));
	}

	// ================================================================================
	// Instantiation
	// ================================================================================

	private EvalResult validOfInstantiate(Table table, ChkStep.Instantiate step) {
		int pos = step.position();
		REntry.Valid v = valid(table, step, pos);
		Sort[] ctx = v.ctx();
		Term[] ws = step.witnesses();
		int n = ws.length;
		// Peel binders, outermost first
		Sort[] binders = new Sort[n];
		Term body = v.term();
		for (int i = 0; i != n; ++i) {
			Syntax.Quantifier q = Syntax.asForall(body);
			check(q != null && q.body() != null, CheckError.Kind.ARITY_MISMATCH, TOO_FEW_BINDERS, step, pos);
			binders[i] = q.sort();
			body = q.body();
		}
		// Witnesses given innermost first are already in bound variable order
		Term[] args = step.getOpcode() == ChkStep.VALID_OF_INSTANTIATE ? ArrayUtils.reverse(ws) : ws;
		Sort[] sorts = ArrayUtils.reverse(binders);
		TypeChecker checker = new TypeChecker(table);
		for (int i = 0; i != n; ++i) {
			checker.check(ctx, args[i], sorts[i]);
		}
		return add(REntry.valid(ctx, Reduction.instantiateN(body, args)));
	}

	private EvalResult validOfInstantiateCtx(Table table, ChkStep.Instantiate step) {
		int pos = step.position();
		REntry.Valid v = valid(table, step, pos);
		Sort[] ctx = v.ctx();
		Term[] ws = step.witnesses();
		check(ctx.length >= ws.length, CheckError.Kind.ARITY_MISMATCH, TOO_FEW_BINDERS, step, pos);
		Sort[] rest = ArrayUtils.drop(ctx, ws.length);
		TypeChecker checker = new TypeChecker(table);
		for (int i = 0; i != ws.length; ++i) {
			checker.check(rest, ws[i], ctx[i]);
		}
		return add(REntry.valid(rest, Reduction.instantiateN(v.term(), ws)));
	}

	// ================================================================================
	// Congruence
	// ================================================================================

	/**
	 * From <code>f : s</code> and equations <code>a_i = b_i</code> conclude
	 * <code>f a_1 ... a_n = f b_1 ... b_n</code>.
	 */
	private EvalResult validOfCongrArgs(Table table, ChkStep.Ref step) {
		check(step.size() >= 2, CheckError.Kind.ARITY_MISMATCH, MISSING_PREMISES, step);
		int pos = step.position(0);
		REntry.WF fn = wf(table, step, pos);
		Sort[] ctx = fn.ctx();
		Syntax.Binary[] eqs = equations(table, step, ctx, 1);
		Sort[] argTys = argTys(fn.sort(), eqs.length, step, pos);
		Term[] lhs = new Term[eqs.length];
		Term[] rhs = new Term[eqs.length];
		for (int i = 0; i != eqs.length; ++i) {
			check(eqs[i].sort().equals(argTys[i]), SORT_MISMATCH, step, pos, step.position(i + 1));
			lhs[i] = eqs[i].lhs();
			rhs[i] = eqs[i].rhs();
		}
		Sort res = Sort.getResTyN(eqs.length, fn.sort());
		Term l = Syntax.mkAppN(fn.term(), argTys, lhs);
		Term r = Syntax.mkAppN(fn.term(), argTys, rhs);
		return add(REntry.valid(ctx, Syntax.mkEq(res, l, r)));
	}

	/**
	 * From <code>f = g</code> and <code>a_i : s_i</code> conclude
	 * <code>f a_1 ... a_n = g a_1 ... a_n</code>.
	 */
	private EvalResult validOfCongrFunN(Table table, ChkStep.Ref step) {
		check(step.size() >= 2, CheckError.Kind.ARITY_MISMATCH, MISSING_PREMISES, step);
		int pos = step.position(0);
		REntry.Valid v = valid(table, step, pos);
		Sort[] ctx = v.ctx();
		Syntax.Binary fn = equation(v, step, pos);
		int n = step.size() - 1;
		Sort[] argTys = argTys(fn.sort(), n, step, pos);
		Term[] args = new Term[n];
		for (int i = 0; i != n; ++i) {
			int apos = step.position(i + 1);
			REntry.WF w = wf(table, step, apos);
			checkContext(ctx, w.ctx(), step, pos, apos);
			check(w.sort().equals(argTys[i]), SORT_MISMATCH, step, pos, apos);
			args[i] = w.term();
		}
		Sort res = Sort.getResTyN(n, fn.sort());
		Term l = Syntax.mkAppN(fn.lhs(), argTys, args);
		Term r = Syntax.mkAppN(fn.rhs(), argTys, args);
		return add(REntry.valid(ctx, Syntax.mkEq(res, l, r)));
	}

	/**
	 * From <code>f = g</code> and equations <code>a_i = b_i</code> conclude
	 * <code>f a_1 ... a_n = g b_1 ... b_n</code>.
	 */
	private EvalResult validOfCongrs(Table table, ChkStep.Ref step) {
		check(step.size() >= 2, CheckError.Kind.ARITY_MISMATCH, MISSING_PREMISES, step);
		int pos = step.position(0);
		REntry.Valid v = valid(table, step, pos);
		Sort[] ctx = v.ctx();
		Syntax.Binary fn = equation(v, step, pos);
		Syntax.Binary[] eqs = equations(table, step, ctx, 1);
		Sort[] argTys = argTys(fn.sort(), eqs.length, step, pos);
		Term[] lhs = new Term[eqs.length];
		Term[] rhs = new Term[eqs.length];
		for (int i = 0; i != eqs.length; ++i) {
			check(eqs[i].sort().equals(argTys[i]), SORT_MISMATCH, step, pos, step.position(i + 1));
			lhs[i] = eqs[i].lhs();
			rhs[i] = eqs[i].rhs();
		}
		Sort res = Sort.getResTyN(eqs.length, fn.sort());
		Term l = Syntax.mkAppN(fn.lhs(), argTys, lhs);
		Term r = Syntax.mkAppN(fn.rhs(), argTys, rhs);
		return add(REntry.valid(ctx, Syntax.mkEq(res, l, r)));
	}

	private Sort[] argTys(Sort s, int n, ChkStep step, int pos) {
		Sort[] argTys = Sort.getArgTysN(n, s);
		check(argTys != null, CheckError.Kind.ARITY_MISMATCH, TOO_FEW_ARGUMENTS, step, pos);
		return argTys;
	}

	// ================================================================================
	// Equality
	// ================================================================================

	private EvalResult validOfEqSymm(Table table, ChkStep.Ref step) {
		int pos = step.position(0);
		REntry.Valid v = valid(table, step, pos);
		Syntax.Binary eq = equation(v, step, pos);
		return add(REntry.valid(v.ctx(), Syntax.mkEq(eq.sort(), eq.rhs(), eq.lhs())));
	}

	private EvalResult validOfEqTrans(Table table, ChkStep.Ref step) {
		int lpos = step.position(0);
		int rpos = step.position(1);
		REntry.Valid lv = valid(table, step, lpos);
		REntry.Valid rv = valid(table, step, rpos);
		checkContext(lv.ctx(), rv.ctx(), step, lpos, rpos);
		Syntax.Binary l = equation(lv, step, lpos);
		Syntax.Binary r = equation(rv, step, rpos);
		check(l.sort().equals(r.sort()) && l.rhs().equals(r.lhs()), EQUALITY_MISMATCH, step, lpos, rpos);
		return add(REntry.valid(lv.ctx(), Syntax.mkEq(l.sort(), l.lhs(), r.rhs())));
	}

	/**
	 * From <code>a = b</code> at sort <code>prop</code> and <code>a</code>
	 * conclude <code>b</code>.
	 */
	private EvalResult validOfEqMP(Table table, ChkStep.Ref step) {
		int epos = step.position(0);
		int vpos = step.position(1);
		REntry.Valid ev = valid(table, step, epos);
		REntry.Valid v = valid(table, step, vpos);
		checkContext(ev.ctx(), v.ctx(), step, epos, vpos);
		Syntax.Binary eq = equation(ev, step, epos);
		check(eq.sort().equals(Sort.Prop), SORT_MISMATCH, step, epos);
		check(eq.lhs().equals(v.term()), HYPOTHESIS_MISMATCH, step, epos, vpos);
		return add(REntry.valid(v.ctx(), eq.rhs()));
	}

	// ================================================================================
	// Non-emptiness
	// ================================================================================

	/**
	 * An unused innermost binder can be dropped provided its sort is inhabited.
	 */
	private EvalResult validOfBVarLower(Table table, ChkStep.Ref step) {
		int vpos = step.position(0);
		int npos = step.position(1);
		REntry.Valid v = valid(table, step, vpos);
		REntry.Nonempty ne = nonempty(table, step, npos);
		Sort[] ctx = v.ctx();
		check(ctx.length >= 1, CONTEXT_TOO_SHORT, step, vpos);
		check(ctx[0].equals(ne.sort()), SORT_MISMATCH, step, vpos, npos);
		check(!Reduction.hasLooseBVar(v.term(), 0), BVAR_OCCURS, step, vpos);
		return add(REntry.valid(ArrayUtils.drop(ctx, 1), Reduction.bvarLowers(v.term(), 0)));
	}

	private EvalResult nonemptyOfIndex(Table table, ChkStep.Index step) {
		if (step.getOpcode() == ChkStep.NONEMPTY_OF_ATOM) {
			Sort s = table.atomSort(step.index());
			check(s != null, CheckError.Kind.UNDEFINED_REFERENCE, UNKNOWN_ATOM, step);
			return add(REntry.nonempty(s));
		} else {
			Sort s = table.etomSort(step.index());
			check(s != null, CheckError.Kind.UNDEFINED_REFERENCE, UNKNOWN_ETOM, step);
			return add(REntry.nonempty(s));
		}
	}

	// ================================================================================
	// Etom Introduction
	// ================================================================================

	/**
	 * From <code>ctx ⊢ ∃s p</code> allocate a fresh etom <code>e</code> taking
	 * the context as arguments, and conclude <code>ctx ⊢ p (e #(n-1) ... #0)</code>.
	 * When <code>p</code> is an abstraction its body is instantiated directly,
	 * without reducing further. A vacuous existential whose conclusion is
	 * already present would allocate an etom with no line of its own, and so
	 * fails.
	 */
	private EvalResult skolemize(Table table, ChkStep.Ref step) {
		int pos = step.position(0);
		REntry.Valid v = valid(table, step, pos);
		Syntax.Quantifier q = Syntax.asExists(v.term());
		check(q != null, EXPECTED_EXISTS, step, pos);
		Sort[] ctx = v.ctx();
		Term.Etom e = new Term.Etom(table.etomCount());
		Sort etomSort = Sort.mkFuncsRev(q.sort(), ctx);
		Term witness = Syntax.bvarApps(e, ArrayUtils.reverse(ctx), 0);
		Term body;
		if (q.body() != null) {
			body = Reduction.instantiate1(q.body(), witness);
		} else {
			body = new Term.App(q.sort(), q.predicate(), witness);
		}
		check(table.indexOf(REntry.valid(ctx, body)) < 0, SKOLEM_ENTRY_EXISTS, step, pos);
		return new EvalResult.NewEtomWithValid(etomSort, ctx, body, null);
	}

	/**
	 * Bind the next etom to a closed term. Replaying an identical definition of
	 * an existing etom yields its defining entry again.
	 */
	private EvalResult define(Table table, ChkStep.Define step) {
		int etom = step.etom();
		int count = table.etomCount();
		Term t = step.term();
		if (etom >= 0 && etom < count) {
			Term existing = table.definition(etom);
			check(existing != null && existing.equals(t) && table.etomSort(etom).equals(step.sort()),
					CheckError.Kind.DUPLICATE_DEFINITION, CONFLICTING_DEFINITION, step);
			return add(REntry.valid(EMPTY_CONTEXT, Syntax.mkEq(step.sort(), new Term.Etom(etom), t)));
		}
		check(etom == count, CheckError.Kind.UNDEFINED_REFERENCE, UNEXPECTED_ETOM, step);
		new TypeChecker(table).check(EMPTY_CONTEXT, t, step.sort());
		Term eq = Syntax.mkEq(step.sort(), new Term.Etom(etom), t);
		return new EvalResult.NewEtomWithValid(step.sort(), EMPTY_CONTEXT, eq, t);
	}

	// ================================================================================
	// Helpers
	// ================================================================================

	private static EvalResult add(REntry e) {
		return new EvalResult.AddEntry(e);
	}

	private static REntry entry(Table table, ChkStep step, int pos) {
		REntry e = table.get(pos);
		check(e != null, CheckError.Kind.UNDEFINED_REFERENCE, UNKNOWN_POSITION, step, pos);
		return e;
	}

	private static REntry.WF wf(Table table, ChkStep step, int pos) {
		REntry e = entry(table, step, pos);
		check(e instanceof REntry.WF, EXPECTED_WF, step, pos);
		return (REntry.WF) e;
	}

	private static REntry.Valid valid(Table table, ChkStep step, int pos) {
		REntry e = entry(table, step, pos);
		check(e instanceof REntry.Valid, EXPECTED_VALID, step, pos);
		return (REntry.Valid) e;
	}

	private static REntry.Nonempty nonempty(Table table, ChkStep step, int pos) {
		REntry e = entry(table, step, pos);
		check(e instanceof REntry.Nonempty, EXPECTED_NONEMPTY, step, pos);
		return (REntry.Nonempty) e;
	}

	private static Syntax.Binary equation(REntry.Valid v, ChkStep step, int pos) {
		Syntax.Binary eq = Syntax.asEq(v.term());
		check(eq != null, EXPECTED_EQUALITY, step, pos);
		return eq;
	}

	/**
	 * Look up the equations referenced by a step from a given index onwards,
	 * each of which must share the given context.
	 */
	private static Syntax.Binary[] equations(Table table, ChkStep.Ref step, Sort[] ctx, int start) {
		Syntax.Binary[] eqs = new Syntax.Binary[step.size() - start];
		for (int i = start; i < step.size(); ++i) {
			int pos = step.position(i);
			REntry.Valid v = valid(table, step, pos);
			checkContext(ctx, v.ctx(), step, step.position(0), pos);
			eqs[i - start] = equation(v, step, pos);
		}
		return eqs;
	}

	private static void checkContext(Sort[] lhs, Sort[] rhs, ChkStep step, int... positions) {
		check(Arrays.equals(lhs, rhs), CONTEXT_MISMATCH, step, positions);
	}

	private static void check(boolean ok, String msg, Object element, int... positions) {
		check(ok, CheckError.Kind.WRONG_SHAPE, msg, element, positions);
	}

	private static void check(boolean ok, CheckError.Kind kind, String msg, Object element, int... positions) {
		if (!ok) {
			throw new CheckError(kind, msg, element, positions);
		}
	}
}
