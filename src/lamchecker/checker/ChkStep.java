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

import lamchecker.core.Syntax;
import lamchecker.core.Syntax.Sort;
import lamchecker.core.Syntax.Term;

/**
 * A single instruction of the checker's instruction set. A step refers to
 * earlier table entries by their integer position and may carry a payload of
 * sorts and terms. Steps are immutable values with structural equality.
 *
 * @author David J. Pearce
 *
 */
public abstract class ChkStep {
	public final static int WF_OF_CHECK = 0;
	public final static int WF_OF_APPEND = 1;
	public final static int WF_OF_PREPEND = 2;
	public final static int VALID_OF_APPEND = 3;
	public final static int VALID_OF_PREPEND = 4;
	public final static int VALID_OF_INTRO1F = 5;
	public final static int VALID_OF_INTRO1H = 6;
	public final static int VALID_OF_INTRO_N = 7;
	public final static int VALID_OF_REVERT1 = 8;
	public final static int VALID_OF_REVERT_N = 9;
	public final static int WF_OF_HEAD_BETA = 10;
	public final static int VALID_OF_HEAD_BETA = 11;
	public final static int WF_OF_BETA_BOUNDED = 12;
	public final static int VALID_OF_BETA_BOUNDED = 13;
	public final static int VALID_OF_EXTENSIONALIZE = 14;
	public final static int VALID_OF_IMP = 15;
	public final static int VALID_OF_IMPS = 16;
	public final static int VALID_OF_INSTANTIATE = 17;
	public final static int VALID_OF_INSTANTIATE_REV = 18;
	public final static int VALID_OF_INSTANTIATE_CTX = 19;
	public final static int VALID_OF_CONGR_ARG = 20;
	public final static int VALID_OF_CONGR_FUN = 21;
	public final static int VALID_OF_CONGR = 22;
	public final static int VALID_OF_CONGR_ARGS = 23;
	public final static int VALID_OF_CONGR_FUN_N = 24;
	public final static int VALID_OF_CONGRS = 25;
	public final static int VALID_OF_EQ_SYMM = 26;
	public final static int VALID_OF_EQ_TRANS = 27;
	public final static int VALID_OF_EQ_MP = 28;
	public final static int VALID_OF_BVAR_LOWER = 29;
	public final static int NONEMPTY_OF_ATOM = 30;
	public final static int NONEMPTY_OF_ETOM = 31;
	public final static int SKOLEMIZE = 32;
	public final static int DEFINE = 33;

	private final static String[] NAMES = { "wfOfCheck", "wfOfAppend", "wfOfPrepend", "validOfAppend",
			"validOfPrepend", "validOfIntro1F", "validOfIntro1H", "validOfIntroN", "validOfRevert1",
			"validOfRevertN", "wfOfHeadBeta", "validOfHeadBeta", "wfOfBetaBounded", "validOfBetaBounded",
			"validOfExtensionalize", "validOfImp", "validOfImps", "validOfInstantiate", "validOfInstantiateRev",
			"validOfInstantiateCtx", "validOfCongrArg", "validOfCongrFun", "validOfCongr", "validOfCongrArgs",
			"validOfCongrFunN", "validOfCongrs", "validOfEqSymm", "validOfEqTrans", "validOfEqMP",
			"validOfBVarLower", "nonemptyOfAtom", "nonemptyOfEtom", "skolemize", "define" };

	private final static int[] NO_POSITIONS = new int[0];
	private final static Term[] NO_TERMS = new Term[0];

	private final int opcode;

	private ChkStep(int opcode) {
		this.opcode = opcode;
	}

	public int getOpcode() {
		return opcode;
	}

	/**
	 * The table positions this step refers to, in the order given.
	 *
	 * @return
	 */
	public abstract int[] references();

	/**
	 * The terms carried in the payload of this step (if any).
	 *
	 * @return
	 */
	public Term[] terms() {
		return NO_TERMS;
	}

	/**
	 * Apply a mapping to every position, sort, term, atom and etom mentioned by
	 * this step.
	 *
	 * @param m
	 * @return
	 */
	public abstract ChkStep map(Mapping m);

	/**
	 * Describes how the components of a step are rewritten when a derivation is
	 * reindexed.
	 *
	 * @author David J. Pearce
	 *
	 */
	public interface Mapping {
		public int position(int position);

		public Sort sort(Sort s);

		public Term term(Term t);

		public int atom(int index);

		public int etom(int index);
	}

	public static String name(int opcode) {
		return NAMES[opcode];
	}

	// ================================================================================
	// Factories
	// ================================================================================

	public static ChkStep wfOfCheck(Sort[] ctx, Term t) {
		return new Check(ctx, t);
	}

	public static ChkStep wfOfAppend(int pos, Sort... sorts) {
		return new Extend(WF_OF_APPEND, pos, sorts);
	}

	public static ChkStep wfOfPrepend(int pos, Sort... sorts) {
		return new Extend(WF_OF_PREPEND, pos, sorts);
	}

	public static ChkStep validOfAppend(int pos, Sort... sorts) {
		return new Extend(VALID_OF_APPEND, pos, sorts);
	}

	public static ChkStep validOfPrepend(int pos, Sort... sorts) {
		return new Extend(VALID_OF_PREPEND, pos, sorts);
	}

	public static ChkStep validOfIntro1F(int pos) {
		return new Ref(VALID_OF_INTRO1F, pos);
	}

	public static ChkStep validOfIntro1H(int pos) {
		return new Ref(VALID_OF_INTRO1H, pos);
	}

	public static ChkStep validOfIntroN(int pos, int n) {
		return new Bounded(VALID_OF_INTRO_N, pos, n);
	}

	public static ChkStep validOfRevert1(int pos) {
		return new Ref(VALID_OF_REVERT1, pos);
	}

	public static ChkStep validOfRevertN(int pos, int n) {
		return new Bounded(VALID_OF_REVERT_N, pos, n);
	}

	public static ChkStep wfOfHeadBeta(int pos) {
		return new Ref(WF_OF_HEAD_BETA, pos);
	}

	public static ChkStep validOfHeadBeta(int pos) {
		return new Ref(VALID_OF_HEAD_BETA, pos);
	}

	public static ChkStep wfOfBetaBounded(int pos, int bound) {
		return new Bounded(WF_OF_BETA_BOUNDED, pos, bound);
	}

	public static ChkStep validOfBetaBounded(int pos, int bound) {
		return new Bounded(VALID_OF_BETA_BOUNDED, pos, bound);
	}

	public static ChkStep validOfExtensionalize(int pos) {
		return new Ref(VALID_OF_EXTENSIONALIZE, pos);
	}

	public static ChkStep validOfImp(int imp, int hyp) {
		return new Ref(VALID_OF_IMP, imp, hyp);
	}

	public static ChkStep validOfImps(int imp, int... hyps) {
		return new Ref(VALID_OF_IMPS, prepend(imp, hyps));
	}

	public static ChkStep validOfInstantiate(int pos, Term... witnesses) {
		return new Instantiate(VALID_OF_INSTANTIATE, pos, witnesses);
	}

	public static ChkStep validOfInstantiateRev(int pos, Term... witnesses) {
		return new Instantiate(VALID_OF_INSTANTIATE_REV, pos, witnesses);
	}

	public static ChkStep validOfInstantiateCtx(int pos, Term... witnesses) {
		return new Instantiate(VALID_OF_INSTANTIATE_CTX, pos, witnesses);
	}

	public static ChkStep validOfCongrArg(int wf, int eq) {
		return new Ref(VALID_OF_CONGR_ARG, wf, eq);
	}

	public static ChkStep validOfCongrFun(int eq, int wf) {
		return new Ref(VALID_OF_CONGR_FUN, eq, wf);
	}

	public static ChkStep validOfCongr(int fnEq, int argEq) {
		return new Ref(VALID_OF_CONGR, fnEq, argEq);
	}

	public static ChkStep validOfCongrArgs(int wf, int... eqs) {
		return new Ref(VALID_OF_CONGR_ARGS, prepend(wf, eqs));
	}

	public static ChkStep validOfCongrFunN(int eq, int... wfs) {
		return new Ref(VALID_OF_CONGR_FUN_N, prepend(eq, wfs));
	}

	public static ChkStep validOfCongrs(int fnEq, int... argEqs) {
		return new Ref(VALID_OF_CONGRS, prepend(fnEq, argEqs));
	}

	public static ChkStep validOfEqSymm(int eq) {
		return new Ref(VALID_OF_EQ_SYMM, eq);
	}

	public static ChkStep validOfEqTrans(int lhs, int rhs) {
		return new Ref(VALID_OF_EQ_TRANS, lhs, rhs);
	}

	public static ChkStep validOfEqMP(int eq, int valid) {
		return new Ref(VALID_OF_EQ_MP, eq, valid);
	}

	public static ChkStep validOfBVarLower(int valid, int nonempty) {
		return new Ref(VALID_OF_BVAR_LOWER, valid, nonempty);
	}

	public static ChkStep nonemptyOfAtom(int atom) {
		return new Index(NONEMPTY_OF_ATOM, atom);
	}

	public static ChkStep nonemptyOfEtom(int etom) {
		return new Index(NONEMPTY_OF_ETOM, etom);
	}

	public static ChkStep skolemize(int pos) {
		return new Ref(SKOLEMIZE, pos);
	}

	public static ChkStep define(Sort s, Term t, int etom) {
		return new Define(s, t, etom);
	}

	private static int[] prepend(int first, int[] rest) {
		int[] rs = new int[rest.length + 1];
		rs[0] = first;
		System.arraycopy(rest, 0, rs, 1, rest.length);
		return rs;
	}

	// ================================================================================
	// Step Forms
	// ================================================================================

	/**
	 * Checks a term against an explicitly given context.
	 */
	public static class Check extends ChkStep {
		private final Sort[] ctx;
		private final Term term;

		private Check(Sort[] ctx, Term term) {
			super(WF_OF_CHECK);
			this.ctx = ctx.clone();
			this.term = term;
		}

		public Sort[] ctx() {
			return ctx.clone();
		}

		public Term term() {
			return term;
		}

		@Override
		public int[] references() {
			return NO_POSITIONS;
		}

		@Override
		public Term[] terms() {
			return new Term[] { term };
		}

		@Override
		public ChkStep map(Mapping m) {
			Sort[] nctx = new Sort[ctx.length];
			for (int i = 0; i != ctx.length; ++i) {
				nctx[i] = m.sort(ctx[i]);
			}
			return new Check(nctx, m.term(term));
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Check) {
				Check s = (Check) o;
				return Arrays.equals(ctx, s.ctx) && term.equals(s.term);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return Arrays.hashCode(ctx) ^ term.hashCode();
		}

		@Override
		public String toString() {
			return name(getOpcode()) + " " + Syntax.toString(ctx) + " " + term;
		}
	}

	/**
	 * Extends the context of an entry by a run of sorts.
	 */
	public static class Extend extends ChkStep {
		private final int position;
		private final Sort[] sorts;

		private Extend(int opcode, int position, Sort[] sorts) {
			super(opcode);
			this.position = position;
			this.sorts = sorts.clone();
		}

		public int position() {
			return position;
		}

		public Sort[] sorts() {
			return sorts.clone();
		}

		@Override
		public int[] references() {
			return new int[] { position };
		}

		@Override
		public ChkStep map(Mapping m) {
			Sort[] nsorts = new Sort[sorts.length];
			for (int i = 0; i != sorts.length; ++i) {
				nsorts[i] = m.sort(sorts[i]);
			}
			return new Extend(getOpcode(), m.position(position), nsorts);
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Extend) {
				Extend s = (Extend) o;
				return getOpcode() == s.getOpcode() && position == s.position && Arrays.equals(sorts, s.sorts);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return getOpcode() ^ (position << 6) ^ Arrays.hashCode(sorts);
		}

		@Override
		public String toString() {
			return name(getOpcode()) + " " + position + " " + Arrays.toString(sorts);
		}
	}

	/**
	 * A step whose only inputs are table positions.
	 */
	public static class Ref extends ChkStep {
		private final int[] positions;

		private Ref(int opcode, int... positions) {
			super(opcode);
			this.positions = positions.clone();
		}

		public int position(int i) {
			return positions[i];
		}

		public int size() {
			return positions.length;
		}

		@Override
		public int[] references() {
			return positions.clone();
		}

		@Override
		public ChkStep map(Mapping m) {
			int[] npositions = new int[positions.length];
			for (int i = 0; i != positions.length; ++i) {
				npositions[i] = m.position(positions[i]);
			}
			return new Ref(getOpcode(), npositions);
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Ref) {
				Ref s = (Ref) o;
				return getOpcode() == s.getOpcode() && Arrays.equals(positions, s.positions);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return getOpcode() ^ (Arrays.hashCode(positions) << 6);
		}

		@Override
		public String toString() {
			return name(getOpcode()) + " " + Arrays.toString(positions);
		}
	}

	/**
	 * A step over a single position, parameterised by a count (a number of
	 * binders or a reduction bound).
	 */
	public static class Bounded extends ChkStep {
		private final int position;
		private final int count;

		private Bounded(int opcode, int position, int count) {
			super(opcode);
			if (count < 0) {
				throw new IllegalArgumentException("negative count");
			}
			this.position = position;
			this.count = count;
		}

		public int position() {
			return position;
		}

		public int count() {
			return count;
		}

		@Override
		public int[] references() {
			return new int[] { position };
		}

		@Override
		public ChkStep map(Mapping m) {
			return new Bounded(getOpcode(), m.position(position), count);
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Bounded) {
				Bounded s = (Bounded) o;
				return getOpcode() == s.getOpcode() && position == s.position && count == s.count;
			}
			return false;
		}

		@Override
		public int hashCode() {
			return getOpcode() ^ (position << 6) ^ (count << 16);
		}

		@Override
		public String toString() {
			return name(getOpcode()) + " " + position + " " + count;
		}
	}

	/**
	 * Instantiates the leading binders of an entry with witnessing terms.
	 */
	public static class Instantiate extends ChkStep {
		private final int position;
		private final Term[] witnesses;

		private Instantiate(int opcode, int position, Term[] witnesses) {
			super(opcode);
			this.position = position;
			this.witnesses = witnesses.clone();
		}

		public int position() {
			return position;
		}

		public Term[] witnesses() {
			return witnesses.clone();
		}

		@Override
		public int[] references() {
			return new int[] { position };
		}

		@Override
		public Term[] terms() {
			return witnesses.clone();
		}

		@Override
		public ChkStep map(Mapping m) {
			Term[] nwitnesses = new Term[witnesses.length];
			for (int i = 0; i != witnesses.length; ++i) {
				nwitnesses[i] = m.term(witnesses[i]);
			}
			return new Instantiate(getOpcode(), m.position(position), nwitnesses);
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Instantiate) {
				Instantiate s = (Instantiate) o;
				return getOpcode() == s.getOpcode() && position == s.position && Arrays.equals(witnesses, s.witnesses);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return getOpcode() ^ (position << 6) ^ Arrays.hashCode(witnesses);
		}

		@Override
		public String toString() {
			return name(getOpcode()) + " " + position + " " + Arrays.toString(witnesses);
		}
	}

	/**
	 * Refers to a term atom or etom by index.
	 */
	public static class Index extends ChkStep {
		private final int index;

		private Index(int opcode, int index) {
			super(opcode);
			this.index = index;
		}

		public int index() {
			return index;
		}

		@Override
		public int[] references() {
			return NO_POSITIONS;
		}

		@Override
		public ChkStep map(Mapping m) {
			int nindex = getOpcode() == NONEMPTY_OF_ATOM ? m.atom(index) : m.etom(index);
			return new Index(getOpcode(), nindex);
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Index) {
				Index s = (Index) o;
				return getOpcode() == s.getOpcode() && index == s.index;
			}
			return false;
		}

		@Override
		public int hashCode() {
			return getOpcode() ^ (index << 6);
		}

		@Override
		public String toString() {
			return name(getOpcode()) + " " + index;
		}
	}

	/**
	 * Introduces an etom bound to a closed term. The etom index expected by the
	 * producer is part of the step, so that replaying a definition can be
	 * recognised.
	 */
	public static class Define extends ChkStep {
		private final Sort sort;
		private final Term term;
		private final int etom;

		private Define(Sort sort, Term term, int etom) {
			super(DEFINE);
			this.sort = sort;
			this.term = term;
			this.etom = etom;
		}

		public Sort sort() {
			return sort;
		}

		public Term term() {
			return term;
		}

		public int etom() {
			return etom;
		}

		@Override
		public int[] references() {
			return NO_POSITIONS;
		}

		@Override
		public Term[] terms() {
			return new Term[] { term };
		}

		@Override
		public ChkStep map(Mapping m) {
			return new Define(m.sort(sort), m.term(term), m.etom(etom));
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Define) {
				Define s = (Define) o;
				return etom == s.etom && sort.equals(s.sort) && term.equals(s.term);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return DEFINE ^ (etom << 6) ^ sort.hashCode() ^ term.hashCode();
		}

		@Override
		public String toString() {
			return name(DEFINE) + " e" + etom + " : " + sort + " := " + term;
		}
	}
}
