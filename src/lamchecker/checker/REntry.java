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
 * A judgement held in the checker table. Entries are immutable, and equality
 * is structural so that the table can deduplicate them.
 *
 * @author David J. Pearce
 *
 */
public abstract class REntry {
	public final static int ENTRY_wf = 0;
	public final static int ENTRY_valid = 1;
	public final static int ENTRY_nonempty = 2;

	private final int opcode;

	private REntry(int opcode) {
		this.opcode = opcode;
	}

	public int getOpcode() {
		return opcode;
	}

	public static WF wf(Sort[] ctx, Sort sort, Term term) {
		return new WF(ctx, sort, term);
	}

	public static Valid valid(Sort[] ctx, Term term) {
		return new Valid(ctx, term);
	}

	public static Nonempty nonempty(Sort sort) {
		return new Nonempty(sort);
	}

	/**
	 * Asserts that <code>term</code> has sort <code>sort</code> in context
	 * <code>ctx</code>.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class WF extends REntry {
		private final Sort[] ctx;
		private final Sort sort;
		private final Term term;

		public WF(Sort[] ctx, Sort sort, Term term) {
			super(ENTRY_wf);
			this.ctx = ctx.clone();
			this.sort = sort;
			this.term = term;
		}

		public Sort[] ctx() {
			return ctx.clone();
		}

		public Sort sort() {
			return sort;
		}

		public Term term() {
			return term;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof WF) {
				WF e = (WF) o;
				return Arrays.equals(ctx, e.ctx) && sort.equals(e.sort) && term.equals(e.term);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return Arrays.hashCode(ctx) ^ sort.hashCode() ^ (31 * term.hashCode());
		}

		@Override
		public String toString() {
			return "WF " + Syntax.toString(ctx) + " ⊢ " + term + " : " + sort;
		}
	}

	/**
	 * Asserts that the proposition <code>term</code> holds for every
	 * assignment of values to the context <code>ctx</code>.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Valid extends REntry {
		private final Sort[] ctx;
		private final Term term;

		public Valid(Sort[] ctx, Term term) {
			super(ENTRY_valid);
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
		public boolean equals(Object o) {
			if (o instanceof Valid) {
				Valid e = (Valid) o;
				return Arrays.equals(ctx, e.ctx) && term.equals(e.term);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return Arrays.hashCode(ctx) ^ term.hashCode();
		}

		@Override
		public String toString() {
			return "VALID " + Syntax.toString(ctx) + " ⊢ " + term;
		}
	}

	/**
	 * Asserts that a sort is inhabited.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Nonempty extends REntry {
		private final Sort sort;

		public Nonempty(Sort sort) {
			super(ENTRY_nonempty);
			this.sort = sort;
		}

		public Sort sort() {
			return sort;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Nonempty && sort.equals(((Nonempty) o).sort);
		}

		@Override
		public int hashCode() {
			return ~sort.hashCode();
		}

		@Override
		public String toString() {
			return "NONEMPTY " + sort;
		}
	}
}
