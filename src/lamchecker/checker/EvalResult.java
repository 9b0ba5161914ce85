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
import lamchecker.util.CheckError;

/**
 * The outcome of evaluating a single checking step against a table. Evaluation
 * is pure: the result describes how the table should change, but applying it
 * is left to the table itself.
 *
 * @author David J. Pearce
 *
 */
public abstract class EvalResult {

	private EvalResult() {
	}

	/**
	 * The step cannot be applied. The table must be left unchanged.
	 */
	public static class Fail extends EvalResult {
		private final CheckError error;

		public Fail(CheckError error) {
			this.error = error;
		}

		public CheckError error() {
			return error;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Fail && error.equals(((Fail) o).error);
		}

		@Override
		public int hashCode() {
			return error.hashCode();
		}

		@Override
		public String toString() {
			return "fail(" + error.getMessage() + ")";
		}
	}

	/**
	 * Append an entry to the table, unless it is already present.
	 */
	public static class AddEntry extends EvalResult {
		private final REntry entry;

		public AddEntry(REntry entry) {
			this.entry = entry;
		}

		public REntry entry() {
			return entry;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof AddEntry && entry.equals(((AddEntry) o).entry);
		}

		@Override
		public int hashCode() {
			return entry.hashCode();
		}

		@Override
		public String toString() {
			return "add(" + entry + ")";
		}
	}

	/**
	 * Allocate the next etom with a given sort, then append a validity entry
	 * which mentions it. The definiens is <code>null</code> for skolem
	 * constants.
	 */
	public static class NewEtomWithValid extends EvalResult {
		private final Sort sort;
		private final Sort[] ctx;
		private final Term term;
		private final Term definiens;

		public NewEtomWithValid(Sort sort, Sort[] ctx, Term term, Term definiens) {
			this.sort = sort;
			this.ctx = ctx.clone();
			this.term = term;
			this.definiens = definiens;
		}

		public Sort sort() {
			return sort;
		}

		public Term definiens() {
			return definiens;
		}

		public REntry.Valid entry() {
			return REntry.valid(ctx, term);
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof NewEtomWithValid) {
				NewEtomWithValid r = (NewEtomWithValid) o;
				return sort.equals(r.sort) && Arrays.equals(ctx, r.ctx) && term.equals(r.term)
						&& (definiens == null ? r.definiens == null : definiens.equals(r.definiens));
			}
			return false;
		}

		@Override
		public int hashCode() {
			return sort.hashCode() ^ Arrays.hashCode(ctx) ^ term.hashCode();
		}

		@Override
		public String toString() {
			return "newEtom(" + sort + ", " + Syntax.toString(ctx) + " ⊢ " + term + ")";
		}
	}
}
