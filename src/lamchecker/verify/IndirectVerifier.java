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
package lamchecker.verify;

import java.util.HashMap;

import lamchecker.checker.Assertion;
import lamchecker.checker.Certificate;
import lamchecker.checker.ChkStep;
import lamchecker.checker.EvalResult;
import lamchecker.checker.Line;
import lamchecker.checker.REntry;
import lamchecker.checker.StepEvaluator;
import lamchecker.checker.Table;
import lamchecker.core.Syntax.Sort;
import lamchecker.core.Syntax.Term;

/**
 * Verifies a certificate without rebuilding a table. Each line is evaluated
 * independently against the entries the certificate claims precede it, and
 * the result compared with the entry claimed for that line. Lookups of
 * claimed entries are shared across all lines.
 *
 * @author David J. Pearce
 *
 */
public class IndirectVerifier extends AbstractVerifier {
	/**
	 * Enable or disable debugging output.
	 */
	private static final boolean DEBUG = false;

	private final StepEvaluator evaluator = new StepEvaluator();

	@Override
	public boolean verify(Certificate certificate) {
		Claimed claimed = new Claimed(certificate);
		Line[] lines = certificate.lines();
		REntry[] entries = certificate.entries();
		Assertion[] assertions = certificate.assertions();
		for (int i = 0; i != lines.length; ++i) {
			claimed.limit(i);
			EvalResult r;
			if (lines[i].isAssertion()) {
				int a = lines[i].assertion();
				if (a < 0 || a >= assertions.length) {
					return reject(i, UNKNOWN_ASSERTION);
				}
				r = evaluator.assertion(claimed, assertions[a].term());
			} else {
				r = evaluator.evaluate(claimed, lines[i].step());
			}
			REntry produced;
			if (r instanceof EvalResult.AddEntry && !claimed.creates(i)) {
				produced = ((EvalResult.AddEntry) r).entry();
			} else if (r instanceof EvalResult.NewEtomWithValid && claimed.creates(i)) {
				EvalResult.NewEtomWithValid n = (EvalResult.NewEtomWithValid) r;
				Sort s = claimed.claimedEtomSort(claimed.etomCount());
				if (s == null || !s.equals(n.sort())) {
					return reject(i, "etom sort mismatch");
				}
				produced = n.entry();
			} else {
				return reject(i, r.toString());
			}
			// The claimed position must be the first occurrence of the entry
			if (!produced.equals(entries[i]) || claimed.firstIndexOf(produced) != i) {
				return reject(i, "produced " + produced);
			}
		}
		return claimed.totalEtoms() == certificate.etomSorts().length && goalsInRange(certificate);
	}

	private boolean reject(int line, String reason) {
		if (DEBUG) {
			reject("indirect", line, reason);
		}
		return false;
	}

	/**
	 * A view of the claimed entries of a certificate, truncated to those
	 * preceding a given line.
	 *
	 * @author David J. Pearce
	 *
	 */
	private static class Claimed implements Table {
		private final Certificate certificate;
		private final Sort[] atomSorts;
		private final Sort[] importSorts;
		private final Sort[] etomSorts;
		private final REntry[] entries;
		private final HashMap<REntry, Integer> index = new HashMap<>();
		/**
		 * The number of etoms introduced before each line.
		 */
		private final int[] etomsBefore;
		/**
		 * The definiens of each etom introduced by a definition line.
		 */
		private final Term[] definitions;
		private int limit;

		public Claimed(Certificate certificate) {
			this.certificate = certificate;
			this.atomSorts = certificate.atomSorts();
			this.importSorts = certificate.importSorts();
			this.etomSorts = certificate.etomSorts();
			this.entries = certificate.entries();
			Line[] lines = certificate.lines();
			this.etomsBefore = new int[lines.length + 1];
			this.definitions = new Term[lines.length];
			for (int i = 0; i != lines.length; ++i) {
				index.putIfAbsent(entries[i], i);
				int count = etomsBefore[i];
				ChkStep step = lines[i].step();
				if (step != null && step.getOpcode() == ChkStep.DEFINE) {
					definitions[count] = ((ChkStep.Define) step).term();
				}
				etomsBefore[i + 1] = creates(lines[i]) ? count + 1 : count;
			}
		}

		public void limit(int limit) {
			this.limit = limit;
		}

		public boolean creates(int line) {
			return etomsBefore[line + 1] != etomsBefore[line];
		}

		public int totalEtoms() {
			return etomsBefore[certificate.size()];
		}

		public int firstIndexOf(REntry e) {
			Integer i = index.get(e);
			return i == null ? -1 : i;
		}

		private static boolean creates(Line line) {
			ChkStep step = line.step();
			return step != null && (step.getOpcode() == ChkStep.SKOLEMIZE || step.getOpcode() == ChkStep.DEFINE);
		}

		@Override
		public REntry get(int position) {
			return position >= 0 && position < limit ? entries[position] : null;
		}

		@Override
		public int size() {
			return limit;
		}

		@Override
		public int indexOf(REntry e) {
			int i = firstIndexOf(e);
			return i < limit ? i : -1;
		}

		@Override
		public int etomCount() {
			return etomsBefore[limit];
		}

		@Override
		public Term definition(int etom) {
			return etom >= 0 && etom < etomCount() ? definitions[etom] : null;
		}

		@Override
		public Sort atomSort(int i) {
			return i >= 0 && i < atomSorts.length ? atomSorts[i] : null;
		}

		@Override
		public Sort etomSort(int i) {
			return i < etomCount() ? claimedEtomSort(i) : null;
		}

		public Sort claimedEtomSort(int i) {
			return i >= 0 && i < etomSorts.length ? etomSorts[i] : null;
		}

		@Override
		public Sort importSort(int i) {
			return i >= 0 && i < importSorts.length ? importSorts[i] : null;
		}
	}
}
