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

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.BitSet;
import java.util.HashMap;
import java.util.Map;

import lamchecker.core.Reduction;
import lamchecker.core.Syntax.Sort;
import lamchecker.core.Syntax.Term;
import lamchecker.util.CheckError;

/**
 * Extracts the part of a table needed to justify a set of goal entries. The
 * closure of the goals under "is justified using" is computed backwards, and
 * then replayed forwards into a fresh table. During replay every import-form
 * primitive is resolved, and sort atoms, term atoms and etoms are renumbered
 * densely in order of first use. The original table is never modified.
 *
 * @author David J. Pearce
 *
 */
public class Minimizer {
	/**
	 * Enable or disable debugging output.
	 */
	private static final boolean DEBUG = false;

	private final CheckerTable table;

	public Minimizer(CheckerTable table) {
		this.table = table;
	}

	/**
	 * Produce a certificate for the given goal positions containing only the
	 * entries they transitively depend upon.
	 *
	 * @param goals
	 * @return
	 */
	public Certificate minimize(int... goals) {
		for (int g : goals) {
			if (table.get(g) == null) {
				throw new CheckError(CheckError.Kind.UNDEFINED_REFERENCE, StepEvaluator.UNKNOWN_POSITION, null, g);
			}
		}
		BitSet closure = closure(goals);
		Replay replay = new Replay();
		for (int p = closure.nextSetBit(0); p >= 0; p = closure.nextSetBit(p + 1)) {
			replay.apply(p);
		}
		int[] ngoals = new int[goals.length];
		for (int i = 0; i != goals.length; ++i) {
			ngoals[i] = replay.position(goals[i]);
		}
		CheckerTable target = replay.target;
		if (DEBUG) {
			System.err.println("minimised " + table.size() + " entries to " + target.size() + " (closure "
					+ closure.cardinality() + ")");
		}
		return new Certificate(target.atomSorts(), target.importSorts(), target.assertions(), target.lines(),
				target.entries(), target.etomSorts(), ngoals, replay.reindexing());
	}

	/**
	 * Compute the set of positions reachable backwards from the goals. A
	 * position depends on the positions its step references, and on the entry
	 * which introduced each etom mentioned by its entry or its step.
	 *
	 * @param goals
	 * @return
	 */
	private BitSet closure(int[] goals) {
		BitSet visited = new BitSet();
		ArrayDeque<Integer> worklist = new ArrayDeque<>();
		for (int g : goals) {
			worklist.push(g);
		}
		while (!worklist.isEmpty()) {
			int p = worklist.pop();
			if (visited.get(p)) {
				continue;
			}
			visited.set(p);
			Line line = table.line(p);
			if (line.isAssertion()) {
				// External facts are etom free and depend on nothing
				continue;
			}
			ChkStep step = line.step();
			for (int r : step.references()) {
				worklist.push(r);
			}
			BitSet etoms = new BitSet();
			etoms(table.get(p), etoms);
			for (Term t : step.terms()) {
				Reduction.etoms(t, etoms);
			}
			if (step.getOpcode() == ChkStep.NONEMPTY_OF_ETOM) {
				etoms.set(((ChkStep.Index) step).index());
			}
			for (int e = etoms.nextSetBit(0); e >= 0; e = etoms.nextSetBit(e + 1)) {
				worklist.push(table.creator(e));
			}
		}
		return visited;
	}

	private static void etoms(REntry e, BitSet etoms) {
		if (e instanceof REntry.WF) {
			Reduction.etoms(((REntry.WF) e).term(), etoms);
		} else if (e instanceof REntry.Valid) {
			Reduction.etoms(((REntry.Valid) e).term(), etoms);
		}
	}

	/**
	 * The state of a forward replay into a fresh table.
	 *
	 * @author David J. Pearce
	 *
	 */
	private class Replay implements ChkStep.Mapping, Reduction.Renaming {
		private final CheckerTable target = new CheckerTable();
		private final int[] positions;
		private final int[] etoms;
		private final int[] created;
		private final HashMap<Integer, Integer> sortAtoms = new HashMap<>();
		private final HashMap<Integer, Integer> atoms = new HashMap<>();

		public Replay() {
			positions = new int[table.size()];
			etoms = new int[table.etomCount()];
			created = new int[table.size()];
			Arrays.fill(positions, -1);
			Arrays.fill(etoms, -1);
			Arrays.fill(created, -1);
			for (int e = 0; e != table.etomCount(); ++e) {
				created[table.creator(e)] = e;
			}
		}

		public void apply(int p) {
			Line line = table.line(p);
			if (line.isAssertion()) {
				Assertion a = table.assertion(line.assertion());
				positions[p] = target.assertExternal(a.proof(), term(a.term()));
			} else {
				if (created[p] >= 0) {
					etoms[created[p]] = target.etomCount();
				}
				positions[p] = target.apply(line.step().map(this));
			}
		}

		@Override
		public int position(int p) {
			if (positions[p] < 0) {
				throw new IllegalStateException("position " + p + " not yet replayed");
			}
			return positions[p];
		}

		@Override
		public Sort sort(Sort s) {
			return Reduction.remap(s, this);
		}

		@Override
		public Term term(Term t) {
			return Reduction.remap(Reduction.resolveImport(t, table), this);
		}

		@Override
		public int sortAtom(int index) {
			Integer i = sortAtoms.get(index);
			if (i == null) {
				i = sortAtoms.size();
				sortAtoms.put(index, i);
			}
			return i;
		}

		@Override
		public int atom(int index) {
			Integer i = atoms.get(index);
			if (i == null) {
				i = target.addAtom(sort(table.atomSort(index)));
				atoms.put(index, i);
			}
			return i;
		}

		@Override
		public int etom(int index) {
			if (etoms[index] < 0) {
				throw new IllegalStateException("etom " + index + " used before its introduction");
			}
			return etoms[index];
		}

		public Certificate.Reindexing reindexing() {
			int[] sas = toArray(sortAtoms);
			int[] as = toArray(atoms);
			return new Certificate.Reindexing(positions.clone(), sas, as, etoms.clone());
		}

		private int[] toArray(HashMap<Integer, Integer> map) {
			int size = 0;
			for (int k : map.keySet()) {
				size = Math.max(size, k + 1);
			}
			int[] rs = new int[size];
			Arrays.fill(rs, -1);
			for (Map.Entry<Integer, Integer> e : map.entrySet()) {
				rs[e.getKey()] = e.getValue();
			}
			return rs;
		}
	}
}
