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

import java.util.ArrayList;
import java.util.HashMap;

import lamchecker.core.Syntax.Sort;
import lamchecker.core.Syntax.Term;
import lamchecker.util.CheckError;

/**
 * An append-only log of derived judgements. Every entry is justified by the
 * line at the same position: either the step which produced it, or the
 * external assertion it records. A hash index mirrors the entry list so that
 * re-deriving an existing entry returns its original position instead of
 * appending a duplicate.
 *
 * The table also owns the sorts of term atoms, the lazily populated import
 * table of sorts, and the etoms allocated by skolemization and definition
 * steps. None of these ever shrink.
 *
 * @author David J. Pearce
 *
 */
public class CheckerTable implements Table {
	private final ArrayList<Sort> atomSorts = new ArrayList<>();
	private final ArrayList<Sort> importSorts = new ArrayList<>();
	private final HashMap<Sort, Integer> importIndex = new HashMap<>();
	private final ArrayList<REntry> entries = new ArrayList<>();
	private final HashMap<REntry, Integer> index = new HashMap<>();
	private final ArrayList<Line> lines = new ArrayList<>();
	private final ArrayList<Assertion> assertions = new ArrayList<>();
	private final ArrayList<Sort> etomSorts = new ArrayList<>();
	private final ArrayList<Term> definitions = new ArrayList<>();
	private final ArrayList<Integer> etomCreators = new ArrayList<>();
	private final StepEvaluator evaluator = new StepEvaluator();

	/**
	 * Construct a table over given atom and import sorts. The import sorts are
	 * kept at the positions given, even when a sort occurs more than once; a
	 * later {@link #addImport(Sort)} returns the first such position.
	 *
	 * @param atomSorts
	 * @param importSorts
	 */
	public CheckerTable(Sort[] atomSorts, Sort[] importSorts) {
		for (Sort s : atomSorts) {
			addAtom(s);
		}
		for (Sort s : importSorts) {
			importIndex.putIfAbsent(s, this.importSorts.size());
			this.importSorts.add(s);
		}
	}

	public CheckerTable(Sort... atomSorts) {
		this(atomSorts, new Sort[0]);
	}

	// ================================================================================
	// Signature
	// ================================================================================

	/**
	 * Declare a new term atom of a given sort, returning its index.
	 *
	 * @param s
	 * @return
	 */
	public int addAtom(Sort s) {
		atomSorts.add(s);
		return atomSorts.size() - 1;
	}

	/**
	 * Get the import index of a given sort, allocating the next index when the
	 * sort is first encountered.
	 *
	 * @param s
	 * @return
	 */
	public int addImport(Sort s) {
		Integer i = importIndex.get(s);
		if (i == null) {
			i = importSorts.size();
			importSorts.add(s);
			importIndex.put(s, i);
		}
		return i;
	}

	@Override
	public Sort atomSort(int i) {
		return i >= 0 && i < atomSorts.size() ? atomSorts.get(i) : null;
	}

	@Override
	public Sort etomSort(int i) {
		return i >= 0 && i < etomSorts.size() ? etomSorts.get(i) : null;
	}

	@Override
	public Sort importSort(int i) {
		return i >= 0 && i < importSorts.size() ? importSorts.get(i) : null;
	}

	@Override
	public Term definition(int etom) {
		return etom >= 0 && etom < definitions.size() ? definitions.get(etom) : null;
	}

	@Override
	public int etomCount() {
		return etomSorts.size();
	}

	/**
	 * Get the position of the entry created together with a given etom.
	 *
	 * @param etom
	 * @return
	 */
	public int creator(int etom) {
		return etomCreators.get(etom);
	}

	// ================================================================================
	// Entries
	// ================================================================================

	@Override
	public REntry get(int position) {
		return position >= 0 && position < entries.size() ? entries.get(position) : null;
	}

	@Override
	public int size() {
		return entries.size();
	}

	@Override
	public int indexOf(REntry e) {
		Integer i = index.get(e);
		return i == null ? -1 : i;
	}

	public Line line(int position) {
		return lines.get(position);
	}

	public Assertion assertion(int i) {
		return assertions.get(i);
	}

	/**
	 * Evaluate a step against this table and apply its result, returning the
	 * position of the (possibly pre-existing) entry it derives.
	 *
	 * @param step
	 * @return
	 * @throws CheckError if the step fails, in which case the table is unchanged
	 */
	public int apply(ChkStep step) {
		EvalResult r = evaluator.evaluate(this, step);
		if (r instanceof EvalResult.Fail) {
			throw ((EvalResult.Fail) r).error();
		} else if (r instanceof EvalResult.AddEntry) {
			return add(((EvalResult.AddEntry) r).entry(), Line.of(step));
		} else {
			EvalResult.NewEtomWithValid n = (EvalResult.NewEtomWithValid) r;
			etomSorts.add(n.sort());
			definitions.add(n.definiens());
			int pos = add(n.entry(), Line.of(step));
			etomCreators.add(pos);
			return pos;
		}
	}

	/**
	 * Record an external fact as a closed validity entry. Re-asserting a term
	 * already present is a no-op.
	 *
	 * @param proof
	 * @param t
	 * @return
	 * @throws CheckError if the term is not a closed, etom-free proposition
	 */
	public int assertExternal(Object proof, Term t) {
		EvalResult r = evaluator.assertion(this, t);
		if (r instanceof EvalResult.Fail) {
			throw ((EvalResult.Fail) r).error();
		}
		REntry e = ((EvalResult.AddEntry) r).entry();
		int i = indexOf(e);
		if (i >= 0) {
			return i;
		}
		assertions.add(new Assertion(proof, t));
		return add(e, Line.asserted(assertions.size() - 1));
	}

	private int add(REntry e, Line line) {
		Integer i = index.get(e);
		if (i != null) {
			return i;
		}
		entries.add(e);
		lines.add(line);
		index.put(e, entries.size() - 1);
		return entries.size() - 1;
	}

	// ================================================================================
	// Snapshots
	// ================================================================================

	public Sort[] atomSorts() {
		return atomSorts.toArray(new Sort[atomSorts.size()]);
	}

	public Sort[] importSorts() {
		return importSorts.toArray(new Sort[importSorts.size()]);
	}

	public Sort[] etomSorts() {
		return etomSorts.toArray(new Sort[etomSorts.size()]);
	}

	public REntry[] entries() {
		return entries.toArray(new REntry[entries.size()]);
	}

	public Line[] lines() {
		return lines.toArray(new Line[lines.size()]);
	}

	public Assertion[] assertions() {
		return assertions.toArray(new Assertion[assertions.size()]);
	}

	/**
	 * Package the current contents of this table as a certificate for a given
	 * set of goal positions.
	 *
	 * @param goals
	 * @return
	 */
	public Certificate certificate(int... goals) {
		for (int g : goals) {
			if (get(g) == null) {
				throw new CheckError(CheckError.Kind.UNDEFINED_REFERENCE, StepEvaluator.UNKNOWN_POSITION, null, g);
			}
		}
		return new Certificate(atomSorts(), importSorts(), assertions(), lines(), entries(), etomSorts(), goals,
				null);
	}

	@Override
	public String toString() {
		StringBuilder r = new StringBuilder();
		for (int i = 0; i != entries.size(); ++i) {
			r.append(i).append(": ").append(entries.get(i)).append("  [").append(lines.get(i)).append("]\n");
		}
		return r.toString();
	}
}
