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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import lamchecker.checker.Assertion;
import lamchecker.checker.Certificate;
import lamchecker.checker.CheckerTable;
import lamchecker.checker.ChkStep;
import lamchecker.checker.Line;
import lamchecker.checker.Minimizer;
import lamchecker.checker.REntry;
import lamchecker.core.Constant;
import lamchecker.core.Syntax;
import lamchecker.core.Syntax.Sort;
import lamchecker.core.Syntax.Term;
import lamchecker.verify.CompiledVerifier;
import lamchecker.verify.ConsensusVerifier;
import lamchecker.verify.DirectVerifier;
import lamchecker.verify.IndirectVerifier;
import lamchecker.verify.Verifier;

/**
 * Tests that every verification strategy accepts honest certificates and
 * rejects tampered ones.
 *
 * @author David J. Pearce
 *
 */
public class VerifierTests {
	private static final Term A0 = new Term.Atom(0);
	private static final Term A1 = new Term.Atom(1);
	private static final Term A2 = new Term.Atom(2);
	private static final Term B0 = new Term.BVar(0);
	private static final Term E0 = new Term.Etom(0);
	private static final Sort[] EMPTY = new Sort[0];

	// ==============================================================
	// Accepted
	// ==============================================================

	@Test
	public void test_0x0001() {
		checkAccepted(derivation().certificate(1, 3));
	}

	@Test
	public void test_0x0002() {
		CheckerTable t = derivation();
		Certificate c = new Minimizer(t).minimize(1, 3);
		assertEquals(4, c.size());
		checkAccepted(c);
	}

	@Test
	public void test_0x0003() {
		checkAccepted(new CheckerTable().certificate());
		checkAccepted(derivation().certificate());
	}

	@Test
	public void test_0x0004() {
		// Goals may name any entry, including repeats
		checkAccepted(derivation().certificate(5, 5, 0));
	}

	// ==============================================================
	// Rejected
	// ==============================================================

	@Test
	public void test_0x0010() {
		Certificate c = derivation().certificate(1, 3);
		REntry[] entries = c.entries();
		entries[3] = REntry.valid(EMPTY, A2);
		checkRejected(with(c, c.lines(), entries, c.etomSorts(), c.goals()));
	}

	@Test
	public void test_0x0011() {
		Certificate c = derivation().certificate(1, 3);
		REntry[] entries = c.entries();
		entries[5] = REntry.valid(EMPTY, Syntax.mkEq(Sort.Nat, new Term.Etom(1), A1));
		checkRejected(with(c, c.lines(), entries, c.etomSorts(), c.goals()));
	}

	@Test
	public void test_0x0012() {
		Certificate c = derivation().certificate(1, 3);
		checkRejected(with(c, c.lines(), c.entries(), new Sort[] { Sort.Int, Sort.Nat }, c.goals()));
		checkRejected(with(c, c.lines(), c.entries(), new Sort[] { Sort.Nat }, c.goals()));
		checkRejected(with(c, c.lines(), c.entries(), new Sort[] { Sort.Nat, Sort.Nat, Sort.Nat }, c.goals()));
	}

	@Test
	public void test_0x0013() {
		Certificate c = derivation().certificate(1, 3);
		checkRejected(with(c, c.lines(), c.entries(), c.etomSorts(), new int[] { 99 }));
		checkRejected(with(c, c.lines(), c.entries(), c.etomSorts(), new int[] { 1, -1 }));
	}

	@Test
	public void test_0x0014() {
		Certificate c = derivation().certificate(1, 3);
		Line[] lines = c.lines();
		lines[3] = Line.of(ChkStep.validOfEqSymm(0));
		checkRejected(with(c, lines, c.entries(), c.etomSorts(), c.goals()));
	}

	@Test
	public void test_0x0015() {
		Certificate c = derivation().certificate(1, 3);
		Line[] lines = c.lines();
		lines[0] = Line.asserted(7);
		checkRejected(with(c, lines, c.entries(), c.etomSorts(), c.goals()));
	}

	@Test
	public void test_0x0016() {
		// A line which re-derives an earlier entry
		Certificate c = derivation().certificate(1, 3);
		Line[] lines = Arrays.copyOf(c.lines(), c.size() + 1);
		REntry[] entries = Arrays.copyOf(c.entries(), c.size() + 1);
		lines[c.size()] = lines[3];
		entries[c.size()] = entries[3];
		checkRejected(with(c, lines, entries, c.etomSorts(), c.goals()));
	}

	@Test
	public void test_0x0017() {
		// Lines out of order refer forwards
		Certificate c = derivation().certificate(1, 3);
		Line[] lines = c.lines();
		REntry[] entries = c.entries();
		swap(lines, 2, 3);
		swap(entries, 2, 3);
		checkRejected(with(c, lines, entries, c.etomSorts(), c.goals()));
	}

	@Test
	public void test_0x0018() {
		Certificate c = derivation().certificate(1, 3);
		Certificate d = new Certificate(new Sort[] { Sort.Int, Sort.Nat, Sort.Prop }, c.importSorts(),
				c.assertions(), c.lines(), c.entries(), c.etomSorts(), c.goals(), null);
		checkRejected(d);
	}

	@Test
	public void test_0x0019() {
		// Import tables are positional, even when a sort repeats
		Term eq = Syntax.mkEqI(1, Sort.Nat, A0, A0);
		Certificate c = new Certificate(new Sort[] { Sort.Nat }, new Sort[] { Sort.Nat, Sort.Nat },
				new Assertion[] { new Assertion(null, eq) }, new Line[] { Line.asserted(0) },
				new REntry[] { REntry.valid(EMPTY, eq) }, EMPTY, new int[] { 0 }, null);
		checkAccepted(c);
		Term bad = Syntax.mkEqI(2, Sort.Nat, A0, A0);
		Certificate d = new Certificate(new Sort[] { Sort.Nat }, new Sort[] { Sort.Nat, Sort.Nat },
				new Assertion[] { new Assertion(null, bad) }, new Line[] { Line.asserted(0) },
				new REntry[] { REntry.valid(EMPTY, bad) }, EMPTY, new int[] { 0 }, null);
		checkRejected(d);
	}

	// ==============================================================
	// Consensus
	// ==============================================================

	@Test
	public void test_0x0020() {
		assertThrows(IllegalArgumentException.class, () -> new ConsensusVerifier(new Verifier[0]));
	}

	@Test
	public void test_0x0021() {
		Certificate c = derivation().certificate(1, 3);
		assertTrue(new ConsensusVerifier(new DirectVerifier()).verify(c));
		// A single dissenting strategy is enough to reject
		assertFalse(new ConsensusVerifier(new DirectVerifier(), cert -> false).verify(c));
	}

	// ==============================================================
	// Helpers
	// ==============================================================

	/**
	 * Atoms <code>a0,a1 : nat</code> and <code>a2 : prop</code>. Entries 1
	 * and 5 each introduce an etom, and entry 4 is unrelated to everything
	 * else.
	 *
	 * @return
	 */
	private static CheckerTable derivation() {
		CheckerTable t = new CheckerTable(Sort.Nat, Sort.Nat, Sort.Prop);
		int p0 = t.assertExternal("h0", Syntax.mkExistEF(Sort.Nat, lt(A0, B0)));
		t.apply(ChkStep.skolemize(p0));
		int p2 = t.assertExternal("h1", Syntax.mkEq(Sort.Nat, A0, A1));
		t.apply(ChkStep.validOfEqSymm(p2));
		t.assertExternal("h2", A2);
		t.apply(ChkStep.define(Sort.Nat, succ(E0), 1));
		return t;
	}

	private static Certificate with(Certificate c, Line[] lines, REntry[] entries, Sort[] etomSorts, int[] goals) {
		return new Certificate(c.atomSorts(), c.importSorts(), c.assertions(), lines, entries, etomSorts, goals, null);
	}

	private static Verifier[] verifiers() {
		return new Verifier[] { new DirectVerifier(), new IndirectVerifier(), new CompiledVerifier(),
				new ConsensusVerifier() };
	}

	private static void checkAccepted(Certificate c) {
		for (Verifier v : verifiers()) {
			assertTrue(v.verify(c), v.getClass().getSimpleName() + " rejected");
		}
	}

	private static void checkRejected(Certificate c) {
		for (Verifier v : verifiers()) {
			assertFalse(v.verify(c), v.getClass().getSimpleName() + " accepted");
		}
	}

	private static <T> void swap(T[] items, int i, int j) {
		T tmp = items[i];
		items[i] = items[j];
		items[j] = tmp;
	}

	private static Term succ(Term t) {
		return Syntax.mkUnOp(Constant.NatOp.SUCC, t);
	}

	private static Term lt(Term l, Term r) {
		return Syntax.mkBinOp(Constant.NatOp.LT, l, r);
	}
}
