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

import java.math.BigDecimal;
import java.math.BigInteger;

import org.junit.jupiter.api.Test;

import lamchecker.core.Constant;
import lamchecker.core.Semantics;
import lamchecker.core.Signature;
import lamchecker.core.Syntax;
import lamchecker.core.Syntax.Sort;
import lamchecker.core.Syntax.Term;
import lamchecker.core.Valuation;
import lamchecker.util.CheckError;

/**
 * Tests for the denotational semantics. Each test interprets a closed term
 * under a fixed valuation and compares the result against its expected value.
 *
 * @author David J. Pearce
 *
 */
public class SemanticsTests {
	private static final Term A = new Term.Atom(0);
	private static final Term B = new Term.Atom(1);
	private static final Term B0 = new Term.BVar(0);
	private static final Term TRUE = Syntax.mkConst(Constant.PropOp.TRUE);
	private static final Term FALSE = Syntax.mkConst(Constant.PropOp.FALSE);

	// ==============================================================
	// Naturals
	// ==============================================================

	@Test
	public void test_0x0001() {
		check(Syntax.mkBinOp(Constant.NatOp.ADD, A, B), 8);
		check(Syntax.mkBinOp(Constant.NatOp.MUL, A, B), 15);
		check(Syntax.mkUnOp(Constant.NatOp.SUCC, A), 4);
		check(Syntax.mkBinOp(Constant.NatOp.MAX, A, B), 5);
		check(Syntax.mkBinOp(Constant.NatOp.MIN, A, B), 3);
	}

	@Test
	public void test_0x0002() {
		// Subtraction truncates at zero
		check(Syntax.mkBinOp(Constant.NatOp.SUB, A, B), 0);
		check(Syntax.mkBinOp(Constant.NatOp.SUB, B, A), 2);
	}

	@Test
	public void test_0x0003() {
		check(Syntax.mkBinOp(Constant.NatOp.DIV, nat(7), nat(2)), 3);
		check(Syntax.mkBinOp(Constant.NatOp.DIV, nat(7), nat(0)), 0);
		check(Syntax.mkBinOp(Constant.NatOp.MOD, nat(7), nat(3)), 1);
		check(Syntax.mkBinOp(Constant.NatOp.MOD, nat(7), nat(0)), 7);
	}

	@Test
	public void test_0x0004() {
		check(Syntax.mkBinOp(Constant.NatOp.LT, A, B), true);
		check(Syntax.mkBinOp(Constant.NatOp.LT, A, A), false);
		check(Syntax.mkBinOp(Constant.NatOp.LE, A, A), true);
	}

	// ==============================================================
	// Integers
	// ==============================================================

	@Test
	public void test_0x0010() {
		check(integer(-7), -7);
		check(integer(4), 4);
		check(Syntax.mkUnOp(Constant.IntOp.NEG, integer(4)), -4);
		check(Syntax.mkUnOp(Constant.IntOp.ABS, integer(-4)), 4);
		check(Syntax.mkBinOp(Constant.IntOp.SUB, integer(2), integer(5)), -3);
	}

	@Test
	public void test_0x0011() {
		// Truncating division
		check(Syntax.mkBinOp(Constant.IntOp.DIV, integer(-7), integer(2)), -3);
		check(Syntax.mkBinOp(Constant.IntOp.MOD, integer(-7), integer(2)), -1);
		check(Syntax.mkBinOp(Constant.IntOp.DIV, integer(-7), integer(0)), 0);
		check(Syntax.mkBinOp(Constant.IntOp.MOD, integer(-7), integer(0)), -7);
	}

	@Test
	public void test_0x0012() {
		// Euclidean division
		check(Syntax.mkBinOp(Constant.IntOp.EDIV, integer(-7), integer(2)), -4);
		check(Syntax.mkBinOp(Constant.IntOp.EMOD, integer(-7), integer(2)), 1);
		check(Syntax.mkBinOp(Constant.IntOp.EDIV, integer(7), integer(-2)), -3);
		check(Syntax.mkBinOp(Constant.IntOp.EMOD, integer(7), integer(-2)), 1);
		check(Syntax.mkBinOp(Constant.IntOp.EDIV, integer(-7), integer(-2)), 4);
		check(Syntax.mkBinOp(Constant.IntOp.EDIV, integer(5), integer(0)), 0);
		check(Syntax.mkBinOp(Constant.IntOp.EMOD, integer(5), integer(0)), 5);
	}

	@Test
	public void test_0x0013() {
		check(Syntax.mkBinOp(Constant.IntOp.LT, integer(-1), integer(0)), true);
		check(Syntax.mkBinOp(Constant.IntOp.MAX, integer(-1), integer(-9)), -1);
		check(Syntax.mkBinOp(Constant.IntOp.MIN, integer(-1), integer(-9)), -9);
	}

	// ==============================================================
	// Strings
	// ==============================================================

	@Test
	public void test_0x0020() {
		check(Syntax.mkUnOp(Constant.StringOp.LENGTH, Syntax.mkStrVal("hello")), 5);
		// Length counts code points
		check(Syntax.mkUnOp(Constant.StringOp.LENGTH, Syntax.mkStrVal("a😀")), 2);
	}

	@Test
	public void test_0x0021() {
		check(Syntax.mkBinOp(Constant.StringOp.APPEND, Syntax.mkStrVal("ab"), Syntax.mkStrVal("cd")), "abcd");
		check(Syntax.mkBinOp(Constant.StringOp.PREFIX_OF, Syntax.mkStrVal("ab"), Syntax.mkStrVal("abc")), true);
		check(Syntax.mkBinOp(Constant.StringOp.PREFIX_OF, Syntax.mkStrVal("abc"), Syntax.mkStrVal("ab")), false);
		check(Syntax.mkBinOp(Constant.StringOp.LT, Syntax.mkStrVal("ab"), Syntax.mkStrVal("b")), true);
		check(Syntax.mkBinOp(Constant.StringOp.LE, Syntax.mkStrVal("b"), Syntax.mkStrVal("b")), true);
	}

	@Test
	public void test_0x0022() {
		check(replaceAll("aXbX", "X", ""), "ab");
		check(replaceAll("aaa", "a", "bb"), "bbbbbb");
		// An empty pattern leaves the string unchanged
		check(replaceAll("abc", "", "z"), "abc");
	}

	@Test
	public void test_0x0023() {
		// Ordering is by code point, so U+FFFF precedes U+1F600
		Term hi = Syntax.mkStrVal("￿");
		Term emoji = Syntax.mkStrVal("😀");
		check(Syntax.mkBinOp(Constant.StringOp.LT, hi, emoji), true);
		check(Syntax.mkBinOp(Constant.StringOp.LT, emoji, hi), false);
		check(Syntax.mkBinOp(Constant.StringOp.LE, emoji, hi), false);
		check(Syntax.mkBinOp(Constant.StringOp.LE, Syntax.mkStrVal("a😀"), Syntax.mkStrVal("a😀b")), true);
	}

	// ==============================================================
	// Propositions & Booleans
	// ==============================================================

	@Test
	public void test_0x0030() {
		check(Syntax.mkImp(FALSE, FALSE), true);
		check(Syntax.mkImp(TRUE, FALSE), false);
		check(Syntax.mkIff(FALSE, FALSE), true);
		check(Syntax.mkAnd(TRUE, Syntax.mkNot(FALSE)), true);
		check(Syntax.mkOr(FALSE, FALSE), false);
	}

	@Test
	public void test_0x0031() {
		check(Syntax.mkUnOp(Constant.BoolOp.OF_PROP, TRUE), true);
		Term t = Syntax.mkBinOp(Constant.BoolOp.AND, Syntax.mkConst(Constant.BoolOp.TRUE),
				Syntax.mkUnOp(Constant.BoolOp.NOT, Syntax.mkConst(Constant.BoolOp.FALSE)));
		check(t, true);
	}

	@Test
	public void test_0x0032() {
		check(Syntax.mkIte(Sort.Nat, Syntax.mkBinOp(Constant.NatOp.LT, A, B), A, B), 3);
		check(Syntax.mkIte(Sort.Nat, Syntax.mkBinOp(Constant.NatOp.LT, B, A), A, B), 5);
	}

	// ==============================================================
	// Abstraction & Frames
	// ==============================================================

	@Test
	public void test_0x0040() {
		Term f = new Term.Lam(Sort.Nat, Syntax.mkUnOp(Constant.NatOp.SUCC, B0));
		check(new Term.App(Sort.Nat, f, A), 4);
	}

	@Test
	public void test_0x0041() {
		Semantics semantics = new Semantics(valuation());
		Term t = Syntax.mkBinOp(Constant.NatOp.ADD, B0, new Term.BVar(1));
		Object v = semantics.interpret(new Object[] { BigInteger.ONE, BigInteger.TEN }, t);
		assertEquals(BigInteger.valueOf(11), v);
	}

	// ==============================================================
	// Equality & Quantifiers
	// ==============================================================

	@Test
	public void test_0x0050() {
		check(Syntax.mkEq(Sort.Nat, A, A), true);
		check(Syntax.mkEq(Sort.Nat, A, B), false);
		check(Syntax.mkEq(Sort.Prop, TRUE, Syntax.mkNot(FALSE)), true);
	}

	@Test
	public void test_0x0051() {
		check(Syntax.mkForallEF(Sort.Nat, Syntax.mkBinOp(Constant.NatOp.LE, B0, nat(3))), true);
		check(Syntax.mkForallEF(Sort.Nat, Syntax.mkBinOp(Constant.NatOp.LT, B0, nat(3))), false);
		check(Syntax.mkExistEF(Sort.Nat, Syntax.mkEq(Sort.Nat, B0, nat(2))), true);
		check(Syntax.mkExistEF(Sort.Nat, Syntax.mkEq(Sort.Nat, B0, nat(9))), false);
	}

	@Test
	public void test_0x0052() {
		// Excluded middle over the built-in carrier of propositions
		check(Syntax.mkForallEF(Sort.Prop, Syntax.mkOr(B0, Syntax.mkNot(B0))), true);
		Semantics semantics = new Semantics(valuation());
		assertTrue(semantics.holds(new Sort[] { Sort.Prop }, Syntax.mkOr(B0, Syntax.mkNot(B0))));
		assertFalse(semantics.holds(new Sort[] { Sort.Prop }, B0));
	}

	@Test
	public void test_0x0053() {
		Semantics semantics = new Semantics(valuation());
		Term t = Syntax.mkBinOp(Constant.NatOp.LE, B0, new Term.BVar(1));
		assertFalse(semantics.holds(new Sort[] { Sort.Nat, Sort.Nat }, t));
		assertTrue(semantics.holds(new Sort[] { Sort.Nat, Sort.Nat },
				Syntax.mkOr(t, Syntax.mkBinOp(Constant.NatOp.LT, new Term.BVar(1), B0))));
	}

	@Test
	public void test_0x0054() {
		// A sort atom is interpreted by whatever the valuation registers
		Sort s = new Sort.Atom(0);
		Valuation v = new Valuation("Foo", "FOO");
		v.register(s, new Semantics.Finite((x, y) -> ((String) x).equalsIgnoreCase((String) y), "Foo", "bar"));
		Semantics semantics = new Semantics(v);
		assertEquals(true, semantics.interpret(Syntax.mkEq(s, A, B)));
		assertEquals(true, semantics.interpret(Syntax.mkExistEF(s, Syntax.mkEq(s, B0, B))));
		assertEquals(false, semantics.interpret(Syntax.mkForallEF(s, Syntax.mkEq(s, B0, B))));
	}

	// ==============================================================
	// Failures
	// ==============================================================

	@Test
	public void test_0x0060() {
		Semantics semantics = new Semantics(valuation());
		CheckError e = assertThrows(CheckError.class,
				() -> semantics.interpret(Syntax.mkEqI(0, Sort.Nat, A, A)));
		assertEquals(CheckError.Kind.UNRESOLVED_IMPORT, e.kind());
		assertEquals(Semantics.UNRESOLVED_IMPORT, e.msg());
	}

	@Test
	public void test_0x0061() {
		// No interpretation bundle for integers
		Semantics semantics = new Semantics(valuation());
		assertThrows(IllegalArgumentException.class,
				() -> semantics.interpret(Syntax.mkEq(Sort.Int, integer(1), integer(1))));
		assertThrows(IllegalArgumentException.class, () -> semantics.interpret(new Term.Atom(7)));
		assertThrows(IllegalArgumentException.class, () -> semantics.interpret(new Term.Etom(0)));
	}

	@Test
	public void test_0x0062() {
		Valuation v = valuation();
		assertThrows(IllegalArgumentException.class, () -> v.register(Sort.Prop, new Semantics.Finite()));
		assertThrows(IllegalArgumentException.class, () -> v.register(Sort.Bool, new Semantics.Finite()));
		assertThrows(IllegalArgumentException.class, () -> v.register(Sort.Nat, new Semantics.Finite()));
	}

	// ==============================================================
	// Semantic Domains
	// ==============================================================

	@Test
	public void test_0x0070() {
		Semantics.BitVec v = new Semantics.BitVec(4, BigInteger.valueOf(15));
		assertEquals("15#4", v.toString());
		assertTrue(Semantics.inDomain(Sort.bitVec(4), v));
		assertFalse(Semantics.inDomain(Sort.bitVec(8), v));
		assertThrows(IllegalArgumentException.class, () -> new Semantics.BitVec(4, BigInteger.valueOf(16)));
		assertThrows(IllegalArgumentException.class, () -> new Semantics.BitVec(4, BigInteger.valueOf(-1)));
	}

	@Test
	public void test_0x0071() {
		assertTrue(Semantics.inDomain(Sort.Nat, BigInteger.ZERO));
		assertFalse(Semantics.inDomain(Sort.Nat, BigInteger.valueOf(-1)));
		assertTrue(Semantics.inDomain(Sort.Int, BigInteger.valueOf(-1)));
		assertTrue(Semantics.inDomain(Sort.Real, BigDecimal.ONE));
		assertFalse(Semantics.inDomain(Sort.Str, BigInteger.ONE));
		assertTrue(Semantics.inDomain(Sort.Bool, Boolean.TRUE));
	}

	@Test
	public void test_0x0072() {
		Signature sig = new Signature.Impl(new Sort[] { Sort.Nat, Sort.Nat }, new Sort[] { Sort.Str }, new Sort[0]);
		Valuation good = new Valuation(new Object[] { BigInteger.ONE, BigInteger.TEN }, new Object[] { "e" });
		assertTrue(new Semantics(good).conforms(sig));
		Valuation bad = new Valuation(new Object[] { BigInteger.ONE, "ten" }, new Object[] { "e" });
		assertFalse(new Semantics(bad).conforms(sig));
		Valuation extra = new Valuation(BigInteger.ONE, BigInteger.TEN, BigInteger.ONE);
		assertFalse(new Semantics(extra).conforms(sig));
	}

	// ==============================================================
	// Helpers
	// ==============================================================

	/**
	 * Atoms <code>a0 = 3</code> and <code>a1 = 5</code>, with naturals
	 * quantified over <code>{0,...,3}</code>.
	 *
	 * @return
	 */
	private static Valuation valuation() {
		Valuation v = new Valuation(BigInteger.valueOf(3), BigInteger.valueOf(5));
		v.register(Sort.Nat, new Semantics.Finite(BigInteger.ZERO, BigInteger.ONE, BigInteger.TWO,
				BigInteger.valueOf(3)));
		return v;
	}

	private static Term nat(long n) {
		return Syntax.mkNatVal(n);
	}

	private static Term integer(long n) {
		if (n >= 0) {
			return Syntax.mkUnOp(Constant.IntOp.OF_NAT, nat(n));
		} else {
			return Syntax.mkUnOp(Constant.IntOp.NEG_SUCC, nat(-n - 1));
		}
	}

	private static Term replaceAll(String s, String p, String r) {
		Term t = Syntax.mkUnOp(Constant.StringOp.REPLACE_ALL, Syntax.mkStrVal(s));
		return new Term.App(Sort.Str, new Term.App(Sort.Str, t, Syntax.mkStrVal(p)), Syntax.mkStrVal(r));
	}

	private static void check(Term t, long expected) {
		check(t, BigInteger.valueOf(expected));
	}

	private static void check(Term t, Object expected) {
		Object actual = new Semantics(valuation()).interpret(t);
		assertEquals(expected, actual);
	}
}
