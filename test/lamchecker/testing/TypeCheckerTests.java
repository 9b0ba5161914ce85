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
import static org.junit.jupiter.api.Assertions.fail;

import org.junit.jupiter.api.Test;

import lamchecker.core.Constant;
import lamchecker.core.Signature;
import lamchecker.core.Syntax;
import lamchecker.core.Syntax.Sort;
import lamchecker.core.Syntax.Term;
import lamchecker.core.TypeChecker;
import lamchecker.util.CheckError;

/**
 * Tests for the sort checker. Valid tests must check to the given sort,
 * whilst invalid tests must be rejected with the given message.
 *
 * @author David J. Pearce
 *
 */
public class TypeCheckerTests {
	private static final Sort NatToNat = new Sort.Func(Sort.Nat, Sort.Nat);
	private static final Sort[] EMPTY = new Sort[0];
	private static final Signature SIGNATURE = new Signature.Impl(
			new Sort[] { Sort.Nat, Sort.Nat, NatToNat, Sort.Prop, new Sort.Atom(0) },
			new Sort[] { Sort.Int },
			new Sort[] { Sort.Nat, new Sort.Atom(0) });

	private static final Term A = new Term.Atom(0);
	private static final Term B = new Term.Atom(1);
	private static final Term F = new Term.Atom(2);
	private static final Term P = new Term.Atom(3);
	private static final Term X = new Term.Atom(4);
	private static final Term B0 = new Term.BVar(0);
	private static final Term B1 = new Term.BVar(1);

	// ==============================================================
	// Valid
	// ==============================================================

	@Test
	public void test_0x0001() {
		check(EMPTY, Syntax.mkBinOp(Constant.NatOp.ADD, A, B), Sort.Nat);
	}

	@Test
	public void test_0x0002() {
		check(EMPTY, new Term.Etom(0), Sort.Int);
		check(EMPTY, Syntax.mkNatVal(12), Sort.Nat);
		check(EMPTY, Syntax.mkStrVal("x"), Sort.Str);
		check(EMPTY, Syntax.mkConst(Constant.PropOp.TRUE), Sort.Prop);
	}

	@Test
	public void test_0x0003() {
		check(new Sort[] { Sort.Nat, Sort.Prop }, B1, Sort.Prop);
		check(new Sort[] { Sort.Nat, Sort.Prop }, B0, Sort.Nat);
	}

	@Test
	public void test_0x0004() {
		check(EMPTY, new Term.Lam(Sort.Nat, Syntax.mkUnOp(Constant.NatOp.SUCC, B0)), NatToNat);
		check(EMPTY, Syntax.mkLamFN(new Sort[] { Sort.Nat, Sort.Prop }, B1), Sort.mkFuncs(Sort.Nat, Sort.Nat, Sort.Prop));
	}

	@Test
	public void test_0x0005() {
		check(EMPTY, Syntax.mkForallEF(Sort.Nat, Syntax.mkBinOp(Constant.NatOp.LT, B0, B)), Sort.Prop);
		check(EMPTY, Syntax.mkExistEF(Sort.Nat, Syntax.mkEq(Sort.Nat, B0, A)), Sort.Prop);
		check(EMPTY, Syntax.mkForallE(Sort.Nat, new Term.Lam(Sort.Nat, P)), Sort.Prop);
	}

	@Test
	public void test_0x0006() {
		check(EMPTY, Syntax.mkIte(Sort.Nat, P, A, B), Sort.Nat);
		check(EMPTY, Syntax.mkIte(NatToNat, P, F, F), NatToNat);
		check(EMPTY, Syntax.mkEq(NatToNat, F, new Term.Lam(Sort.Nat, B0)), Sort.Prop);
	}

	@Test
	public void test_0x0007() {
		check(EMPTY, Syntax.mkImp(Syntax.mkAnd(P, P), Syntax.mkOr(Syntax.mkNot(P), Syntax.mkIff(P, P))), Sort.Prop);
		check(EMPTY, Syntax.mkUnOp(Constant.BoolOp.OF_PROP, P), Sort.Bool);
		check(EMPTY, Syntax.mkUnOp(Constant.IntOp.OF_NAT, A), Sort.Int);
		check(EMPTY, Syntax.mkUnOp(Constant.StringOp.LENGTH, Syntax.mkStrVal("abc")), Sort.Nat);
	}

	@Test
	public void test_0x0008() {
		// Import-form primitives take their sort from the import table
		check(EMPTY, Syntax.mkEqI(0, Sort.Nat, A, B), Sort.Prop);
		check(EMPTY, Syntax.mkEqI(1, new Sort.Atom(0), X, X), Sort.Prop);
		check(EMPTY, Syntax.mkForallEIF(1, new Sort.Atom(0), Syntax.mkEqI(1, new Sort.Atom(0), B0, X)), Sort.Prop);
	}

	@Test
	public void test_0x0009() {
		check(EMPTY, Syntax.mkUnOp(Constant.StringOp.REPLACE_ALL, Syntax.mkStrVal("s")),
				Sort.mkFuncs(Sort.Str, Sort.Str, Sort.Str));
	}

	// ==============================================================
	// Invalid
	// ==============================================================

	@Test
	public void test_0x0101() {
		checkInvalid(EMPTY, new Term.Atom(9), TypeChecker.UNKNOWN_ATOM);
	}

	@Test
	public void test_0x0102() {
		checkInvalid(EMPTY, new Term.Etom(1), TypeChecker.UNKNOWN_ETOM);
	}

	@Test
	public void test_0x0103() {
		checkInvalid(EMPTY, Syntax.mkEqI(2, Sort.Nat, A, A), TypeChecker.UNKNOWN_IMPORT);
	}

	@Test
	public void test_0x0104() {
		checkInvalid(EMPTY, B0, TypeChecker.LOOSE_BVAR);
		checkInvalid(new Sort[] { Sort.Nat }, new Term.Lam(Sort.Nat, new Term.BVar(2)), TypeChecker.LOOSE_BVAR);
	}

	@Test
	public void test_0x0105() {
		checkInvalid(EMPTY, new Term.App(Sort.Nat, A, B), TypeChecker.EXPECTED_FUNCTION);
	}

	@Test
	public void test_0x0106() {
		// Argument sort disagrees with the function domain
		checkInvalid(EMPTY, new Term.App(Sort.Prop, F, P), TypeChecker.ARGUMENT_MISMATCH);
	}

	@Test
	public void test_0x0107() {
		// Function domain and argument agree, but the annotation does not
		checkInvalid(EMPTY, new Term.App(Sort.Int, F, A), TypeChecker.ANNOTATION_MISMATCH);
	}

	@Test
	public void test_0x0108() {
		checkInvalid(EMPTY, A, Sort.Int, TypeChecker.INCOMPATIBLE_SORT);
	}

	@Test
	public void test_0x0109() {
		// Equality at one sort applied to operands of another
		checkInvalid(EMPTY, Syntax.mkEq(Sort.Int, A, B), TypeChecker.ARGUMENT_MISMATCH);
		// The quantified predicate must be over the quantified sort
		checkInvalid(EMPTY, Syntax.mkForallE(Sort.Int, new Term.Lam(Sort.Nat, P)), TypeChecker.ARGUMENT_MISMATCH);
	}

	@Test
	public void test_0x010A() {
		// Errors deep inside a term are reported
		Term t = new Term.Lam(Sort.Nat, Syntax.mkAnd(P, new Term.App(Sort.Nat, B0, B0)));
		checkInvalid(EMPTY, t, TypeChecker.EXPECTED_FUNCTION);
	}

	// ==============================================================
	// Helpers
	// ==============================================================

	private static void check(Sort[] ctx, Term t, Sort expected) {
		Sort actual = new TypeChecker(SIGNATURE).check(ctx, t);
		assertEquals(expected, actual);
		// Checking is deterministic
		assertEquals(actual, new TypeChecker(SIGNATURE).check(ctx, t, expected));
	}

	private static void checkInvalid(Sort[] ctx, Term t, String msg) {
		try {
			Sort s = new TypeChecker(SIGNATURE).check(ctx, t);
			fail("should have failed type checking (" + s + ")");
		} catch (CheckError e) {
			assertEquals(CheckError.Kind.ILL_TYPED, e.kind());
			assertEquals(msg, e.msg());
		}
	}

	private static void checkInvalid(Sort[] ctx, Term t, Sort expected, String msg) {
		try {
			new TypeChecker(SIGNATURE).check(ctx, t, expected);
			fail("should have failed type checking");
		} catch (CheckError e) {
			assertEquals(CheckError.Kind.ILL_TYPED, e.kind());
			assertEquals(msg, e.msg());
		}
	}
}
