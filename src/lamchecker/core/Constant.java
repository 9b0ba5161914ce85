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
package lamchecker.core;

import java.math.BigInteger;

import lamchecker.core.Syntax.Sort;

/**
 * A base constant of the term calculus. Constants are drawn from a handful of
 * finite families (propositional, boolean, natural, integer and string
 * operators), along with the logical primitives which are parameterised by a
 * sort. Every constant has exactly one sort, which is determined once when the
 * constant is created.
 *
 * @author David J. Pearce
 *
 */
public interface Constant {
	public final static int FAMILY_prop = 0;
	public final static int FAMILY_bool = 1;
	public final static int FAMILY_nat = 2;
	public final static int FAMILY_int = 3;
	public final static int FAMILY_string = 4;
	public final static int FAMILY_logical = 5;

	/**
	 * Get the family to which this constant belongs.
	 *
	 * @return
	 */
	public int family();

	/**
	 * Get the unique sort of this constant. For a logical primitive in import
	 * form this is <code>null</code>, since its sort is held in the import table.
	 *
	 * @return
	 */
	public Sort sort();

	public enum PropOp implements Constant {
		TRUE("True", Sort.Prop),
		FALSE("False", Sort.Prop),
		NOT("¬", Sort.mkFuncs(Sort.Prop, Sort.Prop)),
		AND("∧", Sort.mkFuncs(Sort.Prop, Sort.Prop, Sort.Prop)),
		OR("∨", Sort.mkFuncs(Sort.Prop, Sort.Prop, Sort.Prop)),
		IMP("→", Sort.mkFuncs(Sort.Prop, Sort.Prop, Sort.Prop)),
		IFF("↔", Sort.mkFuncs(Sort.Prop, Sort.Prop, Sort.Prop));

		private final String name;
		private final Sort sort;

		private PropOp(String name, Sort sort) {
			this.name = name;
			this.sort = sort;
		}

		@Override
		public int family() {
			return FAMILY_prop;
		}

		@Override
		public Sort sort() {
			return sort;
		}

		@Override
		public String toString() {
			return name;
		}
	}

	public enum BoolOp implements Constant {
		TRUE("true", Sort.Bool),
		FALSE("false", Sort.Bool),
		NOT("!b", Sort.mkFuncs(Sort.Bool, Sort.Bool)),
		AND("&&", Sort.mkFuncs(Sort.Bool, Sort.Bool, Sort.Bool)),
		OR("||", Sort.mkFuncs(Sort.Bool, Sort.Bool, Sort.Bool)),
		OF_PROP("decide", Sort.mkFuncs(Sort.Bool, Sort.Prop));

		private final String name;
		private final Sort sort;

		private BoolOp(String name, Sort sort) {
			this.name = name;
			this.sort = sort;
		}

		@Override
		public int family() {
			return FAMILY_bool;
		}

		@Override
		public Sort sort() {
			return sort;
		}

		@Override
		public String toString() {
			return name;
		}
	}

	public enum NatOp implements Constant {
		SUCC("nsucc", Sort.mkFuncs(Sort.Nat, Sort.Nat)),
		ADD("nadd", Sort.mkFuncs(Sort.Nat, Sort.Nat, Sort.Nat)),
		SUB("nsub", Sort.mkFuncs(Sort.Nat, Sort.Nat, Sort.Nat)),
		MUL("nmul", Sort.mkFuncs(Sort.Nat, Sort.Nat, Sort.Nat)),
		DIV("ndiv", Sort.mkFuncs(Sort.Nat, Sort.Nat, Sort.Nat)),
		MOD("nmod", Sort.mkFuncs(Sort.Nat, Sort.Nat, Sort.Nat)),
		MAX("nmax", Sort.mkFuncs(Sort.Nat, Sort.Nat, Sort.Nat)),
		MIN("nmin", Sort.mkFuncs(Sort.Nat, Sort.Nat, Sort.Nat)),
		LE("nle", Sort.mkFuncs(Sort.Prop, Sort.Nat, Sort.Nat)),
		LT("nlt", Sort.mkFuncs(Sort.Prop, Sort.Nat, Sort.Nat));

		private final String name;
		private final Sort sort;

		private NatOp(String name, Sort sort) {
			this.name = name;
			this.sort = sort;
		}

		@Override
		public int family() {
			return FAMILY_nat;
		}

		@Override
		public Sort sort() {
			return sort;
		}

		@Override
		public String toString() {
			return name;
		}
	}

	public enum IntOp implements Constant {
		OF_NAT("iofNat", Sort.mkFuncs(Sort.Int, Sort.Nat)),
		NEG_SUCC("inegSucc", Sort.mkFuncs(Sort.Int, Sort.Nat)),
		NEG("ineg", Sort.mkFuncs(Sort.Int, Sort.Int)),
		ABS("iabs", Sort.mkFuncs(Sort.Int, Sort.Int)),
		ADD("iadd", Sort.mkFuncs(Sort.Int, Sort.Int, Sort.Int)),
		SUB("isub", Sort.mkFuncs(Sort.Int, Sort.Int, Sort.Int)),
		MUL("imul", Sort.mkFuncs(Sort.Int, Sort.Int, Sort.Int)),
		DIV("idiv", Sort.mkFuncs(Sort.Int, Sort.Int, Sort.Int)),
		MOD("imod", Sort.mkFuncs(Sort.Int, Sort.Int, Sort.Int)),
		EDIV("iediv", Sort.mkFuncs(Sort.Int, Sort.Int, Sort.Int)),
		EMOD("iemod", Sort.mkFuncs(Sort.Int, Sort.Int, Sort.Int)),
		MAX("imax", Sort.mkFuncs(Sort.Int, Sort.Int, Sort.Int)),
		MIN("imin", Sort.mkFuncs(Sort.Int, Sort.Int, Sort.Int)),
		LE("ile", Sort.mkFuncs(Sort.Prop, Sort.Int, Sort.Int)),
		LT("ilt", Sort.mkFuncs(Sort.Prop, Sort.Int, Sort.Int));

		private final String name;
		private final Sort sort;

		private IntOp(String name, Sort sort) {
			this.name = name;
			this.sort = sort;
		}

		@Override
		public int family() {
			return FAMILY_int;
		}

		@Override
		public Sort sort() {
			return sort;
		}

		@Override
		public String toString() {
			return name;
		}
	}

	public enum StringOp implements Constant {
		LENGTH("slength", Sort.mkFuncs(Sort.Nat, Sort.Str)),
		APPEND("sapp", Sort.mkFuncs(Sort.Str, Sort.Str, Sort.Str)),
		LE("sle", Sort.mkFuncs(Sort.Prop, Sort.Str, Sort.Str)),
		LT("slt", Sort.mkFuncs(Sort.Prop, Sort.Str, Sort.Str)),
		PREFIX_OF("sprefixof", Sort.mkFuncs(Sort.Prop, Sort.Str, Sort.Str)),
		REPLACE_ALL("srepall", Sort.mkFuncs(Sort.Str, Sort.Str, Sort.Str, Sort.Str));

		private final String name;
		private final Sort sort;

		private StringOp(String name, Sort sort) {
			this.name = name;
			this.sort = sort;
		}

		@Override
		public int family() {
			return FAMILY_string;
		}

		@Override
		public Sort sort() {
			return sort;
		}

		@Override
		public String toString() {
			return name;
		}
	}

	/**
	 * A natural number literal.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class NatVal implements Constant {
		private final BigInteger value;

		public NatVal(BigInteger value) {
			if (value.signum() < 0) {
				throw new IllegalArgumentException("negative natural number");
			}
			this.value = value;
		}

		public BigInteger value() {
			return value;
		}

		@Override
		public int family() {
			return FAMILY_nat;
		}

		@Override
		public Sort sort() {
			return Sort.Nat;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof NatVal && ((NatVal) o).value.equals(value);
		}

		@Override
		public int hashCode() {
			return value.hashCode();
		}

		@Override
		public String toString() {
			return value.toString();
		}
	}

	/**
	 * A string literal.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class StrVal implements Constant {
		private final String value;

		public StrVal(String value) {
			this.value = value;
		}

		public String value() {
			return value;
		}

		@Override
		public int family() {
			return FAMILY_string;
		}

		@Override
		public Sort sort() {
			return Sort.Str;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof StrVal && ((StrVal) o).value.equals(value);
		}

		@Override
		public int hashCode() {
			return value.hashCode();
		}

		@Override
		public String toString() {
			return "\"" + value + "\"";
		}
	}

	/**
	 * A logical primitive (equality, quantifiers and the conditional) at some
	 * sort. Such a primitive exists either in <i>import</i> form, where it holds
	 * an index into the import table of sorts, or in <i>resolved</i> form where
	 * it carries its sort directly.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Logical implements Constant {
		public enum Kind {
			EQ("="), FORALL("∀"), EXISTS("∃"), ITE("ite");

			private final String name;

			private Kind(String name) {
				this.name = name;
			}

			@Override
			public String toString() {
				return name;
			}
		}

		private final Kind kind;
		/**
		 * The sort at which this primitive is instantiated, or null in import form.
		 */
		private final Sort instance;
		/**
		 * The index into the import table, or -1 in resolved form.
		 */
		private final int importIndex;
		/**
		 * The unique sort of this constant, or null in import form.
		 */
		private final Sort sort;

		private Logical(Kind kind, Sort instance, int importIndex) {
			this.kind = kind;
			this.instance = instance;
			this.importIndex = importIndex;
			this.sort = instance == null ? null : sortAt(kind, instance);
		}

		public static Logical eq(Sort s) {
			return new Logical(Kind.EQ, s, -1);
		}

		public static Logical forall(Sort s) {
			return new Logical(Kind.FORALL, s, -1);
		}

		public static Logical exists(Sort s) {
			return new Logical(Kind.EXISTS, s, -1);
		}

		public static Logical ite(Sort s) {
			return new Logical(Kind.ITE, s, -1);
		}

		public static Logical eqI(int n) {
			return imported(Kind.EQ, n);
		}

		public static Logical forallI(int n) {
			return imported(Kind.FORALL, n);
		}

		public static Logical existsI(int n) {
			return imported(Kind.EXISTS, n);
		}

		public static Logical iteI(int n) {
			return imported(Kind.ITE, n);
		}

		private static Logical imported(Kind kind, int n) {
			if (n < 0) {
				throw new IllegalArgumentException("negative import index");
			}
			return new Logical(kind, null, n);
		}

		public Kind kind() {
			return kind;
		}

		/**
		 * Check whether this primitive is in import form.
		 *
		 * @return
		 */
		public boolean isImport() {
			return instance == null;
		}

		/**
		 * Get the sort at which this (resolved) primitive is instantiated.
		 *
		 * @return
		 */
		public Sort instance() {
			return instance;
		}

		/**
		 * Get the import table index of this (import form) primitive.
		 *
		 * @return
		 */
		public int importIndex() {
			return importIndex;
		}

		/**
		 * Produce the resolved form of this primitive at a given sort.
		 *
		 * @param s
		 * @return
		 */
		public Logical resolve(Sort s) {
			return new Logical(kind, s, -1);
		}

		@Override
		public int family() {
			return FAMILY_logical;
		}

		@Override
		public Sort sort() {
			return sort;
		}

		/**
		 * Determine the sort of a logical primitive of a given kind when
		 * instantiated at a given sort.
		 *
		 * @param kind
		 * @param s
		 * @return
		 */
		public static Sort sortAt(Kind kind, Sort s) {
			switch (kind) {
			case EQ:
				return Sort.mkFuncs(Sort.Prop, s, s);
			case FORALL:
			case EXISTS:
				return Sort.mkFuncs(Sort.Prop, new Sort.Func(s, Sort.Prop));
			default:
				return Sort.mkFuncs(s, Sort.Prop, s, s);
			}
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Logical) {
				Logical l = (Logical) o;
				return kind == l.kind && importIndex == l.importIndex
						&& (instance == null ? l.instance == null : instance.equals(l.instance));
			}
			return false;
		}

		@Override
		public int hashCode() {
			int h = instance == null ? importIndex : instance.hashCode();
			return kind.ordinal() ^ (h << 2);
		}

		@Override
		public String toString() {
			if (instance == null) {
				return kind + "I" + importIndex;
			} else {
				return kind + "[" + instance + "]";
			}
		}
	}
}
