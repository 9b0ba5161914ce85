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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import lamchecker.util.Pair;

/**
 * The syntax of the term calculus. Sorts form a closed universe of atoms,
 * interpreted base sorts and curried function sorts. Terms use de Bruijn
 * indices for bound variables and every application node records the sort of
 * its argument.
 *
 * @author David J. Pearce
 *
 */
public class Syntax {
	public final static int SORT_atom = 0;
	public final static int SORT_base = 1;
	public final static int SORT_func = 2;

	public final static int TERM_atom = 0;
	public final static int TERM_etom = 1;
	public final static int TERM_const = 2;
	public final static int TERM_bvar = 3;
	public final static int TERM_lam = 4;
	public final static int TERM_app = 5;

	public interface Sort {

		/**
		 * Get the opcode associated with the syntactic form of this sort.
		 *
		 * @return
		 */
		public int getOpcode();

		/**
		 * Constant representing the sort of propositions
		 */
		public static Sort Prop = new Base(Base.Kind.PROP);
		/**
		 * Constant representing the sort of booleans
		 */
		public static Sort Bool = new Base(Base.Kind.BOOL);
		/**
		 * Constant representing the sort of natural numbers
		 */
		public static Sort Nat = new Base(Base.Kind.NAT);
		/**
		 * Constant representing the sort of integers
		 */
		public static Sort Int = new Base(Base.Kind.INT);
		/**
		 * Constant representing the sort of strings
		 */
		public static Sort Str = new Base(Base.Kind.STRING);
		/**
		 * Constant representing the sort of reals
		 */
		public static Sort Real = new Base(Base.Kind.REAL);

		/**
		 * Construct the sort of bit-vectors of a given width.
		 *
		 * @param width
		 * @return
		 */
		public static Sort bitVec(int width) {
			return new Base(Base.Kind.BITVEC, width);
		}

		/**
		 * An opaque sort variable, whose carrier is supplied by the valuation.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Atom implements Sort {
			private final int index;

			public Atom(int index) {
				if (index < 0) {
					throw new IllegalArgumentException("negative sort atom");
				}
				this.index = index;
			}

			@Override
			public int getOpcode() {
				return SORT_atom;
			}

			public int index() {
				return index;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Sort.Atom && ((Sort.Atom) o).index == index;
			}

			@Override
			public int hashCode() {
				return 17 * index;
			}

			@Override
			public String toString() {
				return "s" + index;
			}
		}

		/**
		 * An interpreted base sort. Only bit-vectors carry a parameter (their
		 * width).
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Base implements Sort {
			public enum Kind {
				PROP("prop"), BOOL("bool"), NAT("nat"), INT("int"), STRING("string"), REAL("real"), BITVEC("bv");

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
			private final int width;

			private Base(Kind kind) {
				this.kind = kind;
				this.width = 0;
			}

			private Base(Kind kind, int width) {
				if (width < 0) {
					throw new IllegalArgumentException("negative bit-vector width");
				}
				this.kind = kind;
				this.width = width;
			}

			@Override
			public int getOpcode() {
				return SORT_base;
			}

			public Kind kind() {
				return kind;
			}

			/**
			 * Get the width of a bit-vector sort (zero for all other base sorts).
			 *
			 * @return
			 */
			public int width() {
				return width;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Sort.Base) {
					Sort.Base b = (Sort.Base) o;
					return kind == b.kind && width == b.width;
				}
				return false;
			}

			@Override
			public int hashCode() {
				return 7 * kind.ordinal() + 31 * width;
			}

			@Override
			public String toString() {
				if (kind == Kind.BITVEC) {
					return "bv" + width;
				} else {
					return kind.toString();
				}
			}
		}

		/**
		 * A (curried) function sort <code>domain → codomain</code>.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Func implements Sort {
			private final Sort domain;
			private final Sort codomain;
			private final int hash;

			public Func(Sort domain, Sort codomain) {
				this.domain = domain;
				this.codomain = codomain;
				this.hash = 31 * domain.hashCode() + codomain.hashCode() + 1;
			}

			@Override
			public int getOpcode() {
				return SORT_func;
			}

			public Sort domain() {
				return domain;
			}

			public Sort codomain() {
				return codomain;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Sort.Func) {
					Sort.Func f = (Sort.Func) o;
					return hash == f.hash && domain.equals(f.domain) && codomain.equals(f.codomain);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return hash;
			}

			@Override
			public String toString() {
				return "(" + domain + " → " + codomain + ")";
			}
		}

		/**
		 * Check whether a given sort occurs anywhere inside another (including the
		 * sort itself).
		 *
		 * @param s
		 * @param sub
		 * @return
		 */
		public static boolean contains(Sort s, Sort sub) {
			if (s.equals(sub)) {
				return true;
			} else if (s instanceof Sort.Func) {
				Sort.Func f = (Sort.Func) s;
				return contains(f.domain, sub) || contains(f.codomain, sub);
			} else {
				return false;
			}
		}

		/**
		 * Construct the curried function sort <code>args[0] → ... → res</code>.
		 *
		 * @param res
		 * @param args
		 * @return
		 */
		public static Sort mkFuncs(Sort res, Sort... args) {
			for (int i = args.length - 1; i >= 0; --i) {
				res = new Sort.Func(args[i], res);
			}
			return res;
		}

		/**
		 * Construct the curried function sort <code>args[n-1] → ... → res</code>.
		 * That is, the arguments are given innermost first.
		 *
		 * @param res
		 * @param args
		 * @return
		 */
		public static Sort mkFuncsRev(Sort res, Sort... args) {
			for (int i = 0; i != args.length; ++i) {
				res = new Sort.Func(args[i], res);
			}
			return res;
		}

		/**
		 * Get the argument sorts of a (curried) function sort, outermost first.
		 *
		 * @param s
		 * @return
		 */
		public static Sort[] getArgTys(Sort s) {
			ArrayList<Sort> args = new ArrayList<>();
			while (s instanceof Sort.Func) {
				Sort.Func f = (Sort.Func) s;
				args.add(f.domain);
				s = f.codomain;
			}
			return args.toArray(new Sort[args.size()]);
		}

		/**
		 * Get the result sort of a (curried) function sort, after all arguments
		 * have been applied.
		 *
		 * @param s
		 * @return
		 */
		public static Sort getResTy(Sort s) {
			while (s instanceof Sort.Func) {
				s = ((Sort.Func) s).codomain;
			}
			return s;
		}

		/**
		 * Get the first <code>n</code> argument sorts of a given sort, or
		 * <code>null</code> if it has fewer than <code>n</code> arrows.
		 *
		 * @param n
		 * @param s
		 * @return
		 */
		public static Sort[] getArgTysN(int n, Sort s) {
			Sort[] args = new Sort[n];
			for (int i = 0; i != n; ++i) {
				if (!(s instanceof Sort.Func)) {
					return null;
				}
				Sort.Func f = (Sort.Func) s;
				args[i] = f.domain;
				s = f.codomain;
			}
			return args;
		}

		/**
		 * Get the sort remaining after <code>n</code> arguments have been applied,
		 * or <code>null</code> if it has fewer than <code>n</code> arrows.
		 *
		 * @param n
		 * @param s
		 * @return
		 */
		public static Sort getResTyN(int n, Sort s) {
			for (int i = 0; i != n; ++i) {
				if (!(s instanceof Sort.Func)) {
					return null;
				}
				s = ((Sort.Func) s).codomain;
			}
			return s;
		}
	}

	public interface Term {

		/**
		 * Get the opcode associated with the syntactic form of this term.
		 *
		 * @return
		 */
		public int getOpcode();

		/**
		 * Get the number of nodes in this term, which is always positive.
		 *
		 * @return
		 */
		public int size();

		/**
		 * Get the smallest bound beyond which no loose bound variable occurs in this
		 * term. A term is closed when this is zero.
		 *
		 * @return
		 */
		public int maxLooseBVarSucc();

		/**
		 * Get the smallest bound beyond which no existential atom occurs in this
		 * term.
		 *
		 * @return
		 */
		public int maxEVarSucc();

		/**
		 * An abstract term to be implemented by all other terms. The synthesized
		 * attributes are computed once at construction.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static abstract class AbstractTerm implements Term {
			private final int opcode;
			private final int size;
			private final int maxLooseBVarSucc;
			private final int maxEVarSucc;
			private final int hash;

			public AbstractTerm(int opcode, int size, int maxLooseBVarSucc, int maxEVarSucc, int hash) {
				this.opcode = opcode;
				this.size = size;
				this.maxLooseBVarSucc = maxLooseBVarSucc;
				this.maxEVarSucc = maxEVarSucc;
				this.hash = hash;
			}

			@Override
			public int getOpcode() {
				return opcode;
			}

			@Override
			public int size() {
				return size;
			}

			@Override
			public int maxLooseBVarSucc() {
				return maxLooseBVarSucc;
			}

			@Override
			public int maxEVarSucc() {
				return maxEVarSucc;
			}

			@Override
			public int hashCode() {
				return hash;
			}
		}

		/**
		 * A term-level atom, whose sort is fixed by the signature and whose value is
		 * supplied by the valuation.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Atom extends AbstractTerm {
			private final int index;

			public Atom(int index) {
				super(TERM_atom, 1, 0, 0, 0x1000 + index);
				if (index < 0) {
					throw new IllegalArgumentException("negative atom");
				}
				this.index = index;
			}

			public int index() {
				return index;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Term.Atom && ((Term.Atom) o).index == index;
			}

			@Override
			public String toString() {
				return "a" + index;
			}
		}

		/**
		 * An existential atom, introduced mid-derivation by skolemization or
		 * definition.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Etom extends AbstractTerm {
			private final int index;

			public Etom(int index) {
				super(TERM_etom, 1, 0, index + 1, 0x2000 + index);
				if (index < 0) {
					throw new IllegalArgumentException("negative etom");
				}
				this.index = index;
			}

			public int index() {
				return index;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Term.Etom && ((Term.Etom) o).index == index;
			}

			@Override
			public String toString() {
				return "e" + index;
			}
		}

		/**
		 * An interpreted base constant drawn from one of the constant families.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Const extends AbstractTerm {
			private final Constant constant;

			public Const(Constant constant) {
				super(TERM_const, 1, 0, 0, constant.toString().hashCode());
				this.constant = constant;
			}

			public Constant constant() {
				return constant;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Term.Const && ((Term.Const) o).constant.equals(constant);
			}

			@Override
			public String toString() {
				return constant.toString();
			}
		}

		/**
		 * A bound variable, identified by the number of binders between it and its
		 * binding abstraction.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class BVar extends AbstractTerm {
			private final int index;

			public BVar(int index) {
				super(TERM_bvar, 1, index + 1, 0, 0x3000 + index);
				if (index < 0) {
					throw new IllegalArgumentException("negative bound variable");
				}
				this.index = index;
			}

			public int index() {
				return index;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Term.BVar && ((Term.BVar) o).index == index;
			}

			@Override
			public String toString() {
				return "#" + index;
			}
		}

		/**
		 * Represents an abstraction of the form <code>λ:s. body</code>.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Lam extends AbstractTerm {
			private final Sort binder;
			private final Term body;

			public Lam(Sort binder, Term body) {
				super(TERM_lam, body.size() + 1, Math.max(0, body.maxLooseBVarSucc() - 1), body.maxEVarSucc(),
						31 * binder.hashCode() + body.hashCode() + 4);
				this.binder = binder;
				this.body = body;
			}

			public Sort binder() {
				return binder;
			}

			public Term body() {
				return body;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Term.Lam) {
					Term.Lam l = (Term.Lam) o;
					return hashCode() == l.hashCode() && binder.equals(l.binder) && body.equals(l.body);
				}
				return false;
			}

			@Override
			public String toString() {
				return "(λ:" + binder + ". " + body + ")";
			}
		}

		/**
		 * Represents an application <code>fn arg</code>, annotated with the sort of
		 * its argument.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class App extends AbstractTerm {
			private final Sort argSort;
			private final Term fn;
			private final Term arg;

			public App(Sort argSort, Term fn, Term arg) {
				super(TERM_app, fn.size() + arg.size() + 1, Math.max(fn.maxLooseBVarSucc(), arg.maxLooseBVarSucc()),
						Math.max(fn.maxEVarSucc(), arg.maxEVarSucc()),
						31 * (31 * argSort.hashCode() + fn.hashCode()) + arg.hashCode() + 5);
				this.argSort = argSort;
				this.fn = fn;
				this.arg = arg;
			}

			/**
			 * Get the sort annotation recorded for the argument.
			 *
			 * @return
			 */
			public Sort argSort() {
				return argSort;
			}

			public Term fn() {
				return fn;
			}

			public Term arg() {
				return arg;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Term.App) {
					Term.App a = (Term.App) o;
					return hashCode() == a.hashCode() && argSort.equals(a.argSort) && fn.equals(a.fn)
							&& arg.equals(a.arg);
				}
				return false;
			}

			@Override
			public String toString() {
				List<Pair<Sort, Term>> args = getAppArgs(this);
				String r = "(" + getAppFn(this);
				for (Pair<Sort, Term> p : args) {
					r = r + " " + p.second();
				}
				return r + ")";
			}
		}
	}

	// ================================================================================
	// Smart Constructors
	// ================================================================================

	public static Term mkConst(Constant c) {
		return new Term.Const(c);
	}

	public static Term mkNatVal(long n) {
		return new Term.Const(new Constant.NatVal(BigInteger.valueOf(n)));
	}

	public static Term mkStrVal(String s) {
		return new Term.Const(new Constant.StrVal(s));
	}

	/**
	 * Apply a unary constant to an argument. The argument sort is read off the
	 * constant's unique sort.
	 *
	 * @param c
	 * @param arg
	 * @return
	 */
	public static Term mkUnOp(Constant c, Term arg) {
		Sort[] argTys = Sort.getArgTys(c.sort());
		return new Term.App(argTys[0], new Term.Const(c), arg);
	}

	/**
	 * Apply a binary constant to two arguments. The argument sorts are read off
	 * the constant's unique sort.
	 *
	 * @param c
	 * @param lhs
	 * @param rhs
	 * @return
	 */
	public static Term mkBinOp(Constant c, Term lhs, Term rhs) {
		Sort[] argTys = Sort.getArgTys(c.sort());
		return new Term.App(argTys[1], new Term.App(argTys[0], new Term.Const(c), lhs), rhs);
	}

	public static Term mkNot(Term p) {
		return mkUnOp(Constant.PropOp.NOT, p);
	}

	public static Term mkAnd(Term lhs, Term rhs) {
		return mkBinOp(Constant.PropOp.AND, lhs, rhs);
	}

	public static Term mkOr(Term lhs, Term rhs) {
		return mkBinOp(Constant.PropOp.OR, lhs, rhs);
	}

	public static Term mkImp(Term lhs, Term rhs) {
		return mkBinOp(Constant.PropOp.IMP, lhs, rhs);
	}

	public static Term mkIff(Term lhs, Term rhs) {
		return mkBinOp(Constant.PropOp.IFF, lhs, rhs);
	}

	/**
	 * Construct the equality <code>lhs = rhs</code> at sort <code>s</code>.
	 *
	 * @param s
	 * @param lhs
	 * @param rhs
	 * @return
	 */
	public static Term mkEq(Sort s, Term lhs, Term rhs) {
		return mkEqOf(Constant.Logical.eq(s), s, lhs, rhs);
	}

	/**
	 * Construct an import-form equality, whose sort is held at a given index of
	 * the import table.
	 *
	 * @param n
	 * @param s
	 * @param lhs
	 * @param rhs
	 * @return
	 */
	public static Term mkEqI(int n, Sort s, Term lhs, Term rhs) {
		return mkEqOf(Constant.Logical.eqI(n), s, lhs, rhs);
	}

	private static Term mkEqOf(Constant.Logical eq, Sort s, Term lhs, Term rhs) {
		return new Term.App(s, new Term.App(s, new Term.Const(eq), lhs), rhs);
	}

	/**
	 * Construct the "bare" universal quantification of a predicate
	 * <code>p : s → prop</code>.
	 *
	 * @param s
	 * @param p
	 * @return
	 */
	public static Term mkForallE(Sort s, Term p) {
		return new Term.App(new Sort.Func(s, Sort.Prop), new Term.Const(Constant.Logical.forall(s)), p);
	}

	/**
	 * Construct the "binder-closed" universal quantification
	 * <code>∀x:s. body</code>.
	 *
	 * @param s
	 * @param body
	 * @return
	 */
	public static Term mkForallEF(Sort s, Term body) {
		return mkForallE(s, new Term.Lam(s, body));
	}

	public static Term mkForallEI(int n, Sort s, Term p) {
		return new Term.App(new Sort.Func(s, Sort.Prop), new Term.Const(Constant.Logical.forallI(n)), p);
	}

	public static Term mkForallEIF(int n, Sort s, Term body) {
		return mkForallEI(n, s, new Term.Lam(s, body));
	}

	/**
	 * Construct a chain of binder-closed universal quantifiers, with
	 * <code>sorts[0]</code> the outermost.
	 *
	 * @param sorts
	 * @param body
	 * @return
	 */
	public static Term mkForallEFN(Sort[] sorts, Term body) {
		for (int i = sorts.length - 1; i >= 0; --i) {
			body = mkForallEF(sorts[i], body);
		}
		return body;
	}

	public static Term mkExistE(Sort s, Term p) {
		return new Term.App(new Sort.Func(s, Sort.Prop), new Term.Const(Constant.Logical.exists(s)), p);
	}

	public static Term mkExistEF(Sort s, Term body) {
		return mkExistE(s, new Term.Lam(s, body));
	}

	public static Term mkExistEI(int n, Sort s, Term p) {
		return new Term.App(new Sort.Func(s, Sort.Prop), new Term.Const(Constant.Logical.existsI(n)), p);
	}

	public static Term mkExistEIF(int n, Sort s, Term body) {
		return mkExistEI(n, s, new Term.Lam(s, body));
	}

	/**
	 * Construct the conditional <code>if c then t else f</code> at sort
	 * <code>s</code>.
	 *
	 * @param s
	 * @param c
	 * @param t
	 * @param f
	 * @return
	 */
	public static Term mkIte(Sort s, Term c, Term t, Term f) {
		Term ite = new Term.Const(Constant.Logical.ite(s));
		return new Term.App(s, new Term.App(s, new Term.App(Sort.Prop, ite, c), t), f);
	}

	/**
	 * Construct a chain of abstractions, with <code>sorts[0]</code> the
	 * outermost binder.
	 *
	 * @param sorts
	 * @param body
	 * @return
	 */
	public static Term mkLamFN(Sort[] sorts, Term body) {
		for (int i = sorts.length - 1; i >= 0; --i) {
			body = new Term.Lam(sorts[i], body);
		}
		return body;
	}

	/**
	 * Apply a term to a sequence of arguments, each paired with its sort.
	 *
	 * @param fn
	 * @param args
	 * @return
	 */
	public static Term mkAppN(Term fn, List<Pair<Sort, Term>> args) {
		for (Pair<Sort, Term> arg : args) {
			fn = new Term.App(arg.first(), fn, arg.second());
		}
		return fn;
	}

	public static Term mkAppN(Term fn, Sort[] sorts, Term[] args) {
		if (sorts.length != args.length) {
			throw new IllegalArgumentException("mismatched argument sorts");
		}
		for (int i = 0; i != args.length; ++i) {
			fn = new Term.App(sorts[i], fn, args[i]);
		}
		return fn;
	}

	/**
	 * Apply a term to a run of bound variables
	 * <code>#(idx+n-1) ... #idx</code>, where <code>sorts[i]</code> is the sort
	 * of the <code>i</code>th argument. This is used to eta-expand a term under
	 * <code>n</code> fresh binders.
	 *
	 * @param t
	 * @param sorts
	 * @param idx
	 * @return
	 */
	public static Term bvarApps(Term t, Sort[] sorts, int idx) {
		final int n = sorts.length;
		for (int i = 0; i != n; ++i) {
			t = new Term.App(sorts[i], t, new Term.BVar(idx + n - 1 - i));
		}
		return t;
	}

	// ================================================================================
	// Decomposition
	// ================================================================================

	/**
	 * Get the head of a curried application.
	 *
	 * @param t
	 * @return
	 */
	public static Term getAppFn(Term t) {
		while (t instanceof Term.App) {
			t = ((Term.App) t).fn;
		}
		return t;
	}

	/**
	 * Get the arguments of a curried application, outermost application last.
	 *
	 * @param t
	 * @return
	 */
	public static List<Pair<Sort, Term>> getAppArgs(Term t) {
		ArrayList<Pair<Sort, Term>> args = new ArrayList<>();
		while (t instanceof Term.App) {
			Term.App a = (Term.App) t;
			args.add(new Pair<>(a.argSort, a.arg));
			t = a.fn;
		}
		Collections.reverse(args);
		return args;
	}

	/**
	 * Strip exactly <code>n</code> arguments off an application, returning what
	 * remains or <code>null</code> if there are fewer than <code>n</code>.
	 *
	 * @param n
	 * @param t
	 * @return
	 */
	public static Term getAppFnN(int n, Term t) {
		for (int i = 0; i != n; ++i) {
			if (!(t instanceof Term.App)) {
				return null;
			}
			t = ((Term.App) t).fn;
		}
		return t;
	}

	/**
	 * Get the last <code>n</code> arguments of an application, or
	 * <code>null</code> if there are fewer than <code>n</code>.
	 *
	 * @param n
	 * @param t
	 * @return
	 */
	public static List<Pair<Sort, Term>> getAppArgsN(int n, Term t) {
		ArrayList<Pair<Sort, Term>> args = new ArrayList<>();
		for (int i = 0; i != n; ++i) {
			if (!(t instanceof Term.App)) {
				return null;
			}
			Term.App a = (Term.App) t;
			args.add(new Pair<>(a.argSort, a.arg));
			t = a.fn;
		}
		Collections.reverse(args);
		return args;
	}

	/**
	 * Check whether a term is an application of a given constant to exactly
	 * <code>n</code> arguments, returning those arguments (or <code>null</code>).
	 *
	 * @param t
	 * @param n
	 * @param c
	 * @return
	 */
	public static Term[] asAppOf(Term t, int n, Constant c) {
		Term fn = getAppFnN(n, t);
		if (fn instanceof Term.Const && ((Term.Const) fn).constant.equals(c)) {
			List<Pair<Sort, Term>> args = getAppArgsN(n, t);
			Term[] ts = new Term[n];
			for (int i = 0; i != n; ++i) {
				ts[i] = args.get(i).second();
			}
			return ts;
		}
		return null;
	}

	/**
	 * Deconstruct an implication <code>lhs → rhs</code>, returning the operands
	 * (or <code>null</code>).
	 *
	 * @param t
	 * @return
	 */
	public static Term[] asImp(Term t) {
		return asAppOf(t, 2, Constant.PropOp.IMP);
	}

	/**
	 * Represents a deconstructed equality, or quantification.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Binary {
		private final Sort sort;
		private final Term lhs;
		private final Term rhs;

		public Binary(Sort sort, Term lhs, Term rhs) {
			this.sort = sort;
			this.lhs = lhs;
			this.rhs = rhs;
		}

		public Sort sort() {
			return sort;
		}

		public Term lhs() {
			return lhs;
		}

		public Term rhs() {
			return rhs;
		}
	}

	/**
	 * Deconstruct an equality (in either import or resolved form). The sort of
	 * the equality is taken from the annotation of its first argument.
	 *
	 * @param t
	 * @return
	 */
	public static Binary asEq(Term t) {
		Term fn = getAppFnN(2, t);
		if (isLogical(fn, Constant.Logical.Kind.EQ)) {
			Term.App outer = (Term.App) t;
			Term.App inner = (Term.App) outer.fn;
			return new Binary(inner.argSort, inner.arg, outer.arg);
		}
		return null;
	}

	/**
	 * Represents a deconstructed quantification <code>Q s p</code>.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Quantifier {
		private final Sort sort;
		private final Term predicate;

		public Quantifier(Sort sort, Term predicate) {
			this.sort = sort;
			this.predicate = predicate;
		}

		/**
		 * The sort being quantified over.
		 *
		 * @return
		 */
		public Sort sort() {
			return sort;
		}

		public Term predicate() {
			return predicate;
		}

		/**
		 * Get the body of the quantifier if it is in binder-closed form (i.e. the
		 * predicate is an abstraction over the quantified sort), otherwise
		 * <code>null</code>.
		 *
		 * @return
		 */
		public Term body() {
			if (predicate instanceof Term.Lam) {
				Term.Lam l = (Term.Lam) predicate;
				if (l.binder.equals(sort)) {
					return l.body;
				}
			}
			return null;
		}
	}

	public static Quantifier asForall(Term t) {
		return asQuantifier(t, Constant.Logical.Kind.FORALL);
	}

	public static Quantifier asExists(Term t) {
		return asQuantifier(t, Constant.Logical.Kind.EXISTS);
	}

	private static Quantifier asQuantifier(Term t, Constant.Logical.Kind kind) {
		if (t instanceof Term.App) {
			Term.App a = (Term.App) t;
			if (isLogical(a.fn, kind) && a.argSort instanceof Sort.Func) {
				return new Quantifier(((Sort.Func) a.argSort).domain(), a.arg);
			}
		}
		return null;
	}

	private static boolean isLogical(Term t, Constant.Logical.Kind kind) {
		if (t instanceof Term.Const) {
			Constant c = ((Term.Const) t).constant;
			return c instanceof Constant.Logical && ((Constant.Logical) c).kind() == kind;
		}
		return false;
	}

	/**
	 * Construct a string representation of a typing context, innermost binder
	 * first.
	 *
	 * @param ctx
	 * @return
	 */
	public static String toString(Sort[] ctx) {
		return Arrays.toString(ctx);
	}
}
