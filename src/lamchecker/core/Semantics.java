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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;
import java.util.function.Function;
import java.util.function.Predicate;

import lamchecker.core.Syntax.Sort;
import lamchecker.core.Syntax.Term;
import lamchecker.util.AbstractTransformer;
import lamchecker.util.ArrayUtils;
import lamchecker.util.CheckError;

/**
 * Encodes the denotational semantics of the term calculus. A well-typed,
 * fully resolved term is mapped to a value in the semantic domain of its sort,
 * given a valuation and a frame of values for its loose bound variables (where
 * <code>frame[i]</code> is the value of <code>#i</code>).
 *
 * <ul>
 * <li><code>prop</code> and <code>bool</code> denote {@link Boolean}.</li>
 * <li><code>nat</code> and <code>int</code> denote {@link BigInteger}.</li>
 * <li><code>string</code> denotes {@link String}.</li>
 * <li><code>real</code> denotes {@link BigDecimal}.</li>
 * <li><code>bv n</code> denotes {@link BitVec} of width <code>n</code>.</li>
 * <li>Function sorts denote {@link Function}.</li>
 * <li>Sort atoms denote whatever the valuation supplies.</li>
 * </ul>
 *
 * @author David J. Pearce
 *
 */
public class Semantics extends AbstractTransformer<Object[], Object> {
	public final static String UNRESOLVED_IMPORT = "cannot interpret import-form primitive";

	private final Valuation valuation;

	public Semantics(Valuation valuation) {
		this.valuation = valuation;
	}

	/**
	 * Interpret a closed term.
	 *
	 * @param t
	 * @return
	 */
	public Object interpret(Term t) {
		return apply(new Object[0], t);
	}

	/**
	 * Interpret a term under a given frame of values for its loose bound
	 * variables.
	 *
	 * @param frame
	 * @param t
	 * @return
	 */
	public Object interpret(Object[] frame, Term t) {
		return apply(frame, t);
	}

	/**
	 * Determine whether a proposition holds for every assignment of values to
	 * the given context, drawing values from the interpretation bundle of each
	 * context sort.
	 *
	 * @param ctx
	 * @param t
	 * @return
	 */
	public boolean holds(Sort[] ctx, Term t) {
		return holds(ctx, t, new Object[ctx.length], ctx.length - 1);
	}

	private boolean holds(Sort[] ctx, Term t, Object[] frame, int i) {
		if (i < 0) {
			return (Boolean) apply(frame.clone(), t);
		}
		return valuation.interp(ctx[i]).forall(x -> {
			frame[i] = x;
			return holds(ctx, t, frame, i - 1);
		});
	}

	@Override
	public Object apply(Object[] frame, Term.Atom t) {
		return valuation.atom(t.index());
	}

	@Override
	public Object apply(Object[] frame, Term.Etom t) {
		return valuation.etom(t.index());
	}

	@Override
	public Object apply(Object[] frame, Term.BVar t) {
		return frame[t.index()];
	}

	@Override
	public Object apply(Object[] frame, Term.Lam t) {
		Function<Object, Object> f = v -> apply(ArrayUtils.prepend(v, frame), t.body());
		return f;
	}

	@Override
	public Object apply(Object[] frame, Term.App t) {
		Function<Object, Object> fn = function(apply(frame, t.fn()));
		return fn.apply(apply(frame, t.arg()));
	}

	@Override
	public Object apply(Object[] frame, Term.Const t) {
		Constant c = t.constant();
		switch (c.family()) {
		case Constant.FAMILY_prop:
			return denote((Constant.PropOp) c);
		case Constant.FAMILY_bool:
			return denote((Constant.BoolOp) c);
		case Constant.FAMILY_nat:
			if (c instanceof Constant.NatVal) {
				return ((Constant.NatVal) c).value();
			}
			return denote((Constant.NatOp) c);
		case Constant.FAMILY_int:
			return denote((Constant.IntOp) c);
		case Constant.FAMILY_string:
			if (c instanceof Constant.StrVal) {
				return ((Constant.StrVal) c).value();
			}
			return denote((Constant.StringOp) c);
		case Constant.FAMILY_logical:
			return denote((Constant.Logical) c, t);
		}
		throw new IllegalArgumentException("Invalid constant encountered: " + c);
	}

	// ================================================================================
	// Constant Families
	// ================================================================================

	private static Object denote(Constant.PropOp c) {
		switch (c) {
		case TRUE:
			return Boolean.TRUE;
		case FALSE:
			return Boolean.FALSE;
		case NOT:
			return unary((Boolean b) -> !b);
		case AND:
			return binary((Boolean a, Boolean b) -> a && b);
		case OR:
			return binary((Boolean a, Boolean b) -> a || b);
		case IMP:
			return binary((Boolean a, Boolean b) -> !a || b);
		default:
			return binary((Boolean a, Boolean b) -> a.equals(b));
		}
	}

	private static Object denote(Constant.BoolOp c) {
		switch (c) {
		case TRUE:
			return Boolean.TRUE;
		case FALSE:
			return Boolean.FALSE;
		case NOT:
			return unary((Boolean b) -> !b);
		case AND:
			return binary((Boolean a, Boolean b) -> a && b);
		case OR:
			return binary((Boolean a, Boolean b) -> a || b);
		default:
			// Propositions are decided classically
			return unary((Boolean b) -> b);
		}
	}

	private static Object denote(Constant.NatOp c) {
		switch (c) {
		case SUCC:
			return unary((BigInteger n) -> n.add(BigInteger.ONE));
		case ADD:
			return binary((BigInteger a, BigInteger b) -> a.add(b));
		case SUB:
			return binary((BigInteger a, BigInteger b) -> a.subtract(b).max(BigInteger.ZERO));
		case MUL:
			return binary((BigInteger a, BigInteger b) -> a.multiply(b));
		case DIV:
			return binary((BigInteger a, BigInteger b) -> b.signum() == 0 ? BigInteger.ZERO : a.divide(b));
		case MOD:
			return binary((BigInteger a, BigInteger b) -> b.signum() == 0 ? a : a.mod(b));
		case MAX:
			return binary((BigInteger a, BigInteger b) -> a.max(b));
		case MIN:
			return binary((BigInteger a, BigInteger b) -> a.min(b));
		case LE:
			return binary((BigInteger a, BigInteger b) -> a.compareTo(b) <= 0);
		default:
			return binary((BigInteger a, BigInteger b) -> a.compareTo(b) < 0);
		}
	}

	private static Object denote(Constant.IntOp c) {
		switch (c) {
		case OF_NAT:
			return unary((BigInteger n) -> n);
		case NEG_SUCC:
			return unary((BigInteger n) -> n.add(BigInteger.ONE).negate());
		case NEG:
			return unary((BigInteger i) -> i.negate());
		case ABS:
			return unary((BigInteger i) -> i.abs());
		case ADD:
			return binary((BigInteger a, BigInteger b) -> a.add(b));
		case SUB:
			return binary((BigInteger a, BigInteger b) -> a.subtract(b));
		case MUL:
			return binary((BigInteger a, BigInteger b) -> a.multiply(b));
		case DIV:
			// Rounds toward zero
			return binary((BigInteger a, BigInteger b) -> b.signum() == 0 ? BigInteger.ZERO : a.divide(b));
		case MOD:
			return binary((BigInteger a, BigInteger b) -> b.signum() == 0 ? a : a.remainder(b));
		case EDIV:
			return binary((BigInteger a, BigInteger b) -> b.signum() == 0 ? BigInteger.ZERO
					: a.subtract(a.mod(b.abs())).divide(b));
		case EMOD:
			return binary((BigInteger a, BigInteger b) -> b.signum() == 0 ? a : a.mod(b.abs()));
		case MAX:
			return binary((BigInteger a, BigInteger b) -> a.max(b));
		case MIN:
			return binary((BigInteger a, BigInteger b) -> a.min(b));
		case LE:
			return binary((BigInteger a, BigInteger b) -> a.compareTo(b) <= 0);
		default:
			return binary((BigInteger a, BigInteger b) -> a.compareTo(b) < 0);
		}
	}

	private static Object denote(Constant.StringOp c) {
		switch (c) {
		case LENGTH:
			return unary((String s) -> BigInteger.valueOf(s.codePointCount(0, s.length())));
		case APPEND:
			return binary((String a, String b) -> a + b);
		case LE:
			return binary((String a, String b) -> compareCodePoints(a, b) <= 0);
		case LT:
			return binary((String a, String b) -> compareCodePoints(a, b) < 0);
		case PREFIX_OF:
			return binary((String a, String b) -> b.startsWith(a));
		default:
			return unary((String s) -> binary((String p, String r) -> p.isEmpty() ? s : s.replace(p, r)));
		}
	}

	private Object denote(Constant.Logical c, Term t) {
		if (c.isImport()) {
			throw new CheckError(CheckError.Kind.UNRESOLVED_IMPORT, UNRESOLVED_IMPORT, t);
		}
		SortInterp interp = c.kind() == Constant.Logical.Kind.ITE ? null : valuation.interp(c.instance());
		switch (c.kind()) {
		case EQ:
			return binary((Object a, Object b) -> interp.eq(a, b));
		case FORALL:
			return unary((Object p) -> interp.forall(x -> (Boolean) function(p).apply(x)));
		case EXISTS:
			return unary((Object p) -> interp.exists(x -> (Boolean) function(p).apply(x)));
		default:
			return unary((Boolean b) -> binary((Object x, Object y) -> b ? x : y));
		}
	}

	@SuppressWarnings("unchecked")
	private static Function<Object, Object> function(Object o) {
		return (Function<Object, Object>) o;
	}

	@SuppressWarnings("unchecked")
	private static <A> Function<Object, Object> unary(Function<A, ?> f) {
		return x -> f.apply((A) x);
	}

	@SuppressWarnings("unchecked")
	private static <A, B> Function<Object, Object> binary(BiFunction<A, B, ?> f) {
		return x -> (Function<Object, Object>) y -> f.apply((A) x, (B) y);
	}

	/**
	 * Lexicographic order over code points, consistent with string length
	 * being measured in code points.
	 */
	private static int compareCodePoints(String a, String b) {
		int[] xs = a.codePoints().toArray();
		int[] ys = b.codePoints().toArray();
		int n = Math.min(xs.length, ys.length);
		for (int i = 0; i != n; ++i) {
			int c = Integer.compare(xs[i], ys[i]);
			if (c != 0) {
				return c;
			}
		}
		return Integer.compare(xs.length, ys.length);
	}

	// ================================================================================
	// Semantic Domains
	// ================================================================================

	/**
	 * Check whether a given value lies in the semantic domain of a given sort.
	 * Values of sort atoms and function sorts are only checked superficially.
	 *
	 * @param s
	 * @param v
	 * @return
	 */
	public static boolean inDomain(Sort s, Object v) {
		if (s instanceof Sort.Func) {
			return v instanceof Function;
		} else if (s instanceof Sort.Atom) {
			return v != null;
		}
		Sort.Base b = (Sort.Base) s;
		switch (b.kind()) {
		case PROP:
		case BOOL:
			return v instanceof Boolean;
		case NAT:
			return v instanceof BigInteger && ((BigInteger) v).signum() >= 0;
		case INT:
			return v instanceof BigInteger;
		case STRING:
			return v instanceof String;
		case REAL:
			return v instanceof BigDecimal;
		default:
			return v instanceof BitVec && ((BitVec) v).width() == b.width();
		}
	}

	/**
	 * Check that a valuation assigns a value of the right domain to every term
	 * atom of a signature.
	 *
	 * @param signature
	 * @return
	 */
	public boolean conforms(Signature signature) {
		for (int i = 0; i != valuation.atomCount(); ++i) {
			Sort s = signature.atomSort(i);
			if (s == null || !inDomain(s, valuation.atom(i))) {
				return false;
			}
		}
		for (int i = 0; i != valuation.etomCount(); ++i) {
			Sort s = signature.etomSort(i);
			if (s == null || !inDomain(s, valuation.etom(i))) {
				return false;
			}
		}
		return true;
	}

	/**
	 * The capability bundle for a sort which is compared or quantified over:
	 * equality, universal and existential quantification over the sort's
	 * representation. One bundle is supplied per distinct sort.
	 *
	 * @author David J. Pearce
	 *
	 */
	public interface SortInterp {
		public boolean eq(Object lhs, Object rhs);

		public boolean forall(Predicate<Object> p);

		public boolean exists(Predicate<Object> p);
	}

	/**
	 * An interpretation bundle over an explicitly enumerated carrier.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Finite implements SortInterp {
		private final Object[] carrier;
		private final BiPredicate<Object, Object> equality;

		public Finite(Object... carrier) {
			this(Objects::equals, carrier);
		}

		public Finite(BiPredicate<Object, Object> equality, Object... carrier) {
			this.carrier = carrier;
			this.equality = equality;
		}

		@Override
		public boolean eq(Object lhs, Object rhs) {
			return equality.test(lhs, rhs);
		}

		@Override
		public boolean forall(Predicate<Object> p) {
			for (Object v : carrier) {
				if (!p.test(v)) {
					return false;
				}
			}
			return true;
		}

		@Override
		public boolean exists(Predicate<Object> p) {
			for (Object v : carrier) {
				if (p.test(v)) {
					return true;
				}
			}
			return false;
		}
	}

	/**
	 * A fixed-width bit-vector value. The width invariant is established at
	 * construction.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class BitVec {
		private final int width;
		private final BigInteger value;

		public BitVec(int width, BigInteger value) {
			if (width < 0 || value.signum() < 0 || value.bitLength() > width) {
				throw new IllegalArgumentException("value " + value + " does not fit in " + width + " bits");
			}
			this.width = width;
			this.value = value;
		}

		public int width() {
			return width;
		}

		public BigInteger value() {
			return value;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof BitVec) {
				BitVec b = (BitVec) o;
				return width == b.width && value.equals(b.value);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return width ^ value.hashCode();
		}

		@Override
		public String toString() {
			return value + "#" + width;
		}
	}
}
