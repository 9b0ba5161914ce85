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
package lamchecker.util;

import lamchecker.core.Syntax;
import lamchecker.core.Syntax.Term;

/**
 * Provides a single point of dispatch over the syntactic forms of a term. A
 * transformer threads some state (e.g. a typing context, or a frame of
 * concrete values) through the term and produces a result for it.
 *
 * @author David J. Pearce
 *
 * @param <T> The state passed down through the term
 * @param <S> The result produced for each term
 */
public abstract class AbstractTransformer<T, S> {

	public S apply(T state, Term term) {
		switch (term.getOpcode()) {
		case Syntax.TERM_atom:
			return apply(state, (Term.Atom) term);
		case Syntax.TERM_etom:
			return apply(state, (Term.Etom) term);
		case Syntax.TERM_const:
			return apply(state, (Term.Const) term);
		case Syntax.TERM_bvar:
			return apply(state, (Term.BVar) term);
		case Syntax.TERM_lam:
			return apply(state, (Term.Lam) term);
		case Syntax.TERM_app:
			return apply(state, (Term.App) term);
		}
		// Give up
		throw new IllegalArgumentException("Invalid term encountered: " + term);
	}

	/**
	 * Apply this transformer to a given term atom.
	 *
	 * @param state The current state (e.g. typing context or value frame)
	 * @param term  The term being transformed.
	 * @return
	 */
	public abstract S apply(T state, Term.Atom term);

	/**
	 * Apply this transformer to a given existential atom.
	 *
	 * @param state The current state (e.g. typing context or value frame)
	 * @param term  The term being transformed.
	 * @return
	 */
	public abstract S apply(T state, Term.Etom term);

	/**
	 * Apply this transformer to a given base constant.
	 *
	 * @param state The current state (e.g. typing context or value frame)
	 * @param term  The term being transformed.
	 * @return
	 */
	public abstract S apply(T state, Term.Const term);

	/**
	 * Apply this transformer to a given bound variable.
	 *
	 * @param state The current state (e.g. typing context or value frame)
	 * @param term  The term being transformed.
	 * @return
	 */
	public abstract S apply(T state, Term.BVar term);

	/**
	 * Apply this transformer to a given abstraction.
	 *
	 * @param state The current state (e.g. typing context or value frame)
	 * @param term  The term being transformed.
	 * @return
	 */
	public abstract S apply(T state, Term.Lam term);

	/**
	 * Apply this transformer to a given application.
	 *
	 * @param state The current state (e.g. typing context or value frame)
	 * @param term  The term being transformed.
	 * @return
	 */
	public abstract S apply(T state, Term.App term);
}
