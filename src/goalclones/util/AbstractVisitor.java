// This file is part of the Goal Clones tool (goalclones).
//
// The Goal Clones tool is free software; you can redistribute
// it and/or modify it under the terms of the GNU General Public
// License as published by the Free Software Foundation; either
// version 3 of the License, or (at your option) any later version.
//
// The Goal Clones tool is distributed in the hope that it
// will be useful, but WITHOUT ANY WARRANTY; without even the
// implied warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR
// PURPOSE. See the GNU General Public License for more details.
//
// You should have received a copy of the GNU General Public
// License along with the Goal Clones tool. If not, see
// <http://www.gnu.org/licenses/>
//
// Copyright 2018, David James Pearce.
package goalclones.util;

import goalclones.core.Syntax;
import goalclones.core.Syntax.Term;

/**
 * Dispatches over the closed set of term forms. Every concrete visitor must
 * provide a case for each form, hence adding a new form forces every visitor
 * to be revisited.
 *
 * @author David J. Pearce
 *
 * @param <T> The result of visiting a term.
 */
public abstract class AbstractVisitor<T> {

	public T apply(Term term) {
		switch (term.getOpcode()) {
		case Syntax.TERM_variable:
			return apply((Term.Variable) term);
		case Syntax.TERM_sort:
			return apply((Term.Sort) term);
		case Syntax.TERM_application:
			return apply((Term.Application) term);
		case Syntax.TERM_cast:
			return apply((Term.Cast) term);
		case Syntax.TERM_function:
			return apply((Term.Function) term);
		case Syntax.TERM_product:
			return apply((Term.Product) term);
		case Syntax.TERM_let:
			return apply((Term.Let) term);
		case Syntax.TERM_fixpoint:
			return apply((Term.Fixpoint) term);
		case Syntax.TERM_conditional:
			return apply((Term.Conditional) term);
		case Syntax.TERM_match:
			return apply((Term.Match) term);
		}
		// Give up
		throw new IllegalArgumentException("Invalid term encountered: " + term);
	}

	/**
	 * Apply this visitor to a given variable.
	 *
	 * @param term The term being visited.
	 * @return
	 */
	public abstract T apply(Term.Variable term);

	/**
	 * Apply this visitor to a given sort.
	 *
	 * @param term The term being visited.
	 * @return
	 */
	public abstract T apply(Term.Sort term);

	/**
	 * Apply this visitor to a given application.
	 *
	 * @param term The term being visited.
	 * @return
	 */
	public abstract T apply(Term.Application term);

	/**
	 * Apply this visitor to a given cast.
	 *
	 * @param term The term being visited.
	 * @return
	 */
	public abstract T apply(Term.Cast term);

	/**
	 * Apply this visitor to a given function abstraction.
	 *
	 * @param term The term being visited.
	 * @return
	 */
	public abstract T apply(Term.Function term);

	/**
	 * Apply this visitor to a given dependent product.
	 *
	 * @param term The term being visited.
	 * @return
	 */
	public abstract T apply(Term.Product term);

	/**
	 * Apply this visitor to a given local definition.
	 *
	 * @param term The term being visited.
	 * @return
	 */
	public abstract T apply(Term.Let term);

	/**
	 * Apply this visitor to a given fixpoint.
	 *
	 * @param term The term being visited.
	 * @return
	 */
	public abstract T apply(Term.Fixpoint term);

	/**
	 * Apply this visitor to a given conditional.
	 *
	 * @param term The term being visited.
	 * @return
	 */
	public abstract T apply(Term.Conditional term);

	/**
	 * Apply this visitor to a given pattern match.
	 *
	 * @param term The term being visited.
	 * @return
	 */
	public abstract T apply(Term.Match term);
}
