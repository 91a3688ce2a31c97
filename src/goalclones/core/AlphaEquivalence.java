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
package goalclones.core;

import static goalclones.core.Syntax.*;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import goalclones.core.Syntax.CaseClause;
import goalclones.core.Syntax.Term;
import goalclones.core.Syntax.Term.Variable;

/**
 * Decides whether two terms are the same up to a consistent renaming of their
 * bound variables. This is the predicate used to identify goal clones.
 *
 * <p>
 * Bound variables are given canonical names by first sorting each side's bound
 * variables by name, and then pairing them positionally with a shared sequence
 * of synthesized variables (see {@link Syntax#synthesized(int)}). After
 * renaming, the two sides are compared with structural equality. Sorting makes
 * the comparison independent of the order in which binders were written, but
 * this is not a complete test of alpha-equivalence under every permutation of
 * binders.
 * </p>
 *
 * @author David J. Pearce
 *
 */
public class AlphaEquivalence {

	/**
	 * Check whether two terms are alpha-equivalent.
	 *
	 * @param lhs
	 * @param rhs
	 * @return
	 */
	public static boolean equivalent(Term lhs, Term rhs) {
		if (lhs.getOpcode() != rhs.getOpcode()) {
			return false;
		}
		switch (lhs.getOpcode()) {
		case TERM_variable:
		case TERM_sort:
			return lhs.equals(rhs);
		case TERM_application:
			return equivalent((Term.Application) lhs, (Term.Application) rhs);
		case TERM_cast:
			return equivalent((Term.Cast) lhs, (Term.Cast) rhs);
		case TERM_function:
		case TERM_product:
			return equivalent((Term.Abstraction) lhs, (Term.Abstraction) rhs);
		case TERM_let:
			return equivalent((Term.Let) lhs, (Term.Let) rhs);
		case TERM_fixpoint:
			return equivalent((Term.Fixpoint) lhs, (Term.Fixpoint) rhs);
		case TERM_conditional:
			return equivalent((Term.Conditional) lhs, (Term.Conditional) rhs);
		case TERM_match:
			return equivalent((Term.Match) lhs, (Term.Match) rhs);
		}
		throw new IllegalArgumentException("Invalid term encountered: " + lhs);
	}

	private static boolean equivalent(Term.Application lhs, Term.Application rhs) {
		return equivalent(lhs.function(), rhs.function()) && equivalent(lhs.argument(), rhs.argument());
	}

	private static boolean equivalent(Term.Cast lhs, Term.Cast rhs) {
		return equivalent(lhs.term(), rhs.term()) && equivalent(lhs.type(), rhs.type());
	}

	private static boolean equivalent(Term.Abstraction lhs, Term.Abstraction rhs) {
		if (!equivalent(lhs.type(), rhs.type())) {
			return false;
		} else if (lhs.variable().equals(rhs.variable())) {
			// Nothing to rename
			return equivalent(lhs.body(), rhs.body());
		} else {
			Variable v = synthesized(0);
			return rename(lhs.body(), lhs.variable(), v).equals(rename(rhs.body(), rhs.variable(), v));
		}
	}

	private static boolean equivalent(Term.Let lhs, Term.Let rhs) {
		return equivalent((Term.Abstraction) lhs, (Term.Abstraction) rhs)
				&& equivalent(lhs.definition(), rhs.definition());
	}

	private static boolean equivalent(Term.Fixpoint lhs, Term.Fixpoint rhs) {
		final int n = lhs.parameters().size();
		if (n != rhs.parameters().size()) {
			return false;
		}
		for (int i = 0; i != n; ++i) {
			if (!equivalent(lhs.parameters().get(i).type(), rhs.parameters().get(i).type())) {
				return false;
			}
		}
		if (!equivalent(lhs.returnType(), rhs.returnType())) {
			return false;
		}
		List<Variable> lbvs = boundVariables(lhs);
		List<Variable> rbvs = boundVariables(rhs);
		if (lbvs.size() != rbvs.size()) {
			return false;
		}
		return canonicalise(lhs.body(), lbvs).equals(canonicalise(rhs.body(), rbvs));
	}

	private static boolean equivalent(Term.Conditional lhs, Term.Conditional rhs) {
		if (!lhs.guard().equals(rhs.guard())) {
			return false;
		} else if (!equivalent(lhs.trueBranch(), rhs.trueBranch())
				|| !equivalent(lhs.falseBranch(), rhs.falseBranch())) {
			return false;
		} else if (lhs.hasAlias() != rhs.hasAlias() || lhs.hasReturnType() != rhs.hasReturnType()) {
			return false;
		} else if (!lhs.hasReturnType()) {
			return true;
		}
		Term l = lhs.returnType();
		Term r = rhs.returnType();
		if (lhs.hasAlias()) {
			Variable v = synthesized(0);
			l = rename(l, lhs.alias(), v);
			r = rename(r, rhs.alias(), v);
		}
		return l.equals(r);
	}

	private static boolean equivalent(Term.Match lhs, Term.Match rhs) {
		// NOTE: only the number of subjects matters here. Their terms are not
		// compared, and their aliases and patterns only matter for the return type.
		if (lhs.subjects().size() != rhs.subjects().size()) {
			return false;
		} else if (!sameElements(canonicalise(lhs.cases()), canonicalise(rhs.cases()))) {
			return false;
		} else if (lhs.hasReturnType() != rhs.hasReturnType()) {
			return false;
		} else if (!lhs.hasReturnType()) {
			return true;
		}
		List<Variable> lbvs = lhs.boundVariables();
		List<Variable> rbvs = rhs.boundVariables();
		if (lbvs.size() != rbvs.size()) {
			return false;
		}
		return canonicalise(lhs.returnType(), lbvs).equals(canonicalise(rhs.returnType(), rbvs));
	}

	/**
	 * Rename a bound variable within a term. A wildcard binds nothing (e.g. in
	 * <code>A -> B</code>), hence there is nothing to rename.
	 *
	 * @param term
	 * @param bound
	 * @param v
	 * @return
	 */
	private static Term rename(Term term, Variable bound, Variable v) {
		return bound.isWildcard() ? term : Substitution.apply(term, bound, v);
	}

	/**
	 * Get the variables bound by a fixpoint over its body: its name followed by
	 * every non-wildcard parameter.
	 *
	 * @param term
	 * @return
	 */
	private static List<Variable> boundVariables(Term.Fixpoint term) {
		ArrayList<Variable> bvs = new ArrayList<>();
		bvs.add(term.name());
		for (Variable p : term.parameterNames()) {
			if (!p.isWildcard()) {
				bvs.add(p);
			}
		}
		return bvs;
	}

	/**
	 * Rename a given list of bound variables within a term, such that the
	 * <code>i</code>th variable (in order of name) becomes the <code>i</code>th
	 * synthesized variable.
	 *
	 * @param term
	 * @param bound
	 * @return
	 */
	private static Term canonicalise(Term term, List<Variable> bound) {
		ArrayList<Variable> sorted = new ArrayList<>(bound);
		sorted.sort(Comparator.comparing(Variable::name));
		for (int i = 0; i != sorted.size(); ++i) {
			term = Substitution.apply(term, sorted.get(i), synthesized(i));
		}
		return term;
	}

	private static List<Canonical> canonicalise(List<CaseClause> cases) {
		ArrayList<Canonical> r = new ArrayList<>();
		for (CaseClause c : cases) {
			List<Variable> bvs = c.boundVariables();
			r.add(new Canonical(c.heads(), bvs.size(), canonicalise(c.body(), bvs)));
		}
		return r;
	}

	/**
	 * A case clause whose bound variables have been given canonical names. Two
	 * clauses are equivalent when their canonical forms are equal.
	 *
	 * @author David J. Pearce
	 *
	 */
	private static class Canonical {
		private final List<Variable> heads;
		private final int bound;
		private final Term body;

		public Canonical(List<Variable> heads, int bound, Term body) {
			this.heads = heads;
			this.bound = bound;
			this.body = body;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Canonical) {
				Canonical c = (Canonical) o;
				return bound == c.bound && heads.equals(c.heads) && body.equals(c.body);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return heads.hashCode() ^ bound ^ body.hashCode();
		}
	}
}
