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

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import goalclones.core.Syntax.Binder;
import goalclones.core.Syntax.CaseClause;
import goalclones.core.Syntax.MatchSubject;
import goalclones.core.Syntax.Term;
import goalclones.core.Syntax.Term.Variable;
import goalclones.util.AbstractVisitor;

/**
 * Computes the set of variables occurring unbound in a term. The wildcard
 * <code>_</code> is never considered free.
 *
 * @author David J. Pearce
 *
 */
public class FreeVariables extends AbstractVisitor<Set<Variable>> {

	/**
	 * Determine the free variables of a given term.
	 *
	 * @param term
	 * @return
	 */
	public static Set<Variable> of(Term term) {
		return new FreeVariables().apply(term);
	}

	@Override
	public Set<Variable> apply(Term.Variable term) {
		HashSet<Variable> fvs = new HashSet<>();
		if (!term.isWildcard()) {
			fvs.add(term);
		}
		return fvs;
	}

	@Override
	public Set<Variable> apply(Term.Sort term) {
		return new HashSet<>();
	}

	@Override
	public Set<Variable> apply(Term.Application term) {
		Set<Variable> fvs = apply(term.function());
		fvs.addAll(apply(term.argument()));
		return fvs;
	}

	@Override
	public Set<Variable> apply(Term.Cast term) {
		Set<Variable> fvs = apply(term.term());
		fvs.addAll(apply(term.type()));
		return fvs;
	}

	@Override
	public Set<Variable> apply(Term.Function term) {
		return apply((Term.Abstraction) term);
	}

	@Override
	public Set<Variable> apply(Term.Product term) {
		return apply((Term.Abstraction) term);
	}

	@Override
	public Set<Variable> apply(Term.Let term) {
		Set<Variable> fvs = apply((Term.Abstraction) term);
		fvs.addAll(apply(term.definition()));
		return fvs;
	}

	private Set<Variable> apply(Term.Abstraction term) {
		Set<Variable> fvs = apply(term.body());
		fvs.remove(term.variable());
		// NOTE: the type is evaluated in the outer scope
		fvs.addAll(apply(term.type()));
		return fvs;
	}

	@Override
	public Set<Variable> apply(Term.Fixpoint term) {
		List<Variable> parameters = term.parameterNames();
		// Parameter types may refer to other parameters, but not to the fixpoint
		// itself.
		HashSet<Variable> types = new HashSet<>();
		for (Binder p : term.parameters()) {
			types.addAll(apply(p.type()));
		}
		types.removeAll(parameters);
		//
		Set<Variable> fvs = apply(term.returnType());
		fvs.addAll(apply(term.body()));
		fvs.remove(term.name());
		fvs.removeAll(parameters);
		fvs.addAll(types);
		return fvs;
	}

	@Override
	public Set<Variable> apply(Term.Conditional term) {
		HashSet<Variable> fvs = new HashSet<>();
		if (term.hasReturnType()) {
			fvs.addAll(apply(term.returnType()));
			if (term.hasAlias()) {
				fvs.remove(term.alias());
			}
		}
		fvs.addAll(apply(term.guard()));
		fvs.addAll(apply(term.trueBranch()));
		fvs.addAll(apply(term.falseBranch()));
		return fvs;
	}

	@Override
	public Set<Variable> apply(Term.Match term) {
		HashSet<Variable> fvs = new HashSet<>();
		if (term.hasReturnType()) {
			fvs.addAll(apply(term.returnType()));
			fvs.removeAll(term.boundVariables());
		}
		for (MatchSubject s : term.subjects()) {
			fvs.addAll(apply(s.term()));
			// The head of an "in" pattern names the inductive family being matched.
			if (s.hasPattern() && !s.pattern().head().isWildcard()) {
				fvs.add(s.pattern().head());
			}
		}
		for (CaseClause c : term.cases()) {
			Set<Variable> body = apply(c.body());
			body.removeAll(c.boundVariables());
			fvs.addAll(body);
		}
		return fvs;
	}
}
