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

import java.util.ArrayList;
import java.util.List;

import goalclones.core.Syntax.Binder;
import goalclones.core.Syntax.CaseClause;
import goalclones.core.Syntax.MatchSubject;
import goalclones.core.Syntax.Pattern;
import goalclones.core.Syntax.Term;
import goalclones.core.Syntax.Term.Variable;
import goalclones.util.AbstractVisitor;

/**
 * Replaces every free occurrence of one variable with another. Substitution
 * does not descend into any scope which rebinds the variable being replaced,
 * but parts of a binding construct evaluated in the outer scope (e.g. the
 * declared type of an abstraction) are still rewritten. Terms are never
 * modified; instead, a new term is returned which shares every subterm left
 * untouched.
 *
 * @author David J. Pearce
 *
 */
public class Substitution extends AbstractVisitor<Term> {
	/**
	 * The variable being replaced.
	 */
	private final Variable from;
	/**
	 * The variable replacing it.
	 */
	private final Variable to;

	public Substitution(Variable from, Variable to) {
		this.from = from;
		this.to = to;
	}

	/**
	 * Replace all free occurrences of <code>from</code> in a given term with
	 * <code>to</code>.
	 *
	 * @param term
	 * @param from
	 * @param to
	 * @return
	 */
	public static Term apply(Term term, Variable from, Variable to) {
		return new Substitution(from, to).apply(term);
	}

	@Override
	public Term apply(Term.Variable term) {
		return term.equals(from) ? to : term;
	}

	@Override
	public Term apply(Term.Sort term) {
		return term;
	}

	@Override
	public Term apply(Term.Application term) {
		Term function = apply(term.function());
		Term argument = apply(term.argument());
		if (function == term.function() && argument == term.argument()) {
			return term;
		}
		return new Term.Application(function, argument, term.attributes());
	}

	@Override
	public Term apply(Term.Cast term) {
		Term t = apply(term.term());
		Term type = apply(term.type());
		if (t == term.term() && type == term.type()) {
			return term;
		}
		return new Term.Cast(t, type, term.attributes());
	}

	@Override
	public Term apply(Term.Function term) {
		Term type = apply(term.type());
		Term body = term.variable().equals(from) ? term.body() : apply(term.body());
		if (type == term.type() && body == term.body()) {
			return term;
		}
		return new Term.Function(term.variable(), type, body, term.attributes());
	}

	@Override
	public Term apply(Term.Product term) {
		Term type = apply(term.type());
		Term body = term.variable().equals(from) ? term.body() : apply(term.body());
		if (type == term.type() && body == term.body()) {
			return term;
		}
		return new Term.Product(term.variable(), type, body, term.attributes());
	}

	@Override
	public Term apply(Term.Let term) {
		Term type = apply(term.type());
		Term definition = apply(term.definition());
		Term body = term.variable().equals(from) ? term.body() : apply(term.body());
		if (type == term.type() && definition == term.definition() && body == term.body()) {
			return term;
		}
		return new Term.Let(term.variable(), type, definition, body, term.attributes());
	}

	@Override
	public Term apply(Term.Fixpoint term) {
		// NOTE: the name and all parameters are in scope across every parameter
		// type, the return type and the body. Hence, if any of them rebinds the
		// variable, nothing is rewritten.
		if (term.name().equals(from) || term.parameterNames().contains(from)) {
			return term;
		}
		boolean changed = false;
		ArrayList<Binder> parameters = new ArrayList<>();
		for (Binder p : term.parameters()) {
			Term type = apply(p.type());
			if (type == p.type()) {
				parameters.add(p);
			} else {
				parameters.add(new Binder(p.names(), type, p.attributes()));
				changed = true;
			}
		}
		Term returnType = apply(term.returnType());
		Term body = apply(term.body());
		if (!changed && returnType == term.returnType() && body == term.body()) {
			return term;
		}
		return new Term.Fixpoint(term.name(), parameters, term.struct(), returnType, body, term.attributes());
	}

	@Override
	public Term apply(Term.Conditional term) {
		Term guard = apply(term.guard());
		Term returnType = term.returnType();
		if (returnType != null && !from.equals(term.alias())) {
			returnType = apply(returnType);
		}
		Term trueBranch = apply(term.trueBranch());
		Term falseBranch = apply(term.falseBranch());
		if (guard == term.guard() && returnType == term.returnType() && trueBranch == term.trueBranch()
				&& falseBranch == term.falseBranch()) {
			return term;
		}
		return new Term.Conditional(guard, term.alias(), returnType, trueBranch, falseBranch, term.attributes());
	}

	@Override
	public Term apply(Term.Match term) {
		boolean changed = false;
		// Subject terms are evaluated in the outer scope
		ArrayList<MatchSubject> subjects = new ArrayList<>();
		for (MatchSubject s : term.subjects()) {
			MatchSubject n = s.withTerm(apply(s.term()));
			// The head of an "in" pattern is a free occurrence
			if (n.hasPattern() && n.pattern().head().equals(from)) {
				n = new MatchSubject(n.term(), n.alias(), apply(n.pattern()), n.attributes());
			}
			changed |= (n != s);
			subjects.add(n);
		}
		// The return type is in the scope of all subject aliases and patterns
		Term returnType = term.returnType();
		if (returnType != null && !term.boundVariables().contains(from)) {
			returnType = apply(returnType);
			changed |= (returnType != term.returnType());
		}
		// Each body is in the scope of its own patterns
		List<CaseClause> cases = new ArrayList<>();
		for (CaseClause c : term.cases()) {
			if (c.boundVariables().contains(from)) {
				cases.add(c);
			} else {
				Term body = apply(c.body());
				if (body == c.body()) {
					cases.add(c);
				} else {
					cases.add(new CaseClause(c.patterns(), body, c.attributes()));
					changed = true;
				}
			}
		}
		if (!changed) {
			return term;
		}
		return new Term.Match(subjects, cases, returnType, term.attributes());
	}

	/**
	 * Replace the head of a pattern. The remaining names are binders, and are
	 * never rewritten.
	 *
	 * @param pattern
	 * @return
	 */
	private Pattern apply(Pattern pattern) {
		ArrayList<Variable> names = new ArrayList<>(pattern.names());
		names.set(0, to);
		return new Pattern(names, pattern.alias(), pattern.attributes());
	}
}
