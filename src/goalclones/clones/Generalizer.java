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
package goalclones.clones;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

import goalclones.core.FreeVariables;
import goalclones.core.Syntax.Hypothesis;
import goalclones.core.Syntax.Term;

/**
 * Responsible for closing a goal over those hypotheses of its local context
 * which it (directly or indirectly) refers to. For example, consider this goal
 * and local context:
 *
 * <pre>
 * A : Type
 * xs : list A
 * ============
 * rev (rev xs) = xs
 * </pre>
 *
 * This is generalised to <code>forall (A : Type), forall (xs : list A), rev
 * (rev xs) = xs</code>. Here, <code>A</code> is included because the type of
 * <code>xs</code> depends upon it and, therefore, it must be quantified
 * outside of <code>xs</code>. Definitions from the local context (e.g.
 * <code>n := 0 : nat</code>) become <code>let</code> expressions instead.
 * <p>
 * As in any local context, a hypothesis may only refer to those declared
 * before it. Hence, a hypothesis may also shadow an earlier one of the same
 * name whilst referring to it (e.g. <code>x : nat</code> followed by
 * <code>x : Q x</code>).
 *
 * @author David J. Pearce
 *
 */
public class Generalizer {
	private static final Comparator<Declaration> BY_NAME = Comparator.comparing(d -> d.name.name());

	/**
	 * Generalise a goal over the hypotheses it depends upon.
	 *
	 * @param goal
	 * @param hypotheses
	 * @return
	 */
	public static Term generalize(Term goal, List<Hypothesis> hypotheses) {
		ArrayList<Declaration> context = new ArrayList<>();
		for (int i = 0; i != hypotheses.size(); ++i) {
			Hypothesis h = hypotheses.get(i);
			for (Term.Variable n : h.names()) {
				context.add(new Declaration(n, h, i));
			}
		}
		DependencyGraph<Declaration> graph = new DependencyGraph<>();
		// The goal sees every hypothesis
		ArrayList<Declaration> worklist = resolve(FreeVariables.of(goal), hypotheses.size(), context);
		for (Declaration d : worklist) {
			graph.addNode(d);
		}
		while (!worklist.isEmpty()) {
			Declaration d = worklist.remove(0);
			for (Declaration e : resolve(dependencies(d.hypothesis), d.position, context)) {
				if (!graph.contains(e)) {
					worklist.add(e);
				}
				graph.addEdge(d, e);
			}
		}
		// Wrap dependents first, so that dependencies end up outermost
		for (Declaration d : graph.topologicalOrder()) {
			Hypothesis h = d.hypothesis;
			if (h.isDefinition()) {
				goal = new Term.Let(d.name, h.type(), h.definition(), goal);
			} else {
				goal = new Term.Product(d.name, h.type(), goal);
			}
		}
		return goal;
	}

	/**
	 * Determine the free variables which the type (and definition, if any) of a
	 * hypothesis refers to.
	 *
	 * @param h
	 * @return
	 */
	private static Set<Term.Variable> dependencies(Hypothesis h) {
		Set<Term.Variable> fvs = FreeVariables.of(h.type());
		if (h.isDefinition()) {
			fvs.addAll(FreeVariables.of(h.definition()));
		}
		return fvs;
	}

	/**
	 * Resolve a set of variables against those hypotheses declared before a given
	 * position in the context. Each variable resolves to the last such
	 * declaration of its name, whilst variables with no such declaration are
	 * ignored.
	 *
	 * @param variables
	 * @param position
	 * @param context
	 * @return
	 */
	private static ArrayList<Declaration> resolve(Set<Term.Variable> variables, int position,
			List<Declaration> context) {
		ArrayList<Declaration> result = new ArrayList<>();
		for (Term.Variable v : variables) {
			for (int i = context.size() - 1; i >= 0; --i) {
				Declaration d = context.get(i);
				if (d.position < position && d.name.equals(v)) {
					result.add(d);
					break;
				}
			}
		}
		result.sort(BY_NAME);
		return result;
	}

	/**
	 * A single variable declared by a hypothesis, along with the position of that
	 * hypothesis in the context. Declarations are compared by identity, since two
	 * hypotheses may declare the same name.
	 *
	 * @author David J. Pearce
	 *
	 */
	private static class Declaration {
		private final Term.Variable name;
		private final Hypothesis hypothesis;
		private final int position;

		public Declaration(Term.Variable name, Hypothesis hypothesis, int position) {
			this.name = name;
			this.hypothesis = hypothesis;
			this.position = position;
		}

		@Override
		public String toString() {
			return name + "@" + position;
		}
	}
}
