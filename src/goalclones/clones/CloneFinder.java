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
import java.util.HashSet;
import java.util.List;

import goalclones.core.AlphaEquivalence;
import goalclones.core.Syntax.Hypothesis;
import goalclones.core.Syntax.Term;
import goalclones.io.Parser;
import goalclones.util.SyntaxError;

/**
 * Responsible for finding goal clones amongst a list of goals. That is, pairs
 * of goals from different theorems which, after being generalised over their
 * local contexts, are alpha-equivalent. The search proceeds in four phases:
 * <ol>
 * <li><b>Selection.</b> Goals whose proofs are shorter than a given minimum are
 * discarded, since they are not worth reporting.</li>
 * <li><b>Generalisation.</b> Each goal is parsed and closed over its local
 * context.</li>
 * <li><b>Reduction.</b> Goals which are simply the body of another goal (e.g.
 * arising after <code>intros</code>) are discarded.</li>
 * <li><b>Search.</b> Every remaining pair is compared.</li>
 * </ol>
 *
 * @author David J. Pearce
 *
 */
public class CloneFinder {
	public static final int DEFAULT_MIN_PROOF_SIZE = 5;

	private final int minProofSize;

	public CloneFinder() {
		this(DEFAULT_MIN_PROOF_SIZE);
	}

	public CloneFinder(int minProofSize) {
		if (minProofSize < 1) {
			throw new IllegalArgumentException("too small proof size (must be a positive integer)");
		}
		this.minProofSize = minProofSize;
	}

	/**
	 * Find all clones amongst a given list of goals.
	 *
	 * @param goals
	 * @return
	 * @throws SyntaxError if a goal or hypothesis cannot be parsed.
	 */
	public List<Clone> find(List<Goal> goals) {
		List<Candidate> candidates = generalize(select(goals));
		return search(reduce(candidates));
	}

	/**
	 * Select those goals whose proofs meet the minimum proof size.
	 *
	 * @param goals
	 * @return
	 */
	public List<Goal> select(List<Goal> goals) {
		ArrayList<Goal> selected = new ArrayList<>();
		for (Goal g : goals) {
			if (g.proof().size() >= minProofSize) {
				selected.add(g);
			}
		}
		return selected;
	}

	/**
	 * Parse and generalise each goal over its local context.
	 *
	 * @param goals
	 * @return
	 */
	public List<Candidate> generalize(List<Goal> goals) {
		ArrayList<Candidate> candidates = new ArrayList<>();
		for (Goal g : goals) {
			ArrayList<Hypothesis> hypotheses = new ArrayList<>();
			for (String h : g.hypotheses()) {
				hypotheses.add(Parser.parseHypothesis(h));
			}
			Term term = Generalizer.generalize(Parser.parse(g.text()), hypotheses);
			candidates.add(new Candidate(g, term));
		}
		return candidates;
	}

	/**
	 * Remove any candidate whose term is the body of a (possibly nested) product
	 * of another candidate. Such goals typically arise from introducing the
	 * quantifiers of another goal, and would otherwise produce spurious clones.
	 *
	 * @param candidates
	 * @return
	 */
	public List<Candidate> reduce(List<Candidate> candidates) {
		HashSet<Term> bodies = new HashSet<>();
		for (Candidate c : candidates) {
			Term t = c.term();
			while (t instanceof Term.Product) {
				t = ((Term.Product) t).body();
				bodies.add(t);
			}
		}
		ArrayList<Candidate> remaining = new ArrayList<>();
		for (Candidate c : candidates) {
			if (!bodies.contains(c.term())) {
				remaining.add(c);
			}
		}
		return remaining;
	}

	/**
	 * Compare every pair of candidates, reporting those from different theorems
	 * which are alpha-equivalent. Pairs are reported in the order they occur.
	 *
	 * @param candidates
	 * @return
	 */
	public List<Clone> search(List<Candidate> candidates) {
		ArrayList<Clone> clones = new ArrayList<>();
		for (int i = 0; i < candidates.size(); ++i) {
			Candidate c1 = candidates.get(i);
			for (int j = i + 1; j < candidates.size(); ++j) {
				Candidate c2 = candidates.get(j);
				if (c1.goal().theorem().equals(c2.goal().theorem())) {
					continue;
				} else if (AlphaEquivalence.equivalent(c1.term(), c2.term())) {
					clones.add(new Clone(c1.goal(), c2.goal()));
				}
			}
		}
		return clones;
	}

	/**
	 * A goal paired with its generalised term.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Candidate {
		private final Goal goal;
		private final Term term;

		public Candidate(Goal goal, Term term) {
			this.goal = goal;
			this.term = term;
		}

		public Goal goal() {
			return goal;
		}

		public Term term() {
			return term;
		}

		@Override
		public String toString() {
			return goal.theorem() + ": " + term;
		}
	}
}
