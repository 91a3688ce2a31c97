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
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A directed graph whose edges record that one node depends upon another. Nodes
 * are kept in insertion order, so that the topological order produced for a
 * given sequence of insertions is deterministic.
 *
 * @author David J. Pearce
 *
 * @param <T>
 */
public class DependencyGraph<T> {
	private final LinkedHashMap<T, List<T>> edges = new LinkedHashMap<>();

	/**
	 * Add a node to this graph, if it is not already present.
	 *
	 * @param node
	 */
	public void addNode(T node) {
		if (!edges.containsKey(node)) {
			edges.put(node, new ArrayList<>());
		}
	}

	/**
	 * Record that <code>from</code> depends upon <code>to</code>. Both nodes are
	 * added if not already present.
	 *
	 * @param from
	 * @param to
	 */
	public void addEdge(T from, T to) {
		addNode(from);
		addNode(to);
		edges.get(from).add(to);
	}

	public boolean contains(T node) {
		return edges.containsKey(node);
	}

	/**
	 * Order the nodes of this graph such that every node appears before all of
	 * the nodes it depends upon.
	 *
	 * @return
	 * @throws IllegalArgumentException if the graph contains a cycle.
	 */
	public List<T> topologicalOrder() {
		ArrayList<T> order = new ArrayList<>();
		HashSet<T> visited = new HashSet<>();
		for (T node : edges.keySet()) {
			if (!visited.contains(node)) {
				visit(node, visited, new HashSet<>(), order);
			}
		}
		Collections.reverse(order);
		return order;
	}

	private void visit(T node, Set<T> visited, Set<T> active, List<T> order) {
		visited.add(node);
		active.add(node);
		for (T dependency : edges.get(node)) {
			if (active.contains(dependency)) {
				throw new IllegalArgumentException("not a DAG");
			} else if (!visited.contains(dependency)) {
				visit(dependency, visited, active, order);
			}
		}
		active.remove(node);
		// NOTE: nodes are added after their dependencies, and reversed at the end
		order.add(node);
	}

	@Override
	public String toString() {
		String r = "{";
		boolean firstTime = true;
		for (Map.Entry<T, List<T>> e : edges.entrySet()) {
			if (!firstTime) {
				r += ",";
			}
			firstTime = false;
			r += e.getKey() + "->" + e.getValue();
		}
		return r + "}";
	}
}
