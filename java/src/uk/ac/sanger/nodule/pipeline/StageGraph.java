// Copyright (c) 2026 Genome Research Ltd.
//
// This file is part of Nodule.
//
// Nodule is free software: you can redistribute it and/or modify it under
// the terms of the GNU General Public License as published by the Free Software
// Foundation; either version 3 of the License, or (at your option) any later
// version.
//
// This program is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// this program. If not, see <http://www.gnu.org/licenses/>.

package uk.ac.sanger.nodule.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;

/**
 * The dependencies between the stages of a pipeline. An edge runs from each
 * stage to every stage which names it as a prerequisite.
 */

public class StageGraph {
	private final DirectedAcyclicGraph<String, DefaultEdge> graph =
			new DirectedAcyclicGraph<String, DefaultEdge>(DefaultEdge.class);

	private final Map<String, Integer> order = new HashMap<String, Integer>();

	/**
	 * Builds the graph and checks that the stages are listed in an order
	 * which runs every prerequisite before the stages which need it.
	 *
	 * @throws IllegalArgumentException
	 *             if two stages have the same name, a prerequisite is not one
	 *             of the stages, the prerequisites form a cycle, or a stage is
	 *             listed before one of its prerequisites.
	 */

	public StageGraph(List<? extends Stage> stages) {
		for (int i = 0; i < stages.size(); i++) {
			String name = stages.get(i).getName();

			if (order.containsKey(name))
				throw new IllegalArgumentException("There are two stages named " + name);

			order.put(name, i);
			graph.addVertex(name);
		}

		for (Stage stage : stages) {
			for (String prerequisite : stage.getPrerequisites()) {
				if (!order.containsKey(prerequisite))
					throw new IllegalArgumentException("Stage " + stage.getName() + " needs the unknown stage "
							+ prerequisite);

				try {
					graph.addEdge(prerequisite, stage.getName());
				} catch (IllegalArgumentException iae) {
					throw new IllegalArgumentException("The prerequisites of stage " + stage.getName()
							+ " form a cycle through " + prerequisite, iae);
				}

				if (order.get(prerequisite) >= order.get(stage.getName()))
					throw new IllegalArgumentException("Stage " + stage.getName() + " is listed before its prerequisite "
							+ prerequisite);
			}
		}
	}

	/**
	 * Returns every stage which needs the named stage, directly or through
	 * other stages, in pipeline order.
	 */

	public List<String> getDependents(String name) {
		Set<String> descendants = graph.getDescendants(name);

		List<String> dependents = new ArrayList<String>(descendants);

		Collections.sort(dependents, new Comparator<String>() {
			public int compare(String a, String b) {
				return order.get(a).compareTo(order.get(b));
			}
		});

		return dependents;
	}

	public boolean dependsOn(String stage, String prerequisite) {
		return graph.getAncestors(stage).contains(prerequisite);
	}
}
