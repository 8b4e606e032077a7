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

package uk.ac.sanger.nodule.data;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * All of the hits from searching one contig set, grouped by query in the order
 * in which the queries appear in the query file.
 */

public class HomologyResultSet {
	private final String queryFile;
	private final Map<String, Query> queries = new LinkedHashMap<String, Query>();

	public HomologyResultSet(String queryFile) {
		this.queryFile = queryFile;
	}

	/**
	 * Groups hits by query name. Every contig becomes a query, even if it has
	 * no hits. Hits whose query is not one of the contigs are grouped under
	 * their own query name after the contigs.
	 */

	public static HomologyResultSet fromHits(String queryFile, List<Contig> contigs, List<HomologyHit> hits) {
		HomologyResultSet resultSet = new HomologyResultSet(queryFile);

		if (contigs != null) {
			for (Contig contig : contigs)
				resultSet.addQuery(contig.getName(), contig.getSequence());
		}

		if (hits != null) {
			for (HomologyHit hit : hits)
				resultSet.addHit(hit);
		}

		return resultSet;
	}

	public Query addQuery(String name, String sequence) {
		Query query = queries.get(name);

		if (query == null) {
			query = new Query(name, sequence);
			queries.put(name, query);
		}

		return query;
	}

	public void addHit(HomologyHit hit) {
		Query query = queries.get(hit.getQueryName());

		if (query == null)
			query = addQuery(hit.getQueryName(), hit.getQuerySequence());

		query.hits.add(hit);
	}

	public String getQueryFile() {
		return queryFile;
	}

	public Collection<Query> getQueries() {
		return Collections.unmodifiableCollection(queries.values());
	}

	public Query getQuery(String name) {
		return queries.get(name);
	}

	public int getQueryCount() {
		return queries.size();
	}

	public String toString() {
		return "HomologyResultSet[queryFile=" + queryFile + ", queries=" + queries.size() + "]";
	}

	public class Query {
		private final String name;
		private final String sequence;
		private final List<HomologyHit> hits = new ArrayList<HomologyHit>();

		protected Query(String name, String sequence) {
			this.name = name;
			this.sequence = sequence;
		}

		public String getName() {
			return name;
		}

		public String getSequence() {
			return sequence;
		}

		public String getQueryFile() {
			return queryFile;
		}

		public List<HomologyHit> getHits() {
			return Collections.unmodifiableList(hits);
		}

		public boolean hasHits() {
			return !hits.isEmpty();
		}
	}
}
