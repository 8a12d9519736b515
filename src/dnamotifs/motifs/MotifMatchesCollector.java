/*******************************************************************************
 * DNAMotifs - Search of gapped motifs in genomic sequences
 * Copyright 2026 DNAMotifs developers
 *
 * This file is part of DNAMotifs.
 *
 *     DNAMotifs is free software: you can redistribute it and/or modify
 *     it under the terms of the GNU General Public License as published by
 *     the Free Software Foundation, either version 3 of the License, or
 *     (at your option) any later version.
 *
 *     DNAMotifs is distributed in the hope that it will be useful,
 *     but WITHOUT ANY WARRANTY; without even the implied warranty of
 *     MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *     GNU General Public License for more details.
 *
 *     You should have received a copy of the GNU General Public License
 *     along with DNAMotifs.  If not, see <http://www.gnu.org/licenses/>.
 *******************************************************************************/
package dnamotifs.motifs;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Accumulates verified matches grouped by motif id. Within each motif, matches keep the order in which
 * they were added, which is the scan order. By default a match found through two different seeds
 * of the same motif is recorded twice. Deduplication keeps only the first occurrence of each span
 */
public class MotifMatchesCollector {
	private Map<Integer,List<MotifMatch>> matchesByMotif = new TreeMap<Integer, List<MotifMatch>>();
	private Set<MotifMatch> recordedMatches = new HashSet<MotifMatch>();
	private boolean deduplicate = false;
	private long totalMatches = 0;

	public MotifMatchesCollector() {
	}

	public MotifMatchesCollector(boolean deduplicate) {
		this.deduplicate = deduplicate;
	}

	public boolean isDeduplicate() {
		return deduplicate;
	}

	/**
	 * Adds a verified match
	 * @param match to add
	 * @return boolean true if the match was recorded, false if it was discarded as a duplicate
	 */
	public boolean addMatch(MotifMatch match) {
		if(deduplicate && !recordedMatches.add(match)) return false;
		List<MotifMatch> motifMatches = matchesByMotif.computeIfAbsent(match.getMotifId(), k -> new ArrayList<MotifMatch>());
		motifMatches.add(match);
		totalMatches++;
		return true;
	}

	/**
	 * Adds the matches of the given collector after the matches already recorded
	 * @param other Collector with matches to add
	 */
	public void addAll(MotifMatchesCollector other) {
		for(List<MotifMatch> motifMatches:other.matchesByMotif.values()) {
			for(MotifMatch match:motifMatches) addMatch(match);
		}
	}

	/**
	 * @param motifId Id of the motif
	 * @return List<MotifMatch> Matches of the given motif in scan order. Empty if the motif was not found
	 */
	public List<MotifMatch> getMatches(int motifId) {
		List<MotifMatch> motifMatches = matchesByMotif.get(motifId);
		if(motifMatches==null) return Collections.emptyList();
		return Collections.unmodifiableList(motifMatches);
	}

	/**
	 * @return List<MotifMatch> All matches sorted by motif id. Matches of the same motif are in scan order
	 */
	public List<MotifMatch> getAllMatches() {
		List<MotifMatch> answer = new ArrayList<MotifMatch>();
		for(List<MotifMatch> motifMatches:matchesByMotif.values()) answer.addAll(motifMatches);
		return answer;
	}

	/**
	 * @return Set<Integer> Ids of the motifs having at least one match, in ascending order
	 */
	public Set<Integer> getMotifIds() {
		return Collections.unmodifiableSet(matchesByMotif.keySet());
	}

	public long getTotalMatches() {
		return totalMatches;
	}

	/**
	 * Removes all recorded matches to start a new scan
	 */
	public void reset() {
		matchesByMotif.clear();
		recordedMatches.clear();
		totalMatches = 0;
	}
}
