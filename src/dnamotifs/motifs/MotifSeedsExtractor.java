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
import java.util.List;

/**
 * Selects the literal fragments of a motif that are indexed in the automaton.
 * Every literal run with at least the minimum seed length becomes a seed. If no run is long enough,
 * the first literal run is used regardless of its length, so every motif with literals can be found
 */
public class MotifSeedsExtractor {

	public static final int DEF_MIN_SEED_LENGTH = 3;

	private int minSeedLength = DEF_MIN_SEED_LENGTH;
	private boolean wildcardsInSeeds = true;

	public MotifSeedsExtractor() {
	}

	public MotifSeedsExtractor(int minSeedLength) {
		setMinSeedLength(minSeedLength);
	}

	public int getMinSeedLength() {
		return minSeedLength;
	}
	public void setMinSeedLength(int minSeedLength) {
		if(minSeedLength<1) throw new IllegalArgumentException("Minimum seed length must be positive. Given: "+minSeedLength);
		this.minSeedLength = minSeedLength;
	}

	public boolean isWildcardsInSeeds() {
		return wildcardsInSeeds;
	}
	/**
	 * If true (default), N is indexed as a concrete symbol within seeds.
	 * If false, literal runs are split at every N and only the N free fragments are candidates for seeds
	 * @param wildcardsInSeeds flag to allow N within seeds
	 */
	public void setWildcardsInSeeds(boolean wildcardsInSeeds) {
		this.wildcardsInSeeds = wildcardsInSeeds;
	}

	/**
	 * Extracts the seeds of the given motif
	 * @param motif Parsed motif
	 * @return List<MotifSeed> Seeds with offsets relative to the motif start. Empty if the motif does not have literals
	 */
	public List<MotifSeed> extractSeeds(GappedMotif motif) {
		return extractSeeds(motif.getId(), motif.getTokens());
	}

	public List<MotifSeed> extractSeeds(int motifId, List<MotifToken> tokens) {
		List<MotifSeed> candidates = new ArrayList<MotifSeed>();
		int offset = 0;
		for(MotifToken token:tokens) {
			if(!token.isGap()) addCandidates(motifId, ((MotifLiteral)token).getSequence(), offset, candidates);
			offset+=token.getLength();
		}
		List<MotifSeed> seeds = new ArrayList<MotifSeed>();
		for(MotifSeed candidate:candidates) {
			if(candidate.getLength()>=minSeedLength) seeds.add(candidate);
		}
		if(seeds.isEmpty() && !candidates.isEmpty()) seeds.add(candidates.get(0));
		return seeds;
	}

	private void addCandidates(int motifId, String literal, int offset, List<MotifSeed> candidates) {
		if(wildcardsInSeeds) {
			candidates.add(new MotifSeed(literal, motifId, offset));
			return;
		}
		int i = 0;
		int n = literal.length();
		while(i<n) {
			if(literal.charAt(i)=='N') {
				i++;
				continue;
			}
			int j = i;
			while(j<n && literal.charAt(j)!='N') j++;
			candidates.add(new MotifSeed(literal.substring(i,j), motifId, offset+i));
			i = j;
		}
	}
}
