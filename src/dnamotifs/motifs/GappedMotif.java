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
import java.util.List;

/**
 * Motif parsed as an ordered list of tokens. Motifs are immutable once the seeds are assigned
 */
public class GappedMotif {
	private final int id;
	private final String motif;
	private final List<MotifToken> tokens;
	private final int length;
	private List<MotifSeed> seeds = Collections.emptyList();

	/**
	 * Creates a new motif
	 * @param id Position of the motif in the input list
	 * @param motif Motif as given by the user
	 * @param tokens Tokens produced by the parser
	 * @throws IllegalArgumentException If the total length of the tokens can not be represented as an int
	 */
	public GappedMotif(int id, String motif, List<MotifToken> tokens) {
		this.id = id;
		this.motif = motif;
		this.tokens = Collections.unmodifiableList(new ArrayList<MotifToken>(tokens));
		long total = 0;
		for(MotifToken token:tokens) total+=token.getLength();
		if(total>Integer.MAX_VALUE) throw new IllegalArgumentException("Total length "+total+" of motif "+motif+" exceeds the maximum length "+Integer.MAX_VALUE);
		this.length = (int)total;
	}

	public int getId() {
		return id;
	}

	public String getMotif() {
		return motif;
	}

	public List<MotifToken> getTokens() {
		return tokens;
	}

	/**
	 * @return int Number of text positions spanned by a match of this motif
	 */
	public int getLength() {
		return length;
	}

	/**
	 * @return boolean true if at least one token is a literal run
	 */
	public boolean hasLiterals() {
		for(MotifToken token:tokens) {
			if(!token.isGap()) return true;
		}
		return false;
	}

	public List<MotifSeed> getSeeds() {
		return seeds;
	}

	void setSeeds(List<MotifSeed> seeds) {
		this.seeds = Collections.unmodifiableList(new ArrayList<MotifSeed>(seeds));
	}

	/**
	 * @return boolean true if the motif has at least one seed that can be indexed
	 */
	public boolean isIndexable() {
		return !seeds.isEmpty();
	}

	@Override
	public String toString() {
		return motif;
	}
}
