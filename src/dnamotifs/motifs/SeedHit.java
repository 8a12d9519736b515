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

/**
 * Occurrence of a seed found while scanning a text
 */
public class SeedHit {
	//Zero based position of the last character of the seed within the text
	private final int textEnd;
	private final MotifSeed seed;

	public SeedHit(int textEnd, MotifSeed seed) {
		this.textEnd = textEnd;
		this.seed = seed;
	}

	public int getTextEnd() {
		return textEnd;
	}

	public MotifSeed getSeed() {
		return seed;
	}

	public int getMotifId() {
		return seed.getMotifId();
	}

	/**
	 * @return int Zero based start of the seed within the text
	 */
	public int getTextStart() {
		return textEnd - seed.getLength() + 1;
	}

	/**
	 * @return int Zero based start that the whole motif would have in the text. Can be negative
	 */
	public int estimateMotifStart() {
		return getTextStart() - seed.getOffset();
	}

	@Override
	public String toString() {
		return seed.getSequence()+" ending at "+textEnd+" (motif "+seed.getMotifId()+")";
	}
}
