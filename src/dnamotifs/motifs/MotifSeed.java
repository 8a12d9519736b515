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
 * Literal fragment of a motif used to anchor candidate matches.
 * The offset is measured in the coordinates of the motif
 */
public class MotifSeed {
	private final String sequence;
	private final int motifId;
	private final int offset;

	public MotifSeed(String sequence, int motifId, int offset) {
		if(sequence==null || sequence.length()==0) throw new IllegalArgumentException("Seeds can not be empty");
		if(offset<0) throw new IllegalArgumentException("Seed offset can not be negative. Given: "+offset);
		this.sequence = sequence;
		this.motifId = motifId;
		this.offset = offset;
	}

	public String getSequence() {
		return sequence;
	}

	public int getMotifId() {
		return motifId;
	}

	public int getOffset() {
		return offset;
	}

	public int getLength() {
		return sequence.length();
	}

	@Override
	public String toString() {
		return sequence+"@"+offset+" (motif "+motifId+")";
	}
}
