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

import java.util.Objects;

/**
 * Verified occurrence of a motif within a sequence
 */
public class MotifMatch {
	private final String sequenceName;
	private final int motifId;
	//Zero based first position of the match
	private final int start;
	//Zero based position after the last position of the match
	private final int end;

	public MotifMatch(int motifId, int start, int end) {
		this(null, motifId, start, end);
	}

	public MotifMatch(String sequenceName, int motifId, int start, int end) {
		if(end<start) throw new IllegalArgumentException("Invalid match coordinates "+start+"-"+end);
		this.sequenceName = sequenceName;
		this.motifId = motifId;
		this.start = start;
		this.end = end;
	}

	/**
	 * @return String name of the sequence where the match was found. Null if the scanned text did not have a name
	 */
	public String getSequenceName() {
		return sequenceName;
	}

	public int getMotifId() {
		return motifId;
	}

	public int getStart() {
		return start;
	}

	public int getEnd() {
		return end;
	}

	public int length() {
		return end-start;
	}

	@Override
	public boolean equals(Object obj) {
		if(!(obj instanceof MotifMatch)) return false;
		MotifMatch other = (MotifMatch)obj;
		return motifId==other.motifId && start==other.start && end==other.end && Objects.equals(sequenceName, other.sequenceName);
	}

	@Override
	public int hashCode() {
		return Objects.hash(sequenceName, motifId, start, end);
	}

	@Override
	public String toString() {
		String seqName = (sequenceName!=null)?sequenceName+":":"";
		return "motif "+motifId+" at "+seqName+start+"-"+end;
	}
}
