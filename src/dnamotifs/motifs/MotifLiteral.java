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
 * Run of symbols that must be found in the text. Within verification, the symbol N matches any character
 */
public class MotifLiteral extends MotifToken {
	private final String sequence;

	public MotifLiteral(String sequence) {
		if(sequence==null || sequence.length()==0) throw new IllegalArgumentException("Literal runs can not be empty");
		this.sequence = sequence;
	}

	public String getSequence() {
		return sequence;
	}

	@Override
	public int getLength() {
		return sequence.length();
	}

	@Override
	public boolean isGap() {
		return false;
	}

	@Override
	public boolean equals(Object obj) {
		if(!(obj instanceof MotifLiteral)) return false;
		return sequence.equals(((MotifLiteral)obj).sequence);
	}

	@Override
	public int hashCode() {
		return sequence.hashCode();
	}

	@Override
	public String toString() {
		return sequence;
	}
}
