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
package dnamotifs.sequences;

/**
 * Difference found between a reference sequence and a compared sequence
 */
public class SequenceDifference {
	public static final byte TYPE_SNP = 0;
	public static final byte TYPE_DELETION = 1;
	public static final byte TYPE_INSERTION = 2;
	public static final byte TYPE_COMPLEX = 3;
	public static final byte TYPE_DELETION_AT_END = 4;
	public static final byte TYPE_INSERTION_AT_END = 5;

	private byte type;
	private int referencePosition;
	private int comparedPosition;
	private char referenceBase;
	private char comparedBase;

	public SequenceDifference(byte type, int referencePosition, int comparedPosition, char referenceBase, char comparedBase) {
		if(type<TYPE_SNP || type>TYPE_INSERTION_AT_END) throw new IllegalArgumentException("Invalid difference type: "+type);
		this.type = type;
		this.referencePosition = referencePosition;
		this.comparedPosition = comparedPosition;
		this.referenceBase = referenceBase;
		this.comparedBase = comparedBase;
	}

	public byte getType() {
		return type;
	}
	/**
	 * @return int Position in the reference sequence where the difference was found
	 */
	public int getReferencePosition() {
		return referencePosition;
	}
	/**
	 * @return int Position in the compared sequence where the difference was found
	 */
	public int getComparedPosition() {
		return comparedPosition;
	}
	public char getReferenceBase() {
		return referenceBase;
	}
	public char getComparedBase() {
		return comparedBase;
	}

	@Override
	public String toString() {
		switch (type) {
		case TYPE_SNP:
			return "SNP at pos "+referencePosition+": "+referenceBase+" -> "+comparedBase;
		case TYPE_DELETION:
			return "Deletion at pos "+referencePosition+": removed "+referenceBase;
		case TYPE_INSERTION:
			return "Insertion at pos "+referencePosition+": inserted "+comparedBase;
		case TYPE_COMPLEX:
			return "Complex mutation near pos A="+referencePosition+" B="+comparedPosition;
		case TYPE_DELETION_AT_END:
			return "Deletion at end: removed "+referenceBase;
		default:
			return "Insertion at end: inserted "+comparedBase;
		}
	}
}
