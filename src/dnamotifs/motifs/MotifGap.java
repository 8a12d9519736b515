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
 * Run of positions that are skipped without comparison
 */
public class MotifGap extends MotifToken {
	private final int length;

	public MotifGap(int length) {
		if(length<=0) throw new IllegalArgumentException("Gap length must be positive. Given: "+length);
		this.length = length;
	}

	@Override
	public int getLength() {
		return length;
	}

	@Override
	public boolean isGap() {
		return true;
	}

	@Override
	public boolean equals(Object obj) {
		if(!(obj instanceof MotifGap)) return false;
		return length == ((MotifGap)obj).length;
	}

	@Override
	public int hashCode() {
		return length;
	}

	@Override
	public String toString() {
		return "{"+length+"}";
	}
}
