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

import java.util.List;

/**
 * Sequence identified by a name, as loaded from a fasta record
 */
public class QualifiedSequence {
	private String name;
	private String comments;
	private CharSequence characters;

	public QualifiedSequence(String name, CharSequence characters) {
		this.name = name;
		this.characters = characters;
	}

	public String getName() {
		return name;
	}
	public void setName(String name) {
		this.name = name;
	}
	public String getComments() {
		return comments;
	}
	public void setComments(String comments) {
		this.comments = comments;
	}
	public CharSequence getCharacters() {
		return characters;
	}
	public int getLength() {
		return characters.length();
	}

	/**
	 * Joins the characters of the given sequences in the given order
	 * @param sequences to concatenate
	 * @return String with the characters of all sequences without separators
	 */
	public static String concatenate(List<QualifiedSequence> sequences) {
		StringBuilder answer = new StringBuilder();
		for(QualifiedSequence seq:sequences) answer.append(seq.getCharacters());
		return answer.toString();
	}
}
