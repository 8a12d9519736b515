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
 * Confirms candidate matches anchored by seed hits replaying every token of the motif against the text.
 * Literal characters are compared ignoring case. The symbol N within a motif literal matches any character,
 * gaps skip text positions without comparison
 */
public class GappedMotifVerifier {

	/**
	 * @param hit Seed hit anchoring the candidate
	 * @return int Start that the motif would have in the text. Can be negative
	 */
	public int getCandidateStart(SeedHit hit) {
		return hit.getTextEnd() - (hit.getSeed().getLength() - 1) - hit.getSeed().getOffset();
	}

	/**
	 * Verifies the candidate match implied by the given seed hit
	 * @param text Scanned text
	 * @param hit Seed hit produced by the automaton
	 * @param motif Motif of the seed
	 * @return boolean true if the whole motif matches the text at the implied start
	 */
	public boolean verify(CharSequence text, SeedHit hit, GappedMotif motif) {
		return matchesAt(text, getCandidateStart(hit), motif);
	}

	/**
	 * Checks if the given motif matches the text at the given start
	 * @param text to compare
	 * @param start Zero based start of the motif within the text
	 * @param motif to verify
	 * @return boolean true if the motif fits within the text and all literal symbols match. false otherwise
	 */
	public boolean matchesAt(CharSequence text, int start, GappedMotif motif) {
		if(start<0 || (long)start + motif.getLength() > text.length()) return false;
		int pos = start;
		for(MotifToken token:motif.getTokens()) {
			if(!token.isGap() && !literalMatches(text, pos, ((MotifLiteral)token).getSequence())) return false;
			pos+=token.getLength();
		}
		return true;
	}

	private boolean literalMatches(CharSequence text, int pos, String literal) {
		for(int i=0;i<literal.length();i++) {
			char pc = literal.charAt(i);
			if(pc=='N') continue;
			if(Character.toUpperCase(text.charAt(pos+i))!=pc) return false;
		}
		return true;
	}
}
