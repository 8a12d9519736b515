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

import dnamotifs.sequences.NucleotideAlphabet;

/**
 * Parser of the motifs mini language:
 * <ul>
 * <li>Runs of A, C, G, T and N are literal runs. N is a wildcard at verification time</li>
 * <li>A run of k dots is a gap of length k</li>
 * <li>{k} is a gap of length k</li>
 * <li>A brace without closing brace, or with a non numeric content, is a gap of length one by default.
 * Gap lengths larger than the int range are always rejected</li>
 * <li>Any other character is ignored by default</li>
 * </ul>
 * The motif is trimmed and converted to upper case before parsing
 */
public class GappedMotifParser {

	public static final byte UNRECOGNIZED_SYMBOL_DROP = 0;
	public static final byte UNRECOGNIZED_SYMBOL_ERROR = 1;
	public static final byte UNTERMINATED_GAP_DEGRADE = 0;
	public static final byte UNTERMINATED_GAP_ERROR = 1;

	private byte unrecognizedSymbolPolicy = UNRECOGNIZED_SYMBOL_DROP;
	private byte unterminatedGapPolicy = UNTERMINATED_GAP_DEGRADE;

	public byte getUnrecognizedSymbolPolicy() {
		return unrecognizedSymbolPolicy;
	}
	public void setUnrecognizedSymbolPolicy(byte unrecognizedSymbolPolicy) {
		if(unrecognizedSymbolPolicy!=UNRECOGNIZED_SYMBOL_DROP && unrecognizedSymbolPolicy!=UNRECOGNIZED_SYMBOL_ERROR) throw new IllegalArgumentException("Invalid policy for unrecognized symbols: "+unrecognizedSymbolPolicy);
		this.unrecognizedSymbolPolicy = unrecognizedSymbolPolicy;
	}
	public byte getUnterminatedGapPolicy() {
		return unterminatedGapPolicy;
	}
	public void setUnterminatedGapPolicy(byte unterminatedGapPolicy) {
		if(unterminatedGapPolicy!=UNTERMINATED_GAP_DEGRADE && unterminatedGapPolicy!=UNTERMINATED_GAP_ERROR) throw new IllegalArgumentException("Invalid policy for unterminated gaps: "+unterminatedGapPolicy);
		this.unterminatedGapPolicy = unterminatedGapPolicy;
	}

	/**
	 * Parses the given motif
	 * @param id Identifier for the new motif
	 * @param motif String to parse
	 * @return GappedMotif with the tokens of the given string
	 */
	public GappedMotif parse(int id, String motif) {
		return new GappedMotif(id, motif, tokenize(motif));
	}

	/**
	 * Splits the given motif into literal runs and gaps
	 * @param motif String to tokenize
	 * @return List<MotifToken> Tokens in the order of the motif
	 * @throws IllegalArgumentException If a policy is set to fail and the motif has the corresponding syntax problem
	 */
	public List<MotifToken> tokenize(String motif) {
		String s = motif.trim().toUpperCase();
		List<MotifToken> tokens = new ArrayList<MotifToken>();
		int n = s.length();
		int i = 0;
		while(i<n) {
			char c = s.charAt(i);
			if(NucleotideAlphabet.isNucleotide(c)) {
				int j = i;
				while(j<n && NucleotideAlphabet.isNucleotide(s.charAt(j))) j++;
				tokens.add(new MotifLiteral(s.substring(i,j)));
				i = j;
			} else if (c=='.') {
				int j = i;
				while(j<n && s.charAt(j)=='.') j++;
				tokens.add(new MotifGap(j-i));
				i = j;
			} else if (c=='{') {
				int j = s.indexOf('}', i+1);
				int gapLength = (j>0)?parseGapLength(s.substring(i+1,j), motif):-1;
				if(gapLength>=0) {
					if(gapLength>0) tokens.add(new MotifGap(gapLength));
					i = j+1;
				} else {
					if(unterminatedGapPolicy==UNTERMINATED_GAP_ERROR) throw new IllegalArgumentException("Malformed gap at position "+i+" of motif "+motif);
					tokens.add(new MotifGap(1));
					i++;
				}
			} else {
				if(unrecognizedSymbolPolicy==UNRECOGNIZED_SYMBOL_ERROR) throw new IllegalArgumentException("Unrecognized character "+c+" at position "+i+" of motif "+motif);
				i++;
			}
		}
		return tokens;
	}

	/**
	 * @param number Content between braces
	 * @param motif Motif being parsed
	 * @return int Decoded length or -1 if the content is not a non negative decimal number
	 * @throws IllegalArgumentException If the content is a decimal number too large to be a gap length
	 */
	private int parseGapLength(String number, String motif) {
		if(number.length()==0) return -1;
		for(int i=0;i<number.length();i++) {
			char c = number.charAt(i);
			if(c<'0' || c>'9') return -1;
		}
		try {
			return Integer.parseInt(number);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Gap length "+number+" of motif "+motif+" exceeds the maximum length "+Integer.MAX_VALUE, e);
		}
	}
}
