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
 * Five symbols alphabet used to index motifs: the four bases plus N.
 * Every character maps to exactly one symbol. Characters outside the alphabet are folded to N
 */
public class NucleotideAlphabet {
	public static final String SYMBOLS = "ACGTN";
	public static final int ALPHABET_SIZE = 5;
	public static final byte INDEX_N = 4;
	//Index of each uppercase letter, -1 if the letter is not a symbol
	private static final byte [] ARRAY_SYMBOLS_INDEXING = {0,-1,1,-1,-1,-1,2,-1,-1,-1,-1,-1,-1,4,-1,-1,-1,-1,-1,3,-1,-1,-1,-1,-1,-1};

	private NucleotideAlphabet() {
	}

	/**
	 * Gets the index of the given character within the alphabet. Lowercase letters are accepted
	 * @param c Character to look up
	 * @return int Index between 0 and 4, or -1 if the character is not a nucleotide symbol
	 */
	public static int getIndex (char c) {
		if(c>='a' && c<='z') c -= 32;
		int i = c - 'A';
		if(i<0 || i>=ARRAY_SYMBOLS_INDEXING.length) return -1;
		return ARRAY_SYMBOLS_INDEXING[i];
	}

	public static boolean isNucleotide (char c) {
		return getIndex(c)>=0;
	}

	/**
	 * Total mapping from characters to symbol indexes
	 * @param c Character to normalize
	 * @return byte Index of the symbol, INDEX_N for characters outside the alphabet
	 */
	public static byte getSymbolIndex (char c) {
		int index = getIndex(c);
		if(index<0) return INDEX_N;
		return (byte)index;
	}

	public static char getSymbol (int index) {
		return SYMBOLS.charAt(index);
	}

	/**
	 * @param c Character to normalize
	 * @return char Uppercase symbol of the alphabet corresponding to the given character
	 */
	public static char normalize (char c) {
		return SYMBOLS.charAt(getSymbolIndex(c));
	}

	/**
	 * Normalizes every character of the given sequence
	 * @param sequence to normalize
	 * @return String sequence having only symbols of the alphabet
	 */
	public static String normalize (CharSequence sequence) {
		char [] answer = new char[sequence.length()];
		for(int i=0;i<answer.length;i++) answer[i] = normalize(sequence.charAt(i));
		return new String(answer);
	}
}
