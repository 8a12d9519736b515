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
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import dnamotifs.sequences.NucleotideAlphabet;

/**
 * Lazy sequence of the seed hits produced by driving a text through a built automaton.
 * Every call to {@link #iterator()} starts a new scan from the beginning of the text
 */
public class AutomatonScanner implements Iterable<SeedHit> {

	/**
	 * Characters outside the nucleotides alphabet send the automaton back to the root
	 */
	public static final byte UNKNOWN_CHARACTER_RESET = 0;
	/**
	 * Characters outside the nucleotides alphabet are read as N
	 */
	public static final byte UNKNOWN_CHARACTER_AS_N = 1;

	private final AhoCorasickAutomaton automaton;
	private final CharSequence text;
	private final byte unknownCharacterPolicy;

	public AutomatonScanner(AhoCorasickAutomaton automaton, CharSequence text) {
		this(automaton, text, UNKNOWN_CHARACTER_RESET);
	}

	public AutomatonScanner(AhoCorasickAutomaton automaton, CharSequence text, byte unknownCharacterPolicy) {
		if(!automaton.isBuilt()) throw new IllegalStateException("Automaton must be built before scanning");
		if(unknownCharacterPolicy!=UNKNOWN_CHARACTER_RESET && unknownCharacterPolicy!=UNKNOWN_CHARACTER_AS_N) throw new IllegalArgumentException("Invalid policy for unknown characters: "+unknownCharacterPolicy);
		this.automaton = automaton;
		this.text = text;
		this.unknownCharacterPolicy = unknownCharacterPolicy;
	}

	public CharSequence getText() {
		return text;
	}

	@Override
	public Iterator<SeedHit> iterator() {
		return new SeedHitsIterator();
	}

	/**
	 * Runs the whole scan and keeps the hits in memory
	 * @return List<SeedHit> Hits sorted by end position in the text
	 */
	public List<SeedHit> collectHits() {
		List<SeedHit> hits = new ArrayList<SeedHit>();
		for(SeedHit hit:this) hits.add(hit);
		return hits;
	}

	private class SeedHitsIterator implements Iterator<SeedHit> {
		private int node = AhoCorasickAutomaton.ROOT;
		//Next position of the text to consume
		private int position = 0;
		private List<MotifSeed> pendingOutputs = Collections.emptyList();
		private int pendingIndex = 0;
		private int pendingEnd = -1;

		@Override
		public boolean hasNext() {
			int n = text.length();
			while(pendingIndex==pendingOutputs.size() && position<n) {
				advance(text.charAt(position));
				if(!pendingOutputs.isEmpty()) pendingEnd = position;
				position++;
			}
			return pendingIndex<pendingOutputs.size();
		}

		@Override
		public SeedHit next() {
			if(!hasNext()) throw new NoSuchElementException();
			SeedHit hit = new SeedHit(pendingEnd, pendingOutputs.get(pendingIndex));
			pendingIndex++;
			return hit;
		}

		private void advance(char c) {
			int symbol = NucleotideAlphabet.getIndex(c);
			if(symbol<0) {
				if(unknownCharacterPolicy==UNKNOWN_CHARACTER_RESET) {
					node = AhoCorasickAutomaton.ROOT;
					pendingOutputs = Collections.emptyList();
					pendingIndex = 0;
					return;
				}
				symbol = NucleotideAlphabet.INDEX_N;
			}
			node = automaton.getNextNode(node, symbol);
			pendingOutputs = automaton.getOutputs(node);
			pendingIndex = 0;
		}
	}
}
