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
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;
import java.util.Queue;

import dnamotifs.sequences.NucleotideAlphabet;

/**
 * Aho-Corasick automaton over the five symbols alphabet. Nodes are stored in arrays indexed by
 * dense integer ids. Node 0 is the root. Seeds are added to the trie first, then {@link #build()}
 * calculates the fail links, completes the transition function of every node and closes the output
 * sets through the fail links. After build the automaton is read only and can be shared between threads
 * @see <a href="https://doi.org/10.1145/360825.360855">Aho and Corasick (1975)</a>
 */
public class AhoCorasickAutomaton {

	public static final int ROOT = 0;
	private static final int UNDEFINED = -1;
	private static final int DEF_CAPACITY = 64;

	//Transition table. One row per node and one column per symbol
	private int [][] transitions;
	private int [] failLinks;
	//Trie structure kept to tell trie edges from completed transitions
	private int [] parents;
	private byte [] parentSymbols;
	private int [] depths;
	//Seeds ending at each node, including the seeds inherited through fail links after build
	private List<List<MotifSeed>> outputs = new ArrayList<List<MotifSeed>>();
	private int numNodes = 0;
	private int numSeeds = 0;
	private boolean built = false;

	public AhoCorasickAutomaton() {
		transitions = new int[DEF_CAPACITY][];
		failLinks = new int[DEF_CAPACITY];
		parents = new int[DEF_CAPACITY];
		parentSymbols = new byte[DEF_CAPACITY];
		depths = new int[DEF_CAPACITY];
		createNode(UNDEFINED, (byte)UNDEFINED);
	}

	/**
	 * Adds the given seed to the trie
	 * @param seed to add. The characters of the seed are normalized to the five symbols alphabet
	 * @throws IllegalStateException If the automaton was already built
	 */
	public void addSeed(MotifSeed seed) {
		if(built) throw new IllegalStateException("Seeds can not be added after building the automaton");
		String sequence = seed.getSequence();
		int node = ROOT;
		for(int i=0;i<sequence.length();i++) {
			byte symbol = NucleotideAlphabet.getSymbolIndex(sequence.charAt(i));
			int next = transitions[node][symbol];
			if(next==UNDEFINED) {
				next = createNode(node, symbol);
				transitions[node][symbol] = next;
			}
			node = next;
		}
		outputs.get(node).add(seed);
		numSeeds++;
	}

	public void addSeeds(List<MotifSeed> seeds) {
		for(MotifSeed seed:seeds) addSeed(seed);
	}

	/**
	 * Calculates fail links and outputs through a breadth first traversal of the trie.
	 * Undefined transitions of each node are completed with the transition of its fail link
	 */
	public void build() {
		if(built) return;
		Queue<Integer> agenda = new LinkedList<Integer>();
		failLinks[ROOT] = ROOT;
		int [] rootTransitions = transitions[ROOT];
		for(int c=0;c<NucleotideAlphabet.ALPHABET_SIZE;c++) {
			int child = rootTransitions[c];
			if(child!=UNDEFINED) {
				failLinks[child] = ROOT;
				agenda.add(child);
			} else {
				rootTransitions[c] = ROOT;
			}
		}
		while(!agenda.isEmpty()) {
			int r = agenda.poll();
			int [] nodeTransitions = transitions[r];
			//The fail link has a lower depth, so its transitions are already complete
			int [] failTransitions = transitions[failLinks[r]];
			for(int c=0;c<NucleotideAlphabet.ALPHABET_SIZE;c++) {
				int u = nodeTransitions[c];
				if(u==UNDEFINED) {
					nodeTransitions[c] = failTransitions[c];
					continue;
				}
				int fail = failTransitions[c];
				failLinks[u] = fail;
				outputs.get(u).addAll(outputs.get(fail));
				agenda.add(u);
			}
		}
		for(int i=0;i<numNodes;i++) {
			List<MotifSeed> nodeOutputs = outputs.get(i);
			if(nodeOutputs.isEmpty()) outputs.set(i, Collections.<MotifSeed>emptyList());
			else outputs.set(i, Collections.unmodifiableList(nodeOutputs));
		}
		built = true;
	}

	private int createNode(int parent, byte symbol) {
		if(numNodes==transitions.length) resizeArrays();
		int id = numNodes;
		int [] nodeTransitions = new int[NucleotideAlphabet.ALPHABET_SIZE];
		Arrays.fill(nodeTransitions, UNDEFINED);
		transitions[id] = nodeTransitions;
		failLinks[id] = ROOT;
		parents[id] = parent;
		parentSymbols[id] = symbol;
		depths[id] = (parent==UNDEFINED)?0:depths[parent]+1;
		outputs.add(new ArrayList<MotifSeed>(1));
		numNodes++;
		return id;
	}

	private void resizeArrays() {
		int newCapacity = 2*transitions.length;
		if(newCapacity<0) newCapacity = Integer.MAX_VALUE;
		transitions = Arrays.copyOf(transitions, newCapacity);
		failLinks = Arrays.copyOf(failLinks, newCapacity);
		parents = Arrays.copyOf(parents, newCapacity);
		parentSymbols = Arrays.copyOf(parentSymbols, newCapacity);
		depths = Arrays.copyOf(depths, newCapacity);
	}

	public boolean isBuilt() {
		return built;
	}

	public int getNumNodes() {
		return numNodes;
	}

	public int getNumSeeds() {
		return numSeeds;
	}

	/**
	 * Follows the transition function of the automaton
	 * @param node Current node
	 * @param symbol Index of the symbol in the alphabet
	 * @return int Next node. Always defined after build
	 */
	public int getNextNode(int node, int symbol) {
		if(!built) throw new IllegalStateException("Automaton must be built before following transitions");
		return transitions[node][symbol];
	}

	/**
	 * @param node Id of a node
	 * @return int Node reached by the longest proper suffix of the path of the given node that is also a path in the trie
	 */
	public int getFailLink(int node) {
		return failLinks[node];
	}

	/**
	 * @param node Id of a node
	 * @return List<MotifSeed> Seeds recognized when the scan reaches the given node. Seeds ending at the node go first
	 */
	public List<MotifSeed> getOutputs(int node) {
		return outputs.get(node);
	}

	public int getParent(int node) {
		return parents[node];
	}

	public int getDepth(int node) {
		return depths[node];
	}

	/**
	 * Finds the child of the given node within the trie, without following completed transitions
	 * @param node Parent node
	 * @param symbol Index of the symbol
	 * @return int Child node or -1 if the trie does not have an edge from the node with the given symbol
	 */
	public int getTrieChild(int node, int symbol) {
		int next = transitions[node][symbol];
		if(next==UNDEFINED || next==ROOT) return UNDEFINED;
		if(parents[next]!=node || parentSymbols[next]!=symbol) return UNDEFINED;
		return next;
	}

	/**
	 * Walks the trie from the root following the given path
	 * @param path Sequence of symbols
	 * @return int Node at the end of the path or -1 if the path is not in the trie
	 */
	public int findNode(CharSequence path) {
		int node = ROOT;
		for(int i=0;i<path.length() && node!=UNDEFINED;i++) {
			node = getTrieChild(node, NucleotideAlphabet.getSymbolIndex(path.charAt(i)));
		}
		return node;
	}
}
