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
package dnamotifs.motifs.io;

import java.io.PrintStream;

import dnamotifs.motifs.AhoCorasickAutomaton;
import dnamotifs.sequences.NucleotideAlphabet;

/**
 * Writes the structure of a built automaton in the DOT language of Graphviz.
 * Trie edges are labeled with their symbol and fail links are drawn as dashed gray edges.
 * Only the first nodes in creation order are written to keep large automata readable
 */
public class AutomatonDotWriter {

	public static final int DEF_MAX_NODES = 1500;

	private int maxNodes = DEF_MAX_NODES;

	public int getMaxNodes() {
		return maxNodes;
	}
	public void setMaxNodes(int maxNodes) {
		if(maxNodes<1) throw new IllegalArgumentException("Maximum number of nodes must be positive. Given: "+maxNodes);
		this.maxNodes = maxNodes;
	}

	/**
	 * Writes the given automaton
	 * @param automaton Built automaton
	 * @param out Stream to write the graph
	 */
	public void write(AhoCorasickAutomaton automaton, PrintStream out) {
		if(!automaton.isBuilt()) throw new IllegalStateException("Automaton must be built before writing");
		int n = Math.min(automaton.getNumNodes(), maxNodes);
		out.println("digraph aho {");
		out.println("  rankdir=LR;");
		out.println("  node [shape=circle,fontname=Helvetica];");
		for(int i=0;i<n;i++) {
			int numOutputs = automaton.getOutputs(i).size();
			if(numOutputs>0) out.println("  n"+i+" [label=\""+i+"\\nout="+numOutputs+"\",style=filled,fillcolor=lightblue];");
			else out.println("  n"+i+" [label=\""+i+"\"];");
		}
		for(int i=0;i<n;i++) {
			for(int c=0;c<NucleotideAlphabet.ALPHABET_SIZE;c++) {
				int child = automaton.getTrieChild(i, c);
				if(child>=0 && child<n) out.println("  n"+i+" -> n"+child+" [label=\""+NucleotideAlphabet.getSymbol(c)+"\"];");
			}
		}
		for(int i=0;i<n;i++) {
			if(i==AhoCorasickAutomaton.ROOT) continue;
			int fail = automaton.getFailLink(i);
			if(fail<n) out.println("  n"+i+" -> n"+fail+" [style=dashed,color=gray,label=\"f\"];");
		}
		out.println("}");
		out.flush();
	}
}
