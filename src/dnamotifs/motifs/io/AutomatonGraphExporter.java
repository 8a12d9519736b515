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

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import java.util.logging.Logger;

import dnamotifs.main.CommandsDescriptor;
import dnamotifs.main.OptionValuesDecoder;
import dnamotifs.motifs.GappedMotifsIndex;
import dnamotifs.motifs.MotifSeedsExtractor;

/**
 * Program to build the automaton of a list of motifs and save its structure in DOT format
 */
public class AutomatonGraphExporter {

	public static final int DEF_MIN_SEED_LENGTH = MotifSeedsExtractor.DEF_MIN_SEED_LENGTH;
	public static final int DEF_MAX_NODES = AutomatonDotWriter.DEF_MAX_NODES;

	private Logger log = Logger.getLogger(AutomatonGraphExporter.class.getName());

	private int minSeedLength = DEF_MIN_SEED_LENGTH;
	private int maxNodes = DEF_MAX_NODES;
	private boolean consistentWildcards = false;

	public Logger getLog() {
		return log;
	}
	public void setLog(Logger log) {
		this.log = log;
	}

	public int getMinSeedLength() {
		return minSeedLength;
	}
	public void setMinSeedLength(int minSeedLength) {
		this.minSeedLength = minSeedLength;
	}
	public void setMinSeedLength(String value) {
		setMinSeedLength((int)OptionValuesDecoder.decode(value, Integer.class));
	}

	public int getMaxNodes() {
		return maxNodes;
	}
	public void setMaxNodes(int maxNodes) {
		this.maxNodes = maxNodes;
	}
	public void setMaxNodes(String value) {
		setMaxNodes((int)OptionValuesDecoder.decode(value, Integer.class));
	}

	public boolean isConsistentWildcards() {
		return consistentWildcards;
	}
	public void setConsistentWildcards(boolean consistentWildcards) {
		this.consistentWildcards = consistentWildcards;
	}
	public void setConsistentWildcards(Boolean consistentWildcards) {
		setConsistentWildcards(consistentWildcards.booleanValue());
	}

	public static void main(String[] args) throws Exception {
		AutomatonGraphExporter instance = new AutomatonGraphExporter();
		int i = CommandsDescriptor.getInstance().loadOptions(instance, args);
		if(i+2>args.length) {
			System.err.println("A motifs file and an output file are required");
			CommandsDescriptor.getInstance().printHelp(AutomatonGraphExporter.class);
			System.exit(1);
		}
		instance.run(args[i], args[i+1]);
	}

	/**
	 * Builds the automaton of the motifs in the given file and writes it
	 * @param motifsFile File with one motif per line
	 * @param outputFile File to write the DOT graph
	 * @throws IOException If the motifs can not be read or the output can not be written
	 */
	public void run(String motifsFile, String outputFile) throws IOException {
		List<String> motifs = new MotifsFileLoader().loadMotifs(motifsFile);
		GappedMotifsIndex index = new GappedMotifsIndex();
		index.setLog(log);
		index.setMinSeedLength(minSeedLength);
		if(consistentWildcards) index.setWildcardPolicy(GappedMotifsIndex.WILDCARD_POLICY_CONSISTENT);
		index.setUnindexableMotifPolicy(GappedMotifsIndex.UNINDEXABLE_MOTIF_IGNORE);
		index.addMotifs(motifs);
		index.build();
		AutomatonDotWriter writer = new AutomatonDotWriter();
		writer.setMaxNodes(maxNodes);
		try (PrintStream out = new PrintStream(new FileOutputStream(outputFile))) {
			writer.write(index.getAutomaton(), out);
		}
		log.info("Saved automaton with "+index.getNumNodes()+" nodes to "+outputFile+". Written nodes: "+Math.min(maxNodes, index.getNumNodes()));
	}
}
