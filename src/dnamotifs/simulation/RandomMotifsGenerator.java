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
package dnamotifs.simulation;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

import dnamotifs.main.CommandsDescriptor;
import dnamotifs.main.OptionValuesDecoder;
import dnamotifs.sequences.QualifiedSequence;

/**
 * Generates test sets of gapped motifs sampling substrings of a genome and masking some of their positions with gaps
 */
public class RandomMotifsGenerator {

	public static final double DEF_GAP_FRACTION = 0.2;
	public static final long DEF_SEED = 123456;
	//Default sets as pairs of number of motifs and motif length
	public static final int [][] DEF_CONFIGURATIONS = {{10,10},{50,12},{200,20}};

	private Logger log = Logger.getLogger(RandomMotifsGenerator.class.getName());

	private double gapFraction = DEF_GAP_FRACTION;
	private long seed = DEF_SEED;
	private int numMotifs = 0;
	private int motifLength = 0;

	private Random random = new Random(DEF_SEED);

	public Logger getLog() {
		return log;
	}
	public void setLog(Logger log) {
		this.log = log;
	}

	public double getGapFraction() {
		return gapFraction;
	}
	public void setGapFraction(double gapFraction) {
		if(gapFraction<0 || gapFraction>1) throw new IllegalArgumentException("Gap fraction must be between 0 and 1. Given: "+gapFraction);
		this.gapFraction = gapFraction;
	}
	public void setGapFraction(String value) {
		setGapFraction((double)OptionValuesDecoder.decode(value, Double.class));
	}

	public long getSeed() {
		return seed;
	}
	public void setSeed(long seed) {
		this.seed = seed;
		this.random = new Random(seed);
	}
	public void setSeed(String value) {
		setSeed((long)OptionValuesDecoder.decode(value, Long.class));
	}

	public int getNumMotifs() {
		return numMotifs;
	}
	/**
	 * Sets the number of motifs of a custom set. If zero, the default sets are generated
	 * @param numMotifs Number of motifs
	 */
	public void setNumMotifs(int numMotifs) {
		if(numMotifs<0) throw new IllegalArgumentException("Number of motifs can not be negative. Given: "+numMotifs);
		this.numMotifs = numMotifs;
	}
	public void setNumMotifs(String value) {
		setNumMotifs((int)OptionValuesDecoder.decode(value, Integer.class));
	}

	public int getMotifLength() {
		return motifLength;
	}
	public void setMotifLength(int motifLength) {
		if(motifLength<0) throw new IllegalArgumentException("Motif length can not be negative. Given: "+motifLength);
		this.motifLength = motifLength;
	}
	public void setMotifLength(String value) {
		setMotifLength((int)OptionValuesDecoder.decode(value, Integer.class));
	}

	public static void main(String[] args) throws Exception {
		RandomMotifsGenerator instance = new RandomMotifsGenerator();
		int i = CommandsDescriptor.getInstance().loadOptions(instance, args);
		if(i+2>args.length) {
			System.err.println("A fasta file and an output prefix are required");
			CommandsDescriptor.getInstance().printHelp(RandomMotifsGenerator.class);
			System.exit(1);
		}
		instance.run(args[i], args[i+1]);
	}

	/**
	 * Generates the motif sets and saves each set in a file named prefix_count.txt
	 * @param fastaFile Genome to sample
	 * @param outputPrefix Prefix of the output files
	 * @throws IOException If the genome can not be read or the output files can not be written
	 */
	public void run(String fastaFile, String outputPrefix) throws IOException {
		String text = QualifiedSequence.concatenate(OptionValuesDecoder.loadSequences(fastaFile, log));
		int [][] configurations = DEF_CONFIGURATIONS;
		if(numMotifs>0 && motifLength>0) configurations = new int[][] {{numMotifs,motifLength}};
		for(int [] configuration:configurations) {
			int count = configuration[0];
			List<String> motifs = generateMotifs(text, count, configuration[1]);
			String filename = outputPrefix+"_"+count+".txt";
			try (PrintStream out = new PrintStream(new FileOutputStream(filename))) {
				for(String motif:motifs) out.println(motif);
			}
			log.info("Saved "+filename+" with "+count+" motifs of length "+configuration[1]);
		}
	}

	/**
	 * Samples random substrings of the given text and adds gaps to them
	 * @param text to sample
	 * @param count Number of motifs
	 * @param length Length of each motif
	 * @return List<String> Generated motifs
	 */
	public List<String> generateMotifs(CharSequence text, int count, int length) {
		if(length<1) throw new IllegalArgumentException("Motif length must be positive. Given: "+length);
		if(text.length()<=length) throw new IllegalArgumentException("Sequence of length "+text.length()+" is too short to sample motifs of length "+length);
		List<String> motifs = new ArrayList<String>(count);
		for(int i=0;i<count;i++) {
			int start = random.nextInt(text.length()-length);
			String motif = text.subSequence(start, start+length).toString();
			motifs.add(addGaps(motif));
		}
		return motifs;
	}

	/**
	 * Replaces randomly chosen positions of the given sequence with dots.
	 * The number of positions is the gap fraction times the length, truncated and at least one if the fraction is positive
	 * @param sequence to mask
	 * @return String masked sequence
	 */
	public String addGaps(String sequence) {
		if(gapFraction<=0 || sequence.length()==0) return sequence;
		int toGap = Math.max(1, (int)(sequence.length()*gapFraction));
		toGap = Math.min(toGap, sequence.length());
		Set<Integer> positions = new TreeSet<Integer>();
		while(positions.size()<toGap) positions.add(random.nextInt(sequence.length()));
		char [] answer = sequence.toCharArray();
		for(int pos:positions) answer[pos] = '.';
		return new String(answer);
	}
}
