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

import java.io.ByteArrayOutputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;

import dnamotifs.main.CommandsDescriptor;
import dnamotifs.main.OptionValuesDecoder;
import dnamotifs.main.ThreadPoolManager;
import dnamotifs.motifs.io.MotifsFileLoader;
import dnamotifs.sequences.QualifiedSequence;

/**
 * Program to find gapped motifs within the sequences of a fasta file
 */
public class GappedMotifsFinder {

	// Constants for default values
	public static final int DEF_MIN_SEED_LENGTH = MotifSeedsExtractor.DEF_MIN_SEED_LENGTH;
	public static final int DEF_NUM_THREADS = 1;
	public static final String CONCATENATED_SEQUENCE_NAME = "concatenated";

	// Logging
	private Logger log = Logger.getLogger(GappedMotifsFinder.class.getName());

	// Parameters
	private String outputFile = null;
	private int minSeedLength = DEF_MIN_SEED_LENGTH;
	private int numThreads = DEF_NUM_THREADS;
	private boolean concatenate = false;
	private boolean deduplicate = false;
	private boolean consistentWildcards = false;
	private boolean ignoreUnindexable = false;
	private boolean strictSyntax = false;
	private boolean unknownAsN = false;

	// Model attributes
	private GappedMotifsIndex index;
	private long sequencesLength = 0;

	// Get and set methods
	public Logger getLog() {
		return log;
	}
	public void setLog(Logger log) {
		this.log = log;
	}

	public String getOutputFile() {
		return outputFile;
	}
	public void setOutputFile(String outputFile) {
		this.outputFile = outputFile;
	}

	public int getMinSeedLength() {
		return minSeedLength;
	}
	public void setMinSeedLength(int minSeedLength) {
		if(minSeedLength<1) throw new IllegalArgumentException("Minimum seed length must be positive. Given: "+minSeedLength);
		this.minSeedLength = minSeedLength;
	}
	public void setMinSeedLength(String value) {
		setMinSeedLength((int)OptionValuesDecoder.decode(value, Integer.class));
	}

	public int getNumThreads() {
		return numThreads;
	}
	public void setNumThreads(int numThreads) {
		if(numThreads<1) throw new IllegalArgumentException("Number of threads must be positive. Given: "+numThreads);
		this.numThreads = numThreads;
	}
	public void setNumThreads(String value) {
		setNumThreads((int)OptionValuesDecoder.decode(value, Integer.class));
	}

	public boolean isConcatenate() {
		return concatenate;
	}
	public void setConcatenate(boolean concatenate) {
		this.concatenate = concatenate;
	}
	public void setConcatenate(Boolean concatenate) {
		setConcatenate(concatenate.booleanValue());
	}

	public boolean isDeduplicate() {
		return deduplicate;
	}
	public void setDeduplicate(boolean deduplicate) {
		this.deduplicate = deduplicate;
	}
	public void setDeduplicate(Boolean deduplicate) {
		setDeduplicate(deduplicate.booleanValue());
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

	public boolean isIgnoreUnindexable() {
		return ignoreUnindexable;
	}
	public void setIgnoreUnindexable(boolean ignoreUnindexable) {
		this.ignoreUnindexable = ignoreUnindexable;
	}
	public void setIgnoreUnindexable(Boolean ignoreUnindexable) {
		setIgnoreUnindexable(ignoreUnindexable.booleanValue());
	}

	public boolean isStrictSyntax() {
		return strictSyntax;
	}
	public void setStrictSyntax(boolean strictSyntax) {
		this.strictSyntax = strictSyntax;
	}
	public void setStrictSyntax(Boolean strictSyntax) {
		setStrictSyntax(strictSyntax.booleanValue());
	}

	public boolean isUnknownAsN() {
		return unknownAsN;
	}
	public void setUnknownAsN(boolean unknownAsN) {
		this.unknownAsN = unknownAsN;
	}
	public void setUnknownAsN(Boolean unknownAsN) {
		setUnknownAsN(unknownAsN.booleanValue());
	}

	/**
	 * @return GappedMotifsIndex Index built in the last run. Null if no index has been built
	 */
	public GappedMotifsIndex getIndex() {
		return index;
	}

	public static void main(String[] args) throws Exception {
		GappedMotifsFinder instance = new GappedMotifsFinder();
		int i = CommandsDescriptor.getInstance().loadOptions(instance, args);
		if(i+2>args.length) {
			System.err.println("A fasta file and a motifs file are required");
			CommandsDescriptor.getInstance().printHelp(GappedMotifsFinder.class);
			System.exit(1);
		}
		String fastaFile = args[i++];
		String motifsFile = args[i++];
		instance.run(fastaFile, motifsFile);
	}

	/**
	 * Runs the search of the motifs in the given file against the sequences of the given fasta file
	 * @param fastaFile File with the sequences to scan
	 * @param motifsFile File with one motif per line
	 * @throws IOException If the files can not be read or the output can not be written
	 * @throws InterruptedException If a parallel search is interrupted
	 */
	public void run(String fastaFile, String motifsFile) throws IOException, InterruptedException {
		logParameters();
		List<QualifiedSequence> sequences = OptionValuesDecoder.loadSequences(fastaFile, log);
		List<String> motifs = new MotifsFileLoader().loadMotifs(motifsFile);
		log.info("Loaded "+motifs.size()+" motifs from "+motifsFile);
		buildIndex(motifs);
		long time1 = System.currentTimeMillis();
		MotifMatchesCollector matches = search(sequences);
		long time2 = System.currentTimeMillis();
		log.info("Total sequence length: "+sequencesLength+". Motifs: "+index.getNumMotifs()+". Automaton nodes: "+index.getNumNodes()+". Total matches: "+matches.getTotalMatches()+". Search time (ms): "+(time2-time1));
		if(outputFile!=null) {
			try (PrintStream out = new PrintStream(new FileOutputStream(outputFile))) {
				printMatches(matches, out);
			}
		} else {
			printMatches(matches, System.out);
		}
	}

	private void logParameters() {
		ByteArrayOutputStream os = new ByteArrayOutputStream();
		PrintStream out = new PrintStream(os);
		out.println("Minimum seed length: "+minSeedLength);
		out.println("Number of threads: "+numThreads);
		if(concatenate) out.println("Sequences will be concatenated and scanned as a single text");
		if(deduplicate) out.println("Duplicated matches found through different seeds will be reported once");
		if(consistentWildcards) out.println("N will be treated as a wildcard within seeds");
		if(ignoreUnindexable) out.println("Motifs without literal symbols will be ignored");
		if(strictSyntax) out.println("Malformed gaps and unrecognized characters within motifs will be reported as errors");
		if(unknownAsN) out.println("Characters different from A, C, G, T and N will be read as N");
		if(outputFile!=null) out.println("Output file: "+outputFile);
		out.flush();
		log.info(os.toString());
	}

	/**
	 * Builds the index for the given motifs according with the parameters of this program
	 * @param motifs to index
	 * @return GappedMotifsIndex built index
	 */
	public GappedMotifsIndex buildIndex(List<String> motifs) {
		index = new GappedMotifsIndex();
		index.setLog(log);
		index.setMinSeedLength(minSeedLength);
		if(consistentWildcards) index.setWildcardPolicy(GappedMotifsIndex.WILDCARD_POLICY_CONSISTENT);
		if(ignoreUnindexable) index.setUnindexableMotifPolicy(GappedMotifsIndex.UNINDEXABLE_MOTIF_IGNORE);
		if(unknownAsN) index.setUnknownCharacterPolicy(AutomatonScanner.UNKNOWN_CHARACTER_AS_N);
		if(strictSyntax) {
			index.getParser().setUnrecognizedSymbolPolicy(GappedMotifParser.UNRECOGNIZED_SYMBOL_ERROR);
			index.getParser().setUnterminatedGapPolicy(GappedMotifParser.UNTERMINATED_GAP_ERROR);
		}
		index.setDeduplicate(deduplicate);
		index.addMotifs(motifs);
		index.build();
		return index;
	}

	/**
	 * Searches the indexed motifs in the given sequences
	 * @param sequences to scan
	 * @return MotifMatchesCollector Matches of all sequences. Matches of each motif follow the order of the sequences
	 * @throws InterruptedException If the parallel search is interrupted
	 * @throws RuntimeException The first exception thrown while scanning a sequence
	 */
	public MotifMatchesCollector search(List<QualifiedSequence> sequences) throws InterruptedException {
		if(index==null) throw new IllegalStateException("Motifs index must be built before searching");
		sequencesLength = 0;
		for(QualifiedSequence seq:sequences) sequencesLength+=seq.getLength();
		if(concatenate) {
			QualifiedSequence joined = new QualifiedSequence(CONCATENATED_SEQUENCE_NAME, QualifiedSequence.concatenate(sequences));
			sequences = new ArrayList<QualifiedSequence>(1);
			sequences.add(joined);
		}
		List<MotifMatchesCollector> collectors = new ArrayList<MotifMatchesCollector>(sequences.size());
		for(int i=0;i<sequences.size();i++) collectors.add(new MotifMatchesCollector(deduplicate));
		if(numThreads==1 || sequences.size()==1) {
			for(int i=0;i<sequences.size();i++) searchSequence(sequences.get(i), collectors.get(i));
		} else {
			ThreadPoolManager pool = new ThreadPoolManager(numThreads, Math.max(1, sequences.size()));
			//First failure of a scanning task. Partial results are never returned
			final AtomicReference<RuntimeException> failure = new AtomicReference<RuntimeException>();
			for(int i=0;i<sequences.size();i++) {
				final QualifiedSequence seq = sequences.get(i);
				final MotifMatchesCollector collector = collectors.get(i);
				pool.queueTask(()->{
					try {
						searchSequence(seq, collector);
					} catch (RuntimeException e) {
						failure.compareAndSet(null, e);
					}
				});
			}
			pool.terminatePool();
			RuntimeException e = failure.get();
			if(e!=null) throw e;
		}
		MotifMatchesCollector answer = new MotifMatchesCollector(deduplicate);
		for(MotifMatchesCollector collector:collectors) answer.addAll(collector);
		return answer;
	}

	private void searchSequence(QualifiedSequence seq, MotifMatchesCollector collector) {
		index.search(seq.getName(), seq.getCharacters(), collector);
		log.fine("Found "+collector.getTotalMatches()+" matches in sequence "+seq.getName());
	}

	/**
	 * Prints the given matches in tab delimited format. Columns are sequence name, motif id, motif, start (zero based) and end (exclusive)
	 * @param matches to print
	 * @param out Stream to print the matches
	 */
	public void printMatches(MotifMatchesCollector matches, PrintStream out) {
		for(MotifMatch match:matches.getAllMatches()) {
			GappedMotif motif = index.getMotif(match.getMotifId());
			out.println(match.getSequenceName()+"\t"+match.getMotifId()+"\t"+motif.getMotif()+"\t"+match.getStart()+"\t"+match.getEnd());
		}
		out.flush();
	}
}
