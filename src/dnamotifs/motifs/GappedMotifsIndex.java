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
import java.util.List;
import java.util.logging.Logger;

/**
 * Index of gapped motifs built on an Aho-Corasick automaton over motif seeds.
 * Motifs are added first and then the index is built. A built index is read only, so the same index
 * can be used to search several texts, even from different threads, each search having its own collector
 */
public class GappedMotifsIndex {

	public static final byte UNINDEXABLE_MOTIF_REJECT = 0;
	public static final byte UNINDEXABLE_MOTIF_IGNORE = 1;
	/**
	 * N is a concrete symbol within seeds and a wildcard during verification
	 */
	public static final byte WILDCARD_POLICY_LEGACY = 0;
	/**
	 * N is a wildcard everywhere. Seeds never include N
	 */
	public static final byte WILDCARD_POLICY_CONSISTENT = 1;

	private Logger log = Logger.getLogger(GappedMotifsIndex.class.getName());

	// Parameters
	private GappedMotifParser parser = new GappedMotifParser();
	private MotifSeedsExtractor seedsExtractor = new MotifSeedsExtractor();
	private byte wildcardPolicy = WILDCARD_POLICY_LEGACY;
	private byte unindexableMotifPolicy = UNINDEXABLE_MOTIF_REJECT;
	private byte unknownCharacterPolicy = AutomatonScanner.UNKNOWN_CHARACTER_RESET;
	private boolean deduplicate = false;

	// Model attributes
	private List<GappedMotif> motifs = new ArrayList<GappedMotif>();
	private AhoCorasickAutomaton automaton = new AhoCorasickAutomaton();
	private GappedMotifVerifier verifier = new GappedMotifVerifier();
	private int maxMotifLength = 0;
	private int numUnindexable = 0;

	public GappedMotifsIndex() {
	}

	/**
	 * Creates and builds an index with default parameters and the given minimum seed length
	 * @param motifs to index
	 * @param minSeedLength minimum length of the literal runs used as seeds
	 */
	public GappedMotifsIndex(List<String> motifs, int minSeedLength) {
		setMinSeedLength(minSeedLength);
		addMotifs(motifs);
		build();
	}

	public Logger getLog() {
		return log;
	}
	public void setLog(Logger log) {
		this.log = log;
	}

	public GappedMotifParser getParser() {
		return parser;
	}

	public int getMinSeedLength() {
		return seedsExtractor.getMinSeedLength();
	}
	public void setMinSeedLength(int minSeedLength) {
		checkEmpty();
		seedsExtractor.setMinSeedLength(minSeedLength);
	}

	public byte getWildcardPolicy() {
		return wildcardPolicy;
	}
	public void setWildcardPolicy(byte wildcardPolicy) {
		if(wildcardPolicy!=WILDCARD_POLICY_LEGACY && wildcardPolicy!=WILDCARD_POLICY_CONSISTENT) throw new IllegalArgumentException("Invalid wildcard policy: "+wildcardPolicy);
		checkEmpty();
		this.wildcardPolicy = wildcardPolicy;
		seedsExtractor.setWildcardsInSeeds(wildcardPolicy==WILDCARD_POLICY_LEGACY);
	}

	public byte getUnindexableMotifPolicy() {
		return unindexableMotifPolicy;
	}
	public void setUnindexableMotifPolicy(byte unindexableMotifPolicy) {
		if(unindexableMotifPolicy!=UNINDEXABLE_MOTIF_REJECT && unindexableMotifPolicy!=UNINDEXABLE_MOTIF_IGNORE) throw new IllegalArgumentException("Invalid policy for unindexable motifs: "+unindexableMotifPolicy);
		this.unindexableMotifPolicy = unindexableMotifPolicy;
	}

	public byte getUnknownCharacterPolicy() {
		return unknownCharacterPolicy;
	}
	public void setUnknownCharacterPolicy(byte unknownCharacterPolicy) {
		if(unknownCharacterPolicy!=AutomatonScanner.UNKNOWN_CHARACTER_RESET && unknownCharacterPolicy!=AutomatonScanner.UNKNOWN_CHARACTER_AS_N) throw new IllegalArgumentException("Invalid policy for unknown characters: "+unknownCharacterPolicy);
		this.unknownCharacterPolicy = unknownCharacterPolicy;
	}

	public boolean isDeduplicate() {
		return deduplicate;
	}
	public void setDeduplicate(boolean deduplicate) {
		this.deduplicate = deduplicate;
	}

	private void checkEmpty() {
		if(!motifs.isEmpty()) throw new IllegalStateException("Seed extraction parameters can not change after adding motifs");
	}

	/**
	 * Parses the given motif, extracts its seeds and adds them to the automaton
	 * @param motif String in the motifs mini language
	 * @return GappedMotif parsed motif. Its id is the number of motifs added before
	 * @throws IllegalArgumentException If the motif can not be parsed or if it has no seeds and unindexable motifs are rejected
	 * @throws IllegalStateException If the index is already built
	 */
	public GappedMotif addMotif(String motif) {
		if(automaton.isBuilt()) throw new IllegalStateException("Motifs can not be added after building the index");
		GappedMotif parsed = parser.parse(motifs.size(), motif);
		List<MotifSeed> seeds = seedsExtractor.extractSeeds(parsed);
		if(seeds.isEmpty()) {
			if(unindexableMotifPolicy==UNINDEXABLE_MOTIF_REJECT) throw new IllegalArgumentException("Motif "+motif+" does not have literal symbols that can be indexed");
			log.warning("Motif "+motif+" does not have literal symbols that can be indexed. It will not be searched");
			numUnindexable++;
		}
		parsed.setSeeds(seeds);
		automaton.addSeeds(seeds);
		motifs.add(parsed);
		maxMotifLength = Math.max(maxMotifLength, parsed.getLength());
		return parsed;
	}

	public void addMotifs(List<String> motifs) {
		for(String motif:motifs) addMotif(motif);
	}

	/**
	 * Builds the automaton. After this call motifs can not be added
	 */
	public void build() {
		automaton.build();
		log.info("Built automaton with "+automaton.getNumNodes()+" nodes for "+automaton.getNumSeeds()+" seeds of "+motifs.size()+" motifs. Unindexable motifs: "+numUnindexable);
	}

	public boolean isBuilt() {
		return automaton.isBuilt();
	}

	public List<GappedMotif> getMotifs() {
		return Collections.unmodifiableList(motifs);
	}

	public GappedMotif getMotif(int motifId) {
		return motifs.get(motifId);
	}

	public int getNumMotifs() {
		return motifs.size();
	}

	/**
	 * @return int Length of the longest motif. Windows of a long text must overlap by at least this length minus one
	 */
	public int getMaxMotifLength() {
		return maxMotifLength;
	}

	public AhoCorasickAutomaton getAutomaton() {
		return automaton;
	}

	public int getNumNodes() {
		return automaton.getNumNodes();
	}

	/**
	 * Searches the motifs in the given text
	 * @param text to scan
	 * @return MotifMatchesCollector New collector with the verified matches
	 */
	public MotifMatchesCollector search(CharSequence text) {
		MotifMatchesCollector collector = new MotifMatchesCollector(deduplicate);
		search(null, text, collector);
		return collector;
	}

	/**
	 * Searches the motifs in the given text adding the verified matches to the given collector
	 * @param sequenceName Name of the scanned sequence. Assigned to every match
	 * @param text to scan
	 * @param collector receiving the verified matches
	 */
	public void search(String sequenceName, CharSequence text, MotifMatchesCollector collector) {
		if(!automaton.isBuilt()) throw new IllegalStateException("Index must be built before searching");
		AutomatonScanner scanner = new AutomatonScanner(automaton, text, unknownCharacterPolicy);
		for(SeedHit hit:scanner) {
			GappedMotif motif = motifs.get(hit.getMotifId());
			int start = verifier.getCandidateStart(hit);
			if(verifier.matchesAt(text, start, motif)) {
				collector.addMatch(new MotifMatch(sequenceName, motif.getId(), start, start+motif.getLength()));
			}
		}
	}
}
