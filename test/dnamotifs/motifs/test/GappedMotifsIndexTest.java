package dnamotifs.motifs.test;

import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;

import junit.framework.TestCase;

import dnamotifs.motifs.AutomatonScanner;
import dnamotifs.motifs.GappedMotif;
import dnamotifs.motifs.GappedMotifsIndex;
import dnamotifs.motifs.MotifMatch;
import dnamotifs.motifs.MotifMatchesCollector;

public class GappedMotifsIndexTest extends TestCase {

	public void testGappedMatches() {
		GappedMotifsIndex index = new GappedMotifsIndex(Arrays.asList("AC.T"), 3);
		assertTrue(index.isBuilt());
		MotifMatchesCollector matches = index.search("ACGTACGTNN");
		List<MotifMatch> motifMatches = matches.getMatches(0);
		assertEquals(2, motifMatches.size());
		assertEquals(0, motifMatches.get(0).getStart());
		assertEquals(4, motifMatches.get(0).getEnd());
		assertEquals(4, motifMatches.get(1).getStart());
		assertEquals(8, motifMatches.get(1).getEnd());
		assertNull(motifMatches.get(0).getSequenceName());
		assertEquals(4, index.getMaxMotifLength());
	}

	public void testEdgeCases() {
		GappedMotifsIndex index = new GappedMotifsIndex(Arrays.asList("ACGTACGT", "GG{3}CC"), 3);
		assertEquals(0, index.search("").getTotalMatches());
		assertEquals(0, index.search("ACGT").getTotalMatches());
		MotifMatchesCollector matches = index.search("ggatcccc");
		assertEquals(1, matches.getTotalMatches());
		assertEquals(1, matches.getAllMatches().get(0).getMotifId());
		assertEquals(7, matches.getAllMatches().get(0).length());
		assertEquals(2, index.getNumMotifs());
		assertEquals("GG{3}CC", index.getMotif(1).getMotif());
	}

	public void testLiteralMotifsAgainstBruteForce() {
		String text = randomSequence(new Random(42), 3000);
		List<String> motifs = Arrays.asList("ACG", "GATTACA", "TTT", "CGCG", "AAAA", "ACG.T", "GA.TA", "TT.T.A", "C.G", "A{2}CGT..G");
		GappedMotifsIndex index = new GappedMotifsIndex();
		index.setDeduplicate(true);
		index.addMotifs(motifs);
		index.build();
		MotifMatchesCollector matches = index.search(text);
		for(int i=0;i<motifs.size();i++) {
			GappedMotif motif = index.getMotif(i);
			String expanded = expand(motif.getMotif());
			Set<Integer> expected = new TreeSet<Integer>();
			for(int start=0;start+expanded.length()<=text.length();start++) {
				if(matchesNaive(text, start, expanded)) expected.add(start);
			}
			Set<Integer> found = new TreeSet<Integer>();
			for(MotifMatch match:matches.getMatches(i)) {
				found.add(match.getStart());
				assertEquals(expanded.length(), match.length());
			}
			assertEquals("Different matches for motif "+motif.getMotif(), expected, found);
			assertEquals(expected.size(), matches.getMatches(i).size());
		}
	}

	public void testDeterminism() {
		String text = randomSequence(new Random(7), 1000);
		List<String> motifs = Arrays.asList("ACG.T", "TT{2}GA", "CCC");
		GappedMotifsIndex index = new GappedMotifsIndex(motifs, 3);
		List<MotifMatch> first = index.search(text).getAllMatches();
		List<MotifMatch> second = index.search(text).getAllMatches();
		assertEquals(first, second);
		GappedMotifsIndex other = new GappedMotifsIndex(motifs, 3);
		assertEquals(first, other.search(text).getAllMatches());
	}

	public void testMatchesFromDifferentSeeds() {
		GappedMotifsIndex index = new GappedMotifsIndex(Arrays.asList("ACG.ACG"), 3);
		assertEquals(2, index.getMotif(0).getSeeds().size());
		MotifMatchesCollector matches = index.search("ACGTACG");
		assertEquals(2, matches.getTotalMatches());
		assertEquals(matches.getAllMatches().get(0), matches.getAllMatches().get(1));

		GappedMotifsIndex unique = new GappedMotifsIndex();
		unique.setDeduplicate(true);
		unique.addMotif("ACG.ACG");
		unique.build();
		assertEquals(1, unique.search("ACGTACG").getTotalMatches());
	}

	public void testUnindexableMotifs() {
		GappedMotifsIndex index = new GappedMotifsIndex();
		try {
			index.addMotif("...");
			fail("Motifs without literals should be rejected");
		} catch (IllegalArgumentException e) {
			//Expected
		}
		index = new GappedMotifsIndex();
		index.setUnindexableMotifPolicy(GappedMotifsIndex.UNINDEXABLE_MOTIF_IGNORE);
		GappedMotif motif = index.addMotif("{4}");
		assertFalse(motif.isIndexable());
		index.addMotif("ACGT");
		index.build();
		assertEquals(2, index.getNumMotifs());
		MotifMatchesCollector matches = index.search("ACGTACGT");
		assertTrue(matches.getMatches(0).isEmpty());
		assertEquals(2, matches.getMatches(1).size());
	}

	public void testWildcardPolicies() {
		GappedMotifsIndex legacy = new GappedMotifsIndex(Arrays.asList("ACNGT"), 3);
		assertEquals(0, legacy.search("ACAGT").getTotalMatches());
		assertEquals(1, legacy.search("ACNGT").getTotalMatches());

		GappedMotifsIndex consistent = new GappedMotifsIndex();
		consistent.setWildcardPolicy(GappedMotifsIndex.WILDCARD_POLICY_CONSISTENT);
		consistent.addMotif("ACNGT");
		consistent.build();
		assertEquals(1, consistent.search("ACAGT").getTotalMatches());
		assertEquals(1, consistent.search("ACNGT").getTotalMatches());
	}

	public void testUnknownCharacters() {
		GappedMotifsIndex reset = new GappedMotifsIndex(Arrays.asList("ACGNT"), 3);
		assertEquals(0, reset.search("ACGXT").getTotalMatches());

		GappedMotifsIndex asN = new GappedMotifsIndex();
		asN.setUnknownCharacterPolicy(AutomatonScanner.UNKNOWN_CHARACTER_AS_N);
		asN.addMotif("ACGNT");
		asN.build();
		assertEquals(1, asN.search("ACGXT").getTotalMatches());
	}

	public void testVeryLongGaps() {
		GappedMotifsIndex index = new GappedMotifsIndex();
		try {
			index.addMotif("ACG{2147483646}");
			fail("Motifs longer than the maximum int should be rejected");
		} catch (IllegalArgumentException e) {
			//Expected
		}
		assertEquals(0, index.getNumMotifs());
		GappedMotif longMotif = index.addMotif("ACG{2147483600}");
		assertEquals(2147483603, longMotif.getLength());
		index.addMotif("ACG");
		index.build();
		MotifMatchesCollector matches = index.search("TTACGTT");
		assertTrue(matches.getMatches(0).isEmpty());
		assertEquals(1, matches.getMatches(1).size());
		assertEquals(2, matches.getMatches(1).get(0).getStart());
	}

	public void testLifecycle() {
		GappedMotifsIndex index = new GappedMotifsIndex();
		index.addMotif("ACGT");
		try {
			index.setMinSeedLength(2);
			fail("Seed length can not change after adding motifs");
		} catch (IllegalStateException e) {
			//Expected
		}
		try {
			index.search("ACGT");
			fail("Search requires a built index");
		} catch (IllegalStateException e) {
			//Expected
		}
		index.build();
		try {
			index.addMotif("TTT");
			fail("Motifs can not be added after build");
		} catch (IllegalStateException e) {
			//Expected
		}
		MotifMatchesCollector collector = new MotifMatchesCollector();
		index.search("seq1", "ACGT", collector);
		index.search("seq2", "TACGT", collector);
		assertEquals(2, collector.getTotalMatches());
		assertEquals("seq2", collector.getMatches(0).get(1).getSequenceName());
		assertEquals(1, collector.getMatches(0).get(1).getStart());
	}

	static String randomSequence(Random random, int length) {
		String bases = "ACGT";
		StringBuilder answer = new StringBuilder(length);
		for(int i=0;i<length;i++) answer.append(bases.charAt(random.nextInt(4)));
		return answer.toString();
	}

	private String expand(String motif) {
		StringBuilder answer = new StringBuilder();
		int i = 0;
		while(i<motif.length()) {
			char c = motif.charAt(i);
			if(c=='{') {
				int j = motif.indexOf('}', i);
				int length = Integer.parseInt(motif.substring(i+1, j));
				for(int k=0;k<length;k++) answer.append('.');
				i = j+1;
			} else {
				answer.append(c);
				i++;
			}
		}
		return answer.toString();
	}

	private boolean matchesNaive(String text, int start, String expanded) {
		for(int i=0;i<expanded.length();i++) {
			char c = expanded.charAt(i);
			if(c!='.' && c!='N' && c!=text.charAt(start+i)) return false;
		}
		return true;
	}
}
