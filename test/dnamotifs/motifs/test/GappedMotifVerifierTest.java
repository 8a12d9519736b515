package dnamotifs.motifs.test;

import junit.framework.TestCase;

import dnamotifs.motifs.GappedMotif;
import dnamotifs.motifs.GappedMotifParser;
import dnamotifs.motifs.GappedMotifVerifier;
import dnamotifs.motifs.MotifSeed;
import dnamotifs.motifs.SeedHit;

public class GappedMotifVerifierTest extends TestCase {
	private GappedMotifParser parser = new GappedMotifParser();
	private GappedMotifVerifier verifier = new GappedMotifVerifier();

	public void testMatchesAt() {
		GappedMotif motif = parser.parse(0, "AC.T");
		assertTrue(verifier.matchesAt("ACGT", 0, motif));
		assertTrue(verifier.matchesAt("acct", 0, motif));
		assertFalse(verifier.matchesAt("ACGA", 0, motif));
		assertTrue(verifier.matchesAt("GGACGT", 2, motif));
		assertFalse(verifier.matchesAt("ACGT", -1, motif));
		assertFalse(verifier.matchesAt("ACG", 0, motif));
		assertFalse(verifier.matchesAt("TTACG", 2, motif));
	}

	public void testWildcards() {
		GappedMotif motif = parser.parse(0, "ANT");
		assertTrue(verifier.matchesAt("AGT", 0, motif));
		assertTrue(verifier.matchesAt("ANT", 0, motif));
		assertTrue(verifier.matchesAt("A-T", 0, motif));
		assertFalse(verifier.matchesAt("AGG", 0, motif));
	}

	public void testCandidateStart() {
		SeedHit hit = new SeedHit(5, new MotifSeed("GT", 0, 2));
		assertEquals(2, verifier.getCandidateStart(hit));
		assertEquals(hit.estimateMotifStart(), verifier.getCandidateStart(hit));

		GappedMotif motif = parser.parse(0, "..ACG");
		SeedHit early = new SeedHit(2, new MotifSeed("ACG", 0, 2));
		assertEquals(-2, verifier.getCandidateStart(early));
		assertFalse(verifier.verify("ACGTT", early, motif));
		SeedHit inside = new SeedHit(4, new MotifSeed("ACG", 0, 2));
		assertTrue(verifier.verify("TTACG", inside, motif));
	}
}
