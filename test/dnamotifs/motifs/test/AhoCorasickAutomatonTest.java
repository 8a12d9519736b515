package dnamotifs.motifs.test;

import java.util.List;

import junit.framework.TestCase;

import dnamotifs.motifs.AhoCorasickAutomaton;
import dnamotifs.motifs.AutomatonScanner;
import dnamotifs.motifs.MotifSeed;
import dnamotifs.motifs.SeedHit;
import dnamotifs.sequences.NucleotideAlphabet;

public class AhoCorasickAutomatonTest extends TestCase {

	public void testOverlappingSeeds() {
		AhoCorasickAutomaton automaton = new AhoCorasickAutomaton();
		automaton.addSeed(new MotifSeed("AC", 0, 0));
		automaton.addSeed(new MotifSeed("CG", 1, 0));
		automaton.addSeed(new MotifSeed("GT", 2, 0));
		assertEquals(7, automaton.getNumNodes());
		assertEquals(3, automaton.getNumSeeds());
		automaton.build();
		List<SeedHit> hits = new AutomatonScanner(automaton, "ACGT").collectHits();
		assertEquals(3, hits.size());
		for(int i=0;i<hits.size();i++) {
			SeedHit hit = hits.get(i);
			assertEquals(i+1, hit.getTextEnd());
			assertEquals(i, hit.getMotifId());
			assertEquals(i, hit.getTextStart());
		}
	}

	public void testFailLinksAndOutputs() {
		AhoCorasickAutomaton automaton = new AhoCorasickAutomaton();
		automaton.addSeed(new MotifSeed("ACG", 0, 0));
		automaton.addSeed(new MotifSeed("CG", 1, 0));
		automaton.addSeed(new MotifSeed("GA", 2, 0));
		automaton.build();
		int nodeACG = automaton.findNode("ACG");
		int nodeCG = automaton.findNode("CG");
		int nodeAC = automaton.findNode("AC");
		assertTrue(nodeACG>0);
		assertEquals(3, automaton.getDepth(nodeACG));
		assertEquals(nodeAC, automaton.getParent(nodeACG));
		assertEquals(nodeCG, automaton.getFailLink(nodeACG));
		assertEquals(automaton.findNode("C"), automaton.getFailLink(nodeAC));
		assertEquals(automaton.findNode("G"), automaton.getFailLink(nodeCG));
		assertEquals(AhoCorasickAutomaton.ROOT, automaton.getFailLink(automaton.findNode("A")));

		List<MotifSeed> outputs = automaton.getOutputs(nodeACG);
		assertEquals(2, outputs.size());
		assertEquals("ACG", outputs.get(0).getSequence());
		assertEquals("CG", outputs.get(1).getSequence());
		assertTrue(automaton.getOutputs(nodeAC).isEmpty());

		//Completed transitions
		int symbolA = NucleotideAlphabet.getIndex('A');
		int symbolT = NucleotideAlphabet.getIndex('T');
		assertEquals(automaton.findNode("GA"), automaton.getNextNode(nodeACG, symbolA));
		assertEquals(AhoCorasickAutomaton.ROOT, automaton.getNextNode(nodeACG, symbolT));
		assertEquals(AhoCorasickAutomaton.ROOT, automaton.getNextNode(AhoCorasickAutomaton.ROOT, symbolT));
		assertEquals(-1, automaton.getTrieChild(nodeACG, symbolA));
		assertEquals(-1, automaton.findNode("TT"));
	}

	public void testLifecycle() {
		AhoCorasickAutomaton automaton = new AhoCorasickAutomaton();
		automaton.addSeed(new MotifSeed("ACG", 0, 0));
		try {
			automaton.getNextNode(AhoCorasickAutomaton.ROOT, 0);
			fail("Transitions are not available before build");
		} catch (IllegalStateException e) {
			//Expected
		}
		automaton.build();
		automaton.build();
		assertTrue(automaton.isBuilt());
		try {
			automaton.addSeed(new MotifSeed("TTT", 1, 0));
			fail("Seeds can not be added after build");
		} catch (IllegalStateException e) {
			//Expected
		}
	}

	public void testAllKmers() {
		AhoCorasickAutomaton automaton = new AhoCorasickAutomaton();
		String bases = "ACGT";
		int id = 0;
		for(int i=0;i<4;i++) {
			for(int j=0;j<4;j++) {
				for(int k=0;k<4;k++) {
					for(int l=0;l<4;l++) {
						String kmer = ""+bases.charAt(i)+bases.charAt(j)+bases.charAt(k)+bases.charAt(l);
						automaton.addSeed(new MotifSeed(kmer, id, 0));
						id++;
					}
				}
			}
		}
		assertEquals(1+4+16+64+256, automaton.getNumNodes());
		automaton.build();
		String text = "ACGTTGCAAC";
		List<SeedHit> hits = new AutomatonScanner(automaton, text).collectHits();
		assertEquals(text.length()-3, hits.size());
		for(SeedHit hit:hits) {
			assertEquals(text.substring(hit.getTextStart(), hit.getTextEnd()+1), hit.getSeed().getSequence());
		}
	}
}
