package dnamotifs.simulation.test;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.Random;

import junit.framework.TestCase;

import dnamotifs.motifs.GappedMotifsIndex;
import dnamotifs.motifs.MotifMatchesCollector;
import dnamotifs.simulation.RandomMotifsGenerator;

public class RandomMotifsGeneratorTest extends TestCase {
	private String text = buildText();

	private static String buildText() {
		Random random = new Random(3);
		StringBuilder answer = new StringBuilder();
		for(int i=0;i<2000;i++) answer.append("ACGT".charAt(random.nextInt(4)));
		return answer.toString();
	}

	public void testDeterminism() {
		RandomMotifsGenerator g1 = new RandomMotifsGenerator();
		RandomMotifsGenerator g2 = new RandomMotifsGenerator();
		assertEquals(g1.generateMotifs(text, 50, 12), g2.generateMotifs(text, 50, 12));
		g1.setSeed(99);
		g2.setSeed(99);
		assertEquals(g1.generateMotifs(text, 10, 10), g2.generateMotifs(text, 10, 10));
	}

	public void testGeneratedMotifsAreFound() {
		RandomMotifsGenerator generator = new RandomMotifsGenerator();
		List<String> motifs = generator.generateMotifs(text, 20, 10);
		assertEquals(20, motifs.size());
		for(String motif:motifs) {
			assertEquals(10, motif.length());
			int gaps = 0;
			for(int i=0;i<motif.length();i++) if(motif.charAt(i)=='.') gaps++;
			assertEquals(2, gaps);
		}
		GappedMotifsIndex index = new GappedMotifsIndex(motifs, 3);
		MotifMatchesCollector matches = index.search(text);
		for(int i=0;i<motifs.size();i++) {
			assertFalse("Motif "+motifs.get(i)+" not found", matches.getMatches(i).isEmpty());
		}
	}

	public void testGapFraction() {
		RandomMotifsGenerator generator = new RandomMotifsGenerator();
		generator.setGapFraction(0);
		String masked = generator.addGaps("ACGTACGT");
		assertEquals("ACGTACGT", masked);
		generator.setGapFraction(0.25);
		masked = generator.addGaps("ACGTACGTAC");
		assertEquals(2, masked.length()-masked.replace(".", "").length());
		generator.setGapFraction(0.01);
		masked = generator.addGaps("ACGTACGT");
		assertEquals(1, masked.length()-masked.replace(".", "").length());
		try {
			generator.setGapFraction(1.5);
			fail("Gap fraction must be a proportion");
		} catch (IllegalArgumentException e) {
			//Expected
		}
		try {
			generator.generateMotifs("ACGT", 1, 10);
			fail("Text shorter than the motifs should be rejected");
		} catch (IllegalArgumentException e) {
			//Expected
		}
	}

	public void testRun() throws IOException {
		File fasta = File.createTempFile("genome", ".fa");
		fasta.deleteOnExit();
		Files.write(fasta.toPath(), (">chr1\n"+text+"\n").getBytes(StandardCharsets.US_ASCII));
		File prefix = File.createTempFile("motifs", "");
		prefix.deleteOnExit();
		RandomMotifsGenerator generator = new RandomMotifsGenerator();
		generator.setNumMotifs(5);
		generator.setMotifLength(8);
		generator.run(fasta.getAbsolutePath(), prefix.getAbsolutePath());
		File output = new File(prefix.getAbsolutePath()+"_5.txt");
		output.deleteOnExit();
		List<String> lines = Files.readAllLines(output.toPath(), StandardCharsets.US_ASCII);
		assertEquals(5, lines.size());
		for(String line:lines) assertEquals(8, line.length());
	}
}
