package dnamotifs.motifs.test;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import junit.framework.TestCase;

import dnamotifs.motifs.GappedMotifsFinder;
import dnamotifs.motifs.MotifMatch;
import dnamotifs.motifs.MotifMatchesCollector;
import dnamotifs.sequences.QualifiedSequence;

public class GappedMotifsFinderTest extends TestCase {
	private List<String> motifs = Arrays.asList("ACG.T", "TT{2}GA", "CCC", "GATC");

	private List<QualifiedSequence> buildSequences() {
		Random random = new Random(11);
		List<QualifiedSequence> sequences = new ArrayList<QualifiedSequence>();
		for(int i=0;i<6;i++) {
			sequences.add(new QualifiedSequence("seq"+i, GappedMotifsIndexTest.randomSequence(random, 500+100*i)));
		}
		return sequences;
	}

	public void testParallelSearch() throws InterruptedException {
		List<QualifiedSequence> sequences = buildSequences();
		GappedMotifsFinder sequential = new GappedMotifsFinder();
		sequential.buildIndex(motifs);
		MotifMatchesCollector expected = sequential.search(sequences);
		assertTrue(expected.getTotalMatches()>0);

		GappedMotifsFinder parallel = new GappedMotifsFinder();
		parallel.setNumThreads(3);
		parallel.buildIndex(motifs);
		MotifMatchesCollector matches = parallel.search(sequences);
		assertEquals(expected.getTotalMatches(), matches.getTotalMatches());
		assertEquals(expected.getAllMatches(), matches.getAllMatches());
	}

	public void testConcatenate() throws InterruptedException {
		List<QualifiedSequence> sequences = new ArrayList<QualifiedSequence>();
		sequences.add(new QualifiedSequence("chr1", "TTTAC"));
		sequences.add(new QualifiedSequence("chr2", "GATTT"));
		GappedMotifsFinder finder = new GappedMotifsFinder();
		finder.buildIndex(Arrays.asList("ACGAT"));
		assertEquals(0, finder.search(sequences).getTotalMatches());

		finder.setConcatenate(true);
		MotifMatchesCollector matches = finder.search(sequences);
		assertEquals(1, matches.getTotalMatches());
		MotifMatch match = matches.getAllMatches().get(0);
		assertEquals(GappedMotifsFinder.CONCATENATED_SEQUENCE_NAME, match.getSequenceName());
		assertEquals(3, match.getStart());
		assertEquals(8, match.getEnd());
	}

	public void testPrintMatches() throws InterruptedException {
		GappedMotifsFinder finder = new GappedMotifsFinder();
		finder.buildIndex(Arrays.asList("AC.T", "GGG"));
		List<QualifiedSequence> sequences = new ArrayList<QualifiedSequence>();
		sequences.add(new QualifiedSequence("chr1", "ACGTGGG"));
		ByteArrayOutputStream os = new ByteArrayOutputStream();
		finder.printMatches(finder.search(sequences), new PrintStream(os, true));
		String [] lines = os.toString().split("\\r?\\n");
		assertEquals(2, lines.length);
		assertEquals("chr1\t0\tAC.T\t0\t4", lines[0]);
		assertEquals("chr1\t1\tGGG\t4\t7", lines[1]);
	}

	public void testRun() throws IOException, InterruptedException {
		File fasta = File.createTempFile("genome", ".fa");
		fasta.deleteOnExit();
		Files.write(fasta.toPath(), ">chr1\nAACCGTT\nACCGT\n>chr2\nccgt\n".getBytes(StandardCharsets.US_ASCII));
		File motifsFile = File.createTempFile("motifs", ".txt");
		motifsFile.deleteOnExit();
		Files.write(motifsFile.toPath(), "CCG.\n\nAAA\n".getBytes(StandardCharsets.US_ASCII));
		File output = File.createTempFile("matches", ".tsv");
		output.deleteOnExit();

		GappedMotifsFinder finder = new GappedMotifsFinder();
		finder.setOutputFile(output.getAbsolutePath());
		finder.run(fasta.getAbsolutePath(), motifsFile.getAbsolutePath());
		assertEquals(2, finder.getIndex().getNumMotifs());
		List<String> lines = Files.readAllLines(output.toPath(), StandardCharsets.US_ASCII);
		assertEquals(3, lines.size());
		assertEquals("chr1\t0\tCCG.\t2\t6", lines.get(0));
		assertEquals("chr1\t0\tCCG.\t8\t12", lines.get(1));
		assertEquals("chr2\t0\tCCG.\t0\t4", lines.get(2));
	}

	public void testFailedScanIsReported() throws InterruptedException {
		List<QualifiedSequence> sequences = buildSequences();
		sequences.set(1, new QualifiedSequence("broken", new UnreadableSequence(400, 250)));
		for(int threads=1;threads<=3;threads+=2) {
			GappedMotifsFinder finder = new GappedMotifsFinder();
			finder.setNumThreads(threads);
			finder.buildIndex(motifs);
			try {
				finder.search(sequences);
				fail("Failure scanning a sequence should be reported with "+threads+" threads");
			} catch (IllegalStateException e) {
				assertEquals("Unreadable position 250", e.getMessage());
			}
		}
	}

	public void testInvalidParameters() {
		GappedMotifsFinder finder = new GappedMotifsFinder();
		try {
			finder.setNumThreads(0);
			fail("Number of threads must be positive");
		} catch (IllegalArgumentException e) {
			//Expected
		}
		try {
			finder.search(buildSequences());
			fail("Search requires an index");
		} catch (IllegalStateException e) {
			//Expected
		} catch (InterruptedException e) {
			fail("Unexpected interruption");
		}
	}

	private static class UnreadableSequence implements CharSequence {
		private final int length;
		private final int failPosition;

		UnreadableSequence(int length, int failPosition) {
			this.length = length;
			this.failPosition = failPosition;
		}
		@Override
		public int length() {
			return length;
		}
		@Override
		public char charAt(int index) {
			if(index==failPosition) throw new IllegalStateException("Unreadable position "+index);
			return "ACGT".charAt(index%4);
		}
		@Override
		public CharSequence subSequence(int start, int end) {
			throw new UnsupportedOperationException();
		}
	}
}
