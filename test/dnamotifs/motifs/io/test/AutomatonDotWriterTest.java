package dnamotifs.motifs.io.test;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

import junit.framework.TestCase;

import dnamotifs.motifs.AhoCorasickAutomaton;
import dnamotifs.motifs.MotifSeed;
import dnamotifs.motifs.io.AutomatonDotWriter;
import dnamotifs.motifs.io.AutomatonGraphExporter;

public class AutomatonDotWriterTest extends TestCase {

	private String [] write(AutomatonDotWriter writer, AhoCorasickAutomaton automaton) {
		ByteArrayOutputStream os = new ByteArrayOutputStream();
		writer.write(automaton, new PrintStream(os, true));
		return os.toString().split("\\r?\\n");
	}

	public void testGraph() {
		AhoCorasickAutomaton automaton = new AhoCorasickAutomaton();
		automaton.addSeed(new MotifSeed("AC", 0, 0));
		automaton.build();
		String [] lines = write(new AutomatonDotWriter(), automaton);
		assertEquals(11, lines.length);
		assertEquals("digraph aho {", lines[0]);
		assertEquals("  rankdir=LR;", lines[1]);
		assertEquals("  node [shape=circle,fontname=Helvetica];", lines[2]);
		assertEquals("  n0 [label=\"0\"];", lines[3]);
		assertEquals("  n1 [label=\"1\"];", lines[4]);
		assertEquals("  n2 [label=\"2\\nout=1\",style=filled,fillcolor=lightblue];", lines[5]);
		assertEquals("  n0 -> n1 [label=\"A\"];", lines[6]);
		assertEquals("  n1 -> n2 [label=\"C\"];", lines[7]);
		assertEquals("  n1 -> n0 [style=dashed,color=gray,label=\"f\"];", lines[8]);
		assertEquals("  n2 -> n0 [style=dashed,color=gray,label=\"f\"];", lines[9]);
		assertEquals("}", lines[10]);
	}

	public void testMaxNodes() {
		AhoCorasickAutomaton automaton = new AhoCorasickAutomaton();
		automaton.addSeed(new MotifSeed("ACGT", 0, 0));
		automaton.build();
		AutomatonDotWriter writer = new AutomatonDotWriter();
		writer.setMaxNodes(2);
		String [] lines = write(writer, automaton);
		//Header, two nodes, one trie edge, one fail link and closing brace
		assertEquals(8, lines.length);
		assertEquals("  n1 -> n0 [style=dashed,color=gray,label=\"f\"];", lines[6]);
		try {
			writer.setMaxNodes(0);
			fail("Maximum number of nodes must be positive");
		} catch (IllegalArgumentException e) {
			//Expected
		}
	}

	public void testUnbuiltAutomaton() {
		AhoCorasickAutomaton automaton = new AhoCorasickAutomaton();
		automaton.addSeed(new MotifSeed("AC", 0, 0));
		try {
			write(new AutomatonDotWriter(), automaton);
			fail("Only built automata can be written");
		} catch (IllegalStateException e) {
			//Expected
		}
	}

	public void testExporter() throws IOException {
		File motifsFile = File.createTempFile("motifs", ".txt");
		motifsFile.deleteOnExit();
		Files.write(motifsFile.toPath(), "AC.T\n...\nCG\n".getBytes(StandardCharsets.US_ASCII));
		File output = File.createTempFile("automaton", ".dot");
		output.deleteOnExit();
		AutomatonGraphExporter exporter = new AutomatonGraphExporter();
		exporter.run(motifsFile.getAbsolutePath(), output.getAbsolutePath());
		List<String> lines = Files.readAllLines(output.toPath(), StandardCharsets.US_ASCII);
		assertEquals("digraph aho {", lines.get(0));
		assertEquals("}", lines.get(lines.size()-1));
		//Root, A, AC, C and CG
		int nodes = 0;
		for(String line:lines) {
			if(line.contains("[label=\"") && !line.contains("->")) nodes++;
		}
		assertEquals(5, nodes);
	}
}
