package dnamotifs.main.test;

import junit.framework.TestCase;

import dnamotifs.main.Command;
import dnamotifs.main.CommandOption;
import dnamotifs.main.CommandsDescriptor;
import dnamotifs.main.OptionValuesDecoder;
import dnamotifs.motifs.GappedMotifsFinder;
import dnamotifs.simulation.RandomMotifsGenerator;

public class CommandsDescriptorTest extends TestCase {

	public void testCommands() {
		CommandsDescriptor descriptor = CommandsDescriptor.getInstance();
		assertEquals("1.0.0", descriptor.getSwVersion());
		Command command = descriptor.getCommand("MotifsFinder");
		assertNotNull(command);
		assertEquals(GappedMotifsFinder.class, command.getProgram());
		assertEquals(2, command.getArguments().size());
		CommandOption option = command.getOption("m");
		assertEquals("minSeedLength", option.getAttribute());
		assertEquals(""+GappedMotifsFinder.DEF_MIN_SEED_LENGTH, option.getDefaultValue());
		assertTrue(command.getOption("d").isBoolean());
		assertNotNull(descriptor.getCommand("ExportAutomatonGraph"));
		assertNotNull(descriptor.getCommand("GenerateMotifs"));
		assertNotNull(descriptor.getCommand("CompareSequences"));
		assertNull(descriptor.getCommand("Unknown"));
		assertSame(command, descriptor.getCommandByClass(GappedMotifsFinder.class.getName()));
	}

	public void testLoadOptions() {
		GappedMotifsFinder finder = new GappedMotifsFinder();
		String [] args = {"-m","5","-t","2","-d","-o","out.tsv","genome.fa","motifs.txt"};
		int i = CommandsDescriptor.getInstance().loadOptions(finder, args);
		assertEquals(7, i);
		assertEquals(5, finder.getMinSeedLength());
		assertEquals(2, finder.getNumThreads());
		assertTrue(finder.isDeduplicate());
		assertFalse(finder.isConcatenate());
		assertEquals("out.tsv", finder.getOutputFile());

		RandomMotifsGenerator generator = new RandomMotifsGenerator();
		i = CommandsDescriptor.getInstance().loadOptions(generator, new String[] {"-f","0.5","-s","77","genome.fa","prefix"});
		assertEquals(4, i);
		assertEquals(0.5, generator.getGapFraction(), 0.000001);
		assertEquals(77, generator.getSeed());
	}

	public void testDecoder() {
		assertEquals(Integer.valueOf(12), OptionValuesDecoder.decode("12", Integer.class));
		assertEquals(Double.valueOf(0.25), OptionValuesDecoder.decode("0.25", Double.class));
		assertEquals(Boolean.TRUE, OptionValuesDecoder.decode("true", Boolean.class));
		assertEquals("text", OptionValuesDecoder.decode("text", String.class));
	}
}
