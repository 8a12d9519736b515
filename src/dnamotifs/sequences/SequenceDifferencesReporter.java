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
package dnamotifs.sequences;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import dnamotifs.main.CommandsDescriptor;
import dnamotifs.sequences.io.FastaFileReader;

/**
 * Reports the differences between two sequences walking both of them at the same time.
 * At each mismatch the first explanation that resynchronizes the sequences one position ahead is chosen,
 * trying a SNP, then a deletion and then an insertion. Mismatches that can not be explained are reported as complex.
 */
public class SequenceDifferencesReporter {

	private Logger log = Logger.getLogger(SequenceDifferencesReporter.class.getName());

	public Logger getLog() {
		return log;
	}
	public void setLog(Logger log) {
		this.log = log;
	}

	public static void main(String[] args) throws Exception {
		SequenceDifferencesReporter instance = new SequenceDifferencesReporter();
		int i = CommandsDescriptor.getInstance().loadOptions(instance, args);
		if(i+2>args.length) {
			System.err.println("Two sequences or two sequence files are required");
			CommandsDescriptor.getInstance().printHelp(SequenceDifferencesReporter.class);
			System.exit(1);
		}
		String seqA = instance.loadSequence(args[i]);
		String seqB = instance.loadSequence(args[i+1]);
		List<SequenceDifference> differences = instance.findDifferences(seqA, seqB);
		System.out.println("Differences ("+differences.size()+"):");
		for(SequenceDifference diff:differences) System.out.println(" - "+diff);
	}

	/**
	 * Loads a sequence given directly or through a file. If a file with the given name exists,
	 * the sequence is built joining its records in fasta format. Lines before the first header are also kept,
	 * so plain sequence files are accepted. Otherwise the argument is taken as the sequence
	 * @param argument File name or sequence
	 * @return String Uppercase sequence without whitespace
	 * @throws IOException If the file exists but can not be read
	 */
	public String loadSequence(String argument) throws IOException {
		File file = new File(argument);
		if(!file.isFile()) return cleanSequence(argument);
		List<QualifiedSequence> records = new ArrayList<QualifiedSequence>();
		try (FastaFileReader reader = new FastaFileReader(file)) {
			reader.setLog(log);
			reader.setUnnamedSequenceName(file.getName());
			for(QualifiedSequence seq:reader) records.add(seq);
		}
		String sequence = QualifiedSequence.concatenate(records);
		log.fine("Loaded sequence of length "+sequence.length()+" from "+argument);
		return sequence;
	}

	private String cleanSequence(String line) {
		StringBuilder answer = new StringBuilder(line.length());
		for(int i=0;i<line.length();i++) {
			char c = line.charAt(i);
			if(!Character.isWhitespace(c)) answer.append(Character.toUpperCase(c));
		}
		return answer.toString();
	}

	/**
	 * Finds the differences between the given sequences
	 * @param reference Sequence taken as reference
	 * @param compared Sequence compared against the reference
	 * @return List<SequenceDifference> Differences in the order in which they were found
	 */
	public List<SequenceDifference> findDifferences(CharSequence reference, CharSequence compared) {
		List<SequenceDifference> answer = new ArrayList<SequenceDifference>();
		int l1 = reference.length();
		int l2 = compared.length();
		int i = 0;
		int j = 0;
		while(i<l1 && j<l2) {
			char c1 = reference.charAt(i);
			char c2 = compared.charAt(j);
			if(c1==c2) {
				i++;
				j++;
			} else if (i+1<l1 && j+1<l2 && reference.charAt(i+1)==compared.charAt(j+1)) {
				answer.add(new SequenceDifference(SequenceDifference.TYPE_SNP, i, j, c1, c2));
				i++;
				j++;
			} else if (i+1<l1 && reference.charAt(i+1)==c2) {
				answer.add(new SequenceDifference(SequenceDifference.TYPE_DELETION, i, j, c1, c2));
				i++;
			} else if (j+1<l2 && c1==compared.charAt(j+1)) {
				answer.add(new SequenceDifference(SequenceDifference.TYPE_INSERTION, i, j, c1, c2));
				j++;
			} else {
				answer.add(new SequenceDifference(SequenceDifference.TYPE_COMPLEX, i, j, c1, c2));
				i++;
				j++;
			}
		}
		for(;i<l1;i++) answer.add(new SequenceDifference(SequenceDifference.TYPE_DELETION_AT_END, i, l2, reference.charAt(i), '-'));
		for(;j<l2;j++) answer.add(new SequenceDifference(SequenceDifference.TYPE_INSERTION_AT_END, l1, j, '-', compared.charAt(j)));
		return answer;
	}
}
