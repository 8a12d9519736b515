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
package dnamotifs.main;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import dnamotifs.sequences.QualifiedSequence;
import dnamotifs.sequences.io.FastaFileReader;

public class OptionValuesDecoder {
	public static Object decode (String value, Class<?> type) {
		if(Integer.class.equals(type)) {
			return Integer.parseInt(value);
		}
		if(Long.class.equals(type)) {
			return Long.parseLong(value);
		}
		if(Double.class.equals(type)) {
			return Double.parseDouble(value);
		}
		if(Boolean.class.equals(type)) {
			return Boolean.parseBoolean(value);
		}
		if(String.class.equals(type)) {
			return value;
		}
		throw new IllegalArgumentException("Can not decode value of type: "+type.toString());
	}

	/**
	 * Loads all the records of a fasta file
	 * @param fastaFile File to load
	 * @param log Logger to report progress
	 * @return List<QualifiedSequence> Records in the same order of the file
	 * @throws IOException If the file can not be read
	 */
	public static List<QualifiedSequence> loadSequences(String fastaFile, Logger log) throws IOException {
		log.info("Loading sequences from: "+fastaFile);
		List<QualifiedSequence> sequences = new ArrayList<QualifiedSequence>();
		long totalLength = 0;
		try (FastaFileReader reader = new FastaFileReader(fastaFile)) {
			for(QualifiedSequence seq:reader) {
				sequences.add(seq);
				totalLength+=seq.getLength();
			}
		}
		log.info("Loaded "+sequences.size()+" sequences. Total length: "+totalLength+" from file: "+fastaFile);
		return sequences;
	}
}
