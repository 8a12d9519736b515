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
package dnamotifs.motifs.io;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads motifs from a text file with one motif per line.
 * Whitespace is removed, letters are converted to upper case and empty lines are skipped
 */
public class MotifsFileLoader {
	/**
	 * Loads the motifs of the given file
	 * @param filename Name of the file with the motifs
	 * @return List<String> Motifs in the order of the file
	 * @throws IOException If the file can not be read
	 */
	public List<String> loadMotifs(String filename) throws IOException {
		try (InputStream is = new FileInputStream(filename)) {
			return loadMotifs(is);
		}
	}

	public List<String> loadMotifs(InputStream is) throws IOException {
		List<String> answer = new ArrayList<String>();
		BufferedReader in = new BufferedReader(new InputStreamReader(is, StandardCharsets.US_ASCII));
		String line=in.readLine();
		while(line!=null) {
			String motif = clean(line);
			if(motif.length()>0) answer.add(motif);
			line=in.readLine();
		}
		return answer;
	}

	private String clean(String line) {
		StringBuilder answer = new StringBuilder(line.length());
		for(int i=0;i<line.length();i++) {
			char c = line.charAt(i);
			if(!Character.isWhitespace(c)) answer.append(Character.toUpperCase(c));
		}
		return answer.toString();
	}
}
