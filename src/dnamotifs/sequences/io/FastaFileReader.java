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
package dnamotifs.sequences.io;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.logging.Logger;
import java.util.zip.GZIPInputStream;

import dnamotifs.sequences.QualifiedSequence;

/**
 * Iterates over the records of a fasta file. Lines starting with '>' are headers, lines
 * starting with '#' are ignored and whitespace within sequence lines is removed.
 * Files with extension .gz are decompressed on the fly
 */
public class FastaFileReader implements Iterable<QualifiedSequence>,Closeable  {

	private Logger log = Logger.getLogger(FastaFileReader.class.getName());

	private BufferedReader in;

	private String currentLine = "";

	private FastaFileIterator currentIterator = null;

	private boolean keepLowerCase = false;

	private String unnamedSequenceName = null;

	public FastaFileReader (String filename) throws IOException {
		this(new File(filename));
	}
	public FastaFileReader (File file) throws IOException {
		InputStream stream = new FileInputStream(file);
		if(file.getName().toLowerCase().endsWith(".gz")) {
			stream = new GZIPInputStream(stream);
		}
		init(stream);
	}
	public FastaFileReader (InputStream stream) {
		init(stream);
	}

	public Logger getLog() {
		return log;
	}
	public void setLog(Logger log) {
		if (log == null) throw new NullPointerException("Log can not be null");
		this.log = log;
	}

	public boolean isKeepLowerCase() {
		return keepLowerCase;
	}
	/**
	 * Changes the behavior to keep lowercase characters if they exist. By default all characters are converted to upper case
	 * @param keepLowerCase
	 */
	public void setKeepLowerCase(boolean keepLowerCase) {
		this.keepLowerCase = keepLowerCase;
	}

	public String getUnnamedSequenceName() {
		return unnamedSequenceName;
	}
	/**
	 * Sets the name of the record built from sequence lines found before the first header.
	 * If null (default), these lines are dropped with a warning
	 * @param unnamedSequenceName Name for the record without header
	 */
	public void setUnnamedSequenceName(String unnamedSequenceName) {
		this.unnamedSequenceName = unnamedSequenceName;
	}

	@Override
	public void close() throws IOException {
		in.close();
	}

	@Override
	public Iterator<QualifiedSequence> iterator() {
		if (currentIterator != null) {
			throw new IllegalStateException("Iteration in progress");
		}
		currentIterator = new FastaFileIterator();
		return currentIterator;
	}

	private void init (InputStream stream) {
		in = new BufferedReader(new InputStreamReader(stream, StandardCharsets.US_ASCII));
	}
	/**
	 * Loads the next record from the given BufferedReader
	 * @param in buffer to read
	 * @return QualifiedSequence next record. The name is null if sequence lines appear before the first header
	 * @throws IOException if the buffer can not be read
	 */
	private QualifiedSequence load (BufferedReader in) throws IOException {
		// end of file
		if (currentLine == null) return null;
		String id = null;
		String comments = null;
		if (currentLine.length()>0) {
			String header = currentLine.substring(1).trim();
			int i = 0;
			while(i<header.length() && !Character.isWhitespace(header.charAt(i))) i++;
			id = header.substring(0, i);
			if(i<header.length()) comments = header.substring(i).trim();
		}
		StringBuilder nextSequence = new StringBuilder();
		currentLine = in.readLine();
		while(currentLine!=null) {
			currentLine = currentLine.trim();
			if (currentLine.length()==0) {
				currentLine = in.readLine();
				continue;
			}
			char firstChr = currentLine.charAt(0);
			if(firstChr=='>') {
				break;
			} else if (firstChr!='#') {
				appendSequenceLine(nextSequence,currentLine);
			}
			currentLine = in.readLine();
		}
		if (id==null) {
			if (nextSequence.length()>0 && unnamedSequenceName!=null) return new QualifiedSequence(unnamedSequenceName,nextSequence.toString());
			if (nextSequence.length()>0) log.warning("Sequence with length "+nextSequence.length()+" found before the first id sequence");
			return new QualifiedSequence(null,nextSequence.toString());
		}
		if (nextSequence.length()==0) log.warning("Loaded empty sequence with id: "+id);
		QualifiedSequence seq = new QualifiedSequence(id,nextSequence.toString());
		if(comments!=null && comments.length()>0) seq.setComments(comments);
		return seq;
	}

	private void appendSequenceLine(StringBuilder sequence, String line) {
		for(int i=0;i<line.length();i++) {
			char c = line.charAt(i);
			if(Character.isWhitespace(c) || Character.isISOControl(c)) continue;
			if(!keepLowerCase) c = Character.toUpperCase(c);
			sequence.append(c);
		}
	}

	private class FastaFileIterator implements Iterator<QualifiedSequence> {
		private QualifiedSequence nextRecord;
		public FastaFileIterator() {
			nextRecord = loadRecord();
		}
		@Override
		public boolean hasNext() {
			return nextRecord!=null;
		}

		@Override
		public QualifiedSequence next() {
			if(nextRecord==null) throw new NoSuchElementException();
			QualifiedSequence answer = nextRecord;
			nextRecord = loadRecord();
			return answer;
		}

		private QualifiedSequence loadRecord() {
			QualifiedSequence record;
			try {
				record = load(in);
				//Case to reach the first record
				if(record !=null && record.getName()==null) record = load(in);
			} catch (IOException e) {
				throw new RuntimeException(e);
			}
			return record;
		}
	}
}
