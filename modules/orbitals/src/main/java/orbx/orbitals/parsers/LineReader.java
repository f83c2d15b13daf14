// ******************************************************************************
//
// Title:       OrbX.
// Description: OrbX - Software for Molecular Orbital Visualization.
// Copyright:   Copyright (c) Michael J. Schnieders 2001-2021.
//
// This file is part of OrbX.
//
// OrbX is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// OrbX is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// OrbX; if not, write to the Free Software Foundation, Inc., 59 Temple
// Place, Suite 330, Boston, MA 02111-1307 USA
//
// Linking this library statically or dynamically with other modules is making a
// combined work based on this library. Thus, the terms and conditions of the
// GNU General Public License cover the whole combination.
//
// As a special exception, the copyright holders of this library give you
// permission to link this library with independent modules to produce an
// executable, regardless of the license terms of these independent modules, and
// to copy and distribute the resulting executable under terms of your choice,
// provided that you also meet, for each linked independent module, the terms
// and conditions of the license of that module. An independent module is a
// module which is not derived from or based on this library. If you modify this
// library, you may extend this exception to your version of the library, but
// you are not obligated to do so. If you do not wish to do so, delete this
// exception statement from your version.
//
// ******************************************************************************
package orbx.orbitals.parsers;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import orbx.utilities.StringUtils;

/**
 * A line reader that tracks line numbers, allows one line of look ahead, and reads numbers as a
 * token stream that ignores line breaks.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class LineReader implements Closeable {

  private final BufferedReader reader;
  private String peeked;
  private boolean hasPeeked = false;
  private int lineNumber = 0;
  private double[] pending = new double[0];
  private int pendingIndex = 0;

  /**
   * Open a file.
   *
   * @param file the file.
   * @throws IOException if the file cannot be opened.
   */
  public LineReader(File file) throws IOException {
    this(Files.newBufferedReader(file.toPath(), StandardCharsets.ISO_8859_1));
  }

  /**
   * Wrap a reader.
   *
   * @param reader the reader.
   */
  public LineReader(Reader reader) {
    this.reader = (reader instanceof BufferedReader) ? (BufferedReader) reader
        : new BufferedReader(reader);
  }

  /**
   * Read the next line.
   *
   * @return the line, or null at the end of input.
   * @throws IOException on read errors.
   */
  public String readLine() throws IOException {
    pending = new double[0];
    pendingIndex = 0;
    if (hasPeeked) {
      hasPeeked = false;
      if (peeked != null) {
        lineNumber++;
      }
      return peeked;
    }
    String line = reader.readLine();
    if (line != null) {
      lineNumber++;
    }
    return line;
  }

  /**
   * Return the next line without consuming it.
   *
   * @return the line, or null at the end of input.
   * @throws IOException on read errors.
   */
  public String peekLine() throws IOException {
    if (!hasPeeked) {
      peeked = reader.readLine();
      hasPeeked = true;
    }
    return peeked;
  }

  /**
   * Read the next line that is not blank.
   *
   * @return the line, or null at the end of input.
   * @throws IOException on read errors.
   */
  public String readNonBlankLine() throws IOException {
    String line;
    do {
      line = readLine();
    } while (line != null && line.isBlank());
    return line;
  }

  /**
   * Read numbers across line breaks. Numbers left over on a partially consumed line are used
   * first; a call to {@link #readLine()} discards them.
   *
   * @param count the number of values.
   * @return the values; starred fields are NaN.
   * @throws IOException on read errors or if input ends early.
   * @throws NumberFormatException if a line holds text other than numbers.
   */
  public double[] readDoubles(int count) throws IOException {
    double[] values = new double[count];
    int n = 0;
    while (n < count) {
      if (pendingIndex < pending.length) {
        values[n++] = pending[pendingIndex++];
        continue;
      }
      String line = hasPeeked ? peeked : reader.readLine();
      hasPeeked = false;
      if (line == null) {
        throw new IOException(String.format(" Expected %d values but found %d.", count, n));
      }
      lineNumber++;
      pending = StringUtils.splitFortranDoubles(line);
      pendingIndex = 0;
    }
    return values;
  }

  /**
   * The number of the line read last.
   *
   * @return the 1-based line number.
   */
  public int getLineNumber() {
    return lineNumber;
  }

  /** {@inheritDoc} */
  @Override
  public void close() throws IOException {
    reader.close();
  }
}
