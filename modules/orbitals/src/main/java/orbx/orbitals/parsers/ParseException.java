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

import static java.lang.String.format;

/**
 * The ParseException class reports malformed or unsupported file content, with the format being
 * read and the offending line when it is known.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class ParseException extends Exception {

  private static final long serialVersionUID = 1L;

  /** Name of the format being parsed. */
  public final String formatName;
  /** The 1-based line number, or -1 if unknown. */
  public final int lineNumber;
  /** Human readable description of the problem. */
  public final String reason;

  /**
   * Constructor for ParseException.
   *
   * @param formatName the format being parsed.
   * @param lineNumber the 1-based line number, or -1.
   * @param reason description of the problem.
   */
  public ParseException(String formatName, int lineNumber, String reason) {
    this(formatName, lineNumber, reason, null);
  }

  /**
   * Constructor for ParseException.
   *
   * @param formatName the format being parsed.
   * @param lineNumber the 1-based line number, or -1.
   * @param reason description of the problem.
   * @param cause the underlying exception.
   */
  public ParseException(String formatName, int lineNumber, String reason, Throwable cause) {
    super(lineNumber > 0 ? format(" %s, line %d: %s", formatName, lineNumber, reason)
        : format(" %s: %s", formatName, reason), cause);
    this.formatName = formatName;
    this.lineNumber = lineNumber;
    this.reason = reason;
  }
}
