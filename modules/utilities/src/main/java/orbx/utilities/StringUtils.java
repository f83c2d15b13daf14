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
package orbx.utilities;

import static java.lang.String.format;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The StringUtils class parses the numeric fields written by Fortran programs. Exponents may use
 * the E, e, D or d markers, fields may be glued together without separating blanks, and
 * overflowing fields are written as a run of asterisks. A sign not preceded by an exponent marker
 * always starts a new field.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class StringUtils {

  /** A single Fortran numeric field, or a run of asterisks. */
  private static final Pattern FORTRAN_NUMBER =
      Pattern.compile("\\*+|[-+]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[EeDd][-+]?\\d+)?");

  private static final Pattern STARRED = Pattern.compile("\\*+");

  /** Private constructor to prevent instantiation. */
  private StringUtils() {
  }

  /**
   * Parse one Fortran numeric field.
   *
   * @param field the field.
   * @return the value, or NaN if the field is starred.
   * @throws NumberFormatException if the field is not a number.
   */
  public static double parseFortranDouble(String field) {
    String trimmed = field.trim();
    if (isStarred(trimmed)) {
      return Double.NaN;
    }
    return Double.parseDouble(trimmed.replace('D', 'E').replace('d', 'e'));
  }

  /**
   * Returns true if the field is an overflow marker such as <code>*****</code>.
   *
   * @param field a field.
   * @return true for a non-empty run of asterisks.
   */
  public static boolean isStarred(String field) {
    return STARRED.matcher(field.trim()).matches();
  }

  /**
   * Split a line into Fortran numeric fields. Blank separators are optional.
   *
   * @param line a line of numbers.
   * @return the parsed values; starred fields become NaN.
   * @throws NumberFormatException if the line contains anything other than numbers.
   */
  public static double[] splitFortranDoubles(String line) {
    List<Double> values = new ArrayList<>();
    Matcher matcher = FORTRAN_NUMBER.matcher(line);
    int end = 0;
    while (matcher.find()) {
      if (!line.substring(end, matcher.start()).isBlank()) {
        throw new NumberFormatException(format(" Unexpected text \"%s\" in numeric record.",
            line.substring(end, matcher.start()).trim()));
      }
      values.add(parseFortranDouble(matcher.group()));
      end = matcher.end();
    }
    if (!line.substring(end).isBlank()) {
      throw new NumberFormatException(format(" Unexpected text \"%s\" in numeric record.",
          line.substring(end).trim()));
    }
    double[] ret = new double[values.size()];
    for (int i = 0; i < ret.length; i++) {
      ret[i] = values.get(i);
    }
    return ret;
  }
}
