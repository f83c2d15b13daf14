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
package orbx.orbitals.mo;

import static java.lang.String.format;

/**
 * Orbital type used in active space definitions.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public enum OrbitalType {
  FROZEN('F'), INACTIVE('I'), RAS1('1'), RAS2('2'), RAS3('3'), SECONDARY('S'), DELETED('D'),
  UNKNOWN('?');

  private final char code;

  OrbitalType(char code) {
    this.code = code;
  }

  /**
   * The one character code (upper case).
   *
   * @return the code.
   */
  public char getCode() {
    return code;
  }

  /**
   * Look up a type by its one character code, ignoring case.
   *
   * @param c the code.
   * @return the type.
   * @throws IllegalArgumentException for unknown codes.
   */
  public static OrbitalType fromCode(char c) {
    char upper = Character.toUpperCase(c);
    for (OrbitalType type : values()) {
      if (type.code == upper) {
        return type;
      }
    }
    throw new IllegalArgumentException(format(" Unknown orbital type '%c'.", c));
  }

  /**
   * Merge the types of an alpha and a beta orbital into one type for a restricted index. An
   * inactive alpha orbital with a secondary beta partner is singly occupied, i.e. RAS2.
   *
   * @param alpha the alpha type.
   * @param beta the beta type.
   * @return the merged type.
   * @throws IllegalArgumentException if the types are incompatible.
   */
  public static OrbitalType merge(OrbitalType alpha, OrbitalType beta) {
    if (alpha == beta) {
      return alpha;
    }
    if ((alpha == INACTIVE && beta == SECONDARY) || (alpha == SECONDARY && beta == INACTIVE)) {
      return RAS2;
    }
    throw new IllegalArgumentException(format(" Alpha type %s and beta type %s cannot be merged.",
        alpha, beta));
  }
}
