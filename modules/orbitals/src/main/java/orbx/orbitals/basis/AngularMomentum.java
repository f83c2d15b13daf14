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
package orbx.orbitals.basis;

import static java.lang.String.format;

/**
 * Angular momentum of a shell.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public enum AngularMomentum {
  S(0), P(1), D(2), F(3), G(4), H(5);

  private final int l;

  AngularMomentum(int l) {
    this.l = l;
  }

  /**
   * The quantum number l.
   *
   * @return l.
   */
  public int getL() {
    return l;
  }

  /**
   * Number of pure spherical components, 2l + 1.
   *
   * @return the spherical count.
   */
  public int sphericalCount() {
    return 2 * l + 1;
  }

  /**
   * Number of Cartesian components, (l + 1)(l + 2) / 2.
   *
   * @return the Cartesian count.
   */
  public int cartesianCount() {
    return (l + 1) * (l + 2) / 2;
  }

  /**
   * Look up by quantum number.
   *
   * @param l the quantum number.
   * @return the angular momentum.
   * @throws IllegalArgumentException if l is not supported.
   */
  public static AngularMomentum fromL(int l) {
    for (AngularMomentum am : values()) {
      if (am.l == l) {
        return am;
      }
    }
    throw new IllegalArgumentException(format(" Angular momentum l=%d is not supported.", l));
  }

  /**
   * Look up by shell letter (case insensitive).
   *
   * @param label a letter from s, p, d, f, g, h.
   * @return the angular momentum.
   * @throws IllegalArgumentException for other letters.
   */
  public static AngularMomentum fromLabel(String label) {
    return valueOf(label.trim().toUpperCase());
  }
}
