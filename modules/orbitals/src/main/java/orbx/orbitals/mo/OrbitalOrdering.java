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

import java.util.Comparator;

/**
 * Orders orbitals by decreasing occupation and then by increasing energy, across irreps.
 *
 * <p>Orbitals whose energy is invalid sort after every orbital with a valid energy in the same
 * occupation tier, and keep their relative order. Orbitals with an invalid occupation sort last.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class OrbitalOrdering implements Comparator<Orbital> {

  /** Shared instance. */
  public static final OrbitalOrdering OCCUPATION_THEN_ENERGY = new OrbitalOrdering();

  private OrbitalOrdering() {
  }

  /** {@inheritDoc} */
  @Override
  public int compare(Orbital a, Orbital b) {
    boolean aOcc = a.hasValidOccupation();
    boolean bOcc = b.hasValidOccupation();
    if (aOcc != bOcc) {
      return aOcc ? -1 : 1;
    }
    if (aOcc) {
      int c = Double.compare(b.getOccupation(), a.getOccupation());
      if (c != 0) {
        return c;
      }
    }
    boolean aEnergy = a.hasValidEnergy();
    boolean bEnergy = b.hasValidEnergy();
    if (aEnergy != bEnergy) {
      return aEnergy ? -1 : 1;
    }
    if (!aEnergy) {
      return 0;
    }
    return Double.compare(a.getEnergy(), b.getEnergy());
  }
}
