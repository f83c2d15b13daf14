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
 * An atomic center: an element, a Cartesian position in Bohr and flags for centers without basis
 * functions and for ghost centers.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Atom {

  private final String name;
  private final int atomicNumber;
  private final double[] xyz;
  private final boolean hasBasis;
  private final boolean ghost;

  /**
   * Constructor for Atom.
   *
   * @param name the label, e.g. "O1".
   * @param atomicNumber the atomic number; 0 for a dummy or ghost center.
   * @param xyz the position in Bohr.
   * @param hasBasis false for point charges and other centers without basis functions.
   * @param ghost true for a ghost center that carries basis functions but no nucleus.
   */
  public Atom(String name, int atomicNumber, double[] xyz, boolean hasBasis, boolean ghost) {
    this.name = name;
    this.atomicNumber = atomicNumber;
    this.xyz = xyz.clone();
    this.hasBasis = hasBasis;
    this.ghost = ghost;
  }

  /**
   * Getter for the field <code>name</code>.
   *
   * @return the label.
   */
  public String getName() {
    return name;
  }

  /**
   * Getter for the field <code>atomicNumber</code>.
   *
   * @return the atomic number.
   */
  public int getAtomicNumber() {
    return atomicNumber;
  }

  /**
   * The element symbol.
   *
   * @return the symbol, or "X" for atomic number 0.
   */
  public String getSymbol() {
    return Elements.symbol(atomicNumber);
  }

  /**
   * The position in Bohr.
   *
   * @return a copy of the position.
   */
  public double[] getXYZ() {
    return xyz.clone();
  }

  /**
   * Copy the position into an array.
   *
   * @param out the output array.
   */
  public void getXYZ(double[] out) {
    System.arraycopy(xyz, 0, out, 0, 3);
  }

  /**
   * Whether basis functions are centered on this atom.
   *
   * @return false for point charges.
   */
  public boolean hasBasis() {
    return hasBasis;
  }

  /**
   * Whether this is a ghost center.
   *
   * @return true for ghost centers.
   */
  public boolean isGhost() {
    return ghost;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format("%-6s %3d %12.6f %12.6f %12.6f%s%s", name, atomicNumber, xyz[0], xyz[1], xyz[2],
        hasBasis ? "" : " (no basis)", ghost ? " (ghost)" : "");
  }
}
