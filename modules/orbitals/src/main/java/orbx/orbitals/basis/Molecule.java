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

import java.util.Collections;
import java.util.List;

/**
 * An ordered collection of atoms.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Molecule {

  private final String title;
  private final List<Atom> atoms;

  /**
   * Constructor for Molecule.
   *
   * @param title a title.
   * @param atoms the atoms.
   */
  public Molecule(String title, List<Atom> atoms) {
    this.title = title;
    this.atoms = List.copyOf(atoms);
  }

  /**
   * Getter for the field <code>title</code>.
   *
   * @return the title.
   */
  public String getTitle() {
    return title;
  }

  /**
   * Getter for the field <code>atoms</code>.
   *
   * @return an unmodifiable list of atoms.
   */
  public List<Atom> getAtoms() {
    return Collections.unmodifiableList(atoms);
  }

  /**
   * The atom at an index.
   *
   * @param index a 0-based index.
   * @return the atom.
   */
  public Atom getAtom(int index) {
    return atoms.get(index);
  }

  /**
   * The number of atoms.
   *
   * @return the number of atoms.
   */
  public int size() {
    return atoms.size();
  }

  /**
   * The coordinates of all atoms.
   *
   * @return an n x 3 array.
   */
  public double[][] getCoordinates() {
    double[][] xyz = new double[atoms.size()][];
    for (int i = 0; i < xyz.length; i++) {
      xyz[i] = atoms.get(i).getXYZ();
    }
    return xyz;
  }
}
