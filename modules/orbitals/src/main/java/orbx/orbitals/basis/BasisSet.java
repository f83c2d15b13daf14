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

import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * The BasisSet class holds the shells of a molecule and the ordered list of basis functions that
 * defines the index space of orbital coefficient vectors. Shells are normalized on construction.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class BasisSet {

  private static final Logger logger = Logger.getLogger(BasisSet.class.getName());

  private final Molecule molecule;
  private final List<Shell> shells;
  private final List<BasisFunction> functions;

  /**
   * Constructor for BasisSet.
   *
   * @param molecule the molecule.
   * @param shells the shells.
   * @param functions the basis functions in coefficient order.
   */
  public BasisSet(Molecule molecule, List<Shell> shells, List<BasisFunction> functions) {
    for (Shell shell : shells) {
      if (shell.getAtomIndex() < 0 || shell.getAtomIndex() >= molecule.size()) {
        throw new IllegalArgumentException(format(" Shell center %d is not an atom.",
            shell.getAtomIndex() + 1));
      }
    }
    for (BasisFunction function : functions) {
      int s = function.getShellIndex();
      if (s < 0 || s >= shells.size()) {
        throw new IllegalArgumentException(format(" Basis function refers to shell %d of %d.",
            s + 1, shells.size()));
      }
      if (function.getComponent().getL() != shells.get(s).getL()) {
        throw new IllegalArgumentException(format(
            " Basis function of degree %d belongs to a shell with l=%d.",
            function.getComponent().getL(), shells.get(s).getL()));
      }
    }
    this.molecule = molecule;
    this.shells = List.copyOf(shells);
    this.functions = List.copyOf(functions);
    int count = 0;
    for (Shell shell : this.shells) {
      if (shell.normalize()) {
        count++;
      }
    }
    logger.fine(format(" Normalized %d of %d shells; %d basis functions.", count, shells.size(),
        functions.size()));
  }

  /**
   * Getter for the field <code>molecule</code>.
   *
   * @return the molecule.
   */
  public Molecule getMolecule() {
    return molecule;
  }

  /**
   * Getter for the field <code>shells</code>.
   *
   * @return an unmodifiable list of shells.
   */
  public List<Shell> getShells() {
    return Collections.unmodifiableList(shells);
  }

  /**
   * Getter for the field <code>functions</code>.
   *
   * @return an unmodifiable list of basis functions.
   */
  public List<BasisFunction> getFunctions() {
    return Collections.unmodifiableList(functions);
  }

  /**
   * The number of basis functions.
   *
   * @return the basis size.
   */
  public int size() {
    return functions.size();
  }

  /**
   * The shell of a basis function.
   *
   * @param function a 0-based basis function index.
   * @return the shell.
   */
  public Shell getShell(int function) {
    return shells.get(functions.get(function).getShellIndex());
  }

  /**
   * The atom of a shell.
   *
   * @param shell the shell.
   * @return the atom it is centered on.
   */
  public Atom getAtom(Shell shell) {
    return shell.getAtom(molecule);
  }
}
