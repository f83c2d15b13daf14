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

import static org.apache.commons.math3.util.FastMath.sqrt;

import java.util.Collections;
import java.util.List;
import orbx.numerics.math.GaussianFunctions;

/**
 * A contracted shell of Gaussian primitives sharing an angular momentum and a center.
 *
 * <p>The shell refers to its atom by index into the {@link Molecule}; it does not own the atom.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Shell {

  private final int atomIndex;
  private final AngularMomentum angularMomentum;
  private final boolean cartesian;
  private final List<Primitive> primitives;
  private boolean normalized = false;

  /**
   * Constructor for Shell.
   *
   * @param atomIndex 0-based index of the center.
   * @param angularMomentum the angular momentum.
   * @param cartesian true for a Cartesian shell.
   * @param primitives the primitives.
   */
  public Shell(int atomIndex, AngularMomentum angularMomentum, boolean cartesian,
      List<Primitive> primitives) {
    if (primitives.isEmpty()) {
      throw new IllegalArgumentException(" A shell needs at least one primitive.");
    }
    this.atomIndex = atomIndex;
    this.angularMomentum = angularMomentum;
    this.cartesian = cartesian;
    this.primitives = List.copyOf(primitives);
  }

  /**
   * Rescale the contraction coefficients so the contracted function has unit norm. Only the first
   * call has an effect.
   *
   * @return true if this call normalized the shell.
   */
  public synchronized boolean normalize() {
    if (normalized) {
      return false;
    }
    int n = primitives.size();
    double[] exponents = new double[n];
    double[] coefficients = new double[n];
    for (int i = 0; i < n; i++) {
      exponents[i] = primitives.get(i).getExponent();
      coefficients[i] = primitives.get(i).getCoefficient();
    }
    double s = GaussianFunctions.contractionSelfOverlap(exponents, coefficients, getL());
    if (s > 0.0) {
      double scale = 1.0 / sqrt(s);
      for (Primitive primitive : primitives) {
        primitive.scale(scale);
      }
    }
    normalized = true;
    return true;
  }

  /**
   * Whether {@link #normalize()} has run.
   *
   * @return true once normalized.
   */
  public synchronized boolean isNormalized() {
    return normalized;
  }

  /**
   * Getter for the field <code>atomIndex</code>.
   *
   * @return the 0-based index of the center.
   */
  public int getAtomIndex() {
    return atomIndex;
  }

  /**
   * The atom this shell is centered on.
   *
   * @param molecule the molecule the shell belongs to.
   * @return the atom.
   */
  public Atom getAtom(Molecule molecule) {
    return molecule.getAtom(atomIndex);
  }

  /**
   * Getter for the field <code>angularMomentum</code>.
   *
   * @return the angular momentum.
   */
  public AngularMomentum getAngularMomentum() {
    return angularMomentum;
  }

  /**
   * The quantum number l.
   *
   * @return l.
   */
  public int getL() {
    return angularMomentum.getL();
  }

  /**
   * Whether the shell holds Cartesian functions.
   *
   * @return true for Cartesian shells.
   */
  public boolean isCartesian() {
    return cartesian;
  }

  /**
   * Getter for the field <code>primitives</code>.
   *
   * @return an unmodifiable list of primitives.
   */
  public List<Primitive> getPrimitives() {
    return Collections.unmodifiableList(primitives);
  }
}
