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
package orbx.grid;

import static java.lang.Math.exp;
import static java.lang.Math.pow;
import static java.lang.Math.sqrt;

import java.util.ArrayList;
import java.util.List;
import orbx.orbitals.OrbitalFile;
import orbx.orbitals.basis.AngularComponent;
import orbx.orbitals.basis.AngularMomentum;
import orbx.orbitals.basis.Atom;
import orbx.orbitals.basis.BasisFunction;
import orbx.orbitals.basis.BasisSet;
import orbx.orbitals.basis.Molecule;
import orbx.orbitals.basis.Primitive;
import orbx.orbitals.basis.Shell;
import orbx.orbitals.mo.Orbital;
import orbx.orbitals.mo.OrbitalSet;
import orbx.orbitals.mo.Spin;
import orbx.orbitals.mo.Symmetry;

/**
 * Small models built in code for grid tests.
 *
 * @author Michael J. Schnieders
 */
final class GridFixtures {

  /** STO-3G hydrogen exponents. */
  static final double[] STO3G_EXPONENTS = {3.42525091, 0.62391373, 0.16885540};

  /** STO-3G hydrogen contraction coefficients. */
  static final double[] STO3G_COEFFICIENTS = {0.15432897, 0.53532814, 0.44463454};

  /** Half the H-H distance (Bohr). */
  static final double HALF_BOND = 0.7;

  private GridFixtures() {
  }

  /**
   * H2 along z with one STO-3G s shell per atom.
   *
   * @return the basis.
   */
  static BasisSet hydrogenMolecule() {
    List<Atom> atoms = List.of(
        new Atom("H1", 1, new double[] {0.0, 0.0, -HALF_BOND}, true, false),
        new Atom("H2", 1, new double[] {0.0, 0.0, HALF_BOND}, true, false));
    Molecule molecule = new Molecule("H2", atoms);
    List<Shell> shells = new ArrayList<>();
    List<BasisFunction> functions = new ArrayList<>();
    for (int a = 0; a < 2; a++) {
      List<Primitive> primitives = new ArrayList<>();
      for (int p = 0; p < STO3G_EXPONENTS.length; p++) {
        primitives.add(new Primitive(STO3G_EXPONENTS[p], STO3G_COEFFICIENTS[p]));
      }
      shells.add(new Shell(a, AngularMomentum.S, false, primitives));
      functions.add(new BasisFunction(a, AngularComponent.spherical(0, 0)));
    }
    return new BasisSet(molecule, shells, functions);
  }

  /**
   * One uncontracted shell on an atom at the origin.
   *
   * @param exponent the exponent.
   * @param coefficient the contraction coefficient before normalization.
   * @param component the single basis function of the shell.
   * @return the basis.
   */
  static BasisSet singleGaussian(double exponent, double coefficient,
      AngularComponent component) {
    Molecule molecule = new Molecule("X",
        List.of(new Atom("H", 1, new double[] {0.0, 0.0, 0.0}, true, false)));
    Shell shell = new Shell(0, AngularMomentum.fromL(component.getL()), true,
        List.of(new Primitive(exponent, coefficient)));
    return new BasisSet(molecule, List.of(shell),
        List.of(new BasisFunction(0, component)));
  }

  /**
   * A set without symmetry.
   *
   * @param name the name.
   * @param spin the spin.
   * @param coefficients coefficients per orbital.
   * @param occupations occupations.
   * @param energies energies; NaN marks an unreadable energy.
   * @return the set.
   */
  static OrbitalSet orbitals(String name, Spin spin, double[][] coefficients,
      double[] occupations, double[] energies) {
    OrbitalSet.Builder builder = new OrbitalSet.Builder(name,
        Symmetry.none(coefficients[0].length)).spin(spin);
    for (int k = 0; k < coefficients.length; k++) {
      builder.add(new Orbital.Builder()
          .coefficients(coefficients[k].clone())
          .occupation(occupations[k])
          .energy(energies[k])
          .spin(spin)
          .irrep(0, "a")
          .indexInIrrep(k + 1)
          .build());
    }
    return builder.build();
  }

  /**
   * A model holding a basis and some sets.
   *
   * @param basisSet the basis.
   * @param sets the sets.
   * @return the model.
   */
  static OrbitalFile model(BasisSet basisSet, OrbitalSet... sets) {
    OrbitalFile.Builder builder = new OrbitalFile.Builder(null, "Test")
        .title("Test model")
        .molecule(basisSet.getMolecule())
        .basisSet(basisSet)
        .symmetry(Symmetry.none(basisSet.size()));
    for (OrbitalSet set : sets) {
      builder.addOrbitalSet(set);
    }
    return builder.build();
  }

  /**
   * Overlap of the two normalized STO-3G functions of {@link #hydrogenMolecule()}.
   *
   * @param basisSet the basis.
   * @return the overlap matrix.
   */
  static double[][] overlap(BasisSet basisSet) {
    int n = basisSet.size();
    double[][] s = new double[n][n];
    for (int mu = 0; mu < n; mu++) {
      for (int nu = 0; nu < n; nu++) {
        Shell a = basisSet.getShell(mu);
        Shell b = basisSet.getShell(nu);
        double[] ra = a.getAtom(basisSet.getMolecule()).getXYZ();
        double[] rb = b.getAtom(basisSet.getMolecule()).getXYZ();
        double r2 = 0.0;
        for (int i = 0; i < 3; i++) {
          r2 += (ra[i] - rb[i]) * (ra[i] - rb[i]);
        }
        double sum = 0.0;
        for (Primitive p : a.getPrimitives()) {
          for (Primitive q : b.getPrimitives()) {
            double x = p.getExponent();
            double y = q.getExponent();
            sum += p.getCoefficient() * q.getCoefficient()
                * pow(2.0 * sqrt(x * y) / (x + y), 1.5) * exp(-x * y / (x + y) * r2);
          }
        }
        s[mu][nu] = sum;
      }
    }
    return s;
  }
}
