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

import static java.lang.Math.PI;
import static java.lang.Math.exp;
import static java.lang.Math.pow;
import static java.lang.Math.sqrt;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.IOException;
import orbx.lattice.GridSpec;
import orbx.lattice.ScalarField;
import orbx.orbitals.IncompleteDataException;
import orbx.orbitals.OrbitalFile;
import orbx.orbitals.basis.AngularComponent;
import orbx.orbitals.basis.BasisSet;
import orbx.orbitals.mo.Orbital;
import orbx.orbitals.mo.OrbitalSet;
import orbx.orbitals.mo.Spin;
import orbx.orbitals.parsers.OrbitalFileOpener;
import orbx.orbitals.parsers.ParseException;
import orbx.utilities.OrbXTest;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.junit.Test;

/**
 * Test evaluation of orbitals and densities on grids.
 *
 * @author Michael J. Schnieders
 */
public class GridEvaluatorTest extends OrbXTest {

  private static final double tolerance = 1.0e-10;
  private static final double[][] IDENTITY = {{1.0, 0.0, 0.0}, {0.0, 1.0, 0.0},
      {0.0, 0.0, 1.0}};

  /** A grid of one point. */
  private static GridSpec point(double x, double y, double z) {
    return new GridSpec(new double[] {x, y, z}, IDENTITY, new int[] {1, 1, 1});
  }

  private static OrbitalSet single(BasisSet basisSet) {
    double[][] c = new double[1][basisSet.size()];
    c[0][0] = 1.0;
    return GridFixtures.orbitals("single", Spin.NONE, c, new double[] {2.0},
        new double[] {-0.5});
  }

  @Test
  public void testGaussianAtEquidistantPoint() throws Exception {
    double a = 0.8;
    double d = 0.6;
    // The contraction coefficient is removed by normalization.
    BasisSet basisSet = GridFixtures.singleGaussian(a, 0.5, AngularComponent.spherical(0, 0));
    OrbitalSet set = single(basisSet);
    GridEvaluator evaluator = new GridEvaluator(GridFixtures.model(basisSet, set), null);
    ScalarField field = evaluator.evaluate(FieldRequest.orbital(set, 0), point(d, d, d),
        new CancellationToken());
    double expected = pow(2.0 * a / PI, 0.75) * exp(-3.0 * a * d * d);
    assertEquals(expected, field.getValues()[0], tolerance);

    // The density is the occupation times the square.
    ScalarField density = evaluator.evaluate(FieldRequest.density(set), point(-d, d, -d),
        new CancellationToken());
    assertEquals(2.0 * expected * expected, density.getValues()[0], tolerance);
  }

  @Test
  public void testCartesianP() throws Exception {
    double a = 1.3;
    double d = 0.4;
    BasisSet basisSet = GridFixtures.singleGaussian(a, 1.0, AngularComponent.cartesian(1, 0, 0));
    OrbitalSet set = single(basisSet);
    GridEvaluator evaluator = new GridEvaluator(GridFixtures.model(basisSet, set), null);
    ScalarField field = evaluator.evaluate(FieldRequest.orbital(set, 0), point(d, d, d),
        new CancellationToken());
    double expected = 2.0 * sqrt(a) * pow(2.0 * a / PI, 0.75) * d * exp(-3.0 * a * d * d);
    assertEquals(expected, field.getValues()[0], tolerance);
  }

  @Test
  public void testElectronCount() throws Exception {
    BasisSet basisSet = GridFixtures.hydrogenMolecule();
    double[][] c = {{0.55, 0.55}, {1.0, -1.0}};
    double[] occupations = {1.0, 1.0};
    // The second energy is unreadable; the orbital still contributes.
    OrbitalSet set = GridFixtures.orbitals("H2", Spin.NONE, c, occupations,
        new double[] {-0.578, Double.NaN});
    double[][] s = GridFixtures.overlap(basisSet);
    assertEquals(1.0, s[0][0], 1.0e-8);
    double expected = 0.0;
    for (int k = 0; k < 2; k++) {
      for (int mu = 0; mu < 2; mu++) {
        for (int nu = 0; nu < 2; nu++) {
          expected += occupations[k] * c[k][mu] * c[k][nu] * s[mu][nu];
        }
      }
    }
    GridSpec grid = GridSpec.orthogonal(new double[] {-7.0, -7.0, -7.7},
        new double[] {7.0, 7.0, 7.7}, new int[] {57, 57, 61});
    GridEvaluator evaluator = new GridEvaluator(GridFixtures.model(basisSet, set), null);
    ScalarField density = evaluator.evaluate(FieldRequest.density(set), grid,
        new CancellationToken());
    assertEquals(expected, density.integrate(), 1.0e-3 * expected);

    // Without the orbital of unreadable energy the integral drops.
    OrbitalSet first = set.edit().retain(Orbital::hasValidEnergy).build();
    ScalarField partial = new GridEvaluator(GridFixtures.model(basisSet, first), null)
        .evaluate(FieldRequest.density(first), grid, new CancellationToken());
    assertTrue(partial.integrate() < density.integrate() - 0.5);
  }

  @Test
  public void testSkewedGrid() throws Exception {
    BasisSet basisSet = GridFixtures.hydrogenMolecule();
    OrbitalSet set = GridFixtures.orbitals("H2", Spin.NONE, new double[][] {{0.55, 0.55}},
        new double[] {2.0}, new double[] {-0.578});
    GridEvaluator evaluator = new GridEvaluator(GridFixtures.model(basisSet, set), null);
    double[][] steps = {{0.3, 0.0, 0.0}, {0.15, 0.3, 0.0}, {0.1, 0.05, 0.3}};
    GridSpec skewed = new GridSpec(new double[] {-0.6, -0.6, -1.2}, steps, new int[] {4, 5, 6});
    ScalarField field = evaluator.evaluate(FieldRequest.orbital(set, 0), skewed,
        new CancellationToken());
    double[] xyz = new double[3];
    for (int i = 0; i < 4; i++) {
      for (int j = 0; j < 5; j++) {
        for (int k = 0; k < 6; k++) {
          skewed.getPoint(i, j, k, xyz);
          ScalarField single = evaluator.evaluate(FieldRequest.orbital(set, 0),
              point(xyz[0], xyz[1], xyz[2]), new CancellationToken());
          assertEquals(single.getValues()[0], field.get(i, j, k), tolerance);
        }
      }
    }
  }

  @Test
  public void testCancelled() throws IOException {
    BasisSet basisSet = GridFixtures.hydrogenMolecule();
    OrbitalSet set = GridFixtures.orbitals("H2", Spin.NONE, new double[][] {{0.55, 0.55}},
        new double[] {2.0}, new double[] {-0.578});
    GridEvaluator evaluator = new GridEvaluator(GridFixtures.model(basisSet, set), null);
    CancellationToken token = new CancellationToken();
    token.cancel();
    try {
      evaluator.evaluate(FieldRequest.density(set), point(0.0, 0.0, 0.0), token);
      fail(" A cancelled computation returned a field.");
    } catch (OperationCancelledException e) {
      assertTrue(token.isCancelled());
    }
  }

  @Test
  public void testStoredDensity() throws Exception {
    OrbitalFile orbitalFile = openGrid();
    OrbitalSet stored = orbitalFile.getPrecomputedSet();
    GridSpec grid = orbitalFile.getPrecomputedFields().getGridSpec();
    GridEvaluator evaluator = new GridEvaluator(orbitalFile, null);

    ScalarField orbital = evaluator.evaluate(FieldRequest.orbital(stored, 1), grid,
        new CancellationToken());
    assertEquals(0.5, orbital.getValues()[0], tolerance);

    // Only the first stored orbital is occupied, with two electrons.
    ScalarField density = evaluator.evaluate(FieldRequest.density(stored), grid,
        new CancellationToken());
    for (int p = 0; p < 8; p++) {
      assertEquals(2.0 * p * p, density.getValues()[p], tolerance);
    }

    try {
      evaluator.evaluate(FieldRequest.orbital(stored, 0), point(0.0, 0.0, 0.0),
          new CancellationToken());
      fail(" A stored orbital was interpolated onto another grid.");
    } catch (IncompleteDataException e) {
      // Expected.
    }
  }

  @Test
  public void testStoredSubset() throws Exception {
    OrbitalFile orbitalFile = openGrid();
    OrbitalSet stored = orbitalFile.getPrecomputedSet();
    GridSpec grid = orbitalFile.getPrecomputedFields().getGridSpec();

    // A third occupied orbital is not stored.
    OrbitalSet reference = GridFixtures.orbitals("reference", Spin.NONE,
        new double[][] {{1.0, 0.0}, {0.0, 1.0}, {0.5, 0.5}}, new double[] {2.0, 0.0, 1.0},
        new double[] {-0.5, 0.6, 0.9});
    OrbitalFile subset = orbitalFile.toBuilder().clearOrbitalSets().addOrbitalSet(reference)
        .addOrbitalSet(stored).build();
    try {
      new GridEvaluator(subset, null).evaluate(FieldRequest.density(stored), grid,
          new CancellationToken());
      fail(" A density was built from a subset of its orbitals.");
    } catch (IncompleteDataException e) {
      assertTrue(e.getMessage().contains("Occupied orbital 3"));
    }

    // Without any orbital coefficients the occupied orbitals are unknown.
    OrbitalFile bare = orbitalFile.toBuilder().clearOrbitalSets().addOrbitalSet(stored).build();
    try {
      new GridEvaluator(bare, null).evaluate(FieldRequest.density(stored), grid,
          new CancellationToken());
      fail(" A density was built without the orbital file.");
    } catch (IncompleteDataException e) {
      assertTrue(e.getMessage().contains("subset"));
    }
  }

  @Test
  public void testNoBasis() throws Exception {
    OrbitalFile orbitalFile = openGrid();
    OrbitalSet embedded = orbitalFile.getOrbitalSets().get(0);
    try {
      new GridEvaluator(orbitalFile, null).evaluate(FieldRequest.orbital(embedded, 0),
          point(0.0, 0.0, 0.0), new CancellationToken());
      fail(" Orbitals were evaluated without a basis.");
    } catch (IncompleteDataException e) {
      assertTrue(e.getMessage().contains("no basis set"));
    }
  }

  private OrbitalFile openGrid() throws IOException, ParseException {
    File file = getResourceFile("orbx/grid/structures/h2.grid");
    return new OrbitalFileOpener(new CompositeConfiguration()).open(file);
  }
}
