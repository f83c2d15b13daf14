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
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import orbx.lattice.GridSpec;
import orbx.lattice.ScalarField;
import orbx.utilities.OrbXTest;
import org.junit.Test;

/**
 * Test the finite difference Laplacian on orthogonal and skewed grids.
 *
 * @author Michael J. Schnieders
 */
public class LaplacianTest extends OrbXTest {

  private static final double tolerance = 2.0e-2;
  private static final double a = 1.0;

  /** exp(-a r^2) about a center, sampled on a grid. */
  private static ScalarField gaussian(GridSpec grid, double[] center) {
    double[] values = new double[grid.size()];
    double[] xyz = new double[3];
    for (int i = 0; i < grid.getCount(0); i++) {
      for (int j = 0; j < grid.getCount(1); j++) {
        for (int k = 0; k < grid.getCount(2); k++) {
          grid.getPoint(i, j, k, xyz);
          values[grid.index(i, j, k)] = exp(-a * r2(xyz, center));
        }
      }
    }
    return new ScalarField(grid, values, "Gaussian");
  }

  private static double r2(double[] xyz, double[] center) {
    double dx = xyz[0] - center[0];
    double dy = xyz[1] - center[1];
    double dz = xyz[2] - center[2];
    return dx * dx + dy * dy + dz * dz;
  }

  /** Compare with (4 a^2 r^2 - 6 a) exp(-a r^2) at every interior point. */
  private static void check(ScalarField laplacian, double[] center) {
    GridSpec grid = laplacian.getGridSpec();
    double[] xyz = new double[3];
    int checked = 0;
    for (int i = 1; i < grid.getCount(0) - 1; i++) {
      for (int j = 1; j < grid.getCount(1) - 1; j++) {
        for (int k = 1; k < grid.getCount(2) - 1; k++) {
          grid.getPoint(i, j, k, xyz);
          double r2 = r2(xyz, center);
          double expected = (4.0 * a * a * r2 - 6.0 * a) * exp(-a * r2);
          assertEquals(expected, laplacian.get(i, j, k), tolerance);
          checked++;
        }
      }
    }
    assertTrue(checked > 0);
  }

  @Test
  public void testOrthogonal() throws OperationCancelledException {
    GridSpec grid = GridSpec.orthogonal(new double[] {-1.5, -1.5, -1.5},
        new double[] {1.5, 1.5, 1.5}, new int[] {61, 61, 61});
    double[] center = {0.0, 0.0, 0.0};
    ScalarField laplacian = Laplacian.apply(gaussian(grid, center), "Laplacian",
        new CancellationToken());
    assertEquals("Laplacian", laplacian.getLabel());
    assertEquals(-6.0, laplacian.get(30, 30, 30), tolerance);
    check(laplacian, center);
    assertTrue(Double.isNaN(laplacian.get(0, 30, 30)));
    assertTrue(Double.isNaN(laplacian.get(30, 60, 30)));
    assertTrue(Double.isNaN(laplacian.get(30, 30, 0)));
  }

  @Test
  public void testSkewed() throws OperationCancelledException {
    double[][] steps = {{0.05, 0.0, 0.0}, {0.025, 0.05, 0.0}, {0.0, 0.025, 0.05}};
    GridSpec grid = new GridSpec(new double[] {-2.25, -2.25, -1.5}, steps,
        new int[] {61, 61, 61});
    assertTrue(!grid.isOrthogonal(1.0e-6));
    double[] center = new double[3];
    grid.getPoint(30, 30, 30, center);
    ScalarField laplacian = Laplacian.apply(gaussian(grid, center), "Laplacian",
        new CancellationToken());
    assertEquals(-6.0, laplacian.get(30, 30, 30), tolerance);
    check(laplacian, center);
  }

  @Test(expected = OperationCancelledException.class)
  public void testCancelled() throws OperationCancelledException {
    GridSpec grid = GridSpec.orthogonal(new double[] {-1.0, -1.0, -1.0},
        new double[] {1.0, 1.0, 1.0}, new int[] {5, 5, 5});
    CancellationToken token = new CancellationToken();
    token.cancel();
    Laplacian.apply(gaussian(grid, new double[3]), "Laplacian", token);
  }
}
