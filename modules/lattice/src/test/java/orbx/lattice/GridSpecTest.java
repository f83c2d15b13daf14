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
package orbx.lattice;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import orbx.utilities.OrbXTest;
import org.junit.Test;

/**
 * Test lattice geometry for orthogonal and skewed grids.
 *
 * @author Michael J. Schnieders
 */
public class GridSpecTest extends OrbXTest {

  private static final double tolerance = 1.0e-12;

  @Test
  public void testOrthogonal() {
    GridSpec grid = GridSpec.orthogonal(new double[] {-1.0, -2.0, -3.0},
        new double[] {1.0, 2.0, 3.0}, new int[] {3, 5, 7});
    assertEquals(105, grid.size());
    assertEquals(1.0, grid.getCellVolume(), tolerance);
    assertTrue(grid.isOrthogonal(tolerance));
    double[] xyz = new double[3];
    grid.getPoint(2, 4, 6, xyz);
    assertArrayEquals(new double[] {1.0, 2.0, 3.0}, xyz, tolerance);
    assertEquals(104, grid.index(2, 4, 6));
    assertEquals(7, grid.index(0, 1, 0));
  }

  @Test
  public void testSkewed() {
    double[][] steps = {{0.5, 0.0, 0.0}, {0.25, 0.5, 0.0}, {0.0, 0.25, 0.5}};
    GridSpec grid = new GridSpec(new double[] {0.0, 0.0, 0.0}, steps, new int[] {4, 4, 4});
    assertFalse(grid.isOrthogonal(1.0e-6));
    assertEquals(0.125, grid.getCellVolume(), tolerance);
    double[] xyz = new double[3];
    grid.getPoint(1, 1, 1, xyz);
    assertArrayEquals(new double[] {0.75, 0.75, 0.5}, xyz, tolerance);

    // G^-1 times G is the identity.
    double[][] inverse = grid.getInverseMetric();
    for (int a = 0; a < 3; a++) {
      for (int b = 0; b < 3; b++) {
        double sum = 0.0;
        for (int c = 0; c < 3; c++) {
          double g = 0.0;
          for (int d = 0; d < 3; d++) {
            g += steps[c][d] * steps[b][d];
          }
          sum += inverse[a][c] * g;
        }
        assertEquals(a == b ? 1.0 : 0.0, sum, 1.0e-10);
      }
    }
  }

  @Test
  public void testSpanning() {
    GridSpec grid = GridSpec.spanning(new double[] {0.0, 0.0, 0.0},
        new double[][] {{2.0, 0.0, 0.0}, {0.0, 2.0, 0.0}, {0.0, 0.0, 2.0}}, new int[] {3, 3, 5});
    assertArrayEquals(new double[] {1.0, 0.0, 0.0}, grid.getStep(0), tolerance);
    assertArrayEquals(new double[] {0.0, 0.0, 0.5}, grid.getStep(2), tolerance);
  }

  @Test
  public void testBoxAround() {
    double[][] xyz = {{0.0, 0.0, 0.0}, {1.5, 0.0, 0.0}};
    GridSpec grid = GridSpec.boxAround(xyz, 4.0, 21);
    // Edges of 10, 8 and 8 Bohr with a spacing of 0.5 Bohr.
    assertArrayEquals(new int[] {21, 17, 17}, grid.getCounts());
    assertArrayEquals(new double[] {-4.25, -4.0, -4.0}, grid.getOrigin(), tolerance);
    assertEquals(0.125, grid.getCellVolume(), tolerance);
  }

  @Test
  public void testEquality() {
    GridSpec a = GridSpec.orthogonal(new double[] {0, 0, 0}, new double[] {1, 1, 1},
        new int[] {5, 5, 5});
    GridSpec b = GridSpec.orthogonal(new double[] {0, 0, 0}, new double[] {1, 1, 1},
        new int[] {5, 5, 5});
    GridSpec c = GridSpec.orthogonal(new double[] {0, 0, 0}, new double[] {1, 1, 1},
        new int[] {5, 5, 6});
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(a, c);
  }

  @Test
  public void testFieldIntegral() {
    GridSpec grid = GridSpec.orthogonal(new double[] {0, 0, 0}, new double[] {1, 1, 1},
        new int[] {3, 3, 3});
    double[] values = new double[27];
    java.util.Arrays.fill(values, 2.0);
    values[0] = Double.NaN;
    ScalarField field = new ScalarField(grid, values, "constant");
    assertEquals(26 * 2.0 * 0.125, field.integrate(), tolerance);
    assertArrayEquals(new double[] {2.0, 2.0}, field.getRange(), 0.0);
  }
}
