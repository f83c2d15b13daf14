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
package orbx.numerics.linalg;

import static org.junit.Assert.assertEquals;

import orbx.utilities.OrbXTest;
import org.junit.Test;

/**
 * Test that natural orbital decompositions reproduce the decomposed matrix.
 *
 * @author Michael J. Schnieders
 */
public class NaturalOrbitalsTest extends OrbXTest {

  private static final double tolerance = 1.0e-10;

  @Test
  public void testSymmetric() {
    double[][] density = {
        {1.8, 0.2, 0.0},
        {0.2, 0.9, 0.1},
        {0.0, 0.1, 0.3}
    };
    NaturalOrbitals natural = NaturalOrbitals.ofSymmetric(density);
    double[] w = natural.getWeights();
    assertEquals(3.0, natural.getTrace(), tolerance);
    for (int k = 1; k < w.length; k++) {
      assertEquals(true, w[k - 1] >= w[k]);
    }
    assertReconstructed(density, w, natural.getOrbitals(), natural.getOrbitals());
  }

  @Test
  public void testNonOrthogonalBasis() {
    // A doubly occupied bonding orbital of two functions that overlap by one half.
    double[][] overlap = {
        {1.0, 0.5},
        {0.5, 1.0}
    };
    double[][] density = {
        {2.0 / 3.0, 2.0 / 3.0},
        {2.0 / 3.0, 2.0 / 3.0}
    };
    NaturalOrbitals natural = NaturalOrbitals.ofSymmetric(density, overlap);
    double[] w = natural.getWeights();
    assertEquals(2.0, w[0], tolerance);
    assertEquals(0.0, w[1], tolerance);
    double c = 1.0 / Math.sqrt(3.0);
    double[] v = natural.getOrbitals()[0];
    assertEquals(c, Math.abs(v[0]), tolerance);
    assertEquals(v[0], v[1], tolerance);
    assertReconstructed(density, w, natural.getOrbitals(), natural.getOrbitals());
  }

  @Test
  public void testDifference() {
    double[][] difference = {
        {-0.5, 0.1},
        {0.1, 0.2}
    };
    NaturalOrbitals natural = NaturalOrbitals.ofDifference(difference);
    double[] w = natural.getWeights();
    assertEquals(true, Math.abs(w[0]) >= Math.abs(w[1]));
    assertEquals(true, w[0] < 0.0);
    assertReconstructed(difference, w, natural.getOrbitals(), natural.getOrbitals());
  }

  @Test
  public void testTransition() {
    double[][] transition = {
        {0.0, 0.7, 0.1},
        {0.05, 0.0, 0.0},
        {0.0, 0.2, 0.0}
    };
    NaturalOrbitals nto = NaturalOrbitals.ofTransition(transition);
    assertReconstructed(transition, nto.getWeights(), nto.getOrbitals(),
        nto.getPartnerOrbitals());
  }

  private static void assertReconstructed(double[][] matrix, double[] w, double[][] left,
      double[][] right) {
    int n = matrix.length;
    for (int i = 0; i < n; i++) {
      for (int j = 0; j < n; j++) {
        double sum = 0.0;
        for (int k = 0; k < n; k++) {
          sum += w[k] * left[k][i] * right[k][j];
        }
        assertEquals(matrix[i][j], sum, tolerance);
      }
    }
  }
}
