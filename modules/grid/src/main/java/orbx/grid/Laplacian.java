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

import static org.apache.commons.math3.util.FastMath.abs;

import orbx.lattice.GridSpec;
import orbx.lattice.ScalarField;

/**
 * Finite difference Laplacian of a field on a possibly skewed lattice.
 *
 * <p>With x = origin + u_a * step_a, the Laplacian is sum_ab G^ab d_a d_b f, where G^ab is the
 * inverse of the metric step_a . step_b. Second derivatives along one axis use the three point
 * stencil and mixed derivatives the four corner stencil; both are second order. Points on the
 * boundary of the grid have no stencil and are NaN.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class Laplacian {

  /** Inverse metric entries below this are treated as zero. */
  private static final double ZERO = 1.0e-14;

  private Laplacian() {
  }

  /**
   * Compute the Laplacian of a field.
   *
   * @param field the field.
   * @param label the label of the result.
   * @param token polled once per plane.
   * @return the Laplacian, NaN on the boundary.
   * @throws OperationCancelledException if the token was set.
   */
  public static ScalarField apply(ScalarField field, String label, CancellationToken token)
      throws OperationCancelledException {
    GridSpec gridSpec = field.getGridSpec();
    double[][] g = gridSpec.getInverseMetric();
    int n1 = gridSpec.getCount(0);
    int n2 = gridSpec.getCount(1);
    int n3 = gridSpec.getCount(2);
    double[] f = field.getValues();
    double[] lap = new double[f.length];
    // Linear index strides of the three axes.
    int[] stride = {n2 * n3, n3, 1};
    for (int i = 0; i < n1; i++) {
      token.throwIfCancelled();
      for (int j = 0; j < n2; j++) {
        for (int k = 0; k < n3; k++) {
          int index = gridSpec.index(i, j, k);
          if (i == 0 || j == 0 || k == 0 || i == n1 - 1 || j == n2 - 1 || k == n3 - 1) {
            lap[index] = Double.NaN;
            continue;
          }
          double sum = 0.0;
          for (int a = 0; a < 3; a++) {
            int sa = stride[a];
            sum += g[a][a] * (f[index + sa] - 2.0 * f[index] + f[index - sa]);
            for (int b = a + 1; b < 3; b++) {
              if (abs(g[a][b]) < ZERO) {
                continue;
              }
              int sb = stride[b];
              double mixed = 0.25 * (f[index + sa + sb] - f[index + sa - sb]
                  - f[index - sa + sb] + f[index - sa - sb]);
              sum += 2.0 * g[a][b] * mixed;
            }
          }
          lap[index] = sum;
        }
      }
    }
    return new ScalarField(gridSpec, lap, label);
  }
}
