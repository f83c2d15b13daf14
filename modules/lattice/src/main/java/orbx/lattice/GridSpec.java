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

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.abs;
import static org.apache.commons.math3.util.FastMath.ceil;
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.min;

import java.util.Arrays;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * The GridSpec class describes a lattice of points that may be skewed. Point (i, j, k) is located
 * at origin + i * a + j * b + k * c, where a, b and c are the step vectors. An orthogonal grid is
 * the special case of axis aligned step vectors.
 *
 * <p>Values on the grid are stored with the first axis varying slowest and the third fastest, i.e.
 * the linear index of point (i, j, k) is (i * n2 + j) * n3 + k.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class GridSpec {

  private final double[] origin;
  private final double[][] steps;
  private final int[] counts;
  private final int hashCode;

  /**
   * Constructor for GridSpec.
   *
   * @param origin the Cartesian position of point (0, 0, 0) in Bohr.
   * @param steps the three step vectors; steps[axis] is the displacement between neighbors.
   * @param counts the number of points along each axis.
   */
  public GridSpec(double[] origin, double[][] steps, int[] counts) {
    if (origin.length != 3 || steps.length != 3 || counts.length != 3) {
      throw new IllegalArgumentException(
          " A grid requires an origin, 3 step vectors and 3 counts.");
    }
    for (int axis = 0; axis < 3; axis++) {
      if (steps[axis].length != 3) {
        throw new IllegalArgumentException(format(" Step vector %d is not 3D.", axis + 1));
      }
      if (counts[axis] < 1) {
        throw new IllegalArgumentException(format(" Axis %d has %d points.", axis + 1,
            counts[axis]));
      }
    }
    this.origin = origin.clone();
    this.steps = new double[][] {steps[0].clone(), steps[1].clone(), steps[2].clone()};
    this.counts = counts.clone();
    this.hashCode = 31 * (31 * Arrays.hashCode(this.origin) + Arrays.deepHashCode(this.steps))
        + Arrays.hashCode(this.counts);
  }

  /**
   * An orthogonal grid spanning [lower, upper] with the given number of points per axis.
   *
   * @param lower the lower corner.
   * @param upper the upper corner.
   * @param counts points per axis (at least 2 where the extent is non-zero).
   * @return the grid.
   */
  public static GridSpec orthogonal(double[] lower, double[] upper, int[] counts) {
    double[][] steps = new double[3][3];
    for (int axis = 0; axis < 3; axis++) {
      steps[axis][axis] = (counts[axis] > 1) ? (upper[axis] - lower[axis]) / (counts[axis] - 1)
          : 1.0;
    }
    return new GridSpec(lower, steps, counts);
  }

  /**
   * A grid whose three axes span the given full vectors, i.e. the last point of axis a is at
   * origin + span[a].
   *
   * @param origin the origin.
   * @param spans the full span of each axis.
   * @param counts points per axis.
   * @return the grid.
   */
  public static GridSpec spanning(double[] origin, double[][] spans, int[] counts) {
    double[][] steps = new double[3][3];
    for (int axis = 0; axis < 3; axis++) {
      int intervals = max(counts[axis] - 1, 1);
      for (int i = 0; i < 3; i++) {
        steps[axis][i] = spans[axis][i] / intervals;
      }
    }
    return new GridSpec(origin, steps, counts);
  }

  /**
   * A cubic box around a set of points, following the usual clearance and resolution defaults: the
   * box edge is the extent plus twice the clearance rounded up, the spacing is set by the longest
   * edge and the maximum number of points, and each axis receives as many points as it needs up to
   * that maximum.
   *
   * @param xyz Cartesian coordinates.
   * @param clearance the clearance around the points.
   * @param maxPoints the maximum points along any axis (at least 2).
   * @return the grid.
   */
  public static GridSpec boxAround(double[][] xyz, double clearance, int maxPoints) {
    if (maxPoints < 2) {
      throw new IllegalArgumentException(format(" At least 2 points are needed, not %d.",
          maxPoints));
    }
    double[] low = {0.0, 0.0, 0.0};
    double[] high = {0.0, 0.0, 0.0};
    if (xyz.length > 0) {
      low = xyz[0].clone();
      high = xyz[0].clone();
      for (double[] p : xyz) {
        for (int i = 0; i < 3; i++) {
          low[i] = min(low[i], p[i]);
          high[i] = max(high[i], p[i]);
        }
      }
    }
    double[] edge = new double[3];
    double longest = 0.0;
    for (int i = 0; i < 3; i++) {
      edge[i] = ceil(high[i] - low[i] + 2.0 * clearance);
      longest = max(longest, edge[i]);
    }
    double size = longest / (maxPoints - 1);
    if (size == 0.0) {
      size = 1.0;
    }
    double[] lower = new double[3];
    double[] upper = new double[3];
    int[] counts = new int[3];
    for (int i = 0; i < 3; i++) {
      double center = 0.5 * (low[i] + high[i]);
      lower[i] = center - 0.5 * edge[i];
      upper[i] = center + 0.5 * edge[i];
      counts[i] = min((int) ceil(edge[i] / size) + 1, maxPoints);
    }
    return orthogonal(lower, upper, counts);
  }

  /**
   * Total number of points.
   *
   * @return n1 * n2 * n3.
   */
  public int size() {
    return counts[0] * counts[1] * counts[2];
  }

  /**
   * Number of points along an axis.
   *
   * @param axis 0, 1 or 2.
   * @return the count.
   */
  public int getCount(int axis) {
    return counts[axis];
  }

  /**
   * The counts along all three axes.
   *
   * @return a copy of the counts.
   */
  public int[] getCounts() {
    return counts.clone();
  }

  /**
   * The origin.
   *
   * @return a copy of the origin.
   */
  public double[] getOrigin() {
    return origin.clone();
  }

  /**
   * A step vector.
   *
   * @param axis 0, 1 or 2.
   * @return a copy of the step vector.
   */
  public double[] getStep(int axis) {
    return steps[axis].clone();
  }

  /**
   * Linear index of a point.
   *
   * @param i first axis index.
   * @param j second axis index.
   * @param k third axis index.
   * @return (i * n2 + j) * n3 + k
   */
  public int index(int i, int j, int k) {
    return (i * counts[1] + j) * counts[2] + k;
  }

  /**
   * Cartesian position of a point.
   *
   * @param i first axis index.
   * @param j second axis index.
   * @param k third axis index.
   * @param xyz the output position.
   */
  public void getPoint(int i, int j, int k, double[] xyz) {
    for (int d = 0; d < 3; d++) {
      xyz[d] = origin[d] + i * steps[0][d] + j * steps[1][d] + k * steps[2][d];
    }
  }

  /**
   * Volume of one lattice cell, |a . (b x c)|.
   *
   * @return the cell volume.
   */
  public double getCellVolume() {
    double[] a = steps[0];
    double[] b = steps[1];
    double[] c = steps[2];
    return abs(a[0] * (b[1] * c[2] - b[2] * c[1])
        - a[1] * (b[0] * c[2] - b[2] * c[0])
        + a[2] * (b[0] * c[1] - b[1] * c[0]));
  }

  /**
   * Returns true if the step vectors are mutually perpendicular.
   *
   * @param tolerance the tolerance on the normalized dot products.
   * @return true for an orthogonal lattice.
   */
  public boolean isOrthogonal(double tolerance) {
    for (int a = 0; a < 3; a++) {
      for (int b = a + 1; b < 3; b++) {
        double dot = dot(steps[a], steps[b]);
        double norm = Math.sqrt(dot(steps[a], steps[a]) * dot(steps[b], steps[b]));
        if (norm > 0.0 && abs(dot / norm) > tolerance) {
          return false;
        }
      }
    }
    return true;
  }

  /**
   * Inverse of the lattice metric G_ab = step_a . step_b. The Laplacian in lattice coordinates is
   * sum_ab G^ab d_a d_b.
   *
   * @return the 3 x 3 inverse metric.
   */
  public double[][] getInverseMetric() {
    double[][] metric = new double[3][3];
    for (int a = 0; a < 3; a++) {
      for (int b = 0; b < 3; b++) {
        metric[a][b] = dot(steps[a], steps[b]);
      }
    }
    RealMatrix inverse = new LUDecomposition(new Array2DRowRealMatrix(metric, false))
        .getSolver().getInverse();
    return inverse.getData();
  }

  private static double dot(double[] u, double[] v) {
    return u[0] * v[0] + u[1] * v[1] + u[2] * v[2];
  }

  /** {@inheritDoc} */
  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    GridSpec other = (GridSpec) obj;
    return Arrays.equals(origin, other.origin) && Arrays.deepEquals(steps, other.steps)
        && Arrays.equals(counts, other.counts);
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return hashCode;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format(" Grid %d x %d x %d, origin (%8.3f,%8.3f,%8.3f)", counts[0], counts[1],
        counts[2], origin[0], origin[1], origin[2]);
  }
}
