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

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.abs;

import java.util.Arrays;
import java.util.Comparator;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;

/**
 * Decomposition of one-particle density matrices into natural orbitals.
 *
 * <p>A density matrix D defines rho(r) = sum_ij D_ij chi_i(r) chi_j(r). For a symmetric matrix the
 * eigen decomposition D = U w U^T gives rho = sum_k w_k phi_k^2 with phi_k = sum_i U_ik chi_i. For
 * a transition density matrix the singular value decomposition T = U s V^T gives rho = sum_k s_k
 * h_k p_k with hole orbitals h from U and particle orbitals p from V.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class NaturalOrbitals {

  private final double[] weights;
  private final double[][] left;
  private final double[][] right;

  private NaturalOrbitals(double[] weights, double[][] left, double[][] right) {
    this.weights = weights;
    this.left = left;
    this.right = right;
  }

  /**
   * Natural orbitals of a symmetric density matrix, sorted by decreasing occupation.
   *
   * @param density an n x n matrix; only its symmetric part is used.
   * @return the decomposition.
   */
  public static NaturalOrbitals ofSymmetric(double[][] density) {
    return decompose(density, false);
  }

  /**
   * Natural orbitals of a density matrix expressed in a non-orthogonal basis. The matrix is
   * transformed with the symmetric (Lowdin) orthogonalization S^1/2 D S^1/2 before decomposition
   * and the orbitals are transformed back with S^-1/2, so the weights are true natural occupations.
   *
   * @param density an n x n matrix.
   * @param overlap the n x n overlap matrix of the basis, or null for an orthonormal basis.
   * @return the decomposition.
   */
  public static NaturalOrbitals ofSymmetric(double[][] density, double[][] overlap) {
    return decompose(density, overlap, false);
  }

  /**
   * Natural difference orbitals, sorted by decreasing magnitude of the (signed) occupation.
   *
   * @param difference an n x n difference density matrix.
   * @return the decomposition.
   */
  public static NaturalOrbitals ofDifference(double[][] difference) {
    return decompose(difference, true);
  }

  /**
   * Natural difference orbitals of a matrix expressed in a non-orthogonal basis.
   *
   * @param difference an n x n difference density matrix.
   * @param overlap the n x n overlap matrix, or null for an orthonormal basis.
   * @return the decomposition.
   */
  public static NaturalOrbitals ofDifference(double[][] difference, double[][] overlap) {
    return decompose(difference, overlap, true);
  }

  private static NaturalOrbitals decompose(double[][] density, double[][] overlap,
      boolean byMagnitude) {
    if (overlap == null) {
      return decompose(density, byMagnitude);
    }
    int n = checkSquare(density);
    if (checkSquare(overlap) != n) {
      throw new IllegalArgumentException(format(" Overlap is %d x %d for a %d x %d density.",
          overlap.length, overlap.length, n, n));
    }
    EigenDecomposition eigen = new EigenDecomposition(new Array2DRowRealMatrix(overlap, true));
    RealMatrix half = eigen.getSquareRoot();
    RealMatrix inverseHalf = new LUDecomposition(half).getSolver().getInverse();
    RealMatrix orthogonal = half.multiply(new Array2DRowRealMatrix(density, false)).multiply(half);
    NaturalOrbitals decomposed = decompose(orthogonal.getData(), byMagnitude);
    double[][] vectors = new double[n][];
    for (int k = 0; k < n; k++) {
      vectors[k] = inverseHalf.operate(decomposed.left[k]);
    }
    return new NaturalOrbitals(decomposed.weights, vectors, vectors);
  }

  private static NaturalOrbitals decompose(double[][] density, boolean byMagnitude) {
    int n = checkSquare(density);
    double[][] symmetric = new double[n][n];
    for (int i = 0; i < n; i++) {
      for (int j = 0; j < n; j++) {
        symmetric[i][j] = 0.5 * (density[i][j] + density[j][i]);
      }
    }
    EigenDecomposition eigen = new EigenDecomposition(new Array2DRowRealMatrix(symmetric, false));
    double[] values = eigen.getRealEigenvalues();
    Integer[] order = sortedIndices(values, byMagnitude);
    double[] weights = new double[n];
    double[][] vectors = new double[n][];
    for (int k = 0; k < n; k++) {
      weights[k] = values[order[k]];
      vectors[k] = eigen.getEigenvector(order[k]).toArray();
    }
    return new NaturalOrbitals(weights, vectors, vectors);
  }

  /**
   * Natural transition orbitals of a (generally non-symmetric) matrix, sorted by decreasing weight.
   *
   * @param transition an n x n transition density matrix.
   * @return the decomposition; left vectors are holes and right vectors are particles.
   */
  public static NaturalOrbitals ofTransition(double[][] transition) {
    int n = checkSquare(transition);
    SingularValueDecomposition svd =
        new SingularValueDecomposition(new Array2DRowRealMatrix(transition, false));
    double[] values = svd.getSingularValues();
    RealMatrix u = svd.getU();
    RealMatrix v = svd.getV();
    double[] weights = new double[n];
    double[][] holes = new double[n][];
    double[][] particles = new double[n][];
    for (int k = 0; k < n; k++) {
      weights[k] = values[k];
      holes[k] = u.getColumn(k);
      particles[k] = v.getColumn(k);
    }
    return new NaturalOrbitals(weights, holes, particles);
  }

  /**
   * Occupations (eigenvalues) or transition weights (singular values).
   *
   * @return the weights, one per orbital.
   */
  public double[] getWeights() {
    return weights;
  }

  /**
   * Natural orbitals, or hole orbitals for a transition. Row k holds orbital k.
   *
   * @return the orbitals.
   */
  public double[][] getOrbitals() {
    return left;
  }

  /**
   * Particle orbitals for a transition; identical to {@link #getOrbitals()} for a symmetric matrix.
   *
   * @return the orbitals.
   */
  public double[][] getPartnerOrbitals() {
    return right;
  }

  /**
   * Sum of the weights.
   *
   * @return the trace of the decomposed matrix for a symmetric decomposition.
   */
  public double getTrace() {
    return Arrays.stream(weights).sum();
  }

  private static int checkSquare(double[][] matrix) {
    int n = matrix.length;
    for (double[] row : matrix) {
      if (row.length != n) {
        throw new IllegalArgumentException(format(" Matrix is not square (%d x %d).", n,
            row.length));
      }
    }
    return n;
  }

  private static Integer[] sortedIndices(double[] values, boolean byMagnitude) {
    Integer[] order = new Integer[values.length];
    for (int i = 0; i < order.length; i++) {
      order[i] = i;
    }
    Comparator<Integer> comparator = byMagnitude
        ? Comparator.comparingDouble(i -> -abs(values[i]))
        : Comparator.comparingDouble(i -> -values[i]);
    Arrays.sort(order, comparator);
    return order;
  }
}
