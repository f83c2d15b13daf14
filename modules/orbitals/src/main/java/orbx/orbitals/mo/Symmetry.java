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
package orbx.orbitals.mo;

import static java.lang.String.format;

import java.util.Arrays;

/**
 * Point group information for symmetry adapted orbitals: irrep labels, basis functions per irrep
 * and an optional desymmetrization matrix.
 *
 * <p>A symmetry adapted coefficient vector has one entry per symmetry adapted basis function, with
 * the functions of irrep 0 first. The AO coefficients are M c, where M is the desymmetrization
 * matrix. Without a matrix the two spaces are identical.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Symmetry {

  private final String[] irrepLabels;
  private final int[] basisPerIrrep;
  private final int[] offsets;
  private final double[][] desymmetrization;

  /**
   * Constructor for Symmetry.
   *
   * @param irrepLabels labels of the irreps.
   * @param basisPerIrrep number of basis functions in each irrep.
   * @param desymmetrization the n x n matrix M, or null.
   */
  public Symmetry(String[] irrepLabels, int[] basisPerIrrep, double[][] desymmetrization) {
    if (irrepLabels.length != basisPerIrrep.length) {
      throw new IllegalArgumentException(format(" %d irrep labels for %d irreps.",
          irrepLabels.length, basisPerIrrep.length));
    }
    this.irrepLabels = irrepLabels.clone();
    this.basisPerIrrep = basisPerIrrep.clone();
    offsets = new int[basisPerIrrep.length + 1];
    for (int i = 0; i < basisPerIrrep.length; i++) {
      offsets[i + 1] = offsets[i] + basisPerIrrep[i];
    }
    if (desymmetrization != null) {
      int n = offsets[basisPerIrrep.length];
      if (desymmetrization.length != n) {
        throw new IllegalArgumentException(format(
            " Desymmetrization matrix has %d rows for %d basis functions.", desymmetrization.length,
            n));
      }
    }
    this.desymmetrization = desymmetrization;
  }

  /**
   * No symmetry: a single irrep holding all basis functions.
   *
   * @param nBasis the basis size.
   * @return the trivial symmetry.
   */
  public static Symmetry none(int nBasis) {
    return new Symmetry(new String[] {"a"}, new int[] {nBasis}, null);
  }

  /**
   * Number of irreps.
   *
   * @return the number of irreps.
   */
  public int getIrrepCount() {
    return basisPerIrrep.length;
  }

  /**
   * The label of an irrep.
   *
   * @param irrep a 0-based irrep index.
   * @return the label.
   */
  public String getIrrepLabel(int irrep) {
    return irrepLabels[irrep];
  }

  /**
   * Basis functions in an irrep.
   *
   * @param irrep a 0-based irrep index.
   * @return the count.
   */
  public int getBasisCount(int irrep) {
    return basisPerIrrep[irrep];
  }

  /**
   * Basis functions per irrep.
   *
   * @return a copy of the counts.
   */
  public int[] getBasisCounts() {
    return basisPerIrrep.clone();
  }

  /**
   * Offset of the first basis function of an irrep.
   *
   * @param irrep a 0-based irrep index.
   * @return the offset.
   */
  public int getOffset(int irrep) {
    return offsets[irrep];
  }

  /**
   * Total number of basis functions.
   *
   * @return the total.
   */
  public int getTotalBasis() {
    return offsets[basisPerIrrep.length];
  }

  /**
   * Whether a desymmetrization matrix is present.
   *
   * @return true if coefficients must be transformed before evaluation.
   */
  public boolean isDesymmetrized() {
    return desymmetrization != null;
  }

  /**
   * Transform symmetry adapted coefficients to AO coefficients.
   *
   * @param coefficients symmetry adapted coefficients.
   * @return the AO coefficients (the input itself if there is no matrix).
   */
  public double[] toAO(double[] coefficients) {
    if (desymmetrization == null) {
      return coefficients;
    }
    int n = desymmetrization.length;
    double[] ao = new double[n];
    for (int i = 0; i < n; i++) {
      double[] row = desymmetrization[i];
      double sum = 0.0;
      for (int j = 0; j < n; j++) {
        sum += row[j] * coefficients[j];
      }
      ao[i] = sum;
    }
    return ao;
  }

  /**
   * Returns true if the irrep structure (labels and counts) matches another symmetry.
   *
   * @param other another symmetry.
   * @return true if compatible.
   */
  public boolean isCompatible(Symmetry other) {
    return Arrays.equals(basisPerIrrep, other.basisPerIrrep);
  }
}
