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

/**
 * A dense array of values sampled on a {@link GridSpec}. NaN marks points where the field is not
 * defined.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class ScalarField {

  private final GridSpec gridSpec;
  private final double[] values;
  private final String label;

  /**
   * Constructor for ScalarField.
   *
   * @param gridSpec the grid.
   * @param values one value per grid point in {@link GridSpec#index(int, int, int)} order.
   * @param label a description of what the field holds.
   */
  public ScalarField(GridSpec gridSpec, double[] values, String label) {
    if (values.length != gridSpec.size()) {
      throw new IllegalArgumentException(format(" %d values do not fill a grid of %d points.",
          values.length, gridSpec.size()));
    }
    this.gridSpec = gridSpec;
    this.values = values;
    this.label = label;
  }

  /**
   * The grid.
   *
   * @return the grid.
   */
  public GridSpec getGridSpec() {
    return gridSpec;
  }

  /**
   * The values. The array is shared, callers must not modify it.
   *
   * @return the values.
   */
  public double[] getValues() {
    return values;
  }

  /**
   * Value at a lattice point.
   *
   * @param i first axis index.
   * @param j second axis index.
   * @param k third axis index.
   * @return the value.
   */
  public double get(int i, int j, int k) {
    return values[gridSpec.index(i, j, k)];
  }

  /**
   * The label.
   *
   * @return the label.
   */
  public String getLabel() {
    return label;
  }

  /**
   * Sum of the defined values times the cell volume.
   *
   * @return the integral of the field over the grid.
   */
  public double integrate() {
    double sum = 0.0;
    for (double v : values) {
      if (!Double.isNaN(v)) {
        sum += v;
      }
    }
    return sum * gridSpec.getCellVolume();
  }

  /**
   * Minimum and maximum of the defined values.
   *
   * @return {min, max}, or {NaN, NaN} if no value is defined.
   */
  public double[] getRange() {
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (double v : values) {
      if (!Double.isNaN(v)) {
        min = Math.min(min, v);
        max = Math.max(max, v);
      }
    }
    if (min > max) {
      return new double[] {Double.NaN, Double.NaN};
    }
    return new double[] {min, max};
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format(" %s on%s", label, gridSpec);
  }
}
