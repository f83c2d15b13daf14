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
package orbx.orbitals.parsers;

import static java.lang.String.format;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.List;

/**
 * Conversions of the arrays returned by the HDF5 reader, which depend on the stored type and
 * rank, into flat Java arrays.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
final class HDF5Arrays {

  /** Private constructor to prevent instantiation. */
  private HDF5Arrays() {
  }

  /**
   * Flatten numeric data of any rank into doubles.
   *
   * @param data a Number or a (nested) primitive array.
   * @return the values in row major order.
   */
  static double[] doubles(Object data) {
    List<Double> values = new ArrayList<>();
    collect(data, values);
    double[] ret = new double[values.size()];
    for (int i = 0; i < ret.length; i++) {
      ret[i] = values.get(i);
    }
    return ret;
  }

  /**
   * Flatten integer data of any rank.
   *
   * @param data a Number or a (nested) primitive array.
   * @return the values in row major order.
   */
  static int[] ints(Object data) {
    double[] values = doubles(data);
    int[] ret = new int[values.length];
    for (int i = 0; i < ret.length; i++) {
      ret[i] = (int) Math.round(values[i]);
    }
    return ret;
  }

  /**
   * Split flattened integer data into rows.
   *
   * @param data the data.
   * @param columns the row length.
   * @return the rows.
   */
  static int[][] intRows(Object data, int columns) {
    int[] flat = ints(data);
    if (flat.length % columns != 0) {
      throw new IllegalArgumentException(format(" %d values do not form rows of %d.",
          flat.length, columns));
    }
    int[][] rows = new int[flat.length / columns][columns];
    for (int i = 0; i < rows.length; i++) {
      System.arraycopy(flat, i * columns, rows[i], 0, columns);
    }
    return rows;
  }

  /**
   * Flatten string data, trimming the padding of fixed length strings.
   *
   * @param data a String or a (nested) String array.
   * @return the strings.
   */
  static String[] strings(Object data) {
    List<String> values = new ArrayList<>();
    collectStrings(data, values);
    return values.toArray(new String[0]);
  }

  private static void collect(Object data, List<Double> values) {
    if (data instanceof Number) {
      values.add(((Number) data).doubleValue());
    } else if (data instanceof double[]) {
      for (double d : (double[]) data) {
        values.add(d);
      }
    } else if (data != null && data.getClass().isArray()) {
      int n = Array.getLength(data);
      for (int i = 0; i < n; i++) {
        Object element = Array.get(data, i);
        if (element instanceof Character) {
          values.add((double) (Character) element);
        } else {
          collect(element, values);
        }
      }
    } else {
      throw new IllegalArgumentException(format(" Expected numeric data, not %s.",
          data == null ? "nothing" : data.getClass().getSimpleName()));
    }
  }

  private static void collectStrings(Object data, List<String> values) {
    if (data instanceof String) {
      values.add(((String) data).trim());
    } else if (data instanceof byte[]) {
      for (byte b : (byte[]) data) {
        values.add(Character.toString((char) b).trim());
      }
    } else if (data instanceof Object[]) {
      for (Object element : (Object[]) data) {
        collectStrings(element, values);
      }
    } else {
      throw new IllegalArgumentException(format(" Expected string data, not %s.",
          data == null ? "nothing" : data.getClass().getSimpleName()));
    }
  }
}
