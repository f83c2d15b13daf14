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
package orbx.numerics.math;

import static org.apache.commons.math3.util.FastMath.PI;
import static org.apache.commons.math3.util.FastMath.pow;
import static org.apache.commons.math3.util.FastMath.sqrt;

import org.apache.commons.math3.special.Gamma;

/**
 * Normalization and overlap of Gaussian type functions.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class GaussianFunctions {

  /** Private constructor to prevent instantiation. */
  private GaussianFunctions() {
  }

  /**
   * Radial normalization ((2a)^(3+2l)/pi^3)^(1/4) of a primitive Gaussian.
   *
   * <p>Together with the angular factor
   * sqrt(2^l) x^lx y^ly z^lz / sqrt((2lx-1)!!(2ly-1)!!(2lz-1)!!) this yields a unit normalized
   * Cartesian primitive.
   *
   * @param exponent the Gaussian exponent.
   * @param l the angular momentum.
   * @return the normalization constant.
   */
  public static double primitiveNormalization(double exponent, int l) {
    return pow(pow(2.0 * exponent, 3 + 2 * l) / (PI * PI * PI), 0.25);
  }

  /**
   * Overlap of two normalized primitives of the same angular momentum on the same center.
   *
   * @param a first exponent.
   * @param b second exponent.
   * @param l the angular momentum.
   * @return (2 sqrt(ab) / (a + b))^(l + 3/2).
   */
  public static double primitiveOverlap(double a, double b, int l) {
    return pow(2.0 * sqrt(a * b) / (a + b), l + 1.5);
  }

  /**
   * Self overlap of a contracted function built from normalized primitives.
   *
   * @param exponents the exponents.
   * @param coefficients the contraction coefficients.
   * @param l the angular momentum.
   * @return the squared norm of the contraction.
   */
  public static double contractionSelfOverlap(double[] exponents, double[] coefficients, int l) {
    double s = 0.0;
    for (int i = 0; i < exponents.length; i++) {
      for (int j = 0; j < exponents.length; j++) {
        s += coefficients[i] * coefficients[j]
            * primitiveOverlap(exponents[i], exponents[j], l);
      }
    }
    return s;
  }

  /**
   * Double factorial n!! with (-1)!! = 0!! = 1.
   *
   * @param n an integer &gt;= -1.
   * @return n!!
   */
  public static double doubleFactorial(int n) {
    double ret = 1.0;
    for (int i = n; i > 1; i -= 2) {
      ret *= i;
    }
    return ret;
  }

  /**
   * Scale of a contaminant r^(2k) S(l-2k, m) evaluated with the radial normalization of l.
   *
   * @param l the shell angular momentum.
   * @param k the power of r^2.
   * @return sqrt(Gamma(l - 2k + 3/2) / Gamma(l + 3/2)).
   */
  public static double contaminantScale(int l, int k) {
    return sqrt(Gamma.gamma(l - 2 * k + 1.5) / Gamma.gamma(l + 1.5));
  }
}
