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

import static java.lang.String.format;
import static org.apache.commons.math3.util.CombinatoricsUtils.binomialCoefficient;
import static org.apache.commons.math3.util.CombinatoricsUtils.factorial;
import static org.apache.commons.math3.util.FastMath.abs;
import static org.apache.commons.math3.util.FastMath.sqrt;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.commons.math3.fraction.BigFraction;

/**
 * Expansion of real solid harmonics in Cartesian monomials.
 *
 * <p>The coefficients follow H. B. Schlegel and M. J. Frisch, "Transformation between Cartesian
 * and pure spherical harmonic Gaussians", Int. J. Quantum Chem. 54, 83 (1995). They are scaled so
 * that a harmonic combined with the primitive normalization ((2a)^(3+2l)/pi^3)^(1/4) is normalized,
 * the same convention as sqrt(2^l) x^lx y^ly z^lz for a Cartesian function.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class SolidHarmonics {

  /** Highest supported angular momentum. */
  public static final int MAX_L = 8;

  private static final Map<Integer, double[]> cache = new ConcurrentHashMap<>();

  /** Private constructor to prevent instantiation. */
  private SolidHarmonics() {
  }

  /**
   * Cartesian exponents of degree l, ordered with lx descending, then ly descending.
   *
   * @param l the degree.
   * @return an array of {lx, ly, lz} triples.
   */
  public static int[][] cartesianPowers(int l) {
    int[][] powers = new int[(l + 1) * (l + 2) / 2][];
    int n = 0;
    for (int lx = l; lx >= 0; lx--) {
      for (int ly = l - lx; ly >= 0; ly--) {
        powers[n++] = new int[] {lx, ly, l - lx - ly};
      }
    }
    return powers;
  }

  /**
   * Coefficients of the real solid harmonic (l, m) over {@link #cartesianPowers(int)}.
   *
   * @param l the degree.
   * @param m the order, -l &lt;= m &lt;= l; positive values are cosine-like, negative sine-like.
   * @return a copy of the coefficients.
   */
  public static double[] coefficients(int l, int m) {
    if (l < 0 || l > MAX_L || abs(m) > l) {
      throw new IllegalArgumentException(format(" Invalid solid harmonic (%d, %d).", l, m));
    }
    return cache.computeIfAbsent(l * (2 * MAX_L + 1) + m + MAX_L, key -> {
      int[][] powers = cartesianPowers(l);
      double[] c = new double[powers.length];
      for (int i = 0; i < powers.length; i++) {
        BigFraction squared = signedSquare(l, m, powers[i][0], powers[i][1], powers[i][2]);
        double value = sqrt(abs(squared.doubleValue()));
        c[i] = squared.getNumerator().signum() < 0 ? -value : value;
      }
      return c;
    }).clone();
  }

  /**
   * The square of the coefficient of x^lx y^ly z^lz in harmonic (l, m), carrying the sign of the
   * coefficient.
   *
   * @param l the degree.
   * @param m the order.
   * @param lx x exponent.
   * @param ly y exponent.
   * @param lz z exponent.
   * @return the signed square of the coefficient.
   */
  static BigFraction signedSquare(int l, int m, int lx, int ly, int lz) {
    if (lx + ly + lz != l || lx < 0 || ly < 0 || lz < 0) {
      throw new IllegalArgumentException(format(" Invalid monomial (%d, %d, %d).", lx, ly, lz));
    }
    int am = abs(m);
    int j = lx + ly - am;
    if (j % 2 != 0) {
      return BigFraction.ZERO;
    }
    j /= 2;

    long radial = 0;
    for (int i = 0; i <= (l - am) / 2; i++) {
      long term = binomial(l, i) * binomial(i, j)
          * (factorial(2 * l - 2 * i) / factorial(l - am - 2 * i));
      radial += (i % 2 == 0) ? term : -term;
    }
    if (radial == 0) {
      return BigFraction.ZERO;
    }

    // Real and imaginary parts of sum_k binom(j, k) binom(am, lx - 2k) i^(am - lx + 2k).
    long re = 0;
    long im = 0;
    for (int k = 0; k <= j; k++) {
      long term = binomial(j, k) * binomial(am, lx - 2 * k);
      if (term == 0) {
        continue;
      }
      switch (Math.floorMod(am - lx + 2 * k, 4)) {
        case 0:
          re += term;
          break;
        case 1:
          im += term;
          break;
        case 2:
          re -= term;
          break;
        default:
          im -= term;
          break;
      }
    }
    long angular = (m >= 0) ? re : im;
    if (angular == 0) {
      return BigFraction.ZERO;
    }

    BigInteger c = BigInteger.valueOf(radial).multiply(BigInteger.valueOf(angular));
    BigFraction squared = new BigFraction(c.multiply(c));
    if (c.signum() < 0) {
      squared = squared.negate();
    }
    int lm = (m == 0) ? 1 : 2;
    BigFraction scale = new BigFraction(factorial(l - am), factorial(l + am))
        .multiply(new BigFraction(lm, factorial(l)))
        .multiply(new BigFraction(1, factorial(2 * l)));
    return squared.multiply(scale);
  }

  /** Binomial coefficient that is zero outside 0 &lt;= k &lt;= n. */
  private static long binomial(int n, int k) {
    if (k < 0 || k > n) {
      return 0;
    }
    return binomialCoefficient(n, k);
  }
}
