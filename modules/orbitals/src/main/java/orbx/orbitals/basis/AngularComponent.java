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
package orbx.orbitals.basis;

import static java.lang.String.format;
import static org.apache.commons.math3.util.CombinatoricsUtils.factorial;
import static org.apache.commons.math3.util.FastMath.abs;
import static org.apache.commons.math3.util.FastMath.sqrt;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import orbx.numerics.math.GaussianFunctions;
import orbx.numerics.math.SolidHarmonics;

/**
 * The angular factor of a basis function, expanded as a polynomial in Cartesian monomials.
 *
 * <p>Three kinds exist: a pure real solid harmonic S(l, m); a Cartesian monomial
 * sqrt(2^l) x^lx y^ly z^lz; and a contaminant r^(2k) S(l - 2k, m) that some programs keep in
 * spherical shells.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class AngularComponent {

  /** Kinds of angular components. */
  public enum Kind {
    SPHERICAL, CARTESIAN, CONTAMINANT
  }

  private final Kind kind;
  private final int l;
  private final int m;
  private final int k;
  private final int[] cartesian;
  private final int[][] powers;
  private final double[] factors;

  private AngularComponent(Kind kind, int l, int m, int k, int[] cartesian,
      Map<List<Integer>, Double> terms) {
    this.kind = kind;
    this.l = l;
    this.m = m;
    this.k = k;
    this.cartesian = cartesian;
    List<int[]> p = new ArrayList<>();
    List<Double> f = new ArrayList<>();
    for (Map.Entry<List<Integer>, Double> term : terms.entrySet()) {
      if (term.getValue() != 0.0) {
        List<Integer> key = term.getKey();
        p.add(new int[] {key.get(0), key.get(1), key.get(2)});
        f.add(term.getValue());
      }
    }
    powers = p.toArray(new int[0][]);
    factors = new double[f.size()];
    for (int i = 0; i < factors.length; i++) {
      factors[i] = f.get(i);
    }
  }

  /**
   * A pure real solid harmonic.
   *
   * @param l the degree.
   * @param m the order, -l &lt;= m &lt;= l.
   * @return the component.
   */
  public static AngularComponent spherical(int l, int m) {
    return new AngularComponent(Kind.SPHERICAL, l, m, 0, null, harmonicTerms(l, m, 0, 1.0));
  }

  /**
   * A Cartesian monomial scaled by sqrt(2^l).
   *
   * @param lx x exponent.
   * @param ly y exponent.
   * @param lz z exponent.
   * @return the component.
   */
  public static AngularComponent cartesian(int lx, int ly, int lz) {
    int l = lx + ly + lz;
    Map<List<Integer>, Double> terms = new LinkedHashMap<>();
    terms.put(List.of(lx, ly, lz), sqrt(1L << l));
    return new AngularComponent(Kind.CARTESIAN, l, 0, 0, new int[] {lx, ly, lz}, terms);
  }

  /**
   * A contaminant r^(2k) S(l - 2k, m) of a spherical shell of degree l.
   *
   * @param l the shell degree.
   * @param k the power of r^2, 1 &lt;= k &lt;= l / 2.
   * @param m the order of the harmonic, |m| &lt;= l - 2k.
   * @return the component.
   */
  public static AngularComponent contaminant(int l, int k, int m) {
    if (k < 1 || 2 * k > l || abs(m) > l - 2 * k) {
      throw new IllegalArgumentException(format(" Invalid contaminant (l=%d, k=%d, m=%d).", l, k,
          m));
    }
    return new AngularComponent(Kind.CONTAMINANT, l, m, k, null,
        harmonicTerms(l - 2 * k, m, k, GaussianFunctions.contaminantScale(l, k)));
  }

  /**
   * Cartesian exponents for index m of a Cartesian shell, using the ordering in which m + l
   * enumerates (ly + lz, lz) pairs: x^l first, z^l last.
   *
   * @param l the shell degree.
   * @param m the index, -l &lt;= m &lt;= (l + 1)(l + 2)/2 - l - 1.
   * @return {lx, ly, lz}.
   */
  public static int[] cartesianPowersOfIndex(int l, int m) {
    int n = m + l;
    if (n < 0 || n >= (l + 1) * (l + 2) / 2) {
      throw new IllegalArgumentException(format(" Cartesian index %d is out of range for l=%d.", m,
          l));
    }
    int lyz = (int) Math.floor((sqrt(8.0 * n + 1.0) - 1.0) / 2.0);
    int lz = n - lyz * (lyz + 1) / 2;
    return new int[] {l - lyz, lyz - lz, lz};
  }

  /** Expand (x^2 + y^2 + z^2)^k S(l, m) into monomials. */
  private static Map<List<Integer>, Double> harmonicTerms(int l, int m, int k, double scale) {
    int[][] monomials = SolidHarmonics.cartesianPowers(l);
    double[] c = SolidHarmonics.coefficients(l, m);
    Map<List<Integer>, Double> terms = new LinkedHashMap<>();
    for (int i = 0; i < monomials.length; i++) {
      if (c[i] == 0.0) {
        continue;
      }
      for (int a = 0; a <= k; a++) {
        for (int b = 0; b <= k - a; b++) {
          int d = k - a - b;
          double multinomial = (double) factorial(k) / (factorial(a) * factorial(b) * factorial(d));
          List<Integer> key = List.of(monomials[i][0] + 2 * a, monomials[i][1] + 2 * b,
              monomials[i][2] + 2 * d);
          terms.merge(key, scale * multinomial * c[i], Double::sum);
        }
      }
    }
    return terms;
  }

  /**
   * Evaluate the polynomial at a displacement from the center.
   *
   * @param x x displacement.
   * @param y y displacement.
   * @param z z displacement.
   * @return the angular factor.
   */
  public double evaluate(double x, double y, double z) {
    double sum = 0.0;
    for (int t = 0; t < factors.length; t++) {
      int[] p = powers[t];
      sum += factors[t] * pow(x, p[0]) * pow(y, p[1]) * pow(z, p[2]);
    }
    return sum;
  }

  private static double pow(double v, int n) {
    double r = 1.0;
    for (int i = 0; i < n; i++) {
      r *= v;
    }
    return r;
  }

  /**
   * Getter for the field <code>kind</code>.
   *
   * @return the kind.
   */
  public Kind getKind() {
    return kind;
  }

  /**
   * Total polynomial degree, equal to the shell degree.
   *
   * @return l.
   */
  public int getL() {
    return l;
  }

  /**
   * Order of the harmonic for spherical components and contaminants.
   *
   * @return m.
   */
  public int getM() {
    return m;
  }

  /**
   * Power of r^2 for a contaminant.
   *
   * @return k, or 0 for other kinds.
   */
  public int getK() {
    return k;
  }

  /**
   * Cartesian exponents.
   *
   * @return {lx, ly, lz} for Cartesian components, otherwise null.
   */
  public int[] getCartesianPowers() {
    return cartesian == null ? null : cartesian.clone();
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    switch (kind) {
      case CARTESIAN:
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 3; i++) {
          sb.append(String.valueOf("xyz".charAt(i)).repeat(cartesian[i]));
        }
        return sb.length() == 0 ? "s" : sb.toString();
      case CONTAMINANT:
        return format("r%d(%d,%+d)", 2 * k, l - 2 * k, m);
      default:
        return format("(%d,%+d)", l, m);
    }
  }
}
