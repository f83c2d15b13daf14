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

import static org.apache.commons.math3.util.FastMath.sqrt;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.Collection;
import orbx.utilities.OrbXTest;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

/**
 * Test the Cartesian expansion of real solid harmonics against known low order functions.
 *
 * @author Michael J. Schnieders
 */
@RunWith(Parameterized.class)
public class SolidHarmonicsTest extends OrbXTest {

  private static final double tolerance = 1.0e-12;
  private final String info;
  private final int l;
  private final int m;
  private final int[] powers;
  private final double expected;

  public SolidHarmonicsTest(String info, int l, int m, int[] powers, double expected) {
    this.info = info;
    this.l = l;
    this.m = m;
    this.powers = powers;
    this.expected = expected;
  }

  @Parameters
  public static Collection<Object[]> data() {
    return Arrays.asList(
        new Object[][] {
            {"s", 0, 0, new int[] {0, 0, 0}, 1.0},
            {"p0 z", 1, 0, new int[] {0, 0, 1}, sqrt(2.0)},
            {"p+1 x", 1, 1, new int[] {1, 0, 0}, sqrt(2.0)},
            {"p-1 y", 1, -1, new int[] {0, 1, 0}, sqrt(2.0)},
            {"p-1 x", 1, -1, new int[] {1, 0, 0}, 0.0},
            {"d0 zz", 2, 0, new int[] {0, 0, 2}, 2.0 / sqrt(3.0)},
            {"d0 xx", 2, 0, new int[] {2, 0, 0}, -1.0 / sqrt(3.0)},
            {"d0 yy", 2, 0, new int[] {0, 2, 0}, -1.0 / sqrt(3.0)},
            {"d-2 xy", 2, -2, new int[] {1, 1, 0}, 2.0},
            {"d+2 xx", 2, 2, new int[] {2, 0, 0}, 1.0},
            {"d+2 yy", 2, 2, new int[] {0, 2, 0}, -1.0},
            {"d+1 xz", 2, 1, new int[] {1, 0, 1}, 2.0},
            {"d-1 yz", 2, -1, new int[] {0, 1, 1}, 2.0}
        });
  }

  @Test
  public void testCoefficient() {
    int[][] cartesian = SolidHarmonics.cartesianPowers(l);
    double[] coefficients = SolidHarmonics.coefficients(l, m);
    for (int i = 0; i < cartesian.length; i++) {
      if (Arrays.equals(cartesian[i], powers)) {
        assertEquals(info, expected, coefficients[i], tolerance);
        return;
      }
    }
    throw new AssertionError(info + " monomial not found.");
  }

  @Test
  public void testCoefficientsAreCopies() {
    double[] first = SolidHarmonics.coefficients(l, m);
    double[] saved = first.clone();
    Arrays.fill(first, 42.0);
    assertArrayEquals(info, saved, SolidHarmonics.coefficients(l, m), 0.0);
  }

  @Test
  public void testPowerCount() {
    assertEquals(info, (l + 1) * (l + 2) / 2, SolidHarmonics.cartesianPowers(l).length);
    for (int[] p : SolidHarmonics.cartesianPowers(l)) {
      assertEquals(info, l, p[0] + p[1] + p[2]);
    }
  }
}
