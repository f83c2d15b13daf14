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
package orbx.utilities;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collection;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

/**
 * Test parsing of Fortran numeric fields.
 *
 * @author Michael J. Schnieders
 */
@RunWith(Parameterized.class)
public class StringUtilsTest extends OrbXTest {

  private static final double tolerance = 1.0e-14;
  private final String info;
  private final String field;
  private final double expected;

  public StringUtilsTest(String info, String field, double expected) {
    this.info = info;
    this.field = field;
    this.expected = expected;
  }

  @Parameters
  public static Collection<Object[]> data() {
    return Arrays.asList(
        new Object[][] {
            {"Upper case E", "1.5E+01", 15.0},
            {"Lower case e", "-2.5e-01", -0.25},
            {"Upper case D", "0.125D+01", 1.25},
            {"Lower case d", "4.0d0", 4.0},
            {"No exponent", "  42.  ", 42.0},
            {"Leading dot", ".5", 0.5},
            {"Starred field", "*********", Double.NaN}
        });
  }

  @Test
  public void testParseFortranDouble() {
    double value = StringUtils.parseFortranDouble(field);
    if (Double.isNaN(expected)) {
      assertTrue(info, Double.isNaN(value));
    } else {
      assertEquals(info, expected, value, tolerance);
    }
  }

  @Test
  public void testGluedFields() {
    double[] values = StringUtils.splitFortranDoubles(" 0.1E+00-0.2D+01 ***** 3");
    assertEquals(4, values.length);
    assertEquals(0.1, values[0], tolerance);
    assertEquals(-2.0, values[1], tolerance);
    assertTrue(Double.isNaN(values[2]));
    assertEquals(3.0, values[3], tolerance);
    assertArrayEquals(new double[0], StringUtils.splitFortranDoubles("   "), 0.0);
  }

  @Test
  public void testSignStartsNewField() {
    // Without an exponent marker a sign begins the next field.
    assertArrayEquals(new double[] {1.234, -105.0}, StringUtils.splitFortranDoubles("1.234-105"),
        tolerance);
  }

  @Test(expected = NumberFormatException.class)
  public void testRejectText() {
    StringUtils.splitFortranDoubles("1.0 abc 2.0");
  }
}
