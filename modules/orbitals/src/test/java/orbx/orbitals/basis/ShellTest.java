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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.List;
import orbx.numerics.math.GaussianFunctions;
import orbx.utilities.OrbXTest;
import org.junit.Test;

/**
 * Test contraction normalization of shells.
 *
 * @author Michael J. Schnieders
 */
public class ShellTest extends OrbXTest {

  private static final double tolerance = 1.0e-12;

  private static double selfOverlap(Shell shell) {
    List<Primitive> primitives = shell.getPrimitives();
    double[] exponents = new double[primitives.size()];
    double[] coefficients = new double[primitives.size()];
    for (int i = 0; i < exponents.length; i++) {
      exponents[i] = primitives.get(i).getExponent();
      coefficients[i] = primitives.get(i).getCoefficient();
    }
    return GaussianFunctions.contractionSelfOverlap(exponents, coefficients, shell.getL());
  }

  @Test
  public void testNormalizeOnce() {
    Shell shell = new Shell(0, AngularMomentum.P, false, List.of(new Primitive(5.0, 0.15),
        new Primitive(1.2, 0.6), new Primitive(0.3, 0.4)));
    assertFalse(shell.isNormalized());
    assertTrue(shell.normalize());
    assertTrue(shell.isNormalized());
    assertEquals(1.0, selfOverlap(shell), tolerance);

    double first = shell.getPrimitives().get(0).getCoefficient();
    assertFalse(shell.normalize());
    assertEquals(first, shell.getPrimitives().get(0).getCoefficient(), 0.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEmptyShell() {
    new Shell(0, AngularMomentum.S, false, List.of());
  }
}
