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
package orbx.ui;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.File;
import orbx.lattice.GridSpec;
import orbx.lattice.ScalarField;
import orbx.orbitals.OrbitalFile;
import orbx.orbitals.parsers.OrbitalFileOpener;
import orbx.utilities.OrbXTest;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.junit.Test;

/**
 * Test the command line.
 *
 * @author Michael J. Schnieders
 */
public class ViewCommandTest extends OrbXTest {

  private int execute(ViewCommand command, String... args) {
    return ViewCommand.commandLine(command).execute(args);
  }

  @Test
  public void testDensityCube() throws Exception {
    String molden = getResourceFile("orbx/ui/structures/h2.molden").getPath();
    File cube = registerTemporaryDirectory().resolve("h2.cube").toFile();
    ViewCommand command = new ViewCommand();
    assertEquals(0, execute(command, molden, "--list", "--density", "total", "--points", "16",
        "--cube", cube.getPath()));
    ScalarField field = command.getField();
    assertNotNull(field);
    for (int axis = 0; axis < 3; axis++) {
      assertTrue(field.getGridSpec().getCount(axis) <= 16);
    }

    OrbitalFile written = new OrbitalFileOpener(new CompositeConfiguration()).open(cube);
    assertEquals("Cube", written.getFormat());
    ScalarField read = written.getPrecomputedFields().readField(0);
    GridSpec grid = read.getGridSpec();
    assertEquals(field.getGridSpec().size(), grid.size());
    double[] expected = field.getValues();
    double[] values = read.getValues();
    for (int i = 0; i < values.length; i++) {
      assertEquals(expected[i], values[i], 1.0e-5 * Math.max(1.0, Math.abs(expected[i])));
    }
  }

  @Test
  public void testLaplacianOfOrbital() {
    String molden = getResourceFile("orbx/ui/structures/h2.molden").getPath();
    ViewCommand command = new ViewCommand();
    assertEquals(0, execute(command, molden, "--orbital", "1", "--laplacian", "-p", "12"));
    assertTrue(Double.isNaN(command.getField().get(0, 0, 0)));
    assertTrue(command.getField().getLabel().startsWith("Laplacian of"));
  }

  @Test
  public void testInpOrb() throws Exception {
    String molden = getResourceFile("orbx/ui/structures/h2.molden").getPath();
    File inporb = registerTemporaryDirectory().resolve("h2.InpOrb").toFile();
    ViewCommand command = new ViewCommand();
    assertEquals(0, execute(command, molden, "--inporb", inporb.getPath()));
    assertNull(command.getField());
    OrbitalFile written = new OrbitalFileOpener(new CompositeConfiguration()).open(inporb);
    assertEquals("InpOrb", written.getFormat());
    assertEquals(4, written.getOrbitalSets().get(0).size());
  }

  @Test
  public void testFailures() {
    String molden = getResourceFile("orbx/ui/structures/h2.molden").getPath();
    File missing = registerTemporaryDirectory().resolve("missing.molden").toFile();
    assertEquals(1, execute(new ViewCommand(), missing.getPath(), "--list"));
    assertEquals(1, execute(new ViewCommand(), molden, "--h5", missing.getPath()));
    assertEquals(1, execute(new ViewCommand(), molden, "--density", "beta"));
    assertEquals(1, execute(new ViewCommand(), molden, "--orbital", "1", "--set", "3"));
  }
}
