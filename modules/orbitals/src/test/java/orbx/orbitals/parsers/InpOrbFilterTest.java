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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import orbx.orbitals.OrbitalFile;
import orbx.orbitals.mo.Orbital;
import orbx.orbitals.mo.OrbitalSet;
import orbx.orbitals.mo.OrbitalType;
import orbx.orbitals.mo.Symmetry;
import orbx.utilities.OrbXTest;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.io.FileUtils;
import org.junit.Test;

/**
 * Test reading InpOrb files.
 *
 * @author Michael J. Schnieders
 */
public class InpOrbFilterTest extends OrbXTest {

  private static final double tolerance = 1.0e-12;

  @Test
  public void testFewerOrbitalsThanBasisFunctions() throws ParseException {
    File file = getResourceFile("orbx/orbitals/structures/five.InpOrb");
    assertTrue(InpOrbFilter.acceptDeep(file));
    OrbitalFile orbitalFile = new InpOrbFilter(file, null, new CompositeConfiguration())
        .readFile();
    assertEquals("Three orbitals of five basis functions", orbitalFile.getTitle());
    assertEquals(1, orbitalFile.getOrbitalSets().size());
    OrbitalSet set = orbitalFile.getOrbitalSets().get(0);
    assertEquals(3, set.size());
    assertEquals(5, set.getSymmetry().getTotalBasis());
    for (Orbital orbital : set.getOrbitals()) {
      assertEquals(5, orbital.getCoefficients().length);
    }

    // Glued fields with D exponents.
    double half = Math.sqrt(0.5);
    assertArrayEquals(new double[] {0.0, half, -half, 0.0, 0.0},
        set.getOrbital(1).getCoefficients(), 1.0e-14);
    assertArrayEquals(new double[] {2.0, 1.0, 0.0},
        new double[] {set.getOrbital(0).getOccupation(), set.getOrbital(1).getOccupation(),
            set.getOrbital(2).getOccupation()}, tolerance);
    assertEquals(-0.25, set.getOrbital(1).getEnergy(), tolerance);
    assertEquals(OrbitalType.INACTIVE, set.getOrbital(0).getType());
    assertEquals(OrbitalType.RAS2, set.getOrbital(1).getType());
    assertEquals(OrbitalType.SECONDARY, set.getOrbital(2).getType());
    assertEquals(3, set.getOrbital(2).getIndexInIrrep());

    // Without a companion there is nothing to evaluate.
    assertNull(orbitalFile.getBasisSet());
    assertFalse(orbitalFile.canEvaluate());
    assertNotNull(orbitalFile.getCompanion());
  }

  @Test
  public void testCompanionMismatch() throws IOException {
    File file = getResourceFile("orbx/orbitals/structures/five.InpOrb");
    OrbitalFile companion = new OrbitalFile.Builder(new File("other.h5"), "HDF5")
        .symmetry(new Symmetry(new String[] {"a1", "b1"}, new int[] {3, 2}, null))
        .build();
    try {
      new InpOrbFilter(file, companion, new CompositeConfiguration()).readFile();
      fail(" A companion with different basis counts was accepted.");
    } catch (ParseException e) {
      assertTrue(e.reason.contains("other.h5"));
    }
  }

  @Test
  public void testSymmetryBlocks() throws IOException, ParseException {
    String content = "#INPORB 2.2\n"
        + "#INFO\n"
        + "* two irreps\n"
        + "       0       2       0\n"
        + "       2       1\n"
        + "       1       1\n"
        + "#ORB\n"
        + "* ORBITAL    1    1\n"
        + "  6.00000000000000E-01  8.00000000000000E-01\n"
        + "* ORBITAL    2    1\n"
        + "  1.00000000000000E+00\n"
        + "#OCC\n"
        + "* OCCUPATION NUMBERS\n"
        + "  2.0000E+00\n"
        + "  0.0000E+00\n"
        + "#UNKNOWN\n"
        + "* skipped\n"
        + "  1 2 3\n"
        + "#ONE\n"
        + "* ONE ELECTRON ENERGIES\n"
        + " -1.0000E+00\n"
        + " ***********\n";
    File file = registerTemporaryDirectory().resolve("blocks.InpOrb").toFile();
    FileUtils.writeStringToFile(file, content, StandardCharsets.UTF_8);
    OrbitalSet set = new InpOrbFilter(file, null, null).readFile().getOrbitalSets().get(0);
    assertEquals(2, set.size());
    assertArrayEquals(new double[] {0.6, 0.8, 0.0}, set.getOrbital(0).getCoefficients(),
        tolerance);
    assertArrayEquals(new double[] {0.0, 0.0, 1.0}, set.getOrbital(1).getCoefficients(),
        tolerance);
    assertEquals(1, set.getOrbital(1).getIrrep());
    assertEquals(1, set.getOrbital(1).getIndexInIrrep());
    assertFalse(set.getOrbital(1).hasValidEnergy());
    assertEquals(OrbitalType.UNKNOWN, set.getOrbital(0).getType());
  }

  @Test
  public void testMissingOrbitals() throws IOException {
    String content = "#INPORB 2.2\n#INFO\n* no orbitals\n       0       1       0\n"
        + "       2\n       2\n#OCC\n* OCCUPATION NUMBERS\n  2.0 0.0\n";
    File file = registerTemporaryDirectory().resolve("empty.InpOrb").toFile();
    FileUtils.writeStringToFile(file, content, StandardCharsets.UTF_8);
    try {
      new InpOrbFilter(file, null, null).readFile();
      fail(" A file without #ORB was accepted.");
    } catch (ParseException e) {
      assertEquals("InpOrb", e.formatName);
    }
  }
}
