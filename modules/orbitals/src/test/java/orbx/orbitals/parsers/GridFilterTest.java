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
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import orbx.lattice.GridSpec;
import orbx.lattice.ScalarField;
import orbx.orbitals.OrbitalFile;
import orbx.orbitals.PrecomputedFields;
import orbx.orbitals.mo.OrbitalSet;
import orbx.orbitals.mo.OrbitalType;
import orbx.utilities.OrbXTest;
import org.apache.commons.io.FileUtils;
import org.junit.Test;

/**
 * Test reading Molcas ASCII grid files.
 *
 * @author Michael J. Schnieders
 */
public class GridFilterTest extends OrbXTest {

  private static final double tolerance = 1.0e-10;

  @Test
  public void testSortedFields() throws ParseException, IOException {
    File file = getResourceFile("orbx/orbitals/structures/h2.grid");
    assertTrue(GridFilter.acceptDeep(file));
    OrbitalFile orbitalFile = new GridFilter(file, null, null).readFile();
    assertEquals("Grid test", orbitalFile.getTitle());
    assertEquals(2, orbitalFile.getMolecule().size());

    PrecomputedFields fields = orbitalFile.getPrecomputedFields();
    GridSpec grid = fields.getGridSpec();
    assertArrayEquals(new int[] {2, 2, 2}, grid.getCounts());
    assertArrayEquals(new double[] {0.0, 2.0, 0.0}, grid.getStep(1), tolerance);
    assertEquals(2, fields.getFieldCount());

    // Index 1 is stored second in the file.
    OrbitalSet set = orbitalFile.getPrecomputedSet();
    assertEquals(1, set.getOrbital(0).getIndexInIrrep());
    assertEquals(-0.5781, set.getOrbital(0).getEnergy(), tolerance);
    assertEquals(2.0, set.getOrbital(0).getOccupation(), tolerance);
    assertEquals(OrbitalType.INACTIVE, set.getOrbital(0).getType());
    assertEquals(OrbitalType.SECONDARY, set.getOrbital(1).getType());

    ScalarField first = fields.readField(0);
    ScalarField second = fields.readField(1);
    for (int p = 0; p < 8; p++) {
      assertEquals(-p, first.getValues()[p], tolerance);
      assertEquals(p + 0.5, second.getValues()[p], tolerance);
    }
  }

  @Test
  public void testEmbeddedOrbitals() throws ParseException {
    File file = getResourceFile("orbx/orbitals/structures/h2.grid");
    OrbitalFile orbitalFile = new GridFilter(file, null, null).readFile();
    assertEquals(2, orbitalFile.getOrbitalSets().size());
    OrbitalSet embedded = orbitalFile.getOrbitalSets().get(0);
    assertEquals(2, embedded.size());
    assertEquals(2.0, embedded.getOrbital(0).getOccupation(), tolerance);
    assertEquals(Math.sqrt(0.5), embedded.getOrbital(1).getCoefficient(0), 1.0e-14);
    assertEquals(InpOrbFilter.COMPANION_HINT, orbitalFile.getCompanion());
  }

  @Test
  public void testCompanionHint() throws ParseException, IOException {
    List<String> lines = FileUtils.readLines(
        getResourceFile("orbx/orbitals/structures/h2.grid"), StandardCharsets.US_ASCII);
    int end = 0;
    while (!lines.get(end).startsWith("#INPORB")) {
      end++;
    }
    File plain = registerTemporaryDirectory().resolve("plain.grid").toFile();
    FileUtils.writeLines(plain, lines.subList(0, end));
    OrbitalFile orbitalFile = new GridFilter(plain, null, null).readFile();
    assertEquals(1, orbitalFile.getOrbitalSets().size());
    assertEquals(InpOrbFilter.COMPANION_HINT, orbitalFile.getCompanion());
    assertFalse(orbitalFile.canEvaluate());

    File truncated = plain.toPath().resolveSibling("truncated.grid").toFile();
    FileUtils.writeLines(truncated, lines.subList(0, end - 3));
    try {
      new GridFilter(truncated, null, null).readFile();
      fail(" Truncated grid data were accepted.");
    } catch (ParseException e) {
      assertEquals("Grid", e.formatName);
    }
  }
}
