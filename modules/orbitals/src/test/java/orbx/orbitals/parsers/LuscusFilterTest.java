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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import orbx.lattice.ScalarField;
import orbx.orbitals.OrbitalFile;
import orbx.orbitals.PrecomputedFields;
import orbx.orbitals.mo.OrbitalSet;
import orbx.utilities.Constants;
import orbx.utilities.OrbXTest;
import org.apache.commons.io.FileUtils;
import org.junit.Before;
import org.junit.Test;

/**
 * Test reading Luscus grid files.
 *
 * @author Michael J. Schnieders
 */
public class LuscusFilterTest extends OrbXTest {

  private static final double tolerance = 1.0e-12;

  private static final String HEADER = String.join("\n",
      "2",
      "H2 luscus",
      "H 0.0 0.0 -0.37",
      "H 0.0 0.0 0.37",
      "<GRID>",
      " N_of_MO= 2",
      " N_of_Grids= 2",
      " N_of_Points= 8",
      " Block_Size= 5",
      " N_Blocks= 2",
      " Is_cutoff= 0",
      " CutOff= 0.0",
      " N_P= 8",
      " Net= 2 2 2",
      " Origin= -1.0 -1.0 -1.0",
      " Axis_1= 2.0 0.0 0.0",
      " Axis_2= 0.0 2.0 0.0",
      " Axis_3= 0.0 0.0 2.0",
      " GridName= 1_2 sym= 1 index= 2 Energ= 0.6700 occ= 0.0000 type= s",
      " GridName= 1_1 sym= 1 index= 1 Energ= -0.5781 occ= 2.0000 type= i",
      " <DENSITY>",
      "");

  private File dir;

  @Before
  public void setUp() {
    dir = registerTemporaryDirectory().toFile();
  }

  /**
   * Write a Luscus file whose first slot holds p + 0.5 and second slot -p at point p.
   *
   * @param name the file name.
   * @param points the number of points actually written.
   * @return the file.
   */
  private File writeLuscus(String name, int points) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.write(HEADER.getBytes(StandardCharsets.US_ASCII));
    ByteBuffer buffer = ByteBuffer.allocate(8 * 16).order(ByteOrder.LITTLE_ENDIAN);
    int[][] blocks = {{0, 5}, {5, 3}};
    for (int[] block : blocks) {
      for (int slot = 0; slot < 2; slot++) {
        for (int p = block[0]; p < block[0] + block[1]; p++) {
          buffer.putDouble(slot == 0 ? p + 0.5 : -p);
        }
      }
    }
    out.write(Arrays.copyOf(buffer.array(), 16 * points));
    File file = new File(dir, name);
    FileUtils.writeByteArrayToFile(file, out.toByteArray());
    return file;
  }

  @Test
  public void testReadFields() throws ParseException, IOException {
    File file = writeLuscus("h2.lus", 8);
    assertTrue(LuscusFilter.acceptDeep(file));
    OrbitalFile orbitalFile = new LuscusFilter(file, null, null).readFile();
    assertEquals("H2 luscus", orbitalFile.getTitle());
    assertEquals(0.37 / Constants.LUSCUS_BOHR,
        orbitalFile.getMolecule().getAtom(1).getXYZ()[2], tolerance);
    assertFalse(orbitalFile.canEvaluate());
    assertEquals(InpOrbFilter.COMPANION_HINT, orbitalFile.getCompanion());

    OrbitalSet set = orbitalFile.getPrecomputedSet();
    assertEquals(1, set.getOrbital(0).getIndexInIrrep());
    assertEquals(2, set.getOrbital(1).getIndexInIrrep());
    assertEquals(0.67, set.getOrbital(1).getEnergy(), tolerance);

    PrecomputedFields fields = orbitalFile.getPrecomputedFields();
    assertEquals(8.0, fields.getGridSpec().getCellVolume(), tolerance);
    ScalarField occupied = fields.readField(0);
    ScalarField virtual = fields.readField(1);
    for (int p = 0; p < 8; p++) {
      assertEquals(-p, occupied.getValues()[p], tolerance);
      assertEquals(p + 0.5, virtual.getValues()[p], tolerance);
    }
  }

  @Test
  public void testShortBinaryData() throws IOException {
    File file = writeLuscus("short.lus", 7);
    assertTrue(LuscusFilter.acceptDeep(file));
    try {
      new LuscusFilter(file, null, null).readFile();
      fail(" Short binary data were accepted.");
    } catch (ParseException e) {
      assertEquals("Luscus", e.formatName);
      assertTrue(e.reason.contains("expected 128"));
    }
  }

  @Test
  public void testNotLuscus() {
    File file = getResourceFile("orbx/orbitals/structures/grid.cube");
    assertFalse(LuscusFilter.acceptDeep(file));
  }
}
