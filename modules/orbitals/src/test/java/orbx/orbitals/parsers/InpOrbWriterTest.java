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
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import orbx.orbitals.mo.Orbital;
import orbx.orbitals.mo.OrbitalSet;
import orbx.orbitals.mo.OrbitalType;
import orbx.orbitals.mo.Spin;
import orbx.orbitals.mo.Symmetry;
import orbx.utilities.OrbXTest;
import org.apache.commons.io.FileUtils;
import org.junit.Test;

/**
 * Test writing InpOrb files.
 *
 * @author Michael J. Schnieders
 */
public class InpOrbWriterTest extends OrbXTest {

  private static final double tolerance = 1.0e-14;

  private OrbitalSet readFive() throws ParseException {
    File file = getResourceFile("orbx/orbitals/structures/five.InpOrb");
    return new InpOrbFilter(file, null, null).readFile().getOrbitalSets().get(0);
  }

  private static OrbitalSet read(File file) throws ParseException {
    return new InpOrbFilter(file, null, null).readFile().getOrbitalSets().get(0);
  }

  private static void assertSameOrbitals(OrbitalSet expected, OrbitalSet actual) {
    assertEquals(expected.size(), actual.size());
    for (int i = 0; i < expected.size(); i++) {
      Orbital e = expected.getOrbital(i);
      Orbital a = actual.getOrbital(i);
      assertArrayEquals(e.getCoefficients(), a.getCoefficients(), tolerance);
      assertEquals(e.getOccupation(), a.getOccupation(), tolerance);
      assertEquals(e.getEnergy(), a.getEnergy(), 1.0e-4);
      assertEquals(e.getType(), a.getType());
      assertEquals(e.getIrrep(), a.getIrrep());
    }
  }

  @Test
  public void testRoundTrip() throws IOException, ParseException {
    OrbitalSet set = readFive();
    File out = registerTemporaryDirectory().resolve("copy.InpOrb").toFile();
    new InpOrbWriter("five.InpOrb").write(out, set, null);
    OrbitalSet copy = read(out);
    assertSameOrbitals(set, copy);
    assertEquals(3, copy.getOrbitalsPerIrrep()[0]);
  }

  @Test
  public void testFilteredAndReordered() throws IOException, ParseException {
    OrbitalSet set = readFive();
    OrbitalSet edited = set.edit()
        .reorder(new int[] {2, 0, 1})
        .retain(o -> o.getType() != OrbitalType.RAS2)
        .build();
    assertEquals(2, edited.size());
    File out = registerTemporaryDirectory().resolve("filtered.InpOrb").toFile();
    new InpOrbWriter("five.InpOrb").write(out, edited, null);
    String text = FileUtils.readFileToString(out, StandardCharsets.US_ASCII);
    assertTrue(text.contains("#INDEX\n* 1234567890\n0 si\n"));
    OrbitalSet copy = read(out);
    assertSameOrbitals(edited, copy);
    assertEquals(5, copy.getSymmetry().getTotalBasis());
  }

  @Test
  public void testPatch() throws IOException, ParseException {
    File source = getResourceFile("orbx/orbitals/structures/five.InpOrb");
    OrbitalSet set = readFive();
    OrbitalSet retyped = set.edit().setType(2, OrbitalType.RAS3).build();
    File out = registerTemporaryDirectory().resolve("patched.InpOrb").toFile();
    new InpOrbWriter("five.InpOrb").patch(source, out, retyped, null);
    String text = FileUtils.readFileToString(out, StandardCharsets.ISO_8859_1);
    assertTrue(text.contains("* File generated by orbx from five.InpOrb"));
    assertTrue(text.endsWith("#INDEX\n* 1234567890\n0 i23\n"));
    OrbitalSet copy = read(out);
    assertSameOrbitals(retyped, copy);

    OrbitalSet fewer = set.edit().retain(o -> o.getIndexInIrrep() < 3).build();
    try {
      new InpOrbWriter("five.InpOrb").patch(source, out, fewer, null);
      fail(" A patch with a different number of orbitals was written.");
    } catch (IllegalArgumentException e) {
      assertTrue(e.getMessage().contains("Wrong number of orbitals"));
    }
  }

  @Test
  public void testPatchInPlace() throws IOException, ParseException {
    Path directory = registerTemporaryDirectory();
    File copy = directory.resolve("five.InpOrb").toFile();
    FileUtils.copyFile(getResourceFile("orbx/orbitals/structures/five.InpOrb"), copy);
    OrbitalSet retyped = readFive().edit().setType(0, OrbitalType.FROZEN).build();
    new InpOrbWriter("five.InpOrb").patch(copy, copy, retyped, null);
    String text = FileUtils.readFileToString(copy, StandardCharsets.ISO_8859_1);
    assertTrue(text.endsWith("#INDEX\n* 1234567890\n0 f2s\n"));
    assertSameOrbitals(retyped, read(copy));
    assertArrayEquals(new String[] {"five.InpOrb"}, directory.toFile().list());
  }

  @Test
  public void testFailedPatchKeepsTarget() throws IOException, ParseException {
    Path directory = registerTemporaryDirectory();
    File copy = directory.resolve("five.InpOrb").toFile();
    FileUtils.copyFile(getResourceFile("orbx/orbitals/structures/five.InpOrb"), copy);
    byte[] before = Files.readAllBytes(copy.toPath());
    OrbitalSet fewer = readFive().edit().retain(o -> o.getIndexInIrrep() < 3).build();
    try {
      new InpOrbWriter("five.InpOrb").patch(copy, copy, fewer, null);
      fail(" A patch with a different number of orbitals was written.");
    } catch (IllegalArgumentException e) {
      assertArrayEquals(before, Files.readAllBytes(copy.toPath()));
    }
    assertArrayEquals(new String[] {"five.InpOrb"}, directory.toFile().list());
  }

  @Test
  public void testCommaDecimalLocale() throws IOException, ParseException {
    OrbitalSet set = readFive();
    File out = registerTemporaryDirectory().resolve("locale.InpOrb").toFile();
    Locale locale = Locale.getDefault();
    try {
      Locale.setDefault(Locale.GERMANY);
      new InpOrbWriter("five.InpOrb").write(out, set, null);
    } finally {
      Locale.setDefault(locale);
    }
    assertSameOrbitals(set, read(out));
  }

  @Test
  public void testPatchFromGrid() throws IOException, ParseException {
    File source = getResourceFile("orbx/orbitals/structures/h2.grid");
    OrbitalSet embedded = new GridFilter(source, null, null).readFile().getOrbitalSets().get(0);
    File out = registerTemporaryDirectory().resolve("embedded.InpOrb").toFile();
    new InpOrbWriter("h2.grid").patch(source, out, embedded, null);
    String text = FileUtils.readFileToString(out, StandardCharsets.ISO_8859_1);
    assertTrue(text.startsWith("#INPORB 2.2\n#INFO\n* File generated by orbx from h2.grid\n"));
    assertEquals(2, read(out).size());
  }

  @Test
  public void testUnrestrictedIndex() {
    Symmetry symmetry = Symmetry.none(3);
    OrbitalSet alpha = set("Alpha", Spin.ALPHA, symmetry, OrbitalType.INACTIVE,
        OrbitalType.INACTIVE, OrbitalType.SECONDARY);
    OrbitalSet beta = set("Beta", Spin.BETA, symmetry, OrbitalType.INACTIVE,
        OrbitalType.SECONDARY, OrbitalType.SECONDARY);
    List<String> index = InpOrbWriter.index(alpha, beta);
    assertEquals(List.of("* 1234567890", "0 i2s"), index);

    OrbitalSet clash = set("Beta", Spin.BETA, symmetry, OrbitalType.FROZEN,
        OrbitalType.SECONDARY, OrbitalType.SECONDARY);
    try {
      InpOrbWriter.index(alpha, clash);
      fail(" Inactive and frozen types were merged.");
    } catch (IllegalArgumentException e) {
      // Expected.
    }
  }

  @Test
  public void testUnrestrictedRoundTrip() throws IOException, ParseException {
    Symmetry symmetry = Symmetry.none(3);
    OrbitalSet alpha = set("Alpha", Spin.ALPHA, symmetry, OrbitalType.INACTIVE,
        OrbitalType.RAS2, OrbitalType.SECONDARY);
    OrbitalSet beta = set("Beta", Spin.BETA, symmetry, OrbitalType.INACTIVE,
        OrbitalType.RAS2, OrbitalType.SECONDARY);
    File out = registerTemporaryDirectory().resolve("uhf.InpOrb").toFile();
    new InpOrbWriter("test").write(out, alpha, beta);
    List<OrbitalSet> sets = new InpOrbFilter(out, null, null).readFile().getOrbitalSets();
    assertEquals(2, sets.size());
    assertEquals(Spin.BETA, sets.get(1).getSpin());
    assertSameOrbitals(beta, sets.get(1));
  }

  private static OrbitalSet set(String name, Spin spin, Symmetry symmetry,
      OrbitalType... types) {
    OrbitalSet.Builder builder = new OrbitalSet.Builder(name, symmetry).spin(spin);
    for (int i = 0; i < types.length; i++) {
      double[] c = new double[types.length];
      c[i] = 1.0;
      builder.add(new Orbital.Builder()
          .coefficients(c)
          .energy(-1.0 + 0.5 * i)
          .occupation(types[i] == OrbitalType.SECONDARY ? 0.0 : 1.0)
          .spin(spin)
          .type(types[i])
          .indexInIrrep(i + 1)
          .build());
    }
    return builder.build();
  }
}
