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

import static orbx.orbitals.parsers.HDF5Fixtures.S;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import orbx.orbitals.OrbitalFile;
import orbx.orbitals.basis.AngularComponent;
import orbx.orbitals.mo.DensityKind;
import orbx.orbitals.mo.OrbitalSet;
import orbx.orbitals.mo.OrbitalType;
import orbx.orbitals.mo.Spin;
import orbx.utilities.OrbXTest;
import org.apache.commons.io.FileUtils;
import org.junit.Before;
import org.junit.Test;

/**
 * Test reading Molcas HDF5 files.
 *
 * @author Michael J. Schnieders
 */
public class HDF5FilterTest extends OrbXTest {

  private static final double tolerance = 1.0e-10;

  private File dir;

  @Before
  public void setUp() {
    dir = registerTemporaryDirectory().toFile();
  }

  static OrbitalSet named(OrbitalFile orbitalFile, String name) {
    for (OrbitalSet set : orbitalFile.getOrbitalSets()) {
      if (set.getName().equals(name)) {
        return set;
      }
    }
    fail(" No orbital set named " + name);
    return null;
  }

  @Test
  public void testWithoutSymmetry() throws ParseException {
    File file = new File(dir, "h2.h5");
    HDF5Fixtures.writeH2(file.toPath());
    assertTrue(HDF5Filter.acceptDeep(file));
    OrbitalFile orbitalFile = new HDF5Filter(file, null).readFile();
    assertTrue(orbitalFile.canEvaluate());
    assertEquals(2, orbitalFile.getMolecule().size());
    assertEquals(1, orbitalFile.getMolecule().getAtom(1).getAtomicNumber());
    assertEquals(0.7, orbitalFile.getMolecule().getAtom(1).getXYZ()[2], tolerance);
    assertEquals(2, orbitalFile.getBasisSet().getFunctions().size());

    OrbitalSet orbitals = named(orbitalFile, "Orbitals");
    assertEquals(Spin.NONE, orbitals.getSpin());
    assertEquals(OrbitalType.INACTIVE, orbitals.getOrbital(0).getType());
    assertEquals(0.67, orbitals.getOrbital(1).getEnergy(), tolerance);
    assertArrayEquals(new double[] {S, -S}, orbitals.getAOCoefficients(1), tolerance);

    OrbitalSet natural = named(orbitalFile, "Root 1 natural orbitals");
    assertEquals(DensityKind.STATE, natural.getDensityKind());
    assertEquals(2.0, natural.getOccupationSum(), 1.0e-8);
    double max = 0.0;
    for (int i = 0; i < natural.size(); i++) {
      max = Math.max(max, natural.getOrbital(i).getOccupation());
    }
    assertEquals(2.0, max, 1.0e-8);
  }

  @Test
  public void testSymmetry() throws ParseException {
    File file = new File(dir, "sym.h5");
    HDF5Fixtures.writeSymmetricH2(file.toPath());
    OrbitalFile orbitalFile = new HDF5Filter(file, null).readFile();
    assertEquals(2, orbitalFile.getSymmetry().getIrrepCount());
    assertEquals("b1u", orbitalFile.getSymmetry().getIrrepLabel(1));

    OrbitalSet orbitals = named(orbitalFile, "Orbitals");
    assertEquals(1, orbitals.getOrbital(1).getIrrep());
    assertArrayEquals(new double[] {S, S}, orbitals.getAOCoefficients(0), tolerance);
    assertArrayEquals(new double[] {S, -S}, orbitals.getAOCoefficients(1), tolerance);

    OrbitalSet second = named(orbitalFile, "Root 2 natural orbitals");
    assertEquals(1, second.getState());
    assertEquals(2.0, second.getOccupationSum(), 1.0e-8);
    OrbitalSet difference = named(orbitalFile, "Root 2 - root 1 difference orbitals");
    assertEquals(DensityKind.DIFFERENCE, difference.getDensityKind());
    assertEquals(0, difference.getTargetState());
    assertEquals(0.0, difference.getOccupationSum(), 1.0e-8);

    assertNotNull(orbitalFile.findTransitionSet(0, 1, OrbitalSet.Role.HOLE));
    assertNotNull(orbitalFile.findTransitionSet(0, 1, OrbitalSet.Role.PARTICLE));
  }

  @Test
  public void testMissingData() throws ParseException, IOException {
    File text = new File(dir, "fake.h5");
    FileUtils.writeStringToFile(text, "not hdf5\n", StandardCharsets.US_ASCII);
    assertFalse(HDF5Filter.acceptDeep(text));
    try {
      new HDF5Filter(text, null).readFile();
      fail(" A text file was read as HDF5.");
    } catch (ParseException e) {
      assertEquals("HDF5", e.formatName);
    }
  }

  private static void assertComponent(AngularComponent.Kind kind, int l, int m,
      AngularComponent component) {
    assertEquals(kind, component.getKind());
    assertEquals(l, component.getL());
    assertEquals(m, component.getM());
  }

  @Test
  public void testComponentIndices() {
    assertComponent(AngularComponent.Kind.SPHERICAL, 2, -2, HDF5Filter.sphericalComponent(2, -2));
    // The first contaminant of a d shell is the s-like r^2 combination.
    AngularComponent r2 = HDF5Filter.sphericalComponent(2, 3);
    assertComponent(AngularComponent.Kind.CONTAMINANT, 2, 0, r2);
    assertEquals(1, r2.getK());
    assertComponent(AngularComponent.Kind.CONTAMINANT, 3, -1, HDF5Filter.sphericalComponent(3, 4));
    try {
      HDF5Filter.sphericalComponent(2, 4);
      fail(" An index beyond the contaminants was accepted.");
    } catch (IllegalArgumentException e) {
      assertTrue(e.getMessage().contains("l=2"));
    }
    int[] powers = AngularComponent.cartesianPowersOfIndex(2, 0);
    assertArrayEquals(powers, HDF5Filter.cartesianComponent(2, 0).getCartesianPowers());
  }
}
