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
package orbx.grid;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;
import orbx.lattice.GridSpec;
import orbx.lattice.ScalarField;
import orbx.orbitals.IncompleteDataException;
import orbx.orbitals.OrbitalFile;
import orbx.orbitals.basis.BasisSet;
import orbx.orbitals.mo.Orbital;
import orbx.orbitals.mo.OrbitalSet;
import orbx.orbitals.mo.Spin;
import orbx.utilities.OrbXTest;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

/**
 * Test the session: background computation, cancellation and model replacement.
 *
 * @author Michael J. Schnieders
 */
public class OrbitalSessionTest extends OrbXTest {

  private final GridSpec grid = GridSpec.orthogonal(new double[] {-2.0, -2.0, -2.0},
      new double[] {2.0, 2.0, 2.0}, new int[] {9, 9, 9});
  private OrbitalSession session;

  @Before
  public void openSession() throws Exception {
    session = new OrbitalSession(new CompositeConfiguration());
  }

  @After
  public void closeSession() {
    session.close();
  }

  private GridOutcome run(FieldRequest request) throws Exception {
    return session.compute(request, grid).get(30, TimeUnit.SECONDS);
  }

  @Test
  public void testReplacementInvalidatesOnlyEditedSet() throws Exception {
    BasisSet basisSet = GridFixtures.hydrogenMolecule();
    OrbitalSet alpha = GridFixtures.orbitals("alpha", Spin.ALPHA,
        new double[][] {{0.55, 0.55}, {1.0, -1.0}}, new double[] {1.0, 0.0},
        new double[] {-0.578, 0.67});
    OrbitalSet beta = GridFixtures.orbitals("beta", Spin.BETA,
        new double[][] {{0.55, 0.55}, {1.0, -1.0}}, new double[] {1.0, 0.0},
        new double[] {-0.578, 0.67});
    OrbitalFile original = GridFixtures.model(basisSet, alpha, beta);
    session.setOrbitalFile(original);

    GridOutcome alphaOutcome = run(FieldRequest.density(alpha));
    GridOutcome betaOutcome = run(FieldRequest.density(beta));
    assertEquals(GridOutcome.Status.COMPUTED, alphaOutcome.getStatus());
    assertEquals(GridOutcome.Status.COMPUTED, betaOutcome.getStatus());
    DensityCache cache = session.getCache();
    assertEquals(2, cache.size());

    // Repeated requests reuse the field.
    assertSame(alphaOutcome.getField(), run(FieldRequest.density(alpha)).getField());
    assertEquals(2, cache.getComputationCount());

    OrbitalSet edited = alpha.edit().reorder(new int[] {1, 0}).build();
    OrbitalFile replaced = session.replaceOrbitalSet(alpha, edited);
    assertSame(edited, replaced.getOrbitalSets().get(0));
    assertNull(cache.peek(FieldRequest.density(alpha).key(original, grid)));
    assertSame(betaOutcome.getField(), cache.peek(FieldRequest.density(beta).key(replaced, grid)));

    GridOutcome editedOutcome = run(FieldRequest.density(edited));
    assertEquals(GridOutcome.Status.COMPUTED, editedOutcome.getStatus());
    assertEquals(3, cache.getComputationCount());
  }

  @Test
  public void testRequestFromReplacedModelFails() throws Exception {
    BasisSet basisSet = GridFixtures.hydrogenMolecule();
    OrbitalSet set = GridFixtures.orbitals("H2", Spin.NONE,
        new double[][] {{0.55, 0.55}, {1.0, -1.0}}, new double[] {2.0, 0.0},
        new double[] {-0.578, 0.67});
    session.setOrbitalFile(GridFixtures.model(basisSet, set));
    OrbitalSet edited = set.edit().reorder(new int[] {1, 0}).build();
    session.replaceOrbitalSet(set, edited);

    GridOutcome outcome = run(FieldRequest.density(set));
    assertEquals(GridOutcome.Status.FAILED, outcome.getStatus());
    assertTrue(outcome.getCause() instanceof IllegalArgumentException);
    assertEquals(0, session.getCache().size());
    assertEquals(0, session.getCache().getComputationCount());
  }

  @Test
  public void testReloadWithMovedAtoms() throws Exception {
    File molden = getResourceFile("orbx/grid/structures/h2.molden");
    OrbitalFile orbitalFile = session.load(molden);
    GridOutcome before = run(FieldRequest.density(orbitalFile.getOrbitalSets().get(0)));
    assertEquals(GridOutcome.Status.COMPUTED, before.getStatus());

    // Same orbitals, both atoms shifted by one bohr along x.
    String text = FileUtils.readFileToString(molden, StandardCharsets.US_ASCII)
        .replace("0.000000    0.000000   -0.700000", "1.000000    0.000000   -0.700000")
        .replace("0.000000    0.000000    0.700000", "1.000000    0.000000    0.700000");
    File moved = registerTemporaryDirectory().resolve("h2.molden").toFile();
    FileUtils.writeStringToFile(moved, text, StandardCharsets.US_ASCII);
    OrbitalFile movedFile = session.load(moved);
    OrbitalSet movedSet = movedFile.getOrbitalSets().get(0);
    assertEquals(orbitalFile.getOrbitalSets().get(0).getFingerprint(),
        movedSet.getFingerprint());
    assertEquals(0, session.getCache().size());

    GridOutcome after = run(FieldRequest.density(movedSet));
    assertEquals(GridOutcome.Status.COMPUTED, after.getStatus());
    assertEquals(2, session.getCache().getComputationCount());
    ScalarField expected = new GridEvaluator(movedFile, new CompositeConfiguration())
        .evaluate(FieldRequest.density(movedSet), grid, new CancellationToken());
    assertArrayEquals(expected.getValues(), after.getField().getValues(), 1.0e-12);
    assertNotEquals(before.getField().get(4, 4, 4), after.getField().get(4, 4, 4), 1.0e-6);
  }

  @Test
  public void testCancelledOutcome() throws Exception {
    BasisSet basisSet = GridFixtures.hydrogenMolecule();
    OrbitalSet set = GridFixtures.orbitals("H2", Spin.NONE, new double[][] {{0.55, 0.55}},
        new double[] {2.0}, new double[] {-0.578});
    session.setOrbitalFile(GridFixtures.model(basisSet, set));
    CancellationToken token = new CancellationToken();
    token.cancel();
    GridOutcome outcome = session.compute(FieldRequest.density(set), grid, token)
        .get(30, TimeUnit.SECONDS);
    assertEquals(GridOutcome.Status.CANCELLED, outcome.getStatus());
    assertNull(outcome.getField());
    assertEquals(0, session.getCache().size());
  }

  @Test
  public void testLoadAndLaplacian() throws Exception {
    File molden = getResourceFile("orbx/grid/structures/h2.molden");
    OrbitalFile orbitalFile = session.load(molden);
    assertSame(orbitalFile, session.getOrbitalFile());

    GridSpec defaultGrid = session.defaultGrid();
    for (int axis = 0; axis < 3; axis++) {
      assertTrue(defaultGrid.getCount(axis) <= 64);
    }

    OrbitalSet set = orbitalFile.getOrbitalSets().get(0);
    GridOutcome outcome = run(FieldRequest.laplacian(FieldRequest.density(set)));
    assertEquals(GridOutcome.Status.COMPUTED, outcome.getStatus());
    assertTrue(Double.isNaN(outcome.getField().get(0, 0, 0)));
    // The density itself is cached along with its Laplacian.
    assertEquals(2, session.getCache().size());
    assertNotNull(session.getCache().peek(FieldRequest.density(set).key(orbitalFile, grid)));

    // Loading another file drops every field of the old model.
    session.load(getResourceFile("orbx/grid/structures/h2.grid"));
    assertEquals(0, session.getCache().size());
  }

  @Test
  public void testMissingBasis() throws Exception {
    OrbitalFile orbitalFile = session.load(getResourceFile("orbx/grid/structures/h2.grid"));
    assertEquals(orbitalFile.getPrecomputedFields().getGridSpec(), session.defaultGrid());
    OrbitalSet embedded = orbitalFile.getOrbitalSets().get(0);
    GridOutcome outcome = run(FieldRequest.orbital(embedded, 0));
    assertEquals(GridOutcome.Status.FAILED, outcome.getStatus());
    assertTrue(outcome.getCause() instanceof IncompleteDataException);
    assertEquals(0, session.getCache().size());
  }

  @Test
  public void testSortedOrbitals() throws Exception {
    BasisSet basisSet = GridFixtures.hydrogenMolecule();
    OrbitalSet set = GridFixtures.orbitals("H2", Spin.NONE,
        new double[][] {{1.0, 0.0}, {0.0, 1.0}, {0.5, 0.5}, {0.5, -0.5}},
        new double[] {0.0, 2.0, 0.0, 2.0}, new double[] {0.4, Double.NaN, 0.2, -0.6});
    session.setOrbitalFile(GridFixtures.model(basisSet, set));
    List<Orbital> sorted = session.sortedOrbitals(set);
    assertEquals(4, sorted.get(0).getIndexInIrrep());
    assertEquals(2, sorted.get(1).getIndexInIrrep());
    assertEquals(3, sorted.get(2).getIndexInIrrep());
    assertEquals(1, sorted.get(3).getIndexInIrrep());
  }
}
