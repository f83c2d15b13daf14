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

import static java.lang.String.format;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.logging.Logger;
import orbx.grid.FieldRequest;
import orbx.grid.GridEvaluator;
import orbx.grid.GridOutcome;
import orbx.grid.OrbitalSession;
import orbx.lattice.GridSpec;
import orbx.lattice.ScalarField;
import orbx.orbitals.OrbitalFile;
import orbx.orbitals.mo.DensityKind;
import orbx.orbitals.mo.Orbital;
import orbx.orbitals.mo.OrbitalSet;
import orbx.orbitals.mo.Spin;
import orbx.orbitals.parsers.CubeWriter;
import orbx.orbitals.parsers.HDF5Writer;
import orbx.orbitals.parsers.InpOrbWriter;
import orbx.orbitals.parsers.OrbitalFormat;
import orbx.orbitals.parsers.ParseException;
import orbx.utilities.OrbXProperties;
import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.configuration2.CompositeConfiguration;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Lists the orbitals of a file, evaluates an orbital or a density on the default grid, and writes
 * Cube, InpOrb or HDF5 output.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
@Command(name = "orbx", mixinStandardHelpOptions = true, version = "OrbX 1.0.0-beta",
    description = "Inspect molecular orbitals and evaluate them on grids.")
public class ViewCommand implements Callable<Integer> {

  private static final Logger logger = Logger.getLogger(ViewCommand.class.getName());

  /** The density choices of --density. */
  public enum DensityChoice {
    TOTAL, ALPHA, BETA, SPIN
  }

  /** --list Print the orbitals of every set. */
  @Option(names = {"-l", "--list"}, description = "List the orbitals of every set.")
  private boolean list = false;

  /** --set The set used by --orbital, --inporb and --h5. */
  @Option(names = {"--set"}, paramLabel = "1", defaultValue = "1",
      description = "The orbital set (1-based) used by --orbital, --inporb and --h5.")
  private int set = 1;

  /** --orbital Evaluate one orbital. */
  @Option(names = {"-o", "--orbital"}, paramLabel = "n",
      description = "Evaluate orbital n (1-based) of the chosen set.")
  private Integer orbital = null;

  /** --density Evaluate a density. */
  @Option(names = {"-d", "--density"}, paramLabel = "total",
      description = "Evaluate a density: ${COMPLETION-CANDIDATES}.")
  private DensityChoice density = null;

  /** --laplacian Evaluate the Laplacian of the chosen field. */
  @Option(names = {"--laplacian"}, description = "Evaluate the Laplacian of the field.")
  private boolean laplacian = false;

  /** --points Maximum grid points along an axis. */
  @Option(names = {"-p", "--points"}, paramLabel = "64",
      description = "Maximum grid points along any axis.")
  private Integer points = null;

  /** --cube Write the evaluated field. */
  @Option(names = {"--cube"}, paramLabel = "out.cube", description = "Write the field as a cube.")
  private File cube = null;

  /** --inporb Write the chosen set. */
  @Option(names = {"--inporb"}, paramLabel = "out.InpOrb",
      description = "Write the chosen set in InpOrb format.")
  private File inporb = null;

  /** --h5 Write the chosen set into a copy of the HDF5 input. */
  @Option(names = {"--h5"}, paramLabel = "out.h5",
      description = "Write the chosen set into a copy of the HDF5 input.")
  private File h5 = null;

  /** The input file. */
  @Parameters(arity = "1", paramLabel = "file", description = "An orbital or grid file.")
  private File file = null;

  private ScalarField field = null;

  /**
   * A command line for this command, accepting density choices in any case.
   *
   * @param command the command.
   * @return the command line.
   */
  public static CommandLine commandLine(ViewCommand command) {
    return new CommandLine(command).setCaseInsensitiveEnumValuesAllowed(true);
  }

  /**
   * The field evaluated by the last call.
   *
   * @return the field, or null.
   */
  public ScalarField getField() {
    return field;
  }

  /**
   * Execute the command.
   *
   * @return 0 on success, 1 on failure.
   */
  @Override
  public Integer call() {
    BaseConfiguration overrides = new BaseConfiguration();
    if (points != null) {
      overrides.setProperty(OrbXProperties.Key.GRID_POINTS.key(), points);
    }
    CompositeConfiguration properties = new CompositeConfiguration();
    properties.addConfiguration(overrides);
    properties.addConfiguration(OrbXProperties.loadProperties(file));

    try (OrbitalSession session = new OrbitalSession(properties)) {
      OrbitalFile orbitalFile = session.load(file);
      logger.info(orbitalFile.toString());
      if (list) {
        list(session, orbitalFile);
      }
      if (orbital != null || density != null) {
        field = evaluate(session, orbitalFile, properties);
        double[] range = field.getRange();
        logger.info(format(" %s: %d points, range [%.6f, %.6f], integral %.6f", field.getLabel(),
            field.getValues().length, range[0], range[1], field.integrate()));
        if (cube != null) {
          List<ScalarField> fields = List.of(field);
          new CubeWriter(file.getName()).write(cube, orbitalFile.getMolecule(), fields,
              new int[] {orbital == null ? 0 : orbital});
          logger.info(format(" Wrote %s.", cube));
        }
      } else if (cube != null) {
        logger.warning(" --cube needs --orbital or --density.");
        return 1;
      }
      if (inporb != null) {
        new InpOrbWriter(file.getName()).write(inporb, chosenSet(orbitalFile),
            partner(orbitalFile, chosenSet(orbitalFile)));
        logger.info(format(" Wrote %s.", inporb));
      }
      if (h5 != null) {
        if (!OrbitalFormat.HDF5.getFormatName().equals(orbitalFile.getFormat())) {
          logger.warning(format(" --h5 needs an HDF5 input, not %s.", orbitalFile.getFormat()));
          return 1;
        }
        OrbitalSet chosen = chosenSet(orbitalFile);
        List<OrbitalSet> sets = new ArrayList<>();
        sets.add(chosen);
        OrbitalSet partner = partner(orbitalFile, chosen);
        if (partner != null) {
          sets.add(partner);
        }
        new HDF5Writer().write(file, h5, sets);
        logger.info(format(" Wrote %s.", h5));
      }
      return 0;
    } catch (ParseException e) {
      logger.warning(format(" %s could not be read:%s", file, e.getMessage()));
    } catch (IOException | RuntimeException e) {
      logger.warning(format(" %s", e.getMessage()));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.warning(" Interrupted.");
    }
    return 1;
  }

  private void list(OrbitalSession session, OrbitalFile orbitalFile) {
    List<OrbitalSet> sets = orbitalFile.getOrbitalSets();
    for (int s = 0; s < sets.size(); s++) {
      OrbitalSet orbitalSet = sets.get(s);
      StringBuilder sb = new StringBuilder(format("\n Set %d: %s (%s, %d orbitals)\n", s + 1,
          orbitalSet.getName(), orbitalSet.getSpin(), orbitalSet.size()));
      for (Orbital o : session.sortedOrbitals(orbitalSet)) {
        sb.append(" ").append(o).append("\n");
      }
      logger.info(sb.toString());
    }
  }

  private ScalarField evaluate(OrbitalSession session, OrbitalFile orbitalFile,
      CompositeConfiguration properties) throws IOException, InterruptedException {
    GridSpec grid = session.defaultGrid();
    if (orbital != null && orbitalFile.getOrbitalSets().isEmpty()) {
      // A cube or grid file holding fields but no orbitals.
      return new GridEvaluator(orbitalFile, properties).stored(orbital - 1);
    }
    FieldRequest request = orbital != null ? FieldRequest.orbital(chosenSet(orbitalFile),
        orbital - 1) : densityRequest(orbitalFile);
    if (laplacian) {
      request = FieldRequest.laplacian(request);
    }
    logger.info(format(" Evaluating %s on %s.", request.getLabel(), grid));
    GridOutcome outcome;
    try {
      outcome = session.compute(request, grid).get();
    } catch (ExecutionException e) {
      throw new IllegalStateException(e.getCause());
    }
    switch (outcome.getStatus()) {
      case COMPUTED:
        return outcome.getField();
      case CANCELLED:
        throw new IllegalStateException(format(" %s was cancelled.", request.getLabel()));
      case FAILED:
      default:
        Throwable cause = outcome.getCause();
        if (cause instanceof IOException) {
          throw (IOException) cause;
        }
        throw new IllegalStateException(cause.getMessage(), cause);
    }
  }

  private FieldRequest densityRequest(OrbitalFile orbitalFile) {
    OrbitalSet alpha = orbitalFile.findSet(DensityKind.STATE, 0, Spin.ALPHA);
    OrbitalSet beta = orbitalFile.findSet(DensityKind.STATE, 0, Spin.BETA);
    switch (density) {
      case ALPHA:
        return FieldRequest.density(require(alpha, "alpha orbitals"));
      case BETA:
        return FieldRequest.density(require(beta, "beta orbitals"));
      case SPIN:
        if (alpha != null && beta != null) {
          return FieldRequest.spin(alpha, beta);
        }
        for (OrbitalSet orbitalSet : orbitalFile.getOrbitalSets()) {
          if (orbitalSet.getDensityKind() == DensityKind.SPIN) {
            return FieldRequest.density(orbitalSet);
          }
        }
        throw new IllegalArgumentException(" The file holds no spin information.");
      case TOTAL:
      default:
        if (alpha != null && beta != null) {
          return FieldRequest.total(alpha, beta);
        }
        OrbitalSet restricted = orbitalFile.findSet(DensityKind.STATE, 0, Spin.NONE);
        if (restricted == null) {
          restricted = alpha;
        }
        if (restricted == null && orbitalFile.getPrecomputedSet() != null) {
          restricted = orbitalFile.getPrecomputedSet();
        }
        return FieldRequest.density(require(restricted, "orbitals of the ground state"));
    }
  }

  private static OrbitalSet require(OrbitalSet orbitalSet, String what) {
    if (orbitalSet == null) {
      throw new IllegalArgumentException(format(" The file holds no %s.", what));
    }
    return orbitalSet;
  }

  private OrbitalSet chosenSet(OrbitalFile orbitalFile) {
    List<OrbitalSet> sets = orbitalFile.getOrbitalSets();
    if (set < 1 || set > sets.size()) {
      throw new IllegalArgumentException(format(" Set %d does not exist; the file has %d.", set,
          sets.size()));
    }
    return sets.get(set - 1);
  }

  /** The beta set matching an alpha set, or null. */
  private static OrbitalSet partner(OrbitalFile orbitalFile, OrbitalSet chosen) {
    if (chosen.getSpin() != Spin.ALPHA) {
      return null;
    }
    for (OrbitalSet candidate : orbitalFile.getOrbitalSets()) {
      if (candidate.getSpin() == Spin.BETA && candidate.getState() == chosen.getState()
          && candidate.getDensityKind() == chosen.getDensityKind()
          && candidate.getRole() == chosen.getRole()) {
        return candidate;
      }
    }
    return null;
  }
}
