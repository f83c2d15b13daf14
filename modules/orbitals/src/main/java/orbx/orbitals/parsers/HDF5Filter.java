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

import static java.lang.String.format;
import static orbx.orbitals.parsers.HDF5Arrays.doubles;
import static orbx.orbitals.parsers.HDF5Arrays.intRows;
import static orbx.orbitals.parsers.HDF5Arrays.ints;
import static orbx.orbitals.parsers.HDF5Arrays.strings;

import io.jhdf.HdfFile;
import io.jhdf.api.Attribute;
import io.jhdf.api.Dataset;
import io.jhdf.api.Node;
import io.jhdf.exceptions.HdfException;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import orbx.numerics.linalg.NaturalOrbitals;
import orbx.orbitals.OrbitalFile;
import orbx.orbitals.basis.AngularComponent;
import orbx.orbitals.basis.AngularMomentum;
import orbx.orbitals.basis.Atom;
import orbx.orbitals.basis.BasisFunction;
import orbx.orbitals.basis.BasisSet;
import orbx.orbitals.basis.Elements;
import orbx.orbitals.basis.Molecule;
import orbx.orbitals.basis.Primitive;
import orbx.orbitals.basis.Shell;
import orbx.orbitals.mo.DensityKind;
import orbx.orbitals.mo.Orbital;
import orbx.orbitals.mo.OrbitalKind;
import orbx.orbitals.mo.OrbitalSet;
import orbx.orbitals.mo.OrbitalType;
import orbx.orbitals.mo.Spin;
import orbx.orbitals.mo.Symmetry;
import orbx.utilities.Constants;
import org.apache.commons.configuration2.CompositeConfiguration;

/**
 * The HDF5Filter class reads Molcas HDF5 files: the molecule, the basis set, symmetry information,
 * canonical orbitals and, when present, natural orbitals derived from the stored state, spin and
 * transition density matrices.
 *
 * <p>Basis function rows are (center, shell, l, m). A negative l marks a Cartesian shell whose m
 * indexes the Cartesian component. In a spherical shell, m &gt; l encodes the contaminants r^2k
 * S(l - 2k, m'), listed for k = 1, 2, ... with m' running from -(l - 2k) to l - 2k.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class HDF5Filter extends OrbitalFilter {

  private static final Logger logger = Logger.getLogger(HDF5Filter.class.getName());

  /** Prefix of the datasets of the desymmetrized molecule and basis. */
  public static final String DESYM = "DESYM_";

  /**
   * Constructor for HDF5Filter.
   *
   * @param file the file.
   * @param properties the configuration.
   */
  public HDF5Filter(File file, CompositeConfiguration properties) {
    super(file, OrbitalFormat.HDF5, null, properties);
  }

  /**
   * Returns true if the file starts with the HDF5 signature.
   *
   * @param file a file.
   * @return true for an HDF5 file.
   */
  public static boolean acceptDeep(File file) {
    byte[] signature = new byte[Constants.HDF5_SIGNATURE.length];
    try (InputStream in = Files.newInputStream(file.toPath())) {
      if (in.readNBytes(signature, 0, signature.length) != signature.length) {
        return false;
      }
    } catch (IOException e) {
      return false;
    }
    return Arrays.equals(signature, Constants.HDF5_SIGNATURE);
  }

  /** {@inheritDoc} */
  @Override
  public OrbitalFile readFile() throws ParseException {
    try (HdfFile hdf = new HdfFile(file.toPath())) {
      return read(hdf);
    } catch (HdfException | IllegalArgumentException e) {
      throw error(-1, e.getMessage() == null ? e.toString() : e.getMessage().trim(), e);
    }
  }

  private OrbitalFile read(HdfFile hdf) throws ParseException {
    int nSym = ints(requireAttribute(hdf, "NSYM"))[0];
    int[] nBas = ints(requireAttribute(hdf, "NBAS"));
    if (nBas.length != nSym) {
      throw error(-1, format("NBAS has %d entries for %d irreps.", nBas.length, nSym));
    }
    String[] irrepLabels = new String[nSym];
    if (hdf.getAttributes().containsKey("IRREP_LABELS")) {
      String[] labels = strings(hdf.getAttribute("IRREP_LABELS").getData());
      if (labels.length != nSym) {
        throw error(-1, format("%d irrep labels for %d irreps.", labels.length, nSym));
      }
      System.arraycopy(labels, 0, irrepLabels, 0, nSym);
    } else {
      for (int i = 0; i < nSym; i++) {
        irrepLabels[i] = Integer.toString(i + 1);
      }
    }
    int n = Arrays.stream(nBas).sum();
    boolean desymmetrize = nSym > 1;
    String prefix = desymmetrize ? DESYM : "";

    Molecule molecule = readMolecule(hdf, prefix);
    BasisSet basisSet = readBasis(hdf, prefix, molecule, n);

    double[][] matrix = null;
    if (desymmetrize) {
      double[] flat = doubles(requireDataset(hdf, DESYM + "MATRIX").getData());
      if (flat.length != n * n) {
        throw error(-1, format("DESYM_MATRIX has %d values for %d basis functions.", flat.length,
            n));
      }
      // Stored transposed.
      matrix = new double[n][n];
      for (int i = 0; i < n; i++) {
        for (int j = 0; j < n; j++) {
          matrix[i][j] = flat[j * n + i];
        }
      }
    }
    Symmetry symmetry = new Symmetry(irrepLabels, nBas, matrix);
    OrbitalFile.Builder builder = new OrbitalFile.Builder(file, orbitalFormat.getFormatName())
        .title(file.getName())
        .molecule(basisSet.getMolecule())
        .basisSet(basisSet)
        .symmetry(symmetry);

    if (exists(hdf, "MO_ALPHA_VECTORS")) {
      builder.addOrbitalSet(readOrbitals(hdf, "MO_ALPHA_", "Alpha", Spin.ALPHA, symmetry));
      builder.addOrbitalSet(readOrbitals(hdf, "MO_BETA_", "Beta", Spin.BETA, symmetry));
    } else if (exists(hdf, "MO_VECTORS")) {
      builder.addOrbitalSet(readOrbitals(hdf, "MO_", "Orbitals", Spin.NONE, symmetry));
    }
    if (desymmetrize) {
      Symmetry none = Symmetry.none(n);
      if (exists(hdf, DESYM + "MO_ALPHA_VECTORS")) {
        builder.addOrbitalSet(readOrbitals(hdf, DESYM + "MO_ALPHA_", "Desymmetrized alpha",
            Spin.ALPHA, none));
        builder.addOrbitalSet(readOrbitals(hdf, DESYM + "MO_BETA_", "Desymmetrized beta",
            Spin.BETA, none));
      } else if (exists(hdf, DESYM + "MO_VECTORS")) {
        builder.addOrbitalSet(readOrbitals(hdf, DESYM + "MO_", "Desymmetrized orbitals",
            Spin.NONE, none));
      }
    }
    readDensityMatrices(hdf, symmetry, builder);

    OrbitalFile orbitalFile = builder.build();
    logger.info(format(" Read %d atoms, %d basis functions and %d orbital sets from %s.",
        basisSet.getMolecule().size(), n, orbitalFile.getOrbitalSets().size(), file.getName()));
    return orbitalFile;
  }

  private Molecule readMolecule(HdfFile hdf, String prefix) throws ParseException {
    String[] labels = strings(requireDataset(hdf, prefix + "CENTER_LABELS").getData());
    double[] charges = doubles(requireDataset(hdf, prefix + "CENTER_CHARGES").getData());
    double[] coordinates = doubles(requireDataset(hdf, prefix + "CENTER_COORDINATES").getData());
    if (charges.length != labels.length || coordinates.length != 3 * labels.length) {
      throw error(-1, format("Inconsistent center data for %d centers.", labels.length));
    }
    List<Atom> atoms = new ArrayList<>(labels.length);
    for (int i = 0; i < labels.length; i++) {
      double[] xyz = {coordinates[3 * i], coordinates[3 * i + 1], coordinates[3 * i + 2]};
      // Charges are reduced by effective core potentials; prefer the label.
      int z = Elements.atomicNumber(labels[i]);
      if (charges[i] == 0.0) {
        z = 0;
      } else if (z == 0) {
        z = (int) Math.round(charges[i]);
      }
      atoms.add(createAtom(labels[i], z, xyz, -1));
    }
    return new Molecule(file.getName(), atoms);
  }

  private BasisSet readBasis(HdfFile hdf, String prefix, Molecule molecule, int n)
      throws ParseException {
    double[] primitives = doubles(requireDataset(hdf, "PRIMITIVES").getData());
    int[][] primitiveIds = intRows(requireDataset(hdf, "PRIMITIVE_IDS").getData(), 3);
    int[][] functionIds = intRows(requireDataset(hdf, prefix + "BASIS_FUNCTION_IDS").getData(), 4);
    if (primitives.length != 2 * primitiveIds.length) {
      throw error(-1, format("%d primitive values for %d primitive ids.", primitives.length,
          primitiveIds.length));
    }
    if (functionIds.length != n) {
      throw error(-1, format("%d basis function ids for %d basis functions.", functionIds.length,
          n));
    }

    // Shells are keyed by (center, l, shell), in order of first appearance.
    Map<List<Integer>, List<Primitive>> shellPrimitives = new LinkedHashMap<>();
    for (int i = 0; i < primitiveIds.length; i++) {
      int[] id = primitiveIds[i];
      shellPrimitives.computeIfAbsent(List.of(id[0], id[1], id[2]), k -> new ArrayList<>())
          .add(new Primitive(primitives[2 * i], primitives[2 * i + 1]));
    }
    Map<List<Integer>, Boolean> cartesianShells = new LinkedHashMap<>();
    for (int[] id : functionIds) {
      cartesianShells.merge(List.of(id[0], Math.abs(id[2]), id[1]), id[2] < 0,
          Boolean::logicalOr);
    }
    List<Shell> shells = new ArrayList<>();
    Map<List<Integer>, Integer> shellIndex = new LinkedHashMap<>();
    boolean[] withBasis = new boolean[molecule.size()];
    for (Map.Entry<List<Integer>, List<Primitive>> entry : shellPrimitives.entrySet()) {
      List<Integer> key = entry.getKey();
      int center = key.get(0) - 1;
      if (center < 0 || center >= molecule.size()) {
        throw error(-1, format("Primitive refers to center %d of %d.", center + 1,
            molecule.size()));
      }
      AngularMomentum angularMomentum;
      try {
        angularMomentum = AngularMomentum.fromL(key.get(1));
      } catch (IllegalArgumentException e) {
        throw error(-1, format("Unsupported angular momentum %d.", key.get(1)), e);
      }
      withBasis[center] = true;
      shellIndex.put(key, shells.size());
      shells.add(new Shell(center, angularMomentum, cartesianShells.getOrDefault(key, false),
          entry.getValue()));
    }
    List<BasisFunction> functions = new ArrayList<>(n);
    for (int[] id : functionIds) {
      int l = Math.abs(id[2]);
      Integer s = shellIndex.get(List.of(id[0], l, id[1]));
      if (s == null) {
        throw error(-1, format("Basis function (%d, %d, %d, %d) has no primitives.", id[0], id[1],
            id[2], id[3]));
      }
      AngularComponent component;
      try {
        component = id[2] < 0 ? cartesianComponent(l, id[3]) : sphericalComponent(l, id[3]);
      } catch (IllegalArgumentException e) {
        throw error(-1, e.getMessage().trim(), e);
      }
      functions.add(new BasisFunction(s, component));
    }
    List<Atom> atoms = new ArrayList<>(molecule.getAtoms());
    for (int i = 0; i < atoms.size(); i++) {
      Atom atom = atoms.get(i);
      if (!withBasis[i]) {
        atoms.set(i, new Atom(atom.getName(), atom.getAtomicNumber(), atom.getXYZ(), false,
            atom.isGhost()));
      }
    }
    return new BasisSet(new Molecule(molecule.getTitle(), atoms), shells, functions);
  }

  /**
   * The component of a Cartesian shell.
   *
   * @param l the shell degree.
   * @param m the stored index.
   * @return the component.
   */
  static AngularComponent cartesianComponent(int l, int m) {
    int[] powers = AngularComponent.cartesianPowersOfIndex(l, m);
    return AngularComponent.cartesian(powers[0], powers[1], powers[2]);
  }

  /**
   * The component of a spherical shell, including contaminants.
   *
   * @param l the shell degree.
   * @param m the stored index.
   * @return the component.
   */
  static AngularComponent sphericalComponent(int l, int m) {
    if (m < -l) {
      throw new IllegalArgumentException(format(" Invalid index m=%d for l=%d.", m, l));
    }
    if (m <= l) {
      return AngularComponent.spherical(l, m);
    }
    int t = m - l - 1;
    for (int k = 1; 2 * k <= l; k++) {
      int lk = l - 2 * k;
      int size = 2 * lk + 1;
      if (t < size) {
        return AngularComponent.contaminant(l, k, t - lk);
      }
      t -= size;
    }
    throw new IllegalArgumentException(format(" Invalid index m=%d for l=%d.", m, l));
  }

  private OrbitalSet readOrbitals(HdfFile hdf, String prefix, String name, Spin spin,
      Symmetry symmetry) throws ParseException {
    double[] vectors = doubles(requireDataset(hdf, prefix + "VECTORS").getData());
    double[] energies = exists(hdf, prefix + "ENERGIES")
        ? doubles(hdf.getDatasetByPath(prefix + "ENERGIES").getData()) : null;
    double[] occupations = exists(hdf, prefix + "OCCUPATIONS")
        ? doubles(hdf.getDatasetByPath(prefix + "OCCUPATIONS").getData()) : null;
    String[] types = exists(hdf, prefix + "TYPEINDICES")
        ? strings(hdf.getDatasetByPath(prefix + "TYPEINDICES").getData()) : null;
    int total = symmetry.getTotalBasis();
    int squares = 0;
    for (int irrep = 0; irrep < symmetry.getIrrepCount(); irrep++) {
      squares += symmetry.getBasisCount(irrep) * symmetry.getBasisCount(irrep);
    }
    if (vectors.length != squares) {
      throw error(-1, format("%sVECTORS has %d values, expected %d.", prefix, vectors.length,
          squares));
    }
    checkLength(prefix + "ENERGIES", energies, total);
    checkLength(prefix + "OCCUPATIONS", occupations, total);
    if (types != null && types.length != total) {
      throw error(-1, format("%sTYPEINDICES has %d values, expected %d.", prefix, types.length,
          total));
    }
    OrbitalSet.Builder builder = new OrbitalSet.Builder(name, symmetry).spin(spin);
    int o = 0;
    int j = 0;
    for (int irrep = 0; irrep < symmetry.getIrrepCount(); irrep++) {
      int nb = symmetry.getBasisCount(irrep);
      int offset = symmetry.getOffset(irrep);
      for (int k = 0; k < nb; k++) {
        double[] c = new double[total];
        System.arraycopy(vectors, j, c, offset, nb);
        j += nb;
        OrbitalType type = OrbitalType.UNKNOWN;
        if (types != null && !types[o].isEmpty()) {
          try {
            type = OrbitalType.fromCode(types[o].charAt(0));
          } catch (IllegalArgumentException e) {
            throw error(-1, e.getMessage().trim(), e);
          }
        }
        builder.add(new Orbital.Builder()
            .coefficients(c)
            .energy(energies == null ? Double.NaN : energies[o])
            .occupation(occupations == null ? 0.0 : occupations[o])
            .spin(spin)
            .type(type)
            .irrep(irrep, symmetry.getIrrepLabel(irrep))
            .indexInIrrep(k + 1)
            .build());
        o++;
      }
    }
    OrbitalSet set = builder.build();
    logSet(set);
    return set;
  }

  private void checkLength(String name, double[] values, int expected) throws ParseException {
    if (values != null && values.length != expected) {
      throw error(-1, format("%s has %d values, expected %d.", name, values.length, expected));
    }
  }

  private void readDensityMatrices(HdfFile hdf, Symmetry symmetry, OrbitalFile.Builder builder)
      throws ParseException {
    int blockSize = 0;
    for (int irrep = 0; irrep < symmetry.getIrrepCount(); irrep++) {
      blockSize += symmetry.getBasisCount(irrep) * symmetry.getBasisCount(irrep);
    }
    double[][][] overlap = null;
    if (exists(hdf, "AO_OVERLAP_MATRIX")) {
      double[] s = doubles(hdf.getDatasetByPath("AO_OVERLAP_MATRIX").getData());
      if (s.length == blockSize) {
        overlap = blocks(s, 0, symmetry);
      } else {
        logger.warning(format(" Ignoring AO_OVERLAP_MATRIX with %d values.", s.length));
      }
    }
    double[][][][] densities = null;
    if (exists(hdf, "DENSITY_MATRIX")) {
      double[] d = doubles(hdf.getDatasetByPath("DENSITY_MATRIX").getData());
      int roots = rootCount("DENSITY_MATRIX", d.length, blockSize, 1);
      densities = new double[roots][][][];
      for (int r = 0; r < roots; r++) {
        densities[r] = blocks(d, r * blockSize, symmetry);
        builder.addOrbitalSet(naturalSet(format("Root %d natural orbitals", r + 1),
            DensityKind.STATE, r, -1, densities[r], overlap, symmetry, false));
      }
      for (int r = 1; r < roots; r++) {
        double[][][] difference = new double[symmetry.getIrrepCount()][][];
        for (int irrep = 0; irrep < difference.length; irrep++) {
          int nb = symmetry.getBasisCount(irrep);
          difference[irrep] = new double[nb][nb];
          for (int a = 0; a < nb; a++) {
            for (int b = 0; b < nb; b++) {
              difference[irrep][a][b] = densities[r][irrep][a][b] - densities[0][irrep][a][b];
            }
          }
        }
        builder.addOrbitalSet(naturalSet(format("Root %d - root 1 difference orbitals", r + 1),
            DensityKind.DIFFERENCE, r, 0, difference, overlap, symmetry, true));
      }
    }
    if (exists(hdf, "SPINDENSITY_MATRIX")) {
      double[] d = doubles(hdf.getDatasetByPath("SPINDENSITY_MATRIX").getData());
      int roots = rootCount("SPINDENSITY_MATRIX", d.length, blockSize, 1);
      for (int r = 0; r < roots; r++) {
        builder.addOrbitalSet(naturalSet(format("Root %d spin natural orbitals", r + 1),
            DensityKind.SPIN, r, -1, blocks(d, r * blockSize, symmetry), overlap, symmetry,
            true));
      }
    }
    if (exists(hdf, "TRANSITION_DENSITY_MATRIX")) {
      double[] d = doubles(hdf.getDatasetByPath("TRANSITION_DENSITY_MATRIX").getData());
      int pairs = rootCount("TRANSITION_DENSITY_MATRIX", d.length, blockSize, 1);
      int roots = (int) Math.round(Math.sqrt(pairs));
      if (roots * roots != pairs) {
        throw error(-1, format("TRANSITION_DENSITY_MATRIX holds %d blocks, not a square number.",
            pairs));
      }
      for (int r = 0; r < roots; r++) {
        for (int s = r + 1; s < roots; s++) {
          double[][][] t = blocks(d, (r * roots + s) * blockSize, symmetry);
          if (isZero(t)) {
            continue;
          }
          addTransitionSets(r, s, t, symmetry, builder);
        }
      }
    }
  }

  private int rootCount(String name, int length, int blockSize, int minimum)
      throws ParseException {
    if (blockSize == 0 || length % blockSize != 0 || length / blockSize < minimum) {
      throw error(-1, format("%s has %d values, not a multiple of %d.", name, length, blockSize));
    }
    return length / blockSize;
  }

  /** Split one root of a flattened block diagonal matrix into its irrep blocks. */
  private static double[][][] blocks(double[] flat, int start, Symmetry symmetry) {
    double[][][] blocks = new double[symmetry.getIrrepCount()][][];
    int p = start;
    for (int irrep = 0; irrep < blocks.length; irrep++) {
      int nb = symmetry.getBasisCount(irrep);
      blocks[irrep] = new double[nb][nb];
      for (int a = 0; a < nb; a++) {
        for (int b = 0; b < nb; b++) {
          blocks[irrep][a][b] = flat[p++];
        }
      }
    }
    return blocks;
  }

  private static boolean isZero(double[][][] blocks) {
    for (double[][] block : blocks) {
      for (double[] row : block) {
        for (double v : row) {
          if (v != 0.0) {
            return false;
          }
        }
      }
    }
    return true;
  }

  private OrbitalSet naturalSet(String name, DensityKind kind, int state, int target,
      double[][][] blocks, double[][][] overlap, Symmetry symmetry, boolean signed) {
    OrbitalSet.Builder builder = new OrbitalSet.Builder(name, symmetry)
        .densityKind(kind)
        .state(state)
        .targetState(target);
    OrbitalKind orbitalKind = kind == DensityKind.DIFFERENCE ? OrbitalKind.NATURAL_DIFFERENCE
        : OrbitalKind.NATURAL;
    int total = symmetry.getTotalBasis();
    for (int irrep = 0; irrep < blocks.length; irrep++) {
      if (blocks[irrep].length == 0) {
        continue;
      }
      double[][] s = overlap == null ? null : overlap[irrep];
      NaturalOrbitals natural = signed ? NaturalOrbitals.ofDifference(blocks[irrep], s)
          : NaturalOrbitals.ofSymmetric(blocks[irrep], s);
      addOrbitals(builder, natural.getWeights(), natural.getOrbitals(), irrep, symmetry,
          total, orbitalKind);
    }
    OrbitalSet set = builder.build();
    logSet(set);
    return set;
  }

  private void addTransitionSets(int r, int s, double[][][] blocks, Symmetry symmetry,
      OrbitalFile.Builder builder) {
    String name = format("Root %d -> %d natural transition orbitals", r + 1, s + 1);
    OrbitalSet.Builder holes = new OrbitalSet.Builder(name + " (hole)", symmetry)
        .densityKind(DensityKind.TRANSITION).state(r).targetState(s).role(OrbitalSet.Role.HOLE);
    OrbitalSet.Builder particles = new OrbitalSet.Builder(name + " (particle)", symmetry)
        .densityKind(DensityKind.TRANSITION).state(r).targetState(s)
        .role(OrbitalSet.Role.PARTICLE);
    int total = symmetry.getTotalBasis();
    for (int irrep = 0; irrep < blocks.length; irrep++) {
      if (blocks[irrep].length == 0) {
        continue;
      }
      NaturalOrbitals natural = NaturalOrbitals.ofTransition(blocks[irrep]);
      addOrbitals(holes, natural.getWeights(), natural.getOrbitals(), irrep, symmetry, total,
          OrbitalKind.NATURAL_TRANSITION);
      addOrbitals(particles, natural.getWeights(), natural.getPartnerOrbitals(), irrep, symmetry,
          total, OrbitalKind.NATURAL_TRANSITION);
    }
    builder.addOrbitalSet(holes.build());
    builder.addOrbitalSet(particles.build());
  }

  private static void addOrbitals(OrbitalSet.Builder builder, double[] weights,
      double[][] vectors, int irrep, Symmetry symmetry, int total, OrbitalKind kind) {
    int offset = symmetry.getOffset(irrep);
    for (int k = 0; k < weights.length; k++) {
      double[] c = new double[total];
      System.arraycopy(vectors[k], 0, c, offset, vectors[k].length);
      builder.add(new Orbital.Builder()
          .coefficients(c)
          .occupation(weights[k])
          .irrep(irrep, symmetry.getIrrepLabel(irrep))
          .indexInIrrep(k + 1)
          .kind(kind)
          .build());
    }
  }

  private static boolean exists(HdfFile hdf, String name) {
    Node node = hdf.getChildren().get(name);
    return node instanceof Dataset;
  }

  private Dataset requireDataset(HdfFile hdf, String name) throws ParseException {
    if (!exists(hdf, name)) {
      throw error(-1, format("Missing dataset %s.", name));
    }
    return hdf.getDatasetByPath(name);
  }

  private Object requireAttribute(HdfFile hdf, String name) throws ParseException {
    Attribute attribute = hdf.getAttributes().get(name);
    if (attribute == null) {
      throw error(-1, format("Missing attribute %s.", name));
    }
    return attribute.getData();
  }
}
