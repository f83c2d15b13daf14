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

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.Locale;
import java.util.logging.Logger;
import orbx.orbitals.OrbitalFile;
import orbx.orbitals.mo.Orbital;
import orbx.orbitals.mo.OrbitalSet;
import orbx.orbitals.mo.OrbitalType;
import orbx.orbitals.mo.Spin;
import orbx.orbitals.mo.Symmetry;
import orbx.utilities.StringUtils;
import org.apache.commons.configuration2.CompositeConfiguration;

/**
 * The InpOrbFilter class reads Molcas InpOrb orbital files.
 *
 * <p>An InpOrb file holds symmetry adapted coefficients, occupations, energies and orbital types,
 * but no geometry or basis set. When a companion file (usually the HDF5 file of the same
 * calculation) is given, its molecule, basis set and symmetry are reused after the basis sizes
 * have been checked; otherwise the orbitals can be listed and rewritten but not evaluated.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class InpOrbFilter extends OrbitalFilter {

  private static final Logger logger = Logger.getLogger(InpOrbFilter.class.getName());

  /** Hint naming the file that supplies a basis set. */
  public static final String COMPANION_HINT = "an HDF5 file of the same calculation";

  /**
   * Constructor for InpOrbFilter.
   *
   * @param file the file.
   * @param companion a file supplying basis and symmetry, or null.
   * @param properties the configuration.
   */
  public InpOrbFilter(File file, OrbitalFile companion, CompositeConfiguration properties) {
    super(file, OrbitalFormat.INPORB, companion, properties);
  }

  /**
   * Returns true if the first non-blank line is an <code>#INPORB</code> marker.
   *
   * @param file a file.
   * @return true for an InpOrb file.
   */
  public static boolean acceptDeep(File file) {
    try (LineReader reader = new LineReader(file)) {
      String line = reader.readNonBlankLine();
      return line != null && line.trim().toUpperCase(Locale.ROOT).startsWith("#INPORB");
    } catch (IOException e) {
      return false;
    }
  }

  /** {@inheritDoc} */
  @Override
  public OrbitalFile readFile() throws ParseException {
    try (LineReader reader = new LineReader(file)) {
      String line = reader.readNonBlankLine();
      if (line == null || !line.trim().toUpperCase(Locale.ROOT).startsWith("#INPORB")) {
        throw error(reader.getLineNumber(), "Missing #INPORB marker.");
      }
      Contents contents = parse(reader, line);
      OrbitalFile.Builder builder = new OrbitalFile.Builder(file, orbitalFormat.getFormatName())
          .title(contents.title);
      contents.addTo(builder);
      OrbitalFile orbitalFile = builder.build();
      logger.info(format(" Read %d orbitals from %s.", contents.orbitalCount(), file.getName()));
      return orbitalFile;
    } catch (IOException e) {
      throw error(-1, e.toString(), e);
    }
  }

  /**
   * Parse InpOrb content starting after its marker line. Used directly for InpOrb files and for
   * sections embedded in grid files.
   *
   * @param reader a reader positioned after the marker.
   * @param marker the <code>#INPORB</code> line.
   * @return the parsed content.
   * @throws ParseException if the content is malformed or incompatible with the companion.
   * @throws IOException on read errors.
   */
  Contents parse(LineReader reader, String marker) throws ParseException, IOException {
    String[] version = marker.trim().split("\\s+");
    logger.fine(format(" InpOrb version %s.", version.length > 1 ? version[1] : "unknown"));
    Contents contents = new Contents();
    try {
      String line = reader.readLine();
      while (line != null) {
        String trimmed = line.trim().toUpperCase(Locale.ROOT);
        if (!trimmed.startsWith("#")) {
          line = reader.readLine();
          continue;
        }
        String section = trimmed.split("\\s+")[0];
        switch (section) {
          case "#INFO":
            readInfo(reader, contents);
            break;
          case "#ORB":
            contents.alphaCoefficients = readCoefficients(reader, contents);
            break;
          case "#UORB":
            contents.betaCoefficients = readCoefficients(reader, contents);
            break;
          case "#OCC":
            contents.alphaOccupations = readValues(reader, contents, contents.alphaOccupations,
                false);
            break;
          case "#UOCC":
            contents.betaOccupations = readValues(reader, contents, contents.betaOccupations,
                false);
            break;
          case "#OCHR":
            contents.alphaOccupations = readValues(reader, contents, null, true);
            break;
          case "#UOCHR":
            contents.betaOccupations = readValues(reader, contents, null, true);
            break;
          case "#ONE":
            contents.alphaEnergies = readValues(reader, contents, null, false);
            break;
          case "#UONE":
            contents.betaEnergies = readValues(reader, contents, null, false);
            break;
          case "#INDEX":
            contents.types = readIndex(reader, contents);
            break;
          default:
            logger.fine(format(" Skipping InpOrb section %s.", section));
            skipSection(reader);
        }
        line = reader.readLine();
      }
    } catch (NumberFormatException e) {
      throw error(reader.getLineNumber(), e.getMessage().trim(), e);
    }
    if (contents.basisPerIrrep == null) {
      throw error(reader.getLineNumber(), "Missing #INFO section.");
    }
    if (contents.alphaCoefficients == null) {
      throw error(reader.getLineNumber(), "Missing #ORB section.");
    }
    if (contents.unrestricted && contents.betaCoefficients == null) {
      throw error(reader.getLineNumber(), "Missing #UORB section for unrestricted orbitals.");
    }
    contents.build();
    return contents;
  }

  private static void skipSection(LineReader reader) throws IOException {
    while (reader.peekLine() != null && !reader.peekLine().trim().startsWith("#")) {
      reader.readLine();
    }
  }

  /** Comment lines start with '*' and are not a run of overflow markers. */
  private static boolean isComment(String line) {
    if (!line.startsWith("*")) {
      return false;
    }
    try {
      StringUtils.splitFortranDoubles(line);
      return false;
    } catch (NumberFormatException e) {
      return true;
    }
  }

  private static void skipComments(LineReader reader) throws IOException {
    while (reader.peekLine() != null
        && (reader.peekLine().isBlank() || isComment(reader.peekLine()))) {
      reader.readLine();
    }
  }

  private void readInfo(LineReader reader, Contents contents) throws IOException,
      ParseException {
    String title = reader.peekLine();
    if (title != null && title.startsWith("*")) {
      reader.readLine();
      contents.title = title.substring(1).trim();
    }
    double[] header = reader.readDoubles(3);
    contents.unrestricted = (int) header[0] == 1;
    int nSym = (int) header[1];
    if (nSym < 1 || nSym > 8) {
      throw error(reader.getLineNumber(), format("Invalid number of irreps %d.", nSym));
    }
    contents.basisPerIrrep = toInts(reader, nSym);
    contents.orbitalsPerIrrep = toInts(reader, nSym);
    for (int i = 0; i < nSym; i++) {
      if (contents.orbitalsPerIrrep[i] > contents.basisPerIrrep[i]) {
        throw error(reader.getLineNumber(), format("Irrep %d has %d orbitals for %d basis"
            + " functions.", i + 1, contents.orbitalsPerIrrep[i], contents.basisPerIrrep[i]));
      }
    }
    contents.symmetry = resolveSymmetry(contents.basisPerIrrep, reader.getLineNumber());
  }

  private static int[] toInts(LineReader reader, int n) throws IOException {
    double[] values = reader.readDoubles(n);
    int[] ints = new int[n];
    for (int i = 0; i < n; i++) {
      ints[i] = (int) values[i];
    }
    return ints;
  }

  private Symmetry resolveSymmetry(int[] basisPerIrrep, int lineNumber) throws ParseException {
    if (companion != null && companion.getSymmetry() != null) {
      Symmetry symmetry = companion.getSymmetry();
      if (!Arrays.equals(symmetry.getBasisCounts(), basisPerIrrep)) {
        throw error(lineNumber, format("Basis functions per irrep %s do not match %s of %s.",
            Arrays.toString(basisPerIrrep), Arrays.toString(symmetry.getBasisCounts()),
            companion.getFile() == null ? "the companion file" : companion.getFile().getName()));
      }
      return symmetry;
    }
    String[] labels = new String[basisPerIrrep.length];
    for (int i = 0; i < labels.length; i++) {
      labels[i] = Integer.toString(i + 1);
    }
    return new Symmetry(labels, basisPerIrrep, null);
  }

  private double[][] readCoefficients(LineReader reader, Contents contents) throws IOException,
      ParseException {
    requireInfo(reader, contents);
    Symmetry symmetry = contents.symmetry;
    int total = symmetry.getTotalBasis();
    double[][] coefficients = new double[contents.orbitalCount()][];
    int o = 0;
    for (int irrep = 0; irrep < symmetry.getIrrepCount(); irrep++) {
      int nb = contents.basisPerIrrep[irrep];
      int offset = symmetry.getOffset(irrep);
      for (int k = 0; k < contents.orbitalsPerIrrep[irrep]; k++) {
        skipComments(reader);
        double[] values = reader.readDoubles(nb);
        double[] c = new double[total];
        System.arraycopy(values, 0, c, offset, nb);
        coefficients[o++] = c;
      }
    }
    return coefficients;
  }

  private double[] readValues(LineReader reader, Contents contents, double[] previous,
      boolean human) throws IOException, ParseException {
    requireInfo(reader, contents);
    if (previous != null && !human) {
      // #OCHR has precedence over #OCC.
      skipSection(reader);
      return previous;
    }
    double[] values = new double[contents.orbitalCount()];
    int o = 0;
    for (int irrep = 0; irrep < contents.orbitalsPerIrrep.length; irrep++) {
      int n = contents.orbitalsPerIrrep[irrep];
      if (n == 0) {
        continue;
      }
      skipComments(reader);
      double[] block = reader.readDoubles(n);
      System.arraycopy(block, 0, values, o, n);
      o += n;
    }
    return values;
  }

  private OrbitalType[] readIndex(LineReader reader, Contents contents) throws IOException,
      ParseException {
    requireInfo(reader, contents);
    OrbitalType[] types = new OrbitalType[contents.orbitalCount()];
    int o = 0;
    for (int irrep = 0; irrep < contents.orbitalsPerIrrep.length; irrep++) {
      int n = contents.orbitalsPerIrrep[irrep];
      StringBuilder codes = new StringBuilder();
      String header = reader.readLine();
      if (header == null || !header.startsWith("*")) {
        throw error(reader.getLineNumber(), "Missing index header.");
      }
      while (codes.length() < n) {
        String line = reader.readLine();
        if (line == null) {
          throw error(reader.getLineNumber(), "Unexpected end of file in #INDEX.");
        }
        String[] tokens = line.trim().split("\\s+", 2);
        if (tokens.length < 2) {
          throw error(reader.getLineNumber(), "Malformed index record.");
        }
        codes.append(tokens[1].replaceAll("\\s+", ""));
      }
      if (codes.length() != n) {
        throw error(reader.getLineNumber(), format("Index of irrep %d has %d entries for %d"
            + " orbitals.", irrep + 1, codes.length(), n));
      }
      for (int i = 0; i < n; i++) {
        try {
          types[o++] = OrbitalType.fromCode(codes.charAt(i));
        } catch (IllegalArgumentException e) {
          throw error(reader.getLineNumber(), e.getMessage().trim(), e);
        }
      }
    }
    return types;
  }

  private void requireInfo(LineReader reader, Contents contents) throws ParseException {
    if (contents.basisPerIrrep == null) {
      throw error(reader.getLineNumber(), "Data section found before #INFO.");
    }
  }

  /** Content of an InpOrb section. */
  class Contents {

    String title = "";
    boolean unrestricted = false;
    int[] basisPerIrrep;
    int[] orbitalsPerIrrep;
    Symmetry symmetry;
    double[][] alphaCoefficients;
    double[][] betaCoefficients;
    double[] alphaOccupations;
    double[] betaOccupations;
    double[] alphaEnergies;
    double[] betaEnergies;
    OrbitalType[] types;
    OrbitalSet alpha;
    OrbitalSet beta;

    int orbitalCount() {
      int n = 0;
      for (int i : orbitalsPerIrrep) {
        n += i;
      }
      return n;
    }

    private void build() {
      if (unrestricted) {
        alpha = buildSet("Alpha", Spin.ALPHA, alphaCoefficients, alphaOccupations, alphaEnergies);
        beta = buildSet("Beta", Spin.BETA, betaCoefficients, betaOccupations, betaEnergies);
      } else {
        alpha = buildSet("Orbitals", Spin.NONE, alphaCoefficients, alphaOccupations,
            alphaEnergies);
      }
    }

    private OrbitalSet buildSet(String name, Spin spin, double[][] coefficients,
        double[] occupations, double[] energies) {
      OrbitalSet.Builder builder = new OrbitalSet.Builder(name, symmetry).spin(spin);
      int o = 0;
      for (int irrep = 0; irrep < orbitalsPerIrrep.length; irrep++) {
        for (int k = 0; k < orbitalsPerIrrep[irrep]; k++) {
          builder.add(new Orbital.Builder()
              .coefficients(coefficients[o])
              .occupation(occupations == null ? 0.0 : occupations[o])
              .energy(energies == null ? Double.NaN : energies[o])
              .type(types == null ? OrbitalType.UNKNOWN : types[o])
              .spin(spin)
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

    /** Add the model parts to a file builder, reusing the companion basis where present. */
    void addTo(OrbitalFile.Builder builder) {
      builder.symmetry(symmetry);
      if (companion != null && companion.getBasisSet() != null) {
        builder.molecule(companion.getMolecule()).basisSet(companion.getBasisSet());
      } else {
        builder.companion(COMPANION_HINT);
      }
      builder.addOrbitalSet(alpha);
      if (beta != null) {
        builder.addOrbitalSet(beta);
      }
    }
  }
}
