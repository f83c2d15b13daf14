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
import static orbx.numerics.math.GaussianFunctions.doubleFactorial;
import static org.apache.commons.math3.util.FastMath.sqrt;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import orbx.orbitals.OrbitalFile;
import orbx.orbitals.basis.AngularComponent;
import orbx.orbitals.basis.AngularMomentum;
import orbx.orbitals.basis.Atom;
import orbx.orbitals.basis.BasisFunction;
import orbx.orbitals.basis.BasisSet;
import orbx.orbitals.basis.Molecule;
import orbx.orbitals.basis.Primitive;
import orbx.orbitals.basis.Shell;
import orbx.orbitals.mo.Orbital;
import orbx.orbitals.mo.OrbitalSet;
import orbx.orbitals.mo.Spin;
import orbx.orbitals.mo.Symmetry;
import orbx.utilities.Constants;
import orbx.utilities.StringUtils;
import org.apache.commons.configuration2.CompositeConfiguration;

/**
 * The MoldenFilter class reads Molden files.
 *
 * <p>Sections may appear in any order. The shell flags <code>[5D]</code>, <code>[5D7F]</code>,
 * <code>[5D10F]</code>, <code>[7F]</code> and <code>[9G]</code> are applied once all sections have
 * been read. Cartesian d, f and g shells follow the Molden component order and their coefficients
 * are rescaled from the Molden normalization to that of {@link AngularComponent#cartesian}.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class MoldenFilter extends OrbitalFilter {

  private static final Logger logger = Logger.getLogger(MoldenFilter.class.getName());

  private static final Pattern SECTION = Pattern.compile("^\\s*\\[([^]]*)](.*)$");
  private static final Pattern TAG = Pattern.compile("^\\s*([A-Za-z_]+)\\s*=\\s*(.*)$");

  /** Molden order of Cartesian components for d, f and g shells. */
  private static final String[][] CARTESIAN_ORDER = {
      {""},
      {"x", "y", "z"},
      {"xx", "yy", "zz", "xy", "xz", "yz"},
      {"xxx", "yyy", "zzz", "xyy", "xxy", "xxz", "xzz", "yzz", "yyz", "xyz"},
      {"xxxx", "yyyy", "zzzz", "xxxy", "xxxz", "yyyx", "yyyz", "zzzx", "zzzy", "xxyy", "xxzz",
          "yyzz", "xxyz", "yyxz", "zzxy"}
  };

  private String title = "";
  private int declaredAtoms = -1;
  private final List<Atom> atoms = new ArrayList<>();
  private final Map<Integer, Integer> atomIndex = new HashMap<>();
  private final List<ShellRecord> shellRecords = new ArrayList<>();
  private final List<OrbitalRecord> orbitalRecords = new ArrayList<>();
  private boolean hasBasis = false;
  private final boolean[] cartesian = {false, true, true, true, true, false};

  /**
   * Constructor for MoldenFilter.
   *
   * @param file the file.
   * @param properties the configuration.
   */
  public MoldenFilter(File file, CompositeConfiguration properties) {
    super(file, OrbitalFormat.MOLDEN, null, properties);
  }

  /**
   * Returns true if the first non-blank line carries the Molden format marker.
   *
   * @param file a file.
   * @return true for a Molden file.
   */
  public static boolean acceptDeep(File file) {
    try (LineReader reader = new LineReader(file)) {
      String line = reader.readNonBlankLine();
      return line != null && line.toLowerCase(Locale.ROOT).contains("[molden format]");
    } catch (IOException e) {
      return false;
    }
  }

  /** {@inheritDoc} */
  @Override
  public OrbitalFile readFile() throws ParseException {
    LineReader reader = null;
    try {
      reader = new LineReader(file);
      String line = reader.readNonBlankLine();
      if (line == null || !line.toLowerCase(Locale.ROOT).contains("[molden format]")) {
        throw error(reader.getLineNumber(), "Missing [Molden Format] marker.");
      }
      line = reader.readLine();
      while (line != null) {
        Matcher matcher = SECTION.matcher(line);
        if (!matcher.matches()) {
          line = reader.readLine();
          continue;
        }
        String section = matcher.group(1).trim().toLowerCase(Locale.ROOT);
        String rest = matcher.group(2);
        switch (section) {
          case "title":
            readTitle(reader);
            break;
          case "n_atoms":
            readAtomCount(reader);
            break;
          case "atoms":
            readAtoms(reader, rest);
            break;
          case "gto":
            readBasis(reader);
            break;
          case "5d":
          case "5d7f":
            cartesian[2] = false;
            cartesian[3] = false;
            break;
          case "5d10f":
            cartesian[2] = false;
            cartesian[3] = true;
            break;
          case "7f":
            cartesian[3] = false;
            break;
          case "9g":
            cartesian[4] = false;
            break;
          case "mo":
            readOrbitals(reader);
            break;
          default:
            logger.fine(format(" Skipping Molden section [%s].", matcher.group(1)));
            skipSection(reader);
        }
        line = reader.readLine();
      }
      return build();
    } catch (IOException | NumberFormatException e) {
      int lineNumber = reader == null ? -1 : reader.getLineNumber();
      throw error(lineNumber, e.getMessage() == null ? e.toString() : e.getMessage().trim(), e);
    } finally {
      if (reader != null) {
        try {
          reader.close();
        } catch (IOException e) {
          logger.fine(format(" Error closing %s: %s", file.getName(), e));
        }
      }
    }
  }

  private static boolean isSection(String line) {
    return line != null && SECTION.matcher(line).matches();
  }

  private void skipSection(LineReader reader) throws IOException {
    while (reader.peekLine() != null && !isSection(reader.peekLine())) {
      reader.readLine();
    }
  }

  private void readTitle(LineReader reader) throws IOException {
    StringBuilder sb = new StringBuilder();
    while (reader.peekLine() != null && !isSection(reader.peekLine())) {
      String line = reader.readLine().trim();
      if (!line.isEmpty()) {
        if (sb.length() > 0) {
          sb.append(' ');
        }
        sb.append(line);
      }
    }
    title = sb.toString();
  }

  private void readAtomCount(LineReader reader) throws IOException, ParseException {
    String line = reader.readNonBlankLine();
    if (line == null) {
      throw error(reader.getLineNumber(), "Missing atom count.");
    }
    declaredAtoms = Integer.parseInt(line.trim());
  }

  private void readAtoms(LineReader reader, String rest) throws IOException, ParseException {
    double unit = rest.toLowerCase(Locale.ROOT).contains("angs") ? 1.0 / Constants.MOLDEN_BOHR
        : 1.0;
    while (reader.peekLine() != null && !isSection(reader.peekLine())) {
      String line = reader.readLine();
      if (line.isBlank()) {
        continue;
      }
      String[] tokens = line.trim().split("\\s+");
      if (tokens.length < 6) {
        throw error(reader.getLineNumber(), "An atom record needs a label, an index, an atomic"
            + " number and three coordinates.");
      }
      int index = Integer.parseInt(tokens[1]);
      int z = Integer.parseInt(tokens[2]);
      double[] xyz = new double[3];
      for (int i = 0; i < 3; i++) {
        xyz[i] = StringUtils.parseFortranDouble(tokens[3 + i]) * unit;
      }
      if (atomIndex.put(index, atoms.size()) != null) {
        throw error(reader.getLineNumber(), format("Atom index %d appears twice.", index));
      }
      atoms.add(createAtom(tokens[0], z, xyz, reader.getLineNumber()));
    }
  }

  private void readBasis(LineReader reader) throws IOException, ParseException {
    hasBasis = true;
    int center = -1;
    int centerLine = -1;
    while (reader.peekLine() != null && !isSection(reader.peekLine())) {
      String line = reader.readLine();
      if (line.isBlank()) {
        continue;
      }
      String[] tokens = line.trim().split("\\s+");
      if (isInteger(tokens[0])) {
        center = Integer.parseInt(tokens[0]);
        centerLine = reader.getLineNumber();
        continue;
      }
      if (center < 0) {
        throw error(reader.getLineNumber(), "Shell found before an atom index.");
      }
      if (tokens.length < 2) {
        throw error(reader.getLineNumber(), "A shell record needs a type and a primitive count.");
      }
      String label = tokens[0].toLowerCase(Locale.ROOT);
      int nPrimitives = Integer.parseInt(tokens[1]);
      double scale = tokens.length > 2 ? StringUtils.parseFortranDouble(tokens[2]) : 1.0;
      boolean sp = label.equals("sp");
      int l = 0;
      if (!sp) {
        try {
          l = AngularMomentum.fromLabel(label).getL();
        } catch (IllegalArgumentException e) {
          throw error(reader.getLineNumber(), format("Unsupported shell type \"%s\".", tokens[0]),
              e);
        }
      }
      double[] exponents = new double[nPrimitives];
      double[] c1 = new double[nPrimitives];
      double[] c2 = new double[nPrimitives];
      for (int i = 0; i < nPrimitives; i++) {
        String primitive = reader.readLine();
        if (primitive == null) {
          throw error(reader.getLineNumber(), "Unexpected end of file in a shell.");
        }
        double[] values = StringUtils.splitFortranDoubles(primitive);
        if (values.length < (sp ? 3 : 2)) {
          throw error(reader.getLineNumber(), "Too few values in a primitive record.");
        }
        exponents[i] = values[0] * scale * scale;
        c1[i] = values[1];
        if (sp) {
          c2[i] = values[2];
        }
      }
      if (sp) {
        shellRecords.add(new ShellRecord(center, centerLine, 0, exponents, c1));
        shellRecords.add(new ShellRecord(center, centerLine, 1, exponents, c2));
      } else {
        shellRecords.add(new ShellRecord(center, centerLine, l, exponents, c1));
      }
    }
  }

  private static boolean isInteger(String token) {
    return token.matches("[-+]?\\d+");
  }

  private void readOrbitals(LineReader reader) throws IOException, ParseException {
    OrbitalRecord current = null;
    while (reader.peekLine() != null && !isSection(reader.peekLine())) {
      String line = reader.readLine();
      if (line.isBlank()) {
        continue;
      }
      Matcher tag = TAG.matcher(line);
      if (tag.matches()) {
        if (current == null || !current.coefficients.isEmpty()) {
          current = new OrbitalRecord();
          orbitalRecords.add(current);
        }
        current.setTag(tag.group(1), tag.group(2).trim(), reader.getLineNumber());
        continue;
      }
      if (current == null) {
        throw error(reader.getLineNumber(), "Coefficient found before an orbital header.");
      }
      String[] tokens = line.trim().split("\\s+");
      if (tokens.length < 2) {
        throw error(reader.getLineNumber(), "A coefficient record needs an index and a value.");
      }
      int index = Integer.parseInt(tokens[0]);
      if (index < 1) {
        throw error(reader.getLineNumber(), format("Invalid coefficient index %d.", index));
      }
      current.coefficients.put(index, StringUtils.parseFortranDouble(tokens[1]));
      if (index > current.maxIndex) {
        current.maxIndex = index;
        current.maxIndexLine = reader.getLineNumber();
      }
    }
  }

  private OrbitalFile build() throws ParseException {
    if (declaredAtoms >= 0 && !atoms.isEmpty() && declaredAtoms != atoms.size()) {
      throw error(-1, format("[N_Atoms] declares %d atoms but %d were read.", declaredAtoms,
          atoms.size()));
    }
    OrbitalFile.Builder builder = new OrbitalFile.Builder(file, orbitalFormat.getFormatName())
        .title(title);
    if (atoms.isEmpty()) {
      throw error(-1, orbitalRecords.isEmpty() ? "No [Atoms] section was found."
          : "Orbitals were found but no atoms.");
    }

    // Shells and basis functions in file order.
    List<Shell> shells = new ArrayList<>();
    List<BasisFunction> functions = new ArrayList<>();
    List<Double> factors = new ArrayList<>();
    boolean[] withBasis = new boolean[atoms.size()];
    for (ShellRecord record : shellRecords) {
      Integer atom = atomIndex.get(record.center);
      if (atom == null) {
        throw error(record.line, format("Basis functions refer to unknown atom %d.",
            record.center));
      }
      withBasis[atom] = true;
      boolean cart = record.l > 0 && cartesian[record.l];
      List<Primitive> primitives = new ArrayList<>();
      for (int i = 0; i < record.exponents.length; i++) {
        primitives.add(new Primitive(record.exponents[i], record.coefficients[i]));
      }
      int shellIndex = shells.size();
      shells.add(new Shell(atom, AngularMomentum.fromL(record.l), cart, primitives));
      addFunctions(shellIndex, record.l, cart, functions, factors);
    }
    Molecule molecule = new Molecule(title, hasBasis ? withBasisFlags(withBasis) : atoms);
    builder.molecule(molecule);
    if (!hasBasis) {
      if (!orbitalRecords.isEmpty()) {
        throw error(-1, "Orbitals were found but no [GTO] section.");
      }
      return builder.build();
    }
    int nBasis = functions.size();
    BasisSet basisSet = new BasisSet(molecule, shells, functions);
    Symmetry symmetry = Symmetry.none(nBasis);
    builder.basisSet(basisSet).symmetry(symmetry);

    boolean unrestricted = false;
    for (OrbitalRecord record : orbitalRecords) {
      if (record.spin == Spin.BETA) {
        unrestricted = true;
        break;
      }
    }
    OrbitalSet.Builder alpha = new OrbitalSet.Builder(unrestricted ? "Alpha" : "Orbitals",
        symmetry).spin(unrestricted ? Spin.ALPHA : Spin.NONE);
    OrbitalSet.Builder beta = new OrbitalSet.Builder("Beta", symmetry).spin(Spin.BETA);
    Map<String, Integer> alphaCount = new HashMap<>();
    Map<String, Integer> betaCount = new HashMap<>();
    for (OrbitalRecord record : orbitalRecords) {
      if (record.maxIndex > nBasis) {
        throw error(record.maxIndexLine, format("Coefficient index %d exceeds the %d basis"
            + " functions.", record.maxIndex, nBasis));
      }
      double[] c = new double[nBasis];
      for (Map.Entry<Integer, Double> entry : record.coefficients.entrySet()) {
        int i = entry.getKey() - 1;
        c[i] = entry.getValue() * factors.get(i);
      }
      boolean isBeta = record.spin == Spin.BETA;
      Spin spin = unrestricted ? (isBeta ? Spin.BETA : Spin.ALPHA) : Spin.NONE;
      Map<String, Integer> counts = isBeta ? betaCount : alphaCount;
      int index = counts.merge(record.symmetry, 1, Integer::sum);
      Orbital orbital = new Orbital.Builder()
          .coefficients(c)
          .energy(record.energy)
          .occupation(record.occupation)
          .spin(spin)
          .irrep(0, record.symmetry)
          .indexInIrrep(index)
          .build();
      if (isBeta) {
        beta.add(orbital);
      } else {
        alpha.add(orbital);
      }
    }
    if (!orbitalRecords.isEmpty()) {
      OrbitalSet alphaSet = alpha.build();
      logSet(alphaSet);
      builder.addOrbitalSet(alphaSet);
      if (unrestricted) {
        OrbitalSet betaSet = beta.build();
        logSet(betaSet);
        builder.addOrbitalSet(betaSet);
      }
    }
    OrbitalFile orbitalFile = builder.build();
    logger.info(format(" Read %d orbitals and %d basis functions from %s.",
        orbitalRecords.size(), nBasis, file.getName()));
    return orbitalFile;
  }

  private List<Atom> withBasisFlags(boolean[] withBasis) {
    List<Atom> flagged = new ArrayList<>(atoms.size());
    for (int i = 0; i < atoms.size(); i++) {
      Atom atom = atoms.get(i);
      flagged.add(withBasis[i] ? atom : new Atom(atom.getName(), atom.getAtomicNumber(),
          atom.getXYZ(), false, atom.isGhost()));
    }
    return flagged;
  }

  /**
   * Append the functions of one shell in Molden order, with the factor that converts a Molden
   * coefficient into one for the component used here.
   */
  private static void addFunctions(int shellIndex, int l, boolean cart,
      List<BasisFunction> functions, List<Double> factors) {
    if (cart) {
      for (String component : CARTESIAN_ORDER[l]) {
        int lx = count(component, 'x');
        int ly = count(component, 'y');
        int lz = count(component, 'z');
        functions.add(new BasisFunction(shellIndex, AngularComponent.cartesian(lx, ly, lz)));
        factors.add(1.0 / sqrt(doubleFactorialOdd(lx) * doubleFactorialOdd(ly)
            * doubleFactorialOdd(lz)));
      }
    } else {
      functions.add(new BasisFunction(shellIndex, AngularComponent.spherical(l, 0)));
      factors.add(1.0);
      for (int m = 1; m <= l; m++) {
        functions.add(new BasisFunction(shellIndex, AngularComponent.spherical(l, m)));
        factors.add(1.0);
        functions.add(new BasisFunction(shellIndex, AngularComponent.spherical(l, -m)));
        factors.add(1.0);
      }
    }
  }

  private static double doubleFactorialOdd(int n) {
    return doubleFactorial(2 * n - 1);
  }

  private static int count(String s, char c) {
    int n = 0;
    for (int i = 0; i < s.length(); i++) {
      if (s.charAt(i) == c) {
        n++;
      }
    }
    return n;
  }

  /** A shell as read, before the shell flags are known. */
  private static class ShellRecord {

    final int center;
    final int line;
    final int l;
    final double[] exponents;
    final double[] coefficients;

    ShellRecord(int center, int line, int l, double[] exponents, double[] coefficients) {
      this.center = center;
      this.line = line;
      this.l = l;
      this.exponents = exponents;
      this.coefficients = coefficients;
    }
  }

  /** An orbital as read, before the basis size is known. */
  private class OrbitalRecord {

    String symmetry = "";
    double energy = Double.NaN;
    double occupation = 0.0;
    Spin spin = Spin.NONE;
    final Map<Integer, Double> coefficients = new LinkedHashMap<>();
    int maxIndex = 0;
    int maxIndexLine = -1;

    void setTag(String key, String value, int lineNumber) throws ParseException {
      switch (key.toLowerCase(Locale.ROOT)) {
        case "sym":
          symmetry = value.replaceFirst("^\\d*", "");
          break;
        case "ene":
          energy = parseValue(value, "energy", lineNumber);
          break;
        case "occup":
          occupation = parseValue(value, "occupation", lineNumber);
          break;
        case "spin":
          String s = value.toLowerCase(Locale.ROOT);
          if (s.startsWith("beta")) {
            spin = Spin.BETA;
          } else if (s.startsWith("alpha")) {
            spin = Spin.ALPHA;
          } else {
            throw error(lineNumber, format("Unknown spin \"%s\".", value));
          }
          break;
        default:
          logger.fine(format(" Ignoring orbital tag %s at line %d.", key, lineNumber));
      }
    }

    private double parseValue(String value, String what, int lineNumber) throws ParseException {
      if (StringUtils.isStarred(value)) {
        logger.warning(format(" Unreadable %s at line %d of %s; it is marked invalid.", what,
            lineNumber, file.getName()));
        return Double.NaN;
      }
      try {
        return StringUtils.parseFortranDouble(value);
      } catch (NumberFormatException e) {
        throw error(lineNumber, format("Invalid %s \"%s\".", what, value), e);
      }
    }
  }
}
