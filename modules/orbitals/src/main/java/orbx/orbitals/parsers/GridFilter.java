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
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import orbx.lattice.GridSpec;
import orbx.lattice.ScalarField;
import orbx.orbitals.OrbitalFile;
import orbx.orbitals.PrecomputedFields;
import orbx.orbitals.basis.Atom;
import orbx.orbitals.basis.Molecule;
import orbx.orbitals.mo.OrbitalSet;
import orbx.utilities.StringUtils;
import org.apache.commons.configuration2.CompositeConfiguration;

/**
 * The GridFilter class reads Molcas ASCII grid files.
 *
 * <p>The header is keyword driven. <code>Net=</code> gives the number of intervals per axis and
 * <code>Axis_1..3=</code> the full span of each axis. Data follow in blocks of
 * <code>Block_Size</code> points; within a block each orbital contributes a title line and one
 * value per line. An <code>#INPORB</code> section may follow the data.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class GridFilter extends OrbitalFilter {

  private static final Logger logger = Logger.getLogger(GridFilter.class.getName());

  private static final Pattern NAME = Pattern.compile(
      "\\s*GridName=\\s+(\\d+)\\s+(\\d+)\\s+(.+)\\s+\\((.+)\\)\\s+(\\w)\\s*");

  /**
   * Constructor for GridFilter.
   *
   * @param file the file.
   * @param companion the file whose orbitals were sampled, or null.
   * @param properties the configuration.
   */
  public GridFilter(File file, OrbitalFile companion, CompositeConfiguration properties) {
    super(file, OrbitalFormat.GRID, companion, properties);
  }

  /**
   * Returns true if the header declares atoms and a grid within its first lines.
   *
   * @param file a file.
   * @return true for an ASCII grid file.
   */
  public static boolean acceptDeep(File file) {
    try (LineReader reader = new LineReader(file)) {
      boolean natom = false;
      for (int i = 0; i < 8; i++) {
        String line = reader.readLine();
        if (line == null) {
          return false;
        }
        if (line.trim().startsWith("Natom=")) {
          natom = true;
          break;
        }
      }
      if (!natom) {
        return false;
      }
      String line;
      while ((line = reader.readLine()) != null) {
        String trimmed = line.trim();
        if (trimmed.startsWith("GridName=") || trimmed.startsWith("#")) {
          break;
        }
        if (trimmed.startsWith("Net=") || trimmed.startsWith("N_of_MO=")) {
          return true;
        }
      }
      return false;
    } catch (IOException e) {
      return false;
    }
  }

  /** {@inheritDoc} */
  @Override
  public OrbitalFile readFile() throws ParseException {
    try (LineReader reader = new LineReader(file)) {
      try {
        return read(reader);
      } catch (IllegalArgumentException e) {
        throw error(reader.getLineNumber(), e.getMessage() == null ? e.toString()
            : e.getMessage().trim(), e);
      }
    } catch (IOException e) {
      throw error(-1, e.toString(), e);
    }
  }

  private OrbitalFile read(LineReader reader) throws ParseException, IOException {
    String title = "";
    List<Atom> atoms = null;
    int nFields = -1;
    int nMO = -1;
    int blockSize = -1;
    int[] counts = null;
    double[] origin = null;
    double[][] axes = new double[3][];
    GridOrbitals orbitals = new GridOrbitals();
    int lineCount = 0;
    while (true) {
      String line = reader.readLine();
      if (line == null) {
        throw error(reader.getLineNumber(), "Unexpected end of file in the grid header.");
      }
      String trimmed = line.trim();
      if (reader.getLineNumber() == 2) {
        title = trimmed;
      }
      if (trimmed.startsWith("Natom=")) {
        int n = Integer.parseInt(GridOrbitals.keyValues(trimmed).get("natom"));
        atoms = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
          line = reader.readLine();
          if (line == null) {
            throw error(reader.getLineNumber(), "Unexpected end of file in the geometry.");
          }
          String[] tokens = line.trim().split("\\s+");
          if (tokens.length < 4) {
            throw error(reader.getLineNumber(), "An atom record needs a label and 3 coordinates.");
          }
          double[] xyz = new double[3];
          for (int j = 0; j < 3; j++) {
            xyz[j] = StringUtils.parseFortranDouble(tokens[j + 1]);
          }
          atoms.add(createAtom(tokens[0], xyz, reader.getLineNumber()));
        }
      } else if (trimmed.startsWith("GridName=")) {
        if (nFields < 0) {
          throw error(reader.getLineNumber(), "Orbital records found before N_of_MO.");
        }
        Matcher matcher = NAME.matcher(line);
        String label = trimmed.substring("GridName=".length()).trim();
        orbitals.add(matcher.matches() ? matcher : null, label);
        if (orbitals.size() == nFields) {
          lineCount = reader.getLineNumber();
          break;
        }
      } else if (trimmed.startsWith("Net=")) {
        double[] v = GridOrbitals.values(trimmed, 3);
        counts = new int[] {(int) v[0] + 1, (int) v[1] + 1, (int) v[2] + 1};
      } else if (trimmed.startsWith("Origin=")) {
        origin = GridOrbitals.values(trimmed, 3);
      } else if (trimmed.matches("Axis_[123]=.*")) {
        axes[trimmed.charAt(5) - '1'] = GridOrbitals.values(trimmed, 3);
      } else {
        Map<String, String> keys = GridOrbitals.keyValues(trimmed);
        if (keys.containsKey("n_of_grids")) {
          nFields = Integer.parseInt(keys.get("n_of_grids"));
        }
        if (keys.containsKey("n_of_mo")) {
          nMO = Integer.parseInt(keys.get("n_of_mo"));
        }
        if (keys.containsKey("block_size")) {
          blockSize = Integer.parseInt(keys.get("block_size"));
        }
        if (nFields < 0 && nMO >= 0 && keys.containsKey("n_of_mo")) {
          nFields = nMO;
        }
        if (nFields == 0) {
          throw error(reader.getLineNumber(), "The grid holds no fields.");
        }
      }
    }
    if (atoms == null) {
      throw error(lineCount, "Missing Natom= record.");
    }
    if (counts == null || origin == null || axes[0] == null || axes[1] == null
        || axes[2] == null) {
      throw error(lineCount, "Incomplete grid definition.");
    }
    if (blockSize <= 0) {
      throw error(lineCount, "Missing Block_Size.");
    }
    GridSpec gridSpec = GridSpec.spanning(origin, axes, counts);
    GridFields fields = new GridFields(gridSpec, lineCount, nFields, blockSize, orbitals.slots(),
        orbitals.labels());

    // Check the data and look for an embedded InpOrb section.
    fields.skipData(reader, -1, null);
    InpOrbFilter.Contents inpOrb = null;
    String line;
    while ((line = reader.readLine()) != null) {
      if (line.trim().toUpperCase(Locale.ROOT).startsWith("#INPORB")) {
        InpOrbFilter inpOrbFilter = new InpOrbFilter(file, companion, properties);
        inpOrb = inpOrbFilter.parse(reader, line);
        break;
      }
    }

    Molecule molecule = new Molecule(title, atoms);
    OrbitalSet set = orbitals.build("Grid orbitals");
    OrbitalFile.Builder builder = new OrbitalFile.Builder(file, orbitalFormat.getFormatName())
        .title(title)
        .molecule(molecule)
        .symmetry(set.getSymmetry());
    if (inpOrb != null) {
      inpOrb.addTo(builder);
      if (companion == null || companion.getBasisSet() == null) {
        builder.molecule(molecule);
      }
    } else {
      builder.companion(companion != null && companion.getFile() != null
          ? companion.getFile().getName() : InpOrbFilter.COMPANION_HINT);
    }
    builder.addOrbitalSet(set).precomputed(fields, set);
    logger.info(format(" Read %d fields on a %d x %d x %d grid from %s%s.", nFields, counts[0],
        counts[1], counts[2], file.getName(), inpOrb != null ? " with embedded orbitals" : ""));
    return builder.build();
  }

  /** Lazily read fields of an ASCII grid file. */
  private class GridFields implements PrecomputedFields {

    private final GridSpec gridSpec;
    private final int headerLines;
    private final int nFields;
    private final int blockSize;
    private final int[] slots;
    private final String[] labels;

    GridFields(GridSpec gridSpec, int headerLines, int nFields, int blockSize, int[] slots,
        String[] labels) {
      this.gridSpec = gridSpec;
      this.headerLines = headerLines;
      this.nFields = nFields;
      this.blockSize = blockSize;
      this.slots = slots;
      this.labels = labels;
    }

    /**
     * Step through the data blocks, optionally collecting the values of one slot.
     *
     * @param reader a reader positioned after the header.
     * @param slot the slot to collect, or -1.
     * @param values the destination, or null.
     * @throws IOException if the data end early or hold a malformed value.
     */
    void skipData(LineReader reader, int slot, double[] values) throws IOException {
      int total = gridSpec.size();
      for (int start = 0; start < total; start += blockSize) {
        int length = Math.min(blockSize, total - start);
        for (int o = 0; o < nFields; o++) {
          if (reader.readLine() == null) {
            throw new IOException(format(" Grid data end in block at point %d.", start));
          }
          for (int p = 0; p < length; p++) {
            String line = reader.readLine();
            if (line == null) {
              throw new IOException(format(" Grid data end in block at point %d.", start));
            }
            double value;
            try {
              value = StringUtils.parseFortranDouble(line.trim());
            } catch (NumberFormatException e) {
              throw new IOException(format(" Malformed grid value at line %d: %s",
                  reader.getLineNumber(), line.trim()), e);
            }
            if (o == slot) {
              values[start + p] = value;
            }
          }
        }
      }
    }

    @Override
    public GridSpec getGridSpec() {
      return gridSpec;
    }

    @Override
    public int getFieldCount() {
      return slots.length;
    }

    @Override
    public String getFieldLabel(int index) {
      return labels[index];
    }

    @Override
    public ScalarField readField(int index) throws IOException {
      double[] values = new double[gridSpec.size()];
      try (LineReader reader = new LineReader(file)) {
        for (int i = 0; i < headerLines; i++) {
          reader.readLine();
        }
        skipData(reader, slots[index], values);
      }
      return new ScalarField(gridSpec, values, labels[index]);
    }
  }
}
