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
import java.util.logging.Logger;
import orbx.lattice.GridSpec;
import orbx.lattice.ScalarField;
import orbx.orbitals.OrbitalFile;
import orbx.orbitals.PrecomputedFields;
import orbx.orbitals.basis.Atom;
import orbx.orbitals.basis.Elements;
import orbx.orbitals.basis.Molecule;
import orbx.orbitals.mo.OrbitalSet;
import orbx.utilities.Constants;
import org.apache.commons.configuration2.CompositeConfiguration;

/**
 * The CubeFilter class reads Gaussian cube files.
 *
 * <p>Values are read as a stream of numbers, so the line layout of the data is irrelevant. With
 * several orbitals in one file the values are nested x:y:z:orbital.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class CubeFilter extends OrbitalFilter {

  private static final Logger logger = Logger.getLogger(CubeFilter.class.getName());

  /**
   * Constructor for CubeFilter.
   *
   * @param file the file.
   * @param properties the configuration.
   */
  public CubeFilter(File file, CompositeConfiguration properties) {
    super(file, OrbitalFormat.CUBE, null, properties);
  }

  /**
   * Returns true if lines 3 to 6 hold a count and three numbers each.
   *
   * @param file a file.
   * @return true for a cube file.
   */
  public static boolean acceptDeep(File file) {
    try (LineReader reader = new LineReader(file)) {
      reader.readLine();
      reader.readLine();
      for (int i = 0; i < 4; i++) {
        String line = reader.readLine();
        if (line == null) {
          return false;
        }
        String[] tokens = line.trim().split("\\s+");
        if (tokens.length < 4) {
          return false;
        }
        Integer.parseInt(tokens[0]);
        for (int j = 1; j < 4; j++) {
          Double.parseDouble(tokens[j]);
        }
      }
      return true;
    } catch (IOException | NumberFormatException e) {
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
      throw error(-1, e.getMessage() == null ? e.toString() : e.getMessage().trim(), e);
    }
  }

  private OrbitalFile read(LineReader reader) throws ParseException, IOException {
    String first = reader.readLine();
    String title = reader.readLine();
    if (first == null || title == null) {
      throw error(reader.getLineNumber(), "Missing title lines.");
    }
    title = title.trim();
    if (title.isEmpty()) {
      title = first.trim();
    }
    String[] tokens = tokens(reader, 4);
    int nAtoms = Integer.parseInt(tokens[0]);
    double[] origin = new double[3];
    for (int j = 0; j < 3; j++) {
      origin[j] = Double.parseDouble(tokens[j + 1]);
    }
    int[] counts = new int[3];
    double[][] steps = new double[3][3];
    boolean angstrom = false;
    for (int axis = 0; axis < 3; axis++) {
      tokens = tokens(reader, 4);
      counts[axis] = Integer.parseInt(tokens[0]);
      if (counts[axis] < 0) {
        angstrom = true;
        counts[axis] = -counts[axis];
      }
      for (int j = 0; j < 3; j++) {
        steps[axis][j] = Double.parseDouble(tokens[j + 1]);
      }
    }
    double scale = angstrom ? 1.0 / Constants.BOHR : 1.0;
    for (int j = 0; j < 3; j++) {
      origin[j] *= scale;
      for (int axis = 0; axis < 3; axis++) {
        steps[axis][j] *= scale;
      }
    }

    List<Atom> atoms = new ArrayList<>();
    for (int i = 0; i < Math.abs(nAtoms); i++) {
      tokens = tokens(reader, 5);
      int z = (int) Math.round(Double.parseDouble(tokens[0]));
      double[] xyz = new double[3];
      for (int j = 0; j < 3; j++) {
        xyz[j] = Double.parseDouble(tokens[j + 2]) * scale;
      }
      atoms.add(createAtom(Elements.symbol(z), z, xyz, reader.getLineNumber()));
    }

    GridOrbitals orbitals = null;
    int nFields = 1;
    String[] labels = {title};
    if (nAtoms < 0) {
      int n = (int) reader.readDoubles(1)[0];
      if (n < 1) {
        throw error(reader.getLineNumber(), format("Invalid orbital count %d.", n));
      }
      double[] ids = reader.readDoubles(n);
      orbitals = new GridOrbitals();
      for (double id : ids) {
        int index = (int) id;
        orbitals.add(index, format("%d: %s", index, title));
      }
      nFields = n;
      labels = orbitals.labels();
    }
    int headerLines = reader.getLineNumber();

    GridSpec gridSpec = new GridSpec(origin, steps, counts);
    int[] slots = orbitals != null ? orbitals.slots() : new int[] {0};
    CubeFields fields = new CubeFields(gridSpec, headerLines, nFields, slots, labels);
    fields.scan(reader, -1, null);

    Molecule molecule = new Molecule(title, atoms);
    OrbitalFile.Builder builder = new OrbitalFile.Builder(file, orbitalFormat.getFormatName())
        .title(title)
        .molecule(molecule);
    if (orbitals != null) {
      OrbitalSet set = orbitals.build("Cube orbitals");
      builder.symmetry(set.getSymmetry()).addOrbitalSet(set).precomputed(fields, set);
    } else {
      builder.precomputed(fields, null);
    }
    logger.info(format(" Read %d field(s) on a %d x %d x %d grid from %s.", nFields, counts[0],
        counts[1], counts[2], file.getName()));
    return builder.build();
  }

  private String[] tokens(LineReader reader, int count) throws IOException, ParseException {
    String line = reader.readLine();
    if (line == null) {
      throw error(reader.getLineNumber(), "Unexpected end of file in the header.");
    }
    String[] tokens = line.trim().split("\\s+");
    if (tokens.length < count) {
      throw error(reader.getLineNumber(), format("Expected %d fields.", count));
    }
    return tokens;
  }

  /** Lazily read fields of a cube file. */
  private class CubeFields implements PrecomputedFields {

    private final GridSpec gridSpec;
    private final int headerLines;
    private final int nFields;
    private final int[] slots;
    private final String[] labels;

    CubeFields(GridSpec gridSpec, int headerLines, int nFields, int[] slots, String[] labels) {
      this.gridSpec = gridSpec;
      this.headerLines = headerLines;
      this.nFields = nFields;
      this.slots = slots;
      this.labels = labels;
    }

    /**
     * Read the values one plane of the first axis at a time.
     *
     * @param reader a reader positioned after the header.
     * @param slot the field to collect, or -1.
     * @param values the destination, or null.
     * @throws IOException if the data end early.
     */
    void scan(LineReader reader, int slot, double[] values) throws IOException {
      int n1 = gridSpec.getCount(0);
      int plane = gridSpec.getCount(1) * gridSpec.getCount(2);
      for (int i = 0; i < n1; i++) {
        double[] data;
        try {
          data = reader.readDoubles(plane * nFields);
        } catch (NumberFormatException e) {
          throw new IOException(format(" Malformed value near line %d.", reader.getLineNumber()),
              e);
        }
        if (slot >= 0) {
          for (int p = 0; p < plane; p++) {
            values[i * plane + p] = data[p * nFields + slot];
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
        scan(reader, slots[index], values);
      }
      return new ScalarField(gridSpec, values, labels[index]);
    }
  }
}
