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
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
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
import orbx.utilities.Constants;
import org.apache.commons.configuration2.CompositeConfiguration;

/**
 * The LuscusFilter class reads Luscus grid files: a text header with the geometry (in Angstrom),
 * the grid and one record per stored orbital, followed by little endian doubles.
 *
 * <p>The binary data is split into blocks of <code>Block_Size</code> points; each block holds the
 * values of every stored orbital in turn. Points run with x slowest and z fastest. A Luscus file
 * stores a subset of the orbitals of a calculation and no coefficients, so other orbitals, and
 * densities that need them, require the companion HDF5 file.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class LuscusFilter extends OrbitalFilter {

  private static final Logger logger = Logger.getLogger(LuscusFilter.class.getName());

  private static final Pattern NAME = Pattern.compile(
      "\\s*GridName=\\s*(?:.+?)\\s*sym=\\s*(\\d+)\\s*index=\\s*(\\d+)\\s*Energ=\\s*(\\S+)\\s*"
          + "occ=\\s*(\\S+)\\s*type=\\s*(\\w)\\s*");
  private static final String GRID_MARKER = "<GRID>";

  /**
   * Constructor for LuscusFilter.
   *
   * @param file the file.
   * @param companion the file whose orbitals were sampled, or null.
   * @param properties the configuration.
   */
  public LuscusFilter(File file, OrbitalFile companion, CompositeConfiguration properties) {
    super(file, OrbitalFormat.LUSCUS, companion, properties);
  }

  /**
   * Returns true if the atom count and geometry are followed by a grid marker.
   *
   * @param file a file.
   * @return true for a Luscus file.
   */
  public static boolean acceptDeep(File file) {
    try (RandomAccessFile raf = new RandomAccessFile(file, "r")) {
      String line = raf.readLine();
      if (line == null || !line.trim().matches("\\d+")) {
        return false;
      }
      int n = Integer.parseInt(line.trim());
      for (int i = 0; i <= n; i++) {
        if (raf.readLine() == null) {
          return false;
        }
      }
      line = raf.readLine();
      return line != null && line.trim().equals(GRID_MARKER);
    } catch (IOException | NumberFormatException e) {
      return false;
    }
  }

  /** {@inheritDoc} */
  @Override
  public OrbitalFile readFile() throws ParseException {
    int lineNumber = 0;
    try (RandomAccessFile raf = new RandomAccessFile(file, "r")) {
      String line = raf.readLine();
      lineNumber++;
      if (line == null) {
        throw error(lineNumber, "Empty file.");
      }
      int nAtoms = Integer.parseInt(line.trim());
      String title = raf.readLine();
      lineNumber++;
      List<Atom> atoms = new ArrayList<>(nAtoms);
      for (int i = 0; i < nAtoms; i++) {
        line = raf.readLine();
        lineNumber++;
        if (line == null) {
          throw error(lineNumber, "Unexpected end of file in the geometry.");
        }
        String[] tokens = line.trim().split("\\s+");
        if (tokens.length < 4) {
          throw error(lineNumber, "An atom record needs a label and three coordinates.");
        }
        double[] xyz = new double[3];
        for (int j = 0; j < 3; j++) {
          xyz[j] = Double.parseDouble(tokens[j + 1]) / Constants.LUSCUS_BOHR;
        }
        atoms.add(createAtom(tokens[0], xyz, lineNumber));
      }
      line = raf.readLine();
      lineNumber++;
      if (line == null || !line.trim().equals(GRID_MARKER)) {
        throw error(lineNumber, "Missing " + GRID_MARKER + " marker.");
      }

      int nFields = -1;
      int blockSize = -1;
      int[] net = null;
      double[] origin = null;
      double[][] axes = new double[3][];
      GridOrbitals orbitals = new GridOrbitals();
      while (nFields < 0 || orbitals.size() < nFields) {
        line = raf.readLine();
        lineNumber++;
        if (line == null) {
          throw error(lineNumber, "Unexpected end of file in the grid header.");
        }
        String trimmed = line.trim();
        if (trimmed.startsWith("GridName=")) {
          if (nFields < 0) {
            throw error(lineNumber, "Orbital records found before N_of_Grids.");
          }
          Matcher matcher = NAME.matcher(line);
          boolean matches = matcher.matches();
          orbitals.add(matches ? matcher : null,
              trimmed.substring("GridName=".length()).trim());
        } else if (trimmed.startsWith("Net=")) {
          double[] v = GridOrbitals.values(trimmed, 3);
          net = new int[] {(int) v[0], (int) v[1], (int) v[2]};
        } else if (trimmed.startsWith("Origin=")) {
          origin = GridOrbitals.values(trimmed, 3);
        } else if (trimmed.matches("Axis_[123]=.*")) {
          axes[trimmed.charAt(5) - '1'] = GridOrbitals.values(trimmed, 3);
        } else {
          Map<String, String> keys = GridOrbitals.keyValues(trimmed);
          if (keys.containsKey("n_of_grids")) {
            nFields = Integer.parseInt(keys.get("n_of_grids"));
          } else if (keys.containsKey("n_of_mo")) {
            nFields = Integer.parseInt(keys.get("n_of_mo"));
          }
          if (keys.containsKey("block_size")) {
            blockSize = Integer.parseInt(keys.get("block_size"));
          }
        }
      }
      // One separator line precedes the binary data.
      raf.readLine();
      long head = raf.getFilePointer();
      if (net == null || origin == null || axes[0] == null || axes[1] == null
          || axes[2] == null) {
        throw error(lineNumber, "Incomplete grid definition.");
      }
      if (blockSize <= 0) {
        throw error(lineNumber, "Missing Block_Size.");
      }
      GridSpec gridSpec = GridSpec.spanning(origin, axes, net);
      long expected = head + 8L * gridSpec.size() * nFields;
      if (raf.length() < expected) {
        throw error(-1, format("Binary data holds %d bytes, expected %d.", raf.length() - head,
            expected - head));
      }

      Molecule molecule = new Molecule(title == null ? "" : title.trim(), atoms);
      OrbitalSet set = orbitals.build("Grid orbitals");
      LuscusFields fields = new LuscusFields(gridSpec, head, nFields, blockSize, orbitals.slots(),
          orbitals.labels());
      String hint = companion != null && companion.getFile() != null
          ? companion.getFile().getName() : InpOrbFilter.COMPANION_HINT;
      logger.info(format(" Read %d stored orbitals on a %d x %d x %d grid from %s.", nFields,
          net[0], net[1], net[2], file.getName()));
      return new OrbitalFile.Builder(file, orbitalFormat.getFormatName())
          .title(molecule.getTitle())
          .molecule(molecule)
          .symmetry(set.getSymmetry())
          .addOrbitalSet(set)
          .precomputed(fields, set)
          .companion(hint)
          .build();
    } catch (IOException | IllegalArgumentException e) {
      throw error(lineNumber, e.getMessage() == null ? e.toString() : e.getMessage().trim(), e);
    }
  }

  /** Lazily read fields of a Luscus file. */
  private class LuscusFields implements PrecomputedFields {

    private final GridSpec gridSpec;
    private final long head;
    private final int nFields;
    private final int blockSize;
    private final int[] slots;
    private final String[] labels;

    LuscusFields(GridSpec gridSpec, long head, int nFields, int blockSize, int[] slots,
        String[] labels) {
      this.gridSpec = gridSpec;
      this.head = head;
      this.nFields = nFields;
      this.blockSize = blockSize;
      this.slots = slots;
      this.labels = labels;
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
      int slot = slots[index];
      int total = gridSpec.size();
      double[] values = new double[total];
      try (FileChannel channel = FileChannel.open(file.toPath(), StandardOpenOption.READ)) {
        ByteBuffer buffer = ByteBuffer.allocate(8 * blockSize).order(ByteOrder.LITTLE_ENDIAN);
        for (int start = 0; start < total; start += blockSize) {
          int length = Math.min(blockSize, total - start);
          long position = head + 8L * ((long) start * nFields + (long) slot * length);
          buffer.clear();
          buffer.limit(8 * length);
          while (buffer.hasRemaining()) {
            if (channel.read(buffer, position + buffer.position()) < 0) {
              throw new IOException(format(" Unexpected end of %s.", file.getName()));
            }
          }
          buffer.flip();
          for (int p = 0; p < length; p++) {
            values[start + p] = buffer.getDouble();
          }
        }
      }
      return new ScalarField(gridSpec, values, labels[index]);
    }
  }
}
