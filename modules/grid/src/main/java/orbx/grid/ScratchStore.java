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

import static java.lang.String.format;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import orbx.lattice.GridSpec;
import orbx.lattice.ScalarField;
import orbx.utilities.DirectoryUtils;
import org.apache.commons.io.FileUtils;

/**
 * Persists computed fields in a scratch directory, one file per cache key.
 *
 * <p>Each file starts with a header holding the key description and the fingerprints of the
 * source sets, so entries can be invalidated without loading them. Files are written to a
 * temporary name and moved into place atomically. Removal goes through {@link
 * DirectoryUtils#removeAtomically(Path)}; tombstones that could not be deleted are purged when the
 * next store opens the directory.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class ScratchStore {

  private static final Logger logger = Logger.getLogger(ScratchStore.class.getName());

  private static final int MAGIC = 0x4f524258;
  private static final int VERSION = 1;
  private static final String SUFFIX = ".field";

  private final Path directory;

  /**
   * Open (and create if needed) a scratch directory, purging entries left half removed.
   *
   * @param directory the directory.
   * @throws IOException if the directory cannot be created.
   */
  public ScratchStore(Path directory) throws IOException {
    this.directory = directory;
    Files.createDirectories(directory);
    int purged = DirectoryUtils.purgeTombstones(directory);
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*.tmp")) {
      for (Path stale : stream) {
        FileUtils.deleteQuietly(stale.toFile());
        purged++;
      }
    }
    if (purged > 0) {
      logger.info(format(" Purged %d stale scratch entries from %s.", purged, directory));
    }
  }

  public Path getDirectory() {
    return directory;
  }

  /**
   * The file of a key.
   *
   * @param key the key.
   * @return the path, which may not exist.
   */
  public Path path(FieldKey key) {
    return directory.resolve(key.digest() + SUFFIX);
  }

  /**
   * Persist a field.
   *
   * @param key the key.
   * @param field the field.
   * @throws IOException if the field could not be written.
   */
  public void store(FieldKey key, ScalarField field) throws IOException {
    Path target = path(key);
    Path temporary = Files.createTempFile(directory, key.digest(), ".tmp");
    boolean moved = false;
    try {
      try (DataOutputStream out = new DataOutputStream(
          new BufferedOutputStream(Files.newOutputStream(temporary)))) {
        out.writeInt(MAGIC);
        out.writeInt(VERSION);
        out.writeUTF(key.describe());
        List<String> fingerprints = key.getFingerprints();
        out.writeInt(fingerprints.size());
        for (String fingerprint : fingerprints) {
          out.writeUTF(fingerprint);
        }
        out.writeUTF(field.getLabel() == null ? "" : field.getLabel());
        GridSpec gridSpec = field.getGridSpec();
        for (double v : gridSpec.getOrigin()) {
          out.writeDouble(v);
        }
        for (int axis = 0; axis < 3; axis++) {
          for (double v : gridSpec.getStep(axis)) {
            out.writeDouble(v);
          }
          out.writeInt(gridSpec.getCount(axis));
        }
        double[] values = field.getValues();
        out.writeInt(values.length);
        for (double v : values) {
          out.writeDouble(v);
        }
      }
      try {
        Files.move(temporary, target, StandardCopyOption.ATOMIC_MOVE,
            StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(temporary, target, StandardCopyOption.REPLACE_EXISTING);
      }
      moved = true;
    } finally {
      if (!moved) {
        FileUtils.deleteQuietly(temporary.toFile());
      }
    }
    logger.fine(format(" Stored%s in %s.", key, target.getFileName()));
  }

  /**
   * Load a persisted field.
   *
   * @param key the key.
   * @return the field, or null if none is stored or the entry is unreadable.
   */
  public ScalarField load(FieldKey key) {
    Path file = path(key);
    if (!Files.isRegularFile(file)) {
      return null;
    }
    try (DataInputStream in = open(file)) {
      if (!key.describe().equals(in.readUTF())) {
        logger.warning(format(" %s does not hold%s.", file.getFileName(), key));
        return null;
      }
      readFingerprints(in);
      String label = in.readUTF();
      double[] origin = readDoubles(in, 3);
      double[][] steps = new double[3][];
      int[] counts = new int[3];
      for (int axis = 0; axis < 3; axis++) {
        steps[axis] = readDoubles(in, 3);
        counts[axis] = in.readInt();
      }
      GridSpec gridSpec = new GridSpec(origin, steps, counts);
      int n = in.readInt();
      if (n != gridSpec.size()) {
        throw new IOException(format(" %d values for %d points.", n, gridSpec.size()));
      }
      ScalarField field = new ScalarField(gridSpec, readDoubles(in, n), label);
      logger.fine(format(" Loaded%s from %s.", key, file.getFileName()));
      return field;
    } catch (IOException | IllegalArgumentException e) {
      logger.warning(format(" Discarding unreadable scratch entry %s: %s", file.getFileName(),
          e));
      removeQuietly(file);
      return null;
    }
  }

  /**
   * Atomically remove the entry of a key.
   *
   * @param key the key.
   * @throws IOException if the entry could not be moved out of the way.
   */
  public void remove(FieldKey key) throws IOException {
    DirectoryUtils.removeAtomically(path(key));
  }

  /**
   * Remove every entry derived from a set.
   *
   * @param fingerprint the fingerprint of the set.
   * @return the number of entries removed.
   * @throws IOException if the directory could not be scanned or an entry not removed.
   */
  public int removeReferencing(String fingerprint) throws IOException {
    int count = 0;
    for (Path file : entries()) {
      List<String> fingerprints;
      try (DataInputStream in = open(file)) {
        in.readUTF();
        fingerprints = readFingerprints(in);
      } catch (IOException e) {
        logger.warning(format(" Removing unreadable scratch entry %s: %s", file.getFileName(), e));
        fingerprints = List.of(fingerprint);
      }
      if (fingerprints.contains(fingerprint)) {
        DirectoryUtils.removeAtomically(file);
        count++;
      }
    }
    return count;
  }

  /**
   * Remove every entry.
   *
   * @throws IOException if an entry could not be removed.
   */
  public void clear() throws IOException {
    for (Path file : entries()) {
      DirectoryUtils.removeAtomically(file);
    }
  }

  /**
   * Persisted entries.
   *
   * @return the entry files.
   * @throws IOException if the directory could not be scanned.
   */
  public List<Path> entries() throws IOException {
    List<Path> files = new ArrayList<>();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
      for (Path file : stream) {
        files.add(file);
      }
    }
    return files;
  }

  /** Open an entry and check its header. */
  private static DataInputStream open(Path file) throws IOException {
    DataInputStream in = new DataInputStream(new BufferedInputStream(Files.newInputStream(file)));
    try {
      if (in.readInt() != MAGIC || in.readInt() != VERSION) {
        throw new IOException(" Not an OrbX scratch entry.");
      }
    } catch (IOException e) {
      in.close();
      throw e;
    }
    return in;
  }

  private static List<String> readFingerprints(DataInputStream in) throws IOException {
    int n = in.readInt();
    List<String> fingerprints = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      fingerprints.add(in.readUTF());
    }
    return fingerprints;
  }

  private static double[] readDoubles(DataInputStream in, int n) throws IOException {
    double[] values = new double[n];
    for (int i = 0; i < n; i++) {
      values[i] = in.readDouble();
    }
    return values;
  }

  private static void removeQuietly(Path file) {
    try {
      DirectoryUtils.removeAtomically(file);
    } catch (IOException e) {
      logger.warning(format(" Could not remove %s: %s", file.getFileName(), e));
    }
  }
}
