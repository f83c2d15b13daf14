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
package orbx.utilities;

import static java.lang.String.format;

import java.io.File;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.io.FileUtils;

/**
 * Utilities for removing files and directory trees without leaving partial state behind.
 *
 * <p>A path is first renamed to a tombstone in the same parent directory, which is atomic on a
 * single file system. Only then is the tombstone deleted. If deletion fails (for example because a
 * network file system still holds a handle to a file), the tombstone is left in place and removed
 * later by {@link #purgeTombstones(Path)}. The original name is free as soon as the rename returns.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class DirectoryUtils {

  private static final Logger logger = Logger.getLogger(DirectoryUtils.class.getName());

  /** Suffix marking a path that is scheduled for deletion. */
  public static final String TOMBSTONE = ".orbx-deleted";

  /** Private constructor to prevent instantiation. */
  private DirectoryUtils() {
  }

  /**
   * Delete a directory tree.
   *
   * @param path the root of the tree.
   * @throws IOException if the tree could not be deleted.
   */
  public static void deleteDirectoryTree(Path path) throws IOException {
    FileUtils.deleteDirectory(path.toFile());
  }

  /**
   * Atomically remove a file or directory.
   *
   * @param path the path to remove.
   * @return true if the tombstone was fully deleted, false if it was left for a later purge.
   * @throws IOException if the path could not be renamed out of the way.
   */
  public static boolean removeAtomically(Path path) throws IOException {
    if (!Files.exists(path)) {
      return true;
    }
    Path tombstone = path.resolveSibling(
        path.getFileName() + "." + UUID.randomUUID() + TOMBSTONE);
    try {
      Files.move(path, tombstone, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException e) {
      throw new IOException(format(" Atomic removal of %s is not supported.", path), e);
    }
    return deleteTombstone(tombstone);
  }

  /**
   * Delete all tombstones left in a directory by earlier calls to {@link #removeAtomically(Path)}.
   *
   * @param directory the directory to scan.
   * @return the number of tombstones removed.
   */
  public static int purgeTombstones(Path directory) {
    if (!Files.isDirectory(directory)) {
      return 0;
    }
    int count = 0;
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + TOMBSTONE)) {
      for (Path tombstone : stream) {
        if (deleteTombstone(tombstone)) {
          count++;
        }
      }
    } catch (IOException e) {
      logger.log(Level.WARNING, format(" Could not scan %s for stale entries.", directory), e);
    }
    return count;
  }

  private static boolean deleteTombstone(Path tombstone) {
    File file = tombstone.toFile();
    try {
      if (file.isDirectory()) {
        FileUtils.deleteDirectory(file);
      } else {
        Files.deleteIfExists(tombstone);
      }
      return true;
    } catch (IOException e) {
      logger.warning(format(" %s is still in use and will be removed later: %s", tombstone, e));
      return false;
    }
  }
}
