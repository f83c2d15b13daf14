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

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.logging.Logger;
import org.apache.commons.io.FileUtils;

/**
 * A temporary file next to a target that replaces the target on {@link #commit()}. Closing an
 * uncommitted replacement deletes the temporary file and leaves the target untouched.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
final class FileReplacement implements Closeable {

  private static final Logger logger = Logger.getLogger(FileReplacement.class.getName());

  private final Path target;
  private final Path temporary;
  private boolean committed = false;

  /**
   * Create the temporary file in the directory of the target.
   *
   * @param target the file to replace.
   * @throws IOException if the temporary file cannot be created.
   */
  FileReplacement(File target) throws IOException {
    this.target = target.getAbsoluteFile().toPath();
    temporary = Files.createTempFile(this.target.getParent(), target.getName() + ".", ".tmp");
  }

  Path getTemporary() {
    return temporary;
  }

  /**
   * Move the temporary file over the target.
   *
   * @throws IOException if the move fails.
   */
  void commit() throws IOException {
    try {
      Files.move(temporary, target, StandardCopyOption.REPLACE_EXISTING,
          StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException e) {
      logger.warning(format(" Atomic move to %s is not supported; replacing it directly.",
          target.getFileName()));
      Files.move(temporary, target, StandardCopyOption.REPLACE_EXISTING);
    }
    committed = true;
  }

  @Override
  public void close() {
    if (!committed) {
      FileUtils.deleteQuietly(temporary.toFile());
    }
  }
}
