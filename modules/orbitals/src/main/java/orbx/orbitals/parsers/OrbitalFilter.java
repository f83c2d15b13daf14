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
import java.util.logging.Logger;
import orbx.orbitals.OrbitalFile;
import orbx.orbitals.basis.Atom;
import orbx.orbitals.basis.Elements;
import orbx.orbitals.mo.OrbitalSet;
import orbx.utilities.OrbXProperties;
import org.apache.commons.configuration2.CompositeConfiguration;

/**
 * The OrbitalFilter class is the base class for readers of orbital and grid files.
 *
 * <p>A filter reads one file into an {@link OrbitalFile}. Malformed content raises a {@link
 * ParseException}; a filter never returns a partial model.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public abstract class OrbitalFilter {

  private static final Logger logger = Logger.getLogger(OrbitalFilter.class.getName());

  /** The file being read. */
  protected final File file;
  /** The format of the file. */
  protected final OrbitalFormat orbitalFormat;
  /** An already loaded file that supplies the basis set, or null. */
  protected final OrbitalFile companion;
  /** The configuration. */
  protected final CompositeConfiguration properties;

  /**
   * Constructor for OrbitalFilter.
   *
   * @param file the file to read.
   * @param orbitalFormat the format.
   * @param companion a file supplying basis and symmetry, or null.
   * @param properties the configuration.
   */
  protected OrbitalFilter(File file, OrbitalFormat orbitalFormat, OrbitalFile companion,
      CompositeConfiguration properties) {
    this.file = file;
    this.orbitalFormat = orbitalFormat;
    this.companion = companion;
    this.properties = properties == null ? new CompositeConfiguration() : properties;
  }

  /**
   * Read the file.
   *
   * @return the parsed file.
   * @throws ParseException if the content is malformed or unsupported.
   */
  public abstract OrbitalFile readFile() throws ParseException;

  /**
   * Getter for the field <code>orbitalFormat</code>.
   *
   * @return the format.
   */
  public OrbitalFormat getOrbitalFormat() {
    return orbitalFormat;
  }

  /**
   * Getter for the field <code>file</code>.
   *
   * @return the file.
   */
  public File getFile() {
    return file;
  }

  /**
   * Build a ParseException for this format.
   *
   * @param lineNumber the 1-based line number, or -1.
   * @param reason the problem.
   * @return the exception.
   */
  protected ParseException error(int lineNumber, String reason) {
    return new ParseException(orbitalFormat.getFormatName(), lineNumber, reason);
  }

  /**
   * Build a ParseException for this format.
   *
   * @param lineNumber the 1-based line number, or -1.
   * @param reason the problem.
   * @param cause the underlying exception.
   * @return the exception.
   */
  protected ParseException error(int lineNumber, String reason, Throwable cause) {
    return new ParseException(orbitalFormat.getFormatName(), lineNumber, reason, cause);
  }

  /**
   * Create an atom after checking its atomic number against the configured range.
   *
   * @param name the label.
   * @param atomicNumber the atomic number.
   * @param xyz the position in Bohr.
   * @param lineNumber the line the atom was read from, or -1.
   * @return the atom.
   * @throws ParseException if the atomic number is out of range.
   */
  protected Atom createAtom(String name, int atomicNumber, double[] xyz, int lineNumber)
      throws ParseException {
    int min = OrbXProperties.Key.ATOMIC_NUMBER_MIN.getInt(properties);
    int max = OrbXProperties.Key.ATOMIC_NUMBER_MAX.getInt(properties);
    if (atomicNumber < min || atomicNumber > max) {
      throw error(lineNumber, format("Atomic number %d of %s is outside [%d, %d].", atomicNumber,
          name, min, max));
    }
    boolean ghost = atomicNumber == 0;
    return new Atom(name, atomicNumber, xyz, true, ghost);
  }

  /**
   * Create an atom whose atomic number is derived from its label.
   *
   * @param name the label.
   * @param xyz the position in Bohr.
   * @param lineNumber the line the atom was read from, or -1.
   * @return the atom.
   * @throws ParseException if the atomic number is out of range.
   */
  protected Atom createAtom(String name, double[] xyz, int lineNumber) throws ParseException {
    return createAtom(name, Elements.atomicNumber(name), xyz, lineNumber);
  }

  /**
   * Tolerance for declared electron counts.
   *
   * @return the tolerance.
   */
  protected double electronTolerance() {
    return OrbXProperties.Key.ELECTRON_TOLERANCE.getDouble(properties);
  }

  /**
   * Log a summary of a parsed set.
   *
   * @param set the set.
   */
  protected void logSet(OrbitalSet set) {
    logger.fine(format(" %s: %s", file.getName(), set));
  }
}
