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
import java.io.FileNotFoundException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import orbx.orbitals.OrbitalFile;
import org.apache.commons.configuration2.CompositeConfiguration;

/**
 * The OrbitalFileOpener class detects the format of a file and reads it with the matching filter.
 *
 * <p>Formats whose content check passes are tried first, in priority order, followed by the
 * remaining formats whose extension matches. If a candidate fails to parse, the next one is tried.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class OrbitalFileOpener {

  private static final Logger logger = Logger.getLogger(OrbitalFileOpener.class.getName());

  private final CompositeConfiguration properties;

  /**
   * Constructor for OrbitalFileOpener.
   *
   * @param properties the configuration.
   */
  public OrbitalFileOpener(CompositeConfiguration properties) {
    this.properties = properties;
  }

  /**
   * Candidate formats for a file, in the order they will be tried.
   *
   * @param file the file.
   * @return the candidates; empty if nothing matches.
   */
  public static List<OrbitalFormat> candidates(File file) {
    List<OrbitalFormat> candidates = new ArrayList<>();
    for (OrbitalFormat orbitalFormat : OrbitalFormat.values()) {
      if (orbitalFormat.acceptDeep(file)) {
        candidates.add(orbitalFormat);
      }
    }
    for (OrbitalFormat orbitalFormat : OrbitalFormat.values()) {
      if (!candidates.contains(orbitalFormat) && orbitalFormat.acceptsExtension(file)) {
        candidates.add(orbitalFormat);
      }
    }
    return candidates;
  }

  /**
   * Open a file that does not need a companion.
   *
   * @param file the file.
   * @return the parsed file.
   * @throws FileNotFoundException if the file cannot be read.
   * @throws ParseException if no candidate format can read the file.
   */
  public OrbitalFile open(File file) throws FileNotFoundException, ParseException {
    return open(file, null);
  }

  /**
   * Open a file.
   *
   * @param file the file.
   * @param companion an already loaded file supplying basis and symmetry, or null.
   * @return the parsed file.
   * @throws FileNotFoundException if the file cannot be read.
   * @throws ParseException if no candidate format can read the file.
   */
  public OrbitalFile open(File file, OrbitalFile companion)
      throws FileNotFoundException, ParseException {
    if (file == null || !file.isFile() || !file.canRead()) {
      throw new FileNotFoundException(format(" %s is not a readable file.", file));
    }
    List<OrbitalFormat> candidates = candidates(file);
    if (candidates.isEmpty()) {
      throw new ParseException("Unknown", -1,
          format("The format of %s was not recognized.", file.getName()));
    }
    List<ParseException> failures = new ArrayList<>();
    for (OrbitalFormat candidate : candidates) {
      try {
        OrbitalFile orbitalFile = candidate.createFilter(file, companion, properties).readFile();
        logger.info(format(" Opened %s as %s.", file.getName(), candidate.getFormatName()));
        return orbitalFile;
      } catch (ParseException e) {
        logger.warning(format(" %s is not a valid %s file:%s", file.getName(),
            candidate.getFormatName(), e.getMessage()));
        failures.add(e);
      }
    }
    ParseException last = failures.remove(failures.size() - 1);
    for (ParseException e : failures) {
      last.addSuppressed(e);
    }
    throw last;
  }
}
