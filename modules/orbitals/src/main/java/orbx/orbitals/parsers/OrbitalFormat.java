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

import java.io.File;
import java.util.Locale;
import orbx.orbitals.OrbitalFile;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.io.FilenameUtils;

/**
 * Supported orbital and grid file formats, in detection priority order.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public enum OrbitalFormat {
  HDF5("HDF5", "h5", "hdf5"),
  MOLDEN("Molden", "molden", "mld", "molf"),
  INPORB("InpOrb", "inporb", "orb"),
  LUSCUS("Luscus", "lus"),
  GRID("Grid", "grid"),
  CUBE("Cube", "cube", "cub");

  private final String formatName;
  private final String[] extensions;

  OrbitalFormat(String formatName, String... extensions) {
    this.formatName = formatName;
    this.extensions = extensions;
  }

  /**
   * Getter for the field <code>formatName</code>.
   *
   * @return the display name.
   */
  public String getFormatName() {
    return formatName;
  }

  /**
   * Returns true if the file name carries one of the extensions of this format. Molcas orbital
   * files are also recognized by names such as <code>x.ScfOrb</code> or <code>x.RasOrb.1</code>.
   *
   * @param file a file.
   * @return true if the extension matches.
   */
  public boolean acceptsExtension(File file) {
    String name = file.getName().toLowerCase(Locale.ROOT);
    String extension = FilenameUtils.getExtension(name);
    for (String e : extensions) {
      if (extension.equals(e)) {
        return true;
      }
    }
    if (this == INPORB) {
      return extension.endsWith("orb") || name.matches(".*orb\\.\\d+");
    }
    return false;
  }

  /**
   * Returns true if the content of the file looks like this format.
   *
   * @param file a file.
   * @return true if the content matches.
   */
  public boolean acceptDeep(File file) {
    if (file == null || file.isDirectory() || !file.canRead()) {
      return false;
    }
    switch (this) {
      case HDF5:
        return HDF5Filter.acceptDeep(file);
      case MOLDEN:
        return MoldenFilter.acceptDeep(file);
      case INPORB:
        return InpOrbFilter.acceptDeep(file);
      case LUSCUS:
        return LuscusFilter.acceptDeep(file);
      case GRID:
        return GridFilter.acceptDeep(file);
      case CUBE:
      default:
        return CubeFilter.acceptDeep(file);
    }
  }

  /**
   * Create a filter for a file.
   *
   * @param file the file.
   * @param companion an already loaded file supplying basis and symmetry, or null.
   * @param properties the configuration.
   * @return the filter.
   */
  public OrbitalFilter createFilter(File file, OrbitalFile companion,
      CompositeConfiguration properties) {
    switch (this) {
      case HDF5:
        return new HDF5Filter(file, properties);
      case MOLDEN:
        return new MoldenFilter(file, properties);
      case INPORB:
        return new InpOrbFilter(file, companion, properties);
      case LUSCUS:
        return new LuscusFilter(file, companion, properties);
      case GRID:
        return new GridFilter(file, companion, properties);
      case CUBE:
      default:
        return new CubeFilter(file, properties);
    }
  }
}
