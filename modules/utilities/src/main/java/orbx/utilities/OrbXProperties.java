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
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.SystemConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.io.FilenameUtils;

/**
 * The OrbXProperties class loads the layered configuration used by the parsers, the grid evaluator
 * and the cache, and names the keys it understands.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class OrbXProperties {

  private static final Logger logger = Logger.getLogger(OrbXProperties.class.getName());

  /** Configuration keys with their default values. */
  public enum Key {
    /** Coefficients with a smaller magnitude are skipped during grid evaluation. */
    COEFFICIENT_THRESHOLD("orbx.coefficient.threshold", Constants.EPSILON),
    /** Orbitals with a smaller absolute occupation do not contribute to densities. */
    OCCUPATION_THRESHOLD("orbx.occupation.threshold", 1.0e-10),
    /** Allowed difference between summed occupations and a declared electron count. */
    ELECTRON_TOLERANCE("orbx.electron.tolerance", 1.0e-4),
    /** Smallest valid atomic number; zero denotes a ghost centre. */
    ATOMIC_NUMBER_MIN("orbx.atomicNumber.min", 0),
    /** Largest valid atomic number. */
    ATOMIC_NUMBER_MAX("orbx.atomicNumber.max", 118),
    /** Maximum number of points per axis for the default grid. */
    GRID_POINTS("orbx.grid.points", 64),
    /** Clearance around the molecule for the default grid (Bohr). */
    GRID_CLEARANCE("orbx.grid.clearance", 4.0),
    /** Scratch directory for persisted fields. */
    SCRATCH_DIR("orbx.scratch.dir", System.getProperty("java.io.tmpdir")),
    /** Persist computed fields to the scratch directory. */
    CACHE_PERSIST("orbx.cache.persist", false);

    private final String key;
    private final Object defaultValue;

    Key(String key, Object defaultValue) {
      this.key = key;
      this.defaultValue = defaultValue;
    }

    /**
     * The property name.
     *
     * @return the property name.
     */
    public String key() {
      return key;
    }

    /**
     * Look up a double valued key.
     *
     * @param configuration the configuration.
     * @return the configured value or the default.
     */
    public double getDouble(Configuration configuration) {
      return configuration.getDouble(key, ((Number) defaultValue).doubleValue());
    }

    /**
     * Look up an integer valued key.
     *
     * @param configuration the configuration.
     * @return the configured value or the default.
     */
    public int getInt(Configuration configuration) {
      return configuration.getInt(key, ((Number) defaultValue).intValue());
    }

    /**
     * Look up a boolean valued key.
     *
     * @param configuration the configuration.
     * @return the configured value or the default.
     */
    public boolean getBoolean(Configuration configuration) {
      return configuration.getBoolean(key, (Boolean) defaultValue);
    }

    /**
     * Look up a string valued key.
     *
     * @param configuration the configuration.
     * @return the configured value or the default.
     */
    public String getString(Configuration configuration) {
      return configuration.getString(key, defaultValue.toString());
    }
  }

  /** Private constructor to prevent instantiation. */
  private OrbXProperties() {
  }

  /**
   * Load properties with the default search path and no file specific layer.
   *
   * @return the configuration.
   */
  public static CompositeConfiguration loadProperties() {
    return loadProperties(null);
  }

  /**
   * This method sets up configuration properties in the following precedence order:
   *
   * <p>1.) JVM system properties, e.g. -Dorbx.grid.points=80
   *
   * <p>2.) A file named basename.properties next to the input file.
   *
   * <p>3.) User specific properties in ~/.orbx/orbx.properties
   *
   * <p>4.) System wide properties in the file named by the ORBX_PROPERTIES environment variable.
   *
   * @param file the input file, or null.
   * @return the configuration.
   */
  public static CompositeConfiguration loadProperties(File file) {
    CompositeConfiguration properties = new CompositeConfiguration();

    // JVM system properties take precedence.
    PropertiesConfiguration systemConfiguration = new PropertiesConfiguration();
    systemConfiguration.append(new SystemConfiguration());
    systemConfiguration.setHeader("JVM system properties (i.e. command line -Dkey=value pairs).");
    properties.addConfiguration(systemConfiguration);

    // File specific options are 2nd.
    if (file != null) {
      String basename = FilenameUtils.removeExtension(file.getAbsolutePath());
      File propertyFile = new File(basename + ".properties");
      if (propertyFile.canRead()) {
        addFile(properties, propertyFile, "File properties");
        try {
          properties.addProperty("propertyFile", propertyFile.getCanonicalPath());
        } catch (IOException e) {
          logger.log(Level.INFO, " Error resolving {0}.", propertyFile);
        }
      }
    }

    // User specific options are 3rd.
    File userFile = new File(
        System.getProperty("user.home") + File.separator + ".orbx" + File.separator
            + "orbx.properties");
    if (userFile.canRead()) {
      addFile(properties, userFile, "OrbX user property file");
    }

    // System wide options are last.
    String filename = System.getenv("ORBX_PROPERTIES");
    if (filename != null) {
      File systemFile = new File(filename);
      if (systemFile.canRead()) {
        addFile(properties, systemFile, "OrbX system property file");
      }
    }

    if (logger.isLoggable(Level.FINE)) {
      StringBuilder sb = new StringBuilder(" Configuration:\n");
      for (Key key : Key.values()) {
        sb.append(format("  %-28s %s\n", key.key(), key.getString(properties)));
      }
      logger.fine(sb.toString());
    }
    return properties;
  }

  private static void addFile(CompositeConfiguration properties, File file, String header) {
    try {
      FileBasedConfigurationBuilder<PropertiesConfiguration> builder =
          new FileBasedConfigurationBuilder<>(PropertiesConfiguration.class)
              .configure(new Parameters().properties()
                  .setFile(file)
                  .setThrowExceptionOnMissing(true)
                  .setIncludesAllowed(false));
      PropertiesConfiguration configuration = builder.getConfiguration();
      configuration.setHeader(header + " (" + file.getPath() + ").");
      properties.addConfiguration(configuration);
    } catch (ConfigurationException e) {
      logger.log(Level.INFO, " Error loading {0}.", file);
    }
  }
}
