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

import io.jhdf.HdfFile;
import io.jhdf.WritableHdfFile;
import io.jhdf.api.Attribute;
import io.jhdf.api.Dataset;
import io.jhdf.api.Group;
import io.jhdf.api.Node;
import io.jhdf.api.WritableGroup;
import io.jhdf.api.WritableNode;
import io.jhdf.exceptions.HdfException;
import java.io.File;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import orbx.orbitals.mo.Orbital;
import orbx.orbitals.mo.OrbitalSet;
import orbx.orbitals.mo.Spin;
import orbx.orbitals.mo.Symmetry;

/**
 * The HDF5Writer class stores orbitals in a Molcas HDF5 file.
 *
 * <p>Every group, dataset and attribute of the source file is copied; only the <code>MO_*</code>
 * datasets of the written orbital sets are replaced. The result is written to a temporary file
 * in the target directory and then moved over the target, so the source and the target may be the
 * same file.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class HDF5Writer {

  private static final Logger logger = Logger.getLogger(HDF5Writer.class.getName());

  private static final String[] SUFFIXES = {"VECTORS", "ENERGIES", "OCCUPATIONS", "TYPEINDICES"};

  /**
   * Write orbital sets into a copy of a source file.
   *
   * @param source the HDF5 file providing everything except the orbitals.
   * @param target the destination, which may be the source.
   * @param sets the orbital sets: one set with spin NONE, or an alpha and a beta set.
   * @throws IOException if the source cannot be read, any of its content cannot be preserved,
   *     or the target cannot be written.
   * @throws IllegalArgumentException if a set does not hold one orbital per basis function.
   */
  public void write(File source, File target, List<OrbitalSet> sets) throws IOException {
    Map<String, Object> replacements = new LinkedHashMap<>();
    for (OrbitalSet set : sets) {
      replacements.putAll(datasets(set));
    }
    try (FileReplacement replacement = new FileReplacement(target)) {
      try (HdfFile in = new HdfFile(source.toPath());
          WritableHdfFile out = HdfFile.write(replacement.getTemporary())) {
        copyAttributes(in, out, "/");
        copyChildren(in, out, replacements, "/");
        for (Map.Entry<String, Object> entry : replacements.entrySet()) {
          out.putDataset(entry.getKey(), entry.getValue());
        }
      } catch (HdfException | IllegalArgumentException | UnsupportedOperationException e) {
        throw new IOException(format(" Unable to copy %s: %s", source.getName(), e.getMessage()),
            e);
      }
      replacement.commit();
    }
    logger.info(format(" Wrote %d orbital set(s) to %s.", sets.size(), target.getName()));
  }

  /**
   * Dataset names of a set.
   *
   * @param spin the spin of the set.
   * @return the prefix of its datasets.
   */
  static String prefix(Spin spin) {
    switch (spin) {
      case ALPHA:
        return "MO_ALPHA_";
      case BETA:
        return "MO_BETA_";
      default:
        return "MO_";
    }
  }

  /** The four orbital datasets of one set, in the blocked layout of the file. */
  private static Map<String, Object> datasets(OrbitalSet set) {
    Symmetry symmetry = set.getSymmetry();
    int nSym = symmetry.getIrrepCount();
    int total = symmetry.getTotalBasis();
    int[] perIrrep = set.getOrbitalsPerIrrep();
    int squares = 0;
    for (int irrep = 0; irrep < nSym; irrep++) {
      int nb = symmetry.getBasisCount(irrep);
      if (perIrrep[irrep] != nb) {
        throw new IllegalArgumentException(format(" %s has %d orbitals in irrep %d, the file"
            + " needs %d.", set.getName(), perIrrep[irrep], irrep + 1, nb));
      }
      squares += nb * nb;
    }
    double[] vectors = new double[squares];
    double[] energies = new double[total];
    double[] occupations = new double[total];
    String[] types = new String[total];
    int v = 0;
    int o = 0;
    for (int irrep = 0; irrep < nSym; irrep++) {
      int nb = symmetry.getBasisCount(irrep);
      int offset = symmetry.getOffset(irrep);
      for (Orbital orbital : set.getOrbitals()) {
        if (orbital.getIrrep() != irrep) {
          continue;
        }
        if (!orbital.hasCoefficients()) {
          throw new IllegalArgumentException(format(" %s has no coefficients.", orbital));
        }
        System.arraycopy(orbital.getCoefficients(), offset, vectors, v, nb);
        v += nb;
        energies[o] = orbital.getEnergy();
        occupations[o] = orbital.getOccupation();
        types[o] = String.valueOf(orbital.getType().getCode());
        o++;
      }
    }
    String prefix = prefix(set.getSpin());
    Map<String, Object> map = new LinkedHashMap<>();
    map.put(prefix + SUFFIXES[0], vectors);
    map.put(prefix + SUFFIXES[1], energies);
    map.put(prefix + SUFFIXES[2], occupations);
    map.put(prefix + SUFFIXES[3], types);
    return map;
  }

  private static void copyChildren(Group in, WritableGroup out, Map<String, Object> replaced,
      String path) throws IOException {
    for (Map.Entry<String, Node> entry : in.getChildren().entrySet()) {
      String name = entry.getKey();
      Node node = entry.getValue();
      String childPath = path + name;
      if (node.isLink()) {
        throw new IOException(format(" Unable to preserve link %s.", childPath));
      }
      if (node instanceof Dataset) {
        if ("/".equals(path) && replaced.containsKey(name)) {
          continue;
        }
        Dataset dataset = (Dataset) node;
        if (dataset.isCompound() || dataset.isEmpty()) {
          throw new IOException(format(" Unable to preserve dataset %s.", childPath));
        }
        WritableNode copy = out.putDataset(name, dataset.getData());
        copyAttributes(dataset, copy, childPath);
      } else if (node instanceof Group) {
        WritableGroup group = out.putGroup(name);
        copyAttributes(node, group, childPath);
        copyChildren((Group) node, group, replaced, childPath + "/");
      } else {
        throw new IOException(format(" Unable to preserve %s.", childPath));
      }
    }
  }

  private static void copyAttributes(Node in, WritableNode out, String path) throws IOException {
    for (Map.Entry<String, Attribute> entry : in.getAttributes().entrySet()) {
      Attribute attribute = entry.getValue();
      if (attribute.isEmpty()) {
        throw new IOException(format(" Unable to preserve attribute %s of %s.", entry.getKey(),
            path));
      }
      out.putAttribute(entry.getKey(), attribute.getData());
    }
  }
}
