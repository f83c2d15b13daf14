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

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;
import orbx.lattice.GridSpec;
import orbx.lattice.ScalarField;
import orbx.orbitals.basis.Atom;
import orbx.orbitals.basis.Molecule;

/**
 * The CubeWriter class writes scalar fields in the Gaussian cube format. Several fields on the same
 * grid are written to one file with an orbital list and values nested x:y:z:field.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class CubeWriter {

  private static final Logger logger = Logger.getLogger(CubeWriter.class.getName());

  private final String source;

  /**
   * Constructor for CubeWriter.
   *
   * @param source the name of the file the fields were derived from.
   */
  public CubeWriter(String source) {
    this.source = source;
  }

  /**
   * Write one or more fields.
   *
   * @param file the destination.
   * @param molecule the atoms to list, or null.
   * @param fields the fields, all on the same grid.
   * @param ids identifiers of the fields for the orbital list; ignored for a single field.
   * @throws IOException if the file cannot be written.
   * @throws IllegalArgumentException if the fields do not share a grid.
   */
  public void write(File file, Molecule molecule, List<ScalarField> fields, int[] ids)
      throws IOException {
    if (fields.isEmpty()) {
      throw new IllegalArgumentException(" No fields to write.");
    }
    GridSpec gridSpec = fields.get(0).getGridSpec();
    for (ScalarField field : fields) {
      if (!field.getGridSpec().equals(gridSpec)) {
        throw new IllegalArgumentException(format(" %s is not on the grid of %s.",
            field.getLabel(), fields.get(0).getLabel()));
      }
    }
    int nFields = fields.size();
    if (nFields > 1 && (ids == null || ids.length != nFields)) {
      throw new IllegalArgumentException(format(" %d fields need %d identifiers.", nFields,
          nFields));
    }
    List<Atom> atoms = molecule == null ? List.of() : molecule.getAtoms();
    try (FileReplacement replacement = new FileReplacement(file)) {
      try (BufferedWriter bw = Files.newBufferedWriter(replacement.getTemporary(),
          StandardCharsets.US_ASCII)) {
        bw.write(format(Locale.ROOT, "File generated by orbx from %s\n", source));
        bw.write(fields.get(0).getLabel() + "\n");
        double[] origin = gridSpec.getOrigin();
        int nAtoms = nFields > 1 ? -atoms.size() : atoms.size();
        bw.write(format(Locale.ROOT, "%5d %11.6f %11.6f %11.6f\n", nAtoms, origin[0], origin[1],
            origin[2]));
        for (int axis = 0; axis < 3; axis++) {
          double[] step = gridSpec.getStep(axis);
          bw.write(format(Locale.ROOT, "%5d %11.6f %11.6f %11.6f\n", gridSpec.getCount(axis),
              step[0], step[1], step[2]));
        }
        for (Atom atom : atoms) {
          double[] xyz = atom.getXYZ();
          bw.write(format(Locale.ROOT, "%5d %11.6f %11.6f %11.6f %11.6f\n", atom.getAtomicNumber(),
              (double) atom.getAtomicNumber(), xyz[0], xyz[1], xyz[2]));
        }
        if (nFields > 1) {
          StringBuilder sb = new StringBuilder(format(Locale.ROOT, "%5d", nFields));
          for (int id : ids) {
            sb.append(format(Locale.ROOT, "%5d", id));
          }
          bw.write(sb.append("\n").toString());
        }
        int n1 = gridSpec.getCount(0);
        int n2 = gridSpec.getCount(1);
        int n3 = gridSpec.getCount(2);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < n1; i++) {
          for (int j = 0; j < n2; j++) {
            sb.setLength(0);
            int written = 0;
            for (int k = 0; k < n3; k++) {
              for (ScalarField field : fields) {
                double value = field.get(i, j, k);
                // Undefined points are written as zero.
                sb.append(format(Locale.ROOT, "%13.5E", Double.isNaN(value) ? 0.0 : value));
                if (++written % 6 == 0) {
                  sb.append("\n");
                }
              }
            }
            if (written % 6 != 0) {
              sb.append("\n");
            }
            bw.write(sb.toString());
          }
        }
      }
      replacement.commit();
    }
    logger.info(format(" Wrote %d field(s) to %s.", nFields, file.getName()));
  }
}
