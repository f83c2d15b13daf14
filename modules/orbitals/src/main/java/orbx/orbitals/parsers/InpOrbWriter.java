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

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;
import orbx.orbitals.mo.Orbital;
import orbx.orbitals.mo.OrbitalSet;
import orbx.orbitals.mo.OrbitalType;
import orbx.orbitals.mo.Symmetry;

/**
 * The InpOrbWriter class writes orbitals in the InpOrb 2.2 format.
 *
 * <p>Orbitals are written grouped by irrep, keeping their order within each irrep. An irrep may
 * hold fewer orbitals than basis functions, in which case NORB is smaller than NBAS and the index
 * covers only the written orbitals.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class InpOrbWriter {

  private static final Logger logger = Logger.getLogger(InpOrbWriter.class.getName());

  /** Version written to the <code>#INPORB</code> marker. */
  public static final String VERSION = "2.2";

  private static final String INDEX_HEADER = "* 1234567890";

  private final String source;

  /**
   * Constructor for InpOrbWriter.
   *
   * @param source the name of the file the orbitals came from, used in the title.
   */
  public InpOrbWriter(String source) {
    this.source = source;
  }

  /**
   * Write a complete InpOrb file.
   *
   * @param file the destination.
   * @param alpha the orbitals, or the alpha orbitals of an unrestricted calculation.
   * @param beta the beta orbitals, or null.
   * @throws IOException if the file cannot be written.
   * @throws IllegalArgumentException if orbitals lack coefficients, or alpha and beta do not pair.
   */
  public void write(File file, OrbitalSet alpha, OrbitalSet beta) throws IOException {
    Symmetry symmetry = alpha.getSymmetry();
    List<List<Orbital>> alphaBlocks = blocks(alpha);
    List<List<Orbital>> betaBlocks = beta == null ? null : blocks(beta);
    List<String> index = index(alphaBlocks, betaBlocks);
    int nSym = symmetry.getIrrepCount();
    int[] norb = new int[nSym];
    for (int irrep = 0; irrep < nSym; irrep++) {
      norb[irrep] = alphaBlocks.get(irrep).size();
    }
    try (FileReplacement replacement = new FileReplacement(file)) {
      try (BufferedWriter bw = Files.newBufferedWriter(replacement.getTemporary(),
          StandardCharsets.US_ASCII)) {
        bw.write("#INPORB " + VERSION + "\n");
        bw.write("#INFO\n");
        bw.write(title() + "\n");
        bw.write(format(Locale.ROOT, "%8d%8d%8d\n", beta == null ? 0 : 1, nSym, 0));
        writeInts(bw, symmetry.getBasisCounts());
        writeInts(bw, norb);
        writeCoefficients(bw, "#ORB", alphaBlocks, symmetry);
        if (betaBlocks != null) {
          writeCoefficients(bw, "#UORB", betaBlocks, symmetry);
        }
        writeValues(bw, "#OCC", "* OCCUPATION NUMBERS", alphaBlocks, true, 10, "%11.4E", 11);
        if (betaBlocks != null) {
          writeValues(bw, "#UOCC", "* Beta OCCUPATION NUMBERS", betaBlocks, true, 10, "%11.4E", 11);
        }
        writeValues(bw, "#OCHR", "* OCCUPATION NUMBERS (HUMAN-READABLE)", alphaBlocks, true, 5,
            "%21.14E", 21);
        if (betaBlocks != null) {
          writeValues(bw, "#UOCHR", "* Beta OCCUPATION NUMBERS (HUMAN-READABLE)", betaBlocks, true,
              5, "%21.14E", 21);
        }
        writeValues(bw, "#ONE", "* ONE ELECTRON ENERGIES", alphaBlocks, false, 10, "%11.4E", 11);
        if (betaBlocks != null) {
          writeValues(bw, "#UONE", "* Beta ONE ELECTRON ENERGIES", betaBlocks, false, 10, "%11.4E",
              11);
        }
        bw.write("#INDEX\n");
        for (String line : index) {
          bw.write(line + "\n");
        }
      }
      replacement.commit();
    }
    logger.info(format(" Wrote %d orbitals to %s.", alpha.size(), file.getName()));
  }

  /**
   * Copy an existing InpOrb section, replacing its title and its index.
   *
   * <p>Copying starts at the <code>#INPORB</code> line, so the source may also be a grid file with
   * an embedded section. The orbitals per irrep declared by the source must match the orbitals
   * being indexed.
   *
   * @param sourceFile the file holding the InpOrb section.
   * @param file the destination.
   * @param alpha the orbitals providing the types.
   * @param beta the beta orbitals, or null.
   * @throws IOException if the source has no InpOrb section or a file cannot be accessed.
   * @throws IllegalArgumentException if the orbital counts do not match the source.
   */
  public void patch(File sourceFile, File file, OrbitalSet alpha, OrbitalSet beta)
      throws IOException {
    List<List<Orbital>> alphaBlocks = blocks(alpha);
    List<List<Orbital>> betaBlocks = beta == null ? null : blocks(beta);
    List<String> index = index(alphaBlocks, betaBlocks);
    int[] norb = new int[alphaBlocks.size()];
    for (int irrep = 0; irrep < norb.length; irrep++) {
      norb[irrep] = alphaBlocks.get(irrep).size();
    }
    try (FileReplacement replacement = new FileReplacement(file)) {
      try (BufferedReader br = Files.newBufferedReader(sourceFile.toPath(),
          StandardCharsets.ISO_8859_1);
          BufferedWriter bw = Files.newBufferedWriter(replacement.getTemporary(),
              StandardCharsets.ISO_8859_1)) {
        String line = br.readLine();
        while (line != null && !line.trim().toUpperCase(Locale.ROOT).startsWith("#INPORB")) {
          line = br.readLine();
        }
        if (line == null) {
          throw new IOException(format(" %s has no #INPORB section.", sourceFile.getName()));
        }
        boolean indexed = false;
        while (line != null) {
          String upper = line.trim().toUpperCase(Locale.ROOT);
          bw.write(line + "\n");
          if (upper.startsWith("#INDEX")) {
            indexed = true;
            break;
          }
          if (upper.startsWith("#INFO")) {
            String oldTitle = br.readLine();
            if (oldTitle != null && !oldTitle.startsWith("*")) {
              throw new IOException(format(" %s has no title after #INFO.", sourceFile.getName()));
            }
            bw.write(title() + "\n");
            for (int i = 0; i < 3; i++) {
              line = br.readLine();
              if (line == null) {
                throw new IOException(format(" Incomplete #INFO section in %s.",
                    sourceFile.getName()));
              }
              bw.write(line + "\n");
            }
            int[] declared = Arrays.stream(line.trim().split("\\s+")).mapToInt(Integer::parseInt)
                .toArray();
            if (!Arrays.equals(declared, norb)) {
              throw new IllegalArgumentException(format(" Wrong number of orbitals: %s declares %s,"
                  + " the index needs %s.", sourceFile.getName(), Arrays.toString(declared),
                  Arrays.toString(norb)));
            }
          }
          line = br.readLine();
        }
        if (!indexed) {
          bw.write("#INDEX\n");
        }
        for (String indexLine : index) {
          bw.write(indexLine + "\n");
        }
      }
      replacement.commit();
    }
    logger.info(format(" Patched %s into %s.", sourceFile.getName(), file.getName()));
  }

  /**
   * Build the index section for a set of orbitals.
   *
   * @param alpha the orbitals.
   * @param beta the beta orbitals, or null.
   * @return the index lines, without the <code>#INDEX</code> marker.
   * @throws IllegalArgumentException if alpha and beta types or counts do not match.
   */
  public static List<String> index(OrbitalSet alpha, OrbitalSet beta) {
    return index(blocks(alpha), beta == null ? null : blocks(beta));
  }

  private static List<String> index(List<List<Orbital>> alpha, List<List<Orbital>> beta) {
    List<String> lines = new ArrayList<>();
    for (int irrep = 0; irrep < alpha.size(); irrep++) {
      List<Orbital> a = alpha.get(irrep);
      List<Orbital> b = beta == null ? null : beta.get(irrep);
      if (b != null && b.size() != a.size()) {
        throw new IllegalArgumentException(format(" Irrep %d has %d alpha and %d beta orbitals.",
            irrep + 1, a.size(), b.size()));
      }
      StringBuilder types = new StringBuilder();
      for (int k = 0; k < a.size(); k++) {
        OrbitalType type = a.get(k).getType();
        if (b != null) {
          type = OrbitalType.merge(type, b.get(k).getType());
        }
        types.append(Character.toLowerCase(type.getCode()));
      }
      lines.add(INDEX_HEADER);
      for (int start = 0, j = 0; start < types.length(); start += 10, j++) {
        lines.add(format(Locale.ROOT, "%d %s", j % 10, types.substring(start,
            Math.min(start + 10, types.length()))));
      }
    }
    return lines;
  }

  /** Orbitals grouped by irrep, in set order within each irrep. */
  private static List<List<Orbital>> blocks(OrbitalSet set) {
    Symmetry symmetry = set.getSymmetry();
    List<List<Orbital>> blocks = new ArrayList<>();
    for (int irrep = 0; irrep < symmetry.getIrrepCount(); irrep++) {
      blocks.add(new ArrayList<>());
    }
    for (Orbital orbital : set.getOrbitals()) {
      int irrep = orbital.getIrrep();
      if (irrep < 0 || irrep >= blocks.size()) {
        throw new IllegalArgumentException(format(" %s has no irrep in %s.", orbital,
            set.getName()));
      }
      blocks.get(irrep).add(orbital);
    }
    for (int irrep = 0; irrep < blocks.size(); irrep++) {
      if (blocks.get(irrep).size() > symmetry.getBasisCount(irrep)) {
        throw new IllegalArgumentException(format(" Irrep %d has %d orbitals for %d basis"
            + " functions.", irrep + 1, blocks.get(irrep).size(), symmetry.getBasisCount(irrep)));
      }
    }
    return blocks;
  }

  private String title() {
    return format(Locale.ROOT, "* File generated by orbx from %s", source);
  }

  private static void writeInts(BufferedWriter bw, int[] values) throws IOException {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < values.length; i++) {
      sb.append(format(Locale.ROOT, "%8d", values[i]));
      if ((i + 1) % 8 == 0 || i == values.length - 1) {
        sb.append("\n");
      }
    }
    bw.write(sb.toString());
  }

  private static void writeCoefficients(BufferedWriter bw, String section,
      List<List<Orbital>> blocks, Symmetry symmetry) throws IOException {
    bw.write(section + "\n");
    for (int irrep = 0; irrep < blocks.size(); irrep++) {
      int nb = symmetry.getBasisCount(irrep);
      int offset = symmetry.getOffset(irrep);
      List<Orbital> block = blocks.get(irrep);
      for (int k = 0; k < block.size(); k++) {
        Orbital orbital = block.get(k);
        if (!orbital.hasCoefficients()) {
          throw new IllegalArgumentException(format(" %s has no coefficients.", orbital));
        }
        bw.write(format(Locale.ROOT, "* ORBITAL%5d%5d\n", irrep + 1, k + 1));
        double[] c = orbital.getCoefficients();
        double[] values = Arrays.copyOfRange(c, offset, offset + nb);
        writeWrapped(bw, values, 5, "%21.14E", 21);
      }
    }
  }

  private static void writeValues(BufferedWriter bw, String section, String comment,
      List<List<Orbital>> blocks, boolean occupations, int perLine, String fmt, int width)
      throws IOException {
    bw.write(section + "\n");
    bw.write(comment + "\n");
    for (List<Orbital> block : blocks) {
      double[] values = new double[block.size()];
      for (int k = 0; k < values.length; k++) {
        values[k] = occupations ? block.get(k).getOccupation() : block.get(k).getEnergy();
      }
      writeWrapped(bw, values, perLine, fmt, width);
    }
  }

  /** Invalid values are written as a run of asterisks. */
  private static void writeWrapped(BufferedWriter bw, double[] values, int perLine, String fmt,
      int width) throws IOException {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < values.length; i++) {
      sb.append(' ');
      if (Double.isFinite(values[i])) {
        sb.append(format(Locale.ROOT, fmt, values[i]));
      } else {
        sb.append("*".repeat(width));
      }
      if ((i + 1) % perLine == 0 || i == values.length - 1) {
        sb.append('\n');
      }
    }
    bw.write(sb.toString());
  }
}
