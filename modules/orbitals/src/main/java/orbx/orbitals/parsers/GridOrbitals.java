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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import orbx.orbitals.mo.Orbital;
import orbx.orbitals.mo.OrbitalSet;
import orbx.orbitals.mo.OrbitalType;
import orbx.orbitals.mo.Symmetry;
import orbx.utilities.StringUtils;

/**
 * Orbitals described by the <code>GridName=</code> records of grid files. Orbitals are sorted by
 * irrep and index; the slot of each orbital records its position in the file.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
class GridOrbitals {

  /** Label of the irrep given to fields that are not orbitals. */
  static final String NO_IRREP = "z";

  private static final Pattern KEY_VALUE = Pattern.compile("([A-Za-z_0-9]+)\\s*=\\s*(\\S+)");

  private final List<Entry> entries = new ArrayList<>();
  private List<Entry> sorted;

  /**
   * Parse all <code>key=value</code> pairs of a header line.
   *
   * @param line the line.
   * @return keys in lower case, mapped to their values.
   */
  static Map<String, String> keyValues(String line) {
    Map<String, String> map = new LinkedHashMap<>();
    Matcher matcher = KEY_VALUE.matcher(line);
    while (matcher.find()) {
      map.put(matcher.group(1).toLowerCase(), matcher.group(2));
    }
    return map;
  }

  /**
   * Parse the numbers following a key such as <code>Origin=</code>.
   *
   * @param line the line.
   * @param count the number of values.
   * @return the values.
   * @throws NumberFormatException if the line holds fewer numbers.
   */
  static double[] values(String line, int count) {
    String rest = line.substring(line.indexOf('=') + 1).trim();
    String[] tokens = rest.split("\\s+");
    if (tokens.length < count) {
      throw new NumberFormatException(String.format(" Expected %d values in \"%s\".", count,
          line.trim()));
    }
    double[] values = new double[count];
    for (int i = 0; i < count; i++) {
      values[i] = StringUtils.parseFortranDouble(tokens[i]);
    }
    return values;
  }

  /**
   * Add an orbital described by a name record.
   *
   * @param matcher a matcher of the record whose groups are irrep, index, energy, occupation and
   *     type, or null if the record did not describe an orbital.
   * @param label the field label.
   */
  void add(Matcher matcher, String label) {
    Entry entry = new Entry();
    entry.slot = entries.size();
    entry.label = label;
    if (matcher != null) {
      entry.irrep = matcher.group(1).trim();
      entry.index = Integer.parseInt(matcher.group(2).trim());
      entry.energy = parse(matcher.group(3));
      entry.occupation = parse(matcher.group(4));
      entry.type = OrbitalType.fromCode(matcher.group(5).trim().charAt(0));
    }
    entries.add(entry);
    sorted = null;
  }

  /**
   * Add an orbital known only by its index.
   *
   * @param index the orbital index.
   * @param label the field label.
   */
  void add(int index, String label) {
    Entry entry = new Entry();
    entry.slot = entries.size();
    entry.label = label;
    entry.index = index;
    entries.add(entry);
    sorted = null;
  }

  private static double parse(String value) {
    try {
      return StringUtils.parseFortranDouble(value);
    } catch (NumberFormatException e) {
      return Double.NaN;
    }
  }

  private List<Entry> sorted() {
    if (sorted == null) {
      sorted = new ArrayList<>(entries);
      sorted.sort(Comparator.comparing((Entry e) -> e.irrep).thenComparingInt(e -> e.index));
    }
    return sorted;
  }

  int size() {
    return entries.size();
  }

  /**
   * File slots in sorted order.
   *
   * @return slot[i] is the file position of the orbital at position i.
   */
  int[] slots() {
    return sorted().stream().mapToInt(e -> e.slot).toArray();
  }

  /**
   * Field labels in sorted order.
   *
   * @return the labels.
   */
  String[] labels() {
    return sorted().stream().map(e -> e.label).toArray(String[]::new);
  }

  /**
   * Build the set of grid orbitals, which carry no coefficients.
   *
   * @param name the set name.
   * @return the set.
   */
  OrbitalSet build(String name) {
    List<String> irreps = new ArrayList<>();
    for (Entry e : sorted()) {
      if (!irreps.contains(e.irrep)) {
        irreps.add(e.irrep);
      }
    }
    Symmetry symmetry = new Symmetry(irreps.toArray(new String[0]), new int[irreps.size()], null);
    OrbitalSet.Builder builder = new OrbitalSet.Builder(name, symmetry);
    for (Entry e : sorted()) {
      builder.add(new Orbital.Builder()
          .energy(e.energy)
          .occupation(e.occupation)
          .type(e.type)
          .irrep(irreps.indexOf(e.irrep), e.irrep)
          .indexInIrrep(e.index)
          .build());
    }
    return builder.build();
  }

  /** One name record. */
  private static class Entry {

    int slot;
    String label;
    String irrep = NO_IRREP;
    int index = 0;
    double energy = Double.NaN;
    double occupation = 0.0;
    OrbitalType type = OrbitalType.UNKNOWN;
  }
}
