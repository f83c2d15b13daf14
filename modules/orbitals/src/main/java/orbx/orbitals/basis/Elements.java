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
package orbx.orbitals.basis;

import java.util.Locale;

/**
 * Element symbols indexed by atomic number.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class Elements {

  private static final String[] SYMBOLS = {
      "X", "H", "He", "Li", "Be", "B", "C", "N", "O", "F", "Ne", "Na", "Mg", "Al", "Si", "P", "S",
      "Cl", "Ar", "K", "Ca", "Sc", "Ti", "V", "Cr", "Mn", "Fe", "Co", "Ni", "Cu", "Zn", "Ga", "Ge",
      "As", "Se", "Br", "Kr", "Rb", "Sr", "Y", "Zr", "Nb", "Mo", "Tc", "Ru", "Rh", "Pd", "Ag", "Cd",
      "In", "Sn", "Sb", "Te", "I", "Xe", "Cs", "Ba", "La", "Ce", "Pr", "Nd", "Pm", "Sm", "Eu", "Gd",
      "Tb", "Dy", "Ho", "Er", "Tm", "Yb", "Lu", "Hf", "Ta", "W", "Re", "Os", "Ir", "Pt", "Au", "Hg",
      "Tl", "Pb", "Bi", "Po", "At", "Rn", "Fr", "Ra", "Ac", "Th", "Pa", "U", "Np", "Pu", "Am", "Cm",
      "Bk", "Cf", "Es", "Fm", "Md", "No", "Lr", "Rf", "Db", "Sg", "Bh", "Hs", "Mt", "Ds", "Rg",
      "Cn", "Nh", "Fl", "Mc", "Lv", "Ts", "Og"
  };

  /** Private constructor to prevent instantiation. */
  private Elements() {
  }

  /**
   * The symbol of an element.
   *
   * @param atomicNumber the atomic number.
   * @return the symbol, or "X" outside the periodic table.
   */
  public static String symbol(int atomicNumber) {
    if (atomicNumber < 1 || atomicNumber >= SYMBOLS.length) {
      return SYMBOLS[0];
    }
    return SYMBOLS[atomicNumber];
  }

  /**
   * Atomic number from an atom label such as "C12", "cl3" or "FE".
   *
   * <p>Leading letters are matched as a two letter symbol first, then as a one letter symbol.
   *
   * @param label the label.
   * @return the atomic number, or 0 if no element matches.
   */
  public static int atomicNumber(String label) {
    StringBuilder letters = new StringBuilder();
    for (char c : label.trim().toCharArray()) {
      if (!Character.isLetter(c) || letters.length() == 2) {
        break;
      }
      letters.append(c);
    }
    String s = letters.toString().toLowerCase(Locale.ROOT);
    for (int len = Math.min(2, s.length()); len > 0; len--) {
      String candidate = s.substring(0, len);
      for (int z = 1; z < SYMBOLS.length; z++) {
        if (SYMBOLS[z].toLowerCase(Locale.ROOT).equals(candidate)) {
          return z;
        }
      }
    }
    return 0;
  }
}
