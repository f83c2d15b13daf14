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

/**
 * Library class containing unit conversions and numeric constants shared by the file formats.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Constants {

  /** Conversion from Bohr to Angstroms. <code>BOHR=0.52917720859</code> */
  public static final double BOHR = 0.52917720859;
  /**
   * Bohr radius in Angstroms used by Molden-like files (CODATA 2010). <code>
   * MOLDEN_BOHR=0.52917721092</code>
   */
  public static final double MOLDEN_BOHR = 0.52917721092;
  /**
   * Bohr radius in Angstroms used by Luscus files (CODATA 2014). <code>
   * LUSCUS_BOHR=0.52917721067</code>
   */
  public static final double LUSCUS_BOHR = 0.52917721067;
  /** Machine epsilon for doubles. <code>EPSILON=2.220446049250313E-16</code> */
  public static final double EPSILON = Math.ulp(1.0);
  /** Magic bytes at the start of every HDF5 file. */
  public static final byte[] HDF5_SIGNATURE = {
      (byte) 0x89, 'H', 'D', 'F', '\r', '\n', 0x1a, '\n'
  };

  /** Private constructor to prevent instantiation. */
  private Constants() {
  }
}
