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
package orbx.orbitals;

/**
 * Thrown when a valid file lacks data needed by a requested operation, for example an orbital file
 * without the companion basis set needed to evaluate its orbitals. Missing data is never
 * fabricated.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class IncompleteDataException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Name of the file that would supply the missing data, or null. */
  public final String companion;

  /**
   * Constructor for IncompleteDataException.
   *
   * @param message a description of the missing data.
   */
  public IncompleteDataException(String message) {
    this(message, null);
  }

  /**
   * Constructor for IncompleteDataException.
   *
   * @param message a description of the missing data.
   * @param companion the file that would supply it.
   */
  public IncompleteDataException(String message, String companion) {
    super(message);
    this.companion = companion;
  }
}
