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
package orbx.orbitals.mo;

import static java.lang.String.format;

/**
 * A molecular orbital: symmetry adapted coefficients, an energy, an occupation and labels.
 *
 * <p>Unreadable numbers are stored as NaN and reported through the validity methods; they are never
 * replaced by zero. Orbitals read from precomputed grids carry no coefficients.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Orbital {

  private final double[] coefficients;
  private final double energy;
  private final double occupation;
  private final Spin spin;
  private final int irrep;
  private final String irrepLabel;
  private final int indexInIrrep;
  private final OrbitalType type;
  private final OrbitalKind kind;

  private Orbital(Builder builder) {
    this.coefficients = builder.coefficients;
    this.energy = builder.energy;
    this.occupation = builder.occupation;
    this.spin = builder.spin;
    this.irrep = builder.irrep;
    this.irrepLabel = builder.irrepLabel;
    this.indexInIrrep = builder.indexInIrrep;
    this.type = builder.type;
    this.kind = builder.kind;
  }

  /**
   * A builder initialized from this orbital.
   *
   * @return the builder.
   */
  public Builder toBuilder() {
    return new Builder()
        .coefficients(coefficients)
        .energy(energy)
        .occupation(occupation)
        .spin(spin)
        .irrep(irrep, irrepLabel)
        .indexInIrrep(indexInIrrep)
        .type(type)
        .kind(kind);
  }

  /**
   * Whether coefficients are available.
   *
   * @return false for orbitals known only from a precomputed grid.
   */
  public boolean hasCoefficients() {
    return coefficients != null;
  }

  /**
   * Whether coefficients are available and all of them were readable.
   *
   * @return true if the orbital can be evaluated.
   */
  public boolean hasValidCoefficients() {
    if (coefficients == null) {
      return false;
    }
    for (double c : coefficients) {
      if (!Double.isFinite(c)) {
        return false;
      }
    }
    return true;
  }

  /**
   * The symmetry adapted coefficients.
   *
   * @return a copy of the coefficients, or null.
   */
  public double[] getCoefficients() {
    return coefficients == null ? null : coefficients.clone();
  }

  /**
   * A single coefficient.
   *
   * @param i basis function index.
   * @return the coefficient.
   */
  public double getCoefficient(int i) {
    return coefficients[i];
  }

  /**
   * The orbital energy in Hartree.
   *
   * @return the energy, NaN when invalid.
   */
  public double getEnergy() {
    return energy;
  }

  /**
   * Whether the energy was readable.
   *
   * @return true for a valid energy.
   */
  public boolean hasValidEnergy() {
    return Double.isFinite(energy);
  }

  /**
   * Getter for the field <code>occupation</code>.
   *
   * @return the occupation, NaN when invalid.
   */
  public double getOccupation() {
    return occupation;
  }

  /**
   * Whether the occupation was readable.
   *
   * @return true for a valid occupation.
   */
  public boolean hasValidOccupation() {
    return Double.isFinite(occupation);
  }

  /**
   * Getter for the field <code>spin</code>.
   *
   * @return the spin.
   */
  public Spin getSpin() {
    return spin;
  }

  /**
   * The 0-based irrep index.
   *
   * @return the irrep.
   */
  public int getIrrep() {
    return irrep;
  }

  /**
   * Getter for the field <code>irrepLabel</code>.
   *
   * @return the label, empty without symmetry information.
   */
  public String getIrrepLabel() {
    return irrepLabel;
  }

  /**
   * The 1-based index of the orbital within its irrep.
   *
   * @return the index.
   */
  public int getIndexInIrrep() {
    return indexInIrrep;
  }

  /**
   * Getter for the field <code>type</code>.
   *
   * @return the type.
   */
  public OrbitalType getType() {
    return type;
  }

  /**
   * Getter for the field <code>kind</code>.
   *
   * @return the kind tag.
   */
  public OrbitalKind getKind() {
    return kind;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    String e = hasValidEnergy() ? format("%12.6f", energy) : "     *******";
    return format("%4d %-4s %s %8.5f %c %s", indexInIrrep, irrepLabel, e, occupation,
        type.getCode(), spin == Spin.NONE ? "" : spin.toString().toLowerCase());
  }

  /** Builder for orbitals. */
  public static class Builder {

    private double[] coefficients;
    private double energy = Double.NaN;
    private double occupation = 0.0;
    private Spin spin = Spin.NONE;
    private int irrep = 0;
    private String irrepLabel = "";
    private int indexInIrrep = 1;
    private OrbitalType type = OrbitalType.UNKNOWN;
    private OrbitalKind kind = OrbitalKind.CANONICAL;

    /**
     * Set the coefficients. The array is not copied.
     *
     * @param coefficients symmetry adapted coefficients, or null.
     * @return this builder.
     */
    public Builder coefficients(double[] coefficients) {
      this.coefficients = coefficients;
      return this;
    }

    public Builder energy(double energy) {
      this.energy = energy;
      return this;
    }

    public Builder occupation(double occupation) {
      this.occupation = occupation;
      return this;
    }

    public Builder spin(Spin spin) {
      this.spin = spin;
      return this;
    }

    public Builder irrep(int irrep, String label) {
      this.irrep = irrep;
      this.irrepLabel = label;
      return this;
    }

    public Builder indexInIrrep(int indexInIrrep) {
      this.indexInIrrep = indexInIrrep;
      return this;
    }

    public Builder type(OrbitalType type) {
      this.type = type;
      return this;
    }

    public Builder kind(OrbitalKind kind) {
      this.kind = kind;
      return this;
    }

    public Orbital build() {
      return new Orbital(this);
    }
  }
}
