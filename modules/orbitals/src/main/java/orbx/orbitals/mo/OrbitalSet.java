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
import static org.apache.commons.math3.util.FastMath.abs;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.List;
import java.util.function.Predicate;
import orbx.orbitals.IncompleteDataException;

/**
 * The OrbitalSet class is a named collection of orbitals that share a context: one density kind,
 * one state (or pair of states for a transition), one spin channel and one symmetry.
 *
 * <p>Sets are immutable. Edits made for export go through an {@link Editor}, which produces a new
 * set with a new fingerprint.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class OrbitalSet {

  /** Role of a set within a pair of sets that together define a density. */
  public enum Role {
    DEFAULT, HOLE, PARTICLE
  }

  private final String name;
  private final DensityKind densityKind;
  private final int state;
  private final int targetState;
  private final Spin spin;
  private final Role role;
  private final List<Orbital> orbitals;
  private final Symmetry symmetry;
  private final Double electronCount;
  private volatile String fingerprint;

  private OrbitalSet(Builder builder) {
    this.name = builder.name;
    this.densityKind = builder.densityKind;
    this.state = builder.state;
    this.targetState = builder.targetState;
    this.spin = builder.spin;
    this.role = builder.role;
    this.orbitals = List.copyOf(builder.orbitals);
    this.symmetry = builder.symmetry;
    this.electronCount = builder.electronCount;
    for (Orbital orbital : orbitals) {
      if (orbital.hasCoefficients()
          && orbital.getCoefficients().length != symmetry.getTotalBasis()) {
        throw new IllegalArgumentException(format(
            " Orbital %d of %s has %d coefficients for %d basis functions.",
            orbital.getIndexInIrrep(), name, orbital.getCoefficients().length,
            symmetry.getTotalBasis()));
      }
    }
    if (electronCount != null) {
      double sum = getOccupationSum();
      if (abs(sum - electronCount) > builder.tolerance) {
        throw new IllegalArgumentException(format(
            " Occupations of %s sum to %.6f, but %.6f electrons were declared.", name, sum,
            electronCount));
      }
    }
  }

  /**
   * Getter for the field <code>name</code>.
   *
   * @return the name.
   */
  public String getName() {
    return name;
  }

  /**
   * Getter for the field <code>densityKind</code>.
   *
   * @return the density kind.
   */
  public DensityKind getDensityKind() {
    return densityKind;
  }

  /**
   * The 0-based state (root) index.
   *
   * @return the state.
   */
  public int getState() {
    return state;
  }

  /**
   * The second state of a transition.
   *
   * @return the target state, or -1.
   */
  public int getTargetState() {
    return targetState;
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
   * Getter for the field <code>role</code>.
   *
   * @return the role.
   */
  public Role getRole() {
    return role;
  }

  /**
   * Getter for the field <code>orbitals</code>.
   *
   * @return an unmodifiable list of orbitals.
   */
  public List<Orbital> getOrbitals() {
    return Collections.unmodifiableList(orbitals);
  }

  /**
   * The orbital at an index.
   *
   * @param index 0-based position in the set.
   * @return the orbital.
   */
  public Orbital getOrbital(int index) {
    return orbitals.get(index);
  }

  /**
   * The number of orbitals.
   *
   * @return the size.
   */
  public int size() {
    return orbitals.size();
  }

  /**
   * Getter for the field <code>symmetry</code>.
   *
   * @return the symmetry.
   */
  public Symmetry getSymmetry() {
    return symmetry;
  }

  /**
   * The declared number of electrons.
   *
   * @return the count, or null if none was declared.
   */
  public Double getElectronCount() {
    return electronCount;
  }

  /**
   * Sum of the valid occupations.
   *
   * @return the sum.
   */
  public double getOccupationSum() {
    double sum = 0.0;
    for (Orbital orbital : orbitals) {
      if (orbital.hasValidOccupation()) {
        sum += orbital.getOccupation();
      }
    }
    return sum;
  }

  /**
   * Number of orbitals in each irrep.
   *
   * @return the counts.
   */
  public int[] getOrbitalsPerIrrep() {
    int[] counts = new int[symmetry.getIrrepCount()];
    for (Orbital orbital : orbitals) {
      counts[orbital.getIrrep()]++;
    }
    return counts;
  }

  /**
   * AO coefficients of an orbital, i.e. its coefficients transformed by the desymmetrization
   * matrix.
   *
   * @param index 0-based position in the set.
   * @return the AO coefficients.
   * @throws IncompleteDataException if the orbital has no readable coefficients.
   */
  public double[] getAOCoefficients(int index) {
    Orbital orbital = orbitals.get(index);
    if (!orbital.hasValidCoefficients()) {
      throw new IncompleteDataException(format(" Orbital %d of %s has no readable coefficients.",
          index + 1, name));
    }
    return symmetry.toAO(orbital.getCoefficients());
  }

  /**
   * Orbitals sorted by {@link OrbitalOrdering#OCCUPATION_THEN_ENERGY}.
   *
   * @return a new sorted list.
   */
  public List<Orbital> sortedByOccupationAndEnergy() {
    List<Orbital> sorted = new ArrayList<>(orbitals);
    sorted.sort(OrbitalOrdering.OCCUPATION_THEN_ENERGY);
    return sorted;
  }

  /**
   * A SHA-256 digest of the content of this set. Sets with equal content share a fingerprint, so
   * the fingerprint identifies derived fields across sessions.
   *
   * @return a hexadecimal digest.
   */
  public String getFingerprint() {
    String f = fingerprint;
    if (f == null) {
      MessageDigest digest;
      try {
        digest = MessageDigest.getInstance("SHA-256");
      } catch (NoSuchAlgorithmException e) {
        throw new IllegalStateException(e);
      }
      digest.update(format("%s|%s|%d|%d|%s|%s", name, densityKind, state, targetState, spin, role)
          .getBytes(StandardCharsets.UTF_8));
      for (int b : symmetry.getBasisCounts()) {
        digest.update(ByteBuffer.allocate(4).putInt(b).array());
      }
      for (Orbital orbital : orbitals) {
        ByteBuffer buffer = ByteBuffer.allocate(8 * (orbital.hasCoefficients()
            ? orbital.getCoefficients().length + 2 : 2) + 8);
        buffer.putDouble(orbital.getOccupation());
        buffer.putDouble(orbital.getEnergy());
        buffer.putInt(orbital.getIrrep());
        buffer.putChar(orbital.getType().getCode());
        buffer.putChar((char) orbital.getSpin().ordinal());
        if (orbital.hasCoefficients()) {
          for (double c : orbital.getCoefficients()) {
            buffer.putDouble(c);
          }
        }
        digest.update(buffer.array());
      }
      f = HexFormat.of().formatHex(digest.digest());
      fingerprint = f;
    }
    return f;
  }

  /**
   * A builder initialized with the metadata of this set but no orbitals.
   *
   * @return the builder.
   */
  public Builder toBuilder() {
    return new Builder(name, symmetry)
        .densityKind(densityKind)
        .state(state)
        .targetState(targetState)
        .spin(spin)
        .role(role)
        .electronCount(electronCount);
  }

  /**
   * Start editing a copy of this set.
   *
   * @return an editor.
   */
  public Editor edit() {
    return new Editor(this);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format(" %s (%s, state %d, %s): %d orbitals", name, densityKind, state, spin,
        orbitals.size());
  }

  /** Builder for orbital sets. */
  public static class Builder {

    private final String name;
    private final Symmetry symmetry;
    private final List<Orbital> orbitals = new ArrayList<>();
    private DensityKind densityKind = DensityKind.STATE;
    private int state = 0;
    private int targetState = -1;
    private Spin spin = Spin.NONE;
    private Role role = Role.DEFAULT;
    private Double electronCount;
    private double tolerance = 1.0e-4;

    /**
     * Constructor for Builder.
     *
     * @param name the set name.
     * @param symmetry the symmetry of the coefficients.
     */
    public Builder(String name, Symmetry symmetry) {
      this.name = name;
      this.symmetry = symmetry;
    }

    public Builder densityKind(DensityKind densityKind) {
      this.densityKind = densityKind;
      return this;
    }

    public Builder state(int state) {
      this.state = state;
      return this;
    }

    public Builder targetState(int targetState) {
      this.targetState = targetState;
      return this;
    }

    public Builder spin(Spin spin) {
      this.spin = spin;
      return this;
    }

    public Builder role(Role role) {
      this.role = role;
      return this;
    }

    /**
     * Declare the number of electrons the occupations must sum to.
     *
     * @param electronCount the count, or null.
     * @return this builder.
     */
    public Builder electronCount(Double electronCount) {
      this.electronCount = electronCount;
      return this;
    }

    /**
     * Tolerance for the declared electron count.
     *
     * @param tolerance the tolerance.
     * @return this builder.
     */
    public Builder tolerance(double tolerance) {
      this.tolerance = tolerance;
      return this;
    }

    public Builder add(Orbital orbital) {
      orbitals.add(orbital);
      return this;
    }

    public Builder addAll(List<Orbital> orbitals) {
      this.orbitals.addAll(orbitals);
      return this;
    }

    /**
     * Build the set.
     *
     * @return the set.
     * @throws IllegalArgumentException if coefficient lengths or the electron count do not match.
     */
    public OrbitalSet build() {
      return new OrbitalSet(this);
    }
  }

  /**
   * Editor producing a reordered, filtered or retyped copy of a set.
   */
  public static class Editor {

    private final OrbitalSet source;
    private final List<Orbital> orbitals;

    private Editor(OrbitalSet source) {
      this.source = source;
      this.orbitals = new ArrayList<>(source.orbitals);
    }

    /**
     * Reorder the orbitals.
     *
     * @param order order[i] is the current position of the orbital that moves to position i.
     * @return this editor.
     */
    public Editor reorder(int[] order) {
      if (order.length != orbitals.size()) {
        throw new IllegalArgumentException(format(" Order has %d entries for %d orbitals.",
            order.length, orbitals.size()));
      }
      boolean[] seen = new boolean[order.length];
      List<Orbital> reordered = new ArrayList<>(orbitals.size());
      for (int i : order) {
        if (seen[i]) {
          throw new IllegalArgumentException(format(" Orbital %d appears twice.", i + 1));
        }
        seen[i] = true;
        reordered.add(orbitals.get(i));
      }
      orbitals.clear();
      orbitals.addAll(reordered);
      renumber();
      return this;
    }

    /**
     * Keep only the orbitals matching a predicate.
     *
     * @param filter the predicate.
     * @return this editor.
     */
    public Editor retain(Predicate<Orbital> filter) {
      orbitals.removeIf(filter.negate());
      renumber();
      return this;
    }

    /**
     * Change the type of an orbital.
     *
     * @param index 0-based position.
     * @param type the new type.
     * @return this editor.
     */
    public Editor setType(int index, OrbitalType type) {
      orbitals.set(index, orbitals.get(index).toBuilder().type(type).build());
      return this;
    }

    /** Keep indices within each irrep consecutive. */
    private void renumber() {
      int[] next = new int[source.symmetry.getIrrepCount()];
      for (int i = 0; i < orbitals.size(); i++) {
        Orbital orbital = orbitals.get(i);
        int index = ++next[orbital.getIrrep()];
        if (orbital.getIndexInIrrep() != index) {
          orbitals.set(i, orbital.toBuilder().indexInIrrep(index).build());
        }
      }
    }

    /**
     * Build the edited set. The declared electron count is dropped if orbitals were removed.
     *
     * @return a new set.
     */
    public OrbitalSet build() {
      Builder builder = source.toBuilder();
      if (orbitals.size() != source.orbitals.size()) {
        builder.electronCount(null);
      }
      return builder.addAll(orbitals).build();
    }
  }
}
