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
package orbx.grid;

import static java.lang.String.format;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import orbx.lattice.GridSpec;
import orbx.orbitals.OrbitalFile;
import orbx.orbitals.mo.OrbitalSet;
import orbx.orbitals.mo.Spin;

/**
 * Describes a field to evaluate: the amplitude of one orbital, or a density
 * rho = sum_terms w * sum_k occ_k * phi_(a,k) * phi_(b,k), where each term pairs the k-th
 * orbitals of two sets (usually the same set) and occ_k is the occupation of the first.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class FieldRequest {

  /** One weighted pairing of two orbital sets. */
  public static final class Term {

    private final OrbitalSet left;
    private final OrbitalSet right;
    private final double weight;

    Term(OrbitalSet left, OrbitalSet right, double weight) {
      if (left.size() != right.size()) {
        throw new IllegalArgumentException(format(" %s and %s hold %d and %d orbitals.",
            left.getName(), right.getName(), left.size(), right.size()));
      }
      this.left = left;
      this.right = right;
      this.weight = weight;
    }

    /**
     * The set supplying the occupations and the first factor.
     *
     * @return the set.
     */
    public OrbitalSet getLeft() {
      return left;
    }

    public OrbitalSet getRight() {
      return right;
    }

    public double getWeight() {
      return weight;
    }

    boolean isSquare() {
      return left == right;
    }
  }

  private final FieldKind kind;
  private final List<Term> terms;
  private final OrbitalSet orbitalSet;
  private final int orbitalIndex;
  private final int state;
  private final int targetState;
  private final Spin spin;
  private final FieldRequest inner;
  private final String label;

  private FieldRequest(FieldKind kind, List<Term> terms, OrbitalSet orbitalSet,
      int orbitalIndex, int state, int targetState, Spin spin, FieldRequest inner, String label) {
    this.kind = kind;
    this.terms = terms;
    this.orbitalSet = orbitalSet;
    this.orbitalIndex = orbitalIndex;
    this.state = state;
    this.targetState = targetState;
    this.spin = spin;
    this.inner = inner;
    this.label = label;
  }

  private static FieldRequest density(FieldKind kind, OrbitalSet first, int targetState,
      Spin spin, String label, Term... terms) {
    return new FieldRequest(kind, List.of(terms), null, -1, first.getState(), targetState, spin,
        null, label);
  }

  /**
   * The amplitude of one orbital.
   *
   * @param set the set.
   * @param index 0-based position of the orbital in the set.
   * @return the request.
   */
  public static FieldRequest orbital(OrbitalSet set, int index) {
    if (index < 0 || index >= set.size()) {
      throw new IllegalArgumentException(format(" %s has no orbital %d.", set.getName(),
          index + 1));
    }
    return new FieldRequest(FieldKind.ORBITAL, List.of(), set, index, set.getState(), -1,
        set.getSpin(), null, format("%s orbital %d", set.getName(), index + 1));
  }

  /**
   * The density of one set, interpreted by its density kind. Spin and difference natural
   * orbitals carry signed occupations, so their density is a plain sum.
   *
   * @param set the set.
   * @return the request.
   * @throws IllegalArgumentException for hole or particle sets, which need their partner.
   */
  public static FieldRequest density(OrbitalSet set) {
    Term term = new Term(set, set, 1.0);
    switch (set.getDensityKind()) {
      case SPIN:
        return density(FieldKind.SPIN, set, -1, Spin.NONE, set.getName() + " spin density",
            term);
      case DIFFERENCE:
        return density(FieldKind.DIFFERENCE, set, set.getTargetState(), set.getSpin(),
            set.getName() + " difference density", term);
      case TRANSITION:
        throw new IllegalArgumentException(format(
            " The transition density of %s needs both hole and particle orbitals.",
            set.getName()));
      case STATE:
      default:
        return density(FieldKind.STATE, set, -1, set.getSpin(), set.getName() + " density",
            term);
    }
  }

  /**
   * Total density of an unrestricted calculation.
   *
   * @param alpha the alpha set.
   * @param beta the beta set.
   * @return the request.
   */
  public static FieldRequest total(OrbitalSet alpha, OrbitalSet beta) {
    return density(FieldKind.TOTAL, alpha, -1, Spin.NONE, "Total density",
        new Term(alpha, alpha, 1.0), new Term(beta, beta, 1.0));
  }

  /**
   * Spin density of an unrestricted calculation.
   *
   * @param alpha the alpha set.
   * @param beta the beta set.
   * @return the request.
   */
  public static FieldRequest spin(OrbitalSet alpha, OrbitalSet beta) {
    return density(FieldKind.SPIN, alpha, -1, Spin.NONE, "Spin density",
        new Term(alpha, alpha, 1.0), new Term(beta, beta, -1.0));
  }

  /**
   * Transition density from natural transition orbitals.
   *
   * @param hole the hole set, whose occupations are the transition weights.
   * @param particle the matching particle set.
   * @return the request.
   */
  public static FieldRequest transition(OrbitalSet hole, OrbitalSet particle) {
    return density(FieldKind.TRANSITION, hole, hole.getTargetState(), Spin.NONE,
        format("Transition density %d -> %d", hole.getState() + 1, hole.getTargetState() + 1),
        new Term(hole, particle, 1.0));
  }

  /**
   * Difference between the densities of a state and a reference.
   *
   * @param state the state.
   * @param reference the reference state.
   * @return the request.
   */
  public static FieldRequest difference(OrbitalSet state, OrbitalSet reference) {
    return density(FieldKind.DIFFERENCE, state, reference.getState(), state.getSpin(),
        format("%s - %s", state.getName(), reference.getName()),
        new Term(state, state, 1.0), new Term(reference, reference, -1.0));
  }

  /**
   * The Laplacian of another field.
   *
   * @param inner the field to differentiate.
   * @return the request.
   */
  public static FieldRequest laplacian(FieldRequest inner) {
    Objects.requireNonNull(inner);
    if (inner.isLaplacian()) {
      throw new IllegalArgumentException(" Nested Laplacians are not supported.");
    }
    return new FieldRequest(inner.kind, inner.terms, inner.orbitalSet, inner.orbitalIndex,
        inner.state, inner.targetState, inner.spin, inner, "Laplacian of " + inner.label);
  }

  public FieldKind getKind() {
    return kind;
  }

  public List<Term> getTerms() {
    return terms;
  }

  /**
   * The set of an ORBITAL request.
   *
   * @return the set, or null for densities.
   */
  public OrbitalSet getOrbitalSet() {
    return orbitalSet;
  }

  public int getOrbitalIndex() {
    return orbitalIndex;
  }

  public boolean isLaplacian() {
    return inner != null;
  }

  /**
   * The differentiated request.
   *
   * @return the inner request, or null if this is not a Laplacian.
   */
  public FieldRequest getInner() {
    return inner;
  }

  public String getLabel() {
    return label;
  }

  /**
   * The distinct source sets, in term order.
   *
   * @return the sets.
   */
  public List<OrbitalSet> getSources() {
    List<OrbitalSet> sets = new ArrayList<>();
    if (orbitalSet != null) {
      sets.add(orbitalSet);
    }
    for (Term term : terms) {
      if (!sets.contains(term.left)) {
        sets.add(term.left);
      }
      if (!sets.contains(term.right)) {
        sets.add(term.right);
      }
    }
    return sets;
  }

  /**
   * The cache key of this request on a grid. Source sets are identified by their fingerprint
   * bound to the model, so the same orbitals on moved atoms or another basis get another key.
   *
   * @param model the model holding the source sets.
   * @param gridSpec the grid.
   * @return the key.
   * @throws IllegalArgumentException if a source set does not belong to the model.
   */
  public FieldKey key(OrbitalFile model, GridSpec gridSpec) {
    List<String> fingerprints = new ArrayList<>();
    for (OrbitalSet set : getSources()) {
      if (!model.contains(set)) {
        throw new IllegalArgumentException(format(" %s does not belong to the active model.",
            set.getName()));
      }
      fingerprints.add(model.getSourceFingerprint(set));
    }
    return new FieldKey(kind, isLaplacian(), state, targetState, spin, orbitalIndex, gridSpec,
        fingerprints);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return " " + label;
  }
}
