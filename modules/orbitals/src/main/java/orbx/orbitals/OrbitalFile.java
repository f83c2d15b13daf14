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

import static java.lang.String.format;

import java.io.File;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.List;
import orbx.lattice.GridSpec;
import orbx.orbitals.basis.Atom;
import orbx.orbitals.basis.BasisFunction;
import orbx.orbitals.basis.BasisSet;
import orbx.orbitals.basis.Molecule;
import orbx.orbitals.basis.Primitive;
import orbx.orbitals.basis.Shell;
import orbx.orbitals.mo.DensityKind;
import orbx.orbitals.mo.OrbitalSet;
import orbx.orbitals.mo.Spin;
import orbx.orbitals.mo.Symmetry;

/**
 * The OrbitalFile class is the unified result of parsing any supported format: a molecule, a basis
 * set, symmetry information and one or more orbital sets, plus any fields the file stores
 * directly. Every part except the orbital set list may be absent.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class OrbitalFile {

  private final File file;
  private final String format;
  private final String title;
  private final Molecule molecule;
  private final BasisSet basisSet;
  private final Symmetry symmetry;
  private final List<OrbitalSet> orbitalSets;
  private final PrecomputedFields precomputedFields;
  private final OrbitalSet precomputedSet;
  private final String companion;
  private volatile String modelFingerprint;

  private OrbitalFile(Builder builder) {
    this.file = builder.file;
    this.format = builder.format;
    this.title = builder.title;
    this.molecule = builder.molecule;
    this.basisSet = builder.basisSet;
    this.symmetry = builder.symmetry;
    this.orbitalSets = List.copyOf(builder.orbitalSets);
    this.precomputedFields = builder.precomputedFields;
    this.precomputedSet = builder.precomputedSet;
    this.companion = builder.companion;
    if (precomputedSet != null && precomputedFields != null
        && precomputedSet.size() > precomputedFields.getFieldCount()) {
      throw new IllegalArgumentException(format(" %d orbitals for %d stored fields.",
          precomputedSet.size(), precomputedFields.getFieldCount()));
    }
  }

  public File getFile() {
    return file;
  }

  /**
   * The name of the format the file was read as.
   *
   * @return the format name.
   */
  public String getFormat() {
    return format;
  }

  public String getTitle() {
    return title;
  }

  /**
   * The molecule.
   *
   * @return the molecule, or null.
   */
  public Molecule getMolecule() {
    return molecule;
  }

  /**
   * The basis set.
   *
   * @return the basis set, or null if the file does not define one.
   */
  public BasisSet getBasisSet() {
    return basisSet;
  }

  /**
   * The symmetry.
   *
   * @return the symmetry, or null.
   */
  public Symmetry getSymmetry() {
    return symmetry;
  }

  /**
   * Getter for the field <code>orbitalSets</code>.
   *
   * @return an unmodifiable list of orbital sets.
   */
  public List<OrbitalSet> getOrbitalSets() {
    return Collections.unmodifiableList(orbitalSets);
  }

  /**
   * Find an orbital set.
   *
   * @param kind the density kind.
   * @param state the state.
   * @param spin the spin.
   * @return the first matching set with the default role, or null.
   */
  public OrbitalSet findSet(DensityKind kind, int state, Spin spin) {
    for (OrbitalSet set : orbitalSets) {
      if (set.getDensityKind() == kind && set.getState() == state && set.getSpin() == spin
          && set.getRole() == OrbitalSet.Role.DEFAULT) {
        return set;
      }
    }
    return null;
  }

  /**
   * Find the hole or particle set of a transition.
   *
   * @param from the initial state.
   * @param to the final state.
   * @param role HOLE or PARTICLE.
   * @return the set, or null.
   */
  public OrbitalSet findTransitionSet(int from, int to, OrbitalSet.Role role) {
    for (OrbitalSet set : orbitalSets) {
      if (set.getDensityKind() == DensityKind.TRANSITION && set.getState() == from
          && set.getTargetState() == to && set.getRole() == role) {
        return set;
      }
    }
    return null;
  }

  /**
   * Fields stored directly in the file.
   *
   * @return the fields, or null.
   */
  public PrecomputedFields getPrecomputedFields() {
    return precomputedFields;
  }

  /**
   * The set whose orbital i is stored as precomputed field i.
   *
   * @return the set, or null.
   */
  public OrbitalSet getPrecomputedSet() {
    return precomputedSet;
  }

  /**
   * Name of a companion file needed for data this file does not hold.
   *
   * @return a description of the companion, or null if the file is self contained.
   */
  public String getCompanion() {
    return companion;
  }

  /**
   * Whether orbitals can be evaluated from coefficients.
   *
   * @return true if a basis set is present.
   */
  public boolean canEvaluate() {
    return basisSet != null;
  }

  /**
   * Whether a set is one of the orbital sets of this file or its precomputed set. Sets are
   * compared by identity.
   *
   * @param set a set.
   * @return true if the set belongs to this file.
   */
  public boolean contains(OrbitalSet set) {
    if (set == precomputedSet) {
      return set != null;
    }
    for (OrbitalSet candidate : orbitalSets) {
      if (candidate == set) {
        return true;
      }
    }
    return false;
  }

  /**
   * A SHA-256 digest of everything except the orbitals that a field evaluated from this file
   * depends on: the atoms, the normalized basis set and the grid of any stored fields.
   *
   * @return a hexadecimal digest.
   */
  public String getModelFingerprint() {
    String f = modelFingerprint;
    if (f == null) {
      MessageDigest digest = sha256();
      if (molecule != null) {
        for (Atom atom : molecule.getAtoms()) {
          double[] xyz = atom.getXYZ();
          digest.update(ByteBuffer.allocate(30).putInt(atom.getAtomicNumber()).putDouble(xyz[0])
              .putDouble(xyz[1]).putDouble(xyz[2]).put((byte) (atom.hasBasis() ? 1 : 0))
              .put((byte) (atom.isGhost() ? 1 : 0)).array());
        }
      }
      digest.update((byte) '|');
      if (basisSet != null) {
        for (Shell shell : basisSet.getShells()) {
          shell.normalize();
          List<Primitive> primitives = shell.getPrimitives();
          ByteBuffer buffer = ByteBuffer.allocate(9 + 16 * primitives.size());
          buffer.putInt(shell.getAtomIndex()).putInt(shell.getL())
              .put((byte) (shell.isCartesian() ? 1 : 0));
          for (Primitive primitive : primitives) {
            buffer.putDouble(primitive.getExponent()).putDouble(primitive.getCoefficient());
          }
          digest.update(buffer.array());
        }
        for (BasisFunction function : basisSet.getFunctions()) {
          digest.update(format("%d:%s:%s;", function.getShellIndex(),
              function.getComponent().getKind(), function.getComponent())
              .getBytes(StandardCharsets.UTF_8));
        }
      }
      digest.update((byte) '|');
      if (precomputedFields != null) {
        GridSpec gridSpec = precomputedFields.getGridSpec();
        ByteBuffer buffer = ByteBuffer.allocate(4 + 12 * 8 + 3 * 4);
        buffer.putInt(precomputedFields.getFieldCount());
        for (double x : gridSpec.getOrigin()) {
          buffer.putDouble(x);
        }
        for (int axis = 0; axis < 3; axis++) {
          for (double x : gridSpec.getStep(axis)) {
            buffer.putDouble(x);
          }
          buffer.putInt(gridSpec.getCount(axis));
        }
        digest.update(buffer.array());
        if (file != null) {
          digest.update(format("%s|%d|%d", file.getAbsolutePath(), file.length(),
              file.lastModified()).getBytes(StandardCharsets.UTF_8));
        }
      }
      f = HexFormat.of().formatHex(digest.digest());
      modelFingerprint = f;
    }
    return f;
  }

  /**
   * The fingerprint of an orbital set evaluated with this file's atoms and basis. Equal sets read
   * with different geometries or basis sets have different source fingerprints.
   *
   * @param set a set of this file.
   * @return a hexadecimal digest.
   */
  public String getSourceFingerprint(OrbitalSet set) {
    MessageDigest digest = sha256();
    digest.update(getModelFingerprint().getBytes(StandardCharsets.US_ASCII));
    digest.update((byte) '|');
    digest.update(set.getFingerprint().getBytes(StandardCharsets.US_ASCII));
    return HexFormat.of().formatHex(digest.digest());
  }

  private static MessageDigest sha256() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException(e);
    }
  }

  /**
   * A builder initialized from this file.
   *
   * @return the builder.
   */
  public Builder toBuilder() {
    Builder builder = new Builder(file, format)
        .title(title)
        .molecule(molecule)
        .basisSet(basisSet)
        .symmetry(symmetry)
        .precomputed(precomputedFields, precomputedSet)
        .companion(companion);
    orbitalSets.forEach(builder::addOrbitalSet);
    return builder;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format(" %s file %s: %d atoms, %d basis functions, %d orbital sets", this.format,
        file == null ? "" : file.getName(), molecule == null ? 0 : molecule.size(),
        basisSet == null ? 0 : basisSet.size(), orbitalSets.size());
  }

  /** Builder for orbital files. */
  public static class Builder {

    private final File file;
    private final String format;
    private String title = "";
    private Molecule molecule;
    private BasisSet basisSet;
    private Symmetry symmetry;
    private final List<OrbitalSet> orbitalSets = new ArrayList<>();
    private PrecomputedFields precomputedFields;
    private OrbitalSet precomputedSet;
    private String companion;

    public Builder(File file, String format) {
      this.file = file;
      this.format = format;
    }

    public Builder title(String title) {
      this.title = title;
      return this;
    }

    public Builder molecule(Molecule molecule) {
      this.molecule = molecule;
      return this;
    }

    public Builder basisSet(BasisSet basisSet) {
      this.basisSet = basisSet;
      return this;
    }

    public Builder symmetry(Symmetry symmetry) {
      this.symmetry = symmetry;
      return this;
    }

    public Builder addOrbitalSet(OrbitalSet set) {
      orbitalSets.add(set);
      return this;
    }

    /**
     * Replace one orbital set with another, keeping its position.
     *
     * @param old the set to replace.
     * @param replacement the new set.
     * @return this builder.
     */
    public Builder replaceOrbitalSet(OrbitalSet old, OrbitalSet replacement) {
      int i = orbitalSets.indexOf(old);
      if (i < 0) {
        throw new IllegalArgumentException(format(" %s is not part of this file.", old.getName()));
      }
      orbitalSets.set(i, replacement);
      if (precomputedSet == old) {
        precomputedSet = replacement;
      }
      return this;
    }

    public Builder clearOrbitalSets() {
      orbitalSets.clear();
      return this;
    }

    public Builder precomputed(PrecomputedFields fields, OrbitalSet set) {
      this.precomputedFields = fields;
      this.precomputedSet = set;
      return this;
    }

    public Builder companion(String companion) {
      this.companion = companion;
      return this;
    }

    public OrbitalFile build() {
      return new OrbitalFile(this);
    }
  }
}
