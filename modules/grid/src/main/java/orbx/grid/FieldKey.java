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

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import orbx.lattice.GridSpec;
import orbx.orbitals.mo.Spin;

/**
 * Identifies a cached field: what was computed, on which grid, and from which orbital sets. The
 * fingerprints of the source sets tie an entry to the exact content it was derived from.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class FieldKey {

  private final FieldKind kind;
  private final boolean laplacian;
  private final int state;
  private final int targetState;
  private final Spin spin;
  private final int orbital;
  private final GridSpec gridSpec;
  private final List<String> fingerprints;
  private final int hashCode;

  /**
   * Constructor for FieldKey.
   *
   * @param kind the field kind.
   * @param laplacian true for the Laplacian of the field.
   * @param state the state index.
   * @param targetState the target state of a transition, or -1.
   * @param spin the spin channel.
   * @param orbital the orbital position for ORBITAL fields, or -1.
   * @param gridSpec the grid.
   * @param fingerprints fingerprints of the source sets, in term order.
   */
  public FieldKey(FieldKind kind, boolean laplacian, int state, int targetState, Spin spin,
      int orbital, GridSpec gridSpec, List<String> fingerprints) {
    this.kind = Objects.requireNonNull(kind);
    this.laplacian = laplacian;
    this.state = state;
    this.targetState = targetState;
    this.spin = Objects.requireNonNull(spin);
    this.orbital = orbital;
    this.gridSpec = Objects.requireNonNull(gridSpec);
    this.fingerprints = List.copyOf(fingerprints);
    this.hashCode = Objects.hash(kind, laplacian, state, targetState, spin, orbital, gridSpec,
        this.fingerprints);
  }

  public FieldKind getKind() {
    return kind;
  }

  public boolean isLaplacian() {
    return laplacian;
  }

  public int getState() {
    return state;
  }

  public int getTargetState() {
    return targetState;
  }

  public Spin getSpin() {
    return spin;
  }

  public int getOrbital() {
    return orbital;
  }

  public GridSpec getGridSpec() {
    return gridSpec;
  }

  public List<String> getFingerprints() {
    return fingerprints;
  }

  /**
   * Returns true if the field was derived from the set with this fingerprint.
   *
   * @param fingerprint a set fingerprint.
   * @return true if referenced.
   */
  public boolean references(String fingerprint) {
    return fingerprints.contains(fingerprint);
  }

  /**
   * A lossless description of the key, used to identify persisted entries.
   *
   * @return the description.
   */
  public String describe() {
    StringBuilder sb = new StringBuilder();
    sb.append(format("%s|%b|%d|%d|%s|%d|", kind, laplacian, state, targetState, spin, orbital));
    double[] origin = gridSpec.getOrigin();
    sb.append(Double.toString(origin[0])).append(',').append(Double.toString(origin[1]))
        .append(',').append(Double.toString(origin[2]));
    for (int axis = 0; axis < 3; axis++) {
      double[] step = gridSpec.getStep(axis);
      sb.append(format("|%d:%s,%s,%s", gridSpec.getCount(axis), Double.toString(step[0]),
          Double.toString(step[1]), Double.toString(step[2])));
    }
    for (String fingerprint : fingerprints) {
      sb.append('|').append(fingerprint);
    }
    return sb.toString();
  }

  /**
   * A SHA-256 digest of {@link #describe()}, suitable as a file name.
   *
   * @return a hexadecimal digest.
   */
  public String digest() {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(describe().getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException(e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    FieldKey other = (FieldKey) obj;
    return kind == other.kind && laplacian == other.laplacian && state == other.state
        && targetState == other.targetState && spin == other.spin && orbital == other.orbital
        && gridSpec.equals(other.gridSpec) && fingerprints.equals(other.fingerprints);
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return hashCode;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format(" %s%s (state %d, %s%s)", laplacian ? "Laplacian of " : "", kind, state, spin,
        orbital >= 0 ? ", orbital " + (orbital + 1) : "");
  }
}
