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
import static org.apache.commons.math3.util.FastMath.abs;
import static org.apache.commons.math3.util.FastMath.exp;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;
import orbx.lattice.GridSpec;
import orbx.lattice.ScalarField;
import orbx.numerics.math.GaussianFunctions;
import orbx.orbitals.IncompleteDataException;
import orbx.orbitals.OrbitalFile;
import orbx.orbitals.PrecomputedFields;
import orbx.orbitals.basis.Atom;
import orbx.orbitals.basis.BasisFunction;
import orbx.orbitals.basis.BasisSet;
import orbx.orbitals.basis.Primitive;
import orbx.orbitals.basis.Shell;
import orbx.orbitals.mo.Orbital;
import orbx.orbitals.mo.OrbitalSet;
import orbx.utilities.OrbXProperties;
import org.apache.commons.configuration2.CompositeConfiguration;

/**
 * The GridEvaluator class computes orbital amplitudes and densities on a grid.
 *
 * <p>Points are generated from the lattice vectors of the {@link GridSpec}, so skewed grids need
 * no special treatment. Work proceeds one plane of the first axis at a time: the cancellation
 * token is polled, every needed basis function is evaluated on the plane, and the orbitals and
 * their products are accumulated.
 *
 * <p>Files that store fields instead of coefficients are served from their {@link
 * PrecomputedFields}, on their own grid only.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class GridEvaluator {

  private static final Logger logger = Logger.getLogger(GridEvaluator.class.getName());

  private final OrbitalFile orbitalFile;
  private final BasisSet basisSet;
  private final double coefficientThreshold;
  private final double occupationThreshold;

  /**
   * Constructor for GridEvaluator.
   *
   * @param orbitalFile the model to evaluate.
   * @param properties the configuration, or null for defaults.
   */
  public GridEvaluator(OrbitalFile orbitalFile, CompositeConfiguration properties) {
    this.orbitalFile = orbitalFile;
    this.basisSet = orbitalFile.getBasisSet();
    CompositeConfiguration config = properties == null ? new CompositeConfiguration()
        : properties;
    coefficientThreshold = OrbXProperties.Key.COEFFICIENT_THRESHOLD.getDouble(config);
    occupationThreshold = OrbXProperties.Key.OCCUPATION_THRESHOLD.getDouble(config);
  }

  /** A weighted product of two orbitals, or a single orbital if right is null. */
  private static final class Contribution {

    final double weight;
    final double[] left;
    final double[] right;

    Contribution(double weight, double[] left, double[] right) {
      this.weight = weight;
      this.left = left;
      this.right = right;
    }
  }

  /**
   * Evaluate a request.
   *
   * @param request the field to compute.
   * @param gridSpec the grid.
   * @param token polled once per plane.
   * @return the field.
   * @throws OperationCancelledException if the token was set.
   * @throws IOException if stored fields could not be read.
   * @throws IncompleteDataException if the model lacks data the request needs.
   */
  public ScalarField evaluate(FieldRequest request, GridSpec gridSpec, CancellationToken token)
      throws OperationCancelledException, IOException {
    if (request.isLaplacian()) {
      ScalarField inner = evaluate(request.getInner(), gridSpec, token);
      return Laplacian.apply(inner, request.getLabel(), token);
    }
    if (usesStoredFields(request)) {
      return evaluateStored(request, gridSpec, token);
    }
    if (basisSet == null) {
      throw new IncompleteDataException(format(" %s has no basis set; %s is needed.",
          orbitalFile.getFile() == null ? "The model" : orbitalFile.getFile().getName(),
          orbitalFile.getCompanion() == null ? "a file with a basis"
              : orbitalFile.getCompanion()));
    }
    return evaluateAnalytic(request.getLabel(), contributions(request), gridSpec, token);
  }

  /**
   * A stored field, for files that hold fields without orbitals.
   *
   * @param index the field index.
   * @return the field.
   * @throws IOException if the field could not be read.
   */
  public ScalarField stored(int index) throws IOException {
    PrecomputedFields fields = orbitalFile.getPrecomputedFields();
    if (fields == null) {
      throw new IncompleteDataException(" The model holds no stored fields.");
    }
    return fields.readField(index);
  }

  private boolean usesStoredFields(FieldRequest request) {
    OrbitalSet stored = orbitalFile.getPrecomputedSet();
    return stored != null && request.getSources().contains(stored);
  }

  private List<Contribution> contributions(FieldRequest request) {
    int n = basisSet.size();
    List<Contribution> contributions = new ArrayList<>();
    if (request.getKind() == FieldKind.ORBITAL) {
      double[] c = request.getOrbitalSet().getAOCoefficients(request.getOrbitalIndex());
      checkLength(c, n, request.getOrbitalSet());
      contributions.add(new Contribution(1.0, c, null));
      return contributions;
    }
    for (FieldRequest.Term term : request.getTerms()) {
      OrbitalSet left = term.getLeft();
      OrbitalSet right = term.getRight();
      for (int k = 0; k < left.size(); k++) {
        Orbital a = left.getOrbital(k);
        Orbital b = right.getOrbital(k);
        if (!a.hasValidOccupation()) {
          logger.warning(format(" Orbital %d of %s has no valid occupation and is skipped.",
              k + 1, left.getName()));
          continue;
        }
        double occupation = a.getOccupation();
        if (abs(occupation) < occupationThreshold) {
          continue;
        }
        if (!a.hasValidCoefficients() || !b.hasValidCoefficients()) {
          logger.warning(format(" Orbital %d of %s has unreadable coefficients and is skipped.",
              k + 1, left.getName()));
          continue;
        }
        double[] ca = left.getAOCoefficients(k);
        checkLength(ca, n, left);
        double[] cb = ca;
        if (!term.isSquare()) {
          cb = right.getAOCoefficients(k);
          checkLength(cb, n, right);
        }
        contributions.add(new Contribution(term.getWeight() * occupation, ca, cb));
      }
    }
    return contributions;
  }

  private static void checkLength(double[] c, int n, OrbitalSet set) {
    if (c.length != n) {
      throw new IllegalArgumentException(format(" %s has %d coefficients per orbital for %d basis"
          + " functions.", set.getName(), c.length, n));
    }
  }

  private ScalarField evaluateAnalytic(String label, List<Contribution> contributions,
      GridSpec gridSpec, CancellationToken token) throws OperationCancelledException {
    List<Shell> shells = basisSet.getShells();
    List<BasisFunction> functions = basisSet.getFunctions();
    int nFunctions = functions.size();

    // Only basis functions with a significant coefficient are evaluated.
    boolean[] needed = new boolean[nFunctions];
    boolean[] shellNeeded = new boolean[shells.size()];
    for (Contribution contribution : contributions) {
      for (int mu = 0; mu < nFunctions; mu++) {
        boolean rightNeeded = contribution.right != null
            && abs(contribution.right[mu]) >= coefficientThreshold;
        if (abs(contribution.left[mu]) >= coefficientThreshold || rightNeeded) {
          needed[mu] = true;
          shellNeeded[functions.get(mu).getShellIndex()] = true;
        }
      }
    }
    double[][] centers = new double[shells.size()][];
    double[][] exponents = new double[shells.size()][];
    double[][] weights = new double[shells.size()][];
    for (int s = 0; s < shells.size(); s++) {
      Shell shell = shells.get(s);
      Atom atom = shell.getAtom(basisSet.getMolecule());
      centers[s] = atom.getXYZ();
      List<Primitive> primitives = shell.getPrimitives();
      exponents[s] = new double[primitives.size()];
      weights[s] = new double[primitives.size()];
      for (int p = 0; p < primitives.size(); p++) {
        Primitive primitive = primitives.get(p);
        exponents[s][p] = primitive.getExponent();
        weights[s][p] = primitive.getCoefficient()
            * GaussianFunctions.primitiveNormalization(primitive.getExponent(), shell.getL());
      }
    }

    int n1 = gridSpec.getCount(0);
    int n2 = gridSpec.getCount(1);
    int n3 = gridSpec.getCount(2);
    int plane = n2 * n3;
    double[] values = new double[gridSpec.size()];
    double[][] ao = new double[nFunctions][];
    for (int mu = 0; mu < nFunctions; mu++) {
      if (needed[mu]) {
        ao[mu] = new double[plane];
      }
    }
    double[] radial = new double[plane];
    double[][] displacement = new double[plane][3];
    double[] xyz = new double[3];
    double[] left = new double[plane];
    double[] right = new double[plane];
    for (int i = 0; i < n1; i++) {
      token.throwIfCancelled();
      for (int s = 0; s < shells.size(); s++) {
        if (!shellNeeded[s]) {
          continue;
        }
        double[] center = centers[s];
        for (int j = 0; j < n2; j++) {
          for (int k = 0; k < n3; k++) {
            int p = j * n3 + k;
            gridSpec.getPoint(i, j, k, xyz);
            double dx = xyz[0] - center[0];
            double dy = xyz[1] - center[1];
            double dz = xyz[2] - center[2];
            displacement[p][0] = dx;
            displacement[p][1] = dy;
            displacement[p][2] = dz;
            double r2 = dx * dx + dy * dy + dz * dz;
            double sum = 0.0;
            for (int q = 0; q < exponents[s].length; q++) {
              sum += weights[s][q] * exp(-exponents[s][q] * r2);
            }
            radial[p] = sum;
          }
        }
        for (int mu = 0; mu < nFunctions; mu++) {
          BasisFunction function = functions.get(mu);
          if (!needed[mu] || function.getShellIndex() != s) {
            continue;
          }
          double[] chi = ao[mu];
          for (int p = 0; p < plane; p++) {
            double[] d = displacement[p];
            chi[p] = radial[p] * function.getComponent().evaluate(d[0], d[1], d[2]);
          }
        }
      }
      int offset = i * plane;
      for (Contribution contribution : contributions) {
        combine(contribution.left, ao, needed, left);
        if (contribution.right == null) {
          for (int p = 0; p < plane; p++) {
            values[offset + p] += contribution.weight * left[p];
          }
        } else if (contribution.right == contribution.left) {
          for (int p = 0; p < plane; p++) {
            values[offset + p] += contribution.weight * left[p] * left[p];
          }
        } else {
          combine(contribution.right, ao, needed, right);
          for (int p = 0; p < plane; p++) {
            values[offset + p] += contribution.weight * left[p] * right[p];
          }
        }
      }
    }
    logger.fine(format(" Evaluated %s from %d orbital terms on %d points.", label,
        contributions.size(), values.length));
    return new ScalarField(gridSpec, values, label);
  }

  /** Orbital values on a plane: sum over basis functions of coefficient times value. */
  private void combine(double[] c, double[][] ao, boolean[] needed, double[] out) {
    Arrays.fill(out, 0.0);
    for (int mu = 0; mu < c.length; mu++) {
      double cmu = c[mu];
      if (!needed[mu] || abs(cmu) < coefficientThreshold) {
        continue;
      }
      double[] chi = ao[mu];
      for (int p = 0; p < out.length; p++) {
        out[p] += cmu * chi[p];
      }
    }
  }

  private ScalarField evaluateStored(FieldRequest request, GridSpec gridSpec,
      CancellationToken token) throws OperationCancelledException, IOException {
    PrecomputedFields fields = orbitalFile.getPrecomputedFields();
    OrbitalSet stored = orbitalFile.getPrecomputedSet();
    if (!fields.getGridSpec().equals(gridSpec)) {
      throw new IncompleteDataException(format(" Stored orbitals of %s are only available on"
          + " their own grid.", orbitalFile.getFile().getName()));
    }
    if (request.getKind() == FieldKind.ORBITAL) {
      token.throwIfCancelled();
      return fields.readField(request.getOrbitalIndex());
    }
    for (FieldRequest.Term term : request.getTerms()) {
      if (!term.isSquare() || term.getLeft() != stored) {
        throw new IncompleteDataException(format(" %s cannot be built from stored orbitals.",
            request.getLabel()));
      }
    }
    OrbitalSet reference = referenceSet();
    if (reference == null) {
      throw new IncompleteDataException(format(" %s stores a subset of the orbitals; the density"
          + " needs %s.", orbitalFile.getFile().getName(), orbitalFile.getCompanion() == null
          ? "the orbital file of the calculation" : orbitalFile.getCompanion()));
    }
    // Every occupied orbital of the calculation must be stored.
    double[] occupations = new double[stored.size()];
    for (Orbital orbital : reference.getOrbitals()) {
      if (!orbital.hasValidOccupation() || abs(orbital.getOccupation()) < occupationThreshold) {
        continue;
      }
      int index = find(stored, orbital);
      if (index < 0) {
        throw new IncompleteDataException(format(" Occupied orbital %d of irrep %s is not stored"
                + " in %s.", orbital.getIndexInIrrep(), orbital.getIrrepLabel(),
            orbitalFile.getFile().getName()));
      }
      occupations[index] = orbital.getOccupation();
    }
    double weight = 0.0;
    for (FieldRequest.Term term : request.getTerms()) {
      weight += term.getWeight();
    }
    double[] values = new double[gridSpec.size()];
    for (int k = 0; k < occupations.length; k++) {
      if (occupations[k] == 0.0) {
        continue;
      }
      token.throwIfCancelled();
      double[] phi = fields.readField(k).getValues();
      for (int p = 0; p < values.length; p++) {
        values[p] += weight * occupations[k] * phi[p] * phi[p];
      }
    }
    return new ScalarField(gridSpec, values, request.getLabel());
  }

  /** The first set of the file with coefficients; it describes the whole calculation. */
  private OrbitalSet referenceSet() {
    for (OrbitalSet set : orbitalFile.getOrbitalSets()) {
      if (set != orbitalFile.getPrecomputedSet() && set.size() > 0
          && set.getOrbital(0).hasCoefficients()) {
        return set;
      }
    }
    return null;
  }

  /** Position of a stored orbital with the irrep number and index of another orbital. */
  private static int find(OrbitalSet stored, Orbital orbital) {
    for (int k = 0; k < stored.size(); k++) {
      Orbital candidate = stored.getOrbital(k);
      int irrep;
      try {
        irrep = Integer.parseInt(candidate.getIrrepLabel().trim()) - 1;
      } catch (NumberFormatException e) {
        continue;
      }
      if (irrep == orbital.getIrrep() && candidate.getIndexInIrrep() == orbital.getIndexInIrrep()) {
        return k;
      }
    }
    return -1;
  }
}
