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

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Logger;
import orbx.lattice.GridSpec;
import orbx.lattice.ScalarField;
import orbx.orbitals.OrbitalFile;
import orbx.orbitals.mo.Orbital;
import orbx.orbitals.mo.OrbitalSet;
import orbx.orbitals.parsers.OrbitalFileOpener;
import orbx.orbitals.parsers.OrbitalFormat;
import orbx.orbitals.parsers.ParseException;
import orbx.utilities.OrbXProperties;
import org.apache.commons.configuration2.CompositeConfiguration;

/**
 * The context of one viewer: the active orbital file, the cache of fields computed from it, and
 * the workers that compute them.
 *
 * <p>Grid computations hold a read lock on the active model. Loading a file or replacing an
 * orbital set first cancels every computation in flight, then swaps the model under the write
 * lock and invalidates the cached fields of the sets that were replaced.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class OrbitalSession implements AutoCloseable {

  private static final Logger logger = Logger.getLogger(OrbitalSession.class.getName());

  private final CompositeConfiguration properties;
  private final OrbitalFileOpener opener;
  private final DensityCache cache;
  private final ExecutorService executor;
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final Set<CancellationToken> activeTokens = ConcurrentHashMap.newKeySet();
  private volatile OrbitalFile orbitalFile;

  /**
   * Constructor for OrbitalSession.
   *
   * @param properties the configuration.
   * @throws IOException if the scratch directory cannot be prepared.
   */
  public OrbitalSession(CompositeConfiguration properties) throws IOException {
    this.properties = properties == null ? new CompositeConfiguration() : properties;
    opener = new OrbitalFileOpener(this.properties);
    ScratchStore scratch = null;
    if (OrbXProperties.Key.CACHE_PERSIST.getBoolean(this.properties)) {
      Path directory = Paths.get(OrbXProperties.Key.SCRATCH_DIR.getString(this.properties),
          "orbx-cache");
      scratch = new ScratchStore(directory);
    }
    cache = new DensityCache(scratch);
    int threads = Math.max(1, Runtime.getRuntime().availableProcessors());
    executor = Executors.newFixedThreadPool(threads, new GridThreadFactory());
  }

  /** Daemon workers, so an open session never keeps the JVM alive. */
  private static final class GridThreadFactory implements ThreadFactory {

    private final AtomicInteger count = new AtomicInteger();

    @Override
    public Thread newThread(Runnable runnable) {
      Thread thread = new Thread(runnable, "orbx-grid-" + count.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    }
  }

  /**
   * Load a file and make it the active model. InpOrb, Luscus and grid files use the current model
   * as companion when it was read from HDF5.
   *
   * @param file the file.
   * @return the new model.
   * @throws FileNotFoundException if the file cannot be read.
   * @throws ParseException if no format can read the file.
   */
  public OrbitalFile load(File file) throws FileNotFoundException, ParseException {
    OrbitalFile current = orbitalFile;
    OrbitalFile companion = null;
    if (current != null && OrbitalFormat.HDF5.getFormatName().equals(current.getFormat())) {
      companion = current;
    }
    OrbitalFile loaded = opener.open(file, companion);
    swap(loaded);
    logger.info(format(" Active model:%s", loaded));
    return loaded;
  }

  /**
   * Make an already constructed model the active one.
   *
   * @param model the model.
   */
  public void setOrbitalFile(OrbitalFile model) {
    swap(model);
  }

  /**
   * Replace one orbital set of the active model, e.g. after reordering or retyping it.
   *
   * @param old a set of the active model.
   * @param edited its replacement.
   * @return the new model.
   */
  public OrbitalFile replaceOrbitalSet(OrbitalSet old, OrbitalSet edited) {
    OrbitalFile current = getOrbitalFile();
    OrbitalFile replaced = current.toBuilder().replaceOrbitalSet(old, edited).build();
    swap(replaced);
    return replaced;
  }

  private void swap(OrbitalFile model) {
    cancelAll();
    OrbitalFile old;
    lock.writeLock().lock();
    try {
      old = orbitalFile;
      orbitalFile = model;
    } finally {
      lock.writeLock().unlock();
    }
    if (old == null) {
      return;
    }
    Set<String> kept = sourceFingerprints(model);
    for (String fingerprint : sourceFingerprints(old)) {
      if (!kept.contains(fingerprint)) {
        cache.invalidate(fingerprint);
      }
    }
  }

  private static Set<String> sourceFingerprints(OrbitalFile model) {
    Set<String> fingerprints = new HashSet<>();
    for (OrbitalSet set : model.getOrbitalSets()) {
      fingerprints.add(model.getSourceFingerprint(set));
    }
    if (model.getPrecomputedSet() != null) {
      fingerprints.add(model.getSourceFingerprint(model.getPrecomputedSet()));
    }
    return fingerprints;
  }

  /**
   * The active model.
   *
   * @return the model.
   * @throws IllegalStateException if nothing has been loaded.
   */
  public OrbitalFile getOrbitalFile() {
    OrbitalFile current = orbitalFile;
    if (current == null) {
      throw new IllegalStateException(" No orbital file has been loaded.");
    }
    return current;
  }

  /**
   * Compute a field in the background.
   *
   * @param request the field.
   * @param gridSpec the grid.
   * @return the outcome.
   */
  public Future<GridOutcome> compute(FieldRequest request, GridSpec gridSpec) {
    return compute(request, gridSpec, new CancellationToken());
  }

  /**
   * Compute a field in the background.
   *
   * @param request the field.
   * @param gridSpec the grid.
   * @param token cancels this computation; loading a new model cancels it too.
   * @return the outcome; FAILED if the request refers to sets that are not in the active model.
   */
  public Future<GridOutcome> compute(FieldRequest request, GridSpec gridSpec,
      CancellationToken token) {
    activeTokens.add(token);
    return executor.submit(() -> {
      try {
        return GridOutcome.computed(computeNow(request, gridSpec, token));
      } catch (OperationCancelledException e) {
        logger.info(format(" Computation of %s was cancelled.", request.getLabel()));
        return GridOutcome.cancelled();
      } catch (IOException | RuntimeException e) {
        logger.warning(format(" Computation of %s failed:%s", request.getLabel(),
            e.getMessage()));
        return GridOutcome.failed(e);
      } finally {
        activeTokens.remove(token);
      }
    });
  }

  private ScalarField computeNow(FieldRequest request, GridSpec gridSpec,
      CancellationToken token) throws OperationCancelledException, IOException {
    lock.readLock().lock();
    try {
      OrbitalFile model = getOrbitalFile();
      // Throws for sets of a replaced model.
      FieldKey key = request.key(model, gridSpec);
      GridEvaluator evaluator = new GridEvaluator(model, properties);
      if (!request.isLaplacian()) {
        return cache.getOrCompute(key, token, t -> evaluator.evaluate(request, gridSpec, t));
      }
      FieldRequest inner = request.getInner();
      ScalarField field = cache.getOrCompute(inner.key(model, gridSpec), token,
          t -> evaluator.evaluate(inner, gridSpec, t));
      return cache.getOrCompute(key, token, t -> Laplacian.apply(field, request.getLabel(), t));
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Cancel every computation in flight. */
  public void cancelAll() {
    for (CancellationToken token : activeTokens) {
      token.cancel();
    }
  }

  /**
   * The default grid of the active model: a box around the atoms following the configured
   * clearance and resolution, or the stored grid of a file without a basis.
   *
   * @return the grid.
   */
  public GridSpec defaultGrid() {
    OrbitalFile current = getOrbitalFile();
    if (!current.canEvaluate() && current.getPrecomputedFields() != null) {
      return current.getPrecomputedFields().getGridSpec();
    }
    double[][] xyz = current.getMolecule() == null ? new double[0][]
        : current.getMolecule().getCoordinates();
    return GridSpec.boxAround(xyz, OrbXProperties.Key.GRID_CLEARANCE.getDouble(properties),
        OrbXProperties.Key.GRID_POINTS.getInt(properties));
  }

  /**
   * Orbitals of a set by occupation descending, then energy ascending across irreps. Orbitals
   * with an invalid energy come last within their occupation.
   *
   * @param set the set.
   * @return a new list.
   */
  public List<Orbital> sortedOrbitals(OrbitalSet set) {
    return set.sortedByOccupationAndEnergy();
  }

  /**
   * Getter for the field <code>cache</code>.
   *
   * @return the cache.
   */
  public DensityCache getCache() {
    return cache;
  }

  /** {@inheritDoc} */
  @Override
  public void close() {
    cancelAll();
    executor.shutdown();
    try {
      if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
        logger.warning(" Grid workers did not stop within 10 seconds.");
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
    cache.clearMemory();
  }
}
