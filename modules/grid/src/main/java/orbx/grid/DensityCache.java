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

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;
import orbx.lattice.ScalarField;

/**
 * A cache of computed fields with single flight computation per key.
 *
 * <p>The first caller for a key installs a future and computes; later callers wait on that future.
 * If the computing caller is cancelled or fails, its future is removed so the key stays
 * unpopulated. Waiters of a cancelled computation retry and compute themselves unless their own
 * token is set; waiters of a failed computation see the same failure.
 *
 * <p>Fields are optionally persisted in a {@link ScratchStore} and loaded from it before
 * computing.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class DensityCache {

  private static final Logger logger = Logger.getLogger(DensityCache.class.getName());

  /** How often waiters poll their own token (ms). */
  private static final long POLL_MILLIS = 50;

  private final ConcurrentHashMap<FieldKey, CompletableFuture<ScalarField>> entries =
      new ConcurrentHashMap<>();
  private final ScratchStore scratch;
  private final AtomicLong computations = new AtomicLong();

  /** Constructor for an in-memory DensityCache. */
  public DensityCache() {
    this(null);
  }

  /**
   * Constructor for DensityCache.
   *
   * @param scratch persistent storage, or null.
   */
  public DensityCache(ScratchStore scratch) {
    this.scratch = scratch;
  }

  /**
   * Return the field of a key, computing it at most once between invalidations.
   *
   * @param key the key.
   * @param token the caller's cancellation token.
   * @param producer computes the field if it is neither cached nor persisted.
   * @return the field; repeated calls return the same instance.
   * @throws OperationCancelledException if the caller's token was set.
   * @throws IOException if the producer failed reading stored data.
   */
  public ScalarField getOrCompute(FieldKey key, CancellationToken token, FieldProducer producer)
      throws OperationCancelledException, IOException {
    while (true) {
      token.throwIfCancelled();
      CompletableFuture<ScalarField> future = new CompletableFuture<>();
      CompletableFuture<ScalarField> existing = entries.putIfAbsent(key, future);
      if (existing == null) {
        return compute(key, token, producer, future);
      }
      try {
        return await(existing, token);
      } catch (ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof OperationCancelledException) {
          logger.fine(format(" Computation of%s was cancelled; retrying.", key));
          continue;
        }
        if (cause instanceof IOException) {
          throw (IOException) cause;
        }
        if (cause instanceof RuntimeException) {
          throw (RuntimeException) cause;
        }
        if (cause instanceof Error) {
          throw (Error) cause;
        }
        throw new IllegalStateException(cause);
      }
    }
  }

  private ScalarField compute(FieldKey key, CancellationToken token, FieldProducer producer,
      CompletableFuture<ScalarField> future) throws OperationCancelledException, IOException {
    try {
      ScalarField field = scratch == null ? null : scratch.load(key);
      if (field == null) {
        computations.incrementAndGet();
        field = producer.produce(token);
        if (scratch != null) {
          try {
            scratch.store(key, field);
          } catch (IOException e) {
            logger.warning(format(" Could not persist%s: %s", key, e));
          }
        }
      }
      future.complete(field);
      return field;
    } catch (OperationCancelledException | IOException | RuntimeException | Error e) {
      entries.remove(key, future);
      future.completeExceptionally(e);
      throw e;
    }
  }

  private static ScalarField await(CompletableFuture<ScalarField> future, CancellationToken token)
      throws OperationCancelledException, ExecutionException {
    while (true) {
      token.throwIfCancelled();
      try {
        return future.get(POLL_MILLIS, TimeUnit.MILLISECONDS);
      } catch (TimeoutException e) {
        // Poll the token again.
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new OperationCancelledException();
      }
    }
  }

  /**
   * The completed field of a key.
   *
   * @param key the key.
   * @return the field, or null if it is absent or still being computed.
   */
  public ScalarField peek(FieldKey key) {
    CompletableFuture<ScalarField> future = entries.get(key);
    if (future == null || !future.isDone() || future.isCompletedExceptionally()) {
      return null;
    }
    return future.join();
  }

  /**
   * Remove every entry derived from a set, in memory and in scratch storage.
   *
   * @param fingerprint the fingerprint of the set.
   * @return the number of entries removed from memory.
   */
  public int invalidate(String fingerprint) {
    int count = 0;
    for (Map.Entry<FieldKey, CompletableFuture<ScalarField>> entry : entries.entrySet()) {
      if (entry.getKey().references(fingerprint)
          && entries.remove(entry.getKey(), entry.getValue())) {
        count++;
      }
    }
    if (scratch != null) {
      try {
        int removed = scratch.removeReferencing(fingerprint);
        logger.fine(format(" Removed %d persisted fields.", removed));
      } catch (IOException e) {
        logger.warning(format(" Could not remove persisted fields: %s", e));
      }
    }
    if (count > 0) {
      logger.info(format(" Invalidated %d cached field(s).", count));
    }
    return count;
  }

  /** Remove every entry, in memory and in scratch storage. */
  public void clear() {
    entries.clear();
    if (scratch != null) {
      try {
        scratch.clear();
      } catch (IOException e) {
        logger.warning(format(" Could not clear %s: %s", scratch.getDirectory(), e));
      }
    }
  }

  /** Drop the entries held in memory and keep persisted fields for later sessions. */
  public void clearMemory() {
    entries.clear();
  }

  /**
   * The number of entries held in memory, including computations in flight.
   *
   * @return the size.
   */
  public int size() {
    return entries.size();
  }

  /**
   * The number of times a producer has been invoked.
   *
   * @return the count.
   */
  public long getComputationCount() {
    return computations.get();
  }
}
