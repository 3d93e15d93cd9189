/*
 * Copyright Travolo
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.travolo.online.similarity;

import java.util.concurrent.Callable;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.travolo.common.ReloadingReference;

/**
 * <p>Holds the {@link SimilarityMatrix} shared by all requests. The matrix is loaded from a
 * {@link SimilarityProvider} on first use and kept until {@link #invalidate()} is called by whoever knows
 * the underlying data changed. Loading and invalidation are serialized, so concurrent first requests load
 * only once and an invalidation never interleaves with a load.</p>
 *
 * <p>A load that fails is logged and treated as an empty matrix for that request. The failure is not
 * cached; the next request tries to load again.</p>
 */
public final class SimilarityCache {

  private static final Logger log = LoggerFactory.getLogger(SimilarityCache.class);

  private final ReloadingReference<SimilarityMatrix> matrix;

  public SimilarityCache(final SimilarityProvider provider) {
    Preconditions.checkNotNull(provider);
    matrix = new ReloadingReference<SimilarityMatrix>(new Callable<SimilarityMatrix>() {
      @Override
      public SimilarityMatrix call() throws Exception {
        log.info("Loading item similarities from {}", provider);
        SimilarityMatrix loaded = provider.load();
        log.info("Loaded similarities for {} items", loaded == null ? 0 : loaded.size());
        return loaded;
      }
    });
  }

  /**
   * @return current matrix, loading it first if needed, or {@link SimilarityMatrix#EMPTY} if it can't be loaded
   */
  public SimilarityMatrix get() {
    try {
      return matrix.get();
    } catch (IllegalStateException ise) {
      Throwable cause = ise.getCause() == null ? ise : ise.getCause();
      log.error("Failed to load item similarities; collaborative scoring is disabled for this request", cause);
      return SimilarityMatrix.EMPTY;
    }
  }

  /**
   * @return current matrix if already loaded, or {@code null} if not
   */
  public SimilarityMatrix maybeGet() {
    return matrix.maybeGet();
  }

  /**
   * Discards the current matrix, so that the next {@link #get()} loads it again.
   */
  public void invalidate() {
    log.info("Invalidating item similarities");
    matrix.clear();
  }

  /**
   * @return number of successful loads so far
   */
  public int getLoadCount() {
    return matrix.getLoadCount();
  }

}
