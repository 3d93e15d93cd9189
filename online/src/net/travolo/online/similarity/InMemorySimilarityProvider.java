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

import com.google.common.base.Preconditions;

/**
 * Supplies a fixed {@link SimilarityMatrix} held in memory.
 */
public final class InMemorySimilarityProvider implements SimilarityProvider {

  private final SimilarityMatrix matrix;

  /**
   * Supplies {@link SimilarityMatrix#EMPTY}.
   */
  public InMemorySimilarityProvider() {
    this(SimilarityMatrix.EMPTY);
  }

  public InMemorySimilarityProvider(SimilarityMatrix matrix) {
    Preconditions.checkNotNull(matrix);
    this.matrix = matrix;
  }

  @Override
  public SimilarityMatrix load() {
    return matrix;
  }

  @Override
  public String toString() {
    return "InMemorySimilarityProvider[" + matrix + ']';
  }

}
