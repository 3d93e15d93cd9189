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

import org.apache.mahout.cf.taste.common.TasteException;

/**
 * Supplies the current item-item {@link SimilarityMatrix}, typically from some external store.
 * Implementations are called only when {@link SimilarityCache} needs a fresh snapshot.
 * An implementation configured by class name must have a public no-argument constructor.
 */
public interface SimilarityProvider {

  /**
   * @return current similarities; never {@code null}
   * @throws TasteException if the similarities can't be read
   */
  SimilarityMatrix load() throws TasteException;

}
