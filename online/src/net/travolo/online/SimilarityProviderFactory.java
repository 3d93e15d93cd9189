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

package net.travolo.online;

import java.io.File;

import com.google.common.base.Preconditions;

import net.travolo.common.ClassUtils;
import net.travolo.online.io.FileSimilarityProvider;
import net.travolo.online.similarity.InMemorySimilarityProvider;
import net.travolo.online.similarity.SimilarityProvider;

/**
 * <p>This class helps choose which {@link SimilarityProvider} a {@link DestinationRecommender} loads
 * similarities from. If {@link RecommenderConfiguration#getSimilarityProviderClass()} is set, then this class
 * will be loaded and used. It must have a public no-argument constructor.</p>
 *
 * <p>Otherwise, if {@link RecommenderConfiguration#getSimilarityFile()} is set, a {@link FileSimilarityProvider}
 * reads that file.</p>
 *
 * <p>Otherwise a provider with no similarities is returned, and collaborative scoring never contributes.</p>
 */
public final class SimilarityProviderFactory {

  private SimilarityProviderFactory() {
  }

  /**
   * @return an implementation of {@link SimilarityProvider} chosen per above. It will be non-null.
   */
  public static SimilarityProvider buildSimilarityProvider(RecommenderConfiguration config) {
    Preconditions.checkNotNull(config);
    String providerClass = config.getSimilarityProviderClass();
    if (providerClass != null) {
      return ClassUtils.loadInstanceOf(providerClass, SimilarityProvider.class);
    }
    String similarityFile = config.getSimilarityFile();
    if (similarityFile != null) {
      return new FileSimilarityProvider(new File(similarityFile));
    }
    return new InMemorySimilarityProvider();
  }

}
