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

import com.google.common.base.Preconditions;

import net.travolo.common.LangUtils;

/**
 * <p>Encapsulates configuration for a {@link DestinationRecommender}. Values may be set directly, or read
 * from system properties by {@link #fromSystemProperties()}:</p>
 *
 * <ul>
 *   <li>{@code model.recommend.howMany}: number of destinations to recommend (default 3)</li>
 *   <li>{@code model.hybrid.contentWeight}: weight of the content score for users with ratings (default 0.7)</li>
 *   <li>{@code model.hybrid.collabWeight}: weight of the collaborative score for users with ratings
 *    (default 0.3)</li>
 *   <li>{@code model.similarity.file}: file of item similarities, read by
 *    {@link net.travolo.online.io.FileSimilarityProvider}</li>
 *   <li>{@code model.similarity.providerClass}: name of a custom
 *    {@link net.travolo.online.similarity.SimilarityProvider} to use instead</li>
 * </ul>
 *
 * <p>Users without ratings are always scored on content alone.</p>
 */
public final class RecommenderConfiguration {

  public static final int DEFAULT_HOW_MANY = 3;
  public static final double DEFAULT_CONTENT_WEIGHT = 0.7;
  public static final double DEFAULT_COLLAB_WEIGHT = 0.3;

  private int howMany;
  private double contentWeight;
  private double collabWeight;
  private String similarityFile;
  private String similarityProviderClass;

  public RecommenderConfiguration() {
    howMany = DEFAULT_HOW_MANY;
    contentWeight = DEFAULT_CONTENT_WEIGHT;
    collabWeight = DEFAULT_COLLAB_WEIGHT;
  }

  /**
   * @return configuration with defaults, overridden by any {@code model.*} system properties that are set
   */
  public static RecommenderConfiguration fromSystemProperties() {
    RecommenderConfiguration config = new RecommenderConfiguration();
    String howManyString = System.getProperty("model.recommend.howMany");
    if (howManyString != null) {
      config.setHowMany(Integer.parseInt(howManyString.trim()));
    }
    String contentWeightString = System.getProperty("model.hybrid.contentWeight");
    if (contentWeightString != null) {
      config.setContentWeight(LangUtils.parseDouble(contentWeightString));
    }
    String collabWeightString = System.getProperty("model.hybrid.collabWeight");
    if (collabWeightString != null) {
      config.setCollabWeight(LangUtils.parseDouble(collabWeightString));
    }
    config.setSimilarityFile(System.getProperty("model.similarity.file"));
    config.setSimilarityProviderClass(System.getProperty("model.similarity.providerClass"));
    return config;
  }

  /**
   * @return how many destinations to recommend. Defaults to {@link #DEFAULT_HOW_MANY}.
   */
  public int getHowMany() {
    return howMany;
  }

  public void setHowMany(int howMany) {
    Preconditions.checkArgument(howMany > 0, "howMany must be positive: %s", howMany);
    this.howMany = howMany;
  }

  /**
   * @return weight of the content score for users with ratings. Defaults to {@link #DEFAULT_CONTENT_WEIGHT}.
   */
  public double getContentWeight() {
    return contentWeight;
  }

  public void setContentWeight(double contentWeight) {
    Preconditions.checkArgument(contentWeight >= 0.0 && LangUtils.isFinite(contentWeight),
                                "Bad content weight: %s", contentWeight);
    this.contentWeight = contentWeight;
  }

  /**
   * @return weight of the collaborative score for users with ratings. Defaults to {@link #DEFAULT_COLLAB_WEIGHT}.
   */
  public double getCollabWeight() {
    return collabWeight;
  }

  public void setCollabWeight(double collabWeight) {
    Preconditions.checkArgument(collabWeight >= 0.0 && LangUtils.isFinite(collabWeight),
                                "Bad collaborative weight: %s", collabWeight);
    this.collabWeight = collabWeight;
  }

  /**
   * @return path of the item similarity file, or {@code null} if not set
   */
  public String getSimilarityFile() {
    return similarityFile;
  }

  public void setSimilarityFile(String similarityFile) {
    this.similarityFile = similarityFile;
  }

  /**
   * @return name of a custom similarity provider class, or {@code null} if not set
   */
  public String getSimilarityProviderClass() {
    return similarityProviderClass;
  }

  public void setSimilarityProviderClass(String similarityProviderClass) {
    this.similarityProviderClass = similarityProviderClass;
  }

  @Override
  public String toString() {
    return "RecommenderConfiguration[howMany=" + howMany + ", contentWeight=" + contentWeight +
        ", collabWeight=" + collabWeight + ", similarityFile=" + similarityFile +
        ", similarityProviderClass=" + similarityProviderClass + ']';
  }

}
