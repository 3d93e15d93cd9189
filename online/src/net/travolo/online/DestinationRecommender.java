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

import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.apache.mahout.cf.taste.common.TasteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.travolo.online.content.ContentScorer;
import net.travolo.online.content.NullScoreDiagnostics;
import net.travolo.online.content.ScoreDiagnostics;
import net.travolo.online.content.ScoreRecord;
import net.travolo.online.feedback.FeedbackAdjuster;
import net.travolo.online.feedback.ProfileAdjustment;
import net.travolo.online.model.CatalogItem;
import net.travolo.online.model.PreferenceProfile;
import net.travolo.online.similarity.CollaborativeScorer;
import net.travolo.online.similarity.SimilarityCache;

/**
 * <p>Recommends destinations for a {@link PreferenceProfile}. A full request:</p>
 *
 * <ol>
 *   <li>adjusts the profile's theme scores from its like/dislike ratings ({@link #adjustProfile(PreferenceProfile, Iterable)})</li>
 *   <li>scores each catalog item's content against the adjusted profile
 *    ({@link #scoreContent(PreferenceProfile, Iterable)})</li>
 *   <li>scores unrated items by their similarity to liked items
 *    ({@link #scoreCollaborative(PreferenceProfile, Iterable)})</li>
 *   <li>blends both and keeps the best ({@link #rank(Map, Map, boolean)})</li>
 * </ol>
 *
 * <p>Item similarities are shared by all requests through a {@link SimilarityCache}. Whoever updates the
 * underlying similarities should call {@link #invalidateSimilarities()} afterwards. Otherwise this class
 * holds no state between requests and may be used by many threads at once.</p>
 *
 * <p>Missing data never fails a request: an unavailable catalog gives an empty result and unavailable
 * similarities give content-only scores.</p>
 */
public final class DestinationRecommender {

  private static final Logger log = LoggerFactory.getLogger(DestinationRecommender.class);

  private final CatalogProvider catalogProvider;
  private final SimilarityCache similarityCache;
  private final RecommenderConfiguration config;
  private final FeedbackAdjuster feedbackAdjuster;
  private final ContentScorer contentScorer;
  private final CollaborativeScorer collaborativeScorer;
  private final HybridRanker ranker;

  /**
   * Creates a recommender whose similarities come from the provider that {@link SimilarityProviderFactory}
   * chooses for {@code config}.
   */
  public DestinationRecommender(CatalogProvider catalogProvider, RecommenderConfiguration config) {
    this(catalogProvider,
         new SimilarityCache(SimilarityProviderFactory.buildSimilarityProvider(config)),
         config,
         NullScoreDiagnostics.getInstance());
  }

  /**
   * @param catalogProvider source of the catalog for {@link #recommend(PreferenceProfile)}; may be {@code null}
   *  if only {@link #recommend(PreferenceProfile, Iterable)} is used
   * @param similarityCache item similarities
   * @param config weights and result size
   * @param diagnostics told about every candidate's scores
   */
  public DestinationRecommender(CatalogProvider catalogProvider,
                                SimilarityCache similarityCache,
                                RecommenderConfiguration config,
                                ScoreDiagnostics diagnostics) {
    Preconditions.checkNotNull(similarityCache);
    Preconditions.checkNotNull(config);
    this.catalogProvider = catalogProvider;
    this.similarityCache = similarityCache;
    this.config = config;
    feedbackAdjuster = new FeedbackAdjuster();
    contentScorer = new ContentScorer();
    collaborativeScorer = new CollaborativeScorer(similarityCache);
    ranker = new HybridRanker(config.getContentWeight(), config.getCollabWeight(), diagnostics);
  }

  public RecommenderConfiguration getConfiguration() {
    return config;
  }

  public SimilarityCache getSimilarityCache() {
    return similarityCache;
  }

  public ProfileAdjustment adjustProfile(PreferenceProfile profile, Iterable<CatalogItem> catalog) {
    return feedbackAdjuster.adjust(profile, catalog);
  }

  public Map<String,ScoreRecord> scoreContent(PreferenceProfile adjustedProfile, Iterable<CatalogItem> catalog) {
    return contentScorer.score(adjustedProfile, catalog);
  }

  public Map<String,Double> scoreCollaborative(PreferenceProfile profile, Iterable<CatalogItem> catalog) {
    return collaborativeScorer.score(profile, catalog);
  }

  /**
   * Like {@link #rank(Map, Map, boolean, int)} for the configured number of results.
   */
  public RecommendationResult rank(Map<String,ScoreRecord> contentScores,
                                   Map<String,Double> collabScores,
                                   boolean hasRatings) {
    return rank(contentScores, collabScores, hasRatings, config.getHowMany());
  }

  /**
   * @see HybridRanker#rank(Map, Map, boolean, int)
   */
  public RecommendationResult rank(Map<String,ScoreRecord> contentScores,
                                   Map<String,Double> collabScores,
                                   boolean hasRatings,
                                   int howMany) {
    return ranker.rank(contentScores, collabScores, hasRatings, howMany);
  }

  /**
   * Recommends from the catalog that this recommender's {@link CatalogProvider} supplies.
   *
   * @return recommendations, or an empty result if the catalog can't be read
   */
  public RecommendationResult recommend(PreferenceProfile profile) {
    Preconditions.checkState(catalogProvider != null, "No catalog provider");
    List<CatalogItem> catalog;
    try {
      catalog = catalogProvider.getCatalog();
    } catch (TasteException te) {
      log.error("Failed to read catalog; no recommendations possible", te);
      return RecommendationResult.empty();
    }
    return recommend(profile, catalog);
  }

  /**
   * @param profile user's preferences; {@code null} gives an empty result
   * @param catalog items to recommend from
   * @return up to the configured number of recommendations, best first
   */
  public RecommendationResult recommend(PreferenceProfile profile, Iterable<CatalogItem> catalog) {
    if (profile == null) {
      log.warn("No preference profile; no recommendations possible");
      return RecommendationResult.empty();
    }
    List<CatalogItem> items = catalog == null ? ImmutableList.<CatalogItem>of() : ImmutableList.copyOf(catalog);
    if (items.isEmpty()) {
      log.warn("Catalog is empty; no recommendations possible");
      return RecommendationResult.empty();
    }

    ProfileAdjustment adjustment = adjustProfile(profile, items);
    PreferenceProfile adjusted = adjustment.getAdjustedProfile();
    Map<String,ScoreRecord> contentScores = scoreContent(adjusted, items);
    Map<String,Double> collabScores = scoreCollaborative(adjusted, items);
    RecommendationResult result = rank(contentScores, collabScores, profile.hasRatings());
    log.info("Recommended {} of {} destinations", result.size(), items.size());
    return result.withAdjustment(adjustment);
  }

  /**
   * Discards cached item similarities, so that the next request loads them again.
   */
  public void invalidateSimilarities() {
    similarityCache.invalidate();
  }

}
