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
import com.google.common.collect.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.travolo.common.TopN;
import net.travolo.online.content.NullScoreDiagnostics;
import net.travolo.online.content.ScoreDiagnostics;
import net.travolo.online.content.ScoreRecord;

/**
 * <p>Blends content and collaborative scores into a hybrid score and picks the best candidates.</p>
 *
 * <p>For users with ratings, the hybrid score is {@code contentWeight * content + collabWeight * collab},
 * a candidate with no collaborative score counting as 0. Without ratings it is the content score alone.
 * Candidates are ranked by hybrid score, ties going to the one earlier in catalog order, and the
 * hybrid score of each one kept is mapped to a confidence by {@link ConfidenceMapper}.</p>
 */
public final class HybridRanker {

  private static final Logger log = LoggerFactory.getLogger(HybridRanker.class);

  private final double contentWeight;
  private final double collabWeight;
  private final ScoreDiagnostics diagnostics;

  public HybridRanker(double contentWeight, double collabWeight) {
    this(contentWeight, collabWeight, NullScoreDiagnostics.getInstance());
  }

  /**
   * @param contentWeight weight of the content score, for users with ratings
   * @param collabWeight weight of the collaborative score, for users with ratings
   * @param diagnostics told about every candidate once blended
   */
  public HybridRanker(double contentWeight, double collabWeight, ScoreDiagnostics diagnostics) {
    Preconditions.checkNotNull(diagnostics);
    this.contentWeight = contentWeight;
    this.collabWeight = collabWeight;
    this.diagnostics = diagnostics;
  }

  /**
   * Sets the collaborative and hybrid scores of each record in {@code contentScores}, then ranks them.
   * The records are updated in place: after this call the caller's map holds the blended scores, and
   * ranking the same map again overwrites them.
   *
   * @param contentScores item ID to content scores, in catalog order; each record is modified
   * @param collabScores item ID to collaborative score; absent items count as 0
   * @param hasRatings whether the user rated any items
   * @param howMany maximum number of results
   * @return best {@code howMany} candidates, best first
   */
  public RecommendationResult rank(Map<String,ScoreRecord> contentScores,
                                   Map<String,Double> collabScores,
                                   boolean hasRatings,
                                   int howMany) {
    Preconditions.checkNotNull(contentScores);
    Preconditions.checkNotNull(collabScores);
    Preconditions.checkArgument(howMany > 0, "howMany must be positive: %s", howMany);

    double theContentWeight = hasRatings ? contentWeight : 1.0;
    double theCollabWeight = hasRatings ? collabWeight : 0.0;
    for (ScoreRecord record : contentScores.values()) {
      Double collab = collabScores.get(record.getItemID());
      record.blend(collab == null ? 0.0 : collab, theContentWeight, theCollabWeight);
      diagnostics.scored(record);
    }

    List<ScoreRecord> top = TopN.selectTopN(contentScores.values(), howMany);
    List<RankedDestination> ranked = Lists.newArrayListWithCapacity(top.size());
    for (ScoreRecord record : top) {
      double hybrid = record.getHybridScore();
      ranked.add(new RankedDestination(record.getItemID(), ConfidenceMapper.toConfidence(hybrid), hybrid));
    }
    log.debug("Ranked {} candidates (weights {} / {}): {}",
              contentScores.size(), theContentWeight, theCollabWeight, ranked);
    return new RecommendationResult(ranked, null);
  }

}
