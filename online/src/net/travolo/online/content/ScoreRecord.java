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

package net.travolo.online.content;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

import com.google.common.base.Preconditions;

import net.travolo.common.LangUtils;
import net.travolo.common.ScoredItem;

/**
 * <p>Scores for one catalog item within one request. Each {@link ContentFactor} sub-score is present
 * only if its inputs were available; {@link #getFactorScore(ContentFactor)} returns {@link Double#NaN}
 * otherwise. The content score is the weighted mean of the present sub-scores, renormalized by
 * the weights of those present, or 0 if none is.</p>
 *
 * <p>The collaborative score starts at 0 and the hybrid score equals the content score until
 * {@link #blend(double, double, double)} is called.</p>
 */
public final class ScoreRecord implements ScoredItem {

  private final String itemID;
  private final Map<ContentFactor,Double> factorScores;
  private final double contentScore;
  private double collabScore;
  private double hybridScore;

  public ScoreRecord(String itemID, Map<ContentFactor,Double> factorScores) {
    Preconditions.checkNotNull(itemID);
    this.itemID = itemID;
    this.factorScores = new EnumMap<ContentFactor,Double>(ContentFactor.class);
    double weightedSum = 0.0;
    double weightSum = 0.0;
    for (Map.Entry<ContentFactor,Double> entry : factorScores.entrySet()) {
      Double score = entry.getValue();
      if (score != null && LangUtils.isFinite(score)) {
        ContentFactor factor = entry.getKey();
        this.factorScores.put(factor, score);
        weightedSum += factor.getWeight() * score;
        weightSum += factor.getWeight();
      }
    }
    contentScore = weightSum > 0.0 ? weightedSum / weightSum : 0.0;
    collabScore = 0.0;
    hybridScore = contentScore;
  }

  @Override
  public String getItemID() {
    return itemID;
  }

  public boolean hasFactorScore(ContentFactor factor) {
    return factorScores.containsKey(factor);
  }

  /**
   * @return sub-score for the factor, or {@link Double#NaN} if it could not be computed
   */
  public double getFactorScore(ContentFactor factor) {
    Double score = factorScores.get(factor);
    return score == null ? Double.NaN : score;
  }

  public double getContentScore() {
    return contentScore;
  }

  public double getCollabScore() {
    return collabScore;
  }

  public double getHybridScore() {
    return hybridScore;
  }

  /**
   * Sets the collaborative score and computes the hybrid score as
   * {@code contentWeight * contentScore + collabWeight * collabScore}.
   */
  public void blend(double collabScore, double contentWeight, double collabWeight) {
    this.collabScore = collabScore;
    hybridScore = contentWeight * contentScore + collabWeight * collabScore;
  }

  /**
   * @return the hybrid score, which ranking orders by
   */
  @Override
  public double getValue() {
    return hybridScore;
  }

  /**
   * @return one line per sub-score followed by the content, collaborative and hybrid scores, with
   *  "N/A" for sub-scores that are absent
   */
  public String describe() {
    StringBuilder result = new StringBuilder();
    for (ContentFactor factor : ContentFactor.values()) {
      result.append(String.format(Locale.ENGLISH, "  %-16s %s%n", factor, format(getFactorScore(factor))));
    }
    result.append(String.format(Locale.ENGLISH, "  %-16s %s%n", "CONTENT", format(contentScore)));
    result.append(String.format(Locale.ENGLISH, "  %-16s %s%n", "COLLABORATIVE", format(collabScore)));
    result.append(String.format(Locale.ENGLISH, "  %-16s %s", "HYBRID", format(hybridScore)));
    return result.toString();
  }

  private static String format(double value) {
    return Double.isNaN(value) ? "N/A" : String.format(Locale.ENGLISH, "%.3f", value);
  }

  @Override
  public String toString() {
    return "ScoreRecord[" + itemID + ", content=" + contentScore + ", collab=" + collabScore +
        ", hybrid=" + hybridScore + ", factors=" + factorScores + ']';
  }

}
