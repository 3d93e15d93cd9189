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

import java.util.Collection;
import java.util.Set;

import org.apache.commons.math3.util.FastMath;

import net.travolo.common.LangUtils;
import net.travolo.common.math.SimpleVectorMath;
import net.travolo.online.model.BudgetLevel;

/**
 * The individual content sub-score functions. Each returns a value in [0,1], or {@link Double#NaN}
 * where the sub-score does not apply.
 */
public final class ContentFactors {

  /** Width of the climate bell curve in degrees Celsius. */
  public static final double CLIMATE_SIGMA = 5.0;
  /** Distance at which the base distance score falls to 0.5. */
  public static final double DISTANCE_SCALE_KM = 2000.0;
  /** Lowest multiplier that a trip-length distance penalty may apply. */
  public static final double MIN_DISTANCE_PENALTY = 0.1;

  static final double REGION_MATCH = 1.0;
  static final double REGION_MISMATCH = 0.3;
  static final double DURATION_OVERLAP = 1.0;
  static final double DURATION_NO_OVERLAP = 0.5;
  static final double DURATION_ONLY_ITEM = 0.7;
  static final double DURATION_ONLY_USER = 0.8;

  private ContentFactors() {
  }

  /**
   * @return cosine similarity of the two theme vectors
   */
  public static double themeScore(double[] userThemes, double[] itemThemes) {
    return SimpleVectorMath.cosineSimilarity(userThemes, itemThemes);
  }

  /**
   * @return {@code exp(-(avgTemp - desiredMid)^2 / (2 sigma^2))} limited to [0,1]
   */
  public static double gaussianClimateScore(double avgTemp, double desiredMid, double sigma) {
    double delta = avgTemp - desiredMid;
    return LangUtils.clamp(FastMath.exp(-(delta * delta) / (2.0 * sigma * sigma)), 0.0, 1.0);
  }

  /**
   * @param accepted budget levels the user accepts; must not be empty
   * @param itemLevel the item's level
   * @return 1 if the item's level is accepted, otherwise 1 minus 0.5 per level of distance to the nearest
   *  accepted level, floored at 0
   */
  public static double budgetScore(Collection<BudgetLevel> accepted, BudgetLevel itemLevel) {
    if (accepted.contains(itemLevel)) {
      return 1.0;
    }
    int minDistance = Integer.MAX_VALUE;
    for (BudgetLevel level : accepted) {
      minDistance = Math.min(minDistance, Math.abs(level.getLevel() - itemLevel.getLevel()));
    }
    return Math.max(0.0, 1.0 - 0.5 * minDistance);
  }

  /**
   * @param preferredRegions lower-cased regions the user prefers
   * @param itemRegion lower-cased region of the item
   */
  public static double regionScore(Set<String> preferredRegions, String itemRegion) {
    return preferredRegions.contains(itemRegion) ? REGION_MATCH : REGION_MISMATCH;
  }

  /**
   * @param userDurations normalized duration labels the user asked for
   * @param itemDurations normalized ideal duration labels of the item
   * @return 1 if both are given and overlap, 0.5 if both are given and do not, 0.7 if only the item
   *  has durations, 0.8 if only the user gave durations, {@link Double#NaN} if neither did
   */
  public static double durationMatchScore(Set<String> userDurations, Set<String> itemDurations) {
    boolean userHas = !userDurations.isEmpty();
    boolean itemHas = !itemDurations.isEmpty();
    if (userHas && itemHas) {
      for (String duration : itemDurations) {
        if (userDurations.contains(duration)) {
          return DURATION_OVERLAP;
        }
      }
      return DURATION_NO_OVERLAP;
    }
    if (itemHas) {
      return DURATION_ONLY_ITEM;
    }
    if (userHas) {
      return DURATION_ONLY_USER;
    }
    return Double.NaN;
  }

  /**
   * @return {@code 1 / (1 + (km / 2000)^2)}
   */
  public static double baseDistanceScore(double km) {
    double scaled = km / DISTANCE_SCALE_KM;
    return 1.0 / (1.0 + scaled * scaled);
  }

  /**
   * @return 1 when {@code km} is within {@code thresholdKm}, else {@code thresholdKm / km} but no less than 0.1
   */
  public static double distancePenalty(double km, double thresholdKm) {
    if (km > thresholdKm && thresholdKm > 0.0) {
      return Math.max(MIN_DISTANCE_PENALTY, thresholdKm / km);
    }
    return 1.0;
  }

}
