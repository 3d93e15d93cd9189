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

import java.time.Month;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import org.apache.mahout.cf.taste.impl.common.FullRunningAverage;
import org.apache.mahout.cf.taste.impl.common.RunningAverage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.travolo.common.math.GeoDistance;
import net.travolo.online.model.BudgetLevel;
import net.travolo.online.model.CatalogItem;
import net.travolo.online.model.GeoPoint;
import net.travolo.online.model.MonthlyTemperature;
import net.travolo.online.model.PreferenceProfile;
import net.travolo.online.model.TemperatureRange;
import net.travolo.online.model.TripDuration;

/**
 * <p>Scores every catalog item against a (usually already feedback-adjusted) profile on up to six
 * {@link ContentFactor}s and combines them into a content score. A factor whose inputs are missing,
 * on either the profile or the item, is left out of the record rather than scored as 0.</p>
 *
 * <p>This class is stateless and thread-safe.</p>
 */
public final class ContentScorer {

  private static final Logger log = LoggerFactory.getLogger(ContentScorer.class);

  /**
   * @param profile preferences to score against
   * @param catalog items to score
   * @return item ID to its {@link ScoreRecord}, in catalog iteration order
   */
  public Map<String,ScoreRecord> score(PreferenceProfile profile, Iterable<CatalogItem> catalog) {
    Preconditions.checkNotNull(profile);
    Preconditions.checkNotNull(catalog);
    UserTerms terms = new UserTerms(profile);
    Map<String,ScoreRecord> records = Maps.newLinkedHashMap();
    for (CatalogItem item : catalog) {
      ScoreRecord record = scoreItem(terms, item);
      if (records.put(item.getID(), record) != null) {
        log.warn("Duplicate catalog item {}; later entry replaces earlier one", item.getID());
      }
    }
    log.debug("Computed content scores for {} items", records.size());
    return records;
  }

  private static ScoreRecord scoreItem(UserTerms terms, CatalogItem item) {
    Map<ContentFactor,Double> scores = new EnumMap<ContentFactor,Double>(ContentFactor.class);

    scores.put(ContentFactor.THEME, ContentFactors.themeScore(terms.themeVector, item.getThemeVector()));

    if (terms.midpoint != null && !terms.months.isEmpty()) {
      RunningAverage climate = new FullRunningAverage();
      for (int month : terms.months) {
        MonthlyTemperature temperature = item.getMonthlyTemperature(month);
        if (temperature != null) {
          climate.addDatum(ContentFactors.gaussianClimateScore(temperature.getAvg(),
                                                               terms.midpoint,
                                                               ContentFactors.CLIMATE_SIGMA));
        }
      }
      if (climate.getCount() > 0) {
        scores.put(ContentFactor.CLIMATE, climate.getAverage());
      }
    }

    if (!terms.budgets.isEmpty()) {
      BudgetLevel itemLevel = BudgetLevel.fromLabel(item.getBudgetLevel());
      if (itemLevel != null) {
        scores.put(ContentFactor.BUDGET, ContentFactors.budgetScore(terms.budgets, itemLevel));
      }
    }

    String itemRegion = item.getRegion();
    if (!terms.regions.isEmpty() && itemRegion != null && !itemRegion.isEmpty()) {
      scores.put(ContentFactor.REGION,
                 ContentFactors.regionScore(terms.regions, itemRegion.toLowerCase(Locale.ENGLISH)));
    }

    double durationScore =
        ContentFactors.durationMatchScore(terms.durations, normalizeDurations(item.getIdealDurations()));
    if (!Double.isNaN(durationScore)) {
      scores.put(ContentFactor.DURATION_MATCH, durationScore);
    }

    if (terms.origin != null && item.hasCoordinates()) {
      double km = GeoDistance.haversineKm(terms.origin.getLatitude(), terms.origin.getLongitude(),
                                          item.getLatitude(), item.getLongitude());
      double distanceScore = ContentFactors.baseDistanceScore(km);
      if (terms.shortestTripDays > 0) {
        double threshold = TripDuration.maxDistanceKmForDays(terms.shortestTripDays);
        distanceScore *= ContentFactors.distancePenalty(km, threshold);
      }
      scores.put(ContentFactor.DISTANCE, distanceScore);
    }

    return new ScoreRecord(item.getID(), scores);
  }

  private static Set<String> normalizeDurations(Collection<String> labels) {
    Set<String> normalized = Sets.newHashSetWithExpectedSize(labels.size());
    for (String label : labels) {
      normalized.add(TripDuration.normalizeLabel(label));
    }
    return normalized;
  }

  /**
   * @return month number 1-12 for a full English month name in any case, or -1 if not a month name
   */
  static int parseMonth(String name) {
    try {
      return Month.valueOf(name.trim().toUpperCase(Locale.ENGLISH)).getValue();
    } catch (IllegalArgumentException iae) {
      return -1;
    }
  }

  /**
   * The profile's preferences, normalized once per request rather than once per item.
   */
  private static final class UserTerms {

    private final double[] themeVector;
    private final Double midpoint;
    private final Set<Integer> months;
    private final Set<BudgetLevel> budgets;
    private final Set<String> regions;
    private final Set<String> durations;
    private final GeoPoint origin;
    private final int shortestTripDays;

    UserTerms(PreferenceProfile profile) {
      themeVector = profile.getThemeVector();

      TemperatureRange range = profile.getTemperatureRange();
      midpoint = range == null ? null : range.getMidpoint();

      months = Sets.newLinkedHashSet();
      for (String name : profile.getTravelMonths()) {
        int month = parseMonth(name);
        if (month < 0) {
          log.warn("Ignoring unknown travel month {}", name);
        } else {
          months.add(month);
        }
      }

      budgets = EnumSet.noneOf(BudgetLevel.class);
      for (String label : profile.getTravelBudgets()) {
        BudgetLevel level = BudgetLevel.fromLabel(label);
        if (level == null) {
          log.warn("Ignoring unknown budget level {}", label);
        } else {
          budgets.add(level);
        }
      }

      regions = Sets.newHashSet();
      for (String region : profile.getPreferredRegions()) {
        regions.add(region.toLowerCase(Locale.ENGLISH));
      }

      durations = normalizeDurations(profile.getTravelDurations());

      int shortest = Integer.MAX_VALUE;
      for (String label : durations) {
        TripDuration duration = TripDuration.fromLabel(label);
        if (duration != null) {
          shortest = Math.min(shortest, duration.getDays());
        }
      }
      shortestTripDays = shortest == Integer.MAX_VALUE ? 0 : shortest;

      origin = profile.getOrigin();
    }
  }

}
