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

package net.travolo.online.model;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Collection;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.travolo.common.LangUtils;

/**
 * <p>What a traveller is looking for: one score per {@link Theme}, plus optional constraints on
 * climate, trip length, region, distance from home and budget, and optional like/dislike feedback
 * on destinations already seen.</p>
 *
 * <p>Instances are immutable. A theme that was never set scores 0. The optional collections are
 * empty, never {@code null}, when not given; {@link #getTemperatureRange()} and {@link #getOrigin()}
 * return {@code null} when not given.</p>
 */
public final class PreferenceProfile implements Serializable {

  private static final Logger log = LoggerFactory.getLogger(PreferenceProfile.class);

  private final int[] themeScores;
  private final TemperatureRange temperatureRange;
  private final Set<String> travelMonths;
  private final Set<String> travelDurations;
  private final Set<String> preferredRegions;
  private final GeoPoint origin;
  private final Set<String> travelBudgets;
  private final Map<String,Rating> destinationRatings;

  private PreferenceProfile(Builder builder) {
    themeScores = builder.themeScores.clone();
    temperatureRange = builder.temperatureRange;
    travelMonths = ImmutableSet.copyOf(builder.travelMonths);
    travelDurations = ImmutableSet.copyOf(builder.travelDurations);
    preferredRegions = ImmutableSet.copyOf(builder.preferredRegions);
    origin = builder.origin;
    travelBudgets = ImmutableSet.copyOf(builder.travelBudgets);
    destinationRatings = ImmutableMap.copyOf(builder.destinationRatings);
  }

  private PreferenceProfile(PreferenceProfile other, int[] themeScores) {
    this.themeScores = themeScores;
    temperatureRange = other.temperatureRange;
    travelMonths = other.travelMonths;
    travelDurations = other.travelDurations;
    preferredRegions = other.preferredRegions;
    origin = other.origin;
    travelBudgets = other.travelBudgets;
    destinationRatings = other.destinationRatings;
  }

  public static Builder builder() {
    return new Builder();
  }

  public int getThemeScore(Theme theme) {
    return themeScores[theme.ordinal()];
  }

  /**
   * @return copy of the theme scores, in {@link Theme} order
   */
  public int[] getThemeScores() {
    return themeScores.clone();
  }

  /**
   * @return theme scores as a vector, in {@link Theme} order
   */
  public double[] getThemeVector() {
    double[] vector = new double[themeScores.length];
    for (int i = 0; i < themeScores.length; i++) {
      vector[i] = themeScores[i];
    }
    return vector;
  }

  /**
   * @return a profile equal to this one except for its theme scores. This profile is not modified.
   */
  public PreferenceProfile withThemeScores(int[] newThemeScores) {
    Preconditions.checkArgument(newThemeScores.length == Theme.COUNT,
                                "Expected %s theme scores but got %s", Theme.COUNT, newThemeScores.length);
    return new PreferenceProfile(this, newThemeScores.clone());
  }

  public TemperatureRange getTemperatureRange() {
    return temperatureRange;
  }

  /**
   * @return month names as given, like "July"
   */
  public Set<String> getTravelMonths() {
    return travelMonths;
  }

  /**
   * @return duration labels as given, like "Short trip"
   */
  public Set<String> getTravelDurations() {
    return travelDurations;
  }

  public Set<String> getPreferredRegions() {
    return preferredRegions;
  }

  public GeoPoint getOrigin() {
    return origin;
  }

  /**
   * @return budget labels as given, like "Mid-range"
   */
  public Set<String> getTravelBudgets() {
    return travelBudgets;
  }

  /**
   * @return item ID to rating, in the order the ratings were added
   */
  public Map<String,Rating> getDestinationRatings() {
    return destinationRatings;
  }

  public boolean hasRatings() {
    return !destinationRatings.isEmpty();
  }

  @Override
  public String toString() {
    return "PreferenceProfile[themes=" + Arrays.toString(themeScores) +
        ", temperatureRange=" + temperatureRange +
        ", travelMonths=" + travelMonths +
        ", travelDurations=" + travelDurations +
        ", preferredRegions=" + preferredRegions +
        ", origin=" + origin +
        ", travelBudgets=" + travelBudgets +
        ", ratings=" + destinationRatings + ']';
  }

  public static final class Builder {

    private final int[] themeScores = new int[Theme.COUNT];
    private TemperatureRange temperatureRange;
    private final Set<String> travelMonths = Sets.<String>newLinkedHashSet();
    private final Set<String> travelDurations = Sets.<String>newLinkedHashSet();
    private final Set<String> preferredRegions = Sets.<String>newLinkedHashSet();
    private GeoPoint origin;
    private final Set<String> travelBudgets = Sets.<String>newLinkedHashSet();
    private final Map<String,Rating> destinationRatings = Maps.newLinkedHashMap();

    private Builder() {
    }

    public Builder themeScore(Theme theme, int score) {
      themeScores[theme.ordinal()] = score;
      return this;
    }

    /**
     * @param scores one score per {@link Theme}, in {@link Theme} order
     */
    public Builder themeScores(int... scores) {
      Preconditions.checkArgument(scores.length == Theme.COUNT,
                                  "Expected %s theme scores but got %s", Theme.COUNT, scores.length);
      System.arraycopy(scores, 0, themeScores, 0, Theme.COUNT);
      return this;
    }

    public Builder temperatureRange(TemperatureRange range) {
      temperatureRange = range;
      return this;
    }

    public Builder temperatureRange(double min, double max) {
      return temperatureRange(new double[] {min, max});
    }

    /**
     * Sets the desired temperature range from a {min, max} pair. Anything other than two finite numbers
     * is logged and ignored, leaving the profile without a temperature range.
     */
    public Builder temperatureRange(double[] range) {
      if (range == null || range.length != 2 || !LangUtils.isFinite(range[0]) || !LangUtils.isFinite(range[1])) {
        log.warn("Ignoring malformed temperature range {}", Arrays.toString(range));
        temperatureRange = null;
      } else {
        temperatureRange = new TemperatureRange(range[0], range[1]);
      }
      return this;
    }

    public Builder travelMonths(String... months) {
      return travelMonths(Arrays.asList(months));
    }

    public Builder travelMonths(Collection<String> months) {
      addNonBlank(months, travelMonths);
      return this;
    }

    public Builder travelDurations(String... durations) {
      return travelDurations(Arrays.asList(durations));
    }

    public Builder travelDurations(Collection<String> durations) {
      addNonBlank(durations, travelDurations);
      return this;
    }

    public Builder preferredRegions(String... regions) {
      return preferredRegions(Arrays.asList(regions));
    }

    public Builder preferredRegions(Collection<String> regions) {
      addNonBlank(regions, preferredRegions);
      return this;
    }

    public Builder origin(GeoPoint origin) {
      this.origin = origin;
      return this;
    }

    public Builder origin(double latitude, double longitude) {
      return origin(new GeoPoint(latitude, longitude));
    }

    public Builder travelBudgets(String... budgets) {
      return travelBudgets(Arrays.asList(budgets));
    }

    public Builder travelBudgets(Collection<String> budgets) {
      addNonBlank(budgets, travelBudgets);
      return this;
    }

    public Builder rating(String itemID, Rating rating) {
      Preconditions.checkNotNull(itemID);
      Preconditions.checkNotNull(rating);
      destinationRatings.put(itemID, rating);
      return this;
    }

    /**
     * Adds a rating given as text. Values other than "like" or "dislike" are logged and skipped.
     */
    public Builder rating(String itemID, String rating) {
      Rating parsed = Rating.parse(rating);
      if (parsed == null) {
        log.warn("Ignoring unknown rating '{}' for item {}", rating, itemID);
        return this;
      }
      return rating(itemID, parsed);
    }

    public Builder ratings(Map<String,Rating> ratings) {
      for (Map.Entry<String,Rating> entry : ratings.entrySet()) {
        rating(entry.getKey(), entry.getValue());
      }
      return this;
    }

    public PreferenceProfile build() {
      return new PreferenceProfile(this);
    }

    private static void addNonBlank(Collection<String> values, Set<String> target) {
      if (values == null) {
        return;
      }
      for (String value : values) {
        if (value != null && !value.trim().isEmpty()) {
          target.add(value.trim());
        }
      }
    }

  }

}
