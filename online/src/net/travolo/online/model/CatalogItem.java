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

import net.travolo.common.LangUtils;

/**
 * <p>A destination in the catalog. Immutable.</p>
 *
 * <p>Theme scores that were never set are 0. {@link #getLatitude()} and {@link #getLongitude()} are
 * {@link Double#NaN} unless {@link #hasCoordinates()}. {@link #getBudgetLevel()} and {@link #getRegion()}
 * may be {@code null}.</p>
 */
public final class CatalogItem implements Serializable {

  private final String id;
  private final String city;
  private final String country;
  private final int[] themeScores;
  private final Map<Integer,MonthlyTemperature> avgTempMonthly;
  private final String budgetLevel;
  private final String region;
  private final Set<String> idealDurations;
  private final double latitude;
  private final double longitude;

  private CatalogItem(Builder builder) {
    id = builder.id;
    city = builder.city;
    country = builder.country;
    themeScores = builder.themeScores.clone();
    avgTempMonthly = ImmutableMap.copyOf(builder.avgTempMonthly);
    budgetLevel = builder.budgetLevel;
    region = builder.region;
    idealDurations = ImmutableSet.copyOf(builder.idealDurations);
    latitude = builder.latitude;
    longitude = builder.longitude;
  }

  public static Builder builder(String id) {
    return new Builder(id);
  }

  public String getID() {
    return id;
  }

  public String getCity() {
    return city;
  }

  public String getCountry() {
    return country;
  }

  public int getThemeScore(Theme theme) {
    return themeScores[theme.ordinal()];
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
   * @return month number, 1 for January, to temperatures for that month
   */
  public Map<Integer,MonthlyTemperature> getAvgTempMonthly() {
    return avgTempMonthly;
  }

  /**
   * @return temperatures for the month (1-12), or {@code null} if unknown
   */
  public MonthlyTemperature getMonthlyTemperature(int month) {
    return avgTempMonthly.get(month);
  }

  /**
   * @return budget label as given, like "Luxury"
   */
  public String getBudgetLevel() {
    return budgetLevel;
  }

  public String getRegion() {
    return region;
  }

  /**
   * @return ideal trip length labels as given, like "One week"
   */
  public Set<String> getIdealDurations() {
    return idealDurations;
  }

  public boolean hasCoordinates() {
    return LangUtils.isFinite(latitude) && LangUtils.isFinite(longitude);
  }

  public double getLatitude() {
    return latitude;
  }

  public double getLongitude() {
    return longitude;
  }

  @Override
  public String toString() {
    return "CatalogItem[" + id + (city == null ? "" : ", " + city) + ", themes=" + Arrays.toString(themeScores) + ']';
  }

  public static final class Builder {

    private final String id;
    private String city;
    private String country;
    private final int[] themeScores = new int[Theme.COUNT];
    private final Map<Integer,MonthlyTemperature> avgTempMonthly = Maps.newTreeMap();
    private String budgetLevel;
    private String region;
    private final Set<String> idealDurations = Sets.newLinkedHashSet();
    private double latitude = Double.NaN;
    private double longitude = Double.NaN;

    private Builder(String id) {
      Preconditions.checkNotNull(id, "Item ID is required");
      this.id = id;
    }

    public Builder city(String city) {
      this.city = city;
      return this;
    }

    public Builder country(String country) {
      this.country = country;
      return this;
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

    public Builder monthlyTemperature(int month, MonthlyTemperature temperature) {
      Preconditions.checkArgument(month >= 1 && month <= 12, "Bad month: %s", month);
      Preconditions.checkNotNull(temperature);
      avgTempMonthly.put(month, temperature);
      return this;
    }

    public Builder monthlyTemperature(int month, double avg) {
      return monthlyTemperature(month, new MonthlyTemperature(avg));
    }

    public Builder budgetLevel(String budgetLevel) {
      this.budgetLevel = budgetLevel;
      return this;
    }

    public Builder region(String region) {
      this.region = region;
      return this;
    }

    public Builder idealDurations(String... durations) {
      return idealDurations(Arrays.asList(durations));
    }

    public Builder idealDurations(Collection<String> durations) {
      for (String duration : durations) {
        if (duration != null && !duration.trim().isEmpty()) {
          idealDurations.add(duration.trim());
        }
      }
      return this;
    }

    public Builder coordinates(double latitude, double longitude) {
      this.latitude = latitude;
      this.longitude = longitude;
      return this;
    }

    public CatalogItem build() {
      return new CatalogItem(this);
    }

  }

}
