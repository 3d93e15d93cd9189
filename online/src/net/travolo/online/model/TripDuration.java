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

import java.util.Locale;

/**
 * Trip length labels, with the approximate number of days each stands for and how far it is
 * reasonable to travel for a trip of that length.
 */
public enum TripDuration {

  DAY_TRIP("day-trip", 1, 500.0),
  WEEKEND("weekend", 2, 1500.0),
  SHORT_TRIP("short-trip", 4, 3000.0),
  ONE_WEEK("one-week", 7, 6000.0),
  LONG_TRIP("long-trip", 10, 15000.0);

  private final String label;
  private final int days;
  private final double maxDistanceKm;

  TripDuration(String label, int days, double maxDistanceKm) {
    this.label = label;
    this.days = days;
    this.maxDistanceKm = maxDistanceKm;
  }

  /**
   * @return normalized label, like "short-trip"
   */
  public String getLabel() {
    return label;
  }

  public int getDays() {
    return days;
  }

  public double getMaxDistanceKm() {
    return maxDistanceKm;
  }

  /**
   * Lower-cases a duration label and replaces spaces with hyphens, so "Day trip" and "day-trip" match.
   */
  public static String normalizeLabel(String label) {
    return label.trim().toLowerCase(Locale.ENGLISH).replace(' ', '-');
  }

  /**
   * @return duration for the label after {@link #normalizeLabel(String)}, or {@code null} if unknown
   */
  public static TripDuration fromLabel(String label) {
    if (label == null) {
      return null;
    }
    String normalized = normalizeLabel(label);
    for (TripDuration duration : values()) {
      if (duration.label.equals(normalized)) {
        return duration;
      }
    }
    return null;
  }

  /**
   * @return distance threshold for a trip of the given number of days; a day count that no duration
   *  maps to gets the {@link #LONG_TRIP} threshold
   */
  public static double maxDistanceKmForDays(int days) {
    for (TripDuration duration : values()) {
      if (duration.days == days) {
        return duration.maxDistanceKm;
      }
    }
    return LONG_TRIP.maxDistanceKm;
  }

}
