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

import org.junit.Test;

import net.travolo.common.TravoloTest;

public final class LabelsTest extends TravoloTest {

  @Test
  public void testTripDurationLabels() {
    assertEquals("short-trip", TripDuration.normalizeLabel(" Short trip "));
    assertSame(TripDuration.ONE_WEEK, TripDuration.fromLabel("One week"));
    assertSame(TripDuration.DAY_TRIP, TripDuration.fromLabel("day-trip"));
    assertNull(TripDuration.fromLabel("fortnight"));
    assertNull(TripDuration.fromLabel(null));
  }

  @Test
  public void testTripDurationThresholds() {
    assertEquals(500.0, TripDuration.maxDistanceKmForDays(1));
    assertEquals(1500.0, TripDuration.maxDistanceKmForDays(2));
    assertEquals(3000.0, TripDuration.maxDistanceKmForDays(4));
    assertEquals(6000.0, TripDuration.maxDistanceKmForDays(7));
    assertEquals(15000.0, TripDuration.maxDistanceKmForDays(10));
    assertEquals(15000.0, TripDuration.maxDistanceKmForDays(3));
  }

  @Test
  public void testBudgetLevels() {
    assertSame(BudgetLevel.MID_RANGE, BudgetLevel.fromLabel("Mid-Range"));
    assertSame(BudgetLevel.LUXURY, BudgetLevel.fromLabel(" luxury"));
    assertNull(BudgetLevel.fromLabel("cheap"));
    assertNull(BudgetLevel.fromLabel(null));
    assertEquals(1, BudgetLevel.BUDGET.getLevel());
    assertEquals(3, BudgetLevel.LUXURY.getLevel());
  }

  @Test
  public void testRatings() {
    assertSame(Rating.LIKE, Rating.parse("LIKE"));
    assertSame(Rating.DISLIKE, Rating.parse(" dislike "));
    assertNull(Rating.parse("meh"));
    assertNull(Rating.parse(null));
  }

  @Test
  public void testThemeLabels() {
    assertEquals(9, Theme.COUNT);
    assertEquals("culture", Theme.CULTURE.label());
    assertEquals("seclusion", Theme.SECLUSION.label());
  }

}
