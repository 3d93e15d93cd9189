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

import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import org.junit.Test;

import net.travolo.common.TravoloTest;
import net.travolo.common.math.GeoDistance;
import net.travolo.online.CatalogFixtures;
import net.travolo.online.model.CatalogItem;
import net.travolo.online.model.PreferenceProfile;

public final class ContentScorerTest extends TravoloTest {

  private static final int[] ALL_THREES = {3, 3, 3, 3, 3, 3, 3, 3, 3};

  private final ContentScorer scorer = new ContentScorer();

  private static PreferenceProfile.Builder threes() {
    return PreferenceProfile.builder().themeScores(ALL_THREES);
  }

  private ScoreRecord scoreOne(PreferenceProfile profile, CatalogItem item) {
    return scorer.score(profile, ImmutableList.of(item)).get(item.getID());
  }

  @Test
  public void testIdenticalThemesOnly() {
    ScoreRecord record = scoreOne(threes().build(), CatalogFixtures.themesOnly("a", ALL_THREES));
    assertEquals(1.0, record.getFactorScore(ContentFactor.THEME));
    for (ContentFactor factor : ContentFactor.values()) {
      assertEquals(factor == ContentFactor.THEME, record.hasFactorScore(factor));
    }
    assertEquals(1.0, record.getContentScore());
  }

  @Test
  public void testCatalogOrderKept() {
    List<CatalogItem> catalog = Lists.newArrayList(CatalogFixtures.all());
    catalog.add(0, CatalogFixtures.themesOnly("z", ALL_THREES));
    Map<String,ScoreRecord> records = scorer.score(threes().build(), catalog);
    assertEquals(ImmutableList.of("z", CatalogFixtures.BOSTON, CatalogFixtures.TOULOUSE, CatalogFixtures.VIENTIANE),
                 ImmutableList.copyOf(records.keySet()));
  }

  @Test
  public void testClimate() {
    PreferenceProfile profile = threes().temperatureRange(20.0, 27.0).travelMonths("July", "august").build();
    ScoreRecord record = scoreOne(profile, CatalogFixtures.toulouse());
    double expected = (ContentFactors.gaussianClimateScore(23.5, 23.5, 5.0) +
                       ContentFactors.gaussianClimateScore(23.5, 23.5, 5.0)) / 2.0;
    assertEquals(expected, record.getFactorScore(ContentFactor.CLIMATE));
    assertEquals(1.0, record.getFactorScore(ContentFactor.CLIMATE));
  }

  @Test
  public void testClimateSkipsUnknownAndMissingMonths() {
    PreferenceProfile profile = threes().temperatureRange(20.0, 26.0).travelMonths("Juli", "March", "July").build();
    ScoreRecord record = scoreOne(profile, CatalogFixtures.boston());
    assertEquals(ContentFactors.gaussianClimateScore(23.9, 23.0, 5.0), record.getFactorScore(ContentFactor.CLIMATE));

    PreferenceProfile noData = threes().temperatureRange(20.0, 26.0).travelMonths("March").build();
    assertFalse(scoreOne(noData, CatalogFixtures.boston()).hasFactorScore(ContentFactor.CLIMATE));

    PreferenceProfile noRange = threes().travelMonths("July").build();
    assertFalse(scoreOne(noRange, CatalogFixtures.boston()).hasFactorScore(ContentFactor.CLIMATE));
  }

  @Test
  public void testBudget() {
    PreferenceProfile profile = threes().travelBudgets("BUDGET").build();
    assertEquals(0.0, scoreOne(profile, CatalogFixtures.boston()).getFactorScore(ContentFactor.BUDGET));
    assertEquals(0.5, scoreOne(profile, CatalogFixtures.toulouse()).getFactorScore(ContentFactor.BUDGET));
    assertEquals(1.0, scoreOne(profile, CatalogFixtures.vientiane()).getFactorScore(ContentFactor.BUDGET));

    PreferenceProfile unknownOnly = threes().travelBudgets("cheap").build();
    assertFalse(scoreOne(unknownOnly, CatalogFixtures.boston()).hasFactorScore(ContentFactor.BUDGET));
    assertFalse(scoreOne(profile, CatalogFixtures.themesOnly("a", ALL_THREES)).hasFactorScore(ContentFactor.BUDGET));
  }

  @Test
  public void testRegion() {
    PreferenceProfile profile = threes().preferredRegions("europe").build();
    assertEquals(1.0, scoreOne(profile, CatalogFixtures.toulouse()).getFactorScore(ContentFactor.REGION));
    assertEquals(0.3, scoreOne(profile, CatalogFixtures.boston()).getFactorScore(ContentFactor.REGION));
    assertFalse(scoreOne(profile, CatalogFixtures.themesOnly("a", ALL_THREES)).hasFactorScore(ContentFactor.REGION));
    assertFalse(scoreOne(threes().build(), CatalogFixtures.toulouse()).hasFactorScore(ContentFactor.REGION));
  }

  @Test
  public void testDurationLabelsNormalized() {
    PreferenceProfile profile = threes().travelDurations("one-WEEK").build();
    assertEquals(1.0, scoreOne(profile, CatalogFixtures.boston()).getFactorScore(ContentFactor.DURATION_MATCH));
    assertEquals(0.5, scoreOne(profile, CatalogFixtures.vientiane()).getFactorScore(ContentFactor.DURATION_MATCH));
    assertEquals(0.8,
                 scoreOne(profile, CatalogFixtures.themesOnly("a", ALL_THREES)).getFactorScore(ContentFactor.DURATION_MATCH));
    assertEquals(0.7, scoreOne(threes().build(), CatalogFixtures.boston()).getFactorScore(ContentFactor.DURATION_MATCH));
  }

  @Test
  public void testDistanceWithoutDurations() {
    PreferenceProfile profile = threes().origin(CatalogFixtures.TOULOUSE_LAT, CatalogFixtures.TOULOUSE_LON).build();
    assertEquals(1.0, scoreOne(profile, CatalogFixtures.toulouse()).getFactorScore(ContentFactor.DISTANCE));
    double km = GeoDistance.haversineKm(CatalogFixtures.TOULOUSE_LAT, CatalogFixtures.TOULOUSE_LON, 42.3601, -71.0589);
    assertEquals(ContentFactors.baseDistanceScore(km),
                 scoreOne(profile, CatalogFixtures.boston()).getFactorScore(ContentFactor.DISTANCE));
    assertFalse(scoreOne(profile, CatalogFixtures.themesOnly("a", ALL_THREES)).hasFactorScore(ContentFactor.DISTANCE));
  }

  @Test
  public void testDistancePenalizedByShortestTrip() {
    PreferenceProfile profile = threes()
        .origin(CatalogFixtures.TOULOUSE_LAT, CatalogFixtures.TOULOUSE_LON)
        .travelDurations("One week", "Weekend")
        .build();
    double km = GeoDistance.haversineKm(CatalogFixtures.TOULOUSE_LAT, CatalogFixtures.TOULOUSE_LON, 42.3601, -71.0589);
    double score = scoreOne(profile, CatalogFixtures.boston()).getFactorScore(ContentFactor.DISTANCE);
    assertEquals(ContentFactors.baseDistanceScore(km) * (1500.0 / km), score);
    assertTrue(score < ContentFactors.baseDistanceScore(km));
  }

  @Test
  public void testUnmappedDurationsDoNotPenalize() {
    PreferenceProfile profile = threes()
        .origin(CatalogFixtures.TOULOUSE_LAT, CatalogFixtures.TOULOUSE_LON)
        .travelDurations("fortnight")
        .build();
    double km = GeoDistance.haversineKm(CatalogFixtures.TOULOUSE_LAT, CatalogFixtures.TOULOUSE_LON, 42.3601, -71.0589);
    assertEquals(ContentFactors.baseDistanceScore(km),
                 scoreOne(profile, CatalogFixtures.boston()).getFactorScore(ContentFactor.DISTANCE));
  }

  @Test
  public void testAllFactors() {
    PreferenceProfile profile = PreferenceProfile.builder()
        .themeScores(4, 3, 3, 2, 4, 4, 3, 4, 2)
        .temperatureRange(20.0, 27.0)
        .travelMonths("July")
        .travelBudgets("Mid-range")
        .preferredRegions("Europe")
        .travelDurations("Weekend")
        .origin(CatalogFixtures.TOULOUSE_LAT, CatalogFixtures.TOULOUSE_LON)
        .build();
    ScoreRecord record = scoreOne(profile, CatalogFixtures.toulouse());
    for (ContentFactor factor : ContentFactor.values()) {
      assertTrue(record.hasFactorScore(factor));
      assertEquals(1.0, record.getFactorScore(factor));
    }
    assertEquals(1.0, record.getContentScore());
  }

}
