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

package net.travolo.online.feedback;

import java.util.List;

import com.google.common.collect.ImmutableList;
import org.junit.Test;

import net.travolo.common.TravoloTest;
import net.travolo.online.CatalogFixtures;
import net.travolo.online.model.CatalogItem;
import net.travolo.online.model.PreferenceProfile;
import net.travolo.online.model.Rating;
import net.travolo.online.model.Theme;

public final class FeedbackAdjusterTest extends TravoloTest {

  private static final int[] ALL_THREES = {3, 3, 3, 3, 3, 3, 3, 3, 3};

  private final FeedbackAdjuster adjuster = new FeedbackAdjuster();

  @Test
  public void testLikedAndDislikedAdventure() {
    List<CatalogItem> catalog = ImmutableList.of(
        CatalogFixtures.themesOnly("liked", 3, 5, 3, 3, 3, 3, 3, 3, 3),
        CatalogFixtures.themesOnly("disliked", 3, 1, 3, 3, 3, 3, 3, 3, 3));
    PreferenceProfile profile = PreferenceProfile.builder()
        .themeScores(ALL_THREES)
        .rating("liked", Rating.LIKE)
        .rating("disliked", Rating.DISLIKE)
        .build();

    ProfileAdjustment adjustment = adjuster.adjust(profile, catalog);
    int adventure = adjustment.getAdjustedProfile().getThemeScore(Theme.ADVENTURE);
    assertTrue(adventure > 3);
    assertTrue(adventure <= 5);
    assertEquals(5, adventure);
    assertEquals(4, adjustment.getThemeAdjustment(Theme.ADVENTURE));
    assertEquals(0, adjustment.getThemeAdjustment(Theme.CULTURE));
    assertEquals(3, adjustment.getAdjustedProfile().getThemeScore(Theme.CULTURE));
    assertEquals(1, adjustment.getLikedCount());
    assertEquals(1, adjustment.getDislikedCount());
    assertTrue(adjustment.isAdjusted());
    // input is untouched
    assertEquals(3, profile.getThemeScore(Theme.ADVENTURE));
  }

  @Test
  public void testFractionalMeansRoundAwayFromZero() {
    List<CatalogItem> catalog = ImmutableList.of(
        CatalogFixtures.themesOnly("d1", 0, 0, 0, 0, 1, 0, 0, 0, 0),
        CatalogFixtures.themesOnly("d2", 0, 0, 0, 0, 2, 0, 0, 0, 0));
    PreferenceProfile profile = PreferenceProfile.builder()
        .themeScores(3, 3, 3, 3, 4, 3, 3, 3, 3)
        .rating("d1", Rating.DISLIKE)
        .rating("d2", Rating.DISLIKE)
        .build();
    ProfileAdjustment adjustment = adjuster.adjust(profile, catalog);
    assertEquals(-2, adjustment.getThemeAdjustment(Theme.NIGHTLIFE));
    assertEquals(2, adjustment.getAdjustedProfile().getThemeScore(Theme.NIGHTLIFE));
    assertEquals(0, adjustment.getThemeAdjustment(Theme.CULTURE));
    assertEquals(0, adjustment.getLikedCount());
    assertEquals(2, adjustment.getDislikedCount());
  }

  @Test
  public void testClampedToValidRange() {
    List<CatalogItem> catalog = ImmutableList.of(CatalogFixtures.themesOnly("x", 5, 5, 5, 5, 5, 5, 5, 5, 5));
    PreferenceProfile liked = PreferenceProfile.builder().themeScores(ALL_THREES).rating("x", Rating.LIKE).build();
    for (int score : adjuster.adjust(liked, catalog).getAdjustedProfile().getThemeScores()) {
      assertEquals(Theme.MAX_SCORE, score);
    }
    PreferenceProfile disliked = PreferenceProfile.builder().themeScores(ALL_THREES).rating("x", Rating.DISLIKE).build();
    for (int score : adjuster.adjust(disliked, catalog).getAdjustedProfile().getThemeScores()) {
      assertEquals(Theme.MIN_SCORE, score);
    }
  }

  @Test
  public void testUnknownItemsSkipped() {
    List<CatalogItem> catalog = ImmutableList.of(CatalogFixtures.themesOnly("x", 4, 3, 3, 3, 3, 3, 3, 3, 3));
    PreferenceProfile profile = PreferenceProfile.builder()
        .themeScores(ALL_THREES)
        .rating("gone", Rating.LIKE)
        .rating("x", Rating.LIKE)
        .build();
    ProfileAdjustment adjustment = adjuster.adjust(profile, catalog);
    assertEquals(ImmutableList.of("gone"), adjustment.getUnknownItemIDs());
    assertEquals(1, adjustment.getLikedCount());
    assertEquals(4, adjustment.getThemeAdjustment(Theme.CULTURE));
    assertEquals(5, adjustment.getAdjustedProfile().getThemeScore(Theme.CULTURE));
  }

  @Test
  public void testNoRatings() {
    PreferenceProfile profile = PreferenceProfile.builder().themeScores(ALL_THREES).build();
    ProfileAdjustment adjustment = adjuster.adjust(profile, CatalogFixtures.all());
    assertSame(profile, adjustment.getAdjustedProfile());
    assertFalse(adjustment.isAdjusted());
    assertArrayEquals(new int[Theme.COUNT], adjustment.getThemeAdjustments());
    assertEquals(0, adjustment.getLikedCount());
    assertTrue(adjustment.getUnknownItemIDs().isEmpty());
  }

  @Test
  public void testNoRatingsStillClamped() {
    PreferenceProfile profile = PreferenceProfile.builder()
        .themeScore(Theme.CULTURE, 5)
        .themeScore(Theme.NIGHTLIFE, 9)
        .themeScore(Theme.URBAN, -2)
        .build();
    ProfileAdjustment adjustment = adjuster.adjust(profile, CatalogFixtures.all());
    assertArrayEquals(new int[] {5, 1, 1, 1, 5, 1, 1, 1, 1}, adjustment.getAdjustedProfile().getThemeScores());
    assertFalse(adjustment.isAdjusted());
    assertEquals(0, profile.getThemeScore(Theme.ADVENTURE));

    // an irrelevant rating changes nothing
    PreferenceProfile rated = PreferenceProfile.builder()
        .themeScore(Theme.CULTURE, 5)
        .themeScore(Theme.NIGHTLIFE, 9)
        .themeScore(Theme.URBAN, -2)
        .rating("elsewhere", Rating.LIKE)
        .build();
    assertArrayEquals(adjustment.getAdjustedProfile().getThemeScores(),
                      adjuster.adjust(rated, CatalogFixtures.all()).getAdjustedProfile().getThemeScores());
  }

  @Test
  public void testExactIntegerDeltaNotRoundedUp() {
    List<CatalogItem> catalog = ImmutableList.of(
        CatalogFixtures.themesOnly("l1", 3, 3, 3, 3, 3, 3, 3, 3, 3),
        CatalogFixtures.themesOnly("l2", 3, 2, 3, 3, 3, 3, 3, 3, 3),
        CatalogFixtures.themesOnly("l3", 3, 2, 3, 3, 3, 3, 3, 3, 3),
        CatalogFixtures.themesOnly("d1", 3, 1, 3, 3, 3, 3, 3, 3, 3),
        CatalogFixtures.themesOnly("d2", 3, 1, 3, 3, 3, 3, 3, 3, 3),
        CatalogFixtures.themesOnly("d3", 3, 2, 3, 3, 3, 3, 3, 3, 3));
    PreferenceProfile profile = PreferenceProfile.builder()
        .themeScores(ALL_THREES)
        .rating("l1", Rating.LIKE)
        .rating("l2", Rating.LIKE)
        .rating("l3", Rating.LIKE)
        .rating("d1", Rating.DISLIKE)
        .rating("d2", Rating.DISLIKE)
        .rating("d3", Rating.DISLIKE)
        .build();
    ProfileAdjustment adjustment = adjuster.adjust(profile, catalog);
    // 7/3 - 4/3 is exactly 1
    assertEquals(1, adjustment.getThemeAdjustment(Theme.ADVENTURE));
    assertEquals(4, adjustment.getAdjustedProfile().getThemeScore(Theme.ADVENTURE));
    assertEquals(0, adjustment.getThemeAdjustment(Theme.CULTURE));
  }

  @Test
  public void testOtherPreferencesCarriedOver() {
    PreferenceProfile profile = PreferenceProfile.builder()
        .themeScores(ALL_THREES)
        .preferredRegions("Europe")
        .travelMonths("July")
        .rating(CatalogFixtures.TOULOUSE, Rating.LIKE)
        .build();
    PreferenceProfile adjusted = adjuster.adjust(profile, CatalogFixtures.all()).getAdjustedProfile();
    assertEquals(profile.getPreferredRegions(), adjusted.getPreferredRegions());
    assertEquals(profile.getTravelMonths(), adjusted.getTravelMonths());
    assertEquals(profile.getDestinationRatings(), adjusted.getDestinationRatings());
  }

}
