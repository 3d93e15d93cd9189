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
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.travolo.common.LangUtils;
import net.travolo.online.model.CatalogItem;
import net.travolo.online.model.PreferenceProfile;
import net.travolo.online.model.Rating;
import net.travolo.online.model.Theme;

/**
 * <p>Moves a profile's theme scores toward the themes of items the user liked and away from those
 * they disliked.</p>
 *
 * <p>For each theme, the mean score over liked items minus the mean over disliked items (a missing
 * side counts as 0) is computed exactly, rounded away from zero to an integer and added to the
 * profile's score. Every score, rated or not, is then limited to
 * [{@link Theme#MIN_SCORE}, {@link Theme#MAX_SCORE}]. The input profile is never modified.</p>
 */
public final class FeedbackAdjuster {

  private static final Logger log = LoggerFactory.getLogger(FeedbackAdjuster.class);

  public ProfileAdjustment adjust(PreferenceProfile profile, Iterable<CatalogItem> catalog) {
    Preconditions.checkNotNull(profile);
    Preconditions.checkNotNull(catalog);

    long[] likedSum = new long[Theme.COUNT];
    long[] dislikedSum = new long[Theme.COUNT];
    int likedCount = 0;
    int dislikedCount = 0;
    List<String> unknown = Lists.newArrayList();

    if (profile.hasRatings()) {
      Map<String,CatalogItem> byID = Maps.newHashMap();
      for (CatalogItem item : catalog) {
        byID.put(item.getID(), item);
      }
      for (Map.Entry<String,Rating> entry : profile.getDestinationRatings().entrySet()) {
        String itemID = entry.getKey();
        CatalogItem item = byID.get(itemID);
        if (item == null) {
          log.warn("Rated item {} is not in the catalog; ignoring its rating", itemID);
          unknown.add(itemID);
          continue;
        }
        if (entry.getValue() == Rating.LIKE) {
          add(likedSum, item);
          likedCount++;
        } else {
          add(dislikedSum, item);
          dislikedCount++;
        }
      }
    }

    // liked mean - disliked mean over a common denominator; an empty side contributes 0
    long likedDivisor = likedCount == 0 ? 1 : likedCount;
    long dislikedDivisor = dislikedCount == 0 ? 1 : dislikedCount;
    int[] base = profile.getThemeScores();
    int[] adjustments = new int[Theme.COUNT];
    int[] adjusted = new int[Theme.COUNT];
    boolean changed = false;
    for (int i = 0; i < Theme.COUNT; i++) {
      long numerator = likedSum[i] * dislikedDivisor - dislikedSum[i] * likedDivisor;
      adjustments[i] = (int) LangUtils.ceilDivAwayFromZero(numerator, likedDivisor * dislikedDivisor);
      adjusted[i] = LangUtils.clamp(base[i] + adjustments[i], Theme.MIN_SCORE, Theme.MAX_SCORE);
      changed |= adjusted[i] != base[i];
    }

    PreferenceProfile adjustedProfile = changed ? profile.withThemeScores(adjusted) : profile;
    ProfileAdjustment result =
        new ProfileAdjustment(adjustedProfile, adjustments, likedCount, dislikedCount, unknown);
    log.debug("Feedback from {} liked / {} disliked items: {}", likedCount, dislikedCount, result);
    return result;
  }

  private static void add(long[] sum, CatalogItem item) {
    Theme[] themes = Theme.values();
    for (int i = 0; i < sum.length; i++) {
      sum[i] += item.getThemeScore(themes[i]);
    }
  }

}
