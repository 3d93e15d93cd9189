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

import java.util.Arrays;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import net.travolo.online.model.PreferenceProfile;
import net.travolo.online.model.Theme;

/**
 * Outcome of applying like/dislike feedback to a profile: the adjusted profile and what was
 * changed to get there.
 */
public final class ProfileAdjustment {

  private final PreferenceProfile adjustedProfile;
  private final int[] themeAdjustments;
  private final int likedCount;
  private final int dislikedCount;
  private final List<String> unknownItemIDs;

  public ProfileAdjustment(PreferenceProfile adjustedProfile,
                           int[] themeAdjustments,
                           int likedCount,
                           int dislikedCount,
                           List<String> unknownItemIDs) {
    Preconditions.checkNotNull(adjustedProfile);
    Preconditions.checkArgument(themeAdjustments.length == Theme.COUNT);
    this.adjustedProfile = adjustedProfile;
    this.themeAdjustments = themeAdjustments.clone();
    this.likedCount = likedCount;
    this.dislikedCount = dislikedCount;
    this.unknownItemIDs = ImmutableList.copyOf(unknownItemIDs);
  }

  public PreferenceProfile getAdjustedProfile() {
    return adjustedProfile;
  }

  /**
   * @return integer amount added to each theme score before clamping, in {@link Theme} order
   */
  public int[] getThemeAdjustments() {
    return themeAdjustments.clone();
  }

  public int getThemeAdjustment(Theme theme) {
    return themeAdjustments[theme.ordinal()];
  }

  /**
   * @return number of liked items found in the catalog
   */
  public int getLikedCount() {
    return likedCount;
  }

  /**
   * @return number of disliked items found in the catalog
   */
  public int getDislikedCount() {
    return dislikedCount;
  }

  /**
   * @return rated item IDs that were not in the catalog, and so did not contribute
   */
  public List<String> getUnknownItemIDs() {
    return unknownItemIDs;
  }

  /**
   * @return true if feedback moved any theme score; clamping alone does not count
   */
  public boolean isAdjusted() {
    for (int adjustment : themeAdjustments) {
      if (adjustment != 0) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return "ProfileAdjustment[adjustments=" + Arrays.toString(themeAdjustments) +
        ", liked=" + likedCount + ", disliked=" + dislikedCount + ", unknown=" + unknownItemIDs + ']';
  }

}
