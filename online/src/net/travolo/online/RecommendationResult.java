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

package net.travolo.online;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.travolo.online.feedback.ProfileAdjustment;

/**
 * Ranked recommendations, best first, along with the feedback adjustment made to the profile that produced
 * them, when known.
 */
public final class RecommendationResult {

  private static final RecommendationResult EMPTY =
      new RecommendationResult(ImmutableList.<RankedDestination>of(), null);

  private final List<RankedDestination> destinations;
  private final ProfileAdjustment adjustment;

  public RecommendationResult(List<RankedDestination> destinations, ProfileAdjustment adjustment) {
    Preconditions.checkNotNull(destinations);
    this.destinations = ImmutableList.copyOf(destinations);
    this.adjustment = adjustment;
  }

  /**
   * @return a result with no recommendations
   */
  public static RecommendationResult empty() {
    return EMPTY;
  }

  /**
   * @return this result's recommendations, recorded as coming from the given adjustment
   */
  public RecommendationResult withAdjustment(ProfileAdjustment adjustment) {
    return new RecommendationResult(destinations, adjustment);
  }

  /**
   * @return recommendations, best first
   */
  public List<RankedDestination> getDestinations() {
    return destinations;
  }

  public List<String> getItemIDs() {
    List<String> ids = Lists.newArrayListWithCapacity(destinations.size());
    for (RankedDestination destination : destinations) {
      ids.add(destination.getItemID());
    }
    return ids;
  }

  /**
   * @return adjustment applied to the profile before scoring, or {@code null} if not known
   */
  public ProfileAdjustment getAdjustment() {
    return adjustment;
  }

  public boolean isEmpty() {
    return destinations.isEmpty();
  }

  public int size() {
    return destinations.size();
  }

  @Override
  public String toString() {
    return destinations.toString();
  }

}
