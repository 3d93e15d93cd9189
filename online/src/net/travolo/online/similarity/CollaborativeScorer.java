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

package net.travolo.online.similarity;

import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.travolo.online.model.CatalogItem;
import net.travolo.online.model.PreferenceProfile;
import net.travolo.online.model.Rating;

/**
 * <p>Scores unrated catalog items by their similarity to the items a user liked. An item's score is the
 * mean of the positive similarities listed from each liked item to it; items reachable from no liked item
 * get no score.</p>
 *
 * <p>Returns an empty map, never an error, when there are no liked items or no similarities.</p>
 */
public final class CollaborativeScorer {

  private static final Logger log = LoggerFactory.getLogger(CollaborativeScorer.class);

  private final SimilarityCache cache;

  public CollaborativeScorer(SimilarityCache cache) {
    Preconditions.checkNotNull(cache);
    this.cache = cache;
  }

  /**
   * @return item ID to score in (0,1], in catalog order, for unrated items with a positive score
   */
  public Map<String,Double> score(PreferenceProfile profile, Iterable<CatalogItem> catalog) {
    Preconditions.checkNotNull(profile);
    Preconditions.checkNotNull(catalog);

    Map<String,Rating> ratings = profile.getDestinationRatings();
    List<String> likedIDs = Lists.newArrayList();
    for (Map.Entry<String,Rating> entry : ratings.entrySet()) {
      if (entry.getValue() == Rating.LIKE) {
        likedIDs.add(entry.getKey());
      }
    }
    if (likedIDs.isEmpty()) {
      log.debug("No liked items; skipping collaborative scoring");
      return ImmutableMap.of();
    }

    SimilarityMatrix matrix = cache.get();
    if (matrix.isEmpty()) {
      log.warn("No item similarities available; skipping collaborative scoring");
      return ImmutableMap.of();
    }

    Set<String> ratedIDs = ratings.keySet();
    Map<String,Double> scores = Maps.newLinkedHashMap();
    for (CatalogItem item : catalog) {
      String candidateID = item.getID();
      if (ratedIDs.contains(candidateID)) {
        continue;
      }
      double sum = 0.0;
      int count = 0;
      for (String likedID : likedIDs) {
        double similarity = matrix.getSimilarity(likedID, candidateID);
        if (similarity > 0.0) {
          sum += similarity;
          count++;
        }
      }
      if (count > 0) {
        scores.put(candidateID, sum / count);
      }
    }
    log.debug("Collaborative scores for {} items from {} liked items", scores.size(), likedIDs.size());
    return scores;
  }

}
