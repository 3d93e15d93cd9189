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

import java.util.Collection;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>An immutable snapshot of item-item similarities: for each item, an ordered list of its
 * {@link Neighbor}s. Pairs that are not listed have similarity 0.</p>
 *
 * <p>Lookups go one way only. {@link #getSimilarity(String, String)} searches the first item's list
 * for the second; a pair listed only under the second item is not found.</p>
 */
public final class SimilarityMatrix {

  private static final Logger log = LoggerFactory.getLogger(SimilarityMatrix.class);

  /** A matrix with no similarities at all. */
  public static final SimilarityMatrix EMPTY = new SimilarityMatrix(ImmutableMap.<String,List<Neighbor>>of());

  private final Map<String,List<Neighbor>> neighbors;

  private SimilarityMatrix(Map<String,List<Neighbor>> neighbors) {
    this.neighbors = neighbors;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * @return neighbours listed for the item, in the order they were added; empty if none
   */
  public List<Neighbor> getNeighbors(String itemID) {
    List<Neighbor> list = neighbors.get(itemID);
    return list == null ? ImmutableList.<Neighbor>of() : list;
  }

  /**
   * @return similarity of the first entry for {@code toItemID} in {@code fromItemID}'s list, or 0 if there is none
   */
  public double getSimilarity(String fromItemID, String toItemID) {
    for (Neighbor neighbor : getNeighbors(fromItemID)) {
      if (neighbor.getItemID().equals(toItemID)) {
        return neighbor.getSimilarity();
      }
    }
    return 0.0;
  }

  /**
   * @return IDs of items that have a neighbour list
   */
  public Collection<String> getItemIDs() {
    return neighbors.keySet();
  }

  /**
   * @return number of items that have a neighbour list
   */
  public int size() {
    return neighbors.size();
  }

  public boolean isEmpty() {
    return neighbors.isEmpty();
  }

  @Override
  public String toString() {
    return "SimilarityMatrix[" + neighbors.size() + " items]";
  }

  /**
   * Collects rows of (item, neighbour, similarity) the way they are stored, one row per pair.
   */
  public static final class Builder {

    private final Map<String,List<Neighbor>> neighbors = Maps.newLinkedHashMap();
    private int skipped;

    private Builder() {
    }

    /**
     * Adds {@code neighborID} to the end of {@code itemID}'s list. Rows whose similarity is not in (0,1]
     * are skipped.
     *
     * @return this
     */
    public Builder add(String itemID, String neighborID, double similarity) {
      Preconditions.checkNotNull(itemID);
      Preconditions.checkNotNull(neighborID);
      if (!(similarity > 0.0 && similarity <= 1.0)) {
        log.debug("Skipping similarity {} for {} -> {}", similarity, itemID, neighborID);
        skipped++;
        return this;
      }
      List<Neighbor> list = neighbors.get(itemID);
      if (list == null) {
        list = Lists.newArrayList();
        neighbors.put(itemID, list);
      }
      list.add(new Neighbor(neighborID, similarity));
      return this;
    }

    /**
     * @return rows passed to {@link #add(String, String, double)} that were skipped
     */
    public int getSkippedCount() {
      return skipped;
    }

    public SimilarityMatrix build() {
      if (neighbors.isEmpty()) {
        return EMPTY;
      }
      ImmutableMap.Builder<String,List<Neighbor>> copy = ImmutableMap.builder();
      for (Map.Entry<String,List<Neighbor>> entry : neighbors.entrySet()) {
        copy.put(entry.getKey(), ImmutableList.copyOf(entry.getValue()));
      }
      return new SimilarityMatrix(copy.build());
    }
  }

}
