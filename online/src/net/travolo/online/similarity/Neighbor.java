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

import java.io.Serializable;

import com.google.common.base.Preconditions;

/**
 * One entry in an item's similarity list: a neighbouring item and how similar it is, in (0,1].
 */
public final class Neighbor implements Serializable {

  private final String itemID;
  private final double similarity;

  public Neighbor(String itemID, double similarity) {
    Preconditions.checkNotNull(itemID);
    Preconditions.checkArgument(similarity > 0.0 && similarity <= 1.0, "Bad similarity: %s", similarity);
    this.itemID = itemID;
    this.similarity = similarity;
  }

  public String getItemID() {
    return itemID;
  }

  public double getSimilarity() {
    return similarity;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Neighbor)) {
      return false;
    }
    Neighbor other = (Neighbor) o;
    return itemID.equals(other.itemID) && similarity == other.similarity;
  }

  @Override
  public int hashCode() {
    return itemID.hashCode() ^ Double.valueOf(similarity).hashCode();
  }

  @Override
  public String toString() {
    return itemID + ':' + similarity;
  }

}
