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

import java.io.Serializable;

import com.google.common.base.Preconditions;

/**
 * One recommended destination: its ID, the 0-100 confidence shown to users and the hybrid score that
 * confidence came from.
 */
public final class RankedDestination implements Serializable {

  private final String itemID;
  private final int confidence;
  private final double hybridScore;

  public RankedDestination(String itemID, int confidence, double hybridScore) {
    Preconditions.checkNotNull(itemID);
    Preconditions.checkArgument(confidence >= 0 && confidence <= 100, "Bad confidence: %s", confidence);
    this.itemID = itemID;
    this.confidence = confidence;
    this.hybridScore = hybridScore;
  }

  public String getItemID() {
    return itemID;
  }

  public int getConfidence() {
    return confidence;
  }

  public double getHybridScore() {
    return hybridScore;
  }

  @Override
  public String toString() {
    return itemID + ':' + confidence;
  }

}
