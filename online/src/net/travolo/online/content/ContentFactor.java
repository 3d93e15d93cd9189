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

/**
 * The independent sub-scores that make up a content score, with their blend weights.
 */
public enum ContentFactor {

  THEME(0.35),
  CLIMATE(0.20),
  BUDGET(0.10),
  REGION(0.20),
  DURATION_MATCH(0.10),
  DISTANCE(0.05);

  private final double weight;

  ContentFactor(double weight) {
    this.weight = weight;
  }

  public double getWeight() {
    return weight;
  }

}
