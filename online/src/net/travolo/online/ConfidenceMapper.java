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

import net.travolo.common.LangUtils;

/**
 * Maps a hybrid score to the 0-100 confidence shown to users. Scores are first limited to [0,1], then
 * mapped linearly within four bands: [0,0.4) to [0,49], [0.4,0.6) to [50,69], [0.6,0.8) to [70,89]
 * and [0.8,1] to [90,100], and rounded. {@link Double#NaN} maps to 0.
 */
public final class ConfidenceMapper {

  private ConfidenceMapper() {
  }

  public static int toConfidence(double score) {
    if (Double.isNaN(score)) {
      return 0;
    }
    double s = LangUtils.clamp(score, 0.0, 1.0);
    double confidence;
    if (s < 0.4) {
      confidence = 49.0 * s / 0.4;
    } else if (s < 0.6) {
      confidence = 50.0 + 19.0 * (s - 0.4) / 0.2;
    } else if (s < 0.8) {
      confidence = 70.0 + 19.0 * (s - 0.6) / 0.2;
    } else {
      confidence = 90.0 + 10.0 * (s - 0.8) / 0.2;
    }
    return (int) Math.round(confidence);
  }

}
