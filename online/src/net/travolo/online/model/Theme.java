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

package net.travolo.online.model;

import java.util.Locale;

/**
 * The travel themes that both preference profiles and catalog items score, in vector order.
 */
public enum Theme {

  CULTURE,
  ADVENTURE,
  NATURE,
  BEACHES,
  NIGHTLIFE,
  CUISINE,
  WELLNESS,
  URBAN,
  SECLUSION;

  /** Number of themes, and so the dimension of a theme vector. */
  public static final int COUNT = values().length;

  /** Lowest score a preference profile may hold for a theme. */
  public static final int MIN_SCORE = 1;

  /** Highest score a preference profile may hold for a theme. */
  public static final int MAX_SCORE = 5;

  /**
   * @return lower-case name, like "culture"
   */
  public String label() {
    return name().toLowerCase(Locale.ENGLISH);
  }

}
