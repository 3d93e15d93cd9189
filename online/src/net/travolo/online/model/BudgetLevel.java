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
 * Price levels of a destination, ordered from cheapest.
 */
public enum BudgetLevel {

  BUDGET("budget", 1),
  MID_RANGE("mid-range", 2),
  LUXURY("luxury", 3);

  private final String label;
  private final int level;

  BudgetLevel(String label, int level) {
    this.label = label;
    this.level = level;
  }

  public String getLabel() {
    return label;
  }

  /**
   * @return ordinal level, 1 for {@link #BUDGET} up to 3 for {@link #LUXURY}
   */
  public int getLevel() {
    return level;
  }

  /**
   * @param label label like "Budget", "Mid-range" or "luxury"; case-insensitive
   * @return matching level, or {@code null} if the label is unknown
   */
  public static BudgetLevel fromLabel(String label) {
    if (label == null) {
      return null;
    }
    String normalized = label.trim().toLowerCase(Locale.ENGLISH);
    for (BudgetLevel budgetLevel : values()) {
      if (budgetLevel.label.equals(normalized)) {
        return budgetLevel;
      }
    }
    return null;
  }

}
