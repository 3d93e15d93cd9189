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
 * Explicit feedback a user gave on a destination.
 */
public enum Rating {

  LIKE,
  DISLIKE;

  /**
   * @param value rating as stored, like "like" or "dislike"; case-insensitive
   * @return matching {@link Rating}, or {@code null} if the value is not a known rating
   */
  public static Rating parse(String value) {
    if (value == null) {
      return null;
    }
    String normalized = value.trim().toLowerCase(Locale.ENGLISH);
    if ("like".equals(normalized)) {
      return LIKE;
    }
    if ("dislike".equals(normalized)) {
      return DISLIKE;
    }
    return null;
  }

}
