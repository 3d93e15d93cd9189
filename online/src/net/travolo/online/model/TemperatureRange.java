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

import java.io.Serializable;

import com.google.common.base.Preconditions;

import net.travolo.common.LangUtils;

/**
 * Desired temperature range in degrees Celsius.
 */
public final class TemperatureRange implements Serializable {

  private final double min;
  private final double max;

  public TemperatureRange(double min, double max) {
    Preconditions.checkArgument(LangUtils.isFinite(min) && LangUtils.isFinite(max),
                                "Bad temperature range: %s,%s", min, max);
    this.min = min;
    this.max = max;
  }

  public double getMin() {
    return min;
  }

  public double getMax() {
    return max;
  }

  /**
   * @return midpoint of the range
   */
  public double getMidpoint() {
    return (min + max) / 2.0;
  }

  @Override
  public String toString() {
    return "[" + min + ',' + max + ']';
  }

}
