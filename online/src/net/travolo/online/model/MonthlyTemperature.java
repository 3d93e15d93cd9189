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

/**
 * Temperatures in degrees Celsius for one month at a destination. {@code min} and {@code max} are
 * {@link Double#NaN} when not known.
 */
public final class MonthlyTemperature implements Serializable {

  private final double avg;
  private final double min;
  private final double max;

  public MonthlyTemperature(double avg) {
    this(avg, Double.NaN, Double.NaN);
  }

  public MonthlyTemperature(double avg, double min, double max) {
    this.avg = avg;
    this.min = min;
    this.max = max;
  }

  public double getAvg() {
    return avg;
  }

  public double getMin() {
    return min;
  }

  public double getMax() {
    return max;
  }

  @Override
  public String toString() {
    return avg + " (" + min + ".." + max + ')';
  }

}
