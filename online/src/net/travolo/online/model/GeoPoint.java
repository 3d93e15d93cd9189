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
 * A latitude / longitude pair in degrees, with an optional display name.
 */
public final class GeoPoint implements Serializable {

  private final String name;
  private final double latitude;
  private final double longitude;

  public GeoPoint(double latitude, double longitude) {
    this(null, latitude, longitude);
  }

  public GeoPoint(String name, double latitude, double longitude) {
    Preconditions.checkArgument(LangUtils.isFinite(latitude) && LangUtils.isFinite(longitude),
                                "Bad coordinates: %s,%s", latitude, longitude);
    this.name = name;
    this.latitude = latitude;
    this.longitude = longitude;
  }

  /**
   * @return display name, like "Boston", or {@code null}
   */
  public String getName() {
    return name;
  }

  public double getLatitude() {
    return latitude;
  }

  public double getLongitude() {
    return longitude;
  }

  @Override
  public String toString() {
    return (name == null ? "" : name) + '(' + latitude + ',' + longitude + ')';
  }

}
