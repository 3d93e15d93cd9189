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

package net.travolo.common.math;

import org.apache.commons.math3.util.FastMath;

/**
 * Great-circle distances on a spherical Earth.
 */
public final class GeoDistance {

  /** Mean Earth radius in kilometers. */
  public static final double EARTH_RADIUS_KM = 6371.0;

  private GeoDistance() {
  }

  /**
   * @return haversine distance in kilometers between two points given in degrees
   */
  public static double haversineKm(double lat1, double lon1, double lat2, double lon2) {
    double dLat = FastMath.toRadians(lat2 - lat1);
    double dLon = FastMath.toRadians(lon2 - lon1);
    double phi1 = FastMath.toRadians(lat1);
    double phi2 = FastMath.toRadians(lat2);
    double sinHalfDLat = FastMath.sin(dLat / 2.0);
    double sinHalfDLon = FastMath.sin(dLon / 2.0);
    double a = sinHalfDLat * sinHalfDLat + sinHalfDLon * sinHalfDLon * FastMath.cos(phi1) * FastMath.cos(phi2);
    double c = 2.0 * FastMath.atan2(FastMath.sqrt(a), FastMath.sqrt(1.0 - a));
    return EARTH_RADIUS_KM * c;
  }

}
