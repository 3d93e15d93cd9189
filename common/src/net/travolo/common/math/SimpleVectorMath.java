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
 * Simple utility methods related to vectors represented as simple {@code double[]}s.
 */
public final class SimpleVectorMath {

  private SimpleVectorMath() {}

  /**
   * @return dot product of the two given arrays
   */
  public static double dot(double[] x, double[] y) {
    int length = x.length;
    double dot = 0.0;
    for (int i = 0; i < length; i++) {
      dot += x[i] * y[i];
    }
    return dot;
  }

  /**
   * @return the L2 norm of vector x
   */
  public static double norm(double[] x) {
    double total = 0.0;
    for (double d : x) {
      total += d * d;
    }
    return FastMath.sqrt(total);
  }

  /**
   * @return cosine of the angle between {@code x} and {@code y}, or 0 if either is {@code null},
   *  their lengths differ, or either has zero length (norm)
   */
  public static double cosineSimilarity(double[] x, double[] y) {
    if (x == null || y == null || x.length != y.length) {
      return 0.0;
    }
    double normX = norm(x);
    double normY = norm(y);
    if (normX == 0.0 || normY == 0.0) {
      return 0.0;
    }
    return dot(x, y) / (normX * normY);
  }

  /**
   * @return element-wise {@code x - y}
   */
  public static double[] subtract(double[] x, double[] y) {
    int length = x.length;
    double[] result = new double[length];
    for (int i = 0; i < length; i++) {
      result[i] = x[i] - y[i];
    }
    return result;
  }

}
