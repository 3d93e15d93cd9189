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

import org.junit.Test;

import net.travolo.common.TravoloTest;

public final class ConfidenceMapperTest extends TravoloTest {

  @Test
  public void testEnds() {
    assertEquals(0, ConfidenceMapper.toConfidence(0.0));
    assertEquals(100, ConfidenceMapper.toConfidence(1.0));
  }

  @Test
  public void testBandEdges() {
    assertEquals(49, ConfidenceMapper.toConfidence(0.3999));
    assertEquals(50, ConfidenceMapper.toConfidence(0.4));
    assertEquals(70, ConfidenceMapper.toConfidence(0.6));
    assertEquals(90, ConfidenceMapper.toConfidence(0.8));
    assertEquals(95, ConfidenceMapper.toConfidence(0.9));
  }

  @Test
  public void testOutOfRange() {
    assertEquals(0, ConfidenceMapper.toConfidence(Double.NaN));
    assertEquals(0, ConfidenceMapper.toConfidence(-0.5));
    assertEquals(100, ConfidenceMapper.toConfidence(1.5));
  }

  @Test
  public void testMonotone() {
    int previous = 0;
    for (int i = 0; i <= 1000; i++) {
      int confidence = ConfidenceMapper.toConfidence(i / 1000.0);
      assertTrue(confidence >= previous);
      assertTrue(confidence <= 100);
      previous = confidence;
    }
    assertEquals(100, previous);
  }

}
