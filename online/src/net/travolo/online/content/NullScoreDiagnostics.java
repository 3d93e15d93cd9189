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

package net.travolo.online.content;

/**
 * A {@link ScoreDiagnostics} that does nothing.
 */
public final class NullScoreDiagnostics implements ScoreDiagnostics {

  private static final ScoreDiagnostics INSTANCE = new NullScoreDiagnostics();

  public static ScoreDiagnostics getInstance() {
    return INSTANCE;
  }

  private NullScoreDiagnostics() {
  }

  @Override
  public void scored(ScoreRecord record) {
    // do nothing
  }

}
