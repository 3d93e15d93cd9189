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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs the full breakdown of each {@link ScoreRecord} at debug level.
 */
public final class LoggingScoreDiagnostics implements ScoreDiagnostics {

  private static final Logger log = LoggerFactory.getLogger(LoggingScoreDiagnostics.class);

  @Override
  public void scored(ScoreRecord record) {
    if (log.isDebugEnabled()) {
      log.debug("Scores for {}:\n{}", record.getItemID(), record.describe());
    }
  }

}
