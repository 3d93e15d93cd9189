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


package net.travolo.cli;

/**
 * Commands understood by {@link CLI}. Each corresponds to one stage of
 * {@link net.travolo.online.DestinationRecommender}.
 */
enum CLICommand {

  /** Full pipeline: adjust, score, blend and rank. */
  RECOMMEND,
  /** Prints the per-theme feedback adjustment and the adjusted theme scores. */
  ADJUST,
  /** Prints the content score breakdown for every catalog item. */
  SCORE,
  /** Prints the collaborative score of every item reachable from a liked item. */
  COLLABORATIVE

}
