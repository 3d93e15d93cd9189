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

package net.travolo.online.io;

import java.io.File;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.Maps;
import org.apache.mahout.cf.taste.common.TasteException;

import net.travolo.online.model.Rating;

/**
 * Reads a user's destination ratings from lines of the form {@code itemID,like} or {@code itemID,dislike}.
 * A later line for the same item replaces the earlier rating.
 */
public final class RatingsFileReader {

  private final File file;

  public RatingsFileReader(File file) {
    Preconditions.checkNotNull(file);
    this.file = file;
  }

  /**
   * @return item ID to rating, in file order
   * @throws TasteException if the file can't be read
   */
  public Map<String,Rating> read() throws TasteException {
    final Map<String,Rating> ratings = Maps.newLinkedHashMap();
    DelimitedLineProcessor.process(file, new DelimitedLineProcessor<Map<String,Rating>>(file.toString()) {
      @Override
      void processTokens(List<String> tokens) {
        Preconditions.checkArgument(tokens.size() == 2, "Expected 2 fields but got %s", tokens.size());
        String itemID = tokens.get(0);
        Preconditions.checkArgument(!itemID.isEmpty(), "Missing item ID");
        Rating rating = Rating.parse(tokens.get(1));
        Preconditions.checkArgument(rating != null, "Unknown rating %s", tokens.get(1));
        ratings.put(itemID, rating);
      }
      @Override
      public Map<String,Rating> getResult() {
        return ratings;
      }
    });
    return ratings;
  }

}
