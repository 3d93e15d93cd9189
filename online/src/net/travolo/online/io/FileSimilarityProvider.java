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

import com.google.common.base.Preconditions;
import org.apache.mahout.cf.taste.common.TasteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.travolo.common.LangUtils;
import net.travolo.online.similarity.SimilarityMatrix;
import net.travolo.online.similarity.SimilarityProvider;

/**
 * Reads item similarities from a file with lines of the form {@code itemID,neighborID,similarity}.
 * Lines for the same item keep their file order in that item's neighbour list. The file is read again
 * on each {@link #load()}.
 */
public final class FileSimilarityProvider implements SimilarityProvider {

  private static final Logger log = LoggerFactory.getLogger(FileSimilarityProvider.class);

  private final File file;

  public FileSimilarityProvider(File file) {
    Preconditions.checkNotNull(file);
    this.file = file;
  }

  public File getFile() {
    return file;
  }

  @Override
  public SimilarityMatrix load() throws TasteException {
    if (!file.isFile()) {
      throw new TasteException("No such similarity file: " + file);
    }
    final SimilarityMatrix.Builder builder = SimilarityMatrix.builder();
    DelimitedLineProcessor.process(file, new DelimitedLineProcessor<Void>(file.toString()) {
      @Override
      void processTokens(List<String> tokens) {
        Preconditions.checkArgument(tokens.size() == 3, "Expected 3 fields but got %s", tokens.size());
        String itemID = tokens.get(0);
        String neighborID = tokens.get(1);
        Preconditions.checkArgument(!itemID.isEmpty() && !neighborID.isEmpty(), "Missing item ID");
        builder.add(itemID, neighborID, LangUtils.parseDouble(tokens.get(2)));
      }
      @Override
      public Void getResult() {
        return null;
      }
    });
    if (builder.getSkippedCount() > 0) {
      log.info("Skipped {} similarities outside (0,1] in {}", builder.getSkippedCount(), file);
    }
    return builder.build();
  }

  @Override
  public String toString() {
    return "FileSimilarityProvider[" + file + ']';
  }

}
