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

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.io.CharStreams;
import com.google.common.io.Closeables;
import com.google.common.io.LineProcessor;
import org.apache.mahout.cf.taste.common.TasteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.travolo.common.LangUtils;
import net.travolo.common.io.IOUtils;

/**
 * <p>Base for readers of simple comma-delimited files. Blank lines and lines starting with {@code #}
 * are skipped. Fields are trimmed; quoting is not supported.</p>
 *
 * <p>A line that {@link #processTokens(List)} rejects with an {@link IllegalArgumentException}
 * is logged and skipped. Reading fails once more than {@link #MAX_BAD_LINES} lines have been skipped.</p>
 *
 * @param <T> type of result produced from the whole file
 */
abstract class DelimitedLineProcessor<T> implements LineProcessor<T> {

  private static final Logger log = LoggerFactory.getLogger(DelimitedLineProcessor.class);

  static final Splitter DELIMITER = Splitter.on(',').trimResults();
  static final int MAX_BAD_LINES = 100;

  private final String source;
  private int lineNumber;
  private int badLines;

  DelimitedLineProcessor(String source) {
    this.source = source;
  }

  /**
   * Reads the whole file, which may be compressed, through the given processor.
   *
   * @throws TasteException if the file can't be read or has too many bad lines
   */
  static <T> T process(File file, DelimitedLineProcessor<T> processor) throws TasteException {
    Preconditions.checkNotNull(file);
    BufferedReader reader = null;
    try {
      reader = IOUtils.openReaderMaybeDecompressing(file);
      return CharStreams.readLines(reader, processor);
    } catch (IOException ioe) {
      throw new TasteException(ioe);
    } finally {
      Closeables.closeQuietly(reader);
    }
  }

  @Override
  public final boolean processLine(String line) throws IOException {
    lineNumber++;
    String trimmed = line.trim();
    if (trimmed.isEmpty() || trimmed.charAt(0) == '#') {
      return true;
    }
    try {
      processTokens(DELIMITER.splitToList(trimmed));
    } catch (IllegalArgumentException iae) {
      badLines++;
      log.warn("Skipping line {} of {}: {} ({})", lineNumber, source, line, iae.getMessage());
      if (badLines > MAX_BAD_LINES) {
        throw new IOException("Too many bad lines in " + source);
      }
    }
    return true;
  }

  /**
   * @param tokens trimmed fields of one non-comment line
   * @throws IllegalArgumentException if the line is malformed
   */
  abstract void processTokens(List<String> tokens);

  /**
   * @return number of lines skipped as malformed so far
   */
  final int getBadLineCount() {
    return badLines;
  }

  static String field(List<String> tokens, int index) {
    Preconditions.checkArgument(index < tokens.size(), "Expected at least %s fields", index + 1);
    return tokens.get(index);
  }

  /**
   * @return field's value, or {@link Double#NaN} if the field is empty or missing
   */
  static double optionalDouble(List<String> tokens, int index) {
    if (index >= tokens.size()) {
      return Double.NaN;
    }
    String token = tokens.get(index);
    return token.isEmpty() ? Double.NaN : LangUtils.parseDouble(token);
  }

}
