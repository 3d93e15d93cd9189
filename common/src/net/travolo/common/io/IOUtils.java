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

package net.travolo.common.io;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.zip.GZIPInputStream;
import java.util.zip.InflaterInputStream;
import java.util.zip.ZipInputStream;

import com.google.common.base.Charsets;
import com.google.common.io.Closeables;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;

/**
 * Simple utility methods related to I/O.
 */
public final class IOUtils {

  private IOUtils() {
  }

  /**
   * Attempts to recursively delete a directory. This may not work across symlinks.
   *
   * @param dir directory to delete along with contents
   * @return {@code true} if all files and dirs were deleted successfully
   */
  public static boolean deleteRecursively(File dir) {
    if (dir == null) {
      return false;
    }
    Deque<File> stack = new ArrayDeque<File>();
    stack.push(dir);
    boolean result = true;
    while (!stack.isEmpty()) {
      File topElement = stack.peek();
      File[] directoryContents = topElement.isDirectory() ? topElement.listFiles() : null;
      if (directoryContents != null && directoryContents.length > 0) {
        for (File fileOrSubDirectory : directoryContents) {
          stack.push(fileOrSubDirectory);
        }
      } else {
        result = stack.pop().delete() && result;
      }
    }
    return result;
  }

  /**
   * Opens an {@link InputStream} to the file. If it appears to be compressed, because its file name ends in
   * ".gz", ".zip", ".deflate" or ".bz2", then it will be decompressed accordingly. A ".zip" file is read
   * from its first entry.
   *
   * @param file file, possibly compressed, to open
   * @return {@link InputStream} on uncompressed contents
   * @throws IOException if the stream can't be opened or is invalid or can't be read
   */
  public static InputStream openMaybeDecompressing(File file) throws IOException {
    String name = file.getName();
    InputStream in = new FileInputStream(file);
    try {
      if (name.endsWith(".gz")) {
        return new GZIPInputStream(in);
      }
      if (name.endsWith(".zip")) {
        ZipInputStream zipIn = new ZipInputStream(in);
        if (zipIn.getNextEntry() == null) {
          throw new IOException("No entries in " + file);
        }
        return zipIn;
      }
      if (name.endsWith(".deflate")) {
        return new InflaterInputStream(in);
      }
      if (name.endsWith(".bz2") || name.endsWith(".bzip2")) {
        return new BZip2CompressorInputStream(in);
      }
      return in;
    } catch (IOException ioe) {
      Closeables.closeQuietly(in);
      throw ioe;
    }
  }

  /**
   * @param file file, possibly compressed, to open
   * @return {@link BufferedReader} on uncompressed contents, decoded as UTF-8
   * @throws IOException if the stream can't be opened or is invalid or can't be read
   * @see #openMaybeDecompressing(File)
   */
  public static BufferedReader openReaderMaybeDecompressing(File file) throws IOException {
    return new BufferedReader(new InputStreamReader(openMaybeDecompressing(file), Charsets.UTF_8));
  }

}
