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

package net.travolo.common.log;

import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Helpers for configuring {@code java.util.logging}, which backs SLF4J in this project.
 */
public final class LogUtils {

  private static final String JAVA7_LOG_FORMAT_PROP = "java.util.logging.SimpleFormatter.format";

  private LogUtils() {
  }

  /**
   * <p>Sets the {@code java.util.logging} default output format to something more sensible than the 2-line default.
   * This can be overridden further on the command line. The format is like:</p>
   *
   * <p><pre>
   * Mon Nov 26 23:16:09 GMT 2012 INFO Loaded similarities for 412 items
   * </pre></p>
   */
  public static void setSensibleLogFormat() {
    if (System.getProperty(JAVA7_LOG_FORMAT_PROP) == null) {
      System.setProperty(JAVA7_LOG_FORMAT_PROP, "%1$tc %4$s %5$s%6$s%n");
    }
  }

  /**
   * Turns on {@code FINE} (SLF4J debug) output for the loggers of the given classes and for the handlers
   * of their parent loggers.
   */
  public static void enableDebugLoggingIn(Class<?>... classes) {
    for (Class<?> c : classes) {
      Logger julLogger = Logger.getLogger(c.getName());
      julLogger.setLevel(Level.FINE);
      while (julLogger != null) {
        for (Handler handler : julLogger.getHandlers()) {
          handler.setLevel(Level.FINE);
        }
        julLogger = julLogger.getParent();
      }
    }
  }

}
