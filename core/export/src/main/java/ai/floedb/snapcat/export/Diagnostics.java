/*
 * Copyright 2026 Yellowbrick Data, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.floedb.snapcat.export;

import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * Logging wrappers for values that may be absent and actions that may fail, for code paths where a
 * problem is worth a log line but not an abort.
 */
public final class Diagnostics {

  private static final Logger LOG = Logger.getLogger(Diagnostics.class);

  private Diagnostics() {}

  @FunctionalInterface
  public interface FallibleAction {
    void run() throws Exception;
  }

  /** Logs {@code message} at error level when {@code value} is empty. Returns {@code value}. */
  public static <T> Optional<T> complain(Optional<T> value, String message) {
    if (value.isEmpty()) {
      LOG.error(message);
    }
    return value;
  }

  /** Logs {@code message} at error level when {@code ok} is false. Returns {@code ok}. */
  public static boolean complain(boolean ok, String message) {
    if (!ok) {
      LOG.error(message);
    }
    return ok;
  }

  /** Logs {@code message} and the value at info level when {@code value} is present. */
  public static <T> Optional<T> relief(Optional<T> value, String message) {
    value.ifPresent(v -> LOG.infof("%s: %s", message, v));
    return value;
  }

  /** Logs {@code message} and {@code value} at debug level and passes the value through. */
  public static <T> T report(String message, T value) {
    LOG.debugf("%s: %s", message, value);
    return value;
  }

  /**
   * Runs {@code action}; a failure is logged at error level with {@code message} and reported as
   * {@code false} instead of being thrown.
   */
  public static boolean hope(FallibleAction action, String message) {
    try {
      action.run();
      return true;
    } catch (Exception e) {
      LOG.errorf(e, "%s", message);
      return false;
    }
  }
}
