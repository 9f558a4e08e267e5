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

/** Base of all export failures. */
public class ExportException extends RuntimeException {

  public ExportException(String msg) {
    super(msg);
  }

  public ExportException(String msg, Throwable cause) {
    super(msg, cause);
  }

  /** Directory or file could not be created or written. Aborts the export. */
  public static class IoFailure extends ExportException {
    public IoFailure(String msg, Throwable cause) {
      super(msg, cause);
    }
  }

  /** Batch could not be assembled or encoded. Aborts the export. */
  public static class WriteFailure extends ExportException {
    public WriteFailure(String msg) {
      super(msg);
    }

    public WriteFailure(String msg, Throwable cause) {
      super(msg, cause);
    }
  }

  /** One value or attribute could not be described or reflected. */
  public static class SerializationFailure extends ExportException {
    public SerializationFailure(String msg) {
      super(msg);
    }

    public SerializationFailure(String msg, Throwable cause) {
      super(msg, cause);
    }
  }
}
