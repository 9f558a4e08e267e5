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

import java.util.Locale;

/** What the writer does when materialized columns of one cluster differ in length. */
public enum RaggedColumnPolicy {
  /** Keep only entities present in every column; log how many rows were dropped. */
  DROP_INCOMPLETE_ROWS,
  /** Refuse to write the file. */
  FAIL;

  public static RaggedColumnPolicy fromString(String value) {
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
