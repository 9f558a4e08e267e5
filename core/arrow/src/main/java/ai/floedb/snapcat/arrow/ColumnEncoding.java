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

package ai.floedb.snapcat.arrow;

import java.util.Locale;

/** How attribute values are laid out in columns. */
public enum ColumnEncoding {
  /** Native Arrow types where a mapping exists; debug strings only for unmappable kinds. */
  TYPED,
  /** Every attribute becomes a Utf8 column holding the value's debug string. */
  DEBUG_STRING;

  public static ColumnEncoding fromString(String value) {
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
