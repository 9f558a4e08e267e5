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

package ai.floedb.snapcat.store;

/** Snapshot-local attribute identifier. */
public record AttributeId(int index) {

  public AttributeId {
    if (index < 0) {
      throw new IllegalArgumentException("attribute index must be >= 0");
    }
  }

  public static AttributeId of(int index) {
    return new AttributeId(index);
  }
}
