/*
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

package org.remotemirror.metadata;

import org.jspecify.annotations.Nullable;

/** The kind of a runtime metadata record, stored in the record's first word. */
public enum MetadataKind {
  CLASS(0),
  STRUCT(1),
  ENUM(2),
  OPTIONAL(3),
  OPAQUE(8),
  TUPLE(9),
  FUNCTION(10),
  EXISTENTIAL(12),
  METATYPE(13),
  OBJC_CLASS_WRAPPER(14),
  EXISTENTIAL_METATYPE(15),
  FOREIGN_CLASS(16),
  HEAP_LOCAL_VARIABLE(64),
  HEAP_GENERIC_LOCAL_VARIABLE(65),
  ERROR_OBJECT(128);

  /**
   * The largest kind value. Class metadata stores an isa pointer in the kind word, which is always
   * larger.
   */
  public static final long MAX_KIND = 2047;

  private final int value;

  MetadataKind(int value) {
    this.value = value;
  }

  /** The encoded value. */
  public int value() {
    return value;
  }

  /** Decodes a kind word, or returns {@code null} if it isn't a valid kind. */
  public static @Nullable MetadataKind fromKindWord(long kindWord) {
    if (Long.compareUnsigned(kindWord, MAX_KIND) > 0) {
      return CLASS;
    }
    for (MetadataKind kind : values()) {
      if (kind.value == kindWord) {
        return kind;
      }
    }
    return null;
  }
}
