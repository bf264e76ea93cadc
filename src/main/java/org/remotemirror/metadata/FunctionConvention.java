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

/** The calling convention recorded in function metadata. */
public enum FunctionConvention {
  SWIFT(0),
  BLOCK(1),
  THIN(2),
  C_FUNCTION_POINTER(3);

  private final int value;

  FunctionConvention(int value) {
    this.value = value;
  }

  /** The encoded value. */
  public int value() {
    return value;
  }

  /** Returns the convention with the given encoded value, or {@code null} if there is none. */
  public static @Nullable FunctionConvention fromValue(int value) {
    for (FunctionConvention convention : values()) {
      if (convention.value == value) {
        return convention;
      }
    }
    return null;
  }
}
