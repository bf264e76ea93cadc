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

import com.google.auto.value.AutoValue;

/** A decoded nominal type descriptor. */
@AutoValue
public abstract class NominalTypeDescriptor {

  /** The size of a descriptor in bytes, independent of the pointer width. */
  public static final int SIZE = 12;

  public static NominalTypeDescriptor create(
      long address, String mangledName, long genericArgumentOffset, int genericParamCount) {
    return new AutoValue_NominalTypeDescriptor(
        address, mangledName, genericArgumentOffset, genericParamCount);
  }

  /** The remote address of the descriptor. */
  public abstract long address();

  /** The mangled name of the described type. */
  public abstract String mangledName();

  /** The offset in words of the generic argument vector from the start of a metadata record. */
  public abstract long genericArgumentOffset();

  /** The number of generic parameters the described type declares. */
  public abstract int genericParamCount();
}
