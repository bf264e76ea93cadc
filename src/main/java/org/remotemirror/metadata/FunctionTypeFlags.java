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
import org.jspecify.annotations.Nullable;

/**
 * The flags word of function metadata.
 *
 * <p>The low 24 bits hold the argument count, bits 24-27 the {@link FunctionConvention}, and bit
 * 28 is set for throwing functions.
 */
@AutoValue
public abstract class FunctionTypeFlags {

  static final long NUM_ARGUMENTS_MASK = 0x00FF_FFFFL;
  static final long CONVENTION_MASK = 0x0F00_0000L;
  static final int CONVENTION_SHIFT = 24;
  static final long THROWS_MASK = 0x1000_0000L;

  public static FunctionTypeFlags create(
      int numArguments, FunctionConvention convention, boolean throwing) {
    return new AutoValue_FunctionTypeFlags(numArguments, convention, throwing);
  }

  /** Decodes a flags word, or returns {@code null} if the convention is unknown. */
  public static @Nullable FunctionTypeFlags decode(long flags) {
    FunctionConvention convention =
        FunctionConvention.fromValue((int) ((flags & CONVENTION_MASK) >>> CONVENTION_SHIFT));
    if (convention == null) {
      return null;
    }
    return create((int) (flags & NUM_ARGUMENTS_MASK), convention, (flags & THROWS_MASK) != 0);
  }

  public abstract int numArguments();

  public abstract FunctionConvention convention();

  public abstract boolean throwing();

  /** Encodes these flags as a flags word. */
  public long encode() {
    long flags = numArguments() & NUM_ARGUMENTS_MASK;
    flags |= ((long) convention().value()) << CONVENTION_SHIFT;
    if (throwing()) {
      flags |= THROWS_MASK;
    }
    return flags;
  }
}
