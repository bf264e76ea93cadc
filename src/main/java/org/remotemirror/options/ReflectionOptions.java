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

package org.remotemirror.options;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import java.nio.ByteOrder;
import org.remotemirror.metadata.PointerWidth;

/** Settings for a {@link org.remotemirror.ReflectionContext}. */
@AutoValue
public abstract class ReflectionOptions {

  public static final int DEFAULT_MAX_METADATA_DEPTH = 256;
  public static final int DEFAULT_MAX_STRING_LENGTH = 4096;
  public static final String DEFAULT_FOREIGN_MODULE_NAME = "__ObjC";

  /** The pointer width of the target process. */
  public abstract PointerWidth pointerWidth();

  /** The byte order of the target process. */
  public abstract ByteOrder byteOrder();

  /** The deepest nesting of metadata records that will be followed before giving up. */
  public abstract int maxMetadataDepth();

  /** The longest NUL-terminated string, excluding the terminator, that will be read. */
  public abstract int maxStringLength();

  /** The name of the pseudo-module that foreign declarations are mangled into. */
  public abstract String foreignModuleName();

  public abstract Builder toBuilder();

  public static Builder builder() {
    return new AutoValue_ReflectionOptions.Builder()
        .setPointerWidth(PointerWidth.BITS_64)
        .setByteOrder(ByteOrder.LITTLE_ENDIAN)
        .setMaxMetadataDepth(DEFAULT_MAX_METADATA_DEPTH)
        .setMaxStringLength(DEFAULT_MAX_STRING_LENGTH)
        .setForeignModuleName(DEFAULT_FOREIGN_MODULE_NAME);
  }

  /** Returns the default options. */
  public static ReflectionOptions defaults() {
    return builder().build();
  }

  /** A {@link Builder} for {@link ReflectionOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setPointerWidth(PointerWidth pointerWidth);

    public abstract Builder setByteOrder(ByteOrder byteOrder);

    public abstract Builder setMaxMetadataDepth(int maxMetadataDepth);

    public abstract Builder setMaxStringLength(int maxStringLength);

    public abstract Builder setForeignModuleName(String foreignModuleName);

    abstract ReflectionOptions autoBuild();

    public ReflectionOptions build() {
      ReflectionOptions options = autoBuild();
      checkArgument(
          options.maxMetadataDepth() > 0,
          "max metadata depth must be positive: %s",
          options.maxMetadataDepth());
      checkArgument(
          options.maxStringLength() > 0,
          "max string length must be positive: %s",
          options.maxStringLength());
      checkArgument(!options.foreignModuleName().isEmpty(), "empty foreign module name");
      return options;
    }
  }
}
