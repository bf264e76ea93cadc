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

/**
 * The pointer width of the target process.
 *
 * <p>A {@link MetadataReader} is bound to one width for its lifetime; everything that depends on
 * the width is looked up here rather than tested at each read.
 */
public enum PointerWidth {
  BITS_32(4, ~0x3L, 16) {
    @Override
    public long readWord(RecordReader reader) {
      return reader.u4();
    }
  },
  BITS_64(8, ~0x7L, 24) {
    @Override
    public long readWord(RecordReader reader) {
      return reader.u8();
    }
  };

  private final int size;
  private final long objcDataMask;
  private final int objcNameOffset;

  PointerWidth(int size, long objcDataMask, int objcNameOffset) {
    this.size = size;
    this.objcDataMask = objcDataMask;
    this.objcNameOffset = objcNameOffset;
  }

  /** The size of a pointer in bytes. */
  public int size() {
    return size;
  }

  /** Reads one pointer-sized word. */
  public abstract long readWord(RecordReader reader);

  /** The mask that clears the flag bits of an Objective-C class object's data pointer. */
  public long objcDataMask() {
    return objcDataMask;
  }

  /** The offset of the name pointer in an Objective-C class's read-only data. */
  public int objcNameOffset() {
    return objcNameOffset;
  }

  /** Returns the width with the given number of bits. */
  public static PointerWidth fromBits(int bits) {
    switch (bits) {
      case 32:
        return BITS_32;
      case 64:
        return BITS_64;
      default:
        throw new IllegalArgumentException("unsupported pointer width: " + bits);
    }
  }
}
