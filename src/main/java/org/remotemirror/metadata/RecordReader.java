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

import static com.google.common.base.Preconditions.checkPositionIndexes;

import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;
import java.nio.ByteOrder;

/** Reads fixed-width integers from a buffer copied out of remote memory, tracking the position. */
public class RecordReader {

  private final byte[] bytes;
  private final boolean littleEndian;
  private int pos;

  public RecordReader(byte[] bytes, ByteOrder order) {
    this.bytes = bytes;
    this.littleEndian = order.equals(ByteOrder.LITTLE_ENDIAN);
    this.pos = 0;
  }

  /** The position in the buffer. */
  public int pos() {
    return pos;
  }

  /** Moves to the given position in the buffer. */
  public void seek(int pos) {
    checkPositionIndexes(pos, pos, bytes.length);
    this.pos = pos;
  }

  /** Skips n bytes of input. */
  public void skip(int n) {
    seek(pos + n);
  }

  /** Reads an unsigned 8-bit integer. */
  public int u1() {
    checkPositionIndexes(pos, pos + 1, bytes.length);
    return bytes[pos++] & 0xff;
  }

  /** Reads a signed 32-bit integer. */
  public int s4() {
    checkPositionIndexes(pos, pos + 4, bytes.length);
    int result;
    if (littleEndian) {
      result = Ints.fromBytes(bytes[pos + 3], bytes[pos + 2], bytes[pos + 1], bytes[pos]);
    } else {
      result = Ints.fromBytes(bytes[pos], bytes[pos + 1], bytes[pos + 2], bytes[pos + 3]);
    }
    pos += 4;
    return result;
  }

  /** Reads an unsigned 32-bit integer. */
  public long u4() {
    return Integer.toUnsignedLong(s4());
  }

  /** Reads a 64-bit integer. Values above {@link Long#MAX_VALUE} are returned as negative. */
  public long u8() {
    checkPositionIndexes(pos, pos + 8, bytes.length);
    long result;
    if (littleEndian) {
      result =
          Longs.fromBytes(
              bytes[pos + 7],
              bytes[pos + 6],
              bytes[pos + 5],
              bytes[pos + 4],
              bytes[pos + 3],
              bytes[pos + 2],
              bytes[pos + 1],
              bytes[pos]);
    } else {
      result =
          Longs.fromBytes(
              bytes[pos],
              bytes[pos + 1],
              bytes[pos + 2],
              bytes[pos + 3],
              bytes[pos + 4],
              bytes[pos + 5],
              bytes[pos + 6],
              bytes[pos + 7]);
    }
    pos += 8;
    return result;
  }
}
