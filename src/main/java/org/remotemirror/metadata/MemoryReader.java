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

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.ByteArrayOutputStream;
import org.jspecify.annotations.Nullable;

/**
 * Reads the address space of the remote process. Supplied by the embedding debugger, which owns
 * any timeout or retry policy.
 */
public interface MemoryReader {

  /**
   * Fills {@code dest} with the bytes starting at {@code address}.
   *
   * @return false if any part of the range could not be read
   */
  boolean readBytes(long address, byte[] dest);

  /**
   * Reads a NUL-terminated UTF-8 string.
   *
   * @return the string, or {@code null} if it could not be read or has no terminator within {@code
   *     maxLength} bytes
   */
  default @Nullable String readString(long address, int maxLength) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    byte[] b = new byte[1];
    for (int i = 0; i < maxLength; i++) {
      if (!readBytes(address + i, b)) {
        return null;
      }
      if (b[0] == 0) {
        return new String(out.toByteArray(), UTF_8);
      }
      out.write(b[0]);
    }
    return null;
  }
}
