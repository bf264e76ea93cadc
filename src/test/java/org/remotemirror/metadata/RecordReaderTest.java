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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

import java.nio.ByteOrder;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class RecordReaderTest {

  private static final byte[] BYTES = {
    (byte) 0x01, (byte) 0x02, (byte) 0x03, (byte) 0x04,
    (byte) 0xfe, (byte) 0xff, (byte) 0xff, (byte) 0xff,
  };

  @Test
  public void littleEndian() {
    RecordReader reader = new RecordReader(BYTES, ByteOrder.LITTLE_ENDIAN);

    assertEquals(0x04030201, reader.s4());
    assertEquals(-2, reader.s4());
    assertEquals(8, reader.pos());

    reader.seek(4);
    assertEquals(0xfffffffeL, reader.u4());

    reader.seek(0);
    assertEquals(0xfffffffe04030201L, reader.u8());
  }

  @Test
  public void bigEndian() {
    RecordReader reader = new RecordReader(BYTES, ByteOrder.BIG_ENDIAN);

    assertEquals(0x01020304L, reader.u4());
    assertEquals(0xfeffffffL, reader.u4());

    reader.seek(0);
    assertEquals(0x01, reader.u1());
    reader.skip(2);
    assertEquals(0x04, reader.u1());
  }

  @Test
  public void pointerWords() {
    RecordReader reader = new RecordReader(BYTES, ByteOrder.LITTLE_ENDIAN);
    assertEquals(0x04030201L, PointerWidth.BITS_32.readWord(reader));
    assertEquals(0xfffffffeL, PointerWidth.BITS_32.readWord(reader));

    reader.seek(0);
    assertEquals(0xfffffffe04030201L, PointerWidth.BITS_64.readWord(reader));
  }

  @Test
  public void readPastEnd() {
    RecordReader reader = new RecordReader(BYTES, ByteOrder.LITTLE_ENDIAN);
    reader.seek(6);

    assertThrows(IndexOutOfBoundsException.class, reader::u4);
  }
}
