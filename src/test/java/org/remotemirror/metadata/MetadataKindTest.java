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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class MetadataKindTest {

  @Test
  public void kindWords() {
    assertEquals(MetadataKind.STRUCT, MetadataKind.fromKindWord(1));
    assertEquals(MetadataKind.FOREIGN_CLASS, MetadataKind.fromKindWord(16));
    assertEquals(MetadataKind.ERROR_OBJECT, MetadataKind.fromKindWord(128));
    assertNull(MetadataKind.fromKindWord(4));
    assertNull(MetadataKind.fromKindWord(MetadataKind.MAX_KIND));
  }

  @Test
  public void isaPointerMeansClass() {
    assertEquals(MetadataKind.CLASS, MetadataKind.fromKindWord(MetadataKind.MAX_KIND + 1));
    assertEquals(MetadataKind.CLASS, MetadataKind.fromKindWord(0x7fff_5000_1000L));
    // Addresses in the upper half of a 64-bit address space read as negative.
    assertEquals(MetadataKind.CLASS, MetadataKind.fromKindWord(0xffff_8000_0000_0000L));
  }

  @Test
  public void functionTypeFlags() {
    FunctionTypeFlags flags = FunctionTypeFlags.decode(0x1300_0002L);

    assertEquals(2, flags.numArguments());
    assertEquals(FunctionConvention.C_FUNCTION_POINTER, flags.convention());
    assertTrue(flags.throwing());
    assertEquals(0x1300_0002L, flags.encode());

    FunctionTypeFlags block = FunctionTypeFlags.decode(0x0100_0000L);
    assertEquals(0, block.numArguments());
    assertEquals(FunctionConvention.BLOCK, block.convention());
    assertFalse(block.throwing());

    assertNull(FunctionTypeFlags.decode(0x0500_0001L));
  }
}
