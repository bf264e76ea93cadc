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

package org.remotemirror;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.remotemirror.decl.Declaration;
import org.remotemirror.diag.Failure;
import org.remotemirror.metadata.MetadataKind;
import org.remotemirror.metadata.PointerWidth;
import org.remotemirror.options.ReflectionOptions;
import org.remotemirror.testing.MemoryImage;
import org.remotemirror.testing.SampleProgram;
import org.remotemirror.type.Type;
import org.remotemirror.type.Type.NominalTy;
import org.remotemirror.type.Type.ProtocolTy;

@RunWith(JUnit4.class)
public class ReflectionContextTest {

  private final SampleProgram program = new SampleProgram();
  private final MemoryImage image = new MemoryImage(PointerWidth.BITS_32);

  private ReflectionContext context;
  private long intMetadata;

  @Before
  public void setUp() {
    ReflectionOptions options =
        ReflectionOptions.builder().setPointerWidth(PointerWidth.BITS_32).build();
    context =
        new ReflectionContext(
            options,
            image,
            program.decoder,
            program.directory,
            program.directory,
            program.typeResolver);
    intMetadata = image.structMetadata(image.valueDescriptor(SampleProgram.INT, 0), 0);
  }

  @Test
  public void typeForMetadata() {
    Result<Type> result = context.getTypeForRemoteTypeMetadata(intMetadata);

    assertTrue(result.isSuccess());
    assertEquals(NominalTy.create(program.intDecl, null), result.value());
  }

  @Test
  public void unresolvedTypeIsExplained() {
    long missing = image.structMetadata(image.valueDescriptor(SampleProgram.MISSING, 0), 0);

    Result<Type> result = context.getTypeForRemoteTypeMetadata(missing);

    assertFalse(result.isSuccess());
    assertEquals(Failure.Kind.COULD_NOT_RESOLVE_TYPE_DECL, result.failure().kind());
    assertEquals(
        "could not resolve type declaration for '$s1M7MissingV'", result.failure().message());
  }

  @Test
  public void failuresDoNotLeakBetweenQueries() {
    long missing = image.structMetadata(image.valueDescriptor(SampleProgram.MISSING, 0), 0);
    context.getTypeForRemoteTypeMetadata(missing);

    Result<Type> unreadable = context.getTypeForRemoteTypeMetadata(0x20);

    assertEquals(Failure.create(Failure.Kind.UNKNOWN), unreadable.failure());
  }

  @Test
  public void kindForMetadata() {
    assertEquals(
        Result.success(MetadataKind.STRUCT), context.getKindForRemoteTypeMetadata(intMetadata));
    assertEquals(Failure.Kind.UNKNOWN, context.getKindForRemoteTypeMetadata(0).failure().kind());
  }

  @Test
  public void declForDescriptor() {
    long descriptor = image.valueDescriptor(SampleProgram.BOX, 1);

    assertEquals(
        Result.success(program.box), context.getDeclForRemoteNominalTypeDescriptor(descriptor));
  }

  @Test
  public void offsetForPropertyIsUnknown() {
    Result<Long> result =
        context.getOffsetForProperty(NominalTy.create(program.intDecl, null), "bitWidth");

    assertEquals(Failure.create(Failure.Kind.UNKNOWN), result.failure());
    assertEquals(Long.valueOf(-1), result.orElse(-1L));
  }

  @Test
  public void typeForMangledName() {
    assertEquals(
        NominalTy.create(program.widgetInner, NominalTy.create(program.widget, null)),
        context.getTypeForMangledName(SampleProgram.WIDGET_INNER).value());
    assertEquals(
        ProtocolTy.create(program.hashable),
        context.getTypeForMangledName(SampleProgram.HASHABLE).value());
    assertEquals(
        Failure.Kind.UNKNOWN, context.getTypeForMangledName(SampleProgram.BOX).failure().kind());
    assertEquals(
        Failure.Kind.COULD_NOT_RESOLVE_TYPE_DECL,
        context.getTypeForMangledName(SampleProgram.MISSING).failure().kind());
  }

  @Test
  public void declForMangledName() {
    Result<Declaration> result = context.getDeclForMangledName(SampleProgram.CF_STRING);

    assertEquals(program.cfString, result.value());
    assertEquals("__ObjC.CFString", result.value().qualifiedName());
    assertEquals(
        Failure.Kind.UNKNOWN, context.getDeclForMangledName("not mangled").failure().kind());
  }
}
