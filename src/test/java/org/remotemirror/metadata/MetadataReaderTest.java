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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;
import org.remotemirror.builder.TypeBuilder;
import org.remotemirror.diag.Failure;
import org.remotemirror.options.ReflectionOptions;
import org.remotemirror.testing.MemoryImage;
import org.remotemirror.testing.SampleProgram;
import org.remotemirror.type.Type;
import org.remotemirror.type.Type.BoundGenericTy;
import org.remotemirror.type.Type.ForeignClassTy;
import org.remotemirror.type.Type.FunctionTy;
import org.remotemirror.type.Type.MetatypeTy;
import org.remotemirror.type.Type.NominalTy;
import org.remotemirror.type.Type.ProtocolCompositionTy;
import org.remotemirror.type.Type.ProtocolTy;
import org.remotemirror.type.Type.TupleTy;

@RunWith(Parameterized.class)
public class MetadataReaderTest {

  @Parameters(name = "{0}")
  public static Iterable<Object[]> parameters() {
    return Arrays.asList(new Object[][] {{PointerWidth.BITS_32}, {PointerWidth.BITS_64}});
  }

  private final PointerWidth width;

  private SampleProgram program;
  private MemoryImage image;
  private TypeBuilder builder;
  private MetadataReader reader;

  private long intMetadata;
  private long stringMetadata;

  public MetadataReaderTest(PointerWidth width) {
    this.width = width;
  }

  @Before
  public void setUp() {
    program = new SampleProgram();
    image = new MemoryImage(width);
    builder = program.newTypeBuilder();
    reader = newReader(ReflectionOptions.builder().setPointerWidth(width).build());

    intMetadata = image.structMetadata(image.valueDescriptor(SampleProgram.INT, 0), 0);
    stringMetadata = image.structMetadata(image.valueDescriptor(SampleProgram.STRING, 0), 0);
  }

  private MetadataReader newReader(ReflectionOptions options) {
    return new MetadataReader(options, image, program.decoder, builder);
  }

  private Type intType() {
    return NominalTy.create(program.intDecl, null);
  }

  private Type stringType() {
    return NominalTy.create(program.stringDecl, null);
  }

  @Test
  public void kinds() {
    long classMetadata = image.classMetadata(image.classDescriptor(SampleProgram.WIDGET, 0), 0);

    assertEquals(MetadataKind.STRUCT, reader.readKindFromMetadata(intMetadata));
    assertEquals(MetadataKind.CLASS, reader.readKindFromMetadata(classMetadata));
    assertEquals(
        MetadataKind.TUPLE, reader.readKindFromMetadata(image.tupleMetadata(null, intMetadata)));
    assertNull(reader.readKindFromMetadata(image.words(5)));
    assertNull(reader.readKindFromMetadata(0));
    assertNull(reader.readKindFromMetadata(0x10));
  }

  @Test
  public void struct() {
    assertEquals(intType(), reader.readTypeFromMetadata(intMetadata));
    assertNull(builder.failure());
  }

  @Test
  public void enumAndOptional() {
    long descriptor = image.valueDescriptor(SampleProgram.MODE, 0);
    Type mode = NominalTy.create(program.mode, null);

    assertEquals(
        mode,
        reader.readTypeFromMetadata(image.valueMetadata(MetadataKind.ENUM, descriptor, 0)));
    assertEquals(
        mode,
        reader.readTypeFromMetadata(image.valueMetadata(MetadataKind.OPTIONAL, descriptor, 0)));
  }

  @Test
  public void classWithNestedStruct() {
    long widgetMetadata = image.classMetadata(image.classDescriptor(SampleProgram.WIDGET, 0), 0);
    long innerMetadata =
        image.structMetadata(image.valueDescriptor(SampleProgram.WIDGET_INNER, 0), widgetMetadata);

    Type widget = NominalTy.create(program.widget, null);
    assertEquals(widget, reader.readTypeFromMetadata(widgetMetadata));
    assertEquals(
        NominalTy.create(program.widgetInner, widget), reader.readTypeFromMetadata(innerMetadata));
  }

  @Test
  public void nestedStructWithoutParentMetadata() {
    long innerMetadata =
        image.structMetadata(image.valueDescriptor(SampleProgram.WIDGET_INNER, 0), 0);
    assertNull(reader.readTypeFromMetadata(innerMetadata));
  }

  @Test
  public void classWithoutDescriptor() {
    assertNull(reader.readTypeFromMetadata(image.classMetadata(0, 0)));
  }

  @Test
  public void boundGenericStruct() {
    long boxDescriptor = image.valueDescriptor(SampleProgram.BOX, 1);
    long boxOfInt = image.structMetadata(boxDescriptor, 0, intMetadata);
    long boxOfBox = image.structMetadata(boxDescriptor, 0, boxOfInt);

    Type expected = BoundGenericTy.create(program.box, ImmutableList.of(intType()), null);
    assertEquals(expected, reader.readTypeFromMetadata(boxOfInt));
    assertEquals(
        BoundGenericTy.create(program.box, ImmutableList.of(expected), null),
        reader.readTypeFromMetadata(boxOfBox));
    assertEquals("M.Box<M.Box<M.Int>>", reader.readTypeFromMetadata(boxOfBox).toString());
  }

  @Test
  public void unreadableGenericArgumentFailsOwner() {
    long boxDescriptor = image.valueDescriptor(SampleProgram.BOX, 1);
    long boxOfInt = image.structMetadata(boxDescriptor, 0, intMetadata);
    image.makeUnreadable(intMetadata, width.size());

    assertNull(reader.readTypeFromMetadata(boxOfInt));
  }

  @Test
  public void genericArgumentRejectedByResolver() {
    long boxDescriptor = image.valueDescriptor(SampleProgram.BOX, 1);
    long boxOfInt = image.structMetadata(boxDescriptor, 0, intMetadata);
    program.typeResolver.rejectAll();

    assertNull(reader.readTypeFromMetadata(boxOfInt));
    assertEquals(1, program.typeResolver.requests().size());
  }

  @Test
  public void unresolvedDescriptorRecordsFailure() {
    long missing = image.structMetadata(image.valueDescriptor(SampleProgram.MISSING, 0), 0);
    long boxOfMissing =
        image.structMetadata(image.valueDescriptor(SampleProgram.BOX, 1), 0, missing);

    assertNull(reader.readTypeFromMetadata(boxOfMissing));
    assertEquals(
        Failure.create(Failure.Kind.COULD_NOT_RESOLVE_TYPE_DECL, SampleProgram.MISSING),
        builder.failure());
  }

  @Test
  public void descriptor() {
    long address = image.descriptor(SampleProgram.BOX, 7, 1);

    NominalTypeDescriptor descriptor = reader.readNominalTypeDescriptor(address);

    assertEquals(address, descriptor.address());
    assertEquals(SampleProgram.BOX, descriptor.mangledName());
    assertEquals(7, descriptor.genericArgumentOffset());
    assertEquals(1, descriptor.genericParamCount());
    assertEquals(program.box, reader.readNominalTypeFromDescriptor(address));
  }

  @Test
  public void descriptorWithUnterminatedName() {
    ReflectionOptions options =
        ReflectionOptions.builder().setPointerWidth(width).setMaxStringLength(4).build();
    long address = image.valueDescriptor(SampleProgram.BOX, 1);

    assertNull(newReader(options).readNominalTypeDescriptor(address));
  }

  @Test
  public void tuple() {
    long tuple = image.tupleMetadata("a  c ", intMetadata, stringMetadata, intMetadata);

    TupleTy type = (TupleTy) reader.readTypeFromMetadata(tuple);

    assertEquals("(a: M.Int, M.String, c: M.Int)", type.toString());
    assertEquals(
        TupleTy.create(ImmutableList.of()),
        reader.readTypeFromMetadata(image.tupleMetadata(null)));
  }

  @Test
  public void tupleWithoutLabels() {
    long tuple = image.tupleMetadata(null, intMetadata, stringMetadata);

    assertEquals(
        TupleTy.create(
            ImmutableList.of(
                TupleTy.TupleElement.create(null, intType()),
                TupleTy.TupleElement.create(null, stringType()))),
        reader.readTypeFromMetadata(tuple));
  }

  @Test
  public void tupleWithTooManyLabels() {
    assertNull(reader.readTypeFromMetadata(image.tupleMetadata("a b c ", intMetadata)));
  }

  @Test
  public void function() {
    FunctionTypeFlags flags = FunctionTypeFlags.create(2, FunctionConvention.THIN, true);
    long function = image.functionMetadata(flags, stringMetadata, intMetadata | 1, stringMetadata);

    FunctionTy type = (FunctionTy) reader.readTypeFromMetadata(function);

    assertEquals(FunctionTy.Representation.THIN, type.representation());
    assertTrue(type.throwing());
    assertEquals(
        ImmutableList.of(
            FunctionTy.Param.create(intType(), true),
            FunctionTy.Param.create(stringType(), false)),
        type.params());
    assertEquals(stringType(), type.result());
  }

  @Test
  public void functionWithUnknownConvention() {
    long function = image.words(MetadataKind.FUNCTION.value(), 7L << 24, intMetadata);
    assertNull(reader.readTypeFromMetadata(function));
  }

  @Test
  public void existentials() {
    long hashable = image.protocolDescriptor(SampleProgram.HASHABLE);
    long codable = image.protocolDescriptor(SampleProgram.CODABLE);
    ProtocolTy hashableType = ProtocolTy.create(program.hashable);
    ProtocolTy codableType = ProtocolTy.create(program.codable);

    assertEquals(
        ProtocolCompositionTy.ANY, reader.readTypeFromMetadata(image.existentialMetadata()));
    assertEquals(hashableType, reader.readTypeFromMetadata(image.existentialMetadata(hashable)));
    assertEquals(
        ProtocolCompositionTy.create(ImmutableList.of(hashableType, codableType)),
        reader.readTypeFromMetadata(image.existentialMetadata(hashable, codable)));
  }

  @Test
  public void existentialWithUnknownProtocol() {
    long unknown = image.protocolDescriptor("$s1M5WidgetP");
    assertNull(reader.readTypeFromMetadata(image.existentialMetadata(unknown)));

    long notAProtocol = image.protocolDescriptor(SampleProgram.INT);
    assertNull(reader.readTypeFromMetadata(image.existentialMetadata(notAProtocol)));
  }

  @Test
  public void metatypes() {
    long hashable = image.existentialMetadata(image.protocolDescriptor(SampleProgram.HASHABLE));

    assertEquals(
        MetatypeTy.create(intType()),
        reader.readTypeFromMetadata(image.metatypeMetadata(intMetadata)));
    assertEquals(
        "M.Hashable.Protocol",
        reader.readTypeFromMetadata(image.metatypeMetadata(hashable)).toString());
    assertEquals(
        "M.Hashable.Type",
        reader.readTypeFromMetadata(image.existentialMetatypeMetadata(hashable)).toString());
    assertNull(reader.readTypeFromMetadata(image.existentialMetatypeMetadata(intMetadata)));
  }

  @Test
  public void objcClassWrapper() {
    assertEquals(
        NominalTy.create(program.nsObject, null),
        reader.readTypeFromMetadata(image.objcClassWrapper("NSObject")));
    assertNull(reader.readTypeFromMetadata(image.objcClassWrapper("NSMissing")));
  }

  @Test
  public void foreignClass() {
    assertEquals(
        ForeignClassTy.create(program.cfString),
        reader.readTypeFromMetadata(image.foreignClassMetadata(SampleProgram.CF_STRING)));
    assertSame(Type.OPAQUE, reader.readTypeFromMetadata(image.foreignClassMetadata(null)));
  }

  @Test
  public void opaque() {
    assertSame(
        Type.OPAQUE, reader.readTypeFromMetadata(image.kindOnlyMetadata(MetadataKind.OPAQUE)));
  }

  @Test
  public void kindsWithoutTypes() {
    for (MetadataKind kind :
        ImmutableList.of(
            MetadataKind.HEAP_LOCAL_VARIABLE,
            MetadataKind.HEAP_GENERIC_LOCAL_VARIABLE,
            MetadataKind.ERROR_OBJECT)) {
      assertNull(reader.readTypeFromMetadata(image.kindOnlyMetadata(kind)));
    }
    assertNull(builder.failure());
  }

  @Test
  public void nullPointers() {
    assertNull(reader.readTypeFromMetadata(0));
    assertNull(reader.readTypeFromMetadata(image.metatypeMetadata(0)));
    assertNull(reader.readNominalTypeDescriptor(0));
  }

  @Test
  public void selfReferentialMetadataHitsDepthCap() {
    MetadataReader shallow =
        newReader(
            ReflectionOptions.builder().setPointerWidth(width).setMaxMetadataDepth(16).build());
    long loop = image.reserve(2);
    image.setWords(loop, MetadataKind.METATYPE.value(), loop);

    assertNull(shallow.readTypeFromMetadata(loop));
    assertEquals(Failure.create(Failure.Kind.METADATA_TOO_DEEP, 16, loop), builder.failure());

    builder.clearFailure();
    assertEquals(intType(), shallow.readTypeFromMetadata(intMetadata));
  }

  @Test
  public void depthCapCountsNesting() {
    MetadataReader shallow =
        newReader(
            ReflectionOptions.builder().setPointerWidth(width).setMaxMetadataDepth(3).build());
    long twice = image.metatypeMetadata(image.metatypeMetadata(intMetadata));
    long thrice = image.metatypeMetadata(twice);

    assertEquals(
        MetatypeTy.create(MetatypeTy.create(intType())), shallow.readTypeFromMetadata(twice));
    assertNull(shallow.readTypeFromMetadata(thrice));
  }
}
