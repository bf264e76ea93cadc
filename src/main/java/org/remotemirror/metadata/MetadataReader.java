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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.remotemirror.builder.TypeBuilder;
import org.remotemirror.decl.Declaration;
import org.remotemirror.demangle.Node;
import org.remotemirror.demangle.SymbolDecoder;
import org.remotemirror.diag.Failure;
import org.remotemirror.options.ReflectionOptions;
import org.remotemirror.type.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes runtime metadata records in a remote process into {@link Type}s.
 *
 * <p>Every record starts with a kind word. Records are laid out in pointer-sized words, so a
 * reader is bound to one {@link PointerWidth} for its lifetime. A record that cannot be read, or
 * that refers to something that cannot be read, decodes to {@code null}; the reason, if one is
 * known, is left in the {@link TypeBuilder}'s failure slot.
 *
 * <p>Not thread-safe.
 */
public class MetadataReader {

  private static final Logger logger = LoggerFactory.getLogger(MetadataReader.class);

  /** Element counts above this are treated as corrupt rather than allocated. */
  static final long MAX_ELEMENTS = 0x10000;

  private static final int CLASS_DESCRIPTOR_WORD = 2;
  private static final int CLASS_PARENT_WORD = 3;
  private static final int VALUE_DESCRIPTOR_WORD = 1;
  private static final int VALUE_PARENT_WORD = 2;
  private static final int TRAILING_WORD = 3;
  private static final int OBJC_DATA_WORD = 4;
  private static final int PROTOCOL_NAME_WORD = 1;

  private final PointerWidth width;
  private final ByteOrder byteOrder;
  private final int maxDepth;
  private final int maxStringLength;
  private final MemoryReader memory;
  private final SymbolDecoder decoder;
  private final TypeBuilder builder;

  private int depth = 0;

  public MetadataReader(
      ReflectionOptions options, MemoryReader memory, SymbolDecoder decoder, TypeBuilder builder) {
    this.width = options.pointerWidth();
    this.byteOrder = options.byteOrder();
    this.maxDepth = options.maxMetadataDepth();
    this.maxStringLength = options.maxStringLength();
    this.memory = requireNonNull(memory);
    this.decoder = requireNonNull(decoder);
    this.builder = requireNonNull(builder);
  }

  public PointerWidth pointerWidth() {
    return width;
  }

  public TypeBuilder builder() {
    return builder;
  }

  /** Reads the kind of the metadata record at {@code address}. */
  public @Nullable MetadataKind readKindFromMetadata(long address) {
    long[] words = readWords(address, 1);
    if (words == null) {
      return null;
    }
    MetadataKind kind = MetadataKind.fromKindWord(words[0]);
    if (kind == null) {
      logger.debug("unknown metadata kind {} at 0x{}", words[0], Long.toHexString(address));
    }
    return kind;
  }

  /** Decodes the metadata record at {@code address}, and the records it refers to. */
  public @Nullable Type readTypeFromMetadata(long address) {
    if (depth >= maxDepth) {
      return builder.fail(Failure.Kind.METADATA_TOO_DEEP, maxDepth, address);
    }
    depth++;
    try {
      return readTypeAt(address);
    } finally {
      depth--;
    }
  }

  private @Nullable Type readTypeAt(long address) {
    MetadataKind kind = readKindFromMetadata(address);
    if (kind == null) {
      return null;
    }
    switch (kind) {
      case CLASS:
        return readNominalType(address, CLASS_DESCRIPTOR_WORD, CLASS_PARENT_WORD);
      case STRUCT:
      case ENUM:
      case OPTIONAL:
        return readNominalType(address, VALUE_DESCRIPTOR_WORD, VALUE_PARENT_WORD);
      case TUPLE:
        return readTupleType(address);
      case FUNCTION:
        return readFunctionType(address);
      case EXISTENTIAL:
        return readExistentialType(address);
      case METATYPE:
        {
          Type instance = readReferencedType(address, 1);
          return instance != null ? builder.createMetatypeType(instance) : null;
        }
      case EXISTENTIAL_METATYPE:
        {
          Type instance = readReferencedType(address, 1);
          return instance != null ? builder.createExistentialMetatypeType(instance) : null;
        }
      case OBJC_CLASS_WRAPPER:
        return readObjCClassWrapper(address);
      case FOREIGN_CLASS:
        return readForeignClass(address);
      case OPAQUE:
        return builder.getOpaqueType();
      case HEAP_LOCAL_VARIABLE:
      case HEAP_GENERIC_LOCAL_VARIABLE:
      case ERROR_OBJECT:
        logger.debug("no type for {} metadata at 0x{}", kind, Long.toHexString(address));
        return null;
    }
    throw new AssertionError(kind);
  }

  /** Reads the pointer in word {@code index} of a record and decodes the record it points to. */
  private @Nullable Type readReferencedType(long address, int index) {
    long[] words = readWords(address, index + 1);
    if (words == null) {
      return null;
    }
    return readTypeFromMetadata(words[index]);
  }

  private @Nullable Type readNominalType(long address, int descriptorWord, int parentWord) {
    long[] header = readWords(address, parentWord + 1);
    if (header == null) {
      return null;
    }
    long descriptorAddress = header[descriptorWord];
    if (descriptorAddress == 0) {
      // Class metadata without a descriptor, such as an Objective-C class seen through Swift.
      logger.debug("nominal metadata without a descriptor at 0x{}", Long.toHexString(address));
      return null;
    }
    NominalTypeDescriptor descriptor = readNominalTypeDescriptor(descriptorAddress);
    if (descriptor == null) {
      return null;
    }
    Declaration decl = builder.createNominalTypeDecl(descriptor.mangledName());
    if (decl == null) {
      return null;
    }

    Type parent = null;
    long parentAddress = header[parentWord];
    if (parentAddress != 0) {
      parent = readTypeFromMetadata(parentAddress);
      if (parent == null) {
        return null;
      }
    }

    if (descriptor.genericParamCount() == 0) {
      return builder.createNominalType(decl, parent);
    }
    long[] argAddresses =
        readWords(
            address + descriptor.genericArgumentOffset() * width.size(),
            descriptor.genericParamCount());
    if (argAddresses == null) {
      return null;
    }
    ImmutableList<Type> args = readTypes(argAddresses);
    if (args == null) {
      return null;
    }
    return builder.createBoundGenericType(decl, args, parent);
  }

  /** Decodes the descriptor at {@code address} and resolves the declaration it describes. */
  public @Nullable Declaration readNominalTypeFromDescriptor(long address) {
    NominalTypeDescriptor descriptor = readNominalTypeDescriptor(address);
    if (descriptor == null) {
      return null;
    }
    return builder.createNominalTypeDecl(descriptor.mangledName());
  }

  /** Decodes the nominal type descriptor at {@code address}. */
  public @Nullable NominalTypeDescriptor readNominalTypeDescriptor(long address) {
    RecordReader reader = readRecord(address, NominalTypeDescriptor.SIZE);
    if (reader == null) {
      return null;
    }
    int nameOffset = reader.s4();
    long genericArgumentOffset = reader.u4();
    long genericParamCount = reader.u4();
    if (genericParamCount > MAX_ELEMENTS) {
      logger.debug(
          "descriptor at 0x{} claims {} generic parameters",
          Long.toHexString(address),
          genericParamCount);
      return null;
    }
    String mangledName = readString(address + nameOffset);
    if (mangledName == null) {
      return null;
    }
    return NominalTypeDescriptor.create(
        address, mangledName, genericArgumentOffset, (int) genericParamCount);
  }

  private @Nullable Type readTupleType(long address) {
    long[] header = readWords(address, TRAILING_WORD);
    if (header == null) {
      return null;
    }
    long count = header[1];
    if (!checkCount(address, count)) {
      return null;
    }
    long[] elements = readWords(address + TRAILING_WORD * width.size(), 2 * (int) count);
    if (elements == null) {
      return null;
    }
    long[] typeAddresses = new long[(int) count];
    for (int i = 0; i < count; i++) {
      // Each element is a (type, offset) pair.
      typeAddresses[i] = elements[2 * i];
    }
    ImmutableList<Type> types = readTypes(typeAddresses);
    if (types == null) {
      return null;
    }

    String labels = "";
    long labelsAddress = header[2];
    if (labelsAddress != 0) {
      labels = readString(labelsAddress);
      if (labels == null) {
        return null;
      }
    }
    try {
      return builder.createTupleType(types, labels, /* isVariadic= */ false);
    } catch (IllegalArgumentException e) {
      // The labels came from the target, so a mismatch means the record is corrupt.
      logger.debug("malformed tuple metadata at 0x{}", Long.toHexString(address), e);
      return null;
    }
  }

  private @Nullable Type readFunctionType(long address) {
    long[] header = readWords(address, TRAILING_WORD);
    if (header == null) {
      return null;
    }
    FunctionTypeFlags flags = FunctionTypeFlags.decode(header[1]);
    if (flags == null) {
      logger.debug("unknown function convention in flags 0x{}", Long.toHexString(header[1]));
      return null;
    }
    if (!checkCount(address, flags.numArguments())) {
      return null;
    }
    long[] argWords = readWords(address + TRAILING_WORD * width.size(), flags.numArguments());
    if (argWords == null) {
      return null;
    }
    long[] argAddresses = new long[argWords.length];
    List<Boolean> inout = new ArrayList<>();
    for (int i = 0; i < argWords.length; i++) {
      // The low bit of an argument pointer marks it inout.
      argAddresses[i] = argWords[i] & ~1L;
      inout.add((argWords[i] & 1L) != 0);
    }
    ImmutableList<Type> args = readTypes(argAddresses);
    if (args == null) {
      return null;
    }
    Type result = readTypeFromMetadata(header[2]);
    if (result == null) {
      return null;
    }
    return builder.createFunctionType(args, inout, result, flags);
  }

  private @Nullable Type readExistentialType(long address) {
    long[] header = readWords(address, TRAILING_WORD);
    if (header == null) {
      return null;
    }
    long count = header[2];
    if (!checkCount(address, count)) {
      return null;
    }
    long[] descriptors = readWords(address + TRAILING_WORD * width.size(), (int) count);
    if (descriptors == null) {
      return null;
    }
    List<Type> protocols = new ArrayList<>();
    for (long descriptor : descriptors) {
      Type protocol = readProtocol(descriptor);
      if (protocol == null) {
        return null;
      }
      protocols.add(protocol);
    }
    if (protocols.size() == 1) {
      return protocols.get(0);
    }
    return builder.createProtocolCompositionType(protocols);
  }

  private @Nullable Type readProtocol(long descriptorAddress) {
    long[] words = readWords(descriptorAddress, PROTOCOL_NAME_WORD + 1);
    if (words == null) {
      return null;
    }
    String mangledName = readString(words[PROTOCOL_NAME_WORD]);
    if (mangledName == null) {
      return null;
    }
    Node node = unwrapType(decoder.demangleType(mangledName));
    if (node == null || node.kind() != Node.Kind.PROTOCOL || node.children().size() < 2) {
      logger.debug("not a protocol name: {}", mangledName);
      return null;
    }
    Node moduleNode = node.child(0);
    if (moduleNode.kind() == Node.Kind.DECL_CONTEXT && moduleNode.hasChildren()) {
      moduleNode = moduleNode.firstChild();
    }
    Node nameNode = node.child(1);
    if (moduleNode.kind() != Node.Kind.MODULE
        || nameNode.kind() != Node.Kind.IDENTIFIER
        || moduleNode.text() == null
        || nameNode.text() == null) {
      logger.debug("not a top-level protocol: {}", mangledName);
      return null;
    }
    return builder.createProtocolType(mangledName, moduleNode.text(), nameNode.text());
  }

  private static @Nullable Node unwrapType(@Nullable Node node) {
    while (node != null && node.hasChildren()) {
      switch (node.kind()) {
        case GLOBAL:
        case TYPE_MANGLING:
        case TYPE:
          node = node.firstChild();
          break;
        default:
          return node;
      }
    }
    return node;
  }

  private @Nullable Type readObjCClassWrapper(long address) {
    long[] words = readWords(address, 2);
    if (words == null) {
      return null;
    }
    String name = readObjCClassName(words[1]);
    if (name == null) {
      return null;
    }
    return builder.createObjCClassType(name);
  }

  private @Nullable String readObjCClassName(long classAddress) {
    long[] words = readWords(classAddress, OBJC_DATA_WORD + 1);
    if (words == null) {
      return null;
    }
    long dataAddress = words[OBJC_DATA_WORD] & width.objcDataMask();
    RecordReader reader = readRecord(dataAddress, width.objcNameOffset() + width.size());
    if (reader == null) {
      return null;
    }
    reader.seek(width.objcNameOffset());
    return readString(width.readWord(reader));
  }

  private @Nullable Type readForeignClass(long address) {
    long[] words = readWords(address, 2);
    if (words == null) {
      return null;
    }
    if (words[1] == 0) {
      return builder.getUnnamedForeignClassType();
    }
    String mangledName = readString(words[1]);
    if (mangledName == null) {
      return null;
    }
    return builder.createForeignClassType(mangledName);
  }

  private @Nullable ImmutableList<Type> readTypes(long[] addresses) {
    ImmutableList.Builder<Type> types = ImmutableList.builder();
    for (long address : addresses) {
      Type type = readTypeFromMetadata(address);
      if (type == null) {
        return null;
      }
      types.add(type);
    }
    return types.build();
  }

  private boolean checkCount(long address, long count) {
    if (count < 0 || count > MAX_ELEMENTS) {
      logger.debug("record at 0x{} claims {} elements", Long.toHexString(address), count);
      return false;
    }
    return true;
  }

  /** Reads {@code count} pointer-sized words starting at {@code address}. */
  private long @Nullable [] readWords(long address, int count) {
    RecordReader reader = readRecord(address, count * width.size());
    if (reader == null) {
      return null;
    }
    long[] words = new long[count];
    for (int i = 0; i < count; i++) {
      words[i] = width.readWord(reader);
    }
    return words;
  }

  private @Nullable RecordReader readRecord(long address, int size) {
    if (address == 0) {
      logger.debug("null pointer in metadata");
      return null;
    }
    byte[] bytes = new byte[size];
    if (!memory.readBytes(address, bytes)) {
      logger.debug("could not read {} bytes at 0x{}", size, Long.toHexString(address));
      return null;
    }
    return new RecordReader(bytes, byteOrder);
  }

  private @Nullable String readString(long address) {
    if (address == 0) {
      return null;
    }
    String result = memory.readString(address, maxStringLength);
    if (result == null) {
      logger.debug("could not read string at 0x{}", Long.toHexString(address));
    }
    return result;
  }
}
