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

import static java.util.Objects.requireNonNull;

import org.jspecify.annotations.Nullable;
import org.remotemirror.builder.TypeBuilder;
import org.remotemirror.builder.TypeResolver;
import org.remotemirror.decl.Declaration;
import org.remotemirror.demangle.SymbolDecoder;
import org.remotemirror.diag.Failure;
import org.remotemirror.lookup.DeclarationResolver;
import org.remotemirror.lookup.Directory;
import org.remotemirror.lookup.ImporterBridge;
import org.remotemirror.metadata.MemoryReader;
import org.remotemirror.metadata.MetadataKind;
import org.remotemirror.metadata.MetadataReader;
import org.remotemirror.options.ReflectionOptions;
import org.remotemirror.type.Type;

/**
 * Answers type questions about a remote process.
 *
 * <p>Each query starts with a clean failure slot and returns a {@link Result}; no query throws
 * because of what it finds in remote memory. A context is bound to one target for its lifetime
 * and is not thread-safe.
 */
public class ReflectionContext {

  private final ReflectionOptions options;
  private final TypeBuilder builder;
  private final MetadataReader reader;

  public ReflectionContext(
      ReflectionOptions options,
      MemoryReader memory,
      SymbolDecoder decoder,
      Directory directory,
      @Nullable ImporterBridge importer,
      TypeResolver typeResolver) {
    this.options = requireNonNull(options);
    DeclarationResolver resolver =
        new DeclarationResolver(directory, importer, decoder, options.foreignModuleName());
    this.builder = new TypeBuilder(resolver, decoder, typeResolver);
    this.reader = new MetadataReader(options, memory, decoder, builder);
  }

  public ReflectionOptions options() {
    return options;
  }

  /** Decodes the type described by the metadata record at {@code address}. */
  public Result<Type> getTypeForRemoteTypeMetadata(long address) {
    builder.clearFailure();
    return toResult(reader.readTypeFromMetadata(address));
  }

  /** Reads the kind of the metadata record at {@code address}. */
  public Result<MetadataKind> getKindForRemoteTypeMetadata(long address) {
    builder.clearFailure();
    return toResult(reader.readKindFromMetadata(address));
  }

  /** Resolves the declaration described by the nominal type descriptor at {@code address}. */
  public Result<Declaration> getDeclForRemoteNominalTypeDescriptor(long address) {
    builder.clearFailure();
    return toResult(reader.readNominalTypeFromDescriptor(address));
  }

  /** Field offsets are not computed; this always fails. */
  public Result<Long> getOffsetForProperty(Type type, String propertyName) {
    builder.clearFailure();
    return builder.failureAsResult(Failure.Kind.UNKNOWN);
  }

  /** Resolves a mangled nominal type name to its declaration. */
  public Result<Declaration> getDeclForMangledName(String mangledName) {
    builder.clearFailure();
    return toResult(builder.createNominalTypeDecl(mangledName));
  }

  /**
   * Resolves a mangled nominal type name to the type it declares. Fails for declarations that,
   * or whose enclosing declarations, have generic parameters.
   */
  public Result<Type> getTypeForMangledName(String mangledName) {
    builder.clearFailure();
    Declaration decl = builder.createNominalTypeDecl(mangledName);
    if (decl == null) {
      return builder.failureAsResult(Failure.Kind.UNKNOWN);
    }
    return toResult(builder.createDeclaredType(decl));
  }

  private <T> Result<T> toResult(@Nullable T value) {
    if (value == null) {
      return builder.failureAsResult(Failure.Kind.UNKNOWN);
    }
    return Result.success(value);
  }
}
