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

package org.remotemirror.builder;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.remotemirror.Result;
import org.remotemirror.decl.DeclContext;
import org.remotemirror.decl.DeclKind;
import org.remotemirror.decl.Declaration;
import org.remotemirror.decl.ModuleDecl;
import org.remotemirror.demangle.Node;
import org.remotemirror.demangle.SymbolDecoder;
import org.remotemirror.diag.Failure;
import org.remotemirror.lookup.DeclarationResolver;
import org.remotemirror.metadata.FunctionTypeFlags;
import org.remotemirror.type.Type;
import org.remotemirror.type.Type.BoundGenericTy;
import org.remotemirror.type.Type.DependentMemberTy;
import org.remotemirror.type.Type.ExistentialMetatypeTy;
import org.remotemirror.type.Type.ForeignClassTy;
import org.remotemirror.type.Type.FunctionTy;
import org.remotemirror.type.Type.GenericParamTy;
import org.remotemirror.type.Type.MetatypeTy;
import org.remotemirror.type.Type.NominalTy;
import org.remotemirror.type.Type.ProtocolCompositionTy;
import org.remotemirror.type.Type.ProtocolTy;
import org.remotemirror.type.Type.ReferenceStorageTy;
import org.remotemirror.type.Type.ReferenceStorageTy.Ownership;
import org.remotemirror.type.Type.TupleTy;
import org.remotemirror.type.TypeProperties;

/**
 * Builds {@link Type}s and {@link Declaration}s from decoded names and metadata.
 *
 * <p>Every {@code create} method either returns a well-formed value or {@code null}. A {@code
 * null} result is usually a silent structural rejection; when there is something specific to say,
 * the builder also records a {@link Failure}. Only the first failure of a call chain is kept, and
 * it is handed to the caller by {@link #failureAsResult}.
 *
 * <p>Builders hold that failure as mutable state, so a builder must only be used by one call chain
 * at a time.
 */
public class TypeBuilder {

  private final DeclarationResolver resolver;
  private final SymbolDecoder decoder;
  private final TypeResolver typeResolver;

  private @Nullable Failure failure;

  public TypeBuilder(
      DeclarationResolver resolver, SymbolDecoder decoder, TypeResolver typeResolver) {
    this.resolver = requireNonNull(resolver);
    this.decoder = requireNonNull(decoder);
    this.typeResolver = requireNonNull(typeResolver);
  }

  /** Records a failure unless one is already pending, and returns {@code null}. */
  public <T> @Nullable T fail(Failure.Kind kind, Object... args) {
    if (failure == null) {
      failure = Failure.create(kind, args);
    }
    return null;
  }

  /** The pending failure, if any. */
  public @Nullable Failure failure() {
    return failure;
  }

  /** Discards any pending failure. Called at the start of each top-level query. */
  public void clearFailure() {
    failure = null;
  }

  /**
   * Converts the pending failure to a {@link Result} and clears it. If no failure is pending, the
   * result carries a new failure of the given default kind instead.
   */
  public <T> Result<T> failureAsResult(Failure.Kind defaultKind, Object... defaultArgs) {
    if (failure != null) {
      Result<T> result = Result.failure(failure);
      failure = null;
      return result;
    }
    return Result.failure(defaultKind, defaultArgs);
  }

  public Type createBuiltinType(String mangledName) {
    return Type.BuiltinTy.create(mangledName);
  }

  /** Decodes a mangled name and resolves it to a nominal type declaration. */
  public @Nullable Declaration createNominalTypeDecl(String mangledName) {
    Node node = decoder.demangleType(mangledName);
    if (node == null) {
      return null;
    }
    return createNominalTypeDecl(node);
  }

  /** Resolves a symbol tree to a nominal type declaration. */
  public @Nullable Declaration createNominalTypeDecl(Node node) {
    DeclContext dc = resolver.findDeclContext(node);
    if (dc == null) {
      return fail(Failure.Kind.COULD_NOT_RESOLVE_TYPE_DECL, decoder.mangle(node));
    }
    if (!(dc instanceof Declaration)) {
      return null;
    }
    return (Declaration) dc;
  }

  public @Nullable Type createNominalType(Declaration decl, @Nullable Type parent) {
    if (decl.isGeneric()) {
      return null;
    }
    if (!validateNominalParent(decl, parent)) {
      return null;
    }
    return NominalTy.create(decl, parent);
  }

  /**
   * Applies a generic declaration to arguments.
   *
   * <p>Whether the arguments satisfy the declaration's requirements is decided by the {@link
   * TypeResolver}, which is given the fully qualified path to the declaration. Its answer is only
   * accepted if it instantiates {@code decl} itself and not some other declaration that happens to
   * share the path.
   */
  public @Nullable Type createBoundGenericType(
      Declaration decl, ImmutableList<Type> args, @Nullable Type parent) {
    if (!decl.isGeneric()) {
      return null;
    }
    if (!validateNominalParent(decl, parent)) {
      return null;
    }

    List<Type> ancestry = new ArrayList<>();
    for (Type p = parent; p != null; p = TypeProperties.nominalParent(p)) {
      ancestry.add(p);
    }
    ImmutableList.Builder<QualifiedTypeRequest.Segment> segments = ImmutableList.builder();
    for (int i = ancestry.size() - 1; i >= 0; i--) {
      Type p = ancestry.get(i);
      switch (p.tyKind()) {
        case BOUND_GENERIC_TY:
          BoundGenericTy boundGeneric = (BoundGenericTy) p;
          segments.add(
              QualifiedTypeRequest.Segment.create(boundGeneric.decl(), boundGeneric.args()));
          break;
        case NOMINAL_TY:
          segments.add(
              QualifiedTypeRequest.Segment.create(((NominalTy) p).decl(), ImmutableList.of()));
          break;
        default:
          return null;
      }
    }
    segments.add(QualifiedTypeRequest.Segment.create(decl, args));

    Type genericType = typeResolver.resolve(QualifiedTypeRequest.create(segments.build()));
    if (!(genericType instanceof BoundGenericTy)) {
      return null;
    }
    if (!((BoundGenericTy) genericType).decl().equals(decl)) {
      return null;
    }
    return genericType;
  }

  /**
   * Creates a tuple type.
   *
   * @param labels the element labels, one space-terminated token per element in order; an empty
   *     token leaves its element unlabeled, and missing trailing tokens leave the trailing elements
   *     unlabeled
   * @throws IllegalArgumentException if there are more labels than elements
   */
  public @Nullable Type createTupleType(
      ImmutableList<Type> elementTypes, String labels, boolean isVariadic) {
    if (isVariadic) {
      return null;
    }
    ImmutableList.Builder<TupleTy.TupleElement> elements = ImmutableList.builder();
    String remaining = labels;
    for (Type elementType : elementTypes) {
      String label = null;
      if (!remaining.isEmpty()) {
        int space = remaining.indexOf(' ');
        String token = space < 0 ? remaining : remaining.substring(0, space);
        remaining = space < 0 ? "" : remaining.substring(space + 1);
        if (!token.isEmpty()) {
          label = token;
        }
      }
      elements.add(TupleTy.TupleElement.create(label, elementType));
    }
    checkArgument(
        CharMatcher.whitespace().matchesAllOf(remaining),
        "more labels than elements: '%s' for %s elements",
        labels,
        elementTypes.size());
    return TupleTy.create(elements.build());
  }

  /**
   * Creates a function type.
   *
   * @param inoutArgs whether each argument is passed inout; must be the same length as {@code args}
   */
  public @Nullable Type createFunctionType(
      ImmutableList<Type> args, List<Boolean> inoutArgs, Type result, FunctionTypeFlags flags) {
    checkArgument(
        args.size() == inoutArgs.size(),
        "%s arguments but %s inout flags",
        args.size(),
        inoutArgs.size());

    FunctionTy.Representation representation;
    switch (flags.convention()) {
      case SWIFT:
        representation = FunctionTy.Representation.SWIFT;
        break;
      case BLOCK:
        representation = FunctionTy.Representation.BLOCK;
        break;
      case THIN:
        representation = FunctionTy.Representation.THIN;
        break;
      case C_FUNCTION_POINTER:
        representation = FunctionTy.Representation.C_FUNCTION_POINTER;
        break;
      default:
        throw new AssertionError(flags.convention());
    }

    if (!TypeProperties.isMaterializable(result)) {
      return null;
    }
    // Argument types are checked before inout is applied.
    for (Type arg : args) {
      if (!TypeProperties.isMaterializable(arg)) {
        return null;
      }
    }

    ImmutableList.Builder<FunctionTy.Param> params = ImmutableList.builder();
    for (int i = 0; i < args.size(); i++) {
      params.add(FunctionTy.Param.create(args.get(i), inoutArgs.get(i)));
    }
    return FunctionTy.create(params.build(), result, representation, flags.throwing());
  }

  /** Looks up a protocol by its simple name in the named module. */
  public @Nullable Type createProtocolType(
      String mangledName, String moduleName, String protocolName) {
    ModuleDecl module = resolver.findModule(moduleName);
    if (module == null) {
      return null;
    }
    Declaration decl =
        resolver.findNominalTypeDecl(module, protocolName, null, DeclKind.PROTOCOL);
    if (decl == null) {
      return null;
    }
    return ProtocolTy.create(decl);
  }

  public @Nullable Type createProtocolCompositionType(List<Type> protocols) {
    ImmutableList.Builder<ProtocolTy> members = ImmutableList.builder();
    for (Type protocol : protocols) {
      if (!(protocol instanceof ProtocolTy)) {
        return null;
      }
      members.add((ProtocolTy) protocol);
    }
    return ProtocolCompositionTy.create(members.build());
  }

  public @Nullable Type createExistentialMetatypeType(Type instance) {
    if (!TypeProperties.isAnyExistential(instance)) {
      return null;
    }
    return ExistentialMetatypeTy.create(instance);
  }

  public Type createMetatypeType(Type instance) {
    return MetatypeTy.create(instance);
  }

  public Type createGenericTypeParameterType(int depth, int index) {
    return GenericParamTy.create(depth, index);
  }

  public @Nullable Type createDependentMemberType(
      String member, Type base, @Nullable Type protocol) {
    if (!TypeProperties.isTypeParameter(base)) {
      return null;
    }
    return DependentMemberTy.create(base, member, protocol);
  }

  public @Nullable Type createUnownedStorageType(Type base) {
    return createReferenceStorageType(Ownership.UNOWNED, base);
  }

  public @Nullable Type createUnmanagedStorageType(Type base) {
    return createReferenceStorageType(Ownership.UNMANAGED, base);
  }

  public @Nullable Type createWeakStorageType(Type base) {
    return createReferenceStorageType(Ownership.WEAK, base);
  }

  private static @Nullable Type createReferenceStorageType(Ownership ownership, Type base) {
    if (!TypeProperties.allowsOwnership(base)) {
      return null;
    }
    return ReferenceStorageTy.create(ownership, base);
  }

  /** Looks up a foreign class by its simple name. */
  public @Nullable Type createObjCClassType(String name) {
    Declaration decl = resolver.findForeignNominalTypeDecl(name, DeclKind.CLASS);
    if (decl == null) {
      return null;
    }
    return createNominalType(decl, null);
  }

  /** Resolves a foreign class from its mangled name. */
  public @Nullable Type createForeignClassType(String mangledName) {
    Declaration decl = createNominalTypeDecl(mangledName);
    if (decl == null || decl.kind() != DeclKind.CLASS) {
      return null;
    }
    if (decl.isGeneric() || !validateNominalParent(decl, null)) {
      return null;
    }
    return ForeignClassTy.create(decl);
  }

  public Type getUnnamedForeignClassType() {
    return Type.OPAQUE;
  }

  public Type getOpaqueType() {
    return Type.OPAQUE;
  }

  /**
   * Returns the type declared by a declaration that has no generic parameters, including for all
   * of its enclosing declarations.
   */
  public @Nullable Type createDeclaredType(Declaration decl) {
    if (decl.kind() == DeclKind.PROTOCOL) {
      return ProtocolTy.create(decl);
    }
    Type parent = null;
    Declaration parentDecl = decl.nominalParent();
    if (parentDecl != null) {
      parent = createDeclaredType(parentDecl);
      if (parent == null) {
        return null;
      }
    }
    return createNominalType(decl, parent);
  }

  private static boolean validateNominalParent(Declaration decl, @Nullable Type parent) {
    Declaration parentDecl = decl.nominalParent();
    if (parent == null) {
      return parentDecl == null;
    }
    // TODO: check that the parent is an application of the enclosing declaration
    return parentDecl != null;
  }
}
