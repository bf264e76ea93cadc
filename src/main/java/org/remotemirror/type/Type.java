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

package org.remotemirror.type;

import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import com.google.common.base.Ascii;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;
import org.remotemirror.decl.Declaration;

/**
 * A remote type.
 *
 * <p>Types are immutable structural values: two types are equal iff they describe the same type.
 * They are only created by {@link org.remotemirror.builder.TypeBuilder}, which is responsible for
 * the structural invariants documented on each variant.
 */
public interface Type {

  /** A type kind. */
  enum TyKind {
    /** A builtin runtime type that isn't resolved any further. */
    BUILTIN_TY,
    /** A non-generic nominal type. */
    NOMINAL_TY,
    /** A generic nominal type applied to arguments. */
    BOUND_GENERIC_TY,
    TUPLE_TY,
    FUNCTION_TY,
    PROTOCOL_TY,
    PROTOCOL_COMPOSITION_TY,
    EXISTENTIAL_METATYPE_TY,
    METATYPE_TY,
    GENERIC_PARAM_TY,
    DEPENDENT_MEMBER_TY,
    /** The type of an inout function parameter. */
    INOUT_TY,
    /** An unowned, unmanaged or weak reference. */
    REFERENCE_STORAGE_TY,
    FOREIGN_CLASS_TY,
    /** A type that exists but can't be described. */
    OPAQUE_TY,
  }

  /** The type kind. */
  TyKind tyKind();

  /**
   * The opaque type.
   *
   * <p>Returned for types whose existence is known but whose structure is not representable, so
   * that callers can distinguish "unsupported" from "failed".
   */
  Type OPAQUE =
      new Type() {
        @Override
        public TyKind tyKind() {
          return TyKind.OPAQUE_TY;
        }

        @Override
        public final String toString() {
          return "<opaque>";
        }
      };

  /** A builtin type, identified by its mangled name. */
  @AutoValue
  abstract class BuiltinTy implements Type {

    public static BuiltinTy create(String mangledName) {
      return new AutoValue_Type_BuiltinTy(mangledName);
    }

    public abstract String mangledName();

    @Override
    public TyKind tyKind() {
      return TyKind.BUILTIN_TY;
    }

    @Override
    public final String toString() {
      return "Builtin(" + mangledName() + ")";
    }
  }

  /**
   * A non-generic nominal type.
   *
   * <p>The parent is present iff the declaration is nested in another nominal type.
   */
  @AutoValue
  abstract class NominalTy implements Type {

    public static NominalTy create(Declaration decl, @Nullable Type parent) {
      return new AutoValue_Type_NominalTy(decl, parent);
    }

    public abstract Declaration decl();

    public abstract @Nullable Type parent();

    @Override
    public TyKind tyKind() {
      return TyKind.NOMINAL_TY;
    }

    @Memoized
    @Override
    public abstract int hashCode();

    @Override
    public final String toString() {
      return qualify(parent(), decl());
    }
  }

  /**
   * A generic nominal type applied to type arguments.
   *
   * <p>The arguments are the declaration's own; arguments of generic parents live on the parent.
   */
  @AutoValue
  abstract class BoundGenericTy implements Type {

    public static BoundGenericTy create(
        Declaration decl, ImmutableList<Type> args, @Nullable Type parent) {
      return new AutoValue_Type_BoundGenericTy(decl, args, parent);
    }

    public abstract Declaration decl();

    public abstract ImmutableList<Type> args();

    public abstract @Nullable Type parent();

    @Override
    public TyKind tyKind() {
      return TyKind.BOUND_GENERIC_TY;
    }

    @Memoized
    @Override
    public abstract int hashCode();

    @Override
    public final String toString() {
      StringBuilder sb = new StringBuilder(qualify(parent(), decl()));
      sb.append('<');
      Joiner.on(", ").appendTo(sb, args());
      sb.append('>');
      return sb.toString();
    }
  }

  /** A tuple type. Variadic tuples are not represented. */
  @AutoValue
  abstract class TupleTy implements Type {

    public static TupleTy create(ImmutableList<TupleElement> elements) {
      return new AutoValue_Type_TupleTy(elements);
    }

    public abstract ImmutableList<TupleElement> elements();

    @Override
    public TyKind tyKind() {
      return TyKind.TUPLE_TY;
    }

    @Memoized
    @Override
    public abstract int hashCode();

    @Override
    public final String toString() {
      return "(" + Joiner.on(", ").join(elements()) + ")";
    }

    /** One element of a {@link TupleTy}. */
    @AutoValue
    public abstract static class TupleElement {

      public static TupleElement create(@Nullable String label, Type type) {
        return new AutoValue_Type_TupleTy_TupleElement(label, type);
      }

      /** The element label, or {@code null} for an unlabeled element. */
      public abstract @Nullable String label();

      public abstract Type type();

      @Override
      public final String toString() {
        return label() != null ? label() + ": " + type() : type().toString();
      }
    }
  }

  /** A function type. */
  @AutoValue
  abstract class FunctionTy implements Type {

    /** The calling convention of a function value. */
    public enum Representation {
      SWIFT,
      BLOCK,
      THIN,
      C_FUNCTION_POINTER
    }

    public static FunctionTy create(
        ImmutableList<Param> params, Type result, Representation representation, boolean throwing) {
      return new AutoValue_Type_FunctionTy(params, result, representation, throwing);
    }

    public abstract ImmutableList<Param> params();

    public abstract Type result();

    public abstract Representation representation();

    public abstract boolean throwing();

    /**
     * The parameter type of the function: the single parameter's type if there is exactly one,
     * otherwise a tuple of all parameters in order. Inout parameters are wrapped in {@link
     * InOutTy}.
     */
    @Memoized
    public Type input() {
      if (params().size() == 1) {
        return params().get(0).wrappedType();
      }
      ImmutableList.Builder<TupleTy.TupleElement> elements = ImmutableList.builder();
      for (Param param : params()) {
        elements.add(TupleTy.TupleElement.create(null, param.wrappedType()));
      }
      return TupleTy.create(elements.build());
    }

    @Override
    public TyKind tyKind() {
      return TyKind.FUNCTION_TY;
    }

    @Memoized
    @Override
    public abstract int hashCode();

    @Override
    public final String toString() {
      StringBuilder sb = new StringBuilder();
      if (representation() != Representation.SWIFT) {
        sb.append("@convention(").append(Ascii.toLowerCase(representation().name())).append(") ");
      }
      sb.append('(');
      Joiner.on(", ").appendTo(sb, params());
      sb.append(')');
      if (throwing()) {
        sb.append(" throws");
      }
      sb.append(" -> ").append(result());
      return sb.toString();
    }

    /** A function parameter. */
    @AutoValue
    public abstract static class Param {

      public static Param create(Type type, boolean inout) {
        return new AutoValue_Type_FunctionTy_Param(type, inout);
      }

      /** The parameter type, before any inout wrapping. */
      public abstract Type type();

      public abstract boolean inout();

      /** The parameter type as it appears in the function's input. */
      public Type wrappedType() {
        return inout() ? InOutTy.create(type()) : type();
      }

      @Override
      public final String toString() {
        return wrappedType().toString();
      }
    }
  }

  /** A protocol used as a type. */
  @AutoValue
  abstract class ProtocolTy implements Type {

    public static ProtocolTy create(Declaration decl) {
      return new AutoValue_Type_ProtocolTy(decl);
    }

    public abstract Declaration decl();

    @Override
    public TyKind tyKind() {
      return TyKind.PROTOCOL_TY;
    }

    @Override
    public final String toString() {
      return decl().qualifiedName();
    }
  }

  /**
   * A composition of protocols. The empty composition is the top type {@code Any}.
   */
  @AutoValue
  abstract class ProtocolCompositionTy implements Type {

    public static final ProtocolCompositionTy ANY = create(ImmutableList.of());

    public static ProtocolCompositionTy create(ImmutableList<ProtocolTy> protocols) {
      return new AutoValue_Type_ProtocolCompositionTy(protocols);
    }

    public abstract ImmutableList<ProtocolTy> protocols();

    @Override
    public TyKind tyKind() {
      return TyKind.PROTOCOL_COMPOSITION_TY;
    }

    @Override
    public final String toString() {
      return protocols().isEmpty() ? "Any" : Joiner.on(" & ").join(protocols());
    }
  }

  /** The metatype of an existential: the type of any concrete type conforming to it. */
  @AutoValue
  abstract class ExistentialMetatypeTy implements Type {

    public static ExistentialMetatypeTy create(Type instance) {
      return new AutoValue_Type_ExistentialMetatypeTy(instance);
    }

    public abstract Type instance();

    @Override
    public TyKind tyKind() {
      return TyKind.EXISTENTIAL_METATYPE_TY;
    }

    @Override
    public final String toString() {
      return parenthesize(instance()) + ".Type";
    }
  }

  /** The metatype of a type. */
  @AutoValue
  abstract class MetatypeTy implements Type {

    public static MetatypeTy create(Type instance) {
      return new AutoValue_Type_MetatypeTy(instance);
    }

    public abstract Type instance();

    @Override
    public TyKind tyKind() {
      return TyKind.METATYPE_TY;
    }

    @Override
    public final String toString() {
      return parenthesize(instance())
          + (TypeProperties.isAnyExistential(instance()) ? ".Protocol" : ".Type");
    }
  }

  /** A generic parameter, identified by its depth and index. */
  @AutoValue
  abstract class GenericParamTy implements Type {

    public static GenericParamTy create(int depth, int index) {
      return new AutoValue_Type_GenericParamTy(depth, index);
    }

    public abstract int depth();

    public abstract int index();

    @Override
    public TyKind tyKind() {
      return TyKind.GENERIC_PARAM_TY;
    }

    @Override
    public final String toString() {
      return "τ_" + depth() + "_" + index();
    }
  }

  /** An associated type of a type parameter, e.g. {@code T.Element}. */
  @AutoValue
  abstract class DependentMemberTy implements Type {

    public static DependentMemberTy create(Type base, String member, @Nullable Type protocol) {
      return new AutoValue_Type_DependentMemberTy(base, member, protocol);
    }

    public abstract Type base();

    public abstract String member();

    /** The protocol that declares the member, if known. */
    public abstract @Nullable Type protocol();

    @Override
    public TyKind tyKind() {
      return TyKind.DEPENDENT_MEMBER_TY;
    }

    @Override
    public final String toString() {
      return base() + "." + member();
    }
  }

  /** The type of an inout parameter. Not materializable. */
  @AutoValue
  abstract class InOutTy implements Type {

    public static InOutTy create(Type object) {
      return new AutoValue_Type_InOutTy(object);
    }

    public abstract Type object();

    @Override
    public TyKind tyKind() {
      return TyKind.INOUT_TY;
    }

    @Override
    public final String toString() {
      return "inout " + object();
    }
  }

  /** A non-owning reference to a reference-representable type. */
  @AutoValue
  abstract class ReferenceStorageTy implements Type {

    /** The ownership of the reference. */
    public enum Ownership {
      UNOWNED,
      UNMANAGED,
      WEAK
    }

    public static ReferenceStorageTy create(Ownership ownership, Type referent) {
      return new AutoValue_Type_ReferenceStorageTy(ownership, referent);
    }

    public abstract Ownership ownership();

    public abstract Type referent();

    @Override
    public TyKind tyKind() {
      return TyKind.REFERENCE_STORAGE_TY;
    }

    @Override
    public final String toString() {
      return Ascii.toLowerCase(ownership().name()) + " " + referent();
    }
  }

  /** A foreign class, e.g. a bridged CoreFoundation type. Never generic or nested. */
  @AutoValue
  abstract class ForeignClassTy implements Type {

    public static ForeignClassTy create(Declaration decl) {
      return new AutoValue_Type_ForeignClassTy(decl);
    }

    public abstract Declaration decl();

    @Override
    public TyKind tyKind() {
      return TyKind.FOREIGN_CLASS_TY;
    }

    @Override
    public final String toString() {
      return decl().qualifiedName();
    }
  }

  private static String qualify(@Nullable Type parent, Declaration decl) {
    return parent != null ? parent + "." + decl.name() : decl.qualifiedName();
  }

  private static String parenthesize(Type type) {
    switch (type.tyKind()) {
      case FUNCTION_TY:
      case INOUT_TY:
      case REFERENCE_STORAGE_TY:
        return "(" + type + ")";
      case PROTOCOL_COMPOSITION_TY:
        return ((ProtocolCompositionTy) type).protocols().size() > 1
            ? "(" + type + ")"
            : type.toString();
      default:
        return type.toString();
    }
  }
}
