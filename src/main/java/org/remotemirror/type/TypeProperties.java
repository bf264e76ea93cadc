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

import org.jspecify.annotations.Nullable;
import org.remotemirror.decl.DeclKind;
import org.remotemirror.type.Type.BoundGenericTy;
import org.remotemirror.type.Type.NominalTy;
import org.remotemirror.type.Type.TupleTy;

/** Structural queries on {@link Type}s. */
public final class TypeProperties {

  /**
   * Returns true if values of the type can be stored. Inout types, and tuples that contain them,
   * only describe parameter passing.
   */
  public static boolean isMaterializable(Type type) {
    switch (type.tyKind()) {
      case INOUT_TY:
        return false;
      case TUPLE_TY:
        for (TupleTy.TupleElement element : ((TupleTy) type).elements()) {
          if (!isMaterializable(element.type())) {
            return false;
          }
        }
        return true;
      default:
        return true;
    }
  }

  /** Returns true if the type can be held by an unowned, unmanaged or weak reference. */
  public static boolean allowsOwnership(Type type) {
    switch (type.tyKind()) {
      case NOMINAL_TY:
        return ((NominalTy) type).decl().kind() == DeclKind.CLASS;
      case BOUND_GENERIC_TY:
        return ((BoundGenericTy) type).decl().kind() == DeclKind.CLASS;
      case FOREIGN_CLASS_TY:
        return true;
      default:
        return false;
    }
  }

  /** Returns true for protocols and protocol compositions, including {@code Any}. */
  public static boolean isAnyExistential(Type type) {
    switch (type.tyKind()) {
      case PROTOCOL_TY:
      case PROTOCOL_COMPOSITION_TY:
        return true;
      default:
        return false;
    }
  }

  /** Returns true for generic parameters and their associated types. */
  public static boolean isTypeParameter(Type type) {
    switch (type.tyKind()) {
      case GENERIC_PARAM_TY:
      case DEPENDENT_MEMBER_TY:
        return true;
      default:
        return false;
    }
  }

  /** Returns the parent of a nominal or bound generic type, or {@code null}. */
  public static @Nullable Type nominalParent(Type type) {
    switch (type.tyKind()) {
      case NOMINAL_TY:
        return ((NominalTy) type).parent();
      case BOUND_GENERIC_TY:
        return ((BoundGenericTy) type).parent();
      default:
        return null;
    }
  }

  private TypeProperties() {}
}
