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

package org.remotemirror.decl;

import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import com.google.errorprone.annotations.Immutable;
import org.jspecify.annotations.Nullable;

/**
 * A nominal type declaration known to the {@link org.remotemirror.lookup.Directory}.
 *
 * <p>Declarations don't hold members or layout; they identify a type by its kind, name, enclosing
 * context, and (for file-private declarations) the private discriminator of the defining file.
 */
@AutoValue
@Immutable
public abstract class Declaration implements DeclContext {

  /** Creates a non-generic declaration. */
  public static Declaration create(DeclKind kind, String name, DeclContext context) {
    return create(kind, name, context, null, 0);
  }

  public static Declaration create(
      DeclKind kind,
      String name,
      DeclContext context,
      @Nullable String privateDiscriminator,
      int genericParamCount) {
    return new AutoValue_Declaration(kind, name, context, privateDiscriminator, genericParamCount);
  }

  public abstract DeclKind kind();

  /** The simple name. */
  public abstract String name();

  /** The enclosing context. */
  public abstract DeclContext context();

  /** The discriminator of the declaring file, for file-private declarations. */
  public abstract @Nullable String privateDiscriminator();

  /** The number of generic parameters introduced by this declaration (not its parents). */
  public abstract int genericParamCount();

  public boolean isGeneric() {
    return genericParamCount() > 0;
  }

  /** The enclosing nominal declaration, or {@code null} if this is declared in a module. */
  public @Nullable Declaration nominalParent() {
    return context() instanceof Declaration ? (Declaration) context() : null;
  }

  @Override
  public ContextKind contextKind() {
    return ContextKind.NOMINAL;
  }

  @Override
  public ModuleDecl parentModule() {
    return context().parentModule();
  }

  /** The dotted name, starting with the module. */
  public String qualifiedName() {
    DeclContext ctx = context();
    if (ctx instanceof Declaration) {
      return ((Declaration) ctx).qualifiedName() + "." + name();
    }
    return ctx + "." + name();
  }

  @Memoized
  @Override
  public abstract int hashCode();

  @Override
  public final String toString() {
    return qualifiedName();
  }
}
