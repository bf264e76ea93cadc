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

package org.remotemirror.lookup;

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;
import org.remotemirror.decl.DeclContext;
import org.remotemirror.decl.Declaration;
import org.remotemirror.decl.ModuleDecl;

/**
 * Name-based lookup of modules and declarations in the debugger's view of the target program.
 * Supplied by the embedding debugger.
 */
public interface Directory {

  /** Returns the module with the given name, or {@code null} if it isn't loaded. */
  @Nullable ModuleDecl lookupModule(String name);

  /**
   * Returns every declaration named {@code name} that is a member of {@code context}, including
   * candidates of any kind and from any module; callers filter the results.
   *
   * @param privateDiscriminator the discriminator of the declaring file, or {@code null} to find
   *     declarations that aren't file-private
   */
  ImmutableList<Declaration> lookupMember(
      DeclContext context, String name, @Nullable String privateDiscriminator);

  /** Returns the function-local type with the given mangled name in {@code module}. */
  @Nullable Declaration lookupLocalType(ModuleDecl module, String mangledName);
}
