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

/**
 * A context that declarations are nested in: either a module, or a nominal type declaration.
 *
 * <p>Extensions and local contexts are not modelled; local types are looked up directly by
 * mangled name.
 */
public interface DeclContext {

  /** A context kind. */
  enum ContextKind {
    MODULE,
    NOMINAL
  }

  ContextKind contextKind();

  /** The module that (transitively) contains this context. */
  ModuleDecl parentModule();
}
