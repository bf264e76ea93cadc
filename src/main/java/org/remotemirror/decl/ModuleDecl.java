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
import com.google.errorprone.annotations.Immutable;

/** A module. Modules are identified by name. */
@AutoValue
@Immutable
public abstract class ModuleDecl implements DeclContext {

  public static ModuleDecl create(String name) {
    return new AutoValue_ModuleDecl(name);
  }

  public abstract String name();

  @Override
  public ContextKind contextKind() {
    return ContextKind.MODULE;
  }

  @Override
  public ModuleDecl parentModule() {
    return this;
  }

  @Override
  public final String toString() {
    return name();
  }
}
