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

import org.jspecify.annotations.Nullable;
import org.remotemirror.type.Type;

/**
 * Validates and finalizes generic instantiations, including checking that the arguments satisfy
 * the generic signature's requirements. Supplied by the embedding debugger.
 */
public interface TypeResolver {

  /** Resolves the request to a canonical type, or returns {@code null} if it is invalid. */
  @Nullable Type resolve(QualifiedTypeRequest request);
}
