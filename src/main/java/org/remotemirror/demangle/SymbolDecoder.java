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

package org.remotemirror.demangle;

import org.jspecify.annotations.Nullable;

/** Converts between mangled names and {@link Node} trees. Supplied by the embedding debugger. */
public interface SymbolDecoder {

  /** Decodes a mangled type name, or returns {@code null} if it is not a valid mangling. */
  @Nullable Node demangleType(String mangledName);

  /** Re-encodes a node tree into its mangled form. */
  String mangle(Node node);
}
