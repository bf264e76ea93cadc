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
import org.remotemirror.decl.Declaration;

/**
 * Visibility lookup of declarations imported from a foreign language module, which have no real
 * enclosing context in the {@link Directory}.
 */
public interface ImporterBridge {

  /**
   * Returns every visible foreign declaration with the given simple name. The same declaration may
   * be reported more than once.
   */
  ImmutableList<Declaration> lookupValue(String name);
}
