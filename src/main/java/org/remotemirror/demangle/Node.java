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

import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import org.jspecify.annotations.Nullable;

/**
 * A node of a decoded symbol tree.
 *
 * <p>Nodes are produced by a {@link SymbolDecoder} and are never modified. Nominal declaration
 * nodes ({@link Kind#CLASS}, {@link Kind#STRUCTURE}, {@link Kind#ENUM}, {@link Kind#PROTOCOL})
 * have the enclosing context as their first child and the declaration name as their second.
 */
@AutoValue
public abstract class Node {

  /** A node kind. */
  public enum Kind {
    GLOBAL,
    TYPE_MANGLING,
    TYPE,
    DECL_CONTEXT,
    MODULE,
    CLASS,
    STRUCTURE,
    ENUM,
    PROTOCOL,
    EXTENSION,
    FUNCTION,
    IDENTIFIER,
    /** A file-private name: children are the discriminator and the name identifiers. */
    PRIVATE_DECL_NAME,
    /** A function-local name: children are the index and the name identifier. */
    LOCAL_DECL_NAME,
    NUMBER;

    /** Returns true for the kinds that name a nominal type declaration. */
    public boolean isNominal() {
      switch (this) {
        case CLASS:
        case STRUCTURE:
        case ENUM:
        case PROTOCOL:
          return true;
        default:
          return false;
      }
    }
  }

  /** Creates a leaf node carrying text, e.g. a {@link Kind#MODULE} or {@link Kind#IDENTIFIER}. */
  public static Node text(Kind kind, String text) {
    return new AutoValue_Node(kind, text, ImmutableList.of());
  }

  /** Creates an interior node. */
  public static Node create(Kind kind, Node... children) {
    return new AutoValue_Node(kind, null, ImmutableList.copyOf(Arrays.asList(children)));
  }

  public abstract Kind kind();

  public abstract @Nullable String text();

  public abstract ImmutableList<Node> children();

  public boolean hasChildren() {
    return !children().isEmpty();
  }

  public Node child(int i) {
    return children().get(i);
  }

  public Node firstChild() {
    return children().get(0);
  }

  @Memoized
  @Override
  public abstract int hashCode();

  @Override
  public final String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(kind());
    if (text() != null) {
      sb.append(" '").append(text()).append('\'');
    }
    if (hasChildren()) {
      sb.append('(');
      Joiner.on(", ").appendTo(sb, children());
      sb.append(')');
    }
    return sb.toString();
  }
}
