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

import com.google.auto.value.AutoValue;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import org.remotemirror.decl.Declaration;
import org.remotemirror.type.Type;

/**
 * A request to instantiate a generic type, written as a qualified path from the outermost
 * enclosing type inward.
 *
 * <p>For {@code Outer<Int>.Middle.Inner<String>} the path has three segments: {@code Outer} with
 * argument {@code Int}, {@code Middle} with no arguments, and {@code Inner} with argument {@code
 * String}. The last segment is the declaration being instantiated.
 */
@AutoValue
public abstract class QualifiedTypeRequest {

  public static QualifiedTypeRequest create(ImmutableList<Segment> segments) {
    return new AutoValue_QualifiedTypeRequest(segments);
  }

  public abstract ImmutableList<Segment> segments();

  /** The declaration being instantiated. */
  public Declaration decl() {
    return segments().get(segments().size() - 1).decl();
  }

  @Override
  public final String toString() {
    return Joiner.on('.').join(segments());
  }

  /** One component of the path: a declaration and the arguments applied to it, if any. */
  @AutoValue
  public abstract static class Segment {

    public static Segment create(Declaration decl, ImmutableList<Type> genericArgs) {
      return new AutoValue_QualifiedTypeRequest_Segment(decl, genericArgs);
    }

    public abstract Declaration decl();

    /** The generic arguments; empty for a plain segment. */
    public abstract ImmutableList<Type> genericArgs();

    public String name() {
      return decl().name();
    }

    @Override
    public final String toString() {
      if (genericArgs().isEmpty()) {
        return name();
      }
      return name() + "<" + Joiner.on(", ").join(genericArgs()) + ">";
    }
  }
}
