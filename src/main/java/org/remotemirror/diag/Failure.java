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

package org.remotemirror.diag;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.Immutable;
import java.util.Arrays;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/** A failure to describe a remote type, with the payload needed to explain it. */
@Immutable
public final class Failure {

  /** A failure kind. */
  public enum Kind {
    UNKNOWN("an unknown failure occurred"),
    COULD_NOT_RESOLVE_TYPE_DECL("could not resolve type declaration for '%s'"),
    METADATA_TOO_DEEP("metadata nesting exceeds %s levels at address 0x%x");

    private final String message;

    Kind(String message) {
      this.message = message;
    }

    String format(Object... args) {
      return String.format(message, args);
    }
  }

  /**
   * Creates a failure.
   *
   * @param kind the failure kind
   * @param args format args for the kind's message
   */
  public static Failure create(Kind kind, Object... args) {
    return new Failure(kind, ImmutableList.copyOf(Arrays.asList(args)));
  }

  private final Kind kind;

  @SuppressWarnings("Immutable") // the payload is only ever strings and boxed numbers
  private final ImmutableList<Object> args;

  private Failure(Kind kind, ImmutableList<Object> args) {
    this.kind = requireNonNull(kind);
    this.args = requireNonNull(args);
  }

  /** The failure kind. */
  public Kind kind() {
    return kind;
  }

  /** The diagnostic payload. */
  public ImmutableList<Object> args() {
    return args;
  }

  /** The formatted failure message. */
  public String message() {
    return kind.format(args.toArray());
  }

  @Override
  public String toString() {
    return kind + ": " + message();
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, args);
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (!(obj instanceof Failure)) {
      return false;
    }
    Failure that = (Failure) obj;
    return kind.equals(that.kind) && args.equals(that.args);
  }
}
