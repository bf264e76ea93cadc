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

package org.remotemirror;

import static java.util.Objects.requireNonNull;

import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.remotemirror.diag.Failure;

/**
 * The outcome of a {@link ReflectionContext} query: either a value, or the {@link Failure} that
 * explains why there isn't one.
 */
public final class Result<T> {

  public static <T> Result<T> success(T value) {
    return new Result<>(requireNonNull(value), null);
  }

  public static <T> Result<T> failure(Failure failure) {
    return new Result<>(null, requireNonNull(failure));
  }

  public static <T> Result<T> failure(Failure.Kind kind, Object... args) {
    return failure(Failure.create(kind, args));
  }

  private final @Nullable T value;
  private final @Nullable Failure failure;

  private Result(@Nullable T value, @Nullable Failure failure) {
    this.value = value;
    this.failure = failure;
  }

  public boolean isSuccess() {
    return value != null;
  }

  /** Returns the value, or throws {@link IllegalStateException} if this is a failure. */
  public T value() {
    if (value == null) {
      throw new IllegalStateException("no value: " + failure);
    }
    return value;
  }

  /** Returns the failure, or throws {@link IllegalStateException} if this is a success. */
  public Failure failure() {
    if (failure == null) {
      throw new IllegalStateException("not a failure: " + value);
    }
    return failure;
  }

  public T orElse(T other) {
    return value != null ? value : other;
  }

  @Override
  public String toString() {
    return value != null ? "success(" + value + ")" : "failure(" + failure + ")";
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, failure);
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (!(obj instanceof Result)) {
      return false;
    }
    Result<?> that = (Result<?>) obj;
    return Objects.equals(value, that.value) && Objects.equals(failure, that.failure);
  }
}
