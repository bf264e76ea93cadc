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

package org.remotemirror.options;

import com.google.common.base.Ascii;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import java.io.IOException;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayDeque;
import java.util.Deque;
import org.remotemirror.metadata.PointerWidth;

/** A command line options parser for {@link ReflectionOptions}. */
public final class ReflectionOptionsParser {

  private static final Splitter PARAMS_SPLITTER =
      Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

  /**
   * Parses command line options into {@link ReflectionOptions}, expanding any {@code @params}
   * files.
   */
  public static ReflectionOptions parse(Iterable<String> args) throws IOException {
    ReflectionOptions.Builder builder = ReflectionOptions.builder();
    parse(builder, args);
    return builder.build();
  }

  /**
   * Parses command line options into a {@link ReflectionOptions.Builder}, expanding any
   * {@code @params} files.
   */
  public static void parse(ReflectionOptions.Builder builder, Iterable<String> args)
      throws IOException {
    Deque<String> argumentDeque = new ArrayDeque<>();
    expandParamsFiles(argumentDeque, args);
    parse(builder, argumentDeque);
  }

  private static void parse(ReflectionOptions.Builder builder, Deque<String> argumentDeque) {
    while (!argumentDeque.isEmpty()) {
      String next = argumentDeque.removeFirst();
      switch (next) {
        case "--pointer_width":
          builder.setPointerWidth(PointerWidth.fromBits(readInt(next, argumentDeque)));
          break;
        case "--byte_order":
          builder.setByteOrder(byteOrder(readOne(next, argumentDeque)));
          break;
        case "--max_metadata_depth":
          builder.setMaxMetadataDepth(readInt(next, argumentDeque));
          break;
        case "--max_string_length":
          builder.setMaxStringLength(readInt(next, argumentDeque));
          break;
        case "--foreign_module":
          builder.setForeignModuleName(readOne(next, argumentDeque));
          break;
        default:
          throw new IllegalArgumentException("unknown option: " + next);
      }
    }
  }

  private static ByteOrder byteOrder(String value) {
    switch (Ascii.toLowerCase(value)) {
      case "little":
        return ByteOrder.LITTLE_ENDIAN;
      case "big":
        return ByteOrder.BIG_ENDIAN;
      default:
        throw new IllegalArgumentException("unknown byte order: " + value);
    }
  }

  /**
   * Pre-processes an argument list, expanding arguments of the form {@code @filename} by reading
   * the content of the file and appending whitespace-delimited options to {@code argumentDeque}.
   */
  private static void expandParamsFiles(Deque<String> argumentDeque, Iterable<String> args)
      throws IOException {
    for (String arg : args) {
      if (arg.isEmpty()) {
        continue;
      }
      if (arg.startsWith("@@")) {
        argumentDeque.addLast(arg.substring(1));
      } else if (arg.startsWith("@")) {
        Path paramsPath = Paths.get(arg.substring(1));
        if (!Files.exists(paramsPath)) {
          throw new IllegalArgumentException("params file does not exist: " + paramsPath);
        }
        for (String line : Files.readAllLines(paramsPath)) {
          expandParamsFiles(argumentDeque, PARAMS_SPLITTER.split(line));
        }
      } else {
        argumentDeque.addLast(arg);
      }
    }
  }

  /**
   * Returns the value of an option, or throws {@link IllegalArgumentException} if the value is not
   * present.
   */
  private static String readOne(String flag, Deque<String> argumentDeque) {
    if (argumentDeque.isEmpty() || argumentDeque.getFirst().startsWith("-")) {
      throw new IllegalArgumentException("missing required argument for: " + flag);
    }
    return argumentDeque.removeFirst();
  }

  private static int readInt(String flag, Deque<String> argumentDeque) {
    String value = readOne(flag, argumentDeque);
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("expected an integer for " + flag + ": " + value, e);
    }
  }

  private ReflectionOptionsParser() {}
}
