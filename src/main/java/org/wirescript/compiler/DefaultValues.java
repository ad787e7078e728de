/*
 * Copyright 2025 The Retrospect Authors
 *
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

package org.wirescript.compiler;

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;
import org.jspecify.annotations.Nullable;
import org.wirescript.graph.PortType;

/**
 * Collects the default values of class properties while the class is being laid out, and parses
 * them once every property exists (object references may name any property of the class).
 */
final class DefaultValues {

  private record Entry(PortType type, String literal) {}

  private final Map<String, Entry> values = new LinkedHashMap<>();

  /** Records the default value for a property; a later call for the same property replaces it. */
  void set(String property, PortType type, String literal) {
    values.put(property, new Entry(type, literal));
  }

  boolean isEmpty() {
    return values.isEmpty();
  }

  /**
   * Parses each recorded default. A value that cannot be parsed is reported with a warning and
   * left out of the result.
   *
   * @param isProperty tests whether a name refers to a property of the finalized class
   */
  ImmutableMap<String, Object> apply(Predicate<String> isProperty, MessageLog log) {
    ImmutableMap.Builder<String, Object> result = ImmutableMap.builder();
    values.forEach(
        (property, entry) -> {
          Object parsed = parse(entry.type, entry.literal, isProperty);
          if (parsed == null) {
            log.warning(
                null,
                "Can't parse default value '%s' for %s (%s)",
                entry.literal,
                property,
                entry.type);
          } else {
            result.put(property, parsed);
          }
        });
    return result.buildOrThrow();
  }

  /** Returns the parsed value, or null if {@code literal} is not a valid value of {@code type}. */
  static @Nullable Object parse(PortType type, String literal, Predicate<String> isProperty) {
    if (type.container != PortType.Container.NONE) {
      // Containers default to empty
      return literal.isEmpty() || literal.equals("()") ? literal : null;
    }
    String trimmed = literal.trim();
    switch (type.category) {
      case BOOLEAN:
        String lower = Ascii.toLowerCase(trimmed);
        return lower.equals("true") ? Boolean.TRUE : lower.equals("false") ? Boolean.FALSE : null;
      case BYTE:
      case INT:
        if (type.isEnum() && !trimmed.isEmpty() && !Character.isDigit(trimmed.charAt(0))) {
          return trimmed;
        }
        try {
          long value = Long.parseLong(trimmed);
          if (type.category == PortType.Category.BYTE && (value < 0 || value > 255)) {
            return null;
          }
          return value;
        } catch (NumberFormatException e) {
          return null;
        }
      case FLOAT:
        try {
          return Double.parseDouble(trimmed);
        } catch (NumberFormatException e) {
          return null;
        }
      case ENUM:
      case NAME:
        return trimmed.isEmpty() ? null : trimmed;
      case STRING:
      case STRUCT:
        return literal;
      case OBJECT:
      case INTERFACE:
        if (trimmed.isEmpty() || trimmed.equals("None")) {
          return new CompiledClass.ObjectReference(null);
        }
        return isProperty.test(trimmed) ? new CompiledClass.ObjectReference(trimmed) : null;
      default:
        return null;
    }
  }
}
