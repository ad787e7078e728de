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

import org.jspecify.annotations.Nullable;
import org.wirescript.graph.Node;
import org.wirescript.graph.Port;

/**
 * A message produced during compilation. Diagnostics always refer to authored nodes and ports,
 * never to the compiler's private clones.
 */
public record Diagnostic(
    Severity severity, Kind kind, String message, @Nullable Node node, @Nullable Port port) {

  public enum Severity {
    ERROR,
    WARNING,
    NOTE
  }

  /** Classifies what went wrong; every kind except WARNING is fatal to the function involved. */
  public enum Kind {
    /** Malformed graph: dangling references, multiple entries, control-out fan-out. */
    STRUCTURAL,
    /** Unresolved wildcard, incompatible connection, interface wired to an object. */
    TYPE,
    /** An override diverges from the inherited signature in order, types or flags. */
    SIGNATURE_MISMATCH,
    /** Recoverable; compilation continues with a fallback. */
    WARNING
  }

  public boolean isError() {
    return severity == Severity.ERROR;
  }

  @Override
  public String toString() {
    String where = (port != null) ? port.toString() : (node != null) ? node.toString() : null;
    String prefix = severity == Severity.ERROR ? kind.name() : severity.name();
    return where == null
        ? String.format("%s: %s", prefix, message)
        : String.format("%s: %s [%s]", prefix, message, where);
  }
}
