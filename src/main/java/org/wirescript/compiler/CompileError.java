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

import com.google.errorprone.annotations.FormatMethod;
import org.jspecify.annotations.Nullable;
import org.wirescript.graph.Node;
import org.wirescript.graph.Port;

/**
 * Thrown when an error makes it impossible to continue compiling the current function. The
 * orchestrator catches CompileErrors at the function boundary and records them in that function's
 * {@link MessageLog}.
 */
public class CompileError extends RuntimeException {
  public final Diagnostic.Kind kind;
  public final @Nullable Node node;
  public final @Nullable Port port;

  public CompileError(Diagnostic.Kind kind, String msg, @Nullable Node node, @Nullable Port port) {
    super(msg);
    this.kind = kind;
    this.node = node;
    this.port = port;
  }

  @FormatMethod
  public static CompileError structural(@Nullable Node node, String format, Object... args) {
    return new CompileError(Diagnostic.Kind.STRUCTURAL, String.format(format, args), node, null);
  }

  @FormatMethod
  public static CompileError type(Port port, String format, Object... args) {
    return new CompileError(Diagnostic.Kind.TYPE, String.format(format, args), port.node, port);
  }

  @FormatMethod
  public static CompileError signature(@Nullable Node node, String format, Object... args) {
    return new CompileError(
        Diagnostic.Kind.SIGNATURE_MISMATCH, String.format(format, args), node, null);
  }

  /** Returns the message without the location suffix added by {@link #getMessage}. */
  public String messageText() {
    return super.getMessage();
  }

  @Override
  public String getMessage() {
    Object where = (port != null) ? port : node;
    return where == null ? super.getMessage() : String.format("%s (%s)", super.getMessage(), where);
  }
}
