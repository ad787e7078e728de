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

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.errorprone.annotations.FormatMethod;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.wirescript.graph.Node;
import org.wirescript.graph.Port;
import org.wirescript.graph.Provenance;

/**
 * Accumulates the diagnostics for one owner (a single function, or the class as a whole). Each
 * node or port passed in is first mapped back to its authored original through the session's
 * {@link Provenance}.
 */
public class MessageLog {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Provenance provenance;

  private final List<Diagnostic> diagnostics = new ArrayList<>();

  private int numErrors;

  public MessageLog(Provenance provenance) {
    this.provenance = provenance;
  }

  public Provenance provenance() {
    return provenance;
  }

  private void add(
      Diagnostic.Severity severity,
      Diagnostic.Kind kind,
      String message,
      @Nullable Node node,
      @Nullable Port port) {
    Port originalPort = (port == null) ? null : provenance.original(port);
    Node originalNode = (originalPort != null) ? originalPort.node : null;
    if (originalNode == null && node != null) {
      originalNode = provenance.original(node);
    }
    Diagnostic diagnostic = new Diagnostic(severity, kind, message, originalNode, originalPort);
    if (diagnostic.isError()) {
      numErrors++;
    }
    diagnostics.add(diagnostic);
    logger.atFine().log("%s", diagnostic);
  }

  @FormatMethod
  public void error(Diagnostic.Kind kind, @Nullable Node node, String format, Object... args) {
    add(Diagnostic.Severity.ERROR, kind, String.format(format, args), node, null);
  }

  @FormatMethod
  public void errorAt(Diagnostic.Kind kind, Port port, String format, Object... args) {
    add(Diagnostic.Severity.ERROR, kind, String.format(format, args), port.node, port);
  }

  @FormatMethod
  public void warning(@Nullable Node node, String format, Object... args) {
    add(
        Diagnostic.Severity.WARNING,
        Diagnostic.Kind.WARNING,
        String.format(format, args),
        node,
        null);
  }

  @FormatMethod
  public void warningAt(Port port, String format, Object... args) {
    add(
        Diagnostic.Severity.WARNING,
        Diagnostic.Kind.WARNING,
        String.format(format, args),
        port.node,
        port);
  }

  @FormatMethod
  public void note(@Nullable Node node, String format, Object... args) {
    add(Diagnostic.Severity.NOTE, Diagnostic.Kind.WARNING, String.format(format, args), node, null);
  }

  /** Records a CompileError that abandoned some part of the compilation. */
  public void record(CompileError error) {
    add(Diagnostic.Severity.ERROR, error.kind, error.messageText(), error.node, error.port);
  }

  /** Appends all of {@code other}'s diagnostics (which have already been mapped) to this log. */
  public void addAll(MessageLog other) {
    diagnostics.addAll(other.diagnostics);
    numErrors += other.numErrors;
  }

  public int numErrors() {
    return numErrors;
  }

  public boolean hasErrors() {
    return numErrors != 0;
  }

  public ImmutableList<Diagnostic> diagnostics() {
    return ImmutableList.copyOf(diagnostics);
  }

  /** Returns the diagnostics of the given severity. */
  public ImmutableList<Diagnostic> diagnostics(Diagnostic.Severity severity) {
    return diagnostics.stream()
        .filter(d -> d.severity() == severity)
        .collect(ImmutableList.toImmutableList());
  }
}
