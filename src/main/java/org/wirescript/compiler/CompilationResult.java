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
import com.google.common.collect.ImmutableListMultimap;
import org.jspecify.annotations.Nullable;

/**
 * The outcome of compiling a class: its layout (always produced, even when there were errors),
 * the diagnostics, and whatever the backend produced.
 */
public final class CompilationResult<T> {

  public final CompiledClass compiledClass;

  /** Every diagnostic, class-level ones first and then each function's in order. */
  public final ImmutableList<Diagnostic> diagnostics;

  /** The diagnostics of each function, keyed by function name. */
  public final ImmutableListMultimap<String, Diagnostic> functionDiagnostics;

  /** The backend's output, or null if no backend was run. */
  public final @Nullable T output;

  CompilationResult(
      CompiledClass compiledClass,
      ImmutableList<Diagnostic> diagnostics,
      ImmutableListMultimap<String, Diagnostic> functionDiagnostics,
      @Nullable T output) {
    this.compiledClass = compiledClass;
    this.diagnostics = diagnostics;
    this.functionDiagnostics = functionDiagnostics;
    this.output = output;
  }

  /** Returns true if there were no errors, i.e. the result is a loadable build. */
  public boolean isSuccess() {
    return diagnostics.stream().noneMatch(Diagnostic::isError);
  }

  public ImmutableList<Diagnostic> errors() {
    return diagnostics.stream()
        .filter(Diagnostic::isError)
        .collect(ImmutableList.toImmutableList());
  }

  public ImmutableList<Diagnostic> warnings() {
    return diagnostics.stream()
        .filter(d -> d.severity() == Diagnostic.Severity.WARNING)
        .collect(ImmutableList.toImmutableList());
  }
}
