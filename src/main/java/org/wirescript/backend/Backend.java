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

package org.wirescript.backend;

import org.wirescript.compiler.CompiledClass;

/**
 * Generates executable output (bytecode, source text, ...) from a compiled class. Each function of
 * the class provides its resolved statements and its terms with resolved storage.
 */
public interface Backend<T> {

  /**
   * Generates output for the given class. If {@code stubsOnly} is true (a skeleton compile, or one
   * with errors) only the functions' signatures should be relied upon.
   */
  T generate(CompiledClass compiledClass, boolean stubsOnly);
}
