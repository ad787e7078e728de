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

/** The phases of compiling a class. A compilation passes through each of them in order. */
public enum CompilerState {
  IDLE,
  /** Options and handlers are in place and the class scope has been created. */
  SCHEMA_READY,
  /** Member variables, the function list, and every function's signature are known. */
  CLASS_LAYOUT_BUILT,
  /** Function bodies have been pruned, validated and scheduled, and their terms registered. */
  FUNCTIONS_PRECOMPILED,
  /** Statements have been generated and resolved. */
  FUNCTIONS_COMPILED,
  /** Defaults have been applied and the backend has run. */
  CLASS_FINALIZED;

  /** Returns the state that follows this one. */
  public CompilerState next() {
    return values()[ordinal() + 1];
  }
}
