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
import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;

/**
 * The result of compiling one function: its finalized signature, its terms with resolved storage,
 * and its statements. This is what a backend consumes.
 */
public final class CompiledFunction {

  public final String name;
  public final FunctionContext.Kind kind;
  public final FunctionSignature signature;

  /** Inputs and outputs in signature order, with resolved storage. */
  public final ImmutableList<Term> parameters;

  /** Locals with resolved storage; empty for stubs. */
  public final ImmutableList<Term> locals;

  /** The inherited function this one overrides, if any. */
  public final @Nullable FunctionSignature overrides;

  public final ImmutableList<Statement> statements;

  /**
   * True if the body was replaced by a stub (the function had errors, or only signatures were
   * compiled).
   */
  public final boolean isStub;

  /** True for an event stub with no parameters, which only dispatches into the event graph. */
  public final boolean isSimpleStub;

  /** Default values of declared locals, by term name. */
  public final ImmutableMap<String, String> localDefaults;

  /** A printable listing of the statements; only kept when compiling verbosely. */
  public final @Nullable String listing;

  CompiledFunction(
      FunctionContext context,
      FunctionSignature signature,
      ImmutableList<Statement> statements,
      boolean isStub,
      @Nullable String listing) {
    this.name = context.name;
    this.kind = context.kind;
    this.signature = signature;
    this.parameters = ImmutableList.copyOf(context.parameters);
    this.locals = isStub ? ImmutableList.of() : ImmutableList.copyOf(context.locals);
    this.overrides = context.parentSignature;
    this.statements = statements;
    this.isStub = isStub;
    this.isSimpleStub = context.simpleStub;
    this.localDefaults = ImmutableMap.copyOf(context.localDefaults);
    this.listing = listing;
  }

  public boolean hasFlag(FunctionSignature.Flag flag) {
    return signature.hasFlag(flag);
  }

  @Override
  public String toString() {
    return name;
  }
}
