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
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.wirescript.graph.Node;
import org.wirescript.graph.NodeKind;

/**
 * Turns a scheduled FunctionContext into a {@link CompiledFunction}: orders its parameters to match
 * any inherited signature, assigns storage to its terms, and resolves its statements into a single
 * list with numeric jump targets.
 */
final class FunctionAssembler {

  // Static methods only
  private FunctionAssembler() {}

  /**
   * If the function overrides an inherited signature, reorders its parameters to exactly match the
   * parent's order, matching by name. Throws a CompileError if they cannot be matched one-to-one
   * or if a matched parameter's type differs.
   */
  static void orderParameters(FunctionContext context) {
    FunctionSignature parent = context.parentSignature;
    if (parent == null) {
      return;
    }
    List<Term> remaining = new ArrayList<>(context.parameters);
    List<Term> ordered = new ArrayList<>(remaining.size());
    for (FunctionSignature.Param param : parent.params) {
      Term match =
          remaining.stream()
              .filter(
                  t ->
                      t.name().equals(param.name())
                          && (t.role == Term.Role.RESULT) == param.isOutput())
              .findFirst()
              .orElse(null);
      if (match == null) {
        throw CompileError.signature(
            context.entry,
            "Cannot order parameters %s in function %s: the parent's parameter %s is missing",
            context.parameters,
            context.name,
            param.name());
      } else if (!match.type.equals(param.type())) {
        throw CompileError.signature(
            context.entry,
            "Cannot override %s: parameter %s is %s in the parent's signature but %s here",
            context.name,
            param.name(),
            param.type(),
            match.type);
      }
      ordered.add(match);
      remaining.remove(match);
    }
    if (!remaining.isEmpty()) {
      throw CompileError.signature(
          context.entry,
          "Cannot override %s declared in a parent with a different signature: %s not in the"
              + " parent",
          context.name,
          remaining);
    }
    context.parameters.clear();
    context.parameters.addAll(ordered);
  }

  /**
   * Gives each term a storage location. Locals of the event graph are promoted to shared storage,
   * since they must survive between events.
   */
  static void assignStorage(FunctionContext context) {
    int slot = 0;
    for (Term t : context.parameters) {
      t.resolve(Term.Storage.PARAMETER, slot++);
    }
    slot = 0;
    for (Term t : context.locals) {
      if (context.isEventGraph()) {
        context.classScope.promote(t);
      } else {
        t.resolve(Term.Storage.LOCAL, slot++);
      }
    }
  }

  /** Returns the externally visible signature of the function. */
  static FunctionSignature signature(FunctionContext context) {
    ImmutableList<FunctionSignature.Param> params =
        context.parameters.stream()
            .map(t -> new FunctionSignature.Param(t.name(), t.type, t.role == Term.Role.RESULT))
            .collect(ImmutableList.toImmutableList());
    return new FunctionSignature(context.name, params, context.access, context.flags);
  }

  /**
   * Concatenates the statements of the linear execution list, dropping jumps to the immediately
   * following node and replacing jump targets with statement indices. For the event graph, also
   * records the offset at which each event's statements begin.
   */
  static void resolveStatements(FunctionContext context) {
    ImmutableList<Node> linear = context.linearExecutionList;
    List<List<Statement>> blocks = new ArrayList<>(linear.size());
    Map<Node, Integer> labels = new HashMap<>();
    int index = 0;
    for (int i = 0; i < linear.size(); i++) {
      Node node = linear.get(i);
      List<Statement> block = new ArrayList<>(context.statementsFor(node));
      if (!block.isEmpty() && i + 1 < linear.size()) {
        Statement last = block.get(block.size() - 1);
        if (last.type == Statement.Type.GOTO && last.targetNode == linear.get(i + 1)) {
          block.remove(block.size() - 1);
        }
      }
      blocks.add(block);
      labels.put(node, index);
      index += block.size();
    }
    ImmutableList.Builder<Statement> statements = ImmutableList.builderWithExpectedSize(index);
    for (List<Statement> block : blocks) {
      for (Statement s : block) {
        if (!s.isJump()) {
          statements.add(s);
          continue;
        }
        int target = -1;
        if (s.targetNode != null) {
          Integer label = labels.get(s.targetNode);
          if (label == null) {
            throw CompileError.structural(
                s.targetNode,
                "%s is the target of a jump but was not scheduled",
                s.targetNode.title());
          }
          target = label;
        }
        statements.add(s.withTarget(target));
      }
    }
    context.statements = statements.build();
    if (context.isEventGraph()) {
      for (Node node : linear) {
        if (node.kind == NodeKind.EVENT) {
          context.entryPoints.put(context.provenance.original(node), labels.get(node));
        }
      }
    }
  }

  /** Returns a body for a function that will not be compiled (or that failed to compile). */
  static ImmutableList<Statement> stubBody() {
    return ImmutableList.of(Statement.ret());
  }

  /** Builds the function's descriptor. */
  static CompiledFunction finish(FunctionContext context, boolean stub) {
    ImmutableList<Statement> statements = stub ? stubBody() : context.statements;
    String listing = null;
    if (context.options.verbose) {
      StringBuilder sb = new StringBuilder();
      for (int i = 0; i < statements.size(); i++) {
        sb.append(String.format("%3d: %s%n", i, statements.get(i)));
      }
      listing = sb.toString();
    }
    return new CompiledFunction(context, signature(context), statements, stub, listing);
  }
}
