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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;
import org.wirescript.graph.Node;

/**
 * An abstract statement emitted by a node handler. The compiler only interprets the control-flow
 * statements (to resolve jump targets); everything else is passed through to the backend.
 *
 * <p>Statements are immutable; jump targets are first expressed as the node to jump to, and are
 * replaced by statement indices when the function's statements are resolved.
 */
public final class Statement {

  public enum Type {
    NOP,
    COMMENT,
    /** {@code lhs = function(rhs...)}; lhs may be null. */
    CALL_FUNCTION,
    /** Calls the event graph at {@link #entryPoint}. */
    CALL_EVENT_GRAPH,
    /** {@code lhs = rhs[0]}. */
    ASSIGN,
    /** {@code lhs = [rhs...]}. */
    CREATE_ARRAY,
    GOTO,
    /** Jumps if rhs[0] is false. */
    GOTO_IF_NOT,
    /** Jumps to the statement index held in rhs[0]. */
    COMPUTED_GOTO,
    /** Saves a target to resume at when the current flow ends. */
    PUSH_EXECUTION_FLOW,
    /** Resumes the most recently pushed flow, or ends the thread if there is none. */
    POP_EXECUTION_FLOW,
    END_OF_THREAD,
    RETURN,
    /** Marks the start of a node's execution for tracing. */
    WIRE_TRACE_SITE,
    /** Marks execution crossing the boundary of an inlined macro. */
    INSTRUMENTATION_BOUNDARY
  }

  public final Type type;
  public final @Nullable Term lhs;
  public final ImmutableList<Term> rhs;

  /** The called function for calls, the text of a comment, or the node title for trace sites. */
  public final @Nullable String text;

  /** For unresolved jumps, the node whose first statement is the target; null for end of thread. */
  public final @Nullable Node targetNode;

  /** For resolved jumps, the index of the target statement; -1 means end of thread. */
  public final int target;

  /** For CALL_EVENT_GRAPH, the dispatch offset; -1 until patched. */
  public final int entryPoint;

  private Statement(
      Type type,
      @Nullable Term lhs,
      ImmutableList<Term> rhs,
      @Nullable String text,
      @Nullable Node targetNode,
      int target,
      int entryPoint) {
    this.type = type;
    this.lhs = lhs;
    this.rhs = rhs;
    this.text = text;
    this.targetNode = targetNode;
    this.target = target;
    this.entryPoint = entryPoint;
  }

  private static Statement simple(
      Type type, @Nullable Term lhs, ImmutableList<Term> rhs, @Nullable String text) {
    return new Statement(type, lhs, rhs, text, null, -1, -1);
  }

  public static Statement comment(String text) {
    return simple(Type.COMMENT, null, ImmutableList.of(), text);
  }

  public static Statement call(String function, @Nullable Term lhs, Iterable<Term> args) {
    return simple(Type.CALL_FUNCTION, lhs, ImmutableList.copyOf(args), function);
  }

  public static Statement callEventGraph(String eventGraph) {
    return simple(Type.CALL_EVENT_GRAPH, null, ImmutableList.of(), eventGraph);
  }

  public static Statement assign(Term lhs, Term value) {
    return simple(Type.ASSIGN, lhs, ImmutableList.of(value), null);
  }

  public static Statement createArray(Term lhs, Iterable<Term> elements) {
    return simple(Type.CREATE_ARRAY, lhs, ImmutableList.copyOf(elements), null);
  }

  /** An unconditional jump to the given node, or to the end of the thread if it is null. */
  public static Statement gotoNode(@Nullable Node target) {
    return new Statement(Type.GOTO, null, ImmutableList.of(), null, target, -1, -1);
  }

  public static Statement gotoIfNot(Term condition, @Nullable Node target) {
    return new Statement(Type.GOTO_IF_NOT, null, ImmutableList.of(condition), null, target, -1, -1);
  }

  public static Statement computedGoto(Term offset) {
    return simple(Type.COMPUTED_GOTO, null, ImmutableList.of(offset), null);
  }

  public static Statement pushExecutionFlow(Node target) {
    return new Statement(Type.PUSH_EXECUTION_FLOW, null, ImmutableList.of(), null, target, -1, -1);
  }

  public static Statement popExecutionFlow() {
    return simple(Type.POP_EXECUTION_FLOW, null, ImmutableList.of(), null);
  }

  public static Statement endOfThread() {
    return simple(Type.END_OF_THREAD, null, ImmutableList.of(), null);
  }

  public static Statement ret() {
    return simple(Type.RETURN, null, ImmutableList.of(), null);
  }

  public static Statement wireTraceSite(String nodeTitle) {
    return simple(Type.WIRE_TRACE_SITE, null, ImmutableList.of(), nodeTitle);
  }

  public static Statement instrumentationBoundary(String callSite) {
    return simple(Type.INSTRUMENTATION_BOUNDARY, null, ImmutableList.of(), callSite);
  }

  /** Returns true for statements whose target must be resolved. */
  public boolean isJump() {
    return type == Type.GOTO || type == Type.GOTO_IF_NOT || type == Type.PUSH_EXECUTION_FLOW;
  }

  /** Returns a copy of this jump with its target replaced by a statement index. */
  Statement withTarget(int target) {
    Preconditions.checkState(isJump());
    return new Statement(type, lhs, rhs, text, null, target, entryPoint);
  }

  /** Returns a copy of this CALL_EVENT_GRAPH statement with its dispatch offset patched. */
  Statement withEntryPoint(int entryPoint) {
    Preconditions.checkState(type == Type.CALL_EVENT_GRAPH);
    return new Statement(type, lhs, rhs, text, null, target, entryPoint);
  }

  private String targetString() {
    if (targetNode != null) {
      return "@" + targetNode;
    }
    return target < 0 ? "end" : String.valueOf(target);
  }

  @Override
  public String toString() {
    String args = Joiner.on(", ").join(rhs);
    return switch (type) {
      case NOP -> "nop";
      case COMMENT -> "// " + text;
      case CALL_FUNCTION -> (lhs == null ? "" : lhs + " = ") + text + "(" + args + ")";
      case CALL_EVENT_GRAPH -> text + "(" + entryPoint + ")";
      case ASSIGN -> lhs + " = " + args;
      case CREATE_ARRAY -> lhs + " = [" + args + "]";
      case GOTO -> "goto " + targetString();
      case GOTO_IF_NOT -> "if not " + args + " goto " + targetString();
      case COMPUTED_GOTO -> "goto *" + args;
      case PUSH_EXECUTION_FLOW -> "push " + targetString();
      case POP_EXECUTION_FLOW -> "pop";
      case END_OF_THREAD -> "end";
      case RETURN -> "return";
      case WIRE_TRACE_SITE -> "trace " + text;
      case INSTRUMENTATION_BOUNDARY -> "boundary " + text;
    };
  }
}
