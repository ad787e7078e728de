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

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.wirescript.graph.Port;
import org.wirescript.graph.PortType;

/**
 * The class-level symbols visible to every function of a compilation unit: member variables (own
 * and inherited), and the storage shared between the event graph and its stubs.
 *
 * <p>A ClassScope belongs to a single compilation and is not thread-safe.
 */
final class ClassScope {

  private static final CharMatcher INVALID_NAME_CHARS =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.inRange('0', '9'))
          .or(CharMatcher.is('_'))
          .negate();

  final ScriptClass source;
  final CompileOptions options;

  /** Member variables declared by this class (possibly renamed), keyed by their final names. */
  private final Map<String, Term> members = new LinkedHashMap<>();

  /** Storage shared by the event graph and its stubs, keyed by name. */
  private final Map<String, Term> eventGraphLocals = new LinkedHashMap<>();

  /** Names assigned to event parameters, keyed by the authored event port. */
  private final Map<Port, String> eventParameterNames = new HashMap<>();

  /** Every class-level name in use (including inherited ones). */
  private final Set<String> usedNames = new HashSet<>();

  ClassScope(ScriptClass source, CompileOptions options) {
    this.source = source;
    this.options = options;
    for (ClassSignature c = source.parent; c != null; c = c.parent) {
      c.functions.forEach(f -> usedNames.add(f.name));
      c.variables.forEach(v -> usedNames.add(v.name()));
    }
  }

  /** Returns a valid identifier derived from {@code base}. */
  static String sanitize(String base) {
    String result = INVALID_NAME_CHARS.replaceFrom(base, '_');
    return result.isEmpty() || CharMatcher.inRange('0', '9').matches(result.charAt(0))
        ? "_" + result
        : result;
  }

  /** Returns true if {@code name} is already used at class level. */
  boolean isNameUsed(String name) {
    return usedNames.contains(name);
  }

  /** Marks {@code name} as used; returns false if it already was. */
  boolean claimName(String name) {
    return usedNames.add(name);
  }

  /** Returns an unused class-level name based on {@code base}, and marks it used. */
  String uniqueName(String base) {
    String name = sanitize(base);
    for (int i = 1; !usedNames.add(name); i++) {
      name = sanitize(base) + "_" + i;
    }
    return name;
  }

  /** Adds a member variable declared by this class; its name must already be claimed. */
  Term addMember(VariableDecl variable) {
    Term term = new Term(Term.Role.MEMBER, variable.name(), variable.type(), null, null);
    term.resolve(Term.Storage.CLASS, members.size());
    members.put(variable.name(), term);
    return term;
  }

  /** Returns the term for a member variable declared by this class or a parent, or null. */
  @Nullable Term member(String name) {
    Term result = members.get(name);
    if (result == null && source.parent != null) {
      VariableDecl inherited = source.parent.findVariable(name);
      if (inherited != null) {
        result = new Term(Term.Role.MEMBER, name, inherited.type(), null, null);
        result.resolve(Term.Storage.CLASS, -1);
        members.put(name, result);
      }
    }
    return result;
  }

  ImmutableList<Term> ownMembers() {
    return members.values().stream()
        .filter(t -> t.slot() >= 0)
        .collect(ImmutableList.toImmutableList());
  }

  /**
   * Returns the name used for the shared storage of an event parameter. The same authored port
   * always gets the same name, so the event graph and the event's stub agree.
   */
  String eventParameterName(Port authoredPort) {
    return eventParameterNames.computeIfAbsent(
        authoredPort, p -> uniqueName(p.node.title() + "_" + p.name));
  }

  /** Returns the shared event graph storage with the given name, creating it if necessary. */
  Term eventGraphLocal(String name, PortType type) {
    return eventGraphLocals.computeIfAbsent(
        name,
        n -> {
          Term term = new Term(Term.Role.EVENT_GRAPH_LOCAL, n, type, null, null);
          term.resolve(
              options.persistentEventFrame ? Term.Storage.PERSISTENT_FRAME : Term.Storage.CLASS,
              eventGraphLocals.size());
          return term;
        });
  }

  /**
   * Moves an event graph local into the shared storage, so it survives across the event graph's
   * suspension points.
   */
  void promote(Term term) {
    term.resolve(
        options.persistentEventFrame ? Term.Storage.PERSISTENT_FRAME : Term.Storage.CLASS,
        eventGraphLocals.size());
    eventGraphLocals.putIfAbsent(term.name(), term);
  }

  ImmutableList<Term> eventGraphLocals() {
    return ImmutableList.copyOf(eventGraphLocals.values());
  }
}
