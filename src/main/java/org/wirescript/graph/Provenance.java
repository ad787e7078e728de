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

package org.wirescript.graph;

import java.util.HashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Records where each node manipulated by the compiler came from. There are two relations:
 *
 * <ul>
 *   <li>the <i>source</i> of a node is the node it was cloned from, or (for a node synthesized by
 *       the compiler) the node whose processing created it; following sources repeatedly leads to
 *       authored content, which is where diagnostics are reported.
 *   <li>the <i>call site</i> of a node produced by expanding a macro or composite is the instance
 *       node that was expanded; following call sites repeatedly leads to the outermost call site in
 *       the function being compiled.
 * </ul>
 *
 * <p>A Provenance is owned by a single compilation session and is not thread-safe.
 */
public final class Provenance {

  private final Map<Node, Node> sources = new HashMap<>();

  private final Map<Node, Node> callSites = new HashMap<>();

  /** Records that {@code clone} was copied from (or synthesized on behalf of) {@code source}. */
  public void recordSource(Node clone, Node source) {
    if (clone != source) {
      sources.put(clone, source);
    }
  }

  /** Records each entry of a {@link Graph.Copy}. */
  public void recordCopy(Graph.Copy copy) {
    copy.cloneToOriginal().forEach(this::recordSource);
  }

  /** Returns the node that {@code node} was directly copied or synthesized from, if any. */
  public @Nullable Node source(Node node) {
    return sources.get(node);
  }

  /** Returns the authored node that {@code node} ultimately derives from. */
  public Node original(Node node) {
    for (Node source = sources.get(node); source != null; source = sources.get(node)) {
      node = source;
    }
    return node;
  }

  /**
   * Returns the port of {@link #original} corresponding to {@code port}, or {@code port} itself if
   * the original has no such port.
   */
  public Port original(Port port) {
    Node original = original(port.node);
    if (original != port.node) {
      Port result = original.port(port.name, port.direction);
      if (result != null) {
        return result;
      }
    }
    return port;
  }

  /**
   * Records that {@code node} was produced by expanding {@code instance}. If the node was already
   * attributed (by a nested expansion) the earlier attribution is kept.
   */
  public void recordCallSite(Node node, Node instance) {
    if (node != instance) {
      callSites.putIfAbsent(node, instance);
    }
  }

  /** Returns the instance whose expansion produced {@code node}, or null if it was not expanded. */
  public @Nullable Node callSite(Node node) {
    return callSites.get(node);
  }

  /**
   * Returns the outermost instance whose expansion (directly or through nested instances) produced
   * {@code node}, or null if it was not produced by expansion.
   */
  public @Nullable Node outermostCallSite(Node node) {
    Node result = null;
    for (Node site = callSites.get(node); site != null; site = callSites.get(site)) {
      result = site;
    }
    return result;
  }
}
