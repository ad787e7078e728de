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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.wirescript.nodes.Nodes;

@RunWith(JUnit4.class)
public class GraphTest {
  Graph graph;
  Node entry;
  Node print;
  Node literal;

  @Before
  public void setup() {
    // Entry -> Print(value), with value supplied by a literal
    graph = new Graph("F");
    entry = Nodes.entry(graph);
    print = Nodes.call(graph, "Print");
    print.addInput("value", PortType.STRING);
    literal = Nodes.literal(graph, PortType.STRING, "hello");
    graph.connect(entry.output(Nodes.THEN), print.input(Nodes.EXEC));
    graph.connect(literal.output(Nodes.VALUE), print.input("value"));
  }

  @Test
  public void linksAreSymmetric() {
    assertThat(entry.output(Nodes.THEN).links()).containsExactly(print.input(Nodes.EXEC));
    assertThat(print.input(Nodes.EXEC).links()).containsExactly(entry.output(Nodes.THEN));
    // Connecting again doesn't duplicate the link
    graph.connect(print.input(Nodes.EXEC), entry.output(Nodes.THEN));
    assertThat(print.input(Nodes.EXEC).links()).hasSize(1);
    assertThat(print.input("value").source()).isSameInstanceAs(literal.output(Nodes.VALUE));
  }

  @Test
  public void idsAreAssignedInOrder() {
    assertThat(entry.id).isEqualTo(0);
    assertThat(print.id).isEqualTo(1);
    assertThat(literal.id).isEqualTo(2);
    assertThat(graph.idLimit()).isEqualTo(3);
    assertThat(graph.findById(1)).isSameInstanceAs(print);
    assertThat(graph.nodesOfKind(NodeKind.CALL_FUNCTION)).containsExactly(print);
  }

  @Test
  public void removeNodeBreaksLinks() {
    graph.removeNode(literal);
    assertThat(graph.contains(literal)).isFalse();
    assertThat(literal.graph()).isNull();
    assertThat(print.input("value").isLinked()).isFalse();
    // Ids are never reused
    Node added = Nodes.comment(graph, "note");
    assertThat(added.id).isEqualTo(3);
  }

  @Test
  public void cloneKeepsIdsAndSharesNothing() {
    Graph.Copy copy = graph.cloneGraph("F2");
    Graph clone = copy.graph();
    assertThat(clone.name).isEqualTo("F2");
    assertThat(clone.size()).isEqualTo(3);
    Node printClone = copy.cloneOf(print);
    assertThat(printClone).isNotSameInstanceAs(print);
    assertThat(printClone.id).isEqualTo(print.id);
    assertThat(printClone.property(Nodes.FUNCTION)).isEqualTo("Print");
    assertThat(copy.cloneToOriginal().get(printClone)).isSameInstanceAs(print);
    Port valueClone = printClone.input("value");
    assertThat(valueClone.source().node).isSameInstanceAs(copy.cloneOf(literal));
    // Changing the clone leaves the original alone
    clone.removeNode(copy.cloneOf(literal));
    assertThat(print.input("value").isLinked()).isTrue();
    assertThat(graph.size()).isEqualTo(3);
    // New nodes in the clone don't collide with the copied ids
    assertThat(Nodes.comment(clone, "note").id).isEqualTo(3);
  }

  @Test
  public void copyNodesFromAssignsNewIds() {
    Graph target = new Graph("Target");
    Nodes.comment(target, "first");
    Graph.Copy copy = target.copyNodesFrom(graph);
    assertThat(target.size()).isEqualTo(4);
    assertThat(copy.clones()).hasSize(3);
    assertThat(copy.cloneOf(entry).id).isEqualTo(1);
    assertThat(copy.cloneOf(literal).id).isEqualTo(3);
    assertThat(copy.cloneOf(entry).output(Nodes.THEN).links())
        .containsExactly(copy.cloneOf(print).input(Nodes.EXEC));
  }

  @Test
  public void moveLinks() {
    Node other = Nodes.call(graph, "Other");
    graph.moveLinks(entry.output(Nodes.THEN), other.output(Nodes.THEN));
    assertThat(entry.output(Nodes.THEN).isLinked()).isFalse();
    assertThat(other.output(Nodes.THEN).links()).containsExactly(print.input(Nodes.EXEC));
  }

  @Test
  public void connectOutsideGraph() {
    Graph other = new Graph("Other");
    Node stranger = Nodes.call(other, "Stranger");
    assertThrows(
        IllegalArgumentException.class,
        () -> graph.connect(entry.output(Nodes.THEN), stranger.input(Nodes.EXEC)));
  }

  @Test
  public void provenanceFollowsChains() {
    Provenance provenance = new Provenance();
    Graph.Copy first = graph.cloneGraph("F");
    provenance.recordCopy(first);
    Graph.Copy second = first.graph().cloneGraph("F");
    provenance.recordCopy(second);
    Node printTwice = second.cloneOf(first.cloneOf(print));
    assertThat(provenance.original(printTwice)).isSameInstanceAs(print);
    assertThat(provenance.source(printTwice)).isSameInstanceAs(first.cloneOf(print));
    assertThat(provenance.original(printTwice.input("value")))
        .isSameInstanceAs(print.input("value"));
    assertThat(provenance.original(print)).isSameInstanceAs(print);
  }

  @Test
  public void outermostCallSite() {
    Provenance provenance = new Provenance();
    Node outer = Nodes.comment(graph, "outer");
    Node inner = Nodes.comment(graph, "inner");
    provenance.recordCallSite(inner, outer);
    provenance.recordCallSite(print, inner);
    // A later attribution doesn't replace the first
    provenance.recordCallSite(print, outer);
    assertThat(provenance.callSite(print)).isSameInstanceAs(inner);
    assertThat(provenance.outermostCallSite(print)).isSameInstanceAs(outer);
    assertThat(provenance.outermostCallSite(outer)).isNull();
  }
}
