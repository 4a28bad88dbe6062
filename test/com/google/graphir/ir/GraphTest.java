/*
 * Copyright 2026 The GraphIR Authors.
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

package com.google.graphir.ir;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class GraphTest {

  private Value x;
  private Node relu;
  private Node neg;
  private Graph graph;

  @Before
  public void setUp() {
    x = Value.named("x");
    relu = Node.builder("", "Relu").inputs(x).name("relu").build();
    neg = Node.builder("", "Neg").inputs(relu.getOutput(0)).name("neg").build();
    graph =
        Graph.builder()
            .name("main")
            .inputs(x)
            .outputs(neg.getOutput(0))
            .nodes(relu, neg)
            .opsetImport("", 18)
            .build();
  }

  @Test
  public void testOwnership() {
    assertThat(x.getGraph()).isSameInstanceAs(graph);
    assertThat(relu.getGraph()).isSameInstanceAs(graph);
    assertThat(relu.getOutput(0).getGraph()).isSameInstanceAs(graph);
    assertThat(neg.getOutput(0).isGraphOutput()).isTrue();
    assertThat(relu.getOutput(0).isGraphOutput()).isFalse();
  }

  @Test
  public void testNodeCannotJoinTwoGraphs() {
    assertThrows(IllegalStateException.class, () -> Graph.builder().nodes(relu).build());
  }

  @Test
  public void testInputWithProducerRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> Graph.builder().inputs(relu.getOutput(0)).build());
  }

  @Test
  public void testIterationIsOverSnapshot() {
    int visited = 0;
    for (Node node : graph) {
      graph.remove(node, /* safe= */ false);
      visited++;
    }
    assertThat(visited).isEqualTo(2);
    assertThat(graph.getNodeCount()).isEqualTo(0);
  }

  @Test
  public void testInsertAfterAndBefore() {
    Node first = Node.builder("", "Identity").name("first").build();
    Node middle = Node.builder("", "Identity").name("middle").build();
    Node last = Node.builder("", "Identity").name("last").build();

    graph.insertAfter(relu, ImmutableList.of(middle));
    graph.insertBefore(relu, ImmutableList.of(first));
    graph.append(last);

    assertThat(graph.getNodes()).containsExactly(first, relu, middle, neg, last).inOrder();
    assertThat(graph.indexOf(middle)).isEqualTo(2);
    assertThat(middle.getGraph()).isSameInstanceAs(graph);
  }

  @Test
  public void testSafeRemoveRefusesUsedNode() {
    assertThrows(IllegalStateException.class, () -> graph.remove(relu, /* safe= */ true));
    assertThat(graph.getNodes()).contains(relu);
  }

  @Test
  public void testSafeRemoveRefusesGraphOutputProducer() {
    assertThrows(IllegalStateException.class, () -> graph.remove(neg, /* safe= */ true));
  }

  @Test
  public void testRemoveDetachesInputs() {
    graph.replaceOutput(neg.getOutput(0), relu.getOutput(0));
    graph.remove(neg, /* safe= */ true);

    assertThat(relu.getOutput(0).hasUses()).isFalse();
    assertThat(neg.getGraph()).isNull();
    assertThat(graph.getOutputs()).containsExactly(relu.getOutput(0));
  }

  @Test
  public void testInitializers() {
    Value weight = Value.named("w");
    graph.registerInitializer(weight);

    assertThat(graph.getInitializers()).containsExactly("w", weight);
    assertThat(weight.getGraph()).isSameInstanceAs(graph);
    assertThrows(IllegalArgumentException.class, () -> graph.registerInitializer(Value.named("w")));
    assertThrows(IllegalArgumentException.class, () -> graph.registerInitializer(new Value(null)));
  }

  @Test
  public void testOpsetImportsAreLive() {
    graph.getOpsetImports().put("custom", 1);

    assertThat(graph.getOpsetImports()).containsExactly("", 18, "custom", 1).inOrder();
  }

  @Test
  public void testAllNodesVisitsSubgraphsInPreOrder() {
    Node inner = Node.builder("", "Abs").inputs(x).name("inner").build();
    Graph branch = Graph.builder().name("branch").nodes(inner).outputs(inner.getOutput(0)).build();
    Node cond =
        Node.builder("", "If")
            .inputs(neg.getOutput(0))
            .attribute(Attr.ofGraph("then_branch", branch))
            .name("cond")
            .build();
    graph.append(cond);

    assertThat(GraphTraversal.allNodes(graph)).containsExactly(relu, neg, cond, inner).inOrder();
    assertThat(GraphTraversal.subgraphsOf(cond)).containsExactly(branch);
  }
}
