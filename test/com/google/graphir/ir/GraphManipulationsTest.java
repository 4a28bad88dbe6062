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
import java.util.Arrays;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class GraphManipulationsTest {

  @Test
  public void testReplaceNodeWithSequence() {
    Value x = Value.named("x");
    Node gelu = Node.builder("", "Gelu").inputs(x).name("gelu").build();
    Value y = gelu.getOutput(0);
    y.setName("y");
    y.setType(TensorType.of(DataType.FLOAT));
    Node consumer = Node.builder("", "Neg").inputs(y).name("neg").build();
    Graph graph = Graph.builder().inputs(x).nodes(gelu, consumer).outputs(y).build();

    Node erf = Node.builder("", "Erf").inputs(x).name("erf").build();
    Node mul = Node.builder("", "Mul").inputs(x, erf.getOutput(0)).name("mul").build();
    mul.getOutput(0).setName("tmp");

    GraphManipulations.replaceNodesAndValues(
        graph,
        gelu,
        ImmutableList.of(gelu),
        ImmutableList.of(erf, mul),
        gelu.getOutputs(),
        ImmutableList.of(mul.getOutput(0)));

    Value replacement = mul.getOutput(0);
    assertThat(graph.getNodes()).containsExactly(erf, mul, consumer).inOrder();
    assertThat(consumer.getInput(0)).isSameInstanceAs(replacement);
    assertThat(graph.getOutputs()).containsExactly(replacement);
    assertThat(replacement.getName()).isEqualTo("y");
    assertThat(replacement.getType()).isEqualTo(TensorType.of(DataType.FLOAT));
    assertThat(gelu.getGraph()).isNull();
    assertThat(x.getConsumers()).containsExactly(erf, mul);
  }

  @Test
  public void testPassThroughValueKeepsItsName() {
    Value x = Value.named("x");
    Node identity = Node.builder("", "Identity").inputs(x).build();
    identity.getOutput(0).setName("y");
    Node consumer = Node.builder("", "Neg").inputs(identity.getOutput(0)).build();
    Graph graph = Graph.builder().inputs(x).nodes(identity, consumer).build();

    GraphManipulations.replaceNodesAndValues(
        graph,
        identity,
        ImmutableList.of(identity),
        ImmutableList.of(),
        identity.getOutputs(),
        ImmutableList.of(x));

    assertThat(x.getName()).isEqualTo("x");
    assertThat(consumer.getInput(0)).isSameInstanceAs(x);
    assertThat(graph.getNodes()).containsExactly(consumer);
  }

  @Test
  public void testMissingReplacementLeavesNoInput() {
    Value x = Value.named("x");
    Node split = Node.builder("", "Split").inputs(x).numOutputs(2).build();
    Node consumer =
        Node.builder("", "Concat").inputs(split.getOutput(0), split.getOutput(1)).build();
    Graph graph = Graph.builder().inputs(x).nodes(split, consumer).build();
    Node relu = Node.builder("", "Relu").inputs(x).build();

    GraphManipulations.replaceNodesAndValues(
        graph,
        split,
        ImmutableList.of(split),
        ImmutableList.of(relu),
        split.getOutputs(),
        Arrays.asList(relu.getOutput(0), null));

    assertThat(consumer.getInputs()).containsExactly(relu.getOutput(0), null).inOrder();
  }

  @Test
  public void testGraphOutputNeedsReplacement() {
    Value x = Value.named("x");
    Node relu = Node.builder("", "Relu").inputs(x).build();
    Graph graph = Graph.builder().inputs(x).nodes(relu).outputs(relu.getOutput(0)).build();

    assertThrows(
        IllegalStateException.class,
        () -> GraphManipulations.replaceAllUsesWith(graph, relu.getOutput(0), null));
  }
}
