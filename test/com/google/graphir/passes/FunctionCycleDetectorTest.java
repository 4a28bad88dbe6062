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

package com.google.graphir.passes;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.graphir.ir.Attr;
import com.google.graphir.ir.Function;
import com.google.graphir.ir.Graph;
import com.google.graphir.ir.Model;
import com.google.graphir.ir.Node;
import com.google.graphir.ir.OperatorIdentifier;
import com.google.graphir.ir.Value;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class FunctionCycleDetectorTest {

  private static final OperatorIdentifier A = OperatorIdentifier.of("local", "A");
  private static final OperatorIdentifier B = OperatorIdentifier.of("local", "B");
  private static final OperatorIdentifier C = OperatorIdentifier.of("local", "C");

  /** A function whose body calls each of {@code callees} in turn. */
  private static Function calling(OperatorIdentifier id, OperatorIdentifier... callees) {
    Value x = Value.named("x");
    Graph.Builder body = Graph.builder().inputs(x);
    Value last = x;
    for (OperatorIdentifier callee : callees) {
      Node call = Node.builder(callee.domain(), callee.name()).inputs(last).build();
      body.nodes(call);
      last = call.getOutput(0);
    }
    return new Function(id.domain(), id.name(), body.outputs(last).build(), ImmutableList.of());
  }

  private static Model model(Function... functions) {
    Model model = new Model(Graph.builder().build(), 10);
    for (Function function : functions) {
      model.addFunction(function);
    }
    return model;
  }

  @Test
  public void testAcyclic() {
    FunctionCycleDetector detector =
        new FunctionCycleDetector(model(calling(A, B, C), calling(B, C), calling(C)));

    assertThat(detector.findCycle()).isEmpty();
    assertThat(detector.getCallGraph().successors(A)).containsExactly(B, C);
    assertThat(detector.getCallGraph().successors(B)).containsExactly(C);
    assertThat(detector.getCallGraph().successors(C)).isEmpty();
  }

  @Test
  public void testOperatorsAreNotEdges() {
    Value x = Value.named("x");
    Node relu = Node.builder("", "Relu").inputs(x).build();
    Function a =
        new Function(
            "local",
            "A",
            Graph.builder().inputs(x).nodes(relu).outputs(relu.getOutputs()).build(),
            ImmutableList.of());

    FunctionCycleDetector detector = new FunctionCycleDetector(model(a));

    assertThat(detector.getCallGraph().nodes()).containsExactly(A);
    assertThat(detector.getCallGraph().edges()).isEmpty();
  }

  @Test
  public void testTwoFunctionCycle() {
    FunctionCycleDetector detector = new FunctionCycleDetector(model(calling(A, B), calling(B, A)));

    assertThat(detector.findCycle()).hasValue(ImmutableList.of(A, B, A));
  }

  @Test
  public void testSelfRecursion() {
    FunctionCycleDetector detector = new FunctionCycleDetector(model(calling(A, A)));

    assertThat(detector.findCycle()).hasValue(ImmutableList.of(A, A));
  }

  @Test
  public void testCycleNotThroughFirstFunction() {
    FunctionCycleDetector detector =
        new FunctionCycleDetector(model(calling(A, B), calling(B, C), calling(C, B)));

    assertThat(detector.findCycle()).hasValue(ImmutableList.of(B, C, B));
  }

  @Test
  public void testCallInSubgraphIsAnEdge() {
    Value x = Value.named("x");
    Node callA = Node.builder("local", "A").inputs(x).build();
    Graph branch = Graph.builder().nodes(callA).outputs(callA.getOutputs()).build();
    Node ifNode =
        Node.builder("", "If").inputs(x).attribute(Attr.ofGraph("then_branch", branch)).build();
    Function b =
        new Function(
            "local",
            "B",
            Graph.builder().inputs(x).nodes(ifNode).outputs(ifNode.getOutputs()).build(),
            ImmutableList.of());

    FunctionCycleDetector detector = new FunctionCycleDetector(model(calling(A, B), b));

    assertThat(detector.getCallGraph().successors(B)).containsExactly(A);
    assertThat(detector.findCycle()).hasValue(ImmutableList.of(A, B, A));
  }

  @Test
  public void testFormat() {
    assertThat(FunctionCycleDetector.format(ImmutableList.of(A, B, A)))
        .isEqualTo("local::A -> local::B -> local::A");
  }
}
