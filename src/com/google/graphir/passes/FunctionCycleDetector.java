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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.graph.ElementOrder;
import com.google.common.graph.GraphBuilder;
import com.google.common.graph.Graphs;
import com.google.common.graph.ImmutableGraph;
import com.google.common.graph.MutableGraph;
import com.google.graphir.ir.Function;
import com.google.graphir.ir.GraphTraversal;
import com.google.graphir.ir.Model;
import com.google.graphir.ir.Node;
import com.google.graphir.ir.OperatorIdentifier;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finds cycles in the call graph of a model's functions.
 *
 * <p>There is an edge from function X to function Y when the body of X, including the subgraphs
 * nested in it, contains a node whose operator identity names Y. Inlining a function on a cycle
 * would never terminate, so this check runs before anything is changed.
 */
public final class FunctionCycleDetector {

  private enum Color {
    WHITE,
    GRAY,
    BLACK
  }

  private final ImmutableGraph<OperatorIdentifier> callGraph;

  public FunctionCycleDetector(Model model) {
    this.callGraph = buildCallGraph(model.getFunctions());
  }

  static ImmutableGraph<OperatorIdentifier> buildCallGraph(
      Map<OperatorIdentifier, Function> functions) {
    MutableGraph<OperatorIdentifier> graph =
        GraphBuilder.directed()
            .allowsSelfLoops(true)
            .nodeOrder(ElementOrder.insertion())
            .expectedNodeCount(functions.size())
            .build();
    for (Map.Entry<OperatorIdentifier, Function> entry : functions.entrySet()) {
      graph.addNode(entry.getKey());
      for (Node node : GraphTraversal.allNodes(entry.getValue().getGraph())) {
        OperatorIdentifier callee = node.opIdentifier();
        if (functions.containsKey(callee)) {
          graph.putEdge(entry.getKey(), callee);
        }
      }
    }
    return ImmutableGraph.copyOf(graph);
  }

  /** The function call graph; an edge X to Y means X calls Y. */
  public ImmutableGraph<OperatorIdentifier> getCallGraph() {
    return callGraph;
  }

  /**
   * Returns one cycle as a closed chain of function identifiers, first element repeated at the
   * end, or empty if the call graph is acyclic.
   */
  public Optional<ImmutableList<OperatorIdentifier>> findCycle() {
    if (!Graphs.hasCycle(callGraph)) {
      return Optional.empty();
    }
    Map<OperatorIdentifier, Color> colors = new HashMap<>();
    for (OperatorIdentifier id : callGraph.nodes()) {
      colors.put(id, Color.WHITE);
    }
    List<OperatorIdentifier> path = new ArrayList<>();
    for (OperatorIdentifier id : callGraph.nodes()) {
      if (colors.get(id) == Color.WHITE) {
        ImmutableList<OperatorIdentifier> cycle = visit(id, colors, path);
        if (cycle != null) {
          return Optional.of(cycle);
        }
      }
    }
    throw new IllegalStateException("Call graph has a cycle that depth-first search missed");
  }

  private ImmutableList<OperatorIdentifier> visit(
      OperatorIdentifier id, Map<OperatorIdentifier, Color> colors, List<OperatorIdentifier> path) {
    colors.put(id, Color.GRAY);
    path.add(id);
    for (OperatorIdentifier callee : callGraph.successors(id)) {
      Color color = colors.get(callee);
      if (color == Color.GRAY) {
        List<OperatorIdentifier> cycle =
            new ArrayList<>(path.subList(path.indexOf(callee), path.size()));
        cycle.add(callee);
        return ImmutableList.copyOf(cycle);
      }
      if (color == Color.WHITE) {
        ImmutableList<OperatorIdentifier> cycle = visit(callee, colors, path);
        if (cycle != null) {
          return cycle;
        }
      }
    }
    path.remove(path.size() - 1);
    colors.put(id, Color.BLACK);
    return null;
  }

  /** Formats a cycle as {@code a -> b -> a}. */
  static String format(List<OperatorIdentifier> cycle) {
    return Joiner.on(" -> ").join(cycle);
  }
}
