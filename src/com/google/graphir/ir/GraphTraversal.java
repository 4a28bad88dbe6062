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

import com.google.common.collect.ImmutableList;

/** Walks graphs together with the subgraphs held by their nodes' attributes. */
public final class GraphTraversal {

  private GraphTraversal() {}

  /**
   * Returns every node of {@code graph} and of all nested subgraphs, in pre-order: a node comes
   * before the nodes of its subgraph attributes, which come before the node's successors.
   */
  public static ImmutableList<Node> allNodes(Graph graph) {
    ImmutableList.Builder<Node> result = ImmutableList.builder();
    collect(graph, result);
    return result.build();
  }

  /** The subgraphs directly held by {@code node}'s concrete attributes, in attribute order. */
  public static ImmutableList<Graph> subgraphsOf(Node node) {
    ImmutableList.Builder<Graph> result = ImmutableList.builder();
    for (Attr attr : node.getAttributes().values()) {
      if (attr.isRef()) {
        continue;
      }
      switch (attr.getType()) {
        case GRAPH:
          result.add(attr.asGraph());
          break;
        case GRAPHS:
          result.addAll(attr.asGraphs());
          break;
        default:
          break;
      }
    }
    return result.build();
  }

  private static void collect(Graph graph, ImmutableList.Builder<Node> result) {
    for (Node node : graph) {
      result.add(node);
      for (Graph subgraph : subgraphsOf(node)) {
        collect(subgraph, result);
      }
    }
  }
}
