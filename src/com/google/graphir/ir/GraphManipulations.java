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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.Sets;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/** Structural edits of a graph that keep producers, consumers and graph outputs consistent. */
public final class GraphManipulations {

  private GraphManipulations() {}

  /**
   * Replaces {@code oldNodes} with {@code newNodes}.
   *
   * <p>Every use of {@code oldValues[i]}, graph outputs included, is redirected to {@code
   * newValues[i]}; old values without a counterpart, or whose counterpart is null, leave their
   * consumers with no input. A replacement produced by one of the new nodes takes over the name,
   * type, shape and constant payload of the value it replaces. The new nodes are inserted after
   * {@code insertionPoint}, then the old nodes are removed.
   *
   * @throws IllegalStateException if an old value that is a graph output has no replacement
   */
  public static void replaceNodesAndValues(
      Graph graph,
      Node insertionPoint,
      List<Node> oldNodes,
      List<Node> newNodes,
      List<Value> oldValues,
      List<? extends @Nullable Value> newValues) {
    checkArgument(insertionPoint.getGraph() == graph, "%s is not in %s", insertionPoint, graph);
    Set<Node> inserted = Sets.newIdentityHashSet();
    inserted.addAll(newNodes);

    for (int i = 0; i < oldValues.size(); i++) {
      Value oldValue = oldValues.get(i);
      Value newValue = i < newValues.size() ? newValues.get(i) : null;
      if (newValue != null && inserted.contains(newValue.getProducer())) {
        inheritProperties(oldValue, newValue);
      }
      replaceAllUsesWith(graph, oldValue, newValue);
    }

    graph.insertAfter(insertionPoint, newNodes);
    for (Node oldNode : oldNodes) {
      graph.remove(oldNode, /* safe= */ true);
    }
  }

  /** Redirects every consumer of {@code oldValue}, and the graph outputs, to {@code newValue}. */
  public static void replaceAllUsesWith(Graph graph, Value oldValue, @Nullable Value newValue) {
    if (oldValue == newValue) {
      return;
    }
    oldValue.replaceAllUsesWith(newValue);
    if (graph.isOutput(oldValue)) {
      checkState(
          newValue != null,
          "Graph output %s of %s cannot be replaced with no value",
          oldValue,
          graph);
      graph.replaceOutput(oldValue, newValue);
    }
  }

  private static void inheritProperties(Value from, Value to) {
    if (from.getName() != null) {
      to.setName(from.getName());
    }
    if (from.getType() != null) {
      to.setType(from.getType());
    }
    if (from.getShape() != null) {
      to.setShape(from.getShape());
    }
    if (from.getConstValue() != null) {
      to.setConstValue(from.getConstValue());
    }
  }
}
