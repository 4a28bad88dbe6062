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

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * A data edge. A value is produced by at most one {@link Node} (none for graph and function
 * inputs and initializers) and consumed by any number of nodes.
 *
 * <p>Consumers are tracked as {@link Usage}s. Usages are bookkeeping only: a value never owns its
 * consumers, and a node updates them itself when its inputs change.
 */
public final class Value {

  /**
   * One consuming input slot.
   *
   * @param node The consuming node.
   * @param index The input index of the node that reads the value.
   */
  public record Usage(Node node, int index) {}

  private final @Nullable Node producer;
  private final int outputIndex;
  private @Nullable Graph graph;

  private @Nullable String name;
  private @Nullable TensorType type;
  private @Nullable Shape shape;
  private @Nullable Tensor constValue;
  private @Nullable String docString;
  private final Map<String, String> metadataProps = new LinkedHashMap<>();

  private final Set<Usage> uses = new LinkedHashSet<>();

  /** Creates a value without a producer, e.g. a graph input. */
  public Value(@Nullable String name) {
    this.producer = null;
    this.outputIndex = -1;
    this.name = name;
  }

  /** Creates the {@code index}-th output of {@code producer}; only {@link Node} calls this. */
  Value(Node producer, int index) {
    this.producer = producer;
    this.outputIndex = index;
  }

  public static Value named(String name) {
    return new Value(name);
  }

  public @Nullable Node getProducer() {
    return producer;
  }

  /** The output slot of the producer, or -1 when there is no producer. */
  public int getOutputIndex() {
    return outputIndex;
  }

  /**
   * Returns the graph that defines this value: the producer's graph for node outputs, otherwise
   * the graph this value was registered with as input or initializer.
   */
  public @Nullable Graph getGraph() {
    return producer != null ? producer.getGraph() : graph;
  }

  void setGraph(@Nullable Graph graph) {
    checkState(producer == null, "Node outputs belong to the producer's graph: %s", this);
    checkArgument(
        graph == null || this.graph == null || this.graph == graph,
        "%s is already owned by graph %s",
        this,
        this.graph);
    this.graph = graph;
  }

  public @Nullable String getName() {
    return name;
  }

  public void setName(@Nullable String name) {
    this.name = name;
  }

  public @Nullable TensorType getType() {
    return type;
  }

  public void setType(@Nullable TensorType type) {
    this.type = type;
  }

  public @Nullable Shape getShape() {
    return shape;
  }

  public void setShape(@Nullable Shape shape) {
    this.shape = shape;
  }

  public @Nullable Tensor getConstValue() {
    return constValue;
  }

  public void setConstValue(@Nullable Tensor constValue) {
    this.constValue = constValue;
  }

  public @Nullable String getDocString() {
    return docString;
  }

  public void setDocString(@Nullable String docString) {
    this.docString = docString;
  }

  /** The live metadata map of this value. */
  public Map<String, String> getMetadataProps() {
    return metadataProps;
  }

  public ImmutableList<Usage> getUses() {
    return ImmutableList.copyOf(uses);
  }

  public ImmutableList<Node> getConsumers() {
    ImmutableList.Builder<Node> consumers = ImmutableList.builder();
    Set<Node> seen = new LinkedHashSet<>();
    for (Usage use : uses) {
      if (seen.add(use.node())) {
        consumers.add(use.node());
      }
    }
    return consumers.build();
  }

  public boolean hasUses() {
    return !uses.isEmpty();
  }

  void addUsage(Node node, int index) {
    uses.add(new Usage(node, index));
  }

  void removeUsage(Node node, int index) {
    uses.remove(new Usage(node, index));
  }

  /** Whether the defining graph lists this value among its outputs. */
  public boolean isGraphOutput() {
    Graph owner = getGraph();
    return owner != null && owner.isOutput(this);
  }

  /**
   * Points every consumer of this value at {@code replacement} instead. A null replacement leaves
   * the consuming slots with no input. Graph outputs are not touched.
   */
  public void replaceAllUsesWith(@Nullable Value replacement) {
    checkArgument(replacement != this, "Cannot replace %s with itself", this);
    for (Usage use : getUses()) {
      use.node().replaceInputWith(use.index(), replacement);
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("%").append(name == null ? "<anonymous>" : name);
    if (type != null) {
      sb.append('<').append(type.elementType());
      if (shape != null) {
        sb.append(',').append(shape);
      }
      sb.append('>');
    }
    if (constValue != null) {
      sb.append("{const}");
    }
    return sb.toString();
  }
}
