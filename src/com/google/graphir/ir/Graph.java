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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * An ordered sequence of nodes together with declared inputs, outputs, named initializers and an
 * opset-import table.
 *
 * <p>Stored order is topological: every input of a node is a graph input, an initializer, an
 * output of an earlier node, or a value captured from an enclosing graph. Passes rely on this.
 */
public final class Graph implements Iterable<Node> {
  private @Nullable String name;
  private final List<Value> inputs;
  private final List<Value> outputs;
  private final Map<String, Value> initializers = new LinkedHashMap<>();
  private final List<Node> nodes = new ArrayList<>();
  private final Map<String, Integer> opsetImports;
  private @Nullable String docString;
  private final Map<String, String> metadataProps = new LinkedHashMap<>();

  private Graph(Builder builder) {
    this.name = builder.name;
    this.docString = builder.docString;
    this.opsetImports = new LinkedHashMap<>(builder.opsetImports);
    this.metadataProps.putAll(builder.metadataProps);
    this.inputs = new ArrayList<>();
    for (Value input : builder.inputs) {
      checkArgument(input.getProducer() == null, "Graph input %s has a producer", input);
      input.setGraph(this);
      inputs.add(input);
    }
    for (Value initializer : builder.initializers) {
      registerInitializer(initializer);
    }
    for (Node node : builder.nodes) {
      append(node);
    }
    this.outputs = new ArrayList<>(builder.outputs);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builds a {@link Graph}. */
  public static final class Builder {
    private @Nullable String name;
    private final List<Value> inputs = new ArrayList<>();
    private final List<Value> outputs = new ArrayList<>();
    private final List<Value> initializers = new ArrayList<>();
    private final List<Node> nodes = new ArrayList<>();
    private final Map<String, Integer> opsetImports = new LinkedHashMap<>();
    private @Nullable String docString;
    private final Map<String, String> metadataProps = new LinkedHashMap<>();

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder name(@Nullable String name) {
      this.name = name;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder inputs(Value... inputs) {
      return inputs(Arrays.asList(inputs));
    }

    @CanIgnoreReturnValue
    public Builder inputs(List<Value> inputs) {
      this.inputs.addAll(inputs);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder outputs(Value... outputs) {
      return outputs(Arrays.asList(outputs));
    }

    @CanIgnoreReturnValue
    public Builder outputs(List<Value> outputs) {
      this.outputs.addAll(outputs);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder initializers(Value... initializers) {
      return initializers(Arrays.asList(initializers));
    }

    @CanIgnoreReturnValue
    public Builder initializers(List<Value> initializers) {
      this.initializers.addAll(initializers);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder nodes(Node... nodes) {
      return nodes(Arrays.asList(nodes));
    }

    @CanIgnoreReturnValue
    public Builder nodes(List<Node> nodes) {
      this.nodes.addAll(nodes);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder opsetImport(String domain, int version) {
      this.opsetImports.put(domain, version);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder opsetImports(Map<String, Integer> opsetImports) {
      this.opsetImports.putAll(opsetImports);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder docString(@Nullable String docString) {
      this.docString = docString;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder metadataProps(Map<String, String> props) {
      this.metadataProps.putAll(props);
      return this;
    }

    public Graph build() {
      return new Graph(this);
    }
  }

  public @Nullable String getName() {
    return name;
  }

  public void setName(@Nullable String name) {
    this.name = name;
  }

  public ImmutableList<Value> getInputs() {
    return ImmutableList.copyOf(inputs);
  }

  public ImmutableList<Value> getOutputs() {
    return ImmutableList.copyOf(outputs);
  }

  boolean isOutput(Value value) {
    for (Value output : outputs) {
      if (output == value) {
        return true;
      }
    }
    return false;
  }

  /** Replaces every occurrence of {@code oldValue} among the graph outputs. */
  public boolean replaceOutput(Value oldValue, Value newValue) {
    checkNotNull(newValue);
    boolean replaced = false;
    for (int i = 0; i < outputs.size(); i++) {
      if (outputs.get(i) == oldValue) {
        outputs.set(i, newValue);
        replaced = true;
      }
    }
    return replaced;
  }

  public ImmutableMap<String, Value> getInitializers() {
    return ImmutableMap.copyOf(initializers);
  }

  /** Adds a named constant to this graph. The value must have a name and no producer. */
  public void registerInitializer(Value initializer) {
    String initializerName = initializer.getName();
    checkArgument(initializerName != null, "Initializer must have a name: %s", initializer);
    checkArgument(initializer.getProducer() == null, "Initializer %s has a producer", initializer);
    checkArgument(
        !initializers.containsKey(initializerName), "Duplicate initializer %s", initializerName);
    initializer.setGraph(this);
    initializers.put(initializerName, initializer);
  }

  /** The live opset-import table, domain to version. */
  public Map<String, Integer> getOpsetImports() {
    return opsetImports;
  }

  public @Nullable String getDocString() {
    return docString;
  }

  public void setDocString(@Nullable String docString) {
    this.docString = docString;
  }

  /** The live metadata map of this graph. */
  public Map<String, String> getMetadataProps() {
    return metadataProps;
  }

  /** A snapshot of the nodes in stored order. */
  public ImmutableList<Node> getNodes() {
    return ImmutableList.copyOf(nodes);
  }

  public int getNodeCount() {
    return nodes.size();
  }

  public Node getNode(int index) {
    return nodes.get(index);
  }

  public int indexOf(Node node) {
    for (int i = 0; i < nodes.size(); i++) {
      if (nodes.get(i) == node) {
        return i;
      }
    }
    return -1;
  }

  /** Iterates over a snapshot of the nodes, so the graph may be changed while iterating. */
  @Override
  public Iterator<Node> iterator() {
    return getNodes().iterator();
  }

  public void append(Node node) {
    node.setGraph(this);
    nodes.add(node);
  }

  /** Inserts {@code newNodes} in order right after {@code anchor}. */
  public void insertAfter(Node anchor, List<Node> newNodes) {
    int index = indexOf(anchor);
    checkArgument(index >= 0, "%s is not in graph %s", anchor, name);
    insertAt(index + 1, newNodes);
  }

  /** Inserts {@code newNodes} in order right before {@code anchor}. */
  public void insertBefore(Node anchor, List<Node> newNodes) {
    int index = indexOf(anchor);
    checkArgument(index >= 0, "%s is not in graph %s", anchor, name);
    insertAt(index, newNodes);
  }

  private void insertAt(int index, List<Node> newNodes) {
    for (Node node : newNodes) {
      node.setGraph(this);
    }
    nodes.addAll(index, newNodes);
  }

  /**
   * Removes {@code node} from this graph and drops its input usages.
   *
   * @param safe when true, refuse to remove a node whose outputs are still consumed or are graph
   *     outputs
   */
  public void remove(Node node, boolean safe) {
    int index = indexOf(node);
    checkArgument(index >= 0, "%s is not in graph %s", node, name);
    if (safe) {
      for (Value output : node.getOutputs()) {
        checkState(
            !output.hasUses(),
            "Cannot remove %s: output %s is still used by %s",
            node,
            output,
            output.getConsumers());
        checkState(!isOutput(output), "Cannot remove %s: %s is a graph output", node, output);
      }
    }
    nodes.remove(index);
    node.detachInputs();
    node.setGraph(null);
  }

  @Override
  public String toString() {
    return "Graph(" + (name == null ? "<anonymous>" : name) + ", " + nodes.size() + " nodes)";
  }
}
