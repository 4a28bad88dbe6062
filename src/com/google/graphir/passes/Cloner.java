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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.graphir.ir.Attr;
import com.google.graphir.ir.AttributeType;
import com.google.graphir.ir.Graph;
import com.google.graphir.ir.Node;
import com.google.graphir.ir.Value;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;

/**
 * Creates copies of nodes and graphs, substituting input values and, when inlining functions,
 * reference attributes.
 *
 * <p>The value map is shared with the caller and filled in as values are cloned: after cloning a
 * node, each of its outputs maps to the corresponding output of the clone. A value mapped to null
 * is severed; nodes reading it get no input in that slot.
 *
 * <p>Constant payloads (tensors and other non-graph attribute values) are shared, not copied.
 * Subgraph attributes are cloned recursively with the same value map, so a subgraph reading a
 * value of the graph being cloned reads the clone of that value.
 *
 * <p>Every failure is rethrown as a {@link CloneException} naming the operation and its argument.
 */
public final class Cloner {

  static final DiagnosticType UNRESOLVED_OUTER_SCOPE_VALUE =
      DiagnosticType.error(
          "IR_UNRESOLVED_OUTER_SCOPE_VALUE",
          "Value {0} used by node {1} is an outer-scope value (from graph {2}), but outer-scope"
              + " values are not allowed. Add the value to the inputs of the cloned graph, or"
              + " allow outer-scope values.");

  private final ImmutableMap<String, Attr> attrMap;
  private final Map<Value, @Nullable Value> valueMap;
  private final ImmutableMap<String, String> metadataProps;
  private final Consumer<Node> postProcess;
  private final boolean resolveRefAttrs;
  private final boolean allowOuterScopeValues;

  private Cloner(Builder builder) {
    this.attrMap = ImmutableMap.copyOf(builder.attrMap);
    this.valueMap = builder.valueMap;
    this.metadataProps = ImmutableMap.copyOf(builder.metadataProps);
    this.postProcess = builder.postProcess;
    this.resolveRefAttrs = builder.resolveRefAttrs;
    this.allowOuterScopeValues = builder.allowOuterScopeValues;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Configures a {@link Cloner}. */
  public static final class Builder {
    private Map<String, Attr> attrMap = ImmutableMap.of();
    private Map<Value, @Nullable Value> valueMap = new LinkedHashMap<>();
    private Map<String, String> metadataProps = ImmutableMap.of();
    private Consumer<Node> postProcess = node -> {};
    private boolean resolveRefAttrs = false;
    private boolean allowOuterScopeValues = false;

    private Builder() {}

    /** Attributes to substitute for reference attributes, keyed by parameter name. */
    @CanIgnoreReturnValue
    public Builder attrMap(Map<String, Attr> attrMap) {
      this.attrMap = checkNotNull(attrMap);
      return this;
    }

    /**
     * The mapping from original to cloned values. The cloner adds to this map, so pass a mutable
     * map; null entries are allowed and mark severed values.
     */
    @CanIgnoreReturnValue
    public Builder valueMap(Map<Value, @Nullable Value> valueMap) {
      this.valueMap = checkNotNull(valueMap);
      return this;
    }

    /** Metadata added to every cloned node. The node's own metadata wins on conflicts. */
    @CanIgnoreReturnValue
    public Builder metadataProps(Map<String, String> metadataProps) {
      this.metadataProps = checkNotNull(metadataProps);
      return this;
    }

    /** Invoked on each cloned node after its outputs are registered in the value map. */
    @CanIgnoreReturnValue
    public Builder postProcess(Consumer<Node> postProcess) {
      this.postProcess = checkNotNull(postProcess);
      return this;
    }

    /** Whether to resolve reference attributes through the attribute map. Off by default. */
    @CanIgnoreReturnValue
    public Builder resolveRefAttrs(boolean resolveRefAttrs) {
      this.resolveRefAttrs = resolveRefAttrs;
      return this;
    }

    /**
     * Whether nodes may read values from enclosing scopes that are not in the value map. Such
     * values are referenced as-is by the clones instead of being copied. Off by default, in which
     * case reading one is an error.
     */
    @CanIgnoreReturnValue
    public Builder allowOuterScopeValues(boolean allowOuterScopeValues) {
      this.allowOuterScopeValues = allowOuterScopeValues;
      return this;
    }

    public Cloner build() {
      return new Cloner(this);
    }
  }

  /**
   * Returns the clone of {@code value}, creating one if it is not mapped yet. Unmapped values are
   * treated as inputs of the scope being cloned.
   */
  Value cloneOrGetValue(Value value) {
    return withErrorContext(
        "cloneOrGetValue",
        value,
        () -> {
          if (valueMap.containsKey(value)) {
            Value known = valueMap.get(value);
            checkState(known != null, "BUG: Value %s mapped to null in value map", value);
            return known;
          }
          Value newValue = new Value(value.getName());
          newValue.setType(value.getType());
          newValue.setShape(value.getShape());
          newValue.setDocString(value.getDocString());
          newValue.setConstValue(value.getConstValue());
          newValue.getMetadataProps().putAll(value.getMetadataProps());
          valueMap.put(value, newValue);
          return newValue;
        });
  }

  /**
   * Clones an attribute under the name {@code key}.
   *
   * @return the clone, or null if the attribute refers to a parameter that the attribute map does
   *     not bind and should be dropped
   */
  public @Nullable Attr cloneAttr(String key, Attr attr) {
    return withErrorContext("cloneAttr", key + "=" + attr, () -> doCloneAttr(key, attr));
  }

  private @Nullable Attr doCloneAttr(String key, Attr attr) {
    if (!attr.isRef()) {
      if (attr.getType() == AttributeType.GRAPH) {
        Graph graph = cloneGraph(attr.asGraph());
        return Attr.of(key, AttributeType.GRAPH, graph, attr.getDocString());
      } else if (attr.getType() == AttributeType.GRAPHS) {
        ImmutableList.Builder<Graph> graphs = ImmutableList.builder();
        for (Graph graph : attr.asGraphs()) {
          graphs.add(cloneGraph(graph));
        }
        return Attr.of(key, AttributeType.GRAPHS, graphs.build(), attr.getDocString());
      }
      return attr;
    }

    if (!resolveRefAttrs) {
      return attr;
    }

    Attr refAttr = attrMap.get(attr.getRefAttrName());
    if (refAttr == null) {
      // A parameter the call site left unset: every reference to it disappears.
      return null;
    }
    if (!refAttr.isRef()) {
      return Attr.of(key, refAttr.getType(), refAttr.getValue(), refAttr.getDocString());
    }
    // Inlining into another function body: bind to the caller's own parameter.
    return Attr.ref(key, refAttr.getRefAttrName(), refAttr.getType(), refAttr.getDocString());
  }

  /**
   * Clones {@code node}. Its inputs are looked up in the value map, its attributes are cloned with
   * {@link #cloneAttr}, and its outputs are registered in the value map.
   */
  public Node cloneNode(Node node) {
    return withErrorContext("cloneNode", node, () -> doCloneNode(node));
  }

  private Node doCloneNode(Node node) {
    List<@Nullable Value> newInputs = new ArrayList<>();
    for (Value input : node.getInputs()) {
      if (input == null) {
        newInputs.add(null);
      } else if (!valueMap.containsKey(input)) {
        // Nodes are cloned in topological order, so an unmapped input comes from an outer scope.
        if (!allowOuterScopeValues) {
          Graph owner = input.getGraph();
          String graphName;
          if (owner == null) {
            graphName = "<unknown>";
          } else {
            graphName = owner.getName() == null ? "<anonymous>" : owner.getName();
          }
          throw new PassException(
              IrError.make(
                  node,
                  UNRESOLVED_OUTER_SCOPE_VALUE,
                  input.toString(),
                  node.toString(),
                  graphName));
        }
        newInputs.add(input);
      } else {
        newInputs.add(valueMap.get(input));
      }
    }

    List<Attr> newAttributes = new ArrayList<>();
    for (Map.Entry<String, Attr> entry : node.getAttributes().entrySet()) {
      Attr newAttr = cloneAttr(entry.getKey(), entry.getValue());
      if (newAttr != null) {
        newAttributes.add(newAttr);
      }
    }

    // TODO(graphir): keep both values when call-site and node metadata disagree on a key.
    Map<String, String> newMetadata = new LinkedHashMap<>(metadataProps);
    newMetadata.putAll(node.getMetadataProps());

    Node newNode =
        Node.builder(node.getDomain(), node.getOpType())
            .overload(node.getOverload())
            .version(node.getVersion())
            .inputs(newInputs)
            .attributes(newAttributes)
            .numOutputs(node.getOutputs().size())
            .name(node.getName())
            .docString(node.getDocString())
            .metadataProps(newMetadata)
            .build();

    for (int i = 0; i < node.getOutputs().size(); i++) {
      Value output = node.getOutput(i);
      Value newOutput = newNode.getOutput(i);
      valueMap.put(output, newOutput);
      newOutput.setName(output.getName());
      newOutput.setShape(output.getShape());
      newOutput.setType(output.getType());
      newOutput.setConstValue(output.getConstValue());
      newOutput.setDocString(output.getDocString());
      newOutput.getMetadataProps().putAll(output.getMetadataProps());
    }

    postProcess.accept(newNode);
    return newNode;
  }

  /**
   * Clones {@code graph}. Inputs and initializers get fresh values unless already mapped; nodes
   * are cloned in stored order, so producers are registered before their consumers.
   */
  public Graph cloneGraph(Graph graph) {
    return withErrorContext("cloneGraph", graph, () -> doCloneGraph(graph));
  }

  private Graph doCloneGraph(Graph graph) {
    List<Value> inputs = new ArrayList<>();
    for (Value input : graph.getInputs()) {
      inputs.add(cloneOrGetValue(input));
    }
    List<Value> initializers = new ArrayList<>();
    for (Value initializer : graph.getInitializers().values()) {
      initializers.add(cloneOrGetValue(initializer));
    }
    List<Node> nodes = new ArrayList<>();
    for (Node node : graph) {
      nodes.add(cloneNode(node));
    }
    List<Value> outputs = new ArrayList<>();
    for (Value output : graph.getOutputs()) {
      outputs.add(lookUpOutput(output));
    }

    return Graph.builder()
        .name(graph.getName())
        .inputs(inputs)
        .outputs(outputs)
        .initializers(initializers)
        .nodes(nodes)
        .opsetImports(graph.getOpsetImports())
        .docString(graph.getDocString())
        .metadataProps(graph.getMetadataProps())
        .build();
  }

  private Value lookUpOutput(Value output) {
    if (!valueMap.containsKey(output) && allowOuterScopeValues) {
      return output;
    }
    checkState(valueMap.containsKey(output), "Graph output %s was not cloned", output);
    Value newOutput = valueMap.get(output);
    checkState(newOutput != null, "Graph output %s is mapped to no value", output);
    return newOutput;
  }

  private static <T> T withErrorContext(String operation, Object argument, Supplier<T> body) {
    try {
      return body.get();
    } catch (RuntimeException e) {
      throw new CloneException(operation, argument, e);
    }
  }
}
