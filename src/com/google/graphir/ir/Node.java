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
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * An operator instance. A node consumes an ordered list of input values, where a slot may hold
 * no input, and owns freshly created output values.
 *
 * <p>A node belongs to at most one {@link Graph}; it is detached until added to one.
 */
public final class Node {
  private final String domain;
  private final String opType;
  private final String overload;
  private final @Nullable Integer version;
  private final List<@Nullable Value> inputs;
  private final ImmutableList<Value> outputs;
  private final Map<String, Attr> attributes = new LinkedHashMap<>();
  private final Map<String, String> metadataProps = new LinkedHashMap<>();
  private @Nullable String name;
  private @Nullable String docString;
  private @Nullable Graph graph;

  private Node(Builder builder) {
    this.domain = builder.domain;
    this.opType = builder.opType;
    this.overload = builder.overload;
    this.version = builder.version;
    this.name = builder.name;
    this.docString = builder.docString;
    this.inputs = new ArrayList<>(builder.inputs);
    for (int i = 0; i < inputs.size(); i++) {
      Value input = inputs.get(i);
      if (input != null) {
        input.addUsage(this, i);
      }
    }
    ImmutableList.Builder<Value> newOutputs = ImmutableList.builder();
    for (int i = 0; i < builder.numOutputs; i++) {
      newOutputs.add(new Value(this, i));
    }
    this.outputs = newOutputs.build();
    for (Attr attr : builder.attributes) {
      checkArgument(
          !attributes.containsKey(attr.getName()), "Duplicate attribute %s", attr.getName());
      attributes.put(attr.getName(), attr);
    }
    metadataProps.putAll(builder.metadataProps);
  }

  public static Builder builder(String domain, String opType) {
    return new Builder(domain, opType);
  }

  /** Builds a {@link Node}. Inputs may contain null entries for absent optional inputs. */
  public static final class Builder {
    private final String domain;
    private final String opType;
    private String overload = "";
    private @Nullable Integer version;
    private final List<@Nullable Value> inputs = new ArrayList<>();
    private final List<Attr> attributes = new ArrayList<>();
    private final Map<String, String> metadataProps = new LinkedHashMap<>();
    private int numOutputs = 1;
    private @Nullable String name;
    private @Nullable String docString;

    private Builder(String domain, String opType) {
      this.domain = checkNotNull(domain);
      this.opType = checkNotNull(opType);
    }

    @CanIgnoreReturnValue
    public Builder overload(String overload) {
      this.overload = checkNotNull(overload);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder version(@Nullable Integer version) {
      this.version = version;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder inputs(@Nullable Value... inputs) {
      return inputs(Arrays.asList(inputs));
    }

    @CanIgnoreReturnValue
    public Builder inputs(List<? extends @Nullable Value> inputs) {
      this.inputs.addAll(inputs);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder attribute(Attr attr) {
      this.attributes.add(checkNotNull(attr));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder attributes(Iterable<Attr> attrs) {
      for (Attr attr : attrs) {
        attribute(attr);
      }
      return this;
    }

    @CanIgnoreReturnValue
    public Builder metadataProps(Map<String, String> props) {
      this.metadataProps.putAll(props);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder numOutputs(int numOutputs) {
      checkArgument(numOutputs >= 0, "numOutputs must not be negative: %s", numOutputs);
      this.numOutputs = numOutputs;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder name(@Nullable String name) {
      this.name = name;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder docString(@Nullable String docString) {
      this.docString = docString;
      return this;
    }

    public Node build() {
      return new Node(this);
    }
  }

  public String getDomain() {
    return domain;
  }

  public String getOpType() {
    return opType;
  }

  public String getOverload() {
    return overload;
  }

  /** The explicit opset version of this node, or null to use the graph's opset import. */
  public @Nullable Integer getVersion() {
    return version;
  }

  public OperatorIdentifier opIdentifier() {
    return new OperatorIdentifier(domain, opType, overload);
  }

  /** The inputs of this node; entries are null where no input is given. */
  public List<@Nullable Value> getInputs() {
    return Collections.unmodifiableList(inputs);
  }

  public @Nullable Value getInput(int index) {
    return inputs.get(index);
  }

  public ImmutableList<Value> getOutputs() {
    return outputs;
  }

  public Value getOutput(int index) {
    return outputs.get(index);
  }

  /** Replaces the input at {@code index}, keeping the usages of old and new value in sync. */
  public void replaceInputWith(int index, @Nullable Value value) {
    checkElementIndex(index, inputs.size());
    Value old = inputs.get(index);
    if (old == value) {
      return;
    }
    if (old != null) {
      old.removeUsage(this, index);
    }
    inputs.set(index, value);
    if (value != null) {
      value.addUsage(this, index);
    }
  }

  /** Drops the usages this node registered on its inputs. Called when the node leaves a graph. */
  void detachInputs() {
    for (int i = 0; i < inputs.size(); i++) {
      Value input = inputs.get(i);
      if (input != null) {
        input.removeUsage(this, i);
      }
    }
  }

  public ImmutableMap<String, Attr> getAttributes() {
    return ImmutableMap.copyOf(attributes);
  }

  public @Nullable Attr getAttribute(String name) {
    return attributes.get(name);
  }

  public void setAttribute(Attr attr) {
    attributes.put(attr.getName(), attr);
  }

  public @Nullable Attr removeAttribute(String name) {
    return attributes.remove(name);
  }

  /** The live metadata map of this node. */
  public Map<String, String> getMetadataProps() {
    return metadataProps;
  }

  public @Nullable String getName() {
    return name;
  }

  public void setName(@Nullable String name) {
    this.name = name;
  }

  public @Nullable String getDocString() {
    return docString;
  }

  public @Nullable Graph getGraph() {
    return graph;
  }

  void setGraph(@Nullable Graph graph) {
    checkState(
        graph == null || this.graph == null, "%s already belongs to graph %s", this, this.graph);
    this.graph = graph;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(Joiner.on(", ").join(outputs)).append(" = ");
    sb.append(opIdentifier());
    if (version != null) {
      sb.append('@').append(version);
    }
    sb.append('(');
    Joiner.on(", ").useForNull("None").appendTo(sb, inputs);
    sb.append(')');
    if (!attributes.isEmpty()) {
      sb.append(" {");
      Joiner.on(", ").appendTo(sb, attributes.values());
      sb.append('}');
    }
    if (name != null) {
      sb.append(" [").append(name).append(']');
    }
    return sb.toString();
  }
}
