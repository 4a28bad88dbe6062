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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A model-local function: a reusable body graph with formal inputs, outputs and declared
 * attribute parameters. Nodes whose operator identity equals {@link #identifier()} call it.
 */
public final class Function implements Iterable<Node> {
  private final String domain;
  private final String name;
  private final String overload;
  private final Graph graph;
  private final ImmutableMap<String, AttributeParameter> attributes;

  public Function(
      String domain,
      String name,
      String overload,
      Graph graph,
      List<AttributeParameter> attributes) {
    this.domain = checkNotNull(domain);
    this.name = checkNotNull(name);
    this.overload = checkNotNull(overload);
    this.graph = checkNotNull(graph);
    checkArgument(
        graph.getInitializers().isEmpty(),
        "Function %s cannot have initializers",
        identifier());
    Map<String, AttributeParameter> params = new LinkedHashMap<>();
    for (AttributeParameter param : attributes) {
      checkArgument(
          params.put(param.name(), param) == null,
          "Duplicate attribute parameter %s in function %s",
          param.name(),
          identifier());
    }
    this.attributes = ImmutableMap.copyOf(params);
  }

  public Function(String domain, String name, Graph graph, List<AttributeParameter> attributes) {
    this(domain, name, "", graph, attributes);
  }

  public OperatorIdentifier identifier() {
    return new OperatorIdentifier(domain, name, overload);
  }

  public String getDomain() {
    return domain;
  }

  public String getName() {
    return name;
  }

  public String getOverload() {
    return overload;
  }

  /** The body of this function. */
  public Graph getGraph() {
    return graph;
  }

  public ImmutableList<Value> getInputs() {
    return graph.getInputs();
  }

  public ImmutableList<Value> getOutputs() {
    return graph.getOutputs();
  }

  public ImmutableMap<String, AttributeParameter> getAttributes() {
    return attributes;
  }

  public Map<String, Integer> getOpsetImports() {
    return graph.getOpsetImports();
  }

  @Override
  public Iterator<Node> iterator() {
    return graph.iterator();
  }

  @Override
  public String toString() {
    return "Function(" + identifier() + ", " + graph.getNodeCount() + " nodes)";
  }
}
