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

import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** The root container: a main graph and the functions it may call. */
public final class Model {
  private final Graph graph;
  private final Map<OperatorIdentifier, Function> functions = new LinkedHashMap<>();
  private final int irVersion;
  private @Nullable String producerName;
  private @Nullable String docString;

  public Model(Graph graph, int irVersion) {
    this.graph = checkNotNull(graph);
    this.irVersion = irVersion;
  }

  public Graph getGraph() {
    return graph;
  }

  /** The live function table. Passes add and delete entries in place. */
  public Map<OperatorIdentifier, Function> getFunctions() {
    return functions;
  }

  public void addFunction(Function function) {
    OperatorIdentifier id = function.identifier();
    checkArgument(!functions.containsKey(id), "Duplicate function %s", id);
    functions.put(id, function);
  }

  /** The model-wide opset table, which is the main graph's. */
  public Map<String, Integer> getOpsetImports() {
    return graph.getOpsetImports();
  }

  public int getIrVersion() {
    return irVersion;
  }

  public @Nullable String getProducerName() {
    return producerName;
  }

  public void setProducerName(@Nullable String producerName) {
    this.producerName = producerName;
  }

  public @Nullable String getDocString() {
    return docString;
  }

  public void setDocString(@Nullable String docString) {
    this.docString = docString;
  }

  @Override
  public String toString() {
    return "Model(ir_version="
        + irVersion
        + ", "
        + graph
        + ", functions="
        + functions.keySet()
        + ")";
  }
}
