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

import static com.google.common.base.MoreObjects.toStringHelper;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.graphir.ir.Graph;
import com.google.graphir.ir.Node;
import com.google.graphir.ir.Value;
import java.util.HashSet;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Hands out node and value names that have not been used yet.
 *
 * <p>Names accumulate for the lifetime of the disambiguator, so every graph scope seeded into it
 * shares one namespace. A clash is resolved by appending {@code _2}, {@code _3}, ... to the
 * requested name.
 */
public final class NameDisambiguator {

  static final String DEFAULT_NODE_NAME = "node";
  static final String DEFAULT_VALUE_NAME = "val";

  private final Set<String> usedNodeNames = new HashSet<>();
  private final Set<String> usedValueNames = new HashSet<>();

  /**
   * Marks every name already present in {@code graph} as used: input, initializer, node and node
   * output names. Subgraphs are not visited; they are seeded when they are processed.
   */
  public void seed(Graph graph) {
    for (Value input : graph.getInputs()) {
      reserveValueName(input.getName());
    }
    for (String initializer : graph.getInitializers().keySet()) {
      reserveValueName(initializer);
    }
    for (Node node : graph) {
      reserveNodeName(node.getName());
      for (Value output : node.getOutputs()) {
        reserveValueName(output.getName());
      }
    }
  }

  public void reserveNodeName(@Nullable String name) {
    if (name != null) {
      usedNodeNames.add(name);
    }
  }

  public void reserveValueName(@Nullable String name) {
    if (name != null) {
      usedValueNames.add(name);
    }
  }

  /** Returns an unused node name derived from {@code name}, or from "node" if it has none. */
  public String uniqueNodeName(@Nullable String name) {
    return makeUnique(Strings.isNullOrEmpty(name) ? DEFAULT_NODE_NAME : name, usedNodeNames);
  }

  /** Returns an unused value name derived from {@code name}, or from "val" if it has none. */
  public String uniqueValueName(@Nullable String name) {
    return makeUnique(Strings.isNullOrEmpty(name) ? DEFAULT_VALUE_NAME : name, usedValueNames);
  }

  @VisibleForTesting
  boolean isNodeNameUsed(String name) {
    return usedNodeNames.contains(name);
  }

  @VisibleForTesting
  boolean isValueNameUsed(String name) {
    return usedValueNames.contains(name);
  }

  private static String makeUnique(String name, Set<String> usedNames) {
    String candidate = name;
    int i = 1;
    while (usedNames.contains(candidate)) {
      i++;
      candidate = name + "_" + i;
    }
    usedNames.add(candidate);
    return candidate;
  }

  @Override
  public String toString() {
    return toStringHelper(this)
        .add("usedNodeNames", usedNodeNames.size())
        .add("usedValueNames", usedValueNames.size())
        .toString();
  }
}
