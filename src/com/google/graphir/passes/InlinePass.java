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

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.LinkedHashMultiset;
import com.google.common.collect.Multiset;
import com.google.graphir.ir.Attr;
import com.google.graphir.ir.AttributeParameter;
import com.google.graphir.ir.Function;
import com.google.graphir.ir.Graph;
import com.google.graphir.ir.GraphManipulations;
import com.google.graphir.ir.GraphTraversal;
import com.google.graphir.ir.Model;
import com.google.graphir.ir.Node;
import com.google.graphir.ir.OperatorIdentifier;
import com.google.graphir.ir.Value;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Inlines model-local functions into the main graph and into the bodies of functions that are
 * kept, then removes the functions that were inlined.
 *
 * <p>A node calls a function when its operator identity names a function of the model. Every call
 * accepted by the inlining criteria is replaced by a renamed copy of the function body, wired to
 * the call's inputs and feeding the call's consumers. Calls nested in subgraph attributes are
 * inlined as well, and so are calls that a function body makes to other functions.
 *
 * <p>The model must not contain cyclic function calls; {@link #requires} checks this before
 * anything is changed.
 */
public final class InlinePass extends InPlacePass {
  private static final Logger logger = Logger.getLogger(InlinePass.class.getName());

  static final DiagnosticType CYCLIC_FUNCTION_DEPENDENCY =
      DiagnosticType.error(
          "IR_CYCLIC_FUNCTION_DEPENDENCY", "Cyclic dependency detected between functions: {0}");

  static final DiagnosticType OPSET_VERSION_CONFLICT =
      DiagnosticType.error(
          "IR_OPSET_VERSION_CONFLICT",
          "Opset mismatch when inlining function {0}: domain \"{1}\" has version {2} in the model"
              + " but version {3} in the function");

  static final DiagnosticType UNSUPPORTED_GRAPH_ATTRIBUTE =
      DiagnosticType.error(
          "IR_UNSUPPORTED_GRAPH_ATTRIBUTE",
          "Cannot inline function {0}: graph attribute {1} cannot be passed to a function");

  static final DiagnosticType INPUT_COUNT_MISMATCH =
      DiagnosticType.error(
          "IR_INLINE_INPUT_COUNT_MISMATCH",
          "Input mismatch when inlining function {0}: call site has {1} inputs but the function"
              + " defines at most {2} inputs");

  private final @Nullable Predicate<Function> criteria;

  // State for one run of the pass, set up by reset().
  private Map<OperatorIdentifier, Function> functions = new LinkedHashMap<>();
  private Map<OperatorIdentifier, String> abbreviations = new HashMap<>();
  private Map<String, Integer> opsetImports = new LinkedHashMap<>();
  private NameDisambiguator names = new NameDisambiguator();
  private Map<Node, ImmutableList<String>> nodeContext = new HashMap<>();
  private Set<OperatorIdentifier> inlinedFunctions = new LinkedHashSet<>();

  /** Creates a pass that inlines every function call. */
  public InlinePass() {
    this(null);
  }

  /**
   * @param criteria Selects the functions whose calls are inlined; null inlines all of them.
   */
  public InlinePass(@Nullable Predicate<Function> criteria) {
    this.criteria = criteria;
  }

  private void reset(Model model) {
    functions = model.getFunctions();
    abbreviations = abbreviate(functions.keySet());
    opsetImports = model.getOpsetImports();
    names = new NameDisambiguator();
    nodeContext = new HashMap<>();
    inlinedFunctions = new LinkedHashSet<>();
  }

  @Override
  public void requires(Model model) {
    reset(model);
    new FunctionCycleDetector(model)
        .findCycle()
        .ifPresent(
            cycle -> {
              throw new PreconditionException(
                  IrError.make(CYCLIC_FUNCTION_DEPENDENCY, FunctionCycleDetector.format(cycle)));
            });
  }

  @Override
  public InlinePassResult call(Model model) {
    reset(model);
    Multiset<OperatorIdentifier> callCounts = LinkedHashMultiset.create();

    int inlined = inlineCallsIn(model.getGraph(), callCounts);

    // Functions kept because of the criteria may still call functions that can be inlined.
    for (Map.Entry<OperatorIdentifier, Function> entry : functions.entrySet()) {
      if (inlinedFunctions.contains(entry.getKey())) {
        continue;
      }
      inlined += inlineCallsIn(entry.getValue().getGraph(), callCounts);
    }

    for (OperatorIdentifier id : inlinedFunctions) {
      functions.remove(id);
    }

    logger.info(
        "Inlined "
            + inlined
            + " call site(s); removed "
            + inlinedFunctions.size()
            + " function(s): "
            + inlinedFunctions);
    return new InlinePassResult(model, inlined > 0, callCounts, inlined);
  }

  /**
   * Inlines the calls in {@code graph} and its subgraphs. Calls found directly in {@code graph} are
   * added to {@code callCounts}; those in subgraphs are not.
   *
   * @return the number of call sites inlined
   */
  private int inlineCallsIn(Graph graph, Multiset<OperatorIdentifier> callCounts) {
    names.seed(graph);
    Multiset<OperatorIdentifier> idCount = HashMultiset.create();
    for (Node node : graph) {
      OperatorIdentifier id = node.opIdentifier();
      if (functions.containsKey(id)) {
        idCount.add(id);
      }
    }
    callCounts.addAll(idCount);

    Multiset<OperatorIdentifier> nextId = HashMultiset.create();
    int inlined = 0;
    int i = 0;
    while (i < graph.getNodeCount()) {
      Node node = graph.getNode(i);
      OperatorIdentifier id = node.opIdentifier();
      Function function = functions.get(id);
      if (function == null) {
        for (Graph subgraph : GraphTraversal.subgraphsOf(node)) {
          inlined += inlineCallsIn(subgraph, HashMultiset.create());
        }
        i++;
        continue;
      }
      if (criteria != null && !criteria.test(function)) {
        i++;
        continue;
      }

      String callSitePrefix = "";
      if (idCount.count(id) > 1) {
        callSitePrefix = "_" + nextId.count(id);
        nextId.add(id);
      }
      String callSiteId =
          Strings.isNullOrEmpty(node.getName())
              ? abbreviations.get(id) + callSitePrefix
              : node.getName();

      CallReplacement replacement = instantiateCall(node, function, callSiteId);
      GraphManipulations.replaceNodesAndValues(
          graph,
          node,
          ImmutableList.of(node),
          replacement.nodes,
          node.getOutputs(),
          replacement.outputs);
      nodeContext.remove(node);
      inlinedFunctions.add(id);
      inlined++;
      // Stay at index i: the first inlined node now sits there, and it may itself be a call.
    }
    return inlined;
  }

  private static final class CallReplacement {
    final List<Node> nodes;
    final List<@Nullable Value> outputs;

    CallReplacement(List<Node> nodes, List<@Nullable Value> outputs) {
      this.nodes = nodes;
      this.outputs = outputs;
    }
  }

  private CallReplacement instantiateCall(Node call, Function function, String callSiteId) {
    OperatorIdentifier id = function.identifier();

    for (Map.Entry<String, Integer> entry : function.getOpsetImports().entrySet()) {
      Integer existing = opsetImports.get(entry.getKey());
      if (existing == null) {
        opsetImports.put(entry.getKey(), entry.getValue());
      } else if (!existing.equals(entry.getValue())) {
        throw new PassException(
            IrError.make(
                call,
                OPSET_VERSION_CONFLICT,
                id.toString(),
                entry.getKey(),
                existing.toString(),
                entry.getValue().toString()));
      }
    }

    Map<String, Attr> attributes = new LinkedHashMap<>(call.getAttributes());
    for (AttributeParameter param : function.getAttributes().values()) {
      Attr defaultValue = param.defaultValue();
      if (!attributes.containsKey(param.name()) && defaultValue != null) {
        attributes.put(param.name(), defaultValue);
      }
    }
    for (Attr attr : attributes.values()) {
      if (attr.getType().isGraphKind()) {
        throw new PassException(
            IrError.make(call, UNSUPPORTED_GRAPH_ATTRIBUTE, id.toString(), attr.getName()));
      }
    }

    List<@Nullable Value> callInputs = call.getInputs();
    List<Value> formalInputs = function.getInputs();
    if (callInputs.size() > formalInputs.size()) {
      throw new PassException(
          IrError.make(
              call,
              INPUT_COUNT_MISMATCH,
              id.toString(),
              String.valueOf(callInputs.size()),
              String.valueOf(formalInputs.size())));
    }
    Map<Value, @Nullable Value> valueMap = new LinkedHashMap<>();
    for (int i = 0; i < formalInputs.size(); i++) {
      // Missing trailing inputs are optional parameters the caller left out.
      valueMap.put(formalInputs.get(i), i < callInputs.size() ? callInputs.get(i) : null);
    }

    ImmutableList<String> callStack =
        ImmutableList.<String>builder()
            .addAll(nodeContext.getOrDefault(call, ImmutableList.of()))
            .add(callSiteId)
            .build();
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Inlining " + id + " at " + Joiner.on(" / ").join(callStack));
    }

    Cloner cloner =
        Cloner.builder()
            .attrMap(attributes)
            .valueMap(valueMap)
            .metadataProps(call.getMetadataProps())
            .postProcess(node -> rename(node, callStack))
            .resolveRefAttrs(true)
            .build();

    List<Node> nodes = new ArrayList<>();
    for (Node node : function) {
      nodes.add(cloner.cloneNode(node));
    }
    List<@Nullable Value> outputs = new ArrayList<>();
    for (Value output : function.getOutputs()) {
      outputs.add(valueMap.get(output));
    }
    return new CallReplacement(nodes, outputs);
  }

  /** Gives a cloned node and its outputs fresh names and records the call stack it came from. */
  private void rename(Node node, ImmutableList<String> callStack) {
    node.setName(names.uniqueNodeName(node.getName()));
    for (Value output : node.getOutputs()) {
      output.setName(names.uniqueValueName(output.getName()));
    }
    nodeContext.put(node, callStack);
  }

  /** The call stack of a node created by inlining, outermost call site first. */
  ImmutableList<String> getCallStack(Node node) {
    return nodeContext.getOrDefault(checkNotNull(node), ImmutableList.of());
  }

  /**
   * Short names for function identifiers: the function name, with the overload appended after an
   * underscore, and the domain prepended when another function shares the name and overload.
   */
  static ImmutableMap<OperatorIdentifier, String> abbreviate(Set<OperatorIdentifier> ids) {
    ImmutableMap.Builder<OperatorIdentifier, String> result = ImmutableMap.builder();
    for (OperatorIdentifier id : ids) {
      boolean ambiguous = false;
      for (OperatorIdentifier other : ids) {
        if (!other.domain().equals(id.domain())
            && other.name().equals(id.name())
            && other.overload().equals(id.overload())) {
          ambiguous = true;
          break;
        }
      }
      String abbreviation = ambiguous ? id.domain() + "_" + id.name() : id.name();
      if (!id.overload().isEmpty()) {
        abbreviation += "_" + id.overload();
      }
      result.put(id, abbreviation);
    }
    return result.buildOrThrow();
  }
}
