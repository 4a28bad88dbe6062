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
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A named node attribute.
 *
 * <p>An attribute is either <em>concrete</em>, holding a payload whose Java type is fixed by its
 * {@link AttributeType}, or a <em>reference</em> naming an attribute parameter of the enclosing
 * function. References are only meaningful inside a function body and are bound when the
 * function is called.
 *
 * <p>Payloads other than subgraphs are immutable and may be shared between attributes.
 */
public final class Attr {
  private final String name;
  private final AttributeType type;
  private final @Nullable Object value;
  private final @Nullable String refAttrName;
  private final @Nullable String docString;

  private Attr(
      String name,
      AttributeType type,
      @Nullable Object value,
      @Nullable String refAttrName,
      @Nullable String docString) {
    this.name = checkNotNull(name);
    this.type = checkNotNull(type);
    this.value = value;
    this.refAttrName = refAttrName;
    this.docString = docString;
  }

  /**
   * Creates a concrete attribute, checking that {@code value} matches {@code type}.
   *
   * @throws IllegalArgumentException if the payload does not fit the type
   */
  public static Attr of(String name, AttributeType type, Object value, @Nullable String docString) {
    return new Attr(name, type, checkPayload(type, value), null, docString);
  }

  public static Attr of(String name, AttributeType type, Object value) {
    return of(name, type, value, null);
  }

  /** Creates a reference to the attribute parameter {@code refAttrName} of its function. */
  public static Attr ref(
      String name, String refAttrName, AttributeType type, @Nullable String docString) {
    checkNotNull(refAttrName, "Reference attribute must have a name");
    return new Attr(name, type, null, refAttrName, docString);
  }

  public static Attr ref(String name, String refAttrName, AttributeType type) {
    return ref(name, refAttrName, type, null);
  }

  public static Attr ofFloat(String name, float value) {
    return of(name, AttributeType.FLOAT, value);
  }

  public static Attr ofInt(String name, long value) {
    return of(name, AttributeType.INT, value);
  }

  public static Attr ofString(String name, String value) {
    return of(name, AttributeType.STRING, value);
  }

  public static Attr ofTensor(String name, Tensor value) {
    return of(name, AttributeType.TENSOR, value);
  }

  public static Attr ofGraph(String name, Graph value) {
    return of(name, AttributeType.GRAPH, value);
  }

  public static Attr ofGraphs(String name, List<Graph> value) {
    return of(name, AttributeType.GRAPHS, ImmutableList.copyOf(value));
  }

  public static Attr ofInts(String name, List<Long> value) {
    return of(name, AttributeType.INTS, ImmutableList.copyOf(value));
  }

  public static Attr ofFloats(String name, List<Float> value) {
    return of(name, AttributeType.FLOATS, ImmutableList.copyOf(value));
  }

  public static Attr ofStrings(String name, List<String> value) {
    return of(name, AttributeType.STRINGS, ImmutableList.copyOf(value));
  }

  private static Object checkPayload(AttributeType type, Object value) {
    checkNotNull(value, "Concrete attribute of type %s needs a value", type);
    boolean ok;
    switch (type) {
      case FLOAT:
        ok = value instanceof Float;
        break;
      case INT:
        ok = value instanceof Long;
        break;
      case STRING:
        ok = value instanceof String;
        break;
      case TENSOR:
        ok = value instanceof Tensor;
        break;
      case GRAPH:
        ok = value instanceof Graph;
        break;
      case FLOATS:
        ok = isListOf(value, Float.class);
        break;
      case INTS:
        ok = isListOf(value, Long.class);
        break;
      case STRINGS:
        ok = isListOf(value, String.class);
        break;
      case TENSORS:
        ok = isListOf(value, Tensor.class);
        break;
      case GRAPHS:
        ok = isListOf(value, Graph.class);
        break;
      default:
        throw new AssertionError(type);
    }
    checkArgument(ok, "Value %s does not match attribute type %s", value, type);
    if (value instanceof List && !(value instanceof ImmutableList)) {
      return ImmutableList.copyOf((List<?>) value);
    }
    return value;
  }

  private static boolean isListOf(Object value, Class<?> elementClass) {
    if (!(value instanceof List)) {
      return false;
    }
    for (Object element : (List<?>) value) {
      if (!elementClass.isInstance(element)) {
        return false;
      }
    }
    return true;
  }

  public String getName() {
    return name;
  }

  public AttributeType getType() {
    return type;
  }

  /** The concrete payload, or null for a reference attribute. */
  public @Nullable Object getValue() {
    return value;
  }

  public @Nullable String getDocString() {
    return docString;
  }

  public boolean isRef() {
    return refAttrName != null;
  }

  /** The name of the function attribute parameter this attribute refers to. */
  public String getRefAttrName() {
    checkState(refAttrName != null, "%s is not a reference attribute", this);
    return refAttrName;
  }

  /** Returns a copy of this attribute under a different name. */
  public Attr withName(String newName) {
    return new Attr(newName, type, value, refAttrName, docString);
  }

  public Graph asGraph() {
    return (Graph) checkKind(AttributeType.GRAPH);
  }

  @SuppressWarnings("unchecked")
  public ImmutableList<Graph> asGraphs() {
    return (ImmutableList<Graph>) checkKind(AttributeType.GRAPHS);
  }

  public float asFloat() {
    return (Float) checkKind(AttributeType.FLOAT);
  }

  public long asInt() {
    return (Long) checkKind(AttributeType.INT);
  }

  public String asString() {
    return (String) checkKind(AttributeType.STRING);
  }

  public Tensor asTensor() {
    return (Tensor) checkKind(AttributeType.TENSOR);
  }

  @SuppressWarnings("unchecked")
  public ImmutableList<Long> asInts() {
    return (ImmutableList<Long>) checkKind(AttributeType.INTS);
  }

  @SuppressWarnings("unchecked")
  public ImmutableList<Float> asFloats() {
    return (ImmutableList<Float>) checkKind(AttributeType.FLOATS);
  }

  @SuppressWarnings("unchecked")
  public ImmutableList<String> asStrings() {
    return (ImmutableList<String>) checkKind(AttributeType.STRINGS);
  }

  private Object checkKind(AttributeType expected) {
    checkState(!isRef(), "Reference attribute %s has no value", this);
    checkState(type == expected, "Attribute %s is %s, not %s", name, type, expected);
    return value;
  }

  @Override
  public String toString() {
    if (isRef()) {
      return name + "=@" + refAttrName + ":" + type;
    }
    if (type == AttributeType.GRAPH) {
      return name + "=<graph " + ((Graph) value).getName() + ">";
    }
    if (type == AttributeType.GRAPHS) {
      return name + "=<" + ((List<?>) value).size() + " graphs>";
    }
    return name + "=" + value;
  }
}
