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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class AttrTest {

  @Test
  public void testConcreteAccessors() {
    assertThat(Attr.ofInt("axis", -1).asInt()).isEqualTo(-1L);
    assertThat(Attr.ofFloat("alpha", 0.5f).asFloat()).isEqualTo(0.5f);
    assertThat(Attr.ofString("mode", "nearest").asString()).isEqualTo("nearest");
    assertThat(Attr.ofInts("perm", ImmutableList.of(1L, 0L)).asInts()).containsExactly(1L, 0L);
  }

  @Test
  public void testPayloadMustMatchType() {
    assertThrows(IllegalArgumentException.class, () -> Attr.of("axis", AttributeType.INT, "1"));
    assertThrows(
        IllegalArgumentException.class,
        () -> Attr.of("perm", AttributeType.INTS, ImmutableList.of(1, 0)));
  }

  @Test
  public void testListPayloadIsCopied() {
    List<String> names = new ArrayList<>();
    names.add("a");
    Attr attr = Attr.of("names", AttributeType.STRINGS, names);
    names.add("b");

    assertThat(attr.asStrings()).containsExactly("a");
  }

  @Test
  public void testWrongKindAccessFails() {
    Attr attr = Attr.ofInt("axis", 0);

    assertThrows(IllegalStateException.class, attr::asFloat);
  }

  @Test
  public void testReferenceAttribute() {
    Attr ref = Attr.ref("alpha", "slope", AttributeType.FLOAT);

    assertThat(ref.isRef()).isTrue();
    assertThat(ref.getRefAttrName()).isEqualTo("slope");
    assertThat(ref.getValue()).isNull();
    assertThrows(IllegalStateException.class, ref::asFloat);
    assertThat(ref.toString()).isEqualTo("alpha=@slope:FLOAT");
  }

  @Test
  public void testConcreteAttributeHasNoReference() {
    assertThrows(IllegalStateException.class, () -> Attr.ofInt("axis", 0).getRefAttrName());
  }

  @Test
  public void testWithNameKeepsPayload() {
    Tensor tensor = Tensor.ofFloats("t", Shape.of(2), 1f, 2f);
    Attr renamed = Attr.ofTensor("value", tensor).withName("weights");

    assertThat(renamed.getName()).isEqualTo("weights");
    assertThat(renamed.asTensor()).isSameInstanceAs(tensor);
  }

  @Test
  public void testGraphKinds() {
    assertThat(AttributeType.GRAPH.isGraphKind()).isTrue();
    assertThat(AttributeType.GRAPHS.isGraphKind()).isTrue();
    assertThat(AttributeType.TENSOR.isGraphKind()).isFalse();
  }

  @Test
  public void testParameterDefaultIsRenamed() {
    AttributeParameter param =
        new AttributeParameter("alpha", AttributeType.FLOAT, false, Attr.ofFloat("x", 1f));

    assertThat(param.defaultValue().getName()).isEqualTo("alpha");
    assertThrows(
        IllegalArgumentException.class,
        () -> new AttributeParameter("alpha", AttributeType.INT, false, Attr.ofFloat("alpha", 1f)));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new AttributeParameter(
                "alpha", AttributeType.FLOAT, false, Attr.ref("alpha", "b", AttributeType.FLOAT)));
  }
}
