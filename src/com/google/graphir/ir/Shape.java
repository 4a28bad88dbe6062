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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * An immutable tensor shape. Each dimension is either a {@link Long} extent or a {@link String}
 * naming a symbolic dimension.
 *
 * <p>Shapes are immutable, so values may share them freely.
 */
public final class Shape {
  private final ImmutableList<Object> dims;

  private Shape(ImmutableList<Object> dims) {
    for (Object dim : dims) {
      checkArgument(
          dim instanceof Long || dim instanceof String,
          "Dimension must be a Long or a symbolic String, got %s",
          dim);
    }
    this.dims = dims;
  }

  /** Creates a shape from a mix of {@code Long}/{@code Integer} extents and symbolic names. */
  public static Shape of(Object... dims) {
    ImmutableList.Builder<Object> builder = ImmutableList.builder();
    for (Object dim : dims) {
      builder.add(dim instanceof Integer ? Long.valueOf((Integer) dim) : dim);
    }
    return new Shape(builder.build());
  }

  public static Shape scalar() {
    return new Shape(ImmutableList.of());
  }

  public int rank() {
    return dims.size();
  }

  public Object dim(int index) {
    return dims.get(index);
  }

  public ImmutableList<Object> dims() {
    return dims;
  }

  /** Whether every dimension has a known extent. */
  public boolean isStatic() {
    return dims.stream().allMatch(d -> d instanceof Long);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Shape && ((Shape) o).dims.equals(dims);
  }

  @Override
  public int hashCode() {
    return dims.hashCode();
  }

  @Override
  public String toString() {
    return "[" + Joiner.on(",").join(dims) + "]";
  }
}
