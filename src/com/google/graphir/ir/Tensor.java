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
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import org.jspecify.annotations.Nullable;

/**
 * An immutable constant payload. Tensors are never copied by the cloner; every clone of a value or
 * attribute that carries a tensor refers to the same instance.
 */
public final class Tensor {
  private final @Nullable String name;
  private final DataType dataType;
  private final Shape shape;
  private final byte[] rawData;

  public Tensor(@Nullable String name, DataType dataType, Shape shape, byte[] rawData) {
    checkNotNull(dataType);
    checkNotNull(shape);
    checkArgument(shape.isStatic(), "Constant tensors need a static shape: %s", shape);
    this.name = name;
    this.dataType = dataType;
    this.shape = shape;
    this.rawData = rawData.clone();
  }

  /** A little-endian FLOAT tensor holding {@code values} with the given shape. */
  public static Tensor ofFloats(@Nullable String name, Shape shape, float... values) {
    ByteBuffer buffer = ByteBuffer.allocate(values.length * 4).order(ByteOrder.LITTLE_ENDIAN);
    for (float v : values) {
      buffer.putFloat(v);
    }
    return new Tensor(name, DataType.FLOAT, shape, buffer.array());
  }

  /** A little-endian INT64 tensor holding {@code values} with the given shape. */
  public static Tensor ofLongs(@Nullable String name, Shape shape, long... values) {
    ByteBuffer buffer = ByteBuffer.allocate(values.length * 8).order(ByteOrder.LITTLE_ENDIAN);
    for (long v : values) {
      buffer.putLong(v);
    }
    return new Tensor(name, DataType.INT64, shape, buffer.array());
  }

  public @Nullable String getName() {
    return name;
  }

  public DataType getDataType() {
    return dataType;
  }

  public Shape getShape() {
    return shape;
  }

  public long size() {
    long size = 1;
    for (Object dim : shape.dims()) {
      size *= (Long) dim;
    }
    return size;
  }

  public byte[] toByteArray() {
    return rawData.clone();
  }

  /** Decodes a FLOAT tensor. */
  public ImmutableList<Float> floats() {
    checkArgument(dataType == DataType.FLOAT, "Not a FLOAT tensor: %s", this);
    ByteBuffer buffer = ByteBuffer.wrap(rawData).order(ByteOrder.LITTLE_ENDIAN);
    ImmutableList.Builder<Float> result = ImmutableList.builder();
    while (buffer.hasRemaining()) {
      result.add(buffer.getFloat());
    }
    return result.build();
  }

  @Override
  public String toString() {
    return "Tensor<" + dataType + "," + shape + ">(" + (name == null ? "" : name) + ")";
  }
}
