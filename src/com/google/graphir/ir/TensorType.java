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

import static java.util.Objects.requireNonNull;

/**
 * The static type of a {@link Value}: a tensor of a given element type.
 *
 * @param elementType the element type
 */
public record TensorType(DataType elementType) {
  public TensorType {
    requireNonNull(elementType, "elementType");
  }

  public static TensorType of(DataType elementType) {
    return new TensorType(elementType);
  }

  @Override
  public String toString() {
    return "Tensor(" + elementType + ")";
  }
}
