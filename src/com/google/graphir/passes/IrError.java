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

import static java.util.Objects.requireNonNull;

import com.google.graphir.ir.Node;
import java.io.Serializable;
import org.jspecify.annotations.Nullable;

/**
 * Rewrite error description.
 *
 * @param type A type of the error.
 * @param description Description of the error.
 * @param node Node the error is about, if there is one.
 */
public record IrError(DiagnosticType type, String description, @Nullable Node node)
    implements Serializable {
  public IrError {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
  }

  /**
   * Creates an IrError that is not tied to a node.
   *
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static IrError make(DiagnosticType type, String... arguments) {
    return new IrError(type, type.format(arguments), null);
  }

  /**
   * Creates an IrError about a node.
   *
   * @param n The node the error is reported on
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static IrError make(Node n, DiagnosticType type, String... arguments) {
    return new IrError(type, type.format(arguments), n);
  }

  @Override
  public String toString() {
    return type.key + ". " + description + (node == null ? "" : " at " + node);
  }
}
