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
 * Identifies an operator or a model-local function.
 *
 * @param domain The operator domain; the empty string is the default domain.
 * @param name The operator type or function name.
 * @param overload Distinguishes functions sharing a domain and name; usually empty.
 */
public record OperatorIdentifier(String domain, String name, String overload) {
  public OperatorIdentifier {
    requireNonNull(domain, "domain");
    requireNonNull(name, "name");
    requireNonNull(overload, "overload");
  }

  public static OperatorIdentifier of(String domain, String name) {
    return new OperatorIdentifier(domain, name, "");
  }

  public static OperatorIdentifier of(String domain, String name, String overload) {
    return new OperatorIdentifier(domain, name, overload);
  }

  /** Formats as {@code domain::name}, followed by {@code :overload} when there is one. */
  @Override
  public String toString() {
    return domain + "::" + name + (overload.isEmpty() ? "" : ":" + overload);
  }
}
