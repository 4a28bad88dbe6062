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

/**
 * Wraps a failure inside a {@link Cloner} operation with the operation name and its argument.
 * Recursive clones nest these, so the chain of causes reads from the outermost operation to the
 * original failure.
 */
public final class CloneException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String operation;

  CloneException(String operation, Object argument, Throwable cause) {
    super("In " + operation + " with args [" + argument + "]", cause);
    this.operation = operation;
  }

  /** The name of the cloner operation that failed, e.g. {@code cloneNode}. */
  public String getOperation() {
    return operation;
  }
}
