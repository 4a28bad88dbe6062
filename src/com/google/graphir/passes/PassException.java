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

import org.jspecify.annotations.Nullable;

/** A fatal error raised by a pass. The model may be partially rewritten when this is thrown. */
public class PassException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final IrError error;

  public PassException(IrError error) {
    this(error, null);
  }

  public PassException(IrError error, @Nullable Throwable cause) {
    super(error.toString(), cause);
    this.error = checkNotNull(error);
  }

  public IrError getError() {
    return error;
  }

  public DiagnosticType getType() {
    return error.type();
  }
}
