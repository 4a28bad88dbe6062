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

import com.google.graphir.ir.Model;

/**
 * A pass that mutates the model it is given and returns that same model.
 *
 * <p>There is no rollback: callers that may need to discard a partial rewrite should run the pass
 * on a copy.
 */
public abstract class InPlacePass implements ModelPass {

  static final DiagnosticType PRECONDITION_FAILED =
      DiagnosticType.error("IR_PRECONDITION_FAILED", "Pre-condition for pass {0} failed: {1}");

  static final DiagnosticType POSTCONDITION_FAILED =
      DiagnosticType.error("IR_POSTCONDITION_FAILED", "Post-condition for pass {0} failed: {1}");

  static final DiagnosticType PASS_NOT_IN_PLACE =
      DiagnosticType.error(
          "IR_PASS_NOT_IN_PLACE", "In-place pass {0} returned a different model than it was given");

  /** Runs {@link #requires}, {@link #call} and {@link #ensures} on {@code model}, in that order. */
  public final PassResult apply(Model model) {
    try {
      requires(model);
    } catch (PreconditionException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new PreconditionException(
          IrError.make(PRECONDITION_FAILED, getName(), String.valueOf(e.getMessage())), e);
    }

    PassResult result = call(model);
    if (result.getModel() != model) {
      throw new PassException(IrError.make(PASS_NOT_IN_PLACE, getName()));
    }

    try {
      ensures(model);
    } catch (PostconditionException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new PostconditionException(
          IrError.make(POSTCONDITION_FAILED, getName(), String.valueOf(e.getMessage())), e);
    }
    return result;
  }

  /** A short human readable name, used in diagnostics and logs. */
  public String getName() {
    return getClass().getSimpleName();
  }
}
