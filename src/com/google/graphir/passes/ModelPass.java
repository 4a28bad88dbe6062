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
 * Interface for classes that rewrite a model.
 *
 * <p>Callers run {@link #requires} before {@link #call} and {@link #ensures} after it; {@link
 * InPlacePass#apply} does this. Passes are not thread safe, and a model must not be handed to two
 * passes at once.
 */
public interface ModelPass {

  /**
   * Checks the preconditions of this pass. Must not change the model.
   *
   * @throws PreconditionException if the pass cannot run on {@code model}
   */
  default void requires(Model model) {}

  /**
   * Rewrites the model.
   *
   * @return the rewritten model and whether anything changed
   */
  PassResult call(Model model);

  /**
   * Checks the postconditions of this pass.
   *
   * @throws PostconditionException if the pass left the model in an unexpected state
   */
  default void ensures(Model model) {}
}
