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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.graphir.ir.Model;
import java.util.List;
import java.util.logging.Logger;

/**
 * Runs a sequence of in-place passes over a model, optionally repeating the sequence until it
 * stops changing anything.
 */
public final class PassManager extends InPlacePass {
  private static final Logger logger = Logger.getLogger(PassManager.class.getName());

  private final ImmutableList<InPlacePass> passes;
  private final int steps;
  private final boolean earlyStop;

  /**
   * @param passes The passes to run, in order.
   * @param steps How many times to run the whole sequence.
   * @param earlyStop Whether to stop after the first round that modified nothing.
   */
  public PassManager(List<? extends InPlacePass> passes, int steps, boolean earlyStop) {
    checkArgument(steps >= 1, "steps must be positive: %s", steps);
    this.passes = ImmutableList.copyOf(passes);
    this.steps = steps;
    this.earlyStop = earlyStop;
  }

  public PassManager(List<? extends InPlacePass> passes) {
    this(passes, 1, true);
  }

  @Override
  public PassResult call(Model model) {
    boolean anyModified = false;
    for (int step = 0; step < steps; step++) {
      boolean modified = false;
      for (InPlacePass pass : passes) {
        PassResult result = pass.apply(model);
        logger.fine(
            "Step "
                + step
                + ": "
                + pass.getName()
                + (result.isModified() ? " modified" : " no-op"));
        modified |= result.isModified();
      }
      anyModified |= modified;
      if (!modified && earlyStop) {
        logger.fine("No pass modified the model in step " + step + "; stopping early");
        break;
      }
    }
    return new PassResult(model, anyModified);
  }
}
