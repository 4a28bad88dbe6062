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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.Multiset;
import com.google.graphir.ir.Model;
import com.google.graphir.ir.OperatorIdentifier;

/** The outcome of an {@link InlinePass} run. */
public final class InlinePassResult extends PassResult {
  private final ImmutableMultiset<OperatorIdentifier> callCounts;
  private final int inlinedCount;

  InlinePassResult(
      Model model, boolean modified, Multiset<OperatorIdentifier> callCounts, int inlinedCount) {
    super(model, modified);
    this.callCounts = ImmutableMultiset.copyOf(callCounts);
    this.inlinedCount = inlinedCount;
  }

  /**
   * How many call nodes targeted each function, counted over the main graph and the bodies of the
   * functions that were not inlined. Calls inside subgraphs are not counted.
   */
  public ImmutableMultiset<OperatorIdentifier> getCallCounts() {
    return callCounts;
  }

  /** The number of call sites replaced, including those inside subgraphs. */
  public int getInlinedCount() {
    return inlinedCount;
  }

  @Override
  MoreObjects.ToStringHelper describe() {
    return super.describe().add("callCounts", callCounts).add("inlinedCount", inlinedCount);
  }
}
