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

import com.google.common.base.MoreObjects;
import com.google.graphir.ir.Model;

/** The outcome of running a {@link ModelPass}. */
public class PassResult {
  private final Model model;
  private final boolean modified;

  public PassResult(Model model, boolean modified) {
    this.model = checkNotNull(model);
    this.modified = modified;
  }

  public Model getModel() {
    return model;
  }

  public boolean isModified() {
    return modified;
  }

  MoreObjects.ToStringHelper describe() {
    return MoreObjects.toStringHelper(this).add("modified", modified);
  }

  @Override
  public String toString() {
    return describe().toString();
  }
}
