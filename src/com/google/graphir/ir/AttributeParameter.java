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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import org.jspecify.annotations.Nullable;

/**
 * An attribute parameter declared by a {@link Function}.
 *
 * @param name The parameter name, as used by reference attributes in the function body.
 * @param type The declared attribute kind.
 * @param required Whether call sites must supply the attribute.
 * @param defaultValue The value used when a call site omits the attribute, if any.
 */
public record AttributeParameter(
    String name, AttributeType type, boolean required, @Nullable Attr defaultValue) {
  public AttributeParameter {
    requireNonNull(name, "name");
    requireNonNull(type, "type");
    if (defaultValue != null) {
      checkArgument(!defaultValue.isRef(), "Default of %s cannot be a reference", name);
      checkArgument(
          defaultValue.getType() == type,
          "Default of %s is %s, declared %s",
          name,
          defaultValue.getType(),
          type);
      if (!defaultValue.getName().equals(name)) {
        defaultValue = defaultValue.withName(name);
      }
    }
  }

  public static AttributeParameter required(String name, AttributeType type) {
    return new AttributeParameter(name, type, true, null);
  }

  public static AttributeParameter optional(String name, AttributeType type) {
    return new AttributeParameter(name, type, false, null);
  }

  public static AttributeParameter withDefault(Attr defaultValue) {
    return new AttributeParameter(
        defaultValue.getName(), defaultValue.getType(), false, defaultValue);
  }
}
