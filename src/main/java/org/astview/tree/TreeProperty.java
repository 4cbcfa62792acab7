/*
 * Copyright 2025 The AstView Authors
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

package org.astview.tree;

import org.jspecify.annotations.Nullable;

/**
 * One row of a {@link TreeNode}'s property table.
 *
 * @param name the property name, e.g. {@code "lineNumber"}
 * @param value the property's value converted to a String, or null if it could not be read
 * @param type the simple name of the property's declared type
 */
public record TreeProperty(String name, @Nullable String value, String type) {

  @Override
  public String toString() {
    return String.format("%s=%s (%s)", name, value, type);
  }
}
