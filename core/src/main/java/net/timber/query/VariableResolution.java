// This file is part of Timber.
// Copyright (C) 2026  The Timber Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.timber.query;

import java.util.List;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import net.timber.data.VariableSet;

/**
 * The outcome of resolving a {@link VariableSelector}: the variables that
 * exist and, for name lists, the names that don't.
 *
 * @since 1.0
 */
public final class VariableResolution {

  private final VariableSet variables;
  private final List<String> missing;

  /**
   * Default ctor.
   * @param variables The variables found, in resolution order.
   * @param missing The names that were not found, may be null.
   */
  public VariableResolution(final VariableSet variables,
                            final List<String> missing) {
    if (variables == null) {
      throw new IllegalArgumentException("Variables cannot be null.");
    }
    this.variables = variables;
    this.missing = missing == null ?
        ImmutableList.<String>of() : ImmutableList.copyOf(missing);
  }

  /** @return The variables found, possibly empty. */
  public VariableSet getVariables() {
    return variables;
  }

  /** @return The requested names that were not found. */
  public List<String> getMissing() {
    return missing;
  }

  /** @return True if nothing was found. */
  public boolean isEmpty() {
    return variables.isEmpty();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("variables", variables)
        .add("missing", missing)
        .toString();
  }
}
