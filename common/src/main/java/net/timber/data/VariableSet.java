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
package net.timber.data;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * An ordered set of variables keyed by name. The first occurrence of a name
 * wins and keeps its position, later duplicates are ignored.
 *
 * @since 1.0
 */
public final class VariableSet implements Iterable<Variable> {
  private static final VariableSet EMPTY = new VariableSet(
      Collections.<Variable>emptyList());

  /** The variables keyed by name in insertion order. */
  private final Map<String, Variable> variables;

  /**
   * Default ctor.
   * @param variables A non-null collection of variables. Nulls are skipped.
   * @throws IllegalArgumentException if the collection was null.
   */
  public VariableSet(final Iterable<Variable> variables) {
    if (variables == null) {
      throw new IllegalArgumentException("Variables cannot be null.");
    }
    final Map<String, Variable> map = new LinkedHashMap<String, Variable>();
    for (final Variable variable : variables) {
      if (variable != null && !map.containsKey(variable.getVariableName())) {
        map.put(variable.getVariableName(), variable);
      }
    }
    this.variables = Collections.unmodifiableMap(map);
  }

  /** @return A shared empty set. */
  public static VariableSet empty() {
    return EMPTY;
  }

  /**
   * @param name The variable name.
   * @return The variable or null if it's not in the set.
   */
  public Variable getVariable(final String name) {
    return name == null ? null : variables.get(name);
  }

  /**
   * @param index An index from 0 to {@link #size()} exclusive.
   * @return The variable at the index.
   * @throws IndexOutOfBoundsException if the index was out of range.
   */
  public Variable getVariable(final int index) {
    return getVariables().get(index);
  }

  /**
   * @param name The variable name.
   * @return True if the set holds a variable with the name.
   */
  public boolean contains(final String name) {
    return name != null && variables.containsKey(name);
  }

  /** @return The variables in order. */
  public List<Variable> getVariables() {
    return ImmutableList.copyOf(variables.values());
  }

  /** @return The variable names in order. */
  public List<String> getVariableNames() {
    return ImmutableList.copyOf(variables.keySet());
  }

  /** @return The number of variables. */
  public int size() {
    return variables.size();
  }

  /** @return True if the set is empty. */
  public boolean isEmpty() {
    return variables.isEmpty();
  }

  @Override
  public Iterator<Variable> iterator() {
    return variables.values().iterator();
  }

  @Override
  public String toString() {
    return "[" + Joiner.on(", ").join(variables.keySet()) + "]";
  }
}
