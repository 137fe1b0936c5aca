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

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

/**
 * Selects the variables of a query: either a pattern where {@code %}
 * matches any sequence of characters, or an explicit list of names.
 *
 * @since 1.0
 */
public final class VariableSelector {

  /** The pattern, null for name lists. */
  private final String pattern;

  /** The names in input order without duplicates, empty for patterns. */
  private final List<String> names;

  private VariableSelector(final String pattern, final List<String> names) {
    this.pattern = pattern;
    this.names = names;
  }

  /**
   * @param pattern A non-null and non-empty pattern.
   * @return A pattern selector.
   * @throws IllegalArgumentException if the pattern was null or empty.
   */
  public static VariableSelector pattern(final String pattern) {
    if (Strings.isNullOrEmpty(pattern)) {
      throw new IllegalArgumentException("Pattern cannot be null or empty.");
    }
    return new VariableSelector(pattern, ImmutableList.<String>of());
  }

  /**
   * @param names Variable names. Duplicates are removed, the first
   * occurrence keeps its position.
   * @return A name list selector.
   */
  public static VariableSelector names(final String... names) {
    if (names == null) {
      throw new IllegalArgumentException("Names cannot be null.");
    }
    return names(Arrays.asList(names));
  }

  /**
   * @param names A non-null collection of names. Duplicates are removed, the
   * first occurrence keeps its position.
   * @return A name list selector.
   * @throws IllegalArgumentException if the collection or a name was null or
   * empty.
   */
  public static VariableSelector names(final Collection<String> names) {
    if (names == null) {
      throw new IllegalArgumentException("Names cannot be null.");
    }
    final LinkedHashSet<String> unique = new LinkedHashSet<String>();
    for (final String name : names) {
      if (Strings.isNullOrEmpty(name)) {
        throw new IllegalArgumentException("Variable names cannot be null "
            + "or empty: " + names);
      }
      unique.add(name);
    }
    return new VariableSelector(null, ImmutableList.copyOf(unique));
  }

  /** @return True if this is a pattern selector. */
  public boolean isPattern() {
    return pattern != null;
  }

  /** @return The pattern, null for name lists. */
  public String getPattern() {
    return pattern;
  }

  /** @return The unique names in input order, empty for patterns. */
  public List<String> getNames() {
    return names;
  }

  @Override
  public String toString() {
    return isPattern() ? pattern : names.toString();
  }
}
