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
package net.timber.storage;

import java.util.Collection;
import java.util.List;
import java.util.SortedMap;

import net.timber.data.TimeStamp;
import net.timber.data.Variable;
import net.timber.data.VariableSet;
import net.timber.meta.HierarchyGroup;

/**
 * The meta data side of the logging service: variable discovery, the
 * grouping hierarchy and vector element names.
 * <p>
 * Implementations may throw {@link net.timber.exceptions.QueryExecutionException}
 * on remote failures. Collections returned are never null; an empty one
 * means nothing matched.
 *
 * @since 1.0
 */
public interface MetaService {

  /**
   * Finds the variables whose names match a pattern where {@code %} stands
   * for any sequence of characters.
   * @param pattern A non-null pattern.
   * @return The matches in backend discovery order, possibly empty.
   */
  public VariableSet findVariablesLike(final String pattern);

  /**
   * Finds the variables with the given exact names. Unknown names are
   * skipped.
   * @param names A non-null collection of names.
   * @return The variables found, in no guaranteed order.
   */
  public VariableSet findVariablesByName(final Collection<String> names);

  /**
   * Finds the fundamental variables matching a pattern that had data in the
   * window.
   * @param start The inclusive start of the window.
   * @param end The inclusive end of the window.
   * @param pattern A non-null pattern.
   * @return The fundamentals, possibly empty.
   */
  public VariableSet getFundamentals(final TimeStamp start,
                                     final TimeStamp end,
                                     final String pattern);

  /** @return The top level groupings of the hierarchy, possibly empty. */
  public List<HierarchyGroup> getTopLevelHierarchies();

  /**
   * @param group A non-null grouping.
   * @return The direct children of the grouping, possibly empty.
   */
  public List<HierarchyGroup> getChildHierarchies(final HierarchyGroup group);

  /**
   * @param group A non-null grouping.
   * @return The variables attached directly to the grouping, possibly empty.
   */
  public VariableSet getVariablesAttachedTo(final HierarchyGroup group);

  /**
   * Returns the element names of a vector variable keyed by the time they
   * became valid.
   * @param variable A non-null variable.
   * @return The element names over time, possibly empty.
   */
  public SortedMap<TimeStamp, List<String>> getVectorElements(
      final Variable variable);
}
