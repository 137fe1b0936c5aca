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

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.timber.data.Variable;
import net.timber.data.VariableSet;
import net.timber.storage.MetaService;

/**
 * Turns a {@link VariableSelector} into the variable handles of the meta
 * data service.
 * <p>
 * Patterns keep the backend's discovery order. Name lists keep the caller's
 * order; names the backend doesn't know are dropped and reported in the
 * {@link VariableResolution} with a warning.
 *
 * @since 1.0
 */
public class VariableResolver {
  private static final Logger LOG = LoggerFactory.getLogger(
      VariableResolver.class);

  /** The meta data service. */
  private final MetaService meta_service;

  /**
   * Default ctor.
   * @param meta_service A non-null meta data service.
   * @throws IllegalArgumentException if the service was null.
   */
  public VariableResolver(final MetaService meta_service) {
    if (meta_service == null) {
      throw new IllegalArgumentException("Meta service cannot be null.");
    }
    this.meta_service = meta_service;
  }

  /**
   * Resolves the selector.
   * @param selector A non-null selector.
   * @return The resolution, never null. Nothing found is not an error.
   * @throws IllegalArgumentException if the selector was null.
   */
  public VariableResolution resolve(final VariableSelector selector) {
    if (selector == null) {
      throw new IllegalArgumentException("Selector cannot be null.");
    }
    final VariableResolution resolution;
    if (selector.isPattern()) {
      resolution = new VariableResolution(
          meta_service.findVariablesLike(selector.getPattern()), null);
    } else {
      resolution = resolveNames(selector.getNames());
    }
    if (!resolution.isEmpty()) {
      LOG.info("List of variables to be queried: "
          + resolution.getVariables().getVariableNames());
    }
    return resolution;
  }

  private VariableResolution resolveNames(final List<String> names) {
    if (names.isEmpty()) {
      return new VariableResolution(VariableSet.empty(), null);
    }
    final VariableSet found = meta_service.findVariablesByName(names);
    final List<Variable> ordered = new ArrayList<Variable>(names.size());
    final List<String> missing = new ArrayList<String>();
    for (final String name : names) {
      final Variable variable = found.getVariable(name);
      if (variable == null) {
        missing.add(name);
      } else {
        ordered.add(variable);
      }
    }
    if (!missing.isEmpty()) {
      LOG.warn("Variables not found and skipped: " + missing);
    }
    return new VariableResolution(new VariableSet(ordered), missing);
  }
}
