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
package net.timber.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;

import net.timber.data.Variable;
import net.timber.meta.HierarchyGroup;
import net.timber.storage.MetaService;

/**
 * A node of the meta data hierarchy, navigated lazily.
 * <p>
 * Children and attached variables are fetched from the {@link MetaService}
 * on first access and cached for the life of the node. Names are sanitized
 * with {@link #cleanName(String)} so they can be used as identifiers; if two
 * raw names sanitize to the same identifier the last one listed by the
 * service wins. A variable shadows a child node of the same sanitized name.
 * <p>
 * Nodes may be shared between threads. Caches are published with a
 * compare-and-set so concurrent first accesses may fetch twice but every
 * caller sees the first published result.
 *
 * @since 1.0
 */
public class Hierarchy {
  private static final Logger LOG = LoggerFactory.getLogger(Hierarchy.class);

  /** Characters replaced by an underscore. */
  private static final String SEPARATORS = " _-;></:.";

  /** The sanitized name, null for the root. */
  private final String name;

  /** The backend handle, null for the root. */
  private final HierarchyGroup group;

  private final MetaService meta_service;

  /** Sanitized child name to child node. */
  private final AtomicReference<Map<String, Hierarchy>> children =
      new AtomicReference<Map<String, Hierarchy>>();

  /** Sanitized variable name to raw variable name. */
  private final AtomicReference<Map<String, String>> variables =
      new AtomicReference<Map<String, String>>();

  /**
   * Ctor for child nodes.
   * @param name The sanitized name.
   * @param group A non-null backend handle.
   * @param meta_service A non-null meta data service.
   */
  Hierarchy(final String name,
            final HierarchyGroup group,
            final MetaService meta_service) {
    if (meta_service == null) {
      throw new IllegalArgumentException("Meta service cannot be null.");
    }
    this.name = name;
    this.group = group;
    this.meta_service = meta_service;
  }

  /**
   * @param meta_service A non-null meta data service.
   * @return The top of the hierarchy. Nothing is fetched until it's used.
   */
  public static Hierarchy root(final MetaService meta_service) {
    return new Hierarchy(null, null, meta_service);
  }

  /**
   * Sanitizes a raw name into an identifier: a leading digit is prefixed
   * with an underscore and every character of {@code " _-;></:."} becomes an
   * underscore. Applying it twice doesn't change the result.
   * @param raw A non-null and non-empty name.
   * @return The sanitized name.
   */
  public static String cleanName(final String raw) {
    if (Strings.isNullOrEmpty(raw)) {
      throw new IllegalArgumentException("Name cannot be null or empty.");
    }
    final StringBuilder buf = new StringBuilder(raw.length() + 1);
    if (Character.isDigit(raw.charAt(0))) {
      buf.append('_');
    }
    for (int i = 0; i < raw.length(); i++) {
      final char c = raw.charAt(i);
      buf.append(SEPARATORS.indexOf(c) >= 0 ? '_' : c);
    }
    return buf.toString();
  }

  /** @return True if this is the top of the hierarchy. */
  public boolean isRoot() {
    return group == null;
  }

  /** @return The sanitized name, null for the root. */
  public String getName() {
    return name;
  }

  /** @return The backend handle, null for the root. */
  public HierarchyGroup getGroup() {
    return group;
  }

  /**
   * Looks a sanitized name up among the variables, then the children.
   * @param child_name The sanitized name.
   * @return The entry, {@link HierarchyEntry.Kind#NOT_FOUND} if the name is
   * neither a variable nor a child.
   */
  public HierarchyEntry getChild(final String child_name) {
    if (Strings.isNullOrEmpty(child_name)) {
      return HierarchyEntry.notFound(child_name);
    }
    final String variable = getVariables().get(child_name);
    if (variable != null) {
      return HierarchyEntry.variable(child_name, variable);
    }
    final Hierarchy child = getChildren().get(child_name);
    if (child != null) {
      return HierarchyEntry.node(child_name, child);
    }
    return HierarchyEntry.notFound(child_name);
  }

  /** @return The child nodes keyed by sanitized name, fetched once. */
  public Map<String, Hierarchy> getChildren() {
    final Map<String, Hierarchy> cached = children.get();
    if (cached != null) {
      return cached;
    }
    final List<HierarchyGroup> groups = isRoot() ?
        meta_service.getTopLevelHierarchies() :
        meta_service.getChildHierarchies(group);
    final Map<String, Hierarchy> map = new LinkedHashMap<String, Hierarchy>();
    for (final HierarchyGroup child : groups) {
      if (Strings.isNullOrEmpty(child.getHierarchyName())) {
        continue;
      }
      final String clean = cleanName(child.getHierarchyName());
      map.put(clean, new Hierarchy(clean, child, meta_service));
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Fetched " + map.size() + " children of " + this);
    }
    children.compareAndSet(null, Collections.unmodifiableMap(map));
    return children.get();
  }

  /**
   * @return The raw names of the variables attached to this node keyed by
   * sanitized name, fetched once. Always empty for the root.
   */
  public Map<String, String> getVariables() {
    final Map<String, String> cached = variables.get();
    if (cached != null) {
      return cached;
    }
    final Map<String, String> map = new LinkedHashMap<String, String>();
    if (!isRoot()) {
      for (final Variable variable : meta_service.getVariablesAttachedTo(group)) {
        final String raw = variable.getVariableName();
        if (Strings.isNullOrEmpty(raw)) {
          continue;
        }
        map.put(cleanName(raw), raw);
      }
    }
    variables.compareAndSet(null, Collections.unmodifiableMap(map));
    return variables.get();
  }

  /** @return The raw names of the attached variables. */
  public List<String> getVariableNames() {
    return new ArrayList<String>(getVariables().values());
  }

  /** @return The sorted child names followed by the sorted variable names. */
  public List<String> listing() {
    final List<String> child_names = new ArrayList<String>(getChildren().keySet());
    Collections.sort(child_names);
    final List<String> variable_names =
        new ArrayList<String>(getVariables().keySet());
    Collections.sort(variable_names);
    child_names.addAll(variable_names);
    return child_names;
  }

  /** @return The description of the node, null for the root. */
  public String getDescription() {
    return isRoot() ? null : group.getDescription();
  }

  @VisibleForTesting
  boolean childrenFetched() {
    return children.get() != null;
  }

  @Override
  public String toString() {
    if (isRoot()) {
      return "<Top Hierarchy>";
    }
    return "<" + group.getHierarchyName() + ": " + group.getDescription() + ">";
  }
}
