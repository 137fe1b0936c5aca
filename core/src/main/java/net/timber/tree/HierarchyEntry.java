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

/**
 * The result of looking a name up in a {@link Hierarchy} node.
 *
 * @since 1.0
 */
public final class HierarchyEntry {

  /** What the name resolved to. */
  public enum Kind {
    NODE,
    VARIABLE,
    NOT_FOUND
  }

  private final Kind kind;
  private final String name;
  private final Hierarchy node;
  private final String variable_name;

  private HierarchyEntry(final Kind kind,
                         final String name,
                         final Hierarchy node,
                         final String variable_name) {
    this.kind = kind;
    this.name = name;
    this.node = node;
    this.variable_name = variable_name;
  }

  static HierarchyEntry node(final String name, final Hierarchy node) {
    return new HierarchyEntry(Kind.NODE, name, node, null);
  }

  static HierarchyEntry variable(final String name, final String variable_name) {
    return new HierarchyEntry(Kind.VARIABLE, name, null, variable_name);
  }

  static HierarchyEntry notFound(final String name) {
    return new HierarchyEntry(Kind.NOT_FOUND, name, null, null);
  }

  /** @return What the name resolved to. */
  public Kind getKind() {
    return kind;
  }

  /** @return The name that was looked up. */
  public String getName() {
    return name;
  }

  /**
   * @return The child node.
   * @throws IllegalStateException if the entry is not a node.
   */
  public Hierarchy getNode() {
    if (kind != Kind.NODE) {
      throw new IllegalStateException(name + " is not a hierarchy node but "
          + kind);
    }
    return node;
  }

  /**
   * @return The raw variable name, as the meta data service knows it.
   * @throws IllegalStateException if the entry is not a variable.
   */
  public String getVariableName() {
    if (kind != Kind.VARIABLE) {
      throw new IllegalStateException(name + " is not a variable but " + kind);
    }
    return variable_name;
  }

  @Override
  public String toString() {
    switch (kind) {
    case NODE:
      return node.toString();
    case VARIABLE:
      return variable_name;
    default:
      return "<not found: " + name + ">";
    }
  }
}
