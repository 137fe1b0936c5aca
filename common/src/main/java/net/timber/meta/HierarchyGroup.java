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
package net.timber.meta;

/**
 * A backend handle for a node of the meta data hierarchy. The client treats
 * it as opaque apart from the names below and passes it back to the
 * {@link net.timber.storage.MetaService} to list children and variables.
 *
 * @since 1.0
 */
public interface HierarchyGroup {

  /** @return The raw name of the grouping. Not necessarily an identifier. */
  public String getHierarchyName();

  /** @return An optional description. */
  public String getDescription();

  /** @return The full path of the grouping from the top of the tree. */
  public String getHierarchyPath();
}
