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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Strings;

/**
 * A logged variable as known by the meta data service. Variables are
 * identified by name only, the other fields are informational.
 *
 * @since 1.0
 */
@JsonInclude(Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Variable {

  /** The unique name. */
  private final String name;

  /** The declared type, may be null if the service sent an unknown one. */
  private final DataType data_type;

  /** An optional description. */
  private final String description;

  /** An optional unit. */
  private final String unit;

  /**
   * Ctor for a variable without description or unit.
   * @param name A non-null and non-empty name.
   * @param data_type The declared type, may be null.
   */
  public Variable(final String name, final DataType data_type) {
    this(name, data_type, null, null);
  }

  /**
   * Default ctor.
   * @param name A non-null and non-empty name.
   * @param data_type The declared type, may be null.
   * @param description An optional description.
   * @param unit An optional unit.
   * @throws IllegalArgumentException if the name was null or empty.
   */
  @JsonCreator
  public Variable(final @JsonProperty("name") String name,
                  final @JsonProperty("dataType") DataType data_type,
                  final @JsonProperty("description") String description,
                  final @JsonProperty("unit") String unit) {
    if (Strings.isNullOrEmpty(name)) {
      throw new IllegalArgumentException("Variable name cannot be null or empty.");
    }
    this.name = name;
    this.data_type = data_type;
    this.description = description;
    this.unit = unit;
  }

  /** @return The unique name. */
  @JsonProperty("name")
  public String getVariableName() {
    return name;
  }

  /** @return The declared type, may be null. */
  @JsonProperty("dataType")
  public DataType getDataType() {
    return data_type;
  }

  /** @return The description, may be null. */
  @JsonProperty("description")
  public String getDescription() {
    return description;
  }

  /** @return The unit, may be null. */
  @JsonProperty("unit")
  public String getUnit() {
    return unit;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Variable)) {
      return false;
    }
    return name.equals(((Variable) o).name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  /** @return The variable name. */
  @Override
  public String toString() {
    return name;
  }
}
