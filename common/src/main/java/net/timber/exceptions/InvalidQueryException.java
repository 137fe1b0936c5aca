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
package net.timber.exceptions;

/**
 * Thrown when a caller asks for something the client or the service can never
 * answer, e.g. an unknown scaling algorithm or a beam mode filter without a
 * single known mode. Distinct from an empty result, which only means there
 * was no data.
 * @since 1.0
 */
public final class InvalidQueryException extends IllegalArgumentException {

  /**
   * Constructor.
   *
   * @param msg Message describing the problem.
   */
  public InvalidQueryException(final String msg) {
    super(msg);
  }

  /**
   * Constructor.
   *
   * @param msg Message describing the problem.
   * @param cause The source exception.
   */
  public InvalidQueryException(final String msg, final Throwable cause) {
    super(msg, cause);
  }

  static final long serialVersionUID = 1729383101;

}
