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

/**
 * Creates the backend services for a client. Implementations own the
 * remote session and transport.
 *
 * @since 1.0
 */
public interface ServiceFactory {

  /**
   * Prepares the factory. Called once before any service is requested.
   * @param application_name The application registered with the service.
   * @param client_name The client name registered with the service.
   * @param location Which archive to read from.
   */
  public void initialize(final String application_name,
                         final String client_name,
                         final DataLocation location);

  /** @return The meta data service. */
  public MetaService metaService();

  /** @return The time series service. */
  public TimeseriesService timeseriesService();

  /** @return The fill service. */
  public FillService fillService();
}
