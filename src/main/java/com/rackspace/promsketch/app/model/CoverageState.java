/*
 * Copyright 2022 Rackspace US, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.rackspace.promsketch.app.model;

/**
 * Where a (series, function) pair stands relative to a requested window. Only
 * {@link #COVERED} yields a result.
 */
public enum CoverageState {
  /**
   * Nothing has been inserted yet, or the series was never seen.
   */
  UNCOVERED,
  /**
   * Some samples were inserted but they do not span the requested window.
   */
  PARTIAL,
  COVERED
}
