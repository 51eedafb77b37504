/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.mosaicdb.exception;

/**
 * Error codes. Numbers follow the SQLSTATE class grouping used by the catalog.
 */
public enum ResultCode {
  OK(0),

  // General errors
  INTERNAL_ERROR(201),
  NOT_IMPLEMENTED(202),
  FEATURE_NOT_SUPPORTED(203),

  // Syntax error or access rule violation
  UNDEFINED_TABLE(601),
  UNDEFINED_COLUMN(602),
  DUPLICATE_TABLE(611),

  // Data types and values
  INVALID_VALUE_FOR_CAST(801),
  UNSUPPORTED_DATATYPE(802),
  INVALID_DATATYPE(803),
  NOT_HASHABLE(804),

  // Distribution
  INVALID_POLICY(901),
  DISTRIBUTION_KEY_VIOLATION(902);

  private final int number;

  ResultCode(int number) {
    this.number = number;
  }

  public int getNumber() {
    return number;
  }
}
