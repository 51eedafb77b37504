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

package org.mosaicdb.engine.hash;

/**
 * The ways {@link DatumHasher} turns a value into bytes. Types with the same SQL equality
 * semantics share an encoding, so that equal values hash equally across types.
 */
public enum HashEncoding {
  /** any integer widened to 8 bytes */
  INT8,
  /** an unsigned 32 bit oid zero-extended to 8 bytes */
  OID,
  FLOAT4,
  FLOAT8,
  COMPLEX,
  NUMERIC,
  /** the single byte "char" */
  CHAR,
  /** character strings ignoring trailing blanks */
  TEXT,
  /** a 64 byte NUL padded name */
  NAME,
  /** raw bytes */
  BYTES,
  TID,
  INT8_TIME,
  DATE,
  TIMETZ,
  INTERVAL,
  ABSTIME,
  RELTIME,
  TINTERVAL,
  INET,
  MACADDR,
  BOOL,
  OIDVECTOR,
  CASH,
  UUID
}
