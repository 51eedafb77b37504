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

package org.mosaicdb.datum;

import org.mosaicdb.common.MosaicDataTypes.Type;

public class NullDatum extends Datum {
  private static final NullDatum instance = new NullDatum();
  private static final byte [] EMPTY_BYTES = new byte[0];

  private NullDatum() {
    super(Type.NULL_TYPE);
  }

  public static NullDatum get() {
    return instance;
  }

  @Override
  public boolean isNull() {
    return true;
  }

  @Override
  public boolean isNotNull() {
    return false;
  }

  @Override
  public byte[] asByteArray() {
    return EMPTY_BYTES;
  }

  @Override
  public String asChars() {
    return "NULL";
  }

  @Override
  public int size() {
    return 0;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof NullDatum;
  }

  @Override
  public int hashCode() {
    return 23244; // one of the prime number
  }
}
