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

public class Int8Datum extends Datum {
  private static final int size = 8;
  private final long val;

  public Int8Datum(long val) {
    super(Type.INT8);
    this.val = val;
  }

  @Override
  public short asInt2() {
    return (short) val;
  }

  @Override
  public int asInt4() {
    return (int) val;
  }

  @Override
  public long asInt8() {
    return val;
  }

  @Override
  public float asFloat4() {
    return val;
  }

  @Override
  public double asFloat8() {
    return val;
  }

  @Override
  public String asChars() {
    return String.valueOf(val);
  }

  @Override
  public int size() {
    return size;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(val);
  }

  @Override
  public boolean equals(Object obj) {
    if (obj instanceof Int8Datum) {
      Int8Datum other = (Int8Datum) obj;
      return val == other.val;
    }
    return false;
  }
}
