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

public class Float8Datum extends Datum {
  private static final int size = 8;
  private final double val;

  public Float8Datum(double val) {
    super(Type.FLOAT8);
    this.val = val;
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
    return Double.hashCode(val);
  }

  @Override
  public boolean equals(Object obj) {
    if (obj instanceof Float8Datum) {
      Float8Datum other = (Float8Datum) obj;
      return Double.compare(val, other.val) == 0;
    }
    return false;
  }
}
