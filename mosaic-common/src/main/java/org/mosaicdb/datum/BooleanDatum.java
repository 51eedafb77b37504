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

public class BooleanDatum extends Datum {
  public static final String TRUE_STRING = "t";
  public static final String FALSE_STRING = "f";

  public static final BooleanDatum TRUE = new BooleanDatum(true);
  public static final BooleanDatum FALSE = new BooleanDatum(false);

  private final boolean val;

  private BooleanDatum(boolean val) {
    super(Type.BOOL);
    this.val = val;
  }

  @Override
  public boolean asBool() {
    return val;
  }

  @Override
  public byte asByte() {
    return (byte) (val ? 1 : 0);
  }

  @Override
  public String asChars() {
    return val ? TRUE_STRING : FALSE_STRING;
  }

  @Override
  public int size() {
    return 1;
  }

  @Override
  public int hashCode() {
    return val ? 7907 : 0;
  }

  @Override
  public boolean equals(Object obj) {
    if (obj instanceof BooleanDatum) {
      BooleanDatum other = (BooleanDatum) obj;
      return val == other.val;
    }
    return false;
  }
}
