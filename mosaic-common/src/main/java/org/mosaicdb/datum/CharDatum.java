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

/**
 * The single byte <code>"char"</code> type. Blank padded <code>char(n)</code> values are
 * {@link TextDatum}s of type <code>bpchar</code>.
 */
public class CharDatum extends Datum {
  private final byte val;

  public CharDatum(byte val) {
    super(Type.CHAR);
    this.val = val;
  }

  @Override
  public byte asByte() {
    return val;
  }

  @Override
  public short asInt2() {
    return val;
  }

  @Override
  public int asInt4() {
    return val;
  }

  @Override
  public String asChars() {
    return String.valueOf((char) (val & 0xff));
  }

  @Override
  public int size() {
    return 1;
  }

  @Override
  public int hashCode() {
    return val;
  }

  @Override
  public boolean equals(Object obj) {
    if (obj instanceof CharDatum) {
      return val == ((CharDatum) obj).val;
    }
    return false;
  }
}
