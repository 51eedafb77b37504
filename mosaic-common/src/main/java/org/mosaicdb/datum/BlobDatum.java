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

import org.apache.commons.codec.binary.Hex;
import org.mosaicdb.common.MosaicDataTypes.Type;

import java.util.Arrays;

/**
 * <code>bytea</code>
 */
public class BlobDatum extends Datum {
  private final byte[] val;

  public BlobDatum(byte[] val) {
    super(Type.BYTEA);
    this.val = val;
  }

  @Override
  public byte[] asByteArray() {
    return val;
  }

  @Override
  public String asChars() {
    return "\\x" + Hex.encodeHexString(val);
  }

  @Override
  public int size() {
    return val.length;
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(val);
  }

  @Override
  public boolean equals(Object obj) {
    if (obj instanceof BlobDatum) {
      return Arrays.equals(val, ((BlobDatum) obj).val);
    }
    return false;
  }
}
