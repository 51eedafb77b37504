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

import com.google.common.base.Preconditions;
import org.mosaicdb.common.MosaicDataTypes.Type;

import java.util.Arrays;

public class MacAddrDatum extends Datum {
  public static final int SIZE = 6;

  private final byte[] bytes;

  public MacAddrDatum(byte[] bytes) {
    super(Type.MACADDR);
    Preconditions.checkArgument(bytes.length == SIZE, "macaddr must be 6 bytes: %s", bytes.length);
    this.bytes = bytes;
  }

  @Override
  public byte[] asByteArray() {
    return bytes;
  }

  @Override
  public String asChars() {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < bytes.length; i++) {
      if (i > 0) {
        sb.append(':');
      }
      sb.append(String.format("%02x", bytes[i] & 0xff));
    }
    return sb.toString();
  }

  @Override
  public int size() {
    return SIZE;
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof MacAddrDatum && Arrays.equals(bytes, ((MacAddrDatum) obj).bytes);
  }
}
