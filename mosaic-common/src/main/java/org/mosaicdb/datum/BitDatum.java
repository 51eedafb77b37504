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

/**
 * <code>bit(n)</code> and <code>bit varying</code>. Bits are packed eight per byte, most
 * significant bit first; unused bits of the last byte are zero.
 */
public class BitDatum extends Datum {
  private final int bitLength;
  private final byte[] bits;

  public BitDatum(Type type, int bitLength, byte[] bits) {
    super(type);
    Preconditions.checkArgument(type == Type.BIT || type == Type.VARBIT, "Not a bit string type: %s", type);
    Preconditions.checkArgument(bits.length == (bitLength + 7) / 8,
        "%s bits cannot be stored in %s bytes", bitLength, bits.length);
    this.bitLength = bitLength;
    this.bits = bits;
  }

  public int getBitLength() {
    return bitLength;
  }

  @Override
  public byte[] asByteArray() {
    return bits;
  }

  @Override
  public String asChars() {
    StringBuilder sb = new StringBuilder(bitLength);
    for (int i = 0; i < bitLength; i++) {
      sb.append((bits[i / 8] & (0x80 >>> (i % 8))) != 0 ? '1' : '0');
    }
    return sb.toString();
  }

  @Override
  public int size() {
    return bits.length;
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bits) * 31 + bitLength;
  }

  @Override
  public boolean equals(Object obj) {
    if (obj instanceof BitDatum) {
      BitDatum other = (BitDatum) obj;
      return bitLength == other.bitLength && Arrays.equals(bits, other.bits);
    }
    return false;
  }
}
