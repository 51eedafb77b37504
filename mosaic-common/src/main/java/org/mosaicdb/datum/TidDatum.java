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
 * A tuple identifier: a block number and an offset within the block.
 */
public class TidDatum extends Datum {
  private final int blockNumber;
  private final short offset;

  public TidDatum(int blockNumber, short offset) {
    super(Type.TID);
    this.blockNumber = blockNumber;
    this.offset = offset;
  }

  public int getBlockNumber() {
    return blockNumber;
  }

  /** @return the high 16 bits of the block number */
  public short getBlockHi() {
    return (short) (blockNumber >>> 16);
  }

  /** @return the low 16 bits of the block number */
  public short getBlockLo() {
    return (short) blockNumber;
  }

  public short getOffset() {
    return offset;
  }

  @Override
  public String asChars() {
    return "(" + Integer.toUnsignedString(blockNumber) + "," + (offset & 0xffff) + ")";
  }

  @Override
  public int size() {
    return 6;
  }

  @Override
  public int hashCode() {
    return blockNumber * 31 + offset;
  }

  @Override
  public boolean equals(Object obj) {
    if (obj instanceof TidDatum) {
      TidDatum other = (TidDatum) obj;
      return blockNumber == other.blockNumber && offset == other.offset;
    }
    return false;
  }
}
