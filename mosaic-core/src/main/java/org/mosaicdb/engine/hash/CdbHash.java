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

import com.google.common.base.Preconditions;
import org.mosaicdb.common.MosaicDataTypes.Type;
import org.mosaicdb.datum.Datum;
import org.mosaicdb.exception.MosaicInternalError;
import org.mosaicdb.exception.NotHashableException;
import org.mosaicdb.util.FnvHash;

/**
 * Computes the segment of a row from the values of its distribution key.
 *
 * <p>Usage for one row:
 * <pre>
 *   cdbHash.init();
 *   for each key column: cdbHash.hash(value, type) or cdbHash.hashNull()
 *   int segment = cdbHash.reduce();
 * </pre>
 * Rows of a relation without a distribution key call {@link #hashNoKey()} instead, which spreads
 * consecutive rows round robin.
 */
public class CdbHash implements DatumHashFunction {
  private int hash;
  private int rrIndex;
  private final int numSegments;
  private final ReduceAlgorithm reduceAlgorithm;
  private final DatumHasher hasher;
  private final byte[] rrBytes = new byte[4];

  /**
   * @param numSegments the number of segments
   * @param rrIndex the first round robin index
   * @param hasher the encoder of values
   */
  public CdbHash(int numSegments, int rrIndex, DatumHasher hasher) {
    Preconditions.checkArgument(numSegments > 0, "The number of segments must be positive: %s", numSegments);
    this.numSegments = numSegments;
    this.rrIndex = rrIndex;
    this.hasher = hasher;
    this.reduceAlgorithm = ReduceAlgorithm.select(numSegments);
  }

  public void init() {
    hash = FnvHash.FNV1_32_INIT;
  }

  public void hash(byte[] bytes) {
    hash = FnvHash.hash(bytes, 0, bytes.length, hash);
  }

  @Override
  public void add(byte[] buf, int off, int len) {
    hash = FnvHash.hash(buf, off, len, hash);
  }

  public void hash(Datum datum, Type type) throws NotHashableException {
    hasher.hashDatum(datum, type, this);
  }

  public void hashNull() {
    hasher.hashNull(this);
  }

  /**
   * Feeds the round robin index, then advances it.
   */
  public void hashNoKey() {
    rrBytes[0] = (byte) rrIndex;
    rrBytes[1] = (byte) (rrIndex >>> 8);
    rrBytes[2] = (byte) (rrIndex >>> 16);
    rrBytes[3] = (byte) (rrIndex >>> 24);
    add(rrBytes, 0, rrBytes.length);
    rrIndex++;
  }

  /**
   * @return the segment of the hashed row, in <code>[0, numSegments)</code>
   */
  public int reduce() {
    switch (reduceAlgorithm) {
      case BITMASK:
        return hash & (numSegments - 1);
      case LAZYMOD:
        return Integer.remainderUnsigned(hash, numSegments);
      default:
        throw new MosaicInternalError("unknown reduce algorithm " + reduceAlgorithm);
    }
  }

  public int getHash() {
    return hash;
  }

  public int getRrIndex() {
    return rrIndex;
  }

  public int getNumSegments() {
    return numSegments;
  }

  public ReduceAlgorithm getReduceAlgorithm() {
    return reduceAlgorithm;
  }
}
