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

package org.mosaicdb.engine.router;

import com.google.common.base.Preconditions;
import org.mosaicdb.conf.MosaicConf;
import org.mosaicdb.conf.MosaicConf.ConfVars;
import org.mosaicdb.engine.hash.CdbHash;
import org.mosaicdb.engine.hash.DatumHasher;

import java.util.Random;

/**
 * State shared by everything that routes rows for one statement: the segment count, the value
 * encoder and the source of round robin starting points. A context is never shared between
 * statements.
 */
public class RouterContext {
  /** round robin indexes are drawn from <code>[0, UPPER_VAL]</code> */
  public static final long UPPER_VAL = 0xA0B0C0D1L;

  private final int numSegments;
  private final Random random;
  private final DatumHasher hasher = new DatumHasher();
  private final boolean segmentCheckEnabled;

  /**
   * @param numSegments the number of segments
   * @param seed the seed of the round robin starting points, or a negative number for a random one
   */
  public RouterContext(int numSegments, long seed) {
    this(numSegments, seed, ConfVars.COPY_SEGMENT_CHECK_ENABLED.defaultBoolVal);
  }

  public RouterContext(int numSegments, long seed, boolean segmentCheckEnabled) {
    Preconditions.checkArgument(numSegments > 0, "The number of segments must be positive: %s", numSegments);
    this.numSegments = numSegments;
    this.random = seed < 0 ? new Random() : new Random(seed);
    this.segmentCheckEnabled = segmentCheckEnabled;
  }

  public static RouterContext create(MosaicConf conf) {
    return new RouterContext(conf.getNumSegments(),
        conf.getLongVar(ConfVars.ROUND_ROBIN_SEED),
        conf.getBoolVar(ConfVars.COPY_SEGMENT_CHECK_ENABLED));
  }

  /**
   * @return a hash bound to this context's segment count, starting round robin at a random index
   */
  public CdbHash newCdbHash() {
    return new CdbHash(numSegments, nextRoundRobinIndex(), hasher);
  }

  int nextRoundRobinIndex() {
    return (int) Math.floorMod(random.nextLong(), UPPER_VAL + 1);
  }

  public int getNumSegments() {
    return numSegments;
  }

  public DatumHasher getHasher() {
    return hasher;
  }

  public boolean isSegmentCheckEnabled() {
    return segmentCheckEnabled;
  }
}
