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

import org.junit.Test;
import org.mosaicdb.conf.MosaicConf;
import org.mosaicdb.conf.MosaicConf.ConfVars;
import org.mosaicdb.engine.hash.CdbHash;
import org.mosaicdb.engine.hash.ReduceAlgorithm;

import static org.junit.Assert.*;

public class TestRouterContext {

  @Test
  public final void testCreateFromConf() {
    MosaicConf conf = new MosaicConf();
    conf.setIntVar(ConfVars.CLUSTER_SEGMENTS, 6);
    conf.setLongVar(ConfVars.ROUND_ROBIN_SEED, 3L);
    conf.setBoolVar(ConfVars.COPY_SEGMENT_CHECK_ENABLED, false);

    RouterContext context = RouterContext.create(conf);
    assertEquals(6, context.getNumSegments());
    assertFalse(context.isSegmentCheckEnabled());

    CdbHash cdbHash = context.newCdbHash();
    assertEquals(6, cdbHash.getNumSegments());
    assertEquals(ReduceAlgorithm.LAZYMOD, cdbHash.getReduceAlgorithm());
  }

  @Test
  public final void testSeededRoundRobin() {
    RouterContext first = new RouterContext(4, 11L);
    RouterContext second = new RouterContext(4, 11L);
    for (int i = 0; i < 10; i++) {
      assertEquals(first.nextRoundRobinIndex(), second.nextRoundRobinIndex());
    }
  }

  @Test
  public final void testRoundRobinRange() {
    RouterContext context = new RouterContext(4, -1L);
    assertTrue(context.isSegmentCheckEnabled());
    for (int i = 0; i < 1000; i++) {
      long index = Integer.toUnsignedLong(context.nextRoundRobinIndex());
      assertTrue(index <= RouterContext.UPPER_VAL);
    }
  }

  @Test
  public final void testSharedHasher() {
    RouterContext context = new RouterContext(2, 0L);
    assertSame(context.getHasher(), context.getHasher());
    assertNotSame(context.newCdbHash(), context.newCdbHash());
  }

  @Test(expected = IllegalArgumentException.class)
  public final void testNoSegments() {
    new RouterContext(0, 0L);
  }
}
