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

import org.junit.Test;
import org.mosaicdb.common.MosaicDataTypes.Type;
import org.mosaicdb.datum.DatumFactory;
import org.mosaicdb.exception.NotHashableException;
import org.mosaicdb.util.FnvHash;

import static org.junit.Assert.*;

public class TestCdbHash {

  private static int segmentOf(CdbHash cdbHash, int value) throws NotHashableException {
    cdbHash.init();
    cdbHash.hash(DatumFactory.createInt4(value), Type.INT4);
    return cdbHash.reduce();
  }

  @Test
  public final void testReduceAlgorithm() {
    DatumHasher hasher = new DatumHasher();
    assertEquals(ReduceAlgorithm.BITMASK, new CdbHash(1, 0, hasher).getReduceAlgorithm());
    assertEquals(ReduceAlgorithm.BITMASK, new CdbHash(8, 0, hasher).getReduceAlgorithm());
    assertEquals(ReduceAlgorithm.LAZYMOD, new CdbHash(7, 0, hasher).getReduceAlgorithm());
    assertEquals(ReduceAlgorithm.LAZYMOD, new CdbHash(12, 0, hasher).getReduceAlgorithm());
    assertFalse(ReduceAlgorithm.isPowerOfTwo(0));
    assertTrue(ReduceAlgorithm.isPowerOfTwo(1024));
  }

  @Test
  public final void testKnownSegments() throws NotHashableException {
    CdbHash eight = new CdbHash(8, 0, new DatumHasher());
    assertEquals(2, segmentOf(eight, 1));
    assertEquals(0x678c146a, eight.getHash());
    assertEquals(7, segmentOf(eight, 2));
    assertEquals(4, segmentOf(eight, 3));

    CdbHash three = new CdbHash(3, 0, new DatumHasher());
    assertEquals(0, segmentOf(three, 1));
    assertEquals(1, segmentOf(three, 3));
    assertEquals(2, segmentOf(three, 8));
  }

  @Test
  public final void testUnsignedModulo() throws NotHashableException {
    // the hash of 3 has its sign bit set
    CdbHash seven = new CdbHash(7, 0, new DatumHasher());
    assertEquals(4, segmentOf(seven, 3));
    assertTrue(seven.getHash() < 0);
  }

  @Test
  public final void testRange() throws NotHashableException {
    CdbHash cdbHash = new CdbHash(7, 0, new DatumHasher());
    for (int i = -500; i < 500; i++) {
      int segment = segmentOf(cdbHash, i);
      assertTrue(segment >= 0 && segment < 7);
    }
  }

  @Test
  public final void testMultiColumnKey() throws NotHashableException {
    CdbHash cdbHash = new CdbHash(8, 0, new DatumHasher());
    cdbHash.init();
    cdbHash.hash(DatumFactory.createInt4(1), Type.INT4);
    cdbHash.hash(DatumFactory.createText("abc"), Type.TEXT);
    assertEquals(0xd33f7bbe, cdbHash.getHash());
    assertEquals(6, cdbHash.reduce());

    cdbHash.init();
    cdbHash.hash(DatumFactory.createInt4(1), Type.INT4);
    cdbHash.hashNull();
    assertEquals(0x69843775, cdbHash.getHash());
    assertEquals(5, cdbHash.reduce());
  }

  @Test
  public final void testNull() {
    CdbHash cdbHash = new CdbHash(8, 0, new DatumHasher());
    cdbHash.init();
    cdbHash.hashNull();
    assertEquals(0xf75a2f0a, cdbHash.getHash());
    assertEquals(2, cdbHash.reduce());
  }

  @Test
  public final void testRoundRobin() {
    CdbHash cdbHash = new CdbHash(4, 5, new DatumHasher());
    cdbHash.init();
    cdbHash.hashNoKey();
    assertEquals(6, cdbHash.getRrIndex());
    assertEquals(0x1114749e, cdbHash.getHash());
    assertEquals(2, cdbHash.reduce());

    cdbHash.init();
    cdbHash.hashNoKey();
    assertEquals(7, cdbHash.getRrIndex());
    assertEquals(3, cdbHash.reduce());
  }

  @Test
  public final void testInit() {
    CdbHash cdbHash = new CdbHash(2, 0, new DatumHasher());
    cdbHash.init();
    cdbHash.hash(new byte[] {1, 2, 3});
    cdbHash.init();
    assertEquals(FnvHash.FNV1_32_INIT, cdbHash.getHash());
  }

  @Test(expected = IllegalArgumentException.class)
  public final void testNoSegments() {
    new CdbHash(0, 0, new DatumHasher());
  }
}
