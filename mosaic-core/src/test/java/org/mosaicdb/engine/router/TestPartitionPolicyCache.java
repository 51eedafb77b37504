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

import org.junit.Before;
import org.junit.Test;
import org.mosaicdb.catalog.DistributionPolicy;
import org.mosaicdb.catalog.MemoryCatalog;
import org.mosaicdb.catalog.Schema;
import org.mosaicdb.catalog.TableDesc;
import org.mosaicdb.catalog.TypeDesc;
import org.mosaicdb.common.MosaicDataTypes.Type;
import org.mosaicdb.exception.InvalidPolicyException;
import org.mosaicdb.exception.MosaicException;
import org.mosaicdb.exception.NotHashableException;

import static org.junit.Assert.*;

public class TestPartitionPolicyCache {
  private MemoryCatalog catalog;
  private PartitionPolicyCache cache;

  @Before
  public void setUp() throws Exception {
    catalog = new MemoryCatalog();
    Schema schema = new Schema()
        .addColumn("a", Type.INT4)
        .addColumn("b", Type.TEXT)
        .addColumn("c", TypeDesc.userDefined("hstore"));
    catalog.createTable(new TableDesc(11, "p1", schema, DistributionPolicy.partitioned(2)));
    catalog.createTable(new TableDesc(12, "p2", schema, DistributionPolicy.randomly()));
    catalog.createTable(new TableDesc(13, "p3", schema, DistributionPolicy.partitioned(3)));
    cache = new PartitionPolicyCache(catalog, new RouterContext(8, 1L));
  }

  @Test
  public final void testResolveOnce() throws MosaicException {
    DistributionData data = cache.resolve(11);
    assertEquals(11, data.getRelationId());
    assertEquals(DistributionPolicy.partitioned(2), data.getPolicy());
    assertEquals(Type.TEXT, data.getHashType(0));
    assertEquals(8, data.getCdbHash().getNumSegments());

    catalog.dropTable(11);
    assertSame(data, cache.resolve(11));
    assertEquals(1, cache.size());
  }

  @Test
  public final void testOwnHashPerPartition() throws MosaicException {
    DistributionData first = cache.resolve(11);
    DistributionData second = cache.resolve(12);
    assertNotSame(first.getCdbHash(), second.getCdbHash());
    assertFalse(second.getPolicy().hasDistributionKey());
    assertTrue(cache.contains(12));
    assertFalse(cache.contains(13));
  }

  @Test
  public final void testUnknownPartition() throws MosaicException {
    try {
      cache.resolve(99);
      fail("99 does not exist");
    } catch (InvalidPolicyException e) {
      assertTrue(e.getMessage().contains("relation '99' does not exist"));
    }
    assertEquals(0, cache.size());
  }

  @Test(expected = NotHashableException.class)
  public final void testNotHashable() throws MosaicException {
    cache.resolve(13);
  }
}
