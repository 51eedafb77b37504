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

package org.mosaicdb.conf;

import org.junit.Test;
import org.mosaicdb.conf.MosaicConf.ConfVars;

import static org.junit.Assert.*;

public class TestMosaicConf {

  @Test
  public final void testDefaults() {
    MosaicConf conf = new MosaicConf();
    assertEquals(1, conf.getNumSegments());
    assertEquals(-1, conf.getIntVar(ConfVars.SEGMENT_ID));
    assertEquals(-1L, conf.getLongVar(ConfVars.ROUND_ROBIN_SEED));
    assertEquals("|", conf.getVar(ConfVars.COPY_DELIMITER));
    assertEquals("\\N", conf.getVar(ConfVars.COPY_NULL));
    assertTrue(conf.getBoolVar(ConfVars.COPY_SEGMENT_CHECK_ENABLED));
  }

  @Test
  public final void testSetVars() {
    MosaicConf conf = new MosaicConf();
    conf.setIntVar(ConfVars.CLUSTER_SEGMENTS, 16);
    conf.setLongVar(ConfVars.ROUND_ROBIN_SEED, 42L);
    conf.setVar(ConfVars.COPY_DELIMITER, ",");
    conf.setBoolVar(ConfVars.COPY_SEGMENT_CHECK_ENABLED, false);

    MosaicConf copy = new MosaicConf(conf);
    assertEquals(16, copy.getNumSegments());
    assertEquals(42L, copy.getLongVar(ConfVars.ROUND_ROBIN_SEED));
    assertEquals(",", copy.getVar(ConfVars.COPY_DELIMITER));
    assertFalse(copy.getBoolVar(ConfVars.COPY_SEGMENT_CHECK_ENABLED));
  }

  @Test(expected = IllegalStateException.class)
  public final void testNonPositiveSegments() {
    MosaicConf conf = new MosaicConf();
    conf.setIntVar(ConfVars.CLUSTER_SEGMENTS, 0);
    conf.getNumSegments();
  }

  @Test
  public final void testFindVar() {
    assertEquals(ConfVars.COPY_NULL, MosaicConf.findVar("mosaic.copy.null"));
    assertEquals(Integer.class, ConfVars.SEGMENT_ID.valueClass());
    assertNull(MosaicConf.findVar("mosaic.no.such.key"));
  }
}
