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

package org.mosaicdb.engine.copy;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Lists;
import org.junit.Before;
import org.junit.Test;
import org.mosaicdb.catalog.DistributionPolicy;
import org.mosaicdb.catalog.MemoryCatalog;
import org.mosaicdb.catalog.Schema;
import org.mosaicdb.catalog.TableDesc;
import org.mosaicdb.common.MosaicDataTypes.Type;
import org.mosaicdb.conf.MosaicConf;
import org.mosaicdb.conf.MosaicConf.ConfVars;
import org.mosaicdb.datum.Datum;
import org.mosaicdb.datum.DatumFactory;
import org.mosaicdb.datum.NullDatum;
import org.mosaicdb.engine.router.RouterContext;
import org.mosaicdb.engine.router.RowRouter;
import org.mosaicdb.exception.DistributionKeyViolationException;
import org.mosaicdb.exception.MosaicException;
import org.mosaicdb.exception.MosaicRuntimeException;
import org.mosaicdb.storage.VTuple;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.Assert.*;

public class TestCopyDispatcher {
  private static final int ORDERS = 100;
  private static final int EVENTS = 101;
  private static final int SESSIONS = 102;
  private static final int DOCUMENTS = 103;

  private MemoryCatalog catalog;
  private MosaicConf conf;
  private CollectingSink sink;

  static class CollectingSink implements SegmentSink {
    final ListMultimap<Integer, String> lines = ArrayListMultimap.create();

    @Override
    public void send(int segment, byte[] line) throws IOException {
      lines.put(segment, new String(line, StandardCharsets.UTF_8));
    }
  }

  @Before
  public void setUp() throws Exception {
    catalog = new MemoryCatalog();
    catalog.createTable(new TableDesc(ORDERS, "orders", new Schema()
        .addColumn("id", Type.INT4)
        .addColumn("note", Type.TEXT)
        .addColumn("price", Type.NUMERIC)
        .addColumn("qty", Type.INT4), DistributionPolicy.partitioned(1)));
    catalog.createTable(new TableDesc(EVENTS, "events", new Schema()
        .addColumn("ts", Type.TIMESTAMP)
        .addColumn("payload", Type.TEXT), DistributionPolicy.randomly()));
    catalog.createTable(new TableDesc(SESSIONS, "sessions", new Schema()
        .addColumn("duration", Type.INTERVAL)
        .addColumn("user_name", Type.TEXT), DistributionPolicy.partitioned(1)));
    catalog.createTable(new TableDesc(DOCUMENTS, "documents", new Schema()
        .addColumn("id", Type.INT4)
        .addColumn("body", Type.JSON)
        .addColumn("origin", Type.POINT), DistributionPolicy.partitioned(1)));

    conf = new MosaicConf();
    conf.setIntVar(ConfVars.CLUSTER_SEGMENTS, 4);
    conf.setLongVar(ConfVars.ROUND_ROBIN_SEED, 5L);
    conf.setVar(ConfVars.COPY_DELIMITER, ",");
    sink = new CollectingSink();
  }

  private RowRouter router(int relationId) throws MosaicException {
    return new RowRouter(catalog, relationId, RouterContext.create(conf));
  }

  private static byte[] line(String s) {
    return s.getBytes(StandardCharsets.UTF_8);
  }

  @Test
  public final void testDispatch() throws Exception {
    CopyDispatcher dispatcher = new CopyDispatcher(router(ORDERS), conf, null, sink, false);
    assertEquals(0, dispatcher.dispatch(line("7,first,1.50,3")));
    assertEquals(2, dispatcher.dispatch(line("1,second,2.00,1")));
    assertEquals(3, dispatcher.dispatch(line("2,third,2.00,1")));
    // NULL key
    assertEquals(2, dispatcher.dispatch(line("\\N,fourth,2.00,1")));

    assertEquals(Lists.newArrayList("7,first,1.50,3"), sink.lines.get(0));
    assertEquals(Lists.newArrayList("1,second,2.00,1", "\\N,fourth,2.00,1"), sink.lines.get(2));
    assertArrayEquals(new long[] {1, 0, 2, 1}, dispatcher.getRowsPerSegment());
    assertEquals(4, dispatcher.getTotalRows());
    dispatcher.finish();
  }

  @Test
  public final void testOnlyKeyColumnsAreParsed() throws Exception {
    CopyDispatcher dispatcher = new CopyDispatcher(router(ORDERS), conf, null, sink, false);
    assertFalse(dispatcher.isFullParse());
    assertEquals(1, dispatcher.getNumColumnsToSplit());

    // fields after the key are never looked at
    assertEquals(0, dispatcher.dispatch(line("7,x,not a number,also not,extra")));
    assertEquals("7,x,not a number,also not,extra", sink.lines.get(0).get(0));
  }

  @Test
  public final void testFullParse() throws Exception {
    CopyDispatcher dispatcher = new CopyDispatcher(router(ORDERS), conf, null, sink, true);
    assertTrue(dispatcher.isFullParse());
    assertEquals(0, dispatcher.dispatch(line("7,x,1.5,3")));
    try {
      dispatcher.dispatch(line("7,x,not a number,3"));
      fail("the price column is parsed");
    } catch (MosaicRuntimeException e) {
      assertEquals(1, dispatcher.getTotalRows());
    }
  }

  @Test
  public final void testInputColumnList() throws Exception {
    // COPY orders (note, id) FROM ...
    CopyDispatcher dispatcher = new CopyDispatcher(router(ORDERS), conf, new int[] {2, 1}, sink, false);
    assertEquals(2, dispatcher.getNumColumnsToSplit());
    assertEquals(0, dispatcher.dispatch(line("hello,7")));
    assertEquals(2, dispatcher.dispatch(line("world,1")));
  }

  @Test
  public final void testNoDistributionKey() throws Exception {
    CopyDispatcher dispatcher = new CopyDispatcher(router(EVENTS), conf, null, sink, false);
    assertEquals(0, dispatcher.getNumColumnsToSplit());

    List<byte[]> lines = Lists.newArrayList();
    for (int i = 0; i < 12; i++) {
      lines.add(line("garbage " + i + ",payload"));
    }
    assertEquals(12, dispatcher.dispatchAll(lines.iterator()));
    assertEquals(12, dispatcher.getTotalRows());
    assertEquals(12, sink.lines.size());
  }

  @Test
  public final void testLoadOnSegment() throws Exception {
    conf.setIntVar(ConfVars.SEGMENT_ID, 0);
    CopyDispatcher dispatcher = new CopyDispatcher(router(ORDERS), conf, null, sink, false);
    assertTrue(dispatcher.isFullParse());

    assertEquals(0, dispatcher.dispatch(line("7,x,1.5,3")));
    try {
      dispatcher.dispatch(line("1,x,1.5,3"));
      fail("1 belongs to segment 2");
    } catch (DistributionKeyViolationException e) {
      assertEquals(0, e.getLocalSegment());
      assertEquals(2, e.getTargetSegment());
    }
    assertEquals(1, sink.lines.size());
  }

  @Test
  public final void testLoadOnSegmentWithoutCheck() throws Exception {
    conf.setIntVar(ConfVars.SEGMENT_ID, 3);
    conf.setBoolVar(ConfVars.COPY_SEGMENT_CHECK_ENABLED, false);
    CopyDispatcher dispatcher = new CopyDispatcher(router(ORDERS), conf, null, sink, false);
    assertEquals(3, dispatcher.dispatch(line("7,x,1.5,3")));
    assertEquals(3, dispatcher.dispatch(line("1,x,1.5,3")));
    assertEquals(2, dispatcher.getRowsPerSegment()[3]);
  }

  @Test
  public final void testIntervalKey() throws Exception {
    RowRouter router = router(SESSIONS);
    int expected = router.routeRow(new VTuple(new Datum[] {
        DatumFactory.createInterval(0, 1, 0), NullDatum.get()}));

    CopyDispatcher dispatcher = new CopyDispatcher(router, conf, null, sink, false);
    assertEquals(expected, dispatcher.dispatch(line("1 day,alice")));
    assertEquals(expected, dispatcher.dispatch(line("@ 1 day,bob")));
    assertEquals(expected, dispatcher.dispatch(line("P1D,carol")));
    // months are not hashed
    assertEquals(expected, dispatcher.dispatch(line("2 mons 1 day,dave")));
    assertEquals(4, sink.lines.get(expected).size());
  }

  @Test
  public final void testFullParseKeepsColumnsWithoutTextInput() throws Exception {
    CopyDispatcher dispatcher = new CopyDispatcher(router(DOCUMENTS), conf, null, sink, true);
    assertEquals(0, dispatcher.dispatch(line("7,{},(1.5;2)")));
    assertEquals(2, dispatcher.dispatch(line("1,\\N,\\N")));
    assertEquals(2, dispatcher.getTotalRows());
  }

  @Test
  public final void testLoadOnSegmentWithJsonColumn() throws Exception {
    conf.setIntVar(ConfVars.SEGMENT_ID, 0);
    CopyDispatcher dispatcher = new CopyDispatcher(router(DOCUMENTS), conf, null, sink, false);
    assertEquals(0, dispatcher.dispatch(line("7,{\"a\": 1},(0;0)")));
    assertEquals("7,{\"a\": 1},(0;0)", sink.lines.get(0).get(0));
  }

  @Test(expected = IllegalArgumentException.class)
  public final void testBadInputColumn() throws Exception {
    new CopyDispatcher(router(ORDERS), conf, new int[] {5}, sink, false);
  }
}
