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

package org.mosaicdb.storage;

import org.junit.Before;
import org.junit.Test;
import org.mosaicdb.catalog.Schema;
import org.mosaicdb.common.MosaicDataTypes.Type;

import java.nio.charset.StandardCharsets;

import static org.junit.Assert.*;

public class TestTextLineParser {
  private TextLineParser parser;

  @Before
  public void setUp() {
    Schema schema = new Schema()
        .addColumn("a", Type.INT4)
        .addColumn("b", Type.TEXT)
        .addColumn("c", Type.INT8);
    parser = new TextLineParser(schema, ",".getBytes(StandardCharsets.UTF_8),
        "\\N".getBytes(StandardCharsets.UTF_8));
  }

  private static byte[] line(String s) {
    return s.getBytes(StandardCharsets.UTF_8);
  }

  @Test
  public final void testParseAll() {
    LazyTuple tuple = parser.parse(line("1,x\\,y,3"), 10, TextLineParser.ALL_COLUMNS);
    assertEquals(10, tuple.getOffset());
    assertEquals(1, tuple.getInt4(0));
    assertEquals("x,y", tuple.getText(1));
    assertEquals(3L, tuple.getInt8(2));
  }

  @Test
  public final void testParseLeadingColumns() {
    LazyTuple tuple = parser.parse(line("1,x,not a number"), 1, 1);
    assertTrue(tuple.contains(0));
    assertFalse(tuple.contains(1));
    assertFalse(tuple.contains(2));
    assertEquals(1, tuple.getInt4(0));
    // never split, so never parsed
    assertTrue(tuple.isBlankOrNull(2));
  }

  @Test
  public final void testParseNothing() {
    LazyTuple tuple = parser.parse(line("garbage"), 1, 0);
    assertFalse(tuple.contains(0));
    assertEquals(0, tuple.getNumDeserialized());
  }

  @Test(expected = IllegalArgumentException.class)
  public final void testTooManyColumns() {
    parser.parse(line("1,2,3,4"), 1, 4);
  }

  @Test(expected = IllegalArgumentException.class)
  public final void testEmptyDelimiter() {
    new TextLineParser(parser.getSchema(), new byte[0], new byte[0]);
  }
}
