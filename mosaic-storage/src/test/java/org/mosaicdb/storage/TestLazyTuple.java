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
import org.mosaicdb.datum.DatumFactory;
import org.mosaicdb.datum.NullDatum;
import org.mosaicdb.exception.MosaicRuntimeException;
import org.mosaicdb.exception.ResultCode;
import org.mosaicdb.util.BytesUtils;

import java.nio.charset.StandardCharsets;

import static org.junit.Assert.*;

public class TestLazyTuple {

  Schema schema;
  byte[] nullbytes;
  SerializerDeserializer serde;

  @Before
  public void setUp() {
    nullbytes = "\\N".getBytes(StandardCharsets.UTF_8);

    schema = new Schema();
    schema.addColumn("col1", Type.INT4);
    schema.addColumn("col2", Type.TEXT);
    schema.addColumn("col3", Type.FLOAT8);
    schema.addColumn("col4", Type.BOOL);
    schema.addColumn("col5", Type.INT8);
    serde = new TextSerializerDeserializer();
  }

  private byte[][] split(String line) {
    return BytesUtils.splitPreserveAllTokens(line.getBytes(StandardCharsets.UTF_8), new byte[] {'|'},
        TextSerializerDeserializer.ESCAPE);
  }

  @Test
  public final void testGetDatum() {
    LazyTuple t1 = new LazyTuple(schema, split("7|bob|3.5|t|\\N"), -1, nullbytes, serde);
    assertEquals(DatumFactory.createInt4(7), t1.asDatum(0));
    assertEquals(DatumFactory.createText(Type.TEXT, "bob"), t1.asDatum(1));
    assertEquals(DatumFactory.createFloat8(3.5), t1.asDatum(2));
    assertEquals(DatumFactory.createBool(true), t1.asDatum(3));
    assertEquals(NullDatum.get(), t1.asDatum(4));
    assertTrue(t1.isBlankOrNull(4));
    assertEquals(7, t1.getInt4(0));
    assertEquals("bob", t1.getText(1));
  }

  @Test
  public final void testDeserializeOnAccess() {
    LazyTuple t1 = new LazyTuple(schema, split("7|bob|3.5|t|8"), -1, nullbytes, serde);
    assertEquals(0, t1.getNumDeserialized());
    t1.asDatum(2);
    assertEquals(1, t1.getNumDeserialized());
    t1.asDatum(2);
    assertEquals(1, t1.getNumDeserialized());
    t1.asDatum(0);
    assertEquals(2, t1.getNumDeserialized());
  }

  @Test
  public final void testMissingFields() {
    LazyTuple t1 = new LazyTuple(schema, split("7|bob"), 3, nullbytes, serde);
    assertEquals(5, t1.size());
    assertTrue(t1.contains(1));
    assertFalse(t1.contains(2));
    assertEquals(NullDatum.get(), t1.asDatum(2));
    assertEquals(NullDatum.get(), t1.asDatum(4));
    assertEquals(3, t1.getOffset());
  }

  @Test
  public final void testPut() {
    LazyTuple t1 = new LazyTuple(schema, new byte[schema.size()][], -1, nullbytes, serde);
    t1.put(0, DatumFactory.createInt4(1));
    t1.put(4, DatumFactory.createInt8(2));

    assertTrue(t1.contains(0));
    assertFalse(t1.contains(1));
    assertTrue(t1.contains(4));
    assertEquals(DatumFactory.createInt4(1), t1.asDatum(0));
    assertEquals(2L, t1.getInt8(4));

    t1.clear();
    assertFalse(t1.contains(0));
  }

  @Test
  public final void testBadFieldFailsOnAccess() {
    LazyTuple t1 = new LazyTuple(schema, split("seven|bob|3.5|t|8"), -1, nullbytes, serde);
    assertEquals(DatumFactory.createFloat8(3.5), t1.asDatum(2));
    try {
      t1.asDatum(0);
      fail("seven is not an integer");
    } catch (MosaicRuntimeException e) {
      assertEquals(ResultCode.INVALID_DATATYPE, e.getErrorCode());
    }
  }
}
