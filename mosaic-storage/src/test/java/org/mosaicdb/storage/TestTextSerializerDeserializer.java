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

import org.junit.Test;
import org.mosaicdb.catalog.Column;
import org.mosaicdb.catalog.TypeDesc;
import org.mosaicdb.common.MosaicDataTypes.Type;
import org.mosaicdb.datum.Datum;
import org.mosaicdb.datum.DatumFactory;
import org.mosaicdb.datum.NullDatum;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.Assert.*;

public class TestTextSerializerDeserializer {
  private static final byte[] NULL_BYTES = "\\N".getBytes(StandardCharsets.UTF_8);

  private final TextSerializerDeserializer serde = new TextSerializerDeserializer((byte) '|');

  private Datum deserialize(Column col, String text) throws IOException {
    byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
    return serde.deserialize(col, bytes, 0, bytes.length, NULL_BYTES);
  }

  @Test
  public final void testSerializeEscapes() throws IOException {
    Column col = new Column("c", Type.TEXT);
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    int written = serde.serialize(col, DatumFactory.createText("a|b\\c\n"), out, NULL_BYTES);
    assertEquals("a\\|b\\\\c\\n", out.toString("UTF-8"));
    assertEquals(out.size(), written);
  }

  @Test
  public final void testSerializeNull() throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    serde.serialize(new Column("c", Type.INT4), NullDatum.get(), out, NULL_BYTES);
    assertEquals("\\N", out.toString("UTF-8"));
  }

  @Test
  public final void testDeserializeUnescapes() throws IOException {
    Column col = new Column("c", Type.TEXT);
    assertEquals("a|b\\c\n\t", deserialize(col, "a\\|b\\\\c\\n\\t").asChars());
    // a trailing escape is kept as is
    assertEquals("ab\\", deserialize(col, "ab\\").asChars());
  }

  @Test
  public final void testNullMarker() throws IOException {
    Column col = new Column("c", Type.TEXT);
    assertTrue(deserialize(col, "\\N").isNull());
    // an escaped backslash followed by N is text
    assertEquals("\\N", deserialize(col, "\\\\N").asChars());
    assertFalse(deserialize(col, "").isNull());
  }

  @Test
  public final void testDeserializeDomain() throws IOException {
    Column col = new Column("zip", TypeDesc.domain("zipcode", TypeDesc.of(Type.INT4)));
    Datum datum = deserialize(col, "00123");
    assertEquals(Type.INT4, datum.type());
    assertEquals(123, datum.asInt4());
  }
}
