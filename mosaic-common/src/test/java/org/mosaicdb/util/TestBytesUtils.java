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

package org.mosaicdb.util;

import org.junit.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.Assert.*;

public class TestBytesUtils {
  private static final byte[] PIPE = new byte[] {'|'};

  private static byte[] bytes(String s) {
    return s.getBytes(StandardCharsets.UTF_8);
  }

  private static String str(byte[] b) {
    return new String(b, StandardCharsets.UTF_8);
  }

  @Test
  public final void testSplitPreserveAllTokens() {
    byte[][] fields = BytesUtils.splitPreserveAllTokens(bytes("a|bc||d|"), PIPE, BytesUtils.NO_ESCAPE);
    assertEquals(5, fields.length);
    assertEquals("a", str(fields[0]));
    assertEquals("bc", str(fields[1]));
    assertEquals("", str(fields[2]));
    assertEquals("d", str(fields[3]));
    assertEquals("", str(fields[4]));
  }

  @Test
  public final void testEmptyLine() {
    byte[][] fields = BytesUtils.splitPreserveAllTokens(new byte[0], PIPE, BytesUtils.NO_ESCAPE);
    assertEquals(1, fields.length);
    assertEquals(0, fields[0].length);
  }

  @Test
  public final void testSplitLeadingColumns() {
    byte[][] fields = BytesUtils.splitPreserveAllTokens(bytes("1|2|3|4"), PIPE, BytesUtils.NO_ESCAPE, 2);
    assertEquals(2, fields.length);
    assertEquals("1", str(fields[0]));
    assertEquals("2", str(fields[1]));

    fields = BytesUtils.splitPreserveAllTokens(bytes("1|2|3|4"), PIPE, BytesUtils.NO_ESCAPE, 0);
    assertEquals(0, fields.length);
  }

  @Test
  public final void testShortLine() {
    byte[][] fields = BytesUtils.splitPreserveAllTokens(bytes("1|2"), PIPE, BytesUtils.NO_ESCAPE, 4);
    assertEquals(4, fields.length);
    assertEquals("1", str(fields[0]));
    assertEquals("2", str(fields[1]));
    assertNull(fields[2]);
    assertNull(fields[3]);
  }

  @Test
  public final void testEscapedDelimiter() {
    byte[][] fields = BytesUtils.splitPreserveAllTokens(bytes("a\\|b|c"), PIPE, '\\');
    assertEquals(2, fields.length);
    assertEquals("a\\|b", str(fields[0]));
    assertEquals("c", str(fields[1]));

    fields = BytesUtils.splitPreserveAllTokens(bytes("a\\|b|c"), PIPE, BytesUtils.NO_ESCAPE);
    assertEquals(3, fields.length);
  }

  @Test
  public final void testMultiByteDelimiter() {
    byte[][] fields = BytesUtils.splitPreserveAllTokens(bytes("x::y:z::"), bytes("::"), BytesUtils.NO_ESCAPE);
    assertEquals(3, fields.length);
    assertEquals("x", str(fields[0]));
    assertEquals("y:z", str(fields[1]));
    assertEquals("", str(fields[2]));
  }

  @Test
  public final void testSplitIndices() {
    byte[] line = bytes("ab|cd|ef");
    int[][] indices = BytesUtils.split(line, 0, line.length, PIPE, new int[2][]);
    assertArrayEquals(new int[] {0, 2}, indices[0]);
    assertArrayEquals(new int[] {3, 5}, indices[1]);
  }

  @Test
  public final void testCountFields() {
    byte[] line = bytes("a|b|c\\|d");
    assertEquals(3, BytesUtils.countFields(line, 0, line.length, PIPE, '\\'));
    assertEquals(4, BytesUtils.countFields(line, 0, line.length, PIPE, BytesUtils.NO_ESCAPE));
  }

  @Test
  public final void testLengthIgnoringTrailingBlanks() {
    assertEquals(2, BytesUtils.lengthIgnoringTrailingBlanks(bytes("ab  "), 0, 4));
    assertEquals(4, BytesUtils.lengthIgnoringTrailingBlanks(bytes(" a b"), 0, 4));
    assertEquals(1, BytesUtils.lengthIgnoringTrailingBlanks(bytes("   "), 0, 3));
    assertEquals(0, BytesUtils.lengthIgnoringTrailingBlanks(new byte[0], 0, 0));
  }
}
