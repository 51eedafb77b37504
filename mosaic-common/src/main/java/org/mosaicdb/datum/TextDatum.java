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

package org.mosaicdb.datum;

import com.google.common.base.Preconditions;
import org.mosaicdb.common.MosaicDataTypes.Type;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Character strings: <code>text</code>, <code>varchar</code>, blank padded <code>bpchar</code>
 * and <code>name</code>. The value is kept as UTF-8 bytes exactly as given, including any
 * trailing blanks.
 */
public class TextDatum extends Datum {
  public static final Charset DEFAULT_CHARSET = StandardCharsets.UTF_8;

  private final byte[] bytes;

  public TextDatum(byte[] bytes) {
    this(Type.TEXT, bytes);
  }

  public TextDatum(String string) {
    this(Type.TEXT, string.getBytes(DEFAULT_CHARSET));
  }

  public TextDatum(Type type, byte[] bytes) {
    super(type);
    Preconditions.checkArgument(type == Type.TEXT || type == Type.VARCHAR || type == Type.BPCHAR
        || type == Type.NAME, "Not a character type: %s", type);
    this.bytes = bytes;
  }

  @Override
  public byte[] asByteArray() {
    return this.bytes;
  }

  @Override
  public String asChars() {
    return new String(this.bytes, DEFAULT_CHARSET);
  }

  @Override
  public byte[] asTextBytes() {
    return this.bytes;
  }

  @Override
  public int size() {
    return bytes.length;
  }

  @Override
  public boolean equals(Object obj) {
    if (obj instanceof TextDatum) {
      TextDatum o = (TextDatum) obj;
      return type == o.type && Arrays.equals(this.bytes, o.bytes);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }
}
