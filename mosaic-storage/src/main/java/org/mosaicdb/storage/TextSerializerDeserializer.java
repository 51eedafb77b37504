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

import org.mosaicdb.catalog.Column;
import org.mosaicdb.common.MosaicDataTypes.Type;
import org.mosaicdb.datum.Datum;
import org.mosaicdb.datum.DatumFactory;
import org.mosaicdb.datum.NullDatum;
import org.mosaicdb.datum.TextDatum;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Arrays;

/**
 * The text format of COPY: a field equal to the null marker is NULL, and a backslash escapes
 * the next byte. <code>\b \f \n \r \t \v</code> stand for the usual control characters; any
 * other escaped byte, including the delimiter and the backslash itself, stands for itself.
 */
public class TextSerializerDeserializer implements SerializerDeserializer {
  public static final byte ESCAPE = '\\';

  private final byte delimiter;

  public TextSerializerDeserializer() {
    this((byte) '|');
  }

  /**
   * @param delimiter the field delimiter, which is escaped when a value is serialized
   */
  public TextSerializerDeserializer(byte delimiter) {
    this.delimiter = delimiter;
  }

  @Override
  public int serialize(Column col, Datum datum, OutputStream out, byte[] nullCharacters) throws IOException {
    if (datum == null || datum.isNull()) {
      out.write(nullCharacters);
      return nullCharacters.length;
    }

    byte[] bytes = datum.asTextBytes();
    int length = 0;
    for (byte b : bytes) {
      byte escaped = escapeOf(b);
      if (escaped != 0) {
        out.write(ESCAPE);
        out.write(escaped);
        length += 2;
      } else {
        out.write(b);
        length++;
      }
    }
    return length;
  }

  private byte escapeOf(byte b) {
    switch (b) {
      case '\\':
        return '\\';
      case '\b':
        return 'b';
      case '\f':
        return 'f';
      case '\n':
        return 'n';
      case '\r':
        return 'r';
      case '\t':
        return 't';
      case 0x0b:
        return 'v';
      default:
        return b == delimiter ? delimiter : 0;
    }
  }

  @Override
  public Datum deserialize(Column col, byte[] bytes, int offset, int length, byte[] nullCharacters)
      throws IOException {
    if (isNull(bytes, offset, length, nullCharacters)) {
      return NullDatum.get();
    }

    byte[] unescaped = unescape(bytes, offset, length);
    Type type = col.getTypeDesc().resolveHashType();
    return DatumFactory.createFromString(type, new String(unescaped, TextDatum.DEFAULT_CHARSET));
  }

  static byte[] unescape(byte[] bytes, int offset, int length) {
    int limit = offset + length;
    int i = offset;
    while (i < limit && bytes[i] != ESCAPE) {
      i++;
    }
    if (i == limit) {
      return Arrays.copyOfRange(bytes, offset, limit);
    }

    ByteArrayOutputStream out = new ByteArrayOutputStream(length);
    out.write(bytes, offset, i - offset);
    while (i < limit) {
      byte b = bytes[i++];
      if (b != ESCAPE || i == limit) {
        out.write(b);
        continue;
      }
      byte next = bytes[i++];
      switch (next) {
        case 'b':
          out.write('\b');
          break;
        case 'f':
          out.write('\f');
          break;
        case 'n':
          out.write('\n');
          break;
        case 'r':
          out.write('\r');
          break;
        case 't':
          out.write('\t');
          break;
        case 'v':
          out.write(0x0b);
          break;
        default:
          out.write(next);
      }
    }
    return out.toByteArray();
  }

  private static boolean isNull(byte[] val, int offset, int length, byte[] nullBytes) {
    if (length != nullBytes.length) {
      return false;
    }
    for (int i = 0; i < length; i++) {
      if (val[offset + i] != nullBytes[i]) {
        return false;
      }
    }
    return true;
  }
}
