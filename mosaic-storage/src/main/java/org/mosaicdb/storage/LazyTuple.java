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
import org.mosaicdb.catalog.Schema;
import org.mosaicdb.common.MosaicDataTypes.Type;
import org.mosaicdb.datum.Datum;
import org.mosaicdb.datum.NullDatum;
import org.mosaicdb.exception.MosaicInternalError;

import java.io.IOException;
import java.util.Arrays;

/**
 * A tuple over the raw text fields of a line. A field is deserialized on first access only, so
 * fields which are never read are never parsed. A field outside the split part of the line
 * reads as NULL.
 */
public class LazyTuple implements Tuple, Cloneable {
  private long offset;
  private Datum[] values;
  private byte[][] textBytes;
  private final Schema schema;
  private final byte[] nullBytes;
  private final SerializerDeserializer serde;

  /**
   * @param textBytes the raw fields. It may be shorter than the schema, and may hold null for
   *                  fields which were not split.
   */
  public LazyTuple(Schema schema, byte[][] textBytes, long offset, byte[] nullBytes, SerializerDeserializer serde) {
    this.schema = schema;
    this.textBytes = textBytes;
    this.values = new Datum[schema.size()];
    this.offset = offset;
    this.nullBytes = nullBytes;
    this.serde = serde;
  }

  @Override
  public int size() {
    return values.length;
  }

  @Override
  public boolean contains(int fieldid) {
    return (fieldid < textBytes.length && textBytes[fieldid] != null) || values[fieldid] != null;
  }

  @Override
  public boolean isBlankOrNull(int fieldid) {
    return asDatum(fieldid).isNull();
  }

  @Override
  public void clear() {
    for (int i = 0; i < values.length; i++) {
      values[i] = null;
    }
    textBytes = new byte[values.length][];
  }

  //////////////////////////////////////////////////////
  // Setter
  //////////////////////////////////////////////////////
  @Override
  public void put(int fieldId, Datum value) {
    values[fieldId] = value;
    if (fieldId < textBytes.length) {
      textBytes[fieldId] = null;
    }
  }

  @Override
  public void put(Datum[] values) {
    System.arraycopy(values, 0, this.values, 0, size());
    this.textBytes = new byte[values.length][];
  }

  //////////////////////////////////////////////////////
  // Getter
  //////////////////////////////////////////////////////
  @Override
  public Datum asDatum(int fieldId) {
    if (values[fieldId] != null) {
      return values[fieldId];
    } else if (textBytes.length <= fieldId || textBytes[fieldId] == null) {
      values[fieldId] = NullDatum.get();  // missing field (col : 3, separator: ',', row text: "a,")
    } else {
      try {
        values[fieldId] = serde.deserialize(schema.getColumn(fieldId),
            textBytes[fieldId], 0, textBytes[fieldId].length, nullBytes);
      } catch (IOException e) {
        throw new MosaicInternalError(e);
      }
      textBytes[fieldId] = null;
    }
    return values[fieldId];
  }

  /**
   * Returns a field as unescaped text, without converting it to the type of its column.
   */
  public Datum asTextDatum(int fieldId) {
    if (values[fieldId] != null) {
      return values[fieldId];
    } else if (textBytes.length <= fieldId || textBytes[fieldId] == null) {
      return NullDatum.get();
    }
    Column asText = new Column(schema.getColumn(fieldId).getSimpleName(), Type.TEXT);
    try {
      return serde.deserialize(asText, textBytes[fieldId], 0, textBytes[fieldId].length, nullBytes);
    } catch (IOException e) {
      throw new MosaicInternalError(e);
    }
  }

  /**
   * @return the number of fields deserialized so far
   */
  public int getNumDeserialized() {
    int num = 0;
    for (Datum value : values) {
      if (value != null) {
        num++;
      }
    }
    return num;
  }

  @Override
  public void setOffset(long offset) {
    this.offset = offset;
  }

  @Override
  public long getOffset() {
    return this.offset;
  }

  @Override
  public boolean getBool(int fieldId) {
    return asDatum(fieldId).asBool();
  }

  @Override
  public byte[] getBytes(int fieldId) {
    return asDatum(fieldId).asByteArray();
  }

  @Override
  public short getInt2(int fieldId) {
    return asDatum(fieldId).asInt2();
  }

  @Override
  public int getInt4(int fieldId) {
    return asDatum(fieldId).asInt4();
  }

  @Override
  public long getInt8(int fieldId) {
    return asDatum(fieldId).asInt8();
  }

  @Override
  public float getFloat4(int fieldId) {
    return asDatum(fieldId).asFloat4();
  }

  @Override
  public double getFloat8(int fieldId) {
    return asDatum(fieldId).asFloat8();
  }

  @Override
  public String getText(int fieldId) {
    return asDatum(fieldId).asChars();
  }

  @Override
  public Tuple clone() throws CloneNotSupportedException {
    LazyTuple lazyTuple = (LazyTuple) super.clone();
    lazyTuple.values = getValues();
    lazyTuple.textBytes = new byte[size()][];
    return lazyTuple;
  }

  /**
   * Deserializes every field.
   */
  @Override
  public Datum[] getValues() {
    Datum[] datums = new Datum[values.length];
    for (int i = 0; i < values.length; i++) {
      datums[i] = asDatum(i);
    }
    return datums;
  }

  @Override
  public String toString() {
    return Arrays.toString(getValues());
  }
}
