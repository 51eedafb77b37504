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

import org.mosaicdb.datum.Datum;
import org.mosaicdb.datum.NullDatum;

import java.util.Arrays;

public class VTuple implements Tuple, Cloneable {
  private Datum[] values;
  private long offset;

  public VTuple(int size) {
    values = new Datum[size];
  }

  public VTuple(Tuple tuple) {
    this.values = tuple.getValues().clone();
    this.offset = tuple.getOffset();
  }

  public VTuple(Datum[] datum) {
    this(datum.length);
    put(datum);
  }

  @Override
  public int size() {
    return values.length;
  }

  @Override
  public boolean contains(int fieldId) {
    return values[fieldId] != null;
  }

  @Override
  public boolean isBlankOrNull(int fieldid) {
    return values[fieldid] == null || values[fieldid].isNull();
  }

  @Override
  public void clear() {
    for (int i = 0; i < values.length; i++) {
      values[i] = null;
    }
  }

  //////////////////////////////////////////////////////
  // Setter
  //////////////////////////////////////////////////////
  @Override
  public void put(int fieldId, Datum value) {
    values[fieldId] = value;
  }

  @Override
  public void put(Datum[] values) {
    System.arraycopy(values, 0, this.values, 0, values.length);
  }

  //////////////////////////////////////////////////////
  // Getter
  //////////////////////////////////////////////////////
  @Override
  public Datum asDatum(int fieldId) {
    Datum datum = values[fieldId];
    return datum == null ? NullDatum.get() : datum;
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
    return values[fieldId].asBool();
  }

  @Override
  public byte[] getBytes(int fieldId) {
    return values[fieldId].asByteArray();
  }

  @Override
  public short getInt2(int fieldId) {
    return values[fieldId].asInt2();
  }

  @Override
  public int getInt4(int fieldId) {
    return values[fieldId].asInt4();
  }

  @Override
  public long getInt8(int fieldId) {
    return values[fieldId].asInt8();
  }

  @Override
  public float getFloat4(int fieldId) {
    return values[fieldId].asFloat4();
  }

  @Override
  public double getFloat8(int fieldId) {
    return values[fieldId].asFloat8();
  }

  @Override
  public String getText(int fieldId) {
    return values[fieldId].asChars();
  }

  @Override
  public Tuple clone() throws CloneNotSupportedException {
    VTuple tuple = (VTuple) super.clone();
    tuple.values = values.clone();
    return tuple;
  }

  @Override
  public Datum[] getValues() {
    return values;
  }

  @Override
  public boolean equals(Object obj) {
    if (obj instanceof VTuple) {
      VTuple other = (VTuple) obj;
      return Arrays.equals(values, other.values);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(values);
  }

  @Override
  public String toString() {
    return Arrays.toString(values);
  }
}
