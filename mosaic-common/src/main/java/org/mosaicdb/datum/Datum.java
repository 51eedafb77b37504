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

import org.mosaicdb.common.MosaicDataTypes.Type;
import org.mosaicdb.exception.InvalidValueForCastException;
import org.mosaicdb.exception.MosaicRuntimeException;

import java.nio.charset.StandardCharsets;

import static org.mosaicdb.common.MosaicDataTypes.Type.*;

/**
 * An immutable SQL value. Each subclass carries one family of values; the concrete
 * {@link Type} of the value is kept because several types share one representation
 * (e.g., <code>text</code>, <code>varchar</code> and <code>bpchar</code>).
 */
public abstract class Datum {
  protected final Type type;

  public Datum(Type type) {
    this.type = type;
  }

  public Type type() {
    return this.type;
  }

  public boolean isNull() {
    return false;
  }

  public boolean isNotNull() {
    return true;
  }

  public boolean asBool() {
    throw new MosaicRuntimeException(new InvalidValueForCastException(type, BOOL));
  }

  public byte asByte() {
    throw new MosaicRuntimeException(new InvalidValueForCastException(type, CHAR));
  }

  public short asInt2() {
    throw new MosaicRuntimeException(new InvalidValueForCastException(type, INT2));
  }

  public int asInt4() {
    throw new MosaicRuntimeException(new InvalidValueForCastException(type, INT4));
  }

  public long asInt8() {
    throw new MosaicRuntimeException(new InvalidValueForCastException(type, INT8));
  }

  public float asFloat4() {
    throw new MosaicRuntimeException(new InvalidValueForCastException(type, FLOAT4));
  }

  public double asFloat8() {
    throw new MosaicRuntimeException(new InvalidValueForCastException(type, FLOAT8));
  }

  public byte [] asByteArray() {
    throw new MosaicRuntimeException(new InvalidValueForCastException(type, BYTEA));
  }

  public String asChars() {
    throw new MosaicRuntimeException(new InvalidValueForCastException(type, TEXT));
  }

  public byte[] asTextBytes() {
    return asChars().getBytes(StandardCharsets.UTF_8);
  }

  /**
   * @return the number of bytes of the value in its in-memory form
   */
  public abstract int size();

  @Override
  public String toString() {
    return asChars();
  }
}
