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

import java.util.Arrays;

/**
 * An array value. Only its serialized payload, without any length header, is kept; the router
 * never looks at individual elements.
 */
public class ArrayDatum extends Datum {
  private final Type elementType;
  private final byte[] payload;

  public ArrayDatum(Type elementType, byte[] payload) {
    super(Type.ANYARRAY);
    this.elementType = elementType;
    this.payload = payload;
  }

  public Type getElementType() {
    return elementType;
  }

  @Override
  public byte[] asByteArray() {
    return payload;
  }

  @Override
  public String asChars() {
    return elementType.name().toLowerCase() + "[](" + payload.length + " bytes)";
  }

  @Override
  public int size() {
    return payload.length;
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(payload);
  }

  @Override
  public boolean equals(Object obj) {
    if (obj instanceof ArrayDatum) {
      ArrayDatum other = (ArrayDatum) obj;
      return elementType == other.elementType && Arrays.equals(payload, other.payload);
    }
    return false;
  }
}
