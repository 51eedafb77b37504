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

import java.nio.ByteBuffer;
import java.util.UUID;

public class UuidDatum extends Datum {
  private final UUID uuid;

  public UuidDatum(UUID uuid) {
    super(Type.UUID);
    this.uuid = uuid;
  }

  /**
   * @return the 16 bytes of the uuid in network order
   */
  @Override
  public byte[] asByteArray() {
    ByteBuffer bb = ByteBuffer.allocate(16);
    bb.putLong(uuid.getMostSignificantBits());
    bb.putLong(uuid.getLeastSignificantBits());
    return bb.array();
  }

  @Override
  public String asChars() {
    return uuid.toString();
  }

  @Override
  public int size() {
    return 16;
  }

  @Override
  public int hashCode() {
    return uuid.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof UuidDatum && uuid.equals(((UuidDatum) obj).uuid);
  }
}
