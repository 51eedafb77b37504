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

import java.util.EnumSet;
import java.util.Set;

/**
 * An unsigned 32 bit object identifier: <code>oid</code>, the <code>reg*</code> alias types and
 * labels of enum types, which are stored by the oid of the label.
 */
public class OidDatum extends Datum {
  private static final Set<Type> OID_TYPES = EnumSet.of(Type.OID, Type.REGPROC, Type.REGPROCEDURE,
      Type.REGOPER, Type.REGOPERATOR, Type.REGCLASS, Type.REGTYPE, Type.ANYENUM);

  private final int oid;

  public OidDatum(int oid) {
    this(Type.OID, oid);
  }

  public OidDatum(Type type, int oid) {
    super(type);
    Preconditions.checkArgument(OID_TYPES.contains(type), "Not an oid type: %s", type);
    this.oid = oid;
  }

  @Override
  public int asInt4() {
    return oid;
  }

  /**
   * @return the oid zero-extended to 64 bits
   */
  @Override
  public long asInt8() {
    return Integer.toUnsignedLong(oid);
  }

  @Override
  public String asChars() {
    return Integer.toUnsignedString(oid);
  }

  @Override
  public int size() {
    return 4;
  }

  @Override
  public int hashCode() {
    return oid;
  }

  @Override
  public boolean equals(Object obj) {
    if (obj instanceof OidDatum) {
      OidDatum other = (OidDatum) obj;
      return type == other.type && oid == other.oid;
    }
    return false;
  }
}
