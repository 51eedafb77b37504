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

package org.mosaicdb.common;

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * Data types known to the Mosaic catalog. Every constant carries the catalog OID of the type.
 */
public final class MosaicDataTypes {

  private MosaicDataTypes() {
  }

  public enum Type {
    BOOL(16),
    BYTEA(17),
    CHAR(18),
    NAME(19),
    INT8(20),
    INT2(21),
    INT4(23),
    REGPROC(24),
    TEXT(25),
    OID(26),
    TID(27),
    OIDVECTOR(30),
    JSON(114),
    XML(142),
    POINT(600),
    CIDR(650),
    FLOAT4(700),
    FLOAT8(701),
    ABSTIME(702),
    RELTIME(703),
    TINTERVAL(704),
    CASH(790),
    MACADDR(829),
    INET(869),
    BPCHAR(1042),
    VARCHAR(1043),
    DATE(1082),
    TIME(1083),
    TIMESTAMP(1114),
    TIMESTAMPTZ(1184),
    INTERVAL(1186),
    TIMETZ(1266),
    BIT(1560),
    VARBIT(1562),
    NUMERIC(1700),
    REGPROCEDURE(2202),
    REGOPER(2203),
    REGOPERATOR(2204),
    REGCLASS(2205),
    REGTYPE(2206),
    ANYARRAY(2277),
    UUID(2950),
    ANYENUM(3500),
    COMPLEX(7198),
    // placeholder for types created by CREATE TYPE; the actual oid lives in TypeDesc
    USER_DEFINED(0),
    NULL_TYPE(-1);

    private static final Map<Integer, Type> BY_OID;

    static {
      ImmutableMap.Builder<Integer, Type> builder = ImmutableMap.builder();
      for (Type type : values()) {
        if (type.oid > 0) {
          builder.put(type.oid, type);
        }
      }
      BY_OID = builder.build();
    }

    private final int oid;

    Type(int oid) {
      this.oid = oid;
    }

    public int getOid() {
      return oid;
    }

    /**
     * @param oid catalog type oid
     * @return the built-in type, or {@link #USER_DEFINED} if the oid is not a built-in one
     */
    public static Type valueOf(int oid) {
      Type type = BY_OID.get(oid);
      return type == null ? USER_DEFINED : type;
    }
  }
}
